package org.budgetanalyzer.ratesync.service.dto;

import java.time.Instant;

/**
 * Health view of one provider.
 *
 * @param lastSync finish time of the latest successful or partial run, null if none
 */
public record ProviderStatus(
    String name,
    String description,
    boolean enabled,
    Instant lastSync,
    long currencyCount,
    long rowCount) {}

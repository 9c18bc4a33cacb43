package org.budgetanalyzer.ratesync.api.response;

import java.time.Instant;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.ratesync.service.dto.ProviderStatus;

@Schema(description = "Sync status of one provider")
public record ProviderHealthResponse(
    @Schema(
            description = "Provider id",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "ecb")
        String name,
    @Schema(
            description = "Provider description",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "European Central Bank - Daily EUR reference rates")
        String description,
    @Schema(
            description = "Whether the provider is synced",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "true")
        boolean enabled,
    @Schema(
            description = "Finish time of the latest successful or partial sync",
            requiredMode = Schema.RequiredMode.NOT_REQUIRED,
            example = "2025-11-27T16:00:12Z")
        Instant lastSync,
    @Schema(
            description = "Number of currencies the provider publishes",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "31")
        long currencyCount,
    @Schema(
            description = "Number of stored rate rows",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "218000")
        long rowCount) {

  public static ProviderHealthResponse from(ProviderStatus status) {
    return new ProviderHealthResponse(
        status.name(),
        status.description(),
        status.enabled(),
        status.lastSync(),
        status.currencyCount(),
        status.rowCount());
  }
}

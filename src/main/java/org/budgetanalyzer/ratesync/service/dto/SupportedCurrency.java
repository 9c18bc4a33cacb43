package org.budgetanalyzer.ratesync.service.dto;

/** Currency a provider publishes, with its display name. */
public record SupportedCurrency(String code, String name) {}

package org.budgetanalyzer.ratesync.service.dto;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Rates published by one provider for one date, quoted against the provider's native base
 * currency. A rate is the number of target units per one unit of base.
 */
public record DailySnapshot(
    LocalDate date, String provider, String baseCurrency, Map<String, Double> rates) {

  public DailySnapshot {
    Objects.requireNonNull(date, "date cannot be null");
    Objects.requireNonNull(provider, "provider cannot be null");
    Objects.requireNonNull(baseCurrency, "baseCurrency cannot be null");
    Objects.requireNonNull(rates, "rates cannot be null");
    rates = Collections.unmodifiableMap(new LinkedHashMap<>(rates));
  }
}

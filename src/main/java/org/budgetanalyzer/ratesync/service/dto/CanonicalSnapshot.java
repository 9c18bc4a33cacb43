package org.budgetanalyzer.ratesync.service.dto;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.budgetanalyzer.ratesync.domain.CanonicalRate;

/**
 * Canonical rows of one provider for one date: every rate is expressed against the reference
 * currency held in {@code baseCurrency}.
 *
 * @param carriedForward true when the snapshot was synthesized for a day the provider did not
 *     publish
 */
public record CanonicalSnapshot(
    LocalDate date,
    String provider,
    String baseCurrency,
    Map<String, Double> rates,
    boolean carriedForward) {

  public CanonicalSnapshot {
    Objects.requireNonNull(date, "date cannot be null");
    Objects.requireNonNull(provider, "provider cannot be null");
    Objects.requireNonNull(baseCurrency, "baseCurrency cannot be null");
    Objects.requireNonNull(rates, "rates cannot be null");
    rates = Collections.unmodifiableMap(new TreeMap<>(rates));
  }

  /**
   * Rebuilds a snapshot from stored rows of a single provider and date.
   *
   * @param rows canonical rows, all sharing date, provider and base currency
   * @return the snapshot, flagged carried forward if any row is
   */
  public static CanonicalSnapshot fromRates(List<CanonicalRate> rows) {
    if (rows.isEmpty()) {
      throw new IllegalArgumentException("rows cannot be empty");
    }

    var first = rows.get(0);
    var rates = new TreeMap<String, Double>();
    var carriedForward = false;
    for (var row : rows) {
      rates.put(row.getTargetCurrency(), row.getRate());
      carriedForward |= row.isCarriedForward();
    }

    return new CanonicalSnapshot(
        first.getDate(), first.getProvider(), first.getBaseCurrency(), rates, carriedForward);
  }

  /**
   * Copy of this snapshot moved to another date and flagged as carried forward.
   *
   * @param fillDate the unpublished date to fill
   * @return synthesized snapshot for {@code fillDate}
   */
  public CanonicalSnapshot carryForwardTo(LocalDate fillDate) {
    return new CanonicalSnapshot(fillDate, provider, baseCurrency, rates, true);
  }

  /**
   * Expands this snapshot into persistable rows, one per target currency.
   *
   * @return new, unsaved entities
   */
  public List<CanonicalRate> toRates() {
    return rates.entrySet().stream()
        .map(
            entry ->
                new CanonicalRate(
                    date, baseCurrency, entry.getKey(), entry.getValue(), provider, carriedForward))
        .toList();
  }
}

package org.budgetanalyzer.ratesync.service.provider;

import java.io.InputStream;
import java.time.LocalDate;
import java.util.List;

import org.budgetanalyzer.ratesync.service.dto.FetchResult;
import org.budgetanalyzer.ratesync.service.dto.SupportedCurrency;

/**
 * External publisher of daily exchange rates.
 *
 * <p>Implementations return snapshots quoted against their native base currency; normalization to
 * the reference currency happens downstream. Fetch methods throw {@link
 * org.budgetanalyzer.ratesync.exception.FetchException} when the provider cannot be reached and
 * {@link org.budgetanalyzer.ratesync.exception.RateParseException} when its payload is malformed.
 */
public interface RateSource {

  /** Stable provider id, stored with every row the provider produces. */
  String id();

  String description();

  /** Currency the provider quotes its rates against. */
  String nativeBaseCurrency();

  List<SupportedCurrency> supportedCurrencies();

  boolean isEnabled();

  /**
   * Fetches everything the provider has published.
   *
   * @return snapshots in ascending date order
   */
  FetchResult fetchFullHistory();

  /**
   * Fetches the snapshots published within a date range.
   *
   * @param startDate first date, inclusive
   * @param endDate last date, inclusive
   * @return snapshots in ascending date order; days without publication are absent
   */
  FetchResult fetchRange(LocalDate startDate, LocalDate endDate);

  /**
   * Reads bundled history shipped with the application, in the provider's own format.
   *
   * @param inputStream the bundle content
   * @return snapshots in ascending date order
   */
  FetchResult readBundle(InputStream inputStream);
}

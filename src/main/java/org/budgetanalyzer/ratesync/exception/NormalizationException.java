package org.budgetanalyzer.ratesync.exception;

/**
 * Triangulation is impossible: a snapshot lacks the reference currency rate at ingest time, or the
 * requested base currency is absent from a stored date at query time.
 */
public class NormalizationException extends RateSyncException {

  public NormalizationException(String message, RateSyncError error) {
    super(message, error);
  }

  public static NormalizationException referenceRateMissing(String message) {
    return new NormalizationException(message, RateSyncError.REFERENCE_RATE_MISSING);
  }

  public static NormalizationException baseCurrencyUnavailable(String message) {
    return new NormalizationException(message, RateSyncError.BASE_CURRENCY_UNAVAILABLE);
  }
}

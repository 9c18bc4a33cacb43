package org.budgetanalyzer.ratesync.exception;

/** Requested data or provider does not exist. Routine for dates that have not been synced yet. */
public class NotFoundException extends RateSyncException {

  public NotFoundException(String message, RateSyncError error) {
    super(message, error);
  }

  public static NotFoundException noRateData(String message) {
    return new NotFoundException(message, RateSyncError.NO_RATE_DATA);
  }

  public static NotFoundException unknownProvider(String providerId) {
    return new NotFoundException("Unknown provider: " + providerId, RateSyncError.UNKNOWN_PROVIDER);
  }
}

package org.budgetanalyzer.ratesync.exception;

/** Provider payload or bundled history file is malformed. */
public class RateParseException extends RateSyncException {

  public RateParseException(String message) {
    super(message, RateSyncError.PROVIDER_PAYLOAD_MALFORMED);
  }

  public RateParseException(String message, Throwable cause) {
    super(message, RateSyncError.PROVIDER_PAYLOAD_MALFORMED, cause);
  }
}

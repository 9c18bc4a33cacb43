package org.budgetanalyzer.ratesync.exception;

/** Base class of all exceptions raised by the rate sync engine. */
public abstract class RateSyncException extends RuntimeException {

  private final RateSyncError error;

  protected RateSyncException(String message, RateSyncError error) {
    super(message);
    this.error = error;
  }

  protected RateSyncException(String message, RateSyncError error, Throwable cause) {
    super(message, cause);
    this.error = error;
  }

  public RateSyncError getError() {
    return error;
  }
}

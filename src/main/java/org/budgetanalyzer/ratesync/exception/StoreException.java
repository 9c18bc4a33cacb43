package org.budgetanalyzer.ratesync.exception;

/** Durable storage read or write failure. */
public class StoreException extends RateSyncException {

  public StoreException(String message, Throwable cause) {
    super(message, RateSyncError.STORE_FAILURE, cause);
  }
}

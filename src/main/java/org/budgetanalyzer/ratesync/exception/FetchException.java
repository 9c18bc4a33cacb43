package org.budgetanalyzer.ratesync.exception;

/** Network or remote failure while fetching rates from a provider, including timeouts. */
public class FetchException extends RateSyncException {

  public FetchException(String message) {
    super(message, RateSyncError.PROVIDER_FETCH_FAILED);
  }

  public FetchException(String message, Throwable cause) {
    super(message, RateSyncError.PROVIDER_FETCH_FAILED, cause);
  }
}

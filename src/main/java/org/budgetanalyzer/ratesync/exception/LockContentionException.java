package org.budgetanalyzer.ratesync.exception;

/** A sync for the provider is already running; the request was rejected, not queued. */
public class LockContentionException extends RateSyncException {

  private final String providerId;

  public LockContentionException(String providerId) {
    super(
        "Sync already in progress for provider: " + providerId,
        RateSyncError.SYNC_ALREADY_RUNNING);
    this.providerId = providerId;
  }

  public String getProviderId() {
    return providerId;
  }
}

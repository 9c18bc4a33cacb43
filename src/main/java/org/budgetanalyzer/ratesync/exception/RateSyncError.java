package org.budgetanalyzer.ratesync.exception;

/** Error codes reported to API clients and recorded with failed sync runs. */
public enum RateSyncError {
  /** Request parameters are malformed or inconsistent. */
  INVALID_REQUEST,

  /** No synced rate data exists for the requested date or range. */
  NO_RATE_DATA,

  /** Provider id is not registered. */
  UNKNOWN_PROVIDER,

  /** A snapshot does not carry a usable rate for the reference currency. */
  REFERENCE_RATE_MISSING,

  /** Requested base currency is not present in the stored currency set for a date. */
  BASE_CURRENCY_UNAVAILABLE,

  /** A sync for the provider is already running. */
  SYNC_ALREADY_RUNNING,

  /** Provider endpoint could not be reached or answered with an error. */
  PROVIDER_FETCH_FAILED,

  /** Provider payload could not be parsed. */
  PROVIDER_PAYLOAD_MALFORMED,

  /** Durable storage read or write failed. */
  STORE_FAILURE,
}

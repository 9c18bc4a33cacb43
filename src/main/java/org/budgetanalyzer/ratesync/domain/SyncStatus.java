package org.budgetanalyzer.ratesync.domain;

/** Outcome of a sync run. */
public enum SyncStatus {
  /** Every fetched snapshot was normalized and stored. */
  SUCCESS,

  /** Some dates or currency series were rejected or missing; the rest was stored. */
  PARTIAL,

  /** The run was aborted. Rows stored before the failure remain valid. */
  FAILED
}

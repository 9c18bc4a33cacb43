package org.budgetanalyzer.ratesync.domain;

/** What started a sync run. */
public enum SyncTrigger {
  SCHEDULED,
  MANUAL,
  STARTUP,
  BOOTSTRAP
}

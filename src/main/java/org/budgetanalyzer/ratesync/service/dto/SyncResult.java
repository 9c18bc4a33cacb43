package org.budgetanalyzer.ratesync.service.dto;

import java.time.Instant;
import java.time.LocalDate;

import org.budgetanalyzer.ratesync.domain.SyncRun;
import org.budgetanalyzer.ratesync.domain.SyncTrigger;

/**
 * Outcome of one provider sync attempt.
 *
 * <p>{@link Outcome#ALREADY_RUNNING} is reported by bulk syncs for providers whose lock was held;
 * no run is recorded for it.
 */
public record SyncResult(
    String provider,
    SyncTrigger trigger,
    Outcome outcome,
    int snapshotDays,
    int rowsWritten,
    LocalDate windowStart,
    LocalDate windowEnd,
    String message,
    Instant finishedAt) {

  public enum Outcome {
    SUCCESS,
    PARTIAL,
    FAILED,
    ALREADY_RUNNING
  }

  public static SyncResult from(SyncRun run) {
    return new SyncResult(
        run.getProvider(),
        run.getTrigger(),
        Outcome.valueOf(run.getStatus().name()),
        run.getSnapshotDays(),
        run.getRowsWritten(),
        run.getWindowStart(),
        run.getWindowEnd(),
        run.getMessage(),
        run.getFinishedAt());
  }

  public static SyncResult alreadyRunning(String provider, SyncTrigger trigger, Instant now) {
    return new SyncResult(
        provider,
        trigger,
        Outcome.ALREADY_RUNNING,
        0,
        0,
        null,
        null,
        "Sync already in progress for provider: " + provider,
        now);
  }

  public boolean isFailed() {
    return outcome == Outcome.FAILED;
  }
}

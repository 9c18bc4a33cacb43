package org.budgetanalyzer.ratesync.domain;

import java.time.Instant;
import java.time.LocalDate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;

/**
 * Audit record of one sync run for one provider.
 *
 * <p>Append-only: instances are built complete and never modified once persisted. Used for
 * observability only, never to decide what to fetch.
 */
@Entity
@Immutable
@Table(name = "sync_run")
public class SyncRun {

  private static final int MAX_MESSAGE_LENGTH = 1000;

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false, length = 32)
  private String provider;

  @Enumerated(EnumType.STRING)
  @Column(name = "trigger_type", nullable = false, length = 16)
  private SyncTrigger trigger;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 16)
  private SyncStatus status;

  /** Number of snapshot days written. */
  @Column(name = "snapshot_days", nullable = false)
  private int snapshotDays;

  @Column(name = "rows_written", nullable = false)
  private int rowsWritten;

  @Column(name = "window_start")
  private LocalDate windowStart;

  @Column(name = "window_end")
  private LocalDate windowEnd;

  @Column(length = MAX_MESSAGE_LENGTH)
  private String message;

  @Column(name = "started_at", nullable = false)
  private Instant startedAt;

  @Column(name = "finished_at", nullable = false)
  private Instant finishedAt;

  protected SyncRun() {}

  public SyncRun(
      String provider,
      SyncTrigger trigger,
      SyncStatus status,
      int snapshotDays,
      int rowsWritten,
      LocalDate windowStart,
      LocalDate windowEnd,
      String message,
      Instant startedAt,
      Instant finishedAt) {
    this.provider = provider;
    this.trigger = trigger;
    this.status = status;
    this.snapshotDays = snapshotDays;
    this.rowsWritten = rowsWritten;
    this.windowStart = windowStart;
    this.windowEnd = windowEnd;
    this.message = truncate(message);
    this.startedAt = startedAt;
    this.finishedAt = finishedAt;
  }

  private static String truncate(String message) {
    if (message == null || message.length() <= MAX_MESSAGE_LENGTH) {
      return message;
    }
    return message.substring(0, MAX_MESSAGE_LENGTH);
  }

  public Long getId() {
    return id;
  }

  public String getProvider() {
    return provider;
  }

  public SyncTrigger getTrigger() {
    return trigger;
  }

  public SyncStatus getStatus() {
    return status;
  }

  public int getSnapshotDays() {
    return snapshotDays;
  }

  public int getRowsWritten() {
    return rowsWritten;
  }

  public LocalDate getWindowStart() {
    return windowStart;
  }

  public LocalDate getWindowEnd() {
    return windowEnd;
  }

  public String getMessage() {
    return message;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Instant getFinishedAt() {
    return finishedAt;
  }
}

package org.budgetanalyzer.ratesync.scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.MeterRegistry;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;

import org.budgetanalyzer.ratesync.config.RateSyncProperties;
import org.budgetanalyzer.ratesync.domain.SyncTrigger;
import org.budgetanalyzer.ratesync.exception.LockContentionException;
import org.budgetanalyzer.ratesync.exception.NotFoundException;
import org.budgetanalyzer.ratesync.service.SyncOrchestrator;
import org.budgetanalyzer.ratesync.service.dto.SyncResult;

/**
 * Daily sync of every provider.
 *
 * <p>ShedLock keeps the cron execution to one instance per cluster. Providers whose run failed are
 * retried individually after the configured delay, each retry a separate scheduled task, until the
 * attempt limit is reached.
 */
@Component
public class RateSyncScheduler {

  private static final Logger log = LoggerFactory.getLogger(RateSyncScheduler.class);

  private final TaskScheduler taskScheduler;
  private final MeterRegistry meterRegistry;
  private final RateSyncProperties properties;
  private final SyncOrchestrator syncOrchestrator;
  private final Clock clock;

  public RateSyncScheduler(
      TaskScheduler taskScheduler,
      MeterRegistry meterRegistry,
      RateSyncProperties properties,
      SyncOrchestrator syncOrchestrator,
      Clock clock) {
    this.taskScheduler = taskScheduler;
    this.meterRegistry = meterRegistry;
    this.properties = properties;
    this.syncOrchestrator = syncOrchestrator;
    this.clock = clock;
  }

  @Scheduled(cron = "${rate-sync.sync.cron:0 0 16 * * *}", zone = "UTC")
  @SchedulerLock(name = "rateSync", lockAtMostFor = "30m", lockAtLeastFor = "1m")
  public void syncDailyRates() {
    var retryConfig = properties.getSync().getRetry();

    log.info(
        "Starting scheduled rate sync (max attempts: {}, delay: {} minutes)",
        retryConfig.getMaxAttempts(),
        retryConfig.getDelayMinutes());

    var results = syncOrchestrator.syncAll(SyncTrigger.SCHEDULED);
    handleResults(results, 1);
  }

  private void retry(List<String> providerIds, int attemptNumber) {
    log.info("Executing retry attempt {} for providers: {}", attemptNumber, providerIds);

    var results = new ArrayList<SyncResult>();
    for (var providerId : providerIds) {
      try {
        results.add(syncOrchestrator.syncProvider(providerId, SyncTrigger.SCHEDULED));
      } catch (LockContentionException e) {
        log.info("Retry of {} skipped, a sync is already running", providerId);
      } catch (NotFoundException e) {
        log.warn("Retry of {} skipped: {}", providerId, e.getMessage());
      }
    }

    handleResults(results, attemptNumber);
  }

  private void handleResults(List<SyncResult> results, int attemptNumber) {
    var failed = results.stream().filter(SyncResult::isFailed).map(SyncResult::provider).toList();
    recordExecution(attemptNumber, failed.isEmpty());

    if (failed.isEmpty()) {
      log.info(
          "Scheduled rate sync succeeded on attempt {} for {} providers",
          attemptNumber,
          results.size());
      return;
    }

    var maxAttempts = properties.getSync().getRetry().getMaxAttempts();
    log.error(
        "Scheduled rate sync failed on attempt {}/{} for providers: {}",
        attemptNumber,
        maxAttempts,
        failed);

    if (attemptNumber < maxAttempts) {
      scheduleRetry(failed, attemptNumber + 1);
    } else {
      log.error("All retry attempts exhausted for providers: {}", failed);
      meterRegistry.counter("rate.sync.scheduled.exhausted").increment(failed.size());
    }
  }

  private void scheduleRetry(List<String> providerIds, int attemptNumber) {
    var delayMinutes = properties.getSync().getRetry().getDelayMinutes();
    var retryTime = clock.instant().plus(Duration.ofMinutes(delayMinutes));

    log.info(
        "Scheduling retry attempt {} in {} minutes at {}", attemptNumber, delayMinutes, retryTime);

    meterRegistry
        .counter("rate.sync.scheduled.retry.scheduled", "attempt", String.valueOf(attemptNumber))
        .increment();

    taskScheduler.schedule(() -> retry(providerIds, attemptNumber), retryTime);
  }

  private void recordExecution(int attemptNumber, boolean success) {
    meterRegistry
        .counter(
            "rate.sync.scheduled.executions",
            "status",
            success ? "success" : "failure",
            "attempt",
            String.valueOf(attemptNumber))
        .increment();
  }
}

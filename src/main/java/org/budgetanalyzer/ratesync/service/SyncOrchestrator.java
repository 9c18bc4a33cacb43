package org.budgetanalyzer.ratesync.service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import org.budgetanalyzer.ratesync.config.RateSyncProperties;
import org.budgetanalyzer.ratesync.domain.SyncRun;
import org.budgetanalyzer.ratesync.domain.SyncStatus;
import org.budgetanalyzer.ratesync.domain.SyncTrigger;
import org.budgetanalyzer.ratesync.exception.FetchException;
import org.budgetanalyzer.ratesync.exception.LockContentionException;
import org.budgetanalyzer.ratesync.exception.NormalizationException;
import org.budgetanalyzer.ratesync.service.dto.CanonicalSnapshot;
import org.budgetanalyzer.ratesync.service.dto.DailySnapshot;
import org.budgetanalyzer.ratesync.service.dto.FetchResult;
import org.budgetanalyzer.ratesync.service.dto.SyncResult;
import org.budgetanalyzer.ratesync.service.provider.RateSource;
import org.budgetanalyzer.ratesync.service.provider.RateSourceRegistry;

/**
 * Runs the sync pipeline of one provider: fetch, normalize, gap-fill, store, record.
 *
 * <p>At most one sync per provider runs at any time. A second request for a busy provider is
 * rejected immediately rather than queued. Different providers sync independently, and one
 * provider's failure never affects another.
 *
 * <p>The fetch window is derived from stored data only:
 *
 * <ul>
 *   <li>No published rows: the provider's full history.
 *   <li>Otherwise: from the last published date to today, with the stored snapshot of that date as
 *       the carry-forward anchor. Carried-forward rows never move the window, so days filled before
 *       the provider published them are fetched again.
 * </ul>
 *
 * <p>Rows are written in ascending chunks of {@code upsert-batch-days} snapshot days, one
 * transaction per chunk. A failed run keeps the chunks written before the failure.
 */
@Service
public class SyncOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

  private final RateSourceRegistry rateSourceRegistry;
  private final Normalizer normalizer;
  private final GapFiller gapFiller;
  private final RateStore rateStore;
  private final RateSyncProperties properties;
  private final ResourceLoader resourceLoader;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  // Not reentrant: a nested sync of the same provider on the same thread is rejected too
  private final ConcurrentMap<String, Semaphore> locks = new ConcurrentHashMap<>();

  public SyncOrchestrator(
      RateSourceRegistry rateSourceRegistry,
      Normalizer normalizer,
      GapFiller gapFiller,
      RateStore rateStore,
      RateSyncProperties properties,
      ResourceLoader resourceLoader,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.rateSourceRegistry = rateSourceRegistry;
    this.normalizer = normalizer;
    this.gapFiller = gapFiller;
    this.rateStore = rateStore;
    this.properties = properties;
    this.resourceLoader = resourceLoader;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  /**
   * Syncs one provider up to today.
   *
   * @param providerId provider id
   * @param trigger what initiated the sync
   * @return the run outcome; fetch, parse and store failures are reported as {@link
   *     SyncResult.Outcome#FAILED}, not thrown
   * @throws org.budgetanalyzer.ratesync.exception.NotFoundException if no enabled provider has
   *     this id
   * @throws LockContentionException if a sync of this provider is already running
   */
  public SyncResult syncProvider(String providerId, SyncTrigger trigger) {
    var source = rateSourceRegistry.get(providerId);
    var lock = lockFor(source.id());

    if (!lock.tryAcquire()) {
      log.warn("Sync of {} rejected, another sync is in progress", source.id());
      throw new LockContentionException(source.id());
    }

    try {
      return execute(source, trigger, () -> planIncremental(source));
    } finally {
      lock.release();
    }
  }

  /**
   * Syncs every enabled provider in priority order, independently of each other.
   *
   * @param trigger what initiated the sync
   * @return one result per provider; busy providers are reported as {@link
   *     SyncResult.Outcome#ALREADY_RUNNING}
   */
  public List<SyncResult> syncAll(SyncTrigger trigger) {
    var sources = rateSourceRegistry.enabled();
    log.info("Syncing {} providers, trigger: {}", sources.size(), trigger);

    var results = new ArrayList<SyncResult>();
    for (var source : sources) {
      try {
        results.add(syncProvider(source.id(), trigger));
      } catch (LockContentionException e) {
        results.add(SyncResult.alreadyRunning(source.id(), trigger, clock.instant()));
      }
    }

    logSummary(results);
    return results;
  }

  /**
   * Loads bundled history into an empty store, one provider at a time. Does nothing when the store
   * already holds rates.
   *
   * <p>Bundles are gap-filled only up to their own last date; the regular sync continues from
   * there.
   *
   * @return one result per loaded bundle
   */
  public List<SyncResult> bootstrapIfEmpty() {
    if (!rateStore.isEmpty()) {
      log.info("Rate store already holds data, skipping bootstrap");
      return List.of();
    }

    var bundles = properties.getBootstrap().getBundles();
    var results = new ArrayList<SyncResult>();

    for (var source : rateSourceRegistry.enabled()) {
      var location = bundles.get(source.id());
      if (location == null || location.isBlank()) {
        log.debug("No bundle configured for {}", source.id());
        continue;
      }

      var resource = resourceLoader.getResource(location);
      if (!resource.exists()) {
        log.warn("Bundle for {} not found at {}, skipping", source.id(), location);
        continue;
      }

      var lock = lockFor(source.id());
      if (!lock.tryAcquire()) {
        results.add(SyncResult.alreadyRunning(source.id(), SyncTrigger.BOOTSTRAP, clock.instant()));
        continue;
      }

      try {
        log.info("Bootstrapping {} from {}", source.id(), location);
        results.add(
            execute(
                source,
                SyncTrigger.BOOTSTRAP,
                () -> {
                  try (var inputStream = resource.getInputStream()) {
                    return planBundle(source.readBundle(inputStream));
                  } catch (IOException e) {
                    throw new FetchException("Failed to read bundle " + location, e);
                  }
                }));
      } finally {
        lock.release();
      }
    }

    logSummary(results);
    return results;
  }

  private FetchPlan planIncremental(RateSource source) {
    var today = LocalDate.now(clock);
    var lastPublished = rateStore.lastPublishedDate(source.id());

    if (lastPublished.isEmpty()) {
      log.info("No published rates stored for {} - fetching full history", source.id());
      var fetched = source.fetchFullHistory();
      var windowStart = fetched.snapshots().isEmpty() ? null : fetched.snapshots().get(0).date();
      return new FetchPlan(fetched, null, windowStart, today, today);
    }

    var windowStart = lastPublished.get();
    if (!windowStart.isBefore(today)) {
      log.info("{} is up to date, last published: {}", source.id(), windowStart);
      return new FetchPlan(FetchResult.of(List.of()), null, windowStart, today, today);
    }

    var anchor = rateStore.snapshotAt(source.id(), windowStart).orElse(null);
    log.info(
        "Last published date for {}: {}, fetching {} to {}",
        source.id(),
        windowStart,
        windowStart,
        today);

    return new FetchPlan(source.fetchRange(windowStart, today), anchor, windowStart, today, today);
  }

  private FetchPlan planBundle(FetchResult bundle) {
    var snapshots = bundle.snapshots();
    if (snapshots.isEmpty()) {
      return new FetchPlan(bundle, null, null, null, null);
    }

    var first =
        snapshots.stream().map(DailySnapshot::date).min(LocalDate::compareTo).orElseThrow();
    var last =
        snapshots.stream().map(DailySnapshot::date).max(LocalDate::compareTo).orElseThrow();

    return new FetchPlan(bundle, null, first, last, last);
  }

  private SyncResult execute(RateSource source, SyncTrigger trigger, Supplier<FetchPlan> planner) {
    var startedAt = clock.instant();
    var sample = Timer.start(meterRegistry);
    var progress = new Progress();
    FetchPlan plan = null;

    SyncStatus status;
    String message;
    try {
      plan = planner.get();
      var problems = ingest(source, plan, progress);

      status = problems.isEmpty() ? SyncStatus.SUCCESS : SyncStatus.PARTIAL;
      message = problems.isEmpty() ? null : String.join("; ", problems);
    } catch (RuntimeException e) {
      log.error(
          "Sync of {} failed after {} snapshot days: {}",
          source.id(),
          progress.snapshotDays,
          e.getMessage(),
          e);

      status = SyncStatus.FAILED;
      message = e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    var run =
        new SyncRun(
            source.id(),
            trigger,
            status,
            progress.snapshotDays,
            progress.rowsWritten,
            plan != null ? plan.windowStart() : null,
            plan != null ? plan.windowEnd() : null,
            message,
            startedAt,
            clock.instant());
    rateStore.recordRun(run);
    recordMetrics(sample, source.id(), status);

    log.info(
        "Sync of {} finished status: {} trigger: {} snapshot days: {} rows: {}",
        source.id(),
        status,
        trigger,
        progress.snapshotDays,
        progress.rowsWritten);

    return SyncResult.from(run);
  }

  private List<String> ingest(RateSource source, FetchPlan plan, Progress progress) {
    var referenceCurrency = properties.getReferenceCurrency();
    var problems = new ArrayList<>(plan.fetched().warnings());

    var canonical = new ArrayList<CanonicalSnapshot>();
    if (plan.anchor() != null) {
      canonical.add(plan.anchor());
    }

    var normalizedDates = new HashSet<LocalDate>();
    for (DailySnapshot snapshot : plan.fetched().snapshots()) {
      try {
        canonical.add(normalizer.toCanonical(snapshot, referenceCurrency));
        normalizedDates.add(snapshot.date());
      } catch (NormalizationException e) {
        log.warn("Dropping {} snapshot of {}: {}", source.id(), snapshot.date(), e.getMessage());
        problems.add(e.getMessage());
      }
    }

    var toWrite =
        plan.fillUntil() == null
            ? List.<CanonicalSnapshot>of()
            : densify(canonical, plan, normalizedDates);

    var batchDays = properties.getSync().getUpsertBatchDays();
    for (var from = 0; from < toWrite.size(); from += batchDays) {
      var chunk = toWrite.subList(from, Math.min(from + batchDays, toWrite.size()));
      var rows = chunk.stream().flatMap(snapshot -> snapshot.toRates().stream()).toList();

      var result = rateStore.upsert(rows);
      progress.snapshotDays += chunk.size();
      progress.rowsWritten += result.keysWritten();
    }

    rateStore.upsertCurrencies(source.id(), source.supportedCurrencies());
    return problems;
  }

  private List<CanonicalSnapshot> densify(
      List<CanonicalSnapshot> canonical, FetchPlan plan, Set<LocalDate> normalizedDates) {
    var dense = gapFiller.densify(canonical, plan.fillUntil());
    if (plan.anchor() == null || normalizedDates.contains(plan.anchor().date())) {
      return dense;
    }

    // anchor is already stored as-is
    var anchorDate = plan.anchor().date();
    return dense.stream().filter(snapshot -> !snapshot.date().equals(anchorDate)).toList();
  }

  private Semaphore lockFor(String providerId) {
    return locks.computeIfAbsent(providerId, id -> new Semaphore(1));
  }

  private void recordMetrics(Timer.Sample sample, String providerId, SyncStatus status) {
    var statusTag = status.name().toLowerCase(Locale.ROOT);

    sample.stop(
        Timer.builder("rate.sync.duration")
            .tag("provider", providerId)
            .tag("status", statusTag)
            .register(meterRegistry));

    meterRegistry
        .counter("rate.sync.runs", "provider", providerId, "status", statusTag)
        .increment();
  }

  private void logSummary(List<SyncResult> results) {
    if (results.isEmpty()) {
      return;
    }

    var failed = results.stream().filter(SyncResult::isFailed).count();
    var rows = results.stream().mapToInt(SyncResult::rowsWritten).sum();
    log.info(
        "Sync complete: {} providers processed, {} failed, {} rows written",
        results.size(),
        failed,
        rows);
  }

  /**
   * What to ingest and how far to fill.
   *
   * @param anchor stored snapshot the fetched series continues from, may be null
   * @param fillUntil last date to gap-fill to, null when there is nothing to write
   */
  private record FetchPlan(
      FetchResult fetched,
      CanonicalSnapshot anchor,
      LocalDate windowStart,
      LocalDate windowEnd,
      LocalDate fillUntil) {}

  private static final class Progress {
    private int snapshotDays;
    private int rowsWritten;
  }
}

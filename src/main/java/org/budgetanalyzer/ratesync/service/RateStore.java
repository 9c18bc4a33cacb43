package org.budgetanalyzer.ratesync.service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import org.budgetanalyzer.ratesync.config.CacheConfig;
import org.budgetanalyzer.ratesync.config.RateSyncProperties;
import org.budgetanalyzer.ratesync.domain.CanonicalRate;
import org.budgetanalyzer.ratesync.domain.CurrencyMetadata;
import org.budgetanalyzer.ratesync.domain.SyncRun;
import org.budgetanalyzer.ratesync.domain.SyncStatus;
import org.budgetanalyzer.ratesync.exception.NotFoundException;
import org.budgetanalyzer.ratesync.exception.StoreException;
import org.budgetanalyzer.ratesync.repository.CanonicalRateRepository;
import org.budgetanalyzer.ratesync.repository.CurrencyMetadataRepository;
import org.budgetanalyzer.ratesync.repository.SyncRunRepository;
import org.budgetanalyzer.ratesync.repository.spec.CanonicalRateSpecifications;
import org.budgetanalyzer.ratesync.service.dto.CanonicalSnapshot;
import org.budgetanalyzer.ratesync.service.dto.CurrencyInfo;
import org.budgetanalyzer.ratesync.service.dto.DatedRates;
import org.budgetanalyzer.ratesync.service.dto.SupportedCurrency;
import org.budgetanalyzer.ratesync.service.dto.UpsertResult;

/**
 * Durable store of canonical rates, currency metadata and sync runs.
 *
 * <p>Rows are keyed by {@code (date, baseCurrency, targetCurrency, provider)}, so writing the same
 * key twice updates in place. When several providers publish the same currency for the same date,
 * reads merge them by the configured provider priority: the first provider in the list wins.
 *
 * <p>Data access failures surface as {@link StoreException}.
 */
@Service
public class RateStore {

  private static final Logger log = LoggerFactory.getLogger(RateStore.class);

  private static final List<SyncStatus> COMPLETED_STATUSES =
      List.of(SyncStatus.SUCCESS, SyncStatus.PARTIAL);

  private final CanonicalRateRepository canonicalRateRepository;
  private final CurrencyMetadataRepository currencyMetadataRepository;
  private final SyncRunRepository syncRunRepository;
  private final RateSyncProperties properties;

  public RateStore(
      CanonicalRateRepository canonicalRateRepository,
      CurrencyMetadataRepository currencyMetadataRepository,
      SyncRunRepository syncRunRepository,
      RateSyncProperties properties) {
    this.canonicalRateRepository = canonicalRateRepository;
    this.currencyMetadataRepository = currencyMetadataRepository;
    this.syncRunRepository = syncRunRepository;
    this.properties = properties;
  }

  /**
   * Inserts new keys and overwrites the rate and carried-forward flag of existing keys, in a single
   * transaction. Rows repeating a key within the batch are collapsed, the last one wins.
   *
   * <p>Each {@code (provider, base, date)} in the batch is written as a whole snapshot: stored rows
   * of that date whose target currency is absent from the batch are deleted.
   *
   * <p>Evicts every cached lookup: a batch usually touches many dates at once.
   *
   * @param rows canonical rows to write
   * @return counts of new, updated and unchanged keys
   */
  @Transactional
  @CacheEvict(cacheNames = CacheConfig.CANONICAL_RATES_CACHE, allEntries = true)
  public UpsertResult upsert(List<CanonicalRate> rows) {
    if (rows.isEmpty()) {
      return UpsertResult.EMPTY;
    }

    var incoming = new LinkedHashMap<CanonicalRate.Key, CanonicalRate>();
    rows.forEach(row -> incoming.put(row.key(), row));

    try {
      var existing = loadExisting(incoming.values());
      var toSave = new ArrayList<CanonicalRate>();
      var newCount = 0;
      var updatedCount = 0;
      var unchangedCount = 0;

      for (var entry : incoming.entrySet()) {
        var row = entry.getValue();
        var stored = existing.get(entry.getKey());

        if (stored == null) {
          toSave.add(row);
          newCount++;
        } else if (Double.compare(stored.getRate(), row.getRate()) != 0
            || stored.isCarriedForward() != row.isCarriedForward()) {
          if (!stored.isCarriedForward() && !row.isCarriedForward()) {
            log.warn(
                "Published rate changed provider: {} date: {} currency: {} old: {} new: {}",
                row.getProvider(),
                row.getDate(),
                row.getTargetCurrency(),
                stored.getRate(),
                row.getRate());
          }

          stored.setRate(row.getRate());
          stored.setCarriedForward(row.isCarriedForward());
          toSave.add(stored);
          updatedCount++;
        } else {
          unchangedCount++;
        }
      }

      var stale = staleRows(existing, incoming);
      if (!stale.isEmpty()) {
        canonicalRateRepository.deleteAll(stale);
      }
      canonicalRateRepository.saveAll(toSave);
      canonicalRateRepository.flush();

      log.debug(
          "Upsert complete: {} new, {} updated, {} unchanged, {} removed",
          newCount,
          updatedCount,
          unchangedCount,
          stale.size());

      return new UpsertResult(newCount, updatedCount, unchangedCount);
    } catch (DataAccessException e) {
      throw new StoreException("Failed to upsert canonical rates: " + e.getMessage(), e);
    }
  }

  /**
   * Merged canonical mapping of the most recent stored date.
   *
   * @return the latest date and its rates
   * @throws NotFoundException if the store holds no rates
   */
  public DatedRates latest() {
    var referenceCurrency = properties.getReferenceCurrency();
    var latestDate =
        read(() -> canonicalRateRepository.findLatestDate(referenceCurrency))
            .orElseThrow(() -> NotFoundException.noRateData("No rate data has been synced yet"));

    return new DatedRates(latestDate, mergedRatesAt(latestDate));
  }

  /**
   * Merged canonical mapping of one date. Never zero-filled: a date without rows is not found.
   *
   * <p>Cached by date. The returned map is mutable so that it survives a cache round trip.
   *
   * @param date the date to look up
   * @return mapping of target currency to reference-based rate
   * @throws NotFoundException if no rows exist for the date
   */
  @Cacheable(cacheNames = CacheConfig.CANONICAL_RATES_CACHE, key = "#date.toString()")
  public Map<String, Double> atDate(LocalDate date) {
    var rates = mergedRatesAt(date);
    if (rates.isEmpty()) {
      throw NotFoundException.noRateData("No rate data for date: " + date);
    }
    return rates;
  }

  /**
   * Merged canonical mappings of every stored date in a range.
   *
   * @param startDate first date, inclusive
   * @param endDate last date, inclusive
   * @return ascending per-date mappings; dates without rows are absent
   */
  public List<DatedRates> range(LocalDate startDate, LocalDate endDate) {
    var spec =
        CanonicalRateSpecifications.hasBaseCurrency(properties.getReferenceCurrency())
            .and(CanonicalRateSpecifications.dateGreaterThanOrEqual(startDate))
            .and(CanonicalRateSpecifications.dateLessThanOrEqual(endDate));

    var rows = read(() -> canonicalRateRepository.findAll(spec, Sort.by("date").ascending()));

    var byDate =
        rows.stream()
            .collect(
                Collectors.groupingBy(CanonicalRate::getDate, TreeMap::new, Collectors.toList()));

    return byDate.entrySet().stream()
        .map(entry -> new DatedRates(entry.getKey(), merge(entry.getValue())))
        .toList();
  }

  /**
   * Appends a sync run record. Failures are logged and never propagated: the audit trail must not
   * turn a completed sync into a failed one.
   *
   * @param run the run to record
   */
  public void recordRun(SyncRun run) {
    try {
      syncRunRepository.save(run);
    } catch (RuntimeException e) {
      log.error(
          "Failed to record sync run provider: {} status: {}",
          run.getProvider(),
          run.getStatus(),
          e);
    }
  }

  /**
   * Most recent date the provider actually published. Carried-forward rows are ignored.
   *
   * @param provider provider id
   * @return last published date, or empty if the provider has no published rows
   */
  public Optional<LocalDate> lastPublishedDate(String provider) {
    return read(
        () ->
            canonicalRateRepository.findLastPublishedDate(
                provider, properties.getReferenceCurrency()));
  }

  /**
   * Stored canonical snapshot of one provider for one date.
   *
   * @param provider provider id
   * @param date the date
   * @return the snapshot, or empty if the provider has no rows for the date
   */
  public Optional<CanonicalSnapshot> snapshotAt(String provider, LocalDate date) {
    var rows =
        read(
            () ->
                canonicalRateRepository.findByProviderAndBaseCurrencyAndDate(
                    provider, properties.getReferenceCurrency(), date));

    return rows.isEmpty() ? Optional.empty() : Optional.of(CanonicalSnapshot.fromRates(rows));
  }

  public boolean isEmpty() {
    return countRows() == 0;
  }

  public long countRows() {
    return read(canonicalRateRepository::count);
  }

  public long countRows(String provider) {
    return read(() -> canonicalRateRepository.countByProvider(provider));
  }

  public long countCurrencies(String provider) {
    return read(() -> currencyMetadataRepository.countByProvider(provider));
  }

  /**
   * Replaces the stored currency metadata of a provider with its current supported list. Names are
   * overwritten, currencies the provider no longer lists are kept.
   *
   * @param provider provider id
   * @param currencies currencies the provider publishes
   */
  @Transactional
  public void upsertCurrencies(String provider, List<SupportedCurrency> currencies) {
    try {
      var stored =
          currencyMetadataRepository.findByProvider(provider).stream()
              .collect(Collectors.toMap(CurrencyMetadata::getCode, Function.identity()));

      var toSave = new ArrayList<CurrencyMetadata>();
      for (var currency : currencies) {
        var metadata = stored.get(currency.code());
        if (metadata == null) {
          toSave.add(new CurrencyMetadata(currency.code(), currency.name(), provider));
        } else if (!currency.name().equals(metadata.getName())) {
          metadata.setName(currency.name());
          toSave.add(metadata);
        }
      }

      currencyMetadataRepository.saveAll(toSave);
    } catch (DataAccessException e) {
      throw new StoreException("Failed to store currencies of " + provider, e);
    }
  }

  /**
   * Every known currency with the providers that publish it and the observed date range.
   *
   * @return currencies sorted by code
   */
  public List<CurrencyInfo> currencies() {
    var ranges =
        read(
            () ->
                canonicalRateRepository.findDateRangesByTargetCurrency(
                    properties.getReferenceCurrency()));
    var metadata = read(currencyMetadataRepository::findAll);

    var codes = new TreeSet<String>();
    ranges.forEach(range -> codes.add(range.getCode()));
    metadata.forEach(currency -> codes.add(currency.getCode()));

    var rangeByCode =
        ranges.stream()
            .collect(
                Collectors.toMap(
                    CanonicalRateRepository.CurrencyDateRange::getCode, Function.identity()));
    var metadataByCode =
        metadata.stream().collect(Collectors.groupingBy(CurrencyMetadata::getCode));

    return codes.stream()
        .map(
            code -> {
              var entries = metadataByCode.getOrDefault(code, List.of());
              var name = entries.isEmpty() ? code : entries.get(0).getName();
              var providers =
                  entries.stream()
                      .map(CurrencyMetadata::getProvider)
                      .sorted(providerOrder())
                      .toList();
              var range = rangeByCode.get(code);

              return new CurrencyInfo(
                  code,
                  name,
                  providers,
                  range != null ? range.getMinDate() : null,
                  range != null ? range.getMaxDate() : null);
            })
        .toList();
  }

  /**
   * Latest run of a provider that completed, successfully or partially.
   *
   * @param provider provider id
   * @return the run, or empty if the provider never completed a sync
   */
  public Optional<SyncRun> lastCompletedRun(String provider) {
    return read(
        () ->
            syncRunRepository.findTopByProviderAndStatusInOrderByStartedAtDesc(
                provider, COMPLETED_STATUSES));
  }

  /**
   * Most recent sync runs, newest first.
   *
   * @param provider provider id, or null for all providers
   * @param limit maximum number of runs
   * @return the runs
   */
  public List<SyncRun> recentRuns(String provider, int limit) {
    var page = PageRequest.of(0, limit);
    if (provider == null) {
      return read(() -> syncRunRepository.findAllByOrderByStartedAtDesc(page));
    }
    return read(() -> syncRunRepository.findByProviderOrderByStartedAtDesc(provider, page));
  }

  private static List<CanonicalRate> staleRows(
      Map<CanonicalRate.Key, CanonicalRate> existing,
      Map<CanonicalRate.Key, CanonicalRate> incoming) {
    var writtenDates =
        incoming.keySet().stream()
            .map(key -> List.of(key.provider(), key.baseCurrency(), key.date()))
            .collect(Collectors.toSet());

    return existing.entrySet().stream()
        .filter(entry -> !incoming.containsKey(entry.getKey()))
        .filter(
            entry ->
                writtenDates.contains(
                    List.of(
                        entry.getKey().provider(),
                        entry.getKey().baseCurrency(),
                        entry.getKey().date())))
        .map(Map.Entry::getValue)
        .toList();
  }

  private Map<CanonicalRate.Key, CanonicalRate> loadExisting(
      Collection<CanonicalRate> rows) {
    var existing = new LinkedHashMap<CanonicalRate.Key, CanonicalRate>();

    var groups =
        rows.stream()
            .collect(
                Collectors.groupingBy(
                    row -> List.of(row.getProvider(), row.getBaseCurrency()),
                    Collectors.toList()));

    for (var group : groups.values()) {
      var first = group.get(0);
      var minDate =
          group.stream().map(CanonicalRate::getDate).min(Comparator.naturalOrder()).orElseThrow();
      var maxDate =
          group.stream().map(CanonicalRate::getDate).max(Comparator.naturalOrder()).orElseThrow();

      canonicalRateRepository
          .findByProviderAndBaseCurrencyAndDateBetween(
              first.getProvider(), first.getBaseCurrency(), minDate, maxDate)
          .forEach(stored -> existing.put(stored.key(), stored));
    }

    return existing;
  }

  private Map<String, Double> mergedRatesAt(LocalDate date) {
    var rows =
        read(
            () ->
                canonicalRateRepository.findByBaseCurrencyAndDate(
                    properties.getReferenceCurrency(), date));
    return merge(rows);
  }

  private TreeMap<String, Double> merge(List<CanonicalRate> rows) {
    var sorted = new ArrayList<>(rows);
    sorted.sort(Comparator.comparing(CanonicalRate::getProvider, providerOrder()));

    var merged = new TreeMap<String, Double>();
    sorted.forEach(row -> merged.putIfAbsent(row.getTargetCurrency(), row.getRate()));
    return merged;
  }

  private Comparator<String> providerOrder() {
    var priority = properties.getProviderPriority();
    return Comparator.<String>comparingInt(
            provider -> {
              var index = priority.indexOf(provider);
              return index < 0 ? Integer.MAX_VALUE : index;
            })
        .thenComparing(Comparator.naturalOrder());
  }

  private <T> T read(Supplier<T> query) {
    try {
      return query.get();
    } catch (DataAccessException e) {
      throw new StoreException("Failed to read rate store: " + e.getMessage(), e);
    }
  }
}

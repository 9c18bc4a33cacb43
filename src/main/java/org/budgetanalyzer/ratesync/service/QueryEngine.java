package org.budgetanalyzer.ratesync.service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import org.budgetanalyzer.ratesync.config.RateSyncProperties;
import org.budgetanalyzer.ratesync.domain.SyncRun;
import org.budgetanalyzer.ratesync.exception.InvalidRequestException;
import org.budgetanalyzer.ratesync.exception.NotFoundException;
import org.budgetanalyzer.ratesync.service.dto.CurrencyInfo;
import org.budgetanalyzer.ratesync.service.dto.DatedRates;
import org.budgetanalyzer.ratesync.service.dto.ProviderStatus;
import org.budgetanalyzer.ratesync.service.dto.RatesResult;
import org.budgetanalyzer.ratesync.service.dto.TimeSeriesResult;
import org.budgetanalyzer.ratesync.service.provider.RateSourceRegistry;

/**
 * Read side of the service: looks up canonical rates and re-bases them at query time.
 *
 * <p>Stored rates are always expressed against the reference currency. Any other base is derived
 * per date by triangulation, so every base has the same coverage as the reference currency.
 */
@Service
public class QueryEngine {

  private final RateStore rateStore;
  private final Normalizer normalizer;
  private final RateSourceRegistry rateSourceRegistry;
  private final RateSyncProperties properties;

  public QueryEngine(
      RateStore rateStore,
      Normalizer normalizer,
      RateSourceRegistry rateSourceRegistry,
      RateSyncProperties properties) {
    this.rateStore = rateStore;
    this.normalizer = normalizer;
    this.rateSourceRegistry = rateSourceRegistry;
    this.properties = properties;
  }

  /**
   * Rates of the most recent stored date.
   *
   * @param base requested base currency, null for the default
   * @param symbols target currencies to keep, null or empty for all
   * @param amount multiplier, null for 1
   * @return re-based rates
   * @throws NotFoundException if nothing has been synced yet
   */
  public RatesResult latest(String base, Collection<String> symbols, Double amount) {
    var effectiveAmount = resolveAmount(amount);
    var effectiveBase = resolveBase(base);
    var latest = rateStore.latest();

    return new RatesResult(
        effectiveAmount,
        effectiveBase,
        latest.date(),
        project(latest.rates(), effectiveBase, symbols, effectiveAmount));
  }

  /**
   * Rates of one date. Dates without stored data are not found, never approximated.
   *
   * @param date the date
   * @param base requested base currency, null for the default
   * @param symbols target currencies to keep, null or empty for all
   * @param amount multiplier, null for 1
   * @return re-based rates
   * @throws NotFoundException if no rates are stored for the date
   */
  public RatesResult atDate(
      LocalDate date, String base, Collection<String> symbols, Double amount) {
    var effectiveAmount = resolveAmount(amount);
    var effectiveBase = resolveBase(base);
    var rates = rateStore.atDate(date);

    return new RatesResult(
        effectiveAmount,
        effectiveBase,
        date,
        project(rates, effectiveBase, symbols, effectiveAmount));
  }

  /**
   * Rates of every stored date in a range, ascending.
   *
   * @param startDate first date, inclusive
   * @param endDate last date, inclusive
   * @param base requested base currency, null for the default
   * @param symbols target currencies to keep, null or empty for all
   * @param amount multiplier, null for 1
   * @return re-based rates per date; dates without stored data are omitted
   * @throws InvalidRequestException if {@code startDate} is after {@code endDate}
   * @throws NotFoundException if no date in the range has data
   */
  public TimeSeriesResult range(
      LocalDate startDate,
      LocalDate endDate,
      String base,
      Collection<String> symbols,
      Double amount) {
    if (startDate.isAfter(endDate)) {
      throw new InvalidRequestException(
          "Start date " + startDate + " must not be after end date " + endDate);
    }

    var effectiveAmount = resolveAmount(amount);
    var effectiveBase = resolveBase(base);
    var stored = rateStore.range(startDate, endDate);

    if (stored.isEmpty()) {
      throw NotFoundException.noRateData(
          "No rate data between " + startDate + " and " + endDate);
    }

    var rates = new ArrayList<DatedRates>(stored.size());
    for (var day : stored) {
      rates.add(
          new DatedRates(
              day.date(), project(day.rates(), effectiveBase, symbols, effectiveAmount)));
    }

    return new TimeSeriesResult(effectiveAmount, effectiveBase, startDate, endDate, rates);
  }

  /** Known currencies sorted by code. */
  public List<CurrencyInfo> currencies() {
    return rateStore.currencies();
  }

  /** Status of every registered provider, in priority order. */
  public List<ProviderStatus> providers() {
    return rateSourceRegistry.all().stream()
        .map(
            source ->
                new ProviderStatus(
                    source.id(),
                    source.description(),
                    source.isEnabled(),
                    rateStore
                        .lastCompletedRun(source.id())
                        .map(SyncRun::getFinishedAt)
                        .orElse(null),
                    rateStore.countCurrencies(source.id()),
                    rateStore.countRows(source.id())))
        .toList();
  }

  private Map<String, Double> project(
      Map<String, Double> referenceRates,
      String base,
      Collection<String> symbols,
      double amount) {
    var rebased =
        normalizer.convertBase(referenceRates, properties.getReferenceCurrency(), base);
    var wanted = normalizeSymbols(symbols);

    var rv = new LinkedHashMap<String, Double>();
    new TreeMap<>(rebased)
        .forEach(
            (code, rate) -> {
              if (wanted.isEmpty() || wanted.contains(code)) {
                rv.put(code, rate * amount);
              }
            });
    return rv;
  }

  private String resolveBase(String base) {
    if (base == null || base.isBlank()) {
      return properties.getDefaultQueryBase();
    }

    var upper = base.trim().toUpperCase(Locale.ROOT);
    if (!upper.matches("[A-Z]{3}")) {
      throw new InvalidRequestException("Invalid base currency code: " + base);
    }
    return upper;
  }

  private static double resolveAmount(Double amount) {
    if (amount == null) {
      return 1.0;
    }
    if (!Double.isFinite(amount) || amount <= 0) {
      throw new InvalidRequestException("Amount must be a positive number: " + amount);
    }
    return amount;
  }

  private static Set<String> normalizeSymbols(Collection<String> symbols) {
    if (symbols == null) {
      return Set.of();
    }
    return symbols.stream()
        .map(String::trim)
        .filter(symbol -> !symbol.isEmpty())
        .map(symbol -> symbol.toUpperCase(Locale.ROOT))
        .collect(Collectors.toSet());
  }
}

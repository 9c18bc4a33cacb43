package org.budgetanalyzer.ratesync.service.provider;

import java.io.InputStream;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import org.budgetanalyzer.ratesync.client.nbu.NbuClient;
import org.budgetanalyzer.ratesync.client.nbu.response.NbuBatchRate;
import org.budgetanalyzer.ratesync.config.RateSyncProperties;
import org.budgetanalyzer.ratesync.exception.FetchException;
import org.budgetanalyzer.ratesync.exception.RateParseException;
import org.budgetanalyzer.ratesync.service.dto.DailySnapshot;
import org.budgetanalyzer.ratesync.service.dto.FetchResult;
import org.budgetanalyzer.ratesync.service.dto.SupportedCurrency;

/**
 * National Bank of Ukraine official rates, quoted as UAH per unit of foreign currency.
 *
 * <p>The batch endpoint serves one currency per request, so a fetch issues one request per
 * configured currency and merges the series by date. Snapshots carry native-base rates, {@code
 * UAH->XXX = 1 / rate_per_unit}.
 */
@Service
public class NbuRateSource implements RateSource {

  private static final Logger log = LoggerFactory.getLogger(NbuRateSource.class);

  public static final String ID = "nbu";
  private static final String NATIVE_BASE = "UAH";
  private static final DateTimeFormatter EXCHANGE_DATE_FORMAT =
      DateTimeFormatter.ofPattern("dd.MM.yyyy");

  private static final Map<String, String> CURRENCY_NAMES =
      Map.of(
          "UAH", "Ukrainian Hryvnia",
          "USD", "US Dollar",
          "KZT", "Kazakhstani Tenge",
          "LBP", "Lebanese Pound",
          "MDL", "Moldovan Leu",
          "SAR", "Saudi Riyal",
          "VND", "Vietnamese Dong",
          "EGP", "Egyptian Pound",
          "GEL", "Georgian Lari");

  private final NbuClient nbuClient;
  private final RateSyncProperties.Nbu nbuConfig;
  private final Clock clock;

  public NbuRateSource(NbuClient nbuClient, RateSyncProperties properties, Clock clock) {
    this.nbuClient = nbuClient;
    this.nbuConfig = properties.getProviders().getNbu();
    this.clock = clock;
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public String description() {
    return "National Bank of Ukraine - Daily UAH reference rates";
  }

  @Override
  public String nativeBaseCurrency() {
    return NATIVE_BASE;
  }

  @Override
  public List<SupportedCurrency> supportedCurrencies() {
    var currencies = new ArrayList<SupportedCurrency>();
    currencies.add(new SupportedCurrency(NATIVE_BASE, CURRENCY_NAMES.get(NATIVE_BASE)));
    for (var code : nbuConfig.getCurrencies()) {
      var upper = code.toUpperCase(Locale.ROOT);
      currencies.add(new SupportedCurrency(upper, CURRENCY_NAMES.getOrDefault(upper, upper)));
    }
    return currencies;
  }

  @Override
  public boolean isEnabled() {
    return nbuConfig.isEnabled();
  }

  @Override
  public FetchResult fetchFullHistory() {
    return fetchRange(nbuConfig.getHistoryStart(), LocalDate.now(clock));
  }

  @Override
  public FetchResult fetchRange(LocalDate startDate, LocalDate endDate) {
    log.info("Fetching NBU rates start: {} end: {}", startDate, endDate);

    var ratesByDate = new TreeMap<LocalDate, Map<String, Double>>();
    var warnings = new ArrayList<String>();
    var currencies = nbuConfig.getCurrencies();
    var failures = 0;

    for (var i = 0; i < currencies.size(); i++) {
      var code = currencies.get(i);
      if (i > 0) {
        pause();
      }

      try {
        addRows(ratesByDate, nbuClient.fetchBatch(code, startDate, endDate));
      } catch (FetchException | RateParseException e) {
        failures++;
        log.warn("Skipping NBU currency {}: {}", code, e.getMessage());
        warnings.add("NBU series " + code + " unavailable: " + e.getMessage());
      }
    }

    if (failures == currencies.size()) {
      throw new FetchException("Every NBU currency request failed: " + String.join("; ", warnings));
    }

    var snapshots = toSnapshots(ratesByDate);
    log.info("Fetched {} days of NBU data via batch API", snapshots.size());

    return new FetchResult(snapshots, warnings);
  }

  @Override
  public FetchResult readBundle(InputStream inputStream) {
    var ratesByDate = new TreeMap<LocalDate, Map<String, Double>>();
    nbuClient.parseBundle(inputStream).values().forEach(rows -> addRows(ratesByDate, rows));

    return FetchResult.of(toSnapshots(ratesByDate));
  }

  private void addRows(Map<LocalDate, Map<String, Double>> ratesByDate, List<NbuBatchRate> rows) {
    for (var row : rows) {
      if (row.exchangeDate() == null || row.currencyCode() == null) {
        throw new RateParseException("Incomplete NBU row: " + row);
      }

      LocalDate date;
      try {
        date = LocalDate.parse(row.exchangeDate().trim(), EXCHANGE_DATE_FORMAT);
      } catch (DateTimeParseException e) {
        log.warn("Skipping NBU row with unparseable date: {}", row.exchangeDate());
        continue;
      }

      var ratePerUnit = row.ratePerUnit();
      if (ratePerUnit == null || ratePerUnit <= 0) {
        log.warn("Skipping NBU row without usable rate: {}", row);
        continue;
      }

      ratesByDate
          .computeIfAbsent(date, d -> new LinkedHashMap<>())
          .put(row.currencyCode().toUpperCase(Locale.ROOT), 1.0 / ratePerUnit);
    }
  }

  private List<DailySnapshot> toSnapshots(TreeMap<LocalDate, Map<String, Double>> ratesByDate) {
    return ratesByDate.entrySet().stream()
        .map(entry -> new DailySnapshot(entry.getKey(), ID, NATIVE_BASE, entry.getValue()))
        .toList();
  }

  private void pause() {
    if (nbuConfig.getRequestDelayMillis() <= 0) {
      return;
    }

    try {
      Thread.sleep(nbuConfig.getRequestDelayMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FetchException("Interrupted between NBU requests", e);
    }
  }
}

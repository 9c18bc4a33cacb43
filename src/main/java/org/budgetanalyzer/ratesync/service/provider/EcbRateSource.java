package org.budgetanalyzer.ratesync.service.provider;

import java.io.InputStream;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import org.budgetanalyzer.ratesync.client.ecb.EcbClient;
import org.budgetanalyzer.ratesync.client.ecb.response.EcbDayCube;
import org.budgetanalyzer.ratesync.client.ecb.response.EcbEnvelope;
import org.budgetanalyzer.ratesync.client.ecb.response.EcbRateCube;
import org.budgetanalyzer.ratesync.config.RateSyncProperties;
import org.budgetanalyzer.ratesync.exception.RateParseException;
import org.budgetanalyzer.ratesync.service.dto.DailySnapshot;
import org.budgetanalyzer.ratesync.service.dto.FetchResult;
import org.budgetanalyzer.ratesync.service.dto.SupportedCurrency;

/**
 * European Central Bank reference rates, published each TARGET working day against the euro.
 *
 * <p>Ranges starting within the recent window are served from the short history file, everything
 * else from the full history file.
 */
@Service
public class EcbRateSource implements RateSource {

  private static final Logger log = LoggerFactory.getLogger(EcbRateSource.class);

  public static final String ID = "ecb";
  private static final String NATIVE_BASE = "EUR";

  private static final List<SupportedCurrency> SUPPORTED_CURRENCIES =
      List.of(
          new SupportedCurrency("EUR", "Euro"),
          new SupportedCurrency("USD", "US Dollar"),
          new SupportedCurrency("JPY", "Japanese Yen"),
          new SupportedCurrency("BGN", "Bulgarian Lev"),
          new SupportedCurrency("CZK", "Czech Koruna"),
          new SupportedCurrency("DKK", "Danish Krone"),
          new SupportedCurrency("GBP", "British Pound"),
          new SupportedCurrency("HUF", "Hungarian Forint"),
          new SupportedCurrency("PLN", "Polish Zloty"),
          new SupportedCurrency("RON", "Romanian Leu"),
          new SupportedCurrency("SEK", "Swedish Krona"),
          new SupportedCurrency("CHF", "Swiss Franc"),
          new SupportedCurrency("ISK", "Icelandic Krona"),
          new SupportedCurrency("NOK", "Norwegian Krone"),
          new SupportedCurrency("TRY", "Turkish Lira"),
          new SupportedCurrency("AUD", "Australian Dollar"),
          new SupportedCurrency("BRL", "Brazilian Real"),
          new SupportedCurrency("CAD", "Canadian Dollar"),
          new SupportedCurrency("CNY", "Chinese Yuan"),
          new SupportedCurrency("HKD", "Hong Kong Dollar"),
          new SupportedCurrency("IDR", "Indonesian Rupiah"),
          new SupportedCurrency("ILS", "Israeli Shekel"),
          new SupportedCurrency("INR", "Indian Rupee"),
          new SupportedCurrency("KRW", "South Korean Won"),
          new SupportedCurrency("MXN", "Mexican Peso"),
          new SupportedCurrency("MYR", "Malaysian Ringgit"),
          new SupportedCurrency("NZD", "New Zealand Dollar"),
          new SupportedCurrency("PHP", "Philippine Peso"),
          new SupportedCurrency("SGD", "Singapore Dollar"),
          new SupportedCurrency("THB", "Thai Baht"),
          new SupportedCurrency("ZAR", "South African Rand"));

  private final EcbClient ecbClient;
  private final RateSyncProperties.Ecb ecbConfig;
  private final Clock clock;

  public EcbRateSource(EcbClient ecbClient, RateSyncProperties properties, Clock clock) {
    this.ecbClient = ecbClient;
    this.ecbConfig = properties.getProviders().getEcb();
    this.clock = clock;
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public String description() {
    return "European Central Bank - Daily EUR reference rates";
  }

  @Override
  public String nativeBaseCurrency() {
    return NATIVE_BASE;
  }

  @Override
  public List<SupportedCurrency> supportedCurrencies() {
    return SUPPORTED_CURRENCIES;
  }

  @Override
  public boolean isEnabled() {
    return ecbConfig.isEnabled();
  }

  @Override
  public FetchResult fetchFullHistory() {
    log.info("Fetching full ECB history");
    return FetchResult.of(toSnapshots(ecbClient.fetchHistory(false), null, null));
  }

  @Override
  public FetchResult fetchRange(LocalDate startDate, LocalDate endDate) {
    var today = LocalDate.now(clock);
    var recentOnly = !startDate.isBefore(today.minusDays(ecbConfig.getRecentWindowDays()));

    log.info(
        "Fetching ECB rates start: {} end: {} file: {}",
        startDate,
        endDate,
        recentOnly ? "recent" : "full");

    return FetchResult.of(toSnapshots(ecbClient.fetchHistory(recentOnly), startDate, endDate));
  }

  @Override
  public FetchResult readBundle(InputStream inputStream) {
    return FetchResult.of(toSnapshots(ecbClient.parse(inputStream), null, null));
  }

  private List<DailySnapshot> toSnapshots(
      EcbEnvelope envelope, LocalDate startDate, LocalDate endDate) {
    var days = envelope.getCube().getDays();
    if (days == null) {
      return List.of();
    }

    return days.stream()
        .map(this::toSnapshot)
        .filter(snapshot -> startDate == null || !snapshot.date().isBefore(startDate))
        .filter(snapshot -> endDate == null || !snapshot.date().isAfter(endDate))
        .sorted(Comparator.comparing(DailySnapshot::date))
        .toList();
  }

  private DailySnapshot toSnapshot(EcbDayCube day) {
    if (day.getTime() == null) {
      throw new RateParseException("ECB day cube without publication date");
    }

    LocalDate date;
    try {
      date = LocalDate.parse(day.getTime());
    } catch (DateTimeParseException e) {
      throw new RateParseException("Invalid ECB publication date: " + day.getTime(), e);
    }

    var rates = new LinkedHashMap<String, Double>();
    var cubes = day.getRates() != null ? day.getRates() : List.<EcbRateCube>of();
    for (var cube : cubes) {
      if (cube.getCurrency() == null || cube.getRate() == null) {
        throw new RateParseException("Incomplete ECB rate entry on " + date);
      }

      try {
        rates.put(cube.getCurrency(), Double.parseDouble(cube.getRate()));
      } catch (NumberFormatException e) {
        throw new RateParseException(
            "Invalid ECB rate on " + date + " for " + cube.getCurrency() + ": " + cube.getRate(),
            e);
      }
    }

    return new DailySnapshot(date, ID, NATIVE_BASE, rates);
  }
}

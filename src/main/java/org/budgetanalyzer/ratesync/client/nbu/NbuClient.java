package org.budgetanalyzer.ratesync.client.nbu;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import reactor.core.publisher.Mono;

import org.budgetanalyzer.ratesync.client.nbu.response.NbuBatchRate;
import org.budgetanalyzer.ratesync.config.RateSyncProperties;
import org.budgetanalyzer.ratesync.exception.FetchException;
import org.budgetanalyzer.ratesync.exception.RateParseException;

/** Client for the National Bank of Ukraine batch exchange rate endpoint. */
@Component
public class NbuClient {

  private static final Logger log = LoggerFactory.getLogger(NbuClient.class);

  static final String BATCH_PATH = "/NBU_Exchange/exchange_site";

  private static final String USER_AGENT = "RateSyncServiceClient/1.0";
  private static final DateTimeFormatter REQUEST_DATE_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd");
  private static final TypeReference<List<NbuBatchRate>> BATCH_TYPE = new TypeReference<>() {};
  private static final TypeReference<Map<String, List<NbuBatchRate>>> BUNDLE_TYPE =
      new TypeReference<>() {};

  private final WebClient webClient;
  private final Duration timeout;
  private final ObjectMapper objectMapper;

  public NbuClient(
      WebClient.Builder webClientBuilder,
      RateSyncProperties properties,
      ObjectMapper objectMapper) {
    var nbuConfig = properties.getProviders().getNbu();

    this.webClient =
        webClientBuilder
            .clone()
            .baseUrl(nbuConfig.getBaseUrl())
            .defaultHeader("User-Agent", USER_AGENT)
            .build();
    this.timeout = Duration.ofSeconds(nbuConfig.getTimeoutSeconds());
    this.objectMapper = objectMapper;

    log.info("NbuClient initialized with base URL: {}", nbuConfig.getBaseUrl());
  }

  /**
   * Fetches the daily series of one currency.
   *
   * @param currencyCode ISO code of the currency
   * @param startDate first date, inclusive
   * @param endDate last date, inclusive
   * @return rows in ascending date order
   * @throws FetchException if the endpoint cannot be reached or answers with an error
   * @throws RateParseException if the response is not a valid batch payload
   */
  public List<NbuBatchRate> fetchBatch(
      String currencyCode, LocalDate startDate, LocalDate endDate) {
    log.info(
        "Requesting NBU batch currency: {} start: {} end: {}", currencyCode, startDate, endDate);

    String body;
    try {
      body =
          webClient
              .get()
              .uri(
                  uriBuilder ->
                      uriBuilder
                          .path(BATCH_PATH)
                          .queryParam("start", REQUEST_DATE_FORMAT.format(startDate))
                          .queryParam("end", REQUEST_DATE_FORMAT.format(endDate))
                          .queryParam("valcode", currencyCode.toLowerCase(Locale.ROOT))
                          .queryParam("sort", "exchangedate")
                          .queryParam("order", "asc")
                          .queryParam("json")
                          .build())
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .onStatus(HttpStatusCode::isError, this::handleErrorResponse)
              .bodyToMono(String.class)
              .timeout(timeout)
              .block();
    } catch (FetchException fe) {
      throw fe;
    } catch (Exception e) {
      log.warn("Unexpected error fetching NBU batch for {}: {}", currencyCode, e.getMessage(), e);
      throw new FetchException("Failed to fetch NBU batch for " + currencyCode, e);
    }

    if (body == null || body.isBlank()) {
      return List.of();
    }

    try {
      var rows = objectMapper.readValue(body, BATCH_TYPE);
      log.debug("Fetched {} NBU rows for {}", rows.size(), currencyCode);
      return rows;
    } catch (IOException e) {
      throw new RateParseException(
          "Malformed NBU batch response for " + currencyCode + ": " + e.getMessage(), e);
    }
  }

  /**
   * Parses bundled history: a JSON object mapping currency code to its batch rows.
   *
   * @param inputStream the JSON document
   * @return rows per currency code
   * @throws RateParseException if the document cannot be parsed
   */
  public Map<String, List<NbuBatchRate>> parseBundle(InputStream inputStream) {
    try {
      return objectMapper.readValue(inputStream, BUNDLE_TYPE);
    } catch (IOException e) {
      throw new RateParseException("Malformed NBU bundle: " + e.getMessage(), e);
    }
  }

  private Mono<? extends Throwable> handleErrorResponse(ClientResponse response) {
    return response
        .bodyToMono(String.class)
        .defaultIfEmpty("No response body")
        .map(
            body -> {
              log.warn("NBU error: HTTP {} - {}", response.statusCode(), body);
              return new FetchException("NBU responded with HTTP " + response.statusCode());
            });
  }
}

package org.budgetanalyzer.ratesync.client.ecb;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;

import reactor.core.publisher.Mono;

import org.budgetanalyzer.ratesync.client.ecb.response.EcbEnvelope;
import org.budgetanalyzer.ratesync.config.RateSyncProperties;
import org.budgetanalyzer.ratesync.exception.FetchException;
import org.budgetanalyzer.ratesync.exception.RateParseException;

/** Client for the ECB euro foreign exchange reference rate history files. */
@Component
public class EcbClient {

  private static final Logger log = LoggerFactory.getLogger(EcbClient.class);

  static final String RECENT_HISTORY_PATH = "/eurofxref-hist-90d.xml";
  static final String FULL_HISTORY_PATH = "/eurofxref-hist.xml";

  private static final String USER_AGENT = "RateSyncServiceClient/1.0";
  private static final int MAX_ERROR_BODY_LENGTH = 500;

  private final WebClient webClient;
  private final Duration timeout;
  private final XmlMapper xmlMapper;

  public EcbClient(WebClient.Builder webClientBuilder, RateSyncProperties properties) {
    var ecbConfig = properties.getProviders().getEcb();

    this.webClient =
        webClientBuilder
            .clone()
            .baseUrl(ecbConfig.getBaseUrl())
            .defaultHeader("User-Agent", USER_AGENT)
            .build();
    this.timeout = Duration.ofSeconds(ecbConfig.getTimeoutSeconds());
    this.xmlMapper = new XmlMapper();
    this.xmlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    log.info("EcbClient initialized with base URL: {}", ecbConfig.getBaseUrl());
  }

  /**
   * Downloads and parses a history file.
   *
   * @param recentOnly true for the file covering the last 90 days, false for the full history
   * @return parsed envelope
   * @throws FetchException if the file cannot be downloaded
   * @throws RateParseException if the file is not a valid rates document
   */
  public EcbEnvelope fetchHistory(boolean recentOnly) {
    var path = recentOnly ? RECENT_HISTORY_PATH : FULL_HISTORY_PATH;
    log.info("Requesting ECB history file: {}", path);

    String body;
    try {
      body =
          webClient
              .get()
              .uri(path)
              .accept(MediaType.APPLICATION_XML, MediaType.TEXT_XML)
              .retrieve()
              .onStatus(HttpStatusCode::isError, this::handleErrorResponse)
              .bodyToMono(String.class)
              .timeout(timeout)
              .block();
    } catch (FetchException fe) {
      throw fe;
    } catch (Exception e) {
      log.warn("Unexpected error fetching ECB file {}: {}", path, e.getMessage(), e);
      throw new FetchException("Failed to fetch ECB history file: " + path, e);
    }

    if (body == null || body.isBlank()) {
      throw new RateParseException("Received empty response from ECB for " + path);
    }

    return parse(body);
  }

  /**
   * Parses an ECB rates document, as downloaded or bundled.
   *
   * @param inputStream the XML document
   * @return parsed envelope
   * @throws RateParseException if the document cannot be parsed
   */
  public EcbEnvelope parse(InputStream inputStream) {
    try {
      return validate(xmlMapper.readValue(inputStream, EcbEnvelope.class));
    } catch (IOException e) {
      throw new RateParseException("Malformed ECB rates document: " + e.getMessage(), e);
    }
  }

  private EcbEnvelope parse(String body) {
    try {
      return validate(xmlMapper.readValue(body, EcbEnvelope.class));
    } catch (IOException e) {
      throw new RateParseException("Malformed ECB rates document: " + e.getMessage(), e);
    }
  }

  private EcbEnvelope validate(EcbEnvelope envelope) {
    if (envelope == null || envelope.getCube() == null) {
      throw new RateParseException("ECB rates document has no Cube element");
    }
    return envelope;
  }

  private Mono<? extends Throwable> handleErrorResponse(ClientResponse response) {
    return response
        .bodyToMono(String.class)
        .defaultIfEmpty("No response body")
        .map(
            body -> {
              var message =
                  body.length() > MAX_ERROR_BODY_LENGTH
                      ? body.substring(0, MAX_ERROR_BODY_LENGTH) + "... (truncated)"
                      : body;
              log.warn("ECB error: HTTP {} - {}", response.statusCode(), message);
              return new FetchException("ECB responded with HTTP " + response.statusCode());
            });
  }
}

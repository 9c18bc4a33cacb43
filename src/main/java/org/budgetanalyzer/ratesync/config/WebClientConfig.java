package org.budgetanalyzer.ratesync.config;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import reactor.netty.http.client.HttpClient;

/**
 * Shared WebClient builder for provider clients.
 *
 * <p>The full ECB history file is several megabytes of XML, so the in-memory buffer is raised well
 * above the 256KB default. Each client bounds a whole request with its own provider timeout; the
 * socket idle limits here follow the slowest configured provider.
 */
@Configuration
public class WebClientConfig {

  private static final int MAX_IN_MEMORY_SIZE = 64 * 1024 * 1024;
  private static final int CONNECT_TIMEOUT_MILLIS = 5000;
  private static final int WRITE_TIMEOUT_SECONDS = 10;

  @Bean
  public WebClient.Builder webClientBuilder(RateSyncProperties properties) {
    var providers = properties.getProviders();
    var idleSeconds =
        Stream.of(providers.getEcb(), providers.getNbu())
            .mapToInt(RateSyncProperties.ProviderClient::getTimeoutSeconds)
            .max()
            .orElse(60);

    var httpClient =
        HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
            .responseTimeout(Duration.ofSeconds(idleSeconds))
            .doOnConnected(
                conn ->
                    conn.addHandlerLast(new ReadTimeoutHandler(idleSeconds, TimeUnit.SECONDS))
                        .addHandlerLast(
                            new WriteTimeoutHandler(WRITE_TIMEOUT_SECONDS, TimeUnit.SECONDS)));

    var codecs =
        ExchangeStrategies.builder()
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
            .build();

    return WebClient.builder()
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .exchangeStrategies(codecs);
  }
}

package org.budgetanalyzer.ratesync.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Main configuration class for the Rate Sync Service.
 *
 * <p>Note: ObjectMapper is auto-configured by Spring Boot using spring.jackson.* properties in
 * application.yml. The ECB client keeps its own XmlMapper so XML support never replaces the
 * application-wide JSON mapper.
 */
@Configuration
@EnableConfigurationProperties(RateSyncProperties.class)
public class RateSyncConfig {

  /**
   * Clock used to resolve "today" for fetch windows and gap filling. Rates are published per UTC
   * calendar day.
   *
   * @return UTC system clock
   */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}

package org.budgetanalyzer.ratesync;

import org.junit.jupiter.api.Test;

import org.budgetanalyzer.ratesync.base.AbstractIntegrationTest;

/**
 * Smoke test to verify the Spring Boot application context loads with the {@code test} profile.
 *
 * <p>Flyway migrations, provider clients, the scheduler and the MVC layer are all wired.
 */
class RateSyncServiceApplicationTests extends AbstractIntegrationTest {

  @Test
  void contextLoads() {
    // context startup is the assertion
  }
}

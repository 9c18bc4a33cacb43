package org.budgetanalyzer.ratesync.base;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

/**
 * Base class for integration tests running the full application context.
 *
 * <p>The {@code test} profile swaps PostgreSQL for an in-memory H2 database in PostgreSQL mode,
 * migrated by Flyway, and disables the cache, the startup sync, the bootstrap and the cron trigger.
 * Tests that need a real PostgreSQL server use {@link
 * org.budgetanalyzer.ratesync.config.TestContainersConfig} instead.
 *
 * <p>All tables are emptied before each test.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
public abstract class AbstractIntegrationTest {

  @Autowired protected TestDatabaseHelper testDatabaseHelper;

  @BeforeEach
  protected void resetDatabase() {
    testDatabaseHelper.cleanupAllTables();
  }
}

package org.budgetanalyzer.ratesync.config;

import javax.sql.DataSource;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.jdbctemplate.JdbcTemplateLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;

/**
 * ShedLock configuration for the scheduled sync trigger.
 *
 * <p>Two levels of mutual exclusion exist:
 *
 * <ul>
 *   <li>ShedLock keeps the cron trigger to one execution across all instances sharing the database.
 *   <li>{@link org.budgetanalyzer.ratesync.service.SyncOrchestrator} keeps at most one running sync
 *       per provider inside this process, for scheduled and on-demand runs alike.
 * </ul>
 *
 * <p>The {@code shedlock} table is created by Flyway. Lock times are taken from the database clock
 * so instances with skewed clocks still agree on expiry.
 *
 * @see net.javacrumbs.shedlock.spring.annotation.SchedulerLock
 */
@Configuration
@EnableSchedulerLock(defaultLockAtMostFor = "30m")
public class ShedLockConfig {

  @Bean
  public LockProvider lockProvider(DataSource dataSource) {
    return new JdbcTemplateLockProvider(
        JdbcTemplateLockProvider.Configuration.builder()
            .withJdbcTemplate(new JdbcTemplate(dataSource))
            .usingDbTime()
            .build());
  }
}

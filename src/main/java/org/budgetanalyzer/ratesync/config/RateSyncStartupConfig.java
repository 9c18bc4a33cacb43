package org.budgetanalyzer.ratesync.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import org.budgetanalyzer.ratesync.domain.SyncTrigger;
import org.budgetanalyzer.ratesync.service.SyncOrchestrator;
import org.budgetanalyzer.ratesync.service.dto.SyncResult;

/**
 * Loads bundled history into an empty store and catches every provider up once the application is
 * ready. Failures are logged; the service still starts and serves whatever is stored.
 */
@Component
public class RateSyncStartupConfig {

  private static final Logger log = LoggerFactory.getLogger(RateSyncStartupConfig.class);

  private final RateSyncProperties properties;
  private final SyncOrchestrator syncOrchestrator;

  public RateSyncStartupConfig(RateSyncProperties properties, SyncOrchestrator syncOrchestrator) {
    this.properties = properties;
    this.syncOrchestrator = syncOrchestrator;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onStartup() {
    logConfiguration();
    bootstrapIfNeeded();
    syncIfNeeded();
  }

  private void bootstrapIfNeeded() {
    if (!properties.getBootstrap().isEnabled()) {
      log.info("Bootstrap from bundled history is disabled");
      return;
    }

    try {
      var results = syncOrchestrator.bootstrapIfEmpty();
      results.forEach(result -> logResult("Bootstrap", result));
    } catch (RuntimeException e) {
      log.error("Bootstrap from bundled history failed: {}", e.getMessage(), e);
    }
  }

  private void syncIfNeeded() {
    if (!properties.getSync().isSyncOnStartup()) {
      log.info("Startup sync is disabled");
      return;
    }

    try {
      var results = syncOrchestrator.syncAll(SyncTrigger.STARTUP);
      results.forEach(result -> logResult("Startup sync", result));
    } catch (RuntimeException e) {
      log.error("Startup sync failed: {}", e.getMessage(), e);
    }
  }

  private void logResult(String phase, SyncResult result) {
    log.info(
        "{} of {}: {} ({} snapshot days, {} rows){}",
        phase,
        result.provider(),
        result.outcome(),
        result.snapshotDays(),
        result.rowsWritten(),
        result.message() != null ? " - " + result.message() : "");
  }

  private void logConfiguration() {
    var sync = properties.getSync();
    var providers = properties.getProviders();

    log.info(
        "Rate Sync Configuration: reference currency: {}, default query base: {}, provider"
            + " priority: {}, cron: {}, sync on startup: {}, bootstrap: {}",
        properties.getReferenceCurrency(),
        properties.getDefaultQueryBase(),
        properties.getProviderPriority(),
        sync.getCron(),
        sync.isSyncOnStartup(),
        properties.getBootstrap().isEnabled());
    log.info(
        "Providers: ecb enabled: {} url: {}, nbu enabled: {} url: {} currencies: {}",
        providers.getEcb().isEnabled(),
        providers.getEcb().getBaseUrl(),
        providers.getNbu().isEnabled(),
        providers.getNbu().getBaseUrl(),
        providers.getNbu().getCurrencies());
  }
}

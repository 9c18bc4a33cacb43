package org.budgetanalyzer.ratesync.service.provider;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import org.budgetanalyzer.ratesync.config.RateSyncProperties;
import org.budgetanalyzer.ratesync.exception.NotFoundException;

/**
 * Rate sources by provider id, in configured priority order.
 *
 * <p>Sources missing from the priority list follow the listed ones, alphabetically. Disabled
 * sources are reported but never synced.
 */
@Component
public class RateSourceRegistry {

  private static final Logger log = LoggerFactory.getLogger(RateSourceRegistry.class);

  private final Map<String, RateSource> sources;

  public RateSourceRegistry(List<RateSource> rateSources, RateSyncProperties properties) {
    var priority = properties.getProviderPriority();
    var ordered = new ArrayList<>(rateSources);
    ordered.sort(
        Comparator.<RateSource>comparingInt(
                source -> {
                  var index = priority.indexOf(source.id());
                  return index < 0 ? Integer.MAX_VALUE : index;
                })
            .thenComparing(RateSource::id));

    this.sources = new LinkedHashMap<>();
    for (var source : ordered) {
      if (sources.putIfAbsent(source.id(), source) != null) {
        throw new IllegalStateException("Duplicate rate source id: " + source.id());
      }
    }

    log.info(
        "Registered rate sources: {} enabled: {}",
        sources.keySet(),
        enabled().stream().map(RateSource::id).toList());
  }

  /** Every registered source, enabled or not, in priority order. */
  public List<RateSource> all() {
    return List.copyOf(sources.values());
  }

  /** Enabled sources in priority order. */
  public List<RateSource> enabled() {
    return sources.values().stream().filter(RateSource::isEnabled).toList();
  }

  public Optional<RateSource> find(String providerId) {
    return Optional.ofNullable(sources.get(providerId)).filter(RateSource::isEnabled);
  }

  /**
   * Looks up an enabled source.
   *
   * @param providerId provider id
   * @return the source
   * @throws NotFoundException if no enabled source has this id
   */
  public RateSource get(String providerId) {
    return find(providerId).orElseThrow(() -> NotFoundException.unknownProvider(providerId));
  }
}

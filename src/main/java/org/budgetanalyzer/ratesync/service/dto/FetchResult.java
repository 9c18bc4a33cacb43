package org.budgetanalyzer.ratesync.service.dto;

import java.util.List;

/**
 * Snapshots returned by a rate source fetch.
 *
 * @param snapshots snapshots in ascending date order
 * @param warnings recoverable problems, such as one currency series that could not be fetched;
 *     a non-empty list makes the sync run partial
 */
public record FetchResult(List<DailySnapshot> snapshots, List<String> warnings) {

  public FetchResult {
    snapshots = List.copyOf(snapshots);
    warnings = List.copyOf(warnings);
  }

  public static FetchResult of(List<DailySnapshot> snapshots) {
    return new FetchResult(snapshots, List.of());
  }
}

package org.budgetanalyzer.ratesync.service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

import org.springframework.stereotype.Component;

import org.budgetanalyzer.ratesync.service.dto.CanonicalSnapshot;

/**
 * Densifies a provider's snapshot series so that every calendar day is covered.
 *
 * <p>A missing day takes the most recent prior snapshot, flagged as carried forward. Values only
 * move forward in time and are never interpolated. Days before the first snapshot stay absent.
 */
@Component
public class GapFiller {

  /**
   * Fills missing days from the first snapshot up to and including {@code asOf}.
   *
   * @param snapshots snapshots of one provider in any order; on duplicate dates the last one wins
   * @param asOf last day to fill
   * @return ascending, gap-free series; snapshots dated after {@code asOf} are kept as-is
   */
  public List<CanonicalSnapshot> densify(List<CanonicalSnapshot> snapshots, LocalDate asOf) {
    if (snapshots.isEmpty()) {
      return List.of();
    }

    var byDate = new TreeMap<LocalDate, CanonicalSnapshot>();
    for (var snapshot : snapshots) {
      byDate.put(snapshot.date(), snapshot);
    }

    var rv = new ArrayList<CanonicalSnapshot>();
    var current = byDate.firstEntry().getValue();
    var lastDate = byDate.lastKey().isAfter(asOf) ? byDate.lastKey() : asOf;

    for (var date = byDate.firstKey(); !date.isAfter(lastDate); date = date.plusDays(1)) {
      var published = byDate.get(date);
      if (published != null) {
        current = published;
        rv.add(published);
      } else if (!date.isAfter(asOf)) {
        rv.add(current.carryForwardTo(date));
      }
    }

    return rv;
  }
}

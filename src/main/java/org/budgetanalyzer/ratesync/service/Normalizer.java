package org.budgetanalyzer.ratesync.service;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import org.budgetanalyzer.ratesync.exception.NormalizationException;
import org.budgetanalyzer.ratesync.service.dto.CanonicalSnapshot;
import org.budgetanalyzer.ratesync.service.dto.DailySnapshot;

/**
 * Re-expresses rates against a different base currency by triangulation.
 *
 * <p>Given a snapshot quoted against native base {@code X} and a reference currency {@code R}:
 *
 * <ul>
 *   <li>{@code R->Y = rate(X,Y) / rate(X,R)} for every target {@code Y}
 *   <li>{@code R->X = 1 / rate(X,R)}
 *   <li>{@code R->R = 1}
 * </ul>
 *
 * <p>Stateless and pure. Values are never rounded here.
 */
@Component
public class Normalizer {

  private static final Logger log = LoggerFactory.getLogger(Normalizer.class);

  /**
   * Converts a provider snapshot into canonical rows against the reference currency.
   *
   * @param snapshot provider snapshot quoted against its native base
   * @param referenceCurrency the reference currency
   * @return canonical snapshot for the same date and provider
   * @throws NormalizationException if the snapshot has no usable rate for the reference currency
   */
  public CanonicalSnapshot toCanonical(DailySnapshot snapshot, String referenceCurrency) {
    var nativeBase = snapshot.baseCurrency();
    var canonical = new LinkedHashMap<String, Double>();

    if (nativeBase.equals(referenceCurrency)) {
      putValidRates(snapshot, canonical, 1.0);
      canonical.put(referenceCurrency, 1.0);
      return new CanonicalSnapshot(
          snapshot.date(), snapshot.provider(), referenceCurrency, canonical, false);
    }

    var referenceRate = snapshot.rates().get(referenceCurrency);
    if (!isUsable(referenceRate)) {
      throw NormalizationException.referenceRateMissing(
          "Snapshot of "
              + snapshot.provider()
              + " for "
              + snapshot.date()
              + " has no usable "
              + nativeBase
              + "->"
              + referenceCurrency
              + " rate: "
              + referenceRate);
    }

    putValidRates(snapshot, canonical, referenceRate);
    canonical.put(nativeBase, 1.0 / referenceRate);
    canonical.put(referenceCurrency, 1.0);

    return new CanonicalSnapshot(
        snapshot.date(), snapshot.provider(), referenceCurrency, canonical, false);
  }

  /**
   * Re-bases a canonical mapping to the requested currency: {@code Q->Y = rate(R,Y) / rate(R,Q)}.
   *
   * @param referenceRates mapping of target code to {@code R->target} rate for one date
   * @param referenceCurrency the reference currency {@code R}
   * @param requestedBase the requested base {@code Q}
   * @return mapping of target code to {@code Q->target} rate, including {@code Q->Q = 1}
   * @throws NormalizationException if {@code Q} is absent from the mapping
   */
  public Map<String, Double> convertBase(
      Map<String, Double> referenceRates, String referenceCurrency, String requestedBase) {
    if (requestedBase.equals(referenceCurrency)) {
      var rebased = new LinkedHashMap<>(referenceRates);
      rebased.put(referenceCurrency, 1.0);
      return rebased;
    }

    var baseRate = referenceRates.get(requestedBase);
    if (!isUsable(baseRate)) {
      throw NormalizationException.baseCurrencyUnavailable(
          "Base currency " + requestedBase + " is not available for the requested date");
    }

    var rebased = new LinkedHashMap<String, Double>();
    referenceRates.forEach((code, rate) -> rebased.put(code, rate / baseRate));
    rebased.putIfAbsent(referenceCurrency, 1.0 / baseRate);
    rebased.put(requestedBase, 1.0);
    return rebased;
  }

  private void putValidRates(
      DailySnapshot snapshot, Map<String, Double> canonical, double referenceRate) {
    snapshot
        .rates()
        .forEach(
            (code, rate) -> {
              if (isUsable(rate)) {
                canonical.put(code, rate / referenceRate);
              } else {
                log.warn(
                    "Dropping invalid rate provider: {} date: {} currency: {} rate: {}",
                    snapshot.provider(),
                    snapshot.date(),
                    code,
                    rate);
              }
            });
  }

  private static boolean isUsable(Double rate) {
    return rate != null && Double.isFinite(rate) && rate > 0;
  }
}

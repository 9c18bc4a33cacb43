package org.budgetanalyzer.ratesync.api.response;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/** Rounds rates for presentation. Stored values are never rounded. */
final class RateRounding {

  private RateRounding() {}

  static double round(double value, int scale) {
    return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
  }

  static Map<String, Double> round(Map<String, Double> rates, int scale) {
    var rv = new LinkedHashMap<String, Double>();
    rates.forEach((code, rate) -> rv.put(code, round(rate, scale)));
    return rv;
  }
}

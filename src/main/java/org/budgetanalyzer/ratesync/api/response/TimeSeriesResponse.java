package org.budgetanalyzer.ratesync.api.response;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.ratesync.service.dto.TimeSeriesResult;

@Schema(description = "Exchange rates of every stored date in a range")
public record TimeSeriesResponse(
    @Schema(
            description = "Amount of the base currency the rates are multiplied by",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "1.0")
        double amount,
    @Schema(
            description = "ISO 4217 code of the base currency",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "USD")
        String base,
    @Schema(
            description = "First date of the requested range",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2025-11-01")
        LocalDate startDate,
    @Schema(
            description = "Last date of the requested range",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2025-11-30")
        LocalDate endDate,
    @Schema(
            description =
                "Rates by ISO date in ascending order. Dates without stored data are omitted",
            requiredMode = Schema.RequiredMode.REQUIRED)
        Map<String, Map<String, Double>> rates) {

  public static TimeSeriesResponse from(TimeSeriesResult result, int displayScale) {
    var rates = new LinkedHashMap<String, Map<String, Double>>();
    result
        .rates()
        .forEach(
            day -> rates.put(day.date().toString(), RateRounding.round(day.rates(), displayScale)));

    return new TimeSeriesResponse(
        result.amount(), result.base(), result.startDate(), result.endDate(), rates);
  }
}

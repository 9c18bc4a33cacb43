package org.budgetanalyzer.ratesync.api.response;

import java.time.LocalDate;
import java.util.Map;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.ratesync.service.dto.RatesResult;

@Schema(description = "Exchange rates of one date")
public record RatesResponse(
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
            description = "Date the rates apply to",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2025-11-27")
        LocalDate date,
    @Schema(
            description = "Units of each target currency per amount of base, sorted by code",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "{\"EUR\": 0.944644, \"JPY\": 149.357642}")
        Map<String, Double> rates) {

  public static RatesResponse from(RatesResult result, int displayScale) {
    return new RatesResponse(
        result.amount(),
        result.base(),
        result.date(),
        RateRounding.round(result.rates(), displayScale));
  }
}

package org.budgetanalyzer.ratesync.api.response;

import java.time.LocalDate;
import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.ratesync.service.dto.CurrencyInfo;

@Schema(description = "Currency known to the service")
public record CurrencyResponse(
    @Schema(
            description = "ISO 4217 currency code",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "EUR")
        String code,
    @Schema(
            description = "Display name",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "Euro")
        String name,
    @Schema(
            description = "Providers publishing the currency, in priority order",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "[\"ecb\"]")
        List<String> providers,
    @Schema(
            description = "Earliest date with stored rates",
            requiredMode = Schema.RequiredMode.NOT_REQUIRED,
            example = "1999-01-04")
        LocalDate startDate,
    @Schema(
            description = "Latest date with stored rates",
            requiredMode = Schema.RequiredMode.NOT_REQUIRED,
            example = "2025-11-27")
        LocalDate endDate) {

  public static CurrencyResponse from(CurrencyInfo currency) {
    return new CurrencyResponse(
        currency.code(),
        currency.name(),
        currency.providers(),
        currency.minDate(),
        currency.maxDate());
  }
}

package org.budgetanalyzer.ratesync.client.nbu.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of the NBU batch exchange endpoint: {@code units} of {@code cc} cost {@code rate} UAH.
 *
 * @param exchangeDate date in {@code dd.MM.yyyy} format
 * @param currencyCode ISO code, may be lower case
 * @param ratePerUnit UAH per one unit of the currency
 * @param englishName may be null for historical dates
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NbuBatchRate(
    @JsonProperty("exchangedate") String exchangeDate,
    @JsonProperty("r030") Integer numericCode,
    @JsonProperty("cc") String currencyCode,
    @JsonProperty("txt") String name,
    @JsonProperty("enname") String englishName,
    @JsonProperty("rate") Double rate,
    @JsonProperty("units") Integer units,
    @JsonProperty("rate_per_unit") Double ratePerUnit) {}

package org.budgetanalyzer.ratesync.service.dto;

import java.time.LocalDate;
import java.util.Map;

/** Mapping of currency code to rate for one date. */
public record DatedRates(LocalDate date, Map<String, Double> rates) {}

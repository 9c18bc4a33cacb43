package org.budgetanalyzer.ratesync.service.dto;

import java.time.LocalDate;
import java.util.Map;

/** Rates of one date re-based to {@code base} and scaled by {@code amount}. */
public record RatesResult(double amount, String base, LocalDate date, Map<String, Double> rates) {}

package org.budgetanalyzer.ratesync.service.dto;

import java.time.LocalDate;
import java.util.List;

/**
 * Rates of a date range re-based to {@code base} and scaled by {@code amount}.
 *
 * @param rates one entry per stored date in ascending order; dates without data are absent
 */
public record TimeSeriesResult(
    double amount, String base, LocalDate startDate, LocalDate endDate, List<DatedRates> rates) {}

package org.budgetanalyzer.ratesync.service.dto;

import java.time.LocalDate;
import java.util.List;

public record CurrencyInfo(
    String code, String name, List<String> providers, LocalDate minDate, LocalDate maxDate) {}

package org.budgetanalyzer.ratesync.api;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import org.budgetanalyzer.ratesync.base.AbstractControllerTest;
import org.budgetanalyzer.ratesync.fixture.CanonicalRateTestBuilder;
import org.budgetanalyzer.ratesync.fixture.TestConstants;
import org.budgetanalyzer.ratesync.service.Normalizer;
import org.budgetanalyzer.ratesync.service.RateStore;
import org.budgetanalyzer.ratesync.service.dto.DailySnapshot;

@DisplayName("RatesController Integration Tests")
class RatesControllerTest extends AbstractControllerTest {

  private static final double EPSILON = 1e-6;

  @Autowired private RateStore rateStore;

  @Autowired private Normalizer normalizer;

  @Test
  @DisplayName("GET /v1/rates/latest - when nothing synced - returns 404")
  void getLatest_WhenNothingSynced_Returns404() throws Exception {
    // Act & Assert
    performGet("/v1/rates/latest")
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.type").value("NOT_FOUND"))
        .andExpect(jsonPath("$.code").value("NO_RATE_DATA"));
  }

  @Test
  @DisplayName("GET /v1/rates/latest - when EUR snapshot synced - recovers published EUR rates")
  void getLatest_WhenEurSnapshotSynced_RecoversPublishedEurRates() throws Exception {
    // Arrange
    var published =
        new DailySnapshot(
            TestConstants.DATE_THURSDAY,
            TestConstants.PROVIDER_ECB,
            TestConstants.CURRENCY_EUR,
            Map.of(TestConstants.REFERENCE_CURRENCY, 1.158, TestConstants.CURRENCY_GBP, 0.872));
    rateStore.upsert(
        normalizer.toCanonical(published, TestConstants.REFERENCE_CURRENCY).toRates());

    // Act & Assert
    performGet("/v1/rates/latest?from=EUR")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.base").value("EUR"))
        .andExpect(jsonPath("$.date").value("2025-11-27"))
        .andExpect(jsonPath("$.rates.GBP").value(closeTo(0.872, EPSILON)))
        .andExpect(jsonPath("$.rates.USD").value(closeTo(1.158, EPSILON)));
  }

  @Nested
  @DisplayName("With stored rates")
  class WithStoredRates {

    @BeforeEach
    void seedRates() {
      rateStore.upsert(
          CanonicalRateTestBuilder.snapshot(
              TestConstants.PROVIDER_ECB,
              TestConstants.DATE_THURSDAY,
              Map.of(
                  TestConstants.CURRENCY_EUR, 0.8,
                  TestConstants.CURRENCY_JPY, 150.0,
                  TestConstants.CURRENCY_GBP, 0.75)));
      rateStore.upsert(
          CanonicalRateTestBuilder.snapshot(
              TestConstants.PROVIDER_ECB,
              TestConstants.DATE_FRIDAY,
              Map.of(
                  TestConstants.CURRENCY_EUR, 0.8,
                  TestConstants.CURRENCY_JPY, 160.0,
                  TestConstants.CURRENCY_GBP, 0.75)));
    }

    @Test
    @DisplayName("GET /v1/rates/latest - returns most recent date in reference currency")
    void getLatest_ReturnsMostRecentDateInReferenceCurrency() throws Exception {
      // Act & Assert
      performGet("/v1/rates/latest")
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.base").value("USD"))
          .andExpect(jsonPath("$.date").value("2025-11-28"))
          .andExpect(jsonPath("$.amount").value(1.0))
          .andExpect(jsonPath("$.rates.JPY").value(160.0))
          .andExpect(jsonPath("$.rates.USD").value(1.0));
    }

    @Test
    @DisplayName("GET /v1/rates/{date} - with base, symbols and amount - converts rates")
    void getForDate_WithBaseSymbolsAndAmount_ConvertsRates() throws Exception {
      // Act & Assert
      performGet("/v1/rates/2025-11-27?from=eur&to=USD,JPY&amount=100")
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.base").value("EUR"))
          .andExpect(jsonPath("$.amount").value(100.0))
          .andExpect(jsonPath("$.rates.USD").value(closeTo(125.0, EPSILON)))
          .andExpect(jsonPath("$.rates.JPY").value(closeTo(18750.0, EPSILON)))
          .andExpect(jsonPath("$.rates", not(hasKey("GBP"))));
    }

    @Test
    @DisplayName("GET /v1/rates/{date} - with compact date - returns rates")
    void getForDate_WithCompactDate_ReturnsRates() throws Exception {
      // Act & Assert
      performGet("/v1/rates/20251127")
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.date").value("2025-11-27"))
          .andExpect(jsonPath("$.rates.JPY").value(150.0));
    }

    @Test
    @DisplayName("GET /v1/rates/{date} - when date has no rows - returns 404")
    void getForDate_WhenDateHasNoRows_Returns404() throws Exception {
      // Act & Assert
      performGet("/v1/rates/2025-11-29")
          .andExpect(status().isNotFound())
          .andExpect(jsonPath("$.code").value("NO_RATE_DATA"));
    }

    @Test
    @DisplayName("GET /v1/rates/{date} - when date malformed - returns 400")
    void getForDate_WhenDateMalformed_Returns400() throws Exception {
      // Act & Assert
      performGet("/v1/rates/27-11-2025")
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.type").value("INVALID_REQUEST"));
    }

    @Test
    @DisplayName("GET /v1/rates/{date} - when base unavailable - returns 422")
    void getForDate_WhenBaseUnavailable_Returns422() throws Exception {
      // Act & Assert
      performGet("/v1/rates/2025-11-27?from=CHF")
          .andExpect(status().isUnprocessableEntity())
          .andExpect(jsonPath("$.code").value("BASE_CURRENCY_UNAVAILABLE"));
    }

    @Test
    @DisplayName("GET /v1/rates/{date} - when amount not a number - returns 400")
    void getForDate_WhenAmountNotANumber_Returns400() throws Exception {
      // Act & Assert
      performGet("/v1/rates/2025-11-27?amount=ten").andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET /v1/rates/{range} - returns stored dates in ascending order")
    void getForRange_ReturnsStoredDatesInAscendingOrder() throws Exception {
      // Act & Assert
      performGet("/v1/rates/2025-11-26..2025-11-30?to=JPY")
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.startDate").value("2025-11-26"))
          .andExpect(jsonPath("$.endDate").value("2025-11-30"))
          .andExpect(jsonPath("$.rates['2025-11-26']").doesNotExist())
          .andExpect(jsonPath("$.rates['2025-11-29']").doesNotExist())
          .andExpect(jsonPath("$.rates['2025-11-27'].JPY").value(150.0))
          .andExpect(jsonPath("$.rates['2025-11-28'].JPY").value(160.0));
    }

    @Test
    @DisplayName("GET /v1/rates/{range} - when start after end - returns 400")
    void getForRange_WhenStartAfterEnd_Returns400() throws Exception {
      // Act & Assert
      performGet("/v1/rates/2025-11-28..2025-11-27")
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    @Test
    @DisplayName("GET /v1/rates/{range} - when range has no rows - returns 404")
    void getForRange_WhenRangeHasNoRows_Returns404() throws Exception {
      // Act & Assert
      performGet("/v1/rates/2024-01-01..2024-01-31").andExpect(status().isNotFound());
    }
  }
}

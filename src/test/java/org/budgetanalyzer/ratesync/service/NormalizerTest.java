package org.budgetanalyzer.ratesync.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import org.budgetanalyzer.ratesync.exception.NormalizationException;
import org.budgetanalyzer.ratesync.exception.RateSyncError;
import org.budgetanalyzer.ratesync.fixture.SnapshotTestBuilder;
import org.budgetanalyzer.ratesync.fixture.TestConstants;
import org.budgetanalyzer.ratesync.service.dto.DailySnapshot;

@DisplayName("Normalizer Unit Tests")
class NormalizerTest {

  private final Normalizer normalizer = new Normalizer();

  // ===========================================================================================
  // toCanonical
  // ===========================================================================================

  @Test
  @DisplayName("toCanonical - when native base differs - triangulates through reference rate")
  void toCanonical_WhenNativeBaseDiffers_TriangulatesThroughReferenceRate() {
    // Arrange
    var snapshot = SnapshotTestBuilder.ecbSnapshot(TestConstants.DATE_THURSDAY);

    // Act
    var canonical = normalizer.toCanonical(snapshot, TestConstants.REFERENCE_CURRENCY);

    // Assert
    assertThat(canonical.baseCurrency()).isEqualTo("USD");
    assertThat(canonical.date()).isEqualTo(TestConstants.DATE_THURSDAY);
    assertThat(canonical.provider()).isEqualTo(TestConstants.PROVIDER_ECB);
    assertThat(canonical.carriedForward()).isFalse();
    assertThat(canonical.rates().get("USD")).isEqualTo(1.0);
    assertThat(canonical.rates().get("EUR"))
        .isCloseTo(1.0 / 1.0586, within(TestConstants.RATE_TOLERANCE));
    assertThat(canonical.rates().get("JPY"))
        .isCloseTo(158.11 / 1.0586, within(TestConstants.RATE_TOLERANCE));
    assertThat(canonical.rates().get("GBP"))
        .isCloseTo(0.8345 / 1.0586, within(TestConstants.RATE_TOLERANCE));
  }

  @Test
  @DisplayName("toCanonical - when native base is reference - keeps rates and adds identity")
  void toCanonical_WhenNativeBaseIsReference_KeepsRatesAndAddsIdentity() {
    // Arrange
    var snapshot =
        new DailySnapshot(
            TestConstants.DATE_THURSDAY, "test", "USD", Map.of("EUR", 0.9, "JPY", 150.0));

    // Act
    var canonical = normalizer.toCanonical(snapshot, "USD");

    // Assert
    assertThat(canonical.rates()).containsEntry("EUR", 0.9).containsEntry("JPY", 150.0);
    assertThat(canonical.rates()).containsEntry("USD", 1.0);
  }

  @Test
  @DisplayName("toCanonical - when reference rate missing - throws reference rate missing")
  void toCanonical_WhenReferenceRateMissing_ThrowsReferenceRateMissing() {
    // Arrange
    var snapshot =
        SnapshotTestBuilder.ecbSnapshot(
            TestConstants.DATE_THURSDAY, Map.of("JPY", TestConstants.ECB_EUR_JPY));

    // Act & Assert
    assertThatThrownBy(() -> normalizer.toCanonical(snapshot, TestConstants.REFERENCE_CURRENCY))
        .isInstanceOf(NormalizationException.class)
        .hasMessageContaining("EUR->USD")
        .extracting(e -> ((NormalizationException) e).getError())
        .isEqualTo(RateSyncError.REFERENCE_RATE_MISSING);
  }

  @Test
  @DisplayName("toCanonical - when reference rate is zero - throws")
  void toCanonical_WhenReferenceRateIsZero_Throws() {
    // Arrange
    var snapshot =
        SnapshotTestBuilder.ecbSnapshot(TestConstants.DATE_THURSDAY, Map.of("USD", 0.0));

    // Act & Assert
    assertThatThrownBy(() -> normalizer.toCanonical(snapshot, TestConstants.REFERENCE_CURRENCY))
        .isInstanceOf(NormalizationException.class);
  }

  @Test
  @DisplayName("toCanonical - when target rate invalid - drops only that currency")
  void toCanonical_WhenTargetRateInvalid_DropsOnlyThatCurrency() {
    // Arrange
    var rates = new LinkedHashMap<String, Double>();
    rates.put("USD", TestConstants.ECB_EUR_USD);
    rates.put("JPY", -1.0);
    rates.put("GBP", Double.NaN);
    rates.put("CHF", 0.9384);
    var snapshot = SnapshotTestBuilder.ecbSnapshot(TestConstants.DATE_THURSDAY, rates);

    // Act
    var canonical = normalizer.toCanonical(snapshot, TestConstants.REFERENCE_CURRENCY);

    // Assert
    assertThat(canonical.rates()).containsOnlyKeys("USD", "EUR", "CHF");
  }

  @Test
  @DisplayName("toCanonical - when EUR snapshot re-based to EUR - recovers published rates")
  void toCanonical_WhenEurSnapshotRebasedToEur_RecoversPublishedRates() {
    // Arrange
    var snapshot =
        new DailySnapshot(
            TestConstants.DATE_THURSDAY, "ecb", "EUR", Map.of("USD", 1.158, "GBP", 0.872));

    // Act
    var canonical = normalizer.toCanonical(snapshot, "USD");
    var rebased = normalizer.convertBase(canonical.rates(), "USD", "EUR");

    // Assert
    assertThat(canonical.rates()).containsOnlyKeys("USD", "EUR", "GBP");
    assertThat(canonical.rates().get("USD")).isEqualTo(1.0);
    assertThat(canonical.rates().get("EUR")).isCloseTo(0.8636, within(1e-4));
    assertThat(canonical.rates().get("GBP")).isCloseTo(0.7530, within(1e-4));
    assertThat(rebased.get("GBP")).isCloseTo(0.872, within(TestConstants.RATE_TOLERANCE));
    assertThat(rebased.get("USD")).isCloseTo(1.158, within(TestConstants.RATE_TOLERANCE));
    assertThat(rebased.get("EUR")).isEqualTo(1.0);
  }

  // ===========================================================================================
  // convertBase
  // ===========================================================================================

  @Test
  @DisplayName("convertBase - when requested base is reference - returns rates with identity")
  void convertBase_WhenRequestedBaseIsReference_ReturnsRatesWithIdentity() {
    // Arrange
    var referenceRates = Map.of("EUR", 0.9446, "JPY", 149.36);

    // Act
    var rebased = normalizer.convertBase(referenceRates, "USD", "USD");

    // Assert
    assertThat(rebased)
        .containsEntry("EUR", 0.9446)
        .containsEntry("JPY", 149.36)
        .containsEntry("USD", 1.0);
  }

  @Test
  @DisplayName("convertBase - when requested base differs - divides by base rate")
  void convertBase_WhenRequestedBaseDiffers_DividesByBaseRate() {
    // Arrange
    var referenceRates = Map.of("USD", 1.0, "EUR", 0.8, "JPY", 160.0);

    // Act
    var rebased = normalizer.convertBase(referenceRates, "USD", "EUR");

    // Assert
    assertThat(rebased.get("EUR")).isEqualTo(1.0);
    assertThat(rebased.get("USD")).isCloseTo(1.25, within(TestConstants.RATE_TOLERANCE));
    assertThat(rebased.get("JPY")).isCloseTo(200.0, within(TestConstants.RATE_TOLERANCE));
  }

  @Test
  @DisplayName("convertBase - when reference row absent - still adds reference currency")
  void convertBase_WhenReferenceRowAbsent_StillAddsReferenceCurrency() {
    // Arrange
    var referenceRates = Map.of("EUR", 0.8);

    // Act
    var rebased = normalizer.convertBase(referenceRates, "USD", "EUR");

    // Assert
    assertThat(rebased.get("USD")).isCloseTo(1.25, within(TestConstants.RATE_TOLERANCE));
  }

  @Test
  @DisplayName("convertBase - when base absent - throws base currency unavailable")
  void convertBase_WhenBaseAbsent_ThrowsBaseCurrencyUnavailable() {
    // Arrange
    var referenceRates = Map.of("USD", 1.0, "EUR", 0.8);

    // Act & Assert
    assertThatThrownBy(() -> normalizer.convertBase(referenceRates, "USD", "XYZ"))
        .isInstanceOf(NormalizationException.class)
        .extracting(e -> ((NormalizationException) e).getError())
        .isEqualTo(RateSyncError.BASE_CURRENCY_UNAVAILABLE);
  }

  @Test
  @DisplayName("convertBase - when round tripped through another base - preserves cross rates")
  void convertBase_WhenRoundTrippedThroughAnotherBase_PreservesCrossRates() {
    // Arrange
    var canonical =
        normalizer.toCanonical(
            SnapshotTestBuilder.ecbSnapshot(TestConstants.DATE_THURSDAY),
            TestConstants.REFERENCE_CURRENCY);

    // Act
    var eurBased = normalizer.convertBase(canonical.rates(), "USD", "EUR");

    // Assert
    assertThat(eurBased.get("USD"))
        .isCloseTo(TestConstants.ECB_EUR_USD, within(TestConstants.RATE_TOLERANCE));
    assertThat(eurBased.get("JPY"))
        .isCloseTo(TestConstants.ECB_EUR_JPY, within(TestConstants.RATE_TOLERANCE));
  }
}

package org.budgetanalyzer.ratesync.repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import org.budgetanalyzer.ratesync.domain.CanonicalRate;

public interface CanonicalRateRepository
    extends JpaRepository<CanonicalRate, Long>, JpaSpecificationExecutor<CanonicalRate> {

  List<CanonicalRate> findByProviderAndBaseCurrencyAndDateBetween(
      String provider, String baseCurrency, LocalDate startDate, LocalDate endDate);

  List<CanonicalRate> findByProviderAndBaseCurrencyAndDate(
      String provider, String baseCurrency, LocalDate date);

  List<CanonicalRate> findByBaseCurrencyAndDate(String baseCurrency, LocalDate date);

  long countByProvider(String provider);

  /**
   * Finds the most recent date with stored rates across all providers.
   *
   * @param baseCurrency the reference currency rows are expressed against
   * @return Optional containing the latest date, or empty if nothing is stored
   */
  @Query("SELECT MAX(r.date) FROM CanonicalRate r WHERE r.baseCurrency = :baseCurrency")
  Optional<LocalDate> findLatestDate(@Param("baseCurrency") String baseCurrency);

  /**
   * Finds the most recent date a provider actually published, ignoring carried-forward rows.
   *
   * @param provider the provider id
   * @param baseCurrency the reference currency rows are expressed against
   * @return Optional containing the last published date, or empty if the provider has none
   */
  @Query(
      "SELECT MAX(r.date) FROM CanonicalRate r"
          + " WHERE r.provider = :provider AND r.baseCurrency = :baseCurrency"
          + " AND r.carriedForward = false")
  Optional<LocalDate> findLastPublishedDate(
      @Param("provider") String provider, @Param("baseCurrency") String baseCurrency);

  /**
   * Observed date range per target currency.
   *
   * @param baseCurrency the reference currency rows are expressed against
   * @return one entry per target currency
   */
  @Query(
      "SELECT r.targetCurrency AS code, MIN(r.date) AS minDate, MAX(r.date) AS maxDate"
          + " FROM CanonicalRate r WHERE r.baseCurrency = :baseCurrency"
          + " GROUP BY r.targetCurrency")
  List<CurrencyDateRange> findDateRangesByTargetCurrency(
      @Param("baseCurrency") String baseCurrency);

  /** Projection of the observed date range of one target currency. */
  interface CurrencyDateRange {
    String getCode();

    LocalDate getMinDate();

    LocalDate getMaxDate();
  }
}

package org.budgetanalyzer.ratesync.domain;

import java.time.LocalDate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Exchange rate expressed against the reference currency, as published (or carried forward) by one
 * provider for one date.
 *
 * <p>{@code (date, baseCurrency, targetCurrency, provider)} is the idempotency key: re-ingesting a
 * provider's date updates rows in place instead of adding new ones.
 *
 * <p>{@code carriedForward} marks rows synthesized by the gap filler for days the provider did not
 * publish. A later publication for that day overwrites the row and clears the flag.
 */
@Entity
@Table(
    name = "exchange_rate",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_exchange_rate_key",
            columnNames = {"date", "base_currency", "target_currency", "provider"}))
public class CanonicalRate extends AuditableEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @Column(nullable = false)
  private LocalDate date;

  @NotNull
  @Column(name = "base_currency", nullable = false, length = 3)
  private String baseCurrency;

  @NotNull
  @Column(name = "target_currency", nullable = false, length = 3)
  private String targetCurrency;

  @Positive
  @Column(nullable = false)
  private double rate;

  @NotNull
  @Column(nullable = false, length = 32)
  private String provider;

  @Column(name = "carried_forward", nullable = false)
  private boolean carriedForward;

  public CanonicalRate() {}

  public CanonicalRate(
      LocalDate date,
      String baseCurrency,
      String targetCurrency,
      double rate,
      String provider,
      boolean carriedForward) {
    this.date = date;
    this.baseCurrency = baseCurrency;
    this.targetCurrency = targetCurrency;
    this.rate = rate;
    this.provider = provider;
    this.carriedForward = carriedForward;
  }

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public LocalDate getDate() {
    return date;
  }

  public void setDate(LocalDate date) {
    this.date = date;
  }

  public String getBaseCurrency() {
    return baseCurrency;
  }

  public void setBaseCurrency(String baseCurrency) {
    this.baseCurrency = baseCurrency;
  }

  public String getTargetCurrency() {
    return targetCurrency;
  }

  public void setTargetCurrency(String targetCurrency) {
    this.targetCurrency = targetCurrency;
  }

  public double getRate() {
    return rate;
  }

  public void setRate(double rate) {
    this.rate = rate;
  }

  public String getProvider() {
    return provider;
  }

  public void setProvider(String provider) {
    this.provider = provider;
  }

  public boolean isCarriedForward() {
    return carriedForward;
  }

  public void setCarriedForward(boolean carriedForward) {
    this.carriedForward = carriedForward;
  }

  /**
   * Key identifying this row for upserts.
   *
   * @return idempotency key of this rate
   */
  public Key key() {
    return new Key(date, baseCurrency, targetCurrency, provider);
  }

  /** Idempotency key of a canonical rate. */
  public record Key(LocalDate date, String baseCurrency, String targetCurrency, String provider) {}
}

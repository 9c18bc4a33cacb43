package org.budgetanalyzer.ratesync.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.validation.constraints.NotNull;

/**
 * Display metadata of a currency as announced by one provider.
 *
 * <p>A code served by several providers has one row per provider. Rate rows are identified by code
 * alone and never reference this table.
 */
@Entity
@Table(
    name = "currency",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_currency_code_provider",
            columnNames = {"code", "provider"}))
public class CurrencyMetadata extends AuditableEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  /** ISO 4217 style three-letter code. */
  @NotNull
  @Column(nullable = false, length = 3)
  private String code;

  @NotNull
  @Column(nullable = false, length = 100)
  private String name;

  @NotNull
  @Column(nullable = false, length = 32)
  private String provider;

  public CurrencyMetadata() {}

  public CurrencyMetadata(String code, String name, String provider) {
    this.code = code;
    this.name = name;
    this.provider = provider;
  }

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public String getCode() {
    return code;
  }

  public void setCode(String code) {
    this.code = code;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getProvider() {
    return provider;
  }

  public void setProvider(String provider) {
    this.provider = provider;
  }
}

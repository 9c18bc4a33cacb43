package org.budgetanalyzer.ratesync.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import org.budgetanalyzer.ratesync.domain.CurrencyMetadata;

public interface CurrencyMetadataRepository extends JpaRepository<CurrencyMetadata, Long> {

  List<CurrencyMetadata> findByProvider(String provider);

  long countByProvider(String provider);
}

package org.budgetanalyzer.ratesync.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import org.budgetanalyzer.ratesync.domain.SyncRun;
import org.budgetanalyzer.ratesync.domain.SyncStatus;

public interface SyncRunRepository extends JpaRepository<SyncRun, Long> {

  Optional<SyncRun> findTopByProviderAndStatusInOrderByStartedAtDesc(
      String provider, Collection<SyncStatus> statuses);

  List<SyncRun> findByProviderOrderByStartedAtDesc(String provider, Pageable pageable);

  List<SyncRun> findAllByOrderByStartedAtDesc(Pageable pageable);
}

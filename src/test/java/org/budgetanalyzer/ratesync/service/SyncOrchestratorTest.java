package org.budgetanalyzer.ratesync.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.ResourceLoader;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import org.budgetanalyzer.ratesync.config.RateSyncProperties;
import org.budgetanalyzer.ratesync.domain.CanonicalRate;
import org.budgetanalyzer.ratesync.domain.SyncRun;
import org.budgetanalyzer.ratesync.domain.SyncStatus;
import org.budgetanalyzer.ratesync.domain.SyncTrigger;
import org.budgetanalyzer.ratesync.exception.FetchException;
import org.budgetanalyzer.ratesync.exception.LockContentionException;
import org.budgetanalyzer.ratesync.exception.NotFoundException;
import org.budgetanalyzer.ratesync.fixture.SnapshotTestBuilder;
import org.budgetanalyzer.ratesync.fixture.TestConstants;
import org.budgetanalyzer.ratesync.service.dto.FetchResult;
import org.budgetanalyzer.ratesync.service.dto.SyncResult;
import org.budgetanalyzer.ratesync.service.dto.UpsertResult;
import org.budgetanalyzer.ratesync.service.provider.RateSource;
import org.budgetanalyzer.ratesync.service.provider.RateSourceRegistry;

/**
 * Unit tests for {@link SyncOrchestrator}.
 *
 * <p>Runs the real {@link Normalizer} and {@link GapFiller} against mocked sources and store. The
 * clock is fixed to Monday 2025-12-01.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("SyncOrchestrator Unit Tests")
class SyncOrchestratorTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2025-12-01T17:00:00Z"), ZoneOffset.UTC);

  // ===========================================================================================
  // Test Dependencies
  // ===========================================================================================

  @Mock private RateSourceRegistry rateSourceRegistry;

  @Mock private RateStore rateStore;

  @Mock private ResourceLoader resourceLoader;

  @Mock private RateSource ecbSource;

  @Mock private RateSource nbuSource;

  private MeterRegistry meterRegistry;

  private RateSyncProperties properties;

  private SyncOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    properties = new RateSyncProperties();

    orchestrator =
        new SyncOrchestrator(
            rateSourceRegistry,
            new Normalizer(),
            new GapFiller(),
            rateStore,
            properties,
            resourceLoader,
            meterRegistry,
            CLOCK);
  }

  // ===========================================================================================
  // syncProvider - Fetch Window
  // ===========================================================================================

  @Test
  @DisplayName("syncProvider - when first run - fetches full history and fills up to today")
  void syncProvider_WhenFirstRun_FetchesFullHistoryAndFillsUpToToday() {
    // Arrange
    givenEcbRegistered();
    when(rateStore.lastPublishedDate(TestConstants.PROVIDER_ECB)).thenReturn(Optional.empty());
    when(ecbSource.fetchFullHistory())
        .thenReturn(
            FetchResult.of(
                List.of(
                    SnapshotTestBuilder.ecbSnapshot(TestConstants.DATE_THURSDAY),
                    SnapshotTestBuilder.ecbSnapshot(TestConstants.DATE_FRIDAY))));
    var written = captureUpserts();

    // Act
    var result = orchestrator.syncProvider(TestConstants.PROVIDER_ECB, SyncTrigger.MANUAL);

    // Assert
    assertThat(result.outcome()).isEqualTo(SyncResult.Outcome.SUCCESS);
    assertThat(result.snapshotDays()).isEqualTo(5);
    assertThat(result.rowsWritten()).isEqualTo(20);
    assertThat(result.windowStart()).isEqualTo(TestConstants.DATE_THURSDAY);
    assertThat(result.windowEnd()).isEqualTo(TestConstants.DATE_MONDAY);
    verify(ecbSource, never()).fetchRange(any(), any());

    var monday =
        written.stream()
            .filter(row -> row.getDate().equals(TestConstants.DATE_MONDAY))
            .toList();
    assertThat(monday).hasSize(4).allMatch(CanonicalRate::isCarriedForward);
    assertThat(written).allMatch(row -> row.getBaseCurrency().equals("USD"));
  }

  @Test
  @DisplayName("syncProvider - when data stored - fetches from last published date")
  void syncProvider_WhenDataStored_FetchesFromLastPublishedDate() {
    // Arrange
    givenEcbRegistered();
    when(rateStore.lastPublishedDate(TestConstants.PROVIDER_ECB))
        .thenReturn(Optional.of(TestConstants.DATE_FRIDAY));
    when(rateStore.snapshotAt(TestConstants.PROVIDER_ECB, TestConstants.DATE_FRIDAY))
        .thenReturn(
            Optional.of(
                SnapshotTestBuilder.canonical(
                    TestConstants.DATE_FRIDAY, Map.of("USD", 1.0, "EUR", 0.95))));
    when(ecbSource.fetchRange(TestConstants.DATE_FRIDAY, TestConstants.DATE_MONDAY))
        .thenReturn(
            FetchResult.of(List.of(SnapshotTestBuilder.ecbSnapshot(TestConstants.DATE_MONDAY))));
    var written = captureUpserts();

    // Act
    var result = orchestrator.syncProvider(TestConstants.PROVIDER_ECB, SyncTrigger.MANUAL);

    // Assert
    assertThat(result.outcome()).isEqualTo(SyncResult.Outcome.SUCCESS);
    assertThat(result.snapshotDays()).isEqualTo(3);
    assertThat(result.windowStart()).isEqualTo(TestConstants.DATE_FRIDAY);
    assertThat(written).noneMatch(row -> row.getDate().equals(TestConstants.DATE_FRIDAY));

    var saturdayEur =
        written.stream()
            .filter(row -> row.getDate().equals(TestConstants.DATE_SATURDAY))
            .filter(row -> row.getTargetCurrency().equals("EUR"))
            .findFirst()
            .orElseThrow();
    assertThat(saturdayEur.getRate()).isEqualTo(0.95);
    assertThat(saturdayEur.isCarriedForward()).isTrue();
    verify(ecbSource, never()).fetchFullHistory();
  }

  @Test
  @DisplayName("syncProvider - when up to date - writes nothing and succeeds")
  void syncProvider_WhenUpToDate_WritesNothingAndSucceeds() {
    // Arrange
    givenEcbRegistered();
    when(rateStore.lastPublishedDate(TestConstants.PROVIDER_ECB))
        .thenReturn(Optional.of(TestConstants.DATE_MONDAY));

    // Act
    var result = orchestrator.syncProvider(TestConstants.PROVIDER_ECB, SyncTrigger.SCHEDULED);

    // Assert
    assertThat(result.outcome()).isEqualTo(SyncResult.Outcome.SUCCESS);
    assertThat(result.snapshotDays()).isZero();
    verify(ecbSource, never()).fetchRange(any(), any());
    verify(rateStore, never()).upsert(anyList());
    verify(rateStore).upsertCurrencies(TestConstants.PROVIDER_ECB, List.of());
  }

  @Test
  @DisplayName("syncProvider - when upsert batch smaller than window - writes in chunks")
  void syncProvider_WhenUpsertBatchSmallerThanWindow_WritesInChunks() {
    // Arrange
    properties.getSync().setUpsertBatchDays(2);
    givenEcbRegistered();
    when(rateStore.lastPublishedDate(TestConstants.PROVIDER_ECB)).thenReturn(Optional.empty());
    when(ecbSource.fetchFullHistory())
        .thenReturn(
            FetchResult.of(List.of(SnapshotTestBuilder.ecbSnapshot(TestConstants.DATE_THURSDAY))));
    captureUpserts();

    // Act
    var result = orchestrator.syncProvider(TestConstants.PROVIDER_ECB, SyncTrigger.MANUAL);

    // Assert
    assertThat(result.snapshotDays()).isEqualTo(5);
    verify(rateStore, times(3)).upsert(anyList());
  }

  // ===========================================================================================
  // syncProvider - Outcomes
  // ===========================================================================================

  @Test
  @DisplayName("syncProvider - when a snapshot lacks reference rate - reports partial")
  void syncProvider_WhenSnapshotLacksReferenceRate_ReportsPartial() {
    // Arrange
    givenEcbRegistered();
    when(rateStore.lastPublishedDate(TestConstants.PROVIDER_ECB)).thenReturn(Optional.empty());
    when(ecbSource.fetchFullHistory())
        .thenReturn(
            FetchResult.of(
                List.of(
                    SnapshotTestBuilder.ecbSnapshot(TestConstants.DATE_THURSDAY),
                    SnapshotTestBuilder.ecbSnapshot(
                        TestConstants.DATE_FRIDAY, Map.of("JPY", 158.0)))));
    var written = captureUpserts();

    // Act
    var result = orchestrator.syncProvider(TestConstants.PROVIDER_ECB, SyncTrigger.MANUAL);

    // Assert
    assertThat(result.outcome()).isEqualTo(SyncResult.Outcome.PARTIAL);
    assertThat(result.message()).contains("2025-11-28");
    assertThat(written)
        .filteredOn(row -> row.getDate().equals(TestConstants.DATE_FRIDAY))
        .allMatch(CanonicalRate::isCarriedForward);
  }

  @Test
  @DisplayName("syncProvider - when fetch fails - records failed run and counts it")
  void syncProvider_WhenFetchFails_RecordsFailedRunAndCountsIt() {
    // Arrange
    givenEcbRegistered();
    when(rateStore.lastPublishedDate(TestConstants.PROVIDER_ECB)).thenReturn(Optional.empty());
    when(ecbSource.fetchFullHistory()).thenThrow(new FetchException("ECB unavailable"));

    // Act
    var result = orchestrator.syncProvider(TestConstants.PROVIDER_ECB, SyncTrigger.MANUAL);

    // Assert
    assertThat(result.isFailed()).isTrue();
    assertThat(result.message()).isEqualTo("FetchException: ECB unavailable");
    verify(rateStore, never()).upsert(anyList());

    var runCaptor = ArgumentCaptor.forClass(SyncRun.class);
    verify(rateStore).recordRun(runCaptor.capture());
    assertThat(runCaptor.getValue().getStatus()).isEqualTo(SyncStatus.FAILED);
    assertThat(runCaptor.getValue().getTrigger()).isEqualTo(SyncTrigger.MANUAL);

    var counter =
        meterRegistry
            .find("rate.sync.runs")
            .tag("provider", TestConstants.PROVIDER_ECB)
            .tag("status", "failed")
            .counter();
    assertThat(counter).isNotNull();
    assertThat(counter.count()).isEqualTo(1);
  }

  @Test
  @DisplayName("syncProvider - when provider unknown - throws not found")
  void syncProvider_WhenProviderUnknown_ThrowsNotFound() {
    // Arrange
    when(rateSourceRegistry.get("boc")).thenThrow(NotFoundException.unknownProvider("boc"));

    // Act & Assert
    assertThatThrownBy(() -> orchestrator.syncProvider("boc", SyncTrigger.MANUAL))
        .isInstanceOf(NotFoundException.class);
    verifyNoInteractions(rateStore);
  }

  @Test
  @DisplayName("syncProvider - when same provider already syncing - rejects second request")
  void syncProvider_WhenSameProviderAlreadySyncing_RejectsSecondRequest() {
    // Arrange
    givenEcbRegistered();
    when(rateStore.lastPublishedDate(TestConstants.PROVIDER_ECB)).thenReturn(Optional.empty());

    var concurrentFailure = new AtomicReference<Throwable>();
    when(ecbSource.fetchFullHistory())
        .thenAnswer(
            invocation -> {
              var concurrent =
                  CompletableFuture.runAsync(
                      () ->
                          orchestrator.syncProvider(
                              TestConstants.PROVIDER_ECB, SyncTrigger.MANUAL));
              try {
                concurrent.join();
              } catch (CompletionException e) {
                concurrentFailure.set(e.getCause());
              }
              return FetchResult.of(List.of());
            });

    // Act
    var result = orchestrator.syncProvider(TestConstants.PROVIDER_ECB, SyncTrigger.MANUAL);

    // Assert
    assertThat(result.outcome()).isEqualTo(SyncResult.Outcome.SUCCESS);
    assertThat(concurrentFailure.get()).isInstanceOf(LockContentionException.class);
    verify(ecbSource, times(1)).fetchFullHistory();
  }

  @Test
  @DisplayName("syncProvider - when nested on the syncing thread - rejects inner request")
  void syncProvider_WhenNestedOnTheSyncingThread_RejectsInnerRequest() {
    // Arrange
    givenEcbRegistered();
    when(rateStore.lastPublishedDate(TestConstants.PROVIDER_ECB)).thenReturn(Optional.empty());

    var nestedFailure = new AtomicReference<Throwable>();
    when(ecbSource.fetchFullHistory())
        .thenAnswer(
            invocation -> {
              try {
                orchestrator.syncProvider(TestConstants.PROVIDER_ECB, SyncTrigger.MANUAL);
              } catch (LockContentionException e) {
                nestedFailure.set(e);
              }
              return FetchResult.of(List.of());
            });

    // Act
    var result = orchestrator.syncProvider(TestConstants.PROVIDER_ECB, SyncTrigger.MANUAL);

    // Assert
    assertThat(result.outcome()).isEqualTo(SyncResult.Outcome.SUCCESS);
    assertThat(nestedFailure.get()).isInstanceOf(LockContentionException.class);
    verify(ecbSource, times(1)).fetchFullHistory();
  }

  // ===========================================================================================
  // syncAll
  // ===========================================================================================

  @Test
  @DisplayName("syncAll - when one provider fails - still syncs the others")
  void syncAll_WhenOneProviderFails_StillSyncsTheOthers() {
    // Arrange
    givenEcbRegistered();
    when(nbuSource.id()).thenReturn(TestConstants.PROVIDER_NBU);
    when(rateSourceRegistry.get(TestConstants.PROVIDER_NBU)).thenReturn(nbuSource);
    when(rateSourceRegistry.enabled()).thenReturn(List.of(ecbSource, nbuSource));

    when(rateStore.lastPublishedDate(anyString())).thenReturn(Optional.empty());
    when(ecbSource.fetchFullHistory()).thenThrow(new FetchException("ECB unavailable"));
    when(nbuSource.fetchFullHistory()).thenReturn(FetchResult.of(List.of()));

    // Act
    var results = orchestrator.syncAll(SyncTrigger.SCHEDULED);

    // Assert
    assertThat(results).hasSize(2);
    assertThat(results.get(0).provider()).isEqualTo(TestConstants.PROVIDER_ECB);
    assertThat(results.get(0).isFailed()).isTrue();
    assertThat(results.get(1).provider()).isEqualTo(TestConstants.PROVIDER_NBU);
    assertThat(results.get(1).outcome()).isEqualTo(SyncResult.Outcome.SUCCESS);
    verify(rateStore, times(2)).recordRun(any(SyncRun.class));
  }

  // ===========================================================================================
  // bootstrapIfEmpty
  // ===========================================================================================

  @Test
  @DisplayName("bootstrapIfEmpty - when store has data - does nothing")
  void bootstrapIfEmpty_WhenStoreHasData_DoesNothing() {
    // Arrange
    when(rateStore.isEmpty()).thenReturn(false);

    // Act
    var results = orchestrator.bootstrapIfEmpty();

    // Assert
    assertThat(results).isEmpty();
    verifyNoInteractions(rateSourceRegistry, resourceLoader);
  }

  @Test
  @DisplayName("bootstrapIfEmpty - when bundle present - loads it and fills to its last date")
  void bootstrapIfEmpty_WhenBundlePresent_LoadsItAndFillsToItsLastDate() {
    // Arrange
    var location = "classpath:seed/ecb-hist.xml";
    properties.getBootstrap().getBundles().put(TestConstants.PROVIDER_ECB, location);

    when(rateStore.isEmpty()).thenReturn(true);
    when(ecbSource.id()).thenReturn(TestConstants.PROVIDER_ECB);
    when(rateSourceRegistry.enabled()).thenReturn(List.of(ecbSource));
    when(resourceLoader.getResource(location))
        .thenReturn(new ByteArrayResource("<bundle/>".getBytes(StandardCharsets.UTF_8)));
    when(ecbSource.readBundle(any()))
        .thenReturn(
            FetchResult.of(
                List.of(
                    SnapshotTestBuilder.ecbSnapshot(TestConstants.DATE_THURSDAY),
                    SnapshotTestBuilder.ecbSnapshot(TestConstants.DATE_FRIDAY))));
    captureUpserts();

    // Act
    var results = orchestrator.bootstrapIfEmpty();

    // Assert
    assertThat(results).hasSize(1);
    assertThat(results.get(0).trigger()).isEqualTo(SyncTrigger.BOOTSTRAP);
    assertThat(results.get(0).snapshotDays()).isEqualTo(2);
    assertThat(results.get(0).windowEnd()).isEqualTo(TestConstants.DATE_FRIDAY);
    verify(ecbSource, never()).fetchFullHistory();
  }

  @Test
  @DisplayName("bootstrapIfEmpty - when bundle missing - skips provider")
  void bootstrapIfEmpty_WhenBundleMissing_SkipsProvider() {
    // Arrange
    var location = "classpath:seed/missing.xml";
    properties.getBootstrap().getBundles().put(TestConstants.PROVIDER_ECB, location);

    when(rateStore.isEmpty()).thenReturn(true);
    when(ecbSource.id()).thenReturn(TestConstants.PROVIDER_ECB);
    when(rateSourceRegistry.enabled()).thenReturn(List.of(ecbSource));
    when(resourceLoader.getResource(location))
        .thenReturn(new ClassPathResource("seed/missing.xml"));

    // Act
    var results = orchestrator.bootstrapIfEmpty();

    // Assert
    assertThat(results).isEmpty();
    verify(ecbSource, never()).readBundle(any());
    verify(rateStore, never()).recordRun(any());
  }

  // ===========================================================================================
  // Helpers
  // ===========================================================================================

  private void givenEcbRegistered() {
    when(ecbSource.id()).thenReturn(TestConstants.PROVIDER_ECB);
    when(rateSourceRegistry.get(TestConstants.PROVIDER_ECB)).thenReturn(ecbSource);
  }

  /** Collects every row passed to the store and reports each as a new key. */
  private List<CanonicalRate> captureUpserts() {
    var written = new ArrayList<CanonicalRate>();
    when(rateStore.upsert(anyList()))
        .thenAnswer(
            invocation -> {
              List<CanonicalRate> rows = invocation.getArgument(0);
              written.addAll(rows);
              return new UpsertResult(rows.size(), 0, 0);
            });
    return written;
  }
}

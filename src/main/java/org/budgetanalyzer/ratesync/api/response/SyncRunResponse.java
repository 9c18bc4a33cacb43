package org.budgetanalyzer.ratesync.api.response;

import java.time.Instant;
import java.time.LocalDate;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.ratesync.domain.SyncRun;

@Schema(description = "Recorded sync run")
public record SyncRunResponse(
    @Schema(description = "Run id", requiredMode = Schema.RequiredMode.REQUIRED, example = "42")
        Long id,
    @Schema(
            description = "Provider id",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "nbu")
        String provider,
    @Schema(
            description = "What started the run",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "SCHEDULED")
        String trigger,
    @Schema(
            description = "SUCCESS, PARTIAL or FAILED",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "PARTIAL")
        String status,
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, example = "3") int snapshotDays,
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, example = "27") int rowsWritten,
    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED, example = "2025-11-25")
        LocalDate windowStart,
    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED, example = "2025-11-27")
        LocalDate windowEnd,
    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED) String message,
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, example = "2025-11-27T16:00:00Z")
        Instant startedAt,
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, example = "2025-11-27T16:00:12Z")
        Instant finishedAt) {

  public static SyncRunResponse from(SyncRun run) {
    return new SyncRunResponse(
        run.getId(),
        run.getProvider(),
        run.getTrigger().name(),
        run.getStatus().name(),
        run.getSnapshotDays(),
        run.getRowsWritten(),
        run.getWindowStart(),
        run.getWindowEnd(),
        run.getMessage(),
        run.getStartedAt(),
        run.getFinishedAt());
  }
}

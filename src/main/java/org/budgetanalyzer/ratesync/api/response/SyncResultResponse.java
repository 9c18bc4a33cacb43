package org.budgetanalyzer.ratesync.api.response;

import java.time.Instant;
import java.time.LocalDate;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.ratesync.service.dto.SyncResult;

@Schema(description = "Outcome of a provider sync")
public record SyncResultResponse(
    @Schema(
            description = "Provider id",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "ecb")
        String provider,
    @Schema(
            description = "Outcome: SUCCESS, PARTIAL, FAILED or ALREADY_RUNNING",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "SUCCESS")
        String status,
    @Schema(
            description = "Number of snapshot days written, carried-forward days included",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "3")
        int snapshotDays,
    @Schema(
            description = "Number of rate rows written",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "96")
        int rowsWritten,
    @Schema(
            description = "First date of the fetch window",
            requiredMode = Schema.RequiredMode.NOT_REQUIRED,
            example = "2025-11-25")
        LocalDate windowStart,
    @Schema(
            description = "Last date of the fetch window",
            requiredMode = Schema.RequiredMode.NOT_REQUIRED,
            example = "2025-11-27")
        LocalDate windowEnd,
    @Schema(
            description = "Warnings of a partial run or the error of a failed one",
            requiredMode = Schema.RequiredMode.NOT_REQUIRED)
        String message,
    @Schema(
            description = "Timestamp of the sync completion",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2025-11-27T16:00:12Z")
        Instant timestamp) {

  public static SyncResultResponse from(SyncResult result) {
    return new SyncResultResponse(
        result.provider(),
        result.outcome().name(),
        result.snapshotDays(),
        result.rowsWritten(),
        result.windowStart(),
        result.windowEnd(),
        result.message(),
        result.finishedAt());
  }
}

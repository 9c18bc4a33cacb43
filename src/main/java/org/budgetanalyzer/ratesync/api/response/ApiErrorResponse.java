package org.budgetanalyzer.ratesync.api.response;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Error returned by every endpoint on failure")
public record ApiErrorResponse(
    @Schema(
            description = "Error category",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "NOT_FOUND")
        ErrorType type,
    @Schema(
            description = "Human readable message",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "No rate data for date: 2025-11-29")
        String message,
    @Schema(
            description = "Machine readable error code",
            requiredMode = Schema.RequiredMode.NOT_REQUIRED,
            example = "NO_RATE_DATA")
        String code) {

  public enum ErrorType {
    INVALID_REQUEST,
    NOT_FOUND,
    APPLICATION_ERROR,
    CONFLICT,
    UPSTREAM_ERROR,
    INTERNAL_ERROR
  }
}

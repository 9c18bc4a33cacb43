package org.budgetanalyzer.ratesync.api.response;

import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Service health and per-provider sync status")
public record HealthResponse(
    @Schema(
            description = "Service status",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "ok")
        String status,
    @Schema(
            description = "Service version",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "1.0.0")
        String version,
    @Schema(description = "Registered providers", requiredMode = Schema.RequiredMode.REQUIRED)
        List<ProviderHealthResponse> providers) {}

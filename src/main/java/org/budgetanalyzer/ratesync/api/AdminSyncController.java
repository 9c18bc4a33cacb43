package org.budgetanalyzer.ratesync.api;

import java.util.List;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.budgetanalyzer.ratesync.api.response.ApiErrorResponse;
import org.budgetanalyzer.ratesync.api.response.SyncResultResponse;
import org.budgetanalyzer.ratesync.api.response.SyncRunResponse;
import org.budgetanalyzer.ratesync.domain.SyncTrigger;
import org.budgetanalyzer.ratesync.service.RateStore;
import org.budgetanalyzer.ratesync.service.SyncOrchestrator;

/** Admin endpoints for triggering and inspecting provider syncs. */
@Tag(
    name = "Admin - Sync Handler",
    description = "Admin endpoints for triggering provider syncs and reading the sync history")
@RestController
@RequestMapping(path = "/v1/admin/sync")
@Validated
public class AdminSyncController {

  private static final Logger log = LoggerFactory.getLogger(AdminSyncController.class);

  private final SyncOrchestrator syncOrchestrator;
  private final RateStore rateStore;

  public AdminSyncController(SyncOrchestrator syncOrchestrator, RateStore rateStore) {
    this.syncOrchestrator = syncOrchestrator;
    this.rateStore = rateStore;
  }

  @Operation(
      summary = "Sync all providers",
      description =
          "Syncs every enabled provider up to today - manually triggers the daily cron job")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    array =
                        @ArraySchema(
                            schema = @Schema(implementation = SyncResultResponse.class))))
      })
  @PostMapping(path = "", produces = "application/json")
  public List<SyncResultResponse> syncAll() {
    log.info("Received syncAll request");

    return syncOrchestrator.syncAll(SyncTrigger.MANUAL).stream()
        .map(SyncResultResponse::from)
        .toList();
  }

  @Operation(summary = "Sync one provider", description = "Syncs a single provider up to today")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = SyncResultResponse.class))),
        @ApiResponse(
            responseCode = "404",
            description = "Unknown provider",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class))),
        @ApiResponse(
            responseCode = "409",
            description = "A sync of the provider is already running",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class))),
        @ApiResponse(
            responseCode = "502",
            description = "The sync failed",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = SyncResultResponse.class)))
      })
  @PostMapping(path = "/{provider}", produces = "application/json")
  public ResponseEntity<SyncResultResponse> syncProvider(
      @Parameter(description = "Provider id", example = "ecb") @PathVariable String provider) {
    log.info("Received syncProvider request - provider: {}", provider);

    var result = syncOrchestrator.syncProvider(provider, SyncTrigger.MANUAL);
    var status = result.isFailed() ? HttpStatus.BAD_GATEWAY : HttpStatus.OK;

    return ResponseEntity.status(status).body(SyncResultResponse.from(result));
  }

  @Operation(
      summary = "Get sync runs",
      description = "Most recent recorded sync runs, newest first")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    array =
                        @ArraySchema(schema = @Schema(implementation = SyncRunResponse.class))))
      })
  @GetMapping(path = "/runs", produces = "application/json")
  public List<SyncRunResponse> getRuns(
      @Parameter(description = "Provider id, all providers when omitted", example = "nbu")
          @RequestParam(required = false)
          String provider,
      @Parameter(description = "Maximum number of runs", example = "20")
          @RequestParam(defaultValue = "20")
          @Min(1)
          @Max(500)
          int limit) {
    log.info("Received getRuns request - provider: {}, limit: {}", provider, limit);

    return rateStore.recentRuns(provider, limit).stream().map(SyncRunResponse::from).toList();
  }
}

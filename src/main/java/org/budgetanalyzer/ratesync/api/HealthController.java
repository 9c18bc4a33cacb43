package org.budgetanalyzer.ratesync.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.budgetanalyzer.ratesync.api.response.HealthResponse;
import org.budgetanalyzer.ratesync.api.response.ProviderHealthResponse;
import org.budgetanalyzer.ratesync.config.RateSyncProperties;
import org.budgetanalyzer.ratesync.service.QueryEngine;

@Tag(name = "Health Handler", description = "Service and provider status")
@RestController
@RequestMapping(path = "/v1/health")
public class HealthController {

  private static final String STATUS_OK = "ok";

  private final QueryEngine queryEngine;
  private final RateSyncProperties properties;

  public HealthController(QueryEngine queryEngine, RateSyncProperties properties) {
    this.queryEngine = queryEngine;
    this.properties = properties;
  }

  @Operation(summary = "Get health", description = "Service version and per-provider sync status")
  @GetMapping(path = "", produces = "application/json")
  public HealthResponse getHealth() {
    var providers =
        queryEngine.providers().stream().map(ProviderHealthResponse::from).toList();

    return new HealthResponse(STATUS_OK, properties.getVersion(), providers);
  }
}

package org.budgetanalyzer.ratesync.api;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.budgetanalyzer.ratesync.api.response.CurrencyResponse;
import org.budgetanalyzer.ratesync.service.QueryEngine;

@Tag(name = "Currencies Handler", description = "Endpoints for listing known currencies")
@RestController
@RequestMapping(path = "/v1/currencies")
public class CurrencyController {

  private static final Logger log = LoggerFactory.getLogger(CurrencyController.class);

  private final QueryEngine queryEngine;

  public CurrencyController(QueryEngine queryEngine) {
    this.queryEngine = queryEngine;
  }

  @Operation(
      summary = "Get currencies",
      description = "Every known currency with its providers and stored date range")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    array =
                        @ArraySchema(schema = @Schema(implementation = CurrencyResponse.class))))
      })
  @GetMapping(path = "", produces = "application/json")
  public List<CurrencyResponse> getCurrencies() {
    log.info("Received getCurrencies request");

    return queryEngine.currencies().stream().map(CurrencyResponse::from).toList();
  }
}

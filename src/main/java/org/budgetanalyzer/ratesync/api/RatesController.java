package org.budgetanalyzer.ratesync.api;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.budgetanalyzer.ratesync.api.response.ApiErrorResponse;
import org.budgetanalyzer.ratesync.api.response.RatesResponse;
import org.budgetanalyzer.ratesync.api.response.TimeSeriesResponse;
import org.budgetanalyzer.ratesync.config.RateSyncProperties;
import org.budgetanalyzer.ratesync.exception.InvalidRequestException;
import org.budgetanalyzer.ratesync.service.QueryEngine;

@Tag(name = "Rates Handler", description = "Endpoints for querying exchange rates")
@RestController
@RequestMapping(path = "/v1/rates")
public class RatesController {

  private static final Logger log = LoggerFactory.getLogger(RatesController.class);

  private static final String RANGE_SEPARATOR = "..";
  private static final DateTimeFormatter COMPACT_DATE = DateTimeFormatter.BASIC_ISO_DATE;

  private final QueryEngine queryEngine;
  private final RateSyncProperties properties;

  public RatesController(QueryEngine queryEngine, RateSyncProperties properties) {
    this.queryEngine = queryEngine;
    this.properties = properties;
  }

  @Operation(
      summary = "Get latest rates",
      description = "Rates of the most recent date with stored data")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = RatesResponse.class))),
        @ApiResponse(
            responseCode = "404",
            description = "Nothing has been synced yet",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class))),
        @ApiResponse(
            responseCode = "422",
            description = "Base currency not available",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class),
                    examples = {
                      @ExampleObject(
                          name = "Base Currency Unavailable",
                          summary = "Requested base is not in the stored currency set",
                          value =
                              """
                      {
                        "type": "APPLICATION_ERROR",
                        "message": "Base currency XYZ is not available for the requested date",
                        "code": "BASE_CURRENCY_UNAVAILABLE"
                      }
                      """)
                    }))
      })
  @GetMapping(path = "/latest", produces = "application/json")
  public RatesResponse getLatest(
      @Parameter(description = "Base currency", example = "EUR") @RequestParam(required = false)
          String from,
      @Parameter(description = "Comma-separated target currencies", example = "USD,GBP")
          @RequestParam(required = false)
          String to,
      @Parameter(description = "Amount of base currency to convert", example = "100")
          @RequestParam(required = false)
          Double amount) {
    log.info("Received getLatest request - from: {}, to: {}, amount: {}", from, to, amount);

    var result = queryEngine.latest(from, parseSymbols(to), amount);
    return RatesResponse.from(result, displayScale());
  }

  @Operation(
      summary = "Get rates for a date",
      description = "Rates of one date, given as yyyy-MM-dd or yyyyMMdd")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = RatesResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid date"),
        @ApiResponse(
            responseCode = "404",
            description = "No rates stored for the date",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class))),
        @ApiResponse(responseCode = "422", description = "Base currency not available")
      })
  @GetMapping(path = "/{date:[^.]+}", produces = "application/json")
  public RatesResponse getForDate(
      @Parameter(description = "Date", example = "2025-11-27") @PathVariable String date,
      @Parameter(description = "Base currency", example = "EUR") @RequestParam(required = false)
          String from,
      @Parameter(description = "Comma-separated target currencies", example = "USD,GBP")
          @RequestParam(required = false)
          String to,
      @Parameter(description = "Amount of base currency to convert", example = "100")
          @RequestParam(required = false)
          Double amount) {
    log.info(
        "Received getForDate request - date: {}, from: {}, to: {}, amount: {}",
        date,
        from,
        to,
        amount);

    var result = queryEngine.atDate(parseDate(date), from, parseSymbols(to), amount);
    return RatesResponse.from(result, displayScale());
  }

  @Operation(
      summary = "Get rates for a date range",
      description =
          "Rates of every stored date between two dates, inclusive, given as start..end."
              + " Dates without stored data are omitted")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = TimeSeriesResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid range"),
        @ApiResponse(
            responseCode = "404",
            description = "No rates stored in the range",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class))),
        @ApiResponse(responseCode = "422", description = "Base currency not available")
      })
  @GetMapping(path = "/{range:.+\\.\\..+}", produces = "application/json")
  public TimeSeriesResponse getForRange(
      @Parameter(description = "Date range", example = "2025-11-01..2025-11-30") @PathVariable
          String range,
      @Parameter(description = "Base currency", example = "EUR") @RequestParam(required = false)
          String from,
      @Parameter(description = "Comma-separated target currencies", example = "USD,GBP")
          @RequestParam(required = false)
          String to,
      @Parameter(description = "Amount of base currency to convert", example = "100")
          @RequestParam(required = false)
          Double amount) {
    log.info(
        "Received getForRange request - range: {}, from: {}, to: {}, amount: {}",
        range,
        from,
        to,
        amount);

    var separator = range.indexOf(RANGE_SEPARATOR);
    var startDate = parseDate(range.substring(0, separator));
    var endDate = parseDate(range.substring(separator + RANGE_SEPARATOR.length()));

    var result = queryEngine.range(startDate, endDate, from, parseSymbols(to), amount);
    return TimeSeriesResponse.from(result, displayScale());
  }

  private int displayScale() {
    return properties.getApi().getDisplayScale();
  }

  static LocalDate parseDate(String value) {
    try {
      return LocalDate.parse(value);
    } catch (DateTimeParseException e) {
      try {
        return LocalDate.parse(value, COMPACT_DATE);
      } catch (DateTimeParseException compactFailure) {
        throw new InvalidRequestException(
            "Invalid date format: " + value + ". Use yyyy-MM-dd or yyyyMMdd");
      }
    }
  }

  static List<String> parseSymbols(String to) {
    if (to == null || to.isBlank()) {
      return List.of();
    }
    return Arrays.stream(to.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
  }
}

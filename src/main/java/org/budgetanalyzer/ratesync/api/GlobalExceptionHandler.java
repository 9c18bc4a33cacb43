package org.budgetanalyzer.ratesync.api;

import jakarta.validation.ConstraintViolationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import org.budgetanalyzer.ratesync.api.response.ApiErrorResponse;
import org.budgetanalyzer.ratesync.api.response.ApiErrorResponse.ErrorType;
import org.budgetanalyzer.ratesync.exception.FetchException;
import org.budgetanalyzer.ratesync.exception.InvalidRequestException;
import org.budgetanalyzer.ratesync.exception.LockContentionException;
import org.budgetanalyzer.ratesync.exception.NormalizationException;
import org.budgetanalyzer.ratesync.exception.NotFoundException;
import org.budgetanalyzer.ratesync.exception.RateParseException;
import org.budgetanalyzer.ratesync.exception.RateSyncError;
import org.budgetanalyzer.ratesync.exception.RateSyncException;

/** Maps exceptions raised by the controllers to {@link ApiErrorResponse} bodies. */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(InvalidRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidRequestException e) {
    log.warn("Invalid request: {}", e.getMessage());
    return respond(HttpStatus.BAD_REQUEST, ErrorType.INVALID_REQUEST, e);
  }

  @ExceptionHandler({
    MethodArgumentTypeMismatchException.class,
    MissingServletRequestParameterException.class,
    ConstraintViolationException.class,
    HandlerMethodValidationException.class
  })
  public ResponseEntity<ApiErrorResponse> handleBadParameter(Exception e) {
    log.warn("Invalid request parameter: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            new ApiErrorResponse(
                ErrorType.INVALID_REQUEST,
                "Invalid request parameter: " + e.getMessage(),
                RateSyncError.INVALID_REQUEST.name()));
  }

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(NotFoundException e) {
    log.info("Not found: {}", e.getMessage());
    return respond(HttpStatus.NOT_FOUND, ErrorType.NOT_FOUND, e);
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNoResource(NoResourceFoundException e) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ErrorType.NOT_FOUND, e.getMessage(), null));
  }

  @ExceptionHandler(NormalizationException.class)
  public ResponseEntity<ApiErrorResponse> handleNormalization(NormalizationException e) {
    log.warn("Normalization failed: {}", e.getMessage());
    return respond(HttpStatus.UNPROCESSABLE_ENTITY, ErrorType.APPLICATION_ERROR, e);
  }

  @ExceptionHandler(LockContentionException.class)
  public ResponseEntity<ApiErrorResponse> handleLockContention(LockContentionException e) {
    log.info("Rejected sync request: {}", e.getMessage());
    return respond(HttpStatus.CONFLICT, ErrorType.CONFLICT, e);
  }

  @ExceptionHandler({FetchException.class, RateParseException.class})
  public ResponseEntity<ApiErrorResponse> handleUpstream(RateSyncException e) {
    log.error("Upstream provider error: {}", e.getMessage(), e);
    return respond(HttpStatus.BAD_GATEWAY, ErrorType.UPSTREAM_ERROR, e);
  }

  @ExceptionHandler(RateSyncException.class)
  public ResponseEntity<ApiErrorResponse> handleRateSync(RateSyncException e) {
    log.error("Rate sync error: {}", e.getMessage(), e);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorType.INTERNAL_ERROR, e);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception e) {
    log.error("Unexpected error", e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            new ApiErrorResponse(
                ErrorType.INTERNAL_ERROR, "An unexpected error occurred", null));
  }

  private static ResponseEntity<ApiErrorResponse> respond(
      HttpStatus status, ErrorType type, RateSyncException e) {
    return ResponseEntity.status(status)
        .body(new ApiErrorResponse(type, e.getMessage(), e.getError().name()));
  }
}

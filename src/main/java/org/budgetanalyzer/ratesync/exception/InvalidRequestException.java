package org.budgetanalyzer.ratesync.exception;

public class InvalidRequestException extends RateSyncException {

  public InvalidRequestException(String message) {
    super(message, RateSyncError.INVALID_REQUEST);
  }
}

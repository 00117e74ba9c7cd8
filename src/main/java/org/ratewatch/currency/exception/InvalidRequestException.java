package org.ratewatch.currency.exception;

/** Request parameters failed validation. Raised before any cache, store or upstream call. */
public class InvalidRequestException extends ServiceException {

  public InvalidRequestException(String message, String code) {
    super(message, code);
  }

  public InvalidRequestException(String message, String code, Throwable cause) {
    super(message, code, cause);
  }
}

package org.ratewatch.currency.exception;

/** Base class for exceptions that carry a machine-readable error code to the API response. */
public abstract class ServiceException extends RuntimeException {

  private final String code;

  protected ServiceException(String message, String code) {
    super(message);
    this.code = code;
  }

  protected ServiceException(String message, String code, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}

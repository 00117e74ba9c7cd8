package org.ratewatch.currency.exception;

/** Failure talking to an upstream HTTP service. */
public class ClientException extends DependencyException {

  public ClientException(String message, String code) {
    super(message, code);
  }

  public ClientException(String message, String code, Throwable cause) {
    super(message, code, cause);
  }
}

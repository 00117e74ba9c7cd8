package org.ratewatch.currency.exception;

/** A well-formed request that cannot be satisfied, such as a rate the provider does not publish. */
public class BusinessException extends ServiceException {

  public BusinessException(String message, String code) {
    super(message, code);
  }
}

package org.ratewatch.currency.exception;

import org.ratewatch.currency.service.CurrencyServiceError;

public class BanStoreException extends DependencyException {

  public BanStoreException(String message, Throwable cause) {
    super(message, CurrencyServiceError.BAN_STORE_UNAVAILABLE.name(), cause);
  }
}

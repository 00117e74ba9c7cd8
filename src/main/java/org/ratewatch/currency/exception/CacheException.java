package org.ratewatch.currency.exception;

import org.ratewatch.currency.service.CurrencyServiceError;

/** Redis was unreachable, timed out, refused a write or returned an unreadable payload. */
public class CacheException extends DependencyException {

  public CacheException(String message) {
    super(message, CurrencyServiceError.CACHE_UNAVAILABLE.name());
  }

  public CacheException(String message, Throwable cause) {
    super(message, CurrencyServiceError.CACHE_UNAVAILABLE.name(), cause);
  }
}

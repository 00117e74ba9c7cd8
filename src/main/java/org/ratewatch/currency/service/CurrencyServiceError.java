package org.ratewatch.currency.service;

/** Error codes reported in API error responses. */
public enum CurrencyServiceError {
  /** Currency code is not in the currency registry. */
  INVALID_CURRENCY_CODE,

  /** Date parameter is not a YYYY-MM-DD calendar date. */
  INVALID_DATE,

  /** Start date is after end date. */
  INVALID_DATE_RANGE,

  /** The rate provider published no rate for the requested pair. */
  RATE_NOT_FOUND,

  CACHE_UNAVAILABLE,

  BAN_STORE_UNAVAILABLE,

  /** Rate provider failed, timed out or reported an unsuccessful response. */
  RATE_PROVIDER_UNAVAILABLE,

  FORECAST_UNAVAILABLE,
}

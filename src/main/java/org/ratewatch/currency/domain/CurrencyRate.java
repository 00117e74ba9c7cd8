package org.ratewatch.currency.domain;

/** Rate for converting one unit of {@code base} into {@code second} on {@code date}. */
public record CurrencyRate(CurrencyCode base, CurrencyCode second, double rate, CalendarDate date) {

  public CurrencyRate {
    date = date == null ? CalendarDate.UNSET : date;
  }
}

package org.ratewatch.currency.domain;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/** Daily rates of one base currency against the requested targets over a date range. */
public record CurrencyTimelineRates(
    CurrencyCode base,
    Map<CalendarDate, Map<CurrencyCode, Double>> rates,
    CalendarDate startDate,
    CalendarDate endDate) {

  public CurrencyTimelineRates {
    rates = rates == null ? Map.of() : Collections.unmodifiableSortedMap(new TreeMap<>(rates));
    startDate = startDate == null ? CalendarDate.UNSET : startDate;
    endDate = endDate == null ? CalendarDate.UNSET : endDate;
  }

  /**
   * Projects the series of one target currency. Days on which the provider returned no rate for
   * the target are left out.
   */
  public CurrencyTimelineRate toTimelineRate(CurrencyCode second) {
    var series = new TreeMap<CalendarDate, Double>();
    rates.forEach(
        (date, daily) -> {
          var rate = daily == null ? null : daily.get(second);
          if (rate != null) {
            series.put(date, rate);
          }
        });

    return new CurrencyTimelineRate(base, second, series, Map.of(), startDate, endDate);
  }
}

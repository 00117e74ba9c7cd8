package org.ratewatch.currency.domain;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Date-indexed rate series for one currency pair, optionally extended with forecasted values for
 * dates after the last known rate.
 */
public record CurrencyTimelineRate(
    CurrencyCode base,
    CurrencyCode second,
    Map<CalendarDate, Double> rates,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<CalendarDate, Double> predictions,
    CalendarDate startDate,
    CalendarDate endDate) {

  public CurrencyTimelineRate {
    rates = sorted(rates);
    predictions = sorted(predictions);
    startDate = startDate == null ? CalendarDate.UNSET : startDate;
    endDate = endDate == null ? CalendarDate.UNSET : endDate;
  }

  public CurrencyTimelineRate withPredictions(Map<CalendarDate, Double> predictions) {
    return new CurrencyTimelineRate(base, second, rates, predictions, startDate, endDate);
  }

  /**
   * Narrows the series to {@code [start, end]}, both ends inclusive. Predictions are kept whole
   * and the range becomes the new start and end date.
   */
  public CurrencyTimelineRate between(CalendarDate start, CalendarDate end) {
    var window = new TreeMap<CalendarDate, Double>();
    rates.forEach(
        (date, rate) -> {
          if (!date.isBefore(start) && !date.isAfter(end)) {
            window.put(date, rate);
          }
        });

    return new CurrencyTimelineRate(base, second, window, predictions, start, end);
  }

  private static Map<CalendarDate, Double> sorted(Map<CalendarDate, Double> values) {
    return values == null ? Map.of() : Collections.unmodifiableSortedMap(new TreeMap<>(values));
  }
}

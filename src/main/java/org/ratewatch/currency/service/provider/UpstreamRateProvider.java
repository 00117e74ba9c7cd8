package org.ratewatch.currency.service.provider;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.ratewatch.currency.domain.CalendarDate;
import org.ratewatch.currency.domain.CurrencyCode;
import org.ratewatch.currency.domain.CurrencyRates;
import org.ratewatch.currency.domain.CurrencyTimelineRates;

/** Authoritative source of exchange rates and rate forecasts. */
public interface UpstreamRateProvider {

  /**
   * Retrieves all rates for {@code base} as of {@code asOfDate}.
   *
   * @throws org.ratewatch.currency.exception.ClientException if the provider fails or reports an
   *     unsuccessful response
   */
  CurrencyRates fetchSnapshot(CurrencyCode base, CalendarDate asOfDate, Duration timeout);

  /**
   * Retrieves daily {@code base}/{@code target} rates between {@code start} and {@code end}.
   *
   * @throws org.ratewatch.currency.exception.ClientException if the provider fails or reports an
   *     unsuccessful response
   */
  CurrencyTimelineRates fetchTimeline(
      CurrencyCode base,
      CurrencyCode target,
      CalendarDate start,
      CalendarDate end,
      Duration timeout);

  /**
   * Predicts the rates that follow {@code history}.
   *
   * @return one value per day after the last day of the history, in day order
   * @throws org.ratewatch.currency.exception.ClientException if the forecast service fails
   */
  List<Double> forecast(Map<CalendarDate, Double> history, Duration timeout);
}

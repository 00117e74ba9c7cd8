package org.ratewatch.currency.service.provider;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import org.ratewatch.currency.client.forecast.ForecastClient;
import org.ratewatch.currency.client.ratehost.RateHostClient;
import org.ratewatch.currency.client.ratehost.response.RateHostError;
import org.ratewatch.currency.domain.CalendarDate;
import org.ratewatch.currency.domain.CurrencyCode;
import org.ratewatch.currency.domain.CurrencyRates;
import org.ratewatch.currency.domain.CurrencyTimelineRates;
import org.ratewatch.currency.exception.ClientException;
import org.ratewatch.currency.service.CurrencyServiceError;

/**
 * exchangerate.host implementation of {@link UpstreamRateProvider}, with forecasts from the
 * forecasting service.
 */
@Service
public class ExchangeRateHostProvider implements UpstreamRateProvider {

  private static final Logger log = LoggerFactory.getLogger(ExchangeRateHostProvider.class);

  private final RateHostClient rateHostClient;
  private final ForecastClient forecastClient;

  public ExchangeRateHostProvider(RateHostClient rateHostClient, ForecastClient forecastClient) {
    this.rateHostClient = rateHostClient;
    this.forecastClient = forecastClient;
  }

  @Override
  public CurrencyRates fetchSnapshot(CurrencyCode base, CalendarDate asOfDate, Duration timeout) {
    var response = rateHostClient.getRates(base, asOfDate, timeout);
    if (!response.success()) {
      throw unsuccessful("rate snapshot for " + base, response.error());
    }

    // The provider echoes the base; fall back to the requested one if it does not
    var snapshotBase = response.base() != null ? response.base() : base;
    return new CurrencyRates(snapshotBase, response.rates(), response.date());
  }

  @Override
  public CurrencyTimelineRates fetchTimeline(
      CurrencyCode base,
      CurrencyCode target,
      CalendarDate start,
      CalendarDate end,
      Duration timeout) {
    var response = rateHostClient.getTimeSeries(base, target, start, end, timeout);
    if (!response.success()) {
      throw unsuccessful("time series for " + base + "/" + target, response.error());
    }

    var timelineBase = response.base() != null ? response.base() : base;
    return new CurrencyTimelineRates(
        timelineBase, response.rates(), response.startDate(), response.endDate());
  }

  @Override
  public List<Double> forecast(Map<CalendarDate, Double> history, Duration timeout) {
    return forecastClient.predict(history, timeout);
  }

  private ClientException unsuccessful(String what, RateHostError error) {
    var detail = error == null ? "no details" : error.type() + " - " + error.info();
    log.warn("Rate provider reported an unsuccessful {}: {}", what, detail);
    return new ClientException(
        "Rate provider reported an unsuccessful " + what + ": " + detail,
        CurrencyServiceError.RATE_PROVIDER_UNAVAILABLE.name());
  }
}

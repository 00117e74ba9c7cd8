package org.ratewatch.currency.client.forecast;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;

import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import org.ratewatch.currency.config.CurrencyServiceProperties;
import org.ratewatch.currency.domain.CalendarDate;
import org.ratewatch.currency.exception.ClientException;
import org.ratewatch.currency.service.CurrencyServiceError;

/**
 * HTTP client for the rate forecasting service.
 *
 * <p>The service takes a date to rate JSON object and answers with a JSON array of predicted rates,
 * one per day following the last known day.
 */
@Component
public class ForecastClient {

  private static final Logger log = LoggerFactory.getLogger(ForecastClient.class);

  private static final ParameterizedTypeReference<List<Double>> PREDICTIONS_TYPE =
      new ParameterizedTypeReference<>() {};

  private static final int MAX_ERROR_BODY_LENGTH = 500;

  private final WebClient webClient;
  private final String url;

  public ForecastClient(WebClient.Builder webClientBuilder, CurrencyServiceProperties properties) {
    this.url = properties.getForecast().getUrl();
    this.webClient = webClientBuilder.clone().build();

    log.info("ForecastClient initialized with URL: {}", url);
  }

  /**
   * Requests predictions continuing {@code history}.
   *
   * @param history known rates by date
   * @param timeout bound for the whole call
   * @return predicted rates in day order
   * @throws ClientException if the call fails, times out or the body is not an array of numbers
   */
  public List<Double> predict(Map<CalendarDate, Double> history, Duration timeout) {
    log.info("Requesting forecast for {} historical rates", history.size());

    try {
      var predictions =
          webClient
              .post()
              .uri(url)
              .contentType(MediaType.APPLICATION_JSON)
              .accept(MediaType.APPLICATION_JSON)
              .bodyValue(history)
              .retrieve()
              .onStatus(HttpStatusCode::isError, this::handleErrorResponse)
              .bodyToMono(PREDICTIONS_TYPE)
              .timeout(timeout)
              .block();

      if (predictions == null) {
        throw new ClientException(
            "Received empty response from forecast service",
            CurrencyServiceError.FORECAST_UNAVAILABLE.name());
      }

      log.debug("Received {} predicted rates", predictions.size());
      return predictions;
    } catch (ClientException ce) {
      throw ce;
    } catch (Exception e) {
      var cause = Exceptions.unwrap(e);
      log.warn("Unexpected error requesting forecast: {}", cause.getMessage());
      throw new ClientException(
          "Failed to get forecast", CurrencyServiceError.FORECAST_UNAVAILABLE.name(), cause);
    }
  }

  private Mono<? extends Throwable> handleErrorResponse(ClientResponse response) {
    return response
        .bodyToMono(String.class)
        .defaultIfEmpty("No response body")
        .map(
            body -> {
              var message =
                  body.length() > MAX_ERROR_BODY_LENGTH
                      ? body.substring(0, MAX_ERROR_BODY_LENGTH) + "... (truncated)"
                      : body;
              log.warn("Forecast service error: HTTP {} - {}", response.statusCode(), message);
              return new ClientException(
                  "Forecast service error: HTTP " + response.statusCode().value() + " - " + message,
                  CurrencyServiceError.FORECAST_UNAVAILABLE.name());
            });
  }
}

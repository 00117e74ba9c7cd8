package org.ratewatch.currency.client.ratehost;

import java.net.URI;
import java.time.Duration;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import org.ratewatch.currency.client.ratehost.response.RateSnapshotResponse;
import org.ratewatch.currency.client.ratehost.response.TimeSeriesResponse;
import org.ratewatch.currency.config.CurrencyServiceProperties;
import org.ratewatch.currency.domain.CalendarDate;
import org.ratewatch.currency.domain.CurrencyCode;
import org.ratewatch.currency.exception.ClientException;
import org.ratewatch.currency.service.CurrencyServiceError;

/**
 * HTTP client for an exchangerate.host style rate API.
 *
 * <p>Transport errors, timeouts, HTTP error statuses and unreadable bodies are reported as {@link
 * ClientException}. The {@code success} flag of a readable body is left to the caller.
 */
@Component
public class RateHostClient {

  private static final Logger log = LoggerFactory.getLogger(RateHostClient.class);

  private static final String USER_AGENT = "CurrencyRateServiceClient/1.0";

  private static final int MAX_ERROR_BODY_LENGTH = 500;

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final String accessKey;
  private final int places;

  public RateHostClient(
      WebClient.Builder webClientBuilder,
      CurrencyServiceProperties properties,
      ObjectMapper objectMapper) {
    var rateProviderConfig = properties.getRateProvider();

    this.webClient =
        webClientBuilder
            .clone()
            .baseUrl(rateProviderConfig.getBaseUrl())
            .defaultHeader("User-Agent", USER_AGENT)
            .build();
    this.objectMapper = objectMapper;
    this.accessKey = rateProviderConfig.getAccessKey();
    this.places = rateProviderConfig.getPlaces();

    log.info("RateHostClient initialized with base URL: {}", rateProviderConfig.getBaseUrl());
  }

  /**
   * Fetches all rates for {@code base} as of {@code date}.
   *
   * @throws ClientException if the call fails or the body cannot be read
   */
  public RateSnapshotResponse getRates(CurrencyCode base, CalendarDate date, Duration timeout) {
    log.info("Requesting rate snapshot base: {} date: {}", base, date);

    var response =
        get(
            uriBuilder ->
                withCommonParams(uriBuilder.path("/{date}").queryParam("base", base.value()))
                    .build(date.format()),
            RateSnapshotResponse.class,
            timeout,
            "rate snapshot for " + base);

    log.debug("Received rate snapshot base: {} success: {}", base, response.success());
    return response;
  }

  /**
   * Fetches the daily {@code base}/{@code symbol} rates between {@code start} and {@code end}.
   *
   * @throws ClientException if the call fails or the body cannot be read
   */
  public TimeSeriesResponse getTimeSeries(
      CurrencyCode base,
      CurrencyCode symbol,
      CalendarDate start,
      CalendarDate end,
      Duration timeout) {
    log.info(
        "Requesting time series base: {} symbol: {} start: {} end: {}", base, symbol, start, end);

    var response =
        get(
            uriBuilder ->
                withCommonParams(
                        uriBuilder
                            .path("/timeseries")
                            .queryParam("start_date", start.format())
                            .queryParam("end_date", end.format())
                            .queryParam("base", base.value())
                            .queryParam("symbols", symbol.value()))
                    .build(),
            TimeSeriesResponse.class,
            timeout,
            "time series for " + base + "/" + symbol);

    log.debug("Received time series base: {} success: {}", base, response.success());
    return response;
  }

  private UriBuilder withCommonParams(UriBuilder uriBuilder) {
    uriBuilder.queryParam("places", places);
    if (accessKey != null && !accessKey.isBlank()) {
      uriBuilder.queryParam("access_key", accessKey);
    }
    return uriBuilder;
  }

  private <T> T get(
      Function<UriBuilder, URI> uri,
      Class<T> responseType,
      Duration timeout,
      String what) {
    try {
      var response =
          webClient
              .get()
              .uri(uri)
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .onStatus(HttpStatusCode::isError, this::handleErrorResponse)
              .bodyToMono(responseType)
              .timeout(timeout)
              .block();

      if (response == null) {
        throw new ClientException(
            "Received empty " + what + " from rate provider",
            CurrencyServiceError.RATE_PROVIDER_UNAVAILABLE.name());
      }
      return response;
    } catch (ClientException ce) {
      throw ce;
    } catch (Exception e) {
      var cause = Exceptions.unwrap(e);
      log.warn("Unexpected error fetching {}: {}", what, cause.getMessage());
      throw new ClientException(
          "Failed to fetch " + what,
          CurrencyServiceError.RATE_PROVIDER_UNAVAILABLE.name(),
          cause);
    }
  }

  private Mono<? extends Throwable> handleErrorResponse(ClientResponse response) {
    return response
        .bodyToMono(String.class)
        .defaultIfEmpty("No response body")
        .map(body -> parseErrorAndCreateException(response, body));
  }

  private Throwable parseErrorAndCreateException(ClientResponse response, String body) {
    String errorMessage = body;

    if (body != null && !body.isBlank()) {
      try {
        var error = objectMapper.readTree(body).path("error");
        if (error.hasNonNull("info")) {
          errorMessage = error.get("info").asText();
        } else if (error.isTextual()) {
          errorMessage = error.asText();
        } else if (body.length() > MAX_ERROR_BODY_LENGTH) {
          errorMessage = body.substring(0, MAX_ERROR_BODY_LENGTH) + "... (truncated)";
        }
      } catch (JsonProcessingException e) {
        log.debug("Could not parse rate provider error response as JSON: {}", e.getMessage());

        if (body.length() > MAX_ERROR_BODY_LENGTH) {
          errorMessage = body.substring(0, MAX_ERROR_BODY_LENGTH) + "... (truncated)";
        }
      }
    }

    log.warn("Rate provider error: HTTP {} - Message: {}", response.statusCode(), errorMessage);

    return new ClientException(
        "Rate provider error: HTTP " + response.statusCode().value() + " - " + errorMessage,
        CurrencyServiceError.RATE_PROVIDER_UNAVAILABLE.name());
  }
}

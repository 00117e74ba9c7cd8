package org.ratewatch.currency.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.netty.channel.ChannelOption;
import reactor.netty.http.client.HttpClient;

/**
 * Shared {@link WebClient.Builder} for upstream HTTP clients.
 *
 * <p>Only the connect timeout is set here. Response timeouts differ per upstream (seconds for the
 * rate provider, minutes for forecasting) and are applied per call. Clients must {@code clone()}
 * the builder before customizing it.
 */
@Configuration
public class WebClientConfig {

  private static final int CONNECT_TIMEOUT_MILLIS = 5000;

  private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;

  @Bean
  public WebClient.Builder webClientBuilder(ObjectMapper objectMapper) {
    var httpClient =
        HttpClient.create().option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS);

    // Timeline responses for a year of daily rates can be large
    var strategies =
        ExchangeStrategies.builder()
            .codecs(
                configurer -> {
                  configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE);
                  configurer
                      .defaultCodecs()
                      .jackson2JsonEncoder(
                          new Jackson2JsonEncoder(objectMapper, MediaType.APPLICATION_JSON));
                  configurer
                      .defaultCodecs()
                      .jackson2JsonDecoder(
                          new Jackson2JsonDecoder(objectMapper, MediaType.APPLICATION_JSON));
                })
            .build();

    return WebClient.builder()
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .exchangeStrategies(strategies);
  }
}

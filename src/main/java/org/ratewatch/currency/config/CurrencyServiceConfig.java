package org.ratewatch.currency.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import org.ratewatch.currency.domain.CurrencyRegistry;

/**
 * Main configuration class for the Currency Rate Service.
 *
 * <p>Note: ObjectMapper is auto-configured by Spring Boot using spring.jackson.* properties in
 * application.yml.
 */
@Configuration
@EnableConfigurationProperties(CurrencyServiceProperties.class)
public class CurrencyServiceConfig {

  /** Source of "today" for rate freshness and timeline ranges. */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public CurrencyRegistry currencyRegistry() {
    return CurrencyRegistry.withSupportedCodes();
  }
}

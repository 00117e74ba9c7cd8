package org.ratewatch.currency.config;

import java.time.Duration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "currency-service")
@Validated
public class CurrencyServiceProperties {

  @Valid private Cache cache = new Cache();
  @Valid private Database database = new Database();
  @Valid private RateProvider rateProvider = new RateProvider();
  @Valid private Forecast forecast = new Forecast();

  public Cache getCache() {
    return cache;
  }

  public void setCache(Cache cache) {
    this.cache = cache;
  }

  public Database getDatabase() {
    return database;
  }

  public void setDatabase(Database database) {
    this.database = database;
  }

  public RateProvider getRateProvider() {
    return rateProvider;
  }

  public void setRateProvider(RateProvider rateProvider) {
    this.rateProvider = rateProvider;
  }

  public Forecast getForecast() {
    return forecast;
  }

  public void setForecast(Forecast forecast) {
    this.forecast = forecast;
  }

  public static class Cache {
    /** Timeout applied to every Redis call. */
    @NotNull private Duration timeout = Duration.ofSeconds(2);

    /** How long the availability list stays cached. */
    @NotNull private Duration availableCurrenciesTtl = Duration.ofHours(24);

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public Duration getAvailableCurrenciesTtl() {
      return availableCurrenciesTtl;
    }

    public void setAvailableCurrenciesTtl(Duration availableCurrenciesTtl) {
      this.availableCurrenciesTtl = availableCurrenciesTtl;
    }
  }

  public static class Database {
    /** Transaction timeout for ban store queries. */
    @NotNull private Duration timeout = Duration.ofSeconds(5);

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }
  }

  public static class RateProvider {
    /** Rate provider base URL. */
    @NotBlank private String baseUrl = "https://api.exchangerate.host";

    /** Access key sent as the {@code access_key} query parameter, if the plan requires one. */
    private String accessKey;

    @NotNull private Duration timeout = Duration.ofSeconds(10);

    /** Decimal places requested for rates. */
    @Min(0)
    @Max(10)
    private int places = 4;

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getAccessKey() {
      return accessKey;
    }

    public void setAccessKey(String accessKey) {
      this.accessKey = accessKey;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public int getPlaces() {
      return places;
    }

    public void setPlaces(int places) {
      this.places = places;
    }
  }

  public static class Forecast {
    /** Whether timeline responses are extended with predicted rates. */
    private boolean enabled = true;

    @NotBlank private String url = "https://stbuddy.xyz/predict";

    /** Timeout for one forecast call. */
    @NotNull private Duration timeout = Duration.ofMinutes(10);

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }
  }
}

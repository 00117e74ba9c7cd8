package org.ratewatch.currency.cache;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveHashOperations;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import org.ratewatch.currency.config.CurrencyServiceProperties;
import org.ratewatch.currency.domain.CurrencyCode;
import org.ratewatch.currency.domain.CurrencyRate;
import org.ratewatch.currency.domain.CurrencyRates;
import org.ratewatch.currency.domain.CurrencyTimelineRate;
import org.ratewatch.currency.domain.CurrencyWithBanStatus;
import org.ratewatch.currency.exception.CacheException;

/**
 * Redis implementation of {@link RateCache}.
 *
 * <p>Key layout:
 *
 * <ul>
 *   <li>{@code available}: JSON array of currencies with ban status, expires after the configured
 *       TTL
 *   <li>{@code rate:collection}: hash of base code to the last rate snapshot JSON
 *   <li>{@code time:collection}: hash of {@code BASE:SECOND} to the timeline JSON, predictions
 *       included
 * </ul>
 */
@Component
public class RedisRateCache implements RateCache {

  private static final Logger log = LoggerFactory.getLogger(RedisRateCache.class);

  static final String AVAILABLE_CURRENCIES_KEY = "available";
  static final String LAST_RATES_KEY = "rate:collection";
  static final String TIMELINE_RATES_KEY = "time:collection";

  private static final TypeReference<List<CurrencyWithBanStatus>> AVAILABLE_CURRENCIES_TYPE =
      new TypeReference<>() {};

  private final ReactiveStringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final Duration availableCurrenciesTtl;

  public RedisRateCache(
      ReactiveStringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      CurrencyServiceProperties properties) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.availableCurrenciesTtl = properties.getCache().getAvailableCurrenciesTtl();
  }

  @Override
  public Optional<List<CurrencyWithBanStatus>> getAvailableCurrencies(Duration timeout) {
    var json =
        await(
            redisTemplate.opsForValue().get(AVAILABLE_CURRENCIES_KEY),
            timeout,
            "read available currencies from");
    if (json == null) {
      return Optional.empty();
    }

    return Optional.of(read(json, AVAILABLE_CURRENCIES_TYPE, "available currencies"));
  }

  @Override
  public void setAvailableCurrencies(List<CurrencyWithBanStatus> currencies, Duration timeout) {
    var json = write(currencies, "available currencies");
    var stored =
        await(
            redisTemplate
                .opsForValue()
                .set(AVAILABLE_CURRENCIES_KEY, json, availableCurrenciesTtl),
            timeout,
            "write available currencies to");

    if (!Boolean.TRUE.equals(stored)) {
      throw new CacheException("Cache did not store available currencies");
    }
  }

  @Override
  public void invalidateAvailableCurrencies(Duration timeout) {
    var deleted =
        await(
            redisTemplate.delete(AVAILABLE_CURRENCIES_KEY),
            timeout,
            "delete available currencies from");

    if (deleted == null || deleted == 0) {
      throw new CacheException("Cache held no available currencies to delete");
    }
  }

  @Override
  public Optional<CurrencyRate> getLastRate(
      CurrencyCode base, CurrencyCode target, Duration timeout) {
    var json =
        await(
            hashOperations().get(LAST_RATES_KEY, base.value()),
            timeout,
            "read last rates for " + base + " from");
    if (json == null) {
      return Optional.empty();
    }

    var snapshot = read(json, CurrencyRates.class, "last rates for " + base);
    return snapshot.rateFor(target);
  }

  @Override
  public void setLastRates(CurrencyRates snapshot, Duration timeout) {
    var json = write(snapshot, "last rates for " + snapshot.base());
    var reply =
        await(
            hashOperations().put(LAST_RATES_KEY, snapshot.base().value(), json),
            timeout,
            "write last rates for " + snapshot.base() + " to");

    // HSET answers false when it overwrote an existing field, which is still a write
    if (reply == null) {
      throw new CacheException("Cache did not acknowledge last rates for " + snapshot.base());
    }
  }

  @Override
  public Optional<CurrencyTimelineRate> getTimelineRate(
      CurrencyCode base, CurrencyCode second, Duration timeout) {
    var field = timelineField(base, second);
    var json =
        await(
            hashOperations().get(TIMELINE_RATES_KEY, field),
            timeout,
            "read timeline " + field + " from");
    if (json == null) {
      return Optional.empty();
    }

    return Optional.of(read(json, CurrencyTimelineRate.class, "timeline " + field));
  }

  @Override
  public void setTimelineRate(CurrencyTimelineRate timeline, Duration timeout) {
    var field = timelineField(timeline.base(), timeline.second());
    var json = write(timeline, "timeline " + field);
    var reply =
        await(
            hashOperations().put(TIMELINE_RATES_KEY, field, json),
            timeout,
            "write timeline " + field + " to");

    if (reply == null) {
      throw new CacheException("Cache did not acknowledge timeline " + field);
    }
  }

  static String timelineField(CurrencyCode base, CurrencyCode second) {
    return base.value() + ":" + second.value();
  }

  private ReactiveHashOperations<String, String, String> hashOperations() {
    return redisTemplate.opsForHash();
  }

  private <T> T await(Mono<T> operation, Duration timeout, String action) {
    try {
      return operation.timeout(timeout).block();
    } catch (RuntimeException e) {
      var cause = Exceptions.unwrap(e);
      log.warn("Redis call failed: {} cache - {}", action, cause.getMessage());
      throw new CacheException("Failed to " + action + " cache", cause);
    }
  }

  private <T> T read(String json, Class<T> type, String what) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new CacheException("Cached " + what + " is not readable", e);
    }
  }

  private <T> T read(String json, TypeReference<T> type, String what) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new CacheException("Cached " + what + " is not readable", e);
    }
  }

  private String write(Object value, String what) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new CacheException("Could not serialize " + what + " for cache", e);
    }
  }
}

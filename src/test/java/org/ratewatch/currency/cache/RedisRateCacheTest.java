package org.ratewatch.currency.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ReactiveHashOperations;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;

import com.fasterxml.jackson.databind.ObjectMapper;

import reactor.core.publisher.Mono;

import org.ratewatch.currency.config.CurrencyServiceProperties;
import org.ratewatch.currency.domain.CalendarDate;
import org.ratewatch.currency.domain.CurrencyCode;
import org.ratewatch.currency.domain.CurrencyRate;
import org.ratewatch.currency.domain.CurrencyRates;
import org.ratewatch.currency.domain.CurrencyTimelineRate;
import org.ratewatch.currency.domain.CurrencyWithBanStatus;
import org.ratewatch.currency.exception.CacheException;

/**
 * Unit tests for {@link RedisRateCache} with mocked reactive Redis operations.
 *
 * <p>Covers key layout, payload mapping, misses and the failure modes reported as {@link
 * CacheException}.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RedisRateCache Unit Tests")
class RedisRateCacheTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(1);
  private static final CurrencyCode USD = new CurrencyCode("USD");
  private static final CurrencyCode EUR = new CurrencyCode("EUR");
  private static final CalendarDate MARCH_4 = CalendarDate.of(2024, 3, 4);

  @Mock private ReactiveStringRedisTemplate redisTemplate;
  @Mock private ReactiveValueOperations<String, String> valueOperations;
  @Mock private ReactiveHashOperations<String, String, String> hashOperations;

  private final ObjectMapper objectMapper = new ObjectMapper();

  private RedisRateCache rateCache;

  @BeforeEach
  void setUp() {
    lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    lenient().when(redisTemplate.<String, String>opsForHash()).thenReturn(hashOperations);

    rateCache = new RedisRateCache(redisTemplate, objectMapper, new CurrencyServiceProperties());
  }

  // ===========================================================================================
  // Availability list
  // ===========================================================================================

  @Test
  void shouldReportMissingAvailabilityListAsEmpty() {
    when(valueOperations.get("available")).thenReturn(Mono.empty());

    assertThat(rateCache.getAvailableCurrencies(TIMEOUT)).isEmpty();
  }

  @Test
  void shouldReadCachedAvailabilityList() {
    when(valueOperations.get("available"))
        .thenReturn(
            Mono.just(
                "[{\"currency\":\"RUB\",\"banned\":true},"
                    + "{\"currency\":\"USD\",\"banned\":false}]"));

    var currencies = rateCache.getAvailableCurrencies(TIMEOUT);

    assertThat(currencies)
        .contains(
            List.of(
                new CurrencyWithBanStatus(new CurrencyCode("RUB"), true),
                new CurrencyWithBanStatus(USD, false)));
  }

  @Test
  void shouldStoreAvailabilityListWithTtl() {
    var currencies = List.of(new CurrencyWithBanStatus(USD, false));
    when(valueOperations.set(eq("available"), anyString(), eq(Duration.ofHours(24))))
        .thenReturn(Mono.just(true));

    rateCache.setAvailableCurrencies(currencies, TIMEOUT);

    var json = ArgumentCaptor.forClass(String.class);
    verify(valueOperations).set(eq("available"), json.capture(), eq(Duration.ofHours(24)));
    assertThat(json.getValue()).isEqualTo("[{\"currency\":\"USD\",\"banned\":false}]");
  }

  @Test
  void unacknowledgedSetShouldFail() {
    when(valueOperations.set(eq("available"), anyString(), eq(Duration.ofHours(24))))
        .thenReturn(Mono.just(false));

    assertThatThrownBy(
            () ->
                rateCache.setAvailableCurrencies(
                    List.of(new CurrencyWithBanStatus(USD, false)), TIMEOUT))
        .isInstanceOf(CacheException.class);
  }

  @Test
  void shouldDeleteAvailabilityList() {
    when(redisTemplate.delete("available")).thenReturn(Mono.just(1L));

    rateCache.invalidateAvailableCurrencies(TIMEOUT);

    verify(redisTemplate).delete("available");
  }

  @Test
  void deletingAbsentAvailabilityListShouldFail() {
    when(redisTemplate.delete("available")).thenReturn(Mono.just(0L));

    assertThatThrownBy(() -> rateCache.invalidateAvailableCurrencies(TIMEOUT))
        .isInstanceOf(CacheException.class)
        .hasMessageContaining("no available currencies");
  }

  // ===========================================================================================
  // Last rates
  // ===========================================================================================

  @Test
  void shouldProjectTargetFromCachedSnapshot() {
    when(hashOperations.get("rate:collection", "USD"))
        .thenReturn(
            Mono.just(
                "{\"base\":\"USD\",\"rates\":{\"EUR\":0.92,\"GBP\":0.79},"
                    + "\"date\":\"2024-03-04\"}"));

    var rate = rateCache.getLastRate(USD, EUR, TIMEOUT);

    assertThat(rate).contains(new CurrencyRate(USD, EUR, 0.92, MARCH_4));
  }

  @Test
  void snapshotWithoutTargetShouldBeAMiss() {
    when(hashOperations.get("rate:collection", "USD"))
        .thenReturn(
            Mono.just("{\"base\":\"USD\",\"rates\":{\"GBP\":0.79},\"date\":\"2024-03-04\"}"));

    assertThat(rateCache.getLastRate(USD, EUR, TIMEOUT)).isEmpty();
  }

  @Test
  void missingSnapshotShouldBeAMiss() {
    when(hashOperations.get("rate:collection", "USD")).thenReturn(Mono.empty());

    assertThat(rateCache.getLastRate(USD, EUR, TIMEOUT)).isEmpty();
  }

  @Test
  void shouldStoreWholeSnapshotUnderBase() throws Exception {
    var snapshot = new CurrencyRates(USD, Map.of(EUR, 0.92), MARCH_4);
    when(hashOperations.put(eq("rate:collection"), eq("USD"), anyString()))
        .thenReturn(Mono.just(true));

    rateCache.setLastRates(snapshot, TIMEOUT);

    var json = ArgumentCaptor.forClass(String.class);
    verify(hashOperations).put(eq("rate:collection"), eq("USD"), json.capture());
    assertThat(objectMapper.readValue(json.getValue(), CurrencyRates.class)).isEqualTo(snapshot);
  }

  @Test
  void overwritingSnapshotShouldSucceed() {
    when(hashOperations.put(eq("rate:collection"), eq("USD"), anyString()))
        .thenReturn(Mono.just(false));

    rateCache.setLastRates(new CurrencyRates(USD, Map.of(EUR, 0.92), MARCH_4), TIMEOUT);

    verify(hashOperations).put(eq("rate:collection"), eq("USD"), anyString());
  }

  @Test
  void unacknowledgedHashWriteShouldFail() {
    when(hashOperations.put(eq("rate:collection"), eq("USD"), anyString()))
        .thenReturn(Mono.empty());

    assertThatThrownBy(
            () ->
                rateCache.setLastRates(
                    new CurrencyRates(USD, Map.of(EUR, 0.92), MARCH_4), TIMEOUT))
        .isInstanceOf(CacheException.class);
  }

  // ===========================================================================================
  // Timeline rates
  // ===========================================================================================

  @Test
  void shouldStoreAndReadTimelineUnderPairField() {
    var timeline =
        new CurrencyTimelineRate(
            USD,
            EUR,
            Map.of(MARCH_4, 0.92),
            Map.of(MARCH_4.plusDays(1), 0.93),
            MARCH_4,
            MARCH_4);
    when(hashOperations.put(eq("time:collection"), eq("USD:EUR"), anyString()))
        .thenReturn(Mono.just(true));

    rateCache.setTimelineRate(timeline, TIMEOUT);

    var stored = ArgumentCaptor.forClass(String.class);
    verify(hashOperations).put(eq("time:collection"), eq("USD:EUR"), stored.capture());
    when(hashOperations.get("time:collection", "USD:EUR"))
        .thenReturn(Mono.just(stored.getValue()));

    assertThat(rateCache.getTimelineRate(USD, EUR, TIMEOUT)).contains(timeline);
  }

  @Test
  void missingTimelineShouldBeAMiss() {
    when(hashOperations.get("time:collection", "USD:EUR")).thenReturn(Mono.empty());

    assertThat(rateCache.getTimelineRate(USD, EUR, TIMEOUT)).isEmpty();
  }

  // ===========================================================================================
  // Failures
  // ===========================================================================================

  @Test
  void malformedPayloadShouldFail() {
    when(hashOperations.get("time:collection", "USD:EUR")).thenReturn(Mono.just("{not json"));

    assertThatThrownBy(() -> rateCache.getTimelineRate(USD, EUR, TIMEOUT))
        .isInstanceOf(CacheException.class)
        .hasMessageContaining("not readable");
  }

  @Test
  void backendFailureShouldFail() {
    when(valueOperations.get("available"))
        .thenReturn(Mono.error(new RedisConnectionFailureException("Connection refused")));

    assertThatThrownBy(() -> rateCache.getAvailableCurrencies(TIMEOUT))
        .isInstanceOf(CacheException.class)
        .hasCauseInstanceOf(RedisConnectionFailureException.class);
  }

  @Test
  void slowBackendShouldTimeOut() {
    when(hashOperations.get("rate:collection", "USD")).thenReturn(Mono.never());

    assertThatThrownBy(() -> rateCache.getLastRate(USD, EUR, Duration.ofMillis(50)))
        .isInstanceOf(CacheException.class)
        .hasCauseInstanceOf(TimeoutException.class);
  }
}

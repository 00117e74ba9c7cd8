package org.ratewatch.currency.service;

import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import org.ratewatch.currency.cache.RateCache;
import org.ratewatch.currency.config.CurrencyServiceProperties;
import org.ratewatch.currency.domain.CalendarDate;
import org.ratewatch.currency.domain.CurrencyCode;
import org.ratewatch.currency.domain.CurrencyRate;
import org.ratewatch.currency.domain.CurrencyRegistry;
import org.ratewatch.currency.domain.CurrencyTimelineRate;
import org.ratewatch.currency.domain.CurrencyWithBanStatus;
import org.ratewatch.currency.exception.BusinessException;
import org.ratewatch.currency.exception.DependencyException;
import org.ratewatch.currency.exception.InvalidRequestException;
import org.ratewatch.currency.repository.CurrencyBanStore;
import org.ratewatch.currency.service.provider.UpstreamRateProvider;

/**
 * Answers currency queries by combining the rate cache, the ban store and the upstream rate
 * provider.
 *
 * <p>Reads go to the cache first and fall through to the authoritative source on a miss. The
 * result of a fall-through is written back to the cache on a best-effort basis: a failed write is
 * logged and counted, never reported to the caller. Every other failure aborts the request.
 *
 * <p>Request parameters are validated before any I/O.
 */
@Service
public class CurrencyRateService {

  private static final Logger log = LoggerFactory.getLogger(CurrencyRateService.class);

  static final String CACHE_LOOKUPS_METRIC = "currency.cache.lookups";
  static final String CACHE_WRITE_FAILURES_METRIC = "currency.cache.write.failures";

  private final CurrencyRegistry currencyRegistry;
  private final RateCache rateCache;
  private final CurrencyBanStore currencyBanStore;
  private final UpstreamRateProvider upstreamRateProvider;
  private final CurrencyServiceProperties properties;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  public CurrencyRateService(
      CurrencyRegistry currencyRegistry,
      RateCache rateCache,
      CurrencyBanStore currencyBanStore,
      UpstreamRateProvider upstreamRateProvider,
      CurrencyServiceProperties properties,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.currencyRegistry = currencyRegistry;
    this.rateCache = rateCache;
    this.currencyBanStore = currencyBanStore;
    this.upstreamRateProvider = upstreamRateProvider;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  /**
   * List every registry currency with its ban status, banned currencies first and then by code.
   *
   * @return one entry per registry currency
   * @throws DependencyException if the cache or the ban store fails
   */
  public List<CurrencyWithBanStatus> getAvailableCurrencies() {
    var cached = rateCache.getAvailableCurrencies(cacheTimeout());
    if (cached.isPresent()) {
      recordLookup("availability", true);
      return cached.get();
    }
    recordLookup("availability", false);

    var allCodes = currencyRegistry.allCodes();
    var bans = currencyBanStore.listBans(allCodes, databaseTimeout());
    var currencies =
        allCodes.stream()
            .map(code -> new CurrencyWithBanStatus(code, bans.getOrDefault(code, false)))
            .sorted(CurrencyWithBanStatus.BANNED_FIRST)
            .toList();

    writeBack(
        "set-available-currencies",
        () -> rateCache.setAvailableCurrencies(currencies, cacheTimeout()));
    return currencies;
  }

  /**
   * Set the ban flag of a currency and drop the cached availability list.
   *
   * @throws InvalidRequestException if the currency is not in the registry
   * @throws DependencyException if the ban store fails
   */
  public void changeBanStatus(String currency, boolean banned) {
    var code = requireCurrency(currency, "currency");

    currencyBanStore.upsertBan(code, banned, databaseTimeout());
    log.info("Changed ban status currency: {} banned: {}", code, banned);

    writeBack(
        "invalidate-available-currencies",
        () -> rateCache.invalidateAvailableCurrencies(cacheTimeout()));
  }

  /**
   * Get the latest known rate for converting {@code base} into {@code second}.
   *
   * <p>A cached rate is used if its date is set and not after today. Otherwise the snapshot for
   * yesterday is fetched, cached whole and projected to the pair.
   *
   * @throws InvalidRequestException if either currency is not in the registry
   * @throws BusinessException if the provider has no rate for {@code second}
   * @throws DependencyException if the cache or the provider fails
   */
  public CurrencyRate getCurrentRate(String base, String second) {
    var baseCode = requireCurrency(base, "base");
    var secondCode = requireCurrency(second, "second");
    var today = CalendarDate.today(clock);

    var cached = rateCache.getLastRate(baseCode, secondCode, cacheTimeout());
    if (cached.isPresent() && isCurrent(cached.get(), today)) {
      recordLookup("last-rate", true);
      return cached.get();
    }
    recordLookup("last-rate", false);

    var snapshot =
        upstreamRateProvider.fetchSnapshot(baseCode, today.minusDays(1), providerTimeout());
    var rate =
        snapshot
            .rateFor(secondCode)
            .orElseThrow(
                () ->
                    new BusinessException(
                        "No rate available for " + baseCode + "/" + secondCode,
                        CurrencyServiceError.RATE_NOT_FOUND.name()));

    writeBack("set-last-rates", () -> rateCache.setLastRates(snapshot, cacheTimeout()));
    return rate;
  }

  /**
   * Get the daily {@code base}/{@code second} rates between {@code start} and {@code end}, both
   * inclusive, together with any predicted rates.
   *
   * <p>The series is cached per pair and always covers the year ending yesterday; the requested
   * range only selects from it.
   *
   * @throws InvalidRequestException if a currency is not in the registry, a date is not {@code
   *     YYYY-MM-DD} or {@code start} is after {@code end}
   * @throws BusinessException if the provider returned rates but none for {@code second}
   * @throws DependencyException if the cache, the provider or the forecast service fails
   */
  public CurrencyTimelineRate getTimelineRate(
      String base, String second, String start, String end) {
    var baseCode = requireCurrency(base, "base");
    var secondCode = requireCurrency(second, "second");
    var startDate = requireDate(start, "start");
    var endDate = requireDate(end, "end");
    if (startDate.isAfter(endDate)) {
      throw new InvalidRequestException(
          "Start date " + startDate + " is after end date " + endDate,
          CurrencyServiceError.INVALID_DATE_RANGE.name());
    }

    var cached = rateCache.getTimelineRate(baseCode, secondCode, cacheTimeout());
    recordLookup("timeline", cached.isPresent());

    var timeline = cached.orElseGet(() -> loadTimeline(baseCode, secondCode));
    return timeline.between(startDate, endDate);
  }

  private CurrencyTimelineRate loadTimeline(CurrencyCode base, CurrencyCode second) {
    var yesterday = CalendarDate.today(clock).minusDays(1);
    var upstream =
        upstreamRateProvider.fetchTimeline(
            base, second, yesterday.minusYears(1), yesterday, providerTimeout());

    var timeline = upstream.toTimelineRate(second);
    if (timeline.rates().isEmpty() && !upstream.rates().isEmpty()) {
      throw new BusinessException(
          "No rates available for " + base + "/" + second,
          CurrencyServiceError.RATE_NOT_FOUND.name());
    }

    var forecast = properties.getForecast();
    if (forecast.isEnabled() && !timeline.rates().isEmpty()) {
      var predicted = upstreamRateProvider.forecast(timeline.rates(), forecast.getTimeout());
      var predictions = new TreeMap<CalendarDate, Double>();
      for (int i = 0; i < predicted.size(); i++) {
        predictions.put(yesterday.plusDays(i + 1L), predicted.get(i));
      }
      timeline = timeline.withPredictions(predictions);
    }

    var toCache = timeline;
    writeBack("set-timeline-rate", () -> rateCache.setTimelineRate(toCache, cacheTimeout()));
    return timeline;
  }

  private static boolean isCurrent(CurrencyRate rate, CalendarDate today) {
    return rate.date().isSet() && !rate.date().isAfter(today);
  }

  private CurrencyCode requireCurrency(String code, String parameter) {
    if (!currencyRegistry.isValid(code)) {
      throw new InvalidRequestException(
          "Unsupported currency code for " + parameter + ": " + code,
          CurrencyServiceError.INVALID_CURRENCY_CODE.name());
    }
    return new CurrencyCode(code);
  }

  private static CalendarDate requireDate(String date, String parameter) {
    try {
      return CalendarDate.parseStrict(date);
    } catch (DateTimeParseException e) {
      throw new InvalidRequestException(
          "Invalid " + parameter + " date, expected YYYY-MM-DD: " + date,
          CurrencyServiceError.INVALID_DATE.name(),
          e);
    }
  }

  private void writeBack(String operation, Runnable write) {
    var outcome = BestEffort.attempt(operation, write);
    if (!outcome.succeeded()) {
      Counter.builder(CACHE_WRITE_FAILURES_METRIC)
          .tag("operation", operation)
          .register(meterRegistry)
          .increment();
    }
  }

  private void recordLookup(String cache, boolean hit) {
    log.debug("Cache {} for {}", hit ? "hit" : "miss", cache);
    Counter.builder(CACHE_LOOKUPS_METRIC)
        .tag("cache", cache)
        .tag("result", hit ? "hit" : "miss")
        .register(meterRegistry)
        .increment();
  }

  private Duration cacheTimeout() {
    return properties.getCache().getTimeout();
  }

  private Duration databaseTimeout() {
    return properties.getDatabase().getTimeout();
  }

  private Duration providerTimeout() {
    return properties.getRateProvider().getTimeout();
  }
}

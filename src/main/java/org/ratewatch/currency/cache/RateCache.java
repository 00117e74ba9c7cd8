package org.ratewatch.currency.cache;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import org.ratewatch.currency.domain.CurrencyCode;
import org.ratewatch.currency.domain.CurrencyRate;
import org.ratewatch.currency.domain.CurrencyRates;
import org.ratewatch.currency.domain.CurrencyTimelineRate;
import org.ratewatch.currency.domain.CurrencyWithBanStatus;
import org.ratewatch.currency.exception.CacheException;

/**
 * Cache-aside store for derived currency data.
 *
 * <p>Entries are never authoritative: an absent entry is a miss and is reported as {@link
 * Optional#empty()}. Backend failures, timeouts, unreadable payloads and writes the backend reports
 * as having no effect are reported as {@link CacheException}. Every call is bounded by the given
 * timeout.
 */
public interface RateCache {

  Optional<List<CurrencyWithBanStatus>> getAvailableCurrencies(Duration timeout);

  void setAvailableCurrencies(List<CurrencyWithBanStatus> currencies, Duration timeout);

  /** Removes the availability list. Fails if there was no list to remove. */
  void invalidateAvailableCurrencies(Duration timeout);

  /**
   * Looks up the last cached snapshot for {@code base} and projects {@code target} out of it.
   *
   * @return the rate, or empty when no snapshot is cached or the snapshot has no rate for the
   *     target
   */
  Optional<CurrencyRate> getLastRate(CurrencyCode base, CurrencyCode target, Duration timeout);

  /** Stores the whole snapshot under its base currency, replacing any previous one. */
  void setLastRates(CurrencyRates snapshot, Duration timeout);

  Optional<CurrencyTimelineRate> getTimelineRate(
      CurrencyCode base, CurrencyCode second, Duration timeout);

  void setTimelineRate(CurrencyTimelineRate timeline, Duration timeout);
}

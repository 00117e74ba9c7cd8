package org.ratewatch.currency.domain;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Rate snapshot: every target the provider returned for one base currency on one date.
 *
 * <p>Cached as a whole per base so one upstream fetch serves all pairs with that base.
 */
public record CurrencyRates(CurrencyCode base, Map<CurrencyCode, Double> rates, CalendarDate date) {

  public CurrencyRates {
    rates = rates == null ? Map.of() : Collections.unmodifiableSortedMap(new TreeMap<>(rates));
    date = date == null ? CalendarDate.UNSET : date;
  }

  /**
   * Projects a single pair out of the snapshot.
   *
   * @param second the target currency
   * @return the pair rate, or empty when the provider returned no rate for the target
   */
  public Optional<CurrencyRate> rateFor(CurrencyCode second) {
    var rate = rates.get(second);
    if (rate == null) {
      return Optional.empty();
    }
    return Optional.of(new CurrencyRate(base, second, rate, date));
  }
}

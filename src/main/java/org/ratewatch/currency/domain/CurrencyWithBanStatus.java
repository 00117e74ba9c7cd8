package org.ratewatch.currency.domain;

import java.util.Comparator;

/** Availability of one registry currency: banned when an override says so, otherwise not. */
public record CurrencyWithBanStatus(CurrencyCode currency, boolean banned) {

  /** Banned currencies first, then by currency code ascending. */
  public static final Comparator<CurrencyWithBanStatus> BANNED_FIRST =
      (left, right) -> {
        if (left.banned() != right.banned()) {
          return left.banned() ? -1 : 1;
        }
        return left.currency().compareTo(right.currency());
      };
}

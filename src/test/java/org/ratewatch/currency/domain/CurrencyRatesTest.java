package org.ratewatch.currency.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.Test;

class CurrencyRatesTest {

  private static final CurrencyCode USD = new CurrencyCode("USD");
  private static final CurrencyCode EUR = new CurrencyCode("EUR");

  @Test
  void shouldProjectTargetWithSnapshotDate() {
    var snapshot = new CurrencyRates(USD, Map.of(EUR, 0.92), CalendarDate.of(2024, 3, 4));

    var rate = snapshot.rateFor(EUR);

    assertThat(rate).contains(new CurrencyRate(USD, EUR, 0.92, CalendarDate.of(2024, 3, 4)));
  }

  @Test
  void missingTargetShouldNotBecomeZeroRate() {
    var snapshot = new CurrencyRates(USD, Map.of(EUR, 0.92), CalendarDate.of(2024, 3, 4));

    assertThat(snapshot.rateFor(new CurrencyCode("XAG"))).isEmpty();
  }

  @Test
  void nullRatesAndDateShouldBeNormalized() {
    var snapshot = new CurrencyRates(USD, null, null);

    assertThat(snapshot.rates()).isEmpty();
    assertThat(snapshot.date()).isSameAs(CalendarDate.UNSET);
  }
}

package org.ratewatch.currency.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

class CurrencyRegistryTest {

  private final CurrencyRegistry registry = CurrencyRegistry.withSupportedCodes();

  @Test
  void shouldAcceptSupportedCodes() {
    assertThat(registry.isValid("USD")).isTrue();
    assertThat(registry.isValid("EUR")).isTrue();
    assertThat(registry.isValid(new CurrencyCode("THB"))).isTrue();
  }

  @Test
  void shouldRejectUnknownCodes() {
    assertThat(registry.isValid("XXX")).isFalse();
    assertThat(registry.isValid("usd")).isFalse();
    assertThat(registry.isValid("")).isFalse();
    assertThat(registry.isValid((String) null)).isFalse();
    assertThat(registry.isValid((CurrencyCode) null)).isFalse();
  }

  @Test
  void shouldListAllCodesInOrder() {
    var codes = registry.allCodes();

    assertThat(codes).hasSize(CurrencyRegistry.SUPPORTED_CODES.size());
    assertThat(List.copyOf(codes)).isSortedAccordingTo(CurrencyCode::compareTo);
    assertThatThrownBy(() -> codes.add(new CurrencyCode("ABC")))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void shouldOnlyKnowCodesItWasBuiltWith() {
    var custom = new CurrencyRegistry(List.of("USD", "EUR"));

    assertThat(custom.isValid("USD")).isTrue();
    assertThat(custom.isValid("GBP")).isFalse();
    assertThat(custom.allCodes()).containsExactly(new CurrencyCode("EUR"), new CurrencyCode("USD"));
  }

  @Test
  void shouldRejectBlankCodes() {
    assertThatThrownBy(() -> new CurrencyRegistry(List.of("USD", " ")))
        .isInstanceOf(IllegalArgumentException.class);
  }
}

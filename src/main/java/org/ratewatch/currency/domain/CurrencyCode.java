package org.ratewatch.currency.domain;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Currency identifier such as {@code USD}.
 *
 * <p>Any text can be wrapped; whether a code is supported is decided by {@link CurrencyRegistry}.
 * Serializes to a bare JSON string so it can be used both as a field value and as a map key.
 */
public record CurrencyCode(String value) implements Comparable<CurrencyCode> {

  public CurrencyCode {
    Objects.requireNonNull(value, "value");
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static CurrencyCode of(String value) {
    return new CurrencyCode(value == null ? "" : value);
  }

  @Override
  public int compareTo(CurrencyCode other) {
    return value.compareTo(other.value);
  }

  @JsonValue
  @Override
  public String toString() {
    return value;
  }
}

package org.ratewatch.currency.domain;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.KeyDeserializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

/**
 * Calendar date used for rate snapshots, series keys and request ranges.
 *
 * <p>Stored as an epoch-day number, so ordering, equality and hashing are those of the date alone
 * and instances are safe as map keys. The canonical text form is {@code YYYY-MM-DD}; parsing also
 * accepts an RFC 3339 timestamp and keeps only its date part.
 *
 * <p>{@link #UNSET} stands for "no date". It formats as {@code null} and is what a JSON {@code
 * null} deserializes to.
 */
@JsonSerialize(using = CalendarDate.Serializer.class, keyUsing = CalendarDate.KeySerializer.class)
@JsonDeserialize(
    using = CalendarDate.Deserializer.class,
    keyUsing = CalendarDate.KeyParser.class)
public final class CalendarDate implements Comparable<CalendarDate> {

  /** Text emitted for, and accepted as, the unset date. */
  public static final String NULL_TOKEN = "null";

  public static final CalendarDate UNSET = new CalendarDate(Long.MIN_VALUE);

  private final long epochDay;

  private CalendarDate(long epochDay) {
    this.epochDay = epochDay;
  }

  public static CalendarDate of(LocalDate date) {
    return new CalendarDate(date.toEpochDay());
  }

  public static CalendarDate of(int year, int month, int dayOfMonth) {
    return of(LocalDate.of(year, month, dayOfMonth));
  }

  public static CalendarDate today(Clock clock) {
    return of(LocalDate.now(clock));
  }

  /**
   * Parses {@code YYYY-MM-DD}, falling back to an RFC 3339 timestamp.
   *
   * @param text the text to parse
   * @return the parsed date, or {@link #UNSET} for {@code "null"}
   * @throws DateTimeParseException if the text is in neither format
   */
  public static CalendarDate parse(String text) {
    if (NULL_TOKEN.equals(text)) {
      return UNSET;
    }

    try {
      return parseStrict(text);
    } catch (DateTimeParseException e) {
      try {
        return of(OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toLocalDate());
      } catch (DateTimeParseException timestampFailure) {
        e.addSuppressed(timestampFailure);
        throw e;
      }
    }
  }

  /**
   * Parses the canonical {@code YYYY-MM-DD} form only.
   *
   * @param text the text to parse
   * @return the parsed date
   * @throws DateTimeParseException if the text is not a canonical date
   */
  public static CalendarDate parseStrict(String text) {
    if (text == null) {
      throw new DateTimeParseException("Date text is missing", "", 0);
    }
    return of(LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE));
  }

  public boolean isSet() {
    return epochDay != Long.MIN_VALUE;
  }

  public LocalDate toLocalDate() {
    if (!isSet()) {
      throw new IllegalStateException("Date is unset");
    }
    return LocalDate.ofEpochDay(epochDay);
  }

  public CalendarDate plusDays(long days) {
    return of(toLocalDate().plusDays(days));
  }

  public CalendarDate minusDays(long days) {
    return of(toLocalDate().minusDays(days));
  }

  public CalendarDate minusYears(long years) {
    return of(toLocalDate().minusYears(years));
  }

  public boolean isBefore(CalendarDate other) {
    return epochDay < other.epochDay;
  }

  public boolean isAfter(CalendarDate other) {
    return epochDay > other.epochDay;
  }

  public String format() {
    return isSet() ? toLocalDate().format(DateTimeFormatter.ISO_LOCAL_DATE) : NULL_TOKEN;
  }

  @Override
  public int compareTo(CalendarDate other) {
    return Long.compare(epochDay, other.epochDay);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof CalendarDate other && epochDay == other.epochDay;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(epochDay);
  }

  @Override
  public String toString() {
    return format();
  }

  public static class Serializer extends StdSerializer<CalendarDate> {

    public Serializer() {
      super(CalendarDate.class);
    }

    @Override
    public void serialize(CalendarDate value, JsonGenerator gen, SerializerProvider provider)
        throws IOException {
      if (value.isSet()) {
        gen.writeString(value.format());
      } else {
        gen.writeNull();
      }
    }
  }

  public static class KeySerializer extends StdSerializer<CalendarDate> {

    public KeySerializer() {
      super(CalendarDate.class);
    }

    @Override
    public void serialize(CalendarDate value, JsonGenerator gen, SerializerProvider provider)
        throws IOException {
      gen.writeFieldName(value.format());
    }
  }

  public static class Deserializer extends StdDeserializer<CalendarDate> {

    public Deserializer() {
      super(CalendarDate.class);
    }

    @Override
    public CalendarDate deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
      var text = p.getValueAsString();
      try {
        return parse(text);
      } catch (DateTimeParseException e) {
        throw ctxt.weirdStringException(text, CalendarDate.class, e.getMessage());
      }
    }

    @Override
    public CalendarDate getNullValue(DeserializationContext ctxt) {
      return UNSET;
    }
  }

  public static class KeyParser extends KeyDeserializer {

    @Override
    public Object deserializeKey(String key, DeserializationContext ctxt) throws IOException {
      try {
        return parse(key);
      } catch (DateTimeParseException e) {
        return ctxt.handleWeirdKey(CalendarDate.class, key, e.getMessage());
      }
    }
  }
}

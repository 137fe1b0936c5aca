// This file is part of Timber.
// Copyright (C) 2026  The Timber Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.timber.data;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Calendar;
import java.util.Date;

import com.google.common.base.Strings;

/**
 * Converts the time values callers hand us into {@link TimeStamp}s and back.
 * <p>
 * Accepted inputs for {@link #encode(Object)}:
 * <ul>
 * <li>{@code null}: no bound, returned as null.</li>
 * <li>An existing {@link TimeStamp}, returned as is.</li>
 * <li>Calendar strings: {@code yyyy-MM-dd HH:mm:ss[.fffffffff]}, the
 * {@code T} separator or a bare {@code yyyy-MM-dd}, read in the codec's zone.
 * </li>
 * <li>{@link LocalDateTime} (codec zone), {@link ZonedDateTime},
 * {@link OffsetDateTime}, {@link Instant}, {@link Date} (including
 * {@code java.sql.Timestamp} nanos) and {@link Calendar}.</li>
 * <li>Numbers as fractional Unix epoch seconds. {@link BigDecimal} values are
 * split exactly, doubles are rounded to the nearest nanosecond.</li>
 * </ul>
 *
 * @since 1.0
 */
public class TimestampCodec {

  /** Matches what the logging service prints, with optional fraction. */
  private static final DateTimeFormatter CALENDAR_FORMAT =
      new DateTimeFormatterBuilder()
        .appendPattern("uuuu-MM-dd")
        .optionalStart().appendLiteral(' ').optionalEnd()
        .optionalStart().appendLiteral('T').optionalEnd()
        .appendPattern("HH:mm:ss")
        .optionalStart()
          .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
        .optionalEnd()
        .toFormatter();

  private static final BigDecimal NANOS_PER_SECOND = BigDecimal.valueOf(1000000000L);

  /** The zone used for calendar input and output. */
  private final ZoneId zone;

  /** Ctor using the system default zone. */
  public TimestampCodec() {
    this(ZoneId.systemDefault());
  }

  /**
   * Default ctor.
   * @param zone A non-null zone used to read and render calendar values.
   * @throws IllegalArgumentException if the zone was null.
   */
  public TimestampCodec(final ZoneId zone) {
    if (zone == null) {
      throw new IllegalArgumentException("Zone cannot be null.");
    }
    this.zone = zone;
  }

  /** @return The zone used for calendar values. */
  public ZoneId zone() {
    return zone;
  }

  /**
   * Converts a caller supplied value into a canonical timestamp.
   * @param value The value to convert, may be null.
   * @return Null if the value was null, a timestamp otherwise.
   * @throws IllegalArgumentException if the value could not be parsed or its
   * type is not supported.
   */
  public TimeStamp encode(final Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof TimeStamp) {
      return (TimeStamp) value;
    }
    if (value instanceof String) {
      return parse((String) value);
    }
    if (value instanceof Number) {
      return fromEpochSeconds((Number) value);
    }
    if (value instanceof Instant) {
      return NanoTimeStamp.fromInstant((Instant) value);
    }
    if (value instanceof LocalDateTime) {
      return NanoTimeStamp.fromInstant(
          ((LocalDateTime) value).atZone(zone).toInstant());
    }
    if (value instanceof ZonedDateTime) {
      return NanoTimeStamp.fromInstant(((ZonedDateTime) value).toInstant());
    }
    if (value instanceof OffsetDateTime) {
      return NanoTimeStamp.fromInstant(((OffsetDateTime) value).toInstant());
    }
    if (value instanceof Date) {
      // java.sql.Timestamp overrides this to keep the nanos.
      return NanoTimeStamp.fromInstant(((Date) value).toInstant());
    }
    if (value instanceof Calendar) {
      return NanoTimeStamp.fromInstant(((Calendar) value).toInstant());
    }
    throw new IllegalArgumentException("Unsupported time value of type "
        + value.getClass().getName() + ": " + value);
  }

  /**
   * Renders the timestamp in the requested form.
   * @param timestamp The timestamp, may be null.
   * @param as_numeric Whether to return fractional epoch seconds or a
   * calendar value.
   * @return Null if the timestamp was null, a {@link Double} when
   * {@code as_numeric} is true, a {@link ZonedDateTime} in the codec's zone
   * otherwise.
   */
  public Object decode(final TimeStamp timestamp, final boolean as_numeric) {
    if (timestamp == null) {
      return null;
    }
    return as_numeric ? (Object) toEpochSeconds(timestamp) : toDateTime(timestamp);
  }

  /**
   * @param timestamp The timestamp, may be null.
   * @return Null if the timestamp was null, the fractional epoch seconds
   * otherwise.
   */
  public Double toEpochSeconds(final TimeStamp timestamp) {
    if (timestamp == null) {
      return null;
    }
    return timestamp.epochSeconds();
  }

  /**
   * @param timestamp The timestamp, may be null.
   * @return Null if the timestamp was null, the calendar value in the codec's
   * zone otherwise.
   */
  public ZonedDateTime toDateTime(final TimeStamp timestamp) {
    if (timestamp == null) {
      return null;
    }
    return timestamp.toInstant().atZone(zone);
  }

  private TimeStamp parse(final String value) {
    final String trimmed = value.trim();
    if (Strings.isNullOrEmpty(trimmed)) {
      throw new IllegalArgumentException("Time string cannot be empty.");
    }
    try {
      if (trimmed.length() == 10) {
        return NanoTimeStamp.fromInstant(
            LocalDate.parse(trimmed).atStartOfDay(zone).toInstant());
      }
      return NanoTimeStamp.fromInstant(LocalDateTime.parse(trimmed, CALENDAR_FORMAT)
          .atZone(zone).toInstant());
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid time string: " + value
          + ". Expected yyyy-MM-dd HH:mm:ss[.fffffffff]", e);
    }
  }

  private static TimeStamp fromEpochSeconds(final Number value) {
    if (value instanceof BigDecimal) {
      final BigDecimal seconds = ((BigDecimal) value).setScale(0, RoundingMode.FLOOR);
      final BigDecimal nanos = ((BigDecimal) value).subtract(seconds)
          .multiply(NANOS_PER_SECOND)
          .setScale(0, RoundingMode.HALF_UP);
      return new NanoTimeStamp(seconds.longValueExact(), nanos.longValueExact());
    }
    if (value instanceof Long || value instanceof Integer
        || value instanceof Short || value instanceof Byte) {
      return new NanoTimeStamp(value.longValue(), 0);
    }
    if (value instanceof BigInteger) {
      return new NanoTimeStamp(((BigInteger) value).longValueExact(), 0);
    }
    final double seconds = value.doubleValue();
    if (!Double.isFinite(seconds)) {
      throw new IllegalArgumentException("Epoch seconds must be finite: " + value);
    }
    final double whole = Math.floor(seconds);
    return new NanoTimeStamp((long) whole, Math.round((seconds - whole) * 1.0e9));
  }
}

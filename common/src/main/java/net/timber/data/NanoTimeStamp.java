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

import java.time.Instant;

/**
 * An immutable timestamp with nanosecond precision. The nano offset is
 * normalized on construction so that negative or overflowing values are
 * carried into the epoch seconds, e.g. {@code (10, -1)} becomes
 * {@code (9, 999999999)}.
 *
 * @since 1.0
 */
public final class NanoTimeStamp implements TimeStamp {
  private static final long NANOS_PER_SECOND = 1000000000L;

  /** The Unix epoch in seconds. */
  private final long epoch;

  /** The offset in nanoseconds, always in [0, 999999999]. */
  private final long nanos;

  /**
   * Default ctor.
   * @param epoch The Unix epoch time in seconds.
   * @param nanos The nanosecond offset. May be negative or larger than a
   * second, it's normalized.
   */
  public NanoTimeStamp(final long epoch, final long nanos) {
    this.epoch = Math.addExact(epoch, Math.floorDiv(nanos, NANOS_PER_SECOND));
    this.nanos = Math.floorMod(nanos, NANOS_PER_SECOND);
  }

  /**
   * @param instant A non-null instant to copy.
   * @return A timestamp at the same instant.
   * @throws IllegalArgumentException if the instant was null.
   */
  public static NanoTimeStamp fromInstant(final Instant instant) {
    if (instant == null) {
      throw new IllegalArgumentException("Instant cannot be null.");
    }
    return new NanoTimeStamp(instant.getEpochSecond(), instant.getNano());
  }

  /**
   * @param epoch_millis A Unix epoch timestamp in milliseconds.
   * @return A timestamp at the given millisecond.
   */
  public static NanoTimeStamp fromMsEpoch(final long epoch_millis) {
    return new NanoTimeStamp(Math.floorDiv(epoch_millis, 1000L),
        Math.floorMod(epoch_millis, 1000L) * 1000000L);
  }

  @Override
  public long nanos() {
    return nanos;
  }

  @Override
  public long msEpoch() {
    return (epoch * 1000L) + (nanos / 1000000L);
  }

  @Override
  public long epoch() {
    return epoch;
  }

  @Override
  public double epochSeconds() {
    return epoch + (nanos / 1.0e9);
  }

  @Override
  public Instant toInstant() {
    return Instant.ofEpochSecond(epoch, nanos);
  }

  @Override
  public boolean compare(final Op comparator,
                         final TimeStamp compareTo) {
    if (compareTo == null) {
      throw new IllegalArgumentException("Timestamp cannot be null.");
    }
    if (comparator == null) {
      throw new IllegalArgumentException("Comparator cannot be null.");
    }

    switch (comparator) {
    case LT:
      if (epoch == compareTo.epoch()) {
        return nanos < compareTo.nanos();
      }
      return epoch < compareTo.epoch();
    case LTE:
      if (epoch == compareTo.epoch()) {
        return nanos <= compareTo.nanos();
      }
      return epoch < compareTo.epoch();
    case GT:
      if (epoch == compareTo.epoch()) {
        return nanos > compareTo.nanos();
      }
      return epoch > compareTo.epoch();
    case GTE:
      if (epoch == compareTo.epoch()) {
        return nanos >= compareTo.nanos();
      }
      return epoch > compareTo.epoch();
    case EQ:
      return epoch == compareTo.epoch() &&
             nanos == compareTo.nanos();
    case NE:
      return epoch != compareTo.epoch() ||
             nanos != compareTo.nanos();
    default:
      throw new UnsupportedOperationException("Unknown comparator: " + comparator);
    }
  }

  @Override
  public boolean equals(final Object o) {
    if (o == null) {
      return false;
    }
    if (o == this) {
      return true;
    }
    if (!(o instanceof TimeStamp)) {
      return false;
    }
    return compare(Op.EQ, (TimeStamp) o);
  }

  @Override
  public int hashCode() {
    return Long.hashCode(epoch) * 31 + Long.hashCode(nanos);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("timestamp=")
        .append(epoch)
        .append(".")
        .append(String.format("%09d", nanos))
        .append(", utc=")
        .append(toInstant())
        .toString();
  }
}

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
import java.util.Comparator;

/**
 * The canonical instant used throughout the client. A timestamp is a whole
 * number of seconds since the Unix epoch plus a nanosecond offset in the
 * range [0, 999999999] so that the sub-second component of values logged by
 * the remote service is never folded into a lossy double.
 * <p>
 * Implementations are immutable.
 *
 * @since 1.0
 */
public interface TimeStamp {

  /** A singleton instance of the TimeStampComparator. */
  public static TimeStampComparator COMPARATOR = new TimeStampComparator();

  /** Comparator used when evaluating TimeStamp order. */
  public enum Op {
    /** Less Than */
    LT,

    /** Less Than 0r Equal To */
    LTE,

    /** Greater Than */
    GT,

    /** Greater Than or Equal To */
    GTE,

    /** Equal To */
    EQ,

    /** Not Equal To */
    NE
  }

  /** @return The nanosecond offset past {@link #epoch()}, from 0 to 999999999. */
  public long nanos();

  /**
   * Returns the timestamp in the Unix epoch format with millisecond resolution.
   * @return A Unix epoch timestamp in milliseconds.
   */
  public long msEpoch();

  /**
   * Returns the timestamp in Unix epoch format with second resolution.
   * @return A Unix epoch timestamp in seconds.
   */
  public long epoch();

  /**
   * Returns the timestamp as fractional Unix epoch seconds. Precision is
   * limited to what a double can hold, roughly a microsecond for current
   * dates, so use {@link #epoch()} and {@link #nanos()} when exact values
   * are required.
   * @return The fractional Unix epoch seconds.
   */
  public double epochSeconds();

  /** @return The timestamp as a {@link java.time.Instant}. */
  public Instant toInstant();

  /**
   * Compares this timestamp to the given timestamp using the proper comparator.
   * @param comparator A comparison operator.
   * @param compareTo The timestamp to compare this against.
   * @return True if the comparison was successful, false if not.
   * @throws IllegalArgumentException if either argument was null.
   * @throws UnsupportedOperationException if the comparator was not supported.
   */
  public boolean compare(final Op comparator,
      final TimeStamp compareTo);

  /**
   * A comparator to evaluate timestamp ordering. Accepts nulls.
   */
  public static class TimeStampComparator implements Comparator<TimeStamp> {

    @Override
    public int compare(final TimeStamp v1, final TimeStamp v2) {
      if (v1 == null && v2 == null) {
        return 0;
      }
      if (v1 != null && v2 == null) {
        return -1;
      }
      if (v1 == null && v2 != null) {
        return 1;
      }
      if (v1 == v2) {
        return 0;
      }
      if (v1.compare(Op.EQ, v2)) {
        return 0;
      }
      return v1.compare(Op.LT, v2) ? -1 : 1;
    }

  }
}

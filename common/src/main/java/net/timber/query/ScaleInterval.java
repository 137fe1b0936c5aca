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
package net.timber.query;

import java.time.temporal.ChronoUnit;

/**
 * The unit of a fixed scaling interval.
 * @since 1.0
 */
public enum ScaleInterval {
  SECOND(ChronoUnit.SECONDS),
  MINUTE(ChronoUnit.MINUTES),
  HOUR(ChronoUnit.HOURS),
  DAY(ChronoUnit.DAYS),
  WEEK(ChronoUnit.WEEKS),
  MONTH(ChronoUnit.MONTHS),
  YEAR(ChronoUnit.YEARS);

  /** The calendar unit this interval maps to. */
  private final ChronoUnit unit;

  ScaleInterval(final ChronoUnit unit) {
    this.unit = unit;
  }

  /** @return The calendar unit this interval maps to. */
  public ChronoUnit chronoUnit() {
    return unit;
  }

  /**
   * Get an instance of this enumeration from a user supplied name.
   * @param name The name of an interval unit, case insensitive.
   * @return an instance of {@link ScaleInterval}, or {@code null} if the name
   * does not match any instance.
   */
  public static ScaleInterval fromString(final String name) {
    if (name == null) {
      return null;
    }
    for (final ScaleInterval interval : ScaleInterval.values()) {
      if (interval.name().equalsIgnoreCase(name.trim())) {
        return interval;
      }
    }
    return null;
  }
}

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
package net.timber.fill;

import net.timber.data.TimeStamp;

/**
 * Which bound of a beam mode occurrence to select.
 *
 * @since 1.0
 */
public enum ModeTimeField {
  START_TIME("startTime"),
  END_TIME("endTime");

  /** The field name used in serialized fills. */
  private final String field_name;

  ModeTimeField(final String field_name) {
    this.field_name = field_name;
  }

  /** @return The field name used in serialized fills. */
  public String fieldName() {
    return field_name;
  }

  /**
   * @param interval A non-null mode occurrence.
   * @return The selected bound, may be null for a running mode's end.
   */
  public TimeStamp select(final BeamModeInterval interval) {
    return this == START_TIME ? interval.getStartTime() : interval.getEndTime();
  }

  /**
   * @param name Either the enum name or the field name, e.g. {@code startTime}.
   * @return The field or null if the name is unknown.
   */
  public static ModeTimeField fromString(final String name) {
    if (name == null) {
      return null;
    }
    final String trimmed = name.trim();
    for (final ModeTimeField field : values()) {
      if (field.name().equalsIgnoreCase(trimmed)
          || field.field_name.equalsIgnoreCase(trimmed)) {
        return field;
      }
    }
    return null;
  }
}

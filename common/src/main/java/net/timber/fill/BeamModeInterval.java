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

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Strings;

import net.timber.data.TimeStamp;
import net.timber.data.TimestampCodec;

/**
 * One occurrence of a beam mode within a fill.
 *
 * @since 1.0
 */
public final class BeamModeInterval {

  /** The mode name as reported by the service. */
  private final String mode;

  /** When the mode started. */
  private final TimeStamp start_time;

  /** When the mode ended, null while it's still active. */
  private final TimeStamp end_time;

  /**
   * Default ctor.
   * @param mode A non-null and non-empty mode name.
   * @param start_time The start of the mode.
   * @param end_time The end of the mode, may be null.
   * @throws IllegalArgumentException if the mode was null or empty.
   */
  @JsonCreator
  public BeamModeInterval(final @JsonProperty("mode") String mode,
                          final @JsonProperty("startTime") TimeStamp start_time,
                          final @JsonProperty("endTime") TimeStamp end_time) {
    if (Strings.isNullOrEmpty(mode)) {
      throw new IllegalArgumentException("Mode cannot be null or empty.");
    }
    this.mode = mode;
    this.start_time = start_time;
    this.end_time = end_time;
  }

  /** @return The mode name. */
  @JsonProperty("mode")
  public String getMode() {
    return mode;
  }

  /** @return When the mode started. */
  @JsonProperty("startTime")
  public TimeStamp getStartTime() {
    return start_time;
  }

  /** @return When the mode ended, may be null. */
  @JsonProperty("endTime")
  public TimeStamp getEndTime() {
    return end_time;
  }

  /**
   * @param codec A non-null codec.
   * @param unixtime Whether to render as epoch seconds.
   * @return The start rendered by the codec.
   */
  public Object decodedStartTime(final TimestampCodec codec,
                                 final boolean unixtime) {
    return codec.decode(start_time, unixtime);
  }

  /**
   * @param codec A non-null codec.
   * @param unixtime Whether to render as epoch seconds.
   * @return The end rendered by the codec, null if the mode is still running.
   */
  public Object decodedEndTime(final TimestampCodec codec,
                               final boolean unixtime) {
    return codec.decode(end_time, unixtime);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BeamModeInterval)) {
      return false;
    }
    final BeamModeInterval other = (BeamModeInterval) o;
    return mode.equals(other.mode)
        && Objects.equals(start_time, other.start_time)
        && Objects.equals(end_time, other.end_time);
  }

  @Override
  public int hashCode() {
    return Objects.hash(mode, start_time, end_time);
  }

  @Override
  public String toString() {
    return mode + "[" + start_time + " -> " + end_time + "]";
  }
}

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

import net.timber.data.TimeStamp;

/**
 * The span between two beam mode occurrences of the same fill.
 *
 * @since 1.0
 */
public final class FillInterval {

  private final int fill_number;
  private final TimeStamp start_time;
  private final TimeStamp end_time;

  /**
   * Default ctor.
   * @param fill_number The fill number.
   * @param start_time The selected bound of the first mode.
   * @param end_time The selected bound of the second mode, null while that
   * mode is still running.
   */
  @JsonCreator
  public FillInterval(final @JsonProperty("fillNumber") int fill_number,
                      final @JsonProperty("startTime") TimeStamp start_time,
                      final @JsonProperty("endTime") TimeStamp end_time) {
    this.fill_number = fill_number;
    this.start_time = start_time;
    this.end_time = end_time;
  }

  @JsonProperty("fillNumber")
  public int getFillNumber() {
    return fill_number;
  }

  @JsonProperty("startTime")
  public TimeStamp getStartTime() {
    return start_time;
  }

  @JsonProperty("endTime")
  public TimeStamp getEndTime() {
    return end_time;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FillInterval)) {
      return false;
    }
    final FillInterval other = (FillInterval) o;
    return fill_number == other.fill_number
        && Objects.equals(start_time, other.start_time)
        && Objects.equals(end_time, other.end_time);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fill_number, start_time, end_time);
  }

  @Override
  public String toString() {
    return "FillInterval{fill=" + fill_number + ", start=" + start_time
        + ", end=" + end_time + "}";
  }
}

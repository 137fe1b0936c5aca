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

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import net.timber.data.TimeStamp;
import net.timber.data.TimestampCodec;

/**
 * An accelerator fill with the beam modes it went through, in time order.
 * A mode may occur more than once in the same fill.
 *
 * @since 1.0
 */
public final class Fill {

  /** The fill number. */
  private final int fill_number;

  /** When the fill started. */
  private final TimeStamp start_time;

  /** When the fill ended, null for the running fill. */
  private final TimeStamp end_time;

  /** The modes in time order. */
  private final List<BeamModeInterval> beam_modes;

  /**
   * Default ctor.
   * @param fill_number The fill number.
   * @param start_time The start of the fill.
   * @param end_time The end of the fill, may be null.
   * @param beam_modes The modes in time order, may be null or empty.
   */
  @JsonCreator
  public Fill(final @JsonProperty("fillNumber") int fill_number,
              final @JsonProperty("startTime") TimeStamp start_time,
              final @JsonProperty("endTime") TimeStamp end_time,
              final @JsonProperty("beamModes") List<BeamModeInterval> beam_modes) {
    this.fill_number = fill_number;
    this.start_time = start_time;
    this.end_time = end_time;
    this.beam_modes = beam_modes == null ?
        ImmutableList.<BeamModeInterval>of() : ImmutableList.copyOf(beam_modes);
  }

  /** @return The fill number. */
  @JsonProperty("fillNumber")
  public int getFillNumber() {
    return fill_number;
  }

  /** @return When the fill started. */
  @JsonProperty("startTime")
  public TimeStamp getStartTime() {
    return start_time;
  }

  /** @return When the fill ended, may be null. */
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
   * @return The end rendered by the codec, null if the fill is still running.
   */
  public Object decodedEndTime(final TimestampCodec codec,
                               final boolean unixtime) {
    return codec.decode(end_time, unixtime);
  }

  /** @return The modes in time order, possibly empty. */
  @JsonProperty("beamModes")
  public List<BeamModeInterval> getBeamModes() {
    return beam_modes;
  }

  /**
   * @param mode A mode name.
   * @return True if the mode occurred at least once during the fill.
   */
  public boolean hasBeamMode(final String mode) {
    for (final BeamModeInterval interval : beam_modes) {
      if (interval.getMode().equals(mode)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("fillNumber", fill_number)
        .add("startTime", start_time)
        .add("endTime", end_time)
        .add("beamModes", beam_modes)
        .toString();
  }
}

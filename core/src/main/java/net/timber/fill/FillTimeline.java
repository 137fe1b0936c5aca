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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Splitter;

import net.timber.data.TimeStamp;
import net.timber.exceptions.InvalidQueryException;
import net.timber.storage.FillService;

/**
 * Queries over accelerator fills and the beam modes they went through.
 *
 * @since 1.0
 */
public class FillTimeline {
  private static final Logger LOG = LoggerFactory.getLogger(FillTimeline.class);

  private final FillService fill_service;

  /**
   * Default ctor.
   * @param fill_service A non-null fill service.
   * @throws IllegalArgumentException if the service was null.
   */
  public FillTimeline(final FillService fill_service) {
    if (fill_service == null) {
      throw new IllegalArgumentException("Fill service cannot be null.");
    }
    this.fill_service = fill_service;
  }

  /**
   * @param fill_number A fill number, or null for the last completed fill.
   * @return The fill or null if the service has none.
   */
  public Fill getLHCFillData(final Integer fill_number) {
    final Fill fill = fill_number == null ?
        fill_service.getLastCompletedFill() :
        fill_service.getFill(fill_number);
    if (fill == null) {
      LOG.warn("No fill found for " + (fill_number == null ?
          "the last completed fill" : "fill number " + fill_number));
    }
    return fill;
  }

  /**
   * @param start The non-null start of the window.
   * @param end The non-null end of the window.
   * @return Every fill overlapping the window.
   */
  public List<Fill> getLHCFillsByTime(final TimeStamp start,
                                      final TimeStamp end) {
    checkWindow(start, end);
    return fill_service.getFillsInTimeWindow(start, end);
  }

  /**
   * @param start The non-null start of the window.
   * @param end The non-null end of the window.
   * @param beam_modes A comma separated list of modes, null for no filter.
   * @return The fills overlapping the window holding at least one of the
   * modes.
   * @throws InvalidQueryException if none of the modes is known.
   */
  public List<Fill> getLHCFillsByTime(final TimeStamp start,
                                      final TimeStamp end,
                                      final String beam_modes) {
    if (beam_modes == null) {
      return getLHCFillsByTime(start, end);
    }
    return getLHCFillsByTime(start, end,
        Splitter.on(',').trimResults().splitToList(beam_modes));
  }

  /**
   * @param start The non-null start of the window.
   * @param end The non-null end of the window.
   * @param beam_modes Mode names, null for no filter. Unknown names are
   * dropped with a warning.
   * @return The fills overlapping the window holding at least one of the
   * modes.
   * @throws InvalidQueryException if none of the modes is known.
   */
  public List<Fill> getLHCFillsByTime(final TimeStamp start,
                                      final TimeStamp end,
                                      final Collection<String> beam_modes) {
    if (beam_modes == null) {
      return getLHCFillsByTime(start, end);
    }
    checkWindow(start, end);
    final Set<BeamMode> modes = EnumSet.noneOf(BeamMode.class);
    for (final String name : beam_modes) {
      final BeamMode mode = BeamMode.fromString(name);
      if (mode == null) {
        LOG.warn(name + " is not a valid beam mode");
      } else {
        modes.add(mode);
      }
    }
    if (modes.isEmpty()) {
      throw new InvalidQueryException("No valid beam modes found in "
          + beam_modes + ", must be in " + Arrays.toString(BeamMode.values()));
    }
    return fill_service.getFillsInTimeWindowContainingBeamModes(start, end,
        modes);
  }

  /**
   * Intervals from the start of the first occurrence of {@code mode1} to the
   * end of the last occurrence of {@code mode2}, per fill.
   * @see #getIntervalsByLHCModes(TimeStamp, TimeStamp, String, String,
   * ModeTimeField, ModeTimeField, int, int)
   */
  public List<FillInterval> getIntervalsByLHCModes(final TimeStamp start,
                                                   final TimeStamp end,
                                                   final String mode1,
                                                   final String mode2) {
    return getIntervalsByLHCModes(start, end, mode1, mode2,
        ModeTimeField.START_TIME, ModeTimeField.END_TIME, 0, -1);
  }

  /**
   * For every fill in the window that went through both modes, selects one
   * occurrence of each and emits the chosen bounds.
   * @param start The non-null start of the window.
   * @param end The non-null end of the window.
   * @param mode1 The first mode.
   * @param mode2 The second mode.
   * @param mode1_field The bound of the selected {@code mode1} occurrence.
   * @param mode2_field The bound of the selected {@code mode2} occurrence.
   * @param mode1_index The {@code mode1} occurrence, negative values count
   * from the last one.
   * @param mode2_index The {@code mode2} occurrence, negative values count
   * from the last one.
   * @return The intervals in fill order.
   * @throws InvalidQueryException if neither mode is known or an index is
   * out of range for a fill.
   */
  public List<FillInterval> getIntervalsByLHCModes(
      final TimeStamp start,
      final TimeStamp end,
      final String mode1,
      final String mode2,
      final ModeTimeField mode1_field,
      final ModeTimeField mode2_field,
      final int mode1_index,
      final int mode2_index) {
    if (mode1_field == null || mode2_field == null) {
      throw new IllegalArgumentException("Mode time fields cannot be null.");
    }
    final List<Fill> fills = getLHCFillsByTime(start, end,
        Arrays.asList(mode1, mode2));
    // unknown modes were dropped by the filter and never match
    final BeamMode first_mode = BeamMode.fromString(mode1);
    final BeamMode second_mode = BeamMode.fromString(mode2);
    final List<FillInterval> intervals = new ArrayList<FillInterval>();
    for (final Fill fill : fills) {
      final List<TimeStamp> first = new ArrayList<TimeStamp>();
      final List<TimeStamp> second = new ArrayList<TimeStamp>();
      for (final BeamModeInterval mode : fill.getBeamModes()) {
        if (first_mode != null && mode.getMode().equals(first_mode.name())) {
          first.add(mode1_field.select(mode));
        }
        if (second_mode != null && mode.getMode().equals(second_mode.name())) {
          second.add(mode2_field.select(mode));
        }
      }
      if (first.isEmpty() || second.isEmpty()) {
        continue;
      }
      intervals.add(new FillInterval(fill.getFillNumber(),
          pick(first, mode1_index, first_mode, fill),
          pick(second, mode2_index, second_mode, fill)));
    }
    return intervals;
  }

  private static TimeStamp pick(final List<TimeStamp> occurrences,
                                final int index,
                                final BeamMode mode,
                                final Fill fill) {
    final int resolved = index < 0 ? occurrences.size() + index : index;
    if (resolved < 0 || resolved >= occurrences.size()) {
      throw new InvalidQueryException("Index " + index + " out of range for "
          + occurrences.size() + " occurrences of " + mode + " in fill "
          + fill.getFillNumber());
    }
    return occurrences.get(resolved);
  }

  private static void checkWindow(final TimeStamp start, final TimeStamp end) {
    if (start == null || end == null) {
      throw new InvalidQueryException("Fill queries require a closed time "
          + "window.");
    }
  }
}

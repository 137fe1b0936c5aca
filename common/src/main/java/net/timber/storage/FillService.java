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
package net.timber.storage;

import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;

import net.timber.data.TimeStamp;
import net.timber.fill.BeamMode;
import net.timber.fill.Fill;

/**
 * Access to the accelerator fills and their beam modes. Lists returned are
 * never null.
 *
 * @since 1.0
 */
public interface FillService {

  /**
   * @param fill_number The fill number.
   * @return The fill, or null if unknown.
   */
  @Nullable
  public Fill getFill(final int fill_number);

  /** @return The most recent completed fill, or null if there is none. */
  @Nullable
  public Fill getLastCompletedFill();

  /**
   * @param start The start of the window.
   * @param end The end of the window.
   * @return The fills overlapping the window, ascending by number.
   */
  public List<Fill> getFillsInTimeWindow(final TimeStamp start,
                                         final TimeStamp end);

  /**
   * @param start The start of the window.
   * @param end The end of the window.
   * @param beam_modes A non-null and non-empty set of modes.
   * @return The fills overlapping the window that went through at least
   * one of the modes, ascending by number.
   */
  public List<Fill> getFillsInTimeWindowContainingBeamModes(
      final TimeStamp start,
      final TimeStamp end,
      final Set<BeamMode> beam_modes);
}

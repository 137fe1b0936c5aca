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

/**
 * The beam modes the fill service knows about. Only used to validate the
 * filters a caller passes in, fills report their modes as plain strings so
 * that new modes don't break decoding.
 *
 * @since 1.0
 */
public enum BeamMode {
  NOMODE,
  SETUP,
  INJPILOT,
  INJINTR,
  INJNOMN,
  PRERAMP,
  RAMP,
  FLATTOP,
  SQUEEZE,
  ADJUST,
  STABLE,
  UNSTABLE,
  BEAMDUMP,
  RAMPDOWN,
  RECOVERY,
  INJDUMP,
  CIRCDUMP,
  ABORT,
  CYCLING,
  WBDUMP,
  NOBEAM;

  /**
   * Get an instance of this enumeration from a mode name.
   * @param name The mode name, case sensitive as the service reports it.
   * Surrounding whitespace is ignored.
   * @return an instance of {@link BeamMode}, or {@code null} if the name
   * does not match any instance.
   */
  public static BeamMode fromString(final String name) {
    if (name == null) {
      return null;
    }
    final String trimmed = name.trim();
    for (final BeamMode mode : BeamMode.values()) {
      if (mode.name().equals(trimmed)) {
        return mode;
      }
    }
    return null;
  }
}

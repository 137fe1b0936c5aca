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

/**
 * How the values falling into a fixed interval are reduced to one value.
 * {@link #REPEAT} and {@link #INTERPOLATE} fill each interval from the
 * surrounding raw values instead of reducing the ones inside it.
 * @since 1.0
 */
public enum ScaleAlgorithm {
  MAX,
  MIN,
  AVG,
  COUNT,
  SUM,
  REPEAT,
  INTERPOLATE;

  /**
   * Get an instance of this enumeration from a user supplied name.
   * @param name The name of an algorithm, case insensitive.
   * @return an instance of {@link ScaleAlgorithm}, or {@code null} if the name
   * does not match any instance.
   */
  public static ScaleAlgorithm fromString(final String name) {
    if (name == null) {
      return null;
    }
    for (final ScaleAlgorithm algorithm : ScaleAlgorithm.values()) {
      if (algorithm.name().equalsIgnoreCase(name.trim())) {
        return algorithm;
      }
    }
    return null;
  }
}

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
 * Single bound lookups of {@link DataRetriever}.
 *
 * @since 1.0
 */
public enum PointLookup {
  /** The last value strictly before the reference time. */
  LAST,

  /** The first value strictly after the reference time. */
  NEXT;

  /**
   * @param name {@code last} or {@code next}, case insensitive.
   * @return The lookup or null if the name is unknown.
   */
  public static PointLookup fromString(final String name) {
    if (name == null) {
      return null;
    }
    for (final PointLookup lookup : values()) {
      if (lookup.name().equalsIgnoreCase(name.trim())) {
        return lookup;
      }
    }
    return null;
  }
}

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

/**
 * Which archive the backend reads from: the short term measurement database,
 * the long term logging database, or both.
 *
 * @since 1.0
 */
public enum DataLocation {
  MDB,
  LDB,
  ALL;

  /**
   * Get an instance of this enumeration from a configuration value.
   * @param name One of {@code mdb}, {@code ldb} or {@code all}, case
   * insensitive.
   * @return an instance of {@link DataLocation}, or {@code null} if the name
   * does not match any instance.
   */
  public static DataLocation fromString(final String name) {
    if (name == null) {
      return null;
    }
    for (final DataLocation location : DataLocation.values()) {
      if (location.name().equalsIgnoreCase(name.trim())) {
        return location;
      }
    }
    return null;
  }
}

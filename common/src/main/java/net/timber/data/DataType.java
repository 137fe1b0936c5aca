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
package net.timber.data;

/**
 * The declared shape of a logged variable. Numeric shapes don't say whether
 * the values are integers or floating point, that's reported per data set
 * through {@link DataClass}.
 *
 * @since 1.0
 */
public enum DataType {
  /** One number per timestamp. */
  NUMERIC,

  /** A one dimensional array of numbers per timestamp. */
  VECTORNUMERIC,

  /** A two dimensional array of numbers per timestamp. */
  MATRIXNUMERIC,

  /** An array of strings per timestamp. */
  VECTORSTRING,

  /** One string per timestamp. */
  TEXTUAL,

  /** A marker that only records when a condition held. */
  FUNDAMENTAL;

  /**
   * Get an instance of this enumeration from the name the service reports.
   * @param name The name of a data type, case insensitive.
   * @return an instance of {@link DataType}, or {@code null} if the name
   * does not match any instance.
   */
  public static DataType fromString(final String name) {
    if (name == null) {
      return null;
    }
    for (final DataType type : DataType.values()) {
      if (type.name().equalsIgnoreCase(name.trim())) {
        return type;
      }
    }
    return null;
  }
}

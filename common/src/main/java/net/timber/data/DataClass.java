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
 * The concrete storage class of the points in a data set. The same variable
 * may come back as longs from one archive and as doubles from another so the
 * class is read from each data set rather than from the variable.
 *
 * @since 1.0
 */
public enum DataClass {
  NUMERIC_DOUBLE(DataType.NUMERIC, false),
  NUMERIC_LONG(DataType.NUMERIC, true),
  VECTOR_NUMERIC_DOUBLE(DataType.VECTORNUMERIC, false),
  VECTOR_NUMERIC_LONG(DataType.VECTORNUMERIC, true),
  MATRIX_NUMERIC_DOUBLE(DataType.MATRIXNUMERIC, false),
  MATRIX_NUMERIC_LONG(DataType.MATRIXNUMERIC, true),
  VECTOR_STRING(DataType.VECTORSTRING, false),
  TEXTUAL(DataType.TEXTUAL, false),
  FUNDAMENTAL(DataType.FUNDAMENTAL, false),

  /** A storage class this client doesn't know how to read. */
  UNKNOWN(null, false);

  /** The shape this class belongs to, null for {@link #UNKNOWN}. */
  private final DataType type;

  /** Whether or not the numbers are integers. */
  private final boolean integer;

  DataClass(final DataType type, final boolean integer) {
    this.type = type;
    this.integer = integer;
  }

  /** @return The shape this class belongs to, null for {@link #UNKNOWN}. */
  public DataType dataType() {
    return type;
  }

  /** @return True if the values are integers, false for floating point
   * or non-numeric values. */
  public boolean isInteger() {
    return integer;
  }
}

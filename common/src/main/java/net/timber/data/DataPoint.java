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
 * A single value returned by the logging service for one variable at one
 * point in time. Only the accessor matching {@link #dataClass()} is valid, the
 * others throw a {@link ClassCastException}.
 *
 * @since 1.0
 */
public interface DataPoint {

  /** @return The non-null time the value was logged at. */
  public TimeStamp timestamp();

  /** @return The name of the variable this value belongs to. */
  public String variableName();

  /** @return The declared type of the variable. May be null if the service
   * sent a type this client doesn't know. */
  public DataType dataType();

  /** @return The non-null storage class of this value. */
  public DataClass dataClass();

  /**
   * @return The value for {@link DataClass#NUMERIC_DOUBLE}.
   * @throws ClassCastException if the point holds another class.
   */
  public double doubleValue();

  /**
   * @return The value for {@link DataClass#NUMERIC_LONG}.
   * @throws ClassCastException if the point holds another class.
   */
  public long longValue();

  /**
   * @return The value for {@link DataClass#VECTOR_NUMERIC_DOUBLE}.
   * @throws ClassCastException if the point holds another class.
   */
  public double[] doubleVector();

  /**
   * @return The value for {@link DataClass#VECTOR_NUMERIC_LONG}.
   * @throws ClassCastException if the point holds another class.
   */
  public long[] longVector();

  /**
   * @return The value for {@link DataClass#MATRIX_NUMERIC_DOUBLE}.
   * @throws ClassCastException if the point holds another class.
   */
  public double[][] doubleMatrix();

  /**
   * @return The value for {@link DataClass#MATRIX_NUMERIC_LONG}.
   * @throws ClassCastException if the point holds another class.
   */
  public long[][] longMatrix();

  /**
   * @return The value for {@link DataClass#VECTOR_STRING}.
   * @throws ClassCastException if the point holds another class.
   */
  public String[] stringVector();

  /**
   * @return The value for {@link DataClass#TEXTUAL}.
   * @throws ClassCastException if the point holds another class.
   */
  public String stringValue();
}

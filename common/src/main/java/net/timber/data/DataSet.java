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
 * The raw result of a query for a single variable: the points in ascending
 * time order. Iteration follows that order.
 *
 * @since 1.0
 */
public interface DataSet extends Iterable<DataPoint> {

  /** @return The name of the variable queried. */
  public String variableName();

  /** @return The declared type of the variable. May be null if the service
   * reported a type this client doesn't know. */
  public DataType dataType();

  /** @return The storage class of the points, {@link DataClass#UNKNOWN} when
   * the set is empty. */
  public DataClass dataClass();

  /** @return The number of points. */
  public int size();

  /** @return True if there aren't any points. */
  public boolean isEmpty();

  /**
   * @param index An index from 0 to {@link #size()} exclusive.
   * @return The point at the index.
   * @throws IndexOutOfBoundsException if the index was out of range.
   */
  public DataPoint get(final int index);
}

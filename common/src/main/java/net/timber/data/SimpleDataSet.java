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

import java.util.Iterator;
import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * A list backed data set, used to wrap single points from "last before" or
 * "first after" lookups and by backends that materialize their results.
 *
 * @since 1.0
 */
public class SimpleDataSet implements DataSet {

  /** The variable name. */
  private final String variable_name;

  /** The declared type, may be null. */
  private final DataType data_type;

  /** The points in time order. */
  private final List<DataPoint> points;

  /**
   * Default ctor.
   * @param variable_name The variable name.
   * @param data_type The declared type, may be null if unknown.
   * @param points A non-null list of points in time order.
   * @throws IllegalArgumentException if the points were null.
   */
  public SimpleDataSet(final String variable_name,
                       final DataType data_type,
                       final List<DataPoint> points) {
    if (points == null) {
      throw new IllegalArgumentException("Points cannot be null.");
    }
    this.variable_name = variable_name;
    this.data_type = data_type;
    this.points = ImmutableList.copyOf(points);
  }

  /**
   * @param point A point, may be null.
   * @return A set holding the point or an empty set without a type or name
   * if the point was null.
   */
  public static SimpleDataSet of(final DataPoint point) {
    if (point == null) {
      return new SimpleDataSet(null, null, ImmutableList.<DataPoint>of());
    }
    return new SimpleDataSet(point.variableName(), point.dataType(),
        ImmutableList.of(point));
  }

  @Override
  public String variableName() {
    return variable_name;
  }

  @Override
  public DataType dataType() {
    return data_type;
  }

  @Override
  public DataClass dataClass() {
    return points.isEmpty() ? DataClass.UNKNOWN : points.get(0).dataClass();
  }

  @Override
  public int size() {
    return points.size();
  }

  @Override
  public boolean isEmpty() {
    return points.isEmpty();
  }

  @Override
  public DataPoint get(final int index) {
    return points.get(index);
  }

  @Override
  public Iterator<DataPoint> iterator() {
    return points.iterator();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("variable", variable_name)
        .add("dataType", data_type)
        .add("size", points.size())
        .toString();
  }
}

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

import javax.annotation.Nullable;

import net.timber.data.DataPoint;
import net.timber.data.DataSet;
import net.timber.data.TimeStamp;
import net.timber.data.Variable;
import net.timber.data.VariableSet;
import net.timber.data.VariableStatistics;
import net.timber.query.ScalingDescriptor;

/**
 * The data side of the logging service. Every call is a blocking round trip.
 * Windows are inclusive on both ends.
 * <p>
 * Implementations may throw {@link net.timber.exceptions.QueryExecutionException}
 * on remote failures or when a request is rejected. Lists and data sets
 * returned are never null; only the single point lookups return null.
 *
 * @since 1.0
 */
public interface TimeseriesService {

  /**
   * @param variable A non-null variable.
   * @param start The start of the window.
   * @param end The end of the window.
   * @return The raw values of the variable in the window, ascending.
   */
  public DataSet getDataInTimeWindow(final Variable variable,
                                     final TimeStamp start,
                                     final TimeStamp end);

  /**
   * Same as {@link #getDataInTimeWindow(Variable, TimeStamp, TimeStamp)} but
   * restricted to the times at which at least one of the fundamentals was
   * active.
   * @param variable A non-null variable.
   * @param start The start of the window.
   * @param end The end of the window.
   * @param fundamentals A non-null and non-empty set of fundamentals.
   * @return The filtered values, ascending.
   */
  public DataSet getDataInTimeWindowFilteredByFundamentals(
      final Variable variable,
      final TimeStamp start,
      final TimeStamp end,
      final VariableSet fundamentals);

  /**
   * Returns one value of the variable for each timestamp of the master data
   * set, the last known value at or before that timestamp.
   * @param variable A non-null variable.
   * @param master The master data set.
   * @return A data set as long as the master.
   */
  public DataSet getDataAlignedToTimestamps(final Variable variable,
                                            final DataSet master);

  /**
   * @param variable A non-null variable.
   * @param timestamp The reference time.
   * @return The last value strictly before the reference time, or null.
   */
  @Nullable
  public DataPoint getLastDataPriorToTimestamp(final Variable variable,
                                               final TimeStamp timestamp);

  /**
   * @param variable A non-null variable.
   * @param timestamp The reference time.
   * @return The first value strictly after the reference time, or null.
   */
  @Nullable
  public DataPoint getNextDataAfterTimestamp(final Variable variable,
                                             final TimeStamp timestamp);

  /**
   * Computes summary statistics for every variable of the set in one
   * request.
   * @param variables A non-null set of variables.
   * @param start The start of the window.
   * @param end The end of the window.
   * @return One record per variable, including the ones without data.
   */
  public List<VariableStatistics> getVariableStatistics(
      final VariableSet variables,
      final TimeStamp start,
      final TimeStamp end);

  /**
   * Reduces the values of a variable in fixed intervals.
   * @param variable A non-null variable.
   * @param start The start of the window.
   * @param end The end of the window.
   * @param scaling The interval and reduction.
   * @return One value per interval, ascending.
   */
  public DataSet getDataInFixedIntervals(final Variable variable,
                                         final TimeStamp start,
                                         final TimeStamp end,
                                         final ScalingDescriptor scaling);
}

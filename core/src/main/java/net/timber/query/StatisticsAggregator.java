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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.timber.data.TimeStamp;
import net.timber.data.TimestampCodec;
import net.timber.data.VariableStatistics;
import net.timber.exceptions.InvalidQueryException;
import net.timber.storage.TimeseriesService;

/**
 * Summary statistics for the selected variables, computed by the service in
 * a single request. Variables without values in the window are left out.
 *
 * @since 1.0
 */
public class StatisticsAggregator {
  private static final Logger LOG = LoggerFactory.getLogger(
      StatisticsAggregator.class);

  private final TimeseriesService timeseries_service;
  private final VariableResolver resolver;
  private final TimestampCodec codec;

  /**
   * Default ctor.
   * @param timeseries_service A non-null time series service.
   * @param resolver A non-null resolver.
   * @param codec A non-null codec the statistics render timestamps with.
   * @throws IllegalArgumentException if an argument was null.
   */
  public StatisticsAggregator(final TimeseriesService timeseries_service,
                              final VariableResolver resolver,
                              final TimestampCodec codec) {
    if (timeseries_service == null) {
      throw new IllegalArgumentException("Timeseries service cannot be null.");
    }
    if (resolver == null) {
      throw new IllegalArgumentException("Resolver cannot be null.");
    }
    if (codec == null) {
      throw new IllegalArgumentException("Codec cannot be null.");
    }
    this.timeseries_service = timeseries_service;
    this.resolver = resolver;
    this.codec = codec;
  }

  /**
   * @param selector A non-null selector.
   * @param start The non-null start of the window.
   * @param end The non-null end of the window.
   * @param unixtime Whether timestamps render as epoch seconds.
   * @return The statistics keyed by variable name in resolution order.
   * @throws InvalidQueryException if a bound is missing.
   */
  public Map<String, Statistic> getStats(final VariableSelector selector,
                                         final TimeStamp start,
                                         final TimeStamp end,
                                         final boolean unixtime) {
    if (start == null || end == null) {
      throw new InvalidQueryException("Statistics require a closed time window.");
    }
    final VariableResolution resolution = resolver.resolve(selector);
    if (resolution.isEmpty()) {
      LOG.warn("No variables found.");
      return Collections.emptyMap();
    }

    final List<VariableStatistics> records = timeseries_service
        .getVariableStatistics(resolution.getVariables(), start, end);
    final Map<String, VariableStatistics> by_name =
        new LinkedHashMap<String, VariableStatistics>();
    for (final VariableStatistics record : records) {
      by_name.put(record.getVariableName(), record);
    }

    final Map<String, Statistic> results = new LinkedHashMap<String, Statistic>();
    for (final String name : resolution.getVariables().getVariableNames()) {
      final VariableStatistics record = by_name.get(name);
      if (record == null || record.getValueCount() == 0) {
        LOG.warn("No values for " + name + " in the time window, skipping");
        continue;
      }
      results.put(name, new Statistic(record, codec, unixtime));
    }
    return results;
  }
}

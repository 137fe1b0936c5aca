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
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;

import net.timber.data.DataPoint;
import net.timber.data.DataSet;
import net.timber.data.SimpleDataSet;
import net.timber.data.TimeStamp;
import net.timber.data.Variable;
import net.timber.data.VariableSet;
import net.timber.exceptions.InvalidQueryException;
import net.timber.storage.MetaService;
import net.timber.storage.TimeseriesService;

/**
 * Raw retrieval: every value of each selected variable in a window,
 * optionally restricted to the times a fundamental was active, or the single
 * value right before or after a reference time.
 * <p>
 * Results are keyed by variable name in resolution order. Each variable is
 * fetched with its own request, sequentially.
 *
 * @since 1.0
 */
public class DataRetriever {
  private static final Logger LOG = LoggerFactory.getLogger(DataRetriever.class);

  private final MetaService meta_service;
  private final TimeseriesService timeseries_service;
  private final VariableResolver resolver;
  private final DatasetDecoder decoder;

  /**
   * Default ctor.
   * @param meta_service A non-null meta data service, for fundamentals.
   * @param timeseries_service A non-null time series service.
   * @param resolver A non-null resolver.
   * @param decoder A non-null decoder.
   * @throws IllegalArgumentException if an argument was null.
   */
  public DataRetriever(final MetaService meta_service,
                       final TimeseriesService timeseries_service,
                       final VariableResolver resolver,
                       final DatasetDecoder decoder) {
    if (meta_service == null) {
      throw new IllegalArgumentException("Meta service cannot be null.");
    }
    if (timeseries_service == null) {
      throw new IllegalArgumentException("Timeseries service cannot be null.");
    }
    if (resolver == null) {
      throw new IllegalArgumentException("Resolver cannot be null.");
    }
    if (decoder == null) {
      throw new IllegalArgumentException("Decoder cannot be null.");
    }
    this.meta_service = meta_service;
    this.timeseries_service = timeseries_service;
    this.resolver = resolver;
    this.decoder = decoder;
  }

  /**
   * Fetches every value in the window.
   * @param selector A non-null selector.
   * @param start The non-null start of the window.
   * @param end The non-null end of the window.
   * @param fundamental An optional fundamental pattern, may be null.
   * @param unixtime Whether the series render timestamps as epoch seconds.
   * @return The series keyed by variable name, empty if nothing was found.
   * @throws InvalidQueryException if a bound is missing.
   */
  public Map<String, Series> get(final VariableSelector selector,
                                 final TimeStamp start,
                                 final TimeStamp end,
                                 final String fundamental,
                                 final boolean unixtime) {
    if (start == null) {
      throw new InvalidQueryException("Start time cannot be null.");
    }
    if (end == null) {
      if (!Strings.isNullOrEmpty(fundamental)) {
        throw new InvalidQueryException("Fundamental filter requires a "
            + "closed time window.");
      }
      throw new InvalidQueryException("End time cannot be null.");
    }
    final VariableResolution resolution = resolver.resolve(selector);
    if (resolution.isEmpty()) {
      LOG.warn("No variables found.");
      return Collections.emptyMap();
    }

    VariableSet fundamentals = null;
    if (!Strings.isNullOrEmpty(fundamental)) {
      fundamentals = meta_service.getFundamentals(start, end, fundamental);
      if (fundamentals.isEmpty()) {
        LOG.warn("No fundamental found in time window");
        return Collections.emptyMap();
      }
    }

    final Map<String, Series> results = new LinkedHashMap<String, Series>();
    for (final Variable variable : resolution.getVariables()) {
      final DataSet data_set = fundamentals == null ?
          timeseries_service.getDataInTimeWindow(variable, start, end) :
          timeseries_service.getDataInTimeWindowFilteredByFundamentals(
              variable, start, end, fundamentals);
      final Series series = decoder.decode(variable.getVariableName(),
          data_set, variable.getDataType(), unixtime);
      LOG.info("Retrieved " + series.size() + " values for "
          + variable.getVariableName());
      results.put(variable.getVariableName(), series);
    }
    return results;
  }

  /**
   * Fetches the single value before or after the reference time.
   * @param selector A non-null selector.
   * @param timestamp The non-null reference time.
   * @param lookup Which side of the reference time to look at.
   * @param unixtime Whether the series render timestamps as epoch seconds.
   * @return The series keyed by variable name, empty if nothing was found.
   * Variables without a value on that side get an empty series.
   * @throws InvalidQueryException if the reference time or lookup was null.
   */
  public Map<String, Series> get(final VariableSelector selector,
                                 final TimeStamp timestamp,
                                 final PointLookup lookup,
                                 final boolean unixtime) {
    if (timestamp == null) {
      throw new InvalidQueryException("Reference time cannot be null.");
    }
    if (lookup == null) {
      throw new InvalidQueryException("Lookup cannot be null.");
    }
    final VariableResolution resolution = resolver.resolve(selector);
    if (resolution.isEmpty()) {
      LOG.warn("No variables found.");
      return Collections.emptyMap();
    }

    final Map<String, Series> results = new LinkedHashMap<String, Series>();
    for (final Variable variable : resolution.getVariables()) {
      final DataPoint point = lookup == PointLookup.LAST ?
          timeseries_service.getLastDataPriorToTimestamp(variable, timestamp) :
          timeseries_service.getNextDataAfterTimestamp(variable, timestamp);
      final Series series = decoder.decode(variable.getVariableName(),
          SimpleDataSet.of(point), variable.getDataType(), unixtime);
      LOG.info("Retrieved " + series.size() + " values for "
          + variable.getVariableName());
      results.put(variable.getVariableName(), series);
    }
    return results;
  }
}

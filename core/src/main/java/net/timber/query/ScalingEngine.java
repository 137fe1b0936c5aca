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

import net.timber.data.DataSet;
import net.timber.data.TimeStamp;
import net.timber.data.Variable;
import net.timber.exceptions.InvalidQueryException;
import net.timber.exceptions.QueryExecutionException;
import net.timber.storage.TimeseriesService;

/**
 * Fixed interval retrieval: the service reduces the values of each variable
 * in intervals described by a {@link ScalingDescriptor}.
 * <p>
 * A request the service rejects aborts the whole call with an
 * {@link InvalidQueryException} listing the accepted values. Series holding
 * NaN or infinite values are returned as is with one warning per variable.
 *
 * @since 1.0
 */
public class ScalingEngine {
  private static final Logger LOG = LoggerFactory.getLogger(ScalingEngine.class);

  private final TimeseriesService timeseries_service;
  private final VariableResolver resolver;
  private final DatasetDecoder decoder;

  /**
   * Default ctor.
   * @param timeseries_service A non-null time series service.
   * @param resolver A non-null resolver.
   * @param decoder A non-null decoder.
   * @throws IllegalArgumentException if an argument was null.
   */
  public ScalingEngine(final TimeseriesService timeseries_service,
                       final VariableResolver resolver,
                       final DatasetDecoder decoder) {
    if (timeseries_service == null) {
      throw new IllegalArgumentException("Timeseries service cannot be null.");
    }
    if (resolver == null) {
      throw new IllegalArgumentException("Resolver cannot be null.");
    }
    if (decoder == null) {
      throw new IllegalArgumentException("Decoder cannot be null.");
    }
    this.timeseries_service = timeseries_service;
    this.resolver = resolver;
    this.decoder = decoder;
  }

  /**
   * Parses the scaling and fetches the scaled series.
   * @param selector A non-null selector.
   * @param start The non-null start of the window.
   * @param end The non-null end of the window.
   * @param algorithm The algorithm name, e.g. {@code SUM}.
   * @param interval The interval unit name, e.g. {@code MINUTE}.
   * @param size The number of units per interval, e.g. {@code 1}.
   * @param unixtime Whether timestamps render as epoch seconds.
   * @return The series keyed by variable name, empty if nothing was found.
   * @throws InvalidQueryException if the scaling is invalid or rejected.
   */
  public Map<String, Series> getScaled(final VariableSelector selector,
                                       final TimeStamp start,
                                       final TimeStamp end,
                                       final String algorithm,
                                       final String interval,
                                       final String size,
                                       final boolean unixtime) {
    return getScaled(selector, start, end,
        ScalingDescriptor.fromStrings(algorithm, interval, size), unixtime);
  }

  /**
   * Fetches the scaled series.
   * @param selector A non-null selector.
   * @param start The non-null start of the window.
   * @param end The non-null end of the window.
   * @param scaling A non-null scaling.
   * @param unixtime Whether timestamps render as epoch seconds.
   * @return The series keyed by variable name, empty if nothing was found.
   * @throws InvalidQueryException if the scaling was null or rejected, or a
   * bound is missing.
   */
  public Map<String, Series> getScaled(final VariableSelector selector,
                                       final TimeStamp start,
                                       final TimeStamp end,
                                       final ScalingDescriptor scaling,
                                       final boolean unixtime) {
    if (scaling == null) {
      throw new InvalidQueryException("Scaling cannot be null. "
          + ScalingDescriptor.validValues());
    }
    if (start == null || end == null) {
      throw new InvalidQueryException("Scaled queries require a closed "
          + "time window.");
    }
    final VariableResolution resolution = resolver.resolve(selector);
    if (resolution.isEmpty()) {
      LOG.warn("No variables found.");
      return Collections.emptyMap();
    }

    final Map<String, Series> results = new LinkedHashMap<String, Series>();
    for (final Variable variable : resolution.getVariables()) {
      final DataSet data_set;
      try {
        data_set = timeseries_service.getDataInFixedIntervals(variable, start,
            end, scaling);
      } catch (QueryExecutionException e) {
        throw new InvalidQueryException("Scaling " + scaling
            + " rejected for " + variable.getVariableName() + ": "
            + e.getMessage() + ". " + ScalingDescriptor.validValues(), e);
      }
      final Series series = decoder.decode(variable.getVariableName(),
          data_set, variable.getDataType(), unixtime);
      if (series.values().hasNonFinite()) {
        LOG.warn("Variable " + variable.getVariableName()
            + " contains NaN values");
      }
      LOG.info("Retrieved " + series.size() + " values for "
          + variable.getVariableName());
      results.put(variable.getVariableName(), series);
    }
    return results;
  }
}

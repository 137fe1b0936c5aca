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

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;

import net.timber.data.DataSet;
import net.timber.data.TimeStamp;
import net.timber.data.Variable;
import net.timber.data.VariableSet;
import net.timber.exceptions.InvalidQueryException;
import net.timber.exceptions.QueryExecutionException;
import net.timber.storage.MetaService;
import net.timber.storage.TimeseriesService;

/**
 * Fetches several variables on a common time base: the master variable is
 * fetched over the window, every other variable is sampled by the service
 * at the master's timestamps.
 * <p>
 * The master is the explicitly named one, else the first name of an
 * explicit list, else the first variable the pattern matched.
 *
 * @since 1.0
 */
public class AlignmentEngine {
  private static final Logger LOG = LoggerFactory.getLogger(
      AlignmentEngine.class);

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
  public AlignmentEngine(final MetaService meta_service,
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
   * Fetches the variables aligned to the master.
   * @param selector A non-null selector.
   * @param start The non-null start of the window.
   * @param end The non-null end of the window.
   * @param fundamental An optional fundamental pattern filtering the master,
   * may be null.
   * @param master An optional master variable name, may be null.
   * @param unixtime Whether timestamps render as epoch seconds.
   * @return The aligned data, empty if nothing was found.
   * @throws InvalidQueryException if a bound is missing.
   * @throws QueryExecutionException if the service returned a secondary
   * variable with another length than the master.
   */
  public AlignedData getAligned(final VariableSelector selector,
                                final TimeStamp start,
                                final TimeStamp end,
                                final String fundamental,
                                final String master,
                                final boolean unixtime) {
    if (start == null || end == null) {
      if (!Strings.isNullOrEmpty(fundamental)) {
        throw new InvalidQueryException("Fundamental filter requires a "
            + "closed time window.");
      }
      throw new InvalidQueryException("Aligned queries require a closed "
          + "time window.");
    }

    final VariableResolution resolution = resolver.resolve(selector);
    if (resolution.isEmpty()) {
      LOG.warn("No variables found.");
      return AlignedData.empty();
    }
    final VariableSet variables = resolution.getVariables();

    VariableSet fundamentals = null;
    if (!Strings.isNullOrEmpty(fundamental)) {
      fundamentals = meta_service.getFundamentals(start, end, fundamental);
      if (fundamentals.isEmpty()) {
        LOG.warn("No fundamental found in time window");
        return AlignedData.empty();
      }
    }

    final String master_name;
    if (!Strings.isNullOrEmpty(master)) {
      master_name = master;
    } else if (!selector.isPattern()) {
      master_name = selector.getNames().get(0);
    } else {
      master_name = variables.getVariable(0).getVariableName();
    }
    final Variable master_variable = variables.getVariable(master_name);
    if (master_variable == null) {
      LOG.warn("Master variable not found.");
      return AlignedData.empty();
    }

    final DataSet master_data = fundamentals == null ?
        timeseries_service.getDataInTimeWindow(master_variable, start, end) :
        timeseries_service.getDataInTimeWindowFilteredByFundamentals(
            master_variable, start, end, fundamentals);
    final Series master_series = decoder.decode(master_name, master_data,
        master_variable.getDataType(), unixtime);
    LOG.info("Retrieved " + master_series.size() + " values for " + master_name);

    final List<Series> series = new ArrayList<Series>(variables.size());
    series.add(master_series);
    for (final Variable variable : variables) {
      if (variable.equals(master_variable)) {
        continue;
      }
      final DataSet aligned = timeseries_service.getDataAlignedToTimestamps(
          variable, master_data);
      final Series decoded = decoder.decode(variable.getVariableName(),
          aligned, variable.getDataType(), unixtime);
      if (decoded.size() != master_series.size()) {
        throw new QueryExecutionException("Service returned " + decoded.size()
            + " values for " + variable.getVariableName() + " aligned to "
            + master_series.size() + " values of " + master_name, 500);
      }
      LOG.info("Retrieved " + decoded.size() + " values for "
          + variable.getVariableName());
      series.add(decoded);
    }
    return new AlignedData(master_name, series);
  }
}

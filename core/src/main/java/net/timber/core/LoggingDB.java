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
package net.timber.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;

import net.timber.data.NanoTimeStamp;
import net.timber.data.TimeStamp;
import net.timber.data.TimestampCodec;
import net.timber.data.Variable;
import net.timber.data.VariableSet;
import net.timber.exceptions.InvalidQueryException;
import net.timber.fill.Fill;
import net.timber.fill.FillInterval;
import net.timber.fill.FillTimeline;
import net.timber.fill.ModeTimeField;
import net.timber.query.AlignedData;
import net.timber.query.AlignmentEngine;
import net.timber.query.DataRetriever;
import net.timber.query.DatasetDecoder;
import net.timber.query.PointLookup;
import net.timber.query.ScalingEngine;
import net.timber.query.Series;
import net.timber.query.Statistic;
import net.timber.query.StatisticsAggregator;
import net.timber.query.VariableResolver;
import net.timber.query.VariableSelector;
import net.timber.storage.FillService;
import net.timber.storage.MetaService;
import net.timber.storage.ServiceFactory;
import net.timber.storage.TimeseriesService;
import net.timber.tree.Hierarchy;
import net.timber.utils.Config;

/**
 * The entry point of the client: wires the query engines to the logging
 * service and accepts time bounds in any form the {@link TimestampCodec}
 * understands (calendar strings, calendar objects, epoch seconds or
 * {@link TimeStamp}s).
 * <p>
 * Methods without a {@code unixtime} argument use the configured default,
 * see {@link Config#UNIXTIME}.
 *
 * @since 1.0
 */
public class LoggingDB {
  private static final Logger LOG = LoggerFactory.getLogger(LoggingDB.class);

  public static final String DEFAULT_SCALE_ALGORITHM = "SUM";
  public static final String DEFAULT_SCALE_INTERVAL = "MINUTE";
  public static final String DEFAULT_SCALE_SIZE = "1";

  private final Config config;
  private final TimestampCodec codec;
  private final boolean unixtime;
  private final MetaService meta_service;
  private final VariableResolver resolver;
  private final DataRetriever retriever;
  private final AlignmentEngine alignment;
  private final StatisticsAggregator statistics;
  private final ScalingEngine scaling;
  private final FillTimeline fills;
  private final Hierarchy tree;

  /**
   * Ctor creating the services from a factory. The factory is initialized
   * with the configured application name, client name and data location.
   * @param factory A non-null service factory.
   * @param config A non-null configuration.
   * @throws IllegalArgumentException if an argument was null or the
   * configuration is invalid.
   */
  public LoggingDB(final ServiceFactory factory, final Config config) {
    this(initialize(factory, config).metaService(),
        factory.timeseriesService(),
        factory.fillService(),
        config);
  }

  /**
   * Ctor for already created services.
   * @param meta_service A non-null meta data service.
   * @param timeseries_service A non-null time series service.
   * @param fill_service A non-null fill service.
   * @param config A non-null configuration.
   * @throws IllegalArgumentException if an argument was null or the
   * configuration is invalid.
   */
  public LoggingDB(final MetaService meta_service,
                   final TimeseriesService timeseries_service,
                   final FillService fill_service,
                   final Config config) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    this.config = config;
    codec = new TimestampCodec(config.timezone());
    unixtime = config.unixtime();
    this.meta_service = meta_service;
    resolver = new VariableResolver(meta_service);
    final DatasetDecoder decoder = new DatasetDecoder(codec);
    retriever = new DataRetriever(meta_service, timeseries_service, resolver,
        decoder);
    alignment = new AlignmentEngine(meta_service, timeseries_service, resolver,
        decoder);
    statistics = new StatisticsAggregator(timeseries_service, resolver,
        codec);
    scaling = new ScalingEngine(timeseries_service, resolver, decoder);
    fills = new FillTimeline(fill_service);
    tree = Hierarchy.root(meta_service);
  }

  /** @return The configuration. */
  public Config config() {
    return config;
  }

  /** @return The codec used for time bounds and rendering. */
  public TimestampCodec codec() {
    return codec;
  }

  /** @return The top of the meta data hierarchy. */
  public Hierarchy tree() {
    return tree;
  }

  /**
   * @param value A time bound in any supported form, may be null.
   * @return The canonical timestamp, null for null.
   */
  public TimeStamp toTimestamp(final Object value) {
    return codec.encode(value);
  }

  /**
   * @param timestamp A timestamp, may be null.
   * @param as_numeric Whether to return epoch seconds or a calendar value.
   * @return The rendered timestamp, null for null.
   */
  public Object fromTimestamp(final TimeStamp timestamp,
                              final boolean as_numeric) {
    return codec.decode(timestamp, as_numeric);
  }

  // ------------------------------------------------------------------
  // meta data

  /**
   * @param pattern A pattern where {@code %} matches anything.
   * @return The matching variables in discovery order.
   */
  public List<Variable> getVariables(final String pattern) {
    return meta_service.findVariablesLike(pattern).getVariables();
  }

  /**
   * @param selector A non-null selector.
   * @return The resolved variables.
   */
  public VariableSet getVariablesList(final VariableSelector selector) {
    return resolver.resolve(selector).getVariables();
  }

  /**
   * @param pattern A pattern where {@code %} matches anything.
   * @return The matching variable names.
   */
  public List<String> search(final String pattern) {
    final List<String> names = new ArrayList<String>();
    for (final Variable variable : getVariables(pattern)) {
      names.add(variable.getVariableName());
    }
    return names;
  }

  /**
   * @param pattern A pattern where {@code %} matches anything.
   * @return The descriptions keyed by variable name, values may be null.
   */
  public Map<String, String> getDescription(final String pattern) {
    final Map<String, String> descriptions = new LinkedHashMap<String, String>();
    for (final Variable variable : getVariables(pattern)) {
      descriptions.put(variable.getVariableName(), variable.getDescription());
    }
    return descriptions;
  }

  /**
   * @param pattern A pattern where {@code %} matches anything.
   * @return The units keyed by variable name, values may be null.
   */
  public Map<String, String> getUnit(final String pattern) {
    final Map<String, String> units = new LinkedHashMap<String, String>();
    for (final Variable variable : getVariables(pattern)) {
      units.put(variable.getVariableName(), variable.getUnit());
    }
    return units;
  }

  /**
   * Lists the fundamentals active in the window.
   * @param pattern A fundamental pattern.
   * @param start The start of the window.
   * @param end The end of the window, null for now.
   * @return The fundamental names, possibly empty.
   */
  public List<String> searchFundamental(final String pattern,
                                        final Object start,
                                        final Object end) {
    final TimeStamp t1 = requireBound(start, "Start");
    final TimeStamp t2 = end == null ?
        NanoTimeStamp.fromInstant(Instant.now()) : codec.encode(end);
    LOG.info("Querying fundamentals (pattern: " + pattern + ")");
    final VariableSet fundamentals = meta_service.getFundamentals(t1, t2,
        pattern);
    if (fundamentals.isEmpty()) {
      LOG.info("No fundamental found in time window");
      return new ArrayList<String>();
    }
    LOG.info("List of fundamentals found: " + fundamentals);
    return fundamentals.getVariableNames();
  }

  /**
   * Vector element names over time, per variable.
   * @param selector A non-null selector.
   * @return The element names keyed by variable name, then by the time they
   * became valid.
   */
  public Map<String, SortedMap<TimeStamp, List<String>>> getMetaData(
      final VariableSelector selector) {
    final Map<String, SortedMap<TimeStamp, List<String>>> results =
        new LinkedHashMap<String, SortedMap<TimeStamp, List<String>>>();
    for (final Variable variable : getVariablesList(selector)) {
      results.put(variable.getVariableName(),
          meta_service.getVectorElements(variable));
    }
    return results;
  }

  // ------------------------------------------------------------------
  // raw data

  /**
   * The last value before {@code start} of each variable.
   * @see #get(VariableSelector, Object, Object, String, boolean)
   */
  public Map<String, Series> get(final VariableSelector selector,
                                 final Object start) {
    return get(selector, start, null, null, unixtime);
  }

  /** @see #get(VariableSelector, Object, Object, String, boolean) */
  public Map<String, Series> get(final VariableSelector selector,
                                 final Object start,
                                 final Object end) {
    return get(selector, start, end, null, unixtime);
  }

  /**
   * Fetches raw values. When {@code end} is null, {@code "last"} or
   * {@link PointLookup#LAST} the last value before {@code start} is returned;
   * {@code "next"} or {@link PointLookup#NEXT} returns the first value after
   * it. Any other {@code end} is the end of a window.
   * @param selector A non-null selector.
   * @param start The start of the window or the reference time.
   * @param end The end of the window or a lookup.
   * @param fundamental An optional fundamental pattern, requires a window.
   * @param unixtime Whether timestamps render as epoch seconds.
   * @return The series keyed by variable name.
   * @throws InvalidQueryException if a fundamental is given without a window.
   */
  public Map<String, Series> get(final VariableSelector selector,
                                 final Object start,
                                 final Object end,
                                 final String fundamental,
                                 final boolean unixtime) {
    final TimeStamp t1 = requireBound(start, "Start");
    final PointLookup lookup = lookup(end);
    if (lookup == null) {
      return retriever.get(selector, t1, codec.encode(end), fundamental,
          unixtime);
    }
    if (!Strings.isNullOrEmpty(fundamental)) {
      throw new InvalidQueryException("Fundamental filter requires a closed "
          + "time window.");
    }
    return retriever.get(selector, t1, lookup, unixtime);
  }

  /** @see #getAligned(VariableSelector, Object, Object, String, String, boolean) */
  public AlignedData getAligned(final VariableSelector selector,
                                final Object start,
                                final Object end) {
    return getAligned(selector, start, end, null, null, unixtime);
  }

  /**
   * Fetches the variables aligned to the timestamps of a master.
   * @param selector A non-null selector.
   * @param start The start of the window.
   * @param end The end of the window.
   * @param fundamental An optional fundamental pattern.
   * @param master An optional master variable name.
   * @param unixtime Whether timestamps render as epoch seconds.
   * @return The aligned data.
   */
  public AlignedData getAligned(final VariableSelector selector,
                                final Object start,
                                final Object end,
                                final String fundamental,
                                final String master,
                                final boolean unixtime) {
    return alignment.getAligned(selector, codec.encode(start),
        codec.encode(end), fundamental, master, unixtime);
  }

  /** Statistics rendering timestamps per the configured default. */
  public Map<String, Statistic> getStats(final VariableSelector selector,
                                         final Object start,
                                         final Object end) {
    return getStats(selector, start, end, unixtime);
  }

  /**
   * @param selector A non-null selector.
   * @param start The start of the window.
   * @param end The end of the window.
   * @param unixtime Whether timestamps render as epoch seconds.
   * @return The statistics keyed by variable name, without empty variables.
   */
  public Map<String, Statistic> getStats(final VariableSelector selector,
                                         final Object start,
                                         final Object end,
                                         final boolean unixtime) {
    return statistics.getStats(selector, codec.encode(start),
        codec.encode(end), unixtime);
  }

  /** Scaled retrieval with one minute sums. */
  public Map<String, Series> getScaled(final VariableSelector selector,
                                       final Object start,
                                       final Object end) {
    return getScaled(selector, start, end, unixtime, DEFAULT_SCALE_ALGORITHM,
        DEFAULT_SCALE_INTERVAL, DEFAULT_SCALE_SIZE);
  }

  /**
   * Fetches values reduced in fixed intervals.
   * @param selector A non-null selector.
   * @param start The start of the window.
   * @param end The end of the window.
   * @param unixtime Whether timestamps render as epoch seconds.
   * @param algorithm The reduction, e.g. {@code AVG}.
   * @param interval The interval unit, e.g. {@code HOUR}.
   * @param size The number of units per interval.
   * @return The series keyed by variable name.
   * @throws InvalidQueryException if the scaling is invalid or rejected.
   */
  public Map<String, Series> getScaled(final VariableSelector selector,
                                       final Object start,
                                       final Object end,
                                       final boolean unixtime,
                                       final String algorithm,
                                       final String interval,
                                       final String size) {
    return scaling.getScaled(selector, codec.encode(start), codec.encode(end),
        algorithm, interval, size, unixtime);
  }

  // ------------------------------------------------------------------
  // fills

  /**
   * @param fill_number A fill number, null for the last completed fill.
   * @return The fill, null if the service has none.
   */
  public Fill getLHCFillData(final Integer fill_number) {
    return fills.getLHCFillData(fill_number);
  }

  /**
   * @param start The start of the window.
   * @param end The end of the window.
   * @return The fills overlapping the window, in time order.
   */
  public List<Fill> getLHCFillsByTime(final Object start, final Object end) {
    return fills.getLHCFillsByTime(codec.encode(start), codec.encode(end));
  }

  /**
   * @param start The start of the window.
   * @param end The end of the window.
   * @param beam_modes Comma separated mode names, null for no filter.
   * @return The fills in the window that went through any of the modes.
   */
  public List<Fill> getLHCFillsByTime(final Object start,
                                      final Object end,
                                      final String beam_modes) {
    return fills.getLHCFillsByTime(codec.encode(start), codec.encode(end),
        beam_modes);
  }

  /** As above with the mode names already split. */
  public List<Fill> getLHCFillsByTime(final Object start,
                                      final Object end,
                                      final Collection<String> beam_modes) {
    return fills.getLHCFillsByTime(codec.encode(start), codec.encode(end),
        beam_modes);
  }

  /**
   * Intervals from the first start of {@code mode1} to the last end of
   * {@code mode2} in each fill that went through both.
   * @param start The start of the window.
   * @param end The end of the window.
   * @param mode1 The opening mode name.
   * @param mode2 The closing mode name.
   * @return The intervals in time order, possibly empty.
   */
  public List<FillInterval> getIntervalsByLHCModes(final Object start,
                                                   final Object end,
                                                   final String mode1,
                                                   final String mode2) {
    return fills.getIntervalsByLHCModes(codec.encode(start), codec.encode(end),
        mode1, mode2);
  }

  /**
   * @param start The start of the window.
   * @param end The end of the window.
   * @param mode1 The opening mode name.
   * @param mode2 The closing mode name.
   * @param mode1_field Which edge of {@code mode1} opens the interval.
   * @param mode2_field Which edge of {@code mode2} closes it.
   * @param mode1_index The occurrence of {@code mode1}, negative from the end.
   * @param mode2_index The occurrence of {@code mode2}, negative from the end.
   * @return The intervals in time order, possibly empty.
   */
  public List<FillInterval> getIntervalsByLHCModes(
      final Object start,
      final Object end,
      final String mode1,
      final String mode2,
      final ModeTimeField mode1_field,
      final ModeTimeField mode2_field,
      final int mode1_index,
      final int mode2_index) {
    return fills.getIntervalsByLHCModes(codec.encode(start), codec.encode(end),
        mode1, mode2, mode1_field, mode2_field, mode1_index, mode2_index);
  }

  private TimeStamp requireBound(final Object value, final String what) {
    final TimeStamp timestamp = codec.encode(value);
    if (timestamp == null) {
      throw new InvalidQueryException(what + " time cannot be null.");
    }
    return timestamp;
  }

  private static PointLookup lookup(final Object end) {
    if (end == null) {
      return PointLookup.LAST;
    }
    if (end instanceof PointLookup) {
      return (PointLookup) end;
    }
    if (end instanceof String) {
      return PointLookup.fromString((String) end);
    }
    return null;
  }

  private static ServiceFactory initialize(final ServiceFactory factory,
                                           final Config config) {
    if (factory == null) {
      throw new IllegalArgumentException("Service factory cannot be null.");
    }
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (config.configLocation() == null) {
      LOG.debug("Default application and client names selected, this can "
          + "result in poor performance. Set different values or provide a "
          + "configuration file (default name: '" + Config.FILE_NAME + "').");
    }
    factory.initialize(config.applicationName(), config.clientName(),
        config.dataLocation());
    return factory;
  }
}

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

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.NavigableMap;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.timber.data.DataClass;
import net.timber.data.DataPoint;
import net.timber.data.DataSet;
import net.timber.data.DataType;
import net.timber.data.NanoTimeStamp;
import net.timber.data.SimpleDataSet;
import net.timber.data.TimeStamp;
import net.timber.data.TimeStamp.Op;
import net.timber.data.Variable;
import net.timber.data.VariableSet;
import net.timber.data.VariableStatistics;
import net.timber.exceptions.QueryExecutionException;
import net.timber.fill.BeamMode;
import net.timber.fill.Fill;
import net.timber.meta.HierarchyGroup;
import net.timber.query.ScaleAlgorithm;
import net.timber.query.ScaleInterval;
import net.timber.query.ScalingDescriptor;

/**
 * An in-memory logging service for unit tests. Variables, points, groups
 * and fills are added by the test, the service calls then behave like the
 * remote ones would for that data.
 * <p>
 * Notes on what it doesn't do like the real thing:
 * <ul>
 * <li>Fundamental filtering keeps the points logged at exactly the time of a
 * fundamental point.</li>
 * <li>Aligned values are the last value at or before each master timestamp,
 * NaN when there is none.</li>
 * <li>Fixed intervals are computed in UTC and only for scalar numerics.
 * {@code REPEAT} and {@code INTERPOLATE} emit one value per interval start
 * in the window, the others one value per non-empty interval.</li>
 * <li>Standard deviations are population deviations.</li>
 * </ul>
 */
public class MemoryBackend implements MetaService, TimeseriesService,
    FillService, ServiceFactory {

  /** Variables in discovery order. */
  private final Map<String, Variable> variables = Maps.newLinkedHashMap();

  //      variable        timestamp
  private final Map<String, TreeMap<TimeStamp, MockDataPoint>> data =
      Maps.newHashMap();

  private final List<HierarchyGroup> top_level = Lists.newArrayList();
  private final ListMultimap<HierarchyGroup, HierarchyGroup> child_groups =
      ArrayListMultimap.create();
  private final ListMultimap<HierarchyGroup, Variable> attached =
      ArrayListMultimap.create();

  private final Map<String, SortedMap<TimeStamp, List<String>>> vector_elements =
      Maps.newHashMap();

  private final TreeMap<Integer, Fill> fills = Maps.newTreeMap();

  private String application_name;
  private String client_name;
  private DataLocation location;

  // ------------------------------------------------------------------
  // test setup

  public Variable addVariable(final String name, final DataType type) {
    return addVariable(new Variable(name, type));
  }

  public Variable addVariable(final Variable variable) {
    variables.put(variable.getVariableName(), variable);
    return variable;
  }

  /** Stores the points, the variables must have been added. */
  public void addData(final MockDataPoint... points) {
    for (final MockDataPoint point : points) {
      if (!variables.containsKey(point.variableName())) {
        throw new IllegalStateException("Add variable " + point.variableName()
            + " first");
      }
      TreeMap<TimeStamp, MockDataPoint> series = data.get(point.variableName());
      if (series == null) {
        series = new TreeMap<TimeStamp, MockDataPoint>(TimeStamp.COMPARATOR);
        data.put(point.variableName(), series);
      }
      series.put(point.timestamp(), point);
    }
  }

  /**
   * @param parent The parent group, null for a top level group.
   * @param name The raw group name.
   * @param description The description.
   * @return The new group.
   */
  public MockGroup addGroup(final MockGroup parent,
                            final String name,
                            final String description) {
    final MockGroup group = new MockGroup(name, description,
        parent == null ? "/" + name : parent.getHierarchyPath() + "/" + name);
    if (parent == null) {
      top_level.add(group);
    } else {
      child_groups.put(parent, group);
    }
    return group;
  }

  public void attach(final HierarchyGroup group, final Variable... attach) {
    for (final Variable variable : attach) {
      attached.put(group, variable);
    }
  }

  public void setVectorElements(final String name,
                                final TimeStamp since,
                                final List<String> elements) {
    SortedMap<TimeStamp, List<String>> map = vector_elements.get(name);
    if (map == null) {
      map = new TreeMap<TimeStamp, List<String>>(TimeStamp.COMPARATOR);
      vector_elements.put(name, map);
    }
    map.put(since, elements);
  }

  public void addFill(final Fill fill) {
    fills.put(fill.getFillNumber(), fill);
  }

  public String applicationName() {
    return application_name;
  }

  public String clientName() {
    return client_name;
  }

  public DataLocation location() {
    return location;
  }

  // ------------------------------------------------------------------
  // ServiceFactory

  @Override
  public void initialize(final String application_name,
                         final String client_name,
                         final DataLocation location) {
    this.application_name = application_name;
    this.client_name = client_name;
    this.location = location;
  }

  @Override
  public MetaService metaService() {
    return this;
  }

  @Override
  public TimeseriesService timeseriesService() {
    return this;
  }

  @Override
  public FillService fillService() {
    return this;
  }

  // ------------------------------------------------------------------
  // MetaService

  @Override
  public VariableSet findVariablesLike(final String pattern) {
    final Pattern regex = toRegex(pattern);
    final List<Variable> matches = new ArrayList<Variable>();
    for (final Variable variable : variables.values()) {
      if (regex.matcher(variable.getVariableName()).matches()) {
        matches.add(variable);
      }
    }
    return new VariableSet(matches);
  }

  /** Returns the matches in storage order, not in request order. */
  @Override
  public VariableSet findVariablesByName(final Collection<String> names) {
    final Set<String> wanted = new HashSet<String>(names);
    final List<Variable> matches = new ArrayList<Variable>();
    for (final Variable variable : variables.values()) {
      if (wanted.contains(variable.getVariableName())) {
        matches.add(variable);
      }
    }
    return new VariableSet(matches);
  }

  @Override
  public VariableSet getFundamentals(final TimeStamp start,
                                     final TimeStamp end,
                                     final String pattern) {
    final List<Variable> matches = new ArrayList<Variable>();
    for (final Variable variable : findVariablesLike(pattern)) {
      if (variable.getDataType() == DataType.FUNDAMENTAL
          && !window(variable.getVariableName(), start, end).isEmpty()) {
        matches.add(variable);
      }
    }
    return new VariableSet(matches);
  }

  @Override
  public List<HierarchyGroup> getTopLevelHierarchies() {
    return Collections.unmodifiableList(top_level);
  }

  @Override
  public List<HierarchyGroup> getChildHierarchies(final HierarchyGroup group) {
    return Collections.unmodifiableList(child_groups.get(group));
  }

  @Override
  public VariableSet getVariablesAttachedTo(final HierarchyGroup group) {
    return new VariableSet(attached.get(group));
  }

  @Override
  public SortedMap<TimeStamp, List<String>> getVectorElements(
      final Variable variable) {
    final SortedMap<TimeStamp, List<String>> map =
        vector_elements.get(variable.getVariableName());
    if (map == null) {
      return new TreeMap<TimeStamp, List<String>>(TimeStamp.COMPARATOR);
    }
    return Collections.unmodifiableSortedMap(map);
  }

  // ------------------------------------------------------------------
  // TimeseriesService

  @Override
  public DataSet getDataInTimeWindow(final Variable variable,
                                     final TimeStamp start,
                                     final TimeStamp end) {
    return dataSet(variable, window(variable.getVariableName(), start, end)
        .values());
  }

  @Override
  public DataSet getDataInTimeWindowFilteredByFundamentals(
      final Variable variable,
      final TimeStamp start,
      final TimeStamp end,
      final VariableSet fundamentals) {
    final Set<TimeStamp> cycles = new HashSet<TimeStamp>();
    for (final Variable fundamental : fundamentals) {
      cycles.addAll(window(fundamental.getVariableName(), start, end).keySet());
    }
    final List<MockDataPoint> kept = new ArrayList<MockDataPoint>();
    for (final MockDataPoint point : window(variable.getVariableName(), start,
        end).values()) {
      if (cycles.contains(point.timestamp())) {
        kept.add(point);
      }
    }
    return dataSet(variable, kept);
  }

  @Override
  public DataSet getDataAlignedToTimestamps(final Variable variable,
                                            final DataSet master) {
    final TreeMap<TimeStamp, MockDataPoint> series = series(
        variable.getVariableName());
    final List<MockDataPoint> aligned = new ArrayList<MockDataPoint>();
    for (final DataPoint reference : master) {
      final Entry<TimeStamp, MockDataPoint> entry =
          series.floorEntry(reference.timestamp());
      if (entry == null) {
        aligned.add(new MockDataPoint(variable.getVariableName(),
            reference.timestamp(), DataClass.NUMERIC_DOUBLE, Double.NaN));
      } else {
        aligned.add(entry.getValue().at(reference.timestamp()));
      }
    }
    return dataSet(variable, aligned);
  }

  @Override
  public DataPoint getLastDataPriorToTimestamp(final Variable variable,
                                               final TimeStamp timestamp) {
    final Entry<TimeStamp, MockDataPoint> entry = series(
        variable.getVariableName()).lowerEntry(timestamp);
    return entry == null ? null : entry.getValue();
  }

  @Override
  public DataPoint getNextDataAfterTimestamp(final Variable variable,
                                             final TimeStamp timestamp) {
    final Entry<TimeStamp, MockDataPoint> entry = series(
        variable.getVariableName()).higherEntry(timestamp);
    return entry == null ? null : entry.getValue();
  }

  @Override
  public List<VariableStatistics> getVariableStatistics(
      final VariableSet variable_set,
      final TimeStamp start,
      final TimeStamp end) {
    final List<VariableStatistics> results = new ArrayList<VariableStatistics>();
    for (final Variable variable : variable_set) {
      final NavigableMap<TimeStamp, MockDataPoint> window = window(
          variable.getVariableName(), start, end);
      final VariableStatistics.Builder builder = VariableStatistics.newBuilder()
          .setVariableName(variable.getVariableName())
          .setValueCount(window.size());
      if (!window.isEmpty()) {
        builder.setMinTstamp(window.firstKey())
            .setMaxTstamp(window.lastKey());
        final double[] values = numericValues(window.values());
        if (values != null) {
          double min = Double.POSITIVE_INFINITY;
          double max = Double.NEGATIVE_INFINITY;
          double sum = 0;
          for (final double value : values) {
            min = Math.min(min, value);
            max = Math.max(max, value);
            sum += value;
          }
          final double avg = sum / values.length;
          double squares = 0;
          for (final double value : values) {
            squares += (value - avg) * (value - avg);
          }
          builder.setMinValue(min)
              .setMaxValue(max)
              .setAvgValue(avg)
              .setStandardDeviationValue(Math.sqrt(squares / values.length));
        }
      }
      results.add(builder.build());
    }
    return results;
  }

  @Override
  public DataSet getDataInFixedIntervals(final Variable variable,
                                         final TimeStamp start,
                                         final TimeStamp end,
                                         final ScalingDescriptor scaling) {
    if (variable.getDataType() != DataType.NUMERIC) {
      throw new QueryExecutionException("Scaling is only supported for "
          + "scalar numeric variables, not " + variable.getDataType(), 400);
    }
    final NavigableMap<TimeStamp, MockDataPoint> window = window(
        variable.getVariableName(), start, end);
    final List<MockDataPoint> results = new ArrayList<MockDataPoint>();
    switch (scaling.getAlgorithm()) {
    case REPEAT:
    case INTERPOLATE:
      final TreeMap<TimeStamp, MockDataPoint> all = series(
          variable.getVariableName());
      for (TimeStamp bucket = bucketStart(start, scaling);
           bucket.compare(Op.LTE, end);
           bucket = nextBucket(bucket, scaling)) {
        results.add(new MockDataPoint(variable.getVariableName(), bucket,
            DataClass.NUMERIC_DOUBLE, fill(all, bucket, scaling)));
      }
      break;
    default:
      final TreeMap<TimeStamp, List<Double>> buckets =
          new TreeMap<TimeStamp, List<Double>>(TimeStamp.COMPARATOR);
      for (final MockDataPoint point : window.values()) {
        final TimeStamp bucket = bucketStart(point.timestamp(), scaling);
        List<Double> values = buckets.get(bucket);
        if (values == null) {
          values = new ArrayList<Double>();
          buckets.put(bucket, values);
        }
        values.add(numericValue(point));
      }
      for (final Entry<TimeStamp, List<Double>> entry : buckets.entrySet()) {
        results.add(new MockDataPoint(variable.getVariableName(),
            entry.getKey(), DataClass.NUMERIC_DOUBLE,
            reduce(entry.getValue(), scaling)));
      }
    }
    return dataSet(variable, results);
  }

  // ------------------------------------------------------------------
  // FillService

  @Override
  public Fill getFill(final int fill_number) {
    return fills.get(fill_number);
  }

  @Override
  public Fill getLastCompletedFill() {
    for (final Fill fill : fills.descendingMap().values()) {
      if (fill.getEndTime() != null) {
        return fill;
      }
    }
    return null;
  }

  @Override
  public List<Fill> getFillsInTimeWindow(final TimeStamp start,
                                         final TimeStamp end) {
    final List<Fill> results = new ArrayList<Fill>();
    for (final Fill fill : fills.values()) {
      if (fill.getStartTime().compare(Op.LTE, end)
          && (fill.getEndTime() == null
              || fill.getEndTime().compare(Op.GTE, start))) {
        results.add(fill);
      }
    }
    return results;
  }

  @Override
  public List<Fill> getFillsInTimeWindowContainingBeamModes(
      final TimeStamp start,
      final TimeStamp end,
      final Set<BeamMode> beam_modes) {
    final List<Fill> results = new ArrayList<Fill>();
    for (final Fill fill : getFillsInTimeWindow(start, end)) {
      for (final BeamMode mode : beam_modes) {
        if (fill.hasBeamMode(mode.name())) {
          results.add(fill);
          break;
        }
      }
    }
    return results;
  }

  // ------------------------------------------------------------------
  // helpers

  private TreeMap<TimeStamp, MockDataPoint> series(final String name) {
    final TreeMap<TimeStamp, MockDataPoint> series = data.get(name);
    return series == null ?
        new TreeMap<TimeStamp, MockDataPoint>(TimeStamp.COMPARATOR) : series;
  }

  private NavigableMap<TimeStamp, MockDataPoint> window(final String name,
                                                        final TimeStamp start,
                                                        final TimeStamp end) {
    return series(name).subMap(start, true, end, true);
  }

  private static DataSet dataSet(final Variable variable,
                                 final Collection<MockDataPoint> points) {
    return new SimpleDataSet(variable.getVariableName(),
        variable.getDataType(), new ArrayList<DataPoint>(points));
  }

  private static Pattern toRegex(final String pattern) {
    final List<String> parts = new ArrayList<String>();
    for (final String part : Splitter.on('%').split(pattern)) {
      parts.add(part.isEmpty() ? "" : Pattern.quote(part));
    }
    return Pattern.compile(Joiner.on(".*").join(parts));
  }

  private static double numericValue(final DataPoint point) {
    if (point.dataClass() == DataClass.NUMERIC_LONG) {
      return point.longValue();
    }
    return point.doubleValue();
  }

  /** @return The scalar values, null if the points aren't scalar numerics. */
  private static double[] numericValues(final Collection<MockDataPoint> points) {
    final double[] values = new double[points.size()];
    int i = 0;
    for (final MockDataPoint point : points) {
      if (point.dataClass() != DataClass.NUMERIC_DOUBLE
          && point.dataClass() != DataClass.NUMERIC_LONG) {
        return null;
      }
      values[i++] = numericValue(point);
    }
    return values;
  }

  private static double reduce(final List<Double> values,
                               final ScalingDescriptor scaling) {
    switch (scaling.getAlgorithm()) {
    case COUNT:
      return values.size();
    case MIN:
      return Collections.min(values);
    case MAX:
      return Collections.max(values);
    default:
      double sum = 0;
      for (final double value : values) {
        sum += value;
      }
      return scaling.getAlgorithm() == ScaleAlgorithm.AVG ?
          sum / values.size() : sum;
    }
  }

  private static double fill(final TreeMap<TimeStamp, MockDataPoint> all,
                             final TimeStamp bucket,
                             final ScalingDescriptor scaling) {
    final Entry<TimeStamp, MockDataPoint> before = all.floorEntry(bucket);
    if (before == null) {
      return Double.NaN;
    }
    if (scaling.getAlgorithm() == ScaleAlgorithm.REPEAT
        || before.getKey().compare(Op.EQ, bucket)) {
      return numericValue(before.getValue());
    }
    final Entry<TimeStamp, MockDataPoint> after = all.higherEntry(bucket);
    if (after == null) {
      return Double.NaN;
    }
    final double x0 = before.getKey().epochSeconds();
    final double x1 = after.getKey().epochSeconds();
    final double y0 = numericValue(before.getValue());
    final double y1 = numericValue(after.getValue());
    return y0 + (y1 - y0) * (bucket.epochSeconds() - x0) / (x1 - x0);
  }

  static TimeStamp bucketStart(final TimeStamp timestamp,
                               final ScalingDescriptor scaling) {
    final int size = scaling.getSize();
    final ScaleInterval interval = scaling.getInterval();
    if (interval == ScaleInterval.MONTH || interval == ScaleInterval.YEAR) {
      final ZonedDateTime utc = timestamp.toInstant().atZone(ZoneOffset.UTC);
      final long months = interval == ScaleInterval.MONTH ?
          (utc.getYear() - 1970L) * 12 + utc.getMonthValue() - 1 :
          (utc.getYear() - 1970L) * 12;
      final long unit_months = interval == ScaleInterval.MONTH ? 1 : 12;
      final long start = Math.floorDiv(months, size * unit_months)
          * size * unit_months;
      return NanoTimeStamp.fromInstant(ZonedDateTime.of(1970, 1, 1, 0, 0, 0, 0,
          ZoneOffset.UTC).plusMonths(start).toInstant());
    }
    final long width = size * interval.chronoUnit().getDuration().getSeconds();
    return new NanoTimeStamp(Math.floorDiv(timestamp.epoch(), width) * width, 0);
  }

  static TimeStamp nextBucket(final TimeStamp bucket,
                              final ScalingDescriptor scaling) {
    return NanoTimeStamp.fromInstant(bucket.toInstant().atZone(ZoneOffset.UTC)
        .plus(scaling.getSize(), scaling.getInterval().chronoUnit())
        .toInstant());
  }

  /** A group identified by its path. */
  public static class MockGroup implements HierarchyGroup {
    private final String name;
    private final String description;
    private final String path;

    public MockGroup(final String name,
                     final String description,
                     final String path) {
      this.name = name;
      this.description = description;
      this.path = path;
    }

    @Override
    public String getHierarchyName() {
      return name;
    }

    @Override
    public String getDescription() {
      return description;
    }

    @Override
    public String getHierarchyPath() {
      return path;
    }

    @Override
    public boolean equals(final Object o) {
      return o instanceof MockGroup && path.equals(((MockGroup) o).path);
    }

    @Override
    public int hashCode() {
      return path.hashCode();
    }

    @Override
    public String toString() {
      return path;
    }
  }
}

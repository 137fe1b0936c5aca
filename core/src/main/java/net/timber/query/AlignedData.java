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

import com.google.common.collect.ImmutableList;

import net.timber.data.TimeStamp;

/**
 * Variables sampled on the timestamps of a master variable. Every series
 * has the master's timestamps, the master comes first.
 *
 * @since 1.0
 */
public final class AlignedData {
  private static final AlignedData EMPTY = new AlignedData(null,
      Collections.<Series>emptyList());

  private final String master_name;

  /** The series keyed by name, master first. */
  private final Map<String, Series> series;

  /**
   * Default ctor.
   * @param master_name The master variable name, null only when empty.
   * @param series The master series followed by the others.
   * @throws IllegalArgumentException if a series is not as long as the
   * master.
   */
  public AlignedData(final String master_name, final List<Series> series) {
    if (series == null) {
      throw new IllegalArgumentException("Series cannot be null.");
    }
    final Map<String, Series> map = new LinkedHashMap<String, Series>();
    for (final Series entry : series) {
      if (!map.isEmpty() && entry.size() != series.get(0).size()) {
        throw new IllegalArgumentException("Series " + entry.getVariableName()
            + " has " + entry.size() + " values, expected "
            + series.get(0).size());
      }
      map.put(entry.getVariableName(), entry);
    }
    this.master_name = master_name;
    this.series = Collections.unmodifiableMap(map);
  }

  /** @return A shared empty instance. */
  public static AlignedData empty() {
    return EMPTY;
  }

  /** @return The master variable name, null when empty. */
  public String getMasterName() {
    return master_name;
  }

  /** @return True if there's no master. */
  public boolean isEmpty() {
    return series.isEmpty();
  }

  /** @return The variable names, master first. */
  public List<String> getVariableNames() {
    return ImmutableList.copyOf(series.keySet());
  }

  /** @return The number of master samples. */
  public int size() {
    return isEmpty() ? 0 : master().size();
  }

  /** @return The master timestamps, empty when there's no master. */
  public List<TimeStamp> timestamps() {
    return isEmpty() ? ImmutableList.<TimeStamp>of() : master().timestamps();
  }

  /** @return The master timestamps in the requested rendering. */
  public List<Object> decodedTimestamps() {
    return isEmpty() ? ImmutableList.<Object>of() : master().decodedTimestamps();
  }

  /**
   * @param name A variable name.
   * @return The values of the variable, null if it's not part of the result.
   */
  public SeriesValues getValues(final String name) {
    final Series entry = series.get(name);
    return entry == null ? null : entry.values();
  }

  /**
   * @param name A variable name.
   * @return The series of the variable, null if it's not part of the result.
   */
  public Series getSeries(final String name) {
    return series.get(name);
  }

  /** @return The series keyed by name, master first. */
  public Map<String, Series> getSeries() {
    return series;
  }

  private Series master() {
    return series.get(master_name);
  }

  @Override
  public String toString() {
    return "AlignedData{master=" + master_name + ", size=" + size()
        + ", variables=" + series.keySet() + "}";
  }
}

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
import java.util.Collections;
import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import net.timber.data.TimeStamp;
import net.timber.data.TimestampCodec;

/**
 * A decoded series: ascending timestamps and one value per timestamp.
 * <p>
 * The canonical timestamps are always available; {@link #decodedTimestamps()}
 * renders them as epoch seconds or calendar values depending on the
 * {@code unixtime} flag the series was decoded with.
 *
 * @since 1.0
 */
public final class Series {

  /** The variable name, may be null when decoding an anonymous data set. */
  private final String variable_name;

  private final List<TimeStamp> timestamps;

  private final SeriesValues values;

  /** Used to render timestamps. */
  private final TimestampCodec codec;

  /** Whether to render timestamps as epoch seconds. */
  private final boolean unixtime;

  /**
   * Default ctor.
   * @param variable_name The variable name, may be null.
   * @param timestamps The non-null timestamps, ascending.
   * @param values The non-null values, as many as timestamps.
   * @param codec A non-null codec to render timestamps.
   * @param unixtime Whether to render timestamps as epoch seconds.
   * @throws IllegalArgumentException if an argument was null or the lengths
   * differ.
   */
  public Series(final String variable_name,
                final List<TimeStamp> timestamps,
                final SeriesValues values,
                final TimestampCodec codec,
                final boolean unixtime) {
    if (timestamps == null) {
      throw new IllegalArgumentException("Timestamps cannot be null.");
    }
    if (values == null) {
      throw new IllegalArgumentException("Values cannot be null.");
    }
    if (codec == null) {
      throw new IllegalArgumentException("Codec cannot be null.");
    }
    if (timestamps.size() != values.size()) {
      throw new IllegalArgumentException("Found " + timestamps.size()
          + " timestamps but " + values.size() + " values for "
          + variable_name);
    }
    this.variable_name = variable_name;
    this.timestamps = ImmutableList.copyOf(timestamps);
    this.values = values;
    this.codec = codec;
    this.unixtime = unixtime;
  }

  /**
   * @param variable_name The variable name, may be null.
   * @param kind The value kind.
   * @param codec A non-null codec.
   * @param unixtime The timestamp rendering flag.
   * @return An empty series.
   */
  public static Series empty(final String variable_name,
                             final SeriesValues.Kind kind,
                             final TimestampCodec codec,
                             final boolean unixtime) {
    return new Series(variable_name, Collections.<TimeStamp>emptyList(),
        SeriesValues.empty(kind), codec, unixtime);
  }

  /** @return The variable name, may be null. */
  public String getVariableName() {
    return variable_name;
  }

  /** @return The canonical timestamps. */
  public List<TimeStamp> timestamps() {
    return timestamps;
  }

  /** @return The values. */
  public SeriesValues values() {
    return values;
  }

  /** @return Whether timestamps render as epoch seconds. */
  public boolean isUnixtime() {
    return unixtime;
  }

  /** @return The number of samples. */
  public int size() {
    return timestamps.size();
  }

  /** @return True if there are no samples. */
  public boolean isEmpty() {
    return timestamps.isEmpty();
  }

  /** @return The timestamps as fractional epoch seconds. */
  public double[] epochSeconds() {
    final double[] seconds = new double[timestamps.size()];
    for (int i = 0; i < seconds.length; i++) {
      seconds[i] = timestamps.get(i).epochSeconds();
    }
    return seconds;
  }

  /**
   * @return The timestamps as {@link Double} epoch seconds when decoded with
   * {@code unixtime}, as {@link java.time.ZonedDateTime}s otherwise.
   */
  public List<Object> decodedTimestamps() {
    final List<Object> decoded = new ArrayList<Object>(timestamps.size());
    for (final TimeStamp timestamp : timestamps) {
      decoded.add(codec.decode(timestamp, unixtime));
    }
    return decoded;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("variable", variable_name)
        .add("size", timestamps.size())
        .add("kind", values.kind())
        .toString();
  }
}

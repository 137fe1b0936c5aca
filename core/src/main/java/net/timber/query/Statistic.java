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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.MoreObjects;

import net.timber.data.TimeStamp;
import net.timber.data.TimestampCodec;
import net.timber.data.VariableStatistics;

/**
 * Summary statistics of one variable over a window.
 * <p>
 * Like {@link Series}, the canonical timestamps are always available and
 * {@link #decodedMinTstamp()} and {@link #decodedMaxTstamp()} render them
 * with the {@code unixtime} flag the statistics were fetched with.
 *
 * @since 1.0
 */
@JsonPropertyOrder({ "variableName", "count", "minTstamp", "maxTstamp",
  "minValue", "maxValue", "avgValue", "stdDev" })
public final class Statistic {

  private final String variable_name;
  private final long count;
  private final TimeStamp min_tstamp;
  private final TimeStamp max_tstamp;
  private final double min_value;
  private final double max_value;
  private final double avg_value;
  private final double std_dev;
  private final TimestampCodec codec;
  private final boolean unixtime;

  /**
   * Copies the service record.
   * @param statistics A non-null record.
   * @param codec A non-null codec to render timestamps.
   * @param unixtime Whether to render timestamps as epoch seconds.
   */
  public Statistic(final VariableStatistics statistics,
                   final TimestampCodec codec,
                   final boolean unixtime) {
    if (statistics == null) {
      throw new IllegalArgumentException("Statistics cannot be null.");
    }
    if (codec == null) {
      throw new IllegalArgumentException("Codec cannot be null.");
    }
    this.codec = codec;
    this.unixtime = unixtime;
    variable_name = statistics.getVariableName();
    count = statistics.getValueCount();
    min_tstamp = statistics.getMinTstamp();
    max_tstamp = statistics.getMaxTstamp();
    min_value = statistics.getMinValue();
    max_value = statistics.getMaxValue();
    avg_value = statistics.getAvgValue();
    std_dev = statistics.getStandardDeviationValue();
  }

  @JsonProperty("variableName")
  public String getVariableName() {
    return variable_name;
  }

  @JsonProperty("count")
  public long getCount() {
    return count;
  }

  @JsonProperty("minTstamp")
  public TimeStamp getMinTstamp() {
    return min_tstamp;
  }

  @JsonProperty("maxTstamp")
  public TimeStamp getMaxTstamp() {
    return max_tstamp;
  }

  /** @return The first timestamp rendered per the unixtime flag. */
  public Object decodedMinTstamp() {
    return codec.decode(min_tstamp, unixtime);
  }

  /** @return The last timestamp rendered per the unixtime flag. */
  public Object decodedMaxTstamp() {
    return codec.decode(max_tstamp, unixtime);
  }

  @JsonProperty("minValue")
  public double getMinValue() {
    return min_value;
  }

  @JsonProperty("maxValue")
  public double getMaxValue() {
    return max_value;
  }

  @JsonProperty("avgValue")
  public double getAvgValue() {
    return avg_value;
  }

  @JsonProperty("stdDev")
  public double getStdDev() {
    return std_dev;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("variable", variable_name)
        .add("count", count)
        .add("minTstamp", min_tstamp)
        .add("maxTstamp", max_tstamp)
        .add("min", min_value)
        .add("max", max_value)
        .add("avg", avg_value)
        .add("stdDev", std_dev)
        .toString();
  }
}

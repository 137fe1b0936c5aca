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
package net.timber.data;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;

/**
 * The summary the statistics service computes for one variable over a time
 * window. When {@link #getValueCount()} is zero the timestamps are null and
 * the values are meaningless.
 *
 * @since 1.0
 */
public final class VariableStatistics {

  private final String variable_name;
  private final long value_count;
  private final TimeStamp min_tstamp;
  private final TimeStamp max_tstamp;
  private final double min_value;
  private final double max_value;
  private final double avg_value;
  private final double standard_deviation_value;

  protected VariableStatistics(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.variable_name)) {
      throw new IllegalArgumentException("Variable name cannot be null or empty.");
    }
    if (builder.value_count < 0) {
      throw new IllegalArgumentException("Value count cannot be negative: "
          + builder.value_count);
    }
    variable_name = builder.variable_name;
    value_count = builder.value_count;
    min_tstamp = builder.min_tstamp;
    max_tstamp = builder.max_tstamp;
    min_value = builder.min_value;
    max_value = builder.max_value;
    avg_value = builder.avg_value;
    standard_deviation_value = builder.standard_deviation_value;
  }

  /** @return The variable name. */
  public String getVariableName() {
    return variable_name;
  }

  /** @return The number of values in the window. */
  public long getValueCount() {
    return value_count;
  }

  /** @return The earliest timestamp in the window, null without values. */
  public TimeStamp getMinTstamp() {
    return min_tstamp;
  }

  /** @return The latest timestamp in the window, null without values. */
  public TimeStamp getMaxTstamp() {
    return max_tstamp;
  }

  /** @return The smallest value. */
  public double getMinValue() {
    return min_value;
  }

  /** @return The largest value. */
  public double getMaxValue() {
    return max_value;
  }

  /** @return The mean value. */
  public double getAvgValue() {
    return avg_value;
  }

  /** @return The standard deviation of the values. */
  public double getStandardDeviationValue() {
    return standard_deviation_value;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("variable", variable_name)
        .add("count", value_count)
        .add("minTstamp", min_tstamp)
        .add("maxTstamp", max_tstamp)
        .add("min", min_value)
        .add("max", max_value)
        .add("avg", avg_value)
        .add("stddev", standard_deviation_value)
        .toString();
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private String variable_name;
    private long value_count;
    private TimeStamp min_tstamp;
    private TimeStamp max_tstamp;
    private double min_value;
    private double max_value;
    private double avg_value;
    private double standard_deviation_value;

    public Builder setVariableName(final String variable_name) {
      this.variable_name = variable_name;
      return this;
    }

    public Builder setValueCount(final long value_count) {
      this.value_count = value_count;
      return this;
    }

    public Builder setMinTstamp(final TimeStamp min_tstamp) {
      this.min_tstamp = min_tstamp;
      return this;
    }

    public Builder setMaxTstamp(final TimeStamp max_tstamp) {
      this.max_tstamp = max_tstamp;
      return this;
    }

    public Builder setMinValue(final double min_value) {
      this.min_value = min_value;
      return this;
    }

    public Builder setMaxValue(final double max_value) {
      this.max_value = max_value;
      return this;
    }

    public Builder setAvgValue(final double avg_value) {
      this.avg_value = avg_value;
      return this;
    }

    public Builder setStandardDeviationValue(final double standard_deviation_value) {
      this.standard_deviation_value = standard_deviation_value;
      return this;
    }

    public VariableStatistics build() {
      return new VariableStatistics(this);
    }
  }
}

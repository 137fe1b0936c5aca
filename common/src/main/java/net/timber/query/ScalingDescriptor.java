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

import java.util.Arrays;
import java.util.Objects;

import com.google.common.base.Strings;

import net.timber.exceptions.InvalidQueryException;

/**
 * Representation of a fixed interval scaling: every interval of
 * {@code size} {@link ScaleInterval} units is reduced to one value with the
 * {@link ScaleAlgorithm}. The string form is {@code size_INTERVAL_ALGORITHM},
 * e.g. {@code 1_MINUTE_SUM}.
 * @since 1.0
 */
public final class ScalingDescriptor {

  /** The reduction. */
  private final ScaleAlgorithm algorithm;

  /** The interval unit. */
  private final ScaleInterval interval;

  /** The number of units per interval. */
  private final int size;

  /**
   * Non-stringified, piecewise c-tor.
   * @param algorithm The reduction.
   * @param interval The interval unit.
   * @param size The number of units per interval, strictly positive.
   * @throws InvalidQueryException if any argument is invalid.
   */
  public ScalingDescriptor(final ScaleAlgorithm algorithm,
                           final ScaleInterval interval,
                           final int size) {
    if (algorithm == null) {
      throw new InvalidQueryException("Scaling algorithm cannot be null. "
          + validValues());
    }
    if (interval == null) {
      throw new InvalidQueryException("Scaling interval cannot be null. "
          + validValues());
    }
    if (size <= 0) {
      throw new InvalidQueryException("Scaling size not > 0: " + size + ". "
          + validValues());
    }
    this.algorithm = algorithm;
    this.interval = interval;
    this.size = size;
  }

  /**
   * Builds a descriptor from the three user supplied strings.
   * @param algorithm The algorithm name, e.g. {@code SUM}.
   * @param interval The interval unit name, e.g. {@code MINUTE}.
   * @param size The number of units, e.g. {@code 1}.
   * @return A descriptor.
   * @throws InvalidQueryException if any value is unknown or invalid.
   */
  public static ScalingDescriptor fromStrings(final String algorithm,
                                              final String interval,
                                              final String size) {
    final ScaleAlgorithm parsed_algorithm = ScaleAlgorithm.fromString(algorithm);
    if (parsed_algorithm == null) {
      throw new InvalidQueryException("No such scaling algorithm: '"
          + algorithm + "'. " + validValues());
    }
    final ScaleInterval parsed_interval = ScaleInterval.fromString(interval);
    if (parsed_interval == null) {
      throw new InvalidQueryException("No such scaling interval: '"
          + interval + "'. " + validValues());
    }
    if (Strings.isNullOrEmpty(size)) {
      throw new InvalidQueryException("Scaling size cannot be null or empty. "
          + validValues());
    }
    final int parsed_size;
    try {
      parsed_size = Integer.parseInt(size.trim());
    } catch (NumberFormatException e) {
      throw new InvalidQueryException("Invalid scaling size: '" + size + "'. "
          + validValues(), e);
    }
    return new ScalingDescriptor(parsed_algorithm, parsed_interval, parsed_size);
  }

  /**
   * C-tor for string representations in the {@code size_INTERVAL_ALGORITHM}
   * format.
   * @param specification String representation of a scaling.
   * @return A descriptor.
   * @throws InvalidQueryException if the specification is null or invalid.
   */
  public static ScalingDescriptor parse(final String specification) {
    if (Strings.isNullOrEmpty(specification)) {
      throw new InvalidQueryException("Scaling specification cannot be "
          + "null or empty. " + validValues());
    }
    final String[] parts = specification.split("_");
    if (parts.length != 3) {
      throw new InvalidQueryException("Invalid scaling specification '"
          + specification + "': must consist of size, interval and algorithm. "
          + validValues());
    }
    return fromStrings(parts[2], parts[1], parts[0]);
  }

  /** @return A message listing the accepted values. */
  public static String validValues() {
    return "Algorithm should be one of " + Arrays.toString(ScaleAlgorithm.values())
        + ", interval one of " + Arrays.toString(ScaleInterval.values())
        + " and size a positive integer.";
  }

  /** @return The reduction. */
  public ScaleAlgorithm getAlgorithm() {
    return algorithm;
  }

  /** @return The interval unit. */
  public ScaleInterval getInterval() {
    return interval;
  }

  /** @return The number of units per interval. */
  public int getSize() {
    return size;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ScalingDescriptor)) {
      return false;
    }
    final ScalingDescriptor other = (ScalingDescriptor) o;
    return algorithm == other.algorithm
        && interval == other.interval
        && size == other.size;
  }

  @Override
  public int hashCode() {
    return Objects.hash(algorithm, interval, size);
  }

  @Override
  public String toString() {
    return size + "_" + interval + "_" + algorithm;
  }
}

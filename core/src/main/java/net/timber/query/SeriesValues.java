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
import java.util.List;

import com.google.common.collect.ImmutableList;

import net.timber.data.DataPoint;

/**
 * The values of a decoded series. The element type is fixed once when the
 * data set is decoded and reported by {@link #kind()}; the typed accessors
 * throw a {@link ClassCastException} when called for another kind.
 * <p>
 * Arrays are handed out as is, callers must not modify them.
 *
 * @since 1.0
 */
public final class SeriesValues {

  /** The element type of a series. */
  public enum Kind {
    /** {@code double[]} */
    DOUBLE,
    /** {@code long[]} */
    LONG,
    /** {@code double[][]}, one vector per timestamp. */
    DOUBLE_VECTOR,
    /** {@code long[][]}, one vector per timestamp. */
    LONG_VECTOR,
    /** {@code double[][][]}, one matrix per timestamp. */
    DOUBLE_MATRIX,
    /** {@code long[][][]}, one matrix per timestamp. */
    LONG_MATRIX,
    /** {@code String[][]}, one vector per timestamp. */
    STRING_VECTOR,
    /** {@code String[]} */
    STRING,
    /** {@code boolean[]}, presence markers of fundamentals. */
    BOOLEAN,
    /** The undecoded points. */
    RAW
  }

  private final Kind kind;

  /** An array matching the kind, or a list of points for RAW. */
  private final Object values;

  private final int size;

  private SeriesValues(final Kind kind, final Object values, final int size) {
    this.kind = kind;
    this.values = values;
    this.size = size;
  }

  /**
   * @param kind A non-null kind.
   * @return An empty instance of the kind.
   */
  public static SeriesValues empty(final Kind kind) {
    if (kind == null) {
      throw new IllegalArgumentException("Kind cannot be null.");
    }
    switch (kind) {
    case DOUBLE:
      return ofDoubles(new double[0]);
    case LONG:
      return ofLongs(new long[0]);
    case DOUBLE_VECTOR:
      return ofDoubleVectors(new double[0][]);
    case LONG_VECTOR:
      return ofLongVectors(new long[0][]);
    case DOUBLE_MATRIX:
      return ofDoubleMatrices(new double[0][][]);
    case LONG_MATRIX:
      return ofLongMatrices(new long[0][][]);
    case STRING_VECTOR:
      return ofStringVectors(new String[0][]);
    case STRING:
      return ofStrings(new String[0]);
    case BOOLEAN:
      return ofBooleans(new boolean[0]);
    default:
      return ofRaw(ImmutableList.<DataPoint>of());
    }
  }

  /**
   * @param values A non-null array, one value per timestamp.
   * @return A {@link Kind#DOUBLE} instance wrapping the array.
   * @throws NullPointerException if the array was null.
   */
  public static SeriesValues ofDoubles(final double[] values) {
    return new SeriesValues(Kind.DOUBLE, checkNotNull(values), values.length);
  }

  /**
   * @param values A non-null array, one value per timestamp.
   * @return A {@link Kind#LONG} instance wrapping the array.
   * @throws NullPointerException if the array was null.
   */
  public static SeriesValues ofLongs(final long[] values) {
    return new SeriesValues(Kind.LONG, checkNotNull(values), values.length);
  }

  /** @return A {@link Kind#DOUBLE_VECTOR} instance wrapping the array. */
  public static SeriesValues ofDoubleVectors(final double[][] values) {
    return new SeriesValues(Kind.DOUBLE_VECTOR, checkNotNull(values),
        values.length);
  }

  /** @return A {@link Kind#LONG_VECTOR} instance wrapping the array. */
  public static SeriesValues ofLongVectors(final long[][] values) {
    return new SeriesValues(Kind.LONG_VECTOR, checkNotNull(values),
        values.length);
  }

  /** @return A {@link Kind#DOUBLE_MATRIX} instance wrapping the array. */
  public static SeriesValues ofDoubleMatrices(final double[][][] values) {
    return new SeriesValues(Kind.DOUBLE_MATRIX, checkNotNull(values),
        values.length);
  }

  /** @return A {@link Kind#LONG_MATRIX} instance wrapping the array. */
  public static SeriesValues ofLongMatrices(final long[][][] values) {
    return new SeriesValues(Kind.LONG_MATRIX, checkNotNull(values),
        values.length);
  }

  /** @return A {@link Kind#STRING_VECTOR} instance wrapping the array. */
  public static SeriesValues ofStringVectors(final String[][] values) {
    return new SeriesValues(Kind.STRING_VECTOR, checkNotNull(values),
        values.length);
  }

  /** @return A {@link Kind#STRING} instance wrapping the array. */
  public static SeriesValues ofStrings(final String[] values) {
    return new SeriesValues(Kind.STRING, checkNotNull(values), values.length);
  }

  /** @return A {@link Kind#BOOLEAN} instance wrapping the array. */
  public static SeriesValues ofBooleans(final boolean[] values) {
    return new SeriesValues(Kind.BOOLEAN, checkNotNull(values), values.length);
  }

  /**
   * @param points The non-null undecoded points, copied.
   * @return A {@link Kind#RAW} instance.
   */
  public static SeriesValues ofRaw(final List<DataPoint> points) {
    checkNotNull(points);
    return new SeriesValues(Kind.RAW, ImmutableList.copyOf(points),
        points.size());
  }

  /** @return The element type. */
  public Kind kind() {
    return kind;
  }

  /** @return The number of values. */
  public int size() {
    return size;
  }

  /** @return True if there are no values. */
  public boolean isEmpty() {
    return size == 0;
  }

  /**
   * @return The {@link Kind#DOUBLE} values.
   * @throws ClassCastException if the kind is another one.
   */
  public double[] doubles() {
    check(Kind.DOUBLE);
    return (double[]) values;
  }

  /**
   * @return The {@link Kind#LONG} values.
   * @throws ClassCastException if the kind is another one.
   */
  public long[] longs() {
    check(Kind.LONG);
    return (long[]) values;
  }

  /** @return The {@link Kind#DOUBLE_VECTOR} values. */
  public double[][] doubleVectors() {
    check(Kind.DOUBLE_VECTOR);
    return (double[][]) values;
  }

  /** @return The {@link Kind#LONG_VECTOR} values. */
  public long[][] longVectors() {
    check(Kind.LONG_VECTOR);
    return (long[][]) values;
  }

  /** @return The {@link Kind#DOUBLE_MATRIX} values. */
  public double[][][] doubleMatrices() {
    check(Kind.DOUBLE_MATRIX);
    return (double[][][]) values;
  }

  /** @return The {@link Kind#LONG_MATRIX} values. */
  public long[][][] longMatrices() {
    check(Kind.LONG_MATRIX);
    return (long[][][]) values;
  }

  /** @return The {@link Kind#STRING_VECTOR} values. */
  public String[][] stringVectors() {
    check(Kind.STRING_VECTOR);
    return (String[][]) values;
  }

  /** @return The {@link Kind#STRING} values. */
  public String[] strings() {
    check(Kind.STRING);
    return (String[]) values;
  }

  /** @return The {@link Kind#BOOLEAN} values. */
  public boolean[] booleans() {
    check(Kind.BOOLEAN);
    return (boolean[]) values;
  }

  /** @return The undecoded points of a {@link Kind#RAW} instance. */
  @SuppressWarnings("unchecked")
  public List<DataPoint> raw() {
    check(Kind.RAW);
    return (List<DataPoint>) values;
  }

  /**
   * Scalar numeric values widened to doubles.
   * @return The values as doubles.
   * @throws ClassCastException if the kind is neither DOUBLE nor LONG.
   */
  public double[] asDoubles() {
    if (kind == Kind.DOUBLE) {
      return (double[]) values;
    }
    final long[] longs = longs();
    final double[] result = new double[longs.length];
    for (int i = 0; i < longs.length; i++) {
      result[i] = longs[i];
    }
    return result;
  }

  /**
   * @param index An index from 0 to {@link #size()} exclusive.
   * @return The value at the index, boxed for scalars.
   * @throws IndexOutOfBoundsException if the index was out of range.
   */
  public Object get(final int index) {
    if (index < 0 || index >= size) {
      throw new IndexOutOfBoundsException("Index " + index
          + " out of range for size " + size);
    }
    switch (kind) {
    case DOUBLE:
      return ((double[]) values)[index];
    case LONG:
      return ((long[]) values)[index];
    case BOOLEAN:
      return ((boolean[]) values)[index];
    case RAW:
      return raw().get(index);
    default:
      return ((Object[]) values)[index];
    }
  }

  /** @return True if a floating point value is NaN or infinite. */
  public boolean hasNonFinite() {
    switch (kind) {
    case DOUBLE:
      return hasNonFinite((double[]) values);
    case DOUBLE_VECTOR:
      for (final double[] vector : (double[][]) values) {
        if (hasNonFinite(vector)) {
          return true;
        }
      }
      return false;
    case DOUBLE_MATRIX:
      for (final double[][] matrix : (double[][][]) values) {
        for (final double[] row : matrix) {
          if (hasNonFinite(row)) {
            return true;
          }
        }
      }
      return false;
    default:
      return false;
    }
  }

  @Override
  public String toString() {
    final String rendered;
    switch (kind) {
    case DOUBLE:
      rendered = Arrays.toString((double[]) values);
      break;
    case LONG:
      rendered = Arrays.toString((long[]) values);
      break;
    case BOOLEAN:
      rendered = Arrays.toString((boolean[]) values);
      break;
    case RAW:
      rendered = values.toString();
      break;
    default:
      rendered = Arrays.deepToString((Object[]) values);
    }
    return kind + rendered;
  }

  private static boolean hasNonFinite(final double[] values) {
    if (values == null) {
      return false;
    }
    for (final double value : values) {
      if (!Double.isFinite(value)) {
        return true;
      }
    }
    return false;
  }

  private void check(final Kind expected) {
    if (kind != expected) {
      throw new ClassCastException("Values are of kind " + kind
          + ", not " + expected);
    }
  }

  private static <T> T checkNotNull(final T values) {
    if (values == null) {
      throw new IllegalArgumentException("Values cannot be null.");
    }
    return values;
  }
}

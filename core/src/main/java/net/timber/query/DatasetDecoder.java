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

import com.google.common.collect.Lists;

import net.timber.data.DataClass;
import net.timber.data.DataPoint;
import net.timber.data.DataSet;
import net.timber.data.DataType;
import net.timber.data.TimeStamp;
import net.timber.data.TimestampCodec;

/**
 * Normalizes a data set returned by the time series service into a
 * {@link Series}.
 * <p>
 * The declared {@link DataType} of the variable picks the shape, the
 * {@link DataClass} the data set reports picks between integers and floating
 * point. Combinations this decoder doesn't know are passed through as
 * {@link SeriesValues.Kind#RAW} points with a warning.
 *
 * @since 1.0
 */
public class DatasetDecoder {
  private static final Logger LOG = LoggerFactory.getLogger(
      DatasetDecoder.class);

  /** Renders the timestamps of the series. */
  private final TimestampCodec codec;

  /**
   * Default ctor.
   * @param codec A non-null codec.
   * @throws IllegalArgumentException if the codec was null.
   */
  public DatasetDecoder(final TimestampCodec codec) {
    if (codec == null) {
      throw new IllegalArgumentException("Codec cannot be null.");
    }
    this.codec = codec;
  }

  /** @return The codec used for timestamps. */
  public TimestampCodec codec() {
    return codec;
  }

  /**
   * Decodes the data set, naming the series after the data set.
   * @param data_set The data set, may be null.
   * @param data_type The declared type of the variable, may be null.
   * @param unixtime Whether the series renders timestamps as epoch seconds.
   * @return A series, empty for null or empty data sets. Never null.
   */
  public Series decode(final DataSet data_set,
                       final DataType data_type,
                       final boolean unixtime) {
    return decode(data_set == null ? null : data_set.variableName(),
        data_set, data_type, unixtime);
  }

  /**
   * Decodes the data set.
   * @param name The variable name of the series, may be null.
   * @param data_set The data set, may be null.
   * @param data_type The declared type of the variable, may be null.
   * @param unixtime Whether the series renders timestamps as epoch seconds.
   * @return A series, empty for null or empty data sets. Never null.
   */
  public Series decode(final String name,
                       final DataSet data_set,
                       final DataType data_type,
                       final boolean unixtime) {
    if (data_set == null || data_set.isEmpty()) {
      return Series.empty(name, emptyKind(data_type), codec, unixtime);
    }

    final List<DataPoint> points = Lists.newArrayList(data_set);
    final List<TimeStamp> timestamps = new ArrayList<TimeStamp>(points.size());
    for (final DataPoint point : points) {
      timestamps.add(point.timestamp());
    }
    final DataClass data_class = data_set.dataClass();
    final SeriesValues values = decodeValues(points, data_type, data_class);
    if (values.kind() == SeriesValues.Kind.RAW) {
      LOG.warn("Unsupported data class " + data_class + " for " + name
          + " of type " + data_type + ", returning the raw points");
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Decoded " + points.size() + " " + values.kind()
          + " values for " + name);
    }
    return new Series(name, timestamps, values, codec, unixtime);
  }

  private SeriesValues decodeValues(final List<DataPoint> points,
                                    final DataType data_type,
                                    final DataClass data_class) {
    if (data_type == null) {
      return SeriesValues.ofRaw(points);
    }
    final int size = points.size();
    switch (data_type) {
    case NUMERIC:
      if (data_class == DataClass.NUMERIC_LONG) {
        final long[] longs = new long[size];
        for (int i = 0; i < size; i++) {
          longs[i] = points.get(i).longValue();
        }
        return SeriesValues.ofLongs(longs);
      }
      if (data_class == DataClass.NUMERIC_DOUBLE) {
        final double[] doubles = new double[size];
        for (int i = 0; i < size; i++) {
          doubles[i] = points.get(i).doubleValue();
        }
        return SeriesValues.ofDoubles(doubles);
      }
      break;
    case VECTORNUMERIC:
      if (data_class == DataClass.VECTOR_NUMERIC_LONG) {
        final long[][] longs = new long[size][];
        for (int i = 0; i < size; i++) {
          longs[i] = points.get(i).longVector();
        }
        return SeriesValues.ofLongVectors(longs);
      }
      if (data_class == DataClass.VECTOR_NUMERIC_DOUBLE) {
        final double[][] doubles = new double[size][];
        for (int i = 0; i < size; i++) {
          doubles[i] = points.get(i).doubleVector();
        }
        return SeriesValues.ofDoubleVectors(doubles);
      }
      break;
    case MATRIXNUMERIC:
      if (data_class == DataClass.MATRIX_NUMERIC_LONG) {
        final long[][][] longs = new long[size][][];
        for (int i = 0; i < size; i++) {
          longs[i] = points.get(i).longMatrix();
        }
        return SeriesValues.ofLongMatrices(longs);
      }
      if (data_class == DataClass.MATRIX_NUMERIC_DOUBLE) {
        final double[][][] doubles = new double[size][][];
        for (int i = 0; i < size; i++) {
          doubles[i] = points.get(i).doubleMatrix();
        }
        return SeriesValues.ofDoubleMatrices(doubles);
      }
      break;
    case VECTORSTRING:
      if (data_class == DataClass.VECTOR_STRING) {
        final String[][] strings = new String[size][];
        for (int i = 0; i < size; i++) {
          strings[i] = points.get(i).stringVector();
        }
        return SeriesValues.ofStringVectors(strings);
      }
      break;
    case TEXTUAL:
      if (data_class == DataClass.TEXTUAL) {
        final String[] strings = new String[size];
        for (int i = 0; i < size; i++) {
          strings[i] = points.get(i).stringValue();
        }
        return SeriesValues.ofStrings(strings);
      }
      break;
    case FUNDAMENTAL:
      // a fundamental is only ever present
      final boolean[] present = new boolean[size];
      for (int i = 0; i < size; i++) {
        present[i] = true;
      }
      return SeriesValues.ofBooleans(present);
    default:
      break;
    }
    return SeriesValues.ofRaw(points);
  }

  private static SeriesValues.Kind emptyKind(final DataType data_type) {
    if (data_type == null) {
      return SeriesValues.Kind.RAW;
    }
    switch (data_type) {
    case NUMERIC:
      return SeriesValues.Kind.DOUBLE;
    case VECTORNUMERIC:
      return SeriesValues.Kind.DOUBLE_VECTOR;
    case MATRIXNUMERIC:
      return SeriesValues.Kind.DOUBLE_MATRIX;
    case VECTORSTRING:
      return SeriesValues.Kind.STRING_VECTOR;
    case TEXTUAL:
      return SeriesValues.Kind.STRING;
    case FUNDAMENTAL:
      return SeriesValues.Kind.BOOLEAN;
    default:
      return SeriesValues.Kind.RAW;
    }
  }
}

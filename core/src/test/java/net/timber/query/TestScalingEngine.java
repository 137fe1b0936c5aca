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

import static net.timber.storage.MockDataPoint.ts;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import net.timber.data.DataType;
import net.timber.data.TimestampCodec;
import net.timber.exceptions.InvalidQueryException;
import net.timber.exceptions.QueryExecutionException;
import net.timber.storage.MemoryBackend;
import net.timber.storage.MockDataPoint;

public class TestScalingEngine {
  private MemoryBackend backend;
  private ScalingEngine engine;

  @Before
  public void before() throws Exception {
    backend = new MemoryBackend();
    backend.addVariable("TEST:A", DataType.NUMERIC);
    backend.addVariable("TEST:TEXT", DataType.TEXTUAL);
    for (int i = 1; i <= 6; i++) {
      backend.addData(MockDataPoint.ofDouble("TEST:A", (i - 1) * 30, i));
    }
    backend.addData(MockDataPoint.ofString("TEST:TEXT", 0, "ON"));
    engine = new ScalingEngine(backend, new VariableResolver(backend),
        new DatasetDecoder(new TimestampCodec(ZoneOffset.UTC)));
  }

  @Test
  public void sumPerMinute() throws Exception {
    final Map<String, Series> results = engine.getScaled(
        VariableSelector.names("TEST:A"), ts(0), ts(179), "SUM", "MINUTE", "1",
        true);
    final Series series = results.get("TEST:A");
    assertEquals(Arrays.asList(ts(0), ts(60), ts(120)), series.timestamps());
    assertArrayEquals(new double[] { 3, 7, 11 }, series.values().doubles(), 0);
  }

  @Test
  public void avgPerTwoMinutes() throws Exception {
    final Series series = engine.getScaled(VariableSelector.names("TEST:A"),
        ts(0), ts(179), "avg", "minute", "2", true).get("TEST:A");
    assertEquals(Arrays.asList(ts(0), ts(120)), series.timestamps());
    assertArrayEquals(new double[] { 2.5, 5.5 }, series.values().doubles(), 0);
  }

  @Test
  public void descriptor() throws Exception {
    final Series series = engine.getScaled(VariableSelector.pattern("TEST:A"),
        ts(0), ts(179), ScalingDescriptor.parse("1_MINUTE_COUNT"), true)
        .get("TEST:A");
    assertArrayEquals(new double[] { 2, 2, 2 }, series.values().doubles(), 0);
  }

  @Test
  public void repeatKeepsNaN() throws Exception {
    final Series series = engine.getScaled(VariableSelector.names("TEST:A"),
        ts(-60), ts(60), "REPEAT", "MINUTE", "1", true).get("TEST:A");
    assertEquals(Arrays.asList(ts(-60), ts(0), ts(60)), series.timestamps());
    final double[] values = series.values().doubles();
    assertTrue(Double.isNaN(values[0]));
    assertEquals(1, values[1], 0);
    assertEquals(3, values[2], 0);
    assertTrue(series.values().hasNonFinite());
  }

  @Test
  public void invalidScaling() throws Exception {
    try {
      engine.getScaled(VariableSelector.names("TEST:A"), ts(0), ts(179),
          "MEDIAN", "MINUTE", "1", true);
      fail("Expected InvalidQueryException");
    } catch (InvalidQueryException e) {
      assertTrue(e.getMessage().contains("Algorithm should be one of"));
    }
    try {
      engine.getScaled(VariableSelector.names("TEST:A"), ts(0), ts(179),
          "SUM", "MINUTE", "one", true);
      fail("Expected InvalidQueryException");
    } catch (InvalidQueryException e) { }
    try {
      engine.getScaled(VariableSelector.names("TEST:A"), ts(0), ts(179),
          (ScalingDescriptor) null, true);
      fail("Expected InvalidQueryException");
    } catch (InvalidQueryException e) { }
  }

  @Test
  public void rejectedByService() throws Exception {
    try {
      engine.getScaled(VariableSelector.names("TEST:TEXT"), ts(0), ts(179),
          "SUM", "MINUTE", "1", true);
      fail("Expected InvalidQueryException");
    } catch (InvalidQueryException e) {
      assertTrue(e.getCause() instanceof QueryExecutionException);
      assertTrue(e.getMessage().contains(ScalingDescriptor.validValues()));
    }
  }

  @Test
  public void openWindow() throws Exception {
    try {
      engine.getScaled(VariableSelector.names("TEST:A"), ts(0), null,
          "SUM", "MINUTE", "1", true);
      fail("Expected InvalidQueryException");
    } catch (InvalidQueryException e) { }
  }
}

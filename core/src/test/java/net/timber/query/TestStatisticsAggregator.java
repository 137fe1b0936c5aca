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
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import net.timber.data.DataType;
import net.timber.data.TimestampCodec;
import net.timber.exceptions.InvalidQueryException;
import net.timber.storage.MemoryBackend;
import net.timber.storage.MockDataPoint;
import net.timber.utils.JSON;

public class TestStatisticsAggregator {
  private MemoryBackend backend;
  private StatisticsAggregator aggregator;

  @Before
  public void before() throws Exception {
    backend = new MemoryBackend();
    backend.addVariable("TEST:A", DataType.NUMERIC);
    backend.addVariable("TEST:B", DataType.NUMERIC);
    backend.addVariable("TEST:EMPTY", DataType.NUMERIC);
    backend.addData(
        MockDataPoint.ofDouble("TEST:A", 10, 2),
        MockDataPoint.ofDouble("TEST:A", 20, 4),
        MockDataPoint.ofDouble("TEST:A", 30, 6),
        MockDataPoint.ofLong("TEST:B", 15, 5));
    aggregator = new StatisticsAggregator(backend,
        new VariableResolver(backend), new TimestampCodec(ZoneOffset.UTC));
  }

  @Test
  public void stats() throws Exception {
    final Map<String, Statistic> stats = aggregator.getStats(
        VariableSelector.pattern("TEST:%"), ts(0), ts(100), true);
    assertEquals(Arrays.asList("TEST:A", "TEST:B"),
        new ArrayList<String>(stats.keySet()));

    final Statistic a = stats.get("TEST:A");
    assertEquals("TEST:A", a.getVariableName());
    assertEquals(3, a.getCount());
    assertEquals(ts(10), a.getMinTstamp());
    assertEquals(ts(30), a.getMaxTstamp());
    assertEquals(2, a.getMinValue(), 0);
    assertEquals(6, a.getMaxValue(), 0);
    assertEquals(4, a.getAvgValue(), 0.0000001);
    assertEquals(Math.sqrt(8.0 / 3), a.getStdDev(), 0.0000001);
  }

  @Test
  public void singleSample() throws Exception {
    final Statistic b = aggregator.getStats(VariableSelector.names("TEST:B"),
        ts(0), ts(100), true).get("TEST:B");
    assertEquals(1, b.getCount());
    assertEquals(b.getMinTstamp(), b.getMaxTstamp());
    assertEquals(5, b.getMinValue(), 0);
    assertEquals(5, b.getMaxValue(), 0);
    assertEquals(5, b.getAvgValue(), 0);
    assertEquals(0, b.getStdDev(), 0);
  }

  @Test
  public void decodedTimestamps() throws Exception {
    final Statistic numeric = aggregator.getStats(
        VariableSelector.names("TEST:A"), ts(0), ts(100), true).get("TEST:A");
    assertEquals(10.0, (Double) numeric.decodedMinTstamp(), 0.0);
    assertEquals(30.0, (Double) numeric.decodedMaxTstamp(), 0.0);

    final Statistic calendar = aggregator.getStats(
        VariableSelector.names("TEST:A"), ts(0), ts(100), false)
        .get("TEST:A");
    assertEquals(ZonedDateTime.of(1970, 1, 1, 0, 0, 10, 0, ZoneOffset.UTC),
        calendar.decodedMinTstamp());
    assertEquals(ts(10), calendar.getMinTstamp());
  }

  @Test
  public void emptyVariablesSkipped() throws Exception {
    final Map<String, Statistic> stats = aggregator.getStats(
        VariableSelector.names("TEST:EMPTY", "TEST:A"), ts(0), ts(100),
        true);
    assertFalse(stats.containsKey("TEST:EMPTY"));
    assertTrue(stats.containsKey("TEST:A"));

    assertTrue(aggregator.getStats(VariableSelector.names("TEST:A"), ts(50),
        ts(100), true).isEmpty());
  }

  @Test
  public void nothingFound() throws Exception {
    assertTrue(aggregator.getStats(VariableSelector.pattern("NOPE"), ts(0),
        ts(100), true).isEmpty());
  }

  @Test
  public void openWindow() throws Exception {
    try {
      aggregator.getStats(VariableSelector.names("TEST:A"), ts(0), null,
          true);
      fail("Expected InvalidQueryException");
    } catch (InvalidQueryException e) { }
  }

  @Test
  public void serialize() throws Exception {
    final Statistic b = aggregator.getStats(VariableSelector.names("TEST:B"),
        ts(0), ts(100), true).get("TEST:B");
    final String json = JSON.serializeToString(b);
    assertTrue(json.startsWith("{\"variableName\":\"TEST:B\",\"count\":1,"));
    assertTrue(json.contains("\"minTstamp\":15"));
  }
}

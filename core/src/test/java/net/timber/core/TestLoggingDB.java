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
package net.timber.core;

import static net.timber.storage.MockDataPoint.ts;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import org.junit.Before;
import org.junit.Test;

import net.timber.data.DataType;
import net.timber.data.TimeStamp;
import net.timber.data.Variable;
import net.timber.exceptions.InvalidQueryException;
import net.timber.fill.BeamModeInterval;
import net.timber.fill.Fill;
import net.timber.query.AlignedData;
import net.timber.query.PointLookup;
import net.timber.query.Series;
import net.timber.query.Statistic;
import net.timber.query.VariableSelector;
import net.timber.storage.DataLocation;
import net.timber.storage.MemoryBackend;
import net.timber.storage.MockDataPoint;
import net.timber.tree.HierarchyEntry;
import net.timber.utils.Config;

public class TestLoggingDB {
  /** 2016-08-01 10:00:00 UTC */
  private static final double EPOCH = 1470045600;

  private MemoryBackend backend;
  private Config config;
  private LoggingDB db;

  @Before
  public void before() throws Exception {
    backend = new MemoryBackend();
    backend.addVariable(new Variable("RPTE.UA23.RB.A12:I_MEAS",
        DataType.NUMERIC, "Main dipole current", "A"));
    backend.addVariable(new Variable("RPTE.UA23.RB.A12:I_REF",
        DataType.NUMERIC, "Reference current", "A"));
    backend.addVariable(new Variable("LHC.BQBBQ:FREQ", DataType.VECTORNUMERIC,
        null, null));
    backend.addVariable("CPS:NXCY:FUND", DataType.FUNDAMENTAL);
    backend.addData(
        MockDataPoint.ofDouble("RPTE.UA23.RB.A12:I_MEAS", EPOCH, 760),
        MockDataPoint.ofDouble("RPTE.UA23.RB.A12:I_MEAS", EPOCH + 60, 770),
        MockDataPoint.ofDouble("RPTE.UA23.RB.A12:I_MEAS", EPOCH + 90, 780),
        MockDataPoint.ofDouble("RPTE.UA23.RB.A12:I_REF", EPOCH + 30, 765),
        MockDataPoint.fundamental("CPS:NXCY:FUND", EPOCH + 60));
    backend.setVectorElements("LHC.BQBBQ:FREQ", ts(EPOCH),
        Arrays.asList("H", "V"));
    backend.addFill(new Fill(5000, ts(EPOCH), ts(EPOCH + 3600), Arrays.asList(
        new BeamModeInterval("INJPHYS", ts(EPOCH), ts(EPOCH + 600)),
        new BeamModeInterval("STABLE", ts(EPOCH + 600), ts(EPOCH + 3000)),
        new BeamModeInterval("BEAMDUMP", ts(EPOCH + 3000), ts(EPOCH + 3600)))));
    backend.addGroup(null, "LHC", "Large Hadron Collider");

    config = new Config();
    config.overrideConfig(Config.TIMEZONE, "UTC");
    config.overrideConfig(Config.APPLICATION_NAME, "MY_APP");
    config.overrideConfig(Config.SOURCE, "ldb");
    db = new LoggingDB(backend, config);
  }

  @Test
  public void ctor() throws Exception {
    assertSame(config, db.config());
    assertEquals(ZoneId.of("UTC"), db.codec().zone());
    assertEquals("MY_APP", backend.applicationName());
    assertEquals("BEAM PHYSICS", backend.clientName());
    assertEquals(DataLocation.LDB, backend.location());
    try {
      new LoggingDB(null, config);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      new LoggingDB(backend, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void timestamps() throws Exception {
    assertEquals(ts(EPOCH), db.toTimestamp("2016-08-01 10:00:00"));
    assertEquals(ts(EPOCH), db.toTimestamp(EPOCH));
    assertNull(db.toTimestamp(null));
    assertEquals(EPOCH, (Double) db.fromTimestamp(ts(EPOCH), true), 0);
    assertEquals(Instant.ofEpochSecond((long) EPOCH),
        ((ZonedDateTime) db.fromTimestamp(ts(EPOCH), false)).toInstant());
  }

  @Test
  public void search() throws Exception {
    assertEquals(Arrays.asList("RPTE.UA23.RB.A12:I_MEAS",
        "RPTE.UA23.RB.A12:I_REF"), db.search("RPTE.%"));
    assertTrue(db.search("NOPE%").isEmpty());
    assertEquals(2, db.getVariables("%:I_%").size());
  }

  @Test
  public void descriptionAndUnit() throws Exception {
    final Map<String, String> descriptions = db.getDescription("%");
    assertEquals("Main dipole current",
        descriptions.get("RPTE.UA23.RB.A12:I_MEAS"));
    assertTrue(descriptions.containsKey("LHC.BQBBQ:FREQ"));
    assertNull(descriptions.get("LHC.BQBBQ:FREQ"));
    assertEquals("A", db.getUnit("RPTE.%:I_REF").get("RPTE.UA23.RB.A12:I_REF"));
  }

  @Test
  public void searchFundamental() throws Exception {
    assertEquals(Collections.singletonList("CPS:NXCY:FUND"),
        db.searchFundamental("CPS:%", "2016-08-01 10:00:00",
            "2016-08-01 11:00:00"));
    assertEquals(Collections.singletonList("CPS:NXCY:FUND"),
        db.searchFundamental("CPS:%", EPOCH, null));
    assertTrue(db.searchFundamental("CPS:%", EPOCH + 61, EPOCH + 100)
        .isEmpty());
  }

  @Test
  public void metaData() throws Exception {
    final Map<String, SortedMap<TimeStamp, List<String>>> meta =
        db.getMetaData(VariableSelector.names("LHC.BQBBQ:FREQ"));
    assertEquals(Arrays.asList("H", "V"),
        meta.get("LHC.BQBBQ:FREQ").get(ts(EPOCH)));
  }

  @Test
  public void getWindow() throws Exception {
    final Map<String, Series> results = db.get(
        VariableSelector.pattern("RPTE.%"), "2016-08-01 10:00:00",
        "2016-08-01 10:01:00");
    assertArrayEquals(new double[] { 760, 770 },
        results.get("RPTE.UA23.RB.A12:I_MEAS").values().doubles(), 0);
    assertTrue(results.get("RPTE.UA23.RB.A12:I_MEAS").isUnixtime());
    assertEquals(Arrays.<Object>asList(EPOCH + 30),
        results.get("RPTE.UA23.RB.A12:I_REF").decodedTimestamps());
  }

  @Test
  public void getWithFundamental() throws Exception {
    final Map<String, Series> results = db.get(
        VariableSelector.names("RPTE.UA23.RB.A12:I_MEAS"), EPOCH, EPOCH + 100,
        "CPS:%", false);
    final Series series = results.get("RPTE.UA23.RB.A12:I_MEAS");
    assertArrayEquals(new double[] { 770 }, series.values().doubles(), 0);
    assertFalse(series.isUnixtime());
    assertTrue(series.decodedTimestamps().get(0) instanceof ZonedDateTime);
  }

  @Test
  public void getPointModes() throws Exception {
    final VariableSelector selector = VariableSelector.names(
        "RPTE.UA23.RB.A12:I_MEAS");
    assertArrayEquals(new double[] { 770 }, db.get(selector, EPOCH + 90)
        .get("RPTE.UA23.RB.A12:I_MEAS").values().doubles(), 0);
    assertArrayEquals(new double[] { 770 }, db.get(selector, EPOCH + 90, "last")
        .get("RPTE.UA23.RB.A12:I_MEAS").values().doubles(), 0);
    assertArrayEquals(new double[] { 780 }, db.get(selector, EPOCH + 60, "next")
        .get("RPTE.UA23.RB.A12:I_MEAS").values().doubles(), 0);
    assertArrayEquals(new double[] { 770 },
        db.get(selector, EPOCH, PointLookup.NEXT)
        .get("RPTE.UA23.RB.A12:I_MEAS").values().doubles(), 0);
    assertTrue(db.get(selector, EPOCH)
        .get("RPTE.UA23.RB.A12:I_MEAS").isEmpty());
  }

  @Test
  public void getInvalid() throws Exception {
    final VariableSelector selector = VariableSelector.names(
        "RPTE.UA23.RB.A12:I_MEAS");
    try {
      db.get(selector, EPOCH, "next", "CPS:%", true);
      fail("Expected InvalidQueryException");
    } catch (InvalidQueryException e) { }
    try {
      db.get(selector, null, EPOCH);
      fail("Expected InvalidQueryException");
    } catch (InvalidQueryException e) { }
    try {
      db.get(selector, "not a date", EPOCH);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void aligned() throws Exception {
    final AlignedData data = db.getAligned(VariableSelector.names(
        "RPTE.UA23.RB.A12:I_MEAS", "RPTE.UA23.RB.A12:I_REF"), EPOCH,
        EPOCH + 100);
    assertEquals("RPTE.UA23.RB.A12:I_MEAS", data.getMasterName());
    assertEquals(3, data.size());
    final double[] reference = data.getValues("RPTE.UA23.RB.A12:I_REF")
        .doubles();
    assertTrue(Double.isNaN(reference[0]));
    assertEquals(765, reference[1], 0);
    assertEquals(765, reference[2], 0);
  }

  @Test
  public void stats() throws Exception {
    final Map<String, Statistic> stats = db.getStats(
        VariableSelector.pattern("RPTE.%"), EPOCH, EPOCH + 100);
    assertEquals(3, stats.get("RPTE.UA23.RB.A12:I_MEAS").getCount());
    assertEquals(770, stats.get("RPTE.UA23.RB.A12:I_MEAS").getAvgValue(),
        0.000001);
    assertEquals(1, stats.get("RPTE.UA23.RB.A12:I_REF").getCount());
  }

  @Test
  public void statsDecoded() throws Exception {
    // unixtime is on by default
    final Statistic numeric = db.getStats(VariableSelector.names(
        "RPTE.UA23.RB.A12:I_REF"), EPOCH, EPOCH + 100)
        .get("RPTE.UA23.RB.A12:I_REF");
    assertEquals(EPOCH + 30, (Double) numeric.decodedMinTstamp(), 0.0);

    final Statistic calendar = db.getStats(VariableSelector.names(
        "RPTE.UA23.RB.A12:I_REF"), EPOCH, EPOCH + 100, false)
        .get("RPTE.UA23.RB.A12:I_REF");
    assertEquals(db.codec().toDateTime(ts(EPOCH + 30)),
        calendar.decodedMaxTstamp());
  }

  @Test
  public void scaledDefaults() throws Exception {
    final Series series = db.getScaled(VariableSelector.names(
        "RPTE.UA23.RB.A12:I_MEAS"), EPOCH, EPOCH + 119)
        .get("RPTE.UA23.RB.A12:I_MEAS");
    assertEquals(Arrays.asList(ts(EPOCH), ts(EPOCH + 60)), series.timestamps());
    assertArrayEquals(new double[] { 760, 1550 }, series.values().doubles(), 0);

    final Series max = db.getScaled(VariableSelector.names(
        "RPTE.UA23.RB.A12:I_MEAS"), EPOCH, EPOCH + 119, true, "MAX", "HOUR",
        "1").get("RPTE.UA23.RB.A12:I_MEAS");
    assertArrayEquals(new double[] { 780 }, max.values().doubles(), 0);
  }

  @Test
  public void fills() throws Exception {
    assertEquals(5000, db.getLHCFillData(5000).getFillNumber());
    assertEquals(5000, db.getLHCFillData(null).getFillNumber());
    assertEquals(1, db.getLHCFillsByTime("2016-08-01", "2016-08-02").size());
    assertEquals(1, db.getLHCFillsByTime(EPOCH, EPOCH + 10, "STABLE").size());
    assertTrue(db.getLHCFillsByTime(EPOCH, EPOCH + 10,
        Arrays.asList("RAMP")).isEmpty());
    assertEquals(ts(EPOCH + 3000), db.getIntervalsByLHCModes(EPOCH,
        EPOCH + 10, "STABLE", "STABLE").get(0).getEndTime());
  }

  @Test
  public void fillsDecoded() throws Exception {
    final Fill fill = db.getLHCFillData(5000);
    assertEquals(EPOCH, (Double) fill.decodedStartTime(db.codec(), true), 0.0);
    assertEquals(db.codec().toDateTime(ts(EPOCH + 3600)),
        fill.decodedEndTime(db.codec(), false));
    final BeamModeInterval stable = fill.getBeamModes().get(1);
    assertEquals(EPOCH + 3000,
        (Double) stable.decodedEndTime(db.codec(), true), 0.0);
  }

  @Test
  public void tree() throws Exception {
    assertEquals(HierarchyEntry.Kind.NODE,
        db.tree().getChild("LHC").getKind());
  }
}

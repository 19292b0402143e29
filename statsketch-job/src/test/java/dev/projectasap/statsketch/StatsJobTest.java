/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.projectasap.statsketch.datamodel.DataPoint;
import dev.projectasap.statsketch.stats.RunningStat;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;
import net.sourceforge.argparse4j.inf.Namespace;
import org.junit.jupiter.api.Test;

class StatsJobTest {

  @Test
  void testParseArgsDefaults() {
    Namespace args =
        StatsJob.parseArgs(
            new String[] {"--configFilePath", "config.yaml", "--datagenKeyCardinality", "10"});
    assertEquals("config.yaml", args.getString("configFilePath"));
    assertEquals(10, (int) args.getInt("datagenKeyCardinality"));
    assertEquals(1000L, (long) args.getLong("datagenItemsPerSecond"));
    assertEquals("insertion", args.getString("pipeline"));
    assertEquals("stat", args.getString("outputMode"));
    assertEquals("uniform", args.getString("distribution"));
    assertFalse(args.getBoolean("verbose"));
    assertFalse(args.getBoolean("runningStats"));
    StatsJob.checkArgs(args);
  }

  @Test
  void testVerboseRequiresOutput() {
    Namespace args =
        StatsJob.parseArgs(
            new String[] {
              "--configFilePath",
              "config.yaml",
              "--datagenKeyCardinality",
              "10",
              "--verbose",
              "true"
            });
    assertThrows(IllegalArgumentException.class, () -> StatsJob.checkArgs(args));
  }

  @Test
  void testConfigIsRequired() {
    Namespace args = StatsJob.parseArgs(new String[] {"--datagenKeyCardinality", "10"});
    assertThrows(IllegalArgumentException.class, () -> StatsJob.checkArgs(args));
  }

  @Test
  void testUnknownOutputModeIsRejected() {
    Namespace args =
        StatsJob.parseArgs(
            new String[] {
              "--configFilePath",
              "config.yaml",
              "--datagenKeyCardinality",
              "10",
              "--outputMode",
              "stats"
            });
    assertThrows(IllegalArgumentException.class, () -> StatsJob.checkArgs(args));

    Namespace combined =
        StatsJob.parseArgs(
            new String[] {
              "--configFilePath",
              "config.yaml",
              "--datagenKeyCardinality",
              "10",
              "--outputMode",
              "query_stat"
            });
    StatsJob.checkArgs(combined);
  }

  @Test
  void testRunningStatsRejectsRepeatedTimestamps() {
    Namespace tooFast =
        StatsJob.parseArgs(
            new String[] {
              "--configFilePath",
              "config.yaml",
              "--datagenKeyCardinality",
              "10",
              "--datagenItemsPerSecond",
              "20000",
              "--runningStats",
              "true"
            });
    assertThrows(IllegalArgumentException.class, () -> StatsJob.checkArgs(tooFast));

    Namespace atLimit =
        StatsJob.parseArgs(
            new String[] {
              "--configFilePath",
              "config.yaml",
              "--datagenKeyCardinality",
              "10",
              "--datagenItemsPerSecond",
              "10000",
              "--runningStats",
              "true"
            });
    StatsJob.checkArgs(atLimit);

    Namespace uniqueKeys =
        StatsJob.parseArgs(
            new String[] {
              "--configFilePath",
              "config.yaml",
              "--datagenKeyCardinality",
              "-1",
              "--datagenItemsPerSecond",
              "20000",
              "--runningStats",
              "true"
            });
    StatsJob.checkArgs(uniqueKeys);
  }

  @Test
  void testZeroKeyCardinalityIsRejected() {
    Namespace args =
        StatsJob.parseArgs(
            new String[] {"--configFilePath", "config.yaml", "--datagenKeyCardinality", "0"});
    assertThrows(IllegalArgumentException.class, () -> StatsJob.checkArgs(args));
  }

  @Test
  void testGeneratedTimestamps() {
    Random random = new Random(1);
    DataPoint first = StatsJob.generateDataPoint(0, 100, 4, "uniform", random);
    DataPoint second = StatsJob.generateDataPoint(1, 100, 4, "uniform", random);
    DataPoint lastOfSecond = StatsJob.generateDataPoint(99, 100, 4, "uniform", random);
    DataPoint nextSecond = StatsJob.generateDataPoint(100, 100, 4, "uniform", random);
    assertEquals(StatsJob.BASE_TIMESTAMP, (long) first.timestamp);
    assertEquals(StatsJob.BASE_TIMESTAMP + 10, (long) second.timestamp);
    assertEquals(StatsJob.BASE_TIMESTAMP + 990, (long) lastOfSecond.timestamp);
    assertEquals(StatsJob.BASE_TIMESTAMP + 1000, (long) nextSecond.timestamp);
  }

  @Test
  void testGeneratedPointsKeepRunningStatsIncreasing() {
    Random random = new Random(40);
    Map<String, RunningStat> stats = new HashMap<>();
    for (long i = 0; i < 10000; i++) {
      DataPoint point = StatsJob.generateDataPoint(i, 1000, 10, "uniform", random);
      RunningStat stat = stats.computeIfAbsent(point.key, key -> new RunningStat(key, 0.01));
      stat.record(point.value, point.timestamp);
    }
    assertEquals(10, stats.size());
    for (RunningStat stat : stats.values()) {
      assertEquals(1000.0, stat.snapshot().count);
    }
  }

  @Test
  void testGeneratedKeys() {
    Random random = new Random(1);
    assertEquals("key1", StatsJob.generateDataPoint(0, 10, 4, "uniform", random).key);
    assertEquals("key4", StatsJob.generateDataPoint(3, 10, 4, "uniform", random).key);
    assertEquals("key1", StatsJob.generateDataPoint(4, 10, 4, "uniform", random).key);
    assertEquals("key42", StatsJob.generateDataPoint(42, 10, -1, "uniform", random).key);
  }

  @Test
  void testGeneratedValues() {
    Random random = new Random(1);
    for (int i = 0; i < 100; i++) {
      double uniform = StatsJob.generateDataPoint(i, 10, 4, "uniform", random).value;
      assertTrue(uniform >= 0 && uniform < 1000);
      double lognormal = StatsJob.generateDataPoint(i, 10, 4, "lognormal", random).value;
      assertTrue(lognormal > 0);
    }
  }

  @Test
  void testSplitList() {
    assertEquals(Arrays.asList("0.5", "0.99"), StatsJob.splitList(" 0.5, 0.99 "));
    assertTrue(StatsJob.splitList(null).isEmpty());
    assertTrue(StatsJob.splitList("  ").isEmpty());
  }
}

/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.utils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Paths;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class ConfigLoaderTest {

  @Test
  void testLoadConfigFile() throws Exception {
    String path = Paths.get(getClass().getResource("/test-config.yaml").toURI()).toString();
    StreamingConfig config = ConfigLoader.loadConfig(path);

    assertEquals(0.02, config.runningRelativeAccuracy);
    assertEquals(2, config.aggregationConfigs.size());

    AggregationConfig first = config.aggregationConfigs.get(0);
    assertEquals(7, first.aggregationId);
    assertEquals("DDSketchQuantile", first.aggregationType);
    assertEquals("quantile", first.aggregationSubType);
    assertEquals("ddsketch", first.aggregationPackage);
    assertEquals("0.01", first.parameters.get("relativeAccuracy"));
    assertEquals(Arrays.asList(1000L, 60000L), first.getIntervals());

    AggregationConfig second = config.aggregationConfigs.get(1);
    assertEquals(StatIntervals.DEFAULT_INTERVAL_DURATIONS, second.getIntervals());
  }

  @Test
  void testDefaultRunningAccuracy() throws Exception {
    StreamingConfig config =
        ConfigLoader.parseConfig(
            "aggregations:\n"
                + "  - aggregationId: 1\n"
                + "    aggregationType: DDSketchQuantile\n"
                + "    aggregationSubType: quantile\n"
                + "    aggregationPackage: ddsketch\n");
    assertEquals(0.01, config.runningRelativeAccuracy);
    assertEquals(0, config.aggregationConfigs.get(0).parameters.size());
  }

  @Test
  void testMissingAggregations() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigLoader.parseConfig("runningRelativeAccuracy: 0.01\n"));
    assertThrows(
        IllegalArgumentException.class, () -> ConfigLoader.parseConfig("aggregations: 3\n"));
  }

  @Test
  void testMissingRequiredField() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            ConfigLoader.parseConfig(
                "aggregations:\n"
                    + "  - aggregationId: 1\n"
                    + "    aggregationType: DDSketchQuantile\n"
                    + "    aggregationPackage: ddsketch\n"));
  }

  @Test
  void testNonPositiveInterval() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            ConfigLoader.parseConfig(
                "aggregations:\n"
                    + "  - aggregationId: 1\n"
                    + "    aggregationType: DDSketchQuantile\n"
                    + "    aggregationSubType: quantile\n"
                    + "    aggregationPackage: ddsketch\n"
                    + "    intervals: [1000, 0]\n"));
  }
}

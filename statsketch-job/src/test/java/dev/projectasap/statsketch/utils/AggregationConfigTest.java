/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.utils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import dev.projectasap.statsketch.sketches.ddsketch.DDSketchQuantile;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AggregationConfigTest {

  private static AggregationConfig ddsketchConfig(String relativeAccuracy) {
    AggregationConfig config = new AggregationConfig();
    config.aggregationId = 3;
    config.aggregationType = "DDSketchQuantile";
    config.aggregationSubType = "quantile";
    config.aggregationPackage = "ddsketch";
    Map<String, String> parameters = new HashMap<>();
    parameters.put("relativeAccuracy", relativeAccuracy);
    config.parameters = parameters;
    return config;
  }

  @Test
  void testInstantiatesAggregationFunction() {
    AggregationConfig config = ddsketchConfig("0.05");
    DDSketchQuantile function = (DDSketchQuantile) config.getAggregationFunction();
    assertEquals(0.05, function.getRelativeAccuracy());
  }

  @Test
  void testUnknownAggregationType() {
    AggregationConfig config = ddsketchConfig("0.05");
    config.aggregationType = "Unknown";
    assertThrows(RuntimeException.class, config::getAggregationFunction);
  }

  @Test
  void testInvalidParametersFailInstantiation() {
    AggregationConfig config = ddsketchConfig("2");
    RuntimeException e = assertThrows(RuntimeException.class, config::getAggregationFunction);
    assertTrue(e.getCause().getCause() instanceof IllegalArgumentException);
  }

  @Test
  void testSerializeToJson() {
    AggregationConfig config = ddsketchConfig("0.01");
    config.intervals = Arrays.asList(1000L, 5000L);
    JsonNode json = config.serializeToJson();
    assertEquals(3, json.get("aggregationId").asInt());
    assertEquals("DDSketchQuantile", json.get("aggregationType").asText());
    assertEquals("0.01", json.get("parameters").get("relativeAccuracy").asText());
    assertEquals(2, json.get("intervals").size());
    assertEquals(5000L, json.get("intervals").get(1).asLong());
  }

  @Test
  void testSerializeToBytes() {
    AggregationConfig config = ddsketchConfig("0.01");
    assertEquals(0, config.serializeToBytes().length);
    config.setOriginalYaml("{\"aggregationId\":3}");
    assertEquals(
        "{\"aggregationId\":3}", new String(config.serializeToBytes(), StandardCharsets.UTF_8));
  }
}

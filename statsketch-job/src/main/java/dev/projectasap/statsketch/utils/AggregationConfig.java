/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.statsketch.datamodel.DataPoint;
import dev.projectasap.statsketch.datamodel.Summary;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.apache.flink.api.common.functions.AggregateFunction;

/**
 * Configuration for a single aggregation function. Contains type, parameters, and the interval
 * durations the aggregation is windowed by.
 */
public class AggregationConfig implements Serializable {
  public Integer aggregationId;
  public String aggregationType;
  public String aggregationSubType;
  public String aggregationPackage;
  public Map<String, String> parameters;
  public List<Long> intervals;
  public List<String> ranks;
  public String statistic;

  private String originalYaml;

  public void setOriginalYaml(String originalYaml) {
    this.originalYaml = originalYaml;
  }

  /** Interval durations in milliseconds, or the default interval table when none are set. */
  public List<Long> getIntervals() {
    if (intervals == null || intervals.isEmpty()) {
      return StatIntervals.DEFAULT_INTERVAL_DURATIONS;
    }
    return intervals;
  }

  public byte[] serializeToBytes() {
    return originalYaml == null
        ? new byte[0]
        : originalYaml.getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Serializes the aggregation configuration to JSON.
   *
   * @return JsonNode containing the configuration details
   */
  public JsonNode serializeToJson() {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode jsonNode = objectMapper.createObjectNode();

    jsonNode.put("aggregationId", this.aggregationId);
    jsonNode.put("aggregationType", this.aggregationType);
    jsonNode.put("aggregationSubType", this.aggregationSubType);
    jsonNode.put("aggregationPackage", this.aggregationPackage);
    jsonNode.set("parameters", objectMapper.valueToTree(this.parameters));

    ArrayNode intervalsNode = jsonNode.putArray("intervals");
    for (Long interval : getIntervals()) {
      intervalsNode.add(interval);
    }

    return jsonNode;
  }

  /**
   * Instantiates the aggregation function based on configuration.
   *
   * @return the instantiated aggregation function
   * @throws RuntimeException if function instantiation fails
   */
  @SuppressWarnings("unchecked")
  public AggregateFunction<DataPoint, ?, Summary> getAggregationFunction() {
    try {
      String className =
          "dev.projectasap.statsketch.sketches." + aggregationPackage + "." + aggregationType;
      Class<?> clazz = Class.forName(className);
      return (AggregateFunction<DataPoint, ?, Summary>)
          clazz.getConstructor(String.class, Map.class).newInstance(aggregationSubType, parameters);
    } catch (Exception e) {
      throw new RuntimeException("Failed to create aggregation function", e);
    }
  }
}

/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class for loading streaming configuration from YAML files. Parses aggregation
 * configurations, their parameters and interval durations.
 */
public class ConfigLoader {
  private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

  /**
   * Loads streaming configuration from a YAML file.
   *
   * @param configFilePath path to the YAML configuration file
   * @return parsed streaming configuration
   * @throws IOException if file reading or parsing fails
   */
  public static StreamingConfig loadConfig(String configFilePath) throws IOException {
    logger.info("Loading configuration from {}", configFilePath);
    String yamlContent =
        new String(Files.readAllBytes(Paths.get(configFilePath)), StandardCharsets.UTF_8);
    return parseConfig(yamlContent);
  }

  /**
   * Parses streaming configuration from YAML text.
   *
   * @param yamlContent the YAML document
   * @return parsed streaming configuration
   * @throws IOException if the document is not valid YAML
   * @throws IllegalArgumentException if a required field is missing or invalid
   */
  public static StreamingConfig parseConfig(String yamlContent) throws IOException {
    ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    ObjectNode rootNode = mapper.readValue(yamlContent, ObjectNode.class);

    StreamingConfig streamingConfig = new StreamingConfig();

    JsonNode running = rootNode.get("runningRelativeAccuracy");
    if (running != null) {
      streamingConfig.runningRelativeAccuracy = running.asDouble();
    }

    JsonNode aggregations = rootNode.get("aggregations");
    if (aggregations == null || !aggregations.isArray()) {
      throw new IllegalArgumentException("Configuration requires an 'aggregations' list");
    }

    List<AggregationConfig> aggregationConfigs = new ArrayList<>();
    aggregations.forEach(
        node -> {
          AggregationConfig config = new AggregationConfig();
          config.aggregationId = required(node, "aggregationId").asInt();
          config.aggregationType = required(node, "aggregationType").asText();
          config.aggregationSubType = required(node, "aggregationSubType").asText();
          config.aggregationPackage = required(node, "aggregationPackage").asText();

          Map<String, String> parameters = new HashMap<>();
          JsonNode parametersNode = node.get("parameters");
          if (parametersNode != null) {
            parametersNode
                .fields()
                .forEachRemaining(
                    entry -> {
                      parameters.put(entry.getKey(), entry.getValue().asText());
                    });
          }
          config.parameters = parameters;

          JsonNode intervalsNode = node.get("intervals");
          if (intervalsNode != null) {
            List<Long> intervals = new ArrayList<>();
            intervalsNode.forEach(
                interval -> {
                  long duration = interval.asLong();
                  if (duration <= 0) {
                    throw new IllegalArgumentException(
                        "Aggregation "
                            + config.aggregationId
                            + " has a non-positive interval: "
                            + interval.asText());
                  }
                  intervals.add(duration);
                });
            config.intervals = intervals;
          }

          config.setOriginalYaml(node.toString());
          aggregationConfigs.add(config);
        });
    streamingConfig.aggregationConfigs = aggregationConfigs;

    logger.debug("Loaded {} aggregation(s)", aggregationConfigs.size());
    return streamingConfig;
  }

  private static JsonNode required(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException("Aggregation is missing required field '" + field + "'");
    }
    return value;
  }
}

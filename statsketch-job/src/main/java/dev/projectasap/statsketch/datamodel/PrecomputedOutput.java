/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.datamodel;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.statsketch.utils.AggregationConfig;
import dev.projectasap.statsketch.utils.OutputStrategy;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Represents the output of one interval window of one series. Contains the aggregated summary with
 * metadata about the window.
 */
public class PrecomputedOutput implements SerializableToSink {
  @JsonProperty("start_timestamp")
  public Long startTimestamp;

  @JsonProperty("end_timestamp")
  public Long endTimestamp;

  public Summary<?> precompute;
  public AggregationConfig config;
  public String key;
  private OutputStrategy outputStrategy; // Encapsulates output logic (pipeline, mode, verbose)
  private ObjectNode cachedQueryResults; // Cache query results from window function execution

  /**
   * Constructs a PrecomputedOutput.
   *
   * @param startTimestamp the window start timestamp
   * @param endTimestamp the window end timestamp
   * @param precompute the aggregated summary
   * @param config the aggregation configuration
   * @param key the series key
   * @param pipeline the pipeline mode (e.g., "insertion", "insertion_querying")
   * @param outputMode the output mode (e.g., "sketch", "query_stat")
   * @param verbose whether to enable verbose output
   */
  public PrecomputedOutput(
      Long startTimestamp,
      Long endTimestamp,
      Summary<?> precompute,
      AggregationConfig config,
      String key,
      String pipeline,
      String outputMode,
      boolean verbose) {
    this.startTimestamp = startTimestamp;
    this.endTimestamp = endTimestamp;
    this.precompute = precompute;
    this.config = config;
    this.key = key;
    this.outputStrategy = new OutputStrategy(pipeline, outputMode, verbose);
    this.cachedQueryResults = null;
  }

  /**
   * Sets cached query results from eager execution in window function.
   *
   * @param queryResults the query results to cache
   */
  public void setCachedQueryResults(ObjectNode queryResults) {
    this.cachedQueryResults = queryResults;
  }

  public ObjectNode getCachedQueryResults() {
    return cachedQueryResults;
  }

  /** Window duration in milliseconds. */
  public long getDuration() {
    return this.endTimestamp - this.startTimestamp;
  }

  /**
   * Serializes the precomputed output to a byte array: config, window bounds, key and summary, each
   * variable-length part prefixed by its length as an int32.
   *
   * @return serialized byte array
   */
  @Override
  public byte[] serializeToBytes() {
    byte[] precomputeBytes = this.precompute.serializeToBytes();
    byte[] configBytes = this.config.serializeToBytes();
    byte[] keyBytes;
    if (this.key == null) {
      keyBytes = new byte[0];
    } else {
      keyBytes = this.key.getBytes(StandardCharsets.UTF_8);
    }

    ByteBuffer buffer =
        ByteBuffer.allocate(
            Integer.BYTES
                + configBytes.length
                + Long.BYTES
                + Long.BYTES
                + Integer.BYTES
                + keyBytes.length
                + Integer.BYTES
                + precomputeBytes.length);
    buffer.putInt(configBytes.length);
    buffer.put(configBytes);
    buffer.putLong(this.startTimestamp);
    buffer.putLong(this.endTimestamp);
    buffer.putInt(keyBytes.length);
    buffer.put(keyBytes);
    buffer.putInt(precomputeBytes.length);
    buffer.put(precomputeBytes);
    return buffer.array();
  }

  /**
   * Serializes the precomputed output to JSON.
   *
   * @return JsonNode containing the serialized output based on output mode flags
   */
  @Override
  public JsonNode serializeToJson() {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode jsonNode = objectMapper.createObjectNode();

    // Add metadata
    jsonNode.set("config", this.config.serializeToJson());
    jsonNode.put("start_timestamp", this.startTimestamp);
    jsonNode.put("end_timestamp", this.endTimestamp);
    jsonNode.put("duration", getDuration());
    jsonNode.put("key", this.key);
    jsonNode.put("pipeline", this.outputStrategy.getPipeline());
    jsonNode.put("output_mode", this.outputStrategy.getOutputMode());

    // Delegate all output logic to OutputStrategy
    ObjectNode outputContent =
        this.outputStrategy.buildOutput(this.precompute, this.cachedQueryResults, objectMapper);
    jsonNode.setAll(outputContent);

    return jsonNode;
  }

  /** Gets the output strategy for this output. */
  public OutputStrategy getOutputStrategy() {
    return this.outputStrategy;
  }
}

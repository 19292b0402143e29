/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.statsketch.datamodel.Summary;
import dev.projectasap.statsketch.sketches.ddsketch.DDSketchAccumulator;
import java.io.Serializable;
import java.util.List;

/**
 * Centralized output strategy handler for determining what to output and executing queries. Handles
 * the logic for different pipeline modes and output modes.
 */
public class OutputStrategy implements Serializable {
  private final String pipeline;
  private final String outputMode;
  private final boolean verbose;

  public OutputStrategy(String pipeline, String outputMode, boolean verbose) {
    this.pipeline = pipeline;
    this.outputMode = outputMode;
    this.verbose = verbose;
  }

  public String getPipeline() {
    return pipeline;
  }

  public String getOutputMode() {
    return outputMode;
  }

  public boolean isVerbose() {
    return verbose;
  }

  /** Parse output mode flags (e.g., "query_memory" -> ["query", "memory"]). */
  public OutputModeFlags parseOutputMode() {
    String[] flags = this.outputMode.split("_");
    boolean includeSketch = false;
    boolean includeQuery = false;
    boolean includeMemory = false;
    boolean includeStat = false;

    for (String flag : flags) {
      switch (flag) {
        case "sketch":
          includeSketch = true;
          break;
        case "query":
          includeQuery = true;
          break;
        case "memory":
          includeMemory = true;
          break;
        case "stat":
          includeStat = true;
          break;
        default:
          throw new IllegalArgumentException("Unknown output mode flag: " + flag);
      }
    }

    return new OutputModeFlags(includeSketch, includeQuery, includeMemory, includeStat);
  }

  /**
   * Determines if queries should be executed in the window function (before serialization). For
   * insertion_querying pipeline, queries are executed in window function and cached.
   *
   * @return true if queries should be executed in window function, false otherwise
   */
  public boolean shouldExecuteQueries() {
    return "insertion_querying".equals(pipeline);
  }

  /**
   * Execute the rank and statistic queries of the configuration.
   *
   * @param precompute the summary to query
   * @param ranks the list of ranks to query (can be null/empty)
   * @param statistic an exact statistic to query, e.g. "max" (can be null)
   * @return ObjectNode containing all query results
   */
  public static ObjectNode executeQueries(
      Summary<?> precompute, List<String> ranks, String statistic) {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode combinedResults = objectMapper.createObjectNode();

    if (ranks != null) {
      for (String rank : ranks) {
        ObjectNode params = objectMapper.createObjectNode();
        params.put("rank", Double.parseDouble(rank));
        JsonNode result = precompute.query(params);
        combinedResults.setAll((ObjectNode) result);
      }
    }

    if (statistic != null && !statistic.isEmpty()) {
      ObjectNode params = objectMapper.createObjectNode();
      params.put("statistic", statistic);
      JsonNode result = precompute.query(params);
      combinedResults.setAll((ObjectNode) result);
    }

    return combinedResults;
  }

  /**
   * Build the JSON output based on the output strategy configuration.
   *
   * @param precompute the summary to serialize
   * @param cachedQueryResults query results from window function (can be null)
   * @param objectMapper Jackson ObjectMapper for JSON construction
   * @return ObjectNode with the appropriate output fields
   */
  public ObjectNode buildOutput(
      Summary<?> precompute, ObjectNode cachedQueryResults, ObjectMapper objectMapper) {
    ObjectNode outputNode = objectMapper.createObjectNode();
    OutputModeFlags flags = parseOutputMode();

    if (!this.verbose) {
      return outputNode;
    }

    if (flags.includeSketch) {
      outputNode.set("sketch", precompute.serializeToJson());
    }

    if (flags.includeQuery) {
      if (cachedQueryResults != null) {
        outputNode.set("query", cachedQueryResults);
      } else {
        outputNode.put(
            "query_error",
            "Query results not available - queries should be executed in window function");
      }
    }

    if (flags.includeMemory) {
      outputNode.put("memory_bytes", precompute.get_memory());

      // Also add count when memory is requested
      if (precompute instanceof DDSketchAccumulator) {
        outputNode.put("count", ((DDSketchAccumulator) precompute).get_count());
      }
    }

    if (flags.includeStat && precompute instanceof DDSketchAccumulator) {
      outputNode.set("stat", ((DDSketchAccumulator) precompute).snapshot().toJson());
    }

    return outputNode;
  }

  /** Flags indicating which output components to include. */
  public static class OutputModeFlags {
    public final boolean includeSketch;
    public final boolean includeQuery;
    public final boolean includeMemory;
    public final boolean includeStat;

    public OutputModeFlags(
        boolean includeSketch, boolean includeQuery, boolean includeMemory, boolean includeStat) {
      this.includeSketch = includeSketch;
      this.includeQuery = includeQuery;
      this.includeMemory = includeMemory;
      this.includeStat = includeStat;
    }
  }
}

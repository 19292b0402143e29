/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.windowfunctions;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.statsketch.datamodel.PrecomputedOutput;
import dev.projectasap.statsketch.datamodel.Summary;
import dev.projectasap.statsketch.utils.AggregationConfig;
import dev.projectasap.statsketch.utils.OutputStrategy;
import org.apache.flink.streaming.api.functions.windowing.ProcessWindowFunction;
import org.apache.flink.streaming.api.windowing.windows.TimeWindow;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process function that adds window metadata to aggregated summaries. Attaches the series key,
 * window start/end times and configuration to create PrecomputedOutput objects.
 */
public class KeyedWindowProcessor
    extends ProcessWindowFunction<Summary, PrecomputedOutput, String, TimeWindow> {
  private final AggregationConfig config;
  private final String pipeline;
  private final String outputMode;
  private final boolean verbose;
  private static final Logger logger = LoggerFactory.getLogger(KeyedWindowProcessor.class);

  public KeyedWindowProcessor(
      AggregationConfig config, String pipeline, String outputMode, boolean verbose) {
    this.config = config;
    this.pipeline = pipeline;
    this.outputMode = outputMode;
    this.verbose = verbose;
  }

  @Override
  public void process(
      String key, Context context, Iterable<Summary> elements, Collector<PrecomputedOutput> out) {
    Summary result = elements.iterator().next();
    long start = context.window().getStart();
    long end = context.window().getEnd();

    out.collect(buildOutput(key, start, end, result));
  }

  /**
   * Wraps the summary of one window, executing the configured queries eagerly for the
   * insertion_querying pipeline.
   */
  PrecomputedOutput buildOutput(String key, long start, long end, Summary<?> result) {
    PrecomputedOutput output =
        new PrecomputedOutput(start, end, result, config, key, pipeline, outputMode, verbose);

    if (output.getOutputStrategy().shouldExecuteQueries()) {
      try {
        ObjectNode queryResults =
            OutputStrategy.executeQueries(result, config.ranks, config.statistic);
        output.setCachedQueryResults(queryResults);
      } catch (IllegalArgumentException e) {
        logger.error(
            "Failed to execute queries for key {} window [{}, {}]: {}",
            key,
            start,
            end,
            e.getMessage());
      }
    }

    return output;
  }
}

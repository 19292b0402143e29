/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch;

import dev.projectasap.statsketch.datamodel.DataPoint;
import dev.projectasap.statsketch.datamodel.PrecomputedOutput;
import dev.projectasap.statsketch.datamodel.Summary;
import dev.projectasap.statsketch.functions.RunningStatFunction;
import dev.projectasap.statsketch.sinks.SinkBuilder;
import dev.projectasap.statsketch.stats.RunningStat;
import dev.projectasap.statsketch.utils.AggregationConfig;
import dev.projectasap.statsketch.utils.ConfigLoader;
import dev.projectasap.statsketch.utils.OutputStrategy;
import dev.projectasap.statsketch.utils.StreamingConfig;
import dev.projectasap.statsketch.windowfunctions.KeyedWindowProcessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.Namespace;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.functions.AggregateFunction;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.connector.datagen.source.DataGeneratorSource;
import org.apache.flink.connector.datagen.source.GeneratorFunction;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.KeyedStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.streaming.api.windowing.assigners.TumblingEventTimeWindows;
import org.apache.flink.streaming.api.windowing.time.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main Flink job computing per-series statistics. Every configured aggregation is windowed by each
 * of its intervals, and running statistics since the first value of a series can be emitted
 * alongside.
 */
public class StatsJob {
  private static final Logger LOG = LoggerFactory.getLogger(StatsJob.class);

  static final long BASE_TIMESTAMP = 1000000000000L;

  static Namespace parseArgs(String[] args) {
    ArgumentParser parser =
        ArgumentParsers.newFor("StatsJob")
            .build()
            .defaultHelp(true)
            .description("Per-series statistics over time intervals");

    parser.addArgument("--outputFilePath").type(String.class).help("Output directory path");

    parser.addArgument("--configFilePath").type(String.class).help("Configuration file path");

    parser
        .addArgument("--outputFormat")
        .type(String.class)
        .choices("byte", "json")
        .help("Output format: byte or json");

    parser
        .addArgument("--logLevel")
        .type(String.class)
        .choices("TRACE", "DEBUG", "INFO", "WARN", "ERROR")
        .setDefault("INFO")
        .help("Sets the logging level (default: INFO)");

    parser
        .addArgument("--datagenKeyCardinality")
        .type(Integer.class)
        .required(true)
        .help("DataGen key cardinality");

    parser
        .addArgument("--datagenItemsPerSecond")
        .type(Long.class)
        .setDefault(1000L)
        .help("Number of generated items per second of event time (default: 1000)");

    parser
        .addArgument("--verbose")
        .type(Boolean.class)
        .setDefault(false)
        .help("Enable verbose output to sink (default: false)");

    parser
        .addArgument("--pipeline")
        .type(String.class)
        .choices("insertion", "insertion_querying")
        .setDefault("insertion")
        .help("Pipeline type: insertion (sketch only) or insertion_querying (sketch + queries)");

    parser
        .addArgument("--outputMode")
        .type(String.class)
        .setDefault("stat")
        .help(
            "Output mode: sketch, query, memory, stat, or combinations separated by underscore"
                + " (e.g., stat_memory). Note: query only available for insertion_querying"
                + " pipeline");

    parser
        .addArgument("--queryRanks")
        .type(String.class)
        .help("Comma-separated list of query ranks (quantiles 0.0-1.0)");

    parser
        .addArgument("--queryStatistic")
        .type(String.class)
        .choices("count", "sum", "min", "max", "avg")
        .help("Exact statistic to query alongside the ranks");

    parser
        .addArgument("--parallelism")
        .type(Integer.class)
        .setDefault(1)
        .help("Parallelism for the Flink job (default: 1)");

    parser
        .addArgument("--distribution")
        .type(String.class)
        .choices("uniform", "normal", "lognormal")
        .setDefault("uniform")
        .help("Distribution of generated values (default: uniform)");

    parser
        .addArgument("--runningStats")
        .type(Boolean.class)
        .setDefault(false)
        .help("Also emit running statistics since the first value of each series");

    return parser.parseArgsOrFail(args);
  }

  static void checkArgs(Namespace parsedArgs) {
    boolean verbose = parsedArgs.getBoolean("verbose");
    if (verbose && parsedArgs.getString("outputFilePath") == null) {
      throw new IllegalArgumentException(
          "Output file path is required when verbose mode is enabled");
    }
    if (parsedArgs.getString("configFilePath") == null) {
      throw new IllegalArgumentException("Configuration file path is required");
    }
    if (verbose && parsedArgs.getString("outputFormat") == null) {
      throw new IllegalArgumentException("Output format is required when verbose mode is enabled");
    }
    long itemsPerSecond = parsedArgs.getLong("datagenItemsPerSecond");
    if (itemsPerSecond <= 0) {
      throw new IllegalArgumentException("datagenItemsPerSecond must be positive");
    }
    int keyCardinality = parsedArgs.getInt("datagenKeyCardinality");
    if (keyCardinality == 0 || keyCardinality < -1) {
      throw new IllegalArgumentException("datagenKeyCardinality must be positive or -1");
    }
    // running statistics need strictly increasing timestamps per key
    if (parsedArgs.getBoolean("runningStats")
        && keyCardinality != -1
        && itemsPerSecond > 1000L * keyCardinality) {
      throw new IllegalArgumentException(
          "runningStats requires datagenItemsPerSecond <= 1000 * datagenKeyCardinality, got "
              + itemsPerSecond
              + " items per second for "
              + keyCardinality
              + " keys");
    }
    String pipeline = parsedArgs.getString("pipeline");
    new OutputStrategy(pipeline, parsedArgs.getString("outputMode"), verbose).parseOutputMode();
  }

  /**
   * Generates the data point at the given index. Timestamps have millisecond resolution and
   * advance by 1000 / itemsPerSecond milliseconds per index, so a key seen every keyCardinality
   * indices gets strictly increasing timestamps as long as itemsPerSecond <= 1000 *
   * keyCardinality.
   *
   * @param index the index of the data point
   * @param itemsPerSecond number of items per second of event time
   * @param keyCardinality the cardinality of keys, -1 for a new key per point
   * @param distribution the distribution type ("uniform", "normal" or "lognormal")
   * @param randomSource the Random source for value generation
   * @return a new DataPoint
   */
  static DataPoint generateDataPoint(
      long index,
      long itemsPerSecond,
      int keyCardinality,
      String distribution,
      Random randomSource) {
    long timestamp = BASE_TIMESTAMP + index * 1000L / itemsPerSecond;
    String key = keyCardinality == -1 ? "key" + index : "key" + ((index % keyCardinality) + 1);

    double value;
    if ("normal".equals(distribution)) {
      // mean 500, stddev 150, may go negative
      value = randomSource.nextGaussian() * 150 + 500;
    } else if ("lognormal".equals(distribution)) {
      value = Math.exp(randomSource.nextGaussian() + 5);
    } else {
      value = randomSource.nextDouble() * 1000;
    }

    return new DataPoint(timestamp, key, value);
  }

  private static DataStream<DataPoint> createDataGenStream(
      StreamExecutionEnvironment env,
      int keyCardinality,
      long itemsPerSecond,
      String distribution) {
    Random random = new Random(40L);
    GeneratorFunction<Long, DataPoint> generatorFunction =
        index -> generateDataPoint(index, itemsPerSecond, keyCardinality, distribution, random);

    DataGeneratorSource<DataPoint> dataGenSource =
        new DataGeneratorSource<>(
            generatorFunction, Long.MAX_VALUE, TypeInformation.of(DataPoint.class));

    return env.fromSource(dataGenSource, WatermarkStrategy.noWatermarks(), "Generator Source");
  }

  static List<String> splitList(String value) {
    if (value == null || value.trim().isEmpty()) {
      return new ArrayList<>();
    }
    return Arrays.stream(value.split(",")).map(String::trim).collect(Collectors.toList());
  }

  /**
   * Main entry point for the Flink streaming job.
   *
   * @param args command-line arguments for configuration
   * @throws Exception if the job fails to execute
   */
  public static void main(String[] args) throws Exception {
    Namespace parsedArgs = parseArgs(args);

    if (parsedArgs.getString("logLevel") != null) {
      System.setProperty("log.level", parsedArgs.getString("logLevel"));
    }

    LOG.info("Starting with log level: {}", System.getProperty("log.level", "INFO"));

    checkArgs(parsedArgs);

    StreamingConfig streamingConfig =
        ConfigLoader.loadConfig(parsedArgs.getString("configFilePath"));

    List<String> queryRanks = splitList(parsedArgs.getString("queryRanks"));
    String queryStatistic = parsedArgs.getString("queryStatistic");
    for (AggregationConfig config : streamingConfig.aggregationConfigs) {
      config.ranks = queryRanks;
      config.statistic = queryStatistic;
    }

    StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
    env.setParallelism(parsedArgs.getInt("parallelism"));

    boolean verbose = parsedArgs.getBoolean("verbose");
    String pipeline = parsedArgs.getString("pipeline");
    String outputMode = parsedArgs.getString("outputMode");
    String outputFormat = parsedArgs.getString("outputFormat");
    String outputPath = parsedArgs.getString("outputFilePath");

    DataStream<DataPoint> inputStream =
        createDataGenStream(
            env,
            parsedArgs.getInt("datagenKeyCardinality"),
            parsedArgs.getLong("datagenItemsPerSecond"),
            parsedArgs.getString("distribution"));

    inputStream =
        inputStream.assignTimestampsAndWatermarks(
            WatermarkStrategy.<DataPoint>forMonotonousTimestamps()
                .withTimestampAssigner((event, timestamp) -> event.timestamp));

    KeyedStream<DataPoint, String> keyedStream = inputStream.keyBy(point -> point.key);

    for (AggregationConfig config : streamingConfig.aggregationConfigs) {
      for (Long interval : config.getIntervals()) {
        LOG.info("Aggregation {} windowed every {} ms", config.aggregationId, interval);

        DataStream<PrecomputedOutput> outputStream =
            keyedStream
                .window(TumblingEventTimeWindows.of(Time.milliseconds(interval)))
                .aggregate(
                    (AggregateFunction<DataPoint, ?, Summary>) config.getAggregationFunction(),
                    new KeyedWindowProcessor(config, pipeline, outputMode, verbose))
                .name("Aggregation " + config.aggregationId + " / " + interval + " ms");

        if (verbose) {
          outputStream.sinkTo(
              SinkBuilder.<PrecomputedOutput>buildSink(
                  outputFormat,
                  outputPath + "/windows/" + config.aggregationId + "-" + interval));
        }
      }
    }

    if (parsedArgs.getBoolean("runningStats")) {
      DataStream<RunningStat> runningStream =
          keyedStream
              .process(new RunningStatFunction(streamingConfig.runningRelativeAccuracy))
              .name("Running statistics");
      if (verbose) {
        runningStream.sinkTo(
            SinkBuilder.<RunningStat>buildSink(outputFormat, outputPath + "/running"));
      }
    }

    env.execute("Series Statistics");
  }
}

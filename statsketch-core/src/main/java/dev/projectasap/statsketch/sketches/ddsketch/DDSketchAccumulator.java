/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.sketches.ddsketch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.statsketch.datamodel.MetricStat;
import dev.projectasap.statsketch.datamodel.Summary;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.Base64;

/**
 * Accumulator pairing a {@link DDSketch} with exactly tracked count, sum, min and max. Quantile
 * queries rank against the exact count rather than the sketch's own tally.
 *
 * <p>Serialized layout, big-endian: count, sum, min, max (doubles), then the sketch.
 */
public class DDSketchAccumulator implements Summary<DDSketchAccumulator> {
  private static final int TOTALS_SIZE = 4 * Double.BYTES;

  public DDSketch sketch;
  private final double relativeAccuracy;
  private double count;
  private double sum;
  private double min;
  private double max;

  /**
   * Constructs an empty accumulator.
   *
   * @param relativeAccuracy the relative accuracy guaranteed by the sketch
   */
  public DDSketchAccumulator(double relativeAccuracy) {
    this(new DDSketch(relativeAccuracy), 0, 0, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY);
  }

  private DDSketchAccumulator(DDSketch sketch, double count, double sum, double min, double max) {
    this.sketch = sketch;
    this.relativeAccuracy = sketch.getKeyMapping().relativeAccuracy();
    this.count = count;
    this.sum = sum;
    this.min = min;
    this.max = max;
  }

  @Override
  public void add(String key, Double value) {
    // Quantiles are tracked per accumulator; the key only selects the accumulator upstream
    add(value);
  }

  /**
   * Records a value in the sketch and in the exact totals.
   *
   * @param value the value to record
   * @throws IllegalArgumentException if the sketch cannot record the value; totals are unchanged
   */
  public void add(double value) {
    sketch.add(value);
    count += 1;
    sum += value;
    min = Math.min(min, value);
    max = Math.max(max, value);
  }

  @Override
  public DDSketchAccumulator merge(DDSketchAccumulator other) {
    DDSketch mergedSketch = this.sketch.copy();
    mergedSketch.merge(other.sketch);
    return new DDSketchAccumulator(
        mergedSketch,
        this.count + other.count,
        this.sum + other.sum,
        Math.min(this.min, other.min),
        Math.max(this.max, other.max));
  }

  /**
   * Returns the approximate value at the given quantile, ranked against the exact count.
   *
   * @param quantile the quantile in [0, 1]
   * @return the value, or NaN if nothing was recorded or the quantile is out of range
   */
  public double getValueAtQuantile(double quantile) {
    return sketch.getValueAtQuantile(quantile, count);
  }

  public MetricStat snapshot() {
    if (count == 0) {
      return MetricStat.empty();
    }
    return MetricStat.of(sketch, count, sum, min, max);
  }

  public double getRelativeAccuracy() {
    return relativeAccuracy;
  }

  public double getCount() {
    return count;
  }

  public double getSum() {
    return sum;
  }

  public double getMin() {
    return min;
  }

  public double getMax() {
    return max;
  }

  @Override
  public byte[] serializeToBytes() {
    ByteBuffer buffer = ByteBuffer.allocate(TOTALS_SIZE + sketch.serializedSize());
    buffer.putDouble(count);
    buffer.putDouble(sum);
    buffer.putDouble(min);
    buffer.putDouble(max);
    sketch.serialize(buffer);
    return buffer.array();
  }

  /**
   * Rebuilds an accumulator from {@link #serializeToBytes()} output.
   *
   * @param bytes the serialized accumulator
   * @return the accumulator
   * @throws IllegalArgumentException if the bytes are truncated or malformed
   */
  public static DDSketchAccumulator deserialize(byte[] bytes) {
    return deserialize(ByteBuffer.wrap(bytes));
  }

  /** Reads an accumulator from the current position of the buffer and advances past it. */
  public static DDSketchAccumulator deserialize(ByteBuffer buffer) {
    double count;
    double sum;
    double min;
    double max;
    try {
      count = buffer.getDouble();
      sum = buffer.getDouble();
      min = buffer.getDouble();
      max = buffer.getDouble();
    } catch (BufferUnderflowException e) {
      throw new IllegalArgumentException("Truncated accumulator totals", e);
    }
    return new DDSketchAccumulator(DDSketch.deserialize(buffer), count, sum, min, max);
  }

  @Override
  public JsonNode serializeToJson() {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode rootNode = objectMapper.createObjectNode();

    rootNode.put("relative_accuracy", relativeAccuracy);
    rootNode.put("count", count);
    rootNode.put("sum", sum);
    rootNode.put("min", min);
    rootNode.put("max", max);

    // Sketch: return bytes as Base64-encoded string
    byte[] sketchBytes = sketch.serialize();
    rootNode.put("sketch_bytes", Base64.getEncoder().encodeToString(sketchBytes));

    return rootNode;
  }

  /**
   * Execute query operations on the accumulator. A "rank" parameter (0.0-1.0) returns the quantile
   * at that rank; a "statistic" parameter (count, sum, min, max or avg) returns that exact total.
   *
   * @param params JsonNode containing query parameters
   */
  @Override
  public JsonNode query(JsonNode params) {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode queryResult = objectMapper.createObjectNode();

    if (params == null) {
      return queryResult;
    }

    if (params.has("rank")) {
      double rank = params.get("rank").asDouble();
      if (rank >= 0.0 && rank <= 1.0) {
        queryResult.put("rank_" + rank, getValueAtQuantile(rank));
      }
    }

    if (params.has("statistic")) {
      String statistic = params.get("statistic").asText();
      switch (statistic) {
        case "count":
          queryResult.put(statistic, count);
          break;
        case "sum":
          queryResult.put(statistic, sum);
          break;
        case "min":
          queryResult.put(statistic, min);
          break;
        case "max":
          queryResult.put(statistic, max);
          break;
        case "avg":
          queryResult.put(statistic, count == 0 ? Double.NaN : sum / count);
          break;
        default:
          throw new IllegalArgumentException("Unsupported statistic: " + statistic);
      }
    }

    return queryResult;
  }

  @Override
  public long get_memory() {
    // Return the serialized size in bytes without actually serializing
    return sketch.serializedSize();
  }

  /**
   * Returns the count of values added to this accumulator.
   *
   * @return the exact count of values
   */
  public long get_count() {
    return (long) count;
  }
}

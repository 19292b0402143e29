/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.datamodel;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.statsketch.sketches.ddsketch.DDSketch;

/**
 * Statistics of a series over some span: exact count, sum, min and max, plus the p50/p90/p95/p99
 * estimates read from a sketch against the exact count.
 */
@JsonPropertyOrder({"count", "sum", "min", "max", "p50", "p90", "p95", "p99"})
public class MetricStat {
  public final double count;
  public final double sum;
  public final double min;
  public final double max;
  public final double p50;
  public final double p90;
  public final double p95;
  public final double p99;

  public MetricStat(
      double count,
      double sum,
      double min,
      double max,
      double p50,
      double p90,
      double p95,
      double p99) {
    this.count = count;
    this.sum = sum;
    this.min = min;
    this.max = max;
    this.p50 = p50;
    this.p90 = p90;
    this.p95 = p95;
    this.p99 = p99;
  }

  /**
   * Builds the statistics from exact totals and the sketch holding the same values.
   *
   * @param sketch sketch of the values, queried with {@code count} as the total weight
   * @param count exact number of values
   * @param sum exact sum
   * @param min exact minimum
   * @param max exact maximum
   * @return the statistics
   */
  public static MetricStat of(DDSketch sketch, double count, double sum, double min, double max) {
    return new MetricStat(
        count,
        sum,
        min,
        max,
        sketch.getValueAtQuantile(0.5, count),
        sketch.getValueAtQuantile(0.9, count),
        sketch.getValueAtQuantile(0.95, count),
        sketch.getValueAtQuantile(0.99, count));
  }

  /** Statistics of no values at all. */
  public static MetricStat empty() {
    return new MetricStat(
        0,
        0,
        Double.POSITIVE_INFINITY,
        Double.NEGATIVE_INFINITY,
        Double.NaN,
        Double.NaN,
        Double.NaN,
        Double.NaN);
  }

  public ObjectNode toJson() {
    return new ObjectMapper().valueToTree(this);
  }

  @Override
  public String toString() {
    return "MetricStat{"
        + "count="
        + count
        + ", sum="
        + sum
        + ", min="
        + min
        + ", max="
        + max
        + ", p50="
        + p50
        + ", p90="
        + p90
        + ", p95="
        + p95
        + ", p99="
        + p99
        + '}';
  }
}

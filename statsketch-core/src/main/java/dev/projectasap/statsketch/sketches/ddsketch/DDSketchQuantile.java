/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.sketches.ddsketch;

import dev.projectasap.statsketch.datamodel.DataPoint;
import dev.projectasap.statsketch.datamodel.Summary;
import java.util.Map;
import org.apache.flink.api.common.functions.AggregateFunction;

/**
 * Aggregate function producing {@link DDSketchAccumulator}s: approximate quantiles with
 * relative-error guarantees, alongside exact count, sum, min and max.
 */
public class DDSketchQuantile
    implements AggregateFunction<DataPoint, DDSketchAccumulator, Summary> {
  private final double relativeAccuracy;
  private final String aggregationSubType;

  public DDSketchQuantile(String aggregationSubType, Map<String, String> parameters) {
    this.aggregationSubType = aggregationSubType;

    // Require explicit configuration - no defaults
    if (!parameters.containsKey("relativeAccuracy")) {
      throw new IllegalArgumentException("relativeAccuracy parameter is required for DDSketch");
    }

    this.relativeAccuracy = Double.parseDouble(parameters.get("relativeAccuracy"));

    if (!(relativeAccuracy > 0 && relativeAccuracy < 1)) {
      throw new IllegalArgumentException(
          "relativeAccuracy (" + relativeAccuracy + ") must be between 0 and 1");
    }
  }

  public String getAggregationSubType() {
    return aggregationSubType;
  }

  public double getRelativeAccuracy() {
    return relativeAccuracy;
  }

  @Override
  public DDSketchAccumulator createAccumulator() {
    return new DDSketchAccumulator(relativeAccuracy);
  }

  @Override
  public DDSketchAccumulator add(DataPoint value, DDSketchAccumulator acc) {
    acc.add(value.key, value.value);
    return acc;
  }

  @Override
  public DDSketchAccumulator merge(DDSketchAccumulator a, DDSketchAccumulator b) {
    return a.merge(b);
  }

  @Override
  public Summary getResult(DDSketchAccumulator acc) {
    return acc;
  }
}

/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.functions;

import dev.projectasap.statsketch.datamodel.DataPoint;
import dev.projectasap.statsketch.stats.RunningStat;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.PrimitiveArrayTypeInfo;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the running statistics of every series in keyed state, stored as the serialized {@link
 * RunningStat}, and emits the updated statistic for each data point. Points not later than the
 * last recorded one of their series are logged and dropped.
 */
public class RunningStatFunction extends KeyedProcessFunction<String, DataPoint, RunningStat> {
  private static final Logger logger = LoggerFactory.getLogger(RunningStatFunction.class);

  private final double relativeAccuracy;
  private transient ValueState<byte[]> statState;

  public RunningStatFunction(double relativeAccuracy) {
    if (!(relativeAccuracy > 0 && relativeAccuracy < 1)) {
      throw new IllegalArgumentException(
          "relativeAccuracy (" + relativeAccuracy + ") must be between 0 and 1");
    }
    this.relativeAccuracy = relativeAccuracy;
  }

  @Override
  public void open(Configuration parameters) {
    statState =
        getRuntimeContext()
            .getState(
                new ValueStateDescriptor<>(
                    "running-stat", PrimitiveArrayTypeInfo.BYTE_PRIMITIVE_ARRAY_TYPE_INFO));
  }

  @Override
  public void processElement(DataPoint point, Context ctx, Collector<RunningStat> out)
      throws Exception {
    RunningStat stat = record(ctx.getCurrentKey(), statState.value(), point, relativeAccuracy);
    if (stat == null) {
      return;
    }
    statState.update(stat.serializeToBytes());
    out.collect(stat);
  }

  /**
   * Applies one data point to the serialized statistic of its series.
   *
   * @param key the series key
   * @param state the serialized statistic, or null for a new series
   * @param point the data point
   * @param relativeAccuracy accuracy of the sketch of a new series
   * @return the updated statistic, or null if the point was rejected
   */
  static RunningStat record(String key, byte[] state, DataPoint point, double relativeAccuracy) {
    RunningStat stat =
        state == null
            ? new RunningStat(key, relativeAccuracy)
            : RunningStat.deserialize(key, state);
    try {
      stat.record(point.value, point.timestamp);
    } catch (IllegalArgumentException e) {
      logger.warn("Dropping data point {}: {}", point, e.getMessage());
      return null;
    }
    return stat;
  }
}

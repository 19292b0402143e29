/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.stats;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.statsketch.datamodel.MetricStat;
import dev.projectasap.statsketch.datamodel.SerializableToSink;
import dev.projectasap.statsketch.sketches.ddsketch.DDSketchAccumulator;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;

/**
 * Statistics of a series since its first value: the last recorded value and its timestamp, plus a
 * {@link DDSketchAccumulator} over every value. Values must be recorded in strictly increasing
 * timestamp order.
 *
 * <p>Serialized layout, big-endian: last value (double), last recorded timestamp (int64), then the
 * accumulator. The key is not part of the serialized form.
 */
public class RunningStat implements SerializableToSink {
  private final String key;
  private final DDSketchAccumulator accumulator;
  private double lastValue;
  private long recordedAt;

  public RunningStat(String key, double relativeAccuracy) {
    this(key, new DDSketchAccumulator(relativeAccuracy), Double.NaN, Long.MIN_VALUE);
  }

  private RunningStat(
      String key, DDSketchAccumulator accumulator, double lastValue, long recordedAt) {
    this.key = key;
    this.accumulator = accumulator;
    this.lastValue = lastValue;
    this.recordedAt = recordedAt;
  }

  /**
   * Records a value observed at the given time.
   *
   * @param value the observed value
   * @param timestamp epoch milliseconds, later than every timestamp recorded so far
   * @return {@link RecordStatus#CREATED} for the first value, {@link RecordStatus#UPDATED} after
   * @throws IllegalArgumentException if the timestamp is not after the last recorded one, or the
   *     value cannot be recorded; the statistic is left unchanged
   */
  public RecordStatus record(double value, long timestamp) {
    boolean created = isEmpty();
    if (!created && timestamp <= recordedAt) {
      throw new IllegalArgumentException(
          "Timestamp "
              + timestamp
              + " for key '"
              + key
              + "' is in the past, last recorded at "
              + recordedAt);
    }
    accumulator.add(value);
    lastValue = value;
    recordedAt = timestamp;
    return created ? RecordStatus.CREATED : RecordStatus.UPDATED;
  }

  public boolean isEmpty() {
    return accumulator.getCount() == 0;
  }

  public String getKey() {
    return key;
  }

  /** Last recorded value, NaN before the first record. */
  public double getLastValue() {
    return lastValue;
  }

  /** Timestamp of the last recorded value, {@link Long#MIN_VALUE} before the first record. */
  public long getRecordedAt() {
    return recordedAt;
  }

  public DDSketchAccumulator getAccumulator() {
    return accumulator;
  }

  public MetricStat snapshot() {
    return accumulator.snapshot();
  }

  @Override
  public byte[] serializeToBytes() {
    byte[] accumulatorBytes = accumulator.serializeToBytes();
    return ByteBuffer.allocate(Double.BYTES + Long.BYTES + accumulatorBytes.length)
        .putDouble(lastValue)
        .putLong(recordedAt)
        .put(accumulatorBytes)
        .array();
  }

  /**
   * Rebuilds a running statistic from {@link #serializeToBytes()} output.
   *
   * @param key the series key the bytes belong to
   * @param bytes the serialized statistic
   * @return the statistic
   * @throws IllegalArgumentException if the bytes are truncated or malformed
   */
  public static RunningStat deserialize(String key, byte[] bytes) {
    ByteBuffer buffer = ByteBuffer.wrap(bytes);
    double lastValue;
    long recordedAt;
    try {
      lastValue = buffer.getDouble();
      recordedAt = buffer.getLong();
    } catch (BufferUnderflowException e) {
      throw new IllegalArgumentException("Truncated running stat for key '" + key + "'", e);
    }
    return new RunningStat(key, DDSketchAccumulator.deserialize(buffer), lastValue, recordedAt);
  }

  @Override
  public JsonNode serializeToJson() {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode node = objectMapper.createObjectNode();
    node.put("key", key);
    node.put("value", lastValue);
    node.put("recorded_at", recordedAt);
    node.set("stat", snapshot().toJson());
    return node;
  }

  @Override
  public String toString() {
    return "RunningStat{key='"
        + key
        + "', lastValue="
        + lastValue
        + ", recordedAt="
        + recordedAt
        + ", stat="
        + snapshot()
        + '}';
  }
}

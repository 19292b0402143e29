/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.datamodel;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A single measurement of a series: event timestamp in milliseconds, the series key, and the
 * measured value. Used as the basic unit of data in the streaming pipeline.
 */
@JsonPropertyOrder({"timestamp", "key", "value"})
public class DataPoint {
  public Long timestamp;
  public String key;
  public Double value;

  /** Default constructor initializing all fields to default values. */
  public DataPoint() {
    this.timestamp = 0L;
    this.key = "";
    this.value = 0.0;
  }

  /**
   * Constructs a DataPoint with specified values.
   *
   * @param timestamp the event timestamp in milliseconds
   * @param key the series key
   * @param value the measured value
   */
  public DataPoint(Long timestamp, String key, Double value) {
    this.timestamp = timestamp;
    this.key = key;
    this.value = value;
  }

  @Override
  public String toString() {
    return "DataPoint{"
        + "timestamp="
        + timestamp
        + ", key='"
        + key
        + '\''
        + ", value="
        + value
        + '}';
  }
}

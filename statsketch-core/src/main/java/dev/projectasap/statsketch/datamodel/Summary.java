/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.datamodel;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Interface for window aggregation outputs. Uses self-referential generic type T to ensure
 * type-safe merge operations.
 *
 * <p>Inherits serialization methods from SerializableToSink: - byte[] serializeToBytes() - JsonNode
 * serializeToJson() - String serializeToString()
 */
public interface Summary<T extends Summary<T>> extends SerializableToSink {

  /**
   * Execute a query on the accumulated data.
   *
   * @param params Query parameters as JsonNode, e.g. {"rank": 0.95} for a quantile or
   *     {"statistic": "max"} for one of the exact totals
   * @return Query result as JsonNode
   */
  JsonNode query(JsonNode params);

  /**
   * Get the memory footprint of this accumulator in bytes, computed from the raw data size without
   * object overhead.
   *
   * @return Memory usage in bytes
   */
  long get_memory();

  /**
   * Add a value observed for a series key.
   *
   * @param key The series key
   * @param value The observed value
   */
  void add(String key, Double value);

  /**
   * Merge another accumulator of the same type into a new accumulator. This operation should be
   * commutative and associative for correct parallel processing.
   *
   * @param other The accumulator to merge with
   * @return A new merged accumulator of type T
   */
  T merge(T other);
}

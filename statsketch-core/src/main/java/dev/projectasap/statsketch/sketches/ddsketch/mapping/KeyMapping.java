/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.sketches.ddsketch.mapping;

/**
 * Maps positive values to integer bucket keys and back. Implementations are immutable, so a single
 * instance can be shared between sketches.
 */
public interface KeyMapping {

  /**
   * Returns the key of the bucket that holds the given value.
   *
   * @param value a strictly positive value
   * @return the bucket key
   */
  int key(double value);

  /**
   * Returns the representative value of a bucket, chosen so that every value mapped to the bucket
   * lies within the relative accuracy of it.
   *
   * @param key the bucket key
   * @return the representative value
   */
  double value(int key);

  double relativeAccuracy();

  /** Ratio between the bounds of consecutive buckets. */
  double gamma();

  double offset();

  /** Smallest magnitude that gets its own bucket; smaller magnitudes are counted as zero. */
  double minPossible();

  /** Largest magnitude that can be mapped. */
  double maxPossible();

  byte[] serialize();

  int serializedSize();
}

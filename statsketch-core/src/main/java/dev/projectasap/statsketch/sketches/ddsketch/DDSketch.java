/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.sketches.ddsketch;

import dev.projectasap.statsketch.sketches.ddsketch.mapping.KeyMapping;
import dev.projectasap.statsketch.sketches.ddsketch.mapping.LogarithmicMapping;
import dev.projectasap.statsketch.sketches.ddsketch.store.Bin;
import dev.projectasap.statsketch.sketches.ddsketch.store.DenseStore;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Quantile sketch with relative-error guarantees over signed values. Positive and negative
 * magnitudes are bucketed by the same {@link KeyMapping} into two {@link DenseStore}s; magnitudes
 * too small to be mapped are counted in a zero bucket.
 *
 * <p>Sketches built with the same gamma can be merged. Min, max and sum are derived from the bucket
 * representatives, so they are approximations within the relative accuracy.
 *
 * <p>Serialized layout, big-endian: key mapping (16 bytes), positive store, negative store, zero
 * count (8 bytes, double).
 *
 * <p>Not thread-safe.
 */
public class DDSketch implements Iterable<WeightedValue> {
  public static final double DEFAULT_RELATIVE_ACCURACY = 0.01;

  private KeyMapping mapping;
  private final DenseStore positives;
  private final DenseStore negatives;
  private double zeroCount;

  public DDSketch() {
    this(DEFAULT_RELATIVE_ACCURACY);
  }

  public DDSketch(double relativeAccuracy) {
    this(new LogarithmicMapping(relativeAccuracy));
  }

  public DDSketch(KeyMapping mapping) {
    this(mapping, new DenseStore(), new DenseStore(), 0);
  }

  private DDSketch(
      KeyMapping mapping, DenseStore positives, DenseStore negatives, double zeroCount) {
    this.mapping = mapping;
    this.positives = positives;
    this.negatives = negatives;
    this.zeroCount = zeroCount;
  }

  public void add(double value) {
    add(value, 1);
  }

  /**
   * Records a value with the given weight.
   *
   * @param value the value to record
   * @param count the weight, non-negative
   * @throws IllegalArgumentException if the count is negative, or the value is NaN or beyond the
   *     range of the mapping; the sketch is left unchanged
   */
  public void add(double value, double count) {
    if (!(count >= 0)) {
      throw new IllegalArgumentException("Cannot add a negative count: " + count);
    }
    if (Double.isNaN(value) || Math.abs(value) > mapping.maxPossible()) {
      throw new IllegalArgumentException("Cannot add value out of the sketch range: " + value);
    }
    if (value > mapping.minPossible()) {
      positives.add(mapping.key(value), count);
    } else if (value < -mapping.minPossible()) {
      negatives.add(mapping.key(-value), count);
    } else {
      zeroCount += count;
    }
  }

  /**
   * Adds the content of another sketch into this one.
   *
   * @param other the sketch to merge; left unchanged
   * @throws IllegalArgumentException if the two sketches do not share the same gamma
   */
  public void merge(DDSketch other) {
    if (mapping.gamma() != other.mapping.gamma()) {
      throw new IllegalArgumentException(
          "Cannot merge sketches with different gamma values: "
              + mapping.gamma()
              + " and "
              + other.mapping.gamma());
    }
    positives.merge(other.positives);
    negatives.merge(other.negatives);
    zeroCount += other.zeroCount;
  }

  /**
   * Replaces the content of this sketch with a copy of another. The key mapping is immutable and
   * shared with {@code other}.
   */
  public void copy(DDSketch other) {
    this.mapping = other.mapping;
    this.positives.copy(other.positives);
    this.negatives.copy(other.negatives);
    this.zeroCount = other.zeroCount;
  }

  /** Returns an independent copy of this sketch. */
  public DDSketch copy() {
    return new DDSketch(mapping, positives.copy(), negatives.copy(), zeroCount);
  }

  public void clear() {
    positives.clear();
    negatives.clear();
    zeroCount = 0;
  }

  public boolean isEmpty() {
    return getCount() == 0;
  }

  public double getCount() {
    return zeroCount + positives.getCount() + negatives.getCount();
  }

  public double getZeroCount() {
    return zeroCount;
  }

  /** Sum of the bucket representatives weighted by their counts. */
  public double getSum() {
    double sum = 0;
    for (WeightedValue weightedValue : this) {
      sum += weightedValue.getValue() * weightedValue.getCount();
    }
    return sum;
  }

  /** Representative value of the highest non-empty bucket, or NaN if the sketch is empty. */
  public double getMaxValue() {
    if (!positives.isEmpty()) {
      return mapping.value(positives.getMaxKey());
    }
    if (zeroCount > 0) {
      return 0;
    }
    if (!negatives.isEmpty()) {
      return -mapping.value(negatives.getMinKey());
    }
    return Double.NaN;
  }

  /** Representative value of the lowest non-empty bucket, or NaN if the sketch is empty. */
  public double getMinValue() {
    if (!negatives.isEmpty()) {
      return -mapping.value(negatives.getMaxKey());
    }
    if (zeroCount > 0) {
      return 0;
    }
    if (!positives.isEmpty()) {
      return mapping.value(positives.getMinKey());
    }
    return Double.NaN;
  }

  public double getValueAtQuantile(double quantile) {
    return getValueAtQuantile(quantile, getCount());
  }

  /**
   * Returns the approximate value at the given quantile, using the nearest rank {@code quantile *
   * (count - 1)}.
   *
   * @param quantile the quantile, in [0, 1]
   * @param count the total weight to rank against, typically an exactly tracked count that may
   *     differ from {@link #getCount()} after merges of persisted sketches
   * @return the value, or NaN if the quantile is out of range or the count is 0
   */
  public double getValueAtQuantile(double quantile, double count) {
    if (quantile < 0 || quantile > 1 || count == 0) {
      return Double.NaN;
    }

    double rank = quantile * (count - 1);
    double negativeCount = negatives.getCount();

    if (rank < negativeCount) {
      int key = negatives.keyAtRank(negativeCount - rank - 1, false);
      return -mapping.value(key);
    } else if (rank < zeroCount + negativeCount) {
      return 0;
    } else {
      int key = positives.keyAtRank(rank - zeroCount - negativeCount, true);
      return mapping.value(key);
    }
  }

  public KeyMapping getKeyMapping() {
    return mapping;
  }

  public DenseStore getPositiveValueStore() {
    return positives;
  }

  public DenseStore getNegativeValueStore() {
    return negatives;
  }

  /**
   * Iterates over the zero bucket first (if non-empty), then over the positive buckets by
   * increasing key, then over the negative buckets by increasing key. Negative buckets are reported
   * with their negated representative value, so the sequence is not sorted by value.
   */
  @Override
  public Iterator<WeightedValue> iterator() {
    return new Iterator<WeightedValue>() {
      private boolean zeroPending = zeroCount != 0;
      private final Iterator<Bin> positiveBins = positives.iterator();
      private final Iterator<Bin> negativeBins = negatives.iterator();

      @Override
      public boolean hasNext() {
        return zeroPending || positiveBins.hasNext() || negativeBins.hasNext();
      }

      @Override
      public WeightedValue next() {
        if (zeroPending) {
          zeroPending = false;
          return new WeightedValue(0, zeroCount);
        }
        if (positiveBins.hasNext()) {
          Bin bin = positiveBins.next();
          return new WeightedValue(mapping.value(bin.getKey()), bin.getCount());
        }
        if (negativeBins.hasNext()) {
          Bin bin = negativeBins.next();
          return new WeightedValue(-mapping.value(bin.getKey()), bin.getCount());
        }
        throw new NoSuchElementException();
      }
    };
  }

  public int serializedSize() {
    return mapping.serializedSize()
        + positives.serializedSize()
        + negatives.serializedSize()
        + Double.BYTES;
  }

  public byte[] serialize() {
    ByteBuffer buffer = ByteBuffer.allocate(serializedSize());
    serialize(buffer);
    return buffer.array();
  }

  /** Writes this sketch at the current position of the buffer. */
  public void serialize(ByteBuffer buffer) {
    buffer.put(mapping.serialize());
    positives.serialize(buffer);
    negatives.serialize(buffer);
    buffer.putDouble(zeroCount);
  }

  public static DDSketch deserialize(byte[] bytes) {
    return deserialize(ByteBuffer.wrap(bytes));
  }

  /**
   * Reads a sketch from the current position of the buffer and advances past it.
   *
   * @param buffer big-endian buffer positioned at a serialized sketch
   * @return the sketch
   * @throws IllegalArgumentException if the buffer is truncated or holds an invalid mapping
   */
  public static DDSketch deserialize(ByteBuffer buffer) {
    KeyMapping mapping = LogarithmicMapping.deserialize(buffer);
    DenseStore positives = DenseStore.deserialize(buffer);
    DenseStore negatives = DenseStore.deserialize(buffer);
    try {
      double zeroCount = buffer.getDouble();
      return new DDSketch(mapping, positives, negatives, zeroCount);
    } catch (BufferUnderflowException e) {
      throw new IllegalArgumentException("Truncated sketch: missing zero count", e);
    }
  }

  @Override
  public String toString() {
    return "DDSketch{mapping="
        + mapping
        + ", positives="
        + positives
        + ", negatives="
        + negatives
        + ", zeroCount="
        + zeroCount
        + '}';
  }
}

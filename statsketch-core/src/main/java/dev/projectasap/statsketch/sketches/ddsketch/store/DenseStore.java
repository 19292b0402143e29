/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.sketches.ddsketch.store;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Histogram of weights over a contiguous range of integer bucket keys, backed by an array that
 * grows with the range of keys seen. {@code bins[i]} holds the weight of key {@code offset + i};
 * every slot outside {@code [minKey - offset, maxKey - offset]} is zero.
 *
 * <p>The array length is always a multiple of {@link #CHUNK_SIZE}. When a key falls outside the
 * allocated range, the array is enlarged if needed and the recorded range is re-centered in it.
 * Shifts copy into a fresh array, so the old and new live ranges never alias.
 *
 * <p>Serialized layout, big-endian: offset (int32), number of bins (uint32, the physical array
 * length), then one double per bin.
 *
 * <p>Not thread-safe.
 */
public class DenseStore implements Iterable<Bin> {
  public static final int CHUNK_SIZE = 128;

  private double[] bins;
  private double count;
  private int offset;
  private int minKey;
  private int maxKey;

  public DenseStore() {
    this.bins = new double[0];
    this.count = 0;
    this.offset = 0;
    this.minKey = Integer.MAX_VALUE;
    this.maxKey = Integer.MIN_VALUE;
  }

  private DenseStore(DenseStore other) {
    copy(other);
  }

  /** Adds a weight of 1 to the given key. */
  public void add(int key) {
    add(key, 1);
  }

  /**
   * Adds a weight to the given key, extending the range of the store if needed.
   *
   * @param key the bucket key
   * @param count the weight to add; zero is a no-op
   */
  public void add(int key, double count) {
    if (count == 0) {
      return;
    }
    int index = normalize(key);
    bins[index] += count;
    this.count += count;
  }

  /**
   * Returns the key at the given zero-based rank in the weighted, key-ascending ordering of the
   * recorded weights.
   *
   * @param rank the rank; negative ranks are treated as 0
   * @param lower if true, the first key whose cumulative weight exceeds {@code rank}; otherwise the
   *     first key whose cumulative weight reaches {@code rank + 1}
   * @return the key, or {@link #getMaxKey()} if no key satisfies the condition
   */
  public int keyAtRank(double rank, boolean lower) {
    rank = Math.max(0, rank);
    if (!isEmpty()) {
      double n = 0;
      for (int index = minKey - offset; index <= maxKey - offset; index++) {
        n += bins[index];
        if ((lower && n > rank) || (!lower && n >= rank + 1)) {
          return index + offset;
        }
      }
    }
    return maxKey;
  }

  public int keyAtRank(double rank) {
    return keyAtRank(rank, true);
  }

  /**
   * Adds the weights of another store into this one.
   *
   * @param other the store to merge; left unchanged
   */
  public void merge(DenseStore other) {
    if (other.isEmpty()) {
      return;
    }
    if (isEmpty()) {
      copy(other);
      return;
    }
    if (other.minKey < minKey || other.maxKey > maxKey) {
      extendRange(other.minKey, other.maxKey);
    }
    for (int key = other.minKey; key <= other.maxKey; key++) {
      bins[key - offset] += other.bins[key - other.offset];
    }
    count += other.count;
  }

  /**
   * Multiplies every recorded weight by a factor.
   *
   * @param factor a strictly positive factor
   * @throws IllegalArgumentException if the factor is not strictly positive
   */
  public void reweigh(double factor) {
    if (!(factor > 0)) {
      throw new IllegalArgumentException("Cannot reweigh by a non-positive factor: " + factor);
    }
    if (factor == 1 || isEmpty()) {
      return;
    }
    count *= factor;
    for (int index = minKey - offset; index <= maxKey - offset; index++) {
      bins[index] *= factor;
    }
  }

  /** Replaces the content of this store with a deep copy of another store. */
  public void copy(DenseStore other) {
    this.bins = other.bins.clone();
    this.count = other.count;
    this.offset = other.offset;
    this.minKey = other.minKey;
    this.maxKey = other.maxKey;
  }

  /** Returns an independent copy of this store. */
  public DenseStore copy() {
    return new DenseStore(this);
  }

  public void clear() {
    this.bins = new double[0];
    this.count = 0;
    this.minKey = Integer.MAX_VALUE;
    this.maxKey = Integer.MIN_VALUE;
  }

  public boolean isEmpty() {
    return count == 0;
  }

  public double getCount() {
    return count;
  }

  /** Smallest key holding a weight, {@link Integer#MAX_VALUE} when the store is empty. */
  public int getMinKey() {
    return minKey;
  }

  /** Largest key holding a weight, {@link Integer#MIN_VALUE} when the store is empty. */
  public int getMaxKey() {
    return maxKey;
  }

  /** Key stored in the first slot of the backing array. */
  public int getOffset() {
    return offset;
  }

  /** Physical length of the backing array. */
  public int getLength() {
    return bins.length;
  }

  /** Lazily iterates over the non-empty bins in increasing key order. Each call starts over. */
  @Override
  public Iterator<Bin> iterator() {
    return new Iterator<Bin>() {
      private int index = isEmpty() ? bins.length : minKey - offset;

      {
        skipEmpty();
      }

      private void skipEmpty() {
        while (index <= maxKey - offset && index < bins.length && bins[index] == 0) {
          index++;
        }
      }

      @Override
      public boolean hasNext() {
        return index < bins.length && index <= maxKey - offset;
      }

      @Override
      public Bin next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        Bin bin = new Bin(index + offset, bins[index]);
        index++;
        skipEmpty();
        return bin;
      }
    };
  }

  public int serializedSize() {
    return 2 * Integer.BYTES + bins.length * Double.BYTES;
  }

  public byte[] serialize() {
    ByteBuffer buffer = ByteBuffer.allocate(serializedSize());
    serialize(buffer);
    return buffer.array();
  }

  /** Writes this store at the current position of the buffer. */
  public void serialize(ByteBuffer buffer) {
    buffer.putInt(offset);
    buffer.putInt(bins.length);
    for (double bin : bins) {
      buffer.putDouble(bin);
    }
  }

  /**
   * Reads a store from the current position of the buffer and advances past it. The store is
   * rebuilt by adding every serialized bin to an empty store, so zero bins at either end of the
   * serialized array do not widen the rebuilt key range.
   *
   * @param buffer big-endian buffer positioned at a serialized store
   * @return the rebuilt store
   * @throws IllegalArgumentException if the buffer is truncated
   */
  public static DenseStore deserialize(ByteBuffer buffer) {
    try {
      int offset = buffer.getInt();
      long numBins = Integer.toUnsignedLong(buffer.getInt());
      if (numBins * Double.BYTES > buffer.remaining()) {
        throw new IllegalArgumentException(
            "Truncated dense store: "
                + numBins
                + " bins declared, "
                + buffer.remaining()
                + " bytes available");
      }
      if (offset + numBins - 1 > Integer.MAX_VALUE) {
        throw new IllegalArgumentException(
            "Dense store range overflows: offset " + offset + ", " + numBins + " bins");
      }
      DenseStore store = new DenseStore();
      for (int i = 0; i < numBins; i++) {
        store.add(offset + i, buffer.getDouble());
      }
      return store;
    } catch (BufferUnderflowException e) {
      throw new IllegalArgumentException("Truncated dense store", e);
    }
  }

  public static DenseStore deserialize(byte[] bytes) {
    return deserialize(ByteBuffer.wrap(bytes));
  }

  private int normalize(int key) {
    if (key < minKey || key > maxKey) {
      extendRange(key, key);
    }
    return key - offset;
  }

  private static int getNewLength(int newMinKey, int newMaxKey) {
    long desiredLength = (long) newMaxKey - newMinKey + 1;
    long newLength = CHUNK_SIZE * ((desiredLength + CHUNK_SIZE - 1) / CHUNK_SIZE);
    if (newLength > Integer.MAX_VALUE - CHUNK_SIZE) {
      throw new IllegalArgumentException(
          "Key range [" + newMinKey + ", " + newMaxKey + "] is too wide for a dense store");
    }
    return (int) newLength;
  }

  private void extendRange(int newMinKey, int newMaxKey) {
    newMinKey = Math.min(newMinKey, minKey);
    newMaxKey = Math.max(newMaxKey, maxKey);

    if (isEmpty()) {
      bins = new double[getNewLength(newMinKey, newMaxKey)];
      offset = newMinKey;
      adjust(newMinKey, newMaxKey);
    } else if (newMinKey >= minKey && (long) newMaxKey < (long) offset + bins.length) {
      // Still inside the allocated array, nothing to move.
      minKey = newMinKey;
      maxKey = newMaxKey;
    } else {
      int newLength = getNewLength(newMinKey, newMaxKey);
      if (newLength > bins.length) {
        bins = Arrays.copyOf(bins, newLength);
      }
      adjust(newMinKey, newMaxKey);
    }
  }

  /** Re-centers {@code [newMinKey, newMaxKey]} in the backing array. */
  private void adjust(int newMinKey, int newMaxKey) {
    int midKey = newMinKey + (newMaxKey - newMinKey + 1) / 2;
    shiftBins(offset + bins.length / 2 - midKey);
    minKey = newMinKey;
    maxKey = newMaxKey;
  }

  private void shiftBins(int shift) {
    if (shift == 0) {
      return;
    }
    double[] shifted = new double[bins.length];
    int kept = bins.length - Math.abs(shift);
    if (kept > 0) {
      if (shift > 0) {
        System.arraycopy(bins, 0, shifted, shift, kept);
      } else {
        System.arraycopy(bins, -shift, shifted, 0, kept);
      }
    }
    bins = shifted;
    offset -= shift;
  }

  @Override
  public String toString() {
    return "DenseStore{count="
        + count
        + ", offset="
        + offset
        + ", minKey="
        + minKey
        + ", maxKey="
        + maxKey
        + ", length="
        + bins.length
        + '}';
  }
}

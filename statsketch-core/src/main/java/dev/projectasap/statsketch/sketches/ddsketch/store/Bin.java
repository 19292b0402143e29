/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.sketches.ddsketch.store;

import java.util.Objects;

/** A bucket key together with the weight recorded in it. */
public final class Bin {
  private final int key;
  private final double count;

  public Bin(int key, double count) {
    this.key = key;
    this.count = count;
  }

  public int getKey() {
    return key;
  }

  public double getCount() {
    return count;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Bin)) {
      return false;
    }
    Bin bin = (Bin) o;
    return key == bin.key && Double.compare(bin.count, count) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, count);
  }

  @Override
  public String toString() {
    return "Bin{key=" + key + ", count=" + count + '}';
  }
}

/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.sketches.ddsketch;

import java.util.Objects;

/** The representative value of a sketch bucket together with the weight recorded in it. */
public final class WeightedValue {
  private final double value;
  private final double count;

  public WeightedValue(double value, double count) {
    this.value = value;
    this.count = count;
  }

  public double getValue() {
    return value;
  }

  public double getCount() {
    return count;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof WeightedValue)) {
      return false;
    }
    WeightedValue that = (WeightedValue) o;
    return Double.compare(that.value, value) == 0 && Double.compare(that.count, count) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, count);
  }

  @Override
  public String toString() {
    return "WeightedValue{value=" + value + ", count=" + count + '}';
  }
}

/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.sketches.ddsketch.mapping;

import java.nio.ByteBuffer;

/**
 * Base class for mappings whose bucket bounds form a geometric sequence with ratio gamma.
 * Subclasses only decide how the logarithm to base gamma (and its inverse) is computed.
 *
 * <p>Serialized layout, big-endian: gamma (8 bytes, double) followed by offset (8 bytes, double).
 */
public abstract class GammaKeyMapping implements KeyMapping {
  static final double MIN_SAFE_DOUBLE = Double.MIN_NORMAL / 2;
  static final int SERIALIZED_SIZE = 2 * Double.BYTES;

  private final double relativeAccuracy;
  private final double gamma;
  private final double offset;
  private final double minPossible;
  private final double maxPossible;
  protected final double multiplier;

  /**
   * Constructs a mapping.
   *
   * @param relativeAccuracy the relative accuracy guaranteed by the mapping, in (0, 1)
   * @param offset the shift applied to every key
   * @param multiplierScale factor applied to {@code 1 / ln(gamma)} for the logarithm base used by
   *     the subclass
   */
  protected GammaKeyMapping(double relativeAccuracy, double offset, double multiplierScale) {
    this(Double.NaN, relativeAccuracy, offset, multiplierScale);
  }

  /**
   * Constructs a mapping that reports the given gamma instead of the one derived from the relative
   * accuracy. Converting gamma to a relative accuracy and back can be off by one ulp, and merges
   * compare gammas exactly.
   *
   * @param gamma the gamma to keep, or NaN to derive it from {@code relativeAccuracy}
   * @param relativeAccuracy the relative accuracy guaranteed by the mapping, in (0, 1)
   * @param offset the shift applied to every key
   * @param multiplierScale factor applied to {@code 1 / ln(gamma)} for the logarithm base used by
   *     the subclass
   */
  protected GammaKeyMapping(
      double gamma, double relativeAccuracy, double offset, double multiplierScale) {
    if (!(relativeAccuracy > 0 && relativeAccuracy < 1)) {
      throw new IllegalArgumentException(
          "Relative accuracy (" + relativeAccuracy + ") must be between 0 and 1");
    }
    double mantissa = 2 * relativeAccuracy / (1 - relativeAccuracy);
    this.relativeAccuracy = relativeAccuracy;
    this.gamma = Double.isNaN(gamma) ? 1 + mantissa : gamma;
    this.offset = offset;
    this.multiplier = multiplierScale / Math.log1p(mantissa);
    this.minPossible = MIN_SAFE_DOUBLE * this.gamma;
    this.maxPossible = Double.MAX_VALUE / this.gamma;
  }

  /** Logarithm to base gamma, up to the subclass' choice of base. */
  protected abstract double logGamma(double value);

  /** Inverse of {@link #logGamma(double)}. */
  protected abstract double powGamma(double value);

  @Override
  public int key(double value) {
    double key = Math.ceil(logGamma(value)) + offset;
    if (key < Integer.MIN_VALUE || key > Integer.MAX_VALUE) {
      throw new IllegalArgumentException(
          "Value (" + value + ") maps outside of the indexable key range");
    }
    return (int) key;
  }

  @Override
  public double value(int key) {
    return powGamma(key - offset) * (2 / (1 + gamma));
  }

  @Override
  public double relativeAccuracy() {
    return relativeAccuracy;
  }

  @Override
  public double gamma() {
    return gamma;
  }

  @Override
  public double offset() {
    return offset;
  }

  @Override
  public double minPossible() {
    return minPossible;
  }

  @Override
  public double maxPossible() {
    return maxPossible;
  }

  @Override
  public byte[] serialize() {
    return ByteBuffer.allocate(SERIALIZED_SIZE).putDouble(gamma).putDouble(offset).array();
  }

  @Override
  public int serializedSize() {
    return SERIALIZED_SIZE;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "{relativeAccuracy="
        + relativeAccuracy
        + ", gamma="
        + gamma
        + ", offset="
        + offset
        + '}';
  }
}

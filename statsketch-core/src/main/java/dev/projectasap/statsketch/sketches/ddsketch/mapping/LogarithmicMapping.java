/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.sketches.ddsketch.mapping;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;

/** Key mapping that computes the exact logarithm to base gamma, through a base-2 logarithm. */
public class LogarithmicMapping extends GammaKeyMapping {
  private static final double LN_2 = Math.log(2);

  public LogarithmicMapping(double relativeAccuracy) {
    this(relativeAccuracy, 0);
  }

  public LogarithmicMapping(double relativeAccuracy, double offset) {
    super(relativeAccuracy, offset, LN_2);
  }

  private LogarithmicMapping(double gamma, double relativeAccuracy, double offset) {
    super(gamma, relativeAccuracy, offset, LN_2);
  }

  /**
   * Rebuilds a mapping from its gamma and offset, as found in serialized form. The rebuilt mapping
   * reports {@code gamma} unchanged, so it merges with mappings built from the same relative
   * accuracy and serializes back to the same bytes.
   *
   * @param gamma ratio between consecutive bucket bounds, greater than 1
   * @param offset key shift
   * @return an equivalent mapping
   */
  public static LogarithmicMapping fromGammaOffset(double gamma, double offset) {
    return new LogarithmicMapping(gamma, (gamma - 1) / (gamma + 1), offset);
  }

  /**
   * Reads a mapping from the current position of the buffer and advances past it.
   *
   * @param buffer big-endian buffer holding gamma then offset
   * @return the mapping
   * @throws IllegalArgumentException if the buffer is too short or holds an invalid gamma
   */
  public static LogarithmicMapping deserialize(ByteBuffer buffer) {
    try {
      double gamma = buffer.getDouble();
      double offset = buffer.getDouble();
      return fromGammaOffset(gamma, offset);
    } catch (BufferUnderflowException e) {
      throw new IllegalArgumentException("Truncated key mapping", e);
    }
  }

  @Override
  protected double logGamma(double value) {
    return Math.log(value) / LN_2 * multiplier;
  }

  @Override
  protected double powGamma(double value) {
    return Math.pow(2, value / multiplier);
  }
}

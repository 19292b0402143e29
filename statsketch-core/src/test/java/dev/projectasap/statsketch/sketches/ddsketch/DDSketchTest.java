/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.sketches.ddsketch;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.projectasap.statsketch.sketches.ddsketch.mapping.LogarithmicMapping;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class DDSketchTest {
  private static final double EPSILON = 1e-9;
  private static final double[] QUANTILES = {0, 0.01, 0.1, 0.25, 0.5, 0.75, 0.9, 0.95, 0.99, 1};

  private static DDSketch sketchOf(double... values) {
    DDSketch sketch = new DDSketch();
    for (double value : values) {
      sketch.add(value);
    }
    return sketch;
  }

  private static void assertSameQuantiles(DDSketch expected, DDSketch actual) {
    for (double quantile : QUANTILES) {
      assertEquals(
          expected.getValueAtQuantile(quantile),
          actual.getValueAtQuantile(quantile),
          EPSILON,
          "quantile " + quantile);
    }
  }

  @Test
  void testMergedHalvesMatchSequential() {
    DDSketch first = sketchOf(1, 2, 3, 4, 5);
    DDSketch second = sketchOf(6, 7, 8, 9, 10);
    DDSketch merged = new DDSketch();
    merged.merge(first);
    merged.merge(second);
    DDSketch sequential = sketchOf(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);

    for (DDSketch sketch : Arrays.asList(merged, sequential)) {
      assertEquals(0.99, sketch.getValueAtQuantile(0.01), EPSILON);
      assertEquals(2.974233423476717, sketch.getValueAtQuantile(0.25), EPSILON);
      assertEquals(5.002829575110743, sketch.getValueAtQuantile(0.5), EPSILON);
      assertEquals(7.028793021534833, sketch.getValueAtQuantile(0.75), EPSILON);
      assertEquals(8.935418643763667, sketch.getValueAtQuantile(0.99), EPSILON);
      assertEquals(10.074696689511441, sketch.getValueAtQuantile(1), EPSILON);
      assertEquals(10, sketch.getCount());
    }
  }

  @Test
  void testMergedNegativeHalvesMatchSequential() {
    DDSketch first = sketchOf(-10, -9, -8, -7, -6);
    DDSketch second = sketchOf(-5, -4, -3, -2, -1);
    DDSketch merged = new DDSketch();
    merged.merge(first);
    merged.merge(second);
    DDSketch sequential = sketchOf(-10, -9, -8, -7, -6, -5, -4, -3, -2, -1);

    for (DDSketch sketch : Arrays.asList(merged, sequential)) {
      assertEquals(-10.074696689511441, sketch.getValueAtQuantile(0.01), EPSILON);
      assertEquals(-7.924973703917148, sketch.getValueAtQuantile(0.25), EPSILON);
      assertEquals(-5.98951037117267, sketch.getValueAtQuantile(0.5), EPSILON);
      assertEquals(-4.014835333028612, sketch.getValueAtQuantile(0.75), EPSILON);
      assertEquals(-1.993661701417351, sketch.getValueAtQuantile(0.99), EPSILON);
    }
  }

  @Test
  void testMixedSigns() {
    DDSketch sketch = sketchOf(-3, -2, -1, 0, 1, 2, 3);
    assertEquals(-2.974233423476717, sketch.getValueAtQuantile(0), EPSILON);
    assertEquals(-1.993661701417351, sketch.getValueAtQuantile(0.25), EPSILON);
    assertEquals(0.0, sketch.getValueAtQuantile(0.5));
    assertEquals(0.9900000000000001, sketch.getValueAtQuantile(0.75), EPSILON);
    assertEquals(2.974233423476717, sketch.getValueAtQuantile(1), EPSILON);
    assertEquals(1, sketch.getZeroCount());
  }

  @Test
  void testQuantilesWithinRelativeAccuracy() {
    Random random = new Random(7);
    List<Double> values = new ArrayList<>();
    DDSketch sketch = new DDSketch(0.02);
    for (int i = 0; i < 5000; i++) {
      double value = Math.exp(random.nextGaussian() * 2);
      values.add(value);
      sketch.add(value);
    }
    values.sort(null);
    for (double quantile : QUANTILES) {
      double exact = values.get((int) Math.floor(quantile * (values.size() - 1)));
      double estimate = sketch.getValueAtQuantile(quantile);
      assertTrue(
          Math.abs(estimate - exact) <= 0.02 * exact * (1 + 1e-10),
          "quantile " + quantile + ": " + estimate + " vs " + exact);
    }
  }

  @Test
  void testMergeOfArbitraryPartitionMatchesWhole() {
    Random random = new Random(11);
    DDSketch left = new DDSketch();
    DDSketch right = new DDSketch();
    DDSketch whole = new DDSketch();
    for (int i = 0; i < 2000; i++) {
      double value = random.nextGaussian() * 1000;
      whole.add(value);
      if (random.nextBoolean()) {
        left.add(value);
      } else {
        right.add(value);
      }
    }
    left.merge(right);
    assertEquals(whole.getCount(), left.getCount());
    assertSameQuantiles(whole, left);
  }

  @Test
  void testMergeLeavesOtherUnchanged() {
    DDSketch sketch = sketchOf(1, 2);
    DDSketch other = sketchOf(500, -3, 0);
    byte[] before = other.serialize();
    sketch.merge(other);
    assertArrayEquals(before, other.serialize());
    assertEquals(5, sketch.getCount());
  }

  @Test
  void testMergeRejectsDifferentAccuracy() {
    DDSketch sketch = sketchOf(1, 2, 3);
    DDSketch other = new DDSketch(0.05);
    other.add(4);
    byte[] before = sketch.serialize();
    assertThrows(IllegalArgumentException.class, () -> sketch.merge(other));
    assertArrayEquals(before, sketch.serialize());
  }

  @Test
  void testNegativeCountIsRejected() {
    DDSketch sketch = sketchOf(1, 2, 3);
    byte[] before = sketch.serialize();
    assertThrows(IllegalArgumentException.class, () -> sketch.add(4, -1));
    assertThrows(IllegalArgumentException.class, () -> sketch.add(4, Double.NaN));
    assertArrayEquals(before, sketch.serialize());
    assertEquals(3, sketch.getCount());
  }

  @Test
  void testUnmappableValuesAreRejected() {
    DDSketch sketch = sketchOf(1);
    assertThrows(IllegalArgumentException.class, () -> sketch.add(Double.NaN));
    assertThrows(IllegalArgumentException.class, () -> sketch.add(Double.POSITIVE_INFINITY));
    assertThrows(IllegalArgumentException.class, () -> sketch.add(-Double.MAX_VALUE));
    assertEquals(1, sketch.getCount());
  }

  @Test
  void testWeightedAdd() {
    DDSketch sketch = new DDSketch();
    sketch.add(10, 3);
    sketch.add(20, 0);
    assertEquals(3, sketch.getCount());
    assertEquals(sketch.getValueAtQuantile(0), sketch.getValueAtQuantile(1));
  }

  @Test
  void testTinyValuesGoToZeroBucket() {
    DDSketch sketch = sketchOf(0, Double.MIN_VALUE, -Double.MIN_VALUE, -0.0);
    assertEquals(4, sketch.getZeroCount());
    assertTrue(sketch.getPositiveValueStore().isEmpty());
    assertTrue(sketch.getNegativeValueStore().isEmpty());
    assertEquals(0.0, sketch.getValueAtQuantile(0.5));
  }

  @Test
  void testEmptySketch() {
    DDSketch sketch = new DDSketch();
    assertTrue(sketch.isEmpty());
    assertEquals(0, sketch.getCount());
    for (double quantile : QUANTILES) {
      assertTrue(Double.isNaN(sketch.getValueAtQuantile(quantile)));
    }
    assertTrue(Double.isNaN(sketch.getMinValue()));
    assertTrue(Double.isNaN(sketch.getMaxValue()));
    assertEquals(0, sketch.getSum());
    assertFalse(sketch.iterator().hasNext());
  }

  @Test
  void testQuantileOutOfRange() {
    DDSketch sketch = sketchOf(1, 2, 3);
    assertTrue(Double.isNaN(sketch.getValueAtQuantile(-0.1)));
    assertTrue(Double.isNaN(sketch.getValueAtQuantile(1.1)));
    assertTrue(Double.isNaN(sketch.getValueAtQuantile(0.5, 0)));
  }

  @Test
  void testOverrideCount() {
    DDSketch sketch = sketchOf(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
    // rank 9.5 is beyond the recorded weight and falls back to the highest key
    assertEquals(10.074696689511441, sketch.getValueAtQuantile(0.5, 20), EPSILON);
    assertEquals(4.014835333028612, sketch.getValueAtQuantile(0.9, 5), EPSILON);
  }

  @Test
  void testMinAndMax() {
    DDSketch positives = sketchOf(3, 5);
    assertEquals(2.974233423476717, positives.getMinValue(), EPSILON);
    assertEquals(5.002829575110743, positives.getMaxValue(), EPSILON);

    DDSketch mixed = sketchOf(-2, 0, 5);
    assertEquals(-1.993661701417351, mixed.getMinValue(), EPSILON);
    assertEquals(5.002829575110743, mixed.getMaxValue(), EPSILON);

    DDSketch withZero = sketchOf(0, -2);
    assertEquals(0.0, withZero.getMaxValue());

    DDSketch negatives = sketchOf(-3, -5);
    assertEquals(-2.974233423476717, negatives.getMaxValue(), EPSILON);
    assertEquals(-5.002829575110743, negatives.getMinValue(), EPSILON);
  }

  @Test
  void testSumFromRepresentatives() {
    DDSketch sketch = sketchOf(3, 3, -2, 0);
    assertEquals(2 * 2.974233423476717 - 1.993661701417351, sketch.getSum(), EPSILON);
  }

  @Test
  void testIterationOrder() {
    DDSketch sketch = sketchOf(3, -2, 0, 5);
    List<WeightedValue> values = new ArrayList<>();
    for (WeightedValue value : sketch) {
      values.add(value);
    }
    assertEquals(4, values.size());
    assertEquals(new WeightedValue(0, 1), values.get(0));
    assertEquals(2.974233423476717, values.get(1).getValue(), EPSILON);
    assertEquals(5.002829575110743, values.get(2).getValue(), EPSILON);
    assertEquals(-1.993661701417351, values.get(3).getValue(), EPSILON);
  }

  @Test
  void testCopySharesMappingAndDeepCopiesStores() {
    DDSketch source = sketchOf(1, -1, 0);
    DDSketch target = new DDSketch(0.05);
    target.add(100);
    target.copy(source);
    assertSame(source.getKeyMapping(), target.getKeyMapping());
    assertEquals(3, target.getCount());

    target.add(7);
    assertEquals(3, source.getCount());

    DDSketch copy = source.copy();
    copy.add(8);
    assertEquals(3, source.getCount());
    assertEquals(4, copy.getCount());
  }

  @Test
  void testClear() {
    DDSketch sketch = sketchOf(1, -1, 0);
    sketch.clear();
    assertTrue(sketch.isEmpty());
    assertEquals(0, sketch.getZeroCount());
  }

  @Test
  void testSerializedLayout() {
    DDSketch empty = new DDSketch();
    byte[] bytes = empty.serialize();
    assertEquals(16 + 8 + 8 + 8, bytes.length);
    assertEquals(bytes.length, empty.serializedSize());

    DDSketch sketch = sketchOf(1, 0, 0);
    ByteBuffer buffer = ByteBuffer.wrap(sketch.serialize());
    assertEquals(sketch.getKeyMapping().gamma(), buffer.getDouble());
    assertEquals(0.0, buffer.getDouble());
    assertEquals(-64, buffer.getInt());
    assertEquals(128, buffer.getInt());
    buffer.position(buffer.position() + 128 * Double.BYTES);
    assertEquals(0, buffer.getInt());
    assertEquals(0, buffer.getInt());
    assertEquals(2.0, buffer.getDouble());
    assertFalse(buffer.hasRemaining());
  }

  @Test
  void testRoundTrip() {
    Random random = new Random(3);
    DDSketch sketch = new DDSketch(0.01);
    for (int i = 0; i < 1000; i++) {
      sketch.add(random.nextGaussian() * 50, 1 + random.nextInt(3));
    }
    sketch.add(0, 2);

    DDSketch decoded = DDSketch.deserialize(sketch.serialize());
    assertEquals(sketch.getKeyMapping().gamma(), decoded.getKeyMapping().gamma());
    assertEquals(sketch.getCount(), decoded.getCount());
    assertEquals(sketch.getZeroCount(), decoded.getZeroCount());
    assertEquals(sketch.getMinValue(), decoded.getMinValue(), EPSILON);
    assertEquals(sketch.getMaxValue(), decoded.getMaxValue(), EPSILON);
    assertEquals(sketch.getSum(), decoded.getSum(), 1e-6);
    assertSameQuantiles(sketch, decoded);
  }

  @Test
  void testDeserializedSketchAcceptsNewValues() {
    DDSketch sketch = sketchOf(1, 2, 3, 4, 5);
    DDSketch decoded = DDSketch.deserialize(sketch.serialize());
    decoded.merge(sketchOf(6, 7, 8, 9, 10));
    assertEquals(5.002829575110743, decoded.getValueAtQuantile(0.5), EPSILON);
  }

  @Test
  void testDeserializedSketchMergesWithFreshSketch() {
    DDSketch stored = new DDSketch(0.177);
    stored.add(3);
    stored.add(50);
    DDSketch restored = DDSketch.deserialize(stored.serialize());

    DDSketch fresh = new DDSketch(0.177);
    fresh.add(7);
    fresh.merge(restored);
    assertEquals(3, fresh.getCount());
    restored.merge(fresh);
    assertEquals(5, restored.getCount());
  }

  @Test
  void testDeserializeWithCustomMapping() {
    DDSketch sketch = new DDSketch(new LogarithmicMapping(0.02));
    sketch.add(42);
    DDSketch decoded = DDSketch.deserialize(sketch.serialize());
    assertEquals(sketch.getKeyMapping().gamma(), decoded.getKeyMapping().gamma());
    assertEquals(sketch.getValueAtQuantile(0.5), decoded.getValueAtQuantile(0.5), EPSILON);
  }

  @Test
  void testDeserializeTruncated() {
    byte[] bytes = sketchOf(1, -1).serialize();
    assertThrows(
        IllegalArgumentException.class,
        () -> DDSketch.deserialize(Arrays.copyOf(bytes, bytes.length - 4)));
    assertThrows(IllegalArgumentException.class, () -> DDSketch.deserialize(new byte[10]));
  }
}

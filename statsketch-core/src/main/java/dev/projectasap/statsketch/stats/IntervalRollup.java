/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.stats;

import dev.projectasap.statsketch.datamodel.MetricStat;
import dev.projectasap.statsketch.sketches.ddsketch.DDSketchAccumulator;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Combines the per-interval accumulators of one series over a time range. Only buckets of the
 * configured duration lying entirely inside {@code [rangeStart, rangeEnd]} are kept. The combined
 * statistic sums the exact totals and reads quantiles from the merged sketches against the summed
 * count.
 *
 * <p>This is the read side of the interval statistics and has no caller inside the streaming job,
 * which only produces the per-interval accumulators. Applications that persist those accumulators
 * (the job's {@code byte} output format writes them with their window bounds) use it to answer
 * range queries: deserialize each stored bucket with
 * {@link DDSketchAccumulator#deserialize(byte[])}, offer it with {@link #add}, then read
 * {@link #total()} or {@link #samples()}.
 */
public class IntervalRollup {
  private final long duration;
  private final long rangeStart;
  private final long rangeEnd;
  private final TreeMap<Long, Bucket> buckets = new TreeMap<>();

  /**
   * @param duration bucket duration in milliseconds
   * @param rangeStart inclusive lower bound for bucket starts
   * @param rangeEnd inclusive upper bound for bucket ends
   */
  public IntervalRollup(long duration, long rangeStart, long rangeEnd) {
    if (duration <= 0) {
      throw new IllegalArgumentException("Duration (" + duration + ") must be positive");
    }
    if (rangeEnd < rangeStart) {
      throw new IllegalArgumentException(
          "Range end (" + rangeEnd + ") is before range start (" + rangeStart + ")");
    }
    this.duration = duration;
    this.rangeStart = rangeStart;
    this.rangeEnd = rangeEnd;
  }

  /**
   * Offers the accumulator of one interval bucket.
   *
   * @param start bucket start
   * @param end bucket end
   * @param accumulator values recorded in the bucket; not modified
   * @return true if the bucket was kept, false if its duration or position does not match
   * @throws IllegalArgumentException if a bucket with the same start was already kept
   */
  public boolean add(long start, long end, DDSketchAccumulator accumulator) {
    if (end - start != duration || start < rangeStart || end > rangeEnd) {
      return false;
    }
    if (buckets.containsKey(start)) {
      throw new IllegalArgumentException("Interval starting at " + start + " was already added");
    }
    buckets.put(start, new Bucket(end, accumulator));
    return true;
  }

  /** Per-bucket statistics ordered by start. */
  public List<IntervalSample> samples() {
    List<IntervalSample> samples = new ArrayList<>(buckets.size());
    for (Map.Entry<Long, Bucket> entry : buckets.entrySet()) {
      Bucket bucket = entry.getValue();
      samples.add(new IntervalSample(entry.getKey(), bucket.end, bucket.accumulator.snapshot()));
    }
    return samples;
  }

  /** Statistics over every kept bucket, or empty if no bucket was kept. */
  public Optional<MetricStat> total() {
    DDSketchAccumulator merged = null;
    for (Bucket bucket : buckets.values()) {
      merged = merged == null ? bucket.accumulator : merged.merge(bucket.accumulator);
    }
    return merged == null ? Optional.empty() : Optional.of(merged.snapshot());
  }

  private static final class Bucket {
    private final long end;
    private final DDSketchAccumulator accumulator;

    private Bucket(long end, DDSketchAccumulator accumulator) {
      this.end = end;
      this.accumulator = accumulator;
    }
  }
}

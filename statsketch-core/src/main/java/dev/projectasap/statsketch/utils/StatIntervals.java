/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.utils;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Interval durations statistics are bucketed by, and the bucket arithmetic shared by callers.
 *
 * <p>Buckets are aligned to the epoch, as Flink tumbling windows without an offset are, so the
 * window bounds the job emits equal {@link #bucketStart} and {@link #bucketEnd} of any timestamp in
 * the window. Readers of persisted window output use these to locate the buckets of a range before
 * combining them with {@code IntervalRollup}.
 */
public final class StatIntervals {
  public static final long SECOND = 1000L;
  public static final long MINUTE = 60 * SECOND;
  public static final long HOUR = 60 * MINUTE;
  public static final long DAY = 24 * HOUR;
  public static final long WEEK = 7 * DAY;
  public static final long MONTH = 30 * DAY;
  public static final long YEAR = 365 * DAY;

  /** Second, minute, hour, day, week, 30-day month and 365-day year, in milliseconds. */
  public static final List<Long> DEFAULT_INTERVAL_DURATIONS =
      Collections.unmodifiableList(Arrays.asList(SECOND, MINUTE, HOUR, DAY, WEEK, MONTH, YEAR));

  private StatIntervals() {}

  /**
   * Returns the start of the interval bucket containing the timestamp.
   *
   * @param timestamp epoch milliseconds
   * @param interval bucket duration in milliseconds, strictly positive
   * @return the largest multiple of {@code interval} not greater than {@code timestamp}
   */
  public static long bucketStart(long timestamp, long interval) {
    if (interval <= 0) {
      throw new IllegalArgumentException("Interval (" + interval + ") must be positive");
    }
    return Math.floorDiv(timestamp, interval) * interval;
  }

  /** Returns the exclusive end of the interval bucket containing the timestamp. */
  public static long bucketEnd(long timestamp, long interval) {
    return bucketStart(timestamp, interval) + interval;
  }
}

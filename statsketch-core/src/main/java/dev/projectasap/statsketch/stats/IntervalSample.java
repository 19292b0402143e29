/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.projectasap.statsketch.datamodel.MetricStat;

/** Statistics of one interval bucket, {@code [start, end)} in epoch milliseconds. */
@JsonPropertyOrder({"start", "end", "stat"})
public class IntervalSample {
  @JsonProperty("start")
  public final long start;

  @JsonProperty("end")
  public final long end;

  @JsonProperty("stat")
  public final MetricStat stat;

  public IntervalSample(long start, long end, MetricStat stat) {
    this.start = start;
    this.end = end;
    this.stat = stat;
  }

  @Override
  public String toString() {
    return "IntervalSample{start=" + start + ", end=" + end + ", stat=" + stat + '}';
  }
}

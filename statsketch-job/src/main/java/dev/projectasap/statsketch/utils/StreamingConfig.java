/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.utils;

import java.util.List;

/**
 * Configuration for the streaming job: the windowed aggregations to run and the relative accuracy
 * of the running statistics.
 */
public class StreamingConfig {
  public List<AggregationConfig> aggregationConfigs;
  public double runningRelativeAccuracy = 0.01;
}

/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.stats;

/** Outcome of recording a value into a running statistic. */
public enum RecordStatus {
  /** First value of the series. */
  CREATED,
  /** The series already had values. */
  UPDATED
}

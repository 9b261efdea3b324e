/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.series;

/**
 * Discriminant of a metric's series, which renderers branch on instead of
 * assuming a non-empty series.
 */
public enum SeriesState {

  /** Nothing was ever observed for this metric. */
  NO_DATA_YET,

  /** Input was observed, but it did not contain a single row. */
  EMPTY,

  /** At least one row exists. */
  HAS_DATA
}

/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.series;

/** The two per-day traffic metrics reported by the source. */
public enum TrafficMetric {

  VIEWS("views"),
  CLONES("clones");

  private final String columnPrefix;

  TrafficMetric(String columnPrefix) {
    this.columnPrefix = columnPrefix;
  }

  /** Column holding the total count, e.g. {@code views_total}. */
  public String totalColumn() {
    return this.columnPrefix + "_total";
  }

  /** Column holding the unique count, e.g. {@code views_unique}. */
  public String uniqueColumn() {
    return this.columnPrefix + "_unique";
  }

  @Override
  public String toString() {
    return this.columnPrefix;
  }
}

/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDate;

/**
 * One day of a metric with its cumulative totals. Unique counts are only set
 * for views and clones.
 */
@JsonPropertyOrder({ "date", "count", "unique_count", "cumulative_count",
    "cumulative_unique_count" })
public final class ReportRow {

  @JsonProperty("date")
  private final String date;

  @JsonProperty("count")
  private final long count;

  @JsonProperty("unique_count")
  private final Long uniqueCount;

  @JsonProperty("cumulative_count")
  private final long cumulativeCount;

  @JsonProperty("cumulative_unique_count")
  private final Long cumulativeUniqueCount;

  ReportRow(LocalDate date, long count, Long uniqueCount,
      long cumulativeCount, Long cumulativeUniqueCount) {
    this.date = date.toString();
    this.count = count;
    this.uniqueCount = uniqueCount;
    this.cumulativeCount = cumulativeCount;
    this.cumulativeUniqueCount = cumulativeUniqueCount;
  }

  public LocalDate getDate() {
    return LocalDate.parse(this.date);
  }

  public long getCount() {
    return this.count;
  }

  public Long getUniqueCount() {
    return this.uniqueCount;
  }

  public long getCumulativeCount() {
    return this.cumulativeCount;
  }

  public Long getCumulativeUniqueCount() {
    return this.cumulativeUniqueCount;
  }

  @Override
  public String toString() {
    return this.date + "=" + this.count + " (" + this.cumulativeCount + ")";
  }
}

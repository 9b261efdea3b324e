/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.series;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Total and unique count of one traffic metric (views or clones) for one
 * calendar day.
 */
public final class DailyRecord {

  private final LocalDate date;

  private final long count;

  private final long uniqueCount;

  /**
   * Create a record, rejecting negative counts and unique counts exceeding
   * the total count.
   */
  public DailyRecord(LocalDate date, long count, long uniqueCount) {
    if (null == date) {
      throw new IllegalArgumentException("Date must not be null.");
    }
    if (count < 0L || uniqueCount < 0L) {
      throw new IllegalArgumentException("Negative count for " + date + ".");
    }
    if (uniqueCount > count) {
      throw new IllegalArgumentException("Unique count " + uniqueCount
          + " exceeds total count " + count + " for " + date + ".");
    }
    this.date = date;
    this.count = count;
    this.uniqueCount = uniqueCount;
  }

  public LocalDate getDate() {
    return this.date;
  }

  public long getCount() {
    return this.count;
  }

  public long getUniqueCount() {
    return this.uniqueCount;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof DailyRecord)) {
      return false;
    }
    DailyRecord that = (DailyRecord) other;
    return this.count == that.count && this.uniqueCount == that.uniqueCount
        && this.date.equals(that.date);
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.date, this.count, this.uniqueCount);
  }

  @Override
  public String toString() {
    return this.date + ":" + this.count + "/" + this.uniqueCount;
  }
}

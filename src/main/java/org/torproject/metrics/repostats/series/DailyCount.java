/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.series;

import java.time.LocalDate;
import java.util.Objects;

/** Number of events on one calendar day. */
public final class DailyCount {

  private final LocalDate date;

  private final long count;

  /** Create a count, which must be positive as zero days are gaps. */
  public DailyCount(LocalDate date, long count) {
    if (null == date) {
      throw new IllegalArgumentException("Date must not be null.");
    }
    if (count <= 0L) {
      throw new IllegalArgumentException("Non-positive count " + count
          + " for " + date + ".");
    }
    this.date = date;
    this.count = count;
  }

  public LocalDate getDate() {
    return this.date;
  }

  public long getCount() {
    return this.count;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof DailyCount)) {
      return false;
    }
    DailyCount that = (DailyCount) other;
    return this.count == that.count && this.date.equals(that.date);
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.date, this.count);
  }

  @Override
  public String toString() {
    return this.date + ":" + this.count;
  }
}

/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.series;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One row of a views/clones series: views and clones of the same day, as
 * reported together by a single fetch.
 */
public final class TrafficDay {

  private final DailyRecord views;

  private final DailyRecord clones;

  /** Create a row from two records of the same date. */
  public TrafficDay(DailyRecord views, DailyRecord clones) {
    if (!views.getDate().equals(clones.getDate())) {
      throw new IllegalArgumentException("Views date " + views.getDate()
          + " differs from clones date " + clones.getDate() + ".");
    }
    this.views = views;
    this.clones = clones;
  }

  /** Convenience factory used by parsers and tests. */
  public static TrafficDay of(LocalDate date, long viewsTotal,
      long viewsUnique, long clonesTotal, long clonesUnique) {
    return new TrafficDay(new DailyRecord(date, viewsTotal, viewsUnique),
        new DailyRecord(date, clonesTotal, clonesUnique));
  }

  public LocalDate getDate() {
    return this.views.getDate();
  }

  public DailyRecord getViews() {
    return this.views;
  }

  public DailyRecord getClones() {
    return this.clones;
  }

  /** Return the record of the given metric. */
  public DailyRecord get(TrafficMetric metric) {
    return TrafficMetric.VIEWS == metric ? this.views : this.clones;
  }

  /** Whether both days report identical counts, ignoring the date. */
  public boolean sameCounts(TrafficDay other) {
    return this.views.getCount() == other.views.getCount()
        && this.views.getUniqueCount() == other.views.getUniqueCount()
        && this.clones.getCount() == other.clones.getCount()
        && this.clones.getUniqueCount() == other.clones.getUniqueCount();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof TrafficDay)) {
      return false;
    }
    TrafficDay that = (TrafficDay) other;
    return this.views.equals(that.views) && this.clones.equals(that.clones);
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.views, this.clones);
  }

  @Override
  public String toString() {
    return "views=" + this.views + ", clones=" + this.clones;
  }
}

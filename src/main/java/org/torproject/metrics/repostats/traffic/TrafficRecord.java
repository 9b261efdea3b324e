/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.traffic;

import org.torproject.metrics.repostats.series.Provenance;
import org.torproject.metrics.repostats.series.TrafficDay;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A views/clones row together with the provenance of the fragment it was
 * taken from.
 */
public final class TrafficRecord {

  private final TrafficDay day;

  private final Provenance provenance;

  /** Create a record from a row and its provenance. */
  public TrafficRecord(TrafficDay day, Provenance provenance) {
    this.day = Objects.requireNonNull(day);
    this.provenance = Objects.requireNonNull(provenance);
  }

  public LocalDate getDate() {
    return this.day.getDate();
  }

  public TrafficDay getDay() {
    return this.day;
  }

  public Provenance getProvenance() {
    return this.provenance;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof TrafficRecord)) {
      return false;
    }
    TrafficRecord that = (TrafficRecord) other;
    return this.day.equals(that.day)
        && this.provenance.equals(that.provenance);
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.day, this.provenance);
  }

  @Override
  public String toString() {
    return this.getDate() + " [" + this.day + "] from " + this.provenance;
  }
}

/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDate;
import java.util.Objects;

/** Inclusive date range shared by the charts of related series. */
@JsonPropertyOrder({ "start", "end" })
public final class PlotWindow {

  @JsonProperty("start")
  private final String start;

  @JsonProperty("end")
  private final String end;

  /** Create a window from start to end, both inclusive. */
  public PlotWindow(LocalDate start, LocalDate end) {
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("Window end " + end
          + " before start " + start + ".");
    }
    this.start = start.toString();
    this.end = end.toString();
  }

  public LocalDate getStart() {
    return LocalDate.parse(this.start);
  }

  public LocalDate getEnd() {
    return LocalDate.parse(this.end);
  }

  /** Return the smallest window containing both this window and the given. */
  public PlotWindow span(PlotWindow other) {
    if (null == other) {
      return this;
    }
    LocalDate first = this.getStart().isBefore(other.getStart())
        ? this.getStart() : other.getStart();
    LocalDate last = this.getEnd().isAfter(other.getEnd())
        ? this.getEnd() : other.getEnd();
    return new PlotWindow(first, last);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof PlotWindow)) {
      return false;
    }
    PlotWindow that = (PlotWindow) other;
    return this.start.equals(that.start) && this.end.equals(that.end);
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.start, this.end);
  }

  @Override
  public String toString() {
    return this.start + ".." + this.end;
  }
}

/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.events;

import org.torproject.metrics.repostats.fragment.FragmentKind;
import org.torproject.metrics.repostats.fragment.FragmentRef;
import org.torproject.metrics.repostats.series.DailyCount;
import org.torproject.metrics.repostats.series.MetricSeries;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Per-day event counts of one kind and the fragments they came from. */
public final class EventTable {

  private final FragmentKind kind;

  private final MetricSeries<DailyCount> series;

  private final List<FragmentRef> sources;

  EventTable(FragmentKind kind, MetricSeries<DailyCount> series,
      List<FragmentRef> sources) {
    this.kind = kind;
    this.series = series;
    this.sources = Collections.unmodifiableList(new ArrayList<>(sources));
  }

  public FragmentKind getKind() {
    return this.kind;
  }

  public MetricSeries<DailyCount> getSeries() {
    return this.series;
  }

  public List<FragmentRef> getSources() {
    return this.sources;
  }

  @Override
  public String toString() {
    return this.kind + " " + this.series;
  }
}

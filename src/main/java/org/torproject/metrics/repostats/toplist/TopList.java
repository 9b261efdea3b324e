/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.toplist;

import org.torproject.metrics.repostats.fragment.FragmentKind;
import org.torproject.metrics.repostats.series.SeriesState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Ranked, deduplicated top list of referrers or paths. */
public final class TopList {

  private final FragmentKind kind;

  private final SeriesState state;

  private final List<AggregatedEntry> entries;

  TopList(FragmentKind kind, SeriesState state,
      List<AggregatedEntry> entries) {
    this.kind = kind;
    this.state = state;
    this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
  }

  public FragmentKind getKind() {
    return this.kind;
  }

  public SeriesState getState() {
    return this.state;
  }

  /** Return entries ranked by count descending, then by subject. */
  public List<AggregatedEntry> getEntries() {
    return this.entries;
  }

  @Override
  public String toString() {
    return this.kind + " " + this.state + this.entries;
  }
}

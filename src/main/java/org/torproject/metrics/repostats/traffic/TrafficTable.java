/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.traffic;

import org.torproject.metrics.repostats.fragment.FragmentRef;
import org.torproject.metrics.repostats.series.MetricSeries;
import org.torproject.metrics.repostats.series.SeriesState;
import org.torproject.metrics.repostats.series.TrafficDay;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Non-overlapping per-day views/clones table produced by the
 * {@link TrafficMerger}, together with the provenance of every row and the
 * fragments it was merged from.
 */
public final class TrafficTable {

  private final SeriesState state;

  private final SortedMap<LocalDate, TrafficRecord> records;

  private final List<ClosureDecision> conflicts;

  private final List<FragmentRef> sources;

  TrafficTable(SeriesState state, SortedMap<LocalDate, TrafficRecord> records,
      List<ClosureDecision> conflicts, List<FragmentRef> sources) {
    this.state = state;
    this.records = Collections.unmodifiableSortedMap(new TreeMap<>(records));
    this.conflicts = Collections.unmodifiableList(new ArrayList<>(conflicts));
    this.sources = Collections.unmodifiableList(new ArrayList<>(sources));
  }

  public SeriesState getState() {
    return this.state;
  }

  /** Return the chosen record per date, which is empty unless there is data. */
  public SortedMap<LocalDate, TrafficRecord> getRecords() {
    return this.records;
  }

  /** Return the rows as a series carrying this table's state. */
  public MetricSeries<TrafficDay> toSeries() {
    if (SeriesState.NO_DATA_YET == this.state) {
      return MetricSeries.noDataYet();
    }
    SortedMap<LocalDate, TrafficDay> rows = new TreeMap<>();
    for (TrafficRecord rec : this.records.values()) {
      rows.put(rec.getDate(), rec.getDay());
    }
    return MetricSeries.of(rows);
  }

  /** Return decisions for dates whose candidates disagreed. */
  public List<ClosureDecision> getConflicts() {
    return this.conflicts;
  }

  /** Return references of all fragments this table was merged from. */
  public List<FragmentRef> getSources() {
    return this.sources;
  }
}

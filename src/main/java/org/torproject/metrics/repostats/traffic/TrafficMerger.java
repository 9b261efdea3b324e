/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.traffic;

import org.torproject.metrics.repostats.fragment.Fragment;
import org.torproject.metrics.repostats.fragment.FragmentRef;
import org.torproject.metrics.repostats.fragment.FragmentSelection;
import org.torproject.metrics.repostats.series.Provenance;
import org.torproject.metrics.repostats.series.SeriesState;
import org.torproject.metrics.repostats.series.TrafficDay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Collapses overlapping views/clones fragments into one per-day table that
 * covers the union of all observed dates, resolving dates reported by more
 * than one fragment with the {@link ClosurePolicy}.
 */
public class TrafficMerger {

  private static final Logger logger
      = LoggerFactory.getLogger(TrafficMerger.class);

  /**
   * Merge the given fragments.
   *
   * <p>Without any fragment the table is in state
   * {@link SeriesState#NO_DATA_YET}; if all fragments are empty, it is in state
   * {@link SeriesState#EMPTY}.</p>
   */
  public TrafficTable merge(FragmentSelection<TrafficDay> selection) {
    List<FragmentRef> sources = new ArrayList<>();
    SortedMap<LocalDate, List<TrafficRecord>> candidates = new TreeMap<>();
    for (Fragment<TrafficDay> fragment : selection.getFragments()) {
      sources.add(fragment.getRef());
      for (TrafficRecord rec : withProvenance(fragment)) {
        candidates.computeIfAbsent(rec.getDate(), date -> new ArrayList<>())
            .add(rec);
      }
    }
    if (selection.isAbsent()) {
      logger.info("No views/clones fragments found.");
      return new TrafficTable(SeriesState.NO_DATA_YET, new TreeMap<>(),
          new ArrayList<>(), sources);
    }
    SortedMap<LocalDate, TrafficRecord> chosen = new TreeMap<>();
    List<ClosureDecision> conflicts = new ArrayList<>();
    for (Map.Entry<LocalDate, List<TrafficRecord>> e
        : candidates.entrySet()) {
      ClosureDecision decision = ClosurePolicy.decide(e.getKey(),
          e.getValue());
      chosen.put(e.getKey(), decision.getChosen());
      if (decision.isConflict()) {
        logger.debug("Resolved conflicting views/clones values: {}",
            decision);
        conflicts.add(decision);
      }
    }
    logger.info("Merged {} views/clones fragment(s) into {} day(s), "
        + "resolving {} conflicting day(s).", sources.size(), chosen.size(),
        conflicts.size());
    return new TrafficTable(chosen.isEmpty() ? SeriesState.EMPTY
        : SeriesState.HAS_DATA, chosen, conflicts, sources);
  }

  /**
   * Tag every row of a fragment with the fragment's capture time and the
   * row's distance from the nearer edge of the fragment's date range.
   */
  static List<TrafficRecord> withProvenance(Fragment<TrafficDay> fragment) {
    List<TrafficRecord> records = new ArrayList<>();
    if (fragment.isEmpty()) {
      return records;
    }
    LocalDate windowStart = null;
    LocalDate windowEnd = null;
    for (TrafficDay day : fragment.getRows()) {
      if (null == windowStart || day.getDate().isBefore(windowStart)) {
        windowStart = day.getDate();
      }
      if (null == windowEnd || day.getDate().isAfter(windowEnd)) {
        windowEnd = day.getDate();
      }
    }
    for (TrafficDay day : fragment.getRows()) {
      long fromStart = ChronoUnit.DAYS.between(windowStart, day.getDate());
      long toEnd = ChronoUnit.DAYS.between(day.getDate(), windowEnd);
      records.add(new TrafficRecord(day, new Provenance(
          fragment.getCapturedAt(), (int) Math.min(fromStart, toEnd))));
    }
    return records;
  }
}

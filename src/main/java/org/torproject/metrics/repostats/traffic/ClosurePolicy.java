/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.traffic;

import org.torproject.metrics.repostats.series.Provenance;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;

/**
 * Chooses among conflicting views/clones records reported for the same date.
 *
 * <p>The source only closes out a day's counts after the day has fully
 * elapsed, so a record at either edge of its fragment's window is provisional.
 * Candidates are therefore ranked by their distance from the nearer window
 * edge, largest first, and among equal distances by capture time, latest
 * first. If no candidate lies inside its window, this falls back to the most
 * recent fragment containing the date. Identical counts are resolved by
 * keeping the most recent capture time together with the largest edge
 * distance of all candidates, so that confirming a closed-out record from a
 * window edge never weakens it.</p>
 *
 * <p>The policy is a pure function of its input and independent of the order
 * in which candidates are given.</p>
 */
public final class ClosurePolicy {

  /* Last resort for equal provenances. */
  private static final Comparator<TrafficRecord> byCounts
      = Comparator.<TrafficRecord>comparingLong(
          rec -> rec.getDay().getViews().getCount())
      .thenComparingLong(rec -> rec.getDay().getViews().getUniqueCount())
      .thenComparingLong(rec -> rec.getDay().getClones().getCount())
      .thenComparingLong(rec -> rec.getDay().getClones().getUniqueCount());

  private static final Comparator<TrafficRecord> byAuthority
      = Comparator.comparing(TrafficRecord::getProvenance)
      .thenComparing(byCounts);

  private static final Comparator<TrafficRecord> byRecency
      = Comparator.<TrafficRecord, Instant>comparing(
          rec -> rec.getProvenance().getCapturedAt())
      .thenComparingInt(rec -> rec.getProvenance().getEdgeDistance());

  private ClosurePolicy() {
  }

  /**
   * Decide which candidate to keep for the given date.
   *
   * @throws IllegalArgumentException if there are no candidates or a
   *     candidate is for a different date.
   */
  public static ClosureDecision decide(LocalDate date,
      Collection<TrafficRecord> candidates) {
    if (candidates.isEmpty()) {
      throw new IllegalArgumentException("No candidates for " + date + ".");
    }
    TrafficRecord first = null;
    boolean identical = true;
    for (TrafficRecord candidate : candidates) {
      if (!date.equals(candidate.getDate())) {
        throw new IllegalArgumentException("Candidate " + candidate
            + " is not for " + date + ".");
      }
      if (null == first) {
        first = candidate;
      } else if (!first.getDay().sameCounts(candidate.getDay())) {
        identical = false;
      }
    }
    if (1 == candidates.size()) {
      return new ClosureDecision(date, first,
          ClosureDecision.Reason.SOLE_CANDIDATE, 1);
    }
    if (identical) {
      TrafficRecord newest = candidates.stream().max(byRecency).get();
      int deepest = candidates.stream().mapToInt(
          rec -> rec.getProvenance().getEdgeDistance()).max().getAsInt();
      TrafficRecord kept = deepest == newest.getProvenance().getEdgeDistance()
          ? newest : new TrafficRecord(newest.getDay(), new Provenance(
          newest.getProvenance().getCapturedAt(), deepest));
      return new ClosureDecision(date, kept,
          ClosureDecision.Reason.IDENTICAL_VALUES, candidates.size());
    }
    TrafficRecord best = candidates.stream().max(byAuthority).get();
    ClosureDecision.Reason reason = best.getProvenance().isAtEdge()
        ? ClosureDecision.Reason.EDGE_FALLBACK
        : ClosureDecision.Reason.INTERIOR;
    return new ClosureDecision(date, best, reason, candidates.size());
  }
}

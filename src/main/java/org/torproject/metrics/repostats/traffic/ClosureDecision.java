/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.traffic;

import java.time.LocalDate;

/** Outcome of applying the closure policy to the candidates of one date. */
public final class ClosureDecision {

  /** Why a candidate was chosen. */
  public enum Reason {

    /** There was only one candidate. */
    SOLE_CANDIDATE,

    /** All candidates reported the same counts. */
    IDENTICAL_VALUES,

    /** The chosen candidate lay inside its fragment's window. */
    INTERIOR,

    /** Every candidate lay at a window edge; the latest capture won. */
    EDGE_FALLBACK
  }

  private final LocalDate date;

  private final TrafficRecord chosen;

  private final Reason reason;

  private final int candidates;

  ClosureDecision(LocalDate date, TrafficRecord chosen, Reason reason,
      int candidates) {
    this.date = date;
    this.chosen = chosen;
    this.reason = reason;
    this.candidates = candidates;
  }

  public LocalDate getDate() {
    return this.date;
  }

  public TrafficRecord getChosen() {
    return this.chosen;
  }

  public Reason getReason() {
    return this.reason;
  }

  public int getCandidates() {
    return this.candidates;
  }

  /** Whether candidates disagreed about the counts of this date. */
  public boolean isConflict() {
    return Reason.INTERIOR == this.reason
        || Reason.EDGE_FALLBACK == this.reason;
  }

  @Override
  public String toString() {
    return this.date + ": " + this.reason + " out of " + this.candidates
        + " candidate(s), chose " + this.chosen.getProvenance();
  }
}

/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.traffic;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.torproject.metrics.repostats.series.Provenance;
import org.torproject.metrics.repostats.series.TrafficDay;

import org.junit.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class ClosurePolicyTest {

  private static final LocalDate DATE = LocalDate.parse("2021-01-10");

  private static TrafficRecord candidate(long views, String capturedAt,
      int edgeDistance) {
    return new TrafficRecord(TrafficDay.of(DATE, views, 1, 0, 0),
        new Provenance(Instant.parse(capturedAt), edgeDistance));
  }

  @Test
  public void testSoleCandidate() {
    TrafficRecord only = candidate(5, "2021-01-14T00:00:00Z", 0);
    ClosureDecision decision = ClosurePolicy.decide(DATE,
        Collections.singletonList(only));
    assertSame(only, decision.getChosen());
    assertEquals(ClosureDecision.Reason.SOLE_CANDIDATE, decision.getReason());
    assertFalse(decision.isConflict());
  }

  @Test
  public void testInteriorBeatsLaterEdge() {
    TrafficRecord interior = candidate(7, "2021-01-14T00:00:00Z", 4);
    TrafficRecord edge = candidate(3, "2021-01-24T00:00:00Z", 0);
    ClosureDecision decision = ClosurePolicy.decide(DATE,
        Arrays.asList(edge, interior));
    assertSame(interior, decision.getChosen());
    assertEquals(ClosureDecision.Reason.INTERIOR, decision.getReason());
    assertTrue(decision.isConflict());
  }

  @Test
  public void testDeeperInteriorWins() {
    TrafficRecord shallow = candidate(7, "2021-01-15T00:00:00Z", 5);
    TrafficRecord deep = candidate(8, "2021-01-14T00:00:00Z", 6);
    ClosureDecision decision = ClosurePolicy.decide(DATE,
        Arrays.asList(shallow, deep));
    assertSame(deep, decision.getChosen());
  }

  @Test
  public void testEqualDistanceLatestCaptureWins() {
    TrafficRecord earlier = candidate(7, "2021-01-14T00:00:00Z", 3);
    TrafficRecord later = candidate(8, "2021-01-15T00:00:00Z", 3);
    assertSame(later, ClosurePolicy.decide(DATE,
        Arrays.asList(later, earlier)).getChosen());
    assertSame(later, ClosurePolicy.decide(DATE,
        Arrays.asList(earlier, later)).getChosen());
  }

  @Test
  public void testEdgeFallbackTakesMostRecent() {
    TrafficRecord leading = candidate(2, "2021-01-10T00:00:00Z", 0);
    TrafficRecord trailing = candidate(9, "2021-01-23T00:00:00Z", 0);
    ClosureDecision decision = ClosurePolicy.decide(DATE,
        Arrays.asList(trailing, leading));
    assertSame(trailing, decision.getChosen());
    assertEquals(ClosureDecision.Reason.EDGE_FALLBACK, decision.getReason());
  }

  @Test
  public void testIdenticalValuesKeepMostRecentCapture() {
    TrafficRecord interior = candidate(7, "2021-01-14T00:00:00Z", 4);
    TrafficRecord later = candidate(7, "2021-01-23T00:00:00Z", 3);
    ClosureDecision decision = ClosurePolicy.decide(DATE,
        Arrays.asList(interior, later));
    assertEquals(candidate(7, "2021-01-23T00:00:00Z", 4),
        decision.getChosen());
    assertEquals(ClosureDecision.Reason.IDENTICAL_VALUES,
        decision.getReason());
    assertFalse(decision.isConflict());
  }

  @Test
  public void testIdenticalValuesFromEdgeKeepEdgeDistance() {
    TrafficRecord interior = candidate(7, "2021-01-14T00:00:00Z", 6);
    TrafficRecord edge = candidate(7, "2021-01-18T06:00:00Z", 0);
    ClosureDecision decision = ClosurePolicy.decide(DATE,
        Arrays.asList(edge, interior));
    assertEquals(Instant.parse("2021-01-18T06:00:00Z"),
        decision.getChosen().getProvenance().getCapturedAt());
    assertEquals(6, decision.getChosen().getProvenance().getEdgeDistance());
  }

  @Test
  public void testIndependentOfCandidateOrder() {
    List<TrafficRecord> candidates = new ArrayList<>(Arrays.asList(
        candidate(1, "2021-01-11T00:00:00Z", 0),
        candidate(2, "2021-01-12T00:00:00Z", 1),
        candidate(3, "2021-01-13T00:00:00Z", 2),
        candidate(4, "2021-01-17T00:00:00Z", 2),
        candidate(5, "2021-01-24T00:00:00Z", 0)));
    TrafficRecord expected = candidates.get(3);
    for (int i = 0; i < 10; i++) {
      Collections.shuffle(candidates);
      assertEquals(expected, ClosurePolicy.decide(DATE, candidates)
          .getChosen());
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoCandidates() {
    ClosurePolicy.decide(DATE, Collections.<TrafficRecord>emptyList());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCandidateForOtherDate() {
    ClosurePolicy.decide(DATE.plusDays(1), Collections.singletonList(
        candidate(1, "2021-01-11T00:00:00Z", 0)));
  }
}

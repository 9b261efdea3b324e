/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.series;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.TreeMap;

public class MetricSeriesTest {

  private static final LocalDate day = LocalDate.parse("2021-01-10");

  @Test
  public void testStates() {
    assertEquals(SeriesState.NO_DATA_YET,
        MetricSeries.noDataYet().getState());
    assertEquals(SeriesState.EMPTY,
        MetricSeries.of(new TreeMap<LocalDate, DailyCount>()).getState());
    MetricSeries<DailyCount> series = MetricSeries.of(
        Collections.singletonMap(day, new DailyCount(day, 2L)));
    assertTrue(series.hasData());
    assertEquals(2L, series.rows().get(day).getCount());
    assertFalse(MetricSeries.empty().hasData());
  }

  @Test(expected = IllegalStateException.class)
  public void testNoRowsWithoutData() {
    MetricSeries.noDataYet().rows();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUniqueExceedsTotal() {
    TrafficDay.of(day, 3L, 4L, 0L, 0L);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroDailyCount() {
    new DailyCount(day, 0L);
  }

  @Test
  public void testSameCounts() {
    assertTrue(TrafficDay.of(day, 3L, 2L, 1L, 1L).sameCounts(
        TrafficDay.of(day, 3L, 2L, 1L, 1L)));
    assertFalse(TrafficDay.of(day, 3L, 2L, 1L, 1L).sameCounts(
        TrafficDay.of(day, 3L, 2L, 2L, 1L)));
    assertEquals(3L, TrafficDay.of(day, 3L, 2L, 1L, 1L)
        .get(TrafficMetric.VIEWS).getCount());
  }

  @Test
  public void testProvenanceOrder() {
    Provenance older = new Provenance(Instant.parse("2021-01-14T00:00:00Z"),
        5);
    Provenance newer = new Provenance(Instant.parse("2021-01-15T00:00:00Z"),
        5);
    Provenance edge = new Provenance(Instant.parse("2021-01-16T00:00:00Z"),
        0);
    assertTrue(newer.compareTo(older) > 0);
    assertTrue(older.compareTo(edge) > 0);
    assertTrue(edge.isAtEdge());
  }
}

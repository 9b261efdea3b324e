/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.events;

import org.torproject.metrics.repostats.fragment.Fragment;
import org.torproject.metrics.repostats.fragment.FragmentKind;
import org.torproject.metrics.repostats.fragment.FragmentRef;
import org.torproject.metrics.repostats.fragment.FragmentSelection;
import org.torproject.metrics.repostats.series.DailyCount;
import org.torproject.metrics.repostats.series.EventRecord;
import org.torproject.metrics.repostats.series.MetricSeries;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Resamples stargazer or fork events with irregular timestamps into per-day
 * counts of distinct actors.
 *
 * <p>Events of all fragments of a kind are united first, so that an actor
 * listed by several overlapping snapshots is counted once per day. Days
 * without any event are omitted rather than written as zero.</p>
 */
public class EventResampler {

  private static final Logger logger
      = LoggerFactory.getLogger(EventResampler.class);

  private final ZoneId zone;

  /** Create a resampler that assigns events to days in the given zone. */
  public EventResampler(ZoneId zone) {
    this.zone = zone;
  }

  /** Resample all events of the given selection. */
  public EventTable resample(FragmentSelection<EventRecord> selection) {
    FragmentKind kind = selection.getKind();
    List<FragmentRef> sources = new ArrayList<>();
    if (selection.isAbsent()) {
      logger.info("No {} fragments found.", kind);
      return new EventTable(kind, MetricSeries.noDataYet(), sources);
    }
    Map<LocalDate, Set<String>> actorsByDate = new TreeMap<>();
    for (Fragment<EventRecord> fragment : selection.getFragments()) {
      sources.add(fragment.getRef());
      for (EventRecord event : fragment.getRows()) {
        actorsByDate.computeIfAbsent(event.dateIn(this.zone),
            date -> new HashSet<>()).add(event.getActor());
      }
    }
    SortedMap<LocalDate, DailyCount> counts = new TreeMap<>();
    long total = 0L;
    for (Map.Entry<LocalDate, Set<String>> e : actorsByDate.entrySet()) {
      counts.put(e.getKey(), new DailyCount(e.getKey(), e.getValue().size()));
      total += e.getValue().size();
    }
    logger.info("Resampled {} {} fragment(s) into {} day(s) with {} distinct "
        + "event(s).", sources.size(), kind, counts.size(), total);
    return new EventTable(kind, MetricSeries.of(counts), sources);
  }
}

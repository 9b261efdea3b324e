/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.toplist;

import org.torproject.metrics.repostats.fragment.Fragment;
import org.torproject.metrics.repostats.fragment.FragmentSelection;
import org.torproject.metrics.repostats.series.SeriesState;
import org.torproject.metrics.repostats.series.TopListEntry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merges per-fragment top-N lists with overlapping windows into one ranked
 * list.
 *
 * <p>A subject is only attributed counts from fragments that listed it, as
 * absence from a fragment means it was not among that fragment's top N, not
 * that it had no views. For every subject, fragments are visited from newest
 * to oldest, and counts of fragments whose windows do not overlap any window
 * visited before are summed up. The aggregate is the larger of that sum and the
 * largest count of a single fragment.</p>
 */
public class TopListAggregator {

  private static final Logger logger
      = LoggerFactory.getLogger(TopListAggregator.class);

  private static final Comparator<AggregatedEntry> byRank
      = Comparator.comparingLong(AggregatedEntry::getCount).reversed()
      .thenComparing(AggregatedEntry::getSubject);

  private final Duration window;

  private final int limit;

  /**
   * Create an aggregator for fragments covering the given number of days and
   * keeping at most {@code limit} entries.
   */
  public TopListAggregator(int rollingWindowDays, int limit) {
    if (rollingWindowDays < 1 || limit < 1) {
      throw new IllegalArgumentException("Window and limit must be positive.");
    }
    this.window = Duration.ofDays(rollingWindowDays);
    this.limit = limit;
  }

  /** Aggregate all top lists of the given selection. */
  public TopList aggregate(FragmentSelection<TopListEntry> selection) {
    if (selection.isAbsent()) {
      logger.info("No {} fragments found.", selection.getKind());
      return new TopList(selection.getKind(), SeriesState.NO_DATA_YET,
          new ArrayList<>());
    }
    Map<String, List<Listing>> listings = new TreeMap<>();
    for (Fragment<TopListEntry> fragment : selection.getFragments()) {
      for (TopListEntry entry : fragment.getRows()) {
        listings.computeIfAbsent(entry.getSubject(), subject
            -> new ArrayList<>()).add(new Listing(fragment.getCapturedAt(),
            entry));
      }
    }
    List<AggregatedEntry> entries = new ArrayList<>();
    for (Map.Entry<String, List<Listing>> e : listings.entrySet()) {
      entries.add(this.aggregateSubject(e.getKey(), e.getValue()));
    }
    entries.sort(byRank);
    if (entries.size() > this.limit) {
      logger.debug("Truncating {} list from {} to {} entries.",
          selection.getKind(), entries.size(), this.limit);
      entries = entries.subList(0, this.limit);
    }
    logger.info("Aggregated {} {} fragment(s) into {} entries.",
        selection.getFragments().size(), selection.getKind(), entries.size());
    return new TopList(selection.getKind(), entries.isEmpty()
        ? SeriesState.EMPTY : SeriesState.HAS_DATA, entries);
  }

  private AggregatedEntry aggregateSubject(String subject,
      List<Listing> listed) {
    listed.sort(Comparator.comparing((Listing listing) -> listing.capturedAt)
        .reversed());
    long sum = 0L;
    long uniqueSum = 0L;
    long maxSingle = 0L;
    long maxSingleUnique = 0L;
    Instant oldestChosen = null;
    for (Listing listing : listed) {
      if (null == oldestChosen || !listing.capturedAt.isAfter(
          oldestChosen.minus(this.window))) {
        sum += listing.entry.getCount();
        uniqueSum += listing.entry.getUniqueCount();
        oldestChosen = listing.capturedAt;
      }
      maxSingle = Math.max(maxSingle, listing.entry.getCount());
      maxSingleUnique = Math.max(maxSingleUnique,
          listing.entry.getUniqueCount());
    }
    long count = Math.max(sum, maxSingle);
    long uniqueCount = Math.min(count, Math.max(uniqueSum, maxSingleUnique));
    return new AggregatedEntry(subject, count, uniqueCount, listed.size(),
        listed.get(listed.size() - 1).capturedAt, listed.get(0).capturedAt);
  }

  private static class Listing {

    private final Instant capturedAt;

    private final TopListEntry entry;

    Listing(Instant capturedAt, TopListEntry entry) {
      this.capturedAt = capturedAt;
      this.entry = entry;
    }
  }
}

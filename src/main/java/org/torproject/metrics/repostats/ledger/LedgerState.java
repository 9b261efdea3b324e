/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.ledger;

import org.torproject.metrics.repostats.events.EventTable;
import org.torproject.metrics.repostats.fragment.FragmentKind;
import org.torproject.metrics.repostats.fragment.FragmentRef;
import org.torproject.metrics.repostats.series.DailyCount;
import org.torproject.metrics.repostats.series.MetricSeries;
import org.torproject.metrics.repostats.series.SeriesState;
import org.torproject.metrics.repostats.series.TrafficDay;
import org.torproject.metrics.repostats.traffic.ClosureDecision;
import org.torproject.metrics.repostats.traffic.ClosurePolicy;
import org.torproject.metrics.repostats.traffic.TrafficRecord;
import org.torproject.metrics.repostats.traffic.TrafficTable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable, versioned content of the long-term aggregate.
 *
 * <p>Folding in returns a new state whose version is one higher than this
 * state's version if, and only if, the content changed. Folding in the same
 * table twice therefore yields an equal state.</p>
 */
public final class LedgerState {

  private final long version;

  private final SortedMap<LocalDate, TrafficRecord> traffic;

  private final Map<FragmentKind, SortedMap<LocalDate, DailyCount>> events;

  private final Set<FragmentKind> observed;

  private final SortedSet<FragmentRef> folded;

  LedgerState(long version, SortedMap<LocalDate, TrafficRecord> traffic,
      Map<FragmentKind, SortedMap<LocalDate, DailyCount>> events,
      Set<FragmentKind> observed, SortedSet<FragmentRef> folded) {
    this.version = version;
    this.traffic = Collections.unmodifiableSortedMap(new TreeMap<>(traffic));
    Map<FragmentKind, SortedMap<LocalDate, DailyCount>> eventsCopy
        = new EnumMap<>(FragmentKind.class);
    for (FragmentKind kind : eventKinds()) {
      eventsCopy.put(kind, Collections.unmodifiableSortedMap(new TreeMap<>(
          events.getOrDefault(kind, Collections.emptySortedMap()))));
    }
    this.events = Collections.unmodifiableMap(eventsCopy);
    this.observed = observed.isEmpty()
        ? Collections.unmodifiableSet(EnumSet.noneOf(FragmentKind.class))
        : Collections.unmodifiableSet(EnumSet.copyOf(observed));
    this.folded = Collections.unmodifiableSortedSet(new TreeSet<>(folded));
  }

  /** Return the state of a ledger that was never written. */
  public static LedgerState empty() {
    return new LedgerState(0L, new TreeMap<>(),
        new EnumMap<>(FragmentKind.class), EnumSet.noneOf(FragmentKind.class),
        new TreeSet<>());
  }

  /** Return the kinds whose per-day counts this ledger keeps. */
  public static Collection<FragmentKind> eventKinds() {
    return Arrays.asList(FragmentKind.STARGAZERS, FragmentKind.FORKS);
  }

  public long getVersion() {
    return this.version;
  }

  /** Return the traffic record per date. */
  public SortedMap<LocalDate, TrafficRecord> getTraffic() {
    return this.traffic;
  }

  /** Return the event counts per date of the given kind. */
  public SortedMap<LocalDate, DailyCount> getEvents(FragmentKind kind) {
    if (!this.events.containsKey(kind)) {
      throw new IllegalArgumentException("Ledger keeps no " + kind
          + " counts.");
    }
    return this.events.get(kind);
  }

  /** Whether data of the given kind was ever observed, even if empty. */
  public boolean isObserved(FragmentKind kind) {
    return this.observed.contains(kind);
  }

  /** Return the fragment references folded into this state so far. */
  public SortedSet<FragmentRef> getFolded() {
    return this.folded;
  }

  /** Return the views/clones series with its sentinel state. */
  public MetricSeries<TrafficDay> trafficSeries() {
    if (!this.isObserved(FragmentKind.VIEWS_CLONES)) {
      return MetricSeries.noDataYet();
    }
    SortedMap<LocalDate, TrafficDay> rows = new TreeMap<>();
    for (TrafficRecord rec : this.traffic.values()) {
      rows.put(rec.getDate(), rec.getDay());
    }
    return MetricSeries.of(rows);
  }

  /** Return the series of event counts of the given kind. */
  public MetricSeries<DailyCount> eventSeries(FragmentKind kind) {
    SortedMap<LocalDate, DailyCount> counts = this.getEvents(kind);
    return this.isObserved(kind) ? MetricSeries.of(counts)
        : MetricSeries.noDataYet();
  }

  /**
   * Fold a merged views/clones table into this state.
   *
   * <p>Dates are united. For a date already present, the recorded value and
   * the new one are resolved by the same closure policy that resolves
   * overlapping fragments, so a recorded value is only replaced by a strictly
   * more authoritative one.</p>
   */
  public LedgerState foldIn(TrafficTable table) {
    SortedMap<LocalDate, TrafficRecord> merged = new TreeMap<>(this.traffic);
    for (TrafficRecord rec : table.getRecords().values()) {
      TrafficRecord existing = merged.get(rec.getDate());
      if (null == existing) {
        merged.put(rec.getDate(), rec);
      } else {
        ClosureDecision decision = ClosurePolicy.decide(rec.getDate(),
            Arrays.asList(existing, rec));
        merged.put(rec.getDate(), decision.getChosen());
      }
    }
    Set<FragmentKind> observedAfter = this.observedWith(
        FragmentKind.VIEWS_CLONES, table.getState());
    return this.withContent(merged, this.events, observedAfter,
        this.foldedWith(table.getSources()));
  }

  /**
   * Fold a resampled event table into this state.
   *
   * <p>Dates are united. For a date already present, the new count only
   * replaces the recorded one if it is at least as large, because a later
   * snapshot covering the same day cannot have fewer distinct actors.</p>
   */
  public LedgerState foldIn(EventTable table) {
    FragmentKind kind = table.getKind();
    SortedMap<LocalDate, DailyCount> merged
        = new TreeMap<>(this.getEvents(kind));
    if (table.getSeries().hasData()) {
      for (DailyCount count : table.getSeries().rows().values()) {
        DailyCount existing = merged.get(count.getDate());
        if (null == existing || count.getCount() >= existing.getCount()) {
          merged.put(count.getDate(), count);
        }
      }
    }
    Map<FragmentKind, SortedMap<LocalDate, DailyCount>> events
        = new EnumMap<>(this.events);
    events.put(kind, merged);
    return this.withContent(this.traffic, events,
        this.observedWith(kind, table.getSeries().getState()),
        this.foldedWith(table.getSources()));
  }

  /** Drop references of fragments that no longer exist. */
  public LedgerState forget(Collection<FragmentRef> refs) {
    SortedSet<FragmentRef> remaining = new TreeSet<>(this.folded);
    remaining.removeAll(refs);
    return this.withContent(this.traffic, this.events, this.observed,
        remaining);
  }

  private Set<FragmentKind> observedWith(FragmentKind kind,
      SeriesState state) {
    Set<FragmentKind> result = EnumSet.noneOf(FragmentKind.class);
    result.addAll(this.observed);
    if (SeriesState.NO_DATA_YET != state) {
      result.add(kind);
    }
    return result;
  }

  /* References are keyed by file name; a re-fetched file under the same name
   * replaces the older reference. */
  private SortedSet<FragmentRef> foldedWith(Collection<FragmentRef> refs) {
    SortedSet<FragmentRef> result = new TreeSet<>(this.folded);
    for (FragmentRef ref : refs) {
      result.remove(ref);
      result.add(ref);
    }
    return result;
  }

  private LedgerState withContent(SortedMap<LocalDate, TrafficRecord> traffic,
      Map<FragmentKind, SortedMap<LocalDate, DailyCount>> events,
      Set<FragmentKind> observed, SortedSet<FragmentRef> folded) {
    LedgerState candidate = new LedgerState(this.version, traffic, events,
        observed, folded);
    if (this.equals(candidate)) {
      return this;
    }
    return new LedgerState(this.version + 1L, traffic, events, observed,
        folded);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof LedgerState)) {
      return false;
    }
    LedgerState that = (LedgerState) other;
    return this.version == that.version && this.traffic.equals(that.traffic)
        && this.events.equals(that.events)
        && this.observed.equals(that.observed)
        && new ArrayList<>(this.folded).equals(new ArrayList<>(that.folded));
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.version, this.traffic, this.events,
        this.observed, this.folded);
  }

  @Override
  public String toString() {
    return "LedgerState v" + this.version + " with " + this.traffic.size()
        + " traffic day(s), " + this.events + " and " + this.folded.size()
        + " folded fragment(s)";
  }
}

/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.series;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Per-day series of one metric tagged with its {@link SeriesState}.
 *
 * <p>Rows are only accessible in state {@link SeriesState#HAS_DATA}, so that
 * "never observed" and "observed, but empty" cannot be mistaken for a series
 * of zeros.</p>
 *
 * @param <R> Row type.
 */
public final class MetricSeries<R> {

  private static final MetricSeries<?> NO_DATA_YET
      = new MetricSeries<>(SeriesState.NO_DATA_YET,
      Collections.<LocalDate, Object>emptySortedMap());

  private static final MetricSeries<?> EMPTY
      = new MetricSeries<>(SeriesState.EMPTY,
      Collections.<LocalDate, Object>emptySortedMap());

  private final SeriesState state;

  private final SortedMap<LocalDate, R> rows;

  private MetricSeries(SeriesState state, SortedMap<LocalDate, R> rows) {
    this.state = state;
    this.rows = rows;
  }

  /** Series of a metric for which nothing was ever observed. */
  @SuppressWarnings("unchecked")
  public static <R> MetricSeries<R> noDataYet() {
    return (MetricSeries<R>) NO_DATA_YET;
  }

  /** Series of a metric that was observed without a single row. */
  @SuppressWarnings("unchecked")
  public static <R> MetricSeries<R> empty() {
    return (MetricSeries<R>) EMPTY;
  }

  /**
   * Series with the given rows, or an {@link #empty()} series if there are
   * none.
   */
  public static <R> MetricSeries<R> of(Map<LocalDate, R> rows) {
    if (rows.isEmpty()) {
      return empty();
    }
    return new MetricSeries<>(SeriesState.HAS_DATA,
        Collections.unmodifiableSortedMap(new TreeMap<>(rows)));
  }

  public SeriesState getState() {
    return this.state;
  }

  public boolean hasData() {
    return SeriesState.HAS_DATA == this.state;
  }

  /**
   * Return rows by date.
   *
   * @throws IllegalStateException if this series has no data.
   */
  public SortedMap<LocalDate, R> rows() {
    if (!this.hasData()) {
      throw new IllegalStateException("Series is in state " + this.state
          + " and has no rows.");
    }
    return this.rows;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof MetricSeries)) {
      return false;
    }
    MetricSeries<?> that = (MetricSeries<?>) other;
    return this.state == that.state && this.rows.equals(that.rows);
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.state, this.rows);
  }

  @Override
  public String toString() {
    return this.hasData() ? this.state + this.rows.toString()
        : this.state.toString();
  }
}

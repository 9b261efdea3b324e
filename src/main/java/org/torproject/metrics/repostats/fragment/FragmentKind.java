/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.fragment;

import org.torproject.metrics.repostats.series.EventRecord;
import org.torproject.metrics.repostats.series.TopListEntry;
import org.torproject.metrics.repostats.series.TrafficDay;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Kinds of fragments written by the fetch step, with the file name token
 * identifying them, the columns they must contain, and their row type.
 */
public enum FragmentKind {

  VIEWS_CLONES("views_clones_series_fragment", TrafficDay.class,
      "time_iso8601", "clones_total", "clones_unique", "views_total",
      "views_unique"),
  STARGAZERS("stargazers_snapshot", EventRecord.class,
      "time_iso8601", "actor"),
  FORKS("forks_snapshot", EventRecord.class,
      "time_iso8601", "actor"),
  REFERRERS("top_referrers_snapshot", TopListEntry.class,
      "referrer", "views_total", "views_unique"),
  PATHS("top_paths_snapshot", TopListEntry.class,
      "url_path", "views_total", "views_unique");

  private final String token;

  private final Class<?> rowType;

  private final List<String> columns;

  FragmentKind(String token, Class<?> rowType, String... columns) {
    this.token = token;
    this.rowType = rowType;
    this.columns = Collections.unmodifiableList(Arrays.asList(columns));
  }

  /** File name token, e.g. {@code views_clones_series_fragment}. */
  public String token() {
    return this.token;
  }

  public Class<?> rowType() {
    return this.rowType;
  }

  /** Columns every fragment of this kind must contain. */
  public List<String> columns() {
    return this.columns;
  }

  /** First column, which is the key column of top-list kinds. */
  public String keyColumn() {
    return this.columns.get(0);
  }

  /** Return the kind whose token the given base name ends with, or null. */
  public static FragmentKind findByBaseName(String baseName) {
    for (FragmentKind kind : values()) {
      if (baseName.endsWith(kind.token)) {
        return kind;
      }
    }
    return null;
  }
}

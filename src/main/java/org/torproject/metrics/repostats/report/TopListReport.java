/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.report;

import org.torproject.metrics.repostats.series.SeriesState;
import org.torproject.metrics.repostats.toplist.AggregatedEntry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Presentation-ready top list of referrers or paths. */
@JsonPropertyOrder({ "list", "state", "message", "entries" })
public final class TopListReport {

  @JsonProperty("list")
  private final String list;

  @JsonProperty("state")
  private final SeriesState state;

  @JsonProperty("message")
  private final String message;

  @JsonProperty("entries")
  private final List<AggregatedEntry> entries;

  TopListReport(String list, SeriesState state, String message,
      List<AggregatedEntry> entries) {
    this.list = list;
    this.state = state;
    this.message = message;
    this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
  }

  public String getList() {
    return this.list;
  }

  public SeriesState getState() {
    return this.state;
  }

  public String getMessage() {
    return this.message;
  }

  public List<AggregatedEntry> getEntries() {
    return this.entries;
  }
}

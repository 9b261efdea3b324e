/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.toplist;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Objects;

/** One subject of an aggregated top list. */
@JsonPropertyOrder({"subject", "count", "unique_count", "listed_in",
    "first_seen", "last_seen"})
public final class AggregatedEntry {

  @JsonProperty("subject")
  private final String subject;

  @JsonProperty("count")
  private final long count;

  @JsonProperty("unique_count")
  private final long uniqueCount;

  @JsonProperty("listed_in")
  private final int listedIn;

  @JsonProperty("first_seen")
  private final String firstSeen;

  @JsonProperty("last_seen")
  private final String lastSeen;

  AggregatedEntry(String subject, long count, long uniqueCount, int listedIn,
      Instant firstSeen, Instant lastSeen) {
    this.subject = subject;
    this.count = count;
    this.uniqueCount = uniqueCount;
    this.listedIn = listedIn;
    this.firstSeen = firstSeen.toString();
    this.lastSeen = lastSeen.toString();
  }

  public String getSubject() {
    return this.subject;
  }

  public long getCount() {
    return this.count;
  }

  public long getUniqueCount() {
    return this.uniqueCount;
  }

  /** Return the number of fragments that listed this subject. */
  public int getListedIn() {
    return this.listedIn;
  }

  public Instant getFirstSeen() {
    return Instant.parse(this.firstSeen);
  }

  public Instant getLastSeen() {
    return Instant.parse(this.lastSeen);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof AggregatedEntry)) {
      return false;
    }
    AggregatedEntry that = (AggregatedEntry) other;
    return this.count == that.count && this.uniqueCount == that.uniqueCount
        && this.listedIn == that.listedIn
        && this.subject.equals(that.subject)
        && this.firstSeen.equals(that.firstSeen)
        && this.lastSeen.equals(that.lastSeen);
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.subject, this.count, this.uniqueCount,
        this.listedIn, this.firstSeen, this.lastSeen);
  }

  @Override
  public String toString() {
    return this.subject + "=" + this.count + "/" + this.uniqueCount;
  }
}

/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.series;

import java.util.Objects;

/**
 * A referrer domain or a path together with its view counts, as listed in a
 * top-N snapshot.
 */
public final class TopListEntry {

  private final String subject;

  private final long count;

  private final long uniqueCount;

  /** Create an entry with non-negative counts. */
  public TopListEntry(String subject, long count, long uniqueCount) {
    if (null == subject || subject.isEmpty()) {
      throw new IllegalArgumentException("Subject must not be empty.");
    }
    if (count < 0L || uniqueCount < 0L) {
      throw new IllegalArgumentException("Negative count for " + subject
          + ".");
    }
    this.subject = subject;
    this.count = count;
    this.uniqueCount = uniqueCount;
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

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof TopListEntry)) {
      return false;
    }
    TopListEntry that = (TopListEntry) other;
    return this.count == that.count && this.uniqueCount == that.uniqueCount
        && this.subject.equals(that.subject);
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.subject, this.count, this.uniqueCount);
  }

  @Override
  public String toString() {
    return this.subject + ":" + this.count + "/" + this.uniqueCount;
  }
}

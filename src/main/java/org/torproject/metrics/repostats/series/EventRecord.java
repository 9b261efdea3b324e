/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.series;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;

/** A stargazer or fork event: who did it and when. */
public final class EventRecord {

  private final Instant timestamp;

  private final String actor;

  /** Create an event, requiring a non-empty actor identity. */
  public EventRecord(Instant timestamp, String actor) {
    if (null == timestamp) {
      throw new IllegalArgumentException("Timestamp must not be null.");
    }
    if (null == actor || actor.trim().isEmpty()) {
      throw new IllegalArgumentException("Actor must not be empty.");
    }
    this.timestamp = timestamp;
    this.actor = actor.trim();
  }

  public Instant getTimestamp() {
    return this.timestamp;
  }

  public String getActor() {
    return this.actor;
  }

  /** Calendar date of this event in the given time zone. */
  public LocalDate dateIn(ZoneId zone) {
    return this.timestamp.atZone(zone).toLocalDate();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof EventRecord)) {
      return false;
    }
    EventRecord that = (EventRecord) other;
    return this.timestamp.equals(that.timestamp)
        && this.actor.equals(that.actor);
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.timestamp, this.actor);
  }

  @Override
  public String toString() {
    return this.actor + "@" + this.timestamp;
  }
}

/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.series;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Where a traffic value was taken from: the capture time of its fragment and
 * the number of days between the value's date and the nearer edge of that
 * fragment's window.
 *
 * <p>Provenances are ordered by authority: a larger edge distance is more
 * authoritative, and among equal edge distances a later capture is more
 * authoritative.</p>
 */
public final class Provenance implements Comparable<Provenance> {

  private static final Comparator<Provenance> BY_AUTHORITY = Comparator
      .comparingInt(Provenance::getEdgeDistance)
      .thenComparing(Provenance::getCapturedAt);

  private final Instant capturedAt;

  private final int edgeDistance;

  /** Create a provenance with a non-negative edge distance. */
  public Provenance(Instant capturedAt, int edgeDistance) {
    if (null == capturedAt) {
      throw new IllegalArgumentException("Capture time must not be null.");
    }
    if (edgeDistance < 0) {
      throw new IllegalArgumentException("Negative edge distance.");
    }
    this.capturedAt = capturedAt;
    this.edgeDistance = edgeDistance;
  }

  public Instant getCapturedAt() {
    return this.capturedAt;
  }

  public int getEdgeDistance() {
    return this.edgeDistance;
  }

  /** Whether the value sat at the leading or trailing edge of its window. */
  public boolean isAtEdge() {
    return 0 == this.edgeDistance;
  }

  @Override
  public int compareTo(Provenance other) {
    return BY_AUTHORITY.compare(this, other);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Provenance)) {
      return false;
    }
    Provenance that = (Provenance) other;
    return this.edgeDistance == that.edgeDistance
        && this.capturedAt.equals(that.capturedAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.capturedAt, this.edgeDistance);
  }

  @Override
  public String toString() {
    return this.capturedAt + "/" + this.edgeDistance;
  }
}

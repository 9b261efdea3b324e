/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.fragment;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * One parsed capture of a metric, read-only to the aggregator.
 *
 * @param <R> Row type, determined by the fragment's kind.
 */
public final class Fragment<R> {

  private final FragmentMetadata metadata;

  private final FragmentRef ref;

  private final List<R> rows;

  Fragment(FragmentMetadata metadata, String sha256, List<R> rows) {
    this.metadata = metadata;
    this.ref = new FragmentRef(metadata.path.getFileName().toString(),
        metadata.kind, Timestamps.fileNameFormatter.format(metadata.capturedAt),
        sha256);
    this.rows = Collections.unmodifiableList(rows);
  }

  public FragmentKind getKind() {
    return this.metadata.kind;
  }

  public Instant getCapturedAt() {
    return this.metadata.capturedAt;
  }

  public Path getPath() {
    return this.metadata.path;
  }

  public FragmentRef getRef() {
    return this.ref;
  }

  public List<R> getRows() {
    return this.rows;
  }

  public boolean isEmpty() {
    return this.rows.isEmpty();
  }

  @Override
  public String toString() {
    return this.metadata + " with " + this.rows.size() + " row(s)";
  }
}

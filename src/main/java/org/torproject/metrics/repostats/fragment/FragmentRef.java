/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.fragment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Reference to a fragment file by file name and content digest, as recorded
 * in {@code ledger-state.json} once the fragment has been folded in.
 */
@JsonPropertyOrder({ "file", "kind", "captured_at", "sha256" })
public final class FragmentRef implements Comparable<FragmentRef> {

  /**
   * File name of the fragment, relative to the fragment directory.
   */
  @JsonProperty("file")
  private final String file;

  /**
   * Kind of the fragment.
   */
  @JsonProperty("kind")
  private final FragmentKind kind;

  /**
   * Capture time using pattern {@code "YYYY-MM-DD_HHMMSS"} in the UTC
   * timezone.
   */
  @JsonProperty("captured_at")
  private final String capturedAt;

  /**
   * Base64-encoded SHA-256 digest of the raw file contents.
   */
  @JsonProperty("sha256")
  private final String sha256;

  /** Create a reference with the given values. */
  @JsonCreator
  public FragmentRef(@JsonProperty("file") String file,
      @JsonProperty("kind") FragmentKind kind,
      @JsonProperty("captured_at") String capturedAt,
      @JsonProperty("sha256") String sha256) {
    this.file = file;
    this.kind = kind;
    this.capturedAt = capturedAt;
    this.sha256 = sha256;
  }

  public String getFile() {
    return this.file;
  }

  public FragmentKind getKind() {
    return this.kind;
  }

  public String getCapturedAt() {
    return this.capturedAt;
  }

  public String getSha256() {
    return this.sha256;
  }

  @Override
  public int compareTo(FragmentRef other) {
    return this.file.compareTo(other.file);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof FragmentRef)) {
      return false;
    }
    FragmentRef that = (FragmentRef) other;
    return this.file.equals(that.file) && this.kind == that.kind
        && Objects.equals(this.capturedAt, that.capturedAt)
        && Objects.equals(this.sha256, that.sha256);
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.file, this.kind, this.capturedAt, this.sha256);
  }

  @Override
  public String toString() {
    return this.file;
  }
}

/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.fragment;

import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.digest.DigestUtils;

import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;

/** Builds fragments from already parsed rows without writing any file. */
public final class FragmentBuilder {

  private FragmentBuilder() {
  }

  /**
   * Build a fragment of the given kind, named after its capture time, whose
   * digest is computed over its name and rows.
   */
  public static <R> Fragment<R> build(FragmentKind kind, Instant capturedAt,
      List<R> rows) {
    String name = Timestamps.fileNameFormatter.format(capturedAt) + "_"
        + kind.token() + ".csv";
    FragmentMetadata metadata = FragmentMetadata.create(Paths.get(name))
        .orElseThrow(() -> new IllegalArgumentException(name));
    return new Fragment<>(metadata, Base64.encodeBase64String(
        DigestUtils.sha256(name + rows)), rows);
  }
}

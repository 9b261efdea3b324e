/* Copyright 2017--2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.fragment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Metadata of a fragment file derived from its name and, if the name does not
 * contain a capture time, from an embedded {@code # captured_at:} line.
 */
public class FragmentMetadata {

  private static final Logger log
      = LoggerFactory.getLogger(FragmentMetadata.class);

  /** The mandatory fragment file name pattern. */
  public static final Pattern filenamePattern
      = Pattern.compile("^(?:(\\d{4}-\\d{2}-\\d{2}_\\d{6})_)?(\\S+)\\.csv"
      + "(?:\\.([a-zA-Z0-9]+))?$");

  /** Embedded capture time, expected in the first line of the file. */
  public static final Pattern capturedAtPattern
      = Pattern.compile("^#\\s*captured_at:\\s*(\\S+)\\s*$");

  /** The path of the fragment file. */
  public final Path path;

  /** The kind of data contained. */
  public final FragmentKind kind;

  /** When the fetch step captured the fragment. */
  public final Instant capturedAt;

  /** The fragment's compression type. */
  public final FileType fileType;

  private FragmentMetadata(Path path, FragmentKind kind, Instant capturedAt,
      FileType fileType) {
    this.path = path;
    this.kind = kind;
    this.capturedAt = capturedAt;
    this.fileType = fileType;
  }

  /**
   * Only way to create a FragmentMetadata object from a given fragment path.
   */
  public static Optional<FragmentMetadata> create(Path fragmentPath) {
    FragmentMetadata metadata = null;
    try {
      Path file = fragmentPath.getFileName();
      if (null != file) {
        Matcher mat = filenamePattern.matcher(file.toString());
        if (mat.find()) {
          FragmentKind kind = FragmentKind.findByBaseName(mat.group(2));
          FileType fileType = FileType.findType(mat.group(3));
          if (null == kind) {
            log.debug("Non-matching file encountered: '{}'.", fragmentPath);
          } else if (null != mat.group(1)) {
            metadata = new FragmentMetadata(fragmentPath, kind,
                Timestamps.parseFileNamePrefix(mat.group(1)), fileType);
          } else {
            Instant embedded = readEmbeddedCaptureTime(fragmentPath, fileType);
            if (null == embedded) {
              log.warn("Fragment '{}' has neither a capture time in its name "
                  + "nor an embedded one. Skipping.", fragmentPath);
            } else {
              metadata = new FragmentMetadata(fragmentPath, kind, embedded,
                  fileType);
            }
          }
        }
      }
    } catch (Throwable ex) {
      metadata = null;
      log.warn("Problem parsing path '{}'.", fragmentPath, ex);
    }
    return Optional.ofNullable(metadata);
  }

  private static Instant readEmbeddedCaptureTime(Path fragmentPath,
      FileType fileType) throws IOException {
    try (BufferedReader br = new BufferedReader(new InputStreamReader(
        fileType.decompress(Files.newInputStream(fragmentPath)),
        StandardCharsets.UTF_8))) {
      String firstLine = br.readLine();
      if (null == firstLine) {
        return null;
      }
      Matcher mat = capturedAtPattern.matcher(firstLine);
      return mat.matches() ? Timestamps.parseInstant(mat.group(1)) : null;
    }
  }

  @Override
  public String toString() {
    return this.path.getFileName() + " (" + this.kind + ", "
        + Timestamps.fileNameFormatter.format(this.capturedAt) + ")";
  }
}

/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.fragment;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Parser and formatter for the timestamp forms found in fragment and
 * aggregate files.
 */
public final class Timestamps {

  private static final Pattern datePattern
      = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

  private static final Pattern offsetSuffixPattern
      = Pattern.compile(".*(Z|[+-]\\d{2}:\\d{2})$");

  /** Capture time prefix of fragment file names. */
  public static final DateTimeFormatter fileNameFormatter = DateTimeFormatter
      .ofPattern("uuuu-MM-dd_HHmmss").withZone(ZoneOffset.UTC);

  private Timestamps() {
  }

  /**
   * Parse a date, an ISO-8601 offset date-time, a local date-time (taken as
   * UTC), or the pandas form {@code 2021-01-01 00:00:00+00:00}.
   *
   * @throws DateTimeParseException if none of the forms match.
   */
  public static Instant parseInstant(String value) {
    String trimmed = value.trim();
    if (datePattern.matcher(trimmed).matches()) {
      return LocalDate.parse(trimmed).atStartOfDay(ZoneOffset.UTC).toInstant();
    }
    String isoForm = trimmed.replace(' ', 'T');
    if (offsetSuffixPattern.matcher(isoForm).matches()) {
      return OffsetDateTime.parse(isoForm).toInstant();
    }
    return LocalDateTime.parse(isoForm).toInstant(ZoneOffset.UTC);
  }

  /** Parse the capture time prefix of a fragment file name. */
  public static Instant parseFileNamePrefix(String prefix) {
    return fileNameFormatter.parse(prefix, Instant::from);
  }
}

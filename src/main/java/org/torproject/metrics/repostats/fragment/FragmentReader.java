/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.fragment;

import org.torproject.metrics.repostats.series.EventRecord;
import org.torproject.metrics.repostats.series.TopListEntry;
import org.torproject.metrics.repostats.series.TrafficDay;
import org.torproject.metrics.repostats.series.TrafficMetric;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Reads a fragment file, checks its columns, and turns its rows into typed
 * records.
 *
 * <p>A fragment that cannot be read or lacks required columns is rejected as
 * a whole. Single records that are inconsistent with the fragment, like a day
 * outside the fragment's rolling window, are dropped with a warning while the
 * remaining records are kept.</p>
 */
public class FragmentReader {

  private static final Logger logger
      = LoggerFactory.getLogger(FragmentReader.class);

  private static final CsvMapper csvMapper = new CsvMapper()
      .enable(CsvParser.Feature.TRIM_SPACES);

  private static final CsvSchema headerSchema = CsvSchema.emptySchema()
      .withHeader().withComments();

  private final int rollingWindowDays;

  /**
   * Create a reader that accepts traffic days up to the given number of days
   * before a fragment's capture date.
   */
  public FragmentReader(int rollingWindowDays) {
    if (rollingWindowDays < 1) {
      throw new IllegalArgumentException("Rolling window must span at least "
          + "one day.");
    }
    this.rollingWindowDays = rollingWindowDays;
  }

  /**
   * Read and parse the fragment described by the given metadata.
   *
   * @throws FragmentParseException if the file cannot be read or parsed.
   */
  public Fragment<?> read(FragmentMetadata metadata)
      throws FragmentParseException {
    byte[] rawBytes;
    try {
      rawBytes = Files.readAllBytes(metadata.path);
    } catch (IOException e) {
      throw new FragmentParseException("Cannot read " + metadata.path + ".",
          e);
    }
    String sha256 = Base64.encodeBase64String(DigestUtils.sha256(rawBytes));
    List<Map<String, String>> records = this.readRecords(metadata, rawBytes);
    switch (metadata.kind) {
      case VIEWS_CLONES:
        return new Fragment<>(metadata, sha256,
            this.toTrafficDays(metadata, records));
      case STARGAZERS:
      case FORKS:
        return new Fragment<>(metadata, sha256,
            this.toEvents(metadata, records));
      case REFERRERS:
      case PATHS:
        return new Fragment<>(metadata, sha256,
            this.toTopListEntries(metadata, records));
      default:
        throw new FragmentParseException("Unsupported fragment kind "
            + metadata.kind + ".");
    }
  }

  private List<Map<String, String>> readRecords(FragmentMetadata metadata,
      byte[] rawBytes) throws FragmentParseException {
    try (InputStream is = metadata.fileType.decompress(
        new ByteArrayInputStream(rawBytes));
        MappingIterator<Map<String, String>> iterator = csvMapper
            .readerFor(Map.class).with(headerSchema).readValues(is)) {
      List<Map<String, String>> records = iterator.readAll();
      Set<String> columns = new HashSet<>();
      if (iterator.getParserSchema() instanceof CsvSchema) {
        for (CsvSchema.Column column
            : (CsvSchema) iterator.getParserSchema()) {
          columns.add(column.getName());
        }
      }
      List<String> missing = new ArrayList<>();
      for (String required : metadata.kind.columns()) {
        if (!columns.contains(required)) {
          missing.add(required);
        }
      }
      if (!missing.isEmpty()) {
        throw new FragmentParseException("Fragment " + metadata.path
            + " lacks column(s) " + missing + ".");
      }
      return records;
    } catch (IOException | RuntimeException e) {
      throw new FragmentParseException("Cannot parse " + metadata.path + ": "
          + e.getMessage(), e);
    }
  }

  private List<TrafficDay> toTrafficDays(FragmentMetadata metadata,
      List<Map<String, String>> records) throws FragmentParseException {
    LocalDate captureDate = metadata.capturedAt.atOffset(ZoneOffset.UTC)
        .toLocalDate();
    LocalDate oldestAccepted = captureDate.minusDays(this.rollingWindowDays);
    SortedMap<LocalDate, TrafficDay> days = new TreeMap<>();
    for (Map<String, String> rec : records) {
      LocalDate date = this.parseDate(metadata, rec.get("time_iso8601"));
      if (date.isAfter(captureDate) || date.isBefore(oldestAccepted)) {
        logger.warn("Ignoring {} in {}, which lies outside the window from {} "
            + "to {}.", date, metadata, oldestAccepted, captureDate);
        continue;
      }
      if (days.containsKey(date)) {
        logger.warn("Ignoring repeated day {} in {}.", date, metadata);
        continue;
      }
      Long viewsTotal = this.parseCount(metadata,
          rec.get(TrafficMetric.VIEWS.totalColumn()));
      Long viewsUnique = this.parseCount(metadata,
          rec.get(TrafficMetric.VIEWS.uniqueColumn()));
      Long clonesTotal = this.parseCount(metadata,
          rec.get(TrafficMetric.CLONES.totalColumn()));
      Long clonesUnique = this.parseCount(metadata,
          rec.get(TrafficMetric.CLONES.uniqueColumn()));
      if (null == viewsTotal && null == viewsUnique && null == clonesTotal
          && null == clonesUnique) {
        logger.warn("Ignoring day {} without any count in {}.", date,
            metadata);
        continue;
      }
      /* A day may carry only views or only clones. */
      try {
        days.put(date, TrafficDay.of(date, orZero(viewsTotal),
            orZero(viewsUnique), orZero(clonesTotal), orZero(clonesUnique)));
      } catch (IllegalArgumentException e) {
        logger.warn("Ignoring inconsistent day in {}: {}", metadata,
            e.getMessage());
      }
    }
    if (!days.isEmpty()) {
      long span = days.lastKey().toEpochDay() - days.firstKey().toEpochDay();
      if (span + 1 != days.size()) {
        logger.warn("Days in {} are not contiguous: {} day(s) between {} and "
            + "{}.", metadata, days.size(), days.firstKey(), days.lastKey());
      }
    }
    return new ArrayList<>(days.values());
  }

  private List<EventRecord> toEvents(FragmentMetadata metadata,
      List<Map<String, String>> records) throws FragmentParseException {
    List<EventRecord> events = new ArrayList<>();
    for (Map<String, String> rec : records) {
      Instant timestamp = this.parseTimestamp(metadata,
          rec.get("time_iso8601"));
      String actor = rec.get("actor");
      if (null == actor || actor.isEmpty()) {
        logger.warn("Ignoring event at {} without actor in {}.", timestamp,
            metadata);
        continue;
      }
      if (timestamp.isAfter(metadata.capturedAt)) {
        logger.warn("Ignoring event by {} at {} in {}, which is later than the "
            + "capture time.", actor, timestamp, metadata);
        continue;
      }
      events.add(new EventRecord(timestamp, actor));
    }
    return events;
  }

  private List<TopListEntry> toTopListEntries(FragmentMetadata metadata,
      List<Map<String, String>> records) throws FragmentParseException {
    String keyColumn = metadata.kind.keyColumn();
    Set<String> seen = new HashSet<>();
    List<TopListEntry> entries = new ArrayList<>();
    for (Map<String, String> rec : records) {
      String subject = rec.get(keyColumn);
      if (null == subject || subject.isEmpty()) {
        logger.warn("Ignoring entry without {} in {}.", keyColumn, metadata);
        continue;
      }
      if (!seen.add(subject)) {
        logger.warn("Ignoring repeated entry {} in {}.", subject, metadata);
        continue;
      }
      Long total = this.parseCount(metadata, rec.get("views_total"));
      Long unique = this.parseCount(metadata, rec.get("views_unique"));
      if (null == total || null == unique) {
        logger.warn("Ignoring incomplete entry {} in {}.", subject, metadata);
        continue;
      }
      entries.add(new TopListEntry(subject, total, unique));
    }
    return entries;
  }

  private static long orZero(Long count) {
    return null == count ? 0L : count;
  }

  private LocalDate parseDate(FragmentMetadata metadata, String value)
      throws FragmentParseException {
    return this.parseTimestamp(metadata, value).atOffset(ZoneOffset.UTC)
        .toLocalDate();
  }

  private Instant parseTimestamp(FragmentMetadata metadata, String value)
      throws FragmentParseException {
    if (null == value || value.isEmpty()) {
      throw new FragmentParseException("Missing timestamp in " + metadata
          + ".");
    }
    try {
      return Timestamps.parseInstant(value);
    } catch (DateTimeException e) {
      throw new FragmentParseException("Unparseable timestamp '" + value
          + "' in " + metadata + ".", e);
    }
  }

  /**
   * Parse a non-negative count, accepting integral floating point values as
   * written by pandas for columns containing missing values, and return
   * {@code null} for missing values.
   */
  private Long parseCount(FragmentMetadata metadata, String value)
      throws FragmentParseException {
    if (null == value || value.isEmpty() || "nan".equalsIgnoreCase(value)) {
      return null;
    }
    try {
      long count;
      if (value.contains(".")) {
        double parsed = Double.parseDouble(value);
        if (parsed != Math.rint(parsed)) {
          throw new NumberFormatException("not integral");
        }
        count = (long) parsed;
      } else {
        count = Long.parseLong(value);
      }
      if (count < 0L) {
        throw new NumberFormatException("negative");
      }
      return count;
    } catch (NumberFormatException e) {
      throw new FragmentParseException("Invalid count '" + value + "' in "
          + metadata + ".", e);
    }
  }
}

/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.ledger;

import org.torproject.metrics.repostats.fragment.FragmentKind;
import org.torproject.metrics.repostats.fragment.FragmentRef;
import org.torproject.metrics.repostats.series.DailyCount;
import org.torproject.metrics.repostats.series.Provenance;
import org.torproject.metrics.repostats.series.TrafficDay;
import org.torproject.metrics.repostats.traffic.TrafficRecord;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategy;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Owns the aggregate files in one directory: loads them into a
 * {@link LedgerState}, writes a state back, and tells which fragments are
 * durably recorded and may thus be deleted.
 *
 * <p>Every file is first written to a {@code .tmp} sibling and then moved into
 * place, and {@code ledger-state.json} is written last, so that a fragment is
 * only listed as folded after the data derived from it is on disk.</p>
 */
public class AggregateLedger {

  private static final Logger logger
      = LoggerFactory.getLogger(AggregateLedger.class);

  static final String TRAFFIC_FILE_NAME = "views_clones_aggregate.csv";

  static final String STATE_FILE_NAME = "ledger-state.json";

  private static final String[] trafficColumns = new String[] {
      "time_iso8601", "clones_total", "clones_unique", "views_total",
      "views_unique", "captured_at", "edge_distance" };

  private static final ObjectMapper objectMapper = new ObjectMapper()
      .setPropertyNamingStrategy(PropertyNamingStrategy.SNAKE_CASE)
      .setSerializationInclusion(JsonInclude.Include.NON_EMPTY)
      .setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE)
      .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);

  private static final CsvMapper csvMapper = new CsvMapper();

  private final Path directory;

  /** Create a ledger for aggregate files in the given directory. */
  public AggregateLedger(Path directory) {
    this.directory = directory;
  }

  /** Return the name of the aggregate file of the given event kind. */
  static String eventFileName(FragmentKind kind) {
    switch (kind) {
      case STARGAZERS:
        return "stargazers_resampled.csv";
      case FORKS:
        return "forks_resampled.csv";
      default:
        throw new IllegalArgumentException("No event aggregate for " + kind);
    }
  }

  /** Return the count column of the given event kind. */
  static String eventColumn(FragmentKind kind) {
    return FragmentKind.STARGAZERS == kind ? "stars_new" : "forks_new";
  }

  /**
   * Load the aggregate files, treating missing files as never observed.
   *
   * @throws CorruptAggregateException if a present file cannot be parsed.
   */
  public LedgerState load() throws CorruptAggregateException {
    StateNode stateNode = this.readStateNode();
    Set<FragmentKind> observed = EnumSet.noneOf(FragmentKind.class);
    SortedMap<LocalDate, TrafficRecord> traffic = new TreeMap<>();
    Path trafficPath = this.directory.resolve(TRAFFIC_FILE_NAME);
    if (Files.exists(trafficPath)) {
      observed.add(FragmentKind.VIEWS_CLONES);
      for (Map<String, String> rec : this.readCsv(trafficPath,
          trafficColumns)) {
        TrafficRecord parsed = this.parseTrafficRecord(trafficPath, rec);
        if (null != traffic.put(parsed.getDate(), parsed)) {
          throw new CorruptAggregateException("Repeated date "
              + parsed.getDate() + " in " + trafficPath + ".");
        }
      }
    }
    Map<FragmentKind, SortedMap<LocalDate, DailyCount>> events
        = new EnumMap<>(FragmentKind.class);
    for (FragmentKind kind : LedgerState.eventKinds()) {
      SortedMap<LocalDate, DailyCount> counts = new TreeMap<>();
      Path eventPath = this.directory.resolve(eventFileName(kind));
      if (Files.exists(eventPath)) {
        observed.add(kind);
        String column = eventColumn(kind);
        for (Map<String, String> rec : this.readCsv(eventPath,
            new String[] { "time_iso8601", column })) {
          DailyCount count = this.parseDailyCount(eventPath, rec, column);
          if (null != counts.put(count.getDate(), count)) {
            throw new CorruptAggregateException("Repeated date "
                + count.getDate() + " in " + eventPath + ".");
          }
        }
      }
      events.put(kind, counts);
    }
    SortedSet<FragmentRef> folded = new TreeSet<>();
    long version = 0L;
    if (null != stateNode) {
      version = stateNode.version;
      if (null != stateNode.folded) {
        folded.addAll(stateNode.folded);
      }
    }
    LedgerState state = new LedgerState(version, traffic, events, observed,
        folded);
    logger.info("Loaded {} from '{}'.", state, this.directory);
    return state;
  }

  /**
   * Write the given state, replacing each aggregate file atomically.
   *
   * @throws LedgerWriteException if any file cannot be written.
   */
  public void persist(LedgerState state) throws LedgerWriteException {
    try {
      Files.createDirectories(this.directory);
      if (state.isObserved(FragmentKind.VIEWS_CLONES)) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (TrafficRecord rec : state.getTraffic().values()) {
          rows.add(toRow(rec));
        }
        this.writeCsv(this.directory.resolve(TRAFFIC_FILE_NAME),
            trafficColumns, rows);
      }
      for (FragmentKind kind : LedgerState.eventKinds()) {
        if (!state.isObserved(kind)) {
          continue;
        }
        String column = eventColumn(kind);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (DailyCount count : state.getEvents(kind).values()) {
          Map<String, Object> row = new LinkedHashMap<>();
          row.put("time_iso8601", count.getDate().toString());
          row.put(column, count.getCount());
          rows.add(row);
        }
        this.writeCsv(this.directory.resolve(eventFileName(kind)),
            new String[] { "time_iso8601", column }, rows);
      }
      StateNode stateNode = new StateNode();
      stateNode.version = state.getVersion();
      stateNode.updated = Instant.now().toString();
      stateNode.folded = new ArrayList<>(state.getFolded());
      Path statePath = this.directory.resolve(STATE_FILE_NAME);
      Path tmpPath = statePath.resolveSibling(STATE_FILE_NAME + ".tmp");
      try (OutputStream os = Files.newOutputStream(tmpPath)) {
        objectMapper.writeValue(os, stateNode);
      }
      Files.move(tmpPath, statePath, StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new LedgerWriteException("Cannot write aggregate files to "
          + this.directory + ": " + e.getMessage(), e);
    }
    logger.info("Persisted {} to '{}'.", state, this.directory);
  }

  /**
   * Return those of the given references that are recorded with an identical
   * digest in the persisted ledger state, which makes the referenced
   * fragments safe to delete.
   *
   * @throws CorruptAggregateException if the persisted state cannot be read.
   */
  public List<FragmentRef> prune(Collection<FragmentRef> refs)
      throws CorruptAggregateException {
    List<FragmentRef> prunable = new ArrayList<>();
    StateNode stateNode = this.readStateNode();
    if (null == stateNode || null == stateNode.folded) {
      return prunable;
    }
    Set<FragmentRef> persisted = new HashSet<>(stateNode.folded);
    for (FragmentRef ref : refs) {
      if (persisted.contains(ref)) {
        prunable.add(ref);
      } else {
        logger.debug("Keeping fragment {}, which is not recorded as folded.",
            ref);
      }
    }
    return prunable;
  }

  private StateNode readStateNode() throws CorruptAggregateException {
    Path statePath = this.directory.resolve(STATE_FILE_NAME);
    if (!Files.exists(statePath)) {
      return null;
    }
    try (InputStream is = Files.newInputStream(statePath)) {
      return objectMapper.readValue(is, StateNode.class);
    } catch (IOException e) {
      throw new CorruptAggregateException("Cannot parse " + statePath + ": "
          + e.getMessage(), e);
    }
  }

  private List<Map<String, String>> readCsv(Path path, String[] columns)
      throws CorruptAggregateException {
    try (InputStream is = Files.newInputStream(path);
        MappingIterator<Map<String, String>> iterator = csvMapper
            .readerFor(Map.class)
            .with(CsvSchema.emptySchema().withHeader()).readValues(is)) {
      List<Map<String, String>> records = iterator.readAll();
      Set<String> found = new HashSet<>();
      if (iterator.getParserSchema() instanceof CsvSchema) {
        for (CsvSchema.Column column
            : (CsvSchema) iterator.getParserSchema()) {
          found.add(column.getName());
        }
      }
      for (String column : columns) {
        if (!found.contains(column)) {
          throw new CorruptAggregateException("Aggregate " + path
              + " lacks column " + column + ".");
        }
      }
      return records;
    } catch (IOException | RuntimeException e) {
      throw new CorruptAggregateException("Cannot parse " + path + ": "
          + e.getMessage(), e);
    }
  }

  private TrafficRecord parseTrafficRecord(Path path, Map<String, String> rec)
      throws CorruptAggregateException {
    try {
      LocalDate date = LocalDate.parse(rec.get("time_iso8601"));
      TrafficDay day = TrafficDay.of(date,
          Long.parseLong(rec.get("views_total")),
          Long.parseLong(rec.get("views_unique")),
          Long.parseLong(rec.get("clones_total")),
          Long.parseLong(rec.get("clones_unique")));
      Provenance provenance = new Provenance(
          Instant.parse(rec.get("captured_at")),
          Integer.parseInt(rec.get("edge_distance")));
      return new TrafficRecord(day, provenance);
    } catch (DateTimeException | IllegalArgumentException
        | NullPointerException e) {
      throw new CorruptAggregateException("Invalid row " + rec + " in "
          + path + ".", e);
    }
  }

  private DailyCount parseDailyCount(Path path, Map<String, String> rec,
      String column) throws CorruptAggregateException {
    try {
      return new DailyCount(LocalDate.parse(rec.get("time_iso8601")),
          Long.parseLong(rec.get(column)));
    } catch (DateTimeException | IllegalArgumentException
        | NullPointerException e) {
      throw new CorruptAggregateException("Invalid row " + rec + " in "
          + path + ".", e);
    }
  }

  private static Map<String, Object> toRow(TrafficRecord rec) {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("time_iso8601", rec.getDate().toString());
    row.put("clones_total", rec.getDay().getClones().getCount());
    row.put("clones_unique", rec.getDay().getClones().getUniqueCount());
    row.put("views_total", rec.getDay().getViews().getCount());
    row.put("views_unique", rec.getDay().getViews().getUniqueCount());
    row.put("captured_at", rec.getProvenance().getCapturedAt().toString());
    row.put("edge_distance", rec.getProvenance().getEdgeDistance());
    return row;
  }

  /* The header is written explicitly, so that a series without rows still
   * results in a header-only file marking it as observed. */
  private void writeCsv(Path path, String[] columns,
      List<Map<String, Object>> rows) throws IOException {
    CsvSchema.Builder builder = CsvSchema.builder();
    for (String column : columns) {
      builder.addColumn(column);
    }
    CsvSchema schema = builder.build().withoutHeader();
    Path tmpPath = path.resolveSibling(path.getFileName() + ".tmp");
    try (BufferedWriter bw = Files.newBufferedWriter(tmpPath,
        StandardCharsets.UTF_8)) {
      bw.write(String.join(",", columns));
      bw.write('\n');
      bw.flush();
      this.writeRows(bw, schema, rows);
    }
    Files.move(tmpPath, path, StandardCopyOption.REPLACE_EXISTING,
        StandardCopyOption.ATOMIC_MOVE);
  }

  private void writeRows(Writer writer, CsvSchema schema,
      List<Map<String, Object>> rows) throws IOException {
    if (rows.isEmpty()) {
      return;
    }
    try (SequenceWriter sequenceWriter = csvMapper.writer(schema)
        .writeValues(writer)) {
      for (Map<String, Object> row : rows) {
        sequenceWriter.write(row);
      }
    }
  }
}

/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.pipeline;

import org.torproject.metrics.repostats.AggregationException;
import org.torproject.metrics.repostats.conf.Configuration;
import org.torproject.metrics.repostats.conf.ConfigurationException;
import org.torproject.metrics.repostats.conf.Key;
import org.torproject.metrics.repostats.events.EventResampler;
import org.torproject.metrics.repostats.events.EventTable;
import org.torproject.metrics.repostats.fragment.Fragment;
import org.torproject.metrics.repostats.fragment.FragmentKind;
import org.torproject.metrics.repostats.fragment.FragmentReader;
import org.torproject.metrics.repostats.fragment.FragmentRef;
import org.torproject.metrics.repostats.fragment.FragmentSelection;
import org.torproject.metrics.repostats.fragment.FragmentStore;
import org.torproject.metrics.repostats.ledger.AggregateLedger;
import org.torproject.metrics.repostats.ledger.LedgerState;
import org.torproject.metrics.repostats.ledger.LedgerWriteException;
import org.torproject.metrics.repostats.report.PeakToMedianScalePolicy;
import org.torproject.metrics.repostats.report.ReportData;
import org.torproject.metrics.repostats.report.ReportDataAssembler;
import org.torproject.metrics.repostats.report.ReportDataWriter;
import org.torproject.metrics.repostats.series.EventRecord;
import org.torproject.metrics.repostats.series.SeriesState;
import org.torproject.metrics.repostats.series.TopListEntry;
import org.torproject.metrics.repostats.series.TrafficDay;
import org.torproject.metrics.repostats.toplist.TopList;
import org.torproject.metrics.repostats.toplist.TopListAggregator;
import org.torproject.metrics.repostats.traffic.TrafficMerger;
import org.torproject.metrics.repostats.traffic.TrafficTable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one aggregation: loads the ledger, discovers and merges fragments,
 * folds them in, persists the ledger, prunes folded fragments if configured,
 * and writes the report data.
 *
 * <p>Each stage only starts after the previous one completed, and fragments
 * are only deleted after the persisted ledger lists them as folded. A run
 * that is aborted at any point can therefore simply be repeated.</p>
 */
public class AggregationPipeline {

  private static final Logger logger
      = LoggerFactory.getLogger(AggregationPipeline.class);

  private static final long LIMIT_MB = 200;

  private final Path fragmentPath;

  private final Path aggregatePath;

  private final Path reportDataPath;

  private final boolean pruneFragments;

  private final FragmentArchiver archiver;

  private final FragmentStore store;

  private final TrafficMerger merger = new TrafficMerger();

  private final EventResampler resampler;

  private final TopListAggregator topListAggregator;

  private final AggregateLedger ledger;

  private final ReportDataAssembler assembler;

  private final ReportDataWriter reportDataWriter = new ReportDataWriter();

  /**
   * Create a pipeline from the given configuration.
   *
   * @throws ConfigurationException if a property is missing or corrupt.
   */
  public AggregationPipeline(Configuration conf)
      throws ConfigurationException {
    this.fragmentPath = conf.getPath(Key.FragmentPath);
    this.aggregatePath = conf.getPath(Key.AggregatePath);
    this.reportDataPath = conf.getPath(Key.ReportDataPath);
    this.pruneFragments = conf.getBool(Key.PruneFragments);
    this.archiver = this.pruneFragments
        && conf.getBool(Key.ArchivePrunedFragments)
        ? new FragmentArchiver(conf.getPath(Key.ArchivePath)) : null;
    int rollingWindowDays = conf.getInt(Key.RollingWindowDays);
    if (rollingWindowDays < 1) {
      throw new ConfigurationException("Corrupt property: "
          + Key.RollingWindowDays + " reason: must be positive.");
    }
    this.store = new FragmentStore(this.fragmentPath,
        new FragmentReader(rollingWindowDays));
    this.resampler = new EventResampler(conf.getZoneId(Key.EventTimeZone));
    int limit = conf.getInt(Key.TopListLimit);
    if (limit < 1) {
      throw new ConfigurationException("Corrupt property: "
          + Key.TopListLimit + " reason: must be positive.");
    }
    this.topListAggregator = new TopListAggregator(rollingWindowDays, limit);
    this.ledger = new AggregateLedger(this.aggregatePath);
    PeakToMedianScalePolicy scalePolicy;
    try {
      scalePolicy = new PeakToMedianScalePolicy(
          conf.getDouble(Key.SemilogPeakToMedianRatio));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Corrupt property: "
          + Key.SemilogPeakToMedianRatio + " reason: " + e.getMessage(), e);
    }
    this.assembler = new ReportDataAssembler(conf.getString(Key.StatsTarget),
        scalePolicy);
  }

  /**
   * Run all stages once and return the report data that was written.
   *
   * @throws AggregationException if the run has to be aborted.
   */
  public ReportData run() throws AggregationException {
    logger.info("Starting aggregation of fragments in '{}'.",
        this.fragmentPath);
    LedgerState loaded = this.ledger.load();

    Map<FragmentRef, Path> foldable = new LinkedHashMap<>();
    FragmentSelection<TrafficDay> trafficSelection
        = this.store.select(FragmentKind.VIEWS_CLONES, TrafficDay.class);
    TrafficTable trafficTable = this.merger.merge(trafficSelection);
    if (SeriesState.NO_DATA_YET == trafficTable.getState()
        && !loaded.isObserved(FragmentKind.VIEWS_CLONES)) {
      throw new MissingTrafficDataException("no data for views/clones: "
          + "neither fragments in '" + this.fragmentPath + "' nor an "
          + "aggregate in '" + this.aggregatePath + "'");
    }
    collectPaths(trafficSelection, foldable);
    LedgerState state = loaded.foldIn(trafficTable);
    for (FragmentKind kind : LedgerState.eventKinds()) {
      FragmentSelection<EventRecord> eventSelection
          = this.store.select(kind, EventRecord.class);
      EventTable eventTable = this.resampler.resample(eventSelection);
      collectPaths(eventSelection, foldable);
      state = state.foldIn(eventTable);
    }
    TopList referrers = this.topListAggregator.aggregate(
        this.store.select(FragmentKind.REFERRERS, TopListEntry.class));
    TopList paths = this.topListAggregator.aggregate(
        this.store.select(FragmentKind.PATHS, TopListEntry.class));

    checkAvailableSpace(this.aggregatePath);
    if (state.equals(loaded)) {
      logger.info("Ledger content unchanged at version {}.",
          state.getVersion());
    } else {
      this.ledger.persist(state);
    }
    if (this.pruneFragments) {
      state = this.prune(state, foldable);
    }

    ReportData reportData = this.assembler.assemble(state, referrers, paths);
    try {
      this.reportDataWriter.write(reportData, this.reportDataPath);
    } catch (IOException e) {
      throw new LedgerWriteException("Cannot write report data to "
          + this.reportDataPath + ": " + e.getMessage(), e);
    }
    logger.info("Finished aggregation at ledger version {}.",
        state.getVersion());
    return reportData;
  }

  private static <R> void collectPaths(FragmentSelection<R> selection,
      Map<FragmentRef, Path> paths) {
    for (Fragment<R> fragment : selection.getFragments()) {
      paths.put(fragment.getRef(), fragment.getPath());
    }
  }

  /**
   * Delete fragments that the persisted ledger lists as folded, archiving
   * them first if configured, and drop them from the ledger state.
   */
  private LedgerState prune(LedgerState state,
      Map<FragmentRef, Path> foldable) throws AggregationException {
    List<FragmentRef> prunable = this.ledger.prune(foldable.keySet());
    if (prunable.isEmpty()) {
      return state;
    }
    List<Path> files = new ArrayList<>();
    for (FragmentRef ref : prunable) {
      files.add(foldable.get(ref));
    }
    if (null != this.archiver) {
      try {
        this.archiver.archive(files, Instant.now());
      } catch (IOException e) {
        logger.warn("Cannot archive fragments, keeping them for now.", e);
        return state;
      }
    }
    List<FragmentRef> deleted = new ArrayList<>();
    for (FragmentRef ref : prunable) {
      try {
        Files.deleteIfExists(foldable.get(ref));
        deleted.add(ref);
      } catch (IOException e) {
        logger.warn("Cannot delete fragment '{}'.", foldable.get(ref), e);
      }
    }
    logger.info("Pruned {} of {} folded fragment(s).", deleted.size(),
        foldable.size());
    LedgerState pruned = state.forget(deleted);
    if (!pruned.equals(state)) {
      this.ledger.persist(pruned);
    }
    return pruned;
  }

  /**
   * Checks the available space for the storage the given path is located on and
   * logs a warning, if 200 MiB or less are available, and otherwise logs
   * available space in TRACE level.
   */
  public static void checkAvailableSpace(Path location) {
    try {
      long megaBytes = Files.getFileStore(location.toFile()
          .getAbsoluteFile().toPath().getRoot()).getUsableSpace()
              / 1024 / 1024;
      if (megaBytes < LIMIT_MB) {
        logger.warn("Available storage critical for {}; only {} MiB left.",
            location, megaBytes);
      } else {
        logger.trace("Available storage for {}: {} MiB", location, megaBytes);
      }
    } catch (IOException ioe) {
      throw new RuntimeException("Cannot access " + location + " reason: "
          + ioe.getMessage(), ioe);
    }
  }
}

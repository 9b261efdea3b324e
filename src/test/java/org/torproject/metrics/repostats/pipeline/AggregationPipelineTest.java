/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.pipeline;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.torproject.metrics.repostats.conf.Configuration;
import org.torproject.metrics.repostats.conf.ConfigurationException;
import org.torproject.metrics.repostats.conf.Key;
import org.torproject.metrics.repostats.report.ReportData;
import org.torproject.metrics.repostats.report.ReportRow;
import org.torproject.metrics.repostats.series.SeriesState;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class AggregationPipelineTest {

  @Rule
  public TemporaryFolder tmpf = new TemporaryFolder();

  private Path fragmentDir;

  private Path aggregateDir;

  private Path archiveDir;

  private Path reportDataPath;

  private Configuration conf;

  private static final String trafficHeader
      = "time_iso8601,clones_total,clones_unique,views_total,views_unique\n";

  /** Configure a pipeline working in a temporary folder. */
  @Before
  public void configure() throws Exception {
    Path root = tmpf.getRoot().toPath();
    this.fragmentDir = root.resolve("fragments");
    this.aggregateDir = root.resolve("aggregate");
    this.archiveDir = root.resolve("archive");
    this.reportDataPath = root.resolve("report-data.json");
    this.conf = new Configuration();
    this.conf.setProperty(Key.StatsTarget.name(), "owner/repo");
    this.conf.setProperty(Key.FragmentPath.name(), this.fragmentDir.toString());
    this.conf.setProperty(Key.AggregatePath.name(),
        this.aggregateDir.toString());
    this.conf.setProperty(Key.ReportDataPath.name(),
        this.reportDataPath.toString());
    this.conf.setProperty(Key.ArchivePath.name(), this.archiveDir.toString());
    this.conf.setProperty(Key.RollingWindowDays.name(), "14");
    this.conf.setProperty(Key.EventTimeZone.name(), "UTC");
    this.conf.setProperty(Key.SemilogPeakToMedianRatio.name(), "10.0");
    this.conf.setProperty(Key.TopListLimit.name(), "20");
    this.conf.setProperty(Key.PruneFragments.name(), "false");
    this.conf.setProperty(Key.ArchivePrunedFragments.name(), "true");
  }

  private void write(String fileName, String content) throws Exception {
    Files.createDirectories(this.fragmentDir);
    Files.write(this.fragmentDir.resolve(fileName),
        content.getBytes(StandardCharsets.UTF_8));
  }

  private void writeTraffic(String capturedAt, String first, String last,
      long base) throws Exception {
    StringBuilder sb = new StringBuilder(trafficHeader);
    for (LocalDate date = LocalDate.parse(first);
        !date.isAfter(LocalDate.parse(last)); date = date.plusDays(1)) {
      sb.append(String.format("%s,2,1,%d,3\n", date,
          base + date.getDayOfMonth()));
    }
    write(capturedAt + "_views_clones_series_fragment.csv", sb.toString());
  }

  private void writeFragments() throws Exception {
    writeTraffic("2021-01-14_120000", "2021-01-01", "2021-01-14", 100);
    writeTraffic("2021-01-15_120000", "2021-01-02", "2021-01-15", 200);
    write("2021-01-15_120000_stargazers_snapshot.csv", "time_iso8601,actor\n"
        + "2021-01-03T10:00:00Z,alice\n2021-01-05T10:00:00Z,bob\n");
    write("2021-01-15_120000_top_referrers_snapshot.csv",
        "referrer,views_total,views_unique\ngithub.com,10,3\n");
  }

  private static long countOn(List<ReportRow> rows, String date) {
    for (ReportRow row : rows) {
      if (row.getDate().equals(LocalDate.parse(date))) {
        return row.getCount();
      }
    }
    throw new AssertionError("No row for " + date);
  }

  private static List<Path> list(Path dir) throws Exception {
    try (Stream<Path> files = Files.list(dir)) {
      return files.collect(Collectors.toList());
    }
  }

  @Test
  public void testRun() throws Exception {
    writeFragments();
    ReportData data = new AggregationPipeline(this.conf).run();
    assertTrue(Files.exists(this.reportDataPath));
    assertTrue(Files.exists(this.aggregateDir.resolve(
        "views_clones_aggregate.csv")));
    assertTrue(Files.exists(this.aggregateDir.resolve(
        "stargazers_resampled.csv")));
    assertFalse(Files.exists(this.aggregateDir.resolve(
        "forks_resampled.csv")));
    assertEquals(2L, data.getSummary().getLedgerVersion());
    List<ReportRow> views = data.getViews().getRows();
    assertEquals(15, views.size());
    assertEquals(101L, countOn(views, "2021-01-01"));
    assertEquals(107L, countOn(views, "2021-01-07"));
    assertEquals(208L, countOn(views, "2021-01-08"));
    assertEquals(210L, countOn(views, "2021-01-10"));
    assertEquals(215L, countOn(views, "2021-01-15"));
    assertEquals(30L, data.getClones().getTotal());
    assertEquals(2L, data.getStars().getTotal());
    assertEquals(SeriesState.NO_DATA_YET, data.getForks().getState());
    assertEquals(SeriesState.HAS_DATA, data.getReferrers().getState());
    assertEquals(SeriesState.NO_DATA_YET, data.getPaths().getState());
    assertEquals(4, list(this.fragmentDir).size());
  }

  @Test
  public void testRerunIsIdempotent() throws Exception {
    writeFragments();
    new AggregationPipeline(this.conf).run();
    Path statePath = this.aggregateDir.resolve("ledger-state.json");
    byte[] state = Files.readAllBytes(statePath);
    byte[] traffic = Files.readAllBytes(this.aggregateDir.resolve(
        "views_clones_aggregate.csv"));
    ReportData data = new AggregationPipeline(this.conf).run();
    assertEquals(2L, data.getSummary().getLedgerVersion());
    assertArrayEquals(state, Files.readAllBytes(statePath));
    assertArrayEquals(traffic, Files.readAllBytes(this.aggregateDir.resolve(
        "views_clones_aggregate.csv")));
  }

  @Test
  public void testNoTrafficAnywhere() throws Exception {
    write("2021-01-15_120000_stargazers_snapshot.csv", "time_iso8601,actor\n"
        + "2021-01-03T10:00:00Z,alice\n");
    try {
      new AggregationPipeline(this.conf).run();
      fail("Expected missing traffic data.");
    } catch (MissingTrafficDataException e) {
      assertEquals(2, e.exitCode());
      assertTrue(e.getMessage().startsWith("no data for views/clones"));
    }
    assertFalse(Files.exists(this.aggregateDir));
    assertFalse(Files.exists(this.reportDataPath));
  }

  @Test
  public void testFragmentsGoneAfterFirstRun() throws Exception {
    writeFragments();
    new AggregationPipeline(this.conf).run();
    for (Path fragment : list(this.fragmentDir)) {
      Files.delete(fragment);
    }
    ReportData data = new AggregationPipeline(this.conf).run();
    assertEquals(2L, data.getSummary().getLedgerVersion());
    assertEquals(215L, countOn(data.getViews().getRows(), "2021-01-15"));
    assertEquals(SeriesState.NO_DATA_YET, data.getReferrers().getState());
  }

  @Test
  public void testHeaderOnlyTrafficFragment() throws Exception {
    write("2021-01-15_120000_views_clones_series_fragment.csv",
        trafficHeader);
    ReportData data = new AggregationPipeline(this.conf).run();
    assertEquals(SeriesState.EMPTY, data.getViews().getState());
    assertEquals("no views/clones data in any fragment",
        data.getViews().getMessage());
  }

  @Test
  public void testPruneAndArchive() throws Exception {
    writeFragments();
    this.conf.setProperty(Key.PruneFragments.name(), "true");
    ReportData data = new AggregationPipeline(this.conf).run();
    assertEquals(3L, data.getSummary().getLedgerVersion());
    List<Path> remaining = list(this.fragmentDir);
    assertEquals(1, remaining.size());
    assertEquals("2021-01-15_120000_top_referrers_snapshot.csv",
        remaining.get(0).getFileName().toString());
    List<Path> archives = list(this.archiveDir);
    assertEquals(1, archives.size());
    assertTrue(archives.get(0).getFileName().toString().endsWith(".tar.xz"));
    ReportData again = new AggregationPipeline(this.conf).run();
    assertEquals(3L, again.getSummary().getLedgerVersion());
    assertEquals(215L, countOn(again.getViews().getRows(), "2021-01-15"));
  }

  @Test
  public void testPruneWithoutArchive() throws Exception {
    writeFragments();
    this.conf.setProperty(Key.PruneFragments.name(), "true");
    this.conf.setProperty(Key.ArchivePrunedFragments.name(), "false");
    new AggregationPipeline(this.conf).run();
    assertEquals(1, list(this.fragmentDir).size());
    assertFalse(Files.exists(this.archiveDir));
  }

  @Test(expected = ConfigurationException.class)
  public void testInvalidRatio() throws Exception {
    this.conf.setProperty(Key.SemilogPeakToMedianRatio.name(), "0.5");
    new AggregationPipeline(this.conf);
  }

  @Test(expected = ConfigurationException.class)
  public void testInvalidTimeZone() throws Exception {
    this.conf.setProperty(Key.EventTimeZone.name(), "Mars/Olympus");
    new AggregationPipeline(this.conf);
  }

  @Test(expected = ConfigurationException.class)
  public void testInvalidWindow() throws Exception {
    this.conf.setProperty(Key.RollingWindowDays.name(), "0");
    new AggregationPipeline(this.conf);
  }
}

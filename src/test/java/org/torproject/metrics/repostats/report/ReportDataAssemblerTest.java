/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.report;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.torproject.metrics.repostats.events.EventResampler;
import org.torproject.metrics.repostats.fragment.Fragment;
import org.torproject.metrics.repostats.fragment.FragmentBuilder;
import org.torproject.metrics.repostats.fragment.FragmentKind;
import org.torproject.metrics.repostats.fragment.FragmentSelection;
import org.torproject.metrics.repostats.ledger.LedgerState;
import org.torproject.metrics.repostats.series.EventRecord;
import org.torproject.metrics.repostats.series.SeriesState;
import org.torproject.metrics.repostats.series.TopListEntry;
import org.torproject.metrics.repostats.series.TrafficDay;
import org.torproject.metrics.repostats.toplist.TopList;
import org.torproject.metrics.repostats.toplist.TopListAggregator;
import org.torproject.metrics.repostats.traffic.TrafficMerger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class ReportDataAssemblerTest {

  @Rule
  public TemporaryFolder tmpf = new TemporaryFolder();

  private static final Instant capturedAt
      = Instant.parse("2021-01-14T12:00:00Z");

  private final TopListAggregator topListAggregator
      = new TopListAggregator(14, 20);

  private final ReportDataAssembler assembler = new ReportDataAssembler(
      "owner/repo", new PeakToMedianScalePolicy());

  private static LedgerState trafficState() {
    List<TrafficDay> rows = Arrays.asList(
        TrafficDay.of(LocalDate.parse("2021-01-10"), 5, 2, 1, 1),
        TrafficDay.of(LocalDate.parse("2021-01-11"), 3, 1, 0, 0),
        TrafficDay.of(LocalDate.parse("2021-01-13"), 2, 2, 4, 1));
    return LedgerState.empty().foldIn(new TrafficMerger().merge(
        new FragmentSelection<>(FragmentKind.VIEWS_CLONES,
        Collections.singletonList(FragmentBuilder.build(FragmentKind.VIEWS_CLONES,
        capturedAt, rows)))));
  }

  private static LedgerState withEvents(LedgerState state, FragmentKind kind,
      String... timestampActorPairs) {
    List<EventRecord> events = new ArrayList<>();
    for (int i = 0; i < timestampActorPairs.length; i += 2) {
      events.add(new EventRecord(Instant.parse(timestampActorPairs[i]),
          timestampActorPairs[i + 1]));
    }
    return state.foldIn(new EventResampler(ZoneOffset.UTC).resample(
        new FragmentSelection<>(kind, Collections.singletonList(
        FragmentBuilder.build(kind, capturedAt, events)))));
  }

  private TopList topList(FragmentKind kind, TopListEntry... entries) {
    return this.topListAggregator.aggregate(new FragmentSelection<>(kind,
        Collections.singletonList(FragmentBuilder.build(kind, capturedAt,
        Arrays.asList(entries)))));
  }

  private TopList absentTopList(FragmentKind kind) {
    return this.topListAggregator.aggregate(new FragmentSelection<>(kind,
        Collections.<Fragment<TopListEntry>>emptyList()));
  }

  @Test
  public void testTrafficRowsAndTotals() {
    ReportData data = this.assembler.assemble(trafficState(),
        absentTopList(FragmentKind.REFERRERS),
        absentTopList(FragmentKind.PATHS));
    MetricReport views = data.getViews();
    assertEquals(SeriesState.HAS_DATA, views.getState());
    assertEquals("views", views.getMetric());
    assertEquals(new PlotWindow(LocalDate.parse("2021-01-10"),
        LocalDate.parse("2021-01-13")), views.getWindow());
    assertEquals(4, views.getRows().size());
    ReportRow gap = views.getRows().get(2);
    assertEquals(LocalDate.parse("2021-01-12"), gap.getDate());
    assertEquals(0L, gap.getCount());
    assertEquals(8L, gap.getCumulativeCount());
    assertEquals(10L, views.getTotal());
    assertEquals(Long.valueOf(5L), views.getUniqueTotal());
    assertEquals(AxisScale.LINEAR, views.getScale());
    MetricReport clones = data.getClones();
    assertEquals(views.getWindow(), clones.getWindow());
    assertEquals(5L, clones.getTotal());
    assertEquals(Long.valueOf(2L), clones.getUniqueTotal());
  }

  @Test
  public void testEventWindowStartsBeforeTraffic() {
    LedgerState state = withEvents(trafficState(), FragmentKind.FORKS,
        "2021-01-05T08:00:00Z", "alice", "2021-01-11T09:00:00Z", "bob",
        "2021-01-11T10:00:00Z", "carol");
    ReportData data = this.assembler.assemble(state,
        absentTopList(FragmentKind.REFERRERS),
        absentTopList(FragmentKind.PATHS));
    MetricReport forks = data.getForks();
    assertEquals(new PlotWindow(LocalDate.parse("2021-01-05"),
        LocalDate.parse("2021-01-13")), forks.getWindow());
    assertEquals(9, forks.getRows().size());
    assertEquals(3L, forks.getTotal());
    assertNull(forks.getUniqueTotal());
    assertNull(forks.getRows().get(0).getUniqueCount());
    assertEquals(1L, forks.getRows().get(5).getCumulativeCount());
    assertEquals(3L, forks.getRows().get(6).getCumulativeCount());
    MetricReport stars = data.getStars();
    assertEquals(SeriesState.NO_DATA_YET, stars.getState());
    assertEquals("no stars yet", stars.getMessage());
    assertEquals(0L, stars.getTotal());
    assertTrue(stars.getRows().isEmpty());
    assertNull(stars.getWindow());
  }

  @Test
  public void testEventWindowWithoutTraffic() {
    LedgerState state = withEvents(LedgerState.empty(),
        FragmentKind.STARGAZERS, "2021-01-02T08:00:00Z", "alice",
        "2021-01-04T09:00:00Z", "bob");
    ReportData data = this.assembler.assemble(state,
        absentTopList(FragmentKind.REFERRERS),
        absentTopList(FragmentKind.PATHS));
    assertEquals(new PlotWindow(LocalDate.parse("2021-01-02"),
        LocalDate.parse("2021-01-04")), data.getStars().getWindow());
    assertEquals(SeriesState.NO_DATA_YET, data.getViews().getState());
    assertEquals("no views/clones data yet", data.getViews().getMessage());
    assertNull(data.getSummary().getDataCollectionStart());
    assertEquals(2L, data.getSummary().getStarsTotal());
  }

  @Test
  public void testObservedButEmpty() {
    LedgerState state = withEvents(trafficState(), FragmentKind.STARGAZERS);
    ReportData data = this.assembler.assemble(state,
        absentTopList(FragmentKind.REFERRERS),
        topList(FragmentKind.PATHS));
    assertEquals(SeriesState.EMPTY, data.getStars().getState());
    assertEquals("no stars yet", data.getStars().getMessage());
    assertEquals(SeriesState.NO_DATA_YET, data.getReferrers().getState());
    assertEquals("no referrer data available",
        data.getReferrers().getMessage());
    assertEquals(SeriesState.EMPTY, data.getPaths().getState());
    assertEquals("no path listed in any fragment",
        data.getPaths().getMessage());
  }

  @Test
  public void testSummary() {
    LedgerState state = withEvents(trafficState(), FragmentKind.FORKS,
        "2021-01-11T09:00:00Z", "bob");
    ReportData data = this.assembler.assemble(state,
        topList(FragmentKind.REFERRERS, new TopListEntry("github.com", 4, 2)),
        absentTopList(FragmentKind.PATHS));
    ReportSummary summary = data.getSummary();
    assertEquals("owner/repo", summary.getStatsTarget());
    assertEquals("2021-01-10", summary.getDataCollectionStart());
    assertEquals(10L, summary.getViewsTotal());
    assertEquals(5L, summary.getViewsUniqueTotal());
    assertEquals(5L, summary.getClonesTotal());
    assertEquals(2L, summary.getClonesUniqueTotal());
    assertEquals(0L, summary.getStarsTotal());
    assertEquals(1L, summary.getForksTotal());
    assertEquals(2L, summary.getLedgerVersion());
    assertEquals(SeriesState.HAS_DATA, data.getReferrers().getState());
    assertNull(data.getReferrers().getMessage());
    assertEquals("github.com",
        data.getReferrers().getEntries().get(0).getSubject());
  }

  @Test
  public void testScalePolicyIsApplied() {
    ReportDataAssembler semilog = new ReportDataAssembler("owner/repo",
        dailyValues -> AxisScale.SEMILOG);
    ReportData data = semilog.assemble(trafficState(),
        absentTopList(FragmentKind.REFERRERS),
        absentTopList(FragmentKind.PATHS));
    assertEquals(AxisScale.SEMILOG, data.getViews().getScale());
    assertNull(data.getStars().getScale());
  }

  @Test
  public void testWriteReportData() throws Exception {
    ReportData data = this.assembler.assemble(trafficState(),
        absentTopList(FragmentKind.REFERRERS),
        absentTopList(FragmentKind.PATHS));
    Path reportDataPath = tmpf.getRoot().toPath().resolve("out")
        .resolve("report-data.json");
    new ReportDataWriter().write(data, reportDataPath);
    assertFalse(Files.exists(reportDataPath.resolveSibling(
        "report-data.json.tmp")));
    JsonNode root = new ObjectMapper().readTree(reportDataPath.toFile());
    assertEquals("owner/repo",
        root.get("summary").get("stats_target").asText());
    assertEquals("2021-01-10",
        root.get("views").get("window").get("start").asText());
    assertEquals(10L, root.get("views").get("total").asLong());
    assertEquals("NO_DATA_YET", root.get("stars").get("state").asText());
    assertFalse(root.get("stars").has("window"));
    assertFalse(root.get("views").has("message"));
    assertEquals(4, root.get("views").get("rows").size());
  }
}

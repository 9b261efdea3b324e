/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.report;

import org.torproject.metrics.repostats.fragment.FragmentKind;
import org.torproject.metrics.repostats.ledger.LedgerState;
import org.torproject.metrics.repostats.series.DailyCount;
import org.torproject.metrics.repostats.series.DailyRecord;
import org.torproject.metrics.repostats.series.MetricSeries;
import org.torproject.metrics.repostats.series.SeriesState;
import org.torproject.metrics.repostats.series.TrafficDay;
import org.torproject.metrics.repostats.series.TrafficMetric;
import org.torproject.metrics.repostats.toplist.TopList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Derives presentation-ready data from the ledger state and the aggregated
 * top lists: cumulative totals, plotting windows, axis scales, and an explicit
 * state with a message for every metric without data.
 *
 * <p>Views and clones share one plotting window spanning all traffic data.
 * Stars and forks share another window that starts with the earlier of the
 * first event and the first traffic day and ends with the later of the last
 * event and the last traffic day, so that it only matches the traffic window
 * if event history started after traffic data collection.</p>
 */
public class ReportDataAssembler {

  private static final Logger logger
      = LoggerFactory.getLogger(ReportDataAssembler.class);

  private final String statsTarget;

  private final ScalePolicy scalePolicy;

  /** Create an assembler for the given repository. */
  public ReportDataAssembler(String statsTarget, ScalePolicy scalePolicy) {
    this.statsTarget = statsTarget;
    this.scalePolicy = scalePolicy;
  }

  /** Assemble report data from the given ledger state and top lists. */
  public ReportData assemble(LedgerState state, TopList referrers,
      TopList paths) {
    MetricSeries<TrafficDay> traffic = state.trafficSeries();
    MetricSeries<DailyCount> stars
        = state.eventSeries(FragmentKind.STARGAZERS);
    MetricSeries<DailyCount> forks = state.eventSeries(FragmentKind.FORKS);

    PlotWindow trafficWindow = traffic.hasData() ? new PlotWindow(
        traffic.rows().firstKey(), traffic.rows().lastKey()) : null;
    PlotWindow eventWindow = null;
    for (MetricSeries<DailyCount> events : Arrays.asList(stars, forks)) {
      if (events.hasData()) {
        PlotWindow window = new PlotWindow(events.rows().firstKey(),
            events.rows().lastKey());
        eventWindow = window.span(eventWindow);
      }
    }
    if (null != eventWindow) {
      eventWindow = eventWindow.span(trafficWindow);
    }

    MetricReport views = this.trafficReport(TrafficMetric.VIEWS, traffic,
        trafficWindow);
    MetricReport clones = this.trafficReport(TrafficMetric.CLONES, traffic,
        trafficWindow);
    MetricReport starsReport = this.eventReport("stars", stars, eventWindow);
    MetricReport forksReport = this.eventReport("forks", forks, eventWindow);

    ReportSummary summary = new ReportSummary();
    summary.statsTarget = this.statsTarget;
    summary.generated = Instant.now().toString();
    summary.dataCollectionStart = null == trafficWindow ? null
        : trafficWindow.getStart().toString();
    summary.viewsTotal = views.getTotal();
    summary.viewsUniqueTotal = null == views.getUniqueTotal() ? 0L
        : views.getUniqueTotal();
    summary.clonesTotal = clones.getTotal();
    summary.clonesUniqueTotal = null == clones.getUniqueTotal() ? 0L
        : clones.getUniqueTotal();
    summary.starsTotal = starsReport.getTotal();
    summary.forksTotal = forksReport.getTotal();
    summary.ledgerVersion = state.getVersion();

    ReportData data = new ReportData(summary, views, clones, starsReport,
        forksReport, topListReport("referrers", "referrer", referrers),
        topListReport("paths", "path", paths));
    logger.info("Assembled report data for {}: {}, {}, {}, {}.",
        this.statsTarget, views, clones, starsReport, forksReport);
    return data;
  }

  private MetricReport trafficReport(TrafficMetric metric,
      MetricSeries<TrafficDay> traffic, PlotWindow window) {
    if (!traffic.hasData()) {
      return MetricReport.withoutData(metric.toString(), traffic.getState(),
          SeriesState.NO_DATA_YET == traffic.getState()
          ? "no views/clones data yet"
          : "no views/clones data in any fragment");
    }
    List<ReportRow> rows = new ArrayList<>();
    List<Long> dailyValues = new ArrayList<>();
    long cumulative = 0L;
    long cumulativeUnique = 0L;
    for (LocalDate date = window.getStart(); !date.isAfter(window.getEnd());
        date = date.plusDays(1)) {
      TrafficDay day = traffic.rows().get(date);
      long count = 0L;
      long unique = 0L;
      if (null != day) {
        DailyRecord rec = day.get(metric);
        count = rec.getCount();
        unique = rec.getUniqueCount();
      }
      cumulative += count;
      cumulativeUnique += unique;
      dailyValues.add(count);
      rows.add(new ReportRow(date, count, unique, cumulative,
          cumulativeUnique));
    }
    return MetricReport.withData(metric.toString(), window,
        this.scalePolicy.choose(dailyValues), rows);
  }

  private MetricReport eventReport(String metric,
      MetricSeries<DailyCount> events, PlotWindow window) {
    if (!events.hasData()) {
      return MetricReport.withoutData(metric, events.getState(),
          "no " + metric + " yet");
    }
    SortedMap<LocalDate, DailyCount> counts = new TreeMap<>(events.rows());
    List<ReportRow> rows = new ArrayList<>();
    List<Long> dailyValues = new ArrayList<>();
    long cumulative = 0L;
    for (LocalDate date = window.getStart(); !date.isAfter(window.getEnd());
        date = date.plusDays(1)) {
      long count = counts.containsKey(date) ? counts.get(date).getCount()
          : 0L;
      cumulative += count;
      dailyValues.add(count);
      rows.add(new ReportRow(date, count, null, cumulative, null));
    }
    return MetricReport.withData(metric, window,
        this.scalePolicy.choose(dailyValues), rows);
  }

  private static TopListReport topListReport(String list, String subject,
      TopList topList) {
    switch (topList.getState()) {
      case NO_DATA_YET:
        return new TopListReport(list, SeriesState.NO_DATA_YET,
            "no " + subject + " data available", topList.getEntries());
      case EMPTY:
        return new TopListReport(list, SeriesState.EMPTY,
            "no " + subject + " listed in any fragment", topList.getEntries());
      default:
        return new TopListReport(list, SeriesState.HAS_DATA, null,
            topList.getEntries());
    }
  }
}

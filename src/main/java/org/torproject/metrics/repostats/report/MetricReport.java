/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.report;

import org.torproject.metrics.repostats.series.SeriesState;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Presentation-ready data of one daily metric.
 *
 * <p>Consumers must check {@link #getState()} first: only in state
 * {@link SeriesState#HAS_DATA} are window, scale and rows set; otherwise the
 * message explains why there is no chart.</p>
 */
@JsonPropertyOrder({ "metric", "state", "message", "window", "scale", "total",
    "unique_total", "rows" })
public final class MetricReport {

  @JsonProperty("metric")
  private final String metric;

  @JsonProperty("state")
  private final SeriesState state;

  @JsonProperty("message")
  private final String message;

  @JsonProperty("window")
  private final PlotWindow window;

  @JsonProperty("scale")
  private final AxisScale scale;

  @JsonProperty("total")
  private final long total;

  @JsonProperty("unique_total")
  private final Long uniqueTotal;

  @JsonProperty("rows")
  private final List<ReportRow> rows;

  private MetricReport(String metric, SeriesState state, String message,
      PlotWindow window, AxisScale scale, long total, Long uniqueTotal,
      List<ReportRow> rows) {
    this.metric = metric;
    this.state = state;
    this.message = message;
    this.window = window;
    this.scale = scale;
    this.total = total;
    this.uniqueTotal = uniqueTotal;
    this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
  }

  static MetricReport withoutData(String metric, SeriesState state,
      String message) {
    return new MetricReport(metric, state, message, null, null, 0L, null,
        new ArrayList<>());
  }

  static MetricReport withData(String metric, PlotWindow window,
      AxisScale scale, List<ReportRow> rows) {
    ReportRow last = rows.get(rows.size() - 1);
    return new MetricReport(metric, SeriesState.HAS_DATA, null, window, scale,
        last.getCumulativeCount(), last.getCumulativeUniqueCount(), rows);
  }

  public String getMetric() {
    return this.metric;
  }

  public SeriesState getState() {
    return this.state;
  }

  public String getMessage() {
    return this.message;
  }

  public PlotWindow getWindow() {
    return this.window;
  }

  public AxisScale getScale() {
    return this.scale;
  }

  public long getTotal() {
    return this.total;
  }

  public Long getUniqueTotal() {
    return this.uniqueTotal;
  }

  public List<ReportRow> getRows() {
    return this.rows;
  }

  @Override
  public String toString() {
    return this.metric + " " + this.state + (null == this.message ? ""
        : " (" + this.message + ")");
  }
}

/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Root node of {@code report-data.json}, the complete input of the report
 * renderer.
 */
@JsonPropertyOrder({ "summary", "views", "clones", "stars", "forks",
    "referrers", "paths" })
public final class ReportData {

  @JsonProperty("summary")
  private final ReportSummary summary;

  @JsonProperty("views")
  private final MetricReport views;

  @JsonProperty("clones")
  private final MetricReport clones;

  @JsonProperty("stars")
  private final MetricReport stars;

  @JsonProperty("forks")
  private final MetricReport forks;

  @JsonProperty("referrers")
  private final TopListReport referrers;

  @JsonProperty("paths")
  private final TopListReport paths;

  ReportData(ReportSummary summary, MetricReport views, MetricReport clones,
      MetricReport stars, MetricReport forks, TopListReport referrers,
      TopListReport paths) {
    this.summary = summary;
    this.views = views;
    this.clones = clones;
    this.stars = stars;
    this.forks = forks;
    this.referrers = referrers;
    this.paths = paths;
  }

  public ReportSummary getSummary() {
    return this.summary;
  }

  public MetricReport getViews() {
    return this.views;
  }

  public MetricReport getClones() {
    return this.clones;
  }

  public MetricReport getStars() {
    return this.stars;
  }

  public MetricReport getForks() {
    return this.forks;
  }

  public TopListReport getReferrers() {
    return this.referrers;
  }

  public TopListReport getPaths() {
    return this.paths;
  }
}

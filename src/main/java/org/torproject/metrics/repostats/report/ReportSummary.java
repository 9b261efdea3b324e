/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Key figures shown at the top of the report. */
@JsonPropertyOrder({ "stats_target", "generated", "data_collection_start",
    "views_total", "views_unique_total", "clones_total",
    "clones_unique_total", "stars_total", "forks_total", "ledger_version" })
public final class ReportSummary {

  @JsonProperty("stats_target")
  String statsTarget;

  /** Timestamp of report data creation as ISO-8601 instant. */
  @JsonProperty("generated")
  String generated;

  /** First day of views/clones data, if any. */
  @JsonProperty("data_collection_start")
  String dataCollectionStart;

  @JsonProperty("views_total")
  long viewsTotal;

  @JsonProperty("views_unique_total")
  long viewsUniqueTotal;

  @JsonProperty("clones_total")
  long clonesTotal;

  @JsonProperty("clones_unique_total")
  long clonesUniqueTotal;

  @JsonProperty("stars_total")
  long starsTotal;

  @JsonProperty("forks_total")
  long forksTotal;

  @JsonProperty("ledger_version")
  long ledgerVersion;

  public String getStatsTarget() {
    return this.statsTarget;
  }

  public String getGenerated() {
    return this.generated;
  }

  public String getDataCollectionStart() {
    return this.dataCollectionStart;
  }

  public long getViewsTotal() {
    return this.viewsTotal;
  }

  public long getViewsUniqueTotal() {
    return this.viewsUniqueTotal;
  }

  public long getClonesTotal() {
    return this.clonesTotal;
  }

  public long getClonesUniqueTotal() {
    return this.clonesUniqueTotal;
  }

  public long getStarsTotal() {
    return this.starsTotal;
  }

  public long getForksTotal() {
    return this.forksTotal;
  }

  public long getLedgerVersion() {
    return this.ledgerVersion;
  }
}

/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.ledger;

import org.torproject.metrics.repostats.fragment.FragmentRef;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Root node of {@code ledger-state.json}.
 */
@JsonPropertyOrder({ "version", "updated", "folded" })
class StateNode {

  /**
   * Version of the ledger content, increased whenever the content changes.
   */
  @JsonProperty("version")
  long version;

  /**
   * Timestamp when the ledger was last written, as ISO-8601 instant.
   */
  @JsonProperty("updated")
  String updated;

  /**
   * Fragments folded into the aggregate files next to this file.
   */
  @JsonProperty("folded")
  List<FragmentRef> folded;
}

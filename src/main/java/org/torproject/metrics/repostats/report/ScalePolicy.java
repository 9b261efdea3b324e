/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.report;

import java.util.List;

/** Decides how the daily values of one chart should be scaled. */
public interface ScalePolicy {

  /**
   * Choose the axis scale for the given daily values within a plotting
   * window, which may contain zeros for days without data.
   */
  AxisScale choose(List<Long> dailyValues);
}

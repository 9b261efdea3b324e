/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.report;

/** Scale of a chart's value axis. */
public enum AxisScale {
  LINEAR,
  SEMILOG
}

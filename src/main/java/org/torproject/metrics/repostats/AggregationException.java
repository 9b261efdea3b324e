/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats;

/**
 * Fatal error that aborts an aggregation run and determines the process exit
 * code.
 */
public abstract class AggregationException extends Exception {

  protected AggregationException(String message) {
    super(message);
  }

  protected AggregationException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Return the non-zero exit code reported for this error. */
  public abstract int exitCode();
}

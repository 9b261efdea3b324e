/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.ledger;

import org.torproject.metrics.repostats.AggregationException;

/**
 * Thrown if an aggregate file exists but cannot be parsed, in which case
 * nothing may be written over it.
 */
public class CorruptAggregateException extends AggregationException {

  public CorruptAggregateException(String message) {
    super(message);
  }

  public CorruptAggregateException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public int exitCode() {
    return 3;
  }
}

/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.ledger;

import org.torproject.metrics.repostats.AggregationException;

/** Thrown if aggregate or report files cannot be written. */
public class LedgerWriteException extends AggregationException {

  public LedgerWriteException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public int exitCode() {
    return 4;
  }
}

/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.pipeline;

import org.torproject.metrics.repostats.AggregationException;

/**
 * Thrown if there are neither views/clones fragments nor a views/clones
 * aggregate, so that there is nothing to report on.
 */
public class MissingTrafficDataException extends AggregationException {

  public MissingTrafficDataException(String message) {
    super(message);
  }

  @Override
  public int exitCode() {
    return 2;
  }
}

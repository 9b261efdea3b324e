/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Chooses a semi-logarithmic axis when single spikes would flatten the
 * baseline on a linear axis, that is, when the peak exceeds the median of all
 * non-zero values by more than a given ratio.
 */
public class PeakToMedianScalePolicy implements ScalePolicy {

  /** Ratio used if none is configured. */
  public static final double DEFAULT_RATIO = 10.0;

  private final double ratio;

  public PeakToMedianScalePolicy() {
    this(DEFAULT_RATIO);
  }

  /** Create a policy with the given peak to median ratio threshold. */
  public PeakToMedianScalePolicy(double ratio) {
    if (!(ratio > 1.0) || Double.isInfinite(ratio)) {
      throw new IllegalArgumentException("Ratio must be a finite number "
          + "greater than 1, but is " + ratio + ".");
    }
    this.ratio = ratio;
  }

  @Override
  public AxisScale choose(List<Long> dailyValues) {
    List<Long> nonZero = new ArrayList<>();
    for (Long value : dailyValues) {
      if (null != value && value > 0L) {
        nonZero.add(value);
      }
    }
    if (nonZero.isEmpty()) {
      return AxisScale.LINEAR;
    }
    Collections.sort(nonZero);
    double median = median(nonZero);
    double peak = nonZero.get(nonZero.size() - 1);
    return peak / median > this.ratio ? AxisScale.SEMILOG : AxisScale.LINEAR;
  }

  /** Median of a sorted, non-empty list. */
  static double median(List<Long> sorted) {
    int size = sorted.size();
    if (size % 2 == 1) {
      return sorted.get(size / 2);
    }
    return (sorted.get(size / 2 - 1) + sorted.get(size / 2)) / 2.0;
  }
}

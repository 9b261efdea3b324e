/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.report;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

public class PeakToMedianScalePolicyTest {

  private final ScalePolicy policy = new PeakToMedianScalePolicy();

  @Test
  public void testNoValues() {
    assertEquals(AxisScale.LINEAR,
        this.policy.choose(Collections.<Long>emptyList()));
    assertEquals(AxisScale.LINEAR, this.policy.choose(Arrays.asList(0L, 0L)));
  }

  @Test
  public void testEvenValues() {
    assertEquals(AxisScale.LINEAR,
        this.policy.choose(Arrays.asList(10L, 12L, 0L, 0L, 15L)));
  }

  @Test
  public void testSingleSpike() {
    assertEquals(AxisScale.SEMILOG,
        this.policy.choose(Arrays.asList(1L, 1L, 0L, 1L, 100L)));
  }

  @Test
  public void testRatioMustBeExceeded() {
    assertEquals(AxisScale.LINEAR,
        this.policy.choose(Arrays.asList(1L, 1L, 10L)));
    assertEquals(AxisScale.SEMILOG,
        this.policy.choose(Arrays.asList(1L, 1L, 11L)));
  }

  @Test
  public void testConfiguredRatio() {
    ScalePolicy strict = new PeakToMedianScalePolicy(2.0);
    assertEquals(AxisScale.SEMILOG,
        strict.choose(Arrays.asList(10L, 12L, 0L, 0L, 30L)));
  }

  @Test
  public void testMedian() {
    assertEquals(2.0, PeakToMedianScalePolicy.median(Arrays.asList(1L, 2L,
        40L)), 0.0);
    assertEquals(2.5, PeakToMedianScalePolicy.median(Arrays.asList(1L, 2L,
        3L, 40L)), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRatioTooSmall() {
    new PeakToMedianScalePolicy(1.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRatioNotANumber() {
    new PeakToMedianScalePolicy(Double.NaN);
  }
}

/* Copyright 2016--2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.conf;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Enum containing all the properties keys of the configuration.
 * Specifies the key type.
 */
public enum Key {

  StatsTarget(String.class),
  FragmentPath(Path.class),
  AggregatePath(Path.class),
  ReportDataPath(Path.class),
  ArchivePath(Path.class),
  RollingWindowDays(Integer.class),
  EventTimeZone(String.class),
  SemilogPeakToMedianRatio(Double.class),
  TopListLimit(Integer.class),
  PruneFragments(Boolean.class),
  ArchivePrunedFragments(Boolean.class);

  private Class clazz;
  private static Set<String> keys;

  /**
   * Instantiate a new {@code Key} using the given class for the key value.
   *
   * @param clazz Class of key value.
   */
  Key(Class clazz) {
    this.clazz = clazz;
  }

  public Class keyClass() {
    return clazz;
  }

  /** Verifies, if the given string corresponds to an enum value. */
  public static boolean has(String someKey) {
    if (null == keys) {
      keys = new HashSet<>();
      for (Key key : values()) {
        keys.add(key.name());
      }
    }
    return keys.contains(someKey);
  }

}

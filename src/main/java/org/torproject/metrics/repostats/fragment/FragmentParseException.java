/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.fragment;

/** Thrown when a fragment file cannot be parsed as a whole. */
public class FragmentParseException extends Exception {

  public FragmentParseException(String msg) {
    super(msg);
  }

  public FragmentParseException(String msg, Throwable cause) {
    super(msg, cause);
  }

}

/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.fragment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All parsed fragments of one kind, sorted by capture time ascending.
 *
 * <p>A selection without any fragment is the explicit "no data" marker for
 * its kind, which is different from a selection of fragments that merely
 * contain zero rows.</p>
 *
 * @param <R> Row type of the selected kind.
 */
public final class FragmentSelection<R> {

  private final FragmentKind kind;

  private final List<Fragment<R>> fragments;

  /** Create a selection of fragments of the given kind. */
  public FragmentSelection(FragmentKind kind, List<Fragment<R>> fragments) {
    this.kind = kind;
    List<Fragment<R>> sorted = new ArrayList<>(fragments);
    sorted.sort((first, second)
        -> first.getCapturedAt().compareTo(second.getCapturedAt()));
    this.fragments = Collections.unmodifiableList(sorted);
  }

  public FragmentKind getKind() {
    return this.kind;
  }

  public List<Fragment<R>> getFragments() {
    return this.fragments;
  }

  /** Whether no fragment of this kind was found at all. */
  public boolean isAbsent() {
    return this.fragments.isEmpty();
  }

  /** Whether fragments were found but none of them contains a row. */
  public boolean isEmptyButObserved() {
    if (this.fragments.isEmpty()) {
      return false;
    }
    for (Fragment<R> fragment : this.fragments) {
      if (!fragment.isEmpty()) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return this.kind + " " + this.fragments;
  }
}

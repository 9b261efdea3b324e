/* Copyright 2017--2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.fragment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Discovers fragment files below a directory and parses them on demand.
 *
 * <p>Iterating over a store walks the directory again and yields parsed
 * fragments sorted by capture time ascending, so that the sequence is finite,
 * lazy, and restartable. Files that are not fragments are ignored, and
 * fragments that cannot be parsed are skipped with a warning.</p>
 */
public class FragmentStore implements Iterable<Fragment<?>> {

  private static final Logger log
      = LoggerFactory.getLogger(FragmentStore.class);

  private static final Comparator<FragmentMetadata> byCaptureTime
      = Comparator.<FragmentMetadata, Instant>comparing(
          metadata -> metadata.capturedAt)
      .thenComparing(metadata -> metadata.path);

  private final Path startDir;

  private final FragmentReader reader;

  /** Create a store for the given directory. */
  public FragmentStore(Path startDir, FragmentReader reader) {
    this.startDir = startDir;
    this.reader = reader;
  }

  /** Return metadata of all fragment files, sorted by capture time. */
  public List<FragmentMetadata> listFragments() {
    final List<FragmentMetadata> found = new ArrayList<>();
    if (!Files.isDirectory(this.startDir)) {
      log.info("Fragment directory '{}' does not exist (yet).", this.startDir);
      return found;
    }
    try {
      Files.walkFileTree(this.startDir, new SimpleFileVisitor<Path>() {
        @Override
        public FileVisitResult visitFile(Path path, BasicFileAttributes att) {
          String name = path.getFileName().toString();
          if (!name.startsWith(".") && !name.endsWith(".tmp")) {
            Optional<FragmentMetadata> optionalMetadata
                = FragmentMetadata.create(path);
            optionalMetadata.ifPresent(found::add);
          }
          return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path path, IOException ex) {
          return logIfError(path, ex);
        }

        @Override
        public FileVisitResult postVisitDirectory(Path path, IOException ex) {
          return logIfError(path, ex);
        }

        private FileVisitResult logIfError(Path path, IOException ex) {
          if (null != ex) {
            log.warn("Cannot process '{}'.", path, ex);
          }
          return FileVisitResult.CONTINUE;
        }
      });
    } catch (IOException ex) {
      log.error("Cannot read directory '{}'.", this.startDir, ex);
    }
    found.sort(byCaptureTime);
    return found;
  }

  @Override
  public Iterator<Fragment<?>> iterator() {
    return new ParsingIterator(this.listFragments().iterator());
  }

  /**
   * Parse all fragments of the given kind.
   *
   * @param kind Fragment kind to select.
   * @param rowType Row type of that kind, which must match
   *     {@link FragmentKind#rowType()}.
   * @return Selection of parsed fragments, which is absent if none were found.
   */
  @SuppressWarnings("unchecked")
  public <R> FragmentSelection<R> select(FragmentKind kind, Class<R> rowType) {
    if (!kind.rowType().equals(rowType)) {
      throw new IllegalArgumentException("Rows of " + kind + " are of type "
          + kind.rowType().getSimpleName() + ".");
    }
    List<FragmentMetadata> ofKind = new ArrayList<>();
    for (FragmentMetadata metadata : this.listFragments()) {
      if (metadata.kind == kind) {
        ofKind.add(metadata);
      }
    }
    List<Fragment<R>> selected = new ArrayList<>();
    Iterator<Fragment<?>> parsed = new ParsingIterator(ofKind.iterator());
    while (parsed.hasNext()) {
      selected.add((Fragment<R>) parsed.next());
    }
    log.info("Found {} usable {} fragment(s) in '{}'.", selected.size(), kind,
        this.startDir);
    return new FragmentSelection<>(kind, selected);
  }

  /** Iterator parsing one fragment at a time and skipping broken ones. */
  private class ParsingIterator implements Iterator<Fragment<?>> {

    private final Iterator<FragmentMetadata> pending;

    private Fragment<?> next;

    ParsingIterator(Iterator<FragmentMetadata> pending) {
      this.pending = pending;
    }

    @Override
    public boolean hasNext() {
      while (null == this.next && this.pending.hasNext()) {
        FragmentMetadata metadata = this.pending.next();
        try {
          this.next = reader.read(metadata);
        } catch (FragmentParseException e) {
          log.warn("Skipping malformed fragment {}: {}", metadata,
              e.getMessage());
        }
      }
      return null != this.next;
    }

    @Override
    public Fragment<?> next() {
      if (!this.hasNext()) {
        throw new NoSuchElementException();
      }
      Fragment<?> result = this.next;
      this.next = null;
      return result;
    }
  }
}

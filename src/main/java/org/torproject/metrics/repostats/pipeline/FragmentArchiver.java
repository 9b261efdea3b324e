/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.pipeline;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.xz.XZCompressorOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collection;

/**
 * Packs fragments into one {@code .tar.xz} tarball before they are deleted.
 */
public class FragmentArchiver {

  private static final Logger logger
      = LoggerFactory.getLogger(FragmentArchiver.class);

  private static final DateTimeFormatter tarballNameFormatter
      = DateTimeFormatter.ofPattern("'fragments-'uuuu-MM-dd-HH-mm-ss'.tar.xz'")
      .withZone(ZoneOffset.UTC);

  private final Path archiveDir;

  public FragmentArchiver(Path archiveDir) {
    this.archiveDir = archiveDir;
  }

  /**
   * Write the given files into a new tarball named after the given time and
   * return its path.
   */
  public Path archive(Collection<Path> files, Instant now) throws IOException {
    Files.createDirectories(this.archiveDir);
    Path tarball = this.archiveDir.resolve(tarballNameFormatter.format(now));
    Path tmpPath = tarball.resolveSibling(tarball.getFileName() + ".tmp");
    try (TarArchiveOutputStream taos = new TarArchiveOutputStream(
        new XZCompressorOutputStream(new BufferedOutputStream(
        Files.newOutputStream(tmpPath))))) {
      taos.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
      for (Path file : files) {
        byte[] bytes = Files.readAllBytes(file);
        TarArchiveEntry tae = new TarArchiveEntry(
            file.getFileName().toString());
        tae.setSize(bytes.length);
        tae.setModTime(Files.getLastModifiedTime(file).toMillis());
        taos.putArchiveEntry(tae);
        taos.write(bytes);
        taos.closeArchiveEntry();
      }
    }
    Files.move(tmpPath, tarball, StandardCopyOption.REPLACE_EXISTING);
    logger.info("Archived {} fragment(s) in '{}'.", files.size(), tarball);
    return tarball;
  }
}

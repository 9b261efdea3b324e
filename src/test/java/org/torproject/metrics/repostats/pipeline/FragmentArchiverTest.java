/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.pipeline;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.xz.XZCompressorInputStream;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;

public class FragmentArchiverTest {

  @Rule
  public TemporaryFolder tmpf = new TemporaryFolder();

  @Test
  public void testArchive() throws Exception {
    Path fragmentDir = tmpf.newFolder("fragments").toPath();
    Path first = fragmentDir.resolve(
        "2021-01-14_120000_views_clones_series_fragment.csv");
    Path second = fragmentDir.resolve("2021-01-15_120000_forks_snapshot.csv");
    Files.write(first, "a\n".getBytes(StandardCharsets.UTF_8));
    Files.write(second, "bc\n".getBytes(StandardCharsets.UTF_8));
    Path archiveDir = tmpf.getRoot().toPath().resolve("archive");
    Path tarball = new FragmentArchiver(archiveDir).archive(
        Arrays.asList(first, second), Instant.parse("2021-01-16T03:04:05Z"));
    assertEquals(archiveDir.resolve("fragments-2021-01-16-03-04-05.tar.xz"),
        tarball);
    assertFalse(Files.exists(archiveDir.resolve(
        "fragments-2021-01-16-03-04-05.tar.xz.tmp")));
    assertTrue(Files.exists(first));
    try (TarArchiveInputStream tais = new TarArchiveInputStream(
        new XZCompressorInputStream(Files.newInputStream(tarball)))) {
      TarArchiveEntry entry = tais.getNextTarEntry();
      assertEquals(first.getFileName().toString(), entry.getName());
      ByteArrayOutputStream baos = new ByteArrayOutputStream();
      byte[] buffer = new byte[64];
      int read;
      while ((read = tais.read(buffer)) >= 0) {
        baos.write(buffer, 0, read);
      }
      assertEquals("a\n", new String(baos.toByteArray(),
          StandardCharsets.UTF_8));
      entry = tais.getNextTarEntry();
      assertEquals(second.getFileName().toString(), entry.getName());
      assertEquals(3L, entry.getSize());
      assertNull(tais.getNextTarEntry());
    }
  }
}

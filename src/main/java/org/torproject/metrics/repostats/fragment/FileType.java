/* Copyright 2017--2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.fragment;

import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.xz.XZCompressorInputStream;

import java.io.IOException;
import java.io.InputStream;

/**
 * Compression types of fragment files, determined by their file extension.
 */
public enum FileType {

  PLAIN(""),
  GZ("gz"),
  XZ("xz"),
  BZ2("bz2");

  private final String extension;

  FileType(String extension) {
    this.extension = extension;
  }

  /**
   * Return the type for the given file extension (case insensitive), or
   * {@link #PLAIN} for a missing or unknown extension.
   */
  public static FileType findType(String ext) {
    if (null == ext || ext.isEmpty()) {
      return PLAIN;
    }
    for (FileType fileType : values()) {
      if (fileType.extension.equalsIgnoreCase(ext)) {
        return fileType;
      }
    }
    return PLAIN;
  }

  /** Wrap the given stream to decompress its contents. */
  public InputStream decompress(InputStream is) throws IOException {
    switch (this) {
      case GZ:
        return new GzipCompressorInputStream(is, true);
      case XZ:
        return new XZCompressorInputStream(is, true);
      case BZ2:
        return new BZip2CompressorInputStream(is, true);
      default:
        return is;
    }
  }
}

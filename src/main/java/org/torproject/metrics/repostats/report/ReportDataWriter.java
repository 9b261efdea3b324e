/* Copyright 2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.report;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/** Writes {@code report-data.json} for the report renderer. */
public class ReportDataWriter {

  private static final Logger logger
      = LoggerFactory.getLogger(ReportDataWriter.class);

  private static final ObjectMapper objectMapper = new ObjectMapper()
      .setPropertyNamingStrategy(PropertyNamingStrategy.SNAKE_CASE)
      .setSerializationInclusion(JsonInclude.Include.NON_NULL)
      .setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE)
      .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);

  /**
   * Write the given report data to a temporary file next to the given path
   * and move it into place.
   */
  public void write(ReportData data, Path reportDataPath) throws IOException {
    Path parent = reportDataPath.toAbsolutePath().getParent();
    if (null != parent) {
      Files.createDirectories(parent);
    }
    Path tmpPath = reportDataPath.resolveSibling(
        reportDataPath.getFileName() + ".tmp");
    try (OutputStream os = Files.newOutputStream(tmpPath)) {
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(os, data);
    }
    Files.move(tmpPath, reportDataPath, StandardCopyOption.REPLACE_EXISTING);
    logger.info("Wrote report data to '{}'.", reportDataPath);
  }
}

/* Copyright 2016--2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats;

import org.torproject.metrics.repostats.conf.Configuration;
import org.torproject.metrics.repostats.conf.ConfigurationException;
import org.torproject.metrics.repostats.pipeline.AggregationPipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Main class for running one aggregation.
 * <br>
 * Run without arguments in order to read the usage information, i.e.
 * <br>
 * <code>java -jar repostats-aggregator.jar</code>
 */
public class Main {

  private static final Logger log = LoggerFactory.getLogger(Main.class);

  public static final String CONF_FILE = "repostats.properties";

  /** Exit code for configuration errors. */
  static final int CONFIGURATION_ERROR = 1;

  /**
   * At most one argument.
   * See class description {@link Main}.
   */
  public static void main(String[] args) {
    int exitCode = run(args);
    if (0 != exitCode) {
      System.exit(exitCode);
    }
  }

  /**
   * Run once with the given arguments and return the exit code.
   */
  public static int run(String[] args) {
    Path confPath;
    if (args == null || args.length == 0) {
      confPath = Paths.get(CONF_FILE);
    } else if (args.length == 1) {
      confPath = Paths.get(args[0]);
    } else {
      printUsage("The aggregator takes at most one argument.");
      return CONFIGURATION_ERROR;
    }
    if (!confPath.toFile().exists() || confPath.toFile().length() < 1L) {
      writeDefaultConfig(confPath);
      return 0;
    }
    try {
      Configuration conf = new Configuration();
      conf.loadAndCheckConfiguration(confPath);
      new AggregationPipeline(conf).run();
      return 0;
    } catch (ConfigurationException ce) {
      printUsage(ce.getMessage());
      return CONFIGURATION_ERROR;
    } catch (AggregationException ae) {
      log.error("Aggregation failed.", ae);
      System.err.println(ae.getMessage());
      return ae.exitCode();
    }
  }

  private static void printUsage(String msg) {
    final String usage = "Usage:\njava -jar repostats-aggregator.jar "
        + "[path/to/configFile]";
    System.out.println(msg + "\n" + usage);
  }

  private static void writeDefaultConfig(Path confPath) {
    try (InputStream is = Main.class.getClassLoader()
        .getResourceAsStream(CONF_FILE)) {
      Files.copy(is, confPath, StandardCopyOption.REPLACE_EXISTING);
      printUsage("Could not find config file. A default configuration was "
          + "written to " + confPath + ", which reads fragments from and "
          + "writes aggregates and report data to directories relative to "
          + "the working directory. Change the configuration ("
          + CONF_FILE + ") as needed and run again.");
    } catch (IOException e) {
      log.error("Cannot write default configuration. Reason: " + e, e);
      throw new RuntimeException(e);
    }
  }

}

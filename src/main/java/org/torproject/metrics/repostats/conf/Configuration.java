/* Copyright 2016--2021 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.repostats.conf;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Properties;

/**
 * Initialize configuration with defaults from repostats.properties,
 * unless a configuration properties file is available.
 */
public class Configuration {

  private final Properties props = new Properties();

  /**
   * Load the configuration from the given path.
   */
  public void loadAndCheckConfiguration(Path confPath) throws
      ConfigurationException {
    try (FileInputStream fis
             = new FileInputStream(confPath.toFile())) {
      this.props.load(fis);
      requiredPathsGiven();
    } catch (IOException e) {
      throw new ConfigurationException("Cannot load configuration file. "
          + "Reason: " + e.getMessage(), e);
    }
  }

  private void requiredPathsGiven() throws ConfigurationException {
    for (Key key : new Key[] { Key.FragmentPath, Key.AggregatePath,
        Key.ReportDataPath }) {
      String value = this.props.getProperty(key.name());
      if (null == value || value.trim().isEmpty()) {
        throw new ConfigurationException("Property " + key + " is not set!\n"
            + "Please edit repostats.properties. Exiting.");
      }
    }
  }

  /** Return a copy of all properties. */
  public Properties getPropertiesCopy() {
    return (Properties) props.clone();
  }

  /**
   * Loads properties from the given stream.
   */
  public void load(InputStream fis) throws IOException {
    props.load(fis);
  }

  /** Retrieves the value for key. */
  public String getProperty(String key) {
    return props.getProperty(key);
  }

  /** Sets the value for key. */
  public void setProperty(String key, String value) {
    props.setProperty(key, value);
  }

  /** clears all properties. */
  public void clear() {
    props.clear();
  }

  /** Count of properties. */
  public int size() {
    return props.size();
  }

  private void checkClass(Key key, Class clazz) {
    if (!key.keyClass().getSimpleName().equals(clazz.getSimpleName())) {
      throw new RuntimeException("Wrong type wanted! My class is "
          + key.keyClass().getSimpleName());
    }
  }

  /** Returns a {@code String} property, e.g. {@code StatsTarget = a/b}. */
  public String getString(Key key) throws ConfigurationException {
    try {
      checkClass(key, String.class);
      String prop = props.getProperty(key.name());
      if (null == prop) {
        throw new RuntimeException("missing value");
      }
      return prop.trim();
    } catch (RuntimeException re) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + re.getMessage(), re);
    }
  }

  /**
   * Returns a {@code boolean} property (case insensitiv), e.g.
   * {@code propertyOne = True}.
   */
  public boolean getBool(Key key) throws ConfigurationException {
    try {
      checkClass(key, Boolean.class);
      return Boolean.parseBoolean(props.getProperty(key.name()));
    } catch (RuntimeException re) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + re.getMessage(), re);
    }
  }

  /**
   * Parse an integer property and translate the String
   * {@code "inf"} into Integer.MAX_VALUE.
   * Verifies that this enum is a Key for an integer value.
   */
  public int getInt(Key key) throws ConfigurationException {
    try {
      checkClass(key, Integer.class);
      String prop = props.getProperty(key.name());
      if ("inf".equals(prop)) {
        return Integer.MAX_VALUE;
      } else {
        return Integer.parseInt(prop.trim());
      }
    } catch (RuntimeException re) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + re.getMessage(), re);
    }
  }

  /**
   * Parse a floating point property.
   * Verifies that this enum is a Key for a Double value.
   */
  public double getDouble(Key key) throws ConfigurationException {
    try {
      checkClass(key, Double.class);
      return Double.parseDouble(props.getProperty(key.name()).trim());
    } catch (RuntimeException re) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + re.getMessage(), re);
    }
  }

  /**
   * Returns a {@code Path} property, e.g.
   * {@code pathProperty = /my/path/file}.
   */
  public Path getPath(Key key) throws ConfigurationException {
    try {
      checkClass(key, Path.class);
      return Paths.get(props.getProperty(key.name()).trim());
    } catch (RuntimeException re) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + re.getMessage(), re);
    }
  }

  /**
   * Returns a time zone given as {@code String} property, e.g.
   * {@code EventTimeZone = Europe/Berlin}.
   */
  public ZoneId getZoneId(Key key) throws ConfigurationException {
    try {
      return ZoneId.of(this.getString(key));
    } catch (DateTimeException dte) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + dte.getMessage(), dte);
    }
  }

}

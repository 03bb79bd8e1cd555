/* Copyright 2016--2024 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.logsync.conf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Initialize configuration with defaults from logsync.properties,
 * unless a configuration properties file is available.
 */
public class Configuration {

  private static final Logger logger = LoggerFactory.getLogger(
      Configuration.class);

  public static final String FIELDSEP = ",";

  private final Properties props = new Properties();

  /**
   * Load the configuration from the given path.
   */
  public void loadAndCheckConfiguration(Path confPath) throws
      ConfigurationException {
    try (FileInputStream fis
             = new FileInputStream(confPath.toFile())) {
      this.props.load(fis);
    } catch (IOException e) {
      throw new ConfigurationException("Cannot load configuration file. "
          + "Reason: " + e.getMessage(), e);
    }
    this.check();
  }

  /**
   * Verify that the properties needed for talking to the Logs API are present
   * and warn about windows that are too short to ever archive a date.
   */
  public void check() throws ConfigurationException {
    String token = this.props.getProperty(Key.Token.name());
    if (null == token || token.trim().isEmpty()) {
      throw new ConfigurationException("No Logs API token configured!\n"
          + "Please edit logsync.properties. Exiting.");
    }
    if (this.getStringArray(Key.AppIds).length == 0) {
      throw new ConfigurationException("No application ids configured!\n"
          + "Please edit logsync.properties. Exiting.");
    }
    int updateLimitDays = this.getInt(Key.UpdateLimitDays);
    int freshLimitDays = this.getInt(Key.FreshLimitDays);
    if (updateLimitDays < freshLimitDays) {
      logger.warn("{} ({}) is smaller than {} ({}); dates will leave the "
          + "update window before they are ever archived.",
          Key.UpdateLimitDays, updateLimitDays, Key.FreshLimitDays,
          freshLimitDays);
    }
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

  /** Retrieves the value for key returning a default for non-existing keys. */
  public String getProperty(String key, String def) {
    return props.getProperty(key, def);
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

  /**
   * Returns {@code String[]} from a property. Commas seperate array elements,
   * e.g.,
   * {@code propertyname = a1, a2, a3}
   *
   * <p>Blank elements are dropped, so that a missing or empty property yields
   * an empty array.</p>
   */
  public String[] getStringArray(Key key) throws ConfigurationException {
    try {
      checkClass(key, String[].class);
      String prop = props.getProperty(key.name());
      List<String> res = new ArrayList<>();
      if (null != prop) {
        for (String element : prop.split(FIELDSEP)) {
          if (!element.trim().isEmpty()) {
            res.add(element.trim());
          }
        }
      }
      return res.toArray(new String[0]);
    } catch (RuntimeException re) {
      throw corrupt(key, re);
    }
  }

  private static ConfigurationException corrupt(Key key, Exception ex) {
    return new ConfigurationException("Corrupt property: " + key
        + " reason: " + ex.getMessage(), ex);
  }

  private void checkClass(Key key, Class clazz) {
    if (!key.keyClass().getSimpleName().equals(clazz.getSimpleName())) {
      throw new RuntimeException("Wrong type wanted! My class is "
          + key.keyClass().getSimpleName());
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
      throw corrupt(key, re);
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
      String prop = props.getProperty(key.name()).trim();
      return "inf".equals(prop) ? Integer.MAX_VALUE : Integer.parseInt(prop);
    } catch (RuntimeException re) {
      throw corrupt(key, re);
    }
  }

  /**
   * Parse a long property.
   * Verifies that this enum is a Key for a Long value.
   */
  public long getLong(Key key) throws ConfigurationException {
    try {
      checkClass(key, Long.class);
      String prop = props.getProperty(key.name());
      return Long.parseLong(prop.trim());
    } catch (RuntimeException re) {
      throw corrupt(key, re);
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
      throw corrupt(key, re);
    }
  }

  /**
   * Returns a {@code URL} property, e.g.
   * {@code urlProperty = https://my.url.here}.
   */
  public URL getUrl(Key key) throws ConfigurationException {
    try {
      checkClass(key, URL.class);
      return new URL(props.getProperty(key.name()).trim());
    } catch (MalformedURLException | RuntimeException mue) {
      throw corrupt(key, mue);
    }
  }

}

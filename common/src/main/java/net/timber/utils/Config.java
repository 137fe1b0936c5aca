// This file is part of Timber.
// Copyright (C) 2026  The Timber Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.timber.utils;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableMap;

import net.timber.storage.DataLocation;

/**
 * Client configuration.
 * <p>
 * On initialization default values are set for every key. Callers may then
 * search for a {@code configuration.properties} file with
 * {@link #Config(boolean)} or load a given file with {@link #Config(String)}.
 * Values loaded from a file win over the defaults. The file is a standard
 * Java properties file, shared with the other logging service clients:
 * <pre>
 * APPLICATION_NAME=LHC_MD_ABP_ANALYSIS
 * CLIENT_NAME=BEAM PHYSICS
 * timber.source=all
 * </pre>
 * {@link #getBoolean(String)} throws a NullPointerException if the property
 * is missing.
 * @since 1.0
 */
public class Config {
  private static final Logger LOG = LoggerFactory.getLogger(Config.class);

  /** The application name registered with the logging service. */
  public static final String APPLICATION_NAME = "APPLICATION_NAME";

  /** The client name registered with the logging service. */
  public static final String CLIENT_NAME = "CLIENT_NAME";

  /** Which archive to read: mdb, ldb or all. */
  public static final String SOURCE = "timber.source";

  /** The zone used for calendar strings and calendar output. */
  public static final String TIMEZONE = "timber.timezone";

  /** Whether timestamps are returned as epoch seconds by default. */
  public static final String UNIXTIME = "timber.unixtime";

  /** The file name searched for by {@link #loadConfig()}. */
  public static final String FILE_NAME = "configuration.properties";

  /**
   * The list of properties configured to their defaults or modified by users
   */
  protected final HashMap<String, String> properties =
    new HashMap<String, String>();

  /** Holds default values for the config */
  protected static final HashMap<String, String> default_map =
    new HashMap<String, String>();

  /** Tracks the location of the file that was actually loaded */
  protected String config_location;

  /**
   * Constructor that initializes default configuration values. May attempt to
   * search for a config file if configured.
   * @param auto_load_config When set to true, attempts to search for a config
   *          file in the default locations
   * @throws IOException Thrown if unable to read or parse one of the default
   *           config files
   */
  public Config(final boolean auto_load_config) throws IOException {
    if (auto_load_config) {
      loadConfig();
    }
    setDefaults();
  }

  /**
   * Constructor that initializes default values and attempts to load the given
   * properties file
   * @param file Path to the file to load
   * @throws IOException Thrown if unable to read or parse the file
   */
  public Config(final String file) throws IOException {
    loadConfig(file);
    setDefaults();
  }

  /**
   * Copy constructor. Changes to the copy do not affect the parent.
   * @param parent Parent configuration object to load from
   */
  public Config(final Config parent) {
    properties.putAll(parent.properties);
    config_location = parent.config_location;
    setDefaults();
  }

  /**
   * Creates a new Config with the default values only.
   */
  public Config() {
    setDefaults();
  }

  /** @return The file that generated this config. May be null */
  public String configLocation() {
    return config_location;
  }

  /**
   * Allows for modifying properties after creation.
   * @param property The name of the property to override
   * @param value The value to store
   */
  public void overrideConfig(final String property, final String value) {
    properties.put(property, value);
  }

  /**
   * Returns the given property as a String
   * @param property The property to load
   * @return The property value as a string, null if it did not exist
   */
  public final String getString(final String property) {
    return properties.get(property);
  }

  /**
   * Returns the given property as a boolean
   *
   * Property values are case insensitive and the following values will result
   * in a True return value: - 1 - True - Yes
   *
   * Any other values, including an empty string, will result in a False
   *
   * @param property The property to load
   * @return A parsed boolean
   * @throws NullPointerException if the property was not found
   */
  public final boolean getBoolean(final String property) {
    final String val = properties.get(property).trim().toUpperCase();
    if (val.equals("1"))
      return true;
    if (val.equals("TRUE"))
      return true;
    if (val.equals("YES"))
      return true;
    return false;
  }

  /** @return The application name. */
  public String applicationName() {
    return getString(APPLICATION_NAME);
  }

  /** @return The client name. */
  public String clientName() {
    return getString(CLIENT_NAME);
  }

  /**
   * @return The archive to read from.
   * @throws IllegalArgumentException if the configured source is unknown.
   */
  public DataLocation dataLocation() {
    final DataLocation location = DataLocation.fromString(getString(SOURCE));
    if (location == null) {
      throw new IllegalArgumentException("Invalid " + SOURCE + " '"
          + getString(SOURCE) + "', must be one of mdb, ldb or all");
    }
    return location;
  }

  /**
   * @return The configured zone.
   * @throws IllegalArgumentException if the zone id is invalid.
   */
  public ZoneId timezone() {
    try {
      return ZoneId.of(sanitize(getString(TIMEZONE)));
    } catch (DateTimeException e) {
      throw new IllegalArgumentException("Invalid " + TIMEZONE + " '"
          + getString(TIMEZONE) + "'", e);
    }
  }

  /** @return Whether timestamps are returned as epoch seconds by default. */
  public boolean unixtime() {
    return getBoolean(UNIXTIME);
  }

  /**
   * Returns a simple string with the configured properties for debugging
   * @return A string with information about the config
   */
  public final String dumpConfiguration() {
    if (properties.isEmpty())
      return "No configuration settings stored";

    StringBuilder response = new StringBuilder("Timber Configuration:\n");
    response.append("File [" + config_location + "]\n");
    int line = 0;
    for (Map.Entry<String, String> entry : properties.entrySet()) {
      if (line > 0) {
        response.append("\n");
      }
      response.append("Key [" + entry.getKey() + "]  Value [");
      if (entry.getKey().toUpperCase().contains("PASS")) {
         response.append("********");
      } else {
        response.append(entry.getValue());
      }
      response.append("]");
      line++;
    }
    return response.toString();
  }

  /** @return An immutable copy of the configuration map */
  public final Map<String, String> getMap() {
    return ImmutableMap.copyOf(properties);
  }

  /**
   * Loads default entries that were not provided by a file or command line
   *
   * This should be called in the constructor
   */
  protected void setDefaults() {
    default_map.put(APPLICATION_NAME, "LHC_MD_ABP_ANALYSIS");
    default_map.put(CLIENT_NAME, "BEAM PHYSICS");
    default_map.put(SOURCE, "all");
    default_map.put(TIMEZONE, ZoneId.systemDefault().getId());
    default_map.put(UNIXTIME, "true");

    for (Map.Entry<String, String> entry : default_map.entrySet()) {
      if (!properties.containsKey(entry.getKey()))
        properties.put(entry.getKey(), entry.getValue());
    }
  }

  /**
   * Searches a list of locations for a valid configuration file
   *
   * The locations are, in order: ./configuration.properties and
   * ~/.timber/configuration.properties. If none of the locations have a
   * config file, then the defaults will be used.
   *
   * @throws IOException Thrown if there was an issue reading a file
   */
  protected void loadConfig() throws IOException {
    if (config_location != null && !config_location.isEmpty()) {
      loadConfig(config_location);
      return;
    }

    final ArrayList<String> file_locations = new ArrayList<String>();
    file_locations.add(FILE_NAME);
    file_locations.add(System.getProperty("user.home") + File.separator
        + ".timber" + File.separator + FILE_NAME);

    for (String file : file_locations) {
      try (final FileInputStream file_stream = new FileInputStream(file)) {
        Properties props = new Properties();
        props.load(file_stream);
        loadHashMap(props);
      } catch (Exception e) {
        // the file may be missing and that's fine
        LOG.debug("Unable to find or load " + file, e);
        continue;
      }

      LOG.info("Successfully loaded configuration file: " + file);
      config_location = file;
      return;
    }

    LOG.info("No configuration found, will use defaults");
  }

  /**
   * Attempts to load the configuration from the given location
   * @param file Path to the file to load
   * @throws IOException Thrown if there was an issue reading the file
   * @throws FileNotFoundException Thrown if the config file was not found
   */
  protected void loadConfig(final String file) throws FileNotFoundException,
      IOException {
    final FileInputStream file_stream = new FileInputStream(file);
    try {
      final Properties props = new Properties();
      props.load(file_stream);
      loadHashMap(props);
      LOG.info("Successfully loaded configuration file: " + file);
      config_location = file;
    } finally {
      file_stream.close();
    }
  }

  /**
   * Returns the given string trimed or null if is null
   * @param string The string be trimmed of
   * @return The string trimed or null
   */
  private final String sanitize(final String string) {
    if (string == null) {
      return null;
    }
    return string.trim();
  }

  /**
   * Called from {@link #loadConfig} to copy the properties into the hash map
   * @param props The loaded Properties object to copy
   */
  private void loadHashMap(final Properties props) {
    properties.clear();

    @SuppressWarnings("rawtypes")
    Enumeration e = props.propertyNames();
    while (e.hasMoreElements()) {
      String key = (String) e.nextElement();
      properties.put(key, props.getProperty(key));
    }
  }
}

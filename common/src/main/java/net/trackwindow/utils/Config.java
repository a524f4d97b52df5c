// This file is part of TrackWindow.
// Copyright (C) 2019  The TrackWindow Authors.
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
package net.trackwindow.utils;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TrackWindow Configuration Class
 * <p>
 * Holds the tunables of the track controllers. On initialization default
 * values are configured for all variables. Callers can then search for a
 * default configuration file or load one from a stream.
 * <p>
 * To add a configuration, set a default value in {@link #setDefaults()} and
 * add a key constant. Wherever you need the value, use the typed helper.
 * <p>
 * The get&lt;type&gt; number helpers throw a NumberFormatException if the
 * requested property is missing or unparseable.
 */
public class Config {
  private static final Logger LOG = LoggerFactory.getLogger(Config.class);

  /** Row count at which a fetched window is considered saturated. */
  public static final String WINDOW_LIMIT_KEY = "trackwindow.window.limit";

  /** Resolution (ns per pixel) used when the requested one isn't a power of 2. */
  public static final String DEFAULT_RESOLUTION_KEY =
      "trackwindow.resolution.default";

  /** Minimum source rows before a pre-aggregated cache table is worthwhile. */
  public static final String CACHE_MIN_ROWS_KEY = "trackwindow.cache.min_rows";

  /** Worst case horizontal pixel count of the viewport. */
  public static final String CACHE_VIEWPORT_PIXELS_KEY =
      "trackwindow.cache.viewport_pixels";

  /** How many resolution levels below the outermost one a cache must serve. */
  public static final String CACHE_LEVELS_COVERED_KEY =
      "trackwindow.cache.levels_covered";

  /** Resolution (ns per pixel) from which tracks should summarize. */
  public static final String SUMMARIZE_MIN_RESOLUTION_KEY =
      "trackwindow.summarize.min_resolution";

  /** The name of the config file searched for in the default locations. */
  public static final String CONFIG_FILE_NAME = "trackwindow.conf";

  /**
   * The list of properties configured to their defaults or modified by users
   */
  protected final Properties properties = new Properties();

  /** Tracks the location of the file that was actually loaded */
  private String config_location;

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
   * Constructor for components that want a copy of the parent properties
   * without the ability to modify them.
   * @param parent Parent configuration object to load from
   */
  public Config(final Config parent) {
    if (parent == null) {
      throw new IllegalArgumentException("Parent config cannot be null.");
    }
    properties.putAll(parent.properties);
    config_location = parent.config_location;
    setDefaults();
  }

  /**
   * Loads properties from a stream, e.g. a class path resource, then fills in
   * the defaults.
   * @param stream A non-null stream in Java properties format.
   * @return The loaded config.
   * @throws IOException If the stream could not be read.
   */
  public static Config fromStream(final InputStream stream) throws IOException {
    if (stream == null) {
      throw new IllegalArgumentException("Stream cannot be null.");
    }
    final Config config = new Config(false);
    config.properties.load(stream);
    config.setDefaults();
    return config;
  }

  /**
   * Allows for modifying properties after loading
   * <p>
   * This should only be used on initialization and is meant for command
   * line or test overrides.
   *
   * @param property The name of the property to override
   * @param value The value to store
   */
  public void overrideConfig(final String property, final String value) {
    properties.put(property, value);
  }

  /**
   * Returns the given property as a String
   * @param property The property to load
   * @return The property value as a string or null if it doesn't exist.
   */
  public final String getString(final String property) {
    return properties.getProperty(property);
  }

  /**
   * Returns the given property as an integer
   * @param property The property to load
   * @return A parsed integer
   * @throws NumberFormatException if the property was missing or could not
   * be parsed
   */
  public final int getInt(final String property) {
    return Integer.parseInt(properties.getProperty(property));
  }

  /**
   * Returns the given property as a long
   * @param property The property to load
   * @return A parsed long
   * @throws NumberFormatException if the property was missing or could not
   * be parsed
   */
  public final long getLong(final String property) {
    return Long.parseLong(properties.getProperty(property));
  }

  /** @return The file the config was loaded from, may be null. */
  public String configLocation() {
    return config_location;
  }

  /**
   * Loads default entries that were not provided by a file or command line
   * <p>
   * This should be called in the constructor
   */
  protected void setDefaults() {
    final Map<String, String> map = new HashMap<String, String>();
    map.put(WINDOW_LIMIT_KEY, "10000");
    // bitFloor(1s / 1920px)
    map.put(DEFAULT_RESOLUTION_KEY, "524288");
    // roughly where sorts in the backing store start to become expensive
    map.put(CACHE_MIN_ROWS_KEY, "100000");
    // 4k monitors
    map.put(CACHE_VIEWPORT_PIXELS_KEY, "3840");
    map.put(CACHE_LEVELS_COVERED_KEY, "7");
    // 0.8ms per pixel
    map.put(SUMMARIZE_MIN_RESOLUTION_KEY, "800000");

    for (final Map.Entry<String, String> entry : map.entrySet()) {
      if (!properties.containsKey(entry.getKey())) {
        properties.put(entry.getKey(), entry.getValue());
      }
    }
  }

  /**
   * Searches a list of locations for a valid trackwindow.conf file
   * <p>
   * The config file must be a standard JAVA properties formatted file. If none
   * of the locations have a config file, then the defaults or overrides will
   * be used for the configuration
   * <p>
   * Defaults for Linux based systems are: ./trackwindow.conf
   * /etc/trackwindow.conf /etc/trackwindow/trackwindow.conf
   *
   * @throws IOException Thrown if there was an issue reading a file
   */
  protected void loadConfig() throws IOException {
    final ArrayList<String> file_locations = new ArrayList<String>();

    // search locally first
    file_locations.add(CONFIG_FILE_NAME);
    final String os = System.getProperty("os.name");
    if (os != null && os.toUpperCase().contains("WINDOWS")) {
      file_locations.add("C:\\Program Files\\trackwindow\\" + CONFIG_FILE_NAME);
    } else {
      file_locations.add("/etc/" + CONFIG_FILE_NAME);
      file_locations.add("/etc/trackwindow/" + CONFIG_FILE_NAME);
    }

    for (final String file : file_locations) {
      try (final FileInputStream file_stream = new FileInputStream(file)) {
        properties.clear();
        properties.load(file_stream);
      } catch (FileNotFoundException e) {
        // the file may be missing and that's fine
        LOG.debug("Unable to find " + file);
        continue;
      }

      LOG.info("Successfully loaded configuration file: " + file);
      config_location = file;
      return;
    }

    LOG.info("No configuration found, will use defaults");
  }
}

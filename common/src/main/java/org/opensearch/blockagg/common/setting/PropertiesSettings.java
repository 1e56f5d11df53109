/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.common.setting;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;
import lombok.extern.log4j.Log4j2;

/**
 * {@link Settings} backed by a properties file on the class path. Every key may be overridden by
 * a JVM system property of the same name. Values are parsed once, when the settings are loaded.
 */
@Log4j2
public class PropertiesSettings extends Settings {

  public static final String DEFAULT_RESOURCE = "blockagg.properties";

  public static final String DEFAULT_SORT_BACKEND = "default";

  private final Map<Key, Object> values;

  @VisibleForTesting
  PropertiesSettings(Properties properties) {
    ImmutableMap.Builder<Key, Object> builder = ImmutableMap.builder();
    builder.put(
        Key.SORT_BACKEND,
        read(properties, Key.SORT_BACKEND, Function.identity(), DEFAULT_SORT_BACKEND));
    builder.put(
        Key.DISPATCH_PARALLELISM,
        read(
            properties,
            Key.DISPATCH_PARALLELISM,
            PropertiesSettings::parsePositiveInt,
            Runtime.getRuntime().availableProcessors()));
    builder.put(
        Key.PROGRESS_ENABLED,
        read(properties, Key.PROGRESS_ENABLED, Boolean::parseBoolean, true));
    this.values = builder.build();
  }

  /** Loads {@value #DEFAULT_RESOURCE} from the class path, if present. */
  public static PropertiesSettings load() {
    return load(DEFAULT_RESOURCE);
  }

  /**
   * Loads the given class path resource. A missing resource yields the default values.
   *
   * @param resource class path resource name
   * @return loaded settings
   */
  public static PropertiesSettings load(String resource) {
    Properties properties = new Properties();
    ClassLoader loader = PropertiesSettings.class.getClassLoader();
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in != null) {
        properties.load(in);
        log.info("Loaded block aggregation settings from {}", resource);
      } else {
        log.debug("No {} on the class path, using default settings", resource);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read settings resource " + resource, e);
    }
    return new PropertiesSettings(properties);
  }

  /** Creates settings from explicit values, system properties still take precedence. */
  public static PropertiesSettings of(Map<Key, String> overrides) {
    Properties properties = new Properties();
    overrides.forEach((key, value) -> properties.setProperty(key.getKeyValue(), value));
    return new PropertiesSettings(properties);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T getSettingValue(Key key) {
    return (T) values.get(key);
  }

  private static <T> T read(
      Properties properties, Key key, Function<String, T> parser, T defaultValue) {
    String raw = System.getProperty(key.getKeyValue(), properties.getProperty(key.getKeyValue()));
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return parser.apply(raw.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          String.format("Invalid value [%s] for setting [%s]", raw, key.getKeyValue()), e);
    }
  }

  private static Integer parsePositiveInt(String raw) {
    int value = Integer.parseInt(raw);
    if (value <= 0) {
      throw new IllegalArgumentException("must be positive: " + value);
    }
    return value;
  }
}

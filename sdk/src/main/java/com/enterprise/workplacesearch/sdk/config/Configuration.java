/*
 * Copyright © 2017 Google Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.enterprise.workplacesearch.sdk.config;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.enterprise.workplacesearch.sdk.InvalidConfigurationException;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.rules.TestRule;
import org.junit.runner.Description;
import org.junit.runners.model.Statement;

/**
 * Static factory for connector settings.
 *
 * <p>Settings come from a Java properties file named by {@code -Dconfig=<path>} on the command
 * line (default {@value #CONNECTOR_CONFIG_FILE}); any other {@code -Dkey=value} argument overrides
 * the file. Values are trimmed before parsing.
 *
 * <pre>{@code
 * ConfigValue<Integer> threads = Configuration.getInteger("connector.zoomSyncThreadCount", 5);
 * ConfigValue<String> apiKey = Configuration.getString("enterpriseSearch.apiKey", null);
 * ConfigValue<Instant> start =
 *     Configuration.getValue("connector.startTime", DEFAULT_START, Configuration.INSTANT_PARSER);
 * }</pre>
 *
 * <p>A {@code null} default makes the key required. Values requested before {@link #initConfig}
 * are registered and filled in during initialization. Use {@link ResetConfigRule} and {@link
 * SetupConfigRule} in unit tests.
 */
public class Configuration {
  private static final Logger logger = Logger.getLogger(Configuration.class.getName());
  public static final String CONNECTOR_CONFIG_FILE = "zoom-connector.properties";
  private static final String ARGS_KEY = "-D";
  private static final String ARGS_CONFIGFILE = "config";
  @SuppressWarnings("rawtypes")
  private static final List<ConfigValue> configurations = new ArrayList<>();
  private static final AtomicBoolean initialized = new AtomicBoolean();
  private static Properties loadedConfig;

  private Configuration() {
    throw new AssertionError();
  }

  /**
   * Loads the configuration file named in {@code args} and applies command line overrides.
   *
   * @param args command line arguments
   * @throws IOException if the configuration file can not be read
   */
  public static void initConfig(String[] args) throws IOException {
    checkNotNull(args, "arguments can not be null");
    Properties overrides = parseArgs(args);
    String configFilePath = overrides.getProperty(ARGS_CONFIGFILE, CONNECTOR_CONFIG_FILE);
    File configFile = new File(configFilePath);
    Properties configured = new Properties();
    if (configFile.exists()) {
      try (Reader in =
          new InputStreamReader(new FileInputStream(configFile), StandardCharsets.UTF_8)) {
        configured.load(in);
      }
    } else {
      logger.log(Level.WARNING, "Configuration file {0} not found", configFile.getAbsolutePath());
    }
    configured.putAll(overrides);
    initConfig(configured);
  }

  /**
   * Initializes the configuration from {@code config}.
   *
   * <p>Reloading with identical properties is a no-op; reloading with different ones fails.
   *
   * @throws InvalidConfigurationException if a registered value is missing or malformed
   */
  @SuppressWarnings("rawtypes")
  public static synchronized void initConfig(Properties config) {
    checkNotNull(config, "config can not be null");
    if (initialized.get()) {
      Map<String, String> loaded = flatten(loadedConfig);
      Map<String, String> requested = flatten(config);
      if (loaded.equals(requested)) {
        logger.log(Level.CONFIG, "Attempt to reload config with same values; ignoring.");
        return;
      }
      logger.log(Level.CONFIG, "Properties with different values in the configs: "
          + Maps.difference(loaded, requested).entriesDiffering().keySet());
      checkState(false, "Attempt to reload config with different properties.");
    }
    loadedConfig = config;
    synchronized (configurations) {
      try {
        for (ConfigValue value : configurations) {
          initializeConfigValue(value);
        }
        initialized.set(true);
      } finally {
        if (initialized.get()) {
          configurations.forEach(v -> v.freeze());
        } else {
          configurations.forEach(v -> v.reset());
          loadedConfig = null;
        }
      }
    }
  }

  private static Map<String, String> flatten(Properties p) {
    return p.stringPropertyNames()
        .stream()
        .collect(ImmutableMap.toImmutableMap(name -> name, name -> p.getProperty(name)));
  }

  /** Returns a copy of all loaded properties. */
  public static Properties getConfig() {
    checkState(initialized.get(), "configuration not initialized yet");
    Properties copy = new Properties();
    copy.putAll(loadedConfig);
    return copy;
  }

  public static boolean isInitialized() {
    return initialized.get();
  }

  /** Converts a raw property value to a typed setting. */
  public interface Parser<T> {
    /**
     * @throws InvalidConfigurationException if {@code value} is malformed
     */
    T parse(String value) throws InvalidConfigurationException;
  }

  /** Accepts only "true" and "false", ignoring case. */
  public static final Parser<Boolean> BOOLEAN_PARSER =
      value -> {
        checkArgument(!Strings.isNullOrEmpty(value), "value to parse can not be null or empty.");
        if ("true".equalsIgnoreCase(value)) {
          return true;
        }
        if ("false".equalsIgnoreCase(value)) {
          return false;
        }
        throw new InvalidConfigurationException(
            String.format(
                "Invalid configuration value [%s] for boolean configuration property", value));
      };

  public static final Parser<Integer> INTEGER_PARSER =
      value -> {
        checkArgument(!Strings.isNullOrEmpty(value), "value to parse can not be null or empty.");
        try {
          return Integer.parseInt(value);
        } catch (NumberFormatException e) {
          throw new InvalidConfigurationException(e);
        }
      };

  public static final Parser<String> STRING_PARSER =
      value -> {
        checkNotNull(value, "value to parse can not be null.");
        return value;
      };

  /** RFC-3339 timestamps in UTC, such as {@code 2011-10-12T00:00:00Z}. */
  public static final Parser<Instant> INSTANT_PARSER =
      value -> {
        checkArgument(!Strings.isNullOrEmpty(value), "value to parse can not be null or empty.");
        try {
          return Instant.parse(value);
        } catch (DateTimeParseException e) {
          throw new InvalidConfigurationException(
              String.format("Invalid timestamp [%s], expected format YYYY-MM-DDTHH:MM:SSZ", value),
              e);
        }
      };

  private static class ListParser<T> implements Parser<List<T>> {
    private final Parser<T> valueParser;
    private final String delimiter;

    ListParser(Parser<T> valueParser, String delimiter) {
      this.valueParser = valueParser;
      this.delimiter = delimiter;
    }

    @Override
    public List<T> parse(String value) {
      checkNotNull(value);
      ImmutableList.Builder<T> parsed = ImmutableList.builder();
      Splitter.on(delimiter).trimResults().omitEmptyStrings().split(value)
          .forEach(v -> parsed.add(valueParser.parse(v)));
      return parsed.build();
    }
  }

  /** Boolean setting; {@code null} default makes the key required. */
  public static ConfigValue<Boolean> getBoolean(String configKey, Boolean defaultValue) {
    return getValue(configKey, defaultValue, BOOLEAN_PARSER);
  }

  /** String setting; {@code null} default makes the key required. */
  public static ConfigValue<String> getString(String configKey, String defaultValue) {
    return getValue(configKey, defaultValue, STRING_PARSER);
  }

  /** Integer setting; {@code null} default makes the key required. */
  public static ConfigValue<Integer> getInteger(String configKey, Integer defaultValue) {
    return getValue(configKey, defaultValue, INTEGER_PARSER);
  }

  /**
   * Comma delimited list setting.
   *
   * <pre>{@code
   * ConfigValue<List<String>> objects =
   *     Configuration.getMultiValue("zoom.objects", ALL_TYPES, Configuration.STRING_PARSER);
   * }</pre>
   *
   * @param configKey configuration file parameter key
   * @param defaultValues values used when the key is absent; {@code null} makes it required
   * @param parser parser for each list element
   */
  public static <T> ConfigValue<List<T>> getMultiValue(
      String configKey, List<T> defaultValues, Parser<T> parser) {
    return getValue(configKey, defaultValues, new ListParser<T>(parser, ","));
  }

  /**
   * Setting of any type, parsed by {@code parser}.
   *
   * @param configKey configuration file parameter key
   * @param defaultValue value used when the key is absent; {@code null} makes it required
   * @param parser custom parser for the data type
   */
  public static <T> ConfigValue<T> getValue(String configKey, T defaultValue, Parser<T> parser) {
    ConfigValue<T> toReturn =
        new ConfigValue.Builder<T>()
            .setConfigKey(configKey)
            .setDefaultValue(defaultValue)
            .setParser(parser)
            .build();
    initializeOrRegister(toReturn);
    return toReturn;
  }

  /**
   * Setting without a default. {@link ConfigValue#get} returns {@code null} when the key is
   * absent.
   */
  public static <T> ConfigValue<T> getOptional(String configKey, Parser<T> parser) {
    ConfigValue<T> toReturn =
        new ConfigValue.Builder<T>()
            .setConfigKey(configKey)
            .setOptional()
            .setParser(parser)
            .build();
    initializeOrRegister(toReturn);
    return toReturn;
  }

  @SuppressWarnings("rawtypes")
  private static void initializeOrRegister(ConfigValue toReturn) {
    checkNotNull(toReturn);
    if (initialized.get()) {
      initializeConfigValue(toReturn);
    } else {
      synchronized (configurations) {
        configurations.add(toReturn);
      }
    }
  }

  @SuppressWarnings("rawtypes")
  private static void initializeConfigValue(ConfigValue value) {
    checkState(loadedConfig != null, "loadedConfig not initialized yet");
    String configuredValue =
        Optional.ofNullable(loadedConfig.getProperty(value.getConfigKey()))
            .map(String::trim)
            .orElse(null);
    value.initialize(configuredValue);
    value.freeze();
  }

  /**
   * Throws {@link InvalidConfigurationException} instead of the {@code IllegalArgumentException}
   * of {@code checkArgument()}, so that commands exit without retrying.
   */
  public static void checkConfiguration(boolean condition, String errorMessage) {
    if (!condition) {
      throw new InvalidConfigurationException(errorMessage);
    }
  }

  /** Formatted variant of {@link #checkConfiguration(boolean, String)}. */
  public static void checkConfiguration(
      boolean condition, String errorFormat, Object... errorArgs) {
    if (!condition) {
      throw new InvalidConfigurationException(String.format(errorFormat, errorArgs));
    }
  }

  /** Returns the {@code -Dkey=value} pairs of {@code args}. */
  private static Properties parseArgs(String[] args) {
    Properties props = new Properties();
    for (String arg : args) {
      if (arg.startsWith(ARGS_KEY)) {
        String[] parts = arg.substring(ARGS_KEY.length()).split("=", 2);
        if (parts.length == 2) {
          props.setProperty(parts[0].trim(), parts[1].trim());
        }
      }
    }
    return props;
  }

  private static synchronized void resetConfiguration() {
    synchronized (configurations) {
      configurations.clear();
    }
    initialized.set(false);
    loadedConfig = null;
  }

  /** {@link TestRule} that resets the static {@link Configuration} before each test. */
  public static class ResetConfigRule implements TestRule {
    @Override
    public Statement apply(Statement base, Description description) {
      resetConfiguration();
      return base;
    }
  }

  /**
   * {@link TestRule} for initializing {@link Configuration} from a test.
   *
   * <pre>
   * {@code @Rule public ResetConfigRule resetConfig = new ResetConfigRule(); }
   * {@code @Rule public SetupConfigRule setupConfig = SetupConfigRule.uninitialized(); }
   *
   * {@code @Test public void testSomething() {
   *     Properties config = new Properties();
   *     config.put("connector.batchSize", "10");
   *     setupConfig.initConfig(config);
   *     ...
   *   }
   * }</pre>
   */
  public static class SetupConfigRule implements TestRule {
    private SetupConfigRule() {}

    @Override
    public Statement apply(Statement base, Description description) {
      return base;
    }

    public static SetupConfigRule uninitialized() {
      return new SetupConfigRule();
    }

    /** Initializes {@link Configuration} with {@code properties}. */
    public void initConfig(Properties properties) {
      Set<String> names = properties.stringPropertyNames();
      if (properties.size() != names.size()) {
        throw new IllegalArgumentException("Non-string properties found in config: "
            + Sets.difference(properties.keySet(), names));
      }
      Configuration.initConfig(properties);
    }
  }
}

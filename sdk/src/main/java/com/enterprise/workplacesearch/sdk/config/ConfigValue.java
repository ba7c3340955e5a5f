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
import com.enterprise.workplacesearch.sdk.config.Configuration.Parser;
import com.google.common.base.Strings;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nullable;

/**
 * Holder for a single typed connector setting.
 *
 * <p>Instances are handed out by the {@link Configuration} factory methods. A value registered
 * before {@link Configuration#initConfig} runs is filled in once the properties are loaded; after
 * that {@link #get} returns the parsed value, the default, or throws for a required key that has
 * neither.
 */
public class ConfigValue<T> {
  private final String configKey;
  @Nullable private final T defaultValue;
  private final boolean required;
  private final Parser<T> parser;
  private final AtomicBoolean initialized = new AtomicBoolean();
  private T configuredValue;

  private ConfigValue(Builder<T> builder) {
    configKey = builder.configKey;
    defaultValue = builder.defaultValue;
    required = builder.required;
    parser = builder.parser;
  }

  /**
   * Gets the configured value.
   *
   * @throws IllegalStateException if the configuration is not loaded yet
   */
  public T get() {
    checkState(initialized.get(), "Config key %s not initialized", configKey);
    return configuredValue;
  }

  /** Returns the value used when the key is absent, or {@code null} for required keys. */
  @Nullable
  public T getDefault() {
    return defaultValue;
  }

  public boolean isInitialized() {
    return initialized.get();
  }

  /** The property name this value is read from. */
  public String getConfigKey() {
    return configKey;
  }

  synchronized void initialize(@Nullable String value) {
    if (initialized.get()) {
      return;
    }
    if (Strings.isNullOrEmpty(value)) {
      if (required) {
        throw new InvalidConfigurationException(
            String.format("Required config key %s is missing", configKey));
      }
      configuredValue = defaultValue;
      return;
    }
    try {
      configuredValue = parser.parse(value);
    } catch (InvalidConfigurationException | IllegalArgumentException e) {
      throw new InvalidConfigurationException(
          String.format("Failed to parse value [%s] for config key [%s]", value, configKey), e);
    }
  }

  synchronized void freeze() {
    initialized.set(true);
  }

  synchronized void reset() {
    configuredValue = null;
    initialized.set(false);
  }

  static final class Builder<T> {
    private String configKey;
    private T defaultValue;
    private boolean required = true;
    private Parser<T> parser;

    Builder<T> setConfigKey(String configKey) {
      this.configKey = configKey;
      return this;
    }

    /** A {@code null} default marks the key as required. */
    Builder<T> setDefaultValue(@Nullable T defaultValue) {
      this.defaultValue = defaultValue;
      this.required = defaultValue == null;
      return this;
    }

    /** Marks a key whose absence leaves the value {@code null}. */
    Builder<T> setOptional() {
      this.defaultValue = null;
      this.required = false;
      return this;
    }

    Builder<T> setParser(Parser<T> parser) {
      this.parser = parser;
      return this;
    }

    ConfigValue<T> build() {
      checkArgument(!Strings.isNullOrEmpty(configKey), "configKey can not be empty or null");
      checkNotNull(parser, "parser can not be null.");
      return new ConfigValue<T>(this);
    }
  }
}

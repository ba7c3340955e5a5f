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
package com.enterprise.workplacesearch.zoomconnector;

import com.enterprise.workplacesearch.sdk.InvalidConfigurationException;
import com.enterprise.workplacesearch.sdk.StartupException;
import com.enterprise.workplacesearch.sdk.config.Configuration;
import com.enterprise.workplacesearch.zoomconnector.command.BootstrapCommand;
import com.enterprise.workplacesearch.zoomconnector.command.ConnectorCommand;
import com.enterprise.workplacesearch.zoomconnector.command.DeletionSyncCommand;
import com.enterprise.workplacesearch.zoomconnector.command.FullSyncCommand;
import com.enterprise.workplacesearch.zoomconnector.command.IncrementalSyncCommand;
import com.enterprise.workplacesearch.zoomconnector.command.PermissionSyncCommand;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command line entry point.
 *
 * <p>Sample usage:
 *
 * <pre>{@code
 * java -jar zoom-connector.jar full-sync -Dconfig=zoom-connector.properties
 * }</pre>
 *
 * <p>Any {@code -Dkey=value} argument overrides the configuration file. The bundled {@code
 * logging.properties} is used unless {@code java.util.logging.config.file} is set.
 */
public final class ZoomConnector {
  private static final Logger logger = Logger.getLogger(ZoomConnector.class.getName());

  static final String CMD_BOOTSTRAP = "bootstrap";
  static final String CMD_FULL_SYNC = "full-sync";
  static final String CMD_INCREMENTAL_SYNC = "incremental-sync";
  static final String CMD_DELETION_SYNC = "deletion-sync";
  static final String CMD_PERMISSION_SYNC = "permission-sync";

  static final ImmutableList<String> COMMANDS =
      ImmutableList.of(
          CMD_BOOTSTRAP,
          CMD_FULL_SYNC,
          CMD_INCREMENTAL_SYNC,
          CMD_DELETION_SYNC,
          CMD_PERMISSION_SYNC);

  static final int EXIT_OK = 0;
  static final int EXIT_FAILED = 1;
  static final int EXIT_USAGE = 2;

  private static final String LOGGING_CONFIG_FILE = "java.util.logging.config.file";

  private ZoomConnector() {}

  public static void main(String[] args) {
    configureLogging();
    System.exit(run(args));
  }

  /** Runs the command named in {@code args} and returns the process exit code. */
  @VisibleForTesting
  static int run(String[] args) {
    Optional<String> command = commandName(args);
    if (!command.isPresent()) {
      logger.log(
          Level.SEVERE,
          "Usage: ZoomConnector <{0}> [-Dconfig=<file>] [-Dkey=value ...]",
          Joiner.on('|').join(COMMANDS));
      return EXIT_USAGE;
    }
    logger.log(Level.INFO, "Running {0}", command.get());
    try {
      Configuration.initConfig(args);
      createCommand(command.get()).execute();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.SEVERE, command.get() + " interrupted", e);
      return EXIT_FAILED;
    } catch (IOException | RuntimeException e) {
      logger.log(Level.SEVERE, command.get() + " failed", e);
      return EXIT_FAILED;
    }
    logger.log(Level.INFO, "{0} completed", command.get());
    return EXIT_OK;
  }

  @VisibleForTesting
  static Optional<String> commandName(String[] args) {
    List<String> positional = new ArrayList<>();
    for (String arg : args) {
      if (!arg.startsWith("-")) {
        positional.add(arg);
      }
    }
    if (positional.size() != 1 || !COMMANDS.contains(positional.get(0))) {
      return Optional.empty();
    }
    return Optional.of(positional.get(0));
  }

  /**
   * Creates {@code name} from the loaded configuration.
   *
   * @throws StartupException if the configuration is invalid
   */
  @VisibleForTesting
  static ConnectorCommand createCommand(String name) throws IOException {
    switch (name) {
      case CMD_BOOTSTRAP:
        return BootstrapCommand.fromConfiguration();
      case CMD_FULL_SYNC:
        return new FullSyncCommand(ConnectorContext.fromConfiguration());
      case CMD_INCREMENTAL_SYNC:
        return new IncrementalSyncCommand(ConnectorContext.fromConfiguration());
      case CMD_DELETION_SYNC:
        return DeletionSyncCommand.fromConfiguration(ConnectorContext.fromConfiguration());
      case CMD_PERMISSION_SYNC:
        return new PermissionSyncCommand(ConnectorContext.fromConfiguration());
      default:
        throw new InvalidConfigurationException("Unknown command " + name);
    }
  }

  private static void configureLogging() {
    if (System.getProperty(LOGGING_CONFIG_FILE) != null) {
      return;
    }
    try (InputStream in = ZoomConnector.class.getResourceAsStream("/logging.properties")) {
      if (in != null) {
        LogManager.getLogManager().readConfiguration(in);
      }
    } catch (IOException e) {
      logger.log(Level.WARNING, "Unable to load the bundled logging configuration", e);
    }
  }
}

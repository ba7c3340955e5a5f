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
package com.enterprise.workplacesearch.sdk.indexing.state;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.base.Strings.isNullOrEmpty;

import com.enterprise.workplacesearch.sdk.config.Configuration;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import javax.annotation.Nullable;

/**
 * Reads and writes the connector's state files in a local directory.
 *
 * <p>Optional configuration file parameters used:
 *
 * <ul>
 *   <li>{@value #CONNECTOR_STATE_DIRECTORY} - directory holding the document store and
 *       checkpoint files. Default is the current directory.
 * </ul>
 *
 * <p>Writes go to a temporary file in the same directory which then replaces the target, so a
 * crash never leaves a partially written state file.
 */
public class LocalFileStateHandler {

  public static final String CONNECTOR_STATE_DIRECTORY = "connector.stateDirectory";
  @VisibleForTesting static final String DEFAULT_STATE_DIRECTORY = ".";

  private final Path basePath;
  private final FileHelper fileHelper;

  public LocalFileStateHandler(String directory) {
    this(directory, new FileHelper());
  }

  @VisibleForTesting
  LocalFileStateHandler(String directory, FileHelper fileHelper) {
    String stateDir = checkNotNull(directory, "state directory can not be null").trim();
    this.basePath = FileSystems.getDefault().getPath(stateDir);
    this.fileHelper = checkNotNull(fileHelper);
  }

  public static LocalFileStateHandler fromConfiguration() {
    checkState(Configuration.isInitialized(), "Configuration object not initialized");
    return new LocalFileStateHandler(
        Configuration.getString(CONNECTOR_STATE_DIRECTORY, DEFAULT_STATE_DIRECTORY).get(),
        new FileHelper());
  }

  @VisibleForTesting
  Path getStateFilePath(String name) {
    checkState(!isNullOrEmpty(name), "state file name can't be null or empty");
    return basePath.resolve(name);
  }

  /** Returns the content of state file {@code name}, or {@code null} if it does not exist. */
  @Nullable
  public byte[] read(String name) throws IOException {
    Path path = getStateFilePath(name);
    if (!fileHelper.exists(path)) {
      return null;
    }
    checkArgument(fileHelper.isFile(path), "state file %s is not pointing to file", path);
    return fileHelper.readFile(path);
  }

  /** Replaces the content of state file {@code name}. */
  public void write(String name, byte[] content) throws IOException {
    checkNotNull(content, "state content can not be null");
    Path path = getStateFilePath(name);
    checkArgument(
        !fileHelper.exists(path) || fileHelper.isFile(path),
        "state file %s is not pointing to file", path);
    fileHelper.writeAtomically(path, content);
  }

  /** Helper utility to wrap file operations for testing. */
  static class FileHelper {

    boolean exists(Path path) {
      return Files.exists(path);
    }

    boolean isFile(Path path) {
      return Files.isRegularFile(path);
    }

    byte[] readFile(Path path) throws IOException {
      return Files.readAllBytes(path);
    }

    void writeAtomically(Path path, byte[] content) throws IOException {
      Path directory = path.toAbsolutePath().getParent();
      Files.createDirectories(directory);
      Path temp = Files.createTempFile(directory, path.getFileName().toString(), ".tmp");
      try {
        Files.write(temp, content);
        try {
          Files.move(
              temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
          Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
      } finally {
        Files.deleteIfExists(temp);
      }
    }
  }
}

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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.enterprise.workplacesearch.sdk.RepositoryException;
import com.enterprise.workplacesearch.sdk.config.Configuration;
import com.enterprise.workplacesearch.sdk.indexing.RunKind;
import com.enterprise.workplacesearch.sdk.indexing.TimeWindow;
import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Last synced time per object type, kept in {@value #FILE_NAME}.
 *
 * <p>Optional configuration file parameters used:
 *
 * <ul>
 *   <li>{@value #CONFIG_START_TIME} - start of the window for types without a checkpoint.
 *       Default is {@value #DEFAULT_START_TIME}.
 * </ul>
 */
public class CheckpointStore {
  private static final Logger logger = Logger.getLogger(CheckpointStore.class.getName());

  public static final String FILE_NAME = "checkpoint.json";
  public static final String CONFIG_START_TIME = "connector.startTime";
  public static final String DEFAULT_START_TIME = "2011-10-12T00:00:00Z";

  private final LocalFileStateHandler stateHandler;
  private final Instant floor;

  public CheckpointStore(LocalFileStateHandler stateHandler, Instant floor) {
    this.stateHandler = checkNotNull(stateHandler);
    this.floor = checkNotNull(floor);
  }

  public static CheckpointStore fromConfiguration(LocalFileStateHandler stateHandler) {
    checkState(Configuration.isInitialized(), "config not initialized");
    Instant floor =
        Configuration.getValue(
                CONFIG_START_TIME,
                Instant.parse(DEFAULT_START_TIME),
                Configuration.INSTANT_PARSER)
            .get();
    return new CheckpointStore(stateHandler, floor);
  }

  /** Persisted checkpoints, one RFC-3339 timestamp per object type. */
  public static class Checkpoints extends JsonState {}

  /**
   * Returns the window of the next incremental sync of {@code objectType}: from the stored
   * checkpoint, or the configured start time if there is none, to {@code now}.
   */
  public TimeWindow getCheckpoint(String objectType, Instant now) throws IOException {
    Instant start = floor;
    Object stored = load().get(objectType);
    if (stored != null) {
      try {
        start = Instant.parse(stored.toString());
      } catch (DateTimeParseException e) {
        logger.log(
            Level.WARNING,
            String.format(
                "Invalid checkpoint [%s] for %s, using %s", stored, objectType, floor),
            e);
      }
    }
    if (start.isAfter(now)) {
      logger.log(
          Level.WARNING,
          "Checkpoint {0} of {1} is in the future, using {2}",
          new Object[] {start, objectType, now});
      start = now;
    }
    return new TimeWindow(start, now);
  }

  /** Stores {@code time} as the checkpoint of {@code objectType}. */
  public void setCheckpoint(String objectType, Instant time, RunKind runKind) throws IOException {
    Checkpoints checkpoints = load();
    checkpoints.set(objectType, time.toString());
    stateHandler.write(FILE_NAME, checkpoints.toBytes());
    logger.log(
        Level.INFO,
        "Checkpoint of {0} set to {1} after {2} sync",
        new Object[] {objectType, time, runKind});
  }

  private Checkpoints load() throws IOException {
    byte[] content = stateHandler.read(FILE_NAME);
    if (content == null) {
      return new Checkpoints();
    }
    try {
      return JsonState.parse(content, Checkpoints.class);
    } catch (RepositoryException e) {
      logger.log(Level.WARNING, "Checkpoint file " + FILE_NAME + " is corrupt, ignoring it", e);
      return new Checkpoints();
    }
  }
}

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
package com.enterprise.workplacesearch.zoomconnector.fetch;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.enterprise.workplacesearch.sdk.InvalidConfigurationException;
import com.enterprise.workplacesearch.sdk.config.Configuration;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Zoom user ids mapped to Enterprise Search user names.
 *
 * <p>Loaded from the CSV file named by {@value #CONFIG_USER_MAPPING}, one {@code
 * zoom_user_id,enterprise_search_user} pair per line. A Zoom user may appear on several lines.
 */
public class PermissionMapping {
  private static final Logger logger = Logger.getLogger(PermissionMapping.class.getName());

  public static final String CONFIG_USER_MAPPING = "zoom.userMapping";

  private static final PermissionMapping EMPTY =
      new PermissionMapping(ImmutableListMultimap.of());

  private final ImmutableListMultimap<String, String> mappings;

  PermissionMapping(ImmutableListMultimap<String, String> mappings) {
    this.mappings = checkNotNull(mappings);
  }

  public static PermissionMapping empty() {
    return EMPTY;
  }

  /**
   * Loads the configured mapping file. A missing or empty file yields an empty mapping, so that
   * documents carry their type permission only.
   */
  public static PermissionMapping fromConfiguration() throws IOException {
    checkState(Configuration.isInitialized(), "config not initialized");
    String location = Configuration.getString(CONFIG_USER_MAPPING, "").get();
    if (location.isEmpty()) {
      return EMPTY;
    }
    Path path = Paths.get(location);
    if (!Files.isRegularFile(path) || Files.size(path) == 0) {
      logger.log(Level.WARNING, "User mapping file {0} is missing or empty", path);
      return EMPTY;
    }
    return load(path);
  }

  /** Parses {@code path} as {@code zoom_user_id,enterprise_search_user} records. */
  public static PermissionMapping load(Path path) throws IOException {
    ImmutableListMultimap.Builder<String, String> mappings = ImmutableListMultimap.builder();
    try (CSVParser parser =
        CSVParser.parse(path, UTF_8, CSVFormat.DEFAULT.builder().setTrim(true).build())) {
      for (CSVRecord record : parser) {
        if (record.size() < 2 || record.get(0).isEmpty() || record.get(1).isEmpty()) {
          logger.log(
              Level.WARNING,
              "Skipping malformed line {0} of user mapping file {1}",
              new Object[] {record.getRecordNumber(), path});
          continue;
        }
        mappings.put(record.get(0), record.get(1));
      }
    } catch (IllegalStateException | IllegalArgumentException e) {
      throw new InvalidConfigurationException("Unable to parse user mapping file " + path, e);
    }
    PermissionMapping loaded = new PermissionMapping(mappings.build());
    logger.log(
        Level.INFO,
        "Loaded {0} user mapping(s) from {1}",
        new Object[] {loaded.mappings.size(), path});
    return loaded;
  }

  /** Enterprise Search users mapped to {@code zoomUserId}; empty if unmapped. */
  public ImmutableList<String> getIndexIdentities(String zoomUserId) {
    return zoomUserId == null ? ImmutableList.of() : mappings.get(zoomUserId);
  }

  public ImmutableSet<String> getSourceIdentities() {
    return mappings.keySet();
  }

  public boolean isEmpty() {
    return mappings.isEmpty();
  }
}

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

import com.enterprise.workplacesearch.sdk.InvalidConfigurationException;
import com.enterprise.workplacesearch.sdk.config.Configuration;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.time.Instant;
import java.time.Period;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of Zoom objects indexed by the connector.
 *
 * <p>Each kind carries the name used in configuration and in indexed documents, the permission
 * tag granted to every document of the kind, its default field schema (output field to Zoom
 * field) and, for objects the Zoom API only returns for a limited period, that period.
 */
public enum ObjectType {
  USERS(
      "users",
      "User:Read",
      true,
      null,
      ImmutableMap.of("created_at", "created_at", "id", "id", "title", "first_name")),
  ROLES(
      "roles",
      "Role:Read",
      false,
      null,
      ImmutableMap.of("description", "description", "id", "id", "title", "name")),
  GROUPS("groups", "Group:Read", false, null, ImmutableMap.of("id", "id", "title", "name")),
  MEETINGS(
      "meetings",
      "User:Read",
      true,
      Period.ofDays(30),
      ImmutableMap.of("created_at", "created_at", "id", "id", "title", "topic")),
  PAST_MEETINGS(
      "past_meetings",
      "User:Read",
      true,
      Period.ofDays(30),
      ImmutableMap.of("created_at", "start_time", "id", "uuid", "title", "topic")),
  RECORDINGS(
      "recordings",
      "Recording:Read",
      true,
      Period.ofDays(30),
      ImmutableMap.of(
          "created_at", "recording_start",
          "id", "id",
          "size", "total_size",
          "title", "topic",
          "url", "play_url")),
  CHANNELS(
      "channels", "ChatChannel:Read", false, null, ImmutableMap.of("id", "id", "title", "name")),
  CHATS(
      "chats",
      "ChatMessage:Read",
      true,
      // Six months, minus a four day margin.
      Period.of(0, 6, -4),
      ImmutableMap.of("created_at", "date_time", "description", "message", "id", "id")),
  FILES(
      "files",
      "ChatMessage:Read",
      true,
      Period.of(0, 6, -4),
      ImmutableMap.of(
          "created_at", "date_time",
          "id", "file_id",
          "size", "file_size",
          "title", "file_name",
          "url", "download_url"));

  /** Parses configuration values such as {@code past_meetings}. */
  public static final Configuration.Parser<ObjectType> PARSER = ObjectType::fromName;

  private final String configName;
  private final String permission;
  private final boolean timeWindowed;
  private final Period retention;
  private final ImmutableMap<String, String> defaultSchema;

  ObjectType(
      String configName,
      String permission,
      boolean timeWindowed,
      Period retention,
      ImmutableMap<String, String> defaultSchema) {
    this.configName = configName;
    this.permission = permission;
    this.timeWindowed = timeWindowed;
    this.retention = retention;
    this.defaultSchema = defaultSchema;
  }

  public static ObjectType fromName(String name) {
    return Arrays.stream(values())
        .filter(t -> t.configName.equals(name))
        .findFirst()
        .orElseThrow(
            () -> new InvalidConfigurationException("Unknown Zoom object type [" + name + "]"));
  }

  /** Every permission tag granted by some object type. */
  public static ImmutableSet<String> permissionTags() {
    return Arrays.stream(values())
        .map(ObjectType::getPermission)
        .collect(ImmutableSet.toImmutableSet());
  }

  public String getName() {
    return configName;
  }

  public String getPermission() {
    return permission;
  }

  /** True if documents are filtered by the run's time window and checkpointed. */
  public boolean isTimeWindowed() {
    return timeWindowed;
  }

  /**
   * Oldest creation time at which the Zoom API still returns objects of this type, or empty when
   * Zoom keeps them for good.
   */
  public Optional<Instant> retentionBoundary(Instant now) {
    if (retention == null) {
      return Optional.empty();
    }
    return Optional.of(now.atZone(ZoneOffset.UTC).minus(retention).toInstant());
  }

  public ImmutableMap<String, String> getDefaultSchema() {
    return defaultSchema;
  }

  @Override
  public String toString() {
    return configName;
  }
}

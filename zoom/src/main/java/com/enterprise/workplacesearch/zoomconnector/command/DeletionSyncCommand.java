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
package com.enterprise.workplacesearch.zoomconnector.command;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.enterprise.workplacesearch.sdk.config.Configuration;
import com.enterprise.workplacesearch.sdk.indexing.Document;
import com.enterprise.workplacesearch.sdk.indexing.DocumentRecord;
import com.enterprise.workplacesearch.sdk.indexing.DocumentSplitter;
import com.enterprise.workplacesearch.sdk.indexing.TimeWindow;
import com.enterprise.workplacesearch.sdk.indexing.state.LocalDocumentStore;
import com.enterprise.workplacesearch.zoomconnector.ConnectorContext;
import com.enterprise.workplacesearch.zoomconnector.client.ZoomClient;
import com.enterprise.workplacesearch.zoomconnector.fetch.ObjectType;
import com.google.api.client.http.HttpResponseException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Removes documents whose Zoom objects no longer exist.
 *
 * <p>Candidates are the {@code delete_keys} snapshot taken by the last full or incremental sync.
 * Users, roles, groups and meetings are looked up one by one; a "not found" status confirms the
 * deletion. Past meetings are checked through their meeting: when the past meeting of a meeting
 * is gone, every past meeting document under it is deleted. Channels, recordings, chats and
 * files can not be looked up by id, so they are fetched again and the missing ones are deleted.
 *
 * <p>Zoom only returns recent meetings, recordings and chat history. Candidates older than the
 * retention of their type are dropped from the local store without any check, unless their
 * owner was just found deleted. The retention boundary is the one the fetchers use, so every
 * candidate left for the refetch lies inside the fetched window.
 *
 * <p>Optional configuration parameters:
 *
 * <ul>
 *   <li>{@code zoom.deletion.notFoundStatusCodes.<type>} - HTTP status codes meaning "not found"
 *       for {@code users}, {@code roles}, {@code groups}, {@code meetings} and {@code
 *       past_meetings}. Defaults to {@code 400,404}, and to {@code 300,400} for roles.
 * </ul>
 */
public class DeletionSyncCommand implements ConnectorCommand {
  private static final Logger logger = Logger.getLogger(DeletionSyncCommand.class.getName());

  public static final String CONFIG_NOT_FOUND_STATUS_CODES =
      "zoom.deletion.notFoundStatusCodes.%s";

  static final ImmutableList<Integer> DEFAULT_NOT_FOUND_STATUS_CODES = ImmutableList.of(400, 404);
  static final ImmutableList<Integer> DEFAULT_ROLE_NOT_FOUND_STATUS_CODES =
      ImmutableList.of(300, 400);

  /** Types checked by a lookup of {@code <type>/<id>} before retention pruning. */
  static final ImmutableList<ObjectType> LOOKED_UP_TYPES =
      ImmutableList.of(ObjectType.ROLES, ObjectType.GROUPS, ObjectType.USERS);

  static final ImmutableList<ObjectType> REFETCHED_TYPES =
      ImmutableList.of(
          ObjectType.CHANNELS, ObjectType.CHATS, ObjectType.FILES, ObjectType.RECORDINGS);

  private final ConnectorContext context;
  private final ZoomClient client;
  private final ImmutableMap<ObjectType, ImmutableSet<Integer>> notFoundStatusCodes;

  public DeletionSyncCommand(
      ConnectorContext context, Map<ObjectType, ? extends List<Integer>> notFoundStatusCodes) {
    this.context = checkNotNull(context);
    this.client = context.getZoomClient();
    Map<ObjectType, ImmutableSet<Integer>> codes = new EnumMap<>(ObjectType.class);
    for (Map.Entry<ObjectType, ? extends List<Integer>> entry : notFoundStatusCodes.entrySet()) {
      codes.put(entry.getKey(), ImmutableSet.copyOf(entry.getValue()));
    }
    this.notFoundStatusCodes = ImmutableMap.copyOf(codes);
  }

  public DeletionSyncCommand(ConnectorContext context) {
    this(context, defaultNotFoundStatusCodes());
  }

  /** Creates the command with the "not found" status codes of the configuration. */
  public static DeletionSyncCommand fromConfiguration(ConnectorContext context) {
    checkState(Configuration.isInitialized(), "config not initialized");
    Map<ObjectType, List<Integer>> codes = new LinkedHashMap<>();
    for (Map.Entry<ObjectType, List<Integer>> entry : defaultNotFoundStatusCodes().entrySet()) {
      codes.put(
          entry.getKey(),
          Configuration.getMultiValue(
                  String.format(CONFIG_NOT_FOUND_STATUS_CODES, entry.getKey().getName()),
                  entry.getValue(),
                  Configuration.INTEGER_PARSER)
              .get());
    }
    return new DeletionSyncCommand(context, codes);
  }

  @VisibleForTesting
  static Map<ObjectType, List<Integer>> defaultNotFoundStatusCodes() {
    Map<ObjectType, List<Integer>> codes = new EnumMap<>(ObjectType.class);
    codes.put(ObjectType.USERS, DEFAULT_NOT_FOUND_STATUS_CODES);
    codes.put(ObjectType.ROLES, DEFAULT_ROLE_NOT_FOUND_STATUS_CODES);
    codes.put(ObjectType.GROUPS, DEFAULT_NOT_FOUND_STATUS_CODES);
    codes.put(ObjectType.MEETINGS, DEFAULT_NOT_FOUND_STATUS_CODES);
    codes.put(ObjectType.PAST_MEETINGS, DEFAULT_NOT_FOUND_STATUS_CODES);
    return codes;
  }

  @Override
  public void execute() throws IOException, InterruptedException {
    Instant now = context.getClock().instant();
    LocalDocumentStore documentStore = context.getDocumentStore();
    LocalDocumentStore.State state = documentStore.loadStorage();
    if (state.getDeleteKeys().isEmpty()) {
      logger.log(Level.INFO, "No indexed documents to check for deletion");
      return;
    }
    Set<String> deletedIds = new LinkedHashSet<>();
    for (ObjectType type : LOOKED_UP_TYPES) {
      for (DocumentRecord record : candidatesOf(type, state.getDeleteKeys())) {
        if (!exists(type, type.getName() + "/" + record.getId())) {
          deletedIds.add(record.getId());
        }
      }
    }

    pruneExpired(state, deletedIds, now);
    documentStore.updateStorage(state);
    List<DocumentRecord> candidates = state.getDeleteKeys();

    for (DocumentRecord record : candidatesOf(ObjectType.MEETINGS, candidates)) {
      if (!exists(ObjectType.MEETINGS, "meetings/" + record.getId())) {
        deletedIds.add(record.getId());
      }
    }
    deletedIds.addAll(findDeletedPastMeetings(candidates));
    deletedIds.addAll(findMissingAfterRefetch(candidates, now));

    deleteDocuments(ImmutableList.copyOf(deletedIds));
    List<DocumentRecord> remaining = new ArrayList<>();
    for (DocumentRecord record : state.getGlobalKeys()) {
      if (!deletedIds.contains(record.getId())) {
        remaining.add(record);
      }
    }
    state.setGlobalKeys(remaining).setDeleteKeys(ImmutableList.of());
    documentStore.updateStorage(state);
    logger.log(Level.INFO, "Deleted {0} document(s) from Enterprise Search", deletedIds.size());
  }

  /**
   * Drops candidates older than the retention of their type from both key lists of {@code state}.
   * Candidates whose parent is in {@code deletedIds} are added to it instead.
   */
  @VisibleForTesting
  void pruneExpired(LocalDocumentStore.State state, Set<String> deletedIds, Instant now) {
    Set<String> expiredKeys = new LinkedHashSet<>();
    for (DocumentRecord record : state.getDeleteKeys()) {
      Optional<ObjectType> type = typeOf(record);
      if (!type.isPresent() || !isExpired(record, type.get(), now)) {
        continue;
      }
      if (deletedIds.contains(record.getParentId())) {
        deletedIds.add(record.getId());
        continue;
      }
      expiredKeys.add(record.getKey());
    }
    if (expiredKeys.isEmpty()) {
      return;
    }
    logger.log(
        Level.INFO,
        "Dropping {0} document(s) older than Zoom keeps them from the local store",
        expiredKeys.size());
    state.setDeleteKeys(withoutKeys(state.getDeleteKeys(), expiredKeys));
    state.setGlobalKeys(withoutKeys(state.getGlobalKeys(), expiredKeys));
  }

  private Set<String> findDeletedPastMeetings(List<DocumentRecord> candidates)
      throws IOException {
    List<DocumentRecord> pastMeetings = candidatesOf(ObjectType.PAST_MEETINGS, candidates);
    Set<String> meetingIds = new LinkedHashSet<>();
    for (DocumentRecord record : pastMeetings) {
      if (record.getParentId() != null) {
        meetingIds.add(record.getParentId());
      }
    }
    Set<String> deleted = new LinkedHashSet<>();
    for (String meetingId : meetingIds) {
      if (exists(ObjectType.PAST_MEETINGS, "past_meetings/" + meetingId)) {
        continue;
      }
      for (DocumentRecord record : pastMeetings) {
        if (meetingId.equals(record.getParentId())) {
          deleted.add(record.getId());
        }
      }
    }
    return deleted;
  }

  private Set<String> findMissingAfterRefetch(List<DocumentRecord> candidates, Instant now)
      throws IOException, InterruptedException {
    Map<ObjectType, TimeWindow> windows = new LinkedHashMap<>();
    for (ObjectType type : REFETCHED_TYPES) {
      if (!candidatesOf(type, candidates).isEmpty()) {
        windows.put(type, new TimeWindow(context.getStartTime(), now));
      }
    }
    if (windows.isEmpty()) {
      return ImmutableSet.of();
    }
    Set<String> fetchedKeys = ConcurrentHashMap.newKeySet();
    context
        .newFetchPipeline()
        .run(
            windows,
            (type, documents) -> {
              for (Document document : documents) {
                fetchedKeys.add(document.getKey());
              }
            });
    Set<String> missing = new LinkedHashSet<>();
    for (ObjectType type : windows.keySet()) {
      for (DocumentRecord record : candidatesOf(type, candidates)) {
        if (!fetchedKeys.contains(record.getKey())) {
          missing.add(record.getId());
        }
      }
    }
    logger.log(
        Level.FINE,
        "{0} of {1} are gone from Zoom",
        new Object[] {missing.size(), windows.keySet()});
    return missing;
  }

  private void deleteDocuments(List<String> ids) throws IOException {
    for (List<String> chunk : DocumentSplitter.chunk(ids, context.getBatchSize())) {
      context.getSearchService().deleteDocuments(chunk);
    }
  }

  /**
   * Looks up {@code path}. Returns false on one of the "not found" status codes of {@code type};
   * any other error is rethrown.
   */
  private boolean exists(ObjectType type, String path) throws IOException {
    try {
      client.get(client.newUrl(path));
      return true;
    } catch (HttpResponseException e) {
      if (!notFoundStatusCodes.getOrDefault(type, ImmutableSet.of()).contains(e.getStatusCode())) {
        throw e;
      }
      logger.log(
          Level.FINE,
          "{0} not found in Zoom ({1})",
          new Object[] {path, e.getStatusCode()});
      return false;
    }
  }

  /** Candidates of {@code type}, or none when the type is not configured. */
  private List<DocumentRecord> candidatesOf(ObjectType type, List<DocumentRecord> records) {
    List<DocumentRecord> candidates = new ArrayList<>();
    if (!context.getObjectTypes().contains(type)) {
      return candidates;
    }
    for (DocumentRecord record : records) {
      if (type.getName().equals(record.getType())) {
        candidates.add(record);
      }
    }
    return candidates;
  }

  private static boolean isExpired(DocumentRecord record, ObjectType type, Instant now) {
    Optional<Instant> boundary = type.retentionBoundary(now);
    if (!boundary.isPresent() || record.getCreatedAt() == null) {
      return false;
    }
    try {
      return Instant.parse(record.getCreatedAt()).isBefore(boundary.get());
    } catch (DateTimeParseException e) {
      logger.log(
          Level.WARNING,
          "Invalid created_at [{0}] of {1}, keeping it",
          new Object[] {record.getCreatedAt(), record.getKey()});
      return false;
    }
  }

  private static Optional<ObjectType> typeOf(DocumentRecord record) {
    for (ObjectType type : ObjectType.values()) {
      if (type.getName().equals(record.getType())) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  private static List<DocumentRecord> withoutKeys(
      List<DocumentRecord> records, Set<String> keys) {
    List<DocumentRecord> kept = new ArrayList<>();
    for (DocumentRecord record : records) {
      if (!keys.contains(record.getKey())) {
        kept.add(record);
      }
    }
    return kept;
  }
}

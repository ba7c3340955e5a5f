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
package com.enterprise.workplacesearch.zoomconnector.sync;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.enterprise.workplacesearch.sdk.indexing.Document;
import com.enterprise.workplacesearch.sdk.indexing.DocumentSplitter;
import com.enterprise.workplacesearch.sdk.indexing.TimeWindow;
import com.enterprise.workplacesearch.zoomconnector.client.ZoomClient;
import com.enterprise.workplacesearch.zoomconnector.fetch.ChannelsFetcher;
import com.enterprise.workplacesearch.zoomconnector.fetch.ChatMessagesFetcher;
import com.enterprise.workplacesearch.zoomconnector.fetch.FetchScope;
import com.enterprise.workplacesearch.zoomconnector.fetch.FieldSchema;
import com.enterprise.workplacesearch.zoomconnector.fetch.GroupsFetcher;
import com.enterprise.workplacesearch.zoomconnector.fetch.MeetingsFetcher;
import com.enterprise.workplacesearch.zoomconnector.fetch.ObjectFetcher;
import com.enterprise.workplacesearch.zoomconnector.fetch.ObjectType;
import com.enterprise.workplacesearch.zoomconnector.fetch.PastMeetingsFetcher;
import com.enterprise.workplacesearch.zoomconnector.fetch.PermissionMapping;
import com.enterprise.workplacesearch.zoomconnector.fetch.RecordingsFetcher;
import com.enterprise.workplacesearch.zoomconnector.fetch.RoleDirectory;
import com.enterprise.workplacesearch.zoomconnector.fetch.RolesFetcher;
import com.enterprise.workplacesearch.zoomconnector.fetch.UsersFetcher;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fetches Zoom objects and hands the resulting documents to a {@link DocumentSink}.
 *
 * <p>Roles and groups are fetched once for the account on the calling thread. Users are then
 * split round-robin into as many buckets as there are fetch threads, and every bucket fetches
 * its user scoped types in the order of {@link #USER_SCOPED_TYPES}. The meetings of a bucket are
 * listed once and shared by the meetings and past meetings fetchers through {@link FetchScope}.
 */
public class ZoomFetchPipeline {
  private static final Logger logger = Logger.getLogger(ZoomFetchPipeline.class.getName());

  static final ImmutableList<ObjectType> ACCOUNT_TYPES =
      ImmutableList.of(ObjectType.ROLES, ObjectType.GROUPS);

  static final ImmutableList<ObjectType> USER_SCOPED_TYPES =
      ImmutableList.of(
          ObjectType.USERS,
          ObjectType.MEETINGS,
          ObjectType.PAST_MEETINGS,
          ObjectType.RECORDINGS,
          ObjectType.CHANNELS,
          ObjectType.CHATS,
          ObjectType.FILES);

  private final ImmutableMap<ObjectType, ObjectFetcher> fetchers;
  private final UsersFetcher usersFetcher;
  private final MeetingsFetcher meetingsFetcher;
  private final RoleDirectory roleDirectory;
  private final ImmutableMap<ObjectType, FieldSchema> schemas;
  private final int threadCount;
  private final boolean permissionEnabled;

  /**
   * Creates a pipeline fetching through {@code client}.
   *
   * @param schemas field schema of every configured object type
   * @param threadCount number of fetch threads, and of user buckets
   * @param permissionEnabled whether documents carry {@code _allow_permissions}
   */
  public ZoomFetchPipeline(
      ZoomClient client,
      PermissionMapping permissionMapping,
      Map<ObjectType, FieldSchema> schemas,
      int threadCount,
      boolean permissionEnabled,
      Clock clock) {
    checkArgument(threadCount > 0, "fetch thread count must be greater than 0");
    this.schemas = ImmutableMap.copyOf(schemas);
    this.threadCount = threadCount;
    this.permissionEnabled = permissionEnabled;
    this.usersFetcher = new UsersFetcher(client, permissionMapping);
    this.meetingsFetcher = new MeetingsFetcher(client, permissionMapping);
    this.roleDirectory = new RoleDirectory(client);
    Map<ObjectType, ObjectFetcher> table = new EnumMap<>(ObjectType.class);
    table.put(ObjectType.USERS, usersFetcher);
    table.put(ObjectType.ROLES, new RolesFetcher(client, permissionMapping, roleDirectory));
    table.put(ObjectType.GROUPS, new GroupsFetcher(client, permissionMapping));
    table.put(ObjectType.MEETINGS, meetingsFetcher);
    table.put(ObjectType.PAST_MEETINGS, new PastMeetingsFetcher(client, permissionMapping));
    table.put(ObjectType.RECORDINGS, new RecordingsFetcher(client, permissionMapping));
    table.put(ObjectType.CHANNELS, new ChannelsFetcher(client, permissionMapping));
    table.put(
        ObjectType.CHATS,
        new ChatMessagesFetcher(client, permissionMapping, ObjectType.CHATS, clock));
    table.put(
        ObjectType.FILES,
        new ChatMessagesFetcher(client, permissionMapping, ObjectType.FILES, clock));
    this.fetchers = ImmutableMap.copyOf(table);
  }

  /** Object types this pipeline has a schema for, in configuration order. */
  public ImmutableSet<ObjectType> getObjectTypes() {
    return schemas.keySet();
  }

  public RoleDirectory getRoleDirectory() {
    return roleDirectory;
  }

  /**
   * Fetches every type in {@code windows} and hands its documents to {@code sink}.
   *
   * <p>Returns once every fetch thread is done. The first failure cancels the remaining buckets
   * and is rethrown.
   *
   * @param windows time window of each type to fetch; types without a window are not fetched
   * @param sink receiver of the fetched documents
   * @throws IOException if any fetch fails
   * @throws InterruptedException if interrupted while waiting for the fetch threads
   */
  public void run(Map<ObjectType, TimeWindow> windows, DocumentSink sink)
      throws IOException, InterruptedException {
    checkNotNull(sink);
    checkArgument(
        schemas.keySet().containsAll(windows.keySet()),
        "no field schema for some of %s",
        windows.keySet());
    for (ObjectType type : ACCOUNT_TYPES) {
      if (windows.containsKey(type)) {
        sink.accept(type, fetch(type, FetchScope.account(), windows));
      }
    }
    if (Collections.disjoint(windows.keySet(), USER_SCOPED_TYPES)) {
      return;
    }
    ImmutableSet<String> chatAccessUserIds =
        windows.containsKey(ObjectType.CHATS) || windows.containsKey(ObjectType.FILES)
            ? roleDirectory.getChatAccessUserIds()
            : ImmutableSet.of();
    List<Map<String, Object>> users = usersFetcher.listUsers();
    if (users.isEmpty()) {
      logger.log(Level.INFO, "No Zoom users found");
      return;
    }
    List<List<Map<String, Object>>> buckets =
        DocumentSplitter.splitIntoBuckets(users, threadCount);
    logger.log(
        Level.INFO,
        "Fetching {0} for {1} users in {2} buckets",
        new Object[] {windows.keySet(), users.size(), buckets.size()});
    ListeningExecutorService executor =
        MoreExecutors.listeningDecorator(
            Executors.newFixedThreadPool(
                buckets.size(),
                new ThreadFactoryBuilder().setNameFormat("zoom-fetch-%d").build()));
    try {
      List<ListenableFuture<Void>> tasks = new ArrayList<>();
      for (List<Map<String, Object>> bucket : buckets) {
        tasks.add(
            executor.submit(
                bucketTask(FetchScope.forUsers(bucket, chatAccessUserIds), windows, sink)));
      }
      Futures.allAsList(tasks).get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      Throwables.throwIfInstanceOf(cause, IOException.class);
      Throwables.throwIfInstanceOf(cause, InterruptedException.class);
      Throwables.throwIfUnchecked(cause);
      throw new IOException("Error while fetching Zoom objects", cause);
    } finally {
      executor.shutdownNow();
    }
  }

  private Callable<Void> bucketTask(
      FetchScope usersScope, Map<ObjectType, TimeWindow> windows, DocumentSink sink) {
    return () -> {
      FetchScope scope = usersScope;
      if (windows.containsKey(ObjectType.MEETINGS)
          || windows.containsKey(ObjectType.PAST_MEETINGS)) {
        scope = scope.withMeetings(meetingsFetcher.listMeetings(scope.getUsers()));
      }
      for (ObjectType type : USER_SCOPED_TYPES) {
        if (windows.containsKey(type)) {
          sink.accept(type, fetch(type, scope, windows));
        }
      }
      return null;
    };
  }

  private List<Document> fetch(
      ObjectType type, FetchScope scope, Map<ObjectType, TimeWindow> windows)
      throws IOException {
    TimeWindow window = windows.get(type);
    logger.log(Level.FINE, "Fetching {0} in {1} for {2}", new Object[] {type, window, scope});
    return fetchers.get(type).fetch(scope, schemas.get(type), window, permissionEnabled);
  }
}

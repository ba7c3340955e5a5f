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

import static com.enterprise.workplacesearch.zoomconnector.client.ZoomJson.formatTime;
import static com.enterprise.workplacesearch.zoomconnector.client.ZoomJson.getString;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.enterprise.workplacesearch.sdk.indexing.Document;
import com.enterprise.workplacesearch.sdk.indexing.TimeWindow;
import com.enterprise.workplacesearch.zoomconnector.client.ZoomClient;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Indexes chat messages or chat files sent by the users of the scope.
 *
 * <p>Only users whose role grants {@value RoleDirectory#CHAT_MESSAGE_READ} are queried. Zoom
 * keeps chat history for six months, so an earlier window start is moved to that boundary.
 * Several users can see the same message; the first occurrence is kept.
 */
public class ChatMessagesFetcher extends AbstractObjectFetcher {
  private static final Logger logger = Logger.getLogger(ChatMessagesFetcher.class.getName());

  static final String CHAT_ARCHIVE_URL = "https://zoom.us/account/archivemsg/search#/list";

  private final Clock clock;

  public ChatMessagesFetcher(
      ZoomClient client, PermissionMapping permissionMapping, ObjectType objectType, Clock clock) {
    super(client, permissionMapping, objectType);
    checkArgument(
        objectType == ObjectType.CHATS || objectType == ObjectType.FILES,
        "%s is not a chat object type",
        objectType);
    this.clock = checkNotNull(clock);
  }

  @Override
  public List<Document> fetch(
      FetchScope scope, FieldSchema schema, TimeWindow window, boolean permissionEnabled)
      throws IOException {
    TimeWindow effective = clampToRetention(window);
    Set<String> seen = new HashSet<>();
    List<Document> documents = new ArrayList<>();
    for (Map<String, Object> user : scope.getUsers()) {
      String userId = getString(user, "id");
      if (!scope.getChatAccessUserIds().contains(userId)) {
        continue;
      }
      for (Map<String, Object> item : listItems(userId, effective)) {
        if (!effective.contains(getString(item, "date_time"))) {
          continue;
        }
        Document document = newDocument(item, schema);
        if (document.getId() == null || !seen.add(document.getId())) {
          continue;
        }
        document.setParentId(userId).setBody(bodyOf(item));
        if (document.getUrl() == null) {
          document.setUrl(CHAT_ARCHIVE_URL);
        }
        addPermissions(document, permissionEnabled, userId);
        documents.add(document);
      }
    }
    logger.log(
        Level.FINE,
        "Generated {0} {1} document(s)",
        new Object[] {documents.size(), objectType});
    return documents;
  }

  private List<Map<String, Object>> listItems(String userId, TimeWindow window)
      throws IOException {
    boolean chats = objectType == ObjectType.CHATS;
    return client.list(
        client
            .newUrl("chat/users/" + userId + "/messages")
            .set("page_size", 300)
            .set("search_key", " ")
            .set("search_type", chats ? "message" : "file")
            .set("from", formatTime(window.getStart()))
            .set("to", formatTime(window.getEnd())),
        chats ? "messages" : "files");
  }

  private String bodyOf(Map<String, Object> item) {
    if (objectType == ObjectType.CHATS) {
      return "Message : " + getString(item, "message");
    }
    return String.format(
        "File Name : %s\nFile Size : %s",
        getString(item, "file_name"),
        getString(item, "file_size"));
  }

  /** Moves the window start forward to the oldest chat history Zoom still returns. */
  @VisibleForTesting
  TimeWindow clampToRetention(TimeWindow window) {
    Instant boundary = objectType.retentionBoundary(clock.instant()).get();
    TimeWindow clamped = window.clampStart(boundary);
    if (!clamped.equals(window)) {
      logger.log(
          Level.INFO,
          "Zoom keeps {0} for six months only, fetching from {1} instead of {2}",
          new Object[] {objectType, clamped.getStart(), window.getStart()});
    }
    return clamped;
  }
}

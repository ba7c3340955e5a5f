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

import static com.enterprise.workplacesearch.zoomconnector.client.ZoomJson.getString;

import com.enterprise.workplacesearch.sdk.indexing.Document;
import com.enterprise.workplacesearch.sdk.indexing.TimeWindow;
import com.enterprise.workplacesearch.zoomconnector.client.ZoomClient;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lists the meetings of each user and indexes the ones created inside the run's window.
 *
 * <p>The unfiltered listing is also the candidate list of {@link PastMeetingsFetcher}; callers
 * attach it to the scope with {@link FetchScope#withMeetings} before fetching either type.
 */
public class MeetingsFetcher extends AbstractObjectFetcher {
  private static final Logger logger = Logger.getLogger(MeetingsFetcher.class.getName());

  static final String MEETING_URL = "https://zoom.us/user/%s/meeting/%s";

  private static final ImmutableMap<String, String> MEETING_TYPES =
      ImmutableMap.of(
          "1", "An instant meeting",
          "2", "A scheduled meeting",
          "3", "A recurring meeting with no fixed time",
          "8", "A recurring meeting with fixed time");

  public MeetingsFetcher(ZoomClient client, PermissionMapping permissionMapping) {
    super(client, permissionMapping, ObjectType.MEETINGS);
  }

  /** Lists the meetings of every user in {@code users}, keyed by user id. */
  public ImmutableListMultimap<String, Map<String, Object>> listMeetings(
      List<Map<String, Object>> users) throws IOException {
    ImmutableListMultimap.Builder<String, Map<String, Object>> meetings =
        ImmutableListMultimap.builder();
    for (Map<String, Object> user : users) {
      String userId = getString(user, "id");
      meetings.putAll(
          userId,
          client.list(
              client.newUrl("users/" + userId + "/meetings").set("page_size", 300),
              "meetings"));
    }
    return meetings.build();
  }

  @Override
  public List<Document> fetch(
      FetchScope scope, FieldSchema schema, TimeWindow window, boolean permissionEnabled) {
    List<Document> documents = new ArrayList<>();
    for (Map.Entry<String, Map<String, Object>> entry : scope.getMeetings().entries()) {
      String userId = entry.getKey();
      Map<String, Object> meeting = entry.getValue();
      if (!window.contains(getString(meeting, "created_at"))) {
        continue;
      }
      Document document =
          newDocument(meeting, schema)
              .setParentId(userId)
              .setBody(
                  String.format(
                      "Meeting Host : %s\nMeeting Type : %s",
                      getString(meeting, "host_id"),
                      meetingTypeName(getString(meeting, "type"))))
              .setUrl(String.format(MEETING_URL, userId, getString(meeting, "id")));
      addPermissions(document, permissionEnabled, userId);
      documents.add(document);
    }
    logger.log(Level.FINE, "Generated {0} meeting document(s)", documents.size());
    return documents;
  }

  /** Readable name of a Zoom meeting type code. */
  static String meetingTypeName(String type) {
    return MEETING_TYPES.getOrDefault(type, type);
  }
}

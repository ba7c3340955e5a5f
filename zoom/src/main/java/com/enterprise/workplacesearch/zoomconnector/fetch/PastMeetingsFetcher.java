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
import com.google.api.client.http.HttpResponseException;
import com.google.api.client.json.GenericJson;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Indexes concluded instances of the meetings listed in the scope.
 *
 * <p>Past meetings can only be read by meeting id. A 404 or 400 response means the meeting has
 * not taken place yet and the candidate is skipped. Instances are kept when their end time falls
 * inside the run's window.
 */
public class PastMeetingsFetcher extends AbstractObjectFetcher {
  private static final Logger logger = Logger.getLogger(PastMeetingsFetcher.class.getName());

  static final ImmutableSet<Integer> NOT_CONCLUDED_STATUS_CODES = ImmutableSet.of(400, 404);
  private static final ImmutableList<String> PARTICIPANT_FIELDS =
      ImmutableList.of("id", "name", "join_time", "leave_time", "duration");

  public PastMeetingsFetcher(ZoomClient client, PermissionMapping permissionMapping) {
    super(client, permissionMapping, ObjectType.PAST_MEETINGS);
  }

  @Override
  public List<Document> fetch(
      FetchScope scope, FieldSchema schema, TimeWindow window, boolean permissionEnabled)
      throws IOException {
    List<Document> documents = new ArrayList<>();
    for (Map<String, Object> meeting : scope.getMeetings().values()) {
      String meetingId = getString(meeting, "id");
      Optional<GenericJson> pastMeeting = getPastMeeting(meetingId);
      if (!pastMeeting.isPresent()) {
        continue;
      }
      if (!window.contains(getString(pastMeeting.get(), "end_time"))) {
        continue;
      }
      List<Map<String, Object>> participants = getParticipants(meetingId);
      documents.add(
          toDocument(meeting, pastMeeting.get(), participants, schema, permissionEnabled));
    }
    logger.log(Level.FINE, "Generated {0} past meeting document(s)", documents.size());
    return documents;
  }

  private Document toDocument(
      Map<String, Object> meeting,
      GenericJson pastMeeting,
      List<Map<String, Object>> participants,
      FieldSchema schema,
      boolean permissionEnabled) {
    if (participants.isEmpty()) {
      Map<String, Object> host = new LinkedHashMap<>();
      host.put("id", pastMeeting.get("host_id"));
      host.put("name", pastMeeting.get("user_name"));
      host.put("join_time", pastMeeting.get("start_time"));
      host.put("leave_time", pastMeeting.get("end_time"));
      host.put("duration", pastMeeting.get("duration"));
      participants = ImmutableList.of(host);
    }
    String hostId = getString(meeting, "host_id");
    Document document =
        newDocument(pastMeeting, schema)
            .setParentId(getString(meeting, "id"))
            .setBody(
                String.format(
                    "Meeting Duration:%s\nMeeting Type:%s\nMeeting Participants : %s",
                    getString(pastMeeting, "duration"),
                    MeetingsFetcher.meetingTypeName(getString(pastMeeting, "type")),
                    participants))
            .setUrl(
                String.format(
                    MeetingsFetcher.MEETING_URL, hostId, getString(pastMeeting, "id")));
    addPermissions(document, permissionEnabled, hostId);
    return document;
  }

  private Optional<GenericJson> getPastMeeting(String meetingId) throws IOException {
    try {
      return Optional.of(client.get(client.newUrl("past_meetings/" + meetingId)));
    } catch (HttpResponseException e) {
      if (!NOT_CONCLUDED_STATUS_CODES.contains(e.getStatusCode())) {
        throw e;
      }
      logger.log(
          Level.FINE,
          "Meeting {0} is skipped: {1}",
          new Object[] {meetingId, e.getStatusMessage()});
      return Optional.empty();
    }
  }

  private List<Map<String, Object>> getParticipants(String meetingId) throws IOException {
    List<Map<String, Object>> participants;
    try {
      participants =
          client.list(
              client
                  .newUrl("report/meetings/" + meetingId + "/participants")
                  .set("page_size", 300),
              "participants");
    } catch (HttpResponseException e) {
      if (e.getStatusCode() != 404) {
        throw e;
      }
      return ImmutableList.of();
    }
    List<Map<String, Object>> kept = new ArrayList<>();
    for (Map<String, Object> participant : participants) {
      Map<String, Object> fields = new LinkedHashMap<>();
      for (String field : PARTICIPANT_FIELDS) {
        if (participant.containsKey(field)) {
          fields.put(field, participant.get(field));
        }
      }
      kept.add(fields);
    }
    return kept;
  }
}

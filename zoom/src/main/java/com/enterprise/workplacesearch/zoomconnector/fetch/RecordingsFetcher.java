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

import com.enterprise.workplacesearch.sdk.indexing.Document;
import com.enterprise.workplacesearch.sdk.indexing.TimeWindow;
import com.enterprise.workplacesearch.zoomconnector.client.ZoomClient;
import com.enterprise.workplacesearch.zoomconnector.client.ZoomJson;
import com.google.api.client.util.escape.CharEscapers;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Indexes cloud recordings, one document per completed recording file.
 *
 * <p>Files still being processed are skipped; they are picked up by a later run. TIMELINE files
 * have no playable URL, so the schema's {@code url} field is not copied for them. Documents
 * without a playable URL link to the recording management page of the meeting.
 */
public class RecordingsFetcher extends AbstractObjectFetcher {
  private static final Logger logger = Logger.getLogger(RecordingsFetcher.class.getName());

  static final String RECORDING_URL =
      "https://zoom.us/recording/management/detail?meeting_id=%s";

  /** Fields read from the meeting rather than from the recording file. */
  private static final ImmutableSet<String> MEETING_FIELDS =
      ImmutableSet.of("host_id", "topic", "type", "share_url", "total_size", "duration");

  private static final String COMPLETED = "completed";
  private static final String TIMELINE = "TIMELINE";

  public RecordingsFetcher(ZoomClient client, PermissionMapping permissionMapping) {
    super(client, permissionMapping, ObjectType.RECORDINGS);
  }

  @Override
  public List<Document> fetch(
      FetchScope scope, FieldSchema schema, TimeWindow window, boolean permissionEnabled)
      throws IOException {
    List<Document> documents = new ArrayList<>();
    for (Map<String, Object> user : scope.getUsers()) {
      String userId = getString(user, "id");
      List<Map<String, Object>> meetings =
          client.list(
              client
                  .newUrl("users/" + userId + "/recordings")
                  .set("page_size", 300)
                  .set("from", formatTime(window.getStart()))
                  .set("to", formatTime(window.getEnd())),
              "meetings");
      for (Map<String, Object> meeting : meetings) {
        for (Map<String, Object> file : ZoomJson.getObjects(meeting, "recording_files")) {
          if (!COMPLETED.equals(getString(file, "status"))) {
            continue;
          }
          if (!window.contains(getString(file, "recording_start"))) {
            continue;
          }
          Document document = toDocument(meeting, file, schema).setParentId(userId);
          addPermissions(document, permissionEnabled, userId);
          documents.add(document);
        }
      }
    }
    logger.log(Level.FINE, "Generated {0} recording document(s)", documents.size());
    return documents;
  }

  private Document toDocument(
      Map<String, Object> meeting, Map<String, Object> file, FieldSchema schema) {
    Document document = new Document().setType(objectType.getName());
    boolean timeline = TIMELINE.equalsIgnoreCase(getString(file, "file_type"));
    for (Map.Entry<String, String> field : schema.getFields().entrySet()) {
      if (timeline && field.getKey().equals("url")) {
        continue;
      }
      Map<String, Object> source = MEETING_FIELDS.contains(field.getValue()) ? meeting : file;
      schema.projectField(field.getKey(), source, document);
    }
    document.setBody(
        String.format(
            "File MetaData\n File Type : %s\n File Size : %s\n Recording Type : %s",
            getString(file, "file_type"),
            getString(file, "file_size"),
            getString(file, "recording_type")));
    if (document.getUrl() == null) {
      String uuid = Strings.nullToEmpty(getString(meeting, "uuid"));
      document.setUrl(String.format(RECORDING_URL, CharEscapers.escapeUriConformant(uuid)));
    }
    return document;
  }
}

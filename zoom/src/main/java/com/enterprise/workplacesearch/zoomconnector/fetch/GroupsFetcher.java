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
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Indexes every Zoom group. Group documents carry the group permission only. */
public class GroupsFetcher extends AbstractObjectFetcher {
  private static final Logger logger = Logger.getLogger(GroupsFetcher.class.getName());

  static final String GROUP_URL = "https://zoom.us/account/group#/detail/%s/detail";

  public GroupsFetcher(ZoomClient client, PermissionMapping permissionMapping) {
    super(client, permissionMapping, ObjectType.GROUPS);
  }

  @Override
  public List<Document> fetch(
      FetchScope scope, FieldSchema schema, TimeWindow window, boolean permissionEnabled)
      throws IOException {
    List<Document> documents = new ArrayList<>();
    for (Map<String, Object> group : client.list(client.newUrl("groups"), "groups")) {
      Document document =
          newDocument(group, schema)
              .setBody("total_members: " + getString(group, "total_members"))
              .setUrl(String.format(GROUP_URL, getString(group, "id")));
      addPermissions(document, permissionEnabled, null);
      documents.add(document);
    }
    logger.log(Level.INFO, "Generated {0} group document(s)", documents.size());
    return documents;
  }
}

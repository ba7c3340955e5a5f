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

/** Indexes Zoom users created inside the run's window. */
public class UsersFetcher extends AbstractObjectFetcher {
  private static final Logger logger = Logger.getLogger(UsersFetcher.class.getName());

  static final String PROFILE_URL = "https://zoom.us/user/%s/profile";

  public UsersFetcher(ZoomClient client, PermissionMapping permissionMapping) {
    super(client, permissionMapping, ObjectType.USERS);
  }

  /** Lists every user of the Zoom account. */
  public List<Map<String, Object>> listUsers() throws IOException {
    List<Map<String, Object>> users =
        client.list(client.newUrl("users").set("page_size", 300), "users");
    logger.log(Level.INFO, "Fetched {0} Zoom user(s)", users.size());
    return users;
  }

  @Override
  public List<Document> fetch(
      FetchScope scope, FieldSchema schema, TimeWindow window, boolean permissionEnabled) {
    List<Document> documents = new ArrayList<>();
    for (Map<String, Object> user : scope.getUsers()) {
      if (!window.contains(getString(user, "created_at"))) {
        continue;
      }
      String userId = getString(user, "id");
      Document document =
          newDocument(user, schema)
              .setBody(
                  String.format(
                      "First Name : %s\nLast Name : %s\nStatus : %s\nRole Id : %s\nEmail : %s",
                      getString(user, "first_name"),
                      getString(user, "last_name"),
                      getString(user, "status"),
                      getString(user, "role_id"),
                      getString(user, "email")))
              .setUrl(String.format(PROFILE_URL, userId));
      addPermissions(document, permissionEnabled, userId);
      documents.add(document);
    }
    logger.log(Level.FINE, "Generated {0} user document(s)", documents.size());
    return documents;
  }
}

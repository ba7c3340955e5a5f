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

/** Indexes the chat channels each user belongs to. */
public class ChannelsFetcher extends AbstractObjectFetcher {
  private static final Logger logger = Logger.getLogger(ChannelsFetcher.class.getName());

  static final String CHANNEL_URL = "https://zoom.us/account/imchannel/old#/member/%s";

  public ChannelsFetcher(ZoomClient client, PermissionMapping permissionMapping) {
    super(client, permissionMapping, ObjectType.CHANNELS);
  }

  @Override
  public List<Document> fetch(
      FetchScope scope, FieldSchema schema, TimeWindow window, boolean permissionEnabled)
      throws IOException {
    List<Document> documents = new ArrayList<>();
    for (Map<String, Object> user : scope.getUsers()) {
      String userId = getString(user, "id");
      List<Map<String, Object>> channels =
          client.list(
              client.newUrl("chat/users/" + userId + "/channels").set("page_size", 50),
              "channels");
      for (Map<String, Object> channel : channels) {
        Document document =
            newDocument(channel, schema)
                .setParentId(userId)
                .setBody(String.valueOf(channel.get("channel_settings")))
                .setUrl(String.format(CHANNEL_URL, getString(channel, "id")));
        addPermissions(document, permissionEnabled, userId);
        documents.add(document);
      }
    }
    logger.log(Level.FINE, "Generated {0} channel document(s)", documents.size());
    return documents;
  }
}

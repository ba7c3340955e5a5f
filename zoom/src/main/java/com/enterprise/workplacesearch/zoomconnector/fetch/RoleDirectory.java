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

import static com.google.common.base.Preconditions.checkNotNull;

import com.enterprise.workplacesearch.zoomconnector.client.ZoomClient;
import com.enterprise.workplacesearch.zoomconnector.client.ZoomJson;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Zoom roles with their privileges and members. */
public class RoleDirectory {
  private static final Logger logger = Logger.getLogger(RoleDirectory.class.getName());

  /** Privilege required to list the chat messages and files of a user. */
  public static final String CHAT_MESSAGE_READ = "ChatMessage:Read";

  private final ZoomClient client;

  public RoleDirectory(ZoomClient client) {
    this.client = checkNotNull(client);
  }

  public List<Map<String, Object>> listRoles() throws IOException {
    return client.list(client.newUrl("roles"), "roles");
  }

  public List<String> getPrivileges(String roleId) throws IOException {
    return ZoomJson.getStrings(client.get(client.newUrl("roles/" + roleId)), "privileges");
  }

  public List<Map<String, Object>> getMembers(String roleId) throws IOException {
    return client.list(
        client.newUrl("roles/" + roleId + "/members").set("page_size", 300), "members");
  }

  /** Privileges of every user that is a member of at least one role, keyed by user id. */
  public ImmutableSetMultimap<String, String> getPrivilegesByMember() throws IOException {
    ImmutableSetMultimap.Builder<String, String> privileges = ImmutableSetMultimap.builder();
    for (Map<String, Object> role : listRoles()) {
      String roleId = ZoomJson.getString(role, "id");
      List<String> rolePrivileges = getPrivileges(roleId);
      for (Map<String, Object> member : getMembers(roleId)) {
        privileges.putAll(ZoomJson.getString(member, "id"), rolePrivileges);
      }
    }
    return privileges.build();
  }

  /** Ids of the users whose roles grant {@value #CHAT_MESSAGE_READ}. */
  public ImmutableSet<String> getChatAccessUserIds() throws IOException {
    ImmutableSet.Builder<String> users = ImmutableSet.builder();
    for (Map<String, Object> role : listRoles()) {
      String roleId = ZoomJson.getString(role, "id");
      if (!getPrivileges(roleId).contains(CHAT_MESSAGE_READ)) {
        continue;
      }
      for (Map<String, Object> member : getMembers(roleId)) {
        users.add(ZoomJson.getString(member, "id"));
      }
    }
    ImmutableSet<String> chatUsers = users.build();
    logger.log(Level.INFO, "{0} Zoom user(s) can read chat messages", chatUsers.size());
    return chatUsers;
  }
}

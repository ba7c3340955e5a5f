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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import java.util.List;
import java.util.Map;

/**
 * Zoom objects a fetch thread works on: its bucket of users, the meetings those users host and
 * the users allowed to read chat messages.
 *
 * <p>Scopes are immutable. The meetings listing is attached with {@link #withMeetings} once per
 * bucket and then read by both the meetings and the past meetings fetchers.
 */
public final class FetchScope {
  private final ImmutableList<Map<String, Object>> users;
  private final ImmutableListMultimap<String, Map<String, Object>> meetings;
  private final ImmutableSet<String> chatAccessUserIds;

  private FetchScope(
      ImmutableList<Map<String, Object>> users,
      ImmutableListMultimap<String, Map<String, Object>> meetings,
      ImmutableSet<String> chatAccessUserIds) {
    this.users = users;
    this.meetings = meetings;
    this.chatAccessUserIds = chatAccessUserIds;
  }

  /** Scope without users, used for account wide objects such as roles and groups. */
  public static FetchScope account() {
    return new FetchScope(ImmutableList.of(), ImmutableListMultimap.of(), ImmutableSet.of());
  }

  public static FetchScope forUsers(
      List<Map<String, Object>> users, ImmutableSet<String> chatAccessUserIds) {
    return new FetchScope(
        ImmutableList.copyOf(users), ImmutableListMultimap.of(), checkNotNull(chatAccessUserIds));
  }

  /** Returns a copy of this scope holding {@code meetings}, keyed by host user id. */
  public FetchScope withMeetings(ListMultimap<String, Map<String, Object>> meetings) {
    return new FetchScope(users, ImmutableListMultimap.copyOf(meetings), chatAccessUserIds);
  }

  public ImmutableList<Map<String, Object>> getUsers() {
    return users;
  }

  /** Meetings listed for the users of this scope, keyed by the id of the listing user. */
  public ImmutableListMultimap<String, Map<String, Object>> getMeetings() {
    return meetings;
  }

  /** Ids of users whose role grants read access to chat messages. */
  public ImmutableSet<String> getChatAccessUserIds() {
    return chatAccessUserIds;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("users", users.size())
        .add("meetings", meetings.size())
        .add("chatAccessUsers", chatAccessUserIds.size())
        .toString();
  }
}

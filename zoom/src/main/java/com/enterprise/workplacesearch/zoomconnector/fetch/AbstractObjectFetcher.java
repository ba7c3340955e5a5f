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

import com.enterprise.workplacesearch.sdk.indexing.Document;
import com.enterprise.workplacesearch.zoomconnector.client.ZoomClient;
import com.google.common.collect.ImmutableList;
import java.util.Map;
import javax.annotation.Nullable;

/** Document construction shared by the fetchers of every {@link ObjectType}. */
abstract class AbstractObjectFetcher implements ObjectFetcher {
  protected final ZoomClient client;
  protected final PermissionMapping permissionMapping;
  protected final ObjectType objectType;

  AbstractObjectFetcher(
      ZoomClient client, PermissionMapping permissionMapping, ObjectType objectType) {
    this.client = checkNotNull(client);
    this.permissionMapping = checkNotNull(permissionMapping);
    this.objectType = checkNotNull(objectType);
  }

  /** Creates a document of this fetcher's type holding the schema fields of {@code source}. */
  protected Document newDocument(Map<String, Object> source, FieldSchema schema) {
    return schema.project(source, new Document().setType(objectType.getName()));
  }

  /**
   * Grants the type permission and, when {@code ownerId} is mapped, the Enterprise Search users
   * mapped to that Zoom user.
   */
  protected void addPermissions(
      Document document, boolean permissionEnabled, @Nullable String ownerId) {
    if (!permissionEnabled) {
      return;
    }
    document.setAllowPermissions(
        ImmutableList.<String>builder()
            .add(objectType.getPermission())
            .addAll(permissionMapping.getIndexIdentities(ownerId))
            .build());
  }
}

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
package com.enterprise.workplacesearch.sdk.indexing;

import com.google.api.client.json.GenericJson;
import com.google.api.client.util.Key;
import com.google.common.base.MoreObjects;
import java.util.Objects;

/** Trimmed projection of an indexed {@link Document}, persisted in the local document store. */
public class DocumentRecord extends GenericJson {
  @Key private String id;
  @Key private String type;

  @Key("parent_id")
  private String parentId;

  @Key("created_at")
  private String createdAt;

  /** Required for JSON parsing. */
  public DocumentRecord() {}

  public DocumentRecord(String id, String type, String parentId, String createdAt) {
    this.id = id;
    this.type = type;
    this.parentId = parentId;
    this.createdAt = createdAt;
  }

  public String getId() {
    return id;
  }

  public String getType() {
    return type;
  }

  public String getParentId() {
    return parentId;
  }

  public String getCreatedAt() {
    return createdAt;
  }

  /** The dedup key of the record, same as {@link Document#getKey()}. */
  public String getKey() {
    return type + ":" + id;
  }

  @Override
  public DocumentRecord clone() {
    return (DocumentRecord) super.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DocumentRecord)) {
      return false;
    }
    DocumentRecord other = (DocumentRecord) o;
    return Objects.equals(id, other.id)
        && Objects.equals(type, other.type)
        && Objects.equals(parentId, other.parentId)
        && Objects.equals(createdAt, other.createdAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, type, parentId, createdAt);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("type", type)
        .add("id", id)
        .add("parentId", parentId)
        .add("createdAt", createdAt)
        .toString();
  }
}

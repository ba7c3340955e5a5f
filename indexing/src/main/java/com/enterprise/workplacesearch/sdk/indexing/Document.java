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
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.jackson2.JacksonFactory;
import com.google.api.client.util.Key;
import com.google.common.base.MoreObjects;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * A searchable document as sent to the Workplace Search bulk create endpoint.
 *
 * <p>{@code (type, id)} identifies a document. Schema fields other than the declared ones (for
 * example {@code description} or {@code size}) are stored with {@link #set(String, Object)} and
 * serialized alongside the declared keys.
 */
public class Document extends GenericJson {
  static final JsonFactory JSON_FACTORY = JacksonFactory.getDefaultInstance();

  @Key private String id;
  @Key private String type;

  @Key("parent_id")
  private String parentId;

  @Key("created_at")
  private String createdAt;

  @Key private String title;
  @Key private String body;
  @Key private String url;

  @Key("_allow_permissions")
  private List<String> allowPermissions;

  public Document() {
    setFactory(JSON_FACTORY);
  }

  public String getId() {
    return id;
  }

  public Document setId(String id) {
    this.id = id;
    return this;
  }

  public String getType() {
    return type;
  }

  public Document setType(String type) {
    this.type = type;
    return this;
  }

  public String getParentId() {
    return parentId;
  }

  public Document setParentId(String parentId) {
    this.parentId = parentId;
    return this;
  }

  /** RFC-3339 creation time, or {@code null} for types without one. */
  public String getCreatedAt() {
    return createdAt;
  }

  public Document setCreatedAt(String createdAt) {
    this.createdAt = createdAt;
    return this;
  }

  public String getTitle() {
    return title;
  }

  public Document setTitle(String title) {
    this.title = title;
    return this;
  }

  public String getBody() {
    return body;
  }

  public Document setBody(String body) {
    this.body = body;
    return this;
  }

  public String getUrl() {
    return url;
  }

  public Document setUrl(String url) {
    this.url = url;
    return this;
  }

  public List<String> getAllowPermissions() {
    return allowPermissions;
  }

  public Document setAllowPermissions(List<String> allowPermissions) {
    this.allowPermissions = allowPermissions;
    return this;
  }

  /** The dedup key of this document. */
  public String getKey() {
    return type + ":" + id;
  }

  /** Trimmed projection kept in the local document store after indexing. */
  public DocumentRecord toRecord() {
    return new DocumentRecord(id, type, parentId, createdAt);
  }

  /** Length in bytes of the JSON form of this document. */
  public int serializedSize() {
    try {
      return JSON_FACTORY.toByteArray(this).length;
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to serialize document " + getKey(), e);
    }
  }

  @Override
  public Document set(String fieldName, Object value) {
    return (Document) super.set(fieldName, value);
  }

  @Override
  public Document clone() {
    return (Document) super.clone();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("type", type).add("id", id).toString();
  }
}

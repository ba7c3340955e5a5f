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

import java.io.IOException;
import java.util.List;
import java.util.Map;

/** Operations against the content source of the search index. */
public interface EnterpriseSearchService {

  /**
   * Creates or replaces {@code documents}.
   *
   * @return one result per document; a result with errors means that document was rejected
   */
  List<IndexResult> indexDocuments(List<Document> documents) throws IOException;

  /** Deletes the documents with the given ids. */
  void deleteDocuments(List<String> ids) throws IOException;

  /** Lists every identity that holds permissions on the content source. */
  List<UserPermissions> listPermissions() throws IOException;

  void addPermissions(String identity, List<String> permissions) throws IOException;

  void removePermissions(String identity, List<String> permissions) throws IOException;

  /**
   * Creates a custom content source.
   *
   * @param name display name of the source
   * @param schema field name to field type, such as {@code text} or {@code date}
   * @param display display settings of the search result cards
   * @return id of the new content source
   */
  String createContentSource(String name, Map<String, String> schema, Object display)
      throws IOException;
}

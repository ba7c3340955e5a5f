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

import com.enterprise.workplacesearch.sdk.indexing.Document;
import com.enterprise.workplacesearch.sdk.indexing.TimeWindow;
import java.io.IOException;
import java.util.List;

/** Fetches the Zoom objects of one {@link ObjectType} and converts them to documents. */
public interface ObjectFetcher {

  /**
   * Returns the documents of the objects in {@code scope} that fall inside {@code window}.
   *
   * @param scope users and meetings to fetch for
   * @param schema fields copied into each document
   * @param window time window; ignored by types that are not time windowed
   * @param permissionEnabled whether to add {@code _allow_permissions} to each document
   * @throws IOException if Zoom can not be read; no partial result is returned
   */
  List<Document> fetch(
      FetchScope scope, FieldSchema schema, TimeWindow window, boolean permissionEnabled)
      throws IOException;
}

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
import java.util.Collections;
import java.util.List;

/** Per-document outcome of a bulk create call. */
public class IndexResult extends GenericJson {
  @Key private String id;
  @Key private List<String> errors;

  public IndexResult() {}

  public IndexResult(String id, List<String> errors) {
    this.id = id;
    this.errors = errors;
  }

  public String getId() {
    return id;
  }

  public List<String> getErrors() {
    return errors == null ? Collections.emptyList() : errors;
  }

  public boolean isSuccess() {
    return getErrors().isEmpty();
  }
}

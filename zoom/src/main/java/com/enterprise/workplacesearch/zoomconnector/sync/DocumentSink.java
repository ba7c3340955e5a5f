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
package com.enterprise.workplacesearch.zoomconnector.sync;

import com.enterprise.workplacesearch.sdk.indexing.Document;
import com.enterprise.workplacesearch.zoomconnector.fetch.ObjectType;
import java.util.List;

/**
 * Receives the documents produced by {@link ZoomFetchPipeline}.
 *
 * <p>Implementations are called concurrently from the fetch threads.
 */
public interface DocumentSink {

  /**
   * Accepts one fetcher's output.
   *
   * @param objectType type of every document in {@code documents}
   * @param documents documents fetched for one bucket of users, possibly empty
   * @throws InterruptedException if interrupted while handing the documents over
   */
  void accept(ObjectType objectType, List<Document> documents) throws InterruptedException;
}

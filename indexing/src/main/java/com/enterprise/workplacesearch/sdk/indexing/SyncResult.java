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

import com.enterprise.workplacesearch.sdk.indexing.queue.QueueMessage;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Documents an indexing worker saw and indexed, and the checkpoint markers it consumed.
 *
 * <p>Documents are identified by their {@code type:id} key, see {@link Document#getKey()}.
 */
public class SyncResult {
  private final Set<String> generatedKeys = new LinkedHashSet<>();
  private final Set<String> indexedKeys = new LinkedHashSet<>();
  private final List<QueueMessage> checkpoints = new ArrayList<>();

  void addGenerated(Document document) {
    generatedKeys.add(document.getKey());
  }

  void addIndexed(Document document) {
    indexedKeys.add(document.getKey());
  }

  void addCheckpoint(QueueMessage checkpoint) {
    checkpoints.add(checkpoint);
  }

  /** Keys of every document submitted for indexing. */
  public ImmutableSet<String> getGeneratedKeys() {
    return ImmutableSet.copyOf(generatedKeys);
  }

  /** Keys of documents the index accepted without errors. */
  public ImmutableSet<String> getIndexedKeys() {
    return ImmutableSet.copyOf(indexedKeys);
  }

  public ImmutableList<QueueMessage> getCheckpoints() {
    return ImmutableList.copyOf(checkpoints);
  }

  /** Combines the results of several workers. */
  public static SyncResult merge(Iterable<SyncResult> results) {
    SyncResult merged = new SyncResult();
    for (SyncResult result : results) {
      merged.generatedKeys.addAll(result.generatedKeys);
      merged.indexedKeys.addAll(result.indexedKeys);
      merged.checkpoints.addAll(result.checkpoints);
    }
    return merged;
  }
}

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
package com.enterprise.workplacesearch.sdk.indexing.state;

import static com.google.common.base.Preconditions.checkNotNull;

import com.enterprise.workplacesearch.sdk.RepositoryException;
import com.enterprise.workplacesearch.sdk.indexing.DocumentRecord;
import com.google.api.client.util.Key;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Records of the documents believed to be in the index, kept in {@value #FILE_NAME}.
 *
 * <p>{@code global_keys} lists every indexed document, at most once per {@code (type, id)}.
 * {@code delete_keys} is the snapshot of {@code global_keys} taken when the last full or
 * incremental sync stored its results; a deletion sync verifies those records and clears it.
 */
public class LocalDocumentStore {
  private static final Logger logger = Logger.getLogger(LocalDocumentStore.class.getName());

  public static final String FILE_NAME = "doc_id.json";

  private final LocalFileStateHandler stateHandler;

  public LocalDocumentStore(LocalFileStateHandler stateHandler) {
    this.stateHandler = checkNotNull(stateHandler);
  }

  /** Persisted content of the document store. */
  public static class State extends JsonState {
    @Key("global_keys")
    private List<DocumentRecord> globalKeys;

    @Key("delete_keys")
    private List<DocumentRecord> deleteKeys;

    public State() {
      globalKeys = new ArrayList<>();
      deleteKeys = new ArrayList<>();
    }

    public List<DocumentRecord> getGlobalKeys() {
      if (globalKeys == null) {
        globalKeys = new ArrayList<>();
      }
      return globalKeys;
    }

    public State setGlobalKeys(List<DocumentRecord> globalKeys) {
      this.globalKeys = new ArrayList<>(globalKeys);
      return this;
    }

    public List<DocumentRecord> getDeleteKeys() {
      if (deleteKeys == null) {
        deleteKeys = new ArrayList<>();
      }
      return deleteKeys;
    }

    public State setDeleteKeys(List<DocumentRecord> deleteKeys) {
      this.deleteKeys = new ArrayList<>(deleteKeys);
      return this;
    }
  }

  /**
   * Loads the persisted state. A missing file yields an empty state; so does a corrupt one,
   * after logging the problem.
   *
   * @throws IOException if an existing state file can not be read
   */
  public State loadStorage() throws IOException {
    byte[] content = stateHandler.read(FILE_NAME);
    if (content == null) {
      return new State();
    }
    try {
      return JsonState.parse(content, State.class);
    } catch (RepositoryException e) {
      logger.log(
          Level.WARNING, "Local document store " + FILE_NAME + " is corrupt, starting empty", e);
      return new State();
    }
  }

  /** Replaces the persisted state with {@code state}. */
  public void updateStorage(State state) throws IOException {
    stateHandler.write(FILE_NAME, state.toBytes());
  }

  /**
   * Records the documents of a finished sync.
   *
   * <p>{@code delete_keys} becomes a copy of the current {@code global_keys}. Every fetched
   * record whose {@code type:id} key was indexed is then added to {@code global_keys}, replacing
   * an older record with the same key.
   *
   * @param fetched records of every document the sync fetched
   * @param indexedKeys {@code type:id} keys of the documents the index accepted
   */
  public void storeIndexedDocuments(
      Collection<DocumentRecord> fetched, Collection<String> indexedKeys) throws IOException {
    State state = loadStorage();
    List<DocumentRecord> snapshot = new ArrayList<>();
    for (DocumentRecord record : state.getGlobalKeys()) {
      snapshot.add(record.clone());
    }
    state.setDeleteKeys(snapshot);
    Map<String, DocumentRecord> byKey = new LinkedHashMap<>();
    for (DocumentRecord record : state.getGlobalKeys()) {
      byKey.put(record.getKey(), record);
    }
    int added = 0;
    for (DocumentRecord record : fetched) {
      if (indexedKeys.contains(record.getKey())) {
        if (byKey.put(record.getKey(), record) == null) {
          added++;
        }
      }
    }
    state.setGlobalKeys(new ArrayList<>(byKey.values()));
    updateStorage(state);
    logger.log(
        Level.INFO,
        "Local document store holds {0} record(s), {1} new",
        new Object[] {byKey.size(), added});
  }
}

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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.enterprise.workplacesearch.sdk.indexing.queue.ConnectorQueue;
import com.enterprise.workplacesearch.sdk.indexing.queue.QueueMessage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drains a {@link ConnectorQueue} into the search index.
 *
 * <p>The worker collects documents until it holds {@code batchSize} documents or {@code maxBytes}
 * bytes, a checkpoint marker arrives, or the close signal arrives. Each collected batch is
 * deduplicated by {@code (type, id)}, split into calls of at most {@code batchSize} documents and
 * {@code maxBytes} bytes and indexed. Documents the index rejects are logged and left out of the
 * indexed keys.
 *
 * <p>Any unexpected failure aborts the queue and is rethrown from {@link #call()}.
 */
public class IndexingWorker implements Callable<SyncResult> {
  private static final Logger logger = Logger.getLogger(IndexingWorker.class.getName());

  public static final String CONFIG_MAX_BYTES = "connector.maxBytes";
  public static final int DEFAULT_MAX_BYTES = 10_000_000;

  private final String name;
  private final ConnectorQueue queue;
  private final EnterpriseSearchService searchService;
  private final int batchSize;
  private final int maxBytes;

  public IndexingWorker(
      String name,
      ConnectorQueue queue,
      EnterpriseSearchService searchService,
      int batchSize,
      int maxBytes) {
    checkArgument(batchSize > 0, "batch size must be greater than 0");
    checkArgument(maxBytes > 0, "max bytes must be greater than 0");
    this.name = checkNotNull(name);
    this.queue = checkNotNull(queue);
    this.searchService = checkNotNull(searchService);
    this.batchSize = batchSize;
    this.maxBytes = maxBytes;
  }

  @Override
  public SyncResult call() throws Exception {
    SyncResult result = new SyncResult();
    try {
      boolean closed = false;
      while (!closed) {
        List<Document> batch = new ArrayList<>();
        int batchBytes = 0;
        while (batch.size() < batchSize && batchBytes < maxBytes) {
          QueueMessage message = queue.get();
          if (message.getKind() == QueueMessage.Kind.CLOSE) {
            closed = true;
            break;
          }
          if (message.getKind() == QueueMessage.Kind.CHECKPOINT) {
            result.addCheckpoint(message);
            break;
          }
          for (Document document : message.getDocuments()) {
            batch.add(document);
            batchBytes += document.serializedSize();
          }
        }
        if (!batch.isEmpty()) {
          index(batch, result);
        }
      }
    } catch (Exception e) {
      logger.log(Level.SEVERE, "[" + name + "] Error while indexing documents", e);
      queue.abort();
      throw e;
    }
    logger.log(
        Level.INFO,
        "[{0}] Indexed {1} of {2} documents",
        new Object[] {name, result.getIndexedKeys().size(), result.getGeneratedKeys().size()});
    return result;
  }

  private void index(List<Document> batch, SyncResult result) throws IOException {
    List<Document> unique = DocumentSplitter.deduplicate(batch);
    for (Document document : unique) {
      result.addGenerated(document);
    }
    for (List<Document> chunk : DocumentSplitter.chunk(unique, batchSize)) {
      for (List<Document> request : DocumentSplitter.splitBySize(chunk, maxBytes)) {
        for (IndexResult indexResult : searchService.indexDocuments(request)) {
          if (indexResult.isSuccess()) {
            // The index reports bare ids; every document of the request with that id was stored.
            for (Document document : request) {
              if (Objects.equals(document.getId(), indexResult.getId())) {
                result.addIndexed(document);
              }
            }
          } else {
            logger.log(
                Level.SEVERE,
                "[{0}] Error while indexing document {1}: {2}",
                new Object[] {name, indexResult.getId(), indexResult.getErrors()});
          }
        }
      }
    }
  }
}

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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.enterprise.workplacesearch.sdk.indexing.Document;
import com.enterprise.workplacesearch.sdk.indexing.DocumentRecord;
import com.enterprise.workplacesearch.sdk.indexing.EnterpriseSearchService;
import com.enterprise.workplacesearch.sdk.indexing.IndexingWorker;
import com.enterprise.workplacesearch.sdk.indexing.RunKind;
import com.enterprise.workplacesearch.sdk.indexing.SyncResult;
import com.enterprise.workplacesearch.sdk.indexing.TimeWindow;
import com.enterprise.workplacesearch.sdk.indexing.queue.ConnectorQueue;
import com.enterprise.workplacesearch.sdk.indexing.queue.QueueMessage;
import com.enterprise.workplacesearch.sdk.indexing.state.CheckpointStore;
import com.enterprise.workplacesearch.sdk.indexing.state.LocalDocumentStore;
import com.enterprise.workplacesearch.zoomconnector.fetch.ObjectType;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one full or incremental sync.
 *
 * <p>The fetch pipeline feeds a {@link ConnectorQueue} drained by {@link IndexingWorker}s. Once
 * every fetch thread is done, one checkpoint marker per time windowed type and one close signal
 * per worker are queued. Checkpoints and the local document store are only updated when neither
 * side failed, so a failed run is retried from the previous checkpoints.
 */
public class SyncOrchestrator {
  private static final Logger logger = Logger.getLogger(SyncOrchestrator.class.getName());

  private final ZoomFetchPipeline pipeline;
  private final EnterpriseSearchService searchService;
  private final LocalDocumentStore documentStore;
  private final CheckpointStore checkpointStore;
  private final int workerCount;
  private final int queueCapacity;
  private final int batchSize;
  private final int maxBytes;

  private SyncOrchestrator(Builder builder) {
    this.pipeline = checkNotNull(builder.pipeline, "pipeline can not be null");
    this.searchService = checkNotNull(builder.searchService, "search service can not be null");
    this.documentStore = checkNotNull(builder.documentStore, "document store can not be null");
    this.checkpointStore =
        checkNotNull(builder.checkpointStore, "checkpoint store can not be null");
    checkArgument(builder.workerCount > 0, "worker count must be greater than 0");
    this.workerCount = builder.workerCount;
    this.queueCapacity = builder.queueCapacity;
    this.batchSize = builder.batchSize;
    this.maxBytes = builder.maxBytes;
  }

  /**
   * Fetches and indexes every type in {@code windows}.
   *
   * @param windows time window of each type to sync
   * @param endTime checkpoint stored for each time windowed type on success
   * @param runKind kind of run, recorded with the checkpoints
   * @return keys of the documents generated and indexed by the run
   * @throws IOException if fetching or indexing failed; nothing is committed in that case
   */
  public SyncResult run(Map<ObjectType, TimeWindow> windows, Instant endTime, RunKind runKind)
      throws IOException, InterruptedException {
    ConnectorQueue queue = new ConnectorQueue(queueCapacity, batchSize);
    Queue<DocumentRecord> fetched = new ConcurrentLinkedQueue<>();
    ExecutorService indexingPool =
        Executors.newFixedThreadPool(
            workerCount,
            new ThreadFactoryBuilder().setNameFormat("enterprise-search-sync-%d").build());
    SyncResult result;
    try {
      List<Future<SyncResult>> workers = new ArrayList<>();
      for (int i = 0; i < workerCount; i++) {
        workers.add(
            indexingPool.submit(
                new IndexingWorker("worker-" + i, queue, searchService, batchSize, maxBytes)));
      }
      try {
        pipeline.run(
            windows,
            (type, documents) -> {
              for (Document document : documents) {
                fetched.add(document.toRecord());
              }
              queue.appendDocuments(documents);
            });
        for (ObjectType type : windows.keySet()) {
          if (type.isTimeWindowed()) {
            queue.putCheckpoint(type.getName(), endTime, runKind);
          }
        }
        for (int i = 0; i < workerCount; i++) {
          queue.endSignal();
        }
      } catch (IOException | RuntimeException e) {
        logger.log(Level.SEVERE, "Error while fetching Zoom objects, aborting " + runKind, e);
        queue.abort();
        try {
          awaitWorkers(workers);
        } catch (IOException workerFailure) {
          workerFailure.addSuppressed(e);
          throw workerFailure;
        }
        throw e;
      }
      result = awaitWorkers(workers);
    } catch (InterruptedException e) {
      queue.abort();
      throw e;
    } finally {
      indexingPool.shutdownNow();
    }
    commit(result, fetched);
    logger.log(
        Level.INFO,
        "Total {0} documents indexed out of {1}",
        new Object[] {result.getIndexedKeys().size(), result.getGeneratedKeys().size()});
    return result;
  }

  /** Records the indexed documents, then moves the checkpoints past them. */
  private void commit(SyncResult result, Queue<DocumentRecord> fetched) throws IOException {
    documentStore.storeIndexedDocuments(fetched, result.getIndexedKeys());
    for (QueueMessage checkpoint : result.getCheckpoints()) {
      checkpointStore.setCheckpoint(
          checkpoint.getObjectType(), checkpoint.getTimestamp(), checkpoint.getRunKind());
    }
  }

  private static SyncResult awaitWorkers(List<Future<SyncResult>> workers)
      throws IOException, InterruptedException {
    List<SyncResult> results = new ArrayList<>();
    IOException failure = null;
    for (Future<SyncResult> worker : workers) {
      try {
        results.add(worker.get());
      } catch (ExecutionException e) {
        if (failure == null) {
          failure = new IOException("Error while indexing documents", e.getCause());
        } else {
          failure.addSuppressed(e.getCause());
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
    return SyncResult.merge(results);
  }

  /** Builder for creating an instance of {@link SyncOrchestrator} */
  public static class Builder {
    private ZoomFetchPipeline pipeline;
    private EnterpriseSearchService searchService;
    private LocalDocumentStore documentStore;
    private CheckpointStore checkpointStore;
    private int workerCount;
    private int queueCapacity = ConnectorQueue.DEFAULT_QUEUE_CAPACITY;
    private int batchSize = ConnectorQueue.DEFAULT_BATCH_SIZE;
    private int maxBytes = IndexingWorker.DEFAULT_MAX_BYTES;

    public Builder setPipeline(ZoomFetchPipeline pipeline) {
      this.pipeline = pipeline;
      return this;
    }

    public Builder setSearchService(EnterpriseSearchService searchService) {
      this.searchService = searchService;
      return this;
    }

    public Builder setDocumentStore(LocalDocumentStore documentStore) {
      this.documentStore = documentStore;
      return this;
    }

    public Builder setCheckpointStore(CheckpointStore checkpointStore) {
      this.checkpointStore = checkpointStore;
      return this;
    }

    /** Number of indexing workers draining the queue. */
    public Builder setWorkerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    public Builder setQueueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    public Builder setBatchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder setMaxBytes(int maxBytes) {
      this.maxBytes = maxBytes;
      return this;
    }

    public SyncOrchestrator build() {
      return new SyncOrchestrator(this);
    }
  }
}

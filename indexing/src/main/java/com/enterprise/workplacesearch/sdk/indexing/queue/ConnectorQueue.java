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
package com.enterprise.workplacesearch.sdk.indexing.queue;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.enterprise.workplacesearch.sdk.config.Configuration;
import com.enterprise.workplacesearch.sdk.indexing.Document;
import com.enterprise.workplacesearch.sdk.indexing.DocumentSplitter;
import com.enterprise.workplacesearch.sdk.indexing.RunKind;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded FIFO queue between fetch threads and indexing workers.
 *
 * <p>Document batches are split to at most {@code connector.batchSize} documents before
 * insertion. After {@link #abort()} producers fail fast with {@link CancellationException} and
 * {@link #get()} returns the close signal, so neither side blocks on a dead counterpart.
 */
public class ConnectorQueue {
  private static final Logger logger = Logger.getLogger(ConnectorQueue.class.getName());

  public static final String CONFIG_QUEUE_CAPACITY = "connector.queueCapacity";
  public static final String CONFIG_BATCH_SIZE = "connector.batchSize";
  public static final int DEFAULT_QUEUE_CAPACITY = 1000;
  public static final int DEFAULT_BATCH_SIZE = 100;
  private static final long POLL_INTERVAL_MILLIS = 100;

  private final BlockingQueue<QueueMessage> queue;
  private final int batchSize;
  private final AtomicBoolean aborted = new AtomicBoolean();

  public ConnectorQueue(int capacity, int batchSize) {
    checkArgument(capacity > 0, "queue capacity must be greater than 0");
    checkArgument(batchSize > 0, "batch size must be greater than 0");
    this.queue = new LinkedBlockingQueue<>(capacity);
    this.batchSize = batchSize;
  }

  /**
   * Creates a queue sized from configuration.
   *
   * <ul>
   *   <li>{@code connector.queueCapacity} - maximum number of pending messages, default 1000.
   *   <li>{@code connector.batchSize} - maximum documents per batch message, default 100.
   * </ul>
   */
  public static ConnectorQueue fromConfiguration() {
    checkState(Configuration.isInitialized(), "config not initialized");
    int capacity = Configuration.getInteger(CONFIG_QUEUE_CAPACITY, DEFAULT_QUEUE_CAPACITY).get();
    int batchSize = Configuration.getInteger(CONFIG_BATCH_SIZE, DEFAULT_BATCH_SIZE).get();
    Configuration.checkConfiguration(capacity > 0, "%s must be positive", CONFIG_QUEUE_CAPACITY);
    Configuration.checkConfiguration(batchSize > 0, "%s must be positive", CONFIG_BATCH_SIZE);
    return new ConnectorQueue(capacity, batchSize);
  }

  /**
   * Adds a message, blocking while the queue is full.
   *
   * @throws CancellationException if the queue was aborted
   * @throws InterruptedException if interrupted while waiting
   */
  public void put(QueueMessage message) throws InterruptedException {
    checkNotNull(message);
    if (message.getKind() == QueueMessage.Kind.DOCUMENTS
        && message.getDocuments().size() > batchSize) {
      appendDocuments(message.getDocuments());
      return;
    }
    while (!queue.offer(message, POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS)) {
      if (aborted.get()) {
        throw new CancellationException("Queue aborted, dropping " + message);
      }
    }
  }

  /** Adds {@code documents} as consecutive batches of at most the configured batch size. */
  public void appendDocuments(List<Document> documents) throws InterruptedException {
    for (List<Document> batch : DocumentSplitter.chunk(documents, batchSize)) {
      put(QueueMessage.documents(batch));
    }
  }

  /** Adds a checkpoint marker for {@code objectType}. */
  public void putCheckpoint(String objectType, Instant timestamp, RunKind runKind)
      throws InterruptedException {
    put(QueueMessage.checkpoint(objectType, timestamp, runKind));
  }

  /** Adds one close signal. Does nothing once the queue is aborted. */
  public void endSignal() throws InterruptedException {
    if (aborted.get()) {
      return;
    }
    try {
      put(QueueMessage.close());
    } catch (CancellationException e) {
      logger.log(Level.FINE, "Queue aborted while sending close signal");
    }
  }

  /** Removes the next message, blocking until one is available or the queue is aborted. */
  public QueueMessage get() throws InterruptedException {
    while (true) {
      QueueMessage message = queue.poll(POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
      if (message != null) {
        return message;
      }
      if (aborted.get()) {
        return QueueMessage.close();
      }
    }
  }

  /** Stops the flow of messages after an indexing failure. */
  public void abort() {
    if (aborted.compareAndSet(false, true)) {
      logger.log(Level.WARNING, "Connector queue aborted; {0} pending message(s) dropped",
          queue.size());
      queue.clear();
    }
  }

  public boolean isAborted() {
    return aborted.get();
  }

  public int getBatchSize() {
    return batchSize;
  }

  /** Number of messages waiting in the queue. */
  public int size() {
    return queue.size();
  }
}

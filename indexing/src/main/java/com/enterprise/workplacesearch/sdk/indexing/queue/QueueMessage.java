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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.enterprise.workplacesearch.sdk.indexing.Document;
import com.enterprise.workplacesearch.sdk.indexing.RunKind;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.util.List;

/**
 * Message passed from fetch threads to indexing workers through a {@link ConnectorQueue}.
 *
 * <p>A message is exactly one of a document batch, a checkpoint marker or the close signal.
 */
public final class QueueMessage {

  /** Message kinds. */
  public enum Kind {
    DOCUMENTS,
    CHECKPOINT,
    CLOSE
  }

  private static final QueueMessage CLOSE =
      new QueueMessage(Kind.CLOSE, ImmutableList.of(), null, null, null);

  private final Kind kind;
  private final ImmutableList<Document> documents;
  private final String objectType;
  private final Instant timestamp;
  private final RunKind runKind;

  private QueueMessage(
      Kind kind,
      ImmutableList<Document> documents,
      String objectType,
      Instant timestamp,
      RunKind runKind) {
    this.kind = kind;
    this.documents = documents;
    this.objectType = objectType;
    this.timestamp = timestamp;
    this.runKind = runKind;
  }

  public static QueueMessage documents(List<Document> documents) {
    return new QueueMessage(
        Kind.DOCUMENTS, ImmutableList.copyOf(checkNotNull(documents)), null, null, null);
  }

  public static QueueMessage checkpoint(String objectType, Instant timestamp, RunKind runKind) {
    return new QueueMessage(
        Kind.CHECKPOINT,
        ImmutableList.of(),
        checkNotNull(objectType),
        checkNotNull(timestamp),
        checkNotNull(runKind));
  }

  public static QueueMessage close() {
    return CLOSE;
  }

  public Kind getKind() {
    return kind;
  }

  /** Documents of a {@link Kind#DOCUMENTS} message; empty for other kinds. */
  public ImmutableList<Document> getDocuments() {
    return documents;
  }

  public String getObjectType() {
    checkState(kind == Kind.CHECKPOINT, "not a checkpoint message");
    return objectType;
  }

  public Instant getTimestamp() {
    checkState(kind == Kind.CHECKPOINT, "not a checkpoint message");
    return timestamp;
  }

  public RunKind getRunKind() {
    checkState(kind == Kind.CHECKPOINT, "not a checkpoint message");
    return runKind;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("kind", kind)
        .add("documents", kind == Kind.DOCUMENTS ? documents.size() : null)
        .add("objectType", objectType)
        .add("timestamp", timestamp)
        .add("runKind", runKind)
        .toString();
  }
}

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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Partitioning helpers shared by the fetch and indexing sides of a sync. */
public final class DocumentSplitter {
  private static final Logger logger = Logger.getLogger(DocumentSplitter.class.getName());

  /** Bytes added by the enclosing JSON array: brackets plus one comma per extra element. */
  private static final int ARRAY_OVERHEAD = 2;

  private DocumentSplitter() {}

  /**
   * Distributes {@code items} round-robin over {@code min(bucketCount, items.size())} buckets.
   *
   * <p>Item {@code i} goes to bucket {@code i % buckets}, so the result is deterministic for a
   * given input order and every item appears exactly once.
   */
  public static <T> List<List<T>> splitIntoBuckets(List<T> items, int bucketCount) {
    checkNotNull(items);
    checkArgument(bucketCount > 0, "bucket count must be greater than 0");
    int buckets = Math.min(bucketCount, items.size());
    List<List<T>> result = new ArrayList<>(buckets);
    for (int i = 0; i < buckets; i++) {
      result.add(new ArrayList<>());
    }
    for (int i = 0; i < items.size(); i++) {
      result.get(i % buckets).add(items.get(i));
    }
    return result;
  }

  /** Splits {@code items} into consecutive chunks of at most {@code size} items. */
  public static <T> List<List<T>> chunk(List<T> items, int size) {
    checkArgument(size > 0, "chunk size must be greater than 0");
    return Lists.partition(ImmutableList.copyOf(items), size);
  }

  /** Keeps the first document for each {@code (type, id)}, preserving order. */
  public static List<Document> deduplicate(List<Document> documents) {
    Map<String, Document> unique = new LinkedHashMap<>();
    for (Document document : documents) {
      unique.putIfAbsent(document.getKey(), document);
    }
    return new ArrayList<>(unique.values());
  }

  /**
   * Splits {@code documents} into chunks whose serialized JSON array is at most {@code maxBytes}.
   *
   * <p>A document larger than {@code maxBytes} on its own has its body removed and is placed in
   * a chunk by itself. It is left out entirely when it is still too large without its body.
   */
  public static List<List<Document>> splitBySize(List<Document> documents, int maxBytes) {
    checkArgument(maxBytes > 0, "byte limit must be greater than 0");
    List<List<Document>> chunks = new ArrayList<>();
    List<Document> current = new ArrayList<>();
    int currentSize = ARRAY_OVERHEAD;
    for (Document document : documents) {
      int size = document.serializedSize();
      if (size + ARRAY_OVERHEAD > maxBytes) {
        document.setBody(null);
        int strippedSize = document.serializedSize();
        if (strippedSize + ARRAY_OVERHEAD > maxBytes) {
          logger.log(
              Level.SEVERE,
              "Document {0} is {1} bytes without body, larger than the {2} byte limit; skipping it",
              new Object[] {document.getKey(), strippedSize, maxBytes});
          continue;
        }
        logger.log(
            Level.WARNING,
            "Document {0} is {1} bytes, larger than the {2} byte limit; indexing it without body",
            new Object[] {document.getKey(), size, maxBytes});
        if (!current.isEmpty()) {
          chunks.add(current);
          current = new ArrayList<>();
          currentSize = ARRAY_OVERHEAD;
        }
        chunks.add(ImmutableList.of(document));
        continue;
      }
      int separator = current.isEmpty() ? 0 : 1;
      if (currentSize + separator + size > maxBytes) {
        chunks.add(current);
        current = new ArrayList<>();
        currentSize = ARRAY_OVERHEAD;
        separator = 0;
      }
      current.add(document);
      currentSize += separator + size;
    }
    if (!current.isEmpty()) {
      chunks.add(current);
    }
    return chunks;
  }
}

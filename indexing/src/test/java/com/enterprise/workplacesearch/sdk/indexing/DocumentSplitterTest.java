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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.google.common.base.Strings;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

/** Tests for {@link DocumentSplitter}. */
public class DocumentSplitterTest {

  @Rule public ExpectedException thrown = ExpectedException.none();

  private static Document doc(String type, String id, String body) {
    return new Document().setType(type).setId(id).setTitle("title " + id).setBody(body);
  }

  private static int arraySize(List<Document> chunk) {
    int size = 2 + Math.max(0, chunk.size() - 1);
    for (Document d : chunk) {
      size += d.serializedSize();
    }
    return size;
  }

  @Test
  public void splitIntoBuckets_roundRobin() {
    List<Integer> items = ImmutableList.of(0, 1, 2, 3, 4, 5, 6);
    List<List<Integer>> buckets = DocumentSplitter.splitIntoBuckets(items, 3);
    assertEquals(
        ImmutableList.of(
            ImmutableList.of(0, 3, 6), ImmutableList.of(1, 4), ImmutableList.of(2, 5)),
        buckets);
  }

  @Test
  public void splitIntoBuckets_preservesEveryItemExactlyOnce() {
    List<String> items = new ArrayList<>();
    for (int i = 0; i < 53; i++) {
      items.add("user" + (i % 17));
    }
    for (int n = 1; n <= items.size(); n += 7) {
      List<List<String>> buckets = DocumentSplitter.splitIntoBuckets(items, n);
      assertEquals(n, buckets.size());
      HashMultiset<String> union = HashMultiset.create();
      buckets.forEach(union::addAll);
      assertEquals(HashMultiset.create(items), union);
      for (List<String> bucket : buckets) {
        assertTrue(bucket.size() >= items.size() / n);
        assertTrue(bucket.size() <= items.size() / n + 1);
      }
    }
  }

  @Test
  public void splitIntoBuckets_fewerItemsThanBuckets() {
    List<List<String>> buckets = DocumentSplitter.splitIntoBuckets(ImmutableList.of("a", "b"), 5);
    assertEquals(2, buckets.size());
  }

  @Test
  public void splitIntoBuckets_zeroBuckets_throws() {
    thrown.expect(IllegalArgumentException.class);
    DocumentSplitter.splitIntoBuckets(ImmutableList.of("a"), 0);
  }

  @Test
  public void chunk_105ItemsBy100_yieldsTwoChunks() {
    List<Integer> items = IntStream.range(0, 105).boxed().collect(Collectors.toList());
    List<List<Integer>> chunks = DocumentSplitter.chunk(items, 100);
    assertEquals(2, chunks.size());
    assertEquals(100, chunks.get(0).size());
    assertEquals(5, chunks.get(1).size());
    assertEquals(Integer.valueOf(0), chunks.get(0).get(0));
    assertEquals(Integer.valueOf(104), chunks.get(1).get(4));
  }

  @Test
  public void deduplicate_keepsFirstOccurrencePerTypeAndId() {
    Document first = doc("users", "1", "first");
    Document second = doc("users", "1", "second");
    Document otherType = doc("roles", "1", "role");
    List<Document> unique =
        DocumentSplitter.deduplicate(ImmutableList.of(first, otherType, second));
    assertEquals(2, unique.size());
    assertEquals("first", unique.get(0).getBody());
    assertEquals("roles", unique.get(1).getType());
  }

  @Test
  public void splitBySize_everyChunkWithinLimit() {
    List<Document> documents = new ArrayList<>();
    for (int i = 0; i < 40; i++) {
      documents.add(doc("chats", "id" + i, Strings.repeat("x", 10 + i * 7)));
    }
    int limit = 1200;
    List<List<Document>> chunks = DocumentSplitter.splitBySize(documents, limit);
    int total = 0;
    for (List<Document> chunk : chunks) {
      assertTrue(arraySize(chunk) <= limit);
      total += chunk.size();
    }
    assertEquals(documents.size(), total);
    assertTrue(chunks.size() > 1);
  }

  @Test
  public void splitBySize_oversizedDocumentLosesBodyAndStandsAlone() {
    Document small1 = doc("chats", "a", "short");
    Document huge = doc("files", "b", Strings.repeat("y", 5000));
    Document small2 = doc("chats", "c", "short");
    int limit = 1000;

    List<List<Document>> chunks =
        DocumentSplitter.splitBySize(ImmutableList.of(small1, huge, small2), limit);

    assertEquals(3, chunks.size());
    assertEquals(ImmutableList.of(small1), chunks.get(0));
    assertEquals(ImmutableList.of(huge), chunks.get(1));
    assertEquals(ImmutableList.of(small2), chunks.get(2));
    assertNull(huge.getBody());
    assertTrue(arraySize(chunks.get(1)) <= limit);
  }

  @Test
  public void splitBySize_tooLargeEvenWithoutBody_isSkipped() {
    Document small = doc("chats", "a", "short");
    Document wide = doc("files", "b", "short").setTitle(Strings.repeat("t", 2000));
    int limit = 1000;

    List<List<Document>> chunks =
        DocumentSplitter.splitBySize(ImmutableList.of(small, wide), limit);

    assertEquals(ImmutableList.of(ImmutableList.of(small)), chunks);
  }
}

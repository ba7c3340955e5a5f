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
package com.enterprise.workplacesearch.zoomconnector.command;

import static org.junit.Assert.assertEquals;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

import com.enterprise.workplacesearch.sdk.indexing.Document;
import com.enterprise.workplacesearch.sdk.indexing.DocumentRecord;
import com.enterprise.workplacesearch.sdk.indexing.EnterpriseSearchService;
import com.enterprise.workplacesearch.sdk.indexing.IndexResult;
import com.enterprise.workplacesearch.sdk.indexing.state.CheckpointStore;
import com.enterprise.workplacesearch.sdk.indexing.state.LocalDocumentStore;
import com.enterprise.workplacesearch.sdk.indexing.state.LocalFileStateHandler;
import com.enterprise.workplacesearch.zoomconnector.ConnectorContext;
import com.enterprise.workplacesearch.zoomconnector.client.FakeZoomTransport;
import com.enterprise.workplacesearch.zoomconnector.fetch.FieldSchema;
import com.enterprise.workplacesearch.zoomconnector.fetch.ObjectType;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

/** Tests for {@link FullSyncCommand}. */
@RunWith(MockitoJUnitRunner.class)
public class FullSyncCommandTest {
  private static final Instant START = Instant.parse("2022-01-01T00:00:00Z");
  private static final Instant NOW = Instant.parse("2022-06-15T12:00:00Z");
  private static final String USERS_JSON =
      "{\"users\":["
          + "{\"id\":\"u1\",\"first_name\":\"Ada\",\"created_at\":\"2022-02-01T00:00:00Z\"},"
          + "{\"id\":\"u2\",\"first_name\":\"Alan\",\"created_at\":\"2022-05-01T00:00:00Z\"},"
          + "{\"id\":\"u3\",\"first_name\":\"Old\",\"created_at\":\"2021-05-01T00:00:00Z\"}"
          + "]}";

  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  @Mock private EnterpriseSearchService searchService;

  private final Set<String> indexedIds = Collections.synchronizedSet(new HashSet<>());
  private FakeZoomTransport transport;
  private LocalFileStateHandler stateHandler;
  private CheckpointStore checkpointStore;

  @Before
  public void setUp() throws IOException {
    when(searchService.indexDocuments(anyList()))
        .thenAnswer(
            invocation -> {
              List<Document> documents = invocation.getArgument(0);
              for (Document document : documents) {
                indexedIds.add(document.getId());
              }
              return documents.stream()
                  .map(d -> new IndexResult(d.getId(), ImmutableList.of()))
                  .collect(Collectors.toList());
            });
    transport =
        new FakeZoomTransport()
            .respond("/v2/users", 200, USERS_JSON)
            .respond("/v2/groups", 200, "{\"groups\":[{\"id\":\"g1\",\"name\":\"Sales\"}]}");
    stateHandler = new LocalFileStateHandler(temporaryFolder.newFolder().getAbsolutePath());
    checkpointStore = new CheckpointStore(stateHandler, START);
  }

  private FullSyncCommand command(@Nullable Instant endTime) throws IOException {
    return new FullSyncCommand(
        new ConnectorContext.Builder()
            .setZoomClient(transport.newClient(temporaryFolder.newFolder().getAbsolutePath()))
            .setSearchService(searchService)
            .setDocumentStore(new LocalDocumentStore(stateHandler))
            .setCheckpointStore(checkpointStore)
            .setSchemas(
                ImmutableMap.of(
                    ObjectType.GROUPS, FieldSchema.defaultOf(ObjectType.GROUPS),
                    ObjectType.USERS, FieldSchema.defaultOf(ObjectType.USERS)))
            .setZoomSyncThreadCount(2)
            .setEnterpriseSearchSyncThreadCount(2)
            .setStartTime(START)
            .setEndTime(endTime)
            .setClock(Clock.fixed(NOW, ZoneOffset.UTC))
            .build());
  }

  @Test
  public void execute_indexesWindowFromStartTimeToNow() throws Exception {
    command(null).execute();

    assertEquals(ImmutableSet.of("g1", "u1", "u2"), indexedIds);
    assertEquals(NOW, checkpointStore.getCheckpoint("users", NOW).getStart());
    Set<String> stored = new HashSet<>();
    LocalDocumentStore documentStore = new LocalDocumentStore(stateHandler);
    for (DocumentRecord record : documentStore.loadStorage().getGlobalKeys()) {
      stored.add(record.getKey());
    }
    assertEquals(ImmutableSet.of("groups:g1", "users:u1", "users:u2"), stored);
  }

  @Test
  public void execute_configuredEndTime_boundsWindowAndCheckpoint() throws Exception {
    Instant end = Instant.parse("2022-03-01T00:00:00Z");

    command(end).execute();

    assertEquals(ImmutableSet.of("g1", "u1"), indexedIds);
    assertEquals(end, checkpointStore.getCheckpoint("users", NOW).getStart());
  }
}

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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.enterprise.workplacesearch.sdk.indexing.Document;
import com.enterprise.workplacesearch.sdk.indexing.EnterpriseSearchService;
import com.enterprise.workplacesearch.sdk.indexing.IndexResult;
import com.enterprise.workplacesearch.sdk.indexing.RunKind;
import com.enterprise.workplacesearch.sdk.indexing.SyncResult;
import com.enterprise.workplacesearch.sdk.indexing.TimeWindow;
import com.enterprise.workplacesearch.sdk.indexing.state.CheckpointStore;
import com.enterprise.workplacesearch.sdk.indexing.state.LocalDocumentStore;
import com.enterprise.workplacesearch.sdk.indexing.state.LocalFileStateHandler;
import com.enterprise.workplacesearch.zoomconnector.fetch.ObjectType;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

/** Tests for {@link SyncOrchestrator}. */
@RunWith(MockitoJUnitRunner.class)
public class SyncOrchestratorTest {
  private static final Instant FLOOR = Instant.parse("2011-10-12T00:00:00Z");
  private static final Instant END = Instant.parse("2022-06-01T00:00:00Z");
  private static final TimeWindow WINDOW = new TimeWindow(FLOOR, END);
  private static final Map<ObjectType, TimeWindow> WINDOWS =
      ImmutableMap.of(ObjectType.ROLES, WINDOW, ObjectType.MEETINGS, WINDOW);

  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  @Mock private ZoomFetchPipeline pipeline;
  @Mock private EnterpriseSearchService searchService;

  private LocalDocumentStore documentStore;
  private CheckpointStore checkpointStore;
  private SyncOrchestrator orchestrator;

  @Before
  public void setUp() throws IOException {
    LocalFileStateHandler stateHandler =
        new LocalFileStateHandler(temporaryFolder.newFolder().getAbsolutePath());
    documentStore = new LocalDocumentStore(stateHandler);
    checkpointStore = new CheckpointStore(stateHandler, FLOOR);
    orchestrator =
        new SyncOrchestrator.Builder()
            .setPipeline(pipeline)
            .setSearchService(searchService)
            .setDocumentStore(documentStore)
            .setCheckpointStore(checkpointStore)
            .setWorkerCount(2)
            .setBatchSize(10)
            .build();
  }

  private static Document meeting(String id) {
    return new Document()
        .setType("meetings")
        .setId(id)
        .setParentId("u1")
        .setCreatedAt("2022-05-01T00:00:00Z");
  }

  @SuppressWarnings("unchecked")
  private void acceptEverything() throws IOException {
    lenient()
        .when(searchService.indexDocuments(anyList()))
        .thenAnswer(
            invocation ->
                ((List<Document>) invocation.getArgument(0))
                    .stream()
                        .map(d -> new IndexResult(d.getId(), ImmutableList.of()))
                        .collect(Collectors.toList()));
  }

  private void pipelineEmits(ObjectType type, List<Document> documents) throws Exception {
    doAnswer(
            invocation -> {
              DocumentSink sink = invocation.getArgument(1);
              sink.accept(type, documents);
              return null;
            })
        .when(pipeline)
        .run(anyMap(), any(DocumentSink.class));
  }

  @Test
  public void run_success_commitsCheckpointsAndDocuments() throws Exception {
    acceptEverything();
    pipelineEmits(ObjectType.MEETINGS, ImmutableList.of(meeting("m1"), meeting("m2")));

    SyncResult result = orchestrator.run(WINDOWS, END, RunKind.FULL);

    assertEquals(ImmutableSet.of("meetings:m1", "meetings:m2"), result.getIndexedKeys());
    assertEquals(END, checkpointStore.getCheckpoint("meetings", END).getStart());
    assertEquals(FLOOR, checkpointStore.getCheckpoint("roles", END).getStart());
    assertEquals(2, documentStore.loadStorage().getGlobalKeys().size());
  }

  @Test
  public void run_rejectedDocumentIsNotStored() throws Exception {
    when(searchService.indexDocuments(anyList()))
        .thenReturn(
            ImmutableList.of(
                new IndexResult("m1", ImmutableList.of()),
                new IndexResult("m2", ImmutableList.of("Invalid field"))));
    pipelineEmits(ObjectType.MEETINGS, ImmutableList.of(meeting("m1"), meeting("m2")));

    orchestrator.run(WINDOWS, END, RunKind.INCREMENTAL);

    assertEquals(1, documentStore.loadStorage().getGlobalKeys().size());
    assertEquals("m1", documentStore.loadStorage().getGlobalKeys().get(0).getId());
  }

  @Test
  public void run_fetchFailure_commitsNothing() throws Exception {
    acceptEverything();
    doThrow(new IOException("Zoom unavailable")).when(pipeline).run(anyMap(), any());

    try {
      orchestrator.run(WINDOWS, END, RunKind.INCREMENTAL);
      fail("expected IOException");
    } catch (IOException e) {
      assertEquals("Zoom unavailable", e.getMessage());
    }
    assertEquals(FLOOR, checkpointStore.getCheckpoint("meetings", END).getStart());
    assertTrue(documentStore.loadStorage().getGlobalKeys().isEmpty());
  }

  @Test
  public void run_indexingFailure_commitsNothing() throws Exception {
    when(searchService.indexDocuments(anyList())).thenThrow(new IOException("index down"));
    pipelineEmits(ObjectType.MEETINGS, ImmutableList.of(meeting("m1")));

    try {
      orchestrator.run(WINDOWS, END, RunKind.FULL);
      fail("expected IOException");
    } catch (IOException e) {
      assertEquals("Error while indexing documents", e.getMessage());
    }
    assertEquals(FLOOR, checkpointStore.getCheckpoint("meetings", END).getStart());
    assertTrue(documentStore.loadStorage().getGlobalKeys().isEmpty());
  }

  @Test
  public void run_documentStoreFailure_leavesCheckpointsUnchanged() throws Exception {
    acceptEverything();
    pipelineEmits(ObjectType.MEETINGS, ImmutableList.of(meeting("m1")));
    LocalDocumentStore failingStore = mock(LocalDocumentStore.class);
    doThrow(new IOException("disk full"))
        .when(failingStore)
        .storeIndexedDocuments(any(), any());
    SyncOrchestrator failingOrchestrator =
        new SyncOrchestrator.Builder()
            .setPipeline(pipeline)
            .setSearchService(searchService)
            .setDocumentStore(failingStore)
            .setCheckpointStore(checkpointStore)
            .setWorkerCount(2)
            .setBatchSize(10)
            .build();

    try {
      failingOrchestrator.run(WINDOWS, END, RunKind.INCREMENTAL);
      fail("expected IOException");
    } catch (IOException e) {
      assertEquals("disk full", e.getMessage());
    }
    assertEquals(FLOOR, checkpointStore.getCheckpoint("meetings", END).getStart());
  }
}

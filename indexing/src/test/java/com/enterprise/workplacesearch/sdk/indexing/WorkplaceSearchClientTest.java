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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.enterprise.workplacesearch.sdk.RetryPolicy;
import com.google.api.client.http.HttpResponseException;
import com.google.api.client.json.Json;
import com.google.api.client.testing.http.MockHttpTransport;
import com.google.api.client.testing.http.MockLowLevelHttpRequest;
import com.google.api.client.testing.http.MockLowLevelHttpResponse;
import com.google.api.client.util.BackOff;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

/** Tests for {@link WorkplaceSearchClient}. */
public class WorkplaceSearchClientTest {

  @Rule public ExpectedException thrown = ExpectedException.none();

  private static final String HOST = "http://localhost:3002/";
  private static final String SOURCES = "http://localhost:3002/api/ws/v1/sources";

  /** Replays canned responses and records the requests it receives. */
  private static class RecordingTransport extends MockHttpTransport {
    final Deque<MockLowLevelHttpResponse> responses = new ArrayDeque<>();
    final List<MockLowLevelHttpRequest> requests = new ArrayList<>();
    final List<String> methods = new ArrayList<>();

    RecordingTransport respond(int status, String json) {
      responses.add(
          new MockLowLevelHttpResponse()
              .setStatusCode(status)
              .setContentType(Json.MEDIA_TYPE)
              .setContent(json));
      return this;
    }

    @Override
    public MockLowLevelHttpRequest buildRequest(String method, String url) {
      MockLowLevelHttpRequest request = new MockLowLevelHttpRequest(url);
      request.setResponse(responses.remove());
      requests.add(request);
      methods.add(method);
      return request;
    }
  }

  private WorkplaceSearchClient client(RecordingTransport transport, String sourceId) {
    return new WorkplaceSearchClient.Builder()
        .setHostUrl(HOST)
        .setApiKey("secret-key")
        .setSourceId(sourceId)
        .setTransport(transport)
        .setRetryPolicy(
            new RetryPolicy.Builder()
                .setMaxAttempts(2)
                .setBackOffFactory(() -> BackOff.ZERO_BACKOFF)
                .build())
        .build();
  }

  @Test
  public void indexDocuments_postsBulkCreateAndParsesResults() throws IOException {
    RecordingTransport transport =
        new RecordingTransport()
            .respond(
                200,
                "{\"results\":[{\"id\":\"1\",\"errors\":[]},"
                    + "{\"id\":\"2\",\"errors\":[\"bad created_at\"]}]}");
    List<Document> documents =
        ImmutableList.of(
            new Document().setType("users").setId("1").setTitle("Ada"),
            new Document().setType("users").setId("2").setTitle("Grace"));

    List<IndexResult> results = client(transport, "src1").indexDocuments(documents);

    assertEquals(2, results.size());
    assertTrue(results.get(0).isSuccess());
    assertFalse(results.get(1).isSuccess());
    assertEquals(ImmutableList.of("bad created_at"), results.get(1).getErrors());
    MockLowLevelHttpRequest request = transport.requests.get(0);
    assertEquals("POST", transport.methods.get(0));
    assertEquals(SOURCES + "/src1/documents/bulk_create", request.getUrl());
    assertEquals(
        ImmutableList.of("Bearer secret-key"), request.getHeaders().get("authorization"));
    assertTrue(request.getContentAsString().contains("\"title\":\"Grace\""));
  }

  @Test
  public void indexDocuments_emptyList_makesNoCall() throws IOException {
    RecordingTransport transport = new RecordingTransport();
    assertTrue(client(transport, "src1").indexDocuments(ImmutableList.of()).isEmpty());
    assertTrue(transport.requests.isEmpty());
  }

  @Test
  public void deleteDocuments_postsIds() throws IOException {
    RecordingTransport transport =
        new RecordingTransport()
            .respond(200, "{\"results\":[{\"id\":\"1\",\"success\":true}]}");
    client(transport, "src1").deleteDocuments(ImmutableList.of("1"));
    MockLowLevelHttpRequest request = transport.requests.get(0);
    assertEquals(SOURCES + "/src1/documents/bulk_destroy", request.getUrl());
    assertEquals("[\"1\"]", request.getContentAsString());
  }

  @Test
  public void listPermissions_followsPages() throws IOException {
    RecordingTransport transport =
        new RecordingTransport()
            .respond(
                200,
                "{\"meta\":{\"page\":{\"current\":1,\"total_pages\":2}},"
                    + "\"results\":[{\"user\":\"alice\",\"permissions\":[\"User:Read\"]}]}")
            .respond(
                200,
                "{\"meta\":{\"page\":{\"current\":2,\"total_pages\":2}},"
                    + "\"results\":[{\"user\":\"bob\",\"permissions\":[]}]}");

    List<UserPermissions> permissions = client(transport, "src1").listPermissions();

    assertEquals(2, permissions.size());
    assertEquals("alice", permissions.get(0).getUser());
    assertEquals(ImmutableList.of("User:Read"), permissions.get(0).getPermissions());
    assertEquals("bob", permissions.get(1).getUser());
    assertEquals(2, transport.requests.size());
  }

  @Test
  public void addPermissions_postsToUserEndpoint() throws IOException {
    RecordingTransport transport =
        new RecordingTransport().respond(200, "{\"user\":\"alice\",\"permissions\":[\"x\"]}");
    client(transport, "src1").addPermissions("alice", ImmutableList.of("x"));
    MockLowLevelHttpRequest request = transport.requests.get(0);
    assertEquals(SOURCES + "/src1/permissions/alice/add", request.getUrl());
    assertEquals("{\"permissions\":[\"x\"]}", request.getContentAsString());
  }

  @Test
  public void removePermissions_escapesIdentity() throws IOException {
    RecordingTransport transport =
        new RecordingTransport().respond(200, "{\"user\":\"a/b\",\"permissions\":[]}");
    client(transport, "src1").removePermissions("a/b?c#d", ImmutableList.of("x"));
    assertEquals(
        SOURCES + "/src1/permissions/a%2Fb%3Fc%23d/remove", transport.requests.get(0).getUrl());
  }

  @Test
  public void createContentSource_returnsNewId() throws IOException {
    RecordingTransport transport = new RecordingTransport().respond(200, "{\"id\":\"new-src\"}");
    String id =
        client(transport, "")
            .createContentSource(
                "Zoom", ImmutableMap.of("title", "text"), ImmutableMap.of("color", "#000000"));
    assertEquals("new-src", id);
    assertEquals(SOURCES, transport.requests.get(0).getUrl());
  }

  @Test
  public void serverError_isNotRetried() throws IOException {
    RecordingTransport transport =
        new RecordingTransport().respond(500, "{}").respond(200, "{\"results\":[]}");
    thrown.expect(HttpResponseException.class);
    try {
      client(transport, "src1").deleteDocuments(ImmutableList.of("1"));
    } finally {
      assertEquals(1, transport.requests.size());
    }
  }

  @Test
  public void sourceOperation_withoutSourceId_throwsIllegalState() throws IOException {
    thrown.expect(IllegalStateException.class);
    client(new RecordingTransport(), "").deleteDocuments(ImmutableList.of("1"));
  }
}

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
package com.enterprise.workplacesearch.zoomconnector.client;

import com.enterprise.workplacesearch.sdk.RetryPolicy;
import com.enterprise.workplacesearch.sdk.indexing.state.LocalFileStateHandler;
import com.google.api.client.http.GenericUrl;
import com.google.api.client.json.Json;
import com.google.api.client.testing.http.MockHttpTransport;
import com.google.api.client.testing.http.MockLowLevelHttpRequest;
import com.google.api.client.testing.http.MockLowLevelHttpResponse;
import com.google.api.client.util.BackOff;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Serves canned responses keyed by request path, such as {@code /v2/users}. Responses for a path
 * are returned in order and the last one repeats. Unknown paths answer 404.
 */
public class FakeZoomTransport extends MockHttpTransport {
  public static final String API_BASE_URL = "https://api.zoom.test/v2/";
  public static final String TOKEN_URL = "https://zoom.test/oauth/token";
  public static final String ACCESS_TOKEN = "valid-access-token";

  private final Map<String, Deque<String[]>> responses = new HashMap<>();
  private final List<MockLowLevelHttpRequest> requests = new ArrayList<>();

  /** Queues a JSON response for {@code path}. */
  public synchronized FakeZoomTransport respond(String path, int status, String json) {
    responses
        .computeIfAbsent(path, p -> new ArrayDeque<>())
        .add(new String[] {String.valueOf(status), json});
    return this;
  }

  private static MockLowLevelHttpResponse jsonResponse(int status, String json) {
    return new MockLowLevelHttpResponse()
        .setStatusCode(status)
        .setContentType(Json.MEDIA_TYPE)
        .setContent(json);
  }

  @Override
  public synchronized MockLowLevelHttpRequest buildRequest(String method, String url) {
    MockLowLevelHttpRequest request = new MockLowLevelHttpRequest(url);
    Deque<String[]> queued = responses.get(new GenericUrl(url).getRawPath());
    if (queued == null || queued.isEmpty()) {
      request.setResponse(jsonResponse(404, "{\"code\":404,\"message\":\"Not found\"}"));
    } else {
      String[] next = queued.size() > 1 ? queued.remove() : queued.peek();
      request.setResponse(jsonResponse(Integer.parseInt(next[0]), next[1]));
    }
    requests.add(request);
    return request;
  }

  /** Requests received so far. */
  public synchronized List<MockLowLevelHttpRequest> getRequests() {
    return new ArrayList<>(requests);
  }

  /** URLs of the requests received so far whose path is {@code path}. */
  public synchronized List<String> getRequestedUrls(String path) {
    List<String> urls = new ArrayList<>();
    for (MockLowLevelHttpRequest request : requests) {
      if (new GenericUrl(request.getUrl()).getRawPath().equals(path)) {
        urls.add(request.getUrl());
      }
    }
    return urls;
  }

  /** Retry policy that gives up after the first attempt. */
  public static RetryPolicy noRetries() {
    return new RetryPolicy.Builder()
        .setMaxAttempts(1)
        .setBackOffFactory(() -> BackOff.ZERO_BACKOFF)
        .build();
  }

  /**
   * Creates a client against this transport. A valid access token is stored in {@code stateDir}
   * first, so no token request is made.
   */
  public ZoomClient newClient(String stateDir) throws IOException {
    LocalFileStateHandler stateHandler = new LocalFileStateHandler(stateDir);
    stateHandler.write(
        ZoomTokenProvider.SECRETS_FILE_NAME,
        new CredentialState(
                "refresh-token", ACCESS_TOKEN, Instant.now().plus(Duration.ofHours(1)))
            .toBytes());
    ZoomTokenProvider tokenProvider =
        new ZoomTokenProvider.Builder()
            .setTransport(this)
            .setTokenUrl(TOKEN_URL)
            .setClientId("client-id")
            .setClientSecret("client-secret")
            .setStateHandler(stateHandler)
            .setRetryPolicy(noRetries())
            .build();
    return new ZoomClient.Builder()
        .setBaseUrl(API_BASE_URL)
        .setTransport(this)
        .setTokenProvider(tokenProvider)
        .setRetryPolicy(noRetries())
        .build();
  }
}

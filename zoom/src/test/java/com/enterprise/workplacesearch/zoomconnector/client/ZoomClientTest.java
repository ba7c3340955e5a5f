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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpResponseException;
import com.google.api.client.json.GenericJson;
import com.google.api.client.testing.http.MockLowLevelHttpRequest;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

/** Tests for {@link ZoomClient}. */
public class ZoomClientTest {
  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();
  @Rule public ExpectedException thrown = ExpectedException.none();

  private FakeZoomTransport transport;
  private ZoomClient client;

  @Before
  public void setUp() throws IOException {
    transport = new FakeZoomTransport();
    client = transport.newClient(temporaryFolder.newFolder().getAbsolutePath());
  }

  @Test
  public void newUrl_resolvesAgainstApiRoot() {
    assertEquals(
        "https://api.zoom.test/v2/users/u1/meetings",
        client.newUrl("users/u1/meetings").build());
  }

  @Test
  public void get_sendsBearerToken() throws IOException {
    transport.respond("/v2/roles/r1", 200, "{\"id\":\"r1\",\"name\":\"Admin\"}");

    GenericJson role = client.get(client.newUrl("roles/r1"));

    assertEquals("Admin", role.get("name"));
    MockLowLevelHttpRequest request = transport.getRequests().get(0);
    assertEquals(
        "Bearer " + FakeZoomTransport.ACCESS_TOKEN, request.getFirstHeaderValue("Authorization"));
  }

  @Test
  public void get_unauthorized_renewsTokenAndRetriesOnce() throws IOException {
    transport
        .respond("/v2/roles/r1", 401, "{\"code\":124,\"message\":\"Invalid access token.\"}")
        .respond("/v2/roles/r1", 200, "{\"id\":\"r1\"}")
        .respond(
            "/oauth/token",
            200,
            "{\"access_token\":\"renewed\",\"refresh_token\":\"refresh-2\","
                + "\"token_type\":\"bearer\"}");

    GenericJson role = client.get(client.newUrl("roles/r1"));

    assertEquals("r1", role.get("id"));
    List<MockLowLevelHttpRequest> requests = transport.getRequests();
    assertEquals(3, requests.size());
    assertEquals("Bearer renewed", requests.get(2).getFirstHeaderValue("Authorization"));
  }

  @Test
  public void get_notFound_propagates() throws IOException {
    thrown.expect(HttpResponseException.class);
    client.get(client.newUrl("users/missing"));
  }

  @Test
  public void list_followsNextPageToken() throws IOException {
    transport
        .respond(
            "/v2/users",
            200,
            "{\"users\":[{\"id\":\"u1\"},{\"id\":\"u2\"}],\"next_page_token\":\"page-2\"}")
        .respond("/v2/users", 200, "{\"users\":[{\"id\":\"u3\"}],\"next_page_token\":\"\"}");

    GenericUrl url = client.newUrl("users");
    url.set("page_size", 300);
    List<Map<String, Object>> users = client.list(url, "users");

    assertEquals(3, users.size());
    assertEquals("u3", users.get(2).get("id"));
    List<String> urls = transport.getRequestedUrls("/v2/users");
    assertEquals(2, urls.size());
    assertTrue(urls.get(0).contains("page_size=300"));
    assertTrue(urls.get(1).contains("next_page_token=page-2"));
  }

  @Test
  public void list_missingKey_isEmpty() throws IOException {
    transport.respond("/v2/groups", 200, "{\"total_records\":0}");

    assertTrue(client.list(client.newUrl("groups"), "groups").isEmpty());
  }
}

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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.enterprise.workplacesearch.sdk.indexing.state.JsonState;
import com.enterprise.workplacesearch.sdk.indexing.state.LocalFileStateHandler;
import com.google.api.client.testing.http.MockLowLevelHttpRequest;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/** Tests for {@link ZoomTokenProvider}. */
public class ZoomTokenProviderTest {
  private static final String TOKEN_PATH = "/oauth/token";
  private static final Instant NOW = Instant.parse("2022-06-01T10:00:00Z");

  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  private FakeZoomTransport transport;
  private LocalFileStateHandler stateHandler;

  @Before
  public void setUp() throws IOException {
    transport = new FakeZoomTransport();
    stateHandler = new LocalFileStateHandler(temporaryFolder.newFolder().getAbsolutePath());
  }

  private ZoomTokenProvider provider(String authorizationCode) {
    return new ZoomTokenProvider.Builder()
        .setTransport(transport)
        .setTokenUrl(FakeZoomTransport.TOKEN_URL)
        .setClientId("client-id")
        .setClientSecret("client-secret")
        .setAuthorizationCode(authorizationCode)
        .setRedirectUri("https://example.com/callback")
        .setStateHandler(stateHandler)
        .setRetryPolicy(FakeZoomTransport.noRetries())
        .setClock(Clock.fixed(NOW, ZoneOffset.UTC))
        .build();
  }

  private void storeCredentials(String refresh, String access, Instant expiry)
      throws IOException {
    stateHandler.write(
        ZoomTokenProvider.SECRETS_FILE_NAME,
        new CredentialState(refresh, access, expiry).toBytes());
  }

  private CredentialState storedCredentials() throws IOException {
    return JsonState.parse(
        stateHandler.read(ZoomTokenProvider.SECRETS_FILE_NAME), CredentialState.class);
  }

  private static String tokenJson(String access, String refresh) {
    return String.format(
        "{\"access_token\":\"%s\",\"refresh_token\":\"%s\",\"token_type\":\"bearer\","
            + "\"expires_in\":3599}",
        access, refresh);
  }

  private static String errorJson(String reason) {
    return "{\"error\":\"invalid_request\",\"reason\":\"" + reason + "\"}";
  }

  @Test
  public void getAccessToken_validStoredToken_noTokenRequest() throws IOException {
    storeCredentials("refresh-1", "access-1", NOW.plus(Duration.ofMinutes(10)));

    assertEquals("access-1", provider("").getAccessToken());
    assertTrue(transport.getRequests().isEmpty());
  }

  @Test
  public void getAccessToken_expiredToken_usesRefreshGrant() throws IOException {
    storeCredentials("refresh-1", "access-1", NOW.minus(Duration.ofMinutes(1)));
    transport.respond(TOKEN_PATH, 200, tokenJson("access-2", "refresh-2"));

    assertEquals("access-2", provider("").getAccessToken());

    List<MockLowLevelHttpRequest> requests = transport.getRequests();
    assertEquals(1, requests.size());
    assertTrue(requests.get(0).getContentAsString().contains("grant_type=refresh_token"));
    assertTrue(requests.get(0).getContentAsString().contains("refresh_token=refresh-1"));
    CredentialState stored = storedCredentials();
    assertEquals("refresh-2", stored.getRefreshToken());
    assertEquals("access-2", stored.getAccessToken());
    assertEquals(
        NOW.plus(ZoomTokenProvider.TOKEN_LIFETIME).toString(), stored.getAccessTokenExpiry());
  }

  @Test
  public void getAccessToken_noStoredState_usesAuthorizationCode() throws IOException {
    transport.respond(TOKEN_PATH, 200, tokenJson("access-1", "refresh-1"));

    assertEquals("access-1", provider("auth-code").getAccessToken());

    String body = transport.getRequests().get(0).getContentAsString();
    assertTrue(body.contains("grant_type=authorization_code"));
    assertTrue(body.contains("code=auth-code"));
    assertEquals("refresh-1", storedCredentials().getRefreshToken());
  }

  @Test
  public void getAccessToken_rejectedRefreshToken_fallsBackToAuthorizationCode()
      throws IOException {
    storeCredentials("stale-refresh", "access-0", NOW.minus(Duration.ofHours(2)));
    transport
        .respond(TOKEN_PATH, 401, errorJson(ZoomTokenProvider.REASON_INVALID_TOKEN))
        .respond(TOKEN_PATH, 200, tokenJson("access-1", "refresh-1"));

    assertEquals("access-1", provider("auth-code").getAccessToken());

    List<MockLowLevelHttpRequest> requests = transport.getRequests();
    assertEquals(2, requests.size());
    assertTrue(requests.get(0).getContentAsString().contains("grant_type=refresh_token"));
    assertTrue(requests.get(1).getContentAsString().contains("grant_type=authorization_code"));
    assertEquals("refresh-1", storedCredentials().getRefreshToken());
  }

  @Test
  public void getAccessToken_invalidAuthorizationCode_clearsSecrets() throws IOException {
    storeCredentials("stale-refresh", "access-0", NOW.minus(Duration.ofHours(2)));
    transport
        .respond(TOKEN_PATH, 401, errorJson(ZoomTokenProvider.REASON_INVALID_TOKEN))
        .respond(TOKEN_PATH, 400, errorJson(ZoomTokenProvider.REASON_INVALID_CODE));

    try {
      provider("used-code").getAccessToken();
      fail("expected InvalidCredentialException");
    } catch (InvalidCredentialException e) {
      assertEquals(ZoomTokenProvider.CONFIG_AUTHORIZATION_CODE, e.getConfigKey());
    }
    CredentialState stored = storedCredentials();
    assertNull(stored.getRefreshToken());
    assertNull(stored.getAccessToken());
  }

  @Test
  public void getAccessToken_noRefreshTokenAndNoCode_fails() throws IOException {
    try {
      provider("").getAccessToken();
      fail("expected InvalidCredentialException");
    } catch (InvalidCredentialException e) {
      assertEquals(ZoomTokenProvider.CONFIG_AUTHORIZATION_CODE, e.getConfigKey());
    }
    assertTrue(transport.getRequests().isEmpty());
  }

  @Test
  public void getAccessToken_redirectMismatch_namesRedirectUri() throws IOException {
    transport.respond(TOKEN_PATH, 400, errorJson(ZoomTokenProvider.REASON_REDIRECT_MISMATCH));

    try {
      provider("auth-code").getAccessToken();
      fail("expected InvalidCredentialException");
    } catch (InvalidCredentialException e) {
      assertEquals(ZoomTokenProvider.CONFIG_REDIRECT_URI, e.getConfigKey());
    }
  }

  @Test
  public void getAccessToken_badClientCredentials_namesClientId() throws IOException {
    transport.respond(TOKEN_PATH, 401, errorJson("Invalid client_id or client_secret"));

    try {
      provider("auth-code").getAccessToken();
      fail("expected InvalidCredentialException");
    } catch (InvalidCredentialException e) {
      assertTrue(e.getConfigKey().contains(ZoomTokenProvider.CONFIG_CLIENT_ID));
    }
  }

  @Test
  public void refreshAccessToken_alreadyRenewed_reusesToken() throws IOException {
    storeCredentials("refresh-1", "access-1", NOW.plus(Duration.ofMinutes(30)));
    ZoomTokenProvider provider = provider("");

    assertEquals("access-1", provider.refreshAccessToken("access-0"));
    assertTrue(transport.getRequests().isEmpty());
  }

  @Test
  public void refreshAccessToken_rejectedCurrentToken_renews() throws IOException {
    storeCredentials("refresh-1", "access-1", NOW.plus(Duration.ofMinutes(30)));
    transport.respond(TOKEN_PATH, 200, tokenJson("access-2", "refresh-2"));
    ZoomTokenProvider provider = provider("");

    assertEquals("access-2", provider.refreshAccessToken("access-1"));
    assertEquals("access-2", provider.getAccessToken());
    assertEquals(1, transport.getRequests().size());
  }
}

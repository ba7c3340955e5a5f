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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.enterprise.workplacesearch.sdk.RepositoryException;
import com.enterprise.workplacesearch.sdk.RetryPolicy;
import com.enterprise.workplacesearch.sdk.config.Configuration;
import com.enterprise.workplacesearch.sdk.indexing.state.JsonState;
import com.enterprise.workplacesearch.sdk.indexing.state.LocalFileStateHandler;
import com.google.api.client.auth.oauth2.AuthorizationCodeTokenRequest;
import com.google.api.client.auth.oauth2.RefreshTokenRequest;
import com.google.api.client.auth.oauth2.TokenErrorResponse;
import com.google.api.client.auth.oauth2.TokenResponse;
import com.google.api.client.auth.oauth2.TokenResponseException;
import com.google.api.client.http.BasicAuthentication;
import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.jackson2.JacksonFactory;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Issues Zoom OAuth access tokens to every fetch thread of a run.
 *
 * <p>The stored {@link CredentialState} is read and renewed under a single lock. A thread that
 * waited for the lock while another thread renewed the token reuses the renewed token. Renewal
 * uses the stored refresh token and falls back to the configured authorization code when no
 * usable refresh token is stored.
 *
 * <p>Configuration parameters:
 *
 * <ul>
 *   <li>{@value #CONFIG_CLIENT_ID}, {@value #CONFIG_CLIENT_SECRET} - OAuth app credentials.
 *   <li>{@value #CONFIG_AUTHORIZATION_CODE} - authorization code of the first run.
 *   <li>{@value #CONFIG_REDIRECT_URI} - redirect URI the authorization code was issued for.
 *   <li>{@value #CONFIG_OAUTH_TOKEN_URL} - token endpoint, defaults to {@value
 *       #DEFAULT_OAUTH_TOKEN_URL}.
 * </ul>
 */
public class ZoomTokenProvider {
  private static final Logger logger = Logger.getLogger(ZoomTokenProvider.class.getName());

  public static final String CONFIG_CLIENT_ID = "zoom.clientId";
  public static final String CONFIG_CLIENT_SECRET = "zoom.clientSecret";
  public static final String CONFIG_AUTHORIZATION_CODE = "zoom.authorizationCode";
  public static final String CONFIG_REDIRECT_URI = "zoom.redirectUri";
  public static final String CONFIG_OAUTH_TOKEN_URL = "zoom.oauthTokenUrl";
  public static final String DEFAULT_OAUTH_TOKEN_URL = "https://zoom.us/oauth/token";

  public static final String SECRETS_FILE_NAME = "secrets.json";
  @VisibleForTesting static final Duration TOKEN_LIFETIME = Duration.ofSeconds(3500);

  @VisibleForTesting static final String REASON_INVALID_TOKEN = "Invalid Token!";
  @VisibleForTesting static final String REASON_INVALID_CODE = "Invalid authorization code";

  @VisibleForTesting
  static final String REASON_REDIRECT_MISMATCH = "Invalid request : Redirect URI mismatch.";

  private static final JsonFactory JSON_FACTORY = JacksonFactory.getDefaultInstance();

  private final ReentrantLock lock = new ReentrantLock();
  private final HttpTransport transport;
  private final GenericUrl tokenUrl;
  private final String clientId;
  private final String clientSecret;
  private final String authorizationCode;
  private final String redirectUri;
  private final LocalFileStateHandler stateHandler;
  private final RetryPolicy retryPolicy;
  private final Clock clock;

  // guarded by lock
  private CredentialState credentials;

  private ZoomTokenProvider(Builder builder) {
    this.transport = builder.transport;
    this.tokenUrl = new GenericUrl(builder.tokenUrl);
    this.clientId = builder.clientId;
    this.clientSecret = builder.clientSecret;
    this.authorizationCode = Strings.nullToEmpty(builder.authorizationCode);
    this.redirectUri = Strings.nullToEmpty(builder.redirectUri);
    this.stateHandler = builder.stateHandler;
    this.retryPolicy = builder.retryPolicy;
    this.clock = builder.clock;
  }

  /** Creates a token provider for the OAuth app named in the connector configuration. */
  public static ZoomTokenProvider fromConfiguration(
      LocalFileStateHandler stateHandler, RetryPolicy retryPolicy) {
    checkState(Configuration.isInitialized(), "config not initialized");
    return new Builder()
        .setClientId(Configuration.getString(CONFIG_CLIENT_ID, null).get())
        .setClientSecret(Configuration.getString(CONFIG_CLIENT_SECRET, null).get())
        .setAuthorizationCode(Configuration.getString(CONFIG_AUTHORIZATION_CODE, "").get())
        .setRedirectUri(Configuration.getString(CONFIG_REDIRECT_URI, "").get())
        .setTokenUrl(
            Configuration.getString(CONFIG_OAUTH_TOKEN_URL, DEFAULT_OAUTH_TOKEN_URL).get())
        .setStateHandler(stateHandler)
        .setRetryPolicy(retryPolicy)
        .build();
  }

  /**
   * Returns a valid access token, renewing it first if the stored one is missing or expired.
   *
   * @throws InvalidCredentialException if Zoom rejects the configured credentials
   */
  public String getAccessToken() throws IOException {
    lock.lock();
    try {
      CredentialState current = loadCredentials();
      if (current.isAccessTokenValid(clock.instant())) {
        return current.getAccessToken();
      }
      return renew(current).getAccessToken();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Renews the access token after the API rejected {@code rejectedToken}. If another thread has
   * already replaced that token, the replacement is returned without contacting Zoom.
   */
  public String refreshAccessToken(String rejectedToken) throws IOException {
    lock.lock();
    try {
      CredentialState current = loadCredentials();
      if (current.isAccessTokenValid(clock.instant())
          && !Objects.equals(current.getAccessToken(), rejectedToken)) {
        return current.getAccessToken();
      }
      return renew(current).getAccessToken();
    } finally {
      lock.unlock();
    }
  }

  private CredentialState renew(CredentialState current) throws IOException {
    logger.log(Level.INFO, "Generating the Zoom access token for client ID {0}", clientId);
    if (current.hasRefreshToken()) {
      try {
        TokenResponse response =
            retryPolicy.call(
                "refresh Zoom access token",
                () ->
                    new RefreshTokenRequest(
                            transport, JSON_FACTORY, tokenUrl, current.getRefreshToken())
                        .setClientAuthentication(clientAuthentication())
                        .execute());
        return store(response, current.getRefreshToken());
      } catch (TokenResponseException e) {
        String reason = reasonOf(e);
        if (!isInvalidGrant(reason)) {
          throw classify(e, reason);
        }
        logger.log(
            Level.WARNING,
            "Stored Zoom refresh token was rejected ({0}), using the authorization code",
            reason);
        store(new CredentialState());
      }
    }
    if (authorizationCode.isEmpty()) {
      throw new InvalidCredentialException(
          CONFIG_AUTHORIZATION_CODE, "no usable refresh token is stored", null);
    }
    try {
      TokenResponse response =
          retryPolicy.call(
              "exchange Zoom authorization code",
              () ->
                  new AuthorizationCodeTokenRequest(
                          transport, JSON_FACTORY, tokenUrl, authorizationCode)
                      .setRedirectUri(redirectUri)
                      .setClientAuthentication(clientAuthentication())
                      .execute());
      return store(response, null);
    } catch (TokenResponseException e) {
      String reason = reasonOf(e);
      if (isInvalidGrant(reason)) {
        store(new CredentialState());
        throw new InvalidCredentialException(CONFIG_AUTHORIZATION_CODE, reason, e);
      }
      throw classify(e, reason);
    }
  }

  private BasicAuthentication clientAuthentication() {
    return new BasicAuthentication(clientId, clientSecret);
  }

  private CredentialState store(TokenResponse response, String previousRefreshToken)
      throws IOException {
    String refreshToken =
        Strings.isNullOrEmpty(response.getRefreshToken())
            ? previousRefreshToken
            : response.getRefreshToken();
    CredentialState renewed =
        new CredentialState(
            refreshToken, response.getAccessToken(), clock.instant().plus(TOKEN_LIFETIME));
    store(renewed);
    logger.log(Level.INFO, "Saved the renewed Zoom tokens");
    return renewed;
  }

  private void store(CredentialState state) throws IOException {
    stateHandler.write(SECRETS_FILE_NAME, state.toBytes());
    credentials = state;
  }

  private CredentialState loadCredentials() throws IOException {
    if (credentials != null) {
      return credentials;
    }
    byte[] content = stateHandler.read(SECRETS_FILE_NAME);
    if (content == null) {
      credentials = new CredentialState();
      return credentials;
    }
    try {
      credentials = JsonState.parse(content, CredentialState.class);
    } catch (RepositoryException e) {
      logger.log(Level.WARNING, "Ignoring unreadable " + SECRETS_FILE_NAME, e);
      credentials = new CredentialState();
    }
    return credentials;
  }

  private static boolean isInvalidGrant(String reason) {
    return REASON_INVALID_TOKEN.equals(reason) || REASON_INVALID_CODE.equals(reason);
  }

  private static IOException classify(TokenResponseException e, String reason) {
    int status = e.getStatusCode();
    if (status != 400 && status != 401) {
      return e;
    }
    if (REASON_REDIRECT_MISMATCH.equals(reason)) {
      throw new InvalidCredentialException(CONFIG_REDIRECT_URI, reason, e);
    }
    throw new InvalidCredentialException(
        CONFIG_CLIENT_ID + " or " + CONFIG_CLIENT_SECRET, reason, e);
  }

  private static String reasonOf(TokenResponseException e) {
    TokenErrorResponse details = e.getDetails();
    if (details != null) {
      Object reason = details.get("reason");
      if (reason != null) {
        return reason.toString();
      }
      if (details.getErrorDescription() != null) {
        return details.getErrorDescription();
      }
    }
    return e.getStatusMessage();
  }

  /** Builder for creating an instance of {@link ZoomTokenProvider} */
  public static class Builder {
    private HttpTransport transport = new NetHttpTransport();
    private String tokenUrl = DEFAULT_OAUTH_TOKEN_URL;
    private String clientId;
    private String clientSecret;
    private String authorizationCode;
    private String redirectUri;
    private LocalFileStateHandler stateHandler;
    private RetryPolicy retryPolicy = new RetryPolicy.Builder().build();
    private Clock clock = Clock.systemUTC();

    public Builder setTransport(HttpTransport transport) {
      this.transport = transport;
      return this;
    }

    public Builder setTokenUrl(String tokenUrl) {
      this.tokenUrl = tokenUrl;
      return this;
    }

    public Builder setClientId(String clientId) {
      this.clientId = clientId;
      return this;
    }

    public Builder setClientSecret(String clientSecret) {
      this.clientSecret = clientSecret;
      return this;
    }

    public Builder setAuthorizationCode(String authorizationCode) {
      this.authorizationCode = authorizationCode;
      return this;
    }

    public Builder setRedirectUri(String redirectUri) {
      this.redirectUri = redirectUri;
      return this;
    }

    public Builder setStateHandler(LocalFileStateHandler stateHandler) {
      this.stateHandler = stateHandler;
      return this;
    }

    public Builder setRetryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder setClock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public ZoomTokenProvider build() {
      checkArgument(!Strings.isNullOrEmpty(clientId), "client ID can not be empty");
      checkArgument(!Strings.isNullOrEmpty(clientSecret), "client secret can not be empty");
      checkNotNull(transport, "transport can not be null");
      checkNotNull(stateHandler, "state handler can not be null");
      checkNotNull(retryPolicy, "retry policy can not be null");
      checkNotNull(clock, "clock can not be null");
      return new ZoomTokenProvider(this);
    }
  }
}

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

import com.enterprise.workplacesearch.sdk.indexing.state.JsonState;
import com.google.api.client.util.Key;
import com.google.common.base.Strings;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/** Zoom OAuth tokens persisted between runs. */
public class CredentialState extends JsonState {
  @Key("refresh_token")
  private String refreshToken;

  @Key("access_token")
  private String accessToken;

  @Key("access_token_expiry")
  private String accessTokenExpiry;

  public CredentialState() {}

  CredentialState(String refreshToken, String accessToken, Instant accessTokenExpiry) {
    this.refreshToken = refreshToken;
    this.accessToken = accessToken;
    this.accessTokenExpiry = accessTokenExpiry.toString();
  }

  public String getRefreshToken() {
    return refreshToken;
  }

  public String getAccessToken() {
    return accessToken;
  }

  public String getAccessTokenExpiry() {
    return accessTokenExpiry;
  }

  /** True if the access token is present and does not expire before {@code now}. */
  boolean isAccessTokenValid(Instant now) {
    if (Strings.isNullOrEmpty(accessToken) || Strings.isNullOrEmpty(accessTokenExpiry)) {
      return false;
    }
    try {
      return now.isBefore(Instant.parse(accessTokenExpiry));
    } catch (DateTimeParseException e) {
      return false;
    }
  }

  boolean hasRefreshToken() {
    return !Strings.isNullOrEmpty(refreshToken);
  }
}

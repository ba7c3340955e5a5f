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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.enterprise.workplacesearch.sdk.PaginationIterable;
import com.enterprise.workplacesearch.sdk.RetryPolicy;
import com.enterprise.workplacesearch.sdk.config.Configuration;
import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpRequest;
import com.google.api.client.http.HttpRequestFactory;
import com.google.api.client.http.HttpResponseException;
import com.google.api.client.http.HttpStatusCodes;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.GenericJson;
import com.google.api.client.json.JsonObjectParser;
import com.google.api.client.json.jackson2.JacksonFactory;
import com.google.common.base.Strings;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only access to the Zoom REST API.
 *
 * <p>Every call is authorized with a token from {@link ZoomTokenProvider}. A 401 response renews
 * the token and repeats the call once. Connection failures and timeouts are retried by the
 * {@link RetryPolicy}; all other HTTP errors propagate as {@link HttpResponseException}.
 *
 * <p>Optional configuration parameters:
 *
 * <ul>
 *   <li>{@value #CONFIG_API_BASE_URL} - API root, defaults to {@value #DEFAULT_API_BASE_URL}.
 * </ul>
 */
public class ZoomClient {
  private static final Logger logger = Logger.getLogger(ZoomClient.class.getName());

  public static final String CONFIG_API_BASE_URL = "zoom.apiBaseUrl";
  public static final String DEFAULT_API_BASE_URL = "https://api.zoom.us/v2/";
  public static final String NEXT_PAGE_TOKEN = "next_page_token";

  private final String baseUrl;
  private final HttpRequestFactory requestFactory;
  private final ZoomTokenProvider tokenProvider;
  private final RetryPolicy retryPolicy;

  private ZoomClient(Builder builder) {
    this.baseUrl =
        builder.baseUrl.endsWith("/") ? builder.baseUrl : builder.baseUrl + "/";
    this.tokenProvider = builder.tokenProvider;
    this.retryPolicy = builder.retryPolicy;
    this.requestFactory =
        builder.transport.createRequestFactory(
            request -> request.setParser(
                new JsonObjectParser(JacksonFactory.getDefaultInstance())));
  }

  public static ZoomClient fromConfiguration(
      ZoomTokenProvider tokenProvider, RetryPolicy retryPolicy) {
    checkState(Configuration.isInitialized(), "config not initialized");
    return new Builder()
        .setBaseUrl(Configuration.getString(CONFIG_API_BASE_URL, DEFAULT_API_BASE_URL).get())
        .setTokenProvider(tokenProvider)
        .setRetryPolicy(retryPolicy)
        .build();
  }

  /** Creates a URL for {@code path} relative to the API root, such as {@code users}. */
  public GenericUrl newUrl(String path) {
    return new GenericUrl(baseUrl + path);
  }

  /** Fetches one JSON object. */
  public GenericJson get(GenericUrl url) throws IOException {
    return retryPolicy.call("GET " + url.getRawPath(), () -> executeAuthorized(url));
  }

  /**
   * Fetches all pages of a listing and returns the objects found under {@code key}. Pages are
   * chained through {@value #NEXT_PAGE_TOKEN}; a failure on any page fails the whole listing.
   */
  public List<Map<String, Object>> list(GenericUrl url, String key) throws IOException {
    return new PaginationIterable<Map<String, Object>, String>(Optional.empty()) {
      @Override
      public Page<Map<String, Object>, String> getPage(Optional<String> nextPage)
          throws IOException {
        GenericUrl pageUrl = url.clone();
        if (nextPage.isPresent()) {
          pageUrl.set(NEXT_PAGE_TOKEN, nextPage.get());
        }
        GenericJson response = get(pageUrl);
        String nextPageToken = ZoomJson.getString(response, NEXT_PAGE_TOKEN);
        return new Page<>(
            ZoomJson.getObjects(response, key),
            Strings.isNullOrEmpty(nextPageToken) ? Optional.empty() : Optional.of(nextPageToken));
      }
    }.toList();
  }

  private GenericJson executeAuthorized(GenericUrl url) throws IOException {
    String token = tokenProvider.getAccessToken();
    try {
      return execute(url, token);
    } catch (HttpResponseException e) {
      if (e.getStatusCode() != HttpStatusCodes.STATUS_CODE_UNAUTHORIZED) {
        throw e;
      }
      logger.log(Level.FINE, "Access token rejected for {0}, renewing it", url.getRawPath());
      return execute(url, tokenProvider.refreshAccessToken(token));
    }
  }

  private GenericJson execute(GenericUrl url, String token) throws IOException {
    HttpRequest request = requestFactory.buildGetRequest(url);
    request.getHeaders().setAuthorization("Bearer " + token);
    return request.execute().parseAs(GenericJson.class);
  }

  /** Builder for creating an instance of {@link ZoomClient} */
  public static class Builder {
    private String baseUrl = DEFAULT_API_BASE_URL;
    private HttpTransport transport = new NetHttpTransport();
    private ZoomTokenProvider tokenProvider;
    private RetryPolicy retryPolicy = new RetryPolicy.Builder().build();

    public Builder setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    public Builder setTransport(HttpTransport transport) {
      this.transport = transport;
      return this;
    }

    public Builder setTokenProvider(ZoomTokenProvider tokenProvider) {
      this.tokenProvider = tokenProvider;
      return this;
    }

    public Builder setRetryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public ZoomClient build() {
      checkNotNull(baseUrl, "base URL can not be null");
      checkNotNull(transport, "transport can not be null");
      checkNotNull(tokenProvider, "token provider can not be null");
      checkNotNull(retryPolicy, "retry policy can not be null");
      return new ZoomClient(this);
    }
  }
}

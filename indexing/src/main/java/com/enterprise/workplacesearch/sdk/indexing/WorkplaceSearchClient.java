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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.enterprise.workplacesearch.sdk.PaginationIterable;
import com.enterprise.workplacesearch.sdk.RetryPolicy;
import com.enterprise.workplacesearch.sdk.config.Configuration;
import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpRequest;
import com.google.api.client.http.HttpRequestFactory;
import com.google.api.client.http.HttpResponse;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.http.json.JsonHttpContent;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.GenericJson;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.JsonObjectParser;
import com.google.api.client.util.Key;
import com.google.api.client.util.escape.CharEscapers;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EnterpriseSearchService} over the Workplace Search REST API.
 *
 * <p>Required configuration parameters:
 *
 * <ul>
 *   <li>{@value #CONFIG_HOST_URL} - base URL of the Enterprise Search deployment.
 *   <li>{@value #CONFIG_API_KEY} - access token of the custom content source.
 *   <li>{@value #CONFIG_SOURCE_ID} - id of the custom content source. Only {@code bootstrap}
 *       runs without it.
 * </ul>
 */
public class WorkplaceSearchClient implements EnterpriseSearchService {
  private static final Logger logger = Logger.getLogger(WorkplaceSearchClient.class.getName());

  public static final String CONFIG_HOST_URL = "enterpriseSearch.hostUrl";
  public static final String CONFIG_API_KEY = "enterpriseSearch.apiKey";
  public static final String CONFIG_SOURCE_ID = "enterpriseSearch.sourceId";

  private static final JsonFactory JSON_FACTORY = Document.JSON_FACTORY;
  private static final String API_PATH = "/api/ws/v1/sources";

  private final String hostUrl;
  private final String sourceId;
  private final HttpRequestFactory requestFactory;
  private final RetryPolicy retryPolicy;

  private WorkplaceSearchClient(Builder builder) {
    this.hostUrl = stripTrailingSlash(builder.hostUrl);
    this.sourceId = builder.sourceId;
    this.retryPolicy = builder.retryPolicy;
    String authorization = "Bearer " + builder.apiKey;
    this.requestFactory =
        builder.transport.createRequestFactory(
            request -> {
              request.getHeaders().setAuthorization(authorization);
              request.setParser(new JsonObjectParser(JSON_FACTORY));
            });
  }

  /** Creates a client for the content source named in the connector configuration. */
  public static WorkplaceSearchClient fromConfiguration() {
    checkState(Configuration.isInitialized(), "config not initialized");
    return new Builder()
        .setHostUrl(Configuration.getString(CONFIG_HOST_URL, null).get())
        .setApiKey(Configuration.getString(CONFIG_API_KEY, null).get())
        .setSourceId(Configuration.getString(CONFIG_SOURCE_ID, "").get())
        .setRetryPolicy(RetryPolicy.fromConfiguration())
        .build();
  }

  @Override
  public List<IndexResult> indexDocuments(List<Document> documents) throws IOException {
    if (documents.isEmpty()) {
      return Collections.emptyList();
    }
    BulkCreateResponse response =
        retryPolicy.call(
            "index " + documents.size() + " documents",
            () -> post(sourceUrl("documents/bulk_create"), documents)
                .parseAs(BulkCreateResponse.class));
    return response.results == null ? Collections.emptyList() : response.results;
  }

  @Override
  public void deleteDocuments(List<String> ids) throws IOException {
    if (ids.isEmpty()) {
      return;
    }
    BulkDestroyResponse response =
        retryPolicy.call(
            "delete " + ids.size() + " documents",
            () -> post(sourceUrl("documents/bulk_destroy"), ids)
                .parseAs(BulkDestroyResponse.class));
    if (response.results != null) {
      for (DestroyResult result : response.results) {
        if (!Boolean.TRUE.equals(result.success)) {
          logger.log(Level.WARNING, "Deletion of document {0} was not acknowledged", result.id);
        }
      }
    }
  }

  @Override
  public List<UserPermissions> listPermissions() throws IOException {
    PaginationIterable<UserPermissions, Integer> pages =
        new PaginationIterable<UserPermissions, Integer>(Optional.of(1)) {
          @Override
          public Page<UserPermissions, Integer> getPage(Optional<Integer> nextPage)
              throws IOException {
            int current = nextPage.orElse(1);
            GenericUrl url = sourceUrl("permissions");
            url.set("page[current]", current);
            PermissionsResponse response =
                retryPolicy.call(
                    "list permissions",
                    () -> requestFactory.buildGetRequest(url).execute()
                        .parseAs(PermissionsResponse.class));
            List<UserPermissions> results =
                response.results == null ? ImmutableList.of() : response.results;
            boolean more = response.meta != null
                && response.meta.page != null
                && response.meta.page.totalPages != null
                && current < response.meta.page.totalPages;
            return new Page<>(results, more ? Optional.of(current + 1) : Optional.empty());
          }
        };
    return pages.toList();
  }

  @Override
  public void addPermissions(String identity, List<String> permissions) throws IOException {
    updatePermissions(identity, "add", permissions);
  }

  @Override
  public void removePermissions(String identity, List<String> permissions) throws IOException {
    updatePermissions(identity, "remove", permissions);
  }

  private void updatePermissions(String identity, String action, List<String> permissions)
      throws IOException {
    PermissionsRequest body = new PermissionsRequest();
    body.permissions = permissions;
    retryPolicy.call(
        action + " permissions of " + identity,
        () -> {
          String path = "permissions/" + CharEscapers.escapeUriPath(identity) + "/" + action;
          post(sourceUrl(path), body).disconnect();
          return null;
        });
  }

  @Override
  public String createContentSource(String name, Map<String, String> schema, Object display)
      throws IOException {
    ContentSourceRequest body = new ContentSourceRequest();
    body.name = name;
    body.schema = schema;
    body.display = display;
    body.isSearchable = true;
    ContentSourceResponse response =
        retryPolicy.call(
            "create content source " + name,
            () -> post(new GenericUrl(hostUrl + API_PATH), body)
                .parseAs(ContentSourceResponse.class));
    return response.id;
  }

  private HttpResponse post(GenericUrl url, Object body) throws IOException {
    HttpRequest request =
        requestFactory.buildPostRequest(url, new JsonHttpContent(JSON_FACTORY, body));
    return request.execute();
  }

  @VisibleForTesting
  GenericUrl sourceUrl(String path) {
    checkState(!Strings.isNullOrEmpty(sourceId), "%s is not configured", CONFIG_SOURCE_ID);
    return new GenericUrl(hostUrl + API_PATH + "/" + sourceId + "/" + path);
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  /** Builder for creating an instance of {@link WorkplaceSearchClient} */
  public static class Builder {
    private String hostUrl;
    private String apiKey;
    private String sourceId = "";
    private HttpTransport transport = new NetHttpTransport();
    private RetryPolicy retryPolicy = new RetryPolicy.Builder().build();

    public Builder setHostUrl(String hostUrl) {
      this.hostUrl = hostUrl;
      return this;
    }

    public Builder setApiKey(String apiKey) {
      this.apiKey = apiKey;
      return this;
    }

    public Builder setSourceId(String sourceId) {
      this.sourceId = sourceId;
      return this;
    }

    public Builder setTransport(HttpTransport transport) {
      this.transport = transport;
      return this;
    }

    public Builder setRetryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public WorkplaceSearchClient build() {
      checkNotNull(hostUrl, "host url can not be null");
      checkNotNull(apiKey, "api key can not be null");
      checkNotNull(transport, "transport can not be null");
      checkNotNull(retryPolicy, "retry policy can not be null");
      return new WorkplaceSearchClient(this);
    }
  }

  /** Response of {@code documents/bulk_create}. */
  public static class BulkCreateResponse extends GenericJson {
    @Key public List<IndexResult> results;
  }

  /** Response of {@code documents/bulk_destroy}. */
  public static class BulkDestroyResponse extends GenericJson {
    @Key public List<DestroyResult> results;
  }

  public static class DestroyResult extends GenericJson {
    @Key public String id;
    @Key public Boolean success;
  }

  /** Response of {@code permissions}. */
  public static class PermissionsResponse extends GenericJson {
    @Key public List<UserPermissions> results;
    @Key public Meta meta;
  }

  public static class Meta extends GenericJson {
    @Key public PageInfo page;
  }

  public static class PageInfo extends GenericJson {
    @Key public Integer current;

    @Key("total_pages")
    public Integer totalPages;
  }

  public static class PermissionsRequest extends GenericJson {
    @Key public List<String> permissions;
  }

  public static class ContentSourceRequest extends GenericJson {
    @Key public String name;
    @Key public Map<String, String> schema;
    @Key public Object display;

    @Key("is_searchable")
    public Boolean isSearchable;
  }

  public static class ContentSourceResponse extends GenericJson {
    @Key public String id;
  }
}

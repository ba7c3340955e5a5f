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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.enterprise.workplacesearch.sdk.config.Configuration;
import com.enterprise.workplacesearch.sdk.indexing.EnterpriseSearchService;
import com.enterprise.workplacesearch.sdk.indexing.WorkplaceSearchClient;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the custom content source the connector indexes into.
 *
 * <p>Required configuration parameters:
 *
 * <ul>
 *   <li>{@value #CONFIG_CONTENT_SOURCE_NAME} - display name of the new content source.
 * </ul>
 */
public class BootstrapCommand implements ConnectorCommand {
  private static final Logger logger = Logger.getLogger(BootstrapCommand.class.getName());

  public static final String CONFIG_CONTENT_SOURCE_NAME = "bootstrap.contentSourceName";

  static final ImmutableMap<String, String> SCHEMA =
      ImmutableMap.<String, String>builder()
          .put("body", "text")
          .put("created_at", "date")
          .put("description", "text")
          .put("name", "text")
          .put("size", "text")
          .put("title", "text")
          .put("type", "text")
          .put("url", "text")
          .build();

  static final ImmutableMap<String, Object> DISPLAY =
      ImmutableMap.<String, Object>of(
          "title_field", "title",
          "description_field", "description",
          "url_field", "url",
          "detail_fields",
              ImmutableList.of(
                  detailField("created_at", "Created At"),
                  detailField("type", "Type"),
                  detailField("size", "Size (in bytes)"),
                  detailField("description", "Description"),
                  detailField("body", "Content")),
          "color", "#000000");

  private final EnterpriseSearchService searchService;
  private final String contentSourceName;

  public BootstrapCommand(EnterpriseSearchService searchService, String contentSourceName) {
    this.searchService = checkNotNull(searchService);
    checkArgument(!Strings.isNullOrEmpty(contentSourceName), "content source name is empty");
    this.contentSourceName = contentSourceName;
  }

  public static BootstrapCommand fromConfiguration() {
    checkState(Configuration.isInitialized(), "config not initialized");
    return new BootstrapCommand(
        WorkplaceSearchClient.fromConfiguration(),
        Configuration.getString(CONFIG_CONTENT_SOURCE_NAME, null).get());
  }

  @Override
  public void execute() throws IOException {
    String id = searchService.createContentSource(contentSourceName, SCHEMA, DISPLAY);
    logger.log(
        Level.INFO,
        "Created content source {0} with id {1}; set {2} to this id",
        new Object[] {contentSourceName, id, WorkplaceSearchClient.CONFIG_SOURCE_ID});
  }

  private static ImmutableMap<String, String> detailField(String fieldName, String label) {
    return ImmutableMap.of("field_name", fieldName, "label", label);
  }
}

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
package com.enterprise.workplacesearch.zoomconnector;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.enterprise.workplacesearch.sdk.RetryPolicy;
import com.enterprise.workplacesearch.sdk.config.Configuration;
import com.enterprise.workplacesearch.sdk.indexing.EnterpriseSearchService;
import com.enterprise.workplacesearch.sdk.indexing.IndexingWorker;
import com.enterprise.workplacesearch.sdk.indexing.WorkplaceSearchClient;
import com.enterprise.workplacesearch.sdk.indexing.queue.ConnectorQueue;
import com.enterprise.workplacesearch.sdk.indexing.state.CheckpointStore;
import com.enterprise.workplacesearch.sdk.indexing.state.LocalDocumentStore;
import com.enterprise.workplacesearch.sdk.indexing.state.LocalFileStateHandler;
import com.enterprise.workplacesearch.zoomconnector.client.ZoomClient;
import com.enterprise.workplacesearch.zoomconnector.client.ZoomTokenProvider;
import com.enterprise.workplacesearch.zoomconnector.fetch.FieldSchema;
import com.enterprise.workplacesearch.zoomconnector.fetch.ObjectType;
import com.enterprise.workplacesearch.zoomconnector.fetch.PermissionMapping;
import com.enterprise.workplacesearch.zoomconnector.sync.SyncOrchestrator;
import com.enterprise.workplacesearch.zoomconnector.sync.ZoomFetchPipeline;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Collaborators and settings shared by the connector commands.
 *
 * <p>Optional configuration parameters:
 *
 * <ul>
 *   <li>{@value #CONFIG_OBJECTS} - comma separated Zoom object types to sync, all by default.
 *   <li>{@value #CONFIG_ZOOM_SYNC_THREAD_COUNT} - fetch threads, defaults to {@value
 *       #DEFAULT_THREAD_COUNT}.
 *   <li>{@value #CONFIG_ENTERPRISE_SEARCH_SYNC_THREAD_COUNT} - indexing workers, defaults to
 *       {@value #DEFAULT_THREAD_COUNT}.
 *   <li>{@value #CONFIG_ENABLE_DOCUMENT_PERMISSION} - whether documents carry permissions,
 *       {@code true} by default.
 *   <li>{@value #CONFIG_END_TIME} - end of the full sync window, now by default.
 * </ul>
 */
public class ConnectorContext {
  private static final Logger logger = Logger.getLogger(ConnectorContext.class.getName());

  public static final String CONFIG_OBJECTS = "zoom.objects";
  public static final String CONFIG_ZOOM_SYNC_THREAD_COUNT = "connector.zoomSyncThreadCount";
  public static final String CONFIG_ENTERPRISE_SEARCH_SYNC_THREAD_COUNT =
      "connector.enterpriseSearchSyncThreadCount";
  public static final String CONFIG_ENABLE_DOCUMENT_PERMISSION =
      "connector.enableDocumentPermission";
  public static final String CONFIG_END_TIME = "connector.endTime";
  public static final int DEFAULT_THREAD_COUNT = 5;

  private final ZoomClient zoomClient;
  private final EnterpriseSearchService searchService;
  private final LocalDocumentStore documentStore;
  private final CheckpointStore checkpointStore;
  private final PermissionMapping permissionMapping;
  private final ImmutableMap<ObjectType, FieldSchema> schemas;
  private final boolean permissionEnabled;
  private final int zoomSyncThreadCount;
  private final int enterpriseSearchSyncThreadCount;
  private final int queueCapacity;
  private final int batchSize;
  private final int maxBytes;
  private final Instant startTime;
  @Nullable private final Instant endTime;
  private final Clock clock;

  private ConnectorContext(Builder builder) {
    this.zoomClient = checkNotNull(builder.zoomClient, "Zoom client can not be null");
    this.searchService = checkNotNull(builder.searchService, "search service can not be null");
    this.documentStore = checkNotNull(builder.documentStore, "document store can not be null");
    this.checkpointStore =
        checkNotNull(builder.checkpointStore, "checkpoint store can not be null");
    this.permissionMapping = checkNotNull(builder.permissionMapping);
    checkArgument(!builder.schemas.isEmpty(), "no Zoom object type configured");
    this.schemas = ImmutableMap.copyOf(builder.schemas);
    this.permissionEnabled = builder.permissionEnabled;
    checkArgument(builder.zoomSyncThreadCount > 0, "Zoom sync thread count must be positive");
    checkArgument(
        builder.enterpriseSearchSyncThreadCount > 0,
        "Enterprise Search sync thread count must be positive");
    this.zoomSyncThreadCount = builder.zoomSyncThreadCount;
    this.enterpriseSearchSyncThreadCount = builder.enterpriseSearchSyncThreadCount;
    this.queueCapacity = builder.queueCapacity;
    this.batchSize = builder.batchSize;
    this.maxBytes = builder.maxBytes;
    this.startTime = checkNotNull(builder.startTime, "start time can not be null");
    this.endTime = builder.endTime;
    this.clock = checkNotNull(builder.clock);
  }

  /**
   * Builds the context from the connector configuration.
   *
   * @throws IOException if the user mapping file can not be read
   */
  public static ConnectorContext fromConfiguration() throws IOException {
    checkState(Configuration.isInitialized(), "config not initialized");
    LocalFileStateHandler stateHandler = LocalFileStateHandler.fromConfiguration();
    RetryPolicy retryPolicy = RetryPolicy.fromConfiguration();
    ZoomTokenProvider tokenProvider =
        ZoomTokenProvider.fromConfiguration(stateHandler, retryPolicy);
    boolean permissionEnabled =
        Configuration.getBoolean(CONFIG_ENABLE_DOCUMENT_PERMISSION, true).get();
    Map<ObjectType, FieldSchema> schemas = new LinkedHashMap<>();
    for (ObjectType type :
        Configuration.getMultiValue(
                CONFIG_OBJECTS, Arrays.asList(ObjectType.values()), ObjectType.PARSER)
            .get()) {
      schemas.put(type, FieldSchema.fromConfiguration(type));
    }
    logger.log(Level.CONFIG, "Zoom object types to sync: {0}", schemas.keySet());
    return new Builder()
        .setZoomClient(ZoomClient.fromConfiguration(tokenProvider, retryPolicy))
        .setSearchService(WorkplaceSearchClient.fromConfiguration())
        .setDocumentStore(new LocalDocumentStore(stateHandler))
        .setCheckpointStore(CheckpointStore.fromConfiguration(stateHandler))
        .setPermissionMapping(
            permissionEnabled ? PermissionMapping.fromConfiguration() : PermissionMapping.empty())
        .setSchemas(schemas)
        .setPermissionEnabled(permissionEnabled)
        .setZoomSyncThreadCount(
            Configuration.getInteger(CONFIG_ZOOM_SYNC_THREAD_COUNT, DEFAULT_THREAD_COUNT).get())
        .setEnterpriseSearchSyncThreadCount(
            Configuration.getInteger(
                    CONFIG_ENTERPRISE_SEARCH_SYNC_THREAD_COUNT, DEFAULT_THREAD_COUNT)
                .get())
        .setQueueCapacity(
            Configuration.getInteger(
                    ConnectorQueue.CONFIG_QUEUE_CAPACITY, ConnectorQueue.DEFAULT_QUEUE_CAPACITY)
                .get())
        .setBatchSize(
            Configuration.getInteger(
                    ConnectorQueue.CONFIG_BATCH_SIZE, ConnectorQueue.DEFAULT_BATCH_SIZE)
                .get())
        .setMaxBytes(
            Configuration.getInteger(
                    IndexingWorker.CONFIG_MAX_BYTES, IndexingWorker.DEFAULT_MAX_BYTES)
                .get())
        .setStartTime(
            Configuration.getValue(
                    CheckpointStore.CONFIG_START_TIME,
                    Instant.parse(CheckpointStore.DEFAULT_START_TIME),
                    Configuration.INSTANT_PARSER)
                .get())
        .setEndTime(Configuration.getOptional(CONFIG_END_TIME, Configuration.INSTANT_PARSER).get())
        .build();
  }

  /** Creates a fetch pipeline over the configured object types. */
  public ZoomFetchPipeline newFetchPipeline() {
    return new ZoomFetchPipeline(
        zoomClient, permissionMapping, schemas, zoomSyncThreadCount, permissionEnabled, clock);
  }

  /** Creates an orchestrator indexing through the configured content source. */
  public SyncOrchestrator newSyncOrchestrator(ZoomFetchPipeline pipeline) {
    return new SyncOrchestrator.Builder()
        .setPipeline(pipeline)
        .setSearchService(searchService)
        .setDocumentStore(documentStore)
        .setCheckpointStore(checkpointStore)
        .setWorkerCount(enterpriseSearchSyncThreadCount)
        .setQueueCapacity(queueCapacity)
        .setBatchSize(batchSize)
        .setMaxBytes(maxBytes)
        .build();
  }

  public ZoomClient getZoomClient() {
    return zoomClient;
  }

  public EnterpriseSearchService getSearchService() {
    return searchService;
  }

  public LocalDocumentStore getDocumentStore() {
    return documentStore;
  }

  public CheckpointStore getCheckpointStore() {
    return checkpointStore;
  }

  public PermissionMapping getPermissionMapping() {
    return permissionMapping;
  }

  /** Configured object types, in configuration order. */
  public ImmutableSet<ObjectType> getObjectTypes() {
    return schemas.keySet();
  }

  public ImmutableMap<ObjectType, FieldSchema> getSchemas() {
    return schemas;
  }

  public boolean isPermissionEnabled() {
    return permissionEnabled;
  }

  /** Number of documents per index request and per deletion request. */
  public int getBatchSize() {
    return batchSize;
  }

  /** Start of the full sync window, and of incremental windows without a checkpoint. */
  public Instant getStartTime() {
    return startTime;
  }

  /** Configured end of the full sync window, if any. */
  public Optional<Instant> getEndTime() {
    return Optional.ofNullable(endTime);
  }

  public Clock getClock() {
    return clock;
  }

  /** Builder for creating an instance of {@link ConnectorContext} */
  public static class Builder {
    private ZoomClient zoomClient;
    private EnterpriseSearchService searchService;
    private LocalDocumentStore documentStore;
    private CheckpointStore checkpointStore;
    private PermissionMapping permissionMapping = PermissionMapping.empty();
    private Map<ObjectType, FieldSchema> schemas = defaultSchemas();
    private boolean permissionEnabled = true;
    private int zoomSyncThreadCount = DEFAULT_THREAD_COUNT;
    private int enterpriseSearchSyncThreadCount = DEFAULT_THREAD_COUNT;
    private int queueCapacity = ConnectorQueue.DEFAULT_QUEUE_CAPACITY;
    private int batchSize = ConnectorQueue.DEFAULT_BATCH_SIZE;
    private int maxBytes = IndexingWorker.DEFAULT_MAX_BYTES;
    private Instant startTime = Instant.parse(CheckpointStore.DEFAULT_START_TIME);
    private Instant endTime;
    private Clock clock = Clock.systemUTC();

    private static Map<ObjectType, FieldSchema> defaultSchemas() {
      Map<ObjectType, FieldSchema> schemas = new LinkedHashMap<>();
      for (ObjectType type : ObjectType.values()) {
        schemas.put(type, FieldSchema.defaultOf(type));
      }
      return schemas;
    }

    public Builder setZoomClient(ZoomClient zoomClient) {
      this.zoomClient = zoomClient;
      return this;
    }

    public Builder setSearchService(EnterpriseSearchService searchService) {
      this.searchService = searchService;
      return this;
    }

    public Builder setDocumentStore(LocalDocumentStore documentStore) {
      this.documentStore = documentStore;
      return this;
    }

    public Builder setCheckpointStore(CheckpointStore checkpointStore) {
      this.checkpointStore = checkpointStore;
      return this;
    }

    public Builder setPermissionMapping(PermissionMapping permissionMapping) {
      this.permissionMapping = permissionMapping;
      return this;
    }

    /** Field schema of each object type to sync; the key order is the sync order. */
    public Builder setSchemas(Map<ObjectType, FieldSchema> schemas) {
      this.schemas = new LinkedHashMap<>(schemas);
      return this;
    }

    public Builder setPermissionEnabled(boolean permissionEnabled) {
      this.permissionEnabled = permissionEnabled;
      return this;
    }

    public Builder setZoomSyncThreadCount(int zoomSyncThreadCount) {
      this.zoomSyncThreadCount = zoomSyncThreadCount;
      return this;
    }

    public Builder setEnterpriseSearchSyncThreadCount(int enterpriseSearchSyncThreadCount) {
      this.enterpriseSearchSyncThreadCount = enterpriseSearchSyncThreadCount;
      return this;
    }

    public Builder setQueueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    public Builder setBatchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder setMaxBytes(int maxBytes) {
      this.maxBytes = maxBytes;
      return this;
    }

    public Builder setStartTime(Instant startTime) {
      this.startTime = startTime;
      return this;
    }

    public Builder setEndTime(@Nullable Instant endTime) {
      this.endTime = endTime;
      return this;
    }

    public Builder setClock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public ConnectorContext build() {
      return new ConnectorContext(this);
    }
  }
}

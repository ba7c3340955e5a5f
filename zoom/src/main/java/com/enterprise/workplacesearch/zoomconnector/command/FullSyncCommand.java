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

import static com.google.common.base.Preconditions.checkNotNull;

import com.enterprise.workplacesearch.sdk.indexing.RunKind;
import com.enterprise.workplacesearch.sdk.indexing.TimeWindow;
import com.enterprise.workplacesearch.zoomconnector.ConnectorContext;
import com.enterprise.workplacesearch.zoomconnector.fetch.ObjectType;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Indexes every configured object type from {@code connector.startTime} to {@code
 * connector.endTime}, or to now when no end time is configured.
 */
public class FullSyncCommand implements ConnectorCommand {
  private static final Logger logger = Logger.getLogger(FullSyncCommand.class.getName());

  private final ConnectorContext context;

  public FullSyncCommand(ConnectorContext context) {
    this.context = checkNotNull(context);
  }

  @Override
  public void execute() throws IOException, InterruptedException {
    Instant end = context.getEndTime().orElse(context.getClock().instant());
    TimeWindow window = new TimeWindow(context.getStartTime(), end);
    Map<ObjectType, TimeWindow> windows = new LinkedHashMap<>();
    for (ObjectType type : context.getObjectTypes()) {
      windows.put(type, window);
    }
    logger.log(
        Level.INFO, "Starting full sync of {0} in {1}", new Object[] {windows.keySet(), window});
    context.newSyncOrchestrator(context.newFetchPipeline()).run(windows, end, RunKind.FULL);
  }
}

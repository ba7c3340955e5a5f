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
 * Indexes the objects changed since the last successful sync of their type.
 *
 * <p>Each time windowed type starts at its stored checkpoint. Roles, groups and channels have no
 * checkpoint and are fetched from {@code connector.startTime}.
 */
public class IncrementalSyncCommand implements ConnectorCommand {
  private static final Logger logger = Logger.getLogger(IncrementalSyncCommand.class.getName());

  private final ConnectorContext context;

  public IncrementalSyncCommand(ConnectorContext context) {
    this.context = checkNotNull(context);
  }

  @Override
  public void execute() throws IOException, InterruptedException {
    Instant now = context.getClock().instant();
    Map<ObjectType, TimeWindow> windows = new LinkedHashMap<>();
    for (ObjectType type : context.getObjectTypes()) {
      TimeWindow window =
          type.isTimeWindowed()
              ? context.getCheckpointStore().getCheckpoint(type.getName(), now)
              : new TimeWindow(context.getStartTime(), now);
      windows.put(type, window);
      logger.log(Level.INFO, "Incremental sync of {0} in {1}", new Object[] {type, window});
    }
    context
        .newSyncOrchestrator(context.newFetchPipeline())
        .run(windows, now, RunKind.INCREMENTAL);
  }
}

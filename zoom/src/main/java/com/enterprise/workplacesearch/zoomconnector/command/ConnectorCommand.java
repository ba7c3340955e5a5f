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

import java.io.IOException;

/** One sub command of the connector command line. */
public interface ConnectorCommand {

  /**
   * Runs the command to completion.
   *
   * @throws IOException if Zoom or Enterprise Search can not be reached, or rejects a request
   * @throws InterruptedException if interrupted while waiting for worker threads
   */
  void execute() throws IOException, InterruptedException;
}

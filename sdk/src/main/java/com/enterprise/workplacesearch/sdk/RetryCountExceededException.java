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
package com.enterprise.workplacesearch.sdk;

import java.io.IOException;

/**
 * Thrown by {@link RetryPolicy} when a transient failure persists after the configured number of
 * attempts.
 */
public class RetryCountExceededException extends IOException {

  private final int attempts;

  public RetryCountExceededException(String operation, int attempts, Throwable lastFailure) {
    super(
        String.format("Retry count exceeded for [%s] after %d attempt(s)", operation, attempts),
        lastFailure);
    this.attempts = attempts;
  }

  /** Number of attempts made before giving up. */
  public int getAttempts() {
    return attempts;
  }
}

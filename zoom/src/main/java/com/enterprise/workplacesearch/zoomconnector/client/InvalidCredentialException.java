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

import com.enterprise.workplacesearch.sdk.InvalidConfigurationException;

/**
 * Thrown when the Zoom OAuth server rejects the configured credentials. The message names the
 * configuration key that most likely holds the wrong value.
 */
public class InvalidCredentialException extends InvalidConfigurationException {
  private final String configKey;

  public InvalidCredentialException(String configKey, String reason, Throwable cause) {
    super(
        String.format(
            "Error while generating the Zoom access token. Reason: %s. "
                + "Please update %s in the connector configuration.",
            reason, configKey),
        cause);
    this.configKey = configKey;
  }

  /** Configuration key suspected to be wrong. */
  public String getConfigKey() {
    return configKey;
  }
}

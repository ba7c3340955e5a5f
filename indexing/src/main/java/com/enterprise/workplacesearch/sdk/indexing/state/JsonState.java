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
package com.enterprise.workplacesearch.sdk.indexing.state;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.enterprise.workplacesearch.sdk.RepositoryException;
import com.google.api.client.json.GenericJson;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.jackson2.JacksonFactory;
import java.io.IOException;
import java.io.UncheckedIOException;

/** Base class for state files persisted as JSON. */
public abstract class JsonState extends GenericJson {
  static final JsonFactory JSON_FACTORY = JacksonFactory.getDefaultInstance();

  /**
   * Default constructor for Json parsing
   *
   * <p>Subclasses and their constructors must be public for the JSON parser to run correctly.
   */
  public JsonState() {
    setFactory(JSON_FACTORY);
  }

  /** Pretty printed UTF-8 JSON form of this state. */
  public byte[] toBytes() {
    try {
      return toPrettyString().getBytes(UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("error encoding " + getClass().getSimpleName(), e);
    }
  }

  public static <T extends JsonState> T parse(byte[] payload, Class<T> clazz)
      throws RepositoryException {
    String content = new String(payload, UTF_8);
    try {
      T parsed = JSON_FACTORY.fromString(content, clazz);
      if (parsed == null) {
        throw new IOException("empty content");
      }
      return parsed;
    } catch (IOException | IllegalArgumentException e) {
      throw new RepositoryException.Builder()
          .setErrorMessage("Error parsing " + clazz.getSimpleName() + " from " + content)
          .setErrorType(RepositoryException.ErrorType.PARSE_ERROR)
          .setCause(e)
          .build();
    }
  }
}

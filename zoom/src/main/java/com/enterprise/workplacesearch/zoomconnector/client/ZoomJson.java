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

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** Accessors for the untyped JSON objects returned by the Zoom API. */
public final class ZoomJson {

  private ZoomJson() {}

  /** Returns the value of {@code key} as a string, or null if absent. */
  @Nullable
  public static String getString(Map<String, Object> object, String key) {
    return stringValue(object.get(key));
  }

  /**
   * String form of a parsed JSON value. Numbers are printed without exponent so that numeric
   * meeting ids keep their digits.
   */
  @Nullable
  public static String stringValue(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof BigDecimal) {
      return ((BigDecimal) value).toPlainString();
    }
    return value.toString();
  }

  /** Returns the JSON objects of the array under {@code key}, skipping non-object elements. */
  @SuppressWarnings("unchecked")
  public static List<Map<String, Object>> getObjects(Map<String, Object> object, String key) {
    Object value = object.get(key);
    if (!(value instanceof List)) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<Map<String, Object>> objects = ImmutableList.builder();
    for (Object element : (List<Object>) value) {
      if (element instanceof Map) {
        objects.add((Map<String, Object>) element);
      }
    }
    return objects.build();
  }

  /** Returns the string elements of the array under {@code key}. */
  public static List<String> getStrings(Map<String, Object> object, String key) {
    Object value = object.get(key);
    if (!(value instanceof List)) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<String> strings = ImmutableList.builder();
    for (Object element : (List<?>) value) {
      if (element != null) {
        strings.add(stringValue(element));
      }
    }
    return strings.build();
  }

  /** RFC-3339 form used in Zoom query parameters. */
  public static String formatTime(Instant instant) {
    return instant.truncatedTo(ChronoUnit.SECONDS).toString();
  }
}

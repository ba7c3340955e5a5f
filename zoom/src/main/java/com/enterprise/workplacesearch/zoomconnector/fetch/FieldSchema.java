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
package com.enterprise.workplacesearch.zoomconnector.fetch;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.enterprise.workplacesearch.sdk.config.Configuration;
import com.enterprise.workplacesearch.sdk.indexing.Document;
import com.enterprise.workplacesearch.zoomconnector.client.ZoomJson;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fields copied from a Zoom object into its indexed document, as output field to Zoom field.
 *
 * <p>The default schema of an {@link ObjectType} is narrowed by configuration:
 *
 * <ul>
 *   <li>{@code zoom.objects.<type>.includeFields} - Zoom fields to keep. Takes precedence over
 *       the exclusion list when both are set.
 *   <li>{@code zoom.objects.<type>.excludeFields} - Zoom fields to drop.
 * </ul>
 *
 * <p>The field feeding {@code id} is always kept.
 */
public final class FieldSchema {
  private static final Logger logger = Logger.getLogger(FieldSchema.class.getName());

  public static final String CONFIG_INCLUDE_FIELDS = "zoom.objects.%s.includeFields";
  public static final String CONFIG_EXCLUDE_FIELDS = "zoom.objects.%s.excludeFields";

  private static final String ID = "id";
  private static final ImmutableSet<String> TEXT_FIELDS =
      ImmutableSet.of("id", "type", "parent_id", "created_at", "title", "body", "url");

  private final ImmutableMap<String, String> fields;

  private FieldSchema(ImmutableMap<String, String> fields) {
    this.fields = fields;
  }

  /** Default schema of {@code type}, unfiltered. */
  public static FieldSchema defaultOf(ObjectType type) {
    return new FieldSchema(type.getDefaultSchema());
  }

  /**
   * Schema of {@code type} narrowed by {@code includeFields}, or by {@code excludeFields} when
   * no inclusion is given.
   */
  public static FieldSchema of(
      ObjectType type, List<String> includeFields, List<String> excludeFields) {
    ImmutableMap<String, String> defaults = type.getDefaultSchema();
    Predicate<String> keep;
    if (!includeFields.isEmpty()) {
      keep = includeFields::contains;
    } else if (!excludeFields.isEmpty()) {
      keep = source -> !excludeFields.contains(source);
    } else {
      return defaultOf(type);
    }
    ImmutableMap.Builder<String, String> narrowed = ImmutableMap.builder();
    for (Map.Entry<String, String> field : defaults.entrySet()) {
      if (field.getKey().equals(ID) || keep.test(field.getValue())) {
        narrowed.put(field);
      }
    }
    return new FieldSchema(narrowed.build());
  }

  /** Reads the include and exclude lists of {@code type} from configuration. */
  public static FieldSchema fromConfiguration(ObjectType type) {
    checkState(Configuration.isInitialized(), "config not initialized");
    List<String> include =
        Configuration.getMultiValue(
                String.format(CONFIG_INCLUDE_FIELDS, type.getName()),
                ImmutableList.of(),
                Configuration.STRING_PARSER)
            .get();
    List<String> exclude =
        Configuration.getMultiValue(
                String.format(CONFIG_EXCLUDE_FIELDS, type.getName()),
                ImmutableList.of(),
                Configuration.STRING_PARSER)
            .get();
    FieldSchema schema = of(type, include, exclude);
    logger.log(Level.CONFIG, "Fields indexed for {0}: {1}", new Object[] {type, schema.fields});
    return schema;
  }

  public ImmutableMap<String, String> getFields() {
    return fields;
  }

  public boolean contains(String outputField) {
    return fields.containsKey(outputField);
  }

  /**
   * Copies the schema fields present in {@code source} into {@code target}. Numbers stay numbers
   * except in the document's text fields.
   */
  public Document project(Map<String, Object> source, Document target) {
    checkNotNull(source);
    for (Map.Entry<String, String> field : fields.entrySet()) {
      project(field.getKey(), source.get(field.getValue()), target);
    }
    return target;
  }

  /** Copies one schema field, resolving its Zoom field against {@code source}. */
  void projectField(String outputField, Map<String, Object> source, Document target) {
    String sourceField = fields.get(outputField);
    if (sourceField != null) {
      project(outputField, source.get(sourceField), target);
    }
  }

  private static void project(String outputField, Object value, Document target) {
    if (value == null) {
      return;
    }
    if (value instanceof Number && !TEXT_FIELDS.contains(outputField)) {
      target.set(outputField, value);
    } else {
      target.set(outputField, ZoomJson.stringValue(value));
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("fields", fields).toString();
  }
}

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
package com.enterprise.workplacesearch.sdk.indexing;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import javax.annotation.Nullable;

/** Time range {@code [start, end]} of a fetch, inclusive at both ends. */
public final class TimeWindow {
  private final Instant start;
  private final Instant end;

  public TimeWindow(Instant start, Instant end) {
    this.start = checkNotNull(start, "start can not be null");
    this.end = checkNotNull(end, "end can not be null");
    checkArgument(!start.isAfter(end), "window start %s is after end %s", start, end);
  }

  public Instant getStart() {
    return start;
  }

  public Instant getEnd() {
    return end;
  }

  public boolean contains(Instant instant) {
    return !instant.isBefore(start) && !instant.isAfter(end);
  }

  /**
   * Returns true if {@code timestamp} is an RFC-3339 time inside this window. Missing or
   * unparseable timestamps are outside.
   */
  public boolean contains(@Nullable String timestamp) {
    if (timestamp == null || timestamp.isEmpty()) {
      return false;
    }
    try {
      return contains(Instant.parse(timestamp));
    } catch (DateTimeParseException e) {
      return false;
    }
  }

  /** Returns a window starting at the later of {@code floor} and the current start. */
  public TimeWindow clampStart(Instant floor) {
    if (!start.isBefore(floor)) {
      return this;
    }
    return new TimeWindow(floor.isAfter(end) ? end : floor, end);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof TimeWindow)) {
      return false;
    }
    TimeWindow other = (TimeWindow) o;
    return start.equals(other.start) && end.equals(other.end);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + "]";
  }
}

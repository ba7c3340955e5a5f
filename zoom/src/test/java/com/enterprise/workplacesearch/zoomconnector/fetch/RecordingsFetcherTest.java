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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import com.enterprise.workplacesearch.sdk.indexing.Document;
import com.enterprise.workplacesearch.sdk.indexing.TimeWindow;
import com.enterprise.workplacesearch.zoomconnector.client.FakeZoomTransport;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/** Tests for {@link RecordingsFetcher}. */
public class RecordingsFetcherTest {
  private static final TimeWindow WINDOW =
      new TimeWindow(
          Instant.parse("2022-05-01T00:00:00Z"), Instant.parse("2022-05-31T00:00:00Z"));
  private static final String RECORDINGS_JSON =
      "{\"meetings\":[{\"uuid\":\"meetingUuid1\",\"id\":81234,\"host_id\":\"u1\","
          + "\"topic\":\"Weekly sync\",\"total_size\":4096,\"recording_files\":["
          + "{\"id\":\"f1\",\"file_type\":\"MP4\",\"file_size\":3000,\"status\":\"completed\","
          + "\"recording_type\":\"shared_screen_with_speaker_view\","
          + "\"recording_start\":\"2022-05-10T09:00:00Z\","
          + "\"play_url\":\"https://zoom.us/rec/play/f1\"},"
          + "{\"id\":\"f2\",\"file_type\":\"M4A\",\"status\":\"processing\","
          + "\"recording_start\":\"2022-05-10T09:00:00Z\"},"
          + "{\"id\":\"f3\",\"file_type\":\"TIMELINE\",\"file_size\":12,\"status\":\"completed\","
          + "\"recording_start\":\"2022-05-10T09:00:00Z\",\"play_url\":\"https://zoom.us/rec/f3\"},"
          + "{\"id\":\"f4\",\"file_type\":\"MP4\",\"status\":\"completed\","
          + "\"recording_start\":\"2022-04-10T09:00:00Z\"}"
          + "]}]}";

  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  private FakeZoomTransport transport;
  private RecordingsFetcher fetcher;

  @Before
  public void setUp() throws IOException {
    transport =
        new FakeZoomTransport().respond("/v2/users/u1/recordings", 200, RECORDINGS_JSON);
    fetcher =
        new RecordingsFetcher(
            transport.newClient(temporaryFolder.newFolder().getAbsolutePath()),
            PermissionMapping.empty());
  }

  private List<Document> fetch() throws IOException {
    List<Map<String, Object>> users = ImmutableList.of(ImmutableMap.<String, Object>of("id", "u1"));
    return fetcher.fetch(
        FetchScope.forUsers(users, ImmutableSet.of()),
        FieldSchema.defaultOf(ObjectType.RECORDINGS),
        WINDOW,
        true);
  }

  @Test
  public void fetch_completedFilesInsideWindowOnly() throws IOException {
    List<Document> documents = fetch();

    assertEquals(2, documents.size());
    assertEquals("f1", documents.get(0).getId());
    assertEquals("f3", documents.get(1).getId());
  }

  @Test
  public void fetch_mergesMeetingAndFileFields() throws IOException {
    Document recording = fetch().get(0);

    assertEquals("Weekly sync", recording.getTitle());
    assertEquals(new BigDecimal(4096), recording.get("size"));
    assertEquals("2022-05-10T09:00:00Z", recording.getCreatedAt());
    assertEquals("https://zoom.us/rec/play/f1", recording.getUrl());
    assertEquals("u1", recording.getParentId());
    assertTrue(recording.getBody().contains("File Type : MP4"));
    assertEquals(ImmutableList.of("Recording:Read"), recording.getAllowPermissions());
  }

  @Test
  public void fetch_timelineLinksToManagementPage() throws IOException {
    Document timeline = fetch().get(1);

    assertEquals(
        "https://zoom.us/recording/management/detail?meeting_id=meetingUuid1",
        timeline.getUrl());
  }

  @Test
  public void fetch_queriesWindowBounds() throws IOException {
    fetch();

    String url = transport.getRequestedUrls("/v2/users/u1/recordings").get(0);
    assertTrue(url.contains("from=2022-05-01"));
    assertTrue(url.contains("to=2022-05-31"));
  }
}

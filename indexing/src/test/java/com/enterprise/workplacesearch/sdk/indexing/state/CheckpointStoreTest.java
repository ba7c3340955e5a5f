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
import static org.junit.Assert.assertEquals;

import com.enterprise.workplacesearch.sdk.config.Configuration.ResetConfigRule;
import com.enterprise.workplacesearch.sdk.config.Configuration.SetupConfigRule;
import com.enterprise.workplacesearch.sdk.indexing.RunKind;
import com.enterprise.workplacesearch.sdk.indexing.TimeWindow;
import java.io.IOException;
import java.nio.file.Files;
import java.time.Instant;
import java.util.Properties;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/** Tests for {@link CheckpointStore}. */
public class CheckpointStoreTest {

  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();
  @Rule public ResetConfigRule resetConfig = new ResetConfigRule();
  @Rule public SetupConfigRule setupConfig = SetupConfigRule.uninitialized();

  private static final Instant FLOOR = Instant.parse("2020-01-01T00:00:00Z");
  private static final Instant NOW = Instant.parse("2022-06-01T12:00:00Z");

  private LocalFileStateHandler handler;
  private CheckpointStore store;

  @Before
  public void setUp() {
    handler = new LocalFileStateHandler(temporaryFolder.getRoot().getAbsolutePath());
    store = new CheckpointStore(handler, FLOOR);
  }

  @Test
  public void getCheckpoint_noCheckpoint_startsAtFloor() throws IOException {
    assertEquals(new TimeWindow(FLOOR, NOW), store.getCheckpoint("meetings", NOW));
  }

  @Test
  public void setCheckpoint_nextWindowStartsAtPreviousEnd() throws IOException {
    Instant firstRunEnd = Instant.parse("2022-05-01T00:00:00Z");
    store.setCheckpoint("meetings", firstRunEnd, RunKind.FULL);

    assertEquals(new TimeWindow(firstRunEnd, NOW), store.getCheckpoint("meetings", NOW));
    assertEquals(new TimeWindow(FLOOR, NOW), store.getCheckpoint("chats", NOW));
  }

  @Test
  public void setCheckpoint_keepsOtherTypes() throws IOException {
    Instant t1 = Instant.parse("2022-05-01T00:00:00Z");
    Instant t2 = Instant.parse("2022-05-02T00:00:00Z");
    store.setCheckpoint("meetings", t1, RunKind.FULL);
    store.setCheckpoint("chats", t2, RunKind.INCREMENTAL);

    assertEquals(t1, store.getCheckpoint("meetings", NOW).getStart());
    assertEquals(t2, store.getCheckpoint("chats", NOW).getStart());
  }

  @Test
  public void getCheckpoint_corruptFile_startsAtFloor() throws IOException {
    Files.write(
        temporaryFolder.getRoot().toPath().resolve(CheckpointStore.FILE_NAME),
        "]]".getBytes(UTF_8));
    assertEquals(FLOOR, store.getCheckpoint("users", NOW).getStart());
  }

  @Test
  public void getCheckpoint_futureCheckpoint_isClampedToNow() throws IOException {
    store.setCheckpoint("recordings", NOW.plusSeconds(60), RunKind.FULL);
    assertEquals(new TimeWindow(NOW, NOW), store.getCheckpoint("recordings", NOW));
  }

  @Test
  public void fromConfiguration_usesConfiguredStartTime() throws IOException {
    Properties config = new Properties();
    config.setProperty("connector.startTime", "2019-02-03T04:05:06Z");
    setupConfig.initConfig(config);
    CheckpointStore configured = CheckpointStore.fromConfiguration(handler);
    assertEquals(
        Instant.parse("2019-02-03T04:05:06Z"), configured.getCheckpoint("users", NOW).getStart());
  }
}

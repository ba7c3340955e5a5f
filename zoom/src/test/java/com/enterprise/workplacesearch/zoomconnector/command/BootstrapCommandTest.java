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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.enterprise.workplacesearch.sdk.config.Configuration.ResetConfigRule;
import com.enterprise.workplacesearch.sdk.config.Configuration.SetupConfigRule;
import com.enterprise.workplacesearch.sdk.indexing.EnterpriseSearchService;
import com.enterprise.workplacesearch.sdk.indexing.WorkplaceSearchClient;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

/** Tests for {@link BootstrapCommand}. */
@RunWith(MockitoJUnitRunner.class)
public class BootstrapCommandTest {
  @Rule public ExpectedException thrown = ExpectedException.none();
  @Rule public ResetConfigRule resetConfig = new ResetConfigRule();
  @Rule public SetupConfigRule setupConfig = SetupConfigRule.uninitialized();

  @Mock private EnterpriseSearchService searchService;

  @Test
  @SuppressWarnings("unchecked")
  public void execute_createsSourceWithZoomSchema() throws IOException {
    when(searchService.createContentSource(eq("Zoom"), any(), any())).thenReturn("source-1");

    new BootstrapCommand(searchService, "Zoom").execute();

    ArgumentCaptor<Map<String, String>> schema = ArgumentCaptor.forClass(Map.class);
    ArgumentCaptor<Object> display = ArgumentCaptor.forClass(Object.class);
    verify(searchService).createContentSource(eq("Zoom"), schema.capture(), display.capture());
    assertEquals("date", schema.getValue().get("created_at"));
    assertEquals("text", schema.getValue().get("size"));
    assertEquals(8, schema.getValue().size());
    Map<String, Object> cards = (Map<String, Object>) display.getValue();
    assertEquals("title", cards.get("title_field"));
    assertEquals("url", cards.get("url_field"));
    assertEquals(5, ((List<?>) cards.get("detail_fields")).size());
  }

  @Test
  public void constructor_emptyName_fails() {
    thrown.expect(IllegalArgumentException.class);
    new BootstrapCommand(searchService, "");
  }

  @Test
  public void fromConfiguration_readsSourceName() throws IOException {
    Properties properties = new Properties();
    properties.put(BootstrapCommand.CONFIG_CONTENT_SOURCE_NAME, "Zoom meetings");
    properties.put(WorkplaceSearchClient.CONFIG_HOST_URL, "http://localhost:3002");
    properties.put(WorkplaceSearchClient.CONFIG_API_KEY, "secret");
    setupConfig.initConfig(properties);

    assertNotNull(BootstrapCommand.fromConfiguration());
  }
}

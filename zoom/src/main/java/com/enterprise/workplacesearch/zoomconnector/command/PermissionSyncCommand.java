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

import static com.google.common.base.Preconditions.checkNotNull;

import com.enterprise.workplacesearch.sdk.InvalidConfigurationException;
import com.enterprise.workplacesearch.sdk.indexing.EnterpriseSearchService;
import com.enterprise.workplacesearch.sdk.indexing.UserPermissions;
import com.enterprise.workplacesearch.zoomconnector.ConnectorContext;
import com.enterprise.workplacesearch.zoomconnector.fetch.ObjectType;
import com.enterprise.workplacesearch.zoomconnector.fetch.PermissionMapping;
import com.enterprise.workplacesearch.zoomconnector.fetch.RoleDirectory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Replaces the user permissions of the content source.
 *
 * <p>Every permission currently held by an Enterprise Search user is removed first. Each mapped
 * Enterprise Search user is then granted its own name plus the read permissions its Zoom user
 * holds through Zoom roles, so that it sees the documents tagged with either.
 */
public class PermissionSyncCommand implements ConnectorCommand {
  private static final Logger logger = Logger.getLogger(PermissionSyncCommand.class.getName());

  private final ConnectorContext context;

  public PermissionSyncCommand(ConnectorContext context) {
    this.context = checkNotNull(context);
  }

  /**
   * Rebuilds the permissions.
   *
   * @throws InvalidConfigurationException if document permissions are disabled or the user
   *     mapping is empty
   */
  @Override
  public void execute() throws IOException {
    if (!context.isPermissionEnabled()) {
      throw new InvalidConfigurationException(
          "Permission sync requires "
              + ConnectorContext.CONFIG_ENABLE_DOCUMENT_PERMISSION
              + " to be true");
    }
    PermissionMapping mapping = context.getPermissionMapping();
    if (mapping.isEmpty()) {
      throw new InvalidConfigurationException(
          "User mapping file "
              + PermissionMapping.CONFIG_USER_MAPPING
              + " is not configured, missing or empty");
    }
    EnterpriseSearchService searchService = context.getSearchService();
    removeAllPermissions(searchService);

    ImmutableSetMultimap<String, String> privileges =
        new RoleDirectory(context.getZoomClient()).getPrivilegesByMember();
    ImmutableSet<String> permissionTags = ObjectType.permissionTags();
    int granted = 0;
    for (String zoomUserId : mapping.getSourceIdentities()) {
      for (String user : mapping.getIndexIdentities(zoomUserId)) {
        Set<String> permissions = new LinkedHashSet<>();
        permissions.add(user);
        for (String privilege : privileges.get(zoomUserId)) {
          if (permissionTags.contains(privilege)) {
            permissions.add(privilege);
          }
        }
        searchService.addPermissions(user, ImmutableList.copyOf(permissions));
        logger.log(Level.FINE, "Granted {0} to {1}", new Object[] {permissions, user});
        granted++;
      }
    }
    logger.log(Level.INFO, "Permissions synced for {0} Enterprise Search user(s)", granted);
  }

  private void removeAllPermissions(EnterpriseSearchService searchService) throws IOException {
    int removed = 0;
    for (UserPermissions existing : searchService.listPermissions()) {
      if (existing.getPermissions().isEmpty()) {
        continue;
      }
      searchService.removePermissions(existing.getUser(), existing.getPermissions());
      removed++;
    }
    logger.log(Level.INFO, "Removed the permissions of {0} Enterprise Search user(s)", removed);
  }
}

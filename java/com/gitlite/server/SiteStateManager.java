// Copyright (C) 2026 The Android Open Source Project
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.gitlite.server;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.gitlite.common.FileUtil;
import com.gitlite.exceptions.StorageException;
import com.gitlite.lifecycle.LifecycleListener;
import com.gitlite.server.account.AccountSshKey;
import com.gitlite.server.account.IdentityStore;
import com.gitlite.server.account.InvalidSshKeyException;
import com.gitlite.server.account.UsersFile;
import com.gitlite.server.config.SitePaths;
import com.gitlite.server.project.RepositoriesFile;
import com.gitlite.server.project.RepositoryPermissionTable;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.util.List;

/**
 * Loads the administrator key, users and repositories when the daemon starts and saves them when
 * it stops.
 *
 * <p>Failures to read or write the data files are logged and do not stop the daemon.
 */
@Singleton
public class SiteStateManager implements LifecycleListener {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final SitePaths site;
  private final IdentityStore identities;
  private final RepositoryPermissionTable repositories;
  private final UsersFile usersFile;
  private final RepositoriesFile repositoriesFile;

  @Inject
  SiteStateManager(
      SitePaths site,
      IdentityStore identities,
      RepositoryPermissionTable repositories,
      UsersFile usersFile,
      RepositoriesFile repositoriesFile) {
    this.site = site;
    this.identities = identities;
    this.repositories = repositories;
    this.usersFile = usersFile;
    this.repositoriesFile = repositoriesFile;
  }

  @Override
  public void start() {
    FileUtil.mkdirsOrDie(site.data_dir, "Cannot create data directory");
    FileUtil.mkdirsOrDie(repositories.getBasePath(), "Cannot create repository directory");

    loadAdminKey();
    try {
      usersFile.loadInto(identities);
    } catch (StorageException e) {
      logger.atWarning().withCause(e).log("Cannot load users from %s", usersFile.getPath());
    }
    try {
      repositoriesFile.loadInto(repositories);
    } catch (StorageException e) {
      logger.atWarning().withCause(e).log(
          "Cannot load repositories from %s", repositoriesFile.getPath());
    }
    logger.atInfo().log(
        "Loaded %d users and %d repositories",
        identities.listUsers().size(), repositories.list().size());
  }

  @Override
  public void stop() {
    try {
      saveUsers();
    } catch (StorageException e) {
      logger.atWarning().withCause(e).log("Cannot save users");
    }
    try {
      saveRepositories();
    } catch (StorageException e) {
      logger.atWarning().withCause(e).log("Cannot save repositories");
    }
  }

  public void saveUsers() throws StorageException {
    usersFile.saveFrom(identities);
  }

  public void saveRepositories() throws StorageException {
    repositoriesFile.saveFrom(repositories);
  }

  /** Install the first key found in {@code etc/admin.pub}, if there is one. */
  void loadAdminKey() {
    List<String> lines;
    try {
      lines = Files.readAllLines(site.admin_key, UTF_8);
    } catch (NoSuchFileException e) {
      logger.atWarning().log("No administrator key; create %s", site.admin_key);
      return;
    } catch (IOException e) {
      logger.atWarning().withCause(e).log("Cannot read %s", site.admin_key);
      return;
    }

    for (String line : lines) {
      String s = line.trim();
      if (s.isEmpty() || s.startsWith("#")) {
        continue;
      }
      try {
        AccountSshKey key = AccountSshKey.parse(s);
        identities.setAdminKey(key);
        logger.atInfo().log("Loaded administrator key %s", key.fingerprint());
      } catch (InvalidSshKeyException e) {
        logger.atWarning().log(
            "Invalid administrator key in %s: %s", site.admin_key, e.getMessage());
      }
      return;
    }
    logger.atWarning().log("No administrator key in %s", site.admin_key);
  }
}

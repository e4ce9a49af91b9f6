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

package com.gitlite.server.config;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import java.nio.file.Path;

/** Important paths within a {@link SitePath}. */
@Singleton
public final class SitePaths {
  public static final String CONFIG_FILENAME = "gitlite.config";
  public static final String ADMIN_KEY_FILENAME = "admin.pub";
  public static final String USERS_FILENAME = "users.json";
  public static final String REPOS_FILENAME = "repos.json";

  public final Path site_path;
  public final Path etc_dir;
  public final Path data_dir;
  public final Path logs_dir;

  public final Path gitlite_config;
  public final Path admin_key;
  public final Path ssh_key;

  public final Path users_file;
  public final Path repos_file;

  @Inject
  public SitePaths(@SitePath Path sitePath) {
    site_path = sitePath;
    Path p = sitePath;

    etc_dir = p.resolve("etc");
    data_dir = p.resolve("data");
    logs_dir = p.resolve("logs");

    gitlite_config = etc_dir.resolve(CONFIG_FILENAME);
    admin_key = etc_dir.resolve(ADMIN_KEY_FILENAME);
    ssh_key = etc_dir.resolve("ssh_host_key");

    users_file = data_dir.resolve(USERS_FILENAME);
    repos_file = data_dir.resolve(REPOS_FILENAME);
  }

  /**
   * Resolve an absolute or relative path.
   *
   * <p>Relative paths are resolved relative to the {@link #site_path}.
   *
   * @param path the path string to resolve. May be null.
   * @return the resolved path; null if {@code path} was null or empty.
   */
  public Path resolve(String path) {
    if (path == null || path.isEmpty()) {
      return null;
    }
    return site_path.resolve(path).toAbsolutePath().normalize();
  }
}

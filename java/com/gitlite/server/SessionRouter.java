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

import com.gitlite.server.account.AuthResult;
import com.gitlite.server.git.GitCommand;
import com.gitlite.server.git.GitCommandException;
import com.gitlite.server.git.GitCommandParser;
import com.gitlite.server.project.HostedRepository;
import com.gitlite.server.project.RepositoryPermissionTable;
import com.google.common.base.Strings;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Decides what an SSH channel may do once the caller's key has been resolved.
 *
 * <p>A channel without a command is a request for the administrator console, granted to the
 * administrator only. A channel with a command must come from someone other than the
 * administrator, must parse as an allowed Git command, must pass the repository's permission check
 * and must name a repository that is present on disk.
 */
@Singleton
public class SessionRouter {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String ADMIN_ONLY = "Access denied: admin only";
  static final String ADMIN_NO_GIT = "Access denied: admins cannot perform Git operations";
  static final String INSUFFICIENT_PERMISSIONS = "Access denied: insufficient permissions";
  static final String NO_SUCH_REPOSITORY = "Error: repository does not exist";

  private final RepositoryPermissionTable repositories;

  @Inject
  public SessionRouter(RepositoryPermissionTable repositories) {
    this.repositories = repositories;
  }

  public Route route(AuthResult who, @Nullable String commandLine) {
    if (Strings.isNullOrEmpty(commandLine)) {
      return who.isAdmin() ? Route.console() : Route.reject(ADMIN_ONLY);
    }
    if (who.isAdmin()) {
      return Route.reject(ADMIN_NO_GIT);
    }

    GitCommand cmd;
    try {
      cmd = GitCommandParser.parse(commandLine);
    } catch (GitCommandException e) {
      logger.atFine().log(
          "Rejected %s command from %s: %s", e.getKind(), who.username(), e.getMessage());
      return Route.reject("Error: " + e.getMessage());
    }

    if (!repositories.checkPermission(cmd.repoPath(), who.username(), cmd.isWrite())) {
      return Route.reject(INSUFFICIENT_PERMISSIONS);
    }

    Optional<Path> dir = repositories.get(cmd.repoPath()).map(HostedRepository::path);
    if (!dir.isPresent() || !Files.isDirectory(dir.get())) {
      return Route.reject(NO_SUCH_REPOSITORY);
    }
    return Route.execute(cmd, dir.get());
  }
}

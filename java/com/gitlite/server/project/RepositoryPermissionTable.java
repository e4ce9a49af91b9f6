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

package com.gitlite.server.project;

import com.gitlite.common.FileUtil;
import com.gitlite.server.account.Account;
import com.gitlite.server.config.GitliteServerConfig;
import com.gitlite.server.config.SitePaths;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.eclipse.jgit.lib.Config;

/**
 * Tracks the hosted repositories and who may read or write them.
 *
 * <p>Guarded by a single read/write lock, independent of the lock of the identity store. Names are
 * accepted with or without the {@code .git} suffix everywhere.
 *
 * <p>The table does not police the {@code guest} entry; callers that grant permissions must keep
 * {@code guest} at {@link Permission#READ}.
 */
@Singleton
public class RepositoryPermissionTable {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final class Entry {
    final String name;
    final Path path;
    final Map<String, Permission> users;

    Entry(String name, Path path, Map<String, Permission> users) {
      this.name = name;
      this.path = path;
      this.users = new HashMap<>(users);
    }

    HostedRepository snapshot() {
      return HostedRepository.create(name, path, users);
    }
  }

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, Entry> repos = new TreeMap<>();

  private final Path basePath;
  private final RepositoryInitializer initializer;

  @Inject
  RepositoryPermissionTable(
      SitePaths site, @GitliteServerConfig Config cfg, RepositoryInitializer initializer) {
    this(basePath(site, cfg), initializer);
  }

  @VisibleForTesting
  public RepositoryPermissionTable(Path basePath, RepositoryInitializer initializer) {
    this.basePath = basePath;
    this.initializer = initializer;
  }

  private static Path basePath(SitePaths site, Config cfg) {
    String p = cfg.getString("repository", null, "basePath");
    return site.resolve(p == null || p.isEmpty() ? "git" : p);
  }

  public Path getBasePath() {
    return basePath;
  }

  /** Location of the repository {@code name}, whether or not it is tracked. */
  public Path repositoryPath(String name) {
    return basePath.resolve(RepositoryName.strip(name) + RepositoryName.SUFFIX);
  }

  /**
   * Create a repository with an empty permission map.
   *
   * <p>If the bare repository cannot be initialized the partially written directory is removed and
   * nothing is tracked.
   */
  public HostedRepository create(String name) throws RepositoryException {
    if (!RepositoryName.isValid(name)) {
      throw new RepositoryException("invalid repository name: " + name);
    }
    String key = RepositoryName.strip(name);
    lock.writeLock().lock();
    try {
      if (repos.containsKey(key)) {
        throw new RepositoryException("repository " + key + " already exists");
      }
      Path path = repositoryPath(key);
      if (Files.exists(path)) {
        throw new RepositoryException("repository " + key + " already exists on disk: " + path);
      }
      try {
        initializer.initialize(path);
      } catch (IOException e) {
        removeQuietly(path);
        throw new RepositoryException("failed to init repository: " + e.getMessage(), e);
      }
      Entry e = new Entry(key, path, new HashMap<>());
      repos.put(key, e);
      logger.atInfo().log("Created repository %s at %s", key, path);
      return e.snapshot();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Delete a repository and its data.
   *
   * <p>If the data cannot be removed the repository stays tracked, possibly with part of its files
   * gone.
   */
  public void delete(String name) throws RepositoryException {
    lock.writeLock().lock();
    try {
      Entry e = require(name);
      try {
        FileUtil.deleteRecursively(e.path);
      } catch (IOException err) {
        throw new RepositoryException("cannot delete " + e.path + ": " + err.getMessage(), err);
      }
      repos.remove(e.name);
      logger.atInfo().log("Deleted repository %s", e.name);
    } finally {
      lock.writeLock().unlock();
    }
  }

  public Optional<HostedRepository> get(String name) {
    lock.readLock().lock();
    try {
      Entry e = repos.get(RepositoryName.strip(name));
      return e != null ? Optional.of(e.snapshot()) : Optional.empty();
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Snapshot of all repositories, sorted by name. */
  public ImmutableList<HostedRepository> list() {
    lock.readLock().lock();
    try {
      ImmutableList.Builder<HostedRepository> b = ImmutableList.builder();
      for (Entry e : repos.values()) {
        b.add(e.snapshot());
      }
      return b.build();
    } finally {
      lock.readLock().unlock();
    }
  }

  public void addUser(String repo, String user, Permission perm) throws RepositoryException {
    lock.writeLock().lock();
    try {
      require(repo).users.put(user, perm);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Remove {@code user} from the map of {@code repo}; removing an absent user succeeds. */
  public void removeUser(String repo, String user) throws RepositoryException {
    lock.writeLock().lock();
    try {
      require(repo).users.remove(user);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Decide whether {@code user} may read or write {@code repo}.
   *
   * <p>Reads are granted to everyone, known or not, when {@code guest} holds at least {@link
   * Permission#READ}. Otherwise an empty user name is refused, and a named user needs an entry of
   * {@link Permission#WRITE} to write or at least {@link Permission#READ} to read.
   */
  public boolean checkPermission(String repo, String user, boolean needWrite) {
    lock.readLock().lock();
    try {
      Entry e = repos.get(RepositoryName.strip(repo));
      if (e == null) {
        return false;
      }
      if (!needWrite) {
        Permission guest = e.users.get(Account.GUEST_NAME);
        if (guest != null && guest.atLeast(Permission.READ)) {
          return true;
        }
      }
      if (user == null || user.isEmpty()) {
        return false;
      }
      Permission perm = e.users.get(user);
      if (perm == null) {
        return false;
      }
      if (needWrite) {
        return perm == Permission.WRITE;
      }
      return perm.atLeast(Permission.READ);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Re-admit persisted repositories.
   *
   * <p>A repository whose directory no longer exists is skipped, as is one whose name is already
   * tracked. A {@code guest} entry other than read is reduced to read.
   */
  public void load(Iterable<HostedRepository> persisted) {
    lock.writeLock().lock();
    try {
      for (HostedRepository r : persisted) {
        String key = RepositoryName.strip(r.name());
        if (repos.containsKey(key)) {
          continue;
        }
        if (!Files.exists(r.path())) {
          logger.atWarning().log("Repository %s is missing at %s; not loaded", key, r.path());
          continue;
        }
        Entry e = new Entry(key, r.path(), r.users());
        Permission guest = e.users.get(Account.GUEST_NAME);
        if (guest != null && guest != Permission.READ) {
          logger.atWarning().log(
              "Repository %s grants %s to %s; reduced to read", key, guest, Account.GUEST_NAME);
          e.users.put(Account.GUEST_NAME, Permission.READ);
        }
        repos.put(key, e);
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  private Entry require(String name) throws RepositoryException {
    String key = RepositoryName.strip(name);
    Entry e = repos.get(key);
    if (e == null) {
      throw new RepositoryException("repository " + key + " does not exist");
    }
    return e;
  }

  private static void removeQuietly(Path path) {
    try {
      FileUtil.deleteRecursively(path);
    } catch (IOException e) {
      logger.atWarning().withCause(e).log("Cannot remove partially created %s", path);
    }
  }
}

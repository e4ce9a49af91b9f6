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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.gitlite.common.FileUtil;
import com.gitlite.exceptions.StorageException;
import com.gitlite.server.config.SitePaths;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Reads and writes {@code data/repos.json}.
 *
 * <p>The file holds a JSON array of {@code {"name", "path", "users": {user: "r"|"rw"}}} records.
 * Unknown permission strings drop that user only. Entries at {@link Permission#NONE} are not
 * written.
 */
@Singleton
public class RepositoriesFile {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final Gson GSON =
      new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  static class RepositoryRecord {
    String name;
    String path;
    Map<String, String> users;
  }

  private final Path path;

  @Inject
  RepositoriesFile(SitePaths site) {
    this(site.repos_file);
  }

  @VisibleForTesting
  RepositoriesFile(Path path) {
    this.path = path;
  }

  public Path getPath() {
    return path;
  }

  public void loadInto(RepositoryPermissionTable table) throws StorageException {
    table.load(read());
  }

  public void saveFrom(RepositoryPermissionTable table) throws StorageException {
    write(table.list());
  }

  public ImmutableList<HostedRepository> read() throws StorageException {
    String json;
    try {
      json = new String(Files.readAllBytes(path), UTF_8);
    } catch (NoSuchFileException e) {
      return ImmutableList.of();
    } catch (IOException e) {
      throw new StorageException("failed to read repo permission data: " + path, e);
    }
    return decode(json);
  }

  public void write(Iterable<HostedRepository> repos) throws StorageException {
    try {
      FileUtil.writeAtomically(path, encode(repos).getBytes(UTF_8));
    } catch (IOException e) {
      throw new StorageException("failed to save repo permission data: " + path, e);
    }
  }

  @VisibleForTesting
  static ImmutableList<HostedRepository> decode(String json) throws StorageException {
    if (json.trim().isEmpty()) {
      return ImmutableList.of();
    }
    List<RepositoryRecord> records;
    try {
      records = GSON.fromJson(json, new TypeToken<List<RepositoryRecord>>() {}.getType());
    } catch (JsonParseException e) {
      throw new StorageException("failed to parse repo permission data", e);
    }
    if (records == null) {
      return ImmutableList.of();
    }

    ImmutableList.Builder<HostedRepository> repos = ImmutableList.builder();
    for (RepositoryRecord r : records) {
      if (r == null || r.name == null || r.path == null) {
        continue;
      }
      Map<String, Permission> users = new HashMap<>();
      if (r.users != null) {
        for (Map.Entry<String, String> e : r.users.entrySet()) {
          Optional<Permission> p = Permission.fromCode(e.getValue());
          if (p.isPresent()) {
            users.put(e.getKey(), p.get());
          } else {
            logger.atWarning().log(
                "Ignoring permission \"%s\" of %s on %s", e.getValue(), e.getKey(), r.name);
          }
        }
      }
      Path dir;
      try {
        dir = Paths.get(r.path);
      } catch (InvalidPathException e) {
        logger.atWarning().log("Ignoring repository %s with invalid path %s", r.name, r.path);
        continue;
      }
      repos.add(HostedRepository.create(r.name, dir, users));
    }
    return repos.build();
  }

  @VisibleForTesting
  static String encode(Iterable<HostedRepository> repos) {
    List<RepositoryRecord> records = new ArrayList<>();
    for (HostedRepository repo : repos) {
      RepositoryRecord r = new RepositoryRecord();
      r.name = repo.name();
      r.path = repo.path().toString();
      r.users = new TreeMap<>();
      repo.users().forEach((user, perm) -> perm.code().ifPresent(c -> r.users.put(user, c)));
      records.add(r);
    }
    return GSON.toJson(records) + "\n";
  }
}

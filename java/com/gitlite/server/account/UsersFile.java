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

package com.gitlite.server.account;

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
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes {@code data/users.json}.
 *
 * <p>The file holds a JSON array of {@code {"name": ..., "keys": [...]}} records, each key in
 * {@code authorized_keys} format. Keys that cannot be parsed are skipped on load.
 */
@Singleton
public class UsersFile {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final Gson GSON =
      new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  static class UserRecord {
    String name;
    List<String> keys;
  }

  private final Path path;

  @Inject
  UsersFile(SitePaths site) {
    this(site.users_file);
  }

  @VisibleForTesting
  UsersFile(Path path) {
    this.path = path;
  }

  public Path getPath() {
    return path;
  }

  /** Load into {@code store}; a missing or empty file leaves the store untouched. */
  public void loadInto(IdentityStore store) throws StorageException {
    store.load(read());
  }

  public void saveFrom(IdentityStore store) throws StorageException {
    write(store.listUsers());
  }

  public ImmutableList<Account> read() throws StorageException {
    String json;
    try {
      json = new String(Files.readAllBytes(path), UTF_8);
    } catch (NoSuchFileException e) {
      return ImmutableList.of();
    } catch (IOException e) {
      throw new StorageException("failed to read user data: " + path, e);
    }
    return decode(json);
  }

  public void write(Iterable<Account> accounts) throws StorageException {
    try {
      FileUtil.writeAtomically(path, encode(accounts).getBytes(UTF_8));
    } catch (IOException e) {
      throw new StorageException("failed to save user data: " + path, e);
    }
  }

  @VisibleForTesting
  static ImmutableList<Account> decode(String json) throws StorageException {
    if (json.trim().isEmpty()) {
      return ImmutableList.of();
    }
    List<UserRecord> records;
    try {
      records = GSON.fromJson(json, new TypeToken<List<UserRecord>>() {}.getType());
    } catch (JsonParseException e) {
      throw new StorageException("failed to parse user data", e);
    }
    if (records == null) {
      return ImmutableList.of();
    }

    ImmutableList.Builder<Account> accounts = ImmutableList.builder();
    for (UserRecord r : records) {
      if (r == null || r.name == null || r.name.isEmpty()) {
        continue;
      }
      List<AccountSshKey> keys = new ArrayList<>();
      if (r.keys != null) {
        for (String k : r.keys) {
          try {
            keys.add(AccountSshKey.parse(k));
          } catch (InvalidSshKeyException e) {
            logger.atWarning().log("Skipping invalid key of user %s: %s", r.name, e.getMessage());
          }
        }
      }
      accounts.add(Account.create(r.name, keys));
    }
    return accounts.build();
  }

  @VisibleForTesting
  static String encode(Iterable<Account> accounts) {
    List<UserRecord> records = new ArrayList<>();
    for (Account a : accounts) {
      UserRecord r = new UserRecord();
      r.name = a.name();
      r.keys = new ArrayList<>();
      for (AccountSshKey k : a.keys()) {
        r.keys.add(k.sshPublicKey());
      }
      records.add(r);
    }
    return GSON.toJson(records) + "\n";
  }
}

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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Singleton;
import java.security.PublicKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import javax.annotation.Nullable;

/**
 * Process-wide registry of the administrator key and the registered users.
 *
 * <p>All state is guarded by one read/write lock. Lookups share the read lock; every mutation holds
 * the write lock and is visible to the next {@link #authenticate(PublicKey)} from any thread.
 *
 * <p>A fingerprint belongs to at most one identity: {@link #addKey(String, AccountSshKey)} refuses
 * a key that is already registered to another user or that is the administrator key.
 */
@Singleton
public class IdentityStore {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  @Nullable private AccountSshKey adminKey;

  /** Users by name; iteration in name order keeps lookups deterministic. */
  private final Map<String, List<AccountSshKey>> users = new TreeMap<>();

  /** Installs or replaces the administrator credential. */
  public void setAdminKey(AccountSshKey key) {
    lock.writeLock().lock();
    try {
      adminKey = key;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public Optional<AccountSshKey> getAdminKey() {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(adminKey);
    } finally {
      lock.readLock().unlock();
    }
  }

  public AuthResult authenticate(PublicKey key) {
    return authenticate(AccountSshKey.fingerprint(key));
  }

  /**
   * Resolve a key fingerprint to an identity.
   *
   * <p>The administrator key is checked first, then the users. A key nobody holds yields {@link
   * AuthResult#unknown()}; that is not an error.
   */
  public AuthResult authenticate(String fingerprint) {
    lock.readLock().lock();
    try {
      if (adminKey != null && adminKey.fingerprint().equals(fingerprint)) {
        return AuthResult.admin(Account.create(Account.ADMIN_NAME, ImmutableList.of(adminKey)));
      }
      for (Map.Entry<String, List<AccountSshKey>> e : users.entrySet()) {
        for (AccountSshKey k : e.getValue()) {
          if (k.fingerprint().equals(fingerprint)) {
            return AuthResult.user(Account.create(e.getKey(), e.getValue()));
          }
        }
      }
      return AuthResult.unknown();
    } finally {
      lock.readLock().unlock();
    }
  }

  public void createUser(String name) throws AccountException {
    if (Account.ADMIN_NAME.equals(name)) {
      throw new AccountException("cannot create user named '" + Account.ADMIN_NAME + "'");
    }
    lock.writeLock().lock();
    try {
      if (users.containsKey(name)) {
        throw new AccountException("user " + name + " already exists");
      }
      users.put(name, new ArrayList<>());
    } finally {
      lock.writeLock().unlock();
    }
  }

  public void deleteUser(String name) throws AccountException {
    lock.writeLock().lock();
    try {
      if (users.remove(name) == null) {
        throw noSuchUser(name);
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  public Optional<Account> getUser(String name) {
    lock.readLock().lock();
    try {
      List<AccountSshKey> keys = users.get(name);
      return keys != null ? Optional.of(Account.create(name, keys)) : Optional.empty();
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Snapshot of all users, sorted by name. */
  public ImmutableList<Account> listUsers() {
    lock.readLock().lock();
    try {
      ImmutableList.Builder<Account> b = ImmutableList.builderWithExpectedSize(users.size());
      users.forEach((name, keys) -> b.add(Account.create(name, keys)));
      return b.build();
    } finally {
      lock.readLock().unlock();
    }
  }

  public void addKey(String name, AccountSshKey key) throws AccountException {
    lock.writeLock().lock();
    try {
      List<AccountSshKey> keys = users.get(name);
      if (keys == null) {
        throw noSuchUser(name);
      }
      String fp = key.fingerprint();
      if (contains(keys, fp)) {
        throw new AccountException("key already exists");
      }
      if (adminKey != null && adminKey.fingerprint().equals(fp)) {
        throw new AccountException("key is registered to " + Account.ADMIN_NAME);
      }
      String owner = ownerOf(fp);
      if (owner != null) {
        throw new AccountException("key is registered to " + owner);
      }
      keys.add(key);
    } finally {
      lock.writeLock().unlock();
    }
  }

  public void removeKey(String name, String fingerprint) throws AccountException {
    lock.writeLock().lock();
    try {
      List<AccountSshKey> keys = users.get(name);
      if (keys == null) {
        throw noSuchUser(name);
      }
      if (!keys.removeIf(k -> k.fingerprint().equals(fingerprint))) {
        throw new AccountException("key not found");
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Merge persisted users into the store.
   *
   * <p>A user already present is replaced, and users named {@code admin} or {@code guest} are
   * skipped. Accounts are applied in name order; a key whose fingerprint already belongs to another
   * user, or is the administrator key, is dropped with a warning.
   */
  public void load(Iterable<Account> accounts) {
    TreeMap<String, Account> sorted = new TreeMap<>();
    for (Account a : accounts) {
      sorted.put(a.name(), a);
    }

    lock.writeLock().lock();
    try {
      for (Account a : sorted.values()) {
        if (Account.ADMIN_NAME.equals(a.name()) || Account.GUEST_NAME.equals(a.name())) {
          logger.atWarning().log("Ignoring persisted user named %s", a.name());
          continue;
        }
        List<AccountSshKey> keys = new ArrayList<>();
        users.put(a.name(), keys);
        for (AccountSshKey k : a.keys()) {
          String fp = k.fingerprint();
          if (contains(keys, fp)) {
            continue;
          }
          String owner = ownerOf(fp);
          if (adminKey != null && adminKey.fingerprint().equals(fp)) {
            owner = Account.ADMIN_NAME;
          }
          if (owner != null) {
            logger.atWarning().log(
                "Dropping key %s of user %s: already registered to %s", fp, a.name(), owner);
            continue;
          }
          keys.add(k);
        }
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Nullable
  private String ownerOf(String fingerprint) {
    for (Map.Entry<String, List<AccountSshKey>> e : users.entrySet()) {
      if (contains(e.getValue(), fingerprint)) {
        return e.getKey();
      }
    }
    return null;
  }

  private static boolean contains(List<AccountSshKey> keys, String fingerprint) {
    for (AccountSshKey k : keys) {
      if (k.fingerprint().equals(fingerprint)) {
        return true;
      }
    }
    return false;
  }

  private static AccountException noSuchUser(String name) {
    return new AccountException("user " + name + " does not exist");
  }
}

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

import static com.gitlite.testing.GitliteJUnit.assertThrows;
import static com.google.common.truth.Truth.assertThat;

import com.gitlite.testing.TestKeys;
import com.google.common.collect.ImmutableList;
import java.security.KeyPair;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.Before;
import org.junit.Test;

public class IdentityStoreTest {
  private IdentityStore store;
  private KeyPair adminPair;
  private KeyPair alicePair;

  @Before
  public void setUp() throws Exception {
    store = new IdentityStore();
    adminPair = TestKeys.generateKeyPair();
    alicePair = TestKeys.generateKeyPair();
    store.setAdminKey(AccountSshKey.create(adminPair.getPublic(), "admin@host"));
    store.createUser("alice");
    store.addKey("alice", AccountSshKey.create(alicePair.getPublic(), null));
  }

  @Test
  public void authenticateAdmin() {
    AuthResult who = store.authenticate(adminPair.getPublic());

    assertThat(who.identityClass()).isEqualTo(IdentityClass.ADMIN);
    assertThat(who.isAdmin()).isTrue();
    assertThat(who.username()).isEqualTo(Account.ADMIN_NAME);
  }

  @Test
  public void authenticateUser() {
    AuthResult who = store.authenticate(alicePair.getPublic());

    assertThat(who.identityClass()).isEqualTo(IdentityClass.NORMAL);
    assertThat(who.isAdmin()).isFalse();
    assertThat(who.username()).isEqualTo("alice");
  }

  @Test
  public void unknownKeyIsNotAnError() {
    AuthResult who = store.authenticate(TestKeys.generateKeyPair().getPublic());

    assertThat(who.identityClass()).isEqualTo(IdentityClass.UNKNOWN);
    assertThat(who.account()).isNull();
    assertThat(who.username()).isEmpty();
  }

  @Test
  public void adminKeyCanBeReplaced() {
    KeyPair next = TestKeys.generateKeyPair();
    store.setAdminKey(AccountSshKey.create(next.getPublic(), null));

    assertThat(store.authenticate(next.getPublic()).isAdmin()).isTrue();
    assertThat(store.authenticate(adminPair.getPublic()).identityClass())
        .isEqualTo(IdentityClass.UNKNOWN);
  }

  @Test
  public void cannotCreateAdmin() {
    AccountException e = assertThrows(AccountException.class, () -> store.createUser("admin"));
    assertThat(e).hasMessageThat().isEqualTo("cannot create user named 'admin'");
  }

  @Test
  public void cannotCreateUserTwice() {
    AccountException e = assertThrows(AccountException.class, () -> store.createUser("alice"));
    assertThat(e).hasMessageThat().isEqualTo("user alice already exists");
  }

  @Test
  public void deleteUnknownUser() {
    AccountException e = assertThrows(AccountException.class, () -> store.deleteUser("bob"));
    assertThat(e).hasMessageThat().isEqualTo("user bob does not exist");
  }

  @Test
  public void deletedUserNoLongerAuthenticates() throws Exception {
    store.deleteUser("alice");

    assertThat(store.getUser("alice")).isEmpty();
    assertThat(store.authenticate(alicePair.getPublic()).identityClass())
        .isEqualTo(IdentityClass.UNKNOWN);
  }

  @Test
  public void addKeyToUnknownUser() {
    AccountException e =
        assertThrows(AccountException.class, () -> store.addKey("bob", TestKeys.newKey()));
    assertThat(e).hasMessageThat().isEqualTo("user bob does not exist");
  }

  @Test
  public void addSameKeyTwice() {
    AccountSshKey again = AccountSshKey.create(alicePair.getPublic(), "other comment");

    AccountException e = assertThrows(AccountException.class, () -> store.addKey("alice", again));
    assertThat(e).hasMessageThat().isEqualTo("key already exists");
  }

  @Test
  public void keyOfAnotherUserIsRefused() throws Exception {
    store.createUser("bob");

    AccountException e =
        assertThrows(
            AccountException.class,
            () -> store.addKey("bob", AccountSshKey.create(alicePair.getPublic(), null)));
    assertThat(e).hasMessageThat().contains("alice");
    assertThat(store.getUser("bob").get().keys()).isEmpty();
  }

  @Test
  public void adminKeyIsRefusedForUsers() {
    assertThrows(
        AccountException.class,
        () -> store.addKey("alice", AccountSshKey.create(adminPair.getPublic(), null)));
    assertThat(store.getUser("alice").get().keys()).hasSize(1);
  }

  @Test
  public void removeKey() throws Exception {
    String fp = AccountSshKey.fingerprint(alicePair.getPublic());

    store.removeKey("alice", fp);

    assertThat(store.getUser("alice").get().keys()).isEmpty();
    AccountException e =
        assertThrows(AccountException.class, () -> store.removeKey("alice", fp));
    assertThat(e).hasMessageThat().isEqualTo("key not found");
  }

  @Test
  public void userKeepsKeysInInsertionOrder() throws Exception {
    AccountSshKey second = TestKeys.newKey("second");
    store.addKey("alice", second);

    Account alice = store.getUser("alice").get();

    assertThat(alice.keys()).hasSize(2);
    assertThat(alice.keys().get(1)).isEqualTo(second);
    assertThat(alice.findKey(second.fingerprint())).hasValue(second);
  }

  @Test
  public void listUsersIsSortedByName() throws Exception {
    store.createUser("zoe");
    store.createUser("bob");

    assertThat(store.listUsers().stream().map(Account::name))
        .containsExactly("alice", "bob", "zoe")
        .inOrder();
  }

  @Test
  public void snapshotsAreNotAffectedByLaterChanges() throws Exception {
    Account before = store.getUser("alice").get();

    store.addKey("alice", TestKeys.newKey());

    assertThat(before.keys()).hasSize(1);
  }

  @Test
  public void loadKeepsFirstOwnerOfDuplicateKey() {
    IdentityStore fresh = new IdentityStore();
    AccountSshKey shared = TestKeys.newKey("shared");
    AccountSshKey own = TestKeys.newKey("own");

    fresh.load(
        ImmutableList.of(
            Account.create("zed", ImmutableList.of(shared, own)),
            Account.create("amy", ImmutableList.of(shared))));

    assertThat(fresh.authenticate(shared.fingerprint()).username()).isEqualTo("amy");
    assertThat(fresh.getUser("zed").get().keys()).containsExactly(own);
  }

  @Test
  public void loadIgnoresUserNamedAdmin() {
    IdentityStore fresh = new IdentityStore();
    AccountSshKey key = TestKeys.newKey();

    fresh.load(ImmutableList.of(Account.create("admin", ImmutableList.of(key))));

    assertThat(fresh.listUsers()).isEmpty();
    assertThat(fresh.authenticate(key.fingerprint()).identityClass())
        .isEqualTo(IdentityClass.UNKNOWN);
  }

  @Test
  public void loadIgnoresUserNamedGuest() {
    IdentityStore fresh = new IdentityStore();
    AccountSshKey key = TestKeys.newKey();

    fresh.load(ImmutableList.of(Account.create(Account.GUEST_NAME, ImmutableList.of(key))));

    assertThat(fresh.getUser(Account.GUEST_NAME)).isEmpty();
    assertThat(fresh.authenticate(key.fingerprint()).identityClass())
        .isEqualTo(IdentityClass.UNKNOWN);
  }

  @Test
  public void concurrentWritersAndReaders() throws Exception {
    int writers = 8;
    int perWriter = 25;
    ExecutorService pool = Executors.newFixedThreadPool(writers + 2);
    CountDownLatch go = new CountDownLatch(1);
    try {
      List<Future<?>> tasks = new ArrayList<>();
      for (int w = 0; w < writers; w++) {
        int id = w;
        tasks.add(
            pool.submit(
                () -> {
                  go.await();
                  for (int i = 0; i < perWriter; i++) {
                    String name = "u" + id + "-" + i;
                    AccountSshKey key = TestKeys.newKey(name);
                    store.createUser(name);
                    store.addKey(name, key);
                    assertThat(store.authenticate(key.fingerprint()).username()).isEqualTo(name);
                  }
                  return null;
                }));
      }
      for (int r = 0; r < 2; r++) {
        tasks.add(
            pool.submit(
                () -> {
                  go.await();
                  for (int i = 0; i < 200; i++) {
                    assertThat(store.authenticate(alicePair.getPublic()).username())
                        .isEqualTo("alice");
                    store.listUsers();
                  }
                  return null;
                }));
      }
      go.countDown();
      for (Future<?> t : tasks) {
        t.get(60, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(store.listUsers()).hasSize(writers * perWriter + 1);
  }

  @Test
  public void mutationIsVisibleToOtherThread() throws Exception {
    AccountSshKey key = TestKeys.newKey("bob");
    store.createUser("bob");
    store.addKey("bob", key);

    ExecutorService pool = Executors.newSingleThreadExecutor();
    try {
      Future<AuthResult> who = pool.submit(() -> store.authenticate(key.fingerprint()));
      assertThat(who.get(10, TimeUnit.SECONDS).username()).isEqualTo("bob");
    } finally {
      pool.shutdownNow();
    }
  }
}

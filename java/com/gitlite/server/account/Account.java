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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.Optional;

/** Immutable view of an identity and the keys it can authenticate with. */
@AutoValue
public abstract class Account {
  /** Name of the single administrator identity. Never available to users. */
  public static final String ADMIN_NAME = "admin";

  /** Reserved pseudo-user granting anonymous read access in repository permission tables. */
  public static final String GUEST_NAME = "guest";

  public static Account create(String name, Iterable<AccountSshKey> keys) {
    return new AutoValue_Account(name, ImmutableList.copyOf(keys));
  }

  public abstract String name();

  /** Keys in the order they were added; fingerprints are distinct. */
  public abstract ImmutableList<AccountSshKey> keys();

  public Optional<AccountSshKey> findKey(String fingerprint) {
    return keys().stream().filter(k -> k.fingerprint().equals(fingerprint)).findFirst();
  }
}

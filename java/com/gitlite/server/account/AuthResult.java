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
import javax.annotation.Nullable;

/** Outcome of resolving a presented public key against the {@link IdentityStore}. */
@AutoValue
public abstract class AuthResult {
  private static final AuthResult UNKNOWN = new AutoValue_AuthResult(null, IdentityClass.UNKNOWN);

  public static AuthResult admin(Account admin) {
    return new AutoValue_AuthResult(admin, IdentityClass.ADMIN);
  }

  public static AuthResult user(Account user) {
    return new AutoValue_AuthResult(user, IdentityClass.NORMAL);
  }

  public static AuthResult unknown() {
    return UNKNOWN;
  }

  /** The resolved identity; null only when {@link #identityClass()} is {@code UNKNOWN}. */
  @Nullable
  public abstract Account account();

  public abstract IdentityClass identityClass();

  public boolean isAdmin() {
    return identityClass() == IdentityClass.ADMIN;
  }

  /** Name used for permission checks; empty for an unknown caller. */
  public String username() {
    return account() != null ? account().name() : "";
  }
}

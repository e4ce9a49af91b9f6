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

import java.util.Optional;

/** Access level of a user on a repository, ordered {@code NONE < READ < WRITE}. */
public enum Permission {
  NONE(null),
  READ("r"),
  WRITE("rw");

  private final String code;

  Permission(String code) {
    this.code = code;
  }

  /** Short form used in {@code repos.json} and the console; absent for {@link #NONE}. */
  public Optional<String> code() {
    return Optional.ofNullable(code);
  }

  public boolean atLeast(Permission other) {
    return compareTo(other) >= 0;
  }

  /** Parse {@code r} or {@code rw}; anything else is empty. */
  public static Optional<Permission> fromCode(String code) {
    for (Permission p : values()) {
      if (p.code != null && p.code.equals(code)) {
        return Optional.of(p);
      }
    }
    return Optional.empty();
  }
}

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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.nio.file.Path;
import java.util.Map;

/** Snapshot of a tracked repository and its permission map. */
@AutoValue
public abstract class HostedRepository {
  public static HostedRepository create(String name, Path path, Map<String, Permission> users) {
    return new AutoValue_HostedRepository(name, path, ImmutableMap.copyOf(users));
  }

  /** Name without the {@code .git} suffix. */
  public abstract String name();

  /** Location of the bare repository on disk. */
  public abstract Path path();

  /** Permission by user name; may contain {@code guest}. */
  public abstract ImmutableMap<String, Permission> users();

  public Permission permissionOf(String user) {
    return users().getOrDefault(user, Permission.NONE);
  }
}

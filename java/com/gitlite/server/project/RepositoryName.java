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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.regex.Pattern;

/** Syntax of hosted repository names. */
public final class RepositoryName {
  /** Suffix carried by every repository directory and by paths in Git commands. */
  public static final String SUFFIX = ".git";

  private static final Pattern NAME = Pattern.compile("^[a-zA-Z0-9_\\-]+(/[a-zA-Z0-9_\\-]+)*$");

  private static final Pattern PATH =
      Pattern.compile("^[a-zA-Z0-9_\\-]+(/[a-zA-Z0-9_\\-]+)*\\.git$");

  /** Name without the {@link #SUFFIX}, if it has one. */
  public static String strip(String name) {
    checkArgument(name != null, "name is required");
    if (name.endsWith(SUFFIX)) {
      return name.substring(0, name.length() - SUFFIX.length());
    }
    return name;
  }

  /** True if {@code name}, with or without suffix, is made of {@code [A-Za-z0-9_-]} segments. */
  public static boolean isValid(String name) {
    return name != null && NAME.matcher(strip(name)).matches();
  }

  /** True if {@code path} is a valid name followed by {@link #SUFFIX}. */
  public static boolean isValidPath(String path) {
    return path != null && PATH.matcher(path).matches();
  }

  private RepositoryName() {}
}

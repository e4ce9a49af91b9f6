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

package com.gitlite.server.git;

import com.google.auto.value.AutoValue;

/** A validated request to run one {@link GitOperation} against one repository. */
@AutoValue
public abstract class GitCommand {
  static GitCommand create(GitOperation operation, String repoPath) {
    return new AutoValue_GitCommand(operation, repoPath);
  }

  public abstract GitOperation operation();

  /** Relative repository path ending in {@code .git}, e.g. {@code team/project.git}. */
  public abstract String repoPath();

  public boolean isWrite() {
    return operation().isWrite();
  }
}

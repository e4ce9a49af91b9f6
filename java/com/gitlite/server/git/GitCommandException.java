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

/** A client supplied command string that will not be executed. */
public class GitCommandException extends Exception {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    /** Not of the form {@code <program> <path>}. */
    FORMAT,

    /** Program is not one of the allowed Git operations. */
    DISALLOWED_COMMAND,

    /** Repository path does not match the accepted grammar. */
    INVALID_PATH
  }

  private final Kind kind;

  public GitCommandException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }
}

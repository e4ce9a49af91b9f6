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

import java.util.Optional;

/** The Git server programs a client may run. */
public enum GitOperation {
  /** Serves fetch and clone. */
  UPLOAD_PACK("git-upload-pack", false),

  /** Accepts push. */
  RECEIVE_PACK("git-receive-pack", true);

  private final String program;
  private final boolean write;

  GitOperation(String program, boolean write) {
    this.program = program;
    this.write = write;
  }

  /** Name of the external program, as sent by Git clients. */
  public String program() {
    return program;
  }

  public boolean isWrite() {
    return write;
  }

  public static Optional<GitOperation> forProgram(String name) {
    for (GitOperation op : values()) {
      if (op.program.equals(name)) {
        return Optional.of(op);
      }
    }
    return Optional.empty();
  }
}

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

import com.google.inject.ImplementedBy;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;

/** Runs an authorized {@link GitCommand} with the client's streams attached. */
@ImplementedBy(ExternalGitProcessLauncher.class)
public interface GitProcessLauncher {
  /**
   * Run {@code cmd} against the bare repository at {@code repository} and wait for it to finish.
   *
   * @param in bytes sent by the client; becomes the program's standard input.
   * @param out receives the program's standard output.
   * @param err receives the program's diagnostics.
   * @return exit status of the program.
   * @throws IOException if the program cannot be started or its streams fail.
   * @throws InterruptedException if the calling thread is interrupted while waiting.
   */
  int run(GitCommand cmd, Path repository, InputStream in, OutputStream out, OutputStream err)
      throws IOException, InterruptedException;
}

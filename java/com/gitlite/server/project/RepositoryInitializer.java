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

import com.google.inject.ImplementedBy;
import java.io.IOException;
import java.nio.file.Path;

/** Creates the on-disk storage of a new repository. */
@ImplementedBy(BareRepositoryInitializer.class)
public interface RepositoryInitializer {
  /**
   * Initialize a bare repository at {@code dir}.
   *
   * @param dir directory that does not exist yet.
   * @throws IOException if the repository cannot be created; {@code dir} may be left partially
   *     written.
   */
  void initialize(Path dir) throws IOException;
}

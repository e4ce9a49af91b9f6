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

import static com.gitlite.testing.GitliteJUnit.assertThrows;
import static com.google.common.truth.Truth.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class BareRepositoryInitializerTest {
  @Rule public TemporaryFolder tmp = new TemporaryFolder();

  private final BareRepositoryInitializer initializer = new BareRepositoryInitializer();

  @Test
  public void createsBareRepository() throws Exception {
    Path dir = tmp.getRoot().toPath().resolve("team").resolve("app.git");

    initializer.initialize(dir);

    assertThat(Files.isRegularFile(dir.resolve("HEAD"))).isTrue();
    try (Repository repo = new FileRepositoryBuilder().setGitDir(dir.toFile()).build()) {
      assertThat(repo.isBare()).isTrue();
      assertThat(repo.getConfig().getBoolean("core", null, "logallrefupdates", false)).isTrue();
    }
  }

  @Test
  public void existingRepositoryIsAnError() throws Exception {
    Path dir = tmp.getRoot().toPath().resolve("app.git");
    initializer.initialize(dir);

    assertThrows(IOException.class, () -> initializer.initialize(dir));
  }
}

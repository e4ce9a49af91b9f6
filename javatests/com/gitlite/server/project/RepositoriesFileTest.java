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
import static java.nio.charset.StandardCharsets.UTF_8;

import com.gitlite.exceptions.StorageException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class RepositoriesFileTest {
  @Rule public TemporaryFolder tmp = new TemporaryFolder();

  @Test
  public void missingFileReadsAsEmpty() throws Exception {
    RepositoriesFile file = new RepositoriesFile(tmp.getRoot().toPath().resolve("repos.json"));

    assertThat(file.read()).isEmpty();
  }

  @Test
  public void decodeRecords() throws Exception {
    String json =
        "[{\"name\": \"proj\", \"path\": \"/srv/git/proj.git\","
            + " \"users\": {\"alice\": \"rw\", \"guest\": \"r\"}}]";

    ImmutableList<HostedRepository> repos = RepositoriesFile.decode(json);

    assertThat(repos).hasSize(1);
    HostedRepository r = repos.get(0);
    assertThat(r.name()).isEqualTo("proj");
    assertThat(r.path()).isEqualTo(Paths.get("/srv/git/proj.git"));
    assertThat(r.users()).containsExactly("alice", Permission.WRITE, "guest", Permission.READ);
  }

  @Test
  public void unknownPermissionDropsOnlyThatUser() throws Exception {
    String json =
        "[{\"name\": \"proj\", \"path\": \"/srv/git/proj.git\","
            + " \"users\": {\"alice\": \"admin\", \"bob\": \"r\"}}]";

    HostedRepository r = RepositoriesFile.decode(json).get(0);

    assertThat(r.users()).containsExactly("bob", Permission.READ);
  }

  @Test
  public void recordWithoutUsers() throws Exception {
    HostedRepository r =
        RepositoriesFile.decode("[{\"name\": \"proj\", \"path\": \"/srv/git/proj.git\"}]")
            .get(0);

    assertThat(r.users()).isEmpty();
  }

  @Test
  public void noneIsNotWritten() {
    Path p = Paths.get("/srv/git/proj.git");
    String json =
        RepositoriesFile.encode(
            ImmutableList.of(
                HostedRepository.create(
                    "proj",
                    p,
                    ImmutableMap.of(
                        "alice", Permission.WRITE,
                        "bob", Permission.NONE,
                        "guest", Permission.READ))));

    assertThat(json).contains("\"alice\": \"rw\"");
    assertThat(json).contains("\"guest\": \"r\"");
    assertThat(json).doesNotContain("bob");
  }

  @Test
  public void writeThenRead() throws Exception {
    RepositoriesFile file = new RepositoriesFile(tmp.getRoot().toPath().resolve("repos.json"));
    HostedRepository r =
        HostedRepository.create(
            "team/app",
            tmp.getRoot().toPath().resolve("team/app.git"),
            ImmutableMap.of("carol", Permission.READ));

    file.write(ImmutableList.of(r));

    assertThat(file.read()).containsExactly(r);
  }

  @Test
  public void corruptJsonFails() {
    assertThrows(StorageException.class, () -> RepositoriesFile.decode("[{]"));
  }

  @Test
  public void guestWriteIsNotReadBackOrSaved() throws Exception {
    Path base = tmp.newFolder("git").toPath();
    Path dir = Files.createDirectories(base.resolve("p.git"));
    RepositoriesFile file = new RepositoriesFile(tmp.getRoot().toPath().resolve("repos.json"));
    Files.write(
        file.getPath(),
        ("[{\"name\": \"p\", \"path\": \"" + dir.toString().replace("\\", "\\\\")
                + "\", \"users\": {\"guest\": \"rw\", \"alice\": \"rw\"}}]")
            .getBytes(UTF_8));
    RepositoryPermissionTable table = new RepositoryPermissionTable(base, Files::createDirectories);

    file.loadInto(table);

    assertThat(table.get("p").get().users())
        .containsExactly("guest", Permission.READ, "alice", Permission.WRITE);
    assertThat(table.checkPermission("p", "", true)).isFalse();
    file.saveFrom(table);
    assertThat(file.read().get(0).users()).containsEntry("guest", Permission.READ);
  }
}

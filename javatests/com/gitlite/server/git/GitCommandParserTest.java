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

import static com.gitlite.testing.GitliteJUnit.assertThrows;
import static com.google.common.truth.Truth.assertThat;

import com.gitlite.server.git.GitCommandException.Kind;
import org.junit.Test;

public class GitCommandParserTest {
  @Test
  public void uploadPack() throws Exception {
    GitCommand cmd = GitCommandParser.parse("git-upload-pack '/proj.git'");

    assertThat(cmd.operation()).isEqualTo(GitOperation.UPLOAD_PACK);
    assertThat(cmd.repoPath()).isEqualTo("proj.git");
    assertThat(cmd.isWrite()).isFalse();
  }

  @Test
  public void receivePackWithNestedPath() throws Exception {
    GitCommand cmd = GitCommandParser.parse("git-receive-pack '/a/b/c.git'");

    assertThat(cmd.operation()).isEqualTo(GitOperation.RECEIVE_PACK);
    assertThat(cmd.repoPath()).isEqualTo("a/b/c.git");
    assertThat(cmd.isWrite()).isTrue();
  }

  @Test
  public void quotingAndLeadingSlashAreOptional() throws Exception {
    assertThat(GitCommandParser.parse("git-upload-pack proj.git").repoPath()).isEqualTo("proj.git");
    assertThat(GitCommandParser.parse("git-upload-pack /proj.git").repoPath())
        .isEqualTo("proj.git");
    assertThat(GitCommandParser.parse("git-upload-pack \"/proj.git\"").repoPath())
        .isEqualTo("proj.git");
    assertThat(GitCommandParser.parse("  git-upload-pack   'team/x-y_z.git'  ").repoPath())
        .isEqualTo("team/x-y_z.git");
  }

  @Test
  public void pathTraversalIsInvalid() {
    GitCommandException e =
        assertThrows(
            GitCommandException.class,
            () -> GitCommandParser.parse("git-upload-pack '/../../etc/passwd'"));

    assertThat(e.getKind()).isEqualTo(Kind.INVALID_PATH);
    assertThat(e).hasMessageThat().startsWith("invalid repo path: ");
  }

  @Test
  public void otherProgramsAreNotAllowed() {
    GitCommandException e =
        assertThrows(GitCommandException.class, () -> GitCommandParser.parse("ls -la"));

    assertThat(e.getKind()).isEqualTo(Kind.DISALLOWED_COMMAND);
    assertThat(e).hasMessageThat().isEqualTo("command not allowed: ls");
  }

  @Test
  public void uploadArchiveIsNotAllowed() {
    GitCommandException e =
        assertThrows(
            GitCommandException.class,
            () -> GitCommandParser.parse("git-upload-archive 'proj.git'"));

    assertThat(e.getKind()).isEqualTo(Kind.DISALLOWED_COMMAND);
  }

  @Test
  public void singleTokenIsFormatError() {
    for (String line : new String[] {"git-upload-pack", "", "   ", null}) {
      GitCommandException e =
          assertThrows(GitCommandException.class, () -> GitCommandParser.parse(line));
      assertThat(e.getKind()).isEqualTo(Kind.FORMAT);
      assertThat(e).hasMessageThat().isEqualTo("invalid command format");
    }
  }

  @Test
  public void invalidPaths() {
    String[] bad = {
      "git-upload-pack 'proj'",
      "git-upload-pack 'proj.git; rm -rf /'",
      "git-upload-pack '//proj.git'",
      "git-upload-pack 'a//b.git'",
      "git-upload-pack '.git'",
      "git-upload-pack 'proj.git' extra",
      "git-upload-pack '$(id).git'",
      "git-upload-pack 'proj.git",
      "git-upload-pack proj.git'",
      "git-upload-pack 'proj.git\"",
      "git-upload-pack ''proj.git''",
    };
    for (String line : bad) {
      GitCommandException e =
          assertThrows(GitCommandException.class, () -> GitCommandParser.parse(line));
      assertThat(e.getKind()).isEqualTo(Kind.INVALID_PATH);
    }
  }
}

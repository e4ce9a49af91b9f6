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

import com.gitlite.server.git.GitCommandException.Kind;
import com.gitlite.server.project.RepositoryName;
import com.google.common.base.CharMatcher;
import java.util.Optional;

/**
 * Turns the command line sent by an SSH client into a {@link GitCommand}.
 *
 * <p>Accepted input is exactly {@code <program> <path>}: the program must be {@code
 * git-upload-pack} or {@code git-receive-pack}, the path may be wrapped in one pair of single or
 * double quotes and may start with one {@code /}. After that the path must be {@code
 * [A-Za-z0-9_-]} segments joined by {@code /}, ending in {@code .git}. The path is never handed to
 * a shell.
 */
public final class GitCommandParser {
  private static final CharMatcher QUOTE = CharMatcher.anyOf("'\"");

  public static GitCommand parse(String raw) throws GitCommandException {
    String line = raw == null ? "" : raw.trim();
    int sp = CharMatcher.whitespace().indexIn(line);
    if (sp < 0) {
      throw new GitCommandException(Kind.FORMAT, "invalid command format");
    }

    String program = line.substring(0, sp);
    String arg = CharMatcher.whitespace().trimLeadingFrom(line.substring(sp + 1));

    Optional<GitOperation> op = GitOperation.forProgram(program);
    if (!op.isPresent()) {
      throw new GitCommandException(Kind.DISALLOWED_COMMAND, "command not allowed: " + program);
    }

    String path = unquote(arg);
    if (path.startsWith("/")) {
      path = path.substring(1);
    }
    if (!RepositoryName.isValidPath(path)) {
      throw new GitCommandException(Kind.INVALID_PATH, "invalid repo path: " + path);
    }
    return GitCommand.create(op.get(), path);
  }

  /** Strips one matching pair of surrounding single or double quotes. */
  private static String unquote(String s) {
    if (s.length() >= 2 && QUOTE.matches(s.charAt(0)) && s.charAt(s.length() - 1) == s.charAt(0)) {
      return s.substring(1, s.length() - 1);
    }
    return s;
  }

  private GitCommandParser() {}
}

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

package com.gitlite.server;

import com.gitlite.server.git.GitCommand;
import com.google.auto.value.AutoValue;
import java.nio.file.Path;
import javax.annotation.Nullable;

/** Decision taken by {@link SessionRouter} for one SSH channel. */
@AutoValue
public abstract class Route {
  public enum Kind {
    /** Open the administrator console. */
    CONSOLE,

    /** Run {@link #command()} against {@link #repository()}. */
    EXECUTE,

    /** Refuse with {@link #message()}. */
    REJECT
  }

  static Route console() {
    return new AutoValue_Route(Kind.CONSOLE, null, null, null);
  }

  static Route execute(GitCommand command, Path repository) {
    return new AutoValue_Route(Kind.EXECUTE, command, repository, null);
  }

  static Route reject(String message) {
    return new AutoValue_Route(Kind.REJECT, null, null, message);
  }

  public abstract Kind kind();

  @Nullable
  public abstract GitCommand command();

  @Nullable
  public abstract Path repository();

  @Nullable
  public abstract String message();
}

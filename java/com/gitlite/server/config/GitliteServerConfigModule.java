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

package com.gitlite.server.config;

import com.google.inject.AbstractModule;
import com.google.inject.Singleton;
import java.nio.file.Path;
import org.eclipse.jgit.lib.Config;

/** Binds the site layout and {@code gitlite.config} for a site directory. */
public class GitliteServerConfigModule extends AbstractModule {
  private final Path sitePath;

  public GitliteServerConfigModule(Path sitePath) {
    this.sitePath = sitePath;
  }

  @Override
  protected void configure() {
    bind(Path.class).annotatedWith(SitePath.class).toInstance(sitePath);
    bind(SitePaths.class);
    bind(Config.class)
        .annotatedWith(GitliteServerConfig.class)
        .toProvider(GitliteServerConfigProvider.class)
        .in(Singleton.class);
  }
}

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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.Provider;
import com.google.inject.ProvisionException;
import com.google.inject.Singleton;
import java.io.IOException;
import java.util.Map;
import org.eclipse.jgit.errors.ConfigInvalidException;
import org.eclipse.jgit.lib.Config;
import org.eclipse.jgit.storage.file.FileBasedConfig;
import org.eclipse.jgit.util.FS;

/**
 * Provides {@link Config} annotated with {@link GitliteServerConfig}.
 *
 * <p>The file is read once. {@code GITLITE_PORT} in the process environment replaces the port of
 * {@code sshd.listenAddress}.
 */
@Singleton
public class GitliteServerConfigProvider implements Provider<Config> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String PORT_ENV = "GITLITE_PORT";

  private final SitePaths site;
  private final Map<String, String> env;

  private final Object lock = new Object();
  private Config config;

  @Inject
  GitliteServerConfigProvider(SitePaths site) {
    this(site, System.getenv());
  }

  @VisibleForTesting
  GitliteServerConfigProvider(SitePaths site, Map<String, String> env) {
    this.site = site;
    this.env = env;
  }

  @Override
  public Config get() {
    synchronized (lock) {
      if (config == null) {
        config = loadConfig();
      }
      return config;
    }
  }

  private Config loadConfig() {
    FileBasedConfig cfg = new FileBasedConfig(site.gitlite_config.toFile(), FS.DETECTED);
    if (!cfg.getFile().exists()) {
      logger.atInfo().log("No %s; assuming defaults", site.gitlite_config.toAbsolutePath());
    }
    try {
      cfg.load();
    } catch (IOException | ConfigInvalidException e) {
      throw new ProvisionException(e.getMessage(), e);
    }
    applyEnvironment(cfg);
    return cfg;
  }

  private void applyEnvironment(Config cfg) {
    String port = env.get(PORT_ENV);
    if (port == null || port.trim().isEmpty()) {
      return;
    }
    port = port.trim();
    try {
      Integer.parseInt(port);
    } catch (NumberFormatException e) {
      throw new ProvisionException("Invalid " + PORT_ENV + ": " + port, e);
    }
    String[] listen = cfg.getStringList("sshd", null, "listenAddress");
    String host = "*";
    if (listen.length > 0) {
      host = SshAddresses.hostOf(listen[0]);
    }
    cfg.setString("sshd", null, "listenAddress", host + ":" + port);
  }
}

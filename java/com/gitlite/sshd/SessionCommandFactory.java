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

package com.gitlite.sshd;

import com.gitlite.lifecycle.LifecycleListener;
import com.gitlite.server.SessionRouter;
import com.gitlite.server.config.GitliteServerConfig;
import com.gitlite.server.git.GitProcessLauncher;
import com.gitlite.sshd.commands.AdminConsole;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import org.apache.sshd.server.channel.ChannelSession;
import org.apache.sshd.server.command.Command;
import org.apache.sshd.server.command.CommandFactory;
import org.apache.sshd.server.shell.ShellFactory;
import org.eclipse.jgit.lib.Config;

/**
 * Creates a {@link SessionCommand} for exec and shell requests.
 *
 * <p>A shell request, or an exec request with an empty command, asks for the administrator
 * console. Commands run on a pool sized by {@code sshd.threads}; zero or less means one thread per
 * running command.
 */
@Singleton
class SessionCommandFactory implements CommandFactory, ShellFactory, LifecycleListener {
  private final SessionRouter router;
  private final GitProcessLauncher launcher;
  private final AdminConsole console;
  private final ExecutorService executor;

  @Inject
  SessionCommandFactory(
      SessionRouter router,
      GitProcessLauncher launcher,
      AdminConsole console,
      @GitliteServerConfig Config cfg) {
    this.router = router;
    this.launcher = launcher;
    this.console = console;

    int threads = cfg.getInt("sshd", "threads", 0);
    ThreadFactory tf =
        new ThreadFactoryBuilder().setNameFormat("SshCommand-%d").setDaemon(true).build();
    executor =
        threads > 0 ? Executors.newFixedThreadPool(threads, tf) : Executors.newCachedThreadPool(tf);
  }

  @Override
  public void start() {}

  @Override
  public void stop() {
    executor.shutdownNow();
  }

  @Override
  public Command createCommand(ChannelSession channel, String command) {
    return new SessionCommand(router, launcher, console, executor, command);
  }

  @Override
  public Command createShell(ChannelSession channel) {
    return new SessionCommand(router, launcher, console, executor, null);
  }
}

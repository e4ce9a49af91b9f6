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

import com.gitlite.server.Route;
import com.gitlite.server.SessionRouter;
import com.gitlite.server.account.AuthResult;
import com.gitlite.server.git.GitCommand;
import com.gitlite.server.git.GitProcessLauncher;
import com.gitlite.sshd.commands.AdminConsole;
import com.google.common.flogger.FluentLogger;
import java.io.IOException;
import java.util.concurrent.ExecutorService;
import javax.annotation.Nullable;
import org.apache.sshd.server.Environment;
import org.apache.sshd.server.channel.ChannelSession;

/**
 * The single command behind every SSH channel.
 *
 * <p>Asks the {@link SessionRouter} what the caller may do, then opens the administrator console,
 * runs the Git program, or rejects the channel with exit status 1.
 */
class SessionCommand extends BaseCommand {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final SessionRouter router;
  private final GitProcessLauncher launcher;
  private final AdminConsole console;
  private final ExecutorService executor;
  @Nullable private final String commandLine;

  private SshSession session;
  private boolean terminal;

  SessionCommand(
      SessionRouter router,
      GitProcessLauncher launcher,
      AdminConsole console,
      ExecutorService executor,
      @Nullable String commandLine) {
    this.router = router;
    this.launcher = launcher;
    this.console = console;
    this.executor = executor;
    this.commandLine = commandLine;
  }

  @Override
  public void start(ChannelSession channel, Environment env) throws IOException {
    session = channel.getServerSession().getAttribute(SshSession.KEY);
    terminal = env != null && !env.getPtyModes().isEmpty();
    startThread(executor, this::dispatch);
  }

  @Override
  protected String describe() {
    String what = commandLine == null || commandLine.isEmpty() ? "console" : commandLine;
    if (session == null) {
      return what;
    }
    return String.format(
        "%s (%s from %s)", what, session.describeCaller(), session.getRemoteAddressAsString());
  }

  int dispatch() throws Exception {
    AuthResult who = session != null ? session.getIdentity() : AuthResult.unknown();
    Route route = router.route(who, commandLine);
    switch (route.kind()) {
      case CONSOLE:
        logger.atInfo().log("Administrator console opened by %s", describe());
        return console.run(in, out, terminal);

      case EXECUTE:
        return execute(route.command(), route);

      case REJECT:
      default:
        logger.atInfo().log("Denied %s: %s", describe(), route.message());
        throw die(route.message());
    }
  }

  private int execute(GitCommand cmd, Route route) throws Failure, InterruptedException {
    String program = cmd.operation().program();
    logger.atInfo().log("Running %s on %s for %s", program, route.repository(), describe());
    try {
      int rc = launcher.run(cmd, route.repository(), in, out, err);
      if (rc != 0) {
        logger.atWarning().log("%s exited with status %d for %s", program, rc, describe());
      }
      return rc;
    } catch (IOException e) {
      throw new Failure(1, "fatal: git command failed", e);
    }
  }
}

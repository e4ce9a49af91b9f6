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

package com.gitlite.pgm;

import static com.google.inject.Stage.PRODUCTION;

import com.gitlite.common.Die;
import com.gitlite.lifecycle.LifecycleManager;
import com.gitlite.pgm.util.ErrorLogFile;
import com.gitlite.server.config.GitliteServerConfigModule;
import com.gitlite.server.config.SitePaths;
import com.gitlite.sshd.SshDaemon;
import com.gitlite.sshd.SshModule;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.flogger.FluentLogger;
import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.spi.Message;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/** Runs the gitlite SSH gateway until the JVM is asked to shut down. */
public class Daemon {
  static final String FLOGGER_BACKEND_PROPERTY = "flogger.backend_factory";
  static final String LOG4J_BACKEND =
      "com.google.common.flogger.backend.log4j.Log4jBackendFactory#getInstance";

  static {
    if (System.getProperty(FLOGGER_BACKEND_PROPERTY) == null) {
      System.setProperty(FLOGGER_BACKEND_PROPERTY, LOG4J_BACKEND);
    }
  }

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static void main(String[] argv) {
    System.exit(new Daemon().mainImpl(argv));
  }

  @Option(
      name = "--site-path",
      aliases = {"-d"},
      metaVar = "DIR",
      usage = "Local directory containing site data (default: $GITLITE_DATA or .)")
  private void setSitePath(String path) {
    sitePath = Paths.get(path).normalize();
  }

  @Option(name = "--console-log", usage = "Log to console (not $site_path/logs)")
  private boolean consoleLog;

  private Path sitePath = defaultSitePath(System.getenv());

  private final LifecycleManager manager = new LifecycleManager();
  private final CountDownLatch stopped = new CountDownLatch(1);
  private Injector sshInjector;

  @VisibleForTesting
  static Path defaultSitePath(Map<String, String> env) {
    String dir = Strings.emptyToNull(env.get("GITLITE_DATA"));
    return dir != null ? Paths.get(dir).normalize() : Paths.get(".");
  }

  Path getSitePath() {
    return sitePath;
  }

  /** Parses {@code argv} and runs the daemon, returning the process exit status. */
  public int mainImpl(String[] argv) {
    CmdLineParser clp = new CmdLineParser(this);
    try {
      clp.parseArgument(argv);
    } catch (CmdLineException err) {
      System.err.println("fatal: " + err.getMessage());
      clp.printUsage(System.err);
      return 1;
    }

    try {
      return run();
    } catch (Die err) {
      System.err.println("fatal: " + err.getMessage());
      if (err.getCause() != null) {
        System.err.println("  caused by " + err.getCause());
      }
      return 128;
    }
  }

  int run() {
    Thread.setDefaultUncaughtExceptionHandler(
        (t, e) -> logger.atSevere().withCause(e).log("Thread %s threw exception", t.getName()));

    try {
      start();
      Runtime.getRuntime()
          .addShutdownHook(
              new Thread(
                  () -> {
                    logger.atInfo().log("caught shutdown, cleaning up");
                    stop();
                  },
                  "ShutdownCallback"));

      SshDaemon sshd = sshInjector.getInstance(SshDaemon.class);
      logger.atInfo().log("gitlite ready on %s", sshd.getDaemonBoundAddresses());
      stopped.await();
      return 0;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      stop();
      return 1;
    } catch (RuntimeException err) {
      logger.atSevere().withCause(err).log("Unable to start daemon");
      stop();
      return 1;
    }
  }

  @VisibleForTesting
  void start() {
    SitePaths site = new SitePaths(sitePath.toAbsolutePath());
    try {
      manager.add(ErrorLogFile.start(site, consoleLog));
    } catch (IOException e) {
      throw new Die("Cannot open " + site.logs_dir, e);
    }

    sshInjector = createSshInjector(site.site_path);
    manager.add(sshInjector);
    manager.start();
  }

  @VisibleForTesting
  void stop() {
    synchronized (manager) {
      manager.stop();
    }
    stopped.countDown();
  }

  @VisibleForTesting
  Injector getSshInjector() {
    return sshInjector;
  }

  private static Injector createSshInjector(Path site) {
    try {
      return Guice.createInjector(
          PRODUCTION, new GitliteServerConfigModule(site), new SshModule());
    } catch (CreationException ce) {
      Message first = ce.getErrorMessages().iterator().next();
      Throwable why = first.getCause();
      if (why != null) {
        throw new Die(why.getMessage() != null ? why.getMessage() : why.toString(), why);
      }
      throw new Die(first.getMessage(), ce);
    }
  }
}

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

import com.gitlite.lifecycle.LifecycleListener;
import com.gitlite.server.config.GitliteServerConfig;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.eclipse.jgit.lib.Config;

/**
 * Executes {@code git-upload-pack} and {@code git-receive-pack} as child processes.
 *
 * <p>The program is started directly, never through a shell, with the repository directory as its
 * only argument. If {@code gateway.gitExecPath} is set the programs are taken from that directory,
 * otherwise they are looked up on {@code PATH}.
 */
@Singleton
public class ExternalGitProcessLauncher implements GitProcessLauncher, LifecycleListener {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final int BUFFER_SIZE = 8192;

  private final String execPath;
  private final ExecutorService pumps;

  @Inject
  ExternalGitProcessLauncher(@GitliteServerConfig Config cfg) {
    this(cfg.getString("gateway", null, "gitExecPath"));
  }

  @VisibleForTesting
  ExternalGitProcessLauncher(String execPath) {
    this.execPath = Strings.emptyToNull(execPath);
    this.pumps =
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("GitStreamPump-%d").setDaemon(true).build());
  }

  @Override
  public void start() {}

  @Override
  public void stop() {
    pumps.shutdownNow();
  }

  @VisibleForTesting
  ImmutableList<String> commandLine(GitCommand cmd, Path repository) {
    String program = cmd.operation().program();
    if (execPath != null) {
      program = Paths.get(execPath, program).toString();
    }
    return ImmutableList.of(program, repository.toAbsolutePath().toString());
  }

  @Override
  public int run(
      GitCommand cmd, Path repository, InputStream in, OutputStream out, OutputStream err)
      throws IOException, InterruptedException {
    ProcessBuilder pb = new ProcessBuilder(commandLine(cmd, repository));
    pb.directory(repository.toFile());
    Process proc = pb.start();
    logger.atFine().log("Started %s for %s", cmd.operation().program(), repository);

    Future<?> stdin = pumps.submit(() -> pump(in, proc.getOutputStream(), true));
    Future<?> stderr = pumps.submit(() -> pump(proc.getErrorStream(), err, false));
    try {
      copy(proc.getInputStream(), out);
      int status = proc.waitFor();
      await(stderr);
      return status;
    } finally {
      stdin.cancel(true);
      stderr.cancel(true);
      closeStreams(proc);
      if (proc.isAlive()) {
        proc.destroyForcibly();
      }
    }
  }

  @VisibleForTesting
  static void closeStreams(Process proc) {
    closeQuietly(proc.getOutputStream());
    closeQuietly(proc.getInputStream());
    closeQuietly(proc.getErrorStream());
  }

  private static void closeQuietly(Closeable c) {
    try {
      c.close();
    } catch (IOException e) {
      logger.atFine().withCause(e).log("Cannot close child process stream");
    }
  }

  private static Void pump(InputStream src, OutputStream dst, boolean closeDst)
      throws IOException {
    try {
      copy(src, dst);
    } finally {
      if (closeDst) {
        dst.close();
      }
    }
    return null;
  }

  /** Copy until end of stream, flushing after each read so the protocol stays interactive. */
  private static void copy(InputStream src, OutputStream dst) throws IOException {
    byte[] buf = new byte[BUFFER_SIZE];
    int n;
    while ((n = src.read(buf)) >= 0) {
      if (n > 0) {
        dst.write(buf, 0, n);
        dst.flush();
      }
    }
  }

  private static void await(Future<?> f) throws IOException, InterruptedException {
    try {
      f.get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof IOException) {
        throw (IOException) cause;
      }
      throw new IOException(cause);
    }
  }
}

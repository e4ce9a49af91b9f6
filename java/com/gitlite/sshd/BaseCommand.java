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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.Atomics;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.sshd.common.SshException;
import org.apache.sshd.common.channel.exception.SshChannelClosedException;
import org.apache.sshd.server.ExitCallback;
import org.apache.sshd.server.channel.ChannelSession;
import org.apache.sshd.server.command.Command;

/**
 * Base of the commands run on an SSH channel.
 *
 * <p>Work happens on a thread of the executor given to {@link #startThread}, never on the SSH I/O
 * thread. Exceptions are turned into a message on the client's stderr and an exit status.
 */
public abstract class BaseCommand implements Command {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static final Charset ENC = UTF_8;

  /** Exit status reported when the client went away while the command was running. */
  static final int STATUS_CLOSED = 127;

  /** Exit status reported for unexpected errors. */
  static final int STATUS_INTERNAL_ERROR = 128;

  protected InputStream in;
  protected OutputStream out;
  protected OutputStream err;

  protected ExitCallback exit;

  private final AtomicReference<Future<?>> task = Atomics.newReference();

  @Override
  public void setInputStream(InputStream in) {
    this.in = in;
  }

  @Override
  public void setOutputStream(OutputStream out) {
    this.out = out;
  }

  @Override
  public void setErrorStream(OutputStream err) {
    this.err = err;
  }

  @Override
  public void setExitCallback(ExitCallback callback) {
    this.exit = callback;
  }

  @Override
  public void destroy(ChannelSession channel) {
    Future<?> future = task.getAndSet(null);
    if (future != null && !future.isDone()) {
      future.cancel(true);
    }
  }

  /** Text identifying this command in thread names and log messages. */
  protected abstract String describe();

  /**
   * Run {@code thunk} on {@code executor} and report its outcome to the client.
   *
   * <p>Normal completion exits with the status returned by the thunk.
   */
  protected void startThread(ExecutorService executor, CommandRunnable thunk) {
    task.set(executor.submit(new TaskThunk(thunk)));
  }

  /**
   * Terminate this command and return a result code to the remote client.
   *
   * @param rc exit code for the remote client.
   */
  protected void onExit(int rc) {
    exit.onExit(rc);
  }

  protected UnloggedFailure die(String msg) {
    return new UnloggedFailure(1, "fatal: " + msg);
  }

  int handleError(Throwable e) {
    if ((e.getClass() == IOException.class && "Pipe closed".equals(e.getMessage()))
        || (e.getClass() == SshException.class && "Already closed".equals(e.getMessage()))
        || e instanceof SshChannelClosedException
        || e.getClass() == InterruptedIOException.class) {
      // The client dropped off while we were waiting for a read or a write.
      return STATUS_CLOSED;
    }

    if (!(e instanceof UnloggedFailure)) {
      logger.atSevere().withCause(e).log("Internal server error during %s", describe());
    }

    if (e instanceof Failure) {
      Failure f = (Failure) e;
      writeToClient(f.getMessage() + "\n");
      return f.exitCode;
    }

    writeToClient("fatal: internal server error\n");
    return STATUS_INTERNAL_ERROR;
  }

  private void writeToClient(String msg) {
    try {
      err.write(msg.getBytes(ENC));
      err.flush();
    } catch (IOException | RuntimeException e) {
      logger.atFine().withCause(e).log("Cannot send error message to client");
    }
  }

  private static void flushQuietly(OutputStream os) {
    try {
      os.flush();
    } catch (IOException | RuntimeException e) {
      logger.atFine().withCause(e).log("Cannot flush stream to client");
    }
  }

  private final class TaskThunk implements Runnable {
    private final CommandRunnable thunk;

    TaskThunk(CommandRunnable thunk) {
      this.thunk = thunk;
    }

    @Override
    public void run() {
      final Thread thisThread = Thread.currentThread();
      final String thisName = thisThread.getName();
      int rc;
      try {
        thisThread.setName("SSH " + describe());
        rc = thunk.run();
        out.flush();
        err.flush();
      } catch (SshChannelClosedException e) {
        rc = STATUS_CLOSED;
      } catch (Throwable e) {
        flushQuietly(out);
        flushQuietly(err);
        rc = handleError(e);
      } finally {
        thisThread.setName(thisName);
      }
      task.set(null);
      onExit(rc);
    }

    @Override
    public String toString() {
      return describe();
    }
  }

  /** Function run on the command's thread; returns the exit status. */
  @FunctionalInterface
  public interface CommandRunnable {
    int run() throws Exception;
  }

  /** Thrown from {@link CommandRunnable#run()} with client message and code. */
  public static class Failure extends Exception {
    private static final long serialVersionUID = 1L;

    final int exitCode;

    /**
     * Create a new failure.
     *
     * @param exitCode exit code to return the client, which indicates the failure status of this
     *     command. Should be between 1 and 255, inclusive.
     * @param msg message to also send to the client's stderr.
     */
    public Failure(int exitCode, String msg) {
      this(exitCode, msg, null);
    }

    public Failure(int exitCode, String msg, Throwable why) {
      super(msg, why);
      this.exitCode = exitCode;
    }
  }

  /** A {@link Failure} that is expected and not logged as an error. */
  public static class UnloggedFailure extends Failure {
    private static final long serialVersionUID = 1L;

    public UnloggedFailure(int exitCode, String msg) {
      super(exitCode, msg);
    }
  }
}

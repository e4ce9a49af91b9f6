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

package com.gitlite.pgm.util;

import com.gitlite.common.FileUtil;
import com.gitlite.lifecycle.LifecycleListener;
import com.gitlite.server.config.SitePaths;
import java.io.IOException;
import java.nio.file.Path;
import org.apache.log4j.Appender;
import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

/** Points log4j at {@code logs/error_log}, or at stderr when running with {@code --console-log}. */
public class ErrorLogFile {
  static final String LOG_NAME = "error_log";

  public static LifecycleListener start(SitePaths site, boolean consoleLog) throws IOException {
    Path logdir = FileUtil.mkdirsOrDie(site.logs_dir, "Cannot create log directory");
    initLogSystem(logdir, consoleLog);

    return new LifecycleListener() {
      @Override
      public void start() {}

      @Override
      public void stop() {
        LogManager.shutdown();
      }
    };
  }

  private static void initLogSystem(Path logdir, boolean consoleLog) throws IOException {
    Logger root = LogManager.getRootLogger();
    root.removeAllAppenders();
    root.setLevel(Level.INFO);

    PatternLayout errorLogLayout = new PatternLayout("[%d] [%t] %-5p %c %x: %m%n");

    Appender dst;
    if (consoleLog) {
      ConsoleAppender console = new ConsoleAppender();
      console.setLayout(errorLogLayout);
      console.setTarget("System.err");
      console.setThreshold(Level.INFO);
      console.activateOptions();
      dst = console;
    } else {
      FileAppender file =
          new FileAppender(errorLogLayout, logdir.resolve(LOG_NAME).toString(), true);
      file.setThreshold(Level.INFO);
      dst = file;
    }
    root.addAppender(dst);
  }

  private ErrorLogFile() {}
}

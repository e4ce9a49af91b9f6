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

package com.gitlite.lifecycle;

import com.google.common.collect.Lists;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Binding;
import com.google.inject.Injector;
import com.google.inject.TypeLiteral;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Manages the lifecycle of the listeners bound by a {@link LifecycleModule}.
 *
 * <p>Listeners are started in registration order and stopped in the reverse order. A listener that
 * fails to stop does not prevent the remaining listeners from stopping.
 */
public class LifecycleManager {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Set<LifecycleListener> listeners = new LinkedHashSet<>();
  private final List<LifecycleListener> started = new ArrayList<>();

  /** Add a handle that must be cleared during stop. */
  public void add(LifecycleListener listener) {
    listeners.add(listener);
  }

  /** Add all {@link LifecycleListener}s registered in the injectors. */
  public void add(Injector... injectors) {
    for (Injector injector : injectors) {
      for (Binding<LifecycleListener> b :
          injector.findBindingsByType(new TypeLiteral<LifecycleListener>() {})) {
        add(b.getProvider().get());
      }
    }
  }

  /** Start all listeners, in the order they were registered. */
  public void start() {
    for (LifecycleListener obj : listeners) {
      if (!started.contains(obj)) {
        obj.start();
        started.add(obj);
      }
    }
  }

  /** Stop all listeners, in the reverse order they were started. */
  public void stop() {
    for (LifecycleListener obj : Lists.reverse(new ArrayList<>(started))) {
      try {
        obj.stop();
      } catch (RuntimeException e) {
        logger.atWarning().withCause(e).log("Failed to stop %s", obj.getClass().getName());
      }
    }
    started.clear();
  }
}

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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.gitlite.lifecycle.LifecycleManager;
import com.gitlite.server.account.IdentityStore;
import com.gitlite.server.config.GitliteServerConfigModule;
import com.gitlite.server.config.SitePaths;
import com.google.inject.Guice;
import com.google.inject.Injector;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.sshd.server.auth.pubkey.PublickeyAuthenticator;
import org.apache.sshd.server.command.CommandFactory;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class SshModuleTest {
  @Rule public TemporaryFolder tmp = new TemporaryFolder();

  @Test
  public void daemonStartsAndStopsThroughLifecycle() throws Exception {
    Path root = tmp.getRoot().toPath();
    SitePaths site = new SitePaths(root);
    Files.createDirectories(site.etc_dir);
    Files.write(
        site.gitlite_config, "[sshd]\n  listenAddress = 127.0.0.1:0\n".getBytes(UTF_8));

    Injector injector =
        Guice.createInjector(new GitliteServerConfigModule(root), new SshModule());
    LifecycleManager manager = new LifecycleManager();
    manager.add(injector);

    manager.start();
    try {
      SshDaemon daemon = injector.getInstance(SshDaemon.class);
      assertThat(daemon.getDaemonBoundAddresses()).hasSize(1);
      assertThat(((InetSocketAddress) daemon.getDaemonBoundAddresses().get(0)).getPort())
          .isGreaterThan(0);
      assertThat(Files.isDirectory(site.data_dir)).isTrue();
      assertThat(Files.exists(site.ssh_key)).isTrue();
    } finally {
      manager.stop();
    }

    assertThat(injector.getInstance(SshDaemon.class).getDaemonBoundAddresses()).isEmpty();
    assertThat(Files.exists(site.users_file)).isTrue();
    assertThat(Files.exists(site.repos_file)).isTrue();
  }

  @Test
  public void sharedStateIsSingleton() {
    Injector injector =
        Guice.createInjector(
            new GitliteServerConfigModule(tmp.getRoot().toPath()), new SshModule());

    assertThat(injector.getInstance(IdentityStore.class))
        .isSameInstanceAs(injector.getInstance(IdentityStore.class));
    assertThat(injector.getInstance(CommandFactory.class))
        .isInstanceOf(SessionCommandFactory.class);
    assertThat(injector.getInstance(PublickeyAuthenticator.class))
        .isInstanceOf(PubKeyAuth.class);
  }
}

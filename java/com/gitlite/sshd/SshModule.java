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

import com.gitlite.lifecycle.LifecycleModule;
import com.gitlite.server.SiteStateManager;
import com.gitlite.server.git.ExternalGitProcessLauncher;
import org.apache.sshd.common.keyprovider.KeyPairProvider;
import org.apache.sshd.server.auth.pubkey.PublickeyAuthenticator;
import org.apache.sshd.server.command.CommandFactory;
import org.apache.sshd.server.shell.ShellFactory;

/** Configures the SSH daemon and the services it depends on. */
public class SshModule extends LifecycleModule {
  @Override
  protected void configure() {
    bind(KeyPairProvider.class).toProvider(HostKeyProvider.class).asEagerSingleton();
    bind(CommandFactory.class).to(SessionCommandFactory.class);
    bind(ShellFactory.class).to(SessionCommandFactory.class);
    bind(PublickeyAuthenticator.class).to(PubKeyAuth.class);

    listener().to(SiteStateManager.class);
    listener().to(ExternalGitProcessLauncher.class);
    listener().to(SessionCommandFactory.class);
    listener().to(SshDaemon.class);
  }
}

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

import static com.gitlite.testing.GitliteJUnit.assertThrows;
import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableMap;
import com.google.inject.ProvisionException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.eclipse.jgit.lib.Config;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class GitliteServerConfigProviderTest {
  @Rule public TemporaryFolder tmp = new TemporaryFolder();

  private SitePaths site;

  @Before
  public void setUp() throws Exception {
    Path root = tmp.getRoot().toPath();
    site = new SitePaths(root);
    Files.createDirectories(site.etc_dir);
  }

  @Test
  public void missingFileGivesDefaults() {
    Config cfg = new GitliteServerConfigProvider(site, ImmutableMap.of()).get();

    assertThat(cfg.getString("sshd", null, "listenAddress")).isNull();
    assertThat(cfg.getInt("sshd", "maxAuthTries", 6)).isEqualTo(6);
  }

  @Test
  public void readsFile() throws Exception {
    write("[sshd]\n  listenAddress = 127.0.0.1:2022\n  maxAuthTries = 3\n");

    Config cfg = new GitliteServerConfigProvider(site, ImmutableMap.of()).get();

    assertThat(cfg.getString("sshd", null, "listenAddress")).isEqualTo("127.0.0.1:2022");
    assertThat(cfg.getInt("sshd", "maxAuthTries", 6)).isEqualTo(3);
  }

  @Test
  public void loadedOnce() throws Exception {
    GitliteServerConfigProvider provider =
        new GitliteServerConfigProvider(site, ImmutableMap.of());

    assertThat(provider.get()).isSameInstanceAs(provider.get());
  }

  @Test
  public void portFromEnvironmentKeepsHost() throws Exception {
    write("[sshd]\n  listenAddress = 127.0.0.1:2022\n");

    Config cfg =
        new GitliteServerConfigProvider(
                site, ImmutableMap.of(GitliteServerConfigProvider.PORT_ENV, "3022"))
            .get();

    assertThat(cfg.getString("sshd", null, "listenAddress")).isEqualTo("127.0.0.1:3022");
  }

  @Test
  public void portFromEnvironmentWithoutFile() {
    Config cfg =
        new GitliteServerConfigProvider(
                site, ImmutableMap.of(GitliteServerConfigProvider.PORT_ENV, " 4022 "))
            .get();

    assertThat(cfg.getString("sshd", null, "listenAddress")).isEqualTo("*:4022");
  }

  @Test
  public void invalidPortFromEnvironment() {
    GitliteServerConfigProvider provider =
        new GitliteServerConfigProvider(
            site, ImmutableMap.of(GitliteServerConfigProvider.PORT_ENV, "ssh"));

    assertThrows(ProvisionException.class, provider::get);
  }

  @Test
  public void invalidFile() throws Exception {
    write("[sshd\n");

    assertThrows(
        ProvisionException.class,
        () -> new GitliteServerConfigProvider(site, ImmutableMap.of()).get());
  }

  private void write(String text) throws Exception {
    Files.write(site.gitlite_config, text.getBytes(UTF_8));
  }
}

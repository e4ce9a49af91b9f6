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

import com.gitlite.common.FileUtil;
import com.gitlite.server.config.SitePaths;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.Provider;
import com.google.inject.ProvisionException;
import java.nio.file.Files;
import org.apache.sshd.common.config.keys.KeyUtils;
import org.apache.sshd.common.keyprovider.KeyPairProvider;
import org.apache.sshd.server.keyprovider.SimpleGeneratorHostKeyProvider;

/** Supplies {@code etc/ssh_host_key}, generating an ECDSA P-256 key on first start. */
class HostKeyProvider implements Provider<KeyPairProvider> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final SitePaths site;

  @Inject
  HostKeyProvider(SitePaths site) {
    this.site = site;
  }

  @Override
  public KeyPairProvider get() {
    FileUtil.mkdirsOrDie(site.etc_dir, "Cannot create etc directory");
    if (!Files.exists(site.ssh_key)) {
      logger.atInfo().log("Generating new SSH host key %s", site.ssh_key);
    }
    SimpleGeneratorHostKeyProvider p = new SimpleGeneratorHostKeyProvider();
    p.setAlgorithm(KeyUtils.EC_ALGORITHM);
    p.setKeySize(256);
    p.setPath(site.ssh_key.toAbsolutePath());
    try {
      // Generate or read the key before the first connection arrives.
      p.loadKeys(null);
    } catch (RuntimeException e) {
      throw new ProvisionException("Cannot load SSH host key " + site.ssh_key, e);
    }
    return p;
  }
}

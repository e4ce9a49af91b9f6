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

import com.gitlite.server.account.AccountSshKey;
import com.gitlite.server.account.AuthResult;
import com.gitlite.server.account.IdentityStore;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import java.security.PublicKey;
import org.apache.sshd.server.auth.pubkey.PublickeyAuthenticator;
import org.apache.sshd.server.session.ServerSession;

/**
 * Resolves the presented key to an identity and accepts every key.
 *
 * <p>Refusing unknown keys here would stop anonymous clients from reaching repositories that grant
 * read access to {@code guest}. What a caller may do is decided per channel by the session router.
 */
@Singleton
class PubKeyAuth implements PublickeyAuthenticator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final IdentityStore identities;

  @Inject
  PubKeyAuth(IdentityStore identities) {
    this.identities = identities;
  }

  @Override
  public boolean authenticate(String username, PublicKey suppliedKey, ServerSession session) {
    SshSession sd = session.getAttribute(SshSession.KEY);
    AuthResult who = identities.authenticate(suppliedKey);
    if (sd != null) {
      sd.authenticated(username, who);
    }
    logger.atFine().log(
        "Key %s from %s resolved to %s %s",
        AccountSshKey.fingerprint(suppliedKey),
        sd != null ? sd.getRemoteAddressAsString() : "?",
        who.identityClass(),
        who.username());
    return true;
  }
}

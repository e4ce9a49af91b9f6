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
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.gitlite.server.account.AccountSshKey;
import com.gitlite.server.account.IdentityClass;
import com.gitlite.server.account.IdentityStore;
import com.gitlite.testing.TestKeys;
import java.net.InetSocketAddress;
import java.security.KeyPair;
import org.apache.sshd.server.session.ServerSession;
import org.junit.Before;
import org.junit.Test;

public class PubKeyAuthTest {
  private IdentityStore identities;
  private PubKeyAuth auth;
  private SshSession sd;
  private ServerSession session;

  @Before
  public void setUp() {
    identities = new IdentityStore();
    auth = new PubKeyAuth(identities);
    sd = new SshSession(7, new InetSocketAddress("192.0.2.1", 40000));
    session = mock(ServerSession.class);
    when(session.getAttribute(SshSession.KEY)).thenReturn(sd);
  }

  @Test
  public void unknownKeyIsAccepted() {
    assertThat(auth.authenticate("git", TestKeys.generateKeyPair().getPublic(), session)).isTrue();

    assertThat(sd.getIdentity().identityClass()).isEqualTo(IdentityClass.UNKNOWN);
    assertThat(sd.getUsername()).isEqualTo("git");
    assertThat(sd.describeCaller()).isEqualTo("unknown (git)");
  }

  @Test
  public void userKeyResolvesUser() throws Exception {
    KeyPair alice = TestKeys.generateKeyPair();
    identities.createUser("alice");
    identities.addKey("alice", AccountSshKey.create(alice.getPublic(), null));

    assertThat(auth.authenticate("git", alice.getPublic(), session)).isTrue();

    assertThat(sd.getIdentity().username()).isEqualTo("alice");
    assertThat(sd.isAdmin()).isFalse();
    assertThat(sd.describeCaller()).isEqualTo("alice");
  }

  @Test
  public void adminKeyResolvesAdmin() {
    KeyPair admin = TestKeys.generateKeyPair();
    identities.setAdminKey(AccountSshKey.create(admin.getPublic(), null));

    assertThat(auth.authenticate("whatever", admin.getPublic(), session)).isTrue();

    assertThat(sd.isAdmin()).isTrue();
    assertThat(sd.getRemoteAddressAsString()).isEqualTo("192.0.2.1");
  }
}

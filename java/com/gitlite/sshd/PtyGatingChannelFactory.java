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

import com.google.common.flogger.FluentLogger;
import java.io.IOException;
import org.apache.sshd.common.channel.Channel;
import org.apache.sshd.common.channel.ChannelFactory;
import org.apache.sshd.common.channel.RequestHandler;
import org.apache.sshd.common.session.Session;
import org.apache.sshd.common.util.buffer.Buffer;
import org.apache.sshd.server.channel.ChannelSession;

/** Opens {@code session} channels that grant a pseudo-terminal to the administrator only. */
class PtyGatingChannelFactory implements ChannelFactory {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final PtyGatingChannelFactory INSTANCE = new PtyGatingChannelFactory();

  @Override
  public String getName() {
    return "session";
  }

  @Override
  public Channel createChannel(Session session) throws IOException {
    return new GatedChannel();
  }

  static class GatedChannel extends ChannelSession {
    @Override
    protected RequestHandler.Result handlePtyReq(Buffer buffer, boolean wantReply)
        throws IOException {
      SshSession sd = getServerSession().getAttribute(SshSession.KEY);
      if (sd == null || !sd.isAdmin()) {
        logger.atFine().log(
            "Refusing pseudo-terminal to %s", sd != null ? sd.describeCaller() : "unknown");
        return RequestHandler.Result.ReplyFailure;
      }
      return super.handlePtyReq(buffer, wantReply);
    }
  }
}

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

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.UnknownHostException;

/** Parsing and formatting of {@code host:port} strings used by {@code sshd.listenAddress}. */
public final class SshAddresses {
  public static final int DEFAULT_PORT = 2222;

  /** Host part of {@code host:port}, {@code [v6]:port} or {@code *:port}; {@code *} if absent. */
  public static String hostOf(String desc) {
    if (desc.startsWith("[")) {
      int end = desc.indexOf(']');
      if (end < 0) {
        throw new IllegalArgumentException("invalid IPv6: " + desc);
      }
      return desc.substring(0, end + 1);
    }
    int colon = desc.indexOf(':');
    String host = colon < 0 ? desc : desc.substring(0, colon);
    return host.isEmpty() ? "*" : host;
  }

  /**
   * Parse and resolve an address string such as {@code host:port} or {@code *:port}.
   *
   * @param desc address as written in the configuration.
   * @param defaultPort port used when {@code desc} names none.
   * @return the resolved socket address; wildcard host binds all interfaces.
   */
  public static InetSocketAddress resolve(String desc, int defaultPort) {
    String host = hostOf(desc);
    String rest;
    if (desc.startsWith("[")) {
      rest = desc.substring(host.length());
    } else {
      int colon = desc.indexOf(':');
      rest = colon < 0 ? "" : desc.substring(colon);
    }
    if (rest.startsWith(":")) {
      rest = rest.substring(1);
    }

    int port = defaultPort;
    if (!rest.isEmpty()) {
      try {
        port = Integer.parseInt(rest);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("invalid port: " + desc, e);
      }
    }

    if ("*".equals(host)) {
      return new InetSocketAddress(port);
    }
    if (host.startsWith("[")) {
      host = host.substring(1, host.length() - 1);
    }
    try {
      return new InetSocketAddress(InetAddress.getByName(host), port);
    } catch (UnknownHostException e) {
      throw new IllegalArgumentException("unknown host: " + desc, e);
    }
  }

  /** Format a bound address into {@code host:port} or {@code *:port} syntax. */
  public static String format(SocketAddress s) {
    if (!(s instanceof InetSocketAddress)) {
      return s.toString();
    }
    InetSocketAddress addr = (InetSocketAddress) s;
    String host;
    if (addr.getAddress() != null && addr.getAddress().isAnyLocalAddress()) {
      host = "*";
    } else if (addr.getAddress() != null) {
      host = addr.getAddress().getHostAddress();
    } else {
      host = addr.getHostString();
    }
    if (host.indexOf(':') >= 0) {
      host = "[" + host + "]";
    }
    return host + ":" + addr.getPort();
  }

  private SshAddresses() {}
}

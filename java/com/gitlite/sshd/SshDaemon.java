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

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.apache.sshd.core.CoreModuleProperties.AUTH_TIMEOUT;
import static org.apache.sshd.core.CoreModuleProperties.IDLE_TIMEOUT;
import static org.apache.sshd.core.CoreModuleProperties.MAX_AUTH_REQUESTS;
import static org.apache.sshd.core.CoreModuleProperties.NIO2_READ_TIMEOUT;
import static org.apache.sshd.core.CoreModuleProperties.SERVER_IDENTIFICATION;

import com.gitlite.lifecycle.LifecycleListener;
import com.gitlite.server.config.ConfigUtil;
import com.gitlite.server.config.GitliteServerConfig;
import com.gitlite.server.config.SshAddresses;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.sshd.common.BaseBuilder;
import org.apache.sshd.common.NamedFactory;
import org.apache.sshd.common.NamedResource;
import org.apache.sshd.common.cipher.Cipher;
import org.apache.sshd.common.compression.BuiltinCompressions;
import org.apache.sshd.common.file.nonefs.NoneFileSystemFactory;
import org.apache.sshd.common.io.IoAcceptor;
import org.apache.sshd.common.io.IoSession;
import org.apache.sshd.common.kex.KeyExchangeFactory;
import org.apache.sshd.common.keyprovider.KeyPairProvider;
import org.apache.sshd.common.random.SingletonRandomFactory;
import org.apache.sshd.common.session.Session;
import org.apache.sshd.common.util.net.SshdSocketAddress;
import org.apache.sshd.common.util.security.SecurityUtils;
import org.apache.sshd.server.ServerBuilder;
import org.apache.sshd.server.SshServer;
import org.apache.sshd.server.auth.UserAuthFactory;
import org.apache.sshd.server.auth.pubkey.PublickeyAuthenticator;
import org.apache.sshd.server.auth.pubkey.UserAuthPublicKeyFactory;
import org.apache.sshd.server.forward.ForwardingFilter;
import org.apache.sshd.server.session.ServerSessionImpl;
import org.apache.sshd.server.session.SessionFactory;
import org.eclipse.jgit.lib.Config;

/**
 * SSH daemon of the gateway.
 *
 * <p>Only public key authentication is offered, and every key is accepted; the key decides who the
 * caller is, not whether the connection is allowed. Only {@code session} channels can be opened:
 * port, agent and X11 forwarding are refused, and there are no subsystems.
 *
 * <p>Settings are read from the {@code sshd} section of {@code gitlite.config}:
 *
 * <ul>
 *   <li>{@code listenAddress}: {@code host:port} to bind, default {@code *:2222}.
 *   <li>{@code maxAuthTries}: authentication attempts per connection, default 6.
 *   <li>{@code loginGraceTime}: time allowed to authenticate, default 120 seconds.
 *   <li>{@code idleTimeout}: close idle connections after this long, default never.
 * </ul>
 */
@Singleton
public class SshDaemon extends SshServer implements LifecycleListener {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final List<SocketAddress> listen;
  private final AtomicInteger nextSessionId = new AtomicInteger();
  private volatile IoAcceptor daemonAcceptor;

  @Inject
  SshDaemon(
      SessionCommandFactory commandFactory,
      PublickeyAuthenticator userAuth,
      KeyPairProvider hostKeyProvider,
      @GitliteServerConfig Config cfg) {
    setPort(SshAddresses.DEFAULT_PORT /* never used */);
    this.listen = listenAddresses(cfg);

    SERVER_IDENTIFICATION.set(this, "gitlite (" + super.getVersion() + ")");
    MAX_AUTH_REQUESTS.set(this, cfg.getInt("sshd", "maxAuthTries", 6));
    AUTH_TIMEOUT.set(
        this,
        Duration.ofSeconds(
            ConfigUtil.getTimeUnit(cfg, "sshd", null, "loginGraceTime", 120, SECONDS)));

    long idleTimeoutSeconds = ConfigUtil.getTimeUnit(cfg, "sshd", null, "idleTimeout", 0, SECONDS);
    IDLE_TIMEOUT.set(this, Duration.ofSeconds(idleTimeoutSeconds));
    NIO2_READ_TIMEOUT.set(this, Duration.ofSeconds(idleTimeoutSeconds));

    setRandomFactory(new SingletonRandomFactory(SecurityUtils.getRandomFactory()));
    initCiphers(cfg);
    initKeyExchanges(cfg);
    initMacs(cfg);
    setSignatureFactories(ServerBuilder.setUpDefaultSignatureFactories(false));
    setCompressionFactories(Collections.singletonList(BuiltinCompressions.none));
    setChannelFactories(Collections.singletonList(PtyGatingChannelFactory.INSTANCE));
    setSubsystemFactories(Collections.emptyList());
    setFileSystemFactory(NoneFileSystemFactory.INSTANCE);
    initForwarding();
    initUserAuth(userAuth);
    setKeyPairProvider(hostKeyProvider);
    setCommandFactory(commandFactory);
    setShellFactory(commandFactory);

    setSessionFactory(
        new SessionFactory(this) {
          @Override
          protected ServerSessionImpl createSession(IoSession io) throws Exception {
            ServerSessionImpl s = super.createSession(io);
            SshSession sd = new SshSession(nextSessionId.incrementAndGet(), io.getRemoteAddress());
            s.setAttribute(SshSession.KEY, sd);
            s.addCloseFutureListener(
                future ->
                    logger.atFine().log(
                        "Session %d from %s closed",
                        sd.getSessionId(), sd.getRemoteAddressAsString()));
            return s;
          }
        });
  }

  @VisibleForTesting
  static List<SocketAddress> listenAddresses(Config cfg) {
    String[] want = cfg.getStringList("sshd", null, "listenAddress");
    if (want.length == 0) {
      return ImmutableList.of(new InetSocketAddress(SshAddresses.DEFAULT_PORT));
    }
    List<SocketAddress> r = new ArrayList<>(want.length);
    for (String desc : want) {
      r.add(SshAddresses.resolve(desc.trim(), SshAddresses.DEFAULT_PORT));
    }
    return Collections.unmodifiableList(r);
  }

  public List<SocketAddress> getListenAddresses() {
    return listen;
  }

  /** Addresses actually bound; differs from the configured ones when port 0 was requested. */
  public List<SocketAddress> getDaemonBoundAddresses() {
    IoAcceptor a = daemonAcceptor;
    return a != null ? ImmutableList.copyOf(a.getBoundAddresses()) : ImmutableList.of();
  }

  @Override
  public synchronized void start() {
    if (daemonAcceptor == null) {
      checkConfig();
      setupSessionTimeout(getSessionFactory());
      daemonAcceptor = createAcceptor();

      try {
        daemonAcceptor.bind(listen);
      } catch (IOException e) {
        daemonAcceptor = null;
        throw new IllegalStateException("Cannot bind to " + addressList(listen), e);
      }

      logger.atInfo().log(
          "Started gitlite SSHD on %s", addressList(daemonAcceptor.getBoundAddresses()));
    }
  }

  @Override
  public synchronized void stop() {
    if (daemonAcceptor != null) {
      try {
        daemonAcceptor.close(true).await();
        logger.atInfo().log("Stopped gitlite SSHD");
      } catch (IOException e) {
        logger.atWarning().withCause(e).log("Exception caught while closing");
      } finally {
        daemonAcceptor = null;
      }
    }
  }

  private static String addressList(Iterable<? extends SocketAddress> addrs) {
    List<String> r = new ArrayList<>();
    for (SocketAddress a : addrs) {
      r.add(SshAddresses.format(a));
    }
    return Joiner.on(", ").join(r);
  }

  private void initKeyExchanges(Config cfg) {
    List<KeyExchangeFactory> a = ServerBuilder.setUpDefaultKeyExchanges(true);
    setKeyExchangeFactories(filter(cfg, "kex", a));
  }

  private void initCiphers(Config cfg) {
    List<NamedFactory<Cipher>> a = new ArrayList<>(BaseBuilder.setUpDefaultCiphers(true));
    for (Iterator<NamedFactory<Cipher>> i = a.iterator(); i.hasNext(); ) {
      NamedFactory<Cipher> f = i.next();
      try {
        Cipher c = f.create();
        c.init(Cipher.Mode.Encrypt, new byte[c.getKdfSize()], new byte[c.getIVSize()]);
      } catch (Exception e) {
        logger.atWarning().log("Disabling cipher %s: %s", f.getName(), e.getMessage());
        i.remove();
      }
    }
    setCipherFactories(filter(cfg, "cipher", a));
  }

  private void initMacs(Config cfg) {
    setMacFactories(filter(cfg, "mac", BaseBuilder.setUpDefaultMacs(true)));
  }

  /**
   * Apply {@code sshd.<key>} to the available algorithms.
   *
   * <p>A plain name replaces the defaults, {@code +name} adds to them and {@code -name} removes
   * from them. Unknown names are logged and ignored.
   */
  @VisibleForTesting
  static <T extends NamedResource> List<T> filter(Config cfg, String key, List<T> avail) {
    List<T> def = new ArrayList<>(avail);
    String[] want = cfg.getStringList("sshd", null, key);
    if (want.length == 0) {
      return def;
    }

    boolean didClear = false;
    for (String setting : want) {
      String name = setting.trim();
      boolean add = true;
      if (name.startsWith("-")) {
        add = false;
        name = name.substring(1).trim();
      } else if (name.startsWith("+")) {
        name = name.substring(1).trim();
      } else if (!didClear) {
        didClear = true;
        def.clear();
      }

      T n = NamedResource.findByName(name, String.CASE_INSENSITIVE_ORDER, avail);
      if (n == null) {
        logger.atSevere().log(
            "sshd.%s = %s unsupported; only %s is supported",
            key, name, NamedResource.getNames(avail));
      } else if (add) {
        if (!def.contains(n)) {
          def.add(n);
        }
      } else {
        def.remove(n);
      }
    }
    return def;
  }

  private void initUserAuth(PublickeyAuthenticator pubkey) {
    List<UserAuthFactory> authFactories = new ArrayList<>();
    authFactories.add(UserAuthPublicKeyFactory.INSTANCE);
    setUserAuthFactories(authFactories);
    setPublickeyAuthenticator(pubkey);
    setPasswordAuthenticator(null);
    setKeyboardInteractiveAuthenticator(null);
    setHostBasedAuthenticator(null);
  }

  private void initForwarding() {
    setForwardingFilter(
        new ForwardingFilter() {
          @Override
          public boolean canForwardAgent(Session session, String requestType) {
            return false;
          }

          @Override
          public boolean canForwardX11(Session session, String requestType) {
            return false;
          }

          @Override
          public boolean canListen(SshdSocketAddress address, Session session) {
            return false;
          }

          @Override
          public boolean canConnect(Type type, SshdSocketAddress address, Session session) {
            return false;
          }
        });
  }
}

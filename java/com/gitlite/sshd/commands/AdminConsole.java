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

package com.gitlite.sshd.commands;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.gitlite.exceptions.StorageException;
import com.gitlite.server.SiteStateManager;
import com.gitlite.server.account.Account;
import com.gitlite.server.account.AccountException;
import com.gitlite.server.account.AccountSshKey;
import com.gitlite.server.account.IdentityStore;
import com.gitlite.server.account.InvalidSshKeyException;
import com.gitlite.server.project.HostedRepository;
import com.gitlite.server.project.Permission;
import com.gitlite.server.project.RepositoryException;
import com.gitlite.server.project.RepositoryPermissionTable;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Line oriented administration console, reached by the administrator opening a shell.
 *
 * <p>Every successful change is written to both data files right away. A failed write is reported
 * on the console; the change stays in memory and is written again on the next save.
 */
@Singleton
public class AdminConsole {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String PROMPT = "admin> ";

  private static final ImmutableList<String> HELP =
      ImmutableList.of(
          "repo list                         - List all repositories",
          "repo create <name>                - Create a repository",
          "repo delete <name>                - Delete a repository",
          "repo adduser <repo> <user> <r|rw> - Add user to repository (r=read, rw=read-write)",
          "repo deluser <repo> <user>        - Remove user from repository",
          "user list                         - List all users",
          "user create <name>                - Create a user",
          "user delete <name>                - Delete a user",
          "user addkey <name> <pubkey>       - Add SSH key to user",
          "user delkey <name> <fingerprint>  - Remove SSH key from user",
          "user keys <name>                  - List user's SSH keys",
          "help                              - Show this help",
          "quit                              - Exit",
          "",
          "Note: \"guest\" is a built-in user for read-only access. Add guest to a repo",
          "      with \"repo adduser <repo> guest r\" to allow everyone, known or not,",
          "      to read that repository.");

  private final IdentityStore identities;
  private final RepositoryPermissionTable repositories;
  private final SiteStateManager state;

  @Inject
  AdminConsole(
      IdentityStore identities, RepositoryPermissionTable repositories, SiteStateManager state) {
    this.identities = identities;
    this.repositories = repositories;
    this.state = state;
  }

  /**
   * Serve the console until the client quits or disconnects.
   *
   * @param echo whether typed characters are echoed back, which a client with a terminal expects.
   * @return exit status of the console, always 0.
   */
  public int run(InputStream in, OutputStream out, boolean echo) throws IOException {
    Terminal t = new Terminal(in, out, echo);
    t.println("");
    t.println("gitlite administration");
    t.println("");
    help(t);

    while (true) {
      t.print("\r\n" + PROMPT);
      String line = t.readLine();
      if (line == null) {
        return 0;
      }
      List<String> args = new ArrayList<>(Splitter.on(' ').omitEmptyStrings().splitToList(line));
      if (args.isEmpty()) {
        continue;
      }

      String cmd = args.remove(0);
      switch (cmd) {
        case "help":
        case "h":
          help(t);
          break;
        case "quit":
        case "exit":
        case "q":
          t.println("Bye!");
          return 0;
        case "repo":
          repo(t, args);
          break;
        case "user":
          user(t, args);
          break;
        default:
          t.println("Unknown command: " + cmd);
      }
    }
  }

  private void help(Terminal t) throws IOException {
    for (String line : HELP) {
      t.println(line);
    }
  }

  private void repo(Terminal t, List<String> args) throws IOException {
    if (args.isEmpty()) {
      t.println("Usage: repo <list|create|delete|adduser|deluser>");
      return;
    }
    try {
      switch (args.get(0)) {
        case "list":
          listRepositories(t);
          break;

        case "create":
          if (args.size() < 2) {
            t.println("Usage: repo create <name>");
            return;
          }
          HostedRepository created = repositories.create(args.get(1));
          t.println(String.format("Repository %s created", created.name()));
          save(t);
          break;

        case "delete":
          if (args.size() < 2) {
            t.println("Usage: repo delete <name>");
            return;
          }
          repositories.delete(args.get(1));
          t.println(String.format("Repository %s deleted", args.get(1)));
          save(t);
          break;

        case "adduser":
          if (args.size() < 4) {
            t.println("Usage: repo adduser <repo> <user> <r|rw>");
            return;
          }
          grant(t, args.get(1), args.get(2), args.get(3));
          break;

        case "deluser":
          if (args.size() < 3) {
            t.println("Usage: repo deluser <repo> <user>");
            return;
          }
          repositories.removeUser(args.get(1), args.get(2));
          t.println("User removed");
          save(t);
          break;

        default:
          t.println("Unknown repo subcommand");
      }
    } catch (RepositoryException e) {
      t.println("Error: " + e.getMessage());
    }
  }

  private void listRepositories(Terminal t) throws IOException {
    ImmutableList<HostedRepository> all = repositories.list();
    if (all.isEmpty()) {
      t.println("  (no repositories)");
      return;
    }
    for (HostedRepository r : all) {
      List<String> users = new ArrayList<>();
      new TreeMap<>(r.users())
          .forEach((u, p) -> p.code().ifPresent(c -> users.add(u + "(" + c + ")")));
      String suffix = users.isEmpty() ? "" : " [" + Joiner.on(", ").join(users) + "]";
      t.println("  " + r.name() + suffix);
    }
  }

  /** Grant a permission; {@code guest} may only read and other users must exist. */
  private void grant(Terminal t, String repo, String user, String code)
      throws IOException, RepositoryException {
    Optional<Permission> perm = Permission.fromCode(code);
    if (!perm.isPresent()) {
      t.println("Permission must be r or rw");
      return;
    }
    boolean guest = Account.GUEST_NAME.equals(user);
    if (guest && perm.get() != Permission.READ) {
      t.println("Guest user can only have read permission");
      return;
    }
    if (!guest && !identities.getUser(user).isPresent()) {
      t.println("User not found");
      return;
    }
    repositories.addUser(repo, user, perm.get());
    t.println("User added");
    save(t);
  }

  private void user(Terminal t, List<String> args) throws IOException {
    if (args.isEmpty()) {
      t.println("Usage: user <list|create|delete|addkey|delkey|keys>");
      return;
    }
    try {
      switch (args.get(0)) {
        case "list":
          listUsers(t);
          break;

        case "create":
          if (args.size() < 2) {
            t.println("Usage: user create <name>");
            return;
          }
          if (Account.GUEST_NAME.equals(args.get(1))) {
            t.println("Cannot create user named guest");
            return;
          }
          identities.createUser(args.get(1));
          t.println(String.format("User %s created", args.get(1)));
          save(t);
          break;

        case "delete":
          if (args.size() < 2) {
            t.println("Usage: user delete <name>");
            return;
          }
          if (Account.GUEST_NAME.equals(args.get(1))) {
            t.println("Cannot delete guest user");
            return;
          }
          identities.deleteUser(args.get(1));
          t.println(String.format("User %s deleted", args.get(1)));
          save(t);
          break;

        case "addkey":
          if (args.size() < 3) {
            t.println("Usage: user addkey <name> <pubkey>");
            return;
          }
          AccountSshKey key;
          try {
            key = AccountSshKey.parse(Joiner.on(' ').join(args.subList(2, args.size())));
          } catch (InvalidSshKeyException e) {
            t.println("Invalid public key: " + e.getMessage());
            return;
          }
          identities.addKey(args.get(1), key);
          t.println("Key added");
          save(t);
          break;

        case "delkey":
          if (args.size() < 3) {
            t.println("Usage: user delkey <name> <fingerprint>");
            return;
          }
          identities.removeKey(args.get(1), args.get(2));
          t.println("Key removed");
          save(t);
          break;

        case "keys":
          if (args.size() < 2) {
            t.println("Usage: user keys <name>");
            return;
          }
          listKeys(t, args.get(1));
          break;

        default:
          t.println("Unknown user subcommand");
      }
    } catch (AccountException e) {
      t.println("Error: " + e.getMessage());
    }
  }

  private void listUsers(Terminal t) throws IOException {
    ImmutableList<Account> all = identities.listUsers();
    if (all.isEmpty()) {
      t.println("  (no users)");
      return;
    }
    for (Account a : all) {
      t.println(String.format("  %s (%d keys)", a.name(), a.keys().size()));
    }
  }

  private void listKeys(Terminal t, String name) throws IOException {
    Optional<Account> a = identities.getUser(name);
    if (!a.isPresent()) {
      t.println("User not found");
      return;
    }
    if (a.get().keys().isEmpty()) {
      t.println("  (no keys)");
      return;
    }
    for (AccountSshKey k : a.get().keys()) {
      String comment = k.comment().isEmpty() ? "" : " " + k.comment();
      t.println("  " + k.fingerprint() + " " + k.algorithm() + comment);
    }
  }

  private void save(Terminal t) throws IOException {
    try {
      state.saveUsers();
    } catch (StorageException e) {
      logger.atWarning().withCause(e).log("Cannot save users");
      t.println("Failed to save user data: " + e.getMessage());
    }
    try {
      state.saveRepositories();
    } catch (StorageException e) {
      logger.atWarning().withCause(e).log("Cannot save repositories");
      t.println("Failed to save repo permissions: " + e.getMessage());
    }
  }

  /** Minimal line editor over the raw channel streams. */
  static class Terminal {
    private static final int CTRL_C = 3;
    private static final int CTRL_D = 4;
    private static final int BACKSPACE = '\b';
    private static final int DELETE = 127;

    private final InputStream in;
    private final OutputStream out;
    private final boolean echo;
    private boolean lastWasCr;

    Terminal(InputStream in, OutputStream out, boolean echo) {
      this.in = in;
      this.out = out;
      this.echo = echo;
    }

    void print(String s) throws IOException {
      out.write(s.getBytes(UTF_8));
      out.flush();
    }

    void println(String s) throws IOException {
      print(s.replace("\n", "\r\n") + "\r\n");
    }

    /**
     * Read one line of printable ASCII.
     *
     * @return the line, or null at end of input, on Ctrl-C, or on Ctrl-D at the start of a line.
     */
    String readLine() throws IOException {
      StringBuilder line = new StringBuilder();
      while (true) {
        int ch = in.read();
        if (ch < 0) {
          return null;
        }
        if (ch == '\n' && lastWasCr) {
          lastWasCr = false;
          continue;
        }
        lastWasCr = ch == '\r';

        switch (ch) {
          case '\r':
          case '\n':
            if (echo) {
              print("\r\n");
            }
            return line.toString().trim();
          case BACKSPACE:
          case DELETE:
            if (line.length() > 0) {
              line.setLength(line.length() - 1);
              if (echo) {
                print("\b \b");
              }
            }
            break;
          case CTRL_C:
            if (echo) {
              print("^C\r\n");
            }
            return null;
          case CTRL_D:
            if (line.length() == 0) {
              return null;
            }
            break;
          default:
            if (ch >= 32 && ch < 127) {
              line.append((char) ch);
              if (echo) {
                out.write(ch);
                out.flush();
              }
            }
        }
      }
    }
  }
}

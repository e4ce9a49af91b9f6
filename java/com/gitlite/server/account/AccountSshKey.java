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

package com.gitlite.server.account;

import com.google.auto.value.AutoValue;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.util.List;
import org.apache.sshd.common.config.keys.AuthorizedKeyEntry;
import org.apache.sshd.common.config.keys.KeyUtils;
import org.apache.sshd.common.config.keys.PublicKeyEntry;
import org.apache.sshd.common.config.keys.PublicKeyEntryResolver;
import org.apache.sshd.common.digest.BuiltinDigests;

/**
 * An SSH public key registered for the administrator or a user.
 *
 * <p>Keys are compared by {@link #fingerprint()}, the OpenSSH {@code SHA256:<base64>} digest of the
 * key blob. The comment is kept for display and persistence only.
 */
@AutoValue
public abstract class AccountSshKey {
  /**
   * Parse a single line in {@code authorized_keys} format, e.g. {@code ssh-ed25519 AAAA... me@host}
   *
   * @throws InvalidSshKeyException if the line is empty or malformed, or the key type is not
   *     supported.
   */
  public static AccountSshKey parse(String line) throws InvalidSshKeyException {
    String s = Strings.nullToEmpty(line).replace("\n", "").replace("\r", "").trim();
    if (s.isEmpty()) {
      throw new InvalidSshKeyException("empty key");
    }

    AuthorizedKeyEntry entry;
    try {
      entry = AuthorizedKeyEntry.parseAuthorizedKeyEntry(s);
    } catch (IllegalArgumentException e) {
      throw new InvalidSshKeyException(e.getMessage(), e);
    }
    if (entry == null) {
      throw new InvalidSshKeyException("no key in \"" + s + "\"");
    }

    PublicKey key;
    try {
      key = entry.resolvePublicKey(null, PublicKeyEntryResolver.FAILING);
    } catch (IOException | GeneralSecurityException | RuntimeException e) {
      throw new InvalidSshKeyException("cannot decode key: " + e.getMessage(), e);
    }
    if (key == null) {
      throw new InvalidSshKeyException("unsupported key type " + entry.getKeyType());
    }
    return create(key, entry.getComment());
  }

  public static AccountSshKey create(PublicKey key, String comment) {
    String encoded = PublicKeyEntry.toString(key);
    if (!Strings.isNullOrEmpty(comment)) {
      encoded = encoded + " " + comment.trim();
    }
    return new AutoValue_AccountSshKey(encoded, fingerprint(key));
  }

  /** OpenSSH style SHA-256 fingerprint of {@code key}. */
  public static String fingerprint(PublicKey key) {
    return KeyUtils.getFingerPrint(BuiltinDigests.sha256, key);
  }

  /** The key in {@code authorized_keys} format, including the comment if there is one. */
  public abstract String sshPublicKey();

  public abstract String fingerprint();

  private String publicKeyPart(int index, String defaultValue) {
    List<String> parts = Splitter.on(' ').limit(3).splitToList(sshPublicKey());
    if (parts.size() > index) {
      return parts.get(index);
    }
    return defaultValue;
  }

  public String algorithm() {
    return publicKeyPart(0, "none");
  }

  public String encodedKey() {
    return publicKeyPart(1, null);
  }

  public String comment() {
    return publicKeyPart(2, "");
  }
}

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
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.MINUTES;
import static java.util.concurrent.TimeUnit.SECONDS;

import java.util.concurrent.TimeUnit;
import org.eclipse.jgit.lib.Config;
import org.junit.Test;

public class ConfigUtilTest {
  @Test
  public void timeUnit() {
    assertThat(parse("0")).isEqualTo(0);
    assertThat(parse("2ms")).isEqualTo(2);
    assertThat(parse("200 milliseconds")).isEqualTo(200);

    assertThat(parse("1s")).isEqualTo(ms(1, SECONDS));
    assertThat(parse("2 seconds")).isEqualTo(ms(2, SECONDS));
    assertThat(parse("1m")).isEqualTo(ms(1, MINUTES));
    assertThat(parse("2 min")).isEqualTo(ms(2, MINUTES));
    assertThat(parse("1h")).isEqualTo(ms(60, MINUTES));
    assertThat(parse("1 day")).isEqualTo(ms(24 * 60, MINUTES));
    assertThat(parse("1w")).isEqualTo(ms(7 * 24 * 60, MINUTES));
    assertThat(parse("1 mon")).isEqualTo(ms(30 * 24 * 60, MINUTES));
    assertThat(parse("1y")).isEqualTo(ms(365 * 24 * 60, MINUTES));
  }

  @Test
  public void plainNumberUsesWantedUnit() {
    assertThat(ConfigUtil.getTimeUnit("45", 1, SECONDS)).isEqualTo(45);
    assertThat(ConfigUtil.getTimeUnit("2 MIN", 1, SECONDS)).isEqualTo(120);
  }

  @Test
  public void unsetReturnsDefault() {
    assertThat(ConfigUtil.getTimeUnit(null, 7, SECONDS)).isEqualTo(7);
    assertThat(ConfigUtil.getTimeUnit("  ", 7, SECONDS)).isEqualTo(7);
  }

  @Test
  public void badValues() {
    assertThrows(IllegalArgumentException.class, () -> parse("-1"));
    assertThrows(IllegalArgumentException.class, () -> parse("1 fortnight"));
    assertThrows(IllegalArgumentException.class, () -> parse("soon"));
  }

  @Test
  public void fromConfigNamesKeyOnError() {
    Config cfg = new Config();
    cfg.setString("sshd", null, "loginGraceTime", "ten seconds");

    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> ConfigUtil.getTimeUnit(cfg, "sshd", null, "loginGraceTime", 120, SECONDS));
    assertThat(e).hasMessageThat().contains("sshd.loginGraceTime");
  }

  @Test
  public void fromConfig() {
    Config cfg = new Config();
    cfg.setString("sshd", null, "idleTimeout", "5 min");

    assertThat(ConfigUtil.getTimeUnit(cfg, "sshd", null, "idleTimeout", 0, SECONDS))
        .isEqualTo(300);
    assertThat(ConfigUtil.getTimeUnit(cfg, "sshd", null, "loginGraceTime", 120, SECONDS))
        .isEqualTo(120);
  }

  private static long ms(int cnt, TimeUnit unit) {
    return MILLISECONDS.convert(cnt, unit);
  }

  private static long parse(String string) {
    return ConfigUtil.getTimeUnit(string, 1, MILLISECONDS);
  }
}

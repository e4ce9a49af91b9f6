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

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.eclipse.jgit.lib.Config;

public class ConfigUtil {
  private static final Pattern TIME_VALUE = Pattern.compile("^(0|[1-9][0-9]*)\\s*(.*)$");

  /** Accepted unit suffixes, mapped to a base unit and multiplier. */
  private static final ImmutableMap<String, Scale> UNITS = units();

  private static final class Scale {
    final TimeUnit unit;
    final long multiplier;

    Scale(TimeUnit unit, long multiplier) {
      this.unit = unit;
      this.multiplier = multiplier;
    }
  }

  private static ImmutableMap<String, Scale> units() {
    ImmutableMap.Builder<String, Scale> b = ImmutableMap.builder();
    put(b, new Scale(TimeUnit.MILLISECONDS, 1), "ms", "milliseconds");
    put(b, new Scale(TimeUnit.SECONDS, 1), "s", "sec", "second", "seconds");
    put(b, new Scale(TimeUnit.MINUTES, 1), "m", "min", "minute", "minutes");
    put(b, new Scale(TimeUnit.HOURS, 1), "h", "hr", "hour", "hours");
    put(b, new Scale(TimeUnit.DAYS, 1), "d", "day", "days");
    put(b, new Scale(TimeUnit.DAYS, 7), "w", "week", "weeks");
    put(b, new Scale(TimeUnit.DAYS, 30), "mon", "month", "months");
    put(b, new Scale(TimeUnit.DAYS, 365), "y", "year", "years");
    return b.build();
  }

  private static void put(ImmutableMap.Builder<String, Scale> b, Scale s, String... names) {
    for (String n : names) {
      b.put(n, s);
    }
  }

  /**
   * Parse a numerical time unit, such as "1 minute", from the configuration.
   *
   * @param config the configuration file to read.
   * @param section section the key is in.
   * @param subsection subsection the key is in, or null if not in a subsection.
   * @param setting name of the setting to read.
   * @param defaultValue default value to return if no value was set in the configuration file.
   * @param wantUnit the units of {@code defaultValue} and the return value, as well as the units to
   *     assume if the value does not contain an indication of the units.
   * @return the setting, or {@code defaultValue} if not set, expressed in {@code units}.
   */
  public static long getTimeUnit(
      Config config,
      String section,
      String subsection,
      String setting,
      long defaultValue,
      TimeUnit wantUnit) {
    String valueString = config.getString(section, subsection, setting);
    try {
      return getTimeUnit(valueString, defaultValue, wantUnit);
    } catch (IllegalArgumentException notTime) {
      String key = section + (subsection != null ? "." + subsection : "") + "." + setting;
      throw new IllegalArgumentException(
          "Invalid time unit value: " + key + " = " + valueString, notTime);
    }
  }

  /** Parse a numerical time unit, such as "1 minute", from a string. */
  public static long getTimeUnit(String valueString, long defaultValue, TimeUnit wantUnit) {
    if (valueString == null || valueString.trim().isEmpty()) {
      return defaultValue;
    }

    Matcher m = TIME_VALUE.matcher(valueString.trim());
    if (!m.matches()) {
      throw new IllegalArgumentException("Invalid time unit value: " + valueString);
    }

    String unitName = m.group(2).trim().toLowerCase(Locale.US);
    Scale scale = unitName.isEmpty() ? new Scale(wantUnit, 1) : UNITS.get(unitName);
    if (scale == null) {
      throw new IllegalArgumentException("Invalid time unit value: " + valueString);
    }

    try {
      return wantUnit.convert(Long.parseLong(m.group(1)) * scale.multiplier, scale.unit);
    } catch (NumberFormatException nfe) {
      throw new IllegalArgumentException("Invalid time unit value: " + valueString, nfe);
    }
  }

  private ConfigUtil() {}
}

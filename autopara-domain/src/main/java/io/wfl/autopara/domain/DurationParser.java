/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.wfl.autopara.domain;

import java.time.Duration;
import java.util.Locale;

/**
 * Parses user-friendly durations found in remote profiles.
 * <p>
 * Accepted forms: plain seconds ({@code 3600}), suffixed values ({@code 30s}, {@code 5m},
 * {@code 2h}, {@code 1d}) and batch-system clock formats ({@code 45:00}, {@code 1:30:00},
 * {@code 1-12:00:00}).
 * </p>
 */
public final class DurationParser {

  private DurationParser() {
  }

  /**
   * @throws IllegalArgumentException if {@code raw} is blank or not in one of the accepted forms
   */
  public static Duration parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("duration must not be blank");
    }
    var trimmed = raw.trim().toLowerCase(Locale.ROOT);
    try {
      if (trimmed.contains(":")) {
        return parseClock(trimmed);
      }
      if (trimmed.endsWith("s")) {
        return Duration.ofSeconds(Long.parseLong(trimmed.substring(0, trimmed.length() - 1)));
      }
      if (trimmed.endsWith("m")) {
        return Duration.ofMinutes(Long.parseLong(trimmed.substring(0, trimmed.length() - 1)));
      }
      if (trimmed.endsWith("h")) {
        return Duration.ofHours(Long.parseLong(trimmed.substring(0, trimmed.length() - 1)));
      }
      if (trimmed.endsWith("d")) {
        return Duration.ofDays(Long.parseLong(trimmed.substring(0, trimmed.length() - 1)));
      }
      return Duration.ofSeconds(Long.parseLong(trimmed));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid duration: '" + raw + "'", e);
    }
  }

  /**
   * Formats a duration as {@code HH:MM:SS} (hours may exceed 24), the form batch systems expect.
   */
  public static String toClock(Duration duration) {
    long seconds = duration.getSeconds();
    return String.format(Locale.ROOT, "%d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
  }

  private static Duration parseClock(String value) {
    var days = Duration.ZERO;
    var clock = value;
    int dash = value.indexOf('-');
    if (dash > 0) {
      days = Duration.ofDays(Long.parseLong(value.substring(0, dash)));
      clock = value.substring(dash + 1);
    }
    var parts = clock.split(":");
    return switch (parts.length) {
      case 2 -> days.plusMinutes(Long.parseLong(parts[0])).plusSeconds(Long.parseLong(parts[1]));
      case 3 -> days.plusHours(Long.parseLong(parts[0]))
                    .plusMinutes(Long.parseLong(parts[1]))
                    .plusSeconds(Long.parseLong(parts[2]));
      default -> throw new IllegalArgumentException("Invalid duration: '" + value + "'");
    };
  }
}

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
package io.wfl.autopara.domain.command;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * POSIX shell quoting and splitting.
 * <p>
 * {@link #quote(String)} leaves words made only of {@code [A-Za-z0-9_@%+=:,./-]} untouched and
 * single-quotes everything else, so the result is always one shell word.
 * </p>
 */
public final class ShellQuoting {
  private static final Pattern UNSAFE = Pattern.compile("[^\\w@%+=:,./-]");

  private ShellQuoting() {
  }

  public static String quote(String value) {
    if (value.isEmpty()) {
      return "''";
    }
    if (!UNSAFE.matcher(value).find()) {
      return value;
    }
    return "'" + value.replace("'", "'\"'\"'") + "'";
  }

  /**
   * Splits a command line into words, honouring single quotes, double quotes and backslash escapes.
   *
   * @throws IllegalArgumentException on an unterminated quote
   */
  public static List<String> split(String line) {
    var words = new ArrayList<String>();
    var current = new StringBuilder();
    boolean inWord = false;
    int i = 0;
    while (i < line.length()) {
      char c = line.charAt(i);
      if (Character.isWhitespace(c)) {
        if (inWord) {
          words.add(current.toString());
          current.setLength(0);
          inWord = false;
        }
        i++;
      } else if (c == '\'') {
        int end = line.indexOf('\'', i + 1);
        if (end < 0) throw new IllegalArgumentException("Unterminated single quote in: " + line);
        current.append(line, i + 1, end);
        inWord = true;
        i = end + 1;
      } else if (c == '"') {
        i++;
        while (i < line.length() && line.charAt(i) != '"') {
          if (line.charAt(i) == '\\' && i + 1 < line.length() && "\"\\$`".indexOf(line.charAt(i + 1)) >= 0) {
            i++;
          }
          current.append(line.charAt(i));
          i++;
        }
        if (i >= line.length()) throw new IllegalArgumentException("Unterminated double quote in: " + line);
        inWord = true;
        i++;
      } else if (c == '\\' && i + 1 < line.length()) {
        current.append(line.charAt(i + 1));
        inWord = true;
        i += 2;
      } else {
        current.append(c);
        inWord = true;
        i++;
      }
    }
    if (inWord) {
      words.add(current.toString());
    }
    return words;
  }
}

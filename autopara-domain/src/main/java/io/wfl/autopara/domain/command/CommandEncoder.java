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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Converts a {@link ParameterEncoding} into one shell-executable argument string.
 *
 * <h2>Rendering rules</h2>
 * <ul>
 *   <li>One-character names give {@code -k}, longer names {@code --key}.</li>
 *   <li>{@link Parameter.Arity#REPEATED}: the flag is emitted once per element of the sequence
 *       ({@code --key v1 --key v2}).</li>
 *   <li>{@link Parameter.Arity#SINGLE} with a sequence value: the flag once, followed by every element,
 *       space-joined.</li>
 *   <li>Strings are shell-quoted verbatim, never JSON-wrapped. Mappings, numbers, booleans and
 *       nested sequences are rendered as compact JSON, then shell-quoted.</li>
 *   <li>{@link ParamValue.None}: the flag alone.</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * var encoding = ParameterEncoding.create()
 *   .set("a", 1)
 *   .repeated("bb", List.of("x", "y"));
 * new CommandEncoder().encode(encoding);   // "-a 1 --bb x --bb y"
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Instances are immutable and thread-safe.
 * </p>
 */
public final class CommandEncoder {
  private static final Gson GSON = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();

  private final Set<String> requiredKeys;

  /**
   * Creates an encoder without required keys.
   */
  public CommandEncoder() {
    this(Set.of());
  }

  /**
   * Creates an encoder that rejects encodings missing any of {@code requiredKeys}.
   *
   * @param requiredKeys parameter names every encoding must contain
   */
  public CommandEncoder(Set<String> requiredKeys) {
    requireNonNull(requiredKeys, "requiredKeys must not be null");
    this.requiredKeys = Set.copyOf(requiredKeys);
  }

  /**
   * Encodes the parameters in their insertion order.
   *
   * @param encoding the parameters to encode; must not be {@code null}
   * @return the argument string, without leading or trailing whitespace
   * @throws IllegalArgumentException if a required key is missing
   */
  public String encode(ParameterEncoding encoding) {
    requireNonNull(encoding, "encoding must not be null");

    var missing = new LinkedHashSet<>(requiredKeys);
    encoding.parameters().forEach(p -> missing.remove(p.name()));
    if (!missing.isEmpty()) {
      throw new IllegalArgumentException("Missing required parameters: " + String.join(", ", missing));
    }

    var words = new ArrayList<String>();
    for (var parameter : encoding.parameters()) {
      if (parameter.arity() == Parameter.Arity.REPEATED) {
        for (var element : ((ParamValue.Sequence) parameter.value()).values()) {
          appendFlag(words, parameter.flag(), element);
        }
      } else {
        appendFlag(words, parameter.flag(), parameter.value());
      }
    }
    return String.join(" ", words);
  }

  /**
   * Splits an encoded command line back into flag names and their raw (unquoted) values.
   * <p>
   * Words following a flag up to the next flag are its values; a repeated flag accumulates the
   * values of every occurrence. Words before the first flag are ignored.
   * </p>
   */
  public static Map<String, List<String>> decode(String commandLine) {
    requireNonNull(commandLine, "commandLine must not be null");
    var decoded = new LinkedHashMap<String, List<String>>();
    List<String> current = null;
    for (var word : ShellQuoting.split(commandLine)) {
      if (isFlag(word)) {
        var name = word.startsWith("--") ? word.substring(2) : word.substring(1);
        current = decoded.computeIfAbsent(name, k -> new ArrayList<>());
      } else if (current != null) {
        current.add(word);
      }
    }
    return decoded;
  }

  private static boolean isFlag(String word) {
    if (word.startsWith("--")) {
      return word.length() > 2;
    }
    return word.length() == 2 && word.charAt(0) == '-' && Character.isLetter(word.charAt(1));
  }

  private static void appendFlag(List<String> words, String flag, ParamValue value) {
    words.add(flag);
    var rendered = render(value);
    if (!rendered.isEmpty()) {
      words.add(rendered);
    }
  }

  private static String render(ParamValue value) {
    if (value instanceof ParamValue.None) {
      return "";
    }
    if (value instanceof ParamValue.Sequence sequence) {
      var parts = new ArrayList<String>();
      sequence.values().forEach(v -> parts.add(renderElement(v)));
      return String.join(" ", parts);
    }
    return renderElement(value);
  }

  private static String renderElement(ParamValue value) {
    if (value instanceof ParamValue.Scalar scalar && scalar.isString()) {
      return ShellQuoting.quote((String) scalar.value());
    }
    return ShellQuoting.quote(GSON.toJson(value.toJson()));
  }
}

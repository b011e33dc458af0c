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
package io.wfl.autopara.client;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.wfl.autopara.domain.RemoteInfo;
import io.wfl.autopara.domain.RemoteProfile;
import io.wfl.autopara.domain.RemoteProfiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Decides, for one dispatch call, whether it runs remotely and with which {@link RemoteProfile}.
 *
 * <h2>Resolution</h2>
 * <ol>
 *   <li>{@link RemoteInfo.Explicit} returns its profile; {@link RemoteInfo.Ignore} returns empty.</li>
 *   <li>{@link RemoteInfo.Auto} reads the configuration variable from the {@link AutoparaConfig}
 *       snapshot. An absent variable means local execution.</li>
 *   <li>The value is parsed as inline JSON. If it is not a JSON object it is taken as the path of a
 *       file holding the JSON.</li>
 *   <li>An object containing {@value RemoteProfiles#SYSTEM_NAME_KEY} is a single profile and is used
 *       directly.</li>
 *   <li>Otherwise the object is a profile table. Keys are tried in document order and the first
 *       matching key wins. A key matches when it equals the {@code label}, or when its
 *       comma-separated patterns all match the innermost entries of the {@link CallPath}: pattern
 *       {@code p} matches entry {@code e} when the regex {@code p + "$"} is found in {@code e}. A key
 *       with more patterns than the call path has entries does not match.</li>
 * </ol>
 * <p>
 * Configuration problems (unparseable value, unreadable file, invalid profile or pattern) are
 * logged as warnings and resolve to local execution.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Instances are immutable and thread-safe.
 * </p>
 */
public final class ProfileResolver {
  private static final Logger logger = LoggerFactory.getLogger(ProfileResolver.class);

  private final AutoparaConfig config;

  public ProfileResolver(AutoparaConfig config) {
    this.config = requireNonNull(config, "config must not be null");
  }

  /**
   * Resolves using {@value AutoparaConfig#REMOTE_INFO_VARIABLE}.
   */
  public Optional<RemoteProfile> resolve(RemoteInfo remoteInfo, String label, CallPath callPath) {
    return resolve(remoteInfo, AutoparaConfig.REMOTE_INFO_VARIABLE, label, callPath);
  }

  /**
   * @param remoteInfo the caller's selection
   * @param variable   environment variable holding the profile or profile table
   * @param label      optional key shortcut; may be {@code null}
   * @param callPath   call sites leading to this dispatch, outermost first
   * @return the profile to run with, or empty for local execution
   */
  public Optional<RemoteProfile> resolve(RemoteInfo remoteInfo, String variable, String label, CallPath callPath) {
    requireNonNull(remoteInfo, "remoteInfo must not be null");
    requireNonNull(callPath, "callPath must not be null");

    if (remoteInfo instanceof RemoteInfo.Explicit explicit) {
      return Optional.of(explicit.profile());
    }
    if (remoteInfo instanceof RemoteInfo.Ignore) {
      return Optional.empty();
    }

    var raw = config.env(variable);
    if (raw.isEmpty() || raw.get().isBlank()) {
      return Optional.empty();
    }

    return load(variable, raw.get()).flatMap(json -> select(variable, json, label, callPath));
  }

  private Optional<JsonObject> load(String variable, String raw) {
    var inline = parseObject(raw);
    if (inline.isPresent()) {
      return inline;
    }
    if (raw.chars().anyMatch(Character::isWhitespace)) {
      logger.warn("{} contains whitespace but is not parseable as JSON, using it as a file name", variable);
    }
    try {
      var content = Files.readString(Path.of(raw), UTF_8);
      var fromFile = parseObject(content);
      if (fromFile.isEmpty()) {
        logger.warn("{} file {} does not hold a JSON object, running locally", variable, raw);
      }
      return fromFile;
    } catch (IOException | InvalidPathException e) {
      logger.warn("{} is neither inline JSON nor a readable file ({}), running locally", variable, e.toString());
      return Optional.empty();
    }
  }

  private static Optional<JsonObject> parseObject(String text) {
    try {
      JsonElement element = JsonParser.parseString(text);
      return element.isJsonObject() ? Optional.of(element.getAsJsonObject()) : Optional.empty();
    } catch (JsonParseException e) {
      return Optional.empty();
    }
  }

  private Optional<RemoteProfile> select(String variable, JsonObject json, String label, CallPath callPath) {
    if (RemoteProfiles.looksLikeProfile(json)) {
      logger.warn("{} appears to be a single remote profile, using it directly", variable);
      return toProfile(variable, variable, json);
    }

    var entries = callPath.rendered();
    for (var key : json.keySet()) {
      if (matches(key, label, entries)) {
        logger.info("{} matched key {} for label {}", variable, key, label);
        return toProfile(variable, key, json.get(key));
      }
    }
    logger.debug("{} has no key matching call path [{}], running locally", variable, callPath);
    return Optional.empty();
  }

  static boolean matches(String key, String label, List<String> callPath) {
    if (label != null && label.equals(key)) {
      return true;
    }
    var patterns = Arrays.stream(key.split(",")).map(String::trim).toList();
    if (patterns.size() > callPath.size()) {
      return false;
    }
    int offset = callPath.size() - patterns.size();
    try {
      for (int i = 0; i < patterns.size(); i++) {
        if (!Pattern.compile(patterns.get(i) + "$").matcher(callPath.get(offset + i)).find()) {
          return false;
        }
      }
      return true;
    } catch (PatternSyntaxException e) {
      logger.warn("Ignoring remote profile key with invalid pattern '{}': {}", key, e.getDescription());
      return false;
    }
  }

  private static Optional<RemoteProfile> toProfile(String variable, String key, JsonElement json) {
    try {
      return Optional.of(RemoteProfiles.fromJson(json));
    } catch (JsonParseException e) {
      logger.warn("{} entry '{}' is not a valid remote profile, running locally: {}", variable, key, e.getMessage());
      return Optional.empty();
    }
  }
}

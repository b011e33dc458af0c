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
package io.wfl.autopara.domain.job;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.wfl.autopara.domain.Arguments;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Reads and writes {@link RemoteCall} bundles and job outcomes as JSON.
 *
 * <h2>Call Bundle</h2>
 * <pre>{@code
 * {
 *   "function": "com.example.MyFunction",
 *   "hash": "3f2a...",
 *   "positional": [ <typed>, ... ],
 *   "named": { "name": <typed>, ... }
 * }
 * }</pre>
 *
 * <h2>Result</h2>
 * <pre>{@code
 * {"status": "success", "result": <typed>}
 * {"status": "error", "message": "..."}
 * }</pre>
 * <p>
 * Values use the {@link TypedJson} encoding.
 * </p>
 */
public final class RemoteCallSerializer {

  private RemoteCallSerializer() {
  }

  public static JsonObject toJson(RemoteCall call) {
    var root = new JsonObject();
    root.addProperty("function", call.function());
    root.addProperty("hash", call.hash());

    var positional = new JsonArray();
    call.arguments().positional().forEach(v -> positional.add(TypedJson.encode(v)));
    root.add("positional", positional);

    var named = new JsonObject();
    call.arguments().named().forEach((k, v) -> named.add(k, TypedJson.encode(v)));
    root.add("named", named);
    return root;
  }

  public static RemoteCall fromJson(JsonElement element) {
    try {
      var root = element.getAsJsonObject();
      List<Object> positional = new ArrayList<>();
      root.getAsJsonArray("positional").forEach(v -> positional.add(TypedJson.decode(v)));
      Map<String, Object> named = new LinkedHashMap<>();
      root.getAsJsonObject("named").entrySet().forEach(e -> named.put(e.getKey(), TypedJson.decode(e.getValue())));

      return new RemoteCall(root.get("function").getAsString(), Arguments.of(positional, named), root.get("hash").getAsString());
    } catch (IllegalStateException | NullPointerException | UnsupportedOperationException e) {
      throw new JsonParseException("Malformed remote call: " + e.getMessage(), e);
    }
  }

  public static void write(RemoteCall call, Path file) throws IOException {
    Files.createDirectories(file.toAbsolutePath().getParent());
    Files.writeString(file, TypedJson.gson().toJson(toJson(call)), UTF_8);
  }

  public static RemoteCall read(Path file) throws IOException {
    return fromJson(JsonParser.parseString(Files.readString(file, UTF_8)));
  }

  public static JsonObject toJson(JobOutcome outcome) {
    var root = new JsonObject();
    if (outcome instanceof JobOutcome.Success success) {
      root.addProperty("status", "success");
      root.add("result", TypedJson.encode(success.result()));
    } else if (outcome instanceof JobOutcome.Error error) {
      root.addProperty("status", "error");
      root.addProperty("message", error.message());
    }
    return root;
  }

  public static JobOutcome outcomeFromJson(JsonElement element) {
    try {
      var root = element.getAsJsonObject();
      var status = root.get("status").getAsString();
      if ("success".equals(status)) {
        return JobOutcome.success(TypedJson.decode(root.get("result")));
      }
      if ("error".equals(status)) {
        return JobOutcome.error(root.get("message").getAsString());
      }
      throw new JsonParseException("Unknown job status: " + status);
    } catch (IllegalStateException | NullPointerException | UnsupportedOperationException e) {
      throw new JsonParseException("Malformed job result: " + e.getMessage(), e);
    }
  }

  public static void write(JobOutcome outcome, Path file) throws IOException {
    Files.createDirectories(file.toAbsolutePath().getParent());
    Files.writeString(file, TypedJson.gson().toJson(toJson(outcome)), UTF_8);
  }

  public static JobOutcome readOutcome(Path file) throws IOException {
    return outcomeFromJson(JsonParser.parseString(Files.readString(file, UTF_8)));
  }
}

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

import com.google.common.hash.Hashing;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.wfl.autopara.domain.Arguments;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeMap;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Content hash of a remote call.
 * <p>
 * The hash decides whether a submission is equivalent to a job that already exists, so it must be
 * stable for equal calls and change with any argument that is not ignored:
 * </p>
 * <ul>
 *   <li>named arguments listed in {@code hashIgnore} are left out entirely</li>
 *   <li>named arguments are hashed in name order, so their insertion order does not matter</li>
 *   <li>map entries are hashed in key order, so hash-map iteration order does not matter</li>
 *   <li>positional arguments and list items are hashed in order</li>
 * </ul>
 * <p>
 * The digest is SHA-256 over the canonical {@link TypedJson} form.
 * </p>
 */
public final class CallHasher {

  private CallHasher() {
  }

  public static String hash(String function, Arguments arguments, Iterable<String> hashIgnore) {
    Set<String> ignored = new HashSet<>();
    hashIgnore.forEach(ignored::add);

    var root = new JsonObject();
    root.addProperty("function", function);

    var positional = new JsonArray();
    arguments.positional().forEach(v -> positional.add(canonical(TypedJson.encode(v))));
    root.add("positional", positional);

    var named = new JsonObject();
    new TreeMap<>(arguments.named()).forEach((k, v) -> {
      if (!ignored.contains(k)) {
        named.add(k, canonical(TypedJson.encode(v)));
      }
    });
    root.add("named", named);

    return Hashing.sha256().hashString(TypedJson.gson().toJson(root), UTF_8).toString();
  }

  static JsonElement canonical(JsonElement element) {
    if (element.isJsonArray()) {
      var array = new JsonArray();
      element.getAsJsonArray().forEach(e -> array.add(canonical(e)));
      return array;
    }
    if (!element.isJsonObject()) {
      return element;
    }
    var object = element.getAsJsonObject();
    var sorted = new JsonObject();
    new TreeMap<>(object.asMap()).forEach((k, v) -> sorted.add(k, canonical(v)));

    if (object.has(TypedJson.TYPE) && TypedJson.MAP.equals(object.get(TypedJson.TYPE).getAsString())) {
      var entries = new ArrayList<JsonElement>();
      sorted.getAsJsonArray("entries").forEach(entries::add);
      entries.sort(Comparator.comparing(e -> TypedJson.gson().toJson(e.getAsJsonArray().get(0))));
      var array = new JsonArray();
      entries.forEach(array::add);
      sorted.add("entries", array);
    }
    return sorted;
  }
}

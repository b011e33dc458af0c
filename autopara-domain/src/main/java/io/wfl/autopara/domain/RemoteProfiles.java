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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Gson-based reader of {@link RemoteProfile} JSON objects.
 * <p>
 * Keys:
 * </p>
 * <pre>{@code
 * {
 *   "sys_name": "cluster",           // required
 *   "job_name": "fit",               // required
 *   "resources": {"n": [1, "nodes"], "max_time": "1h", "partitions": ["any"], "ncores_per_task": 4},
 *   "pre_cmds": ["module load x"], "post_cmds": [],
 *   "env_vars": {"OMP_NUM_THREADS": "1"},
 *   "input_files": [], "output_files": [],
 *   "header_extra": ["#SBATCH --exclusive"],
 *   "exact_fit": true, "partial_node": false,
 *   "timeout": 3600, "check_interval": "30s"
 * }
 * }</pre>
 * <p>
 * Durations accept every form of {@link DurationParser}; numbers are seconds.
 * </p>
 */
public final class RemoteProfiles {

  /**
   * Key whose presence identifies a single profile, as opposed to a table of profiles.
   */
  public static final String SYSTEM_NAME_KEY = "sys_name";

  private RemoteProfiles() {
  }

  public static boolean looksLikeProfile(JsonObject json) {
    return json.has(SYSTEM_NAME_KEY);
  }

  /**
   * @throws JsonParseException if a required key is missing or a value has the wrong shape
   */
  public static RemoteProfile fromJson(JsonElement element) {
    requireNonNull(element, "element must not be null");
    if (!element.isJsonObject()) {
      throw new JsonParseException("Remote profile must be a JSON object, got: " + element);
    }
    var json = element.getAsJsonObject();
    try {
      return new RemoteProfile(
        requiredString(json, SYSTEM_NAME_KEY),
        requiredString(json, "job_name"),
        json.has("resources") ? resources(json.get("resources")) : null,
        stringList(json, "pre_cmds"),
        stringList(json, "post_cmds"),
        stringMap(json, "env_vars"),
        stringList(json, "input_files"),
        stringList(json, "output_files"),
        stringList(json, "header_extra"),
        !json.has("exact_fit") || json.get("exact_fit").getAsBoolean(),
        json.has("partial_node") && json.get("partial_node").getAsBoolean(),
        duration(json, "timeout"),
        duration(json, "check_interval")
      );
    } catch (IllegalArgumentException | IllegalStateException | UnsupportedOperationException | ClassCastException e) {
      throw new JsonParseException("Invalid remote profile " + json + ": " + e.getMessage(), e);
    }
  }

  static ResourceRequest resources(JsonElement element) {
    if (!element.isJsonObject()) {
      throw new JsonParseException("resources must be a JSON object, got: " + element);
    }
    var json = element.getAsJsonObject();
    int num = 1;
    var unit = ResourceRequest.Unit.NODES;
    if (json.has("n")) {
      var n = json.get("n");
      if (n.isJsonArray()) {
        JsonArray array = n.getAsJsonArray();
        num = array.get(0).getAsInt();
        if (array.size() > 1) {
          unit = ResourceRequest.Unit.valueOf(array.get(1).getAsString().toUpperCase(Locale.ROOT));
        }
      } else {
        num = n.getAsInt();
      }
    }
    var partitions = new ArrayList<String>();
    if (json.has("partitions")) {
      var p = json.get("partitions");
      if (p.isJsonArray()) {
        p.getAsJsonArray().forEach(e -> partitions.add(e.getAsString()));
      } else {
        partitions.add(p.getAsString());
      }
    }
    return new ResourceRequest(
      num,
      unit,
      duration(json, "max_time"),
      partitions,
      json.has("ncores_per_task") ? json.get("ncores_per_task").getAsInt() : null
    );
  }

  private static String requiredString(JsonObject json, String key) {
    if (!json.has(key) || json.get(key).isJsonNull()) {
      throw new JsonParseException("Remote profile is missing required key '" + key + "'");
    }
    return json.get(key).getAsString();
  }

  private static List<String> stringList(JsonObject json, String key) {
    if (!json.has(key) || json.get(key).isJsonNull()) {
      return List.of();
    }
    var value = json.get(key);
    if (!value.isJsonArray()) {
      return List.of(value.getAsString());
    }
    var list = new ArrayList<String>();
    value.getAsJsonArray().forEach(e -> list.add(e.getAsString()));
    return list;
  }

  private static Map<String, String> stringMap(JsonObject json, String key) {
    if (!json.has(key) || json.get(key).isJsonNull()) {
      return Map.of();
    }
    var map = new LinkedHashMap<String, String>();
    json.getAsJsonObject(key).entrySet().forEach(e -> map.put(e.getKey(), e.getValue().getAsString()));
    return map;
  }

  private static Duration duration(JsonObject json, String key) {
    if (!json.has(key) || json.get(key).isJsonNull()) {
      return null;
    }
    var value = json.get(key).getAsJsonPrimitive();
    return value.isNumber() ? Duration.ofSeconds(value.getAsLong()) : DurationParser.parse(value.getAsString());
  }
}

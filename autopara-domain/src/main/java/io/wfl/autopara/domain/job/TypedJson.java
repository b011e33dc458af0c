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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Gson encoding of arbitrary values that keeps their runtime type, so that values staged to a
 * remote job come back as the same classes.
 *
 * <h2>JSON Structure</h2>
 * <pre>{@code
 * {"type": "null"}
 * {"type": "list", "items": [ <typed>, ... ]}
 * {"type": "map",  "entries": [ [<typed key>, <typed value>], ... ]}
 * {"type": "java.lang.Integer", "value": 3}
 * {"type": "com.example.Structure", "value": { ...Gson tree... }}
 * }</pre>
 * <p>
 * Lists (and any other {@link Iterable} that is not a {@link Map}) decode as {@link ArrayList};
 * maps decode as {@link LinkedHashMap}. Every other value must be readable and writable by a default
 * {@link Gson} instance (records, enums, plain objects, boxed primitives, strings).
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * This class is stateless and thread-safe.
 * </p>
 */
public final class TypedJson {
  static final String TYPE = "type";
  static final String VALUE = "value";
  static final String NULL = "null";
  static final String LIST = "list";
  static final String MAP = "map";

  private static final Gson GSON = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();

  private TypedJson() {
  }

  public static Gson gson() {
    return GSON;
  }

  public static JsonElement encode(Object value) {
    var node = new JsonObject();
    if (value == null) {
      node.addProperty(TYPE, NULL);
    } else if (value instanceof Map<?, ?> map) {
      node.addProperty(TYPE, MAP);
      var entries = new JsonArray();
      map.forEach((k, v) -> {
        var entry = new JsonArray();
        entry.add(encode(k));
        entry.add(encode(v));
        entries.add(entry);
      });
      node.add("entries", entries);
    } else if (value instanceof Iterable<?> iterable) {
      node.addProperty(TYPE, LIST);
      var items = new JsonArray();
      iterable.forEach(item -> items.add(encode(item)));
      node.add("items", items);
    } else {
      node.addProperty(TYPE, value.getClass().getName());
      node.add(VALUE, GSON.toJsonTree(value));
    }
    return node;
  }

  /**
   * @throws JsonParseException if the tree is malformed or names a class that cannot be loaded
   */
  public static Object decode(JsonElement element) {
    requireNonNull(element, "element must not be null");
    if (!element.isJsonObject() || !element.getAsJsonObject().has(TYPE)) {
      throw new JsonParseException("Typed value must be an object with a 'type' member, got: " + element);
    }
    var node = element.getAsJsonObject();
    var type = node.get(TYPE).getAsString();
    switch (type) {
      case NULL:
        return null;
      case LIST: {
        List<Object> list = new ArrayList<>();
        node.getAsJsonArray("items").forEach(item -> list.add(decode(item)));
        return list;
      }
      case MAP: {
        Map<Object, Object> map = new LinkedHashMap<>();
        node.getAsJsonArray("entries").forEach(entry -> {
          var pair = entry.getAsJsonArray();
          map.put(decode(pair.get(0)), decode(pair.get(1)));
        });
        return map;
      }
      default:
        return GSON.fromJson(node.get(VALUE), loadClass(type));
    }
  }

  private static Class<?> loadClass(String name) {
    try {
      var loader = Thread.currentThread().getContextClassLoader();
      return Class.forName(name, false, loader != null ? loader : TypedJson.class.getClassLoader());
    } catch (ClassNotFoundException e) {
      throw new JsonParseException("Cannot load staged value type: " + name, e);
    }
  }
}

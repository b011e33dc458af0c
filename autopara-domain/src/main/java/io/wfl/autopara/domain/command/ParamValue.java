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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Tagged value of one command-line parameter.
 * <p>
 * Four shapes exist, each with its own rendering rule in {@link CommandEncoder}:
 * </p>
 * <ul>
 *   <li>{@link Scalar}: a string, number or boolean</li>
 *   <li>{@link Sequence}: an ordered list of values</li>
 *   <li>{@link Mapping}: string-keyed values, always rendered as one JSON object</li>
 *   <li>{@link None}: no value; the flag is emitted bare</li>
 * </ul>
 */
public sealed interface ParamValue {

  ParamValue NONE = new None();

  static ParamValue of(String value) {
    return new Scalar(value);
  }

  static ParamValue of(Number value) {
    return new Scalar(value);
  }

  static ParamValue of(boolean value) {
    return new Scalar(value);
  }

  static ParamValue sequence(ParamValue... values) {
    return new Sequence(Arrays.asList(values));
  }

  static ParamValue strings(String... values) {
    return new Sequence(Arrays.stream(values).map(ParamValue::of).toList());
  }

  static ParamValue mapping(Map<String, ParamValue> values) {
    return new Mapping(values);
  }

  /**
   * Converts a plain Java value: {@code null}, {@link String}, {@link Number}, {@link Boolean},
   * {@link List}/arrays, {@link Map} (keys rendered with {@code toString()}), or an existing
   * {@code ParamValue}.
   *
   * @throws IllegalArgumentException for any other type
   */
  static ParamValue from(Object value) {
    if (value == null) return NONE;
    if (value instanceof ParamValue p) return p;
    if (value instanceof String || value instanceof Number || value instanceof Boolean) return new Scalar(value);
    if (value instanceof Map<?, ?> map) {
      var converted = new LinkedHashMap<String, ParamValue>();
      map.forEach((k, v) -> converted.put(String.valueOf(k), from(v)));
      return new Mapping(converted);
    }
    if (value instanceof Iterable<?> iterable) {
      var converted = new ArrayList<ParamValue>();
      iterable.forEach(v -> converted.add(from(v)));
      return new Sequence(converted);
    }
    if (value instanceof Object[] array) {
      return new Sequence(Arrays.stream(array).map(ParamValue::from).toList());
    }
    throw new IllegalArgumentException("Unsupported parameter value type: " + value.getClass().getName());
  }

  /**
   * Returns the JSON tree of this value.
   */
  JsonElement toJson();

  /**
   * A string, number or boolean.
   */
  record Scalar(Object value) implements ParamValue {
    public Scalar {
      requireNonNull(value, "value must not be null, use ParamValue.NONE");
      if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
        throw new IllegalArgumentException("Scalar must be a String, Number or Boolean, got: " + value.getClass().getName());
      }
    }

    public boolean isString() {
      return value instanceof String;
    }

    @Override
    public JsonElement toJson() {
      if (value instanceof String s) return new JsonPrimitive(s);
      if (value instanceof Number n) return new JsonPrimitive(n);
      return new JsonPrimitive((Boolean) value);
    }
  }

  record Sequence(List<ParamValue> values) implements ParamValue {
    public Sequence {
      requireNonNull(values, "values must not be null");
      values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    @Override
    public JsonElement toJson() {
      var array = new JsonArray();
      values.forEach(v -> array.add(v.toJson()));
      return array;
    }
  }

  record Mapping(Map<String, ParamValue> values) implements ParamValue {
    public Mapping {
      requireNonNull(values, "values must not be null");
      values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @Override
    public JsonElement toJson() {
      var object = new JsonObject();
      values.forEach((k, v) -> object.add(k, v.toJson()));
      return object;
    }
  }

  record None() implements ParamValue {
    @Override
    public JsonElement toJson() {
      return JsonNull.INSTANCE;
    }
  }
}

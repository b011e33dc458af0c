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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Ordered set of parameters to encode as one command line.
 * <p>
 * Setting a parameter that already exists replaces its value and arity but keeps its position.
 * Instances are mutable builders; {@link CommandEncoder} only reads them.
 * </p>
 */
public final class ParameterEncoding {
  private final LinkedHashMap<String, Parameter> parameters = new LinkedHashMap<>();

  public static ParameterEncoding create() {
    return new ParameterEncoding();
  }

  /**
   * Builds an encoding from a plain map; every entry is {@link Parameter.Arity#SINGLE}.
   */
  public static ParameterEncoding fromMap(Map<String, ?> values) {
    requireNonNull(values, "values must not be null");
    var encoding = new ParameterEncoding();
    values.forEach((k, v) -> encoding.set(k, ParamValue.from(v)));
    return encoding;
  }

  public ParameterEncoding set(String name, ParamValue value) {
    return put(new Parameter(name, value, Parameter.Arity.SINGLE));
  }

  public ParameterEncoding set(String name, Object value) {
    return set(name, ParamValue.from(value));
  }

  public ParameterEncoding repeated(String name, ParamValue.Sequence values) {
    return put(new Parameter(name, values, Parameter.Arity.REPEATED));
  }

  public ParameterEncoding repeated(String name, List<?> values) {
    return repeated(name, (ParamValue.Sequence) ParamValue.from(values));
  }

  public ParameterEncoding flag(String name) {
    return set(name, ParamValue.NONE);
  }

  public ParameterEncoding put(Parameter parameter) {
    requireNonNull(parameter, "parameter must not be null");
    parameters.put(parameter.name(), parameter);
    return this;
  }

  public ParameterEncoding copy() {
    var copy = new ParameterEncoding();
    copy.parameters.putAll(parameters);
    return copy;
  }

  public boolean contains(String name) {
    return parameters.containsKey(name);
  }

  public Optional<Parameter> get(String name) {
    return Optional.ofNullable(parameters.get(name));
  }

  public List<Parameter> parameters() {
    return Collections.unmodifiableList(new ArrayList<>(parameters.values()));
  }

  @Override
  public String toString() {
    return "ParameterEncoding" + parameters.values();
  }
}

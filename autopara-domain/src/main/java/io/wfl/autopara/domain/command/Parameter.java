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

import static java.util.Objects.requireNonNull;

/**
 * One named command-line parameter.
 *
 * @param name  the parameter name; one character gives {@code -n}, longer names give {@code --name}
 * @param value the value
 * @param arity whether a sequence value is emitted as one flag with all elements, or one flag per element
 */
public record Parameter(String name, ParamValue value, Arity arity) {

  public Parameter {
    requireNonNull(name, "name must not be null");
    requireNonNull(value, "value must not be null");
    requireNonNull(arity, "arity must not be null");
    if (name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    if (arity == Arity.REPEATED && !(value instanceof ParamValue.Sequence)) {
      throw new IllegalArgumentException("Repeated parameter '" + name + "' must hold a sequence, got: " + value);
    }
  }

  public String flag() {
    return (name.length() == 1 ? "-" : "--") + name;
  }

  public enum Arity {
    /**
     * The flag appears once; a sequence value is space-joined after it.
     */
    SINGLE,
    /**
     * The flag appears once per element of the sequence value.
     */
    REPEATED
  }
}

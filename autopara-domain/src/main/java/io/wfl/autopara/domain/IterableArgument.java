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

import static java.util.Objects.requireNonNull;

/**
 * Designates the argument slot of an {@link Operation} that receives each chunk of work items.
 * <p>
 * A chunk is either inserted in the positional arguments at a given index (later positional
 * arguments are shifted right) or bound to a named argument.
 * </p>
 *
 * @see Arguments#withChunk(IterableArgument, java.util.List)
 */
public sealed interface IterableArgument {

  /**
   * The default slot: first positional argument.
   */
  IterableArgument FIRST = new Positional(0);

  static IterableArgument positional(int index) {
    return new Positional(index);
  }

  static IterableArgument named(String name) {
    return new Named(name);
  }

  /**
   * Positional slot.
   *
   * @param index insertion index in the positional arguments; must be {@code >= 0}
   */
  record Positional(int index) implements IterableArgument {
    public Positional {
      if (index < 0) {
        throw new IllegalArgumentException("index must be >= 0, got: " + index);
      }
    }
  }

  /**
   * Named slot.
   *
   * @param name argument name; must not be blank
   */
  record Named(String name) implements IterableArgument {
    public Named {
      requireNonNull(name, "name must not be null");
      if (name.isBlank()) {
        throw new IllegalArgumentException("name must not be blank");
      }
    }
  }
}

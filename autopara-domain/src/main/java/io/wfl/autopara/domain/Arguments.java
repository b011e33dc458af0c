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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static java.util.Objects.requireNonNull;

/**
 * Immutable positional and named arguments of one operation invocation.
 * <p>
 * Named arguments keep their insertion order. Values may be {@code null}.
 * </p>
 * <p>
 * The dispatcher builds one {@code Arguments} per chunk with {@link #withChunk(IterableArgument, List)},
 * so operations read their work items from the same slot they declared when the dispatch was set up.
 * </p>
 */
public final class Arguments {
  private static final Arguments EMPTY = new Arguments(List.of(), Map.of());

  private final List<Object> positional;
  private final Map<String, Object> named;

  private Arguments(List<Object> positional, Map<String, Object> named) {
    this.positional = Collections.unmodifiableList(new ArrayList<>(positional));
    this.named = Collections.unmodifiableMap(new LinkedHashMap<>(named));
  }

  public static Arguments empty() {
    return EMPTY;
  }

  public static Arguments of(List<?> positional, Map<String, ?> named) {
    requireNonNull(positional, "positional must not be null");
    requireNonNull(named, "named must not be null");
    return new Arguments(new ArrayList<>(positional), new LinkedHashMap<>(named));
  }

  public static Arguments positional(Object... values) {
    var list = new ArrayList<>();
    Collections.addAll(list, values);
    return new Arguments(list, Map.of());
  }

  public static Arguments named(Map<String, ?> named) {
    return of(List.of(), named);
  }

  public List<Object> positional() {
    return positional;
  }

  public Map<String, Object> named() {
    return named;
  }

  /**
   * Returns the positional argument at {@code index}.
   *
   * @throws IndexOutOfBoundsException if there is no such argument
   */
  @SuppressWarnings("unchecked")
  public <T> T get(int index) {
    return (T) positional.get(index);
  }

  /**
   * Returns the named argument {@code name}.
   *
   * @throws NoSuchElementException if the argument is not present
   */
  @SuppressWarnings("unchecked")
  public <T> T get(String name) {
    if (!named.containsKey(name)) {
      throw new NoSuchElementException("No argument named '" + name + "'. Available: " + named.keySet());
    }
    return (T) named.get(name);
  }

  @SuppressWarnings("unchecked")
  public <T> T getOrDefault(String name, T defaultValue) {
    return named.containsKey(name) ? (T) named.get(name) : defaultValue;
  }

  /**
   * Returns the chunk stored in the given slot.
   */
  @SuppressWarnings("unchecked")
  public <I> List<I> chunk(IterableArgument slot) {
    requireNonNull(slot, "slot must not be null");
    if (slot instanceof IterableArgument.Named n) {
      return (List<I>) get(n.name());
    }
    return (List<I>) get(((IterableArgument.Positional) slot).index());
  }

  /**
   * Checks that a chunk can be placed in {@code slot}.
   *
   * @throws IllegalArgumentException if the slot is positional and its index exceeds the number of
   *                                  positional arguments
   */
  public void checkSlot(IterableArgument slot) {
    requireNonNull(slot, "slot must not be null");
    if (slot instanceof IterableArgument.Positional p && p.index() > positional.size()) {
      throw new IllegalArgumentException(
        "Iterable argument index " + p.index() + " exceeds the " + positional.size() + " positional arguments supplied");
    }
  }

  /**
   * Returns a copy of these arguments with {@code chunk} placed in {@code slot}.
   * <p>
   * A positional slot inserts the chunk at its index; a named slot binds (or replaces) the argument.
   * </p>
   */
  public Arguments withChunk(IterableArgument slot, List<?> chunk) {
    checkSlot(slot);
    if (slot instanceof IterableArgument.Named n) {
      return withNamed(n.name(), chunk);
    }
    var list = new ArrayList<>(positional);
    list.add(((IterableArgument.Positional) slot).index(), chunk);
    return new Arguments(list, named);
  }

  public Arguments withNamed(String name, Object value) {
    var map = new LinkedHashMap<>(named);
    map.put(name, value);
    return new Arguments(positional, map);
  }

  public Arguments withoutNamed(Iterable<String> names) {
    var map = new LinkedHashMap<>(named);
    names.forEach(map::remove);
    return new Arguments(positional, map);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (!(obj instanceof Arguments that)) return false;
    return positional.equals(that.positional) && named.equals(that.named);
  }

  @Override
  public int hashCode() {
    return 31 * positional.hashCode() + named.hashCode();
  }

  @Override
  public String toString() {
    return "Arguments[positional=" + positional + ", named=" + named + ']';
  }
}

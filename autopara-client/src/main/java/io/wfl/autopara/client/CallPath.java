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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Immutable list of {@link DispatchContext} entries, outermost first, describing how a dispatch
 * call was reached.
 * <p>
 * Call sites build the path explicitly and pass it down, typically by appending their own context
 * with {@link #then(DispatchContext)} before calling into an operation. {@link ProfileResolver}
 * matches the innermost entries against the keys of a profile table.
 * </p>
 */
public final class CallPath {
  private static final CallPath EMPTY = new CallPath(List.of());

  private final List<DispatchContext> entries;

  private CallPath(List<DispatchContext> entries) {
    this.entries = entries;
  }

  public static CallPath empty() {
    return EMPTY;
  }

  public static CallPath of(DispatchContext... entries) {
    var list = new ArrayList<DispatchContext>();
    for (var entry : entries) {
      list.add(requireNonNull(entry, "entry must not be null"));
    }
    return new CallPath(Collections.unmodifiableList(list));
  }

  /**
   * Parses rendered entries of the form {@code <source>::<name>}.
   *
   * @throws IllegalArgumentException if an entry has no {@code ::} separator
   */
  public static CallPath parse(String... rendered) {
    var list = new ArrayList<DispatchContext>();
    for (var entry : rendered) {
      int separator = entry.lastIndexOf("::");
      if (separator < 0) {
        throw new IllegalArgumentException("Call path entry must be '<source>::<name>', got: " + entry);
      }
      list.add(new DispatchContext(entry.substring(0, separator), entry.substring(separator + 2)));
    }
    return new CallPath(Collections.unmodifiableList(list));
  }

  /**
   * Returns a new path with {@code inner} appended as the innermost entry.
   */
  public CallPath then(DispatchContext inner) {
    var list = new ArrayList<>(entries);
    list.add(requireNonNull(inner, "inner must not be null"));
    return new CallPath(Collections.unmodifiableList(list));
  }

  public List<DispatchContext> entries() {
    return entries;
  }

  public List<String> rendered() {
    return entries.stream().map(DispatchContext::render).toList();
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this || (obj instanceof CallPath that && entries.equals(that.entries));
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    return String.join(" -> ", rendered());
  }
}

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
import java.util.Iterator;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * {@link InputSet} backed by an immutable list.
 * <p>
 * Elements may be {@code null} (a "no result" slot kept by a dispatch with {@code skipFailed=false}).
 * </p>
 */
public final class InMemoryInputSet<T> implements InputSet<T> {
  private final List<T> items;

  private InMemoryInputSet(List<T> items) {
    this.items = Collections.unmodifiableList(new ArrayList<>(items));
  }

  public static <T> InMemoryInputSet<T> of(List<T> items) {
    requireNonNull(items, "items must not be null");
    return new InMemoryInputSet<>(items);
  }

  public static <T> InMemoryInputSet<T> copyOf(Iterable<T> items) {
    requireNonNull(items, "items must not be null");
    var list = new ArrayList<T>();
    items.forEach(list::add);
    return new InMemoryInputSet<>(list);
  }

  @Override
  public List<T> inMemory() {
    return items;
  }

  @Override
  public Iterator<T> iterator() {
    return items.iterator();
  }

  public int size() {
    return items.size();
  }

  @Override
  public String toString() {
    return "InMemoryInputSet" + items;
  }
}

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
import java.util.List;

/**
 * {@link OutputSink} collecting items in memory.
 * <p>
 * Thread-safe: the local pool stores items from the dispatching thread only, but a sink may be
 * shared by successive dispatch calls.
 * </p>
 */
public final class InMemoryOutputSink<T> implements OutputSink<T> {
  private final List<T> items = new ArrayList<>();
  private boolean done;

  @Override
  public synchronized boolean isDone() {
    return done;
  }

  @Override
  public synchronized void store(T item) {
    if (done) {
      throw new IllegalStateException("Sink is already complete");
    }
    items.add(item);
  }

  @Override
  public synchronized void complete() {
    done = true;
  }

  @Override
  public synchronized InputSet<T> toInputSet() {
    return InMemoryInputSet.of(items);
  }

  public synchronized List<T> items() {
    return Collections.unmodifiableList(new ArrayList<>(items));
  }
}

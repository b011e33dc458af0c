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

/**
 * Destination of the merged outputs of a dispatch call.
 * <p>
 * A sink reporting {@link #isDone()} makes the dispatch a no-op: the operation is not invoked and
 * {@link #toInputSet()} is returned directly.
 * </p>
 *
 * @param <T> the item type
 */
public interface OutputSink<T> {

  /**
   * @return {@code true} if this sink was already fully written by an earlier run
   */
  boolean isDone();

  /**
   * Appends one output item, in merged order.
   */
  void store(T item);

  /**
   * Marks the sink as fully written.
   */
  void complete();

  /**
   * Returns the stored items as an input set for the next pipeline step.
   */
  InputSet<T> toInputSet();
}

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

import java.util.List;

/**
 * A bounded or streaming collection of work items.
 * <p>
 * The engine only iterates it, or materializes it in memory when the items have to be staged for
 * a remote job.
 * </p>
 *
 * @param <T> the item type
 */
public interface InputSet<T> extends Iterable<T> {

  /**
   * Returns all items as an in-memory ordered list.
   *
   * @return the items in iteration order; never {@code null}
   */
  List<T> inMemory();
}

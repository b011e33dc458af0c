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
 * The user-supplied work applied to each chunk of a dispatched iterable.
 * <p>
 * The dispatcher calls {@link #apply(Arguments)} once per chunk, with the chunk placed in the
 * argument slot chosen for the dispatch. The returned list holds the outputs of that chunk, in the
 * order they must appear in the merged result.
 * </p>
 *
 * <h2>"No result" signal</h2>
 * <p>
 * Returning {@code null}, or a list containing {@code null} elements, tells the dispatcher that
 * nothing was produced for (part of) the chunk. Depending on {@code skipFailed} these slots are
 * dropped from the merged output or kept as {@code null}. Throwing an exception is not a "no result"
 * signal: it aborts the whole dispatch.
 * </p>
 *
 * <h2>Remote execution</h2>
 * <p>
 * An operation dispatched to a remote job is re-instantiated there by class name, so it must be a
 * named class with a public no-arg constructor. Lambdas can only run in the local pool.
 * </p>
 *
 * @param <O> the output type
 */
@FunctionalInterface
public interface Operation<O> {

  /**
   * Processes one chunk.
   *
   * @param arguments the invocation arguments, chunk included; never {@code null}
   * @return the chunk outputs, or {@code null} when nothing was produced
   */
  List<O> apply(Arguments arguments);
}

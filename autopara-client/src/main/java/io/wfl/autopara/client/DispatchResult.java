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

import io.wfl.autopara.client.broker.RemoteJobHandle;
import io.wfl.autopara.domain.InputSet;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of a dispatch call.
 * <ul>
 *   <li>{@link Completed}: the merged outputs, in input order</li>
 *   <li>{@link Detached}: a remote job submitted without waiting; fetch it later with
 *       {@link RemoteQueueBackend#fetch(RemoteJobHandle, io.wfl.autopara.domain.RemoteProfile)}</li>
 * </ul>
 *
 * @param <O> the output item type
 */
public sealed interface DispatchResult<O> {

  /**
   * Returns the merged outputs.
   *
   * @throws IllegalStateException if the dispatch was detached
   */
  InputSet<O> output();

  default boolean isDetached() {
    return this instanceof Detached;
  }

  record Completed<O>(InputSet<O> output) implements DispatchResult<O> {
    public Completed {
      requireNonNull(output, "output must not be null");
    }
  }

  record Detached<O>(RemoteJobHandle handle) implements DispatchResult<O> {
    public Detached {
      requireNonNull(handle, "handle must not be null");
    }

    @Override
    public InputSet<O> output() {
      throw new IllegalStateException("Remote job " + handle.jobId() + " was submitted without waiting, no output yet");
    }
  }
}

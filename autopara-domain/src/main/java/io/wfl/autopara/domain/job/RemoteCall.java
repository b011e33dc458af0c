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
package io.wfl.autopara.domain.job;

import io.wfl.autopara.domain.Arguments;

import static java.util.Objects.requireNonNull;

/**
 * Everything a remote job needs to re-run one call: the {@link RemoteFunction} class, its arguments,
 * and the content hash identifying the call.
 *
 * @param function  fully qualified name of a {@link RemoteFunction} implementation
 * @param arguments the staged arguments
 * @param hash      content hash computed by {@link CallHasher}
 * @see RemoteCallSerializer
 */
public record RemoteCall(String function, Arguments arguments, String hash) {

  public RemoteCall {
    requireNonNull(function, "function must not be null");
    requireNonNull(arguments, "arguments must not be null");
    requireNonNull(hash, "hash must not be null");
  }

  /**
   * Builds a call for {@code function}, hashing every argument except the named ones in {@code hashIgnore}.
   */
  public static RemoteCall of(Class<? extends RemoteFunction> function, Arguments arguments, Iterable<String> hashIgnore) {
    return new RemoteCall(function.getName(), arguments, CallHasher.hash(function.getName(), arguments, hashIgnore));
  }
}

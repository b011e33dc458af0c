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
package io.wfl.autopara.domain.cache;

import java.io.IOException;
import java.util.Optional;

/**
 * Looks for output produced by an earlier run.
 * <p>
 * A probe returns the cached result when the prior output is present and valid. Missing or
 * malformed artifacts are reported by throwing {@link IOException} or
 * {@link com.google.gson.JsonParseException}, or by returning {@link Optional#empty()}; all three
 * mean "do the work".
 * </p>
 *
 * @param <T> the cached result type
 * @see IdempotentCache
 */
@FunctionalInterface
public interface CacheProbe<T> {

  Optional<T> probe() throws IOException;
}

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

import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * "Already done, skip" helper for expensive operations.
 * <p>
 * {@link #getOrCompute(CacheProbe, Supplier)} runs the probe first and returns its result when it
 * finds valid prior output; otherwise the work runs. Probe failures caused by missing or corrupt
 * artifacts ({@link IOException}, {@link JsonParseException}) are treated as a miss and logged at
 * debug level. Any other exception thrown by the probe is a programming or configuration error and
 * propagates.
 * </p>
 */
public final class IdempotentCache {
  private static final Logger logger = LoggerFactory.getLogger(IdempotentCache.class);

  private IdempotentCache() {
  }

  public static <T> T getOrCompute(CacheProbe<T> probe, Supplier<T> work) {
    requireNonNull(probe, "probe must not be null");
    requireNonNull(work, "work must not be null");

    var cached = lookup(probe);
    if (cached.isPresent()) {
      logger.info("Reusing previously produced output: {}", cached.get());
      return cached.get();
    }
    return work.get();
  }

  /**
   * Runs {@code probe}, mapping artifact failures to {@link Optional#empty()}.
   */
  public static <T> Optional<T> lookup(CacheProbe<T> probe) {
    try {
      return probe.probe();
    } catch (IOException | JsonParseException e) {
      logger.debug("No reusable output found: {}", e.toString());
      return Optional.empty();
    }
  }
}

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
package io.wfl.autopara.client.broker;

import io.wfl.autopara.domain.AutoparaException;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Maps remote system names to the {@link JobBroker} serving them.
 *
 * <p><strong>Thread-safety:</strong> instances are immutable and thread-safe.
 */
public final class JobBrokerRegistry {

  /**
   * Name under which {@link #defaults(Map)} registers an {@link InProcessJobBroker}.
   */
  public static final String IN_PROCESS = "in-process";

  /**
   * Environment variable naming the root directory of in-process jobs.
   */
  public static final String JOBS_DIR_VARIABLE = "WFL_AUTOPARA_JOBS_DIR";

  static final String DEFAULT_JOBS_DIR = "_autopara_jobs";

  private final Map<String, JobBroker> brokers;

  private JobBrokerRegistry(Map<String, JobBroker> brokers) {
    this.brokers = Collections.unmodifiableMap(brokers);
  }

  public static JobBrokerRegistry of(JobBroker... brokers) {
    var map = new LinkedHashMap<String, JobBroker>();
    for (var broker : brokers) {
      if (map.putIfAbsent(broker.name(), broker) != null) {
        throw new IllegalArgumentException("Duplicate broker name: " + broker.name());
      }
    }
    return new JobBrokerRegistry(map);
  }

  /**
   * Registry holding a single {@link InProcessJobBroker} named {@value #IN_PROCESS}, rooted at
   * {@value #JOBS_DIR_VARIABLE} or {@code ./_autopara_jobs}.
   */
  public static JobBrokerRegistry defaults(Map<String, String> environment) {
    var root = environment.getOrDefault(JOBS_DIR_VARIABLE, DEFAULT_JOBS_DIR);
    return of(new InProcessJobBroker(IN_PROCESS, Path.of(root)));
  }

  /**
   * Returns a registry with {@code broker} added, replacing any broker with the same name.
   */
  public JobBrokerRegistry with(JobBroker broker) {
    requireNonNull(broker, "broker must not be null");
    var map = new LinkedHashMap<>(brokers);
    map.put(broker.name(), broker);
    return new JobBrokerRegistry(map);
  }

  /**
   * @throws AutoparaException if no broker serves {@code systemName}
   */
  public JobBroker get(String systemName) {
    var broker = brokers.get(systemName);
    if (broker == null) {
      throw new AutoparaException("No job broker registered for system '" + systemName + "'. Known systems: " + brokers.keySet());
    }
    return broker;
  }

  public boolean contains(String systemName) {
    return brokers.containsKey(systemName);
  }
}

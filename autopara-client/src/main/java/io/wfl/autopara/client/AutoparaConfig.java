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

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import io.wfl.autopara.client.broker.JobBrokerRegistry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Process-wide configuration of the dispatch engine.
 * <p>
 * The configuration is built once, usually with {@link #fromEnvironment()}, and threaded through
 * the {@link Dispatcher} and both backends. It is the only place where environment variables are
 * read; everything downstream works on the snapshot it holds.
 * </p>
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@value #NPOOL_VARIABLE}: default worker pool size (0, the default, runs serially)</li>
 *   <li>{@value #REMOTE_INFO_VARIABLE}: default remote profile or profile table, inline JSON or
 *       path to a JSON file</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * var config = AutoparaConfig.builder()
 *     .withDefaultPoolSize(4)
 *     .withBrokers(registry)
 *     .build();
 * }</pre>
 *
 * <p><strong>Thread-safety:</strong> instances are immutable and thread-safe.
 */
public final class AutoparaConfig {
  public static final String NPOOL_VARIABLE = "WFL_AUTOPARA_NPOOL";
  public static final String REMOTE_INFO_VARIABLE = "WFL_AUTOPARA_REMOTEINFO";

  private static final Supplier<AutoparaConfig> SHARED = Suppliers.memoize(AutoparaConfig::fromEnvironment);

  private final Map<String, String> environment;
  private final int defaultPoolSize;
  private final JobBrokerRegistry brokers;

  private AutoparaConfig(Map<String, String> environment, int defaultPoolSize, JobBrokerRegistry brokers) {
    this.environment = environment;
    this.defaultPoolSize = defaultPoolSize;
    this.brokers = brokers;
  }

  /**
   * Snapshots the current process environment, with the default broker registry.
   *
   * @throws IllegalArgumentException if {@value #NPOOL_VARIABLE} is not a non-negative integer
   */
  public static AutoparaConfig fromEnvironment() {
    return builder().withEnvironment(System.getenv()).build();
  }

  /**
   * Returns the configuration shared by the jobs of this process, snapshotted from the environment
   * on first use. Its broker registry lives as long as the process.
   */
  public static AutoparaConfig shared() {
    return SHARED.get();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the value of an environment variable captured when this configuration was built.
   */
  public Optional<String> env(String name) {
    return Optional.ofNullable(environment.get(name));
  }

  public Map<String, String> environment() {
    return environment;
  }

  public int defaultPoolSize() {
    return defaultPoolSize;
  }

  public JobBrokerRegistry brokers() {
    return brokers;
  }

  /**
   * Returns a copy of this configuration with a different broker registry.
   */
  public AutoparaConfig withBrokers(JobBrokerRegistry brokers) {
    return new AutoparaConfig(environment, defaultPoolSize, requireNonNull(brokers, "brokers must not be null"));
  }

  public static final class Builder {
    private final Map<String, String> environment = new LinkedHashMap<>();
    private Integer defaultPoolSize;
    private JobBrokerRegistry brokers;

    private Builder() {
    }

    /**
     * Adds variables to the environment snapshot.
     */
    public Builder withEnvironment(Map<String, String> environment) {
      this.environment.putAll(requireNonNull(environment, "environment must not be null"));
      return this;
    }

    public Builder withVariable(String name, String value) {
      environment.put(requireNonNull(name, "name must not be null"), requireNonNull(value, "value must not be null"));
      return this;
    }

    /**
     * Sets the default pool size, overriding {@value #NPOOL_VARIABLE}.
     */
    public Builder withDefaultPoolSize(int defaultPoolSize) {
      if (defaultPoolSize < 0) {
        throw new IllegalArgumentException("defaultPoolSize must be >= 0, got: " + defaultPoolSize);
      }
      this.defaultPoolSize = defaultPoolSize;
      return this;
    }

    public Builder withBrokers(JobBrokerRegistry brokers) {
      this.brokers = brokers;
      return this;
    }

    public AutoparaConfig build() {
      int poolSize = defaultPoolSize != null ? defaultPoolSize : poolSizeFromEnvironment();
      var registry = brokers != null ? brokers : JobBrokerRegistry.defaults(environment);
      return new AutoparaConfig(Collections.unmodifiableMap(new LinkedHashMap<>(environment)), poolSize, registry);
    }

    private int poolSizeFromEnvironment() {
      var raw = environment.get(NPOOL_VARIABLE);
      if (raw == null || raw.isBlank()) {
        return 0;
      }
      try {
        int value = Integer.parseInt(raw.trim());
        if (value < 0) {
          throw new IllegalArgumentException(NPOOL_VARIABLE + " must be >= 0, got: " + raw);
        }
        return value;
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(NPOOL_VARIABLE + " must be an integer, got: " + raw, e);
      }
    }
  }
}

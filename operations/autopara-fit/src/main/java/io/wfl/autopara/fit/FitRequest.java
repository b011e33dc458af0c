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
package io.wfl.autopara.fit;

import io.wfl.autopara.domain.InputSet;
import io.wfl.autopara.domain.RemoteInfo;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Parameters of one external fit.
 *
 * <p>Usage:
 * <pre>{@code
 * var request = FitRequest.builder(configs, "ace_water", Map.of("order", 3, "degree", 12))
 *     .withRunDir(Path.of("fits"))
 *     .withExecutable("/opt/ace/ace_fit.jl")
 *     .withSkipIfPresent(true)
 *     .build();
 * }</pre>
 *
 * <p>Defaults:</p>
 * <ul>
 *   <li>{@code refPropertyPrefix}: {@value #DEFAULT_REF_PROPERTY_PREFIX}</li>
 *   <li>{@code runDir}: the current directory</li>
 *   <li>{@code formats}: {@code .json}, {@code .yace}</li>
 *   <li>{@code executable}: {@value #DEFAULT_EXECUTABLE}</li>
 *   <li>{@code verbose}: {@code true}; {@code waitForResults}: {@code true}</li>
 *   <li>{@code remoteInfo}: {@link RemoteInfo#auto()}</li>
 * </ul>
 */
public final class FitRequest {
  public static final String DEFAULT_REF_PROPERTY_PREFIX = "REF_";
  public static final String DEFAULT_EXECUTABLE = "ace_fit.jl";

  private final InputSet<?> configs;
  private final String potentialName;
  private final Map<String, Object> params;
  private final String refPropertyPrefix;
  private final boolean skipIfPresent;
  private final Path runDir;
  private final List<String> formats;
  private final String executable;
  private final boolean dryRun;
  private final boolean verbose;
  private final RemoteInfo remoteInfo;
  private final boolean waitForResults;

  private FitRequest(Builder builder) {
    this.configs = builder.configs;
    this.potentialName = builder.potentialName;
    this.params = Collections.unmodifiableMap(new LinkedHashMap<>(builder.params));
    this.refPropertyPrefix = builder.refPropertyPrefix;
    this.skipIfPresent = builder.skipIfPresent;
    this.runDir = builder.runDir;
    this.formats = List.copyOf(builder.formats);
    this.executable = builder.executable;
    this.dryRun = builder.dryRun;
    this.verbose = builder.verbose;
    this.remoteInfo = builder.remoteInfo;
    this.waitForResults = builder.waitForResults;
  }

  public static Builder builder(InputSet<?> configs, String potentialName, Map<String, ?> params) {
    return new Builder(configs, potentialName, params);
  }

  public InputSet<?> configs() {
    return configs;
  }

  public String potentialName() {
    return potentialName;
  }

  public Map<String, Object> params() {
    return params;
  }

  public String refPropertyPrefix() {
    return refPropertyPrefix;
  }

  public boolean skipIfPresent() {
    return skipIfPresent;
  }

  public Path runDir() {
    return runDir;
  }

  /**
   * @return the output formats, each with a leading {@code .}
   */
  public List<String> formats() {
    return formats;
  }

  public String executable() {
    return executable;
  }

  public boolean dryRun() {
    return dryRun;
  }

  public boolean verbose() {
    return verbose;
  }

  public RemoteInfo remoteInfo() {
    return remoteInfo;
  }

  public boolean waitForResults() {
    return waitForResults;
  }

  /**
   * Base path of every output file: {@code <runDir>/<potentialName>}.
   */
  public Path fileBase() {
    return runDir.resolve(potentialName);
  }

  public Builder toBuilder() {
    var builder = new Builder(configs, potentialName, params);
    builder.refPropertyPrefix = refPropertyPrefix;
    builder.skipIfPresent = skipIfPresent;
    builder.runDir = runDir;
    builder.formats = new ArrayList<>(formats);
    builder.executable = executable;
    builder.dryRun = dryRun;
    builder.verbose = verbose;
    builder.remoteInfo = remoteInfo;
    builder.waitForResults = waitForResults;
    return builder;
  }

  public static final class Builder {
    private final InputSet<?> configs;
    private final String potentialName;
    private final Map<String, Object> params;
    private String refPropertyPrefix = DEFAULT_REF_PROPERTY_PREFIX;
    private boolean skipIfPresent;
    private Path runDir = Path.of(".");
    private List<String> formats = List.of(".json", ".yace");
    private String executable = DEFAULT_EXECUTABLE;
    private boolean dryRun;
    private boolean verbose = true;
    private RemoteInfo remoteInfo = RemoteInfo.auto();
    private boolean waitForResults = true;

    private Builder(InputSet<?> configs, String potentialName, Map<String, ?> params) {
      this.configs = requireNonNull(configs, "configs must not be null");
      this.potentialName = requireNonNull(potentialName, "potentialName must not be null");
      if (potentialName.isBlank()) {
        throw new IllegalArgumentException("potentialName must not be blank");
      }
      this.params = new LinkedHashMap<>(requireNonNull(params, "params must not be null"));
    }

    /**
     * @throws IllegalArgumentException if {@code prefix} is empty
     */
    public Builder withRefPropertyPrefix(String prefix) {
      requireNonNull(prefix, "prefix must not be null");
      if (prefix.isEmpty()) {
        throw new IllegalArgumentException("refPropertyPrefix must not be empty");
      }
      this.refPropertyPrefix = prefix;
      return this;
    }

    public Builder withSkipIfPresent(boolean skipIfPresent) {
      this.skipIfPresent = skipIfPresent;
      return this;
    }

    public Builder withRunDir(Path runDir) {
      this.runDir = requireNonNull(runDir, "runDir must not be null");
      return this;
    }

    /**
     * Sets the output formats; a leading {@code .} is added where missing.
     */
    public Builder withFormats(List<String> formats) {
      requireNonNull(formats, "formats must not be null");
      this.formats = formats.stream().map(f -> f.startsWith(".") ? f : "." + f).toList();
      return this;
    }

    public Builder withExecutable(String executable) {
      this.executable = requireNonNull(executable, "executable must not be null");
      return this;
    }

    public Builder withDryRun(boolean dryRun) {
      this.dryRun = dryRun;
      return this;
    }

    public Builder withVerbose(boolean verbose) {
      this.verbose = verbose;
      return this;
    }

    public Builder withRemoteInfo(RemoteInfo remoteInfo) {
      this.remoteInfo = requireNonNull(remoteInfo, "remoteInfo must not be null");
      return this;
    }

    public Builder withWaitForResults(boolean waitForResults) {
      this.waitForResults = waitForResults;
      return this;
    }

    public FitRequest build() {
      return new FitRequest(this);
    }
  }
}

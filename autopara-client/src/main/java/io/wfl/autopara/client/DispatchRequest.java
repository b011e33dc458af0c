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

import io.wfl.autopara.domain.Arguments;
import io.wfl.autopara.domain.IterableArgument;
import io.wfl.autopara.domain.Operation;
import io.wfl.autopara.domain.OutputSink;
import io.wfl.autopara.domain.RemoteInfo;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Immutable description of one {@link Dispatcher#dispatch(DispatchRequest)} call.
 *
 * <p>Usage:
 * <pre>{@code
 * var request = DispatchRequest.builder(configs, new ComputeEnergy())
 *     .withOutputs(sink)
 *     .withChunksize(10)
 *     .withNpool(4)
 *     .withArguments(Arguments.named(Map.of("cutoff", 5.0)))
 *     .withIterableArgument(IterableArgument.named("atoms"))
 *     .build();
 * }</pre>
 *
 * <p>Defaults:</p>
 * <ul>
 *   <li>{@code arguments}: none</li>
 *   <li>{@code iterableArgument}: first positional argument</li>
 *   <li>{@code chunksize}: 1</li>
 *   <li>{@code npool}: {@link AutoparaConfig#defaultPoolSize()}</li>
 *   <li>{@code skipFailed}: {@code true}</li>
 *   <li>{@code remoteInfo}: {@link RemoteInfo#auto()}</li>
 *   <li>{@code callPath}: empty</li>
 *   <li>{@code waitForResults}: {@code true}</li>
 * </ul>
 *
 * @param <O> the output item type
 */
public final class DispatchRequest<O> {
  private final Iterable<?> iterable;
  private final Operation<O> operation;
  private final OutputSink<O> outputs;
  private final Arguments arguments;
  private final IterableArgument iterableArgument;
  private final int chunksize;
  private final Integer npool;
  private final boolean skipFailed;
  private final Runnable initializer;
  private final RemoteInfo remoteInfo;
  private final String label;
  private final CallPath callPath;
  private final Set<String> hashIgnore;
  private final Path workingDirectory;
  private final boolean waitForResults;

  private DispatchRequest(Builder<O> builder) {
    this.iterable = builder.iterable;
    this.operation = builder.operation;
    this.outputs = builder.outputs;
    this.arguments = builder.arguments;
    this.iterableArgument = builder.iterableArgument;
    this.chunksize = builder.chunksize;
    this.npool = builder.npool;
    this.skipFailed = builder.skipFailed;
    this.initializer = builder.initializer;
    this.remoteInfo = builder.remoteInfo;
    this.label = builder.label;
    this.callPath = builder.callPath;
    this.hashIgnore = Set.copyOf(builder.hashIgnore);
    this.workingDirectory = builder.workingDirectory;
    this.waitForResults = builder.waitForResults;
  }

  public static <O> Builder<O> builder(Iterable<?> iterable, Operation<O> operation) {
    return new Builder<>(iterable, operation);
  }

  public Iterable<?> iterable() {
    return iterable;
  }

  public Operation<O> operation() {
    return operation;
  }

  public Optional<OutputSink<O>> outputs() {
    return Optional.ofNullable(outputs);
  }

  public Arguments arguments() {
    return arguments;
  }

  public IterableArgument iterableArgument() {
    return iterableArgument;
  }

  public int chunksize() {
    return chunksize;
  }

  /**
   * @return the requested pool size, or empty to use the configured default
   */
  public OptionalInt npool() {
    return npool == null ? OptionalInt.empty() : OptionalInt.of(npool);
  }

  public boolean skipFailed() {
    return skipFailed;
  }

  public Optional<Runnable> initializer() {
    return Optional.ofNullable(initializer);
  }

  public RemoteInfo remoteInfo() {
    return remoteInfo;
  }

  public Optional<String> label() {
    return Optional.ofNullable(label);
  }

  public CallPath callPath() {
    return callPath;
  }

  public Set<String> hashIgnore() {
    return hashIgnore;
  }

  public Optional<Path> workingDirectory() {
    return Optional.ofNullable(workingDirectory);
  }

  public boolean waitForResults() {
    return waitForResults;
  }

  /**
   * Returns a builder initialised with the values of this request.
   */
  public Builder<O> toBuilder() {
    var builder = new Builder<>(iterable, operation);
    builder.outputs = outputs;
    builder.arguments = arguments;
    builder.iterableArgument = iterableArgument;
    builder.chunksize = chunksize;
    builder.npool = npool;
    builder.skipFailed = skipFailed;
    builder.initializer = initializer;
    builder.remoteInfo = remoteInfo;
    builder.label = label;
    builder.callPath = callPath;
    builder.hashIgnore.addAll(hashIgnore);
    builder.workingDirectory = workingDirectory;
    builder.waitForResults = waitForResults;
    return builder;
  }

  public static final class Builder<O> {
    private final Iterable<?> iterable;
    private final Operation<O> operation;
    private final Set<String> hashIgnore = new LinkedHashSet<>();
    private OutputSink<O> outputs;
    private Arguments arguments = Arguments.empty();
    private IterableArgument iterableArgument = IterableArgument.FIRST;
    private int chunksize = 1;
    private Integer npool;
    private boolean skipFailed = true;
    private Runnable initializer;
    private RemoteInfo remoteInfo = RemoteInfo.auto();
    private String label;
    private CallPath callPath = CallPath.empty();
    private Path workingDirectory;
    private boolean waitForResults = true;

    private Builder(Iterable<?> iterable, Operation<O> operation) {
      this.iterable = requireNonNull(iterable, "iterable must not be null");
      this.operation = requireNonNull(operation, "operation must not be null");
    }

    public Builder<O> withOutputs(OutputSink<O> outputs) {
      this.outputs = outputs;
      return this;
    }

    public Builder<O> withArguments(Arguments arguments) {
      this.arguments = requireNonNull(arguments, "arguments must not be null");
      return this;
    }

    public Builder<O> withIterableArgument(IterableArgument iterableArgument) {
      this.iterableArgument = requireNonNull(iterableArgument, "iterableArgument must not be null");
      return this;
    }

    /**
     * @throws IllegalArgumentException if {@code chunksize < 1}
     */
    public Builder<O> withChunksize(int chunksize) {
      if (chunksize < 1) {
        throw new IllegalArgumentException("chunksize must be >= 1, got: " + chunksize);
      }
      this.chunksize = chunksize;
      return this;
    }

    /**
     * @throws IllegalArgumentException if {@code npool < 0}
     */
    public Builder<O> withNpool(int npool) {
      if (npool < 0) {
        throw new IllegalArgumentException("npool must be >= 0, got: " + npool);
      }
      this.npool = npool;
      return this;
    }

    public Builder<O> withSkipFailed(boolean skipFailed) {
      this.skipFailed = skipFailed;
      return this;
    }

    /**
     * Sets a callable run once on each pool worker before its first chunk.
     */
    public Builder<O> withInitializer(Runnable initializer) {
      this.initializer = initializer;
      return this;
    }

    public Builder<O> withRemoteInfo(RemoteInfo remoteInfo) {
      this.remoteInfo = requireNonNull(remoteInfo, "remoteInfo must not be null");
      return this;
    }

    public Builder<O> withLabel(String label) {
      this.label = label;
      return this;
    }

    public Builder<O> withCallPath(CallPath callPath) {
      this.callPath = requireNonNull(callPath, "callPath must not be null");
      return this;
    }

    /**
     * Names of arguments left out of the remote call hash.
     */
    public Builder<O> withHashIgnore(Set<String> names) {
      this.hashIgnore.addAll(requireNonNull(names, "names must not be null"));
      return this;
    }

    public Builder<O> withWorkingDirectory(Path workingDirectory) {
      this.workingDirectory = workingDirectory;
      return this;
    }

    public Builder<O> withWaitForResults(boolean waitForResults) {
      this.waitForResults = waitForResults;
      return this;
    }

    public DispatchRequest<O> build() {
      return new DispatchRequest<>(this);
    }
  }
}

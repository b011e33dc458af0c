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
import io.wfl.autopara.domain.InputSet;
import io.wfl.autopara.domain.IterableArgument;
import io.wfl.autopara.domain.Operation;
import io.wfl.autopara.domain.OutputSink;
import io.wfl.autopara.domain.RemoteInfo;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * An {@link Operation} bound to its dispatch defaults, so callers only supply the inputs, the
 * output sink and the operation's own arguments.
 *
 * <p>Usage:
 * <pre>{@code
 * var computeEnergy = AutoparaOperation.builder(new ComputeEnergy())
 *     .withChunksize(10)
 *     .withIterableArgument(IterableArgument.named("atoms"))
 *     .withHashIgnore(Set.of("scratch"))
 *     .build(dispatcher);
 *
 * var energies = computeEnergy.apply(configs, sink, Arguments.named(Map.of("cutoff", 5.0)));
 * var quick = computeEnergy.apply(configs, null, Arguments.empty(), call -> call.withNpool(0));
 * }</pre>
 * <p>
 * Per-call overrides are applied after the defaults and win over them. The default call path is
 * the operation's own {@link DispatchContext}, rendered from its class and the operation name.
 * </p>
 *
 * @param <O> the output item type
 */
public final class AutoparaOperation<O> {
  private final Dispatcher dispatcher;
  private final Operation<O> operation;
  private final String name;
  private final Integer npool;
  private final int chunksize;
  private final IterableArgument iterableArgument;
  private final boolean skipFailed;
  private final Runnable initializer;
  private final RemoteInfo remoteInfo;
  private final String label;
  private final Set<String> hashIgnore;

  private AutoparaOperation(Builder<O> builder, Dispatcher dispatcher) {
    this.dispatcher = requireNonNull(dispatcher, "dispatcher must not be null");
    this.operation = builder.operation;
    this.name = builder.name;
    this.npool = builder.npool;
    this.chunksize = builder.chunksize;
    this.iterableArgument = builder.iterableArgument;
    this.skipFailed = builder.skipFailed;
    this.initializer = builder.initializer;
    this.remoteInfo = builder.remoteInfo;
    this.label = builder.label;
    this.hashIgnore = Set.copyOf(builder.hashIgnore);
  }

  public static <O> Builder<O> builder(Operation<O> operation) {
    return new Builder<>(operation);
  }

  public String name() {
    return name;
  }

  public Operation<O> operation() {
    return operation;
  }

  /**
   * Dispatches with the defaults only and waits for the outputs.
   *
   * @param inputs    items to loop over
   * @param outputs   where to store the outputs, or {@code null} to keep them in memory
   * @param arguments the operation's own arguments, without the iterable
   */
  public InputSet<O> apply(Iterable<?> inputs, OutputSink<O> outputs, Arguments arguments) {
    return dispatch(inputs, outputs, arguments, call -> {
    }).output();
  }

  /**
   * Dispatches with the defaults, then the given overrides, and waits for the outputs.
   */
  public InputSet<O> apply(Iterable<?> inputs,
                           OutputSink<O> outputs,
                           Arguments arguments,
                           Consumer<DispatchRequest.Builder<O>> overrides) {
    return dispatch(inputs, outputs, arguments, overrides).output();
  }

  /**
   * Like {@link #apply(Iterable, OutputSink, Arguments, Consumer)} but returns the raw result, which
   * is {@link DispatchResult.Detached} when the overrides disable waiting for a remote job.
   */
  public DispatchResult<O> dispatch(Iterable<?> inputs,
                                    OutputSink<O> outputs,
                                    Arguments arguments,
                                    Consumer<DispatchRequest.Builder<O>> overrides) {
    requireNonNull(overrides, "overrides must not be null");
    var request = DispatchRequest.builder(inputs, operation)
                                 .withOutputs(outputs)
                                 .withArguments(arguments)
                                 .withIterableArgument(iterableArgument)
                                 .withChunksize(chunksize)
                                 .withSkipFailed(skipFailed)
                                 .withInitializer(initializer)
                                 .withRemoteInfo(remoteInfo)
                                 .withLabel(label)
                                 .withCallPath(CallPath.of(DispatchContext.of(operation.getClass(), name)))
                                 .withHashIgnore(hashIgnore);
    if (npool != null) {
      request.withNpool(npool);
    }
    overrides.accept(request);
    return dispatcher.dispatch(request.build());
  }

  @Override
  public String toString() {
    return "AutoparaOperation[" + name + "]";
  }

  public static final class Builder<O> {
    private final Operation<O> operation;
    private final Set<String> hashIgnore = new LinkedHashSet<>();
    private String name;
    private Integer npool;
    private int chunksize = 1;
    private IterableArgument iterableArgument = IterableArgument.FIRST;
    private boolean skipFailed = true;
    private Runnable initializer;
    private RemoteInfo remoteInfo = RemoteInfo.auto();
    private String label;

    private Builder(Operation<O> operation) {
      this.operation = requireNonNull(operation, "operation must not be null");
      this.name = operation.getClass().getSimpleName();
    }

    public Builder<O> withName(String name) {
      this.name = requireNonNull(name, "name must not be null");
      return this;
    }

    public Builder<O> withNpool(int npool) {
      if (npool < 0) {
        throw new IllegalArgumentException("npool must be >= 0, got: " + npool);
      }
      this.npool = npool;
      return this;
    }

    public Builder<O> withChunksize(int chunksize) {
      if (chunksize < 1) {
        throw new IllegalArgumentException("chunksize must be >= 1, got: " + chunksize);
      }
      this.chunksize = chunksize;
      return this;
    }

    public Builder<O> withIterableArgument(IterableArgument iterableArgument) {
      this.iterableArgument = requireNonNull(iterableArgument, "iterableArgument must not be null");
      return this;
    }

    public Builder<O> withSkipFailed(boolean skipFailed) {
      this.skipFailed = skipFailed;
      return this;
    }

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

    public Builder<O> withHashIgnore(Set<String> names) {
      requireNonNull(names, "names must not be null");
      this.hashIgnore.addAll(names);
      return this;
    }

    public AutoparaOperation<O> build(Dispatcher dispatcher) {
      return new AutoparaOperation<>(this, dispatcher);
    }
  }
}

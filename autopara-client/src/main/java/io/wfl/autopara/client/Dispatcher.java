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

import io.wfl.autopara.domain.InMemoryInputSet;
import io.wfl.autopara.domain.OutputSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Applies an operation to every chunk of an iterable and merges the outputs in input order, locally
 * or as one remote batch job.
 *
 * <h2>Dispatch Steps</h2>
 * <ol>
 *   <li>The iterable argument slot is checked against the supplied arguments.</li>
 *   <li>If the output sink reports itself done, its content is returned without running the
 *       operation or resolving any remote profile.</li>
 *   <li>{@link ProfileResolver} decides between local and remote execution.</li>
 *   <li>{@link LocalPoolBackend} or {@link RemoteQueueBackend} runs the operation.</li>
 *   <li>Outputs go to the sink, which is then completed, or are collected in memory.</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * var dispatcher = new Dispatcher(AutoparaConfig.fromEnvironment());
 * var energies = dispatcher.dispatch(
 *     DispatchRequest.builder(configs, new ComputeEnergy())
 *                    .withChunksize(10)
 *                    .withNpool(4)
 *                    .build())
 *   .output();
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Instances are thread-safe; concurrent dispatches do not share worker pools.
 * </p>
 */
public final class Dispatcher {
  private static final Logger logger = LoggerFactory.getLogger(Dispatcher.class);

  private final AutoparaConfig config;
  private final ProfileResolver resolver;
  private final LocalPoolBackend local;
  private final RemoteQueueBackend remote;

  public Dispatcher(AutoparaConfig config) {
    this(config, new ProfileResolver(config), new LocalPoolBackend(), new RemoteQueueBackend(config));
  }

  Dispatcher(AutoparaConfig config, ProfileResolver resolver, LocalPoolBackend local, RemoteQueueBackend remote) {
    this.config = requireNonNull(config, "config must not be null");
    this.resolver = requireNonNull(resolver, "resolver must not be null");
    this.local = requireNonNull(local, "local must not be null");
    this.remote = requireNonNull(remote, "remote must not be null");
  }

  public AutoparaConfig config() {
    return config;
  }

  /**
   * @param request the dispatch to run
   * @return the merged outputs, or a detached handle for a remote job submitted without waiting
   * @throws IllegalArgumentException                    if the iterable argument slot does not fit the arguments
   * @throws io.wfl.autopara.domain.AutoparaException    if the operation fails locally
   * @throws io.wfl.autopara.domain.RemoteJobException   if the remote job fails
   */
  public <O> DispatchResult<O> dispatch(DispatchRequest<O> request) {
    requireNonNull(request, "request must not be null");
    request.arguments().checkSlot(request.iterableArgument());

    var sink = request.outputs().orElse(null);
    if (sink != null && sink.isDone()) {
      logger.info("Returning before {} since output is done", request.operation());
      return new DispatchResult.Completed<>(sink.toInputSet());
    }

    var profile = resolver.resolve(request.remoteInfo(), request.label().orElse(null), request.callPath());
    var collector = new Collector<>(sink);

    if (profile.isPresent()) {
      var handle = remote.submit(request, profile.get());
      if (!request.waitForResults()) {
        logger.info("Not waiting for remote job {}", handle.jobId());
        return new DispatchResult.Detached<>(handle);
      }
      remote.<O>fetchOutputs(handle, profile.get()).forEach(collector);
    } else {
      int npool = request.npool().orElse(config.defaultPoolSize());
      local.execute(request, npool, collector);
    }
    return collector.finish();
  }

  /**
   * Sends outputs to the sink when there is one, otherwise keeps them in memory.
   */
  private static final class Collector<O> implements Consumer<O> {
    private final OutputSink<O> sink;
    private final List<O> items = new ArrayList<>();

    private Collector(OutputSink<O> sink) {
      this.sink = sink;
    }

    @Override
    public void accept(O item) {
      if (sink != null) {
        sink.store(item);
      } else {
        items.add(item);
      }
    }

    DispatchResult<O> finish() {
      if (sink != null) {
        sink.complete();
        return new DispatchResult.Completed<>(sink.toInputSet());
      }
      return new DispatchResult.Completed<>(InMemoryInputSet.of(items));
    }
  }
}

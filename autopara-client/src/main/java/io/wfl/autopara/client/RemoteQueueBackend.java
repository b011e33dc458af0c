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

import com.google.gson.JsonParseException;
import io.wfl.autopara.client.broker.JobSpec;
import io.wfl.autopara.client.broker.RemoteJobHandle;
import io.wfl.autopara.domain.Arguments;
import io.wfl.autopara.domain.InputSet;
import io.wfl.autopara.domain.RemoteJobException;
import io.wfl.autopara.domain.RemoteProfile;
import io.wfl.autopara.domain.job.JobOutcome;
import io.wfl.autopara.domain.job.RemoteCall;
import io.wfl.autopara.domain.job.RemoteCallSerializer;
import io.wfl.autopara.domain.job.RemoteFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Runs a call as one batch job through the {@link io.wfl.autopara.client.broker.JobBroker} serving
 * the profile's system.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li><strong>assemble</strong>: the iterable is materialized in memory and bundled with the
 *       operation and its arguments into a {@link RemoteCall}, hashed without the hash-ignored
 *       argument names</li>
 *   <li><strong>submit</strong>: the broker queues the job, or returns the existing job for an
 *       identical call</li>
 *   <li><strong>wait</strong>: blocks for at most the profile's timeout, polling at its check
 *       interval</li>
 *   <li><strong>fetch</strong>: the job's captured stdout and stderr are re-emitted on this
 *       process's streams, and the result is decoded</li>
 *   <li><strong>mark processed</strong>: the broker records that the result was consumed</li>
 * </ol>
 * <p>
 * The working directory of the operation, when it declares one, is added to the job's output
 * files. A failed job, an unreadable result or a missing output is a {@link RemoteJobException};
 * no partial result is returned.
 * </p>
 */
public final class RemoteQueueBackend {
  private static final Logger logger = LoggerFactory.getLogger(RemoteQueueBackend.class);

  private final AutoparaConfig config;
  private final PrintStream out;
  private final PrintStream err;

  public RemoteQueueBackend(AutoparaConfig config) {
    this(config, System.out, System.err);
  }

  RemoteQueueBackend(AutoparaConfig config, PrintStream out, PrintStream err) {
    this.config = requireNonNull(config, "config must not be null");
    this.out = out;
    this.err = err;
  }

  /**
   * Submits a {@link RemoteFunction} call as a batch job.
   *
   * @param function         the function run by the job
   * @param arguments        its arguments
   * @param hashIgnore       named arguments left out of the call hash
   * @param profile          where and how to run
   * @param workingDirectory directory the function writes to, staged back with the job's outputs; may be {@code null}
   * @return the handle of the new or reused job
   */
  public RemoteJobHandle submit(Class<? extends RemoteFunction> function,
                                Arguments arguments,
                                Set<String> hashIgnore,
                                RemoteProfile profile,
                                Path workingDirectory) {
    requireNonNull(profile, "profile must not be null");
    var call = RemoteCall.of(function, arguments, hashIgnore);

    var outputs = new ArrayList<>(profile.outputFiles());
    if (workingDirectory != null && !outputs.contains(workingDirectory.toString())) {
      outputs.add(workingDirectory.toString());
    }
    var spec = new JobSpec(call, profile, outputs, hashIgnore);

    var broker = config.brokers().get(profile.systemName());
    var handle = broker.submit(spec);
    logger.info("Remote job {} on {} for {} (hash {})", handle.jobId(), profile.systemName(), function.getSimpleName(), call.hash());
    return handle;
  }

  /**
   * Waits for a job, re-emits its output streams, decodes its result and marks it processed.
   *
   * @return the value returned by the remote function
   */
  public Object fetch(RemoteJobHandle handle, RemoteProfile profile) {
    var broker = config.brokers().get(handle.systemName());
    var result = broker.awaitResult(handle, profile.timeout(), profile.checkInterval());

    if (!result.stdout().isEmpty()) {
      out.print(result.stdout());
      out.flush();
    }
    if (!result.stderr().isEmpty()) {
      err.print(result.stderr());
      err.flush();
    }

    JobOutcome outcome;
    try {
      outcome = RemoteCallSerializer.outcomeFromJson(result.result());
    } catch (JsonParseException e) {
      throw new RemoteJobException("Unreadable result of remote job " + handle.jobId(), e);
    }
    if (outcome instanceof JobOutcome.Error error) {
      throw new RemoteJobException("Remote job " + handle.jobId() + " failed: " + error.message());
    }

    broker.markProcessed(handle);
    logger.info("Remote job {} processed", handle.jobId());
    return ((JobOutcome.Success) outcome).result();
  }

  <O> RemoteJobHandle submit(DispatchRequest<O> request, RemoteProfile profile) {
    if (request.initializer().isPresent()) {
      logger.debug("Initializer not used for remote dispatch, the job runs in a fresh environment");
    }
    var items = materialize(request.iterable());
    var arguments = RemoteDispatchFunction.bundle(request, items);
    return submit(RemoteDispatchFunction.class, arguments, request.hashIgnore(), profile, request.workingDirectory().orElse(null));
  }

  @SuppressWarnings("unchecked")
  <O> List<O> fetchOutputs(RemoteJobHandle handle, RemoteProfile profile) {
    var result = fetch(handle, profile);
    if (result == null) {
      return List.of();
    }
    if (!(result instanceof List<?>)) {
      throw new RemoteJobException("Remote job " + handle.jobId() + " returned " + result.getClass().getName() + " instead of a list");
    }
    return (List<O>) result;
  }

  private static List<?> materialize(Iterable<?> iterable) {
    if (iterable instanceof InputSet<?> inputSet) {
      return inputSet.inMemory();
    }
    var items = new ArrayList<>();
    iterable.forEach(items::add);
    return items;
  }
}

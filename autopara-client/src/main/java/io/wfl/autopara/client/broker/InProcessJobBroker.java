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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.wfl.autopara.domain.RemoteJobException;
import io.wfl.autopara.domain.RemoteJobTimeoutException;
import io.wfl.autopara.domain.job.JobFiles;
import io.wfl.autopara.domain.job.JobOutcome;
import io.wfl.autopara.domain.job.JobRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * {@link JobBroker} running jobs on background threads of the current JVM.
 * <p>
 * Jobs go through the same job directories as queued jobs ({@link JobStore}), so job reuse,
 * processed marks and results survive a restart of the submitting process. The call bundle is run
 * by {@link JobRunner} on a daemon thread named {@code autopara-job-<n>}.
 * </p>
 * <p>
 * Only jobs run by this broker instance can still make progress. A pending or running record left
 * behind by another process is resubmitted.
 * </p>
 * <p>
 * Jobs share the submitting process: resource requests, pre/post commands and environment
 * overrides of the profile do not apply and are ignored.
 * </p>
 */
public final class InProcessJobBroker implements JobBroker {
  private static final Logger logger = LoggerFactory.getLogger(InProcessJobBroker.class);

  private final String name;
  private final JobStore store;
  private final JobRunner runner;
  private final ExecutorService executor;
  private final Set<String> active = ConcurrentHashMap.newKeySet();

  public InProcessJobBroker(String name, Path root) {
    this(name, root, 1);
  }

  public InProcessJobBroker(String name, Path root, int threads) {
    this.name = requireNonNull(name, "name must not be null");
    this.store = new JobStore(root);
    this.runner = new JobRunner();
    var factory = new ThreadFactoryBuilder().setNameFormat("autopara-job-%d").setDaemon(true).build();
    this.executor = Executors.newFixedThreadPool(threads, factory);
  }

  @Override
  public String name() {
    return name;
  }

  public JobStore store() {
    return store;
  }

  @Override
  public synchronized RemoteJobHandle submit(JobSpec spec) {
    requireNonNull(spec, "spec must not be null");
    var handle = new RemoteJobHandle(name, spec.jobId(), spec.callHash());

    var existing = store.read(spec.jobId());
    if (existing.isPresent() && !existing.get().state().requiresResubmission()) {
      var state = existing.get().state();
      if (state.isTerminal() || active.contains(spec.jobId())) {
        logger.info("Reusing job {} in state {}", spec.jobId(), state);
        return handle;
      }
      logger.warn("Resubmitting job {} left in state {} by another process", spec.jobId(), state);
    }

    var jobDir = store.stage(spec);
    store.write(JobRecord.pending(spec));
    logger.info("Submitted in-process job {} to {}", spec.jobId(), jobDir);

    active.add(spec.jobId());
    executor.execute(() -> run(spec.jobId(), jobDir));
    return handle;
  }

  private void run(String jobId, Path jobDir) {
    store.update(jobId, JobState.RUNNING, null);
    try {
      var outcome = runner.run(jobDir);
      if (outcome instanceof JobOutcome.Error error) {
        writeStream(JobFiles.stderr(jobDir), error.message());
        store.update(jobId, JobState.FAILED, error.message());
      } else {
        store.update(jobId, JobState.COMPLETED, null);
      }
    } catch (RuntimeException e) {
      logger.error("In-process job {} failed", jobId, e);
      writeStream(JobFiles.stderr(jobDir), String.valueOf(e));
      store.update(jobId, JobState.FAILED, e.getMessage());
    } finally {
      active.remove(jobId);
    }
  }

  private static void writeStream(Path file, String content) {
    try {
      Files.writeString(file, content + System.lineSeparator(), UTF_8);
    } catch (IOException e) {
      logger.warn("Could not write {}", file, e);
    }
  }

  @Override
  public JobState status(RemoteJobHandle handle) {
    return store.require(handle.jobId()).state();
  }

  @Override
  public JobResult awaitResult(RemoteJobHandle handle, Duration timeout, Duration pollInterval) {
    var deadline = System.nanoTime() + timeout.toNanos();
    var record = store.require(handle.jobId());
    while (!record.state().isTerminal()) {
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        throw new RemoteJobTimeoutException(handle.jobId(), timeout);
      }
      sleep(Math.min(pollInterval.toNanos(), remaining));
      record = store.require(handle.jobId());
    }

    if (!record.state().isSuccess()) {
      throw new RemoteJobException("Remote job " + handle.jobId() + " ended in state " + record.state()
                                   + (record.message() != null ? ": " + record.message() : ""));
    }
    JobStore.verifyOutputs(handle.jobId(), Path.of(""), record.outputs());
    return store.result(handle.jobId());
  }

  @Override
  public void markProcessed(RemoteJobHandle handle) {
    store.update(handle.jobId(), JobState.PROCESSED, null);
    logger.debug("Marked job {} as processed", handle.jobId());
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }

  static void sleep(long nanos) {
    try {
      Thread.sleep(Math.max(1, nanos / 1_000_000));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RemoteJobException("Interrupted while waiting for remote job", e);
    }
  }
}

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
package io.wfl.autopara.client.broker.slurm;

import io.wfl.autopara.client.broker.JobBroker;
import io.wfl.autopara.client.broker.JobRecord;
import io.wfl.autopara.client.broker.JobResult;
import io.wfl.autopara.client.broker.JobSpec;
import io.wfl.autopara.client.broker.JobState;
import io.wfl.autopara.client.broker.JobStore;
import io.wfl.autopara.client.broker.RemoteJobHandle;
import io.wfl.autopara.domain.RemoteJobException;
import io.wfl.autopara.domain.RemoteJobTimeoutException;
import io.wfl.autopara.domain.command.ShellQuoting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * {@link JobBroker} submitting jobs to a Slurm cluster with {@code sbatch}, and tracking them with
 * {@code squeue} and {@code sacct}.
 * <p>
 * Each job gets a directory under {@link SlurmBrokerConfig#jobRoot()} holding the call bundle, the
 * batch script and, once the job ran, its result and captured output. The batch script runs the
 * worker entry point on that directory. Commands go through a {@link CommandRunner}, over ssh when
 * {@link SlurmBrokerConfig#sshHost()} is set.
 * </p>
 */
public final class SlurmJobBroker implements JobBroker {
  private static final Logger logger = LoggerFactory.getLogger(SlurmJobBroker.class);

  static final String SCRIPT_FILE = "job.sbatch";
  private static final Pattern JOB_ID_PATTERN = Pattern.compile("Submitted batch job (\\d+)");

  private final SlurmBrokerConfig config;
  private final CommandRunner commands;
  private final JobStore store;

  public SlurmJobBroker(SlurmBrokerConfig config) {
    this(config, new ProcessCommandRunner());
  }

  public SlurmJobBroker(SlurmBrokerConfig config, CommandRunner commands) {
    this.config = requireNonNull(config, "config must not be null");
    this.commands = requireNonNull(commands, "commands must not be null");
    this.store = new JobStore(config.jobRoot());
  }

  @Override
  public String name() {
    return config.name();
  }

  @Override
  public synchronized RemoteJobHandle submit(JobSpec spec) {
    requireNonNull(spec, "spec must not be null");
    var handle = new RemoteJobHandle(name(), spec.jobId(), spec.callHash());

    var existing = store.read(spec.jobId());
    if (existing.isPresent()) {
      var state = refresh(existing.get()).state();
      if (!state.requiresResubmission()) {
        logger.info("Reusing Slurm job {} in state {}", spec.jobId(), state);
        return handle;
      }
    }

    var jobDir = store.stage(spec);
    var script = jobDir.resolve(SCRIPT_FILE);
    try {
      Files.writeString(script, SlurmScript.render(spec, jobDir, config), UTF_8);
    } catch (IOException e) {
      throw new RemoteJobException("Failed to write batch script for " + spec.jobId(), e);
    }

    var result = execute("sbatch", script.toString());
    var matcher = JOB_ID_PATTERN.matcher(result.stdout());
    if (!result.isSuccess() || !matcher.find()) {
      throw new RemoteJobException("sbatch failed for " + spec.jobId() + ": " + result.stdout() + result.stderr());
    }
    var slurmId = matcher.group(1);
    store.write(JobRecord.pending(spec).withExternalId(slurmId));
    logger.info("Submitted Slurm job {} as {}", spec.jobId(), slurmId);
    return handle;
  }

  @Override
  public JobState status(RemoteJobHandle handle) {
    return refresh(store.require(handle.jobId())).state();
  }

  @Override
  public JobResult awaitResult(RemoteJobHandle handle, Duration timeout, Duration pollInterval) {
    var deadline = System.nanoTime() + timeout.toNanos();
    var record = refresh(store.require(handle.jobId()));
    while (!record.state().isTerminal()) {
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        throw new RemoteJobTimeoutException(handle.jobId(), timeout);
      }
      sleep(Math.min(pollInterval.toNanos(), remaining));
      record = refresh(store.require(handle.jobId()));
    }

    if (!record.state().isSuccess()) {
      throw new RemoteJobException("Slurm job " + handle.jobId() + " (" + record.externalId() + ") ended in state "
                                   + record.state() + (record.message() != null ? ": " + record.message() : ""));
    }
    JobStore.verifyOutputs(handle.jobId(), config.workingDirectory(), record.outputs());
    return store.result(handle.jobId());
  }

  @Override
  public void markProcessed(RemoteJobHandle handle) {
    store.update(handle.jobId(), JobState.PROCESSED, null);
  }

  private JobRecord refresh(JobRecord record) {
    if (record.state().isTerminal() || record.externalId() == null) {
      return record;
    }
    var state = queryState(record.externalId());
    if (state == record.state()) {
      return record;
    }
    var updated = record.withState(state);
    store.write(updated);
    logger.debug("Slurm job {} ({}) is now {}", record.jobId(), record.externalId(), state);
    return updated;
  }

  private JobState queryState(String slurmId) {
    var queued = execute("squeue", "-h", "-j", slurmId, "-o", "%T");
    var line = firstLine(queued.stdout());
    if (queued.isSuccess() && !line.isEmpty()) {
      return mapSlurmState(line);
    }
    var accounted = execute("sacct", "-n", "-P", "-X", "-j", slurmId, "-o", "State");
    line = firstLine(accounted.stdout());
    if (line.isEmpty()) {
      return JobState.PENDING;
    }
    return mapSlurmState(line.split("\\s+")[0]);
  }

  static JobState mapSlurmState(String slurmState) {
    return switch (slurmState.trim().toUpperCase(Locale.ROOT)) {
      case "PENDING", "CONFIGURING", "REQUEUED", "RESV_DEL_HOLD", "REQUEUE_HOLD" -> JobState.PENDING;
      case "RUNNING", "COMPLETING", "STAGE_OUT", "SUSPENDED", "RESIZING" -> JobState.RUNNING;
      case "COMPLETED" -> JobState.COMPLETED;
      case "FAILED", "NODE_FAIL", "OUT_OF_MEMORY", "DEADLINE", "BOOT_FAIL" -> JobState.FAILED;
      case "CANCELLED", "PREEMPTED", "REVOKED" -> JobState.CANCELLED;
      case "TIMEOUT" -> JobState.TIMEOUT;
      default -> JobState.PENDING;
    };
  }

  private CommandRunner.CommandResult execute(String... command) {
    List<String> full = new ArrayList<>();
    if (config.sshHost() != null) {
      full.add("ssh");
      full.add(config.sshHost());
      full.add(String.join(" ", List.of(command).stream().map(ShellQuoting::quote).toList()));
    } else {
      full.addAll(List.of(command));
    }
    return commands.run(full);
  }

  private static String firstLine(String output) {
    return output == null ? "" : output.strip().lines().findFirst().orElse("").trim();
  }

  private static void sleep(long nanos) {
    try {
      Thread.sleep(Math.max(1, nanos / 1_000_000));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RemoteJobException("Interrupted while waiting for Slurm job", e);
    }
  }
}

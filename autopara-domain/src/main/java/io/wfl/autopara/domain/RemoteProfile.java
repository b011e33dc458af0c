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
package io.wfl.autopara.domain;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Immutable configuration of one remote dispatch.
 * <p>
 * A profile is resolved once per dispatch call, either passed explicitly or selected from the
 * environment-supplied profile table, and is owned by the remote backend for the duration of one job.
 * </p>
 *
 * <p>Defaults applied by the compact constructor:</p>
 * <ul>
 *   <li>{@code resources}: {@link ResourceRequest#DEFAULT}</li>
 *   <li>lists and maps: empty</li>
 *   <li>{@code timeout}: 3600 s; {@code checkInterval}: 30 s</li>
 * </ul>
 *
 * @param systemName    name of the target system, used to select the job broker; must not be blank
 * @param jobName       base name of the submitted job; must not be blank
 * @param resources     resources requested from the queue
 * @param preCommands   shell commands run in the job before the payload
 * @param postCommands  shell commands run in the job after the payload
 * @param envVars       environment overrides exported in the job
 * @param inputFiles    files staged in before the job runs
 * @param outputFiles   files or directories staged out after the job completes
 * @param headerExtra   extra lines appended to the batch script header
 * @param exactFit      whether the resource request must be matched exactly by a partition
 * @param partialNode   whether the job may share a node with other jobs
 * @param timeout       how long a caller waits for the result before giving up
 * @param checkInterval polling interval while waiting
 * @see RemoteProfiles
 */
public record RemoteProfile(
  String systemName,
  String jobName,
  ResourceRequest resources,
  List<String> preCommands,
  List<String> postCommands,
  Map<String, String> envVars,
  List<String> inputFiles,
  List<String> outputFiles,
  List<String> headerExtra,
  boolean exactFit,
  boolean partialNode,
  Duration timeout,
  Duration checkInterval
) {
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(3600);
  public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(30);

  public RemoteProfile {
    requireNonNull(systemName, "systemName must not be null");
    requireNonNull(jobName, "jobName must not be null");
    if (systemName.isBlank()) throw new IllegalArgumentException("systemName must not be blank");
    if (jobName.isBlank()) throw new IllegalArgumentException("jobName must not be blank");

    resources = resources == null ? ResourceRequest.DEFAULT : resources;
    preCommands = preCommands == null ? List.of() : List.copyOf(preCommands);
    postCommands = postCommands == null ? List.of() : List.copyOf(postCommands);
    envVars = envVars == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(envVars));
    inputFiles = inputFiles == null ? List.of() : List.copyOf(inputFiles);
    outputFiles = outputFiles == null ? List.of() : List.copyOf(outputFiles);
    headerExtra = headerExtra == null ? List.of() : List.copyOf(headerExtra);
    timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
    checkInterval = checkInterval == null ? DEFAULT_CHECK_INTERVAL : checkInterval;

    if (timeout.isNegative()) throw new IllegalArgumentException("timeout must not be negative");
    if (checkInterval.isZero() || checkInterval.isNegative()) {
      throw new IllegalArgumentException("checkInterval must be > 0, got: " + checkInterval);
    }
  }

  /**
   * Minimal profile: system and job name, defaults for everything else.
   */
  public static RemoteProfile of(String systemName, String jobName) {
    return new RemoteProfile(systemName, jobName, null, null, null, null, null, null, null, true, false, null, null);
  }

  /**
   * Returns a copy whose output files also contain {@code extra} (duplicates skipped).
   */
  public RemoteProfile withAdditionalOutputFiles(List<String> extra) {
    var merged = new ArrayList<>(outputFiles);
    extra.stream().filter(f -> !merged.contains(f)).forEach(merged::add);
    return new RemoteProfile(systemName, jobName, resources, preCommands, postCommands, envVars, inputFiles,
                             merged, headerExtra, exactFit, partialNode, timeout, checkInterval);
  }

  public RemoteProfile withTimeout(Duration timeout, Duration checkInterval) {
    return new RemoteProfile(systemName, jobName, resources, preCommands, postCommands, envVars, inputFiles,
                             outputFiles, headerExtra, exactFit, partialNode, timeout, checkInterval);
  }
}

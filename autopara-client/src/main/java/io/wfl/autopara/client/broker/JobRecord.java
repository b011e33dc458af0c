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

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Persistent status of one job, stored as {@value JobStore#RECORD_FILE} in its job directory.
 *
 * @param jobId      broker-independent job identifier
 * @param jobName    job name from the remote profile
 * @param callHash   content hash of the call
 * @param state      last known state
 * @param externalId identifier in the underlying queue system, if any
 * @param message    failure details, if any
 * @param outputs    declared output files, checked once the job has completed
 */
public record JobRecord(
  String jobId,
  String jobName,
  String callHash,
  JobState state,
  String externalId,
  String message,
  List<String> outputs
) {

  public JobRecord {
    requireNonNull(jobId, "jobId must not be null");
    requireNonNull(callHash, "callHash must not be null");
    requireNonNull(state, "state must not be null");
    outputs = outputs == null ? List.of() : List.copyOf(outputs);
  }

  public static JobRecord pending(JobSpec spec) {
    return new JobRecord(spec.jobId(), spec.jobName(), spec.callHash(), JobState.PENDING, null, null, spec.outputFiles());
  }

  public JobRecord withState(JobState state) {
    return new JobRecord(jobId, jobName, callHash, state, externalId, message, outputs);
  }

  public JobRecord withState(JobState state, String message) {
    return new JobRecord(jobId, jobName, callHash, state, externalId, message, outputs);
  }

  public JobRecord withExternalId(String externalId) {
    return new JobRecord(jobId, jobName, callHash, state, externalId, message, outputs);
  }
}

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

import io.wfl.autopara.domain.RemoteProfile;
import io.wfl.autopara.domain.job.RemoteCall;

import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Everything a {@link JobBroker} needs to run one remote call as a batch job.
 * <p>
 * The profile carries the job name, pre/post commands, environment overrides, resource request,
 * header extras, input files and the exact-fit and node-sharing flags. {@code outputFiles} is the
 * profile's list completed with the working directory of the operation, when it has one.
 * </p>
 *
 * @param call        the call bundle to run
 * @param profile     the resolved remote profile
 * @param outputFiles files and directories the job must produce
 * @param hashIgnore  argument names left out of {@link RemoteCall#hash()}
 */
public record JobSpec(RemoteCall call, RemoteProfile profile, List<String> outputFiles, Set<String> hashIgnore) {

  public JobSpec {
    requireNonNull(call, "call must not be null");
    requireNonNull(profile, "profile must not be null");
    outputFiles = outputFiles == null ? List.of() : List.copyOf(outputFiles);
    hashIgnore = hashIgnore == null ? Set.of() : Set.copyOf(hashIgnore);
  }

  public String jobName() {
    return profile.jobName();
  }

  public String callHash() {
    return call.hash();
  }

  /**
   * Broker-independent job identifier: the job name followed by the first 16 characters of the
   * call hash. Equal calls get equal identifiers.
   */
  public String jobId() {
    var hash = call.hash();
    return profile.jobName() + "_" + hash.substring(0, Math.min(16, hash.length()));
  }
}

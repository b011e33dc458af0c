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

import static java.util.Objects.requireNonNull;

/**
 * Identifies one submitted remote job.
 *
 * @param systemName the broker the job was submitted to
 * @param jobId      broker-scoped job identifier
 * @param callHash   content hash of the submitted call
 */
public record RemoteJobHandle(String systemName, String jobId, String callHash) {

  public RemoteJobHandle {
    requireNonNull(systemName, "systemName must not be null");
    requireNonNull(jobId, "jobId must not be null");
    requireNonNull(callHash, "callHash must not be null");
  }
}

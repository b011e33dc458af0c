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

/**
 * Signals that waiting for a remote job exceeded the profile timeout.
 * <p>
 * The job itself keeps running: there is no cancellation primitive. Dispatching the same call again
 * later finds the existing job (same name and hash) and fetches its result without resubmitting.
 * </p>
 */
public class RemoteJobTimeoutException extends RemoteJobException {
  private final String jobId;
  private final Duration timeout;

  public RemoteJobTimeoutException(String jobId, Duration timeout) {
    super("Timed out after " + timeout + " waiting for remote job " + jobId);
    this.jobId = jobId;
    this.timeout = timeout;
  }

  public String jobId() {
    return jobId;
  }

  public Duration timeout() {
    return timeout;
  }
}

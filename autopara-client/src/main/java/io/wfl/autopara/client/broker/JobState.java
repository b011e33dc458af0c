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

/**
 * Possible states of a remote job during its lifecycle.
 */
public enum JobState {
  /** Job is waiting in queue to be scheduled */
  PENDING,

  /** Job is currently executing */
  RUNNING,

  /** Job finished successfully */
  COMPLETED,

  /** Job finished with an error */
  FAILED,

  /** Job was cancelled outside of this process */
  CANCELLED,

  /** Job exceeded its batch time limit */
  TIMEOUT,

  /** Job completed and its result was consumed by the submitting side */
  PROCESSED;

  /**
   * Returns true if this is a terminal state (job will not change state again, apart from being
   * marked processed).
   */
  public boolean isTerminal() {
    return this != PENDING && this != RUNNING;
  }

  /**
   * Returns true if this state holds a usable result.
   */
  public boolean isSuccess() {
    return this == COMPLETED || this == PROCESSED;
  }

  /**
   * Returns true if an identical submission must start a new job instead of reusing this one.
   */
  public boolean requiresResubmission() {
    return this == FAILED || this == CANCELLED || this == TIMEOUT;
  }
}

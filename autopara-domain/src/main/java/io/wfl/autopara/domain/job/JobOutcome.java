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
package io.wfl.autopara.domain.job;

/**
 * Outcome of running one {@link RemoteCall} inside a job.
 * <p>
 * The job runner writes it to the job's result file; the submitting side reads it back once the
 * job has finished.
 * </p>
 */
public sealed interface JobOutcome {

  static Success success(Object result) {
    return new Success(result);
  }

  static Error error(String message) {
    return new Error(message == null ? "Unknown error" : message);
  }

  static Error error(Throwable throwable) {
    String msg = (throwable == null)
      ? "Unknown error"
      : (throwable.getMessage() != null ? throwable.getMessage() : throwable.toString());
    return new Error(msg);
  }

  /**
   * @param result value returned by the remote function; may be {@code null}
   */
  record Success(Object result) implements JobOutcome {}

  record Error(String message) implements JobOutcome {
    public Error {
      if (message == null) {
        message = "Unknown error";
      }
    }
  }
}

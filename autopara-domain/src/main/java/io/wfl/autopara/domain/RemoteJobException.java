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

/**
 * Signals that a remote batch job did not produce a usable result.
 * <p>
 * Raised when the job broker reports a failed job, when the result written by the job cannot be
 * read, or when an output file declared for stage-out is missing after completion. No partial
 * result is ever returned alongside this exception.
 * </p>
 */
public class RemoteJobException extends AutoparaException {

  public RemoteJobException(String message) {
    super(message);
  }

  public RemoteJobException(String message, Throwable cause) {
    super(message, cause);
  }
}

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
 * Base exception for all autopara dispatch operations.
 * <p>
 * This unchecked exception is thrown when a dispatch call cannot produce its output: an operation
 * failed inside a worker, a remote job could not be submitted or did not complete, or an external
 * process exited abnormally. It can wrap lower-level exceptions (I/O, serialization, interruption)
 * to provide additional context about the failed step.
 * </p>
 * <p>
 * Recoverable conditions such as a cache miss or an ambiguous remote profile are never reported
 * through this exception; they are logged and absorbed where they occur.
 * </p>
 *
 * @see RuntimeException
 */
public class AutoparaException extends RuntimeException {

  /**
   * Creates a new exception with the specified error message.
   *
   * @param message the detail message explaining the error; should not be {@code null}
   */
  public AutoparaException(String message) {
    super(message);
  }

  /**
   * Creates a new exception with the specified error message and cause.
   *
   * @param message the detail message explaining the error; should not be {@code null}
   * @param cause   the underlying cause of this exception; may be {@code null}
   */
  public AutoparaException(String message, Throwable cause) {
    super(message, cause);
  }
}

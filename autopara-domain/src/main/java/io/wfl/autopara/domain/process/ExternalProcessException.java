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
package io.wfl.autopara.domain.process;

import io.wfl.autopara.domain.AutoparaException;

/**
 * Signals that an external executable exited with a non-zero status or could not be started.
 * <p>
 * Captured standard output and error are echoed to the caller's streams before this exception is
 * thrown.
 * </p>
 */
public class ExternalProcessException extends AutoparaException {
  private final int exitCode;

  public ExternalProcessException(String message, int exitCode) {
    super(message);
    this.exitCode = exitCode;
  }

  public ExternalProcessException(String message, Throwable cause) {
    super(message, cause);
    this.exitCode = -1;
  }

  /**
   * @return the exit status of the process, or {@code -1} if it never ran to completion
   */
  public int exitCode() {
    return exitCode;
  }
}

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
package io.wfl.autopara.client.broker.slurm;

import java.util.List;

/**
 * Runs the queue system's command-line tools.
 */
@FunctionalInterface
public interface CommandRunner {

  /**
   * Runs {@code command} to completion.
   *
   * @param command program and arguments
   * @return exit code and captured output
   * @throws io.wfl.autopara.domain.RemoteJobException if the command cannot be started or is interrupted
   */
  CommandResult run(List<String> command);

  /**
   * @param exitCode process exit status
   * @param stdout   captured standard output
   * @param stderr   captured standard error
   */
  record CommandResult(int exitCode, String stdout, String stderr) {
    public boolean isSuccess() {
      return exitCode == 0;
    }
  }
}

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

import java.nio.file.Path;

/**
 * File layout of a job directory, shared by the submitting side and the job runner.
 */
public final class JobFiles {
  public static final String CALL_FILE = "call.json";
  public static final String RESULT_FILE = "result.json";
  public static final String STDOUT_FILE = "stdout";
  public static final String STDERR_FILE = "stderr";

  private JobFiles() {
  }

  public static Path call(Path jobDir) {
    return jobDir.resolve(CALL_FILE);
  }

  public static Path result(Path jobDir) {
    return jobDir.resolve(RESULT_FILE);
  }

  public static Path stdout(Path jobDir) {
    return jobDir.resolve(STDOUT_FILE);
  }

  public static Path stderr(Path jobDir) {
    return jobDir.resolve(STDERR_FILE);
  }
}

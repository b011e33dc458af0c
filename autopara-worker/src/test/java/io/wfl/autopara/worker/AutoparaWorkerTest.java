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
package io.wfl.autopara.worker;

import io.wfl.autopara.domain.Arguments;
import io.wfl.autopara.domain.job.JobFiles;
import io.wfl.autopara.domain.job.JobOutcome;
import io.wfl.autopara.domain.job.RemoteCall;
import io.wfl.autopara.domain.job.RemoteCallSerializer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

class AutoparaWorkerTest {

  @TempDir
  Path jobDir;

  private final AutoparaWorker worker = new AutoparaWorker();

  @Test
  @DisplayName("should run the staged call and exit with success")
  void should_run_staged_call() throws IOException {
    // Given
    stage("remote");

    // When
    int status = worker.run(jobDir);

    // Then
    assertThat(status).isEqualTo(AutoparaWorker.SUCCESS);
    assertThat(RemoteCallSerializer.readOutcome(JobFiles.result(jobDir))).isEqualTo(JobOutcome.success("REMOTE"));
  }

  @Test
  @DisplayName("should record the error and exit with failure when the call throws")
  void should_record_error() throws IOException {
    // Given
    stage("");

    // When
    int status = worker.run(jobDir);

    // Then
    assertThat(status).isEqualTo(AutoparaWorker.FAILURE);
    assertThat(RemoteCallSerializer.readOutcome(JobFiles.result(jobDir))).isEqualTo(JobOutcome.error("nothing to convert"));
  }

  @Test
  @DisplayName("should exit with failure when the call bundle is unreadable")
  void should_fail_on_unreadable_call() throws IOException {
    // Given
    Files.writeString(JobFiles.call(jobDir), "{not json", UTF_8);

    // When / Then
    assertThat(worker.run(jobDir)).isEqualTo(AutoparaWorker.FAILURE);
    assertThat(JobFiles.result(jobDir)).doesNotExist();
  }

  @Test
  @DisplayName("should exit with failure when the job directory is missing")
  void should_fail_on_missing_directory() {
    assertThat(worker.run(jobDir.resolve("missing"))).isEqualTo(AutoparaWorker.FAILURE);
  }

  private void stage(String text) throws IOException {
    var call = RemoteCall.of(UppercaseFunction.class, Arguments.positional(text), Set.of());
    RemoteCallSerializer.write(call, JobFiles.call(jobDir));
  }
}

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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExternalProcessTest {

  @TempDir
  Path tempDir;

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();

  @Test
  @DisplayName("should capture and echo output of a successful command")
  void should_capture_and_echo_output() throws Exception {
    // Given
    var stdout = tempDir.resolve("logs/run.stdout");
    var stderr = tempDir.resolve("logs/run.stderr");

    // When
    var exitCode = ExternalProcess.shell("echo hello; echo oops >&2")
                                  .redirectTo(stdout, stderr)
                                  .echoTo(new PrintStream(out, true, UTF_8), new PrintStream(err, true, UTF_8))
                                  .run();

    // Then
    assertThat(exitCode).isZero();
    assertThat(Files.readString(stdout)).isEqualTo("hello\n");
    assertThat(out.toString(UTF_8)).contains("STDOUT hello");
    assertThat(err.toString(UTF_8)).contains("STDERR oops");
  }

  @Test
  @DisplayName("should pass environment overrides to the child process only")
  void should_pass_environment_to_child_only() throws Exception {
    var stdout = tempDir.resolve("env.stdout");

    ExternalProcess.shell("echo $AUTOPARA_TEST_THREADS")
                   .redirectTo(stdout, tempDir.resolve("env.stderr"))
                   .environment(Map.of("AUTOPARA_TEST_THREADS", "4"))
                   .echoTo(new PrintStream(out, true, UTF_8), new PrintStream(err, true, UTF_8))
                   .run();

    assertThat(Files.readString(stdout).trim()).isEqualTo("4");
    assertThat(System.getenv("AUTOPARA_TEST_THREADS")).isNull();
  }

  @Test
  @DisplayName("should raise with the exit code when the command fails")
  void should_raise_on_non_zero_exit() {
    var process = ExternalProcess.shell("exit 3")
                                 .redirectTo(tempDir.resolve("f.stdout"), tempDir.resolve("f.stderr"))
                                 .echoTo(new PrintStream(out, true, UTF_8), new PrintStream(err, true, UTF_8));

    assertThatThrownBy(process::run)
      .isInstanceOf(ExternalProcessException.class)
      .hasMessageContaining("exited with code 3")
      .extracting(e -> ((ExternalProcessException) e).exitCode())
      .isEqualTo(3);
  }

  @Test
  @DisplayName("should echo output that is not valid UTF-8")
  void should_echo_output_that_is_not_valid_utf8() {
    // When
    var exitCode = ExternalProcess.shell("printf 'caf\\351\\n'")
                                  .redirectTo(tempDir.resolve("latin.stdout"), tempDir.resolve("latin.stderr"))
                                  .echoTo(new PrintStream(out, true, UTF_8), new PrintStream(err, true, UTF_8))
                                  .run();

    // Then
    assertThat(exitCode).isZero();
    assertThat(out.toString(UTF_8)).contains("STDOUT caf");
  }

  @Test
  @DisplayName("should raise the exit code even when failing output is not valid UTF-8")
  void should_raise_the_exit_code_when_failing_output_is_not_valid_utf8() {
    // Given
    var process = ExternalProcess.shell("printf 'erreur \\351\\n' >&2; exit 4")
                                 .redirectTo(tempDir.resolve("bad.stdout"), tempDir.resolve("bad.stderr"))
                                 .echoTo(new PrintStream(out, true, UTF_8), new PrintStream(err, true, UTF_8));

    // When / Then
    assertThatThrownBy(process::run)
      .isInstanceOfSatisfying(ExternalProcessException.class, e -> assertThat(e.exitCode()).isEqualTo(4));
    assertThat(err.toString(UTF_8)).contains("STDERR erreur");
  }

  @Test
  @DisplayName("should require output redirection before running")
  void should_require_redirection() {
    assertThatThrownBy(() -> ExternalProcess.shell("true").run()).isInstanceOf(IllegalStateException.class);
  }
}

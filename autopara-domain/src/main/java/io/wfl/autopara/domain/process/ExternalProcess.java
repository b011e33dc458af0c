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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Runs one external executable through {@code /bin/sh -c}, with standard output and error
 * redirected to files.
 * <p>
 * The command line is passed to the shell as-is, so it is expected to be built with
 * {@link io.wfl.autopara.domain.command.CommandEncoder} or otherwise shell-quoted.
 * </p>
 *
 * <h2>Output echo</h2>
 * <p>
 * After the process exits, each captured line is re-emitted to the configured streams with a
 * {@code STDOUT}/{@code STDERR} prefix. On a non-zero exit the echo happens before the
 * {@link ExternalProcessException} is thrown, so the caller always sees what the executable printed.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ExternalProcess.shell("fit_exec --outfile_base run/pot")
 *                .redirectTo(Path.of("run/pot.stdout"), Path.of("run/pot.stderr"))
 *                .environment(Map.of("JULIA_NUM_THREADS", "4"))
 *                .run();
 * }</pre>
 */
public final class ExternalProcess {
  private static final Logger logger = LoggerFactory.getLogger(ExternalProcess.class);

  private final String command;
  private final Map<String, String> environment = new LinkedHashMap<>();
  private Path directory;
  private Path stdoutFile;
  private Path stderrFile;
  private PrintStream echoOut = System.out;
  private PrintStream echoErr = System.err;

  private ExternalProcess(String command) {
    this.command = command;
  }

  public static ExternalProcess shell(String command) {
    requireNonNull(command, "command must not be null");
    if (command.isBlank()) {
      throw new IllegalArgumentException("command must not be blank");
    }
    return new ExternalProcess(command);
  }

  public ExternalProcess redirectTo(Path stdoutFile, Path stderrFile) {
    this.stdoutFile = requireNonNull(stdoutFile, "stdoutFile must not be null");
    this.stderrFile = requireNonNull(stderrFile, "stderrFile must not be null");
    return this;
  }

  /**
   * Adds environment overrides for the child process only; the current process environment is left untouched.
   */
  public ExternalProcess environment(Map<String, String> overrides) {
    environment.putAll(requireNonNull(overrides, "overrides must not be null"));
    return this;
  }

  public ExternalProcess directory(Path directory) {
    this.directory = directory;
    return this;
  }

  public ExternalProcess echoTo(PrintStream out, PrintStream err) {
    this.echoOut = out;
    this.echoErr = err;
    return this;
  }

  /**
   * Runs the process to completion.
   *
   * @return the exit status (always 0)
   * @throws ExternalProcessException if the process cannot be started, is interrupted, or exits non-zero
   */
  public int run() {
    if (stdoutFile == null) {
      throw new IllegalStateException("redirectTo(...) must be called before run()");
    }
    logger.info("Running external command: {}", command);

    var builder = new ProcessBuilder(List.of("/bin/sh", "-c", command))
      .redirectOutput(stdoutFile.toFile())
      .redirectError(stderrFile.toFile());
    if (directory != null) {
      builder.directory(directory.toFile());
    }
    builder.environment().putAll(environment);

    int exitCode;
    try {
      createParent(stdoutFile);
      createParent(stderrFile);
      exitCode = builder.start().waitFor();
    } catch (IOException e) {
      throw new ExternalProcessException("Failed to start external command: " + command, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ExternalProcessException("Interrupted while waiting for external command: " + command, e);
    }

    echo(stdoutFile, "STDOUT", echoOut);
    echo(stderrFile, "STDERR", echoErr);

    if (exitCode != 0) {
      logger.error("External command failed with exit code {}: {}", exitCode, command);
      throw new ExternalProcessException("External command exited with code " + exitCode + ": " + command, exitCode);
    }
    logger.debug("External command completed: {}", command);
    return exitCode;
  }

  private static void createParent(Path file) throws IOException {
    var parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
  }

  private static void echo(Path file, String prefix, PrintStream stream) {
    if (!Files.exists(file)) {
      return;
    }
    try {
      new String(Files.readAllBytes(file), UTF_8).lines()
                                                 .forEach(line -> stream.println(prefix + " " + line));
    } catch (IOException e) {
      logger.warn("Could not read captured {} from {}", prefix, file, e);
    }
  }
}

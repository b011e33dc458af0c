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

import io.wfl.autopara.domain.RemoteJobException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * {@link CommandRunner} starting local processes.
 */
public final class ProcessCommandRunner implements CommandRunner {
  private static final Logger logger = LoggerFactory.getLogger(ProcessCommandRunner.class);

  @Override
  public CommandResult run(List<String> command) {
    logger.debug("Running {}", command);
    try {
      var process = new ProcessBuilder(command).start();
      process.getOutputStream().close();
      var stderr = CompletableFuture.supplyAsync(() -> read(process.getErrorStream()));
      var stdout = read(process.getInputStream());
      int exitCode = process.waitFor();
      return new CommandResult(exitCode, stdout, stderr.join());
    } catch (IOException e) {
      throw new RemoteJobException("Failed to run " + command, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RemoteJobException("Interrupted while running " + command, e);
    }
  }

  private static String read(InputStream stream) {
    try (stream) {
      return new String(stream.readAllBytes(), UTF_8);
    } catch (IOException e) {
      throw new RemoteJobException("Failed to read command output", e);
    }
  }
}

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

import io.wfl.autopara.domain.job.JobOutcome;
import io.wfl.autopara.domain.job.JobRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * Entry point of a queued batch job.
 * <p>
 * The batch script started by a queue broker runs this class with the job directory as its only
 * argument. The worker reads the call bundle from that directory, runs it with {@link JobRunner}
 * and leaves the outcome next to it, where the submitting process picks it up.
 * </p>
 *
 * <h2>Exit Status</h2>
 * <ul>
 *   <li>{@code 0}: the call returned, its result is in the job directory</li>
 *   <li>{@code 1}: the call threw or could not be run; the error outcome is written when possible
 *       and the stack trace goes to standard error</li>
 *   <li>{@code 2}: wrong command line</li>
 * </ul>
 * <p>
 * The function's own standard output is left untouched, since the batch script captures it for
 * the submitting process. Log lines go to standard error.
 * </p>
 */
public final class AutoparaWorker {
  private static final Logger logger = LoggerFactory.getLogger(AutoparaWorker.class);

  static final int SUCCESS = 0;
  static final int FAILURE = 1;
  static final int USAGE = 2;

  private final JobRunner runner;

  public AutoparaWorker() {
    this(new JobRunner());
  }

  AutoparaWorker(JobRunner runner) {
    this.runner = requireNonNull(runner, "runner must not be null");
  }

  public static void main(String[] args) {
    if (args.length != 1) {
      System.err.println("Usage: AutoparaWorker <job directory>");
      System.exit(USAGE);
    }
    System.exit(new AutoparaWorker().run(Path.of(args[0])));
  }

  /**
   * Runs the call bundled in {@code jobDir}.
   *
   * @return the process exit status
   */
  public int run(Path jobDir) {
    requireNonNull(jobDir, "jobDir must not be null");
    var fileName = jobDir.getFileName();
    MDC.put("jobId", fileName != null ? fileName.toString() : jobDir.toString());
    long startTime = System.nanoTime();
    try {
      if (!Files.isDirectory(jobDir)) {
        logger.error("Job directory {} does not exist", jobDir);
        return FAILURE;
      }

      logger.info("Starting job in {}", jobDir);
      var outcome = runner.run(jobDir);
      long duration = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime);

      if (outcome instanceof JobOutcome.Error error) {
        logger.error("Job failed after {}ms: {}", duration, error.message());
        return FAILURE;
      }
      logger.info("Job completed in {}ms", duration);
      return SUCCESS;
    } catch (RuntimeException e) {
      logger.error("Job could not be run: {}", e.getMessage(), e);
      return FAILURE;
    } finally {
      MDC.clear();
    }
  }
}

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

import io.wfl.autopara.domain.AutoparaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs the {@link RemoteCall} staged in a job directory.
 * <p>
 * The runner:
 * </p>
 * <ol>
 *   <li>reads {@value JobFiles#CALL_FILE} from the job directory</li>
 *   <li>loads the {@link RemoteFunction} class by name and instantiates it through its no-arg constructor</li>
 *   <li>invokes it with the staged arguments</li>
 *   <li>writes a {@link JobOutcome} to {@value JobFiles#RESULT_FILE}</li>
 * </ol>
 * <p>
 * Failures of the function itself are recorded as {@link JobOutcome.Error} and returned; only a job
 * directory that cannot be read or written raises an exception.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * This class is stateless and thread-safe.
 * </p>
 */
public final class JobRunner {
  private static final Logger logger = LoggerFactory.getLogger(JobRunner.class);

  /**
   * @param jobDir the job directory holding the call bundle
   * @return the outcome, also written to the result file
   * @throws AutoparaException if the call bundle cannot be read or the outcome cannot be written
   */
  public JobOutcome run(Path jobDir) {
    RemoteCall call;
    try {
      call = RemoteCallSerializer.read(JobFiles.call(jobDir));
    } catch (IOException | RuntimeException e) {
      throw new AutoparaException("Failed to read remote call from " + jobDir, e);
    }
    logger.info("Running remote call: function={}, hash={}", call.function(), call.hash());

    JobOutcome outcome;
    try {
      var function = loadFunction(call.function());
      outcome = JobOutcome.success(function.invoke(call.arguments()));
      logger.info("Remote call succeeded: function={}", call.function());
    } catch (Exception e) {
      logger.error("Remote call failed: function={}", call.function(), e);
      outcome = JobOutcome.error(e);
    }

    try {
      RemoteCallSerializer.write(outcome, JobFiles.result(jobDir));
    } catch (IOException | RuntimeException e) {
      throw new AutoparaException("Failed to write job result to " + jobDir, e);
    }
    return outcome;
  }

  static RemoteFunction loadFunction(String className) {
    try {
      var loader = Thread.currentThread().getContextClassLoader();
      Class<?> clazz = Class.forName(className, true, loader != null ? loader : JobRunner.class.getClassLoader());
      if (!RemoteFunction.class.isAssignableFrom(clazz)) {
        throw new AutoparaException("Class does not implement RemoteFunction: " + className);
      }
      return (RemoteFunction) clazz.getDeclaredConstructor().newInstance();

    } catch (ClassNotFoundException e) {
      throw new AutoparaException("RemoteFunction class not found: " + className, e);
    } catch (NoSuchMethodException e) {
      throw new AutoparaException("RemoteFunction must have a no-arg constructor: " + className, e);
    } catch (AutoparaException e) {
      throw e;
    } catch (Exception e) {
      throw new AutoparaException("Failed to instantiate RemoteFunction: " + e.getMessage(), e);
    }
  }
}

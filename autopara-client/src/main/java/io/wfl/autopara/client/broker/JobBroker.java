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
package io.wfl.autopara.client.broker;

import io.wfl.autopara.domain.RemoteJobException;
import io.wfl.autopara.domain.RemoteJobTimeoutException;

import java.time.Duration;

/**
 * External system that queues, runs and stages files for remote batch jobs.
 * <p>
 * Each broker serves one system name of {@link io.wfl.autopara.domain.RemoteProfile#systemName()}
 * and is looked up through {@link JobBrokerRegistry}.
 * </p>
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #submit(JobSpec)} returns the handle of an existing job when a job with the same
 *       name and call hash was already submitted and did not fail; it never starts a duplicate.</li>
 *   <li>{@link #awaitResult(RemoteJobHandle, Duration, Duration)} blocks until the job finishes,
 *       polling every {@code pollInterval}. A job still running after {@code timeout} raises
 *       {@link RemoteJobTimeoutException} and is left running.</li>
 *   <li>{@link #markProcessed(RemoteJobHandle)} records that the result was consumed. A later
 *       identical submission reuses the processed job and its result.</li>
 * </ul>
 */
public interface JobBroker extends AutoCloseable {

  /**
   * @return the system name this broker serves
   */
  String name();

  /**
   * @throws RemoteJobException if the job cannot be staged or submitted
   */
  RemoteJobHandle submit(JobSpec spec);

  /**
   * @throws RemoteJobException if the job is unknown to this broker
   */
  JobState status(RemoteJobHandle handle);

  /**
   * @throws RemoteJobTimeoutException if the job has not finished within {@code timeout}
   * @throws RemoteJobException        if the job failed, its result is unreadable, or a declared
   *                                   output file is missing
   */
  JobResult awaitResult(RemoteJobHandle handle, Duration timeout, Duration pollInterval);

  void markProcessed(RemoteJobHandle handle);

  @Override
  default void close() {
  }
}

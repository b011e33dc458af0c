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

import java.nio.file.Path;

import static java.util.Objects.requireNonNull;

/**
 * Configuration of a {@link SlurmJobBroker}.
 * <p>
 * Job directories live under {@code jobRoot}, and the job runs from {@code workingDirectory}; both
 * must be visible from the compute nodes under the same paths (shared file system). Relative
 * input and output files of a profile are resolved against {@code workingDirectory}.
 * </p>
 *
 * @param name             system name served by the broker
 * @param jobRoot          root of the job directories
 * @param workingDirectory directory the job runs in; defaults to the current directory
 * @param sshHost          host to run {@code sbatch}/{@code squeue}/{@code sacct} on; {@code null} runs them locally
 * @param javaCommand      java launcher on the compute nodes; defaults to {@code java}
 * @param classpath        classpath of the job, must contain the worker and every remote function;
 *                         defaults to the current JVM's classpath
 * @param workerMainClass  job entry point; defaults to {@value #DEFAULT_WORKER_MAIN_CLASS}
 */
public record SlurmBrokerConfig(
  String name,
  Path jobRoot,
  Path workingDirectory,
  String sshHost,
  String javaCommand,
  String classpath,
  String workerMainClass
) {
  public static final String DEFAULT_WORKER_MAIN_CLASS = "io.wfl.autopara.worker.AutoparaWorker";

  public SlurmBrokerConfig {
    requireNonNull(name, "name must not be null");
    requireNonNull(jobRoot, "jobRoot must not be null");
    workingDirectory = (workingDirectory == null ? Path.of("") : workingDirectory).toAbsolutePath();
    jobRoot = jobRoot.toAbsolutePath();
    javaCommand = javaCommand == null ? "java" : javaCommand;
    classpath = classpath == null ? System.getProperty("java.class.path") : classpath;
    workerMainClass = workerMainClass == null ? DEFAULT_WORKER_MAIN_CLASS : workerMainClass;
  }

  public static SlurmBrokerConfig local(String name, Path jobRoot) {
    return new SlurmBrokerConfig(name, jobRoot, null, null, null, null, null);
  }

  public SlurmBrokerConfig withSshHost(String sshHost) {
    return new SlurmBrokerConfig(name, jobRoot, workingDirectory, sshHost, javaCommand, classpath, workerMainClass);
  }

  public SlurmBrokerConfig withClasspath(String classpath) {
    return new SlurmBrokerConfig(name, jobRoot, workingDirectory, sshHost, javaCommand, classpath, workerMainClass);
  }
}

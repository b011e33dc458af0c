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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.wfl.autopara.domain.RemoteJobException;
import io.wfl.autopara.domain.job.JobFiles;
import io.wfl.autopara.domain.job.RemoteCallSerializer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * On-disk job directories shared by the brokers.
 *
 * <h2>Layout</h2>
 * <pre>
 * &lt;root&gt;/&lt;jobId&gt;/
 *   job.json      status record ({@link JobRecord})
 *   call.json     call bundle
 *   result.json   job outcome, once finished
 *   stdout        captured standard output
 *   stderr        captured standard error
 *   inputs/       staged copies of the profile's input files
 * </pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Record reads and writes are synchronized on the store; a record is replaced atomically.
 * </p>
 */
public final class JobStore {
  public static final String RECORD_FILE = "job.json";
  public static final String INPUTS_DIR = "inputs";

  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

  private final Path root;

  public JobStore(Path root) {
    this.root = requireNonNull(root, "root must not be null");
  }

  public Path root() {
    return root;
  }

  public Path jobDirectory(String jobId) {
    return root.resolve(jobId);
  }

  public synchronized Optional<JobRecord> read(String jobId) {
    var file = jobDirectory(jobId).resolve(RECORD_FILE);
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(GSON.fromJson(Files.readString(file, UTF_8), JobRecord.class));
    } catch (IOException | JsonParseException e) {
      throw new RemoteJobException("Unreadable job record " + file, e);
    }
  }

  public JobRecord require(String jobId) {
    return read(jobId).orElseThrow(() -> new RemoteJobException("Unknown job: " + jobId));
  }

  public synchronized void write(JobRecord record) {
    var dir = jobDirectory(record.jobId());
    try {
      Files.createDirectories(dir);
      var tmp = dir.resolve(RECORD_FILE + ".tmp");
      Files.writeString(tmp, GSON.toJson(record), UTF_8);
      Files.move(tmp, dir.resolve(RECORD_FILE), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new RemoteJobException("Failed to write job record for " + record.jobId(), e);
    }
  }

  public synchronized JobRecord update(String jobId, JobState state, String message) {
    var updated = require(jobId).withState(state, message);
    write(updated);
    return updated;
  }

  /**
   * Creates the job directory, writes the call bundle and copies the input files into
   * {@value #INPUTS_DIR}.
   *
   * @return the job directory
   * @throws RemoteJobException if an input file is missing or the directory cannot be written
   */
  public Path stage(JobSpec spec) {
    var dir = jobDirectory(spec.jobId());
    try {
      Files.createDirectories(dir);
      Files.deleteIfExists(JobFiles.result(dir));
      RemoteCallSerializer.write(spec.call(), JobFiles.call(dir));
      for (var input : spec.profile().inputFiles()) {
        var source = Path.of(input);
        if (!Files.exists(source)) {
          throw new RemoteJobException("Input file to stage does not exist: " + input);
        }
        var target = dir.resolve(INPUTS_DIR).resolve(source.getFileName());
        Files.createDirectories(target.getParent());
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
      }
      return dir;
    } catch (IOException e) {
      throw new RemoteJobException("Failed to stage job " + spec.jobId(), e);
    }
  }

  /**
   * Reads the finished job's outcome and captured streams.
   *
   * @throws RemoteJobException if the outcome is missing or unreadable
   */
  public JobResult result(String jobId) {
    var dir = jobDirectory(jobId);
    JsonElement outcome;
    try {
      outcome = JsonParser.parseString(Files.readString(JobFiles.result(dir), UTF_8));
    } catch (IOException | JsonParseException e) {
      throw new RemoteJobException("Unreadable result of job " + jobId, e);
    }
    return new JobResult(outcome, readIfPresent(JobFiles.stdout(dir)), readIfPresent(JobFiles.stderr(dir)));
  }

  /**
   * Checks the declared outputs of a completed job; relative paths are resolved against {@code base}.
   *
   * @throws RemoteJobException if any of {@code outputFiles} does not exist
   */
  public static void verifyOutputs(String jobId, Path base, List<String> outputFiles) {
    var missing = outputFiles.stream().filter(f -> !Files.exists(base.resolve(f))).toList();
    if (!missing.isEmpty()) {
      throw new RemoteJobException("Job " + jobId + " completed but declared outputs are missing: " + missing);
    }
  }

  private static String readIfPresent(Path file) {
    if (!Files.exists(file)) {
      return "";
    }
    try {
      return Files.readString(file, UTF_8);
    } catch (IOException e) {
      throw new RemoteJobException("Unreadable job output " + file, e);
    }
  }
}

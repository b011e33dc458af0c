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

import io.wfl.autopara.client.broker.JobSpec;
import io.wfl.autopara.domain.DurationParser;
import io.wfl.autopara.domain.ResourceRequest;
import io.wfl.autopara.domain.job.JobFiles;

import java.nio.file.Path;

import static io.wfl.autopara.domain.command.ShellQuoting.quote;

/**
 * Renders the batch script of one job.
 *
 * <h2>Layout</h2>
 * <ol>
 *   <li>{@code #SBATCH} header: job name, Slurm log files, node or task count, time limit,
 *       partitions, cores per task, {@code --exclusive} unless the profile allows partial nodes,
 *       then the profile's header extras</li>
 *   <li>change to the working directory and export the profile's environment overrides</li>
 *   <li>pre commands, the worker, post commands; the script exits with the worker's status</li>
 * </ol>
 */
final class SlurmScript {

  private SlurmScript() {
  }

  static String render(JobSpec spec, Path jobDir, SlurmBrokerConfig config) {
    var profile = spec.profile();
    var resources = profile.resources();

    var sb = new StringBuilder();
    sb.append("#!/bin/bash\n");
    sb.append("#SBATCH --job-name=").append(spec.jobName()).append('\n');
    sb.append("#SBATCH --output=").append(jobDir.resolve("slurm-%j.out")).append('\n');
    sb.append("#SBATCH --error=").append(jobDir.resolve("slurm-%j.err")).append('\n');
    if (resources.unit() == ResourceRequest.Unit.NODES) {
      sb.append("#SBATCH --nodes=").append(resources.num()).append('\n');
    } else {
      sb.append("#SBATCH --ntasks=").append(resources.num()).append('\n');
    }
    if (resources.maxTime() != null) {
      sb.append("#SBATCH --time=").append(DurationParser.toClock(resources.maxTime())).append('\n');
    }
    if (!resources.partitions().isEmpty()) {
      sb.append("#SBATCH --partition=").append(String.join(",", resources.partitions())).append('\n');
    }
    if (resources.coresPerTask() != null) {
      sb.append("#SBATCH --cpus-per-task=").append(resources.coresPerTask()).append('\n');
    }
    if (!profile.partialNode()) {
      sb.append("#SBATCH --exclusive\n");
    }
    for (var line : profile.headerExtra()) {
      sb.append(line.startsWith("#") ? line : "#SBATCH " + line).append('\n');
    }

    sb.append('\n');
    sb.append("cd ").append(quote(config.workingDirectory().toString())).append('\n');
    profile.envVars().forEach((k, v) -> sb.append("export ").append(k).append('=').append(quote(v)).append('\n'));
    profile.preCommands().forEach(cmd -> sb.append(cmd).append('\n'));

    sb.append(quote(config.javaCommand()))
      .append(" -cp ").append(quote(config.classpath()))
      .append(' ').append(config.workerMainClass())
      .append(' ').append(quote(jobDir.toString()))
      .append(" > ").append(quote(JobFiles.stdout(jobDir).toString()))
      .append(" 2> ").append(quote(JobFiles.stderr(jobDir).toString()))
      .append('\n');
    sb.append("status=$?\n");

    profile.postCommands().forEach(cmd -> sb.append(cmd).append('\n'));
    sb.append("exit $status\n");
    return sb.toString();
  }
}

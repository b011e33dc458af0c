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
package io.wfl.autopara.domain;

import java.time.Duration;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Resources requested for one remote batch job.
 * <p>
 * The JSON form used in remote profiles is:
 * </p>
 * <pre>{@code
 * {"n": [2, "nodes"], "max_time": "4h", "partitions": ["standard"], "ncores_per_task": 1}
 * }</pre>
 *
 * @param num          number of nodes or tasks; must be {@code > 0}
 * @param unit         whether {@code num} counts nodes or tasks
 * @param maxTime      wall-clock limit requested from the queue; may be {@code null} (queue default)
 * @param partitions   candidate partitions/queues, in preference order; never {@code null}
 * @param coresPerTask cores per task; may be {@code null} (one task per core)
 */
public record ResourceRequest(
  int num,
  Unit unit,
  Duration maxTime,
  List<String> partitions,
  Integer coresPerTask
) {

  /**
   * One node, queue defaults for everything else.
   */
  public static final ResourceRequest DEFAULT = new ResourceRequest(1, Unit.NODES, null, List.of(), null);

  public ResourceRequest {
    requireNonNull(unit, "unit must not be null");
    if (num <= 0) {
      throw new IllegalArgumentException("num must be > 0, got: " + num);
    }
    if (coresPerTask != null && coresPerTask <= 0) {
      throw new IllegalArgumentException("coresPerTask must be > 0, got: " + coresPerTask);
    }
    partitions = partitions == null ? List.of() : List.copyOf(partitions);
  }

  public static ResourceRequest nodes(int num, Duration maxTime) {
    return new ResourceRequest(num, Unit.NODES, maxTime, List.of(), null);
  }

  public static ResourceRequest tasks(int num, Duration maxTime) {
    return new ResourceRequest(num, Unit.TASKS, maxTime, List.of(), null);
  }

  public enum Unit {
    NODES,
    TASKS
  }
}

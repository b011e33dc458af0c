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

import com.google.gson.JsonElement;

import static java.util.Objects.requireNonNull;

/**
 * What a finished job hands back: the serialized job outcome and the captured output streams.
 *
 * @param result the job outcome as written by the job runner
 * @param stdout captured standard output; empty when none
 * @param stderr captured standard error; empty when none
 */
public record JobResult(JsonElement result, String stdout, String stderr) {

  public JobResult {
    requireNonNull(result, "result must not be null");
    stdout = stdout == null ? "" : stdout;
    stderr = stderr == null ? "" : stderr;
  }
}

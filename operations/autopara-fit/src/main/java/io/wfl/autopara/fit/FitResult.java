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
package io.wfl.autopara.fit;

import io.wfl.autopara.client.broker.RemoteJobHandle;

import java.nio.file.Path;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of {@link ExternalFit#fit(FitRequest)}.
 */
public sealed interface FitResult {

  /**
   * The potential was fitted; its files are {@code <fileBase>.<format>}.
   *
   * @param fileBase run directory joined with the potential name
   */
  record Fitted(String fileBase) implements FitResult {
    public Fitted {
      requireNonNull(fileBase, "fileBase must not be null");
    }

    public Path path() {
      return Path.of(fileBase);
    }
  }

  /**
   * A dry run reported the size of the least-squares problem.
   */
  record MatrixSize(int rows, int columns) implements FitResult {}

  /**
   * The fit was queued remotely and the caller chose not to wait; calling again with the same
   * request picks up the result.
   */
  record Submitted(RemoteJobHandle handle) implements FitResult {
    public Submitted {
      requireNonNull(handle, "handle must not be null");
    }
  }
}

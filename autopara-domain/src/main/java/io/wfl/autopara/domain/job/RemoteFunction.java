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

import io.wfl.autopara.domain.Arguments;

/**
 * Entry point executed inside a remote batch job.
 * <p>
 * The job runner instantiates the implementation by class name through its public no-arg
 * constructor, calls {@link #invoke(Arguments)} with the staged arguments, and stages the returned
 * value back to the submitting process. Implementations re-run the same code the caller would have
 * run locally, and must make sure that code does not dispatch remotely again
 * (see {@link io.wfl.autopara.domain.RemoteInfo#ignore()}).
 * </p>
 *
 * @see JobRunner
 */
@FunctionalInterface
public interface RemoteFunction {

  /**
   * @param arguments the staged arguments; never {@code null}
   * @return the result to stage back; may be {@code null}
   */
  Object invoke(Arguments arguments);
}

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
package io.wfl.autopara.client;

import static java.util.Objects.requireNonNull;

/**
 * One call-site entry of a {@link CallPath}: where an operation is invoked from, and which
 * operation it is.
 *
 * @param sourceLocation the calling source, e.g. a file or class name
 * @param operationName  the operation or method name
 */
public record DispatchContext(String sourceLocation, String operationName) {

  public DispatchContext {
    requireNonNull(sourceLocation, "sourceLocation must not be null");
    requireNonNull(operationName, "operationName must not be null");
  }

  public static DispatchContext of(Class<?> source, String operationName) {
    return new DispatchContext(source.getName(), operationName);
  }

  /**
   * Renders the entry as {@code <sourceLocation>::<operationName>}, the form profile table keys are
   * matched against.
   */
  public String render() {
    return sourceLocation + "::" + operationName;
  }

  @Override
  public String toString() {
    return render();
  }
}

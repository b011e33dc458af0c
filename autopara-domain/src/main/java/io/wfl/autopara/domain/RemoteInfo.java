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

import static java.util.Objects.requireNonNull;

/**
 * Remote-execution selection passed to a dispatch call.
 * <ul>
 *   <li>{@link Auto}: resolve the profile from the environment-supplied configuration</li>
 *   <li>{@link Ignore}: never dispatch remotely; passed by a remote job to the code it re-runs so
 *       that it does not submit itself again</li>
 *   <li>{@link Explicit}: use the given profile</li>
 * </ul>
 */
public sealed interface RemoteInfo {

  static RemoteInfo auto() {
    return Auto.INSTANCE;
  }

  static RemoteInfo ignore() {
    return Ignore.INSTANCE;
  }

  static RemoteInfo of(RemoteProfile profile) {
    return new Explicit(profile);
  }

  final class Auto implements RemoteInfo {
    private static final Auto INSTANCE = new Auto();

    private Auto() {
    }

    @Override
    public String toString() {
      return "RemoteInfo.auto";
    }
  }

  final class Ignore implements RemoteInfo {
    private static final Ignore INSTANCE = new Ignore();

    private Ignore() {
    }

    @Override
    public String toString() {
      return "RemoteInfo.ignore";
    }
  }

  record Explicit(RemoteProfile profile) implements RemoteInfo {
    public Explicit {
      requireNonNull(profile, "profile must not be null");
    }
  }
}

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

import io.wfl.autopara.client.AutoparaConfig;
import io.wfl.autopara.domain.Arguments;
import io.wfl.autopara.domain.InMemoryInputSet;
import io.wfl.autopara.domain.RemoteInfo;
import io.wfl.autopara.domain.job.RemoteFunction;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs an {@link ExternalFit} inside a queued job.
 * <p>
 * The job fits locally: remote selection is ignored there, and output reuse was already checked
 * by the submitting process.
 * </p>
 */
public final class FitFunction implements RemoteFunction {
  static final String CONFIGS = "configs";
  static final String POTENTIAL_NAME = "potential_name";
  static final String PARAMS = "params";
  static final String REF_PROPERTY_PREFIX = "ref_property_prefix";
  static final String RUN_DIR = "run_dir";
  static final String FORMATS = "formats";
  static final String EXECUTABLE = "executable";
  static final String DRY_RUN = "dry_run";
  static final String VERBOSE = "verbose";

  static Arguments bundle(FitRequest request, List<?> configs) {
    Map<String, Object> named = new LinkedHashMap<>();
    named.put(CONFIGS, new ArrayList<>(configs));
    named.put(POTENTIAL_NAME, request.potentialName());
    named.put(PARAMS, new LinkedHashMap<>(request.params()));
    named.put(REF_PROPERTY_PREFIX, request.refPropertyPrefix());
    named.put(RUN_DIR, request.runDir().toString());
    named.put(FORMATS, new ArrayList<>(request.formats()));
    named.put(EXECUTABLE, request.executable());
    named.put(DRY_RUN, request.dryRun());
    named.put(VERBOSE, request.verbose());
    return Arguments.named(named);
  }

  @Override
  public Object invoke(Arguments arguments) {
    List<Object> configs = arguments.get(CONFIGS);
    Map<String, Object> params = arguments.get(PARAMS);
    String potentialName = arguments.get(POTENTIAL_NAME);
    String prefix = arguments.get(REF_PROPERTY_PREFIX);
    String runDir = arguments.get(RUN_DIR);
    List<String> formats = arguments.get(FORMATS);
    String executable = arguments.get(EXECUTABLE);
    Boolean dryRun = arguments.get(DRY_RUN);
    Boolean verbose = arguments.get(VERBOSE);

    var request = FitRequest.builder(InMemoryInputSet.of(configs), potentialName, params)
                            .withRefPropertyPrefix(prefix)
                            .withRunDir(Path.of(runDir))
                            .withFormats(formats)
                            .withExecutable(executable)
                            .withDryRun(dryRun)
                            .withVerbose(verbose)
                            .withRemoteInfo(RemoteInfo.ignore())
                            .build();
    return new ExternalFit(AutoparaConfig.shared()).fit(request);
  }
}

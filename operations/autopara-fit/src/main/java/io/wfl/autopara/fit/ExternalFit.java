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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import io.wfl.autopara.client.AutoparaConfig;
import io.wfl.autopara.client.CallPath;
import io.wfl.autopara.client.DispatchContext;
import io.wfl.autopara.client.ProfileResolver;
import io.wfl.autopara.client.RemoteQueueBackend;
import io.wfl.autopara.domain.AutoparaException;
import io.wfl.autopara.domain.RemoteJobException;
import io.wfl.autopara.domain.RemoteProfile;
import io.wfl.autopara.domain.cache.CacheProbe;
import io.wfl.autopara.domain.cache.IdempotentCache;
import io.wfl.autopara.domain.command.CommandEncoder;
import io.wfl.autopara.domain.command.ParameterEncoding;
import io.wfl.autopara.domain.process.ExternalProcess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Fits a potential with an external executable, reusing earlier output and optionally running as a
 * queued remote job.
 *
 * <h2>Flow</h2>
 * <ol>
 *   <li>With {@code skipIfPresent}, valid output of an earlier run is returned as is.</li>
 *   <li>The remote profile is resolved from {@value #REMOTE_INFO_VARIABLE}. When one applies, the
 *       configurations are materialized in memory and the fit runs as a {@link FitFunction} job; the
 *       run directory is staged back as the job's output.</li>
 *   <li>Otherwise the configurations are written as JSON lines to
 *       {@code <runDir>/fitting_database.<name>.jsonl} and the executable runs with the encoded
 *       parameters, its output captured in {@code <base>.stdout} and {@code <base>.stderr}.</li>
 *   <li>The output files are validated, or the problem size is read for a dry run.</li>
 * </ol>
 *
 * <h2>Command Line</h2>
 * <p>
 * The caller's parameters come first, followed by {@code --dry_run} when requested,
 * {@code --outfile_base}, {@code --outfile_format}, one {@code --key} per reference property
 * (energy, forces and virial, prefixed with the reference property prefix) and
 * {@code --atoms_filename}.
 * </p>
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@value #REMOTE_INFO_VARIABLE}: remote profile or profile table for fits</li>
 *   <li>{@value #JULIA_THREADS_VARIABLE}: passed to the executable as {@code JULIA_NUM_THREADS}</li>
 *   <li>{@value #BLAS_THREADS_VARIABLE}: passed to the executable unchanged</li>
 * </ul>
 * <p>
 * Thread settings apply to the child process only.
 * </p>
 */
public final class ExternalFit {
  private static final Logger logger = LoggerFactory.getLogger(ExternalFit.class);

  public static final String REMOTE_INFO_VARIABLE = "WFL_ACE_FIT_REMOTEINFO";
  public static final String JULIA_THREADS_VARIABLE = "ACE_FIT_JULIA_THREADS";
  public static final String BLAS_THREADS_VARIABLE = "ACE_FIT_BLAS_THREADS";

  private static final CommandEncoder ENCODER = new CommandEncoder(Set.of("atoms_filename", "outfile_base"));
  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();
  private static final CallPath CALL_PATH = CallPath.of(DispatchContext.of(ExternalFit.class, "fit"));

  private final AutoparaConfig config;
  private final ProfileResolver resolver;
  private final RemoteQueueBackend remote;
  private final PrintStream out;
  private final PrintStream err;

  public ExternalFit(AutoparaConfig config) {
    this(config, System.out, System.err);
  }

  ExternalFit(AutoparaConfig config, PrintStream out, PrintStream err) {
    this.config = requireNonNull(config, "config must not be null");
    this.resolver = new ProfileResolver(config);
    this.remote = new RemoteQueueBackend(config);
    this.out = requireNonNull(out, "out must not be null");
    this.err = requireNonNull(err, "err must not be null");
  }

  /**
   * @return the fitted file base, the dry-run problem size, or the handle of a remote job the
   *         caller does not wait for
   * @throws io.wfl.autopara.domain.process.ExternalProcessException if the executable exits with an error
   * @throws AutoparaException if the executable exits normally but its output is missing or unreadable
   * @throws RemoteJobException if the remote fit fails
   */
  public FitResult fit(FitRequest request) {
    requireNonNull(request, "request must not be null");
    var base = request.fileBase();

    if (request.skipIfPresent()) {
      var previous = IdempotentCache.lookup(probe(request));
      if (previous.isPresent()) {
        logger.info("Reusing fit output at {}", base);
        return previous.get();
      }
    }

    var profile = resolver.resolve(request.remoteInfo(), REMOTE_INFO_VARIABLE, null, CALL_PATH);
    if (profile.isPresent()) {
      return fitRemotely(request, profile.get());
    }
    return fitLocally(request);
  }

  private FitResult fitRemotely(FitRequest request, RemoteProfile profile) {
    var arguments = FitFunction.bundle(request, request.configs().inMemory());
    var handle = remote.submit(FitFunction.class, arguments, Set.of(), profile, request.runDir());
    if (!request.waitForResults()) {
      return new FitResult.Submitted(handle);
    }
    var result = remote.fetch(handle, profile);
    if (!(result instanceof FitResult fitResult)) {
      throw new RemoteJobException("Remote fit " + handle.jobId() + " returned " + result + " instead of a fit result");
    }
    return fitResult;
  }

  private FitResult fitLocally(FitRequest request) {
    var base = request.fileBase();
    var atomsFile = request.runDir().resolve("fitting_database." + request.potentialName() + ".jsonl");
    try {
      Files.createDirectories(request.runDir());
      writeConfigs(request.configs(), atomsFile);
    } catch (IOException e) {
      throw new AutoparaException("Failed to prepare fit directory " + request.runDir(), e);
    }

    var encoding = ParameterEncoding.fromMap(request.params());
    if (request.dryRun()) {
      encoding.flag("dry_run");
    }
    encoding.set("outfile_base", base.toString())
            .set("outfile_format", request.formats())
            .repeated("key", List.of(
              List.of("E", request.refPropertyPrefix() + "energy"),
              List.of("F", request.refPropertyPrefix() + "forces"),
              List.of("V", request.refPropertyPrefix() + "virial")))
            .set("atoms_filename", atomsFile.toString());

    var command = request.executable() + " " + ENCODER.encode(encoding);
    if (request.verbose()) {
      logger.info("Fitting command: {}", command);
    }

    ExternalProcess.shell(command)
                   .redirectTo(FitOutputProbe.sibling(base, ".stdout"), FitOutputProbe.sibling(base, ".stderr"))
                   .environment(threadSettings())
                   .echoTo(out, err)
                   .run();

    try {
      return probe(request).probe()
                           .orElseThrow(() -> new AutoparaException("Fit produced no output at " + base));
    } catch (IOException | JsonParseException e) {
      throw new AutoparaException("Fit completed but its output at " + base + " is missing or unreadable", e);
    }
  }

  private static CacheProbe<FitResult> probe(FitRequest request) {
    return request.dryRun()
      ? FitOutputProbe.size(request.fileBase())
      : FitOutputProbe.validated(request.fileBase(), request.formats());
  }

  private LinkedHashMap<String, String> threadSettings() {
    var overrides = new LinkedHashMap<String, String>();
    config.env(JULIA_THREADS_VARIABLE).ifPresent(v -> overrides.put("JULIA_NUM_THREADS", v));
    config.env(BLAS_THREADS_VARIABLE).ifPresent(v -> overrides.put(BLAS_THREADS_VARIABLE, v));
    return overrides;
  }

  private static void writeConfigs(Iterable<?> configs, Path file) throws IOException {
    try (BufferedWriter writer = Files.newBufferedWriter(file, UTF_8)) {
      for (var config : configs) {
        writer.write(GSON.toJson(config));
        writer.newLine();
      }
    }
  }
}

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

import io.wfl.autopara.client.broker.InProcessJobBroker;
import io.wfl.autopara.client.broker.JobBrokerRegistry;
import io.wfl.autopara.client.broker.JobState;
import io.wfl.autopara.domain.Arguments;
import io.wfl.autopara.domain.AutoparaException;
import io.wfl.autopara.domain.InMemoryOutputSink;
import io.wfl.autopara.domain.IterableArgument;
import io.wfl.autopara.domain.Operation;
import io.wfl.autopara.domain.RemoteInfo;
import io.wfl.autopara.domain.RemoteJobException;
import io.wfl.autopara.domain.RemoteProfile;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DispatcherTest {

  private final Dispatcher dispatcher = new Dispatcher(AutoparaConfig.builder().withBrokers(JobBrokerRegistry.of()).build());

  @BeforeEach
  void resetCounters() {
    SquareOperation.INVOCATIONS.set(0);
  }

  @ParameterizedTest(name = "npool={0}")
  @ValueSource(ints = {0, 1, 4})
  @DisplayName("should merge outputs in input order whatever the pool size")
  void should_merge_outputs_in_input_order(int npool) {
    // Given
    var inputs = IntStream.range(0, 50).boxed().toList();
    Operation<Integer> slowTenfold = args -> {
      sleepRandomly();
      List<Integer> chunk = args.get(0);
      return chunk.stream().map(i -> i * 10).toList();
    };

    // When
    var result = dispatcher.dispatch(DispatchRequest.builder(inputs, slowTenfold)
                                                    .withChunksize(3)
                                                    .withNpool(npool)
                                                    .build());

    // Then
    assertThat(result.isDetached()).isFalse();
    assertThat(result.output().inMemory()).containsExactlyElementsOf(inputs.stream().map(i -> i * 10).toList());
  }

  @Test
  @DisplayName("should drop items without result when skipping failures")
  void should_drop_missing_results_when_skipping() {
    // When
    var result = dispatcher.dispatch(DispatchRequest.builder(List.of(1, -2, 3, -4), new SquareOperation())
                                                    .withChunksize(2)
                                                    .build());

    // Then
    assertThat(result.output().inMemory()).containsExactly(1, 9);
  }

  @Test
  @DisplayName("should keep items without result as null when not skipping failures")
  void should_keep_missing_results_as_null() {
    // When
    var result = dispatcher.dispatch(DispatchRequest.builder(List.of(1, -2, 3), new SquareOperation())
                                                    .withSkipFailed(false)
                                                    .withNpool(2)
                                                    .build());

    // Then
    assertThat(result.output().inMemory()).containsExactly(1, null, 9);
  }

  @Test
  @DisplayName("should count a null chunk result as no result for every item of the chunk")
  void should_expand_null_chunk_result() {
    // Given
    Operation<String> dropsOddChunks = args -> {
      List<Integer> chunk = args.get(0);
      return chunk.get(0) % 2 == 1 ? null : chunk.stream().map(String::valueOf).toList();
    };
    var inputs = List.of(0, 2, 1, 3, 4);

    // When
    var kept = dispatcher.dispatch(DispatchRequest.builder(inputs, dropsOddChunks)
                                                  .withChunksize(2)
                                                  .withSkipFailed(false)
                                                  .build());
    var skipped = dispatcher.dispatch(DispatchRequest.builder(inputs, dropsOddChunks)
                                                     .withChunksize(2)
                                                     .build());

    // Then
    assertThat(kept.output().inMemory()).containsExactly("0", "2", null, null, "4");
    assertThat(skipped.output().inMemory()).containsExactly("0", "2", "4");
  }

  @Test
  @DisplayName("should place chunks in a named argument next to the other arguments")
  void should_place_chunk_in_named_argument() {
    // Given
    Operation<String> label = args -> {
      List<String> names = args.get("names");
      String prefix = args.get(0);
      return names.stream().map(n -> prefix + n).toList();
    };

    // When
    var result = dispatcher.dispatch(DispatchRequest.builder(List.of("a", "b", "c"), label)
                                                    .withArguments(Arguments.positional("x-"))
                                                    .withIterableArgument(IterableArgument.named("names"))
                                                    .withChunksize(2)
                                                    .build());

    // Then
    assertThat(result.output().inMemory()).containsExactly("x-a", "x-b", "x-c");
  }

  @Test
  @DisplayName("should reject a positional slot beyond the supplied arguments")
  void should_reject_out_of_range_slot() {
    // Given
    var request = DispatchRequest.builder(List.of(1), new SquareOperation())
                                 .withArguments(Arguments.positional("a"))
                                 .withIterableArgument(IterableArgument.positional(2))
                                 .build();

    // When / Then
    assertThatThrownBy(() -> dispatcher.dispatch(request))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("index 2");
    assertThat(SquareOperation.INVOCATIONS).hasValue(0);
  }

  @Test
  @DisplayName("should write to the sink and complete it")
  void should_store_outputs_in_sink() {
    // Given
    var sink = new InMemoryOutputSink<Integer>();

    // When
    var result = dispatcher.dispatch(DispatchRequest.builder(List.of(1, 2, 3), new SquareOperation())
                                                    .withOutputs(sink)
                                                    .build());

    // Then
    assertThat(sink.isDone()).isTrue();
    assertThat(sink.items()).containsExactly(1, 4, 9);
    assertThat(result.output().inMemory()).containsExactly(1, 4, 9);
  }

  @Test
  @DisplayName("should return a done sink without running the operation or resolving a profile")
  void should_short_circuit_on_done_sink() {
    // Given
    var sink = new InMemoryOutputSink<Integer>();
    sink.store(42);
    sink.complete();
    var unknownSystem = RemoteInfo.of(RemoteProfile.of("nowhere", "never"));

    // When
    var result = dispatcher.dispatch(DispatchRequest.builder(List.of(1, 2), new SquareOperation())
                                                    .withOutputs(sink)
                                                    .withRemoteInfo(unknownSystem)
                                                    .build());

    // Then
    assertThat(result.output().inMemory()).containsExactly(42);
    assertThat(SquareOperation.INVOCATIONS).hasValue(0);
  }

  @ParameterizedTest(name = "npool={0}")
  @ValueSource(ints = {0, 2})
  @DisplayName("should abort the dispatch when the operation throws")
  void should_abort_on_operation_exception(int npool) {
    // Given
    var request = DispatchRequest.builder(List.of(1, 2, 3, 4), new SquareOperation())
                                 .withArguments(Arguments.named(Map.of("fail", true)))
                                 .withNpool(npool)
                                 .build();

    // When / Then
    assertThatThrownBy(() -> dispatcher.dispatch(request))
      .isInstanceOf(AutoparaException.class)
      .hasMessageContaining("asked to fail")
      .hasCauseInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("should run the initializer once on each worker thread")
  void should_run_initializer_once_per_worker() {
    // Given
    var initializedOn = new ConcurrentLinkedQueue<String>();
    Operation<Integer> identity = args -> {
      sleepRandomly();
      return args.get(0);
    };

    // When
    dispatcher.dispatch(DispatchRequest.builder(IntStream.range(0, 40).boxed().toList(), identity)
                                       .withNpool(3)
                                       .withInitializer(() -> initializedOn.add(Thread.currentThread().getName()))
                                       .build());

    // Then
    assertThat(initializedOn).isNotEmpty().hasSizeLessThanOrEqualTo(3).doesNotHaveDuplicates();
    assertThat(initializedOn).allMatch(name -> name.startsWith("autopara-pool-"));
  }

  @Test
  @DisplayName("should run the initializer once in serial mode")
  void should_run_initializer_once_serially() {
    // Given
    var runs = new AtomicInteger();

    // When
    dispatcher.dispatch(DispatchRequest.builder(List.of(1, 2, 3), new SquareOperation())
                                       .withNpool(0)
                                       .withInitializer(runs::incrementAndGet)
                                       .build());

    // Then
    assertThat(runs).hasValue(1);
  }

  @Test
  @DisplayName("should use the configured default pool size when none is requested")
  void should_use_default_pool_size() {
    // Given
    var pooled = new Dispatcher(AutoparaConfig.builder()
                                              .withDefaultPoolSize(2)
                                              .withBrokers(JobBrokerRegistry.of())
                                              .build());
    var threads = new ConcurrentLinkedQueue<String>();
    Operation<Integer> recordThread = args -> {
      threads.add(Thread.currentThread().getName());
      return args.get(0);
    };

    // When
    pooled.dispatch(DispatchRequest.builder(List.of(1, 2, 3), recordThread).build());

    // Then
    assertThat(threads).allMatch(name -> name.startsWith("autopara-pool-"));
  }

  @Nested
  class Remote {

    @TempDir
    Path jobs;

    private InProcessJobBroker broker;
    private Dispatcher remoteDispatcher;
    private RemoteProfile profile;

    @BeforeEach
    void setUp() {
      broker = new InProcessJobBroker("local-queue", jobs);
      remoteDispatcher = new Dispatcher(AutoparaConfig.builder().withBrokers(JobBrokerRegistry.of(broker)).build());
      profile = RemoteProfile.of("local-queue", "squares").withTimeout(Duration.ofSeconds(30), Duration.ofMillis(20));
    }

    @AfterEach
    void tearDown() {
      broker.close();
    }

    @Test
    @DisplayName("should return the same outputs remotely as locally")
    void should_match_local_outputs() {
      // Given
      var inputs = List.of(1, 2, -3, 4, 5);
      var arguments = Arguments.named(Map.of("offset", 1));

      // When
      var local = dispatcher.dispatch(request(inputs, arguments).build());
      var remote = remoteDispatcher.dispatch(request(inputs, arguments).withRemoteInfo(RemoteInfo.of(profile)).build());

      // Then
      assertThat(remote.output().inMemory()).isEqualTo(local.output().inMemory()).containsExactly(2, 5, 17, 26);
    }

    @Test
    @DisplayName("should reuse the finished job of an identical call")
    void should_reuse_finished_job() throws IOException {
      // Given
      var request = request(List.of(1, 2, 3), Arguments.empty()).withRemoteInfo(RemoteInfo.of(profile)).build();
      var first = remoteDispatcher.dispatch(request).output().inMemory();
      int invocations = SquareOperation.INVOCATIONS.get();

      // When
      var second = remoteDispatcher.dispatch(request).output().inMemory();

      // Then
      assertThat(second).isEqualTo(first);
      assertThat(SquareOperation.INVOCATIONS).hasValue(invocations);
      assertThat(jobDirectories()).hasSize(1);
    }

    @Test
    @DisplayName("should ignore hash-ignored arguments when identifying the job")
    void should_ignore_hash_ignored_arguments() throws IOException {
      // Given
      var remoteInfo = RemoteInfo.of(profile);
      var first = request(List.of(1, 2), Arguments.named(Map.of("scratch", "/tmp/a"))).withRemoteInfo(remoteInfo)
                                                                                       .withHashIgnore(Set.of("scratch"))
                                                                                       .build();
      var second = request(List.of(1, 2), Arguments.named(Map.of("scratch", "/tmp/b"))).withRemoteInfo(remoteInfo)
                                                                                        .withHashIgnore(Set.of("scratch"))
                                                                                        .build();

      // When
      remoteDispatcher.dispatch(first);
      remoteDispatcher.dispatch(second);

      // Then
      assertThat(jobDirectories()).hasSize(1);
    }

    @Test
    @DisplayName("should return a detached handle without waiting, then fetch on a later call")
    void should_detach_then_fetch_later() {
      // Given
      var builder = request(List.of(2, 3), Arguments.empty()).withRemoteInfo(RemoteInfo.of(profile));

      // When
      var detached = remoteDispatcher.dispatch(builder.withWaitForResults(false).build());
      var completed = remoteDispatcher.dispatch(builder.withWaitForResults(true).build());

      // Then
      assertThat(detached.isDetached()).isTrue();
      assertThatThrownBy(detached::output).isInstanceOf(IllegalStateException.class);
      var handle = ((DispatchResult.Detached<Integer>) detached).handle();
      assertThat(completed.output().inMemory()).containsExactly(4, 9);
      assertThat(broker.status(handle)).isEqualTo(JobState.PROCESSED);
    }

    @Test
    @DisplayName("should surface a failed remote job as a remote job error")
    void should_fail_on_remote_error() {
      // Given
      var request = request(List.of(1), Arguments.named(Map.of("fail", true))).withRemoteInfo(RemoteInfo.of(profile))
                                                                               .build();

      // When / Then
      assertThatThrownBy(() -> remoteDispatcher.dispatch(request))
        .isInstanceOf(RemoteJobException.class)
        .hasMessageContaining("FAILED");
    }

    @Test
    @DisplayName("should reject a lambda operation for remote execution")
    void should_reject_lambda_for_remote() {
      // Given
      Operation<Integer> lambda = args -> args.get(0);
      var request = DispatchRequest.builder(List.of(1), lambda).withRemoteInfo(RemoteInfo.of(profile)).build();

      // When / Then
      assertThatThrownBy(() -> remoteDispatcher.dispatch(request))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("named classes");
    }

    @Test
    @DisplayName("should select the remote profile from the environment table")
    void should_select_profile_from_environment() throws IOException {
      // Given
      var table = "{\"SquareOperation::squares\": {\"sys_name\": \"local-queue\", \"job_name\": \"env_squares\","
                  + " \"timeout\": \"30s\", \"check_interval\": 1}}";
      var configured = new Dispatcher(AutoparaConfig.builder()
                                                    .withVariable(AutoparaConfig.REMOTE_INFO_VARIABLE, table)
                                                    .withBrokers(JobBrokerRegistry.of(broker))
                                                    .build());
      var callPath = CallPath.of(DispatchContext.of(SquareOperation.class, "squares"));

      // When
      var result = configured.dispatch(request(List.of(3), Arguments.empty()).withCallPath(callPath).build());

      // Then
      assertThat(result.output().inMemory()).containsExactly(9);
      assertThat(jobDirectories()).singleElement().satisfies(name -> assertThat(name).startsWith("env_squares_"));
    }

    private DispatchRequest.Builder<Integer> request(List<Integer> inputs, Arguments arguments) {
      return DispatchRequest.builder(inputs, new SquareOperation()).withArguments(arguments);
    }

    private List<String> jobDirectories() throws IOException {
      try (Stream<Path> dirs = Files.list(jobs)) {
        return dirs.filter(Files::isDirectory).map(p -> p.getFileName().toString()).collect(Collectors.toList());
      }
    }
  }

  private static void sleepRandomly() {
    try {
      Thread.sleep(ThreadLocalRandom.current().nextInt(3));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}

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

import io.wfl.autopara.client.broker.JobBroker;
import io.wfl.autopara.client.broker.JobBrokerRegistry;
import io.wfl.autopara.domain.Arguments;
import io.wfl.autopara.domain.IterableArgument;
import io.wfl.autopara.domain.Operation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RemoteDispatchFunctionTest {

  @Mock
  private JobBroker cluster;

  private Dispatcher dispatcher;

  @BeforeEach
  void setUp() {
    when(cluster.name()).thenReturn("cluster");
    var config = AutoparaConfig.builder()
                               .withVariable(AutoparaConfig.REMOTE_INFO_VARIABLE, "{\"sys_name\": \"cluster\", \"job_name\": \"all\"}")
                               .withBrokers(JobBrokerRegistry.of(cluster))
                               .build();
    dispatcher = new Dispatcher(config);
  }

  @Test
  @DisplayName("should run the bundled dispatch locally even when a profile is configured")
  void should_not_resubmit_inside_the_job() {
    // Given
    var request = DispatchRequest.builder(List.of(1, -2, 3), new SquareOperation())
                                 .withArguments(Arguments.named(Map.of("offset", 10)))
                                 .withChunksize(2)
                                 .build();
    var arguments = RemoteDispatchFunction.bundle(request, List.of(1, -2, 3));

    // When
    var result = new RemoteDispatchFunction(() -> dispatcher).invoke(arguments);

    // Then
    assertThat(result).isEqualTo(List.of(11, 19));
    verify(cluster, never()).submit(any());
  }

  @Test
  @DisplayName("should keep the iterable slot and the skip-failed flag of the request")
  void should_carry_dispatch_settings() {
    // Given
    Arguments positional = Arguments.positional("unused");
    var request = DispatchRequest.builder(List.of(-1, 2), new SquareOperation())
                                 .withArguments(positional)
                                 .withIterableArgument(IterableArgument.positional(0))
                                 .withSkipFailed(false)
                                 .build();

    // When
    var result = new RemoteDispatchFunction(() -> dispatcher).invoke(RemoteDispatchFunction.bundle(request, List.of(-1, 2)));

    // Then
    assertThat(result).isEqualTo(Arrays.asList(null, 4));
  }

  @Test
  @DisplayName("should reject operations that cannot be re-created by class name")
  void should_reject_unnamed_operations() {
    // Given
    Operation<Integer> anonymous = new Operation<>() {
      @Override
      public List<Integer> apply(Arguments arguments) {
        return List.of();
      }
    };

    // When / Then
    assertThatThrownBy(() -> RemoteDispatchFunction.requireRecreatable(anonymous.getClass()))
      .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> RemoteDispatchFunction.requireRecreatable(InnerOperation.class))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("inner classes");
  }

  @Test
  @DisplayName("should reject operation arguments using the reserved prefix")
  void should_reject_reserved_argument_names() {
    // Given
    var request = DispatchRequest.builder(List.of(1), new SquareOperation())
                                 .withArguments(Arguments.named(Map.of("autopara.items", 1)))
                                 .build();

    // When / Then
    assertThatThrownBy(() -> RemoteDispatchFunction.bundle(request, List.of(1)))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("reserved prefix");
  }

  @Test
  @DisplayName("should encode iterable slots as text")
  void should_encode_iterable_slots() {
    assertThat(RemoteDispatchFunction.decode(RemoteDispatchFunction.encode(IterableArgument.named("atoms"))))
      .isEqualTo(IterableArgument.named("atoms"));
    assertThat(RemoteDispatchFunction.encode(IterableArgument.positional(2))).isEqualTo("positional:2");
  }

  public class InnerOperation implements Operation<Integer> {
    @Override
    public List<Integer> apply(Arguments arguments) {
      return List.of();
    }
  }
}

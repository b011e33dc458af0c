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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import uk.org.webcompere.systemstubs.environment.EnvironmentVariables;
import uk.org.webcompere.systemstubs.jupiter.SystemStub;
import uk.org.webcompere.systemstubs.jupiter.SystemStubsExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(SystemStubsExtension.class)
class AutoparaConfigTest {

  @SystemStub
  private EnvironmentVariables environment;

  @Test
  @DisplayName("should snapshot pool size and remote info from the environment")
  void should_read_environment() {
    // Given
    environment.set(AutoparaConfig.NPOOL_VARIABLE, "3")
               .set(AutoparaConfig.REMOTE_INFO_VARIABLE, "remote_info.json");

    // When
    var config = AutoparaConfig.fromEnvironment();
    environment.set(AutoparaConfig.NPOOL_VARIABLE, "7");

    // Then
    assertThat(config.defaultPoolSize()).isEqualTo(3);
    assertThat(config.env(AutoparaConfig.REMOTE_INFO_VARIABLE)).contains("remote_info.json");
  }

  @Test
  @DisplayName("should run serially when the pool size is not set")
  void should_default_to_serial() {
    // Given
    environment.remove(AutoparaConfig.NPOOL_VARIABLE);

    // When
    var config = AutoparaConfig.fromEnvironment();

    // Then
    assertThat(config.defaultPoolSize()).isZero();
  }

  @Test
  @DisplayName("should reject a malformed pool size")
  void should_reject_malformed_pool_size() {
    // Given
    environment.set(AutoparaConfig.NPOOL_VARIABLE, "many");

    // When / Then
    assertThatThrownBy(AutoparaConfig::fromEnvironment)
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining(AutoparaConfig.NPOOL_VARIABLE);
  }

  @Test
  @DisplayName("should register an in-process broker by default")
  void should_register_in_process_broker() {
    // When
    var config = AutoparaConfig.builder().withVariable(JobBrokerRegistry.JOBS_DIR_VARIABLE, "build/jobs").build();

    // Then
    assertThat(config.brokers().get(JobBrokerRegistry.IN_PROCESS)).isInstanceOf(InProcessJobBroker.class);
    assertThat(((InProcessJobBroker) config.brokers().get(JobBrokerRegistry.IN_PROCESS)).store().root())
      .hasToString("build/jobs");
  }

  @Test
  @DisplayName("should let the builder override the environment pool size")
  void should_override_pool_size() {
    // When
    var config = AutoparaConfig.builder()
                               .withVariable(AutoparaConfig.NPOOL_VARIABLE, "8")
                               .withDefaultPoolSize(2)
                               .withBrokers(JobBrokerRegistry.of())
                               .build();

    // Then
    assertThat(config.defaultPoolSize()).isEqualTo(2);
    assertThatThrownBy(() -> AutoparaConfig.builder().withDefaultPoolSize(-1))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("should build the shared configuration and its brokers only once")
  void should_build_shared_configuration_once() {
    // When
    var first = AutoparaConfig.shared();
    var second = AutoparaConfig.shared();

    // Then
    assertThat(second).isSameAs(first);
    assertThat(second.brokers()).isSameAs(first.brokers());
  }
}

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

import io.wfl.autopara.domain.InMemoryInputSet;
import io.wfl.autopara.domain.RemoteInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FitRequestTest {

  @Test
  @DisplayName("should apply defaults")
  void should_apply_defaults() {
    // When
    var request = FitRequest.builder(InMemoryInputSet.of(List.of()), "pot", Map.of()).build();

    // Then
    assertThat(request.refPropertyPrefix()).isEqualTo("REF_");
    assertThat(request.formats()).containsExactly(".json", ".yace");
    assertThat(request.runDir()).isEqualTo(Path.of("."));
    assertThat(request.fileBase()).isEqualTo(Path.of(".", "pot"));
    assertThat(request.verbose()).isTrue();
    assertThat(request.waitForResults()).isTrue();
    assertThat(request.skipIfPresent()).isFalse();
    assertThat(request.remoteInfo()).isEqualTo(RemoteInfo.auto());
  }

  @Test
  @DisplayName("should prefix formats with a dot when missing")
  void should_prefix_formats_with_a_dot_when_missing() {
    // When
    var request = FitRequest.builder(InMemoryInputSet.of(List.of()), "pot", Map.of())
                            .withFormats(List.of("json", ".yace"))
                            .build();

    // Then
    assertThat(request.formats()).containsExactly(".json", ".yace");
  }

  @Test
  @DisplayName("should reject an empty reference property prefix")
  void should_reject_an_empty_reference_property_prefix() {
    // Given
    var builder = FitRequest.builder(InMemoryInputSet.of(List.of()), "pot", Map.of());

    // When / Then
    assertThatThrownBy(() -> builder.withRefPropertyPrefix(""))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("should copy every setting into a new builder")
  void should_copy_every_setting_into_a_new_builder() {
    // Given
    var request = FitRequest.builder(InMemoryInputSet.of(List.of()), "pot", Map.of("order", 3))
                            .withRefPropertyPrefix("DFT_")
                            .withDryRun(true)
                            .withRunDir(Path.of("fits"))
                            .build();

    // When
    var copy = request.toBuilder().withVerbose(false).build();

    // Then
    assertThat(copy.refPropertyPrefix()).isEqualTo("DFT_");
    assertThat(copy.dryRun()).isTrue();
    assertThat(copy.fileBase()).isEqualTo(Path.of("fits", "pot"));
    assertThat(copy.params()).containsEntry("order", 3);
    assertThat(copy.verbose()).isFalse();
  }
}

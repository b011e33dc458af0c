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
package io.wfl.autopara.domain.command;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandEncoderTest {

  private final CommandEncoder encoder = new CommandEncoder();

  @Test
  @DisplayName("should render short and repeated long flags in insertion order")
  void should_render_short_and_repeated_long_flags() {
    // Given
    var encoding = ParameterEncoding.create()
                                    .set("a", 1)
                                    .repeated("bb", List.of("x", "y"));

    // When
    var command = encoder.encode(encoding);

    // Then
    assertThat(command).isEqualTo("-a 1 --bb x --bb y");
  }

  @Test
  @DisplayName("should emit a bare flag for a parameter without value")
  void should_emit_bare_flag_for_none() {
    // Given
    var encoding = ParameterEncoding.create()
                                    .set("input", "atoms.xyz")
                                    .flag("dry_run");

    // When
    var command = encoder.encode(encoding);

    // Then
    assertThat(command).isEqualTo("--input atoms.xyz --dry_run");
  }

  @Test
  @DisplayName("should quote strings verbatim without JSON wrapping")
  void should_quote_strings_verbatim() {
    // Given
    var encoding = ParameterEncoding.create()
                                    .set("name", "two words")
                                    .set("plain", "simple");

    // When
    var command = encoder.encode(encoding);

    // Then
    assertThat(command).isEqualTo("--name 'two words' --plain simple");
    assertThat(command).doesNotContain("\"");
  }

  @Test
  @DisplayName("should render mappings and nested sequences as quoted compact JSON")
  void should_render_structured_values_as_json() {
    // Given
    var encoding = ParameterEncoding.create()
                                    .set("weights", Map.of("E", 30.0))
                                    .set("pairs", List.of(List.of("E", "REF_energy"), 3));

    // When
    var command = encoder.encode(encoding);

    // Then
    assertThat(command).isEqualTo("--weights '{\"E\":30.0}' --pairs '[\"E\",\"REF_energy\"]' 3");
  }

  @Test
  @DisplayName("should space-join each sequence element of a repeated key after its own flag")
  void should_space_join_sequence_elements_of_a_repeated_key() {
    // Given
    var encoding = ParameterEncoding.create()
                                    .repeated("key", List.of(List.of("E", "REF_energy"), List.of("F", "REF_forces")));

    // When
    var command = encoder.encode(encoding);

    // Then
    assertThat(command).isEqualTo("--key E REF_energy --key F REF_forces");
  }

  @Test
  @DisplayName("should space-join the elements of a single-valued sequence after one flag")
  void should_space_join_single_sequence() {
    // Given
    var encoding = ParameterEncoding.create().set("degrees", List.of(12, 8, 6));

    // When
    var command = encoder.encode(encoding);

    // Then
    assertThat(command).isEqualTo("--degrees 12 8 6");
  }

  @Test
  @DisplayName("should reject an encoding missing a required key")
  void should_reject_missing_required_key() {
    // Given
    var strict = new CommandEncoder(Set.of("atoms_filename", "outfile_base"));
    var encoding = ParameterEncoding.create().set("atoms_filename", "db.xyz");

    // When/Then
    assertThatThrownBy(() -> strict.encode(encoding))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("outfile_base");
  }

  @Test
  @DisplayName("should decode an encoded command back to its raw values")
  void should_decode_encoded_command() {
    // Given
    var encoding = ParameterEncoding.create()
                                    .set("a", 1)
                                    .set("name", "it's here")
                                    .repeated("bb", List.of("x", "y"))
                                    .flag("dry_run");

    // When
    var decoded = CommandEncoder.decode(encoder.encode(encoding));

    // Then
    assertThat(decoded).containsExactly(
      Map.entry("a", List.of("1")),
      Map.entry("name", List.of("it's here")),
      Map.entry("bb", List.of("x", "y")),
      Map.entry("dry_run", List.<String>of())
    );
  }

  @Test
  @DisplayName("should return an empty string for an empty encoding")
  void should_return_empty_string_for_empty_encoding() {
    assertThat(encoder.encode(ParameterEncoding.create())).isEmpty();
  }
}

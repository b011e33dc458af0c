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

import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TypedJsonTest {

  record Configuration(String name, double energy) {}

  @Test
  @DisplayName("should keep element types of nested collections")
  void should_keep_element_types() {
    // Given
    var map = new LinkedHashMap<String, Object>();
    map.put("count", 3L);
    map.put("configs", List.of(new Configuration("c1", -1.5)));
    List<Object> value = Arrays.asList(1, "two", null, map);

    // When
    var decoded = TypedJson.decode(JsonParser.parseString(TypedJson.gson().toJson(TypedJson.encode(value))));

    // Then
    assertThat(decoded).isEqualTo(value);
    var decodedMap = (Map<?, ?>) ((List<?>) decoded).get(3);
    assertThat(decodedMap.get("count")).isInstanceOf(Long.class);
    assertThat(((List<?>) decodedMap.get("configs")).get(0)).isInstanceOf(Configuration.class);
  }

  @Test
  @DisplayName("should reject a value whose type cannot be loaded")
  void should_reject_unknown_type() {
    var json = JsonParser.parseString("{\"type\": \"com.example.Missing\", \"value\": 1}");

    assertThatThrownBy(() -> TypedJson.decode(json))
      .isInstanceOf(JsonParseException.class)
      .hasMessageContaining("com.example.Missing");
  }

  @Test
  @DisplayName("should reject an untyped value")
  void should_reject_untyped_value() {
    assertThatThrownBy(() -> TypedJson.decode(JsonParser.parseString("[1, 2]")))
      .isInstanceOf(JsonParseException.class);
  }
}

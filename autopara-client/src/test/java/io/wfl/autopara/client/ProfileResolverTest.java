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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.wfl.autopara.client.broker.JobBrokerRegistry;
import io.wfl.autopara.domain.RemoteInfo;
import io.wfl.autopara.domain.RemoteProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static io.wfl.autopara.client.AutoparaConfig.REMOTE_INFO_VARIABLE;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

class ProfileResolverTest {

  private static final CallPath CALL_PATH = CallPath.parse("pipeline.py::a_main", "steps.py::run_step", "ops.py::compute");

  private static final String TABLE = """
    {
      "run_step, compute": {"sys_name": "cluster", "job_name": "computed"},
      "compute": {"sys_name": "cluster", "job_name": "fallback"},
      "only_label": {"sys_name": "cluster", "job_name": "labelled"}
    }
    """;

  @Test
  @DisplayName("should select the first key whose patterns match the innermost call sites")
  void should_select_first_matching_key() {
    // When
    var profile = resolver(TABLE).resolve(RemoteInfo.auto(), null, CALL_PATH);

    // Then
    assertThat(profile).map(RemoteProfile::jobName).contains("computed");
  }

  @Test
  @DisplayName("should run locally when no key matches")
  void should_run_locally_without_match() {
    // Given
    var table = "{\"other$\": {\"sys_name\": \"cluster\", \"job_name\": \"x\"}}";

    // When
    var profile = resolver(table).resolve(RemoteInfo.auto(), null, CALL_PATH);

    // Then
    assertThat(profile).isEmpty();
  }

  @Test
  @DisplayName("should select a key equal to the label")
  void should_select_key_equal_to_label() {
    // When
    var profile = resolver(TABLE).resolve(RemoteInfo.auto(), "only_label", CallPath.empty());

    // Then
    assertThat(profile).map(RemoteProfile::jobName).contains("labelled");
  }

  @Test
  @DisplayName("should use a single profile directly")
  void should_use_single_profile_directly() {
    // When
    var profile = resolver("{\"sys_name\": \"cluster\", \"job_name\": \"direct\"}")
      .resolve(RemoteInfo.auto(), null, CallPath.empty());

    // Then
    assertThat(profile).map(RemoteProfile::jobName).contains("direct");
  }

  @Test
  @DisplayName("should read the profile table from a file when the value is not JSON")
  void should_read_table_from_file(@TempDir Path dir) throws IOException {
    // Given
    var file = dir.resolve("remote_info.json");
    Files.writeString(file, TABLE, UTF_8);

    // When
    var profile = resolver(file.toString()).resolve(RemoteInfo.auto(), null, CALL_PATH);

    // Then
    assertThat(profile).map(RemoteProfile::jobName).contains("computed");
  }

  @Test
  @DisplayName("should run locally when the profile file cannot be read")
  void should_run_locally_on_unreadable_file(@TempDir Path dir) {
    // When
    var profile = resolver(dir.resolve("missing.json").toString()).resolve(RemoteInfo.auto(), null, CALL_PATH);

    // Then
    assertThat(profile).isEmpty();
  }

  @Test
  @DisplayName("should warn about whitespace in a value that is not JSON and run locally when no such file exists")
  void should_warn_about_whitespace_and_run_locally(@TempDir Path dir) {
    // Given
    var value = dir.resolve("remote profiles.json").toString();
    var appender = captureWarnings();

    try {
      // When
      var profile = resolver(value).resolve(RemoteInfo.auto(), null, CALL_PATH);

      // Then
      assertThat(profile).isEmpty();
      assertThat(appender.list)
        .filteredOn(event -> event.getLevel() == Level.WARN)
        .extracting(ILoggingEvent::getFormattedMessage)
        .anySatisfy(message -> assertThat(message).contains(REMOTE_INFO_VARIABLE).contains("contains whitespace"))
        .anySatisfy(message -> assertThat(message).contains("running locally"));
    } finally {
      releaseWarnings(appender);
    }
  }

  @Test
  @DisplayName("should warn about whitespace but still read a file whose name contains it")
  void should_warn_about_whitespace_and_read_the_file(@TempDir Path dir) throws IOException {
    // Given
    var file = dir.resolve("remote profiles.json");
    Files.writeString(file, TABLE, UTF_8);
    var appender = captureWarnings();

    try {
      // When
      var profile = resolver(file.toString()).resolve(RemoteInfo.auto(), null, CALL_PATH);

      // Then
      assertThat(profile).map(RemoteProfile::jobName).contains("computed");
      assertThat(appender.list)
        .extracting(ILoggingEvent::getFormattedMessage)
        .anySatisfy(message -> assertThat(message).contains("contains whitespace"));
    } finally {
      releaseWarnings(appender);
    }
  }

  @Test
  @DisplayName("should run locally when the selected entry is not a valid profile")
  void should_run_locally_on_invalid_profile() {
    // When
    var profile = resolver("{\"compute\": {\"job_name\": \"no system\"}}").resolve(RemoteInfo.auto(), null, CALL_PATH);

    // Then
    assertThat(profile).isEmpty();
  }

  @Test
  @DisplayName("should honour explicit and ignore selections before the environment")
  void should_honour_explicit_and_ignore() {
    // Given
    var explicit = RemoteProfile.of("elsewhere", "explicit");
    var resolver = resolver(TABLE);

    // Then
    assertThat(resolver.resolve(RemoteInfo.of(explicit), null, CALL_PATH)).contains(explicit);
    assertThat(resolver.resolve(RemoteInfo.ignore(), null, CALL_PATH)).isEmpty();
  }

  @Test
  @DisplayName("should run locally when the variable is not set")
  void should_run_locally_without_variable() {
    // Given
    var config = AutoparaConfig.builder().withBrokers(JobBrokerRegistry.of()).build();

    // When
    var profile = new ProfileResolver(config).resolve(RemoteInfo.auto(), null, CALL_PATH);

    // Then
    assertThat(profile).isEmpty();
  }

  @Test
  @DisplayName("should read the variable given by the caller")
  void should_read_named_variable() {
    // Given
    var config = AutoparaConfig.builder()
                               .withVariable("WFL_ACE_FIT_REMOTEINFO", "{\"sys_name\": \"cluster\", \"job_name\": \"fit\"}")
                               .withBrokers(JobBrokerRegistry.of())
                               .build();
    var resolver = new ProfileResolver(config);

    // Then
    assertThat(resolver.resolve(RemoteInfo.auto(), "WFL_ACE_FIT_REMOTEINFO", null, CALL_PATH)).isPresent();
    assertThat(resolver.resolve(RemoteInfo.auto(), null, CALL_PATH)).isEmpty();
  }

  @Test
  @DisplayName("should match keys against the end of the call path only")
  void should_match_key_patterns() {
    var path = List.of("a::f", "b::g", "c::h");

    assertThat(ProfileResolver.matches("g$, h$", null, path)).isTrue();
    assertThat(ProfileResolver.matches("h", null, path)).isTrue();
    assertThat(ProfileResolver.matches("f, h", null, path)).isFalse();
    assertThat(ProfileResolver.matches("x$", null, path)).isFalse();
    assertThat(ProfileResolver.matches("a, b, c, h", null, path)).isFalse();
    assertThat(ProfileResolver.matches("[unclosed", null, path)).isFalse();
    assertThat(ProfileResolver.matches("any key", "any key", List.of())).isTrue();
  }

  private static ListAppender<ILoggingEvent> captureWarnings() {
    var appender = new ListAppender<ILoggingEvent>();
    appender.start();
    ((Logger) LoggerFactory.getLogger(ProfileResolver.class)).addAppender(appender);
    return appender;
  }

  private static void releaseWarnings(ListAppender<ILoggingEvent> appender) {
    ((Logger) LoggerFactory.getLogger(ProfileResolver.class)).detachAppender(appender);
    appender.stop();
  }

  private static ProfileResolver resolver(String value) {
    var config = AutoparaConfig.builder()
                               .withVariable(REMOTE_INFO_VARIABLE, value)
                               .withBrokers(JobBrokerRegistry.of())
                               .build();
    return new ProfileResolver(config);
  }
}

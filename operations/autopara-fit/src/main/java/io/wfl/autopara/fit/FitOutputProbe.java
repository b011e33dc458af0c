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

import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.Strictness;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import io.wfl.autopara.domain.cache.CacheProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Probes for the output files of an earlier fit.
 */
public final class FitOutputProbe {
  private static final Logger logger = LoggerFactory.getLogger(FitOutputProbe.class);

  private FitOutputProbe() {
  }

  /**
   * Every {@code <base><format>} file must exist. {@code .json} files must also hold exactly one strictly valid JSON value; {@code .yace}
   * files are only checked for existence.
   *
   * @throws IllegalArgumentException when probed, for a format other than {@code .json} or {@code .yace}
   */
  public static CacheProbe<FitResult> validated(Path base, List<String> formats) {
    return () -> {
      for (var format : formats) {
        var file = sibling(base, format);
        switch (format) {
          case ".json" -> parseStrictly(file);
          case ".yace" -> {
            if (!Files.exists(file)) {
              throw new NoSuchFileException(file.toString());
            }
            logger.warn("Cannot parse yace format, only checking that {} exists", file);
          }
          default -> throw new IllegalArgumentException("Cannot check potential file with format " + format);
        }
      }
      return Optional.of(new FitResult.Fitted(base.toString()));
    };
  }

  /**
   * Reads the problem size written by a dry run: the integers at whitespace-separated fields 3 and 5
   * of the first line of {@code <base>.size}.
   */
  public static CacheProbe<FitResult> size(Path base) {
    return () -> {
      var file = sibling(base, ".size");
      try (var lines = Files.lines(file, UTF_8)) {
        var fields = lines.findFirst().orElse("").trim().split("\\s+");
        if (fields.length < 6) {
          throw new IOException("Malformed size file " + file);
        }
        return Optional.of(new FitResult.MatrixSize(Integer.parseInt(fields[3]), Integer.parseInt(fields[5])));
      } catch (NumberFormatException e) {
        throw new IOException("Malformed size file " + file, e);
      }
    };
  }

  private static void parseStrictly(Path file) throws IOException {
    try (var reader = new JsonReader(Files.newBufferedReader(file, UTF_8))) {
      reader.setStrictness(Strictness.STRICT);
      var json = JsonParser.parseReader(reader);
      if (json.isJsonNull()) {
        throw new JsonParseException("Empty potential file " + file);
      }
      if (reader.peek() != JsonToken.END_DOCUMENT) {
        throw new JsonParseException("Trailing content in potential file " + file);
      }
    }
  }

  static Path sibling(Path base, String suffix) {
    return base.resolveSibling(base.getFileName() + suffix);
  }
}

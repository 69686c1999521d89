/*
 * Copyright 2024 The Closure Compiler Authors.
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

package com.google.ide.refactoring;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableSortedSet;
import com.google.gson.stream.JsonWriter;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.TreeMap;

/**
 * Prints the replacements of a {@link SuggestedFix} as an array of JSON objects, ordered by file
 * and then by offset.
 */
public class JsonFixReportGenerator {
  private final PrintStream stream;

  /**
   * @param stream the stream on which the report is printed. This class does not close the stream
   */
  public JsonFixReportGenerator(PrintStream stream) {
    this.stream = stream;
  }

  public void generateReport(SuggestedFix fix) {
    ByteArrayOutputStream bufferedStream = new ByteArrayOutputStream();
    try (JsonWriter jsonWriter = new JsonWriter(new OutputStreamWriter(bufferedStream, UTF_8))) {
      jsonWriter.beginArray();
      Map<String, ImmutableSortedSet<CodeReplacement>> byFile = new TreeMap<>();
      fix.getReplacements()
          .asMap()
          .forEach(
              (file, replacements) -> byFile.put(file, ImmutableSortedSet.copyOf(replacements)));

      for (Map.Entry<String, ImmutableSortedSet<CodeReplacement>> entry : byFile.entrySet()) {
        for (CodeReplacement replacement : entry.getValue()) {
          jsonWriter.beginObject();
          jsonWriter.name("file").value(entry.getKey());
          jsonWriter.name("offset").value(replacement.getStartPosition());
          jsonWriter.name("length").value(replacement.getLength());
          jsonWriter.name("text").value(replacement.getNewContent());
          jsonWriter.endObject();
        }
      }
      jsonWriter.endArray();
      jsonWriter.flush();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    stream.append(bufferedStream.toString(UTF_8));
  }
}

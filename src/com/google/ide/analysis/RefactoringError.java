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

package com.google.ide.analysis;

import static java.util.Objects.requireNonNull;

import com.google.ide.syntax.SourceFile;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * A diagnostic reported while computing a refactoring.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param sourceName Name of the source
 * @param lineno One-indexed line number of the error location, or -1.
 * @param charno One-indexed column of the error location, or -1.
 * @param offset Character offset of the error location, or -1.
 * @param defaultLevel The level of the diagnostic type.
 */
public record RefactoringError(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    int lineno,
    int charno,
    int offset,
    CheckLevel defaultLevel)
    implements Serializable {
  public RefactoringError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  /**
   * Creates a RefactoringError with no source information
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static RefactoringError make(DiagnosticType type, Object... arguments) {
    return new RefactoringError(type, type.format(arguments), null, -1, -1, -1, type.level);
  }

  /**
   * Creates a RefactoringError at an offset of a file.
   *
   * @param file Determines the line and column of {@code offset}
   * @param offset Character offset of the problem
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static RefactoringError make(
      SourceFile file, int offset, DiagnosticType type, Object... arguments) {
    return new RefactoringError(
        type,
        type.format(arguments),
        file.getName(),
        file.getLineOfOffset(offset),
        file.getColumnOfOffset(offset),
        offset,
        type.level);
  }

  /** Formats the error as {@code file:line:col: LEVEL - [key] description}. */
  public String format(CheckLevel level) {
    StringBuilder sb = new StringBuilder();
    if (sourceName != null) {
      sb.append(sourceName).append(':').append(lineno).append(':').append(charno).append(": ");
    }
    return sb.append(level)
        .append(" - [")
        .append(type.key)
        .append("] ")
        .append(description)
        .toString();
  }

  @Override
  public String toString() {
    return format(defaultLevel);
  }
}

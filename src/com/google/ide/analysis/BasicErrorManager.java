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

import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.Objects;
import java.util.TreeSet;

/**
 * An error manager that keeps every diagnostic reported to it, sorted and de-duplicated, and
 * generates a report when {@link #generateReport()} is called.
 *
 * <p>This error manager does not produce any output, but subclasses can override {@link
 * #println(CheckLevel, RefactoringError)} and {@link #printSummary()} to generate custom output.
 */
public class BasicErrorManager implements ErrorManager {

  private final TreeSet<ErrorWithLevel> messages = new TreeSet<>(new LeveledErrorComparator());
  private int errorCount = 0;
  private int warningCount = 0;

  @Override
  public void report(CheckLevel level, RefactoringError error) {
    if (messages.add(new ErrorWithLevel(error, level))) {
      if (level == CheckLevel.ERROR) {
        errorCount++;
      } else if (level == CheckLevel.WARNING) {
        warningCount++;
      }
    }
  }

  @Override
  public int getErrorCount() {
    return errorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<RefactoringError> getErrors() {
    return toList(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<RefactoringError> getWarnings() {
    return toList(CheckLevel.WARNING);
  }

  /** Replays every diagnostic of this manager, at its reported level, into {@code handler}. */
  public void forwardTo(ErrorHandler handler) {
    for (ErrorWithLevel message : ImmutableList.copyOf(messages)) {
      handler.report(message.level, message.error);
    }
  }

  private ImmutableList<RefactoringError> toList(CheckLevel level) {
    ImmutableList.Builder<RefactoringError> errors = ImmutableList.builder();
    for (ErrorWithLevel p : messages) {
      if (p.level == level) {
        errors.add(p.error);
      }
    }
    return errors.build();
  }

  @Override
  public void generateReport() {
    for (ErrorWithLevel message : ImmutableList.copyOf(messages)) {
      println(message.level, message.error);
    }
    printSummary();
  }

  /**
   * Print a message with a trailing new line. This method is called by the {@link
   * #generateReport()} method when generating messages.
   */
  protected void println(CheckLevel level, RefactoringError error) {}

  /** Print the summary of the operation - number of errors and warnings. */
  protected void printSummary() {}

  /**
   * Orders diagnostics by level, then by (file name, line number, column, description).
   *
   * <p>Note: this comparator imposes orderings that are inconsistent with {@link
   * RefactoringError#equals(Object)}.
   */
  static final class LeveledErrorComparator implements Comparator<ErrorWithLevel> {
    private static final int P1_LT_P2 = -1;
    private static final int P1_GT_P2 = 1;

    @Override
    public int compare(ErrorWithLevel p1, ErrorWithLevel p2) {
      // check level
      if (p1.level != p2.level) {
        return p1.level.compareTo(p2.level);
      }

      // sourceName comparison
      String source1 = p1.error.sourceName();
      String source2 = p2.error.sourceName();
      if (source1 != null && source2 != null) {
        int sourceCompare = source1.compareTo(source2);
        if (sourceCompare != 0) {
          return sourceCompare;
        }
      } else if (source1 == null && source2 != null) {
        return P1_LT_P2;
      } else if (source1 != null && source2 == null) {
        return P1_GT_P2;
      }
      // offset comparison, which orders by line and column
      int offset1 = p1.error.offset();
      int offset2 = p2.error.offset();
      if (offset1 != offset2) {
        return Integer.compare(offset1, offset2);
      }
      int keyCompare = p1.error.type().compareTo(p2.error.type());
      if (keyCompare != 0) {
        return keyCompare;
      }
      // description
      return p1.error.description().compareTo(p2.error.description());
    }
  }

  static final class ErrorWithLevel {
    final RefactoringError error;
    final CheckLevel level;

    ErrorWithLevel(RefactoringError error, CheckLevel level) {
      this.error = error;
      this.level = level;
    }

    @Override
    public int hashCode() {
      return Objects.hash(level, error.description(), error.sourceName(), error.offset());
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof ErrorWithLevel)) {
        return false;
      }
      ErrorWithLevel e = (ErrorWithLevel) obj;
      return Objects.equals(level, e.level)
          && Objects.equals(error.description(), e.error.description())
          && Objects.equals(error.sourceName(), e.error.sourceName())
          && error.offset() == e.error.offset();
    }
  }
}

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

package com.google.ide.syntax;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A half open character range {@code [start, end)} into a {@link SourceFile}. Spans never own the
 * text they refer to.
 */
public record SourceSpan(int start, int end) implements Comparable<SourceSpan> {

  public SourceSpan {
    checkArgument(start >= 0 && start <= end, "Invalid span [%s, %s)", start, end);
  }

  public static SourceSpan of(int start, int end) {
    return new SourceSpan(start, end);
  }

  /** A zero length span, used as an insertion point. */
  public static SourceSpan empty(int offset) {
    return new SourceSpan(offset, offset);
  }

  public int length() {
    return end - start;
  }

  public boolean isEmpty() {
    return start == end;
  }

  /** Whether {@code offset} lies inside the span, or at its end. */
  public boolean containsInclusive(int offset) {
    return start <= offset && offset <= end;
  }

  public boolean contains(int offset) {
    return start <= offset && offset < end;
  }

  public boolean encloses(SourceSpan other) {
    return start <= other.start && other.end <= end;
  }

  public SourceSpan withStart(int newStart) {
    return new SourceSpan(newStart, end);
  }

  @Override
  public int compareTo(SourceSpan other) {
    int result = Integer.compare(start, other.start);
    return result != 0 ? result : Integer.compare(end, other.end);
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}

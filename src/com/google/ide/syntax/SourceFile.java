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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * An immutable snapshot of one source buffer.
 *
 * <p>Besides the text itself the file knows where its lines start and where its comments are, which
 * is all the lexical information the refactorings need.
 */
public final class SourceFile {

  private final String name;
  private final String code;
  private final int[] lineOffsets;
  private final ImmutableList<SourceSpan> comments;

  private SourceFile(String name, String code) {
    this.name = checkNotNull(name);
    this.code = checkNotNull(code);
    this.lineOffsets = computeLineOffsets(code);
    this.comments = scanComments(code);
  }

  public static SourceFile fromCode(String name, String code) {
    return new SourceFile(name, code);
  }

  public String getName() {
    return name;
  }

  public String getCode() {
    return code;
  }

  public int length() {
    return code.length();
  }

  public String getText(SourceSpan span) {
    return code.substring(span.start(), span.end());
  }

  public String getText(int start, int end) {
    return code.substring(start, end);
  }

  public char charAt(int offset) {
    return code.charAt(offset);
  }

  /**
   * Returns the offset of the 1-based {@code line} and {@code column}, or -1 if the position lies
   * outside of the file.
   */
  public int getOffset(int line, int column) {
    if (line < 1 || line > lineOffsets.length || column < 1) {
      return -1;
    }
    int offset = lineOffsets[line - 1] + column - 1;
    int lineEnd = line < lineOffsets.length ? lineOffsets[line] : code.length() + 1;
    return offset < lineEnd ? offset : -1;
  }

  /** Returns the 1-based line of {@code offset}. */
  public int getLineOfOffset(int offset) {
    checkArgument(offset >= 0 && offset <= code.length(), "Offset %s out of range", offset);
    int search = Arrays.binarySearch(lineOffsets, offset);
    return search >= 0 ? search + 1 : -search - 1;
  }

  /** Returns the 1-based column of {@code offset}. */
  public int getColumnOfOffset(int offset) {
    int line = getLineOfOffset(offset);
    return offset - lineOffsets[line - 1] + 1;
  }

  /** All comments in the file, ordered by position. */
  public ImmutableList<SourceSpan> getComments() {
    return comments;
  }

  /** Returns the comment containing {@code offset}, or null. */
  public @Nullable SourceSpan getCommentAt(int offset) {
    for (SourceSpan comment : comments) {
      if (comment.contains(offset)) {
        return comment;
      }
      if (comment.start() > offset) {
        break;
      }
    }
    return null;
  }

  /**
   * Returns the start of the run of comments that directly precedes {@code offset}, only separated
   * from it (and from each other) by whitespace. Returns {@code offset} itself if there is none.
   */
  public int getStartIncludingPrecedingComments(int offset) {
    int result = offset;
    int index = comments.size() - 1;
    while (index >= 0 && comments.get(index).end() > result) {
      index--;
    }
    while (index >= 0) {
      SourceSpan comment = comments.get(index);
      if (!isWhitespace(comment.end(), result)) {
        break;
      }
      result = comment.start();
      index--;
    }
    return result;
  }

  private boolean isWhitespace(int start, int end) {
    for (int i = start; i < end; i++) {
      if (!Character.isWhitespace(code.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private static int[] computeLineOffsets(String code) {
    List<Integer> offsets = new ArrayList<>();
    offsets.add(0);
    for (int i = 0; i < code.length(); i++) {
      if (code.charAt(i) == '\n') {
        offsets.add(i + 1);
      }
    }
    return Ints.toArray(offsets);
  }

  private static ImmutableList<SourceSpan> scanComments(String code) {
    ImmutableList.Builder<SourceSpan> result = ImmutableList.builder();
    int length = code.length();
    int i = 0;
    while (i < length) {
      char c = code.charAt(i);
      if (c == '"') {
        i = skipStringLiteral(code, i);
      } else if (c == '/' && i + 1 < length && code.charAt(i + 1) == '/') {
        int end = code.indexOf('\n', i);
        end = end < 0 ? length : end;
        result.add(SourceSpan.of(i, end));
        i = end;
      } else if (c == '/' && i + 1 < length && code.charAt(i + 1) == '*') {
        int end = skipBlockComment(code, i);
        result.add(SourceSpan.of(i, end));
        i = end;
      } else {
        i++;
      }
    }
    return result.build();
  }

  /** Returns the offset just past the string literal starting at {@code start}. */
  private static int skipStringLiteral(String code, int start) {
    int i = start + 1;
    while (i < code.length()) {
      char c = code.charAt(i);
      if (c == '\\') {
        i += 2;
        continue;
      }
      if (c == '"' || c == '\n') {
        return i + 1;
      }
      i++;
    }
    return code.length();
  }

  /** Block comments nest. */
  private static int skipBlockComment(String code, int start) {
    int depth = 0;
    int i = start;
    while (i < code.length()) {
      if (code.startsWith("/*", i)) {
        depth++;
        i += 2;
      } else if (code.startsWith("*/", i)) {
        depth--;
        i += 2;
        if (depth == 0) {
          return i;
        }
      } else {
        i++;
      }
    }
    return code.length();
  }

  @Override
  public String toString() {
    return name;
  }
}

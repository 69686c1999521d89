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

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableSet;

/** Lexical checks on names. */
public final class Identifiers {

  private static final CharMatcher OPERATOR_CHARS = CharMatcher.anyOf("/=-+*%<>!&|^~?.");

  private static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "as", "async", "await", "break", "case", "catch", "class", "continue", "default", "defer",
          "do", "else", "enum", "extension", "fallthrough", "false", "for", "func", "guard", "if",
          "import", "in", "init", "is", "let", "nil", "protocol", "repeat", "return", "self",
          "Self", "static", "struct", "subscript", "super", "switch", "throw", "throws", "true",
          "try", "typealias", "var", "where", "while", "_");

  private Identifiers() {}

  public static boolean isIdentifierStart(char c) {
    return c == '_' || Character.isLetter(c);
  }

  public static boolean isIdentifierPart(char c) {
    return c == '_' || c == '$' || Character.isLetterOrDigit(c);
  }

  public static boolean isOperatorChar(char c) {
    return OPERATOR_CHARS.matches(c);
  }

  /** Whether {@code text} lexes as a single, non-keyword identifier. */
  public static boolean isIdentifier(String text) {
    if (text.isEmpty() || !isIdentifierStart(text.charAt(0)) || KEYWORDS.contains(text)) {
      return false;
    }
    for (int i = 1; i < text.length(); i++) {
      if (!isIdentifierPart(text.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  /** Whether {@code text} lexes as a single operator. */
  public static boolean isOperator(String text) {
    return !text.isEmpty() && OPERATOR_CHARS.matchesAllOf(text);
  }

  public static boolean isKeyword(String text) {
    return KEYWORDS.contains(text);
  }

  /**
   * Returns the end of the token starting at {@code start}: an identifier, an operator, or a
   * single other character.
   */
  public static int getTokenEnd(CharSequence text, int start) {
    int length = text.length();
    if (start >= length) {
      return start;
    }
    char c = text.charAt(start);
    int i = start + 1;
    if (isIdentifierStart(c) || c == '$') {
      while (i < length && isIdentifierPart(text.charAt(i))) {
        i++;
      }
    } else if (isOperatorChar(c)) {
      while (i < length && isOperatorChar(text.charAt(i))) {
        i++;
      }
    }
    return i;
  }
}

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

package com.google.ide.refactoring.async;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.errorprone.annotations.Immutable;
import com.google.ide.syntax.Decl;
import com.google.ide.syntax.Type;
import org.jspecify.annotations.Nullable;

/**
 * A completion handler, which is either a variable (including parameters) or a function.
 *
 * <p>Both kinds expose the same name and type accessors.
 */
@Immutable
final class HandlerRef {
  enum Kind {
    VARIABLE,
    FUNCTION
  }

  @SuppressWarnings("Immutable") // Decls are not mutated after resolution.
  private final Decl decl;

  private final Kind kind;

  private HandlerRef(Decl decl, Kind kind) {
    this.decl = decl;
    this.kind = kind;
  }

  /** Returns the handler for {@code decl}, or null if it is neither a variable nor a function. */
  static @Nullable HandlerRef of(Decl decl) {
    switch (decl.getKind()) {
      case VAR:
      case PARAM:
        return new HandlerRef(decl, Kind.VARIABLE);
      case FUNC:
        return new HandlerRef(decl, Kind.FUNCTION);
      default:
        return null;
    }
  }

  Kind getKind() {
    return kind;
  }

  Decl getDecl() {
    return decl;
  }

  /** The variable name or the base name of the function. */
  String getName() {
    switch (kind) {
      case VARIABLE:
      case FUNCTION:
        return decl.getName();
    }
    throw new AssertionError(kind);
  }

  Type getType() {
    switch (kind) {
      case VARIABLE:
        return decl.getType();
      case FUNCTION:
        Type type = decl.getType();
        checkArgument(type.isFunction(), "Function %s without function type", decl);
        return type;
    }
    throw new AssertionError(kind);
  }
}

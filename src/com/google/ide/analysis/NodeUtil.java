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

import com.google.ide.syntax.Decl;
import com.google.ide.syntax.Node;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful AST utilities. */
public final class NodeUtil {

  private NodeUtil() {}

  /** Whether the node starts a lexical scope for the names it declares. */
  public static boolean startsNewScope(Node n) {
    switch (n.getToken()) {
      case BLOCK:
      case IF:
      case WHILE:
      case FOR_EACH:
      case CASE:
        return true;
      default:
        return false;
    }
  }

  public static boolean isExpression(Node n) {
    switch (n.getToken()) {
      case CALL:
      case NAME:
      case MEMBER:
      case IMPLICIT_MEMBER:
      case NIL:
      case LITERAL:
      case BINARY:
      case FORCE_UNWRAP:
      case BIND_OPTIONAL:
      case CLOSURE:
      case TRY_OPTIONAL:
      case TRY:
      case AWAIT:
      case TUPLE:
      case PAREN:
        return true;
      default:
        return false;
    }
  }

  /** Functions, parameters, bindings and the variables bound by name patterns. */
  public static boolean isDeclaration(Node n) {
    switch (n.getToken()) {
      case FUNCTION:
      case PARAM:
      case BINDING:
      case NAME_PATTERN:
        return true;
      default:
        return false;
    }
  }

  /** The symbol declared by {@code n}, or null if it does not declare one. */
  public static @Nullable Decl getDeclaredDecl(Node n) {
    switch (n.getToken()) {
      case FUNCTION:
      case PARAM:
      case NAME_PATTERN:
        return n.getDecl();
      default:
        return null;
    }
  }

  /** The declaration referenced by an explicit {@code NAME}, or null. */
  public static @Nullable Decl getExplicitReference(Node n) {
    if (!n.isName() || n.isImplicit()) {
      return null;
    }
    Decl decl = n.getDecl();
    return decl == null || decl.isImplicit() ? null : decl;
  }

  /** Returns the closest enclosing node for which {@code predicate} holds, including {@code n}. */
  public static @Nullable Node getEnclosingNode(Node n, Predicate<Node> pred) {
    for (Node p = n; p != null; p = p.getParent()) {
      if (pred.test(p)) {
        return p;
      }
    }
    return null;
  }
}

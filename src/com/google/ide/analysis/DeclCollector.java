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
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Collects the explicit declarations of a scope that are not nested in a scope of their own.
 * Closures and statements that start a new scope are not entered.
 */
public final class DeclCollector extends NodeTraversal.AbstractPreOrderCallback {
  private final Set<Decl> decls;

  private DeclCollector(Set<Decl> decls) {
    this.decls = decls;
  }

  /**
   * Adds the declarations of {@code scope}, a BLOCK, to {@code decls}. When {@code scope} is a
   * SCRIPT all top level declarations are collected.
   */
  public static void collect(Node scope, Set<Decl> decls, CancellationChecker checker) {
    DeclCollector collector = new DeclCollector(decls);
    for (Node child : scope.children()) {
      NodeTraversal.traverse(child, collector, checker);
    }
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    switch (n.getToken()) {
      case BINDING:
      case BINDING_PATTERN:
      case OPTIONAL_SOME_PATTERN:
      case ENUM_PATTERN:
        return true;
      case CLOSURE:
        return false;
      default:
        break;
    }
    Decl decl = NodeUtil.getDeclaredDecl(n);
    if (decl != null) {
      if (!decl.isImplicit()) {
        decls.add(decl);
      }
      return false;
    }
    return n.isImplicit() || !NodeUtil.startsNewScope(n);
  }
}

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
import java.util.HashSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Collects the explicit references in a scope that appear after a target node and are not
 * declared after it. These are the names that code inserted at the target must not shadow.
 *
 * <p>Every function is collected as well, so that functions and types are never shadowed.
 */
public final class ReferenceCollector extends NodeTraversal.AbstractPreOrderCallback {
  private final Node target;
  private final Set<Decl> declaredDecls = new HashSet<>();
  private final Set<Decl> referencedDecls;
  private boolean afterTarget = false;

  private ReferenceCollector(Node target, Set<Decl> referencedDecls) {
    this.target = target;
    this.referencedDecls = referencedDecls;
  }

  /** Adds the references in {@code scope} that follow {@code target} to {@code decls}. */
  public static void collect(
      Node target, Node scope, Set<Decl> decls, CancellationChecker checker) {
    NodeTraversal.traverse(scope, new ReferenceCollector(target, decls), checker);
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    Decl declared = NodeUtil.getDeclaredDecl(n);
    if (declared != null) {
      if (declared.isDeclContext() && !declared.isImplicit()) {
        referencedDecls.add(declared);
      }
      if (afterTarget && !declared.isImplicit()) {
        declaredDecls.add(declared);
      }
    }
    if (n == target) {
      afterTarget = true;
    } else if (afterTarget) {
      Decl referenced = NodeUtil.getExplicitReference(n);
      if (referenced != null && !declaredDecls.contains(referenced)) {
        referencedDecls.add(referenced);
      }
    }
    return afterTarget || n.getSpan().contains(target.getStart());
  }
}

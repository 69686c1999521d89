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

import com.google.common.collect.ImmutableSet;
import com.google.ide.syntax.Decl;
import com.google.ide.syntax.Node;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Computes, for every block below a root, the declarations referenced in it (or in a nested
 * block) without being declared there first. Those are the names a declaration hoisted into the
 * block could shadow. Functions and types declared in a block always count as referenced.
 *
 * <p>References in the conditions of an {@code if} or {@code while} belong to the enclosing block.
 */
public final class ScopedDeclCollector implements NodeTraversal.Callback {

  private static final class Scope {
    final Set<Decl> declaredDecls = new HashSet<>();
    final Set<Decl> referencedDecls;

    Scope(Set<Decl> referencedDecls) {
      this.referencedDecls = referencedDecls;
    }
  }

  private final Map<Node, Set<Decl>> referencedDecls = new HashMap<>();
  private final ArrayDeque<Scope> scopeStack = new ArrayDeque<>();
  private final CancellationChecker checker;

  public ScopedDeclCollector(CancellationChecker checker) {
    this.checker = checker;
  }

  public void collect(Node root) {
    NodeTraversal.traverse(root, this, checker);
  }

  /** The referenced declarations of {@code block}, empty if it was not collected. */
  public ImmutableSet<Decl> getReferencedDecls(Node block) {
    Set<Decl> decls = referencedDecls.get(block);
    return decls == null ? ImmutableSet.of() : ImmutableSet.copyOf(decls);
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    if (n.isBlock()) {
      scopeStack.push(new Scope(referencedDecls.computeIfAbsent(n, k -> new HashSet<>())));
      return true;
    }
    if (scopeStack.isEmpty()) {
      return true;
    }
    Scope current = scopeStack.peek();
    Decl declared = NodeUtil.getDeclaredDecl(n);
    if (declared != null && !declared.isImplicit()) {
      current.declaredDecls.add(declared);
      if (declared.isDeclContext()) {
        current.referencedDecls.add(declared);
      }
    }
    Decl referenced = NodeUtil.getExplicitReference(n);
    if (referenced != null && !current.declaredDecls.contains(referenced)) {
      current.referencedDecls.add(referenced);
    }
    return true;
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (!n.isBlock()) {
      return;
    }
    Scope scope = scopeStack.pop();
    Scope parentScope = scopeStack.peek();
    if (parentScope != null) {
      // Add any referenced decls to the parent scope that weren't declared there.
      for (Decl decl : scope.referencedDecls) {
        if (!parentScope.declaredDecls.contains(decl)) {
          parentScope.referencedDecls.add(decl);
        }
      }
    }
  }
}

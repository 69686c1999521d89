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
import com.google.ide.analysis.NodeTraversal.AbstractPreOrderCallback;
import com.google.ide.syntax.Node;
import com.google.ide.syntax.SourceSpan;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * Finds every node that contains a target location and satisfies a predicate. The traversal only
 * descends into nodes that contain the target, so the contexts are returned outermost first.
 */
public final class ContextFinder extends AbstractPreOrderCallback {
  private final SourceSpan target;
  private final Predicate<Node> isContext;
  private final ImmutableList.Builder<Node> contexts = ImmutableList.builder();

  private ContextFinder(SourceSpan target, Predicate<Node> isContext) {
    this.target = target;
    this.isContext = isContext;
  }

  /** Contexts enclosing the span {@code target}. */
  public static ImmutableList<Node> findContexts(
      Node root, SourceSpan target, Predicate<Node> isContext) {
    ContextFinder finder = new ContextFinder(target, isContext);
    NodeTraversal.traverse(root, finder);
    return finder.contexts.build();
  }

  /** Contexts enclosing the cursor at {@code offset}. */
  public static ImmutableList<Node> findContexts(
      Node root, int offset, Predicate<Node> isContext) {
    return findContexts(root, SourceSpan.empty(offset), isContext);
  }

  /** The innermost context enclosing the cursor at {@code offset}, or null. */
  public static @Nullable Node findInnermost(Node root, int offset, Predicate<Node> isContext) {
    ImmutableList<Node> contexts = findContexts(root, offset, isContext);
    return contexts.isEmpty() ? null : contexts.get(contexts.size() - 1);
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    boolean result = contains(n.getSpan());
    if (result && isContext.test(n)) {
      contexts.add(n);
    }
    return result;
  }

  private boolean contains(SourceSpan enclosing) {
    if (target.isEmpty()) {
      return enclosing.isEmpty()
          ? enclosing.start() == target.start()
          : enclosing.contains(target.start());
    }
    return enclosing.encloses(target);
  }
}

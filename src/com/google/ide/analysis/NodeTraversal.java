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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.ide.syntax.Node;
import java.util.ArrayDeque;
import org.jspecify.annotations.Nullable;

/**
 * NodeTraversal allows an iteration through the nodes in the syntax tree, and keeps track of the
 * lexical scopes being traversed.
 *
 * <p>The {@link CancellationChecker} is polled before every node, so a cancelled request aborts
 * with a {@link RefactoringCancelledException}.
 */
public class NodeTraversal {
  private final Callback callback;
  private final @Nullable ScopedCallback scopeCallback;
  private final CancellationChecker cancellationChecker;

  /** Roots of the scopes being traversed, innermost first. */
  private final ArrayDeque<Node> scopeRoots = new ArrayDeque<>();

  private @Nullable Node currentNode;

  /** Callback for tree-based traversals */
  public interface Callback {
    /**
     * Visits a node in preorder (before its children) and decides whether the node and its children
     * should be traversed.
     *
     * <p>If this method returns false, the node will not be visited by {@link #visit} and its
     * children will not be visited at all.
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node.
     * @return whether the children of this node should be visited
     */
    boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent);

    /**
     * Visits a node in postorder (after its children). A node is visited in postorder iff {@link
     * #shouldTraverse} returned true for itself.
     */
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** Callback that also knows about scope changes */
  public interface ScopedCallback extends Callback {

    /** Called immediately after entering a new scope, before its children are traversed. */
    void enterScope(NodeTraversal t);

    /** Called immediately before exiting a scope, before the scope root is visited. */
    void exitScope(NodeTraversal t);
  }

  /** Abstract callback to visit all nodes in postorder. */
  public abstract static class AbstractPostOrderCallback implements Callback {
    @Override
    public final boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      return true;
    }
  }

  /** Abstract callback to visit all nodes in preorder. */
  public abstract static class AbstractPreOrderCallback implements Callback {
    @Override
    public final void visit(NodeTraversal t, Node n, @Nullable Node parent) {}
  }

  /** Abstract scoped callback to visit all nodes in postorder. */
  public abstract static class AbstractScopedCallback implements ScopedCallback {
    @Override
    public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      return true;
    }

    @Override
    public void visit(NodeTraversal t, Node n, @Nullable Node parent) {}

    @Override
    public void enterScope(NodeTraversal t) {}

    @Override
    public void exitScope(NodeTraversal t) {}
  }

  public NodeTraversal(Callback cb) {
    this(cb, CancellationChecker.NEVER);
  }

  public NodeTraversal(Callback cb, CancellationChecker cancellationChecker) {
    this.callback = checkNotNull(cb);
    this.scopeCallback = cb instanceof ScopedCallback ? (ScopedCallback) cb : null;
    this.cancellationChecker = checkNotNull(cancellationChecker);
  }

  /** Traverses a parse tree recursively. */
  public static void traverse(Node root, Callback cb) {
    new NodeTraversal(cb).traverse(root);
  }

  public static void traverse(Node root, Callback cb, CancellationChecker cancellationChecker) {
    new NodeTraversal(cb, cancellationChecker).traverse(root);
  }

  /** Traverses a parse tree recursively, starting at {@code root}. */
  public void traverse(Node root) {
    traverseBranch(root, root.getParent());
  }

  private void traverseBranch(Node n, @Nullable Node parent) {
    cancellationChecker.check();
    currentNode = n;
    if (!callback.shouldTraverse(this, n, parent)) {
      return;
    }

    boolean isScope = NodeUtil.startsNewScope(n);
    if (isScope) {
      pushScope(n);
    }
    for (Node child = n.getFirstChild(); child != null; ) {
      // child could be replaced, in which case our child node would no longer point to the true
      // next
      Node next = child.getNext();
      traverseBranch(child, n);
      child = next;
    }
    if (isScope) {
      popScope();
    }

    currentNode = n;
    callback.visit(this, n, parent);
  }

  private void pushScope(Node node) {
    scopeRoots.push(node);
    if (scopeCallback != null) {
      scopeCallback.enterScope(this);
    }
  }

  private void popScope() {
    if (scopeCallback != null) {
      scopeCallback.exitScope(this);
    }
    scopeRoots.pop();
  }

  /** The root of the innermost scope being traversed, or null outside of any scope. */
  public @Nullable Node getScopeRoot() {
    return scopeRoots.peek();
  }

  public int getScopeDepth() {
    return scopeRoots.size();
  }

  public @Nullable Node getCurrentNode() {
    return currentNode;
  }
}

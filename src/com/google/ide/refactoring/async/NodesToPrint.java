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

import com.google.common.collect.ImmutableList;
import com.google.ide.syntax.Node;
import java.util.ArrayList;
import java.util.List;

/**
 * Nodes to print, along with locations that may have comments attached which also need printing.
 *
 * <p>For example, when printing the contents of an if body, comments before the first statement
 * are attached to that statement but a comment before the closing brace is not. The offset of the
 * closing brace is recorded so that comment gets printed too.
 */
final class NodesToPrint {
  private final List<Node> nodes = new ArrayList<>();
  private final List<Integer> possibleCommentLocs = new ArrayList<>();

  NodesToPrint() {}

  NodesToPrint(List<Node> nodes, List<Integer> possibleCommentLocs) {
    this.nodes.addAll(nodes);
    this.possibleCommentLocs.addAll(possibleCommentLocs);
  }

  static NodesToPrint inBraceStmt(Node block) {
    NodesToPrint nodes = new NodesToPrint();
    nodes.addNodesInBraceStmt(block);
    return nodes;
  }

  ImmutableList<Node> getNodes() {
    return ImmutableList.copyOf(nodes);
  }

  ImmutableList<Integer> getPossibleCommentLocs() {
    return ImmutableList.copyOf(possibleCommentLocs);
  }

  void addNode(Node n) {
    nodes.add(n);
  }

  /** Adds an offset that may have a preceding comment. Negative offsets are ignored. */
  void addPossibleCommentLoc(int loc) {
    if (loc >= 0) {
      possibleCommentLocs.add(loc);
    }
  }

  /**
   * Adds the statements of {@code block}, along with its closing brace as a possible comment
   * location so that trailing comments are printed.
   */
  void addNodesInBraceStmt(Node block) {
    for (Node child : block.children()) {
      addNode(child);
    }
    // Implicit braces, as in case bodies, have no closing brace of their own.
    if (!block.isImplicit()) {
      addPossibleCommentLoc(block.getEnd() - 1);
    }
  }

  void addNodes(NodesToPrint other) {
    nodes.addAll(other.nodes);
    possibleCommentLocs.addAll(other.possibleCommentLocs);
  }

  /** Whether the last node is an explicit return or break. */
  boolean hasTrailingReturnOrBreak() {
    if (nodes.isEmpty()) {
      return false;
    }
    Node last = nodes.get(nodes.size() - 1);
    return (last.isReturn() || last.isBreak()) && !last.isImplicit();
  }

  /**
   * Drops a trailing explicit return or break, keeping its start as a comment location. A return
   * with a value is kept.
   */
  void dropTrailingReturnOrBreakIfPossible() {
    if (!hasTrailingReturnOrBreak()) {
      return;
    }
    Node last = nodes.get(nodes.size() - 1);
    if (last.isReturn() && last.hasReturnValue()) {
      return;
    }
    nodes.remove(nodes.size() - 1);
    addPossibleCommentLoc(last.getStart());
  }
}

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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableMap;
import com.google.ide.syntax.Decl;
import com.google.ide.syntax.Node;
import com.google.ide.syntax.Token;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The statements of a callback closure that run on success, or on error, along with the names
 * the closure binds its parameters to in those statements.
 */
final class ClassifiedBlock {
  private final NodesToPrint nodes = new NodesToPrint();
  // closure param -> name
  private final Map<Decl, String> boundNames = new LinkedHashMap<>();
  // bound var -> closure param
  private final Map<Decl, Decl> aliases = new LinkedHashMap<>();
  private boolean allLet = true;

  NodesToPrint nodesToPrint() {
    return nodes;
  }

  /** The name {@code param} was bound to, or an empty string. */
  String boundName(Decl param) {
    return boundNames.getOrDefault(param, "");
  }

  ImmutableMap<Decl, Decl> aliases() {
    return ImmutableMap.copyOf(aliases);
  }

  /** Whether every binding was introduced with {@code let}. */
  boolean allLet() {
    return allLet;
  }

  void addNodesInBraceStmt(Node block) {
    nodes.addNodesInBraceStmt(block);
  }

  void addPossibleCommentLoc(int loc) {
    nodes.addPossibleCommentLoc(loc);
  }

  void addAllNodes(NodesToPrint other) {
    nodes.addNodes(other);
  }

  void addNode(Node n) {
    nodes.addNode(n);
  }

  void addBinding(CallbackCondition fromCondition) {
    Node bindPattern = fromCondition.getBindPattern();
    if (bindPattern == null) {
      return;
    }

    if (bindPattern.getToken() == Token.BINDING_PATTERN
        && !bindPattern.getBooleanProp(Node.Prop.IS_LET)) {
      allLet = false;
    }

    String name = bindPattern.getBoundName();
    Decl singleVar = bindPattern.getSingleVar();
    if (name.isEmpty() || singleVar == null) {
      return;
    }

    Decl previous = aliases.putIfAbsent(singleVar, fromCondition.getSubject());
    checkState(previous == null, "Already bound %s", singleVar);

    // The first name wins.
    boundNames.putIfAbsent(fromCondition.getSubject(), name);
  }

  void addAllBindings(Map<Decl, CallbackCondition> fromConditions) {
    for (CallbackCondition cond : fromConditions.values()) {
      addBinding(cond);
    }
  }
}

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

import com.google.ide.syntax.Decl;
import com.google.ide.syntax.Node;
import com.google.ide.syntax.Token;
import com.google.ide.syntax.Type;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A condition on a completion handler parameter, which is the subject of the condition. Also
 * holds the pattern binding the subject's value, if there is one.
 */
final class CallbackCondition {
  static final CallbackCondition INVALID = new CallbackCondition();

  private ConditionType type = ConditionType.INVALID;
  private @Nullable Decl subject;
  private @Nullable Node bindPattern;
  // Distinguishes .failure from .success for Result subjects.
  private boolean errorCase;

  private CallbackCondition() {}

  /** {@code subject == nil} or {@code subject != nil}. */
  static CallbackCondition fromComparison(Node binary) {
    CallbackCondition cond = new CallbackCondition();
    boolean foundNil = false;
    for (Node operand : binary.children()) {
      if (operand.isNil()) {
        foundNil = true;
      } else if (operand.isName()) {
        cond.subject = operand.getDecl();
      }
    }

    if (cond.subject != null && foundNil) {
      if (binary.getString().equals("==")) {
        cond.type = ConditionType.NIL;
      } else if (binary.getString().equals("!=")) {
        cond.type = ConditionType.NOT_NIL;
      }
    }
    return cond;
  }

  /**
   * A binding of an optional or {@code Result} subject: {@code let bind = subject}, {@code case
   * .success(let bind) = subject}, {@code case .failure(let bind) = subject} or {@code let bind =
   * try? subject.get()}.
   */
  static CallbackCondition fromBinding(Node pattern, Node init) {
    CallbackCondition cond = new CallbackCondition();
    if (init.isName()) {
      if (pattern.getToken() == Token.OPTIONAL_SOME_PATTERN) {
        cond.type = ConditionType.NOT_NIL;
        cond.subject = init.getDecl();
        cond.bindPattern = pattern.getFirstChild();
      } else if (pattern.getToken() == Token.ENUM_PATTERN) {
        cond.initFromEnumPattern(init.getDecl(), pattern);
      }
    } else if (init.isTryOptional() && pattern.getToken() == Token.OPTIONAL_SOME_PATTERN) {
      cond.initFromOptionalTry(pattern.getFirstChild(), init);
    }
    return cond;
  }

  /** A {@code case .success(let bind):} item of a switch over a {@code Result} subject. */
  static CallbackCondition fromCaseItem(@Nullable Decl subject, Node caseItem) {
    CallbackCondition cond = new CallbackCondition();
    Node pattern = caseItem.getFirstChild();
    if (pattern != null && pattern.getToken() == Token.ENUM_PATTERN) {
      cond.initFromEnumPattern(subject, pattern);
    }
    return cond;
  }

  boolean isValid() {
    return type != ConditionType.INVALID;
  }

  ConditionType getType() {
    return type;
  }

  @Nullable Decl getSubject() {
    return subject;
  }

  @Nullable Node getBindPattern() {
    return bindPattern;
  }

  boolean isErrorCase() {
    return errorCase;
  }

  /**
   * Adds every condition of {@code conditionList} on one of {@code decls} to {@code addTo}.
   * Returns true if every condition was mapped to a distinct decl and at least one was found.
   */
  static boolean all(Node conditionList, Set<Decl> decls, Map<Decl, CallbackCondition> addTo) {
    boolean handled = true;
    for (Node element : conditionList.children()) {
      if (element.getToken() == Token.COND_BINDING) {
        CallbackCondition cond = fromBinding(element.getFirstChild(), element.getLastChild());
        handled &= addCond(cond, decls, addTo);
        continue;
      }

      Deque<Node> exprs = new ArrayDeque<>();
      exprs.push(element);
      while (!exprs.isEmpty()) {
        Node next = exprs.pop();
        if (next.isBinary()) {
          if (next.getString().equals("&&")) {
            exprs.push(next.getFirstChild());
            exprs.push(next.getLastChild());
          } else {
            handled &= addCond(fromComparison(next), decls, addTo);
          }
          continue;
        }
        handled = false;
      }
    }
    return handled && !addTo.isEmpty();
  }

  private static boolean addCond(
      CallbackCondition cond, Set<Decl> decls, Map<Decl, CallbackCondition> addTo) {
    if (!cond.isValid() || !decls.contains(cond.subject) || addTo.containsKey(cond.subject)) {
      return false;
    }
    addTo.put(cond.subject, cond);
    return true;
  }

  private void initFromEnumPattern(@Nullable Decl d, Node enumPattern) {
    Decl element = enumPattern.getDecl();
    if (element == null) {
      return;
    }
    Type enumType = element.getContextType();
    if (enumType == null || !enumType.isResult()) {
      return;
    }
    if (element.getName().equals("failure")) {
      errorCase = true;
    }
    type = ConditionType.NOT_NIL;
    subject = d;
    bindPattern = enumPattern.getFirstChild();
  }

  private void initFromOptionalTry(@Nullable Node pattern, Node tryOptional) {
    Node call = tryOptional.getFirstChild();
    if (!call.isCall() || !call.getCallee().isMember()) {
      return;
    }
    Node member = call.getCallee();
    Node base = member.getFirstChild();
    if (!base.isName() || base.getDecl() == null || !getType(base).isResult()) {
      return;
    }

    Decl fn = member.getDecl();
    if (fn == null || !fn.isFunc() || !fn.getName().equals("get")) {
      return;
    }

    type = ConditionType.NOT_NIL;
    subject = base.getDecl();
    bindPattern = pattern;
  }

  private static Type getType(Node n) {
    return n.getType() != null ? n.getType() : n.getDecl().getType();
  }
}

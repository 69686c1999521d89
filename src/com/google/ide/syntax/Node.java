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

package com.google.ide.syntax;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * A node in the resolved syntax tree.
 *
 * <p>Children are kept in a doubly linked sibling list. The {@code previous} pointer of the first
 * child points at the last child so that appending is constant time.
 */
public class Node {

  /** Extra properties attached to nodes. */
  public enum Prop {
    /** SourceSpan of the label of an ARGUMENT or the names of a PARAM. */
    LABEL_SPAN,
    /** SourceSpan of the name of a FUNCTION, MEMBER or IMPLICIT_MEMBER. */
    NAME_SPAN,
    /** SourceSpan of the {@code throws} keyword of a FUNCTION. */
    THROWS_SPAN,
    /** SourceSpan of the generic where clause of a FUNCTION. */
    WHERE_CLAUSE_SPAN,
    /** Node exited by a BREAK. */
    BREAK_TARGET,
    /** Boolean: node was synthesized and has no source text of its own. */
    IMPLICIT,
    /** Boolean: ARGUMENT is a trailing closure. */
    TRAILING_CLOSURE,
    /** Boolean: BINDING or BINDING_PATTERN introduced with {@code let}. */
    IS_LET,
    /** Boolean: LITERAL is a string literal. */
    IS_STRING,
    /** Boolean: PARAM of a subscript, whose single name is not an argument label. */
    NONCOLLAPSIBLE,
    /** Boolean: node lies in a conditionally compiled region that is not active. */
    INACTIVE,
    /** ImmutableList of SourceSpans: the labels of a compound name reference {@code foo(a:b:)}. */
    COMPOUND_LABEL_SPANS,
  }

  private final Token token;
  private int start;
  private int end;
  private @Nullable String string;
  private @Nullable Decl decl;
  private @Nullable Type type;
  private final EnumMap<Prop, Object> props = new EnumMap<>(Prop.class);

  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node next;
  private @Nullable Node previous;

  public Node(Token token, int start, int end) {
    this.token = checkNotNull(token);
    setSpan(start, end);
  }

  public Node(Token token, SourceSpan span) {
    this(token, span.start(), span.end());
  }

  public static Node newString(Token token, String string, int start, int end) {
    Node n = new Node(token, start, end);
    n.setString(string);
    return n;
  }

  public final Token getToken() {
    return token;
  }

  public final int getStart() {
    return start;
  }

  public final int getEnd() {
    return end;
  }

  public final SourceSpan getSpan() {
    return SourceSpan.of(start, end);
  }

  public final void setSpan(int start, int end) {
    checkArgument(0 <= start && start <= end, "Invalid span [%s, %s)", start, end);
    this.start = start;
    this.end = end;
  }

  public final void setEnd(int end) {
    setSpan(start, end);
  }

  /** The name, label, operator or literal text, depending on the token. */
  public final String getString() {
    return string == null ? "" : string;
  }

  public final void setString(String string) {
    this.string = string;
  }

  /** The declaration this node declares or refers to. */
  public final @Nullable Decl getDecl() {
    return decl;
  }

  public final void setDecl(@Nullable Decl decl) {
    this.decl = decl;
  }

  public final @Nullable Type getType() {
    return type;
  }

  public final void setType(@Nullable Type type) {
    this.type = type;
  }

  // Properties

  public final void putProp(Prop prop, @Nullable Object value) {
    if (value == null) {
      props.remove(prop);
    } else {
      props.put(prop, value);
    }
  }

  public final @Nullable Object getProp(Prop prop) {
    return props.get(prop);
  }

  public final void putBooleanProp(Prop prop, boolean value) {
    putProp(prop, value ? Boolean.TRUE : null);
  }

  public final boolean getBooleanProp(Prop prop) {
    return props.containsKey(prop);
  }

  public final @Nullable SourceSpan getSpanProp(Prop prop) {
    return (SourceSpan) props.get(prop);
  }

  @SuppressWarnings("unchecked") // Only COMPOUND_LABEL_SPANS holds a list.
  public final ImmutableList<SourceSpan> getCompoundLabelSpans() {
    Object spans = props.get(Prop.COMPOUND_LABEL_SPANS);
    return spans == null ? ImmutableList.of() : (ImmutableList<SourceSpan>) spans;
  }

  public final boolean isImplicit() {
    return getBooleanProp(Prop.IMPLICIT);
  }

  // Tree structure

  public final @Nullable Node getParent() {
    return parent;
  }

  public final @Nullable Node getGrandparent() {
    return parent == null ? null : parent.parent;
  }

  public final boolean hasChildren() {
    return first != null;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first == null ? null : first.next;
  }

  public final @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getPrevious() {
    return parent == null || this == parent.first ? null : previous;
  }

  public final Node getOnlyChild() {
    checkState(first != null && first.next == null, "%s does not have exactly one child", token);
    return first;
  }

  public final Node getChildAtIndex(int i) {
    Node n = first;
    while (i > 0) {
      n = n.next;
      i--;
    }
    return n;
  }

  public final int getIndexOfChild(Node child) {
    Node n = first;
    int i = 0;
    while (n != null) {
      if (child == n) {
        return i;
      }
      n = n.next;
      i++;
    }
    return -1;
  }

  public final int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  public final void addChildToBack(Node child) {
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    checkArgument(child.next == null);
    checkArgument(child.previous == null);

    if (first == null) {
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      child.previous = last;
      first.previous = child;
    }
    child.parent = this;
  }

  public final Iterable<Node> children() {
    return () ->
        new Iterator<Node>() {
          private @Nullable Node current = first;

          @Override
          public boolean hasNext() {
            return current != null;
          }

          @Override
          public Node next() {
            if (current == null) {
              throw new NoSuchElementException();
            }
            Node result = current;
            current = current.next;
            return result;
          }
        };
  }

  public final ImmutableList<Node> getChildren() {
    return ImmutableList.copyOf(children());
  }

  /** Whether {@code this} is {@code other} or one of its ancestors. */
  public final boolean isAncestorOf(Node other) {
    for (Node n = other; n != null; n = n.parent) {
      if (n == this) {
        return true;
      }
    }
    return false;
  }

  // Token predicates

  public final boolean isScript() {
    return token == Token.SCRIPT;
  }

  public final boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public final boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public final boolean isParam() {
    return token == Token.PARAM;
  }

  public final boolean isBinding() {
    return token == Token.BINDING;
  }

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isIf() {
    return token == Token.IF;
  }

  public final boolean isGuard() {
    return token == Token.GUARD;
  }

  public final boolean isSwitch() {
    return token == Token.SWITCH;
  }

  public final boolean isCase() {
    return token == Token.CASE;
  }

  public final boolean isReturn() {
    return token == Token.RETURN;
  }

  public final boolean isBreak() {
    return token == Token.BREAK;
  }

  public final boolean isThrow() {
    return token == Token.THROW;
  }

  public final boolean isCall() {
    return token == Token.CALL;
  }

  public final boolean isArgument() {
    return token == Token.ARGUMENT;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isMember() {
    return token == Token.MEMBER;
  }

  public final boolean isImplicitMember() {
    return token == Token.IMPLICIT_MEMBER;
  }

  public final boolean isNil() {
    return token == Token.NIL;
  }

  public final boolean isStringLiteral() {
    return token == Token.LITERAL && getBooleanProp(Prop.IS_STRING);
  }

  public final boolean isBinary() {
    return token == Token.BINARY;
  }

  public final boolean isClosure() {
    return token == Token.CLOSURE;
  }

  public final boolean isForceUnwrap() {
    return token == Token.FORCE_UNWRAP;
  }

  public final boolean isBindOptional() {
    return token == Token.BIND_OPTIONAL;
  }

  public final boolean isTryOptional() {
    return token == Token.TRY_OPTIONAL;
  }

  public final boolean isStatement() {
    return token.isStatement();
  }

  public final boolean isPattern() {
    return token.isPattern();
  }

  // Structural accessors

  public final Node getFunctionParamList() {
    checkState(isFunction() || isClosure(), token);
    return first;
  }

  /** The body of a function or closure; null for a function without one. */
  public final @Nullable Node getFunctionBody() {
    checkState(isFunction() || isClosure(), token);
    return first.next;
  }

  public final Node getCallee() {
    checkState(isCall(), token);
    return first;
  }

  /** The ARGUMENT children of a CALL. */
  public final ImmutableList<Node> getArguments() {
    checkState(isCall(), token);
    ImmutableList.Builder<Node> args = ImmutableList.builder();
    for (Node n = first.next; n != null; n = n.next) {
      args.add(n);
    }
    return args.build();
  }

  /** The argument values of a CALL, in order. */
  public final ImmutableList<Node> getArgumentValues() {
    ImmutableList.Builder<Node> values = ImmutableList.builder();
    for (Node arg : getArguments()) {
      values.add(arg.getFirstChild());
    }
    return values.build();
  }

  /** The label of an ARGUMENT, empty when unlabeled. */
  public final String getLabel() {
    checkState(isArgument(), token);
    return getString();
  }

  public final boolean isTrailingClosure() {
    return getBooleanProp(Prop.TRAILING_CLOSURE);
  }

  public final Node getCondition() {
    checkState(isIf() || isGuard() || token == Token.WHILE, token);
    return first;
  }

  public final Node getThenBlock() {
    checkState(isIf(), token);
    return first.next;
  }

  /** The else branch of an if, which is either a BLOCK or another IF. */
  public final @Nullable Node getElse() {
    checkState(isIf(), token);
    return first.next.next;
  }

  public final Node getGuardBody() {
    checkState(isGuard(), token);
    return first.next;
  }

  public final Node getSwitchSubject() {
    checkState(isSwitch(), token);
    return first;
  }

  public final ImmutableList<Node> getCases() {
    checkState(isSwitch(), token);
    ImmutableList.Builder<Node> cases = ImmutableList.builder();
    for (Node n = first.next; n != null; n = n.next) {
      cases.add(n);
    }
    return cases.build();
  }

  public final ImmutableList<Node> getCaseItems() {
    checkState(isCase(), token);
    ImmutableList.Builder<Node> items = ImmutableList.builder();
    for (Node n = first; n != null && n.token == Token.CASE_ITEM; n = n.next) {
      items.add(n);
    }
    return items.build();
  }

  public final Node getCaseBody() {
    checkState(isCase(), token);
    return getLastChild();
  }

  public final boolean isDefaultCase() {
    return isCase() && first.token != Token.CASE_ITEM;
  }

  /** Whether the case body ends in {@code fallthrough}. */
  public final boolean hasFallthroughDest() {
    Node last = getCaseBody().getLastChild();
    return last != null && last.token == Token.FALLTHROUGH;
  }

  public final boolean hasWhereClause() {
    checkState(token == Token.CASE_ITEM, token);
    return first.next != null;
  }

  public final boolean hasReturnValue() {
    checkState(isReturn(), token);
    return first != null;
  }

  public final @Nullable Node getBreakTarget() {
    return (Node) getProp(Prop.BREAK_TARGET);
  }

  /** The declaration referenced by a name or member expression, looking through parens. */
  public final @Nullable Decl getReferencedDecl() {
    switch (token) {
      case NAME:
      case MEMBER:
      case IMPLICIT_MEMBER:
        return decl;
      case PAREN:
        return first.getReferencedDecl();
      default:
        return null;
    }
  }

  /** For a CALL, the declaration of the called function or handler. */
  public final @Nullable Decl getCalledDecl() {
    return getCallee().getReferencedDecl();
  }

  /** Looks through {@code let}/{@code var} patterns. */
  public final Node getSemanticsProvidingPattern() {
    Node n = this;
    while (n.token == Token.BINDING_PATTERN) {
      n = n.first;
    }
    return n;
  }

  /** The name bound by a simple pattern, or an empty string. */
  public final String getBoundName() {
    Node p = getSemanticsProvidingPattern();
    return p.token == Token.NAME_PATTERN ? p.getString() : "";
  }

  /** The single variable bound by a simple pattern, or null. */
  public final @Nullable Decl getSingleVar() {
    Node p = getSemanticsProvidingPattern();
    return p.token == Token.NAME_PATTERN ? p.decl : null;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder().append(token);
    if (string != null) {
      sb.append(' ').append(string);
    }
    return sb.append(' ').append(getSpan()).toString();
  }
}

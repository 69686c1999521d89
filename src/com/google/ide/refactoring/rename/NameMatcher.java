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

package com.google.ide.refactoring.rename;

import com.google.common.collect.ImmutableList;
import com.google.ide.analysis.NodeTraversal;
import com.google.ide.analysis.NodeTraversal.AbstractPostOrderCallback;
import com.google.ide.analysis.NodeTraversal.AbstractPreOrderCallback;
import com.google.ide.syntax.Identifiers;
import com.google.ide.syntax.Node;
import com.google.ide.syntax.SourceFile;
import com.google.ide.syntax.SourceSpan;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Resolves name locations by matching them against the syntax tree of a file.
 *
 * <p>Locations inside comments and string literals are resolved lexically: the identifier at the
 * location, followed by a selector style label list such as {@code (a:_:)} if there is one.
 */
public final class NameMatcher implements NameRangeResolver {
  private final SourceFile file;
  private final Node root;
  private @Nullable Map<Integer, Node> namesByStart;

  public NameMatcher(SourceFile file, Node root) {
    this.file = file;
    this.root = root;
  }

  @Override
  public ImmutableList<ResolvedLoc> resolve(List<UnresolvedLoc> locs) {
    ImmutableList.Builder<ResolvedLoc> resolved = ImmutableList.builder();
    for (UnresolvedLoc loc : locs) {
      resolved.add(resolve(loc));
    }
    return resolved.build();
  }

  private ResolvedLoc resolve(UnresolvedLoc loc) {
    int offset = loc.offset();
    if (offset < 0 || offset >= file.length()) {
      return ResolvedLoc.unresolved();
    }
    SourceSpan comment = file.getCommentAt(offset);
    if (comment != null) {
      return resolveLexically(null, offset, comment.end());
    }
    Node n = getNamesByStart().get(offset);
    if (n == null) {
      Node literal = findStringLiteral(offset);
      return literal == null
          ? ResolvedLoc.unresolved()
          : resolveLexically(literal, offset, literal.getEnd());
    }

    boolean isActive = isActive(n);
    switch (n.getToken()) {
      case FUNCTION:
        {
          ImmutableList.Builder<SourceSpan> labels = ImmutableList.builder();
          boolean noncollapsible = false;
          for (Node param : n.getFunctionParamList().children()) {
            labels.add(param.getSpanProp(Node.Prop.LABEL_SPAN));
            noncollapsible |= param.getBooleanProp(Node.Prop.NONCOLLAPSIBLE);
          }
          return new ResolvedLoc(
              n,
              n.getSpanProp(Node.Prop.NAME_SPAN),
              labels.build(),
              -1,
              noncollapsible ? LabelRangeType.NONCOLLAPSIBLE_PARAM : LabelRangeType.PARAM,
              isActive,
              false);
        }
      case PARAM:
        return withoutLabels(n, n.getSpanProp(Node.Prop.NAME_SPAN), isActive);
      case NAME_PATTERN:
        return withoutLabels(n, n.getSpan(), isActive);
      default:
        return resolveReference(n, loc.resolveArgs(), isActive);
    }
  }

  private ResolvedLoc resolveReference(Node n, boolean resolveArgs, boolean isActive) {
    SourceSpan range = n.isName() ? n.getSpan() : n.getSpanProp(Node.Prop.NAME_SPAN);
    ImmutableList<SourceSpan> compoundLabels = n.getCompoundLabelSpans();
    if (!compoundLabels.isEmpty()) {
      return new ResolvedLoc(
          n, range, compoundLabels, -1, LabelRangeType.SELECTOR, isActive, false);
    }
    Node parent = n.getParent();
    if (resolveArgs && parent != null && parent.isCall() && parent.getCallee() == n) {
      ImmutableList.Builder<SourceSpan> labels = ImmutableList.builder();
      int firstTrailingLabel = -1;
      int index = 0;
      for (Node arg : parent.getArguments()) {
        if (arg.isTrailingClosure() && firstTrailingLabel < 0) {
          firstTrailingLabel = index;
        }
        labels.add(getArgumentLabel(arg));
        index++;
      }
      return new ResolvedLoc(
          n, range, labels.build(), firstTrailingLabel, LabelRangeType.CALL_ARG, isActive, false);
    }
    return withoutLabels(n, range, isActive);
  }

  /** The label of a trailing closure is only its identifier, without the colon. */
  private SourceSpan getArgumentLabel(Node arg) {
    SourceSpan label = arg.getSpanProp(Node.Prop.LABEL_SPAN);
    if (!arg.isTrailingClosure() || label.isEmpty()) {
      return label;
    }
    int end = getIdentifierEnd(file.getCode(), label.start(), label.end());
    return end == label.start() ? label : SourceSpan.of(label.start(), end);
  }

  private static ResolvedLoc withoutLabels(Node n, SourceSpan range, boolean isActive) {
    return new ResolvedLoc(
        n, range, ImmutableList.of(), -1, LabelRangeType.NONE, isActive, false);
  }

  /** Resolves {@code foo} or {@code foo(a:_:)} in text that was not parsed. */
  private ResolvedLoc resolveLexically(@Nullable Node node, int offset, int limit) {
    String code = file.getCode();
    int nameEnd = getIdentifierEnd(code, offset, limit);
    if (nameEnd == offset) {
      return ResolvedLoc.unresolved();
    }
    SourceSpan range = SourceSpan.of(offset, nameEnd);
    ImmutableList<SourceSpan> labels = parseSelectorLabels(code, nameEnd, limit);
    return new ResolvedLoc(
        node,
        range,
        labels,
        -1,
        labels.isEmpty() ? LabelRangeType.NONE : LabelRangeType.SELECTOR,
        true,
        false);
  }

  private static int getIdentifierEnd(String code, int start, int limit) {
    if (code.charAt(start) == '`') {
      int close = code.indexOf('`', start + 1);
      return close < 0 || close >= limit ? start : close + 1;
    }
    if (!Identifiers.isIdentifierStart(code.charAt(start))) {
      return start;
    }
    return Math.min(Identifiers.getTokenEnd(code, start), limit);
  }

  /** Parses {@code (a:_:)} at {@code start}, returning no labels unless it is well formed. */
  private static ImmutableList<SourceSpan> parseSelectorLabels(String code, int start, int limit) {
    if (start >= limit || code.charAt(start) != '(') {
      return ImmutableList.of();
    }
    ImmutableList.Builder<SourceSpan> labels = ImmutableList.builder();
    int i = start + 1;
    while (i < limit && code.charAt(i) != ')') {
      int labelEnd = getIdentifierEnd(code, i, limit);
      if (labelEnd == i || labelEnd >= limit || code.charAt(labelEnd) != ':') {
        return ImmutableList.of();
      }
      labels.add(SourceSpan.of(i, labelEnd));
      i = labelEnd + 1;
    }
    return i < limit ? labels.build() : ImmutableList.of();
  }

  private static boolean isActive(Node n) {
    for (Node p = n; p != null; p = p.getParent()) {
      if (p.getBooleanProp(Node.Prop.INACTIVE)) {
        return false;
      }
    }
    return true;
  }

  private @Nullable Node findStringLiteral(int offset) {
    Node[] result = new Node[1];
    NodeTraversal.traverse(
        root,
        new AbstractPreOrderCallback() {
          @Override
          public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
            if (n.isStringLiteral() && n.getSpan().contains(offset)) {
              result[0] = n;
            }
            return n.getSpan().contains(offset) || n.isScript();
          }
        });
    return result[0];
  }

  private Map<Integer, Node> getNamesByStart() {
    if (namesByStart == null) {
      Map<Integer, Node> names = new HashMap<>();
      NodeTraversal.traverse(
          root,
          new AbstractPostOrderCallback() {
            @Override
            public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
              SourceSpan nameSpan = getNameSpan(n);
              if (nameSpan != null) {
                names.putIfAbsent(nameSpan.start(), n);
              }
            }
          });
      namesByStart = names;
    }
    return namesByStart;
  }

  private static @Nullable SourceSpan getNameSpan(Node n) {
    if (n.isImplicit()) {
      return null;
    }
    switch (n.getToken()) {
      case FUNCTION:
      case PARAM:
      case MEMBER:
      case IMPLICIT_MEMBER:
        return n.getSpanProp(Node.Prop.NAME_SPAN);
      case NAME:
      case NAME_PATTERN:
        return n.getSpan();
      default:
        return null;
    }
  }
}

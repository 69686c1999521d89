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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.ide.analysis.CancellationChecker;
import com.google.ide.analysis.NodeTraversal;
import com.google.ide.analysis.NodeTraversal.AbstractPostOrderCallback;
import com.google.ide.analysis.NodeUtil;
import com.google.ide.syntax.Decl;
import com.google.ide.syntax.Identifiers;
import com.google.ide.syntax.Node;
import com.google.ide.syntax.SourceFile;
import com.google.ide.syntax.SourceSpan;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Collects the occurrences of a local declaration: the declaration itself, its references within
 * the enclosing scope, and any comment or string literal in that scope that spells its base name.
 */
public final class LocalRenameCollector {
  private final SourceFile file;
  private final CancellationChecker cancellationChecker;

  public LocalRenameCollector(SourceFile file, CancellationChecker cancellationChecker) {
    this.file = file;
    this.cancellationChecker = cancellationChecker;
  }

  /** Returns the node whose extent bounds the occurrences of {@code decl}. */
  public static Node getRenameScope(Decl decl) {
    Node declNode = decl.getDeclaringNode();
    checkArgument(declNode != null && declNode.getParent() != null, "No declaration for %s", decl);
    return NodeUtil.getEnclosingNode(
        declNode.getParent(),
        n -> NodeUtil.startsNewScope(n) || n.isFunction() || n.isClosure() || n.isScript());
  }

  /** Returns the occurrences of {@code decl} in source order, to be renamed to {@code newName}. */
  public ImmutableList<RenameLoc> collect(Decl decl, String newName) {
    Node scope = getRenameScope(decl);
    String oldName = decl.getFullName();
    boolean isFunctionLike = decl.isFunc();

    List<Occurrence> occurrences = new ArrayList<>();
    Node declNode = decl.getDeclaringNode();
    occurrences.add(new Occurrence(getNameStart(declNode), NameUsage.DEFINITION));

    NodeTraversal.traverse(
        scope,
        new AbstractPostOrderCallback() {
          @Override
          public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
            if (NodeUtil.getExplicitReference(n) == decl) {
              boolean isCallee = parent != null && parent.isCall() && parent.getCallee() == n;
              occurrences.add(
                  new Occurrence(
                      n.getStart(),
                      isCallee && isFunctionLike ? NameUsage.CALL : NameUsage.REFERENCE));
            } else if (n.isStringLiteral()) {
              addTextualOccurrences(n.getSpan(), decl.getName(), occurrences);
            }
          }
        },
        cancellationChecker);

    for (SourceSpan comment : file.getComments()) {
      if (scope.getSpan().encloses(comment)) {
        addTextualOccurrences(comment, decl.getName(), occurrences);
      }
    }

    occurrences.sort(Comparator.comparingInt(Occurrence::offset));
    ImmutableList.Builder<RenameLoc> locs = ImmutableList.builder();
    for (Occurrence occurrence : occurrences) {
      locs.add(
          new RenameLoc(
              file.getLineOfOffset(occurrence.offset()),
              file.getColumnOfOffset(occurrence.offset()),
              occurrence.usage(),
              oldName,
              newName,
              isFunctionLike,
              false));
    }
    return locs.build();
  }

  private static int getNameStart(Node declNode) {
    SourceSpan nameSpan = declNode.getSpanProp(Node.Prop.NAME_SPAN);
    return nameSpan != null ? nameSpan.start() : declNode.getStart();
  }

  /** Adds every whole-word spelling of {@code name} inside {@code span} as an unknown usage. */
  private void addTextualOccurrences(SourceSpan span, String name, List<Occurrence> out) {
    String code = file.getCode();
    int from = span.start();
    while (true) {
      int index = code.indexOf(name, from);
      if (index < 0 || index + name.length() > span.end()) {
        return;
      }
      int end = index + name.length();
      boolean startsWord = index == 0 || !Identifiers.isIdentifierPart(code.charAt(index - 1));
      boolean endsWord = end == code.length() || !Identifiers.isIdentifierPart(code.charAt(end));
      if (startsWord && endsWord) {
        out.add(new Occurrence(index, NameUsage.UNKNOWN));
      }
      from = end;
    }
  }

  private record Occurrence(int offset, NameUsage usage) {}
}

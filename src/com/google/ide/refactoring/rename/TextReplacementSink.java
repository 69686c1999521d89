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

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.ide.refactoring.CodeReplacement;
import com.google.ide.syntax.SourceFile;
import com.google.ide.syntax.SourceSpan;

/**
 * Turns matched ranges into the text edits that rename the old name to the new one. Ranges whose
 * text would not change produce no edit.
 */
public final class TextReplacementSink implements RenameRangeSink {
  private final SourceFile file;
  private final CompoundName oldName;
  private final CompoundName newName;
  private final ImmutableList.Builder<CodeReplacement> replacements = ImmutableList.builder();

  public TextReplacementSink(SourceFile file, CompoundName oldName, CompoundName newName) {
    checkArgument(oldName.isValid() && newName.isValid(), "%s -> %s", oldName, newName);
    checkArgument(
        oldName.partsCount() == newName.partsCount(), "Arity of %s -> %s", oldName, newName);
    this.file = file;
    this.oldName = oldName;
    this.newName = newName;
  }

  @Override
  public void renameBase(SourceSpan range, RefactoringRangeKind kind) {
    if (!oldName.getBase().equals(newName.getBase())) {
      add(range, newName.getBase());
    }
  }

  @Override
  public void renameLabel(SourceSpan range, RefactoringRangeKind kind, int index) {
    String existing = file.getText(range);
    String text =
        getReplacementText(existing, kind, oldName.getArg(index), newName.getArg(index));
    if (!text.equals(existing)) {
      add(range, text);
    }
  }

  public ImmutableList<CodeReplacement> getReplacements() {
    return replacements.build();
  }

  private void add(SourceSpan range, String text) {
    replacements.add(CodeReplacement.create(range.start(), range.length(), text));
  }

  private static String getReplacementText(
      String labelRange, RefactoringRangeKind kind, String oldLabel, String newLabel) {
    switch (kind) {
      case CALL_ARGUMENT_LABEL:
        return newLabel;
      case CALL_ARGUMENT_COLON:
        return getCallArgColonReplacement(labelRange, newLabel);
      case CALL_ARGUMENT_COMBINED:
        return newLabel.isEmpty() ? "" : newLabel + ": ";
      case PARAMETER_NAME:
        return getParamNameReplacement(labelRange, oldLabel, newLabel);
      case NONCOLLAPSIBLE_PARAMETER_NAME:
        return labelRange;
      case DECL_ARGUMENT_LABEL:
        return getDeclArgumentLabelReplacement(labelRange, newLabel);
      case SELECTOR_ARGUMENT_LABEL:
        return newLabel.isEmpty() ? "_" : newLabel;
      case BASE_NAME:
      case KEYWORD_BASE_NAME:
        break;
    }
    throw new IllegalArgumentException("Not a label range: " + kind);
  }

  // foo( []3, a[: ]2,  b[ : ]3 ...)
  private static String getCallArgColonReplacement(String oldLabelRange, String newLabel) {
    if (newLabel.isEmpty()) {
      return "";
    }
    if (oldLabelRange.isEmpty()) {
      return ": ";
    }
    return oldLabelRange;
  }

  /** The leading whitespace of {@code oldParam} is part of its range. */
  private static String getParamNameReplacement(
      String oldParam, String oldArgLabel, String newArgLabel) {
    // foo(a a: Int) is redundant.
    if (!newArgLabel.isEmpty()
        && CharMatcher.whitespace().trimLeadingFrom(oldParam).equals(newArgLabel)) {
      return "";
    }
    // foo(x: Int) to foo(_:) keeps x as the parameter name used by the body.
    if (newArgLabel.isEmpty() && !oldArgLabel.isEmpty() && oldParam.isEmpty()) {
      return " " + oldArgLabel;
    }
    return oldParam;
  }

  // subscript([]a: Int), foo([a]: Int) or foo([a] b: Int)
  private static String getDeclArgumentLabelReplacement(String oldLabelRange, String newArgLabel) {
    if (newArgLabel.isEmpty()) {
      return oldLabelRange.isEmpty() ? "" : "_";
    }
    if (oldLabelRange.isEmpty()) {
      return newArgLabel + " ";
    }
    return newArgLabel;
  }
}

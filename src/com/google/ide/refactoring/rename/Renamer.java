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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.ide.syntax.Identifiers;
import com.google.ide.syntax.SourceFile;
import com.google.ide.syntax.SourceSpan;
import java.util.List;

/**
 * Matches one occurrence against a compound old name and reports each independently editable
 * sub-range of the match to a {@link RenameRangeSink}.
 *
 * <p>Declarations and plain references are matched strictly: every label must line up with the
 * corresponding label of the old name. Call sites are matched leniently since arguments with
 * default values may be omitted, variadic arguments take several unlabeled values and trailing
 * closures attach to the end of the parameter list.
 *
 * <p>A renamer handles exactly one occurrence.
 */
public final class Renamer {
  private static final CharMatcher SPLIT_CHARS = CharMatcher.anyOf(" \t\n\013\f\r/");

  private final SourceFile file;
  private final CompoundName old;
  private final RenameRangeSink sink;
  private boolean used = false;

  public Renamer(SourceFile file, CompoundName old, RenameRangeSink sink) {
    checkArgument(old.isValid(), "Invalid name %s", old);
    this.file = file;
    this.old = old;
    this.sink = sink;
  }

  /**
   * Matches {@code resolved} against the old name of {@code config}, reporting the matching ranges
   * to the sink. Returns the region of the occurrence, {@link RegionType#MISMATCH} if it is spelled
   * differently or {@link RegionType#UNMATCHED} if it should be ignored. Ranges reported before a
   * mismatch was detected must be discarded by the caller.
   */
  public RegionType addSyntacticRenameRanges(ResolvedLoc resolved, RenameLoc config) {
    checkState(!used, "Renamer already used for an occurrence");
    used = true;

    if (!resolved.isValid()) {
      return RegionType.UNMATCHED;
    }

    RegionType regionKind = getSyntacticRenameRegionType(resolved);
    // Unknown references in active code are likely unrelated symbols with the same name.
    if (regionKind == RegionType.ACTIVE_CODE && config.usage() == NameUsage.UNKNOWN) {
      return RegionType.UNMATCHED;
    }

    checkArgument(config.usage() != NameUsage.CALL || config.isFunctionLike(), config);

    boolean isSubscript = old.getBase().equals("subscript") && config.isFunctionLike();
    boolean isInit = old.getBase().equals("init") && config.isFunctionLike();
    boolean isCallAsFunction = old.getBase().equals("callAsFunction") && config.isFunctionLike();
    boolean isSpecialBase = isInit || isSubscript || isCallAsFunction;

    // A bare init, subscript or callAsFunction in a string, comment or inactive code.
    if (isSpecialBase
        && config.usage() == NameUsage.UNKNOWN
        && resolved.labelType() == LabelRangeType.NONE) {
      return RegionType.UNMATCHED;
    }

    if (!config.isFunctionLike() || !isSpecialBase) {
      if (renameBase(resolved.range(), RefactoringRangeKind.BASE_NAME)) {
        return RegionType.MISMATCH;
      }
    } else if (isInit || isCallAsFunction) {
      // Calls may spell the base name implicitly, as in Foo(a: 1).
      if (renameBase(resolved.range(), RefactoringRangeKind.KEYWORD_BASE_NAME)
          && (config.usage() == NameUsage.DEFINITION || config.usage() == NameUsage.REFERENCE)) {
        return RegionType.MISMATCH;
      }
    } else if (isSubscript && config.usage() == NameUsage.DEFINITION) {
      if (renameBase(resolved.range(), RefactoringRangeKind.KEYWORD_BASE_NAME)) {
        return RegionType.MISMATCH;
      }
    }

    boolean handleLabels = false;
    if (config.isFunctionLike()) {
      switch (config.usage()) {
        case CALL:
          handleLabels = !old.isOperator();
          break;
        case DEFINITION:
          handleLabels = true;
          break;
        case REFERENCE:
          handleLabels = resolved.labelType() == LabelRangeType.SELECTOR || isSubscript;
          break;
        case UNKNOWN:
          handleLabels = resolved.labelType() != LabelRangeType.NONE;
          break;
      }
    } else if (resolved.labelType() != LabelRangeType.NONE
        && !config.isNonProtocolType()
        // Enum case definitions have labels we do not match yet.
        && config.usage() != NameUsage.DEFINITION) {
      return RegionType.MISMATCH;
    }

    if (handleLabels) {
      boolean isCallSite =
          config.usage() != NameUsage.DEFINITION
              && (config.usage() != NameUsage.REFERENCE || isSubscript)
              && resolved.labelType() == LabelRangeType.CALL_ARG;

      if (renameLabels(
          resolved.labelRanges(),
          resolved.firstTrailingLabel(),
          resolved.labelType(),
          isCallSite)) {
        return config.usage() == NameUsage.UNKNOWN ? RegionType.UNMATCHED : RegionType.MISMATCH;
      }
    }

    return regionKind;
  }

  private static RegionType getSyntacticRenameRegionType(ResolvedLoc resolved) {
    if (resolved.node() == null) {
      return RegionType.COMMENT;
    }
    if (resolved.node().isStringLiteral()) {
      return RegionType.STRING;
    }
    if (resolved.isInSelector()) {
      return RegionType.SELECTOR;
    }
    return resolved.isActive() ? RegionType.ACTIVE_CODE : RegionType.INACTIVE_CODE;
  }

  /** Returns true if {@code range} does not spell the old base name. */
  boolean renameBase(SourceSpan range, RefactoringRangeKind kind) {
    if (!file.getText(stripBackticks(range)).equals(old.getBase())) {
      return true;
    }
    sink.renameBase(range, kind);
    return false;
  }

  /** Returns true if the label ranges do not match the old name. */
  boolean renameLabels(
      ImmutableList<SourceSpan> labelRanges,
      int firstTrailingLabel,
      LabelRangeType rangeType,
      boolean isCallSite) {
    if (isCallSite) {
      return renameLabelsLenient(labelRanges, firstTrailingLabel, rangeType);
    }

    checkArgument(firstTrailingLabel < 0, "Trailing closures outside of a call");
    List<String> oldLabels = old.getArgs();
    if (oldLabels.size() != labelRanges.size()) {
      return true;
    }

    int index = 0;
    for (SourceSpan labelRange : labelRanges) {
      if (!labelRangeMatches(labelRange, rangeType, oldLabels.get(index))) {
        return true;
      }
      splitAndRenameLabel(labelRange, rangeType, index++);
    }
    return false;
  }

  private boolean renameLabelsLenient(
      List<SourceSpan> labelRanges, int firstTrailingLabel, LabelRangeType rangeType) {
    List<String> oldNames = old.getArgs();

    // Trailing closures attach to the end of the parameter list, so match them in reverse.
    if (firstTrailingLabel >= 0) {
      List<SourceSpan> trailingLabels = labelRanges.subList(firstTrailingLabel, labelRanges.size());
      labelRanges = labelRanges.subList(0, firstTrailingLabel);

      for (int labelIndex = trailingLabels.size() - 1; labelIndex >= 0; labelIndex--) {
        SourceSpan label = trailingLabels.get(labelIndex);

        if (!label.isEmpty()) {
          if (oldNames.isEmpty()) {
            return true;
          }
          while (!labelRangeMatches(
              label, LabelRangeType.SELECTOR, oldNames.get(oldNames.size() - 1))) {
            oldNames = dropLast(oldNames);
            if (oldNames.isEmpty()) {
              return true;
            }
          }
          splitAndRenameLabel(label, LabelRangeType.SELECTOR, oldNames.size() - 1);
          oldNames = dropLast(oldNames);
          continue;
        }

        // An empty label on a trailing closure after the first.
        if (labelIndex > 0) {
          if (oldNames.isEmpty()) {
            return true;
          }
          while (!oldNames.get(oldNames.size() - 1).isEmpty()) {
            oldNames = dropLast(oldNames);
            if (oldNames.isEmpty()) {
              return true;
            }
          }
          splitAndRenameLabel(label, LabelRangeType.SELECTOR, oldNames.size() - 1);
          oldNames = dropLast(oldNames);
          continue;
        }

        // The unlabeled first trailing closure.
        if (!oldNames.isEmpty()) {
          oldNames = dropLast(oldNames);
        }
      }
    }

    // Then the arguments in parentheses, from the front.
    int nameIndex = 0;
    for (SourceSpan label : labelRanges) {
      if (label.isEmpty()) {
        if (nameIndex == 0) {
          if (oldNames.isEmpty()) {
            return true;
          }
          while (!oldNames.get(nameIndex).isEmpty()) {
            if (++nameIndex >= oldNames.size()) {
              return true;
            }
          }
          splitAndRenameLabel(label, rangeType, nameIndex++);
          continue;
        }

        if (nameIndex >= oldNames.size() || !oldNames.get(nameIndex).isEmpty()) {
          // Further values of a variadic parameter.
          continue;
        }
        splitAndRenameLabel(label, rangeType, nameIndex++);
        continue;
      }

      if (nameIndex >= oldNames.size()) {
        return true;
      }
      while (!labelRangeMatches(label, rangeType, oldNames.get(nameIndex))) {
        if (++nameIndex >= oldNames.size()) {
          return true;
        }
      }
      splitAndRenameLabel(label, rangeType, nameIndex++);
    }
    return false;
  }

  private static List<String> dropLast(List<String> names) {
    return names.subList(0, names.size() - 1);
  }

  boolean labelRangeMatches(SourceSpan range, LabelRangeType rangeType, String expected) {
    if (range.isEmpty()) {
      return expected.isEmpty();
    }
    boolean isEscaped = isEscaped(range);
    int start = isEscaped ? range.start() + 1 : range.start();
    SourceSpan existingLabelRange =
        SourceSpan.of(start, Identifiers.getTokenEnd(file.getCode(), start));
    String existingLabel = file.getText(existingLabelRange);
    boolean isSingleName =
        range.equals(existingLabelRange)
            || (isEscaped && range.length() == existingLabel.length() + 2);

    switch (rangeType) {
      case NONCOLLAPSIBLE_PARAM:
        // subscript([x]: Int)
        if (isSingleName && expected.isEmpty()) {
          return true;
        }
        // fall through
      case CALL_ARG:
      case PARAM:
      case SELECTOR:
        return existingLabel.equals(expected.isEmpty() ? "_" : expected);
      case NONE:
        break;
    }
    throw new IllegalArgumentException("Unhandled label range type " + rangeType);
  }

  private boolean isEscaped(SourceSpan range) {
    return file.charAt(range.start()) == '`';
  }

  /** The end of the possibly escaped identifier at the start of {@code range}. */
  private int getLeadingIdentifierEnd(SourceSpan range) {
    boolean isEscaped = isEscaped(range);
    int start = isEscaped ? range.start() + 1 : range.start();
    int end = Identifiers.getTokenEnd(file.getCode(), start);
    if (isEscaped && end < range.end() && file.charAt(end) == '`') {
      end++;
    }
    return Math.min(end, range.end());
  }

  private SourceSpan stripBackticks(SourceSpan range) {
    String content = file.getText(range);
    if (content.length() < 3
        || content.charAt(0) != '`'
        || content.charAt(content.length() - 1) != '`') {
      return range;
    }
    return SourceSpan.of(range.start() + 1, range.end() - 1);
  }

  private void splitAndRenameLabel(SourceSpan range, LabelRangeType rangeType, int nameIndex) {
    switch (rangeType) {
      case CALL_ARG:
        splitAndRenameCallArg(range, nameIndex);
        return;
      case PARAM:
        splitAndRenameParamLabel(range, nameIndex, /* isCollapsible= */ true);
        return;
      case NONCOLLAPSIBLE_PARAM:
        splitAndRenameParamLabel(range, nameIndex, /* isCollapsible= */ false);
        return;
      case SELECTOR:
        sink.renameLabel(range, RefactoringRangeKind.SELECTOR_ARGUMENT_LABEL, nameIndex);
        return;
      case NONE:
        break;
    }
    throw new IllegalArgumentException("expected a label range");
  }

  /**
   * Splits {@code foo([a b]: Int)} into the argument label {@code a} and the parameter name
   * {@code b}. The leading whitespace belongs to a collapsible parameter name, so collapsing it
   * into a matching label removes the whitespace too. With a single name {@code foo([a]: Int)} the
   * parameter name, or for noncollapsible parameters the argument label, is an empty range.
   */
  private void splitAndRenameParamLabel(SourceSpan range, int nameIndex, boolean isCollapsible) {
    String content = file.getText(range);
    int externalNameEnd = SPLIT_CHARS.indexIn(content);

    if (externalNameEnd < 0) {
      if (isCollapsible) {
        sink.renameLabel(range, RefactoringRangeKind.DECL_ARGUMENT_LABEL, nameIndex);
        sink.renameLabel(
            SourceSpan.empty(range.end()), RefactoringRangeKind.PARAMETER_NAME, nameIndex);
      } else {
        sink.renameLabel(
            SourceSpan.empty(range.start()), RefactoringRangeKind.DECL_ARGUMENT_LABEL, nameIndex);
        sink.renameLabel(range, RefactoringRangeKind.NONCOLLAPSIBLE_PARAMETER_NAME, nameIndex);
      }
      return;
    }

    SourceSpan ext = SourceSpan.of(range.start(), range.start() + externalNameEnd);
    int localNameStart = SPLIT_CHARS.lastIndexIn(content);
    if (!isCollapsible) {
      localNameStart++;
    }
    SourceSpan local = SourceSpan.of(range.start() + localNameStart, range.end());

    sink.renameLabel(ext, RefactoringRangeKind.DECL_ARGUMENT_LABEL, nameIndex);
    sink.renameLabel(
        local,
        isCollapsible
            ? RefactoringRangeKind.PARAMETER_NAME
            : RefactoringRangeKind.NONCOLLAPSIBLE_PARAMETER_NAME,
        nameIndex);
  }

  /**
   * Splits the call argument {@code foo([a: ]1)} into the label {@code a} and the rest. Whitespace
   * and comments between the label and the colon belong to the rest.
   */
  private void splitAndRenameCallArg(SourceSpan range, int nameIndex) {
    String content = file.getText(range);
    if (content.indexOf(':') < 0) {
      checkState(content.isEmpty(), "Call argument label without colon: %s", content);
      sink.renameLabel(range, RefactoringRangeKind.CALL_ARGUMENT_COMBINED, nameIndex);
      return;
    }

    int colon = getLeadingIdentifierEnd(range) - range.start();
    sink.renameLabel(
        SourceSpan.of(range.start(), range.start() + colon),
        RefactoringRangeKind.CALL_ARGUMENT_LABEL,
        nameIndex);
    sink.renameLabel(
        SourceSpan.of(range.start() + colon, range.end()),
        RefactoringRangeKind.CALL_ARGUMENT_COLON,
        nameIndex);
  }
}

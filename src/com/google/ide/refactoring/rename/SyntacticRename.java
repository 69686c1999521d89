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
import com.google.ide.analysis.CancellationChecker;
import com.google.ide.analysis.CheckLevel;
import com.google.ide.analysis.DiagnosticType;
import com.google.ide.analysis.ErrorHandler;
import com.google.ide.analysis.RefactoringError;
import com.google.ide.refactoring.CodeReplacement;
import com.google.ide.syntax.Identifiers;
import com.google.ide.syntax.SourceFile;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Renames, or finds the ranges of, every occurrence of a symbol in one file.
 *
 * <p>The whole request is validated first: an invalid old or new name, or names of different
 * arity, fail the request without any edit. Each occurrence is then matched on its own; an
 * occurrence that is spelled differently from the old name is reported with {@link
 * #MISMATCHED_RENAME} and skipped while the others are still renamed.
 */
public final class SyntacticRename {
  private static final Logger logger = Logger.getLogger(SyntacticRename.class.getName());

  public static final DiagnosticType INVALID_NAME =
      DiagnosticType.error("invalid_name", "''{0}'' is not a valid name");

  public static final DiagnosticType ARITY_MISMATCH =
      DiagnosticType.error(
          "arity_mismatch", "the given new name ''{0}'' does not match the arity of the old name"
              + " ''{1}''");

  public static final DiagnosticType NAME_NOT_FUNCTIONLIKE =
      DiagnosticType.error(
          "name_not_functionlike", "the ''call'' name usage cannot be used with a non-function-like"
              + " name ''{0}''");

  public static final DiagnosticType MISMATCHED_RENAME =
      DiagnosticType.warning(
          "mismatched_rename", "the name at the given location cannot be renamed to ''{0}''");

  /** Receives the edits of each occurrence. */
  @FunctionalInterface
  public interface EditConsumer {
    /** Called once per occurrence; {@code replacements} is empty for mismatched occurrences. */
    void accept(RegionType type, ImmutableList<CodeReplacement> replacements);
  }

  /** Receives the matched ranges of each occurrence. */
  @FunctionalInterface
  public interface RangesConsumer {
    /** Called once per occurrence; {@code ranges} is empty for mismatched occurrences. */
    void accept(RegionType type, ImmutableList<RenameRangeDetail> ranges);
  }

  private final SourceFile file;
  private final NameRangeResolver resolver;
  private final ErrorHandler errorHandler;
  private final CancellationChecker cancellationChecker;

  public SyntacticRename(
      SourceFile file,
      NameRangeResolver resolver,
      ErrorHandler errorHandler,
      CancellationChecker cancellationChecker) {
    this.file = file;
    this.resolver = resolver;
    this.errorHandler = errorHandler;
    this.cancellationChecker = cancellationChecker;
  }

  /**
   * Computes the edits renaming every location to its new name. Returns false, without passing
   * anything to the consumer, if the request is invalid.
   */
  public boolean rename(List<RenameLoc> renameLocs, EditConsumer consumer) {
    ImmutableList<ResolvedLoc> resolvedLocs = resolveRenameLocations(renameLocs);
    if (resolvedLocs == null) {
      return false;
    }
    for (int i = 0; i < renameLocs.size(); i++) {
      cancellationChecker.check();
      RenameLoc rename = renameLocs.get(i);
      ResolvedLoc resolved = resolvedLocs.get(i);
      TextReplacementSink sink =
          new TextReplacementSink(
              file, CompoundName.parse(rename.oldName()), CompoundName.parse(rename.newName()));
      RegionType type =
          new Renamer(file, CompoundName.parse(rename.oldName()), sink)
              .addSyntacticRenameRanges(resolved, rename);
      if (type == RegionType.MISMATCH) {
        reportMismatch(resolved, rename);
        consumer.accept(type, ImmutableList.of());
      } else {
        consumer.accept(type, sink.getReplacements());
      }
    }
    return true;
  }

  /**
   * Finds the matched ranges of every location. New names are optional. Returns false, without
   * passing anything to the consumer, if the request is invalid.
   */
  public boolean findRenameRanges(List<RenameLoc> renameLocs, RangesConsumer consumer) {
    ImmutableList<ResolvedLoc> resolvedLocs = resolveRenameLocations(renameLocs);
    if (resolvedLocs == null) {
      return false;
    }
    for (int i = 0; i < renameLocs.size(); i++) {
      cancellationChecker.check();
      RenameLoc rename = renameLocs.get(i);
      ResolvedLoc resolved = resolvedLocs.get(i);
      RangeCollectorSink sink = new RangeCollectorSink();
      RegionType type =
          new Renamer(file, CompoundName.parse(rename.oldName()), sink)
              .addSyntacticRenameRanges(resolved, rename);
      if (type == RegionType.MISMATCH) {
        reportMismatch(resolved, rename);
        consumer.accept(type, ImmutableList.of());
      } else {
        consumer.accept(type, sink.getRanges());
      }
    }
    return true;
  }

  private void reportMismatch(ResolvedLoc resolved, RenameLoc rename) {
    logger.fine("Skipping mismatched occurrence at " + resolved.range());
    errorHandler.report(
        CheckLevel.WARNING,
        RefactoringError.make(file, resolved.range().start(), MISMATCHED_RENAME, rename.newName()));
  }

  /** Validates the request and resolves every location, or returns null if it is invalid. */
  private @Nullable ImmutableList<ResolvedLoc> resolveRenameLocations(List<RenameLoc> renameLocs) {
    List<UnresolvedLoc> unresolvedLocs = new ArrayList<>();
    for (RenameLoc renameLoc : renameLocs) {
      CompoundName oldName = CompoundName.parse(renameLoc.oldName());
      int location = file.getOffset(renameLoc.line(), renameLoc.column());

      if (!oldName.isValid()) {
        report(location, INVALID_NAME, renameLoc.oldName());
        return null;
      }

      if (!renameLoc.newName().isEmpty()) {
        CompoundName newName = CompoundName.parse(renameLoc.newName());
        boolean newNameIsValid =
            newName.isValid()
                && (Identifiers.isIdentifier(newName.getBase()) || newName.isOperator())
                && newName.getArgs().stream()
                    .allMatch(label -> label.isEmpty() || Identifiers.isIdentifier(label));
        if (!newNameIsValid) {
          report(location, INVALID_NAME, renameLoc.newName());
          return null;
        }

        if (newName.partsCount() != oldName.partsCount()) {
          report(location, ARITY_MISMATCH, renameLoc.newName(), renameLoc.oldName());
          return null;
        }

        if (renameLoc.usage() == NameUsage.CALL && !renameLoc.isFunctionLike()) {
          report(location, NAME_NOT_FUNCTIONLIKE, renameLoc.newName());
          return null;
        }
      }

      boolean resolveArgs =
          renameLoc.usage() == NameUsage.UNKNOWN
              || (renameLoc.usage() == NameUsage.CALL && !oldName.isOperator());
      unresolvedLocs.add(new UnresolvedLoc(location, resolveArgs));
    }
    return resolver.resolve(unresolvedLocs);
  }

  private void report(int location, DiagnosticType type, String... args) {
    RefactoringError error =
        location >= 0
            ? RefactoringError.make(file, location, type, (Object[]) args)
            : RefactoringError.make(type, (Object[]) args);
    errorHandler.report(type.level, error);
  }
}

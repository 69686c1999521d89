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

package com.google.ide.refactoring;

import com.google.common.collect.ImmutableMap;
import com.google.ide.analysis.DiagnosticType;
import com.google.ide.refactoring.async.AsyncConverter;
import com.google.ide.refactoring.async.CallbackClassifier;
import com.google.ide.refactoring.rename.SyntacticRename;
import org.jspecify.annotations.Nullable;

/** How a refactoring reacts to each kind of problem it reports. */
public enum RefactoringErrorKind {
  /** The requested name is unusable. The whole request fails. */
  INVALID_NAME,
  /** One occurrence is spelled differently. Only that occurrence is skipped. */
  MISMATCH,
  /** One occurrence is syntactically out of scope. It is skipped silently. */
  UNMATCHED,
  /**
   * A completion handler closure could not be split into success and error paths. Plain
   * parameter handlers fall back to keeping the closure body, {@code Result} handlers fail.
   */
  UNCLASSIFIABLE_CALLBACK,
  /** The cursor is not on something the refactoring applies to. The request fails. */
  STRUCTURAL_PRECONDITION;

  private static final ImmutableMap<DiagnosticType, RefactoringErrorKind> KINDS = buildKinds();

  private static ImmutableMap<DiagnosticType, RefactoringErrorKind> buildKinds() {
    ImmutableMap.Builder<DiagnosticType, RefactoringErrorKind> kinds = ImmutableMap.builder();
    kinds.put(SyntacticRename.INVALID_NAME, INVALID_NAME);
    kinds.put(SyntacticRename.ARITY_MISMATCH, INVALID_NAME);
    kinds.put(SyntacticRename.NAME_NOT_FUNCTIONLIKE, INVALID_NAME);
    kinds.put(SyntacticRename.MISMATCHED_RENAME, MISMATCH);
    for (DiagnosticType type : CallbackClassifier.ALL_TYPES) {
      kinds.put(type, UNCLASSIFIABLE_CALLBACK);
    }
    kinds.put(AsyncConverter.MISMATCHED_CALLBACK_ARGS, UNCLASSIFIABLE_CALLBACK);
    kinds.put(AsyncConverter.MISSING_CALLBACK_ARG, UNCLASSIFIABLE_CALLBACK);
    kinds.put(RefactoringEngine.NO_INSERT_POSITION, STRUCTURAL_PRECONDITION);
    kinds.put(RefactoringEngine.NO_ENCLOSING_FUNCTION, STRUCTURAL_PRECONDITION);
    kinds.put(RefactoringEngine.NO_ENCLOSING_CALL, STRUCTURAL_PRECONDITION);
    kinds.put(RefactoringEngine.NOT_ASYNC_CONVERTIBLE, STRUCTURAL_PRECONDITION);
    kinds.put(RefactoringEngine.VALUE_DECL_NO_LOC, STRUCTURAL_PRECONDITION);
    return kinds.buildOrThrow();
  }

  /** Returns the kind of problem {@code type} reports, or null for an unknown type. */
  public static @Nullable RefactoringErrorKind of(DiagnosticType type) {
    return KINDS.get(type);
  }
}

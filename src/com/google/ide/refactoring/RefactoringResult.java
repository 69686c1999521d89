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

import com.google.common.collect.ImmutableList;
import com.google.ide.analysis.RefactoringError;

/**
 * The outcome of a refactoring. A failed refactoring has an empty fix and at least one error in
 * its diagnostics.
 *
 * @param success Whether the refactoring succeeded.
 * @param fix The edits to apply.
 * @param diagnostics Errors and warnings reported while refactoring.
 */
public record RefactoringResult(
    boolean success, SuggestedFix fix, ImmutableList<RefactoringError> diagnostics) {

  static RefactoringResult failure(ImmutableList<RefactoringError> diagnostics) {
    return new RefactoringResult(false, SuggestedFix.empty(), diagnostics);
  }
}

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

import static com.google.common.truth.Truth.assertThat;

import com.google.ide.analysis.DiagnosticType;
import com.google.ide.refactoring.async.AsyncConverter;
import com.google.ide.refactoring.async.CallbackClassifier;
import com.google.ide.refactoring.rename.SyntacticRename;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RefactoringErrorKindTest {

  @Test
  public void testRenameDiagnostics() {
    assertThat(RefactoringErrorKind.of(SyntacticRename.INVALID_NAME))
        .isEqualTo(RefactoringErrorKind.INVALID_NAME);
    assertThat(RefactoringErrorKind.of(SyntacticRename.ARITY_MISMATCH))
        .isEqualTo(RefactoringErrorKind.INVALID_NAME);
    assertThat(RefactoringErrorKind.of(SyntacticRename.MISMATCHED_RENAME))
        .isEqualTo(RefactoringErrorKind.MISMATCH);
  }

  @Test
  public void testCallbackDiagnostics() {
    for (DiagnosticType type : CallbackClassifier.ALL_TYPES) {
      assertThat(RefactoringErrorKind.of(type))
          .isEqualTo(RefactoringErrorKind.UNCLASSIFIABLE_CALLBACK);
    }
    assertThat(RefactoringErrorKind.of(AsyncConverter.MISMATCHED_CALLBACK_ARGS))
        .isEqualTo(RefactoringErrorKind.UNCLASSIFIABLE_CALLBACK);
  }

  @Test
  public void testStructuralDiagnostics() {
    assertThat(RefactoringErrorKind.of(RefactoringEngine.NO_INSERT_POSITION))
        .isEqualTo(RefactoringErrorKind.STRUCTURAL_PRECONDITION);
    assertThat(RefactoringErrorKind.of(RefactoringEngine.VALUE_DECL_NO_LOC))
        .isEqualTo(RefactoringErrorKind.STRUCTURAL_PRECONDITION);
  }

  @Test
  public void testUnknownDiagnostic() {
    assertThat(RefactoringErrorKind.of(DiagnosticType.error("TEST_UNKNOWN", "unknown"))).isNull();
  }
}

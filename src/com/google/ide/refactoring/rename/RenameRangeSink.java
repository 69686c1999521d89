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

import com.google.ide.syntax.SourceSpan;

/**
 * Receives the sub-ranges of an occurrence that matched the old name. Called once per
 * independently editable range, in source order within each part of the name.
 */
public interface RenameRangeSink {

  void renameBase(SourceSpan range, RefactoringRangeKind kind);

  /**
   * @param range the label sub-range
   * @param kind the role of the sub-range
   * @param index the index of the matching label of the old name
   */
  void renameLabel(SourceSpan range, RefactoringRangeKind kind, int index);
}

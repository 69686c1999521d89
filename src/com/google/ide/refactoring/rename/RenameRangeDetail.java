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

import com.google.auto.value.AutoValue;
import com.google.ide.syntax.SourceSpan;

/** One matched sub-range of an occurrence, collected by {@link RangeCollectorSink}. */
@AutoValue
public abstract class RenameRangeDetail {

  static RenameRangeDetail create(SourceSpan range, RefactoringRangeKind kind, int index) {
    return new AutoValue_RenameRangeDetail(range, kind, index);
  }

  public abstract SourceSpan getRange();

  public abstract RefactoringRangeKind getKind();

  /** The index of the label in the compound name, or -1 for base names. */
  public abstract int getIndex();

  public boolean hasIndex() {
    return getIndex() >= 0;
  }
}

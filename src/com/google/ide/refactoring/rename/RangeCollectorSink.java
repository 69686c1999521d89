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
import com.google.ide.syntax.SourceSpan;

/** Collects the matched ranges and their roles without computing any edit. */
public final class RangeCollectorSink implements RenameRangeSink {
  private final ImmutableList.Builder<RenameRangeDetail> ranges = ImmutableList.builder();

  @Override
  public void renameBase(SourceSpan range, RefactoringRangeKind kind) {
    ranges.add(RenameRangeDetail.create(range, kind, -1));
  }

  @Override
  public void renameLabel(SourceSpan range, RefactoringRangeKind kind, int index) {
    ranges.add(RenameRangeDetail.create(range, kind, index));
  }

  public ImmutableList<RenameRangeDetail> getRanges() {
    return ranges.build();
  }
}

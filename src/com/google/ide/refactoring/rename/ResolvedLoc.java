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
import com.google.ide.syntax.Node;
import com.google.ide.syntax.SourceSpan;
import org.jspecify.annotations.Nullable;

/**
 * The syntactic shape of an occurrence: its base name range and its label ranges.
 *
 * @param node The node the occurrence belongs to, or null for occurrences in comments.
 * @param range The base name range, or null if the location could not be resolved.
 * @param labelRanges The label ranges, in source order.
 * @param firstTrailingLabel Index into {@code labelRanges} of the first trailing closure, or -1.
 * @param labelType The role of the label ranges.
 * @param isActive Whether the occurrence is in active code.
 * @param isInSelector Whether the occurrence is the name of a selector literal.
 */
public record ResolvedLoc(
    @Nullable Node node,
    @Nullable SourceSpan range,
    ImmutableList<SourceSpan> labelRanges,
    int firstTrailingLabel,
    LabelRangeType labelType,
    boolean isActive,
    boolean isInSelector) {

  /** A location with no matching syntax. */
  public static ResolvedLoc unresolved() {
    return new ResolvedLoc(null, null, ImmutableList.of(), -1, LabelRangeType.NONE, false, false);
  }

  public boolean isValid() {
    return range != null;
  }

  public boolean hasTrailingLabels() {
    return firstTrailingLabel >= 0;
  }
}

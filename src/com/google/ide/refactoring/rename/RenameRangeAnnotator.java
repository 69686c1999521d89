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

import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.List;

/** Prints source text with each renamed range wrapped as {@code <tag index=N>text</tag>}. */
public final class RenameRangeAnnotator {
  private static final Comparator<RenameRangeDetail> BY_RANGE =
      Comparator.comparing(RenameRangeDetail::getRange);

  private RenameRangeAnnotator() {}

  public static String annotate(String text, List<RenameRangeDetail> ranges) {
    ImmutableList<RenameRangeDetail> sorted = ImmutableList.sortedCopyOf(BY_RANGE, ranges);
    StringBuilder sb = new StringBuilder();
    int last = 0;
    for (RenameRangeDetail detail : sorted) {
      int start = detail.getRange().start();
      int end = detail.getRange().end();
      checkArgument(start >= last, "Overlapping rename ranges at %s", detail.getRange());
      sb.append(text, last, start);
      String tag = detail.getKind().getTag();
      sb.append('<').append(tag);
      if (detail.hasIndex()) {
        sb.append(" index=").append(detail.getIndex());
      }
      sb.append('>').append(text, start, end).append("</").append(tag).append('>');
      last = end;
    }
    sb.append(text.substring(last));
    return sb.toString();
  }
}

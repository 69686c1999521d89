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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.SetMultimap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.ide.syntax.Node;
import com.google.ide.syntax.SourceFile;
import com.google.ide.syntax.SourceSpan;
import java.util.Collection;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Object representing the edits a refactoring makes to the source code. To create one, use the
 * {@link Builder} class and helper functions.
 *
 * <p>All positions refer to the original, unedited source. Edits are accumulated, never applied;
 * see {@link ApplySuggestedFixes} for clients that want the resulting text.
 */
public final class SuggestedFix {

  // Multimap of filename to a modification to that file.
  private final SetMultimap<String, CodeReplacement> replacements;

  // An optional description of the fix, e.g. the refactoring that produced it.
  private final @Nullable String description;

  private SuggestedFix(
      SetMultimap<String, CodeReplacement> replacements, @Nullable String description) {
    this.replacements = replacements;
    this.description = description;
  }

  /** A fix without any replacements. */
  public static SuggestedFix empty() {
    return new Builder().build();
  }

  /**
   * Returns a multimap from filename to all the replacements that should be applied for this given
   * fix.
   */
  public SetMultimap<String, CodeReplacement> getReplacements() {
    return replacements;
  }

  public @Nullable String getDescription() {
    return description;
  }

  public boolean isNoOp() {
    return replacements.isEmpty();
  }

  @Override
  public String toString() {
    if (this.isNoOp()) {
      return "<no-op SuggestedFix>";
    }
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, Collection<CodeReplacement>> entry : replacements.asMap().entrySet()) {
      sb.append("Replacements for file: ").append(entry.getKey()).append("\n");
      Joiner.on("\n\n").appendTo(sb, entry.getValue());
    }
    return sb.toString();
  }

  /** Builder class for {@link SuggestedFix} that contains helper functions to edit ranges. */
  public static final class Builder {
    private final ImmutableSetMultimap.Builder<String, CodeReplacement> replacements =
        ImmutableSetMultimap.builder();
    private @Nullable String description = null;
    private int insertionCount = 0;

    /** Replaces the text of {@code span} in {@code file} with {@code newContent}. */
    @CanIgnoreReturnValue
    public Builder replace(SourceFile file, SourceSpan span, String newContent) {
      checkArgument(span.end() <= file.length(), "%s is outside of %s", span, file.getName());
      replacements.put(
          file.getName(), CodeReplacement.create(span.start(), span.length(), newContent));
      return this;
    }

    /**
     * Inserts text at {@code offset}. Insertions at the same offset are applied in the order they
     * were added.
     */
    @CanIgnoreReturnValue
    public Builder insertAt(SourceFile file, int offset, String content) {
      checkArgument(offset <= file.length(), "%s is outside of %s", offset, file.getName());
      replacements.put(
          file.getName(),
          CodeReplacement.create(
              offset, 0, content, Strings.padStart(Integer.toString(insertionCount++), 8, '0')));
      return this;
    }

    /** Inserts text after the given node. */
    @CanIgnoreReturnValue
    public Builder insertAfter(SourceFile file, Node node, String text) {
      return insertAt(file, node.getEnd(), text);
    }

    @CanIgnoreReturnValue
    public Builder delete(SourceFile file, SourceSpan span) {
      return replace(file, span, "");
    }

    @CanIgnoreReturnValue
    public Builder setDescription(String description) {
      this.description = description;
      return this;
    }

    public SuggestedFix build() {
      return new SuggestedFix(replacements.build(), description);
    }
  }
}

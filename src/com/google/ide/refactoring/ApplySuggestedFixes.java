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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Applies the edits of {@link SuggestedFix}es to source text. Every replacement refers to the
 * original text, so replacements are applied from the start of the file to its end.
 */
public final class ApplySuggestedFixes {
  private static final Logger logger = Logger.getLogger(ApplySuggestedFixes.class.getName());

  /**
   * Returns the edited code of every file that {@code fixes} edit. {@code filenameToCodeMap} must
   * hold the code of each of them. A fix that overlaps a fix applied before it is skipped.
   */
  public static ImmutableMap<String, String> applySuggestedFixesToCode(
      Iterable<SuggestedFix> fixes, Map<String, String> filenameToCodeMap) {
    ImmutableMap.Builder<String, String> newCode = ImmutableMap.builder();
    for (Map.Entry<String, TreeSet<CodeReplacement>> entry :
        collectNonOverlapping(fixes).entrySet()) {
      String code = filenameToCodeMap.get(entry.getKey());
      checkArgument(code != null, "filenameToCodeMap missing code for file: %s", entry.getKey());
      newCode.put(entry.getKey(), applyCodeReplacements(entry.getValue(), code));
    }
    return newCode.buildOrThrow();
  }

  /** Applies the edits that {@code fix} makes to {@code filename}, whose text is {@code code}. */
  public static String applySuggestedFixToCode(SuggestedFix fix, String filename, String code) {
    return applyCodeReplacements(fix.getReplacements().get(filename), code);
  }

  /**
   * Applies {@code replacements} to {@code code}. The replacements may come in any order but must
   * not overlap; insertions at the same offset are ordered by their sort key.
   */
  public static String applyCodeReplacements(
      Collection<CodeReplacement> replacements, String code) {
    ImmutableSortedSet<CodeReplacement> sorted = ImmutableSortedSet.copyOf(replacements);
    CodeReplacement overlap = findOverlap(sorted);
    checkArgument(overlap == null, "Replacement overlaps the one before it: %s", overlap);

    StringBuilder sb = new StringBuilder(code.length());
    int copied = 0;
    for (CodeReplacement replacement : sorted) {
      checkArgument(
          replacement.getEndPosition() <= code.length(),
          "Replacement ends past the code (length %s): %s",
          code.length(),
          replacement);
      sb.append(code, copied, replacement.getStartPosition()).append(replacement.getNewContent());
      copied = replacement.getEndPosition();
    }
    return sb.append(code, copied, code.length()).toString();
  }

  /** Returns the first replacement that starts before the previous one ends, or null. */
  private static @Nullable CodeReplacement findOverlap(Iterable<CodeReplacement> sorted) {
    int previousEnd = 0;
    for (CodeReplacement replacement : sorted) {
      if (replacement.getStartPosition() < previousEnd) {
        return replacement;
      }
      previousEnd = replacement.getEndPosition();
    }
    return null;
  }

  private static Map<String, TreeSet<CodeReplacement>> collectNonOverlapping(
      Iterable<SuggestedFix> fixes) {
    Map<String, TreeSet<CodeReplacement>> byFile = new TreeMap<>();
    for (SuggestedFix fix : fixes) {
      if (overlapsAccepted(fix, byFile)) {
        logger.fine("Skipping a fix that overlaps an earlier one: " + fix.getDescription());
        continue;
      }
      fix.getReplacements()
          .forEach(
              (file, replacement) ->
                  byFile.computeIfAbsent(file, f -> new TreeSet<>()).add(replacement));
    }
    return byFile;
  }

  private static boolean overlapsAccepted(
      SuggestedFix fix, Map<String, TreeSet<CodeReplacement>> accepted) {
    for (Map.Entry<String, Collection<CodeReplacement>> entry :
        fix.getReplacements().asMap().entrySet()) {
      TreeSet<CodeReplacement> merged = new TreeSet<>(entry.getValue());
      TreeSet<CodeReplacement> existing = accepted.get(entry.getKey());
      if (existing != null) {
        merged.addAll(existing);
      }
      if (findOverlap(merged) != null) {
        return true;
      }
    }
    return false;
  }

  private ApplySuggestedFixes() {}
}

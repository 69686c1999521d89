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

import java.util.HashSet;
import java.util.Set;

/** Picks a name that does not collide with the names visible where it is declared. */
final class NameCorrection {
  private NameCorrection() {}

  /**
   * Returns {@code name} if no visible name equals it. Otherwise appends the smallest positive
   * number that no visible name uses as a suffix of {@code name}.
   */
  static String correctName(String name, Iterable<String> visibleNames) {
    boolean foundCollision = false;
    Set<String> usedSuffixes = new HashSet<>();
    for (String visible : visibleNames) {
      if (!visible.startsWith(name)) {
        continue;
      }
      String suffix = visible.substring(name.length());
      if (suffix.isEmpty()) {
        foundCollision = true;
      } else {
        usedSuffixes.add(suffix);
      }
    }
    if (!foundCollision) {
      return name;
    }

    for (int i = 1; ; i++) {
      String suffix = Integer.toString(i);
      if (!usedSuffixes.contains(suffix)) {
        return name + suffix;
      }
    }
  }
}

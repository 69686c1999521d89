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

/** A rename refactoring for a symbol and whether it is available. */
public record RenameAvailabilityInfo(RefactoringKind kind, RenameAvailableKind availableKind) {
  public RenameAvailabilityInfo {
    checkArgument(kind.isRename(), "Not a rename: %s", kind);
  }

  public boolean isAvailable() {
    return availableKind == RenameAvailableKind.AVAILABLE;
  }
}

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

/** Whether a symbol can be renamed, and if not, why. */
public enum RenameAvailableKind {
  AVAILABLE(""),
  UNAVAILABLE_SYSTEM_SYMBOL("symbol from system module cannot be renamed"),
  UNAVAILABLE_HAS_NO_LOCATION("symbol without a declaration location cannot be renamed"),
  UNAVAILABLE_HAS_NO_NAME("cannot find the name of the symbol");

  private final String description;

  RenameAvailableKind(String description) {
    this.description = description;
  }

  /** Why the rename is unavailable; empty if it is available. */
  public String getDescription() {
    return description;
  }
}

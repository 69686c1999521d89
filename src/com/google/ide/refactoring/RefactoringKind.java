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

import org.jspecify.annotations.Nullable;

/** The refactorings the engine offers, with their stable ids. */
public enum RefactoringKind {
  LOCAL_RENAME("rename.local", "Local Rename"),
  GLOBAL_RENAME("rename.global", "Global Rename"),
  CONVERT_CALL_TO_ASYNC_ALTERNATIVE("convert.call.to.async", "Convert Call to Async Alternative"),
  CONVERT_TO_ASYNC("convert.to.async", "Convert Function to Async"),
  ADD_ASYNC_ALTERNATIVE("add.async.alternative", "Add Async Alternative");

  private final String id;
  private final String descriptiveName;

  RefactoringKind(String id, String descriptiveName) {
    this.id = id;
    this.descriptiveName = descriptiveName;
  }

  public String getId() {
    return id;
  }

  public String getDescriptiveName() {
    return descriptiveName;
  }

  public boolean isRename() {
    return this == LOCAL_RENAME || this == GLOBAL_RENAME;
  }

  /** Returns the kind with the given id, or null if there is none. */
  public static @Nullable RefactoringKind fromId(String id) {
    for (RefactoringKind kind : values()) {
      if (kind.id.equals(id)) {
        return kind;
      }
    }
    return null;
  }
}

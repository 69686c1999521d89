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

package com.google.ide.analysis;

/**
 * Polled by long running traversals so that a client can abandon a request. Checks happen at
 * every node visited, never in the middle of emitting text.
 */
@FunctionalInterface
public interface CancellationChecker {

  CancellationChecker NEVER = () -> false;

  boolean isCancelled();

  /** Throws {@link RefactoringCancelledException} if the request was cancelled. */
  default void check() {
    if (isCancelled()) {
      throw new RefactoringCancelledException();
    }
  }
}

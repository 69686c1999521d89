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

import com.google.ide.analysis.CancellationChecker;
import java.io.Serializable;

/** Options for a {@link RefactoringEngine}. */
public class RefactoringOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  static final String DEFAULT_PREFERRED_NAME = "newName";
  static final String DEFAULT_DEPRECATION_MESSAGE = "Prefer async alternative instead";

  /** Whether async alternatives are marked with the {@code @completionHandlerAsync} attribute. */
  private boolean experimentalConcurrency = false;

  /** The name used by a local rename when no name is given. */
  private String defaultPreferredName = DEFAULT_PREFERRED_NAME;

  /** The message of the deprecation attribute added to functions with an async alternative. */
  private String deprecationMessage = DEFAULT_DEPRECATION_MESSAGE;

  private transient CancellationChecker cancellationChecker = CancellationChecker.NEVER;

  public boolean isExperimentalConcurrency() {
    return experimentalConcurrency;
  }

  public void setExperimentalConcurrency(boolean experimentalConcurrency) {
    this.experimentalConcurrency = experimentalConcurrency;
  }

  public String getDefaultPreferredName() {
    return defaultPreferredName;
  }

  public void setDefaultPreferredName(String defaultPreferredName) {
    this.defaultPreferredName = defaultPreferredName;
  }

  public String getDeprecationMessage() {
    return deprecationMessage;
  }

  public void setDeprecationMessage(String deprecationMessage) {
    this.deprecationMessage = deprecationMessage;
  }

  public CancellationChecker getCancellationChecker() {
    // Null after deserialization.
    return cancellationChecker == null ? CancellationChecker.NEVER : cancellationChecker;
  }

  public void setCancellationChecker(CancellationChecker cancellationChecker) {
    this.cancellationChecker = cancellationChecker;
  }
}

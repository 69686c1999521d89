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

/** The role of one independently editable sub-range of an occurrence. */
public enum RefactoringRangeKind {
  BASE_NAME("base"),
  KEYWORD_BASE_NAME("keywordBase"),
  PARAMETER_NAME("param"),
  NONCOLLAPSIBLE_PARAMETER_NAME("noncollapsibleparam"),
  DECL_ARGUMENT_LABEL("arglabel"),
  CALL_ARGUMENT_LABEL("callarg"),
  CALL_ARGUMENT_COLON("callcolon"),
  CALL_ARGUMENT_COMBINED("callcombo"),
  SELECTOR_ARGUMENT_LABEL("sel");

  private final String tag;

  RefactoringRangeKind(String tag) {
    this.tag = tag;
  }

  /** The markup tag used when printing inspection ranges. */
  public String getTag() {
    return tag;
  }

  public boolean isBaseName() {
    return this == BASE_NAME || this == KEYWORD_BASE_NAME;
  }
}

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

/** The syntactic role of the label ranges of an occurrence. */
public enum LabelRangeType {
  /** The occurrence has no labels, e.g. a plain reference. */
  NONE,
  /** {@code foo([a: ]1, [b: ]2)}, including the colon and trailing whitespace. */
  CALL_ARG,
  /** {@code func foo([a b]: Int)}. */
  PARAM,
  /** {@code subscript([a]: Int)}, whose single name is not an argument label. */
  NONCOLLAPSIBLE_PARAM,
  /** {@code foo([a]:[b]:)}. */
  SELECTOR
}

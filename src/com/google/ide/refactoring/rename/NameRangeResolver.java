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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Resolves name locations into their syntactic ranges. Implemented by the frontend's name matcher;
 * {@link NameMatcher} is an implementation over the syntax tree of one file.
 */
@FunctionalInterface
public interface NameRangeResolver {

  /** Returns one resolved location per input location, in the same order. */
  ImmutableList<ResolvedLoc> resolve(List<UnresolvedLoc> locs);
}

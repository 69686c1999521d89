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

import static java.util.Objects.requireNonNull;

/**
 * One occurrence of a symbol to rename, as supplied by the indexer.
 *
 * @param line One-based line of the start of the base name.
 * @param column One-based column of the start of the base name.
 * @param usage How the occurrence uses the symbol.
 * @param oldName The current compound name, e.g. {@code foo(a:b:)}.
 * @param newName The requested compound name. Empty when only ranges are requested.
 * @param isFunctionLike Whether the symbol takes arguments.
 * @param isNonProtocolType Whether the symbol is a type other than a protocol.
 */
public record RenameLoc(
    int line,
    int column,
    NameUsage usage,
    String oldName,
    String newName,
    boolean isFunctionLike,
    boolean isNonProtocolType) {
  public RenameLoc {
    requireNonNull(usage, "usage");
    requireNonNull(oldName, "oldName");
    requireNonNull(newName, "newName");
  }
}

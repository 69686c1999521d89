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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import com.google.ide.syntax.Identifiers;
import java.util.ArrayList;
import java.util.List;

/**
 * A compound declaration name such as {@code foo(a:_:)}: a base name followed by the ordered
 * argument labels. An underscore stands for an empty label.
 *
 * <p>Names without parentheses, e.g. {@code foo}, have no labels. A name whose label list is not
 * terminated by {@code :)} is invalid.
 */
@Immutable
public final class CompoundName {
  private static final Splitter LABEL_SPLITTER = Splitter.on(':');

  private final String text;
  private final String base;
  private final ImmutableList<String> args;
  private final boolean hasParen;
  private final boolean isValid;

  private CompoundName(
      String text, String base, ImmutableList<String> args, boolean hasParen, boolean isValid) {
    this.text = text;
    this.base = base;
    this.args = args;
    this.hasParen = hasParen;
    this.isValid = isValid;
  }

  public static CompoundName parse(String text) {
    int argStart = text.indexOf('(');
    if (argStart < 0) {
      return new CompoundName(text, text, ImmutableList.of(), false, true);
    }
    String base = text.substring(0, argStart);
    int argEnd = text.lastIndexOf(')');
    if (argEnd < argStart) {
      return new CompoundName(text, base, ImmutableList.of(), true, false);
    }
    List<String> labels =
        new ArrayList<>(LABEL_SPLITTER.splitToList(text.substring(argStart + 1, argEnd)));
    boolean isValid = labels.get(labels.size() - 1).isEmpty();
    if (!isValid) {
      return new CompoundName(text, base, ImmutableList.of(), true, false);
    }
    labels.remove(labels.size() - 1);
    ImmutableList.Builder<String> args = ImmutableList.builder();
    for (String label : labels) {
      args.add(label.equals("_") ? "" : label);
    }
    return new CompoundName(text, base, args.build(), true, true);
  }

  public boolean isValid() {
    return isValid;
  }

  public String getBase() {
    return base;
  }

  /** The argument labels, with empty strings for {@code _}. */
  public ImmutableList<String> getArgs() {
    return args;
  }

  public String getArg(int index) {
    return args.get(index);
  }

  public boolean hasParen() {
    return hasParen;
  }

  /** The base name plus one part per label. */
  public int partsCount() {
    return 1 + args.size();
  }

  public boolean isOperator() {
    return Identifiers.isOperator(base);
  }

  @Override
  public String toString() {
    return text;
  }
}

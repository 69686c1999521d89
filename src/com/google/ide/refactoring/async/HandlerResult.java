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

package com.google.ide.refactoring.async;

import com.google.common.collect.ImmutableList;
import com.google.ide.syntax.Node;

/**
 * The expressions passed to a call of a completion handler that the async alternative returns
 * or throws.
 *
 * <p>For example {@code completion("something", nil)} keeps {@code ["something"]} and {@code
 * completion(nil, MyError.bad)} keeps {@code [MyError.bad]} as an error.
 */
final class HandlerResult {
  private final ImmutableList<Node> args;
  private final boolean isError;

  HandlerResult() {
    this(ImmutableList.of(), false);
  }

  HandlerResult(ImmutableList<Node> args) {
    this(args, false);
  }

  HandlerResult(Node arg, boolean isError) {
    this(ImmutableList.of(arg), isError);
  }

  private HandlerResult(ImmutableList<Node> args, boolean isError) {
    this.args = args;
    this.isError = isError;
  }

  boolean isError() {
    return isError;
  }

  ImmutableList<Node> args() {
    return args;
  }
}

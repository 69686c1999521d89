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
import com.google.ide.syntax.Decl;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/** A completion handler that is a parameter of a function, along with its index. */
public final class AsyncHandlerParamDesc extends AsyncHandlerDesc {
  private static final AsyncHandlerParamDesc NONE =
      new AsyncHandlerParamDesc(AsyncHandlerDesc.INVALID, null, -1);

  private final @Nullable Decl func;
  private final int index;

  private AsyncHandlerParamDesc(AsyncHandlerDesc handler, @Nullable Decl func, int index) {
    super(handler);
    this.func = func;
    this.index = index;
  }

  /**
   * Finds the completion handler of {@code func}: its last parameter, provided the function is
   * neither async nor throwing and returns Void.
   *
   * @param requireAttributeOrName whether the handler must have a completion handler name, unless
   *     the function is annotated with {@code @completionHandlerAsync}
   */
  public static AsyncHandlerParamDesc find(@Nullable Decl func, boolean requireAttributeOrName) {
    if (func == null || !func.isFunc() || func.hasAsync() || func.hasThrows()) {
      return NONE;
    }

    boolean requireName = requireAttributeOrName && !func.hasCompletionHandlerAsyncAttr();

    ImmutableList<Decl> params = func.getParams();
    if (params.isEmpty() || !func.getResultType().isVoid()) {
      return NONE;
    }

    int index = params.size() - 1;
    Decl param = params.get(index);
    if (param.isAutoClosure()) {
      return NONE;
    }

    return new AsyncHandlerParamDesc(AsyncHandlerDesc.get(param, requireName), func, index);
  }

  public int getIndex() {
    return index;
  }

  /**
   * Prints the compound name of the async alternative, which is the name of the function without
   * the handler parameter, e.g. {@code foo(a:)} for {@code foo(a:completion:)}.
   */
  public String printAsyncFunctionName() {
    if (func == null || index < 0) {
      return "";
    }
    StringBuilder sb = new StringBuilder(func.getName()).append('(');
    ImmutableList<Decl> params = func.getParams();
    for (int i = 0; i < params.size(); i++) {
      if (i != index) {
        String label = params.get(i).getArgumentLabel();
        sb.append(label.isEmpty() ? "_" : label).append(':');
      }
    }
    return sb.append(')').toString();
  }

  @Override
  public boolean equals(@Nullable Object o) {
    return o instanceof AsyncHandlerParamDesc
        && super.equals(o)
        && index == ((AsyncHandlerParamDesc) o).index;
  }

  @Override
  public int hashCode() {
    return Objects.hash(super.hashCode(), index);
  }
}

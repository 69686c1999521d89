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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.ide.syntax.Decl;
import com.google.ide.syntax.Node;
import com.google.ide.syntax.Type;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Describes the completion handler of a function that has, or could have, an async alternative.
 */
public class AsyncHandlerDesc {
  private static final ImmutableSet<String> COMPLETION_HANDLER_NAMES =
      ImmutableSet.of("completionHandler", "completion", "withCompletionHandler", "withCompletion");

  static final AsyncHandlerDesc INVALID = new AsyncHandlerDesc(null, HandlerType.INVALID, false);

  private final @Nullable HandlerRef handler;
  private final HandlerType type;
  private final boolean hasError;

  AsyncHandlerDesc(@Nullable HandlerRef handler, HandlerType type, boolean hasError) {
    this.handler = handler;
    this.type = type;
    this.hasError = hasError;
  }

  AsyncHandlerDesc(AsyncHandlerDesc other) {
    this(other.handler, other.type, other.hasError);
  }

  static boolean isCompletionHandlerParamName(String name) {
    return COMPLETION_HANDLER_NAMES.contains(name);
  }

  /**
   * Describes {@code handler} as a completion handler, returning an invalid description if it is
   * not a Void returning closure variable or function.
   */
  public static AsyncHandlerDesc get(Decl handlerDecl, boolean requireName) {
    HandlerRef handler = HandlerRef.of(handlerDecl);
    if (handler == null) {
      return INVALID;
    }

    if (requireName && !isCompletionHandlerParamName(handler.getName())) {
      return INVALID;
    }

    // May have no parameters at all for a plain "done" callback.
    Type handlerType = handler.getType();
    if (!handlerType.isFunction() || !handlerType.getResult().isVoid()) {
      return INVALID;
    }

    ImmutableList<Type> handlerParams = handlerType.getParams();
    if (handlerParams.size() == 1 && handlerParams.get(0).isResult()) {
      Type failure = handlerParams.get(0).getGenericArgs().get(1);
      return new AsyncHandlerDesc(handler, HandlerType.RESULT, !failure.isUninhabited());
    }

    for (Type param : handlerParams) {
      if (param.isResult()) {
        return INVALID;
      }
    }

    boolean hasError = false;
    if (!handlerParams.isEmpty()) {
      Type errorType = handlerParams.get(handlerParams.size() - 1).getOptionalObjectType();
      hasError = errorType != null && errorType.isErrorType();
    }
    return new AsyncHandlerDesc(handler, HandlerType.PARAMS, hasError);
  }

  public boolean isValid() {
    return type != HandlerType.INVALID;
  }

  public HandlerType getType() {
    return type;
  }

  public boolean hasError() {
    return hasError;
  }

  /** The handler variable or function. */
  public Decl getHandler() {
    checkState(handler != null, "Invalid handler");
    return handler.getDecl();
  }

  /** The variable name, or the base name if the handler is a function. */
  public String getNameStr() {
    checkState(handler != null, "Invalid handler");
    return handler.getName();
  }

  ImmutableList<Type> params() {
    checkState(handler != null, "Invalid handler");
    return handler.getType().getParams();
  }

  /** The handler parameters passed on success, which excludes a trailing error parameter. */
  ImmutableList<Type> getSuccessParams() {
    ImmutableList<Type> params = params();
    if (hasError && type == HandlerType.PARAMS) {
      return params.subList(0, params.size() - 1);
    }
    return params;
  }

  /**
   * The type of error the async alternative throws, or null if the handler takes no error. This
   * may be narrower than {@code Error}.
   */
  @Nullable Type getErrorType() {
    if (!hasError) {
      return null;
    }
    switch (type) {
      case PARAMS:
        return params().get(params().size() - 1).lookThroughSingleOptionalType();
      case RESULT:
        return params().get(0).getGenericArgs().get(1);
      case INVALID:
        return null;
    }
    throw new AssertionError(type);
  }

  /** Returns {@code n} if it is a call of the handler, null otherwise. */
  @Nullable Node getAsHandlerCall(Node n) {
    if (!isValid() || !n.isCall()) {
      return null;
    }
    return Objects.equals(n.getCalledDecl(), getHandler()) ? n : null;
  }

  /**
   * Given a call of the handler, returns the expressions to return or throw. The {@code
   * .success}/{@code .failure} wrapper of a {@code Result} handler is removed.
   */
  HandlerResult extractResultArgs(Node call) {
    ImmutableList<Node> args = call.getArgumentValues();

    if (type == HandlerType.PARAMS) {
      if (args.isEmpty()) {
        return new HandlerResult();
      }
      // Anything other than nil in the error position is the error path.
      Node last = args.get(args.size() - 1);
      if (hasError && !last.isNil()) {
        return new HandlerResult(last, true);
      }

      if (willAsyncReturnVoid()) {
        return new HandlerResult();
      }
      return new HandlerResult(hasError ? args.subList(0, args.size() - 1) : args);
    }

    checkState(type == HandlerType.RESULT, type);
    if (args.size() != 1 || !args.get(0).isCall()) {
      return new HandlerResult(args);
    }
    Node resultCall = args.get(0);
    Node callee = resultCall.getCallee();
    if (!callee.isMember() && !callee.isImplicitMember()) {
      return new HandlerResult(args);
    }
    Decl enumCase = callee.getReferencedDecl();
    if (enumCase == null || !enumCase.isEnumCase()) {
      return new HandlerResult(args);
    }

    boolean isFailure = enumCase.getName().equals("failure");
    if (!isFailure && willAsyncReturnVoid()) {
      return new HandlerResult();
    }
    ImmutableList<Node> resultArgs = resultCall.getArgumentValues();
    if (resultArgs.isEmpty()) {
      return new HandlerResult(args);
    }
    return new HandlerResult(resultArgs.get(0), isFailure);
  }

  /**
   * The async return type for a success parameter: one level of optionality is removed when the
   * handler also takes an error, and {@code Result<T, E>} maps to {@code T}.
   */
  Type getSuccessParamAsyncReturnType(Type paramType) {
    switch (type) {
      case PARAMS:
        return hasError ? paramType.lookThroughSingleOptionalType() : paramType;
      case RESULT:
        return paramType.getGenericArgs().get(0);
      case INVALID:
        break;
    }
    throw new IllegalStateException("Invalid handler type");
  }

  /** The return types of the async alternative. */
  public ImmutableList<Type> getAsyncReturnTypes() {
    ImmutableList.Builder<Type> types = ImmutableList.builder();
    for (Type param : getSuccessParams()) {
      types.add(getSuccessParamAsyncReturnType(param));
    }
    return types.build();
  }

  /** Whether the async alternative returns Void. */
  public boolean willAsyncReturnVoid() {
    for (Type param : getSuccessParams()) {
      if (!getSuccessParamAsyncReturnType(param).isVoid()) {
        return false;
      }
    }
    return true;
  }

  boolean shouldUnwrap(Type paramType) {
    return hasError && paramType.isOptional();
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (!(o instanceof AsyncHandlerDesc)) {
      return false;
    }
    AsyncHandlerDesc other = (AsyncHandlerDesc) o;
    return Objects.equals(handlerDecl(), other.handlerDecl())
        && type == other.type
        && hasError == other.hasError;
  }

  @Override
  public int hashCode() {
    return Objects.hash(handlerDecl(), type, hasError);
  }

  private @Nullable Decl handlerDecl() {
    return handler == null ? null : handler.getDecl();
  }
}

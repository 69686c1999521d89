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

package com.google.ide.syntax;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A resolved type as seen by the refactorings. Types are supplied by the type checker; only the
 * handful of structural questions the refactorings ask are modelled.
 */
@Immutable
public final class Type {

  /** The structural kinds of type. */
  public enum Kind {
    VOID,
    NAMED,
    OPTIONAL,
    FUNCTION,
    GENERIC,
    TUPLE
  }

  private static final Type VOID =
      new Type(Kind.VOID, "Void", ImmutableList.of(), null, false, false);

  private final Kind kind;
  private final String name;
  private final ImmutableList<Type> args;
  private final @Nullable Type result;
  private final boolean conformsToError;
  private final boolean uninhabited;

  private Type(
      Kind kind,
      String name,
      ImmutableList<Type> args,
      @Nullable Type result,
      boolean conformsToError,
      boolean uninhabited) {
    this.kind = kind;
    this.name = name;
    this.args = args;
    this.result = result;
    this.conformsToError = conformsToError;
    this.uninhabited = uninhabited;
  }

  public static Type voidType() {
    return VOID;
  }

  public static Type named(String name) {
    return new Type(Kind.NAMED, checkNotNull(name), ImmutableList.of(), null, false, false);
  }

  /** A nominal type that conforms to the error protocol. */
  public static Type errorType(String name) {
    return new Type(Kind.NAMED, checkNotNull(name), ImmutableList.of(), null, true, false);
  }

  /** A nominal type without values, such as {@code Never}. */
  public static Type uninhabited(String name) {
    return new Type(Kind.NAMED, checkNotNull(name), ImmutableList.of(), null, false, true);
  }

  public static Type optional(Type wrapped) {
    return new Type(Kind.OPTIONAL, "", ImmutableList.of(wrapped), null, false, false);
  }

  public static Type function(List<Type> params, Type result) {
    return new Type(
        Kind.FUNCTION, "", ImmutableList.copyOf(params), checkNotNull(result), false, false);
  }

  public static Type generic(String name, List<Type> genericArgs) {
    checkArgument(!genericArgs.isEmpty(), "Generic type %s needs arguments", name);
    return new Type(Kind.GENERIC, name, ImmutableList.copyOf(genericArgs), null, false, false);
  }

  public static Type result(Type success, Type failure) {
    return generic("Result", ImmutableList.of(success, failure));
  }

  public static Type tuple(List<Type> elements) {
    return new Type(Kind.TUPLE, "", ImmutableList.copyOf(elements), null, false, false);
  }

  public Kind getKind() {
    return kind;
  }

  public String getName() {
    return name;
  }

  /** Both {@code Void} and the empty tuple are void. */
  public boolean isVoid() {
    return kind == Kind.VOID || (kind == Kind.TUPLE && args.isEmpty());
  }

  public boolean isOptional() {
    return kind == Kind.OPTIONAL;
  }

  /** The wrapped type of an optional, or null if this is not an optional. */
  public @Nullable Type getOptionalObjectType() {
    return isOptional() ? args.get(0) : null;
  }

  /** Strips one level of optionality if there is one. */
  public Type lookThroughSingleOptionalType() {
    return isOptional() ? args.get(0) : this;
  }

  public boolean isFunction() {
    return kind == Kind.FUNCTION;
  }

  public ImmutableList<Type> getParams() {
    checkState(isFunction(), "Not a function type: %s", this);
    return args;
  }

  public Type getResult() {
    checkState(isFunction(), "Not a function type: %s", this);
    return result;
  }

  public boolean isGeneric() {
    return kind == Kind.GENERIC;
  }

  public ImmutableList<Type> getGenericArgs() {
    checkState(isGeneric(), "Not a generic type: %s", this);
    return args;
  }

  /** Whether this is the standard library's two argument {@code Result} type. */
  public boolean isResult() {
    return kind == Kind.GENERIC && name.equals("Result") && args.size() == 2;
  }

  public boolean isTuple() {
    return kind == Kind.TUPLE;
  }

  public ImmutableList<Type> getTupleElements() {
    checkState(isTuple(), "Not a tuple type: %s", this);
    return args;
  }

  /** Whether values of this type can be thrown. */
  public boolean isErrorType() {
    return conformsToError;
  }

  public boolean isUninhabited() {
    return uninhabited;
  }

  /** Prints the type the way it is spelled in source. */
  @Override
  public String toString() {
    switch (kind) {
      case VOID:
        return "Void";
      case NAMED:
        return name;
      case OPTIONAL:
        Type wrapped = args.get(0);
        return (wrapped.isFunction() ? "(" + wrapped + ")" : wrapped.toString()) + "?";
      case FUNCTION:
        return "(" + Joiner.on(", ").join(args) + ") -> " + result;
      case GENERIC:
        return name + "<" + Joiner.on(", ").join(args) + ">";
      case TUPLE:
        return "(" + Joiner.on(", ").join(args) + ")";
    }
    throw new AssertionError(kind);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Type)) {
      return false;
    }
    Type other = (Type) o;
    if (isVoid() && other.isVoid()) {
      return true;
    }
    return kind == other.kind
        && name.equals(other.name)
        && args.equals(other.args)
        && Objects.equals(result, other.result);
  }

  @Override
  public int hashCode() {
    return isVoid() ? 0 : Objects.hash(kind, name, args, result);
  }
}

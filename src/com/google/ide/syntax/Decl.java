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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A declared symbol: a variable, parameter, function, type or enum case. Declarations are created
 * by symbol resolution and linked to the syntax node that declares them, if any.
 */
public final class Decl {

  /** Declaration kinds. */
  public enum Kind {
    VAR,
    PARAM,
    FUNC,
    TYPE,
    ENUM_CASE
  }

  private final Kind kind;
  private final String name;
  private final Type type;
  private final String argumentLabel;
  private final @Nullable Type resultType;
  private final ImmutableList<Decl> params;
  private final @Nullable Type contextType;
  private final boolean isLet;
  private final boolean isImplicit;
  private final boolean isSystem;
  private final boolean isLocal;
  private final boolean isAutoClosure;
  private final boolean hasAsync;
  private final boolean hasThrows;
  private final boolean hasCompletionHandlerAsyncAttr;

  private @Nullable Node declaringNode;

  private Decl(Builder builder) {
    this.kind = builder.kind;
    this.name = builder.name;
    this.argumentLabel = builder.argumentLabel;
    this.resultType = builder.resultType;
    this.params = builder.params;
    this.contextType = builder.contextType;
    this.isLet = builder.isLet;
    this.isImplicit = builder.isImplicit;
    this.isSystem = builder.isSystem;
    this.isLocal = builder.isLocal;
    this.isAutoClosure = builder.isAutoClosure;
    this.hasAsync = builder.hasAsync;
    this.hasThrows = builder.hasThrows;
    this.hasCompletionHandlerAsyncAttr = builder.hasCompletionHandlerAsyncAttr;
    if (kind == Kind.FUNC) {
      ImmutableList.Builder<Type> paramTypes = ImmutableList.builder();
      for (Decl param : params) {
        paramTypes.add(param.getType());
      }
      this.type =
          Type.function(
              paramTypes.build(), resultType == null ? Type.voidType() : resultType);
    } else {
      this.type = builder.type == null ? Type.named("_") : builder.type;
    }
  }

  public static Builder builder(Kind kind, String name) {
    return new Builder(kind, name);
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isVar() {
    return kind == Kind.VAR;
  }

  public boolean isParam() {
    return kind == Kind.PARAM;
  }

  public boolean isFunc() {
    return kind == Kind.FUNC;
  }

  public boolean isEnumCase() {
    return kind == Kind.ENUM_CASE;
  }

  /** Functions and types introduce their own declaration context. */
  public boolean isDeclContext() {
    return kind == Kind.FUNC || kind == Kind.TYPE;
  }

  /** The base name, empty for anonymous declarations such as {@code _} parameters. */
  public String getName() {
    return name;
  }

  public boolean hasName() {
    return !name.isEmpty();
  }

  /**
   * The full compound name, e.g. {@code foo(a:_:)} for functions and the plain name for
   * everything else.
   */
  public String getFullName() {
    if (kind != Kind.FUNC) {
      return name;
    }
    StringBuilder sb = new StringBuilder(name).append('(');
    for (Decl param : params) {
      sb.append(param.getArgumentLabel().isEmpty() ? "_" : param.getArgumentLabel()).append(':');
    }
    return sb.append(')').toString();
  }

  /** The type of the declaration. For functions this is the full function type. */
  public Type getType() {
    return type;
  }

  /** The external label of a parameter, empty if it has none. */
  public String getArgumentLabel() {
    return argumentLabel;
  }

  public Type getResultType() {
    checkState(kind == Kind.FUNC, "Not a function: %s", name);
    return resultType == null ? Type.voidType() : resultType;
  }

  public ImmutableList<Decl> getParams() {
    return params;
  }

  /** The type an enum case or member belongs to, if known. */
  public @Nullable Type getContextType() {
    return contextType;
  }

  public boolean isLet() {
    return isLet;
  }

  public boolean isImplicit() {
    return isImplicit;
  }

  /** Whether the declaration comes from a system module and so cannot be edited. */
  public boolean isSystem() {
    return isSystem;
  }

  /** Whether the declaration is only visible inside a function or closure body. */
  public boolean isLocal() {
    return isLocal;
  }

  public boolean isAutoClosure() {
    return isAutoClosure;
  }

  public boolean hasAsync() {
    return hasAsync;
  }

  public boolean hasThrows() {
    return hasThrows;
  }

  public boolean hasCompletionHandlerAsyncAttr() {
    return hasCompletionHandlerAsyncAttr;
  }

  /** The node declaring this symbol, or null if it has no source location. */
  public @Nullable Node getDeclaringNode() {
    return declaringNode;
  }

  public void setDeclaringNode(Node node) {
    checkState(declaringNode == null, "%s already has a declaring node", name);
    this.declaringNode = checkNotNull(node);
  }

  @Override
  public String toString() {
    return kind + " " + getFullName();
  }

  /** Builder for {@link Decl}. */
  public static final class Builder {
    private final Kind kind;
    private final String name;
    private @Nullable Type type;
    private String argumentLabel = "";
    private @Nullable Type resultType;
    private ImmutableList<Decl> params = ImmutableList.of();
    private @Nullable Type contextType;
    private boolean isLet;
    private boolean isImplicit;
    private boolean isSystem;
    private boolean isLocal;
    private boolean isAutoClosure;
    private boolean hasAsync;
    private boolean hasThrows;
    private boolean hasCompletionHandlerAsyncAttr;

    private Builder(Kind kind, String name) {
      this.kind = checkNotNull(kind);
      this.name = checkNotNull(name);
    }

    @CanIgnoreReturnValue
    public Builder setType(Type type) {
      this.type = type;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setArgumentLabel(String argumentLabel) {
      this.argumentLabel = checkNotNull(argumentLabel);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setResultType(Type resultType) {
      this.resultType = resultType;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setParams(List<Decl> params) {
      this.params = ImmutableList.copyOf(params);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setContextType(Type contextType) {
      this.contextType = contextType;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setLet(boolean isLet) {
      this.isLet = isLet;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setImplicit(boolean isImplicit) {
      this.isImplicit = isImplicit;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setSystem(boolean isSystem) {
      this.isSystem = isSystem;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setLocal(boolean isLocal) {
      this.isLocal = isLocal;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setAutoClosure(boolean isAutoClosure) {
      this.isAutoClosure = isAutoClosure;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setAsync(boolean hasAsync) {
      this.hasAsync = hasAsync;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setThrows(boolean hasThrows) {
      this.hasThrows = hasThrows;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setCompletionHandlerAsyncAttr(boolean hasAttr) {
      this.hasCompletionHandlerAsyncAttr = hasAttr;
      return this;
    }

    public Decl build() {
      return new Decl(this);
    }
  }
}

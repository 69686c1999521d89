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

/**
 * The kinds of syntax tree nodes.
 *
 * <p>The child layout of each kind is documented next to it. Children in square brackets are
 * optional.
 */
public enum Token {
  /** Root of a source file. Children: top-level declarations and statements. */
  SCRIPT,

  // Declarations

  /** A function declaration. Children: PARAM_LIST, [BLOCK]. Declares a FUNC decl. */
  FUNCTION,
  /** The parenthesized parameter list of a function or closure. Children: PARAM*. */
  PARAM_LIST,
  /** A single parameter. No children. Declares a PARAM decl; LABEL_SPAN covers its names. */
  PARAM,
  /** A {@code let}/{@code var} declaration. Children: pattern, [initializer]. */
  BINDING,

  // Statements

  /** A braced block. Children: statements. */
  BLOCK,
  /** Children: CONDITION_LIST, BLOCK, [BLOCK or IF]. */
  IF,
  /** Children: CONDITION_LIST, BLOCK (the else body). */
  GUARD,
  /** Children: CONDITION_LIST, BLOCK. */
  WHILE,
  /** Children: pattern, sequence expression, BLOCK. */
  FOR_EACH,
  /** Children: subject expression, CASE*. */
  SWITCH,
  /** Children: CASE_ITEM*, BLOCK (implicit). A {@code default} case has no items. */
  CASE,
  /** Children: pattern, [where clause expression]. */
  CASE_ITEM,
  /** Children: [expression]. */
  RETURN,
  /** No children. BREAK_TARGET points at the statement being exited. */
  BREAK,
  /** No children. */
  FALLTHROUGH,
  /** Children: expression. */
  THROW,

  // Conditions

  /** The comma separated conditions of an if, guard or while. Children: conditions. */
  CONDITION_LIST,
  /** A pattern condition such as {@code let x = y}. Children: pattern, initializer. */
  COND_BINDING,

  // Expressions

  /** Children: callee, ARGUMENT*. */
  CALL,
  /** A call argument. Children: value. LABEL holds the label, LABEL_SPAN its source range. */
  ARGUMENT,
  /** A reference to a declaration by name. */
  NAME,
  /** Member access {@code base.name}. Children: base. */
  MEMBER,
  /** Implicit member access {@code .name}. No children. */
  IMPLICIT_MEMBER,
  /** The {@code nil} literal. */
  NIL,
  /** Number or string literal. IS_STRING distinguishes the two. */
  LITERAL,
  /** Binary operator application. Children: lhs, rhs. The string holds the operator. */
  BINARY,
  /** {@code x!}. Children: operand. */
  FORCE_UNWRAP,
  /** {@code x?} as in {@code x?.foo}. Children: operand. */
  BIND_OPTIONAL,
  /** Children: PARAM_LIST, BLOCK. */
  CLOSURE,
  /** {@code try? expr}. Children: operand. */
  TRY_OPTIONAL,
  /** {@code try expr}. Children: operand. */
  TRY,
  /** {@code await expr}. Children: operand. */
  AWAIT,
  /** Tuple expression, including the empty tuple {@code ()}. Children: elements. */
  TUPLE,
  /** Parenthesized expression. Children: expression. */
  PAREN,

  // Patterns

  /** A name being bound. Declares a VAR decl. */
  NAME_PATTERN,
  /** {@code let p} or {@code var p}. Children: pattern. IS_LET tells which. */
  BINDING_PATTERN,
  /** The implicit {@code .some(p)} of an optional binding. Children: pattern. */
  OPTIONAL_SOME_PATTERN,
  /** {@code .case(p)}. Children: [pattern]. Refers to an ENUM_CASE decl. */
  ENUM_PATTERN,
  /** {@code _}. */
  ANY_PATTERN;

  public boolean isStatement() {
    switch (this) {
      case BLOCK:
      case IF:
      case GUARD:
      case WHILE:
      case FOR_EACH:
      case SWITCH:
      case CASE:
      case RETURN:
      case BREAK:
      case FALLTHROUGH:
      case THROW:
        return true;
      default:
        return false;
    }
  }

  public boolean isPattern() {
    switch (this) {
      case NAME_PATTERN:
      case BINDING_PATTERN:
      case OPTIONAL_SOME_PATTERN:
      case ENUM_PATTERN:
      case ANY_PATTERN:
        return true;
      default:
        return false;
    }
  }
}

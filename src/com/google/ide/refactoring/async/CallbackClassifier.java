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
import com.google.common.collect.ImmutableSet;
import com.google.ide.analysis.CheckLevel;
import com.google.ide.analysis.DiagnosticType;
import com.google.ide.analysis.ErrorManager;
import com.google.ide.analysis.RefactoringError;
import com.google.ide.syntax.Decl;
import com.google.ide.syntax.Node;
import com.google.ide.syntax.SourceFile;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Splits the statements of a callback closure into a success block and an error block.
 *
 * <p>This is a best effort that may give up on some inputs. It covers the common cases of a
 * callback without an error parameter, and of success and error code wrapped in if, guard or
 * switch statements that bind or nil check the callback parameters. Code outside of any
 * recognized condition goes to the success block.
 */
public final class CallbackClassifier {
  public static final DiagnosticType UNKNOWN_CALLBACK_CONDITIONS =
      DiagnosticType.error("unknown_callback_conditions", "cannot refactor complex if conditions");

  public static final DiagnosticType MIXED_CALLBACK_CONDITIONS =
      DiagnosticType.error(
          "mixed_callback_conditions", "cannot refactor mixed nil and not-nil conditions");

  public static final DiagnosticType CALLBACK_WITH_FALLTHROUGH =
      DiagnosticType.error("callback_with_fallthrough", "cannot refactor switch with fallthrough");

  public static final DiagnosticType CALLBACK_WITH_DEFAULT =
      DiagnosticType.error("callback_with_default", "cannot refactor switch with default case");

  public static final DiagnosticType CALLBACK_MULTIPLE_CASE_ITEMS =
      DiagnosticType.error(
          "callback_multiple_case_items",
          "cannot refactor switch using a case with multiple items");

  public static final DiagnosticType CALLBACK_WHERE_CASE_ITEM =
      DiagnosticType.error(
          "callback_where_case_item", "cannot refactor switch using a case with where clause");

  public static final ImmutableSet<DiagnosticType> ALL_TYPES =
      ImmutableSet.of(
          UNKNOWN_CALLBACK_CONDITIONS,
          MIXED_CALLBACK_CONDITIONS,
          CALLBACK_WITH_FALLTHROUGH,
          CALLBACK_WITH_DEFAULT,
          CALLBACK_MULTIPLE_CASE_ITEMS,
          CALLBACK_WHERE_CASE_ITEM);

  private final SourceFile file;
  private final ClassifiedBlocks blocks;
  private final Set<Node> handledSwitches;
  private final ErrorManager errorManager;
  private final ImmutableSet<Decl> unwrapParams;
  private final @Nullable Decl errParam;
  private final boolean isResultParam;
  private ClassifiedBlock currentBlock;

  private CallbackClassifier(
      SourceFile file,
      ClassifiedBlocks blocks,
      Set<Node> handledSwitches,
      ErrorManager errorManager,
      Set<Decl> unwrapParams,
      @Nullable Decl errParam,
      boolean isResultParam) {
    this.file = file;
    this.blocks = blocks;
    this.handledSwitches = handledSwitches;
    this.errorManager = errorManager;
    this.unwrapParams = ImmutableSet.copyOf(unwrapParams);
    this.errParam = errParam;
    this.isResultParam = isResultParam;
    this.currentBlock = blocks.successBlock;
  }

  /**
   * Adds the statements of {@code body} to the success and error blocks of {@code blocks}.
   * Diagnostics are reported to {@code errorManager}, in which case the blocks may be partially
   * filled.
   */
  static void classifyInto(
      SourceFile file,
      ClassifiedBlocks blocks,
      Set<Node> handledSwitches,
      ErrorManager errorManager,
      Set<Decl> unwrapParams,
      @Nullable Decl errParam,
      HandlerType resultType,
      Node body) {
    CallbackClassifier classifier =
        new CallbackClassifier(
            file,
            blocks,
            handledSwitches,
            errorManager,
            unwrapParams,
            errParam,
            resultType == HandlerType.RESULT);
    classifier.classifyNodes(body.getChildren(), body.getEnd() - 1);
  }

  private boolean hadAnyError() {
    return errorManager.getErrorCount() > 0;
  }

  private void report(int offset, DiagnosticType type) {
    errorManager.report(CheckLevel.ERROR, RefactoringError.make(file, offset, type));
  }

  private void classifyNodes(List<Node> nodes, int endCommentLoc) {
    for (Node n : nodes) {
      switch (n.getToken()) {
        case IF:
          classifyConditional(
              n, n.getCondition(), NodesToPrint.inBraceStmt(n.getThenBlock()), n.getElse());
          break;
        case GUARD:
          classifyConditional(n, n.getCondition(), new NodesToPrint(), n.getGuardBody());
          break;
        case SWITCH:
          classifySwitch(n);
          break;
        default:
          currentBlock.addNode(n);
          break;
      }

      if (hadAnyError()) {
        return;
      }
    }
    currentBlock.addPossibleCommentLoc(endCommentLoc);
  }

  private void classifyConditional(
      Node statement, Node condition, NodesToPrint thenNodesToPrint, @Nullable Node elseStmt) {
    Map<Decl, CallbackCondition> callbackConditions = new LinkedHashMap<>();
    boolean unhandledConditions =
        !CallbackCondition.all(condition, unwrapParams, callbackConditions);
    CallbackCondition errCondition =
        errParam == null
            ? CallbackCondition.INVALID
            : callbackConditions.getOrDefault(errParam, CallbackCondition.INVALID);

    if (unhandledConditions) {
      // Known conditions will get placeholders.
      if (callbackConditions.isEmpty()) {
        currentBlock.addNode(statement);
      } else if (elseStmt != null) {
        report(statement.getStart(), UNKNOWN_CALLBACK_CONDITIONS);
      } else if (errCondition.isValid() && errCondition.getType() == ConditionType.NOT_NIL) {
        blocks.errorBlock.addNode(statement);
      } else {
        for (CallbackCondition cond : callbackConditions.values()) {
          if (cond.getType() == ConditionType.NIL) {
            blocks.errorBlock.addNode(statement);
            return;
          }
        }
        blocks.successBlock.addNode(statement);
      }
      return;
    }

    ClassifiedBlock thenBlock = blocks.successBlock;
    ClassifiedBlock elseBlock = blocks.errorBlock;

    if (errCondition.isValid()
        && (!isResultParam || errCondition.isErrorCase())
        && errCondition.getType() == ConditionType.NOT_NIL) {
      thenBlock = blocks.errorBlock;
      elseBlock = blocks.successBlock;
    } else {
      ConditionType condType = ConditionType.INVALID;
      for (CallbackCondition cond : callbackConditions.values()) {
        if (isResultParam || cond.getSubject() != errParam) {
          if (condType == ConditionType.INVALID) {
            condType = cond.getType();
          } else if (condType != cond.getType()) {
            if (elseStmt != null) {
              report(statement.getStart(), MIXED_CALLBACK_CONDITIONS);
            } else {
              currentBlock.addNode(statement);
            }
            return;
          }
        }
      }

      if (condType == ConditionType.NIL) {
        thenBlock = blocks.errorBlock;
        elseBlock = blocks.successBlock;
      }
    }

    // The statement itself is dropped, its comments are not.
    currentBlock.addPossibleCommentLoc(statement.getStart());

    thenBlock.addAllBindings(callbackConditions);

    // TODO(ide-team): classify nested if statements.
    setNodes(thenBlock, elseBlock, thenNodesToPrint);

    if (elseStmt != null) {
      if (elseStmt.isBlock()) {
        setNodes(elseBlock, thenBlock, NodesToPrint.inBraceStmt(elseStmt));
      } else {
        classifyNodes(ImmutableList.of(elseStmt), -1);
      }
    }
  }

  private void setNodes(ClassifiedBlock block, ClassifiedBlock otherBlock, NodesToPrint nodes) {
    if (nodes.hasTrailingReturnOrBreak()) {
      currentBlock = otherBlock;
      nodes.dropTrailingReturnOrBreakIfPossible();
    }
    block.addAllNodes(nodes);
  }

  private void classifySwitch(Node switchStmt) {
    if (!isResultParam || singleSwitchSubject(switchStmt) != errParam) {
      currentBlock.addNode(switchStmt);
      return;
    }

    currentBlock.addPossibleCommentLoc(switchStmt.getStart());

    ImmutableList<Node> cases = switchStmt.getCases();
    for (Node caseStmt : cases) {
      if (caseStmt.hasFallthroughDest()) {
        report(caseStmt.getStart(), CALLBACK_WITH_FALLTHROUGH);
        return;
      }

      if (caseStmt.isDefaultCase()) {
        report(caseStmt.getStart(), CALLBACK_WITH_DEFAULT);
        return;
      }

      ImmutableList<Node> items = caseStmt.getCaseItems();
      if (items.size() > 1) {
        report(caseStmt.getStart(), CALLBACK_MULTIPLE_CASE_ITEMS);
        return;
      }

      if (items.get(0).hasWhereClause()) {
        report(caseStmt.getStart(), CALLBACK_WHERE_CASE_ITEM);
        return;
      }

      CallbackCondition cond = CallbackCondition.fromCaseItem(errParam, items.get(0));
      ClassifiedBlock block = blocks.successBlock;
      ClassifiedBlock otherBlock = blocks.errorBlock;
      if (cond.isErrorCase()) {
        block = blocks.errorBlock;
        otherBlock = blocks.successBlock;
      }

      // Comments before a case belong to the end of the previous one.
      currentBlock.addPossibleCommentLoc(caseStmt.getStart());

      if (caseStmt == cases.get(cases.size() - 1)) {
        block.addPossibleCommentLoc(switchStmt.getEnd() - 1);
      }

      setNodes(block, otherBlock, NodesToPrint.inBraceStmt(caseStmt.getCaseBody()));
      block.addBinding(cond);
    }
    handledSwitches.add(switchStmt);
  }

  /** The declaration a switch subject refers to, or null if the subject is not a plain name. */
  static @Nullable Decl singleSwitchSubject(Node switchStmt) {
    Node subject = switchStmt.getSwitchSubject();
    return subject.isName() ? subject.getDecl() : null;
  }
}

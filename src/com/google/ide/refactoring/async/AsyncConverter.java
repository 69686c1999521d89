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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.ide.analysis.BasicErrorManager;
import com.google.ide.analysis.CancellationChecker;
import com.google.ide.analysis.CheckLevel;
import com.google.ide.analysis.DeclCollector;
import com.google.ide.analysis.DiagnosticType;
import com.google.ide.analysis.ErrorManager;
import com.google.ide.analysis.NodeTraversal;
import com.google.ide.analysis.NodeTraversal.AbstractScopedCallback;
import com.google.ide.analysis.NodeUtil;
import com.google.ide.analysis.RefactoringError;
import com.google.ide.analysis.ReferenceCollector;
import com.google.ide.analysis.ScopedDeclCollector;
import com.google.ide.refactoring.SuggestedFix;
import com.google.ide.syntax.Decl;
import com.google.ide.syntax.Node;
import com.google.ide.syntax.SourceFile;
import com.google.ide.syntax.SourceSpan;
import com.google.ide.syntax.Type;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites a function with a completion handler into an async function, or a call of such a
 * function into an {@code await} of its async alternative.
 *
 * <p>Calls whose completion handler is a closure are hoisted: the closure body is split into its
 * success and error paths by {@link CallbackClassifier} and printed after the awaited call,
 * within a {@code do}/{@code catch} when there is an error path. Calls of the completion handler
 * of the function being converted become {@code return} or {@code throw} statements.
 *
 * <p>A converter can only be used once.
 */
public final class AsyncConverter {
  private static final Logger logger = Logger.getLogger(AsyncConverter.class.getName());

  private static final String PLACEHOLDER_START = "<#";
  private static final String PLACEHOLDER_END = "#>";

  public static final DiagnosticType MISSING_CALLBACK_ARG =
      DiagnosticType.error(
          "missing_callback_arg", "cannot refactor call that is missing its completion handler");

  public static final DiagnosticType MISMATCHED_CALLBACK_ARGS =
      DiagnosticType.error(
          "mismatched_callback_args",
          "cannot refactor callback whose parameters do not match its completion handler");

  private final SourceFile file;
  private final ErrorManager errorManager;
  private final CancellationChecker cancellationChecker;

  private final Node startNode;

  /** Completion handler of {@code startNode} if it is a function with an async alternative. */
  private final AsyncHandlerParamDesc topHandler;

  private final StringBuilder out = new StringBuilder();

  /**
   * Decls whose force unwraps and optional chains are elided, e.g. an optional closure parameter
   * that became a non-optional local.
   */
  private final Set<Decl> unwraps = new HashSet<>();

  /** Decls whose references are printed as placeholders since they no longer exist. */
  private final Set<Decl> placeholders = new HashSet<>();

  /** New names of hoisted closure parameters and of renamed local variables. */
  private final Map<Decl, String> names = new HashMap<>();

  /** Names visible in each scope being printed, innermost first. */
  private final Deque<Set<String>> scopedNames = new ArrayDeque<>();

  private final ScopedDeclCollector scopedDecls;

  /** The switch statements removed by classification. */
  private final Set<Node> handledSwitches = new HashSet<>();

  private final ConvertingCallback walker = new ConvertingCallback();

  /** The end of the source that has been printed so far. */
  private int lastAddedLoc = -1;

  /**
   * Number of expressions or bindings currently nested in, taking hoisting and the removal of
   * classified statements into account.
   */
  private int nestedExprCount = 0;

  /** Whether a completion handler body is being hoisted out of its call. */
  private boolean hoisting = false;

  private boolean used = false;

  private AsyncConverter(
      SourceFile file,
      ErrorManager errorManager,
      CancellationChecker cancellationChecker,
      Node startNode,
      AsyncHandlerParamDesc topHandler) {
    this.file = file;
    this.errorManager = errorManager;
    this.cancellationChecker = cancellationChecker;
    this.startNode = startNode;
    this.topHandler = topHandler;
    this.scopedDecls = new ScopedDeclCollector(cancellationChecker);
  }

  /** Creates a converter for the function declared by {@code function}. */
  public static AsyncConverter forFunction(
      SourceFile file,
      Node function,
      AsyncHandlerParamDesc topHandler,
      ErrorManager errorManager,
      CancellationChecker cancellationChecker) {
    checkState(function.isFunction(), function);
    AsyncConverter converter =
        new AsyncConverter(file, errorManager, cancellationChecker, function, topHandler);
    if (topHandler.isValid()) {
      converter.placeholders.add(topHandler.getHandler());
    }
    converter.scopedDecls.collect(function);
    // Prefer possible shadowing over a missing scope.
    converter.addNewScope(ImmutableSet.of());
    return converter;
  }

  /**
   * Creates a converter for {@code call}, which is in the block {@code scope}. The names declared
   * in the scope, and those referenced after the call, are taken.
   */
  public static AsyncConverter forCall(
      SourceFile file,
      Node call,
      @Nullable Node scope,
      ErrorManager errorManager,
      CancellationChecker cancellationChecker) {
    checkState(call.isCall(), call);
    AsyncConverter converter =
        new AsyncConverter(
            file, errorManager, cancellationChecker, call, AsyncHandlerParamDesc.find(null, false));
    converter.scopedDecls.collect(call);

    Set<Decl> usedDecls = new LinkedHashSet<>();
    if (scope != null) {
      DeclCollector.collect(scope, usedDecls, cancellationChecker);
      ReferenceCollector.collect(call, scope, usedDecls, cancellationChecker);
    }
    converter.addNewScope(usedDecls);
    return converter;
  }

  /** Converts the start node. Returns false if an error was reported. */
  public boolean convert() {
    checkState(!used, "AsyncConverter can only be used once");
    used = true;
    int initialErrorCount = errorManager.getErrorCount();

    if (startNode.isFunction()) {
      addFuncDecl(startNode);
      Node body = startNode.getFunctionBody();
      if (body != null) {
        convertNode(body);
      }
    } else {
      convertNode(startNode);
    }
    return errorManager.getErrorCount() == initialErrorCount;
  }

  /**
   * Creates the body of the function with the completion handler, which calls its async
   * alternative from a task. Returns false if there is no such body, e.g. when the function
   * throws.
   */
  public boolean createLegacyBody() {
    checkState(!used, "AsyncConverter can only be used once");
    used = true;
    if (!canCreateLegacyBody()) {
      return false;
    }
    Decl func = checkNotNull(startNode.getDecl());

    out.append("{\n");
    out.append("Task {\n");
    addHoistedNamedCallback(
        func,
        topHandler,
        topHandler.getNameStr(),
        () -> {
          if (topHandler.hasError()) {
            out.append("try ");
          }
          out.append("await ");
          addCallToAsyncMethod(func, topHandler);
        });
    out.append("\n");
    out.append("}\n");
    out.append("}\n");
    return true;
  }

  /** The text printed so far. */
  public String getOutput() {
    return out.toString();
  }

  /** Replaces {@code node} with the printed text. */
  public void replace(SuggestedFix.Builder fix, Node node) {
    replace(fix, node, node.getStart());
  }

  /** Replaces the text from {@code start} to the end of {@code node} with the printed text. */
  public void replace(SuggestedFix.Builder fix, Node node, int start) {
    fix.replace(file, SourceSpan.of(start, node.getEnd()), out.toString());
    out.setLength(0);
  }

  /** Inserts the printed text after {@code node}, separated by an empty line. */
  public void insertAfter(SuggestedFix.Builder fix, Node node) {
    fix.insertAfter(file, node, "\n\n");
    fix.insertAfter(file, node, out.toString());
    out.setLength(0);
  }

  private boolean canCreateLegacyBody() {
    if (!startNode.isFunction() || startNode.getFunctionBody() == null) {
      return false;
    }
    Decl func = startNode.getDecl();
    if (func == null || func.hasThrows()) {
      return false;
    }
    return topHandler.isValid();
  }

  /** Prints the comments directly preceding {@code loc}. Returns whether there were any. */
  private boolean printCommentIfNeeded(int loc, boolean addNewline) {
    int precedingLoc = file.getStartIncludingPrecedingComments(loc);
    if (precedingLoc == loc) {
      return false;
    }
    if (addNewline) {
      out.append("\n");
    }
    out.append(file.getText(precedingLoc, loc));
    return true;
  }

  private void convertNodes(NodesToPrint toPrint) {
    Deque<Integer> commentLocs = new ArrayDeque<>();
    toPrint.getPossibleCommentLocs().stream().sorted().forEach(commentLocs::add);

    for (Node n : toPrint.getNodes()) {
      out.append("\n");

      // Print the comments that come before the node.
      while (!commentLocs.isEmpty()) {
        int commentLoc = commentLocs.peekFirst();
        if (commentLoc > n.getStart()) {
          break;
        }
        commentLocs.removeFirst();
        if (commentLoc < n.getStart()) {
          printCommentIfNeeded(commentLoc, false);
        }
      }
      convertNode(n);
    }

    boolean hasPrintedComment = false;
    while (!commentLocs.isEmpty()) {
      hasPrintedComment |= printCommentIfNeeded(commentLocs.removeFirst(), !hasPrintedComment);
    }
  }

  private void convertNode(Node n) {
    convertNode(n, -1, true);
  }

  private void convertNode(Node n, int startOverride, boolean convertCalls) {
    int start = startOverride < 0 ? n.getStart() : startOverride;
    // Comments before the start node are outside of the replaced range.
    if (n != startNode) {
      start = file.getStartIncludingPrecedingComments(start);
    }

    int savedLoc = lastAddedLoc;
    int savedCount = nestedExprCount;
    lastAddedLoc = start;
    nestedExprCount = convertCalls ? 0 : 1;

    new NodeTraversal(walker, cancellationChecker).traverse(n);
    addRange(lastAddedLoc, n.getEnd());

    lastAddedLoc = savedLoc;
    nestedExprCount = savedCount;
  }

  /** Prints the source from the last printed location to {@code span}, then {@code custom}. */
  private void addCustom(SourceSpan span, Runnable custom) {
    addRange(lastAddedLoc, span.start());
    custom.run();
    lastAddedLoc = span.end();
  }

  private void addRange(int start, int end) {
    if (start < end) {
      out.append(file.getText(start, end));
    }
  }

  private void replaceRangeWithPlaceholder(SourceSpan span) {
    addCustom(
        span,
        () -> out.append(PLACEHOLDER_START).append(file.getText(span)).append(PLACEHOLDER_END));
  }

  /** Prints the source of the rewritten walk, renaming and replacing nodes as it goes. */
  private final class ConvertingCallback extends AbstractScopedCallback {
    @Override
    public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      switch (n.getToken()) {
        case BINDING:
          nestedExprCount++;
          return true;
        case NAME_PATTERN:
        case PARAM:
          renameVariable(n);
          return false;
        case FUNCTION:
          // Local functions are printed as is, including any returns in them.
          return false;
        case BREAK:
          if (hoisting && !n.isImplicit()) {
            // The break would no longer exit the switch that was removed around it.
            Node target = n.getBreakTarget();
            if (target != null && handledSwitches.contains(target)) {
              replaceRangeWithPlaceholder(n.getSpan());
              return false;
            }
          }
          return true;
        case RETURN:
          if (hoisting && !n.isImplicit() && nestedExprCount == 0) {
            // Only the keyword, so its value is still converted.
            replaceRangeWithPlaceholder(SourceSpan.of(n.getStart(), n.getStart() + 6));
          }
          return true;
        default:
          if (NodeUtil.isExpression(n)) {
            return shouldTraverseExpression(n, parent);
          }
          return true;
      }
    }

    @Override
    public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
      if (n.isBinding() || NodeUtil.isExpression(n)) {
        nestedExprCount--;
      }
    }

    @Override
    public void enterScope(NodeTraversal t) {
      addNewScope(scopedDecls.getReferencedDecls(t.getScopeRoot()));
    }

    @Override
    public void exitScope(NodeTraversal t) {
      scopedNames.pop();
    }
  }

  /** Gives a variable declared in printed code a name that does not shadow any other. */
  private void renameVariable(Node n) {
    Decl decl = n.getDecl();
    if (decl == null || decl.isImplicit() || names.containsKey(decl)) {
      return;
    }
    String ident = assignUniqueName(decl, "");
    if (!ident.isEmpty()) {
      SourceSpan nameSpan = n.getSpanProp(Node.Prop.NAME_SPAN);
      addCustom(nameSpan != null ? nameSpan : n.getSpan(), () -> out.append(ident));
    }
  }

  private boolean shouldTraverseExpression(Node n, @Nullable Node parent) {
    if (n.isName()) {
      Decl decl = n.getDecl();
      if (decl != null) {
        boolean addPlaceholder = placeholders.contains(decl);
        String name = newNameFor(decl, false);
        if (addPlaceholder || !name.isEmpty()) {
          addCustom(
              n.getSpan(),
              () -> {
                if (addPlaceholder) {
                  out.append(PLACEHOLDER_START);
                }
                out.append(name.isEmpty() ? decl.getName() : name);
                if (addPlaceholder) {
                  out.append(PLACEHOLDER_END);
                }
              });
          return false;
        }
      }
    } else if (n.isForceUnwrap() || n.isBindOptional()) {
      // The value is no longer optional. This may change the type of an optional chain, which is
      // still more useful than a placeholder.
      Node operand = n.getFirstChild();
      Decl decl = operand.isName() ? operand.getDecl() : null;
      if (decl != null && unwraps.contains(decl)) {
        addCustom(n.getSpan(), () -> out.append(newNameFor(decl, true)));
        return false;
      }
    } else if (nestedExprCount == 0) {
      Node handlerCall = topHandler.getAsHandlerCall(n);
      if (handlerCall != null) {
        addCustom(n.getSpan(), () -> addHandlerCall(handlerCall, parent));
        return false;
      }

      if (n.isCall()) {
        // Converting the call itself requires neither the attribute nor a completion name.
        AsyncHandlerParamDesc handlerDesc =
            AsyncHandlerParamDesc.find(getUnderlyingFunc(n), startNode != n);
        if (handlerDesc.isValid()) {
          addCustom(n.getSpan(), () -> addHoistedCallback(n, handlerDesc));
          return false;
        }
      }
    }

    nestedExprCount++;
    return true;
  }

  private static @Nullable Decl getUnderlyingFunc(Node call) {
    Decl decl = call.getCalledDecl();
    return decl != null && decl.isFunc() ? decl : null;
  }

  private void addFuncDecl(Node function) {
    Decl func = checkNotNull(function.getDecl());
    Node paramList = function.getFunctionParamList();
    ImmutableList<Node> params = paramList.getChildren();
    int index = topHandler.getIndex();

    // From the start to the parameter to remove, if any.
    int leftEndLoc = paramList.getStart() + 1;
    if (index - 1 >= 0) {
      leftEndLoc = params.get(index - 1).getEnd();
    }
    addRange(function.getStart(), leftEndLoc);

    // From the end of the parameter to remove to the right parenthesis.
    int midStartLoc = leftEndLoc;
    int midEndLoc = paramList.getEnd();
    if (topHandler.isValid()) {
      if (index + 1 < params.size()) {
        midStartLoc = params.get(index + 1).getStart();
      } else {
        midStartLoc = paramList.getEnd() - 1;
      }
    }
    addRange(midStartLoc, midEndLoc);

    out.append(" async");
    if (func.hasThrows() || topHandler.hasError()) {
      out.append(" throws");
    }

    Node body = function.getFunctionBody();
    if (!topHandler.isValid()) {
      // Without a handler the rest of the signature is kept.
      int rightStartLoc = midEndLoc;
      SourceSpan throwsSpan = function.getSpanProp(Node.Prop.THROWS_SPAN);
      if (func.hasThrows() && throwsSpan != null) {
        rightStartLoc = throwsSpan.end();
      }
      int rightEndLoc = body != null ? body.getStart() : rightStartLoc;
      addRange(rightStartLoc, rightEndLoc);
      return;
    }

    ImmutableList<Type> returnTypes = topHandler.getAsyncReturnTypes();
    if (returnTypes.isEmpty()) {
      out.append(" ");
      return;
    }

    if (!topHandler.willAsyncReturnVoid()) {
      out.append(" -> ");
      addAsyncFuncReturnType(topHandler);
    }

    if (body != null) {
      out.append(" ");
    }

    SourceSpan whereClause = function.getSpanProp(Node.Prop.WHERE_CLAUSE_SPAN);
    if (whereClause != null) {
      out.append(file.getText(whereClause));
      if (body != null) {
        out.append(" ");
      }
    }
  }

  private void addFallbackVars(List<Decl> fallbackParams) {
    for (Decl param : fallbackParams) {
      out.append("var ").append(newNameFor(param, true)).append(": ");
      Type type = param.getType();
      if (type.isOptional()) {
        out.append(type);
      } else if (type.isFunction()) {
        out.append('(').append(type).append(")?");
      } else {
        out.append(type).append('?');
      }
      out.append(" = nil\n");
    }
  }

  private void addDo() {
    out.append("do {\n");
  }

  private void addHandlerCall(Node call, @Nullable Node parent) {
    HandlerResult exprs = topHandler.extractResultArgs(call);

    boolean addedReturnOrThrow = true;
    if (!exprs.isError()) {
      // The call may already be returned, as in 'return completion(args...)'.
      addedReturnOrThrow = parent == null || !parent.isReturn();
      if (addedReturnOrThrow) {
        out.append("return");
      }
    } else {
      out.append("throw");
    }

    ImmutableList<Node> args = exprs.args();
    if (!args.isEmpty()) {
      if (addedReturnOrThrow) {
        out.append(" ");
      }
      if (args.size() > 1) {
        out.append("(");
      }
      for (int i = 0; i < args.size(); i++) {
        if (i > 0) {
          out.append(", ");
        }
        convertNode(args.get(i), getArgumentLabelLoc(args.get(i)), false);
      }
      if (args.size() > 1) {
        out.append(")");
      }
    }
  }

  /** The start of the label of an argument value, or -1 if it is unlabeled. */
  private static int getArgumentLabelLoc(Node argValue) {
    Node argument = argValue.getParent();
    if (argument == null || !argument.isArgument() || argument.getLabel().isEmpty()) {
      return -1;
    }
    SourceSpan labelSpan = argument.getSpanProp(Node.Prop.LABEL_SPAN);
    return labelSpan == null ? -1 : labelSpan.start();
  }

  private void addHoistedCallback(Node call, AsyncHandlerParamDesc handlerDesc) {
    boolean wasHoisting = hoisting;
    hoisting = true;
    try {
      addHoistedCallbackImpl(call, handlerDesc);
    } finally {
      hoisting = wasHoisting;
    }
  }

  private void addHoistedCallbackImpl(Node call, AsyncHandlerParamDesc handlerDesc) {
    ImmutableList<Node> args = call.getArgumentValues();
    if (handlerDesc.getIndex() >= args.size()) {
      report(call.getStart(), MISSING_CALLBACK_ARG);
      return;
    }

    Node callbackArg = args.get(handlerDesc.getIndex());
    if (callbackArg.isClosure()) {
      addHoistedClosureCallback(call, handlerDesc, callbackArg, args);
      return;
    }

    Decl callbackDecl = callbackArg.getReferencedDecl();
    if (callbackDecl != null) {
      if (topHandler.isValid() && callbackDecl == topHandler.getHandler()) {
        // The handler of the function being converted is removed, so return the values instead.
        if (!handlerDesc.willAsyncReturnVoid()) {
          out.append("return ");
        }
        addAwaitCall(
            call, args, new ClassifiedBlock(), ImmutableList.of(), handlerDesc, false);
        return;
      }

      // Any other handler is called once the async function returns.
      AsyncHandlerDesc completionHandler = AsyncHandlerDesc.get(callbackDecl, false);
      Decl calledFunc = getUnderlyingFunc(call);
      if (completionHandler.isValid() && calledFunc != null) {
        String handlerName = file.getText(callbackArg.getSpan());
        addHoistedNamedCallback(
            calledFunc,
            completionHandler,
            handlerName,
            () ->
                addAwaitCall(
                    call, args, new ClassifiedBlock(), ImmutableList.of(), handlerDesc, false));
        return;
      }
    }
    report(call.getStart(), MISSING_CALLBACK_ARG);
  }

  /**
   * Adds an await of the async alternative of {@code call} followed by the body of the closure
   * {@code callback} passed as its completion handler.
   */
  private void addHoistedClosureCallback(
      Node call, AsyncHandlerDesc handlerDesc, Node callback, ImmutableList<Node> args) {
    List<Decl> callbackParams = new ArrayList<>();
    for (Node param : callback.getFunctionParamList().children()) {
      callbackParams.add(checkNotNull(param.getDecl(), param));
    }
    Node callbackBody = checkNotNull(callback.getFunctionBody());
    if (handlerDesc.params().size() != callbackParams.size()) {
      report(call.getStart(), MISMATCHED_CALLBACK_ARGS);
      return;
    }

    // The error param of a Result handler is also its only success param.
    List<Decl> successParams = callbackParams;
    Decl errParam = null;
    if (handlerDesc.getType() == HandlerType.RESULT) {
      errParam = successParams.get(successParams.size() - 1);
    } else if (handlerDesc.hasError()) {
      errParam = successParams.get(successParams.size() - 1);
      successParams = successParams.subList(0, successParams.size() - 1);
    }

    ClassifiedBlocks blocks = new ClassifiedBlocks();
    BasicErrorManager classifierErrors = new BasicErrorManager();
    if (!handlerDesc.hasError()) {
      blocks.successBlock.addNodesInBraceStmt(callbackBody);
    } else if (callbackBody.hasChildren()) {
      Set<Decl> unwrapParams = new LinkedHashSet<>();
      for (Decl param : successParams) {
        if (handlerDesc.shouldUnwrap(param.getType())) {
          unwrapParams.add(param);
        }
      }
      if (errParam != null) {
        unwrapParams.add(errParam);
      }
      CallbackClassifier.classifyInto(
          file,
          blocks,
          handledSwitches,
          classifierErrors,
          unwrapParams,
          errParam,
          handlerDesc.getType(),
          callbackBody);
    }

    if (classifierErrors.getErrorCount() > 0) {
      // Only plain params can fall back, since their names stay valid.
      if (handlerDesc.getType() != HandlerType.PARAMS) {
        classifierErrors.forwardTo(errorManager);
        return;
      }
      logger.fine(
          "Falling back to keeping the callback body of "
              + file.getText(call.getCallee().getSpan())
              + ": "
              + classifierErrors.getErrors());

      prepareNames(new ClassifiedBlock(), callbackParams, true);

      addFallbackVars(callbackParams);
      addDo();
      addAwaitCall(
          call, args, blocks.successBlock, successParams, handlerDesc, !handlerDesc.hasError());
      addFallbackCatch(checkNotNull(errParam));
      out.append("\n");
      convertNodes(NodesToPrint.inBraceStmt(callbackBody));

      clearNames(callbackParams);
      return;
    }

    ImmutableList<Node> errorNodes = blocks.errorBlock.nodesToPrint().getNodes();
    boolean requireDo = !errorNodes.isEmpty();
    // No do/catch is needed if the error is just passed on to the handler being removed.
    if (errorNodes.size() == 1) {
      Node handlerCall = topHandler.getAsHandlerCall(errorNodes.get(0));
      if (handlerCall != null) {
        HandlerResult res = topHandler.extractResultArgs(handlerCall);
        if (res.args().size() == 1) {
          Decl singleDecl = res.args().get(0).getReferencedDecl();
          String errName = errParam == null ? "" : blocks.errorBlock.boundName(errParam);
          requireDo =
              singleDecl != errParam
                  && !(res.isError()
                      && singleDecl != null
                      && singleDecl.getName().equals(errName));
        }
      }
    }

    // The error block is dropped, its comments move to the success block.
    if (!requireDo) {
      for (int commentLoc : blocks.errorBlock.nodesToPrint().getPossibleCommentLocs()) {
        blocks.successBlock.addPossibleCommentLoc(commentLoc);
      }
    }

    if (requireDo) {
      addDo();
    }

    prepareNames(blocks.successBlock, successParams, true);
    preparePlaceholdersAndUnwraps(handlerDesc, successParams, errParam, true);

    addAwaitCall(call, args, blocks.successBlock, successParams, handlerDesc, true);
    convertNodes(blocks.successBlock.nodesToPrint());
    clearNames(successParams);

    if (requireDo) {
      ImmutableList<Decl> errParams = ImmutableList.of(checkNotNull(errParam));
      // Result handlers only get an error name if one was bound.
      prepareNames(blocks.errorBlock, errParams, handlerDesc.getType() != HandlerType.RESULT);
      preparePlaceholdersAndUnwraps(handlerDesc, successParams, errParam, false);

      addCatch(errParam);
      convertNodes(blocks.errorBlock.nodesToPrint());
      out.append("\n}");
      clearNames(errParams);
    }
  }

  /**
   * Adds an await of the async alternative of {@code func}, then passes its results to the
   * completion handler {@code handlerName}. Used when a named handler rather than a closure is
   * passed.
   */
  private void addHoistedNamedCallback(
      Decl func, AsyncHandlerDesc handlerDesc, String handlerName, Runnable addAwaitCall) {
    if (handlerDesc.hasError()) {
      // "result" and "error" are declared in a new scope that only contains new code.
      addDo();
      if (!handlerDesc.willAsyncReturnVoid()) {
        out.append("let result = ");
      }
      addAwaitCall.run();
      out.append("\n");
      addCallToCompletionHandler("result", handlerDesc, handlerName);
      out.append("\n");
      out.append("} catch {\n");
      addCallToCompletionHandler("", handlerDesc, handlerName);
      out.append("\n}");
    } else {
      String resultName;
      if (!handlerDesc.willAsyncReturnVoid()) {
        // May be placed in an existing scope.
        resultName = createUniqueName("result");
        scopedNames.peek().add(resultName);
        out.append("let ").append(resultName).append(" = ");
      } else {
        // Unused, but takes the result path.
        resultName = "result";
      }
      addAwaitCall.run();
      out.append("\n");
      addCallToCompletionHandler(resultName, handlerDesc, handlerName);
    }
  }

  private void addAwaitCall(
      Node call,
      ImmutableList<Node> args,
      ClassifiedBlock successBlock,
      List<Decl> successParams,
      AsyncHandlerDesc handlerDesc,
      boolean addDeclarations) {
    // Bindings for the success params, omitted for a Void result.
    if (!successParams.isEmpty() && !handlerDesc.willAsyncReturnVoid()) {
      if (addDeclarations) {
        out.append(successBlock.allLet() ? "let" : "var").append(" ");
      }
      if (successParams.size() > 1) {
        out.append("(");
      }
      List<String> successNames = new ArrayList<>();
      for (Decl param : successParams) {
        successNames.add(newNameFor(param, true));
      }
      Joiner.on(", ").appendTo(out, successNames);
      if (successParams.size() > 1) {
        out.append(")");
      }
      out.append(" = ");
    }

    if (handlerDesc.hasError()) {
      out.append("try ");
    }
    out.append("await ");
    addRange(call.getStart(), call.getCallee().getEnd());

    out.append("(");
    // The handler is the last argument.
    for (int i = 0; i < args.size() - 1; i++) {
      if (i > 0) {
        out.append(", ");
      }
      convertNode(args.get(i), getArgumentLabelLoc(args.get(i)), false);
    }
    out.append(")");
  }

  private void addFallbackCatch(Decl errParam) {
    String errName = newNameFor(errParam, true);
    out.append("\n} catch {\n").append(errName).append(" = error\n}");
  }

  private void addCatch(Decl errParam) {
    out.append("\n} catch ");
    String errName = newNameFor(errParam, false);
    if (!errName.isEmpty()) {
      out.append("let ").append(errName).append(" ");
    }
    out.append("{");
  }

  private void preparePlaceholdersAndUnwraps(
      AsyncHandlerDesc handlerDesc,
      List<Decl> successParams,
      @Nullable Decl errParam,
      boolean success) {
    switch (handlerDesc.getType()) {
      case PARAMS:
        if (!success) {
          if (errParam != null) {
            if (handlerDesc.shouldUnwrap(errParam.getType())) {
              placeholders.add(errParam);
              unwraps.add(errParam);
            }
            // Success params are not available in the error block.
            placeholders.addAll(successParams);
          }
        } else {
          for (Decl successParam : successParams) {
            Type type = successParam.getType();
            if (handlerDesc.shouldUnwrap(type)) {
              // Unwraps are elided, other references become placeholders.
              unwraps.add(successParam);
              placeholders.add(successParam);
            }
            // Void values are dropped, so their references are unlikely to be what is wanted.
            if (handlerDesc.getSuccessParamAsyncReturnType(type).isVoid()) {
              placeholders.add(successParam);
            }
          }
          // The error param is not available in the success block.
          if (errParam != null) {
            placeholders.add(errParam);
          }
        }
        break;
      case RESULT:
        // Remaining references to the Result param are invalid.
        checkState(successParams.size() == 1 && successParams.get(0) == errParam);
        placeholders.add(errParam);
        break;
      case INVALID:
        throw new IllegalStateException("Unhandled handler type");
    }
  }

  /**
   * Maps each param to a new name: its bound name, or its own name if it was not bound and
   * {@code addIfMissing} is set. Names are made unique in the current scope.
   */
  private void prepareNames(ClassifiedBlock block, List<Decl> params, boolean addIfMissing) {
    for (Decl param : params) {
      String name = block.boundName(param);
      if (!name.isEmpty() || addIfMissing) {
        assignUniqueName(param, name);
      }
    }

    for (Map.Entry<Decl, Decl> alias : block.aliases().entrySet()) {
      String name = names.get(alias.getValue());
      if (name != null) {
        names.put(alias.getKey(), name);
      }
    }
  }

  /** Returns {@code name}, with the smallest positive suffix that makes it unique in scope. */
  private String createUniqueName(String name) {
    Set<String> currentNames = scopedNames.peek();
    if (!currentNames.contains(name)) {
      return name;
    }
    String uniqued;
    int uniqueId = 1;
    do {
      uniqued = name + uniqueId++;
    } while (currentNames.contains(uniqued));
    return uniqued;
  }

  /**
   * Names {@code decl} after {@code boundName}, or after itself if that is empty, adding the name
   * to the current scope. Anonymous closure params such as {@code $0} become {@code val0}.
   */
  private String assignUniqueName(Decl decl, String boundName) {
    if (boundName.isEmpty()) {
      boundName = decl.getName();
      if (boundName.isEmpty()) {
        return "";
      }
    }

    String ident =
        boundName.startsWith("$")
            ? createUniqueName("val" + boundName.substring(1))
            : createUniqueName(boundName);

    names.putIfAbsent(decl, ident);
    scopedNames.peek().add(ident);
    return ident;
  }

  private String newNameFor(Decl decl, boolean required) {
    String name = names.get(decl);
    if (name == null) {
      checkState(!required, "Missing name for %s", decl);
      return "";
    }
    return name;
  }

  private void addNewScope(Collection<Decl> decls) {
    Set<String> scope = new HashSet<>();
    for (Decl decl : decls) {
      if (decl.hasName()) {
        scope.add(decl.getName());
      }
    }
    scopedNames.push(scope);
  }

  private void clearNames(Collection<Decl> params) {
    for (Decl param : params) {
      unwraps.remove(param);
      placeholders.remove(param);
      names.remove(param);
    }
  }

  /** Adds a call of the async alternative of {@code func}, without {@code await}. */
  private void addCallToAsyncMethod(Decl func, AsyncHandlerDesc handlerDesc) {
    out.append(func.getName()).append("(");
    boolean firstParam = true;
    for (Decl param : func.getParams()) {
      if (param == handlerDesc.getHandler()) {
        continue;
      }
      if (!firstParam) {
        out.append(", ");
      } else {
        firstParam = false;
      }
      if (!param.getArgumentLabel().isEmpty()) {
        out.append(param.getArgumentLabel()).append(": ");
      }
      out.append(param.getName());
    }
    out.append(")");
  }

  /** Adds an {@code as!} cast if the handler's error type is narrower than {@code Error}. */
  private void addCastToCustomErrorTypeIfNecessary(AsyncHandlerDesc handlerDesc) {
    Type errorType = checkNotNull(handlerDesc.getErrorType());
    if (!errorType.toString().equals("Error")) {
      out.append(" as! ").append(errorType.lookThroughSingleOptionalType());
    }
  }

  /** Adds {@code nil}, {@code ()} or a placeholder hinting at {@code type}. */
  private void addDefaultValueOrPlaceholder(Type type) {
    if (type.isOptional()) {
      out.append("nil");
    } else if (type.isVoid()) {
      out.append("()");
    } else {
      out.append(PLACEHOLDER_START).append(type).append(PLACEHOLDER_END);
    }
  }

  /**
   * Adds the {@code index}th argument of a handler call. A non-empty {@code resultName} holds the
   * result of the async alternative, otherwise a variable named {@code error} holds its error.
   */
  private void addCompletionHandlerArgument(
      int index, String resultName, AsyncHandlerDesc handlerDesc) {
    ImmutableList<Type> params = handlerDesc.params();
    Type paramType = params.get(index);
    if (handlerDesc.hasError() && index == params.size() - 1) {
      if (resultName.isEmpty()) {
        out.append("error");
        addCastToCustomErrorTypeIfNecessary(handlerDesc);
      } else {
        addDefaultValueOrPlaceholder(paramType);
      }
    } else if (resultName.isEmpty()) {
      addDefaultValueOrPlaceholder(paramType);
    } else if (handlerDesc.getSuccessParamAsyncReturnType(paramType).isVoid()) {
      out.append("()");
    } else if (handlerDesc.getSuccessParams().size() > 1) {
      // Tuple results are passed element by element.
      out.append(resultName).append('.').append(index);
    } else {
      out.append(resultName);
    }
  }

  private void addCallToCompletionHandler(
      String resultName, AsyncHandlerDesc handlerDesc, String handlerName) {
    out.append(handlerName).append("(");
    switch (handlerDesc.getType()) {
      case PARAMS:
        for (int i = 0; i < handlerDesc.params().size(); i++) {
          if (i > 0) {
            out.append(", ");
          }
          addCompletionHandlerArgument(i, resultName, handlerDesc);
        }
        break;
      case RESULT:
        if (!resultName.isEmpty()) {
          out.append(".success(").append(resultName).append(")");
        } else {
          out.append(".failure(error");
          addCastToCustomErrorTypeIfNecessary(handlerDesc);
          out.append(")");
        }
        break;
      case INVALID:
        throw new IllegalStateException("Cannot be rewritten");
    }
    out.append(")");
  }

  private void addAsyncFuncReturnType(AsyncHandlerDesc handlerDesc) {
    ImmutableList<Type> returnTypes = handlerDesc.getAsyncReturnTypes();
    if (returnTypes.size() > 1) {
      out.append("(");
    }
    Joiner.on(", ").appendTo(out, returnTypes);
    if (returnTypes.size() > 1) {
      out.append(")");
    }
  }

  private void report(int offset, DiagnosticType type) {
    errorManager.report(CheckLevel.ERROR, RefactoringError.make(file, offset, type));
  }
}

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

package com.google.ide.refactoring;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.ide.analysis.BasicErrorManager;
import com.google.ide.analysis.CancellationChecker;
import com.google.ide.analysis.CheckLevel;
import com.google.ide.analysis.ContextFinder;
import com.google.ide.analysis.DeclCollector;
import com.google.ide.analysis.DiagnosticType;
import com.google.ide.analysis.ErrorManager;
import com.google.ide.analysis.NodeTraversal;
import com.google.ide.analysis.NodeTraversal.AbstractPostOrderCallback;
import com.google.ide.analysis.NodeUtil;
import com.google.ide.analysis.RefactoringError;
import com.google.ide.refactoring.async.AsyncConverter;
import com.google.ide.refactoring.async.AsyncHandlerParamDesc;
import com.google.ide.refactoring.rename.LocalRenameCollector;
import com.google.ide.refactoring.rename.NameMatcher;
import com.google.ide.refactoring.rename.NameRangeResolver;
import com.google.ide.refactoring.rename.RegionType;
import com.google.ide.refactoring.rename.RenameLoc;
import com.google.ide.refactoring.rename.RenameRangeAnnotator;
import com.google.ide.refactoring.rename.RenameRangeDetail;
import com.google.ide.refactoring.rename.SyntacticRename;
import com.google.ide.syntax.Decl;
import com.google.ide.syntax.Node;
import com.google.ide.syntax.SourceFile;
import com.google.ide.syntax.SourceSpan;
import com.google.ide.syntax.Token;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Entry point of the refactorings of one source file: renames, the refactorings available at a
 * cursor, and applying one of them.
 *
 * <p>Every request reports its diagnostics to its own error manager. A failed request produces no
 * edits. Requests throw {@link com.google.ide.analysis.RefactoringCancelledException} once the
 * cancellation checker of the options reports cancellation, and their partial edits are dropped.
 */
public final class RefactoringEngine {
  private static final Logger logger = Logger.getLogger(RefactoringEngine.class.getName());

  public static final DiagnosticType NO_INSERT_POSITION =
      DiagnosticType.error("no_insert_position", "cannot find a position at offset {0}");

  public static final DiagnosticType NO_ENCLOSING_FUNCTION =
      DiagnosticType.error(
          "no_enclosing_function", "cannot find a function declaration at the cursor");

  public static final DiagnosticType NO_ENCLOSING_CALL =
      DiagnosticType.error("no_enclosing_call", "cannot find a call at the cursor");

  public static final DiagnosticType NOT_ASYNC_CONVERTIBLE =
      DiagnosticType.error(
          "not_async_convertible", "''{0}'' has no completion handler to convert to async");

  public static final DiagnosticType VALUE_DECL_NO_LOC =
      DiagnosticType.error(
          "value_decl_no_loc", "cannot find a local symbol to rename at the cursor");

  private final SourceFile file;
  private final Node root;
  private final RefactoringOptions options;

  public RefactoringEngine(SourceFile file, Node root, RefactoringOptions options) {
    checkArgument(root.isScript(), "Expected a script: %s", root);
    this.file = file;
    this.root = root;
    this.options = options;
  }

  private CancellationChecker cancellationChecker() {
    return options.getCancellationChecker();
  }

  /**
   * Renames the occurrences found by an indexer. Only occurrences in code are edited, those in
   * comments and string literals are left to the client.
   */
  public SuggestedFix rename(
      List<RenameLoc> renameLocs, NameRangeResolver resolver, ErrorManager errorManager) {
    SuggestedFix.Builder fix = new SuggestedFix.Builder();
    SyntacticRename rename =
        new SyntacticRename(file, resolver, errorManager, cancellationChecker());
    boolean success =
        rename.rename(
            renameLocs,
            (type, replacements) -> {
              if (!isCode(type)) {
                if (!replacements.isEmpty()) {
                  logger.fine("Not renaming an occurrence in a " + type + " region");
                }
                return;
              }
              for (CodeReplacement replacement : replacements) {
                fix.replace(
                    file,
                    SourceSpan.of(replacement.getStartPosition(), replacement.getEndPosition()),
                    replacement.getNewContent());
              }
            });
    if (!success) {
      logger.fine("Rename of " + renameLocs.size() + " locations failed");
      return SuggestedFix.empty();
    }
    return fix.build();
  }

  private static boolean isCode(RegionType type) {
    switch (type) {
      case ACTIVE_CODE:
      case INACTIVE_CODE:
      case SELECTOR:
        return true;
      default:
        return false;
    }
  }

  /**
   * Returns the source with every range that a rename of {@code renameLocs} would edit marked up
   * as {@code <tag index=N>text</tag>}, or null if the request is invalid. Mismatched and
   * unmatched occurrences are left as they are.
   */
  public @Nullable String findRenameRanges(
      List<RenameLoc> renameLocs, NameRangeResolver resolver, ErrorManager errorManager) {
    List<RenameRangeDetail> ranges = new ArrayList<>();
    SyntacticRename rename =
        new SyntacticRename(file, resolver, errorManager, cancellationChecker());
    boolean success =
        rename.findRenameRanges(
            renameLocs,
            (type, details) -> {
              if (type != RegionType.MISMATCH && type != RegionType.UNMATCHED) {
                ranges.addAll(details);
              }
            });
    return success ? RenameRangeAnnotator.annotate(file.getCode(), ranges) : null;
  }

  /**
   * Like {@link #findRenameRanges}, for the occurrences of the local symbol at {@code offset}.
   * Returns null if there is no such symbol.
   */
  public @Nullable String findLocalRenameRanges(int offset, ErrorManager errorManager) {
    Cursor cursor = resolveCursor(offset);
    if (cursor == null || getAvailableRename(cursor) != RefactoringKind.LOCAL_RENAME) {
      report(errorManager, offset, VALUE_DECL_NO_LOC);
      return null;
    }
    ImmutableList<RenameLoc> locs =
        new LocalRenameCollector(file, cancellationChecker()).collect(cursor.decl(), "");
    return findRenameRanges(locs, new NameMatcher(file, root), errorManager);
  }

  /** Returns the refactorings that apply at {@code offset}, renames first. */
  public ImmutableList<RefactoringKind> collectAvailableRefactorings(int offset) {
    ImmutableList.Builder<RefactoringKind> kinds = ImmutableList.builder();
    Cursor cursor = resolveCursor(offset);
    if (cursor != null) {
      RefactoringKind rename = getAvailableRename(cursor);
      if (rename != null) {
        kinds.add(rename);
      }
    }

    Node call = findOuterCall(offset);
    if (call != null && findHandler(call).isValid()) {
      kinds.add(RefactoringKind.CONVERT_CALL_TO_ASYNC_ALTERNATIVE);
    }
    Node function = findFunction(offset);
    if (function != null) {
      // Without any handler this only adds 'async'.
      kinds.add(RefactoringKind.CONVERT_TO_ASYNC);
      if (AsyncHandlerParamDesc.find(function.getDecl(), false).isValid()) {
        kinds.add(RefactoringKind.ADD_ASYNC_ALTERNATIVE);
      }
    }
    return kinds.build();
  }

  /** Returns the renames of {@code decl} and whether they are available. */
  public static ImmutableList<RenameAvailabilityInfo> collectRenameAvailability(Decl decl) {
    return collectRenameAvailability(decl, null);
  }

  private static ImmutableList<RenameAvailabilityInfo> collectRenameAvailability(
      Decl decl, @Nullable Node reference) {
    RenameAvailableKind availableKind = RenameAvailableKind.AVAILABLE;
    if (decl.isSystem()) {
      availableKind = RenameAvailableKind.UNAVAILABLE_SYSTEM_SYMBOL;
    } else if (decl.getDeclaringNode() == null) {
      availableKind = RenameAvailableKind.UNAVAILABLE_HAS_NO_LOCATION;
    } else if (!decl.hasName()) {
      availableKind = RenameAvailableKind.UNAVAILABLE_HAS_NO_NAME;
    }

    // Renaming these would rename every call without labels.
    if (decl.isFunc()
        && (decl.getName().equals("init") || decl.getName().equals("callAsFunction"))) {
      if (decl.getParams().isEmpty()) {
        return ImmutableList.of();
      }
      if (reference != null && !isCalleeWithArguments(reference)) {
        return ImmutableList.of();
      }
    }

    // TODO(ide-team): a cursor on an argument label should offer a global rename.
    if (decl.isParam() || decl.isLocal()) {
      return ImmutableList.of(
          new RenameAvailabilityInfo(RefactoringKind.LOCAL_RENAME, availableKind));
    }
    return ImmutableList.of(
        new RenameAvailabilityInfo(RefactoringKind.GLOBAL_RENAME, availableKind));
  }

  private static boolean isCalleeWithArguments(Node reference) {
    Node parent = reference.getParent();
    return parent != null
        && parent.isCall()
        && parent.getCallee() == reference
        && !parent.getArguments().isEmpty();
  }

  private static @Nullable RefactoringKind getAvailableRename(Cursor cursor) {
    for (RenameAvailabilityInfo info :
        collectRenameAvailability(cursor.decl(), cursor.isRef() ? cursor.node() : null)) {
      if (info.isAvailable()) {
        return info.kind();
      }
    }
    return null;
  }

  /**
   * Applies {@code kind} at {@code offset}. A local rename names the symbol {@code
   * preferredName}, or the default preferred name if it is null or empty, with a numeric suffix
   * if the name is already visible.
   */
  public RefactoringResult applyRefactoring(
      RefactoringKind kind, int offset, @Nullable String preferredName) {
    checkArgument(
        kind != RefactoringKind.GLOBAL_RENAME, "Global renames take their occurrences from rename");
    BasicErrorManager errorManager = new BasicErrorManager();
    SuggestedFix.Builder fix = new SuggestedFix.Builder().setDescription(kind.getDescriptiveName());

    boolean success;
    if (offset < 0 || offset > file.length()) {
      errorManager.report(
          CheckLevel.ERROR, RefactoringError.make(NO_INSERT_POSITION, Integer.toString(offset)));
      success = false;
    } else {
      switch (kind) {
        case LOCAL_RENAME:
          success = applyLocalRename(offset, preferredName, fix, errorManager);
          break;
        case CONVERT_CALL_TO_ASYNC_ALTERNATIVE:
          success = applyConvertCallToAsyncAlternative(offset, fix, errorManager);
          break;
        case CONVERT_TO_ASYNC:
          success = applyConvertToAsync(offset, fix, errorManager);
          break;
        case ADD_ASYNC_ALTERNATIVE:
          success = applyAddAsyncAlternative(offset, fix, errorManager);
          break;
        default:
          throw new IllegalStateException("Unexpected refactoring " + kind);
      }
    }

    ImmutableList<RefactoringError> diagnostics =
        ImmutableList.<RefactoringError>builder()
            .addAll(errorManager.getErrors())
            .addAll(errorManager.getWarnings())
            .build();
    if (!success || errorManager.getErrorCount() > 0) {
      logger.log(
          Level.INFO,
          "{0} failed at {1}:{2}: {3}",
          new Object[] {kind.getId(), file.getName(), offset, errorManager.getErrors()});
      return RefactoringResult.failure(diagnostics);
    }
    logger.fine(kind.getId() + " succeeded at " + file.getName() + ":" + offset);
    return new RefactoringResult(true, fix.build(), diagnostics);
  }

  private boolean applyLocalRename(
      int offset,
      @Nullable String preferredName,
      SuggestedFix.Builder fix,
      ErrorManager errorManager) {
    Cursor cursor = resolveCursor(offset);
    if (cursor == null || getAvailableRename(cursor) != RefactoringKind.LOCAL_RENAME) {
      report(errorManager, offset, VALUE_DECL_NO_LOC);
      return false;
    }

    Decl decl = cursor.decl();
    String name =
        preferredName == null || preferredName.isEmpty()
            ? options.getDefaultPreferredName()
            : preferredName;
    name = NameCorrection.correctName(name, getVisibleNames(decl));
    // Functions keep their argument labels.
    String newName = name + decl.getFullName().substring(decl.getName().length());

    ImmutableList<RenameLoc> locs =
        new LocalRenameCollector(file, cancellationChecker()).collect(decl, newName);
    int errorCount = errorManager.getErrorCount();
    SuggestedFix renameFix = rename(locs, new NameMatcher(file, root), errorManager);
    if (errorManager.getErrorCount() > errorCount) {
      return false;
    }
    renameFix.getReplacements().values().forEach(r -> addReplacement(fix, r));
    return true;
  }

  private void addReplacement(SuggestedFix.Builder fix, CodeReplacement replacement) {
    fix.replace(
        file,
        SourceSpan.of(replacement.getStartPosition(), replacement.getEndPosition()),
        replacement.getNewContent());
  }

  /** The names declared in the scope of {@code decl} and in the scopes enclosing it. */
  private Set<String> getVisibleNames(Decl decl) {
    Set<Decl> decls = new LinkedHashSet<>();
    for (Node scope = LocalRenameCollector.getRenameScope(decl);
        scope != null;
        scope = scope.getParent()) {
      if (scope.isBlock() || scope.isScript()) {
        DeclCollector.collect(scope, decls, cancellationChecker());
      } else if (scope.isFunction() || scope.isClosure()) {
        for (Node param : scope.getFunctionParamList().children()) {
          if (param.getDecl() != null) {
            decls.add(param.getDecl());
          }
        }
      }
    }
    Set<String> names = new LinkedHashSet<>();
    for (Decl visible : decls) {
      names.add(visible.getName());
    }
    return names;
  }

  private boolean applyConvertCallToAsyncAlternative(
      int offset, SuggestedFix.Builder fix, ErrorManager errorManager) {
    Node call = findOuterCall(offset);
    if (call == null) {
      report(errorManager, offset, NO_ENCLOSING_CALL);
      return false;
    }
    if (!findHandler(call).isValid()) {
      report(errorManager, offset, NOT_ASYNC_CONVERTIBLE, file.getText(call.getCallee().getSpan()));
      return false;
    }

    Node scope = ContextFinder.findInnermost(root, offset, n -> n.isBlock() && !n.isImplicit());
    AsyncConverter converter =
        AsyncConverter.forCall(file, call, scope, errorManager, cancellationChecker());
    if (!converter.convert()) {
      return false;
    }
    converter.replace(fix, call);
    return true;
  }

  private boolean applyConvertToAsync(
      int offset, SuggestedFix.Builder fix, ErrorManager errorManager) {
    Node function = findFunction(offset);
    if (function == null) {
      report(errorManager, offset, NO_ENCLOSING_FUNCTION);
      return false;
    }

    AsyncHandlerParamDesc handlerDesc = AsyncHandlerParamDesc.find(function.getDecl(), false);
    AsyncConverter converter =
        AsyncConverter.forFunction(
            file, function, handlerDesc, errorManager, cancellationChecker());
    if (!converter.convert()) {
      return false;
    }
    converter.replace(fix, function);
    return true;
  }

  private boolean applyAddAsyncAlternative(
      int offset, SuggestedFix.Builder fix, ErrorManager errorManager) {
    Node function = findFunction(offset);
    if (function == null) {
      report(errorManager, offset, NO_ENCLOSING_FUNCTION);
      return false;
    }
    AsyncHandlerParamDesc handlerDesc = AsyncHandlerParamDesc.find(function.getDecl(), false);
    if (!handlerDesc.isValid()) {
      report(
          errorManager,
          function.getStart(),
          NOT_ASYNC_CONVERTIBLE,
          function.getDecl().getName());
      return false;
    }

    AsyncConverter converter =
        AsyncConverter.forFunction(
            file, function, handlerDesc, errorManager, cancellationChecker());
    if (!converter.convert()) {
      return false;
    }

    StringBuilder attributes = new StringBuilder();
    attributes
        .append("@available(*, deprecated, message: \"")
        .append(options.getDeprecationMessage())
        .append("\")\n");
    if (options.isExperimentalConcurrency()) {
      attributes
          .append("@completionHandlerAsync(\"")
          .append(handlerDesc.printAsyncFunctionName())
          .append("\", completionHandlerIndex: ")
          .append(handlerDesc.getIndex())
          .append(")\n");
    }
    fix.insertAt(file, function.getStart(), attributes.toString());

    AsyncConverter legacyBodyCreator =
        AsyncConverter.forFunction(
            file, function, handlerDesc, errorManager, cancellationChecker());
    if (legacyBodyCreator.createLegacyBody()) {
      legacyBodyCreator.replace(fix, function.getFunctionBody());
    } else {
      logger.fine("Keeping the body of " + handlerDesc.printAsyncFunctionName());
    }

    converter.insertAfter(fix, function);
    return true;
  }

  private static AsyncHandlerParamDesc findHandler(Node call) {
    Decl called = call.getCalledDecl();
    return AsyncHandlerParamDesc.find(called != null && called.isFunc() ? called : null, false);
  }

  /**
   * The outermost call enclosing {@code offset}, if the offset is on its callee. Calls that are
   * arguments of other calls are not offered.
   */
  private @Nullable Node findOuterCall(int offset) {
    ImmutableList<Node> contexts =
        ContextFinder.findContexts(root, offset, n -> NodeUtil.isExpression(n) && !n.isImplicit());
    if (contexts.isEmpty()) {
      return null;
    }
    Node call = contexts.get(0);
    if (!call.isCall() || !call.getCallee().getSpan().containsInclusive(offset)) {
      return null;
    }
    return call;
  }

  /** The function declaration whose signature, up to its left brace, encloses {@code offset}. */
  private @Nullable Node findFunction(int offset) {
    List<Node> contexts =
        new ArrayList<>(
            ContextFinder.findContexts(
                root, offset, n -> NodeUtil.isDeclaration(n) && !n.isImplicit()));
    if (!contexts.isEmpty() && contexts.get(contexts.size() - 1).isParam()) {
      contexts.remove(contexts.size() - 1);
    }
    if (contexts.isEmpty()) {
      return null;
    }

    Node function = contexts.get(contexts.size() - 1);
    if (!function.isFunction() || function.getDecl() == null) {
      return null;
    }
    Node body = function.getFunctionBody();
    if (body == null) {
      return null;
    }
    return offset >= function.getStart() && offset <= body.getStart() ? function : null;
  }

  /** A symbol at the cursor. */
  private record Cursor(Node node, Decl decl, boolean isRef) {}

  private @Nullable Cursor resolveCursor(int offset) {
    CursorFinder finder = new CursorFinder(offset);
    NodeTraversal.traverse(root, finder, cancellationChecker());
    return finder.found;
  }

  private static final class CursorFinder extends AbstractPostOrderCallback {
    private final int offset;
    private @Nullable Cursor found = null;

    CursorFinder(int offset) {
      this.offset = offset;
    }

    @Override
    public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
      if (found != null || n.isImplicit()) {
        return;
      }
      switch (n.getToken()) {
        case NAME:
        case MEMBER:
        case IMPLICIT_MEMBER:
          {
            SourceSpan nameSpan = n.isName() ? n.getSpan() : n.getSpanProp(Node.Prop.NAME_SPAN);
            Decl decl = n.getReferencedDecl();
            if (nameSpan != null && decl != null && nameSpan.containsInclusive(offset)) {
              found = new Cursor(n, decl, true);
            }
            break;
          }
        case FUNCTION:
        case PARAM:
        case NAME_PATTERN:
          {
            SourceSpan nameSpan =
                n.getToken() == Token.NAME_PATTERN
                    ? n.getSpan()
                    : n.getSpanProp(Node.Prop.NAME_SPAN);
            Decl decl = n.getDecl();
            if (nameSpan != null && decl != null && nameSpan.containsInclusive(offset)) {
              found = new Cursor(n, decl, false);
            }
            break;
          }
        default:
          break;
      }
    }
  }

  private void report(ErrorManager errorManager, int offset, DiagnosticType type, String... args) {
    errorManager.report(CheckLevel.ERROR, RefactoringError.make(file, offset, type, args));
  }
}

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

package com.google.ide.testing;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.ide.analysis.NodeTraversal;
import com.google.ide.analysis.NodeTraversal.AbstractPreOrderCallback;
import com.google.ide.analysis.NodeUtil;
import com.google.ide.syntax.Decl;
import com.google.ide.syntax.Identifiers;
import com.google.ide.syntax.Node;
import com.google.ide.syntax.SourceFile;
import com.google.ide.syntax.SourceSpan;
import com.google.ide.syntax.Token;
import com.google.ide.syntax.Type;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Parses and resolves the subset of Swift used by the refactoring tests: functions with
 * attributes, bindings, {@code if}/{@code guard}/{@code while}/{@code for}/{@code switch},
 * calls with labels and trailing closures, closures, optional chaining and enum patterns.
 *
 * <p>Closure parameters without a type take their type from the function they are passed to.
 * Names are resolved lexically; functions are visible in their whole block. {@code print} is
 * predeclared as a system function.
 */
public final class TestParser {

  /** A parsed file. */
  public record Parsed(SourceFile file, Node root) {

    /** The first declaration named {@code name}, or with the full name {@code name}. */
    public Decl findDecl(String name) {
      Decl[] found = new Decl[1];
      NodeTraversal.traverse(
          root,
          new AbstractPreOrderCallback() {
            @Override
            public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
              Decl decl = NodeUtil.getDeclaredDecl(n);
              if (found[0] == null
                  && decl != null
                  && (decl.getName().equals(name) || decl.getFullName().equals(name))) {
                found[0] = decl;
              }
              return found[0] == null;
            }
          });
      checkArgument(found[0] != null, "No declaration of %s", name);
      return found[0];
    }

    /** The offset of the first occurrence of {@code text}, which must occur. */
    public int offsetOf(String text) {
      int offset = file.getCode().indexOf(text);
      checkArgument(offset >= 0, "No %s in the code", text);
      return offset;
    }
  }

  public static Parsed parse(String code) {
    return parse("test.swift", code);
  }

  public static Parsed parse(String fileName, String code) {
    SourceFile file = SourceFile.fromCode(fileName, code);
    TestParser parser = new TestParser(file, new Lexer(code).lex());
    Node root = parser.parseScript();
    new Resolver().resolveScript(root);
    return new Parsed(file, root);
  }

  private enum Kind {
    IDENT,
    NUMBER,
    STRING,
    PUNCT,
    EOF
  }

  private record Tok(Kind kind, String text, int start, int end, boolean newlineBefore,
      boolean spaceBefore) {}

  private static final class Lexer {
    private static final ImmutableSet<String> OPERATORS =
        ImmutableSet.of(
            "...", "..<", "->", "==", "!=", "&&", "||", "<=", ">=", "+=", "-=", "??");

    private final String code;
    private final List<Tok> tokens = new ArrayList<>();
    private int pos = 0;
    private boolean newlineBefore = false;
    private boolean spaceBefore = false;

    Lexer(String code) {
      this.code = code;
    }

    ImmutableList<Tok> lex() {
      while (true) {
        skipTrivia();
        if (pos >= code.length()) {
          tokens.add(new Tok(Kind.EOF, "", pos, pos, true, true));
          return ImmutableList.copyOf(tokens);
        }
        int start = pos;
        char c = code.charAt(pos);
        Kind kind;
        if (c == '`') {
          int close = code.indexOf('`', pos + 1);
          checkArgument(close > 0, "Unterminated escaped identifier at %s", pos);
          pos = close + 1;
          kind = Kind.IDENT;
        } else if (Identifiers.isIdentifierStart(c) || c == '$' || c == '@' || c == '#') {
          pos++;
          while (pos < code.length() && Identifiers.isIdentifierPart(code.charAt(pos))) {
            pos++;
          }
          kind = Kind.IDENT;
        } else if (Character.isDigit(c)) {
          while (pos < code.length()
              && (Character.isLetterOrDigit(code.charAt(pos))
                  || code.charAt(pos) == '_'
                  || (code.charAt(pos) == '.'
                      && pos + 1 < code.length()
                      && Character.isDigit(code.charAt(pos + 1))))) {
            pos++;
          }
          kind = Kind.NUMBER;
        } else if (c == '"') {
          pos = skipString(pos);
          kind = Kind.STRING;
        } else {
          pos += punctuationLength(c);
          kind = Kind.PUNCT;
        }
        tokens.add(
            new Tok(kind, code.substring(start, pos), start, pos, newlineBefore, spaceBefore));
        newlineBefore = false;
        spaceBefore = false;
      }
    }

    private int punctuationLength(char c) {
      if ((c == '?' || c == '!') && !spaceBefore && !tokens.isEmpty()) {
        Tok prev = tokens.get(tokens.size() - 1);
        if (prev.kind() != Kind.PUNCT || ImmutableSet.of(")", "]", ">").contains(prev.text())) {
          return 1;
        }
      }
      for (int length = 3; length >= 2; length--) {
        if (pos + length <= code.length()
            && OPERATORS.contains(code.substring(pos, pos + length))) {
          return length;
        }
      }
      return 1;
    }

    private void skipTrivia() {
      while (pos < code.length()) {
        char c = code.charAt(pos);
        if (c == '\n') {
          newlineBefore = true;
          spaceBefore = true;
          pos++;
        } else if (Character.isWhitespace(c)) {
          spaceBefore = true;
          pos++;
        } else if (code.startsWith("//", pos)) {
          int end = code.indexOf('\n', pos);
          pos = end < 0 ? code.length() : end;
          spaceBefore = true;
        } else if (code.startsWith("/*", pos)) {
          int depth = 0;
          do {
            if (code.startsWith("/*", pos)) {
              depth++;
              pos += 2;
            } else if (code.startsWith("*/", pos)) {
              depth--;
              pos += 2;
            } else {
              pos++;
            }
          } while (depth > 0 && pos < code.length());
          spaceBefore = true;
        } else {
          return;
        }
      }
    }

    /** Skips a string literal, including interpolated expressions. */
    private int skipString(int start) {
      int i = start + 1;
      while (i < code.length()) {
        char c = code.charAt(i);
        if (c == '\\' && i + 1 < code.length() && code.charAt(i + 1) == '(') {
          int depth = 1;
          i += 2;
          while (i < code.length() && depth > 0) {
            if (code.charAt(i) == '(') {
              depth++;
            } else if (code.charAt(i) == ')') {
              depth--;
            }
            i++;
          }
        } else if (c == '\\') {
          i += 2;
        } else if (c == '"') {
          return i + 1;
        } else {
          i++;
        }
      }
      throw new IllegalArgumentException("Unterminated string at " + start);
    }
  }

  private final SourceFile file;
  private final ImmutableList<Tok> tokens;
  private int pos = 0;
  private int functionDepth = 0;
  private boolean allowTrailingClosure = true;
  private Deque<Node> breakTargets = new ArrayDeque<>();
  private final Deque<int[]> closureDollarCounts = new ArrayDeque<>();

  private TestParser(SourceFile file, ImmutableList<Tok> tokens) {
    this.file = file;
    this.tokens = tokens;
  }

  private Tok peek() {
    return tokens.get(pos);
  }

  private Tok peekAt(int offset) {
    return tokens.get(Math.min(pos + offset, tokens.size() - 1));
  }

  private Tok next() {
    Tok tok = tokens.get(pos);
    if (tok.kind() != Kind.EOF) {
      pos++;
    }
    return tok;
  }

  private boolean is(String text) {
    Tok tok = peek();
    return tok.kind() != Kind.STRING && tok.text().equals(text);
  }

  private boolean isAttached(String text) {
    return is(text) && !peek().spaceBefore();
  }

  private boolean isEof() {
    return peek().kind() == Kind.EOF;
  }

  private Tok expect(String text) {
    if (!is(text)) {
      throw error("Expected '" + text + "'");
    }
    return next();
  }

  private int prevEnd() {
    return tokens.get(pos - 1).end();
  }

  private IllegalArgumentException error(String message) {
    Tok tok = peek();
    return new IllegalArgumentException(
        message
            + " but found '"
            + tok.text()
            + "' at "
            + file.getName()
            + ":"
            + file.getLineOfOffset(tok.start())
            + ":"
            + file.getColumnOfOffset(tok.start()));
  }

  private static String stripBackticks(String name) {
    return name.length() > 2 && name.startsWith("`") ? name.substring(1, name.length() - 1) : name;
  }

  private static void add(Node parent, @Nullable Node child) {
    if (child != null) {
      parent.addChildToBack(child);
    }
  }

  // Statements

  private Node parseScript() {
    Node script = new Node(Token.SCRIPT, 0, file.length());
    while (!isEof()) {
      add(script, parseStatement());
    }
    return script;
  }

  private @Nullable Node parseStatement() {
    if (is(";")) {
      next();
      return null;
    }
    Node stmt;
    Tok tok = peek();
    if (tok.text().startsWith("@") || is("func")) {
      stmt = parseFunction();
    } else if (is("let") || is("var")) {
      stmt = parseBinding();
    } else if (is("if")) {
      stmt = parseIf();
    } else if (is("guard")) {
      stmt = parseGuard();
    } else if (is("while")) {
      stmt = parseWhile();
    } else if (is("for")) {
      stmt = parseForEach();
    } else if (is("switch")) {
      stmt = parseSwitch();
    } else if (is("return")) {
      stmt = parseReturn();
    } else if (is("break")) {
      next();
      stmt = new Node(Token.BREAK, tok.start(), tok.end());
      stmt.putProp(Node.Prop.BREAK_TARGET, breakTargets.peek());
    } else if (is("fallthrough")) {
      next();
      stmt = new Node(Token.FALLTHROUGH, tok.start(), tok.end());
    } else if (is("throw")) {
      next();
      Node value = parseExpression();
      stmt = new Node(Token.THROW, tok.start(), value.getEnd());
      stmt.addChildToBack(value);
    } else if (is("{")) {
      stmt = parseBlock();
    } else {
      stmt = parseExpression();
    }
    if (is(";")) {
      next();
    }
    return stmt;
  }

  private Node parseFunction() {
    int start = peek().start();
    boolean completionHandlerAsyncAttr = false;
    while (peek().text().startsWith("@")) {
      Tok attr = next();
      completionHandlerAsyncAttr |= attr.text().equals("@completionHandlerAsync");
      if (isAttached("(")) {
        skipBalanced("(", ")");
      }
    }
    expect("func");
    Tok name = next();
    if (isAttached("<")) {
      skipBalanced("<", ">");
    }

    functionDepth++;
    Deque<Node> savedBreakTargets = breakTargets;
    breakTargets = new ArrayDeque<>();

    Node paramList = parseFunctionParams();
    boolean isAsync = false;
    boolean isThrows = false;
    SourceSpan throwsSpan = null;
    while (is("async") || is("throws") || is("rethrows")) {
      Tok tok = next();
      if (tok.text().equals("async")) {
        isAsync = true;
      } else {
        isThrows = true;
        throwsSpan = SourceSpan.of(tok.start(), tok.end());
      }
    }
    Type resultType = null;
    if (is("->")) {
      next();
      resultType = parseType();
    }
    SourceSpan whereClause = null;
    if (is("where")) {
      int whereStart = next().start();
      while (!is("{") && !peek().newlineBefore() && !isEof()) {
        next();
      }
      whereClause = SourceSpan.of(whereStart, prevEnd());
    }
    Node body = is("{") ? parseBlock() : null;

    breakTargets = savedBreakTargets;
    functionDepth--;

    List<Decl> params = new ArrayList<>();
    for (Node param : paramList.children()) {
      params.add(param.getDecl());
    }
    Decl.Builder builder =
        Decl.builder(Decl.Kind.FUNC, stripBackticks(name.text()))
            .setParams(params)
            .setAsync(isAsync)
            .setThrows(isThrows)
            .setCompletionHandlerAsyncAttr(completionHandlerAsyncAttr)
            .setLocal(functionDepth > 0);
    if (resultType != null) {
      builder.setResultType(resultType);
    }
    Decl decl = builder.build();

    Node function = new Node(Token.FUNCTION, start, prevEnd());
    function.setDecl(decl);
    decl.setDeclaringNode(function);
    function.putProp(Node.Prop.NAME_SPAN, SourceSpan.of(name.start(), name.end()));
    function.putProp(Node.Prop.THROWS_SPAN, throwsSpan);
    function.putProp(Node.Prop.WHERE_CLAUSE_SPAN, whereClause);
    function.addChildToBack(paramList);
    add(function, body);
    return function;
  }

  /** Parameters such as {@code (a b: Int, _ c: String?, d: @escaping () -> Void)}. */
  private Node parseFunctionParams() {
    int start = expect("(").start();
    Node paramList = new Node(Token.PARAM_LIST, start, start);
    while (!is(")")) {
      Tok first = next();
      Tok second = null;
      if (peek().kind() == Kind.IDENT && !is(":")) {
        second = next();
      }
      Tok nameTok = second != null ? second : first;
      expect(":");
      Type type = parseType();
      if (is("=")) {
        next();
        parseExpression();
      }
      String label = second != null ? first.text() : nameTok.text();
      Decl decl =
          Decl.builder(Decl.Kind.PARAM, stripBackticks(nameTok.text()))
              .setArgumentLabel(label.equals("_") ? "" : stripBackticks(label))
              .setType(type)
              .setLocal(true)
              .build();
      Node param = new Node(Token.PARAM, first.start(), prevEnd());
      param.setString(decl.getName());
      param.setDecl(decl);
      decl.setDeclaringNode(param);
      param.putProp(Node.Prop.LABEL_SPAN, SourceSpan.of(first.start(), nameTok.end()));
      param.putProp(Node.Prop.NAME_SPAN, SourceSpan.of(nameTok.start(), nameTok.end()));
      paramList.addChildToBack(param);
      if (is(",")) {
        next();
      }
    }
    paramList.setEnd(expect(")").end());
    return paramList;
  }

  private void skipBalanced(String open, String close) {
    int depth = 0;
    do {
      if (isEof()) {
        throw error("Expected '" + close + "'");
      }
      Tok tok = next();
      if (tok.text().equals(open)) {
        depth++;
      } else if (tok.text().equals(close)) {
        depth--;
      }
    } while (depth > 0);
  }

  private Type parseType() {
    while (peek().text().startsWith("@")) {
      next();
    }
    Type type;
    if (is("(")) {
      next();
      List<Type> elements = new ArrayList<>();
      while (!is(")")) {
        if (peek().kind() == Kind.IDENT && peekAt(1).text().equals(":")) {
          // Named tuple element.
          next();
          next();
        }
        elements.add(parseType());
        if (is(",")) {
          next();
        }
      }
      expect(")");
      while (is("async") || is("throws")) {
        next();
      }
      if (is("->")) {
        next();
        type = Type.function(elements, parseType());
      } else if (elements.size() == 1) {
        type = elements.get(0);
      } else {
        type = Type.tuple(elements);
      }
    } else if (is("[")) {
      int start = peek().start();
      skipBalanced("[", "]");
      type = Type.named(file.getText(start, prevEnd()));
    } else {
      String name = next().text();
      List<Type> args = new ArrayList<>();
      if (isAttached("<")) {
        next();
        while (!is(">")) {
          args.add(parseType());
          if (is(",")) {
            next();
          }
        }
        expect(">");
      }
      type = makeType(name, args);
    }
    while (isAttached("?") || isAttached("!")) {
      next();
      type = Type.optional(type);
    }
    return type;
  }

  private static Type makeType(String name, List<Type> args) {
    if (name.equals("Result") && args.size() == 2) {
      return Type.result(args.get(0), args.get(1));
    } else if (!args.isEmpty()) {
      return Type.generic(name, args);
    } else if (name.equals("Void")) {
      return Type.voidType();
    } else if (name.equals("Never")) {
      return Type.uninhabited(name);
    } else if (name.endsWith("Error")) {
      return Type.errorType(name);
    }
    return Type.named(name);
  }

  private Node parseBlock() {
    int start = expect("{").start();
    Node block = new Node(Token.BLOCK, start, start);
    while (!is("}")) {
      if (isEof()) {
        throw error("Expected '}'");
      }
      add(block, parseStatement());
    }
    block.setEnd(next().end());
    return block;
  }

  private Node parseBinding() {
    Tok keyword = next();
    boolean isLet = keyword.text().equals("let");
    Node pattern = parseBindingName();
    if (is(":")) {
      next();
      pattern.setType(parseType());
    }
    Node init = null;
    if (is("=")) {
      next();
      init = parseExpression();
    }
    Node binding = new Node(Token.BINDING, keyword.start(), prevEnd());
    binding.putBooleanProp(Node.Prop.IS_LET, isLet);
    binding.addChildToBack(pattern);
    add(binding, init);
    return binding;
  }

  private Node parseBindingName() {
    Tok name = next();
    if (name.text().equals("_")) {
      return new Node(Token.ANY_PATTERN, name.start(), name.end());
    }
    return Node.newString(
        Token.NAME_PATTERN, stripBackticks(name.text()), name.start(), name.end());
  }

  private Node parseIf() {
    int start = expect("if").start();
    Node conditions = parseConditionList();
    Node ifNode = new Node(Token.IF, start, start);
    ifNode.addChildToBack(conditions);
    ifNode.addChildToBack(parseBlock());
    if (is("else")) {
      next();
      ifNode.addChildToBack(is("if") ? parseIf() : parseBlock());
    }
    ifNode.setEnd(prevEnd());
    return ifNode;
  }

  private Node parseGuard() {
    int start = expect("guard").start();
    Node conditions = parseConditionList();
    expect("else");
    Node guard = new Node(Token.GUARD, start, start);
    guard.addChildToBack(conditions);
    guard.addChildToBack(parseBlock());
    guard.setEnd(prevEnd());
    return guard;
  }

  private Node parseWhile() {
    int start = expect("while").start();
    Node whileNode = new Node(Token.WHILE, start, start);
    whileNode.addChildToBack(parseConditionList());
    breakTargets.push(whileNode);
    whileNode.addChildToBack(parseBlock());
    breakTargets.pop();
    whileNode.setEnd(prevEnd());
    return whileNode;
  }

  private Node parseForEach() {
    int start = expect("for").start();
    Node forEach = new Node(Token.FOR_EACH, start, start);
    forEach.addChildToBack(parseBindingName());
    expect("in");
    forEach.addChildToBack(parseExpressionWithoutTrailingClosure());
    breakTargets.push(forEach);
    forEach.addChildToBack(parseBlock());
    breakTargets.pop();
    forEach.setEnd(prevEnd());
    return forEach;
  }

  private Node parseConditionList() {
    int start = peek().start();
    Node conditions = new Node(Token.CONDITION_LIST, start, start);
    while (true) {
      conditions.addChildToBack(parseCondition());
      if (!is(",")) {
        break;
      }
      next();
    }
    conditions.setEnd(prevEnd());
    return conditions;
  }

  private Node parseCondition() {
    int start = peek().start();
    if (is("let") || is("var")) {
      boolean isLet = next().text().equals("let");
      Node name = parseBindingName();
      if (is(":")) {
        next();
        name.setType(parseType());
      }
      Node bindingPattern = new Node(Token.BINDING_PATTERN, start, name.getEnd());
      bindingPattern.putBooleanProp(Node.Prop.IS_LET, isLet);
      bindingPattern.addChildToBack(name);
      Node somePattern = new Node(Token.OPTIONAL_SOME_PATTERN, start, name.getEnd());
      somePattern.putBooleanProp(Node.Prop.IMPLICIT, true);
      somePattern.addChildToBack(bindingPattern);

      expect("=");
      Node init = parseExpressionWithoutTrailingClosure();
      Node binding = new Node(Token.COND_BINDING, start, init.getEnd());
      binding.addChildToBack(somePattern);
      binding.addChildToBack(init);
      return binding;
    }
    if (is("case")) {
      next();
      Node pattern = parsePattern(false);
      expect("=");
      Node init = parseExpressionWithoutTrailingClosure();
      Node binding = new Node(Token.COND_BINDING, start, init.getEnd());
      binding.addChildToBack(pattern);
      binding.addChildToBack(init);
      return binding;
    }
    return parseExpressionWithoutTrailingClosure();
  }

  /** Patterns of case items and case conditions. */
  private Node parsePattern(boolean inBinding) {
    Tok tok = peek();
    if (is("let") || is("var")) {
      next();
      Node sub = parsePattern(true);
      Node pattern = new Node(Token.BINDING_PATTERN, tok.start(), sub.getEnd());
      pattern.putBooleanProp(Node.Prop.IS_LET, tok.text().equals("let"));
      pattern.addChildToBack(sub);
      return pattern;
    }
    if (is("_")) {
      next();
      return new Node(Token.ANY_PATTERN, tok.start(), tok.end());
    }
    if (is(".") && peekAt(1).kind() == Kind.IDENT) {
      next();
      Tok name = next();
      Node pattern = Node.newString(Token.ENUM_PATTERN, name.text(), tok.start(), name.end());
      if (isAttached("(")) {
        next();
        pattern.addChildToBack(parsePattern(inBinding));
        pattern.setEnd(expect(")").end());
      }
      return pattern;
    }
    if (inBinding && tok.kind() == Kind.IDENT) {
      return parseBindingName();
    }
    return parseExpressionWithoutTrailingClosure();
  }

  private Node parseSwitch() {
    int start = expect("switch").start();
    Node switchNode = new Node(Token.SWITCH, start, start);
    switchNode.addChildToBack(parseExpressionWithoutTrailingClosure());
    expect("{");
    breakTargets.push(switchNode);
    while (!is("}")) {
      switchNode.addChildToBack(parseCase());
    }
    breakTargets.pop();
    switchNode.setEnd(next().end());
    return switchNode;
  }

  private Node parseCase() {
    int start = peek().start();
    Node caseNode = new Node(Token.CASE, start, start);
    if (is("default")) {
      next();
    } else {
      expect("case");
      while (true) {
        int itemStart = peek().start();
        Node item = new Node(Token.CASE_ITEM, itemStart, itemStart);
        item.addChildToBack(parsePattern(false));
        if (is("where")) {
          next();
          item.addChildToBack(parseExpressionWithoutTrailingClosure());
        }
        item.setEnd(prevEnd());
        caseNode.addChildToBack(item);
        if (!is(",")) {
          break;
        }
        next();
      }
    }
    int colonEnd = expect(":").end();

    Node body = new Node(Token.BLOCK, colonEnd, colonEnd);
    body.putBooleanProp(Node.Prop.IMPLICIT, true);
    while (!is("case") && !is("default") && !is("}")) {
      add(body, parseStatement());
    }
    if (body.hasChildren()) {
      body.setSpan(body.getFirstChild().getStart(), body.getLastChild().getEnd());
    }
    caseNode.addChildToBack(body);
    caseNode.setEnd(Math.max(colonEnd, body.getEnd()));
    return caseNode;
  }

  private Node parseReturn() {
    Tok keyword = expect("return");
    Node ret = new Node(Token.RETURN, keyword.start(), keyword.end());
    if (!peek().newlineBefore()
        && !isEof()
        && !is("}")
        && !is(";")
        && !is("case")
        && !is("default")) {
      Node value = parseExpression();
      ret.addChildToBack(value);
      ret.setEnd(value.getEnd());
    }
    return ret;
  }

  // Expressions

  private static final ImmutableList<ImmutableSet<String>> BINARY_PRECEDENCE =
      ImmutableList.of(
          ImmutableSet.of("=", "+=", "-="),
          ImmutableSet.of("||"),
          ImmutableSet.of("&&"),
          ImmutableSet.of("==", "!=", "<", ">", "<=", ">="),
          ImmutableSet.of("??"),
          ImmutableSet.of("..<", "..."),
          ImmutableSet.of("+", "-"),
          ImmutableSet.of("*", "/", "%"));

  private Node parseExpression() {
    boolean saved = allowTrailingClosure;
    allowTrailingClosure = true;
    try {
      return parseBinary(0);
    } finally {
      allowTrailingClosure = saved;
    }
  }

  private Node parseExpressionWithoutTrailingClosure() {
    boolean saved = allowTrailingClosure;
    allowTrailingClosure = false;
    try {
      return parseBinary(0);
    } finally {
      allowTrailingClosure = saved;
    }
  }

  private int precedenceOf(Tok tok) {
    if (tok.kind() != Kind.PUNCT) {
      return -1;
    }
    for (int i = 0; i < BINARY_PRECEDENCE.size(); i++) {
      if (BINARY_PRECEDENCE.get(i).contains(tok.text())) {
        return i;
      }
    }
    return -1;
  }

  private Node parseBinary(int minPrecedence) {
    Node lhs = parseUnary();
    while (true) {
      int precedence = precedenceOf(peek());
      if (precedence < minPrecedence) {
        return lhs;
      }
      String op = next().text();
      // Assignment is right associative.
      Node rhs = parseBinary(precedence == 0 ? precedence : precedence + 1);
      Node binary = Node.newString(Token.BINARY, op, lhs.getStart(), rhs.getEnd());
      binary.addChildToBack(lhs);
      binary.addChildToBack(rhs);
      lhs = binary;
    }
  }

  private Node parseUnary() {
    Tok tok = peek();
    if (is("try")) {
      next();
      Token token = Token.TRY;
      if (isAttached("?")) {
        next();
        token = Token.TRY_OPTIONAL;
      } else if (isAttached("!")) {
        next();
      }
      Node operand = parseUnary();
      Node result = new Node(token, tok.start(), operand.getEnd());
      result.addChildToBack(operand);
      return result;
    }
    if (is("await")) {
      next();
      Node operand = parseUnary();
      Node result = new Node(Token.AWAIT, tok.start(), operand.getEnd());
      result.addChildToBack(operand);
      return result;
    }
    return parsePostfix(parsePrimary());
  }

  private Node parsePrimary() {
    Tok tok = peek();
    switch (tok.kind()) {
      case NUMBER:
        next();
        return new Node(Token.LITERAL, tok.start(), tok.end());
      case STRING:
        {
          next();
          Node literal = new Node(Token.LITERAL, tok.start(), tok.end());
          literal.putBooleanProp(Node.Prop.IS_STRING, true);
          return literal;
        }
      case IDENT:
        return parseIdentifier();
      case PUNCT:
        break;
      case EOF:
        throw error("Expected an expression");
    }
    if (is("(")) {
      return parseParenOrTuple();
    }
    if (is("{")) {
      return parseClosure();
    }
    if (is("[")) {
      skipBalanced("[", "]");
      return new Node(Token.LITERAL, tok.start(), prevEnd());
    }
    if (is(".") && peekAt(1).kind() == Kind.IDENT) {
      next();
      Tok name = next();
      Node member =
          Node.newString(Token.IMPLICIT_MEMBER, name.text(), tok.start(), name.end());
      member.putProp(Node.Prop.NAME_SPAN, SourceSpan.of(name.start(), name.end()));
      return member;
    }
    throw error("Expected an expression");
  }

  private Node parseIdentifier() {
    Tok tok = next();
    switch (tok.text()) {
      case "nil":
        return new Node(Token.NIL, tok.start(), tok.end());
      case "true":
      case "false":
        return new Node(Token.LITERAL, tok.start(), tok.end());
      default:
        break;
    }
    if (tok.text().startsWith("$") && !closureDollarCounts.isEmpty()) {
      int index = Integer.parseInt(tok.text().substring(1));
      int[] count = closureDollarCounts.peek();
      count[0] = Math.max(count[0], index + 1);
    }
    Node name = Node.newString(Token.NAME, stripBackticks(tok.text()), tok.start(), tok.end());
    ImmutableList<SourceSpan> compoundLabels = parseCompoundLabels();
    if (compoundLabels != null) {
      name.putProp(Node.Prop.COMPOUND_LABEL_SPANS, compoundLabels);
    }
    return name;
  }

  /** Parses the labels of {@code foo(a:_:)}, or returns null if no such labels follow. */
  private @Nullable ImmutableList<SourceSpan> parseCompoundLabels() {
    if (!isAttached("(")) {
      return null;
    }
    int i = 1;
    ImmutableList.Builder<SourceSpan> labels = ImmutableList.builder();
    while (peekAt(i).kind() == Kind.IDENT && peekAt(i + 1).text().equals(":")) {
      labels.add(SourceSpan.of(peekAt(i).start(), peekAt(i).end()));
      i += 2;
    }
    if (i == 1 || !peekAt(i).text().equals(")")) {
      return null;
    }
    pos += i + 1;
    return labels.build();
  }

  private Node parseParenOrTuple() {
    int start = expect("(").start();
    List<Node> elements = new ArrayList<>();
    boolean hasComma = false;
    while (!is(")")) {
      elements.add(parseExpression());
      if (is(",")) {
        hasComma = true;
        next();
      }
    }
    int end = next().end();
    Node result =
        new Node(elements.size() == 1 && !hasComma ? Token.PAREN : Token.TUPLE, start, end);
    for (Node element : elements) {
      result.addChildToBack(element);
    }
    return result;
  }

  private Node parsePostfix(Node expr) {
    while (true) {
      if (is(".") && peekAt(1).kind() == Kind.IDENT && !peekAt(1).spaceBefore()) {
        next();
        Tok name = next();
        Node member = Node.newString(Token.MEMBER, name.text(), expr.getStart(), name.end());
        member.putProp(Node.Prop.NAME_SPAN, SourceSpan.of(name.start(), name.end()));
        member.addChildToBack(expr);
        expr = member;
      } else if (is("(") && !peek().newlineBefore()) {
        expr = parseCall(expr);
      } else if (is("{") && allowTrailingClosure && !peek().newlineBefore()) {
        Node call = expr.isCall() ? expr : newCall(expr);
        addTrailingClosures(call);
        expr = call;
      } else if (isAttached("!")) {
        next();
        Node unwrap = new Node(Token.FORCE_UNWRAP, expr.getStart(), prevEnd());
        unwrap.addChildToBack(expr);
        expr = unwrap;
      } else if (isAttached("?")) {
        next();
        Node bind = new Node(Token.BIND_OPTIONAL, expr.getStart(), prevEnd());
        bind.addChildToBack(expr);
        expr = bind;
      } else {
        return expr;
      }
    }
  }

  private static Node newCall(Node callee) {
    Node call = new Node(Token.CALL, callee.getStart(), callee.getEnd());
    call.addChildToBack(callee);
    return call;
  }

  private Node parseCall(Node callee) {
    Node call = newCall(callee);
    expect("(");
    while (!is(")")) {
      int argStart = peek().start();
      String label = "";
      if (peek().kind() == Kind.IDENT && peekAt(1).text().equals(":")) {
        label = stripBackticks(next().text());
        next();
      }
      Node value = parseExpression();
      Node arg = Node.newString(Token.ARGUMENT, label, argStart, value.getEnd());
      arg.putProp(Node.Prop.LABEL_SPAN, SourceSpan.of(argStart, value.getStart()));
      arg.addChildToBack(value);
      call.addChildToBack(arg);
      if (is(",")) {
        next();
      }
    }
    call.setEnd(next().end());
    if (is("{") && allowTrailingClosure && !peek().newlineBefore()) {
      addTrailingClosures(call);
    }
    return call;
  }

  private void addTrailingClosures(Node call) {
    Node first = parseClosure();
    Node firstArg = Node.newString(Token.ARGUMENT, "", first.getStart(), first.getEnd());
    firstArg.putProp(Node.Prop.LABEL_SPAN, SourceSpan.empty(first.getStart()));
    firstArg.putBooleanProp(Node.Prop.TRAILING_CLOSURE, true);
    firstArg.addChildToBack(first);
    call.addChildToBack(firstArg);
    call.setEnd(first.getEnd());

    while (peek().kind() == Kind.IDENT
        && peekAt(1).text().equals(":")
        && peekAt(2).text().equals("{")) {
      Tok label = next();
      next();
      Node closure = parseClosure();
      Node arg =
          Node.newString(
              Token.ARGUMENT, stripBackticks(label.text()), label.start(), closure.getEnd());
      arg.putProp(Node.Prop.LABEL_SPAN, SourceSpan.of(label.start(), closure.getStart()));
      arg.putBooleanProp(Node.Prop.TRAILING_CLOSURE, true);
      arg.addChildToBack(closure);
      call.addChildToBack(arg);
      call.setEnd(closure.getEnd());
    }
  }

  private Node parseClosure() {
    int start = expect("{").start();
    functionDepth++;
    Deque<Node> savedBreakTargets = breakTargets;
    breakTargets = new ArrayDeque<>();
    boolean savedAllowTrailingClosure = allowTrailingClosure;
    allowTrailingClosure = true;
    closureDollarCounts.push(new int[1]);

    Node paramList;
    if (hasClosureSignature()) {
      paramList = parseClosureParams();
      expect("in");
    } else {
      paramList = new Node(Token.PARAM_LIST, start + 1, start + 1);
    }

    Node body = new Node(Token.BLOCK, start, start);
    while (!is("}")) {
      if (isEof()) {
        throw error("Expected '}'");
      }
      add(body, parseStatement());
    }
    int end = next().end();
    body.setSpan(start, end);

    int dollarCount = closureDollarCounts.pop()[0];
    if (!paramList.hasChildren()) {
      for (int i = 0; i < dollarCount; i++) {
        Node param = Node.newString(Token.PARAM, "$" + i, start + 1, start + 1);
        param.putBooleanProp(Node.Prop.IMPLICIT, true);
        paramList.addChildToBack(param);
      }
    }
    allowTrailingClosure = savedAllowTrailingClosure;
    breakTargets = savedBreakTargets;
    functionDepth--;

    Node closure = new Node(Token.CLOSURE, start, end);
    closure.addChildToBack(paramList);
    closure.addChildToBack(body);
    return closure;
  }

  /** Whether the closure starting at the current token has a signature ending in {@code in}. */
  private boolean hasClosureSignature() {
    int depth = 0;
    for (int i = pos; i < tokens.size(); i++) {
      Tok tok = tokens.get(i);
      String text = tok.text();
      if (tok.kind() == Kind.EOF || tok.kind() == Kind.STRING || tok.kind() == Kind.NUMBER) {
        return false;
      }
      if (depth == 0 && text.equals("in")) {
        return true;
      }
      switch (text) {
        case "(":
        case "[":
        case "<":
          depth++;
          break;
        case ")":
        case "]":
        case ">":
          depth--;
          break;
        case ",":
        case ":":
        case "->":
        case "?":
        case "!":
        case ".":
          break;
        default:
          if (tok.kind() != Kind.IDENT || Identifiers.isKeyword(text) && !text.equals("_")) {
            return false;
          }
      }
    }
    return false;
  }

  private Node parseClosureParams() {
    if (is("[")) {
      skipBalanced("[", "]");
    }
    int start = peek().start();
    Node paramList = new Node(Token.PARAM_LIST, start, start);
    boolean parenthesized = is("(");
    if (parenthesized) {
      next();
    }
    while (!is("in") && !is(")")) {
      Tok name = next();
      Node param =
          Node.newString(Token.PARAM, stripBackticks(name.text()), name.start(), name.end());
      param.putProp(Node.Prop.NAME_SPAN, SourceSpan.of(name.start(), name.end()));
      if (is(":")) {
        next();
        param.setType(parseType());
        param.setEnd(prevEnd());
      }
      paramList.addChildToBack(param);
      if (is(",")) {
        next();
      }
    }
    if (parenthesized) {
      expect(")");
    }
    if (is("->")) {
      next();
      parseType();
    }
    paramList.setEnd(prevEnd());
    return paramList;
  }

  /** Binds names to declarations and gives declarations their types. */
  private static final class Resolver {
    private static final Decl PRINT =
        Decl.builder(Decl.Kind.FUNC, "print")
            .setParams(
                ImmutableList.of(
                    Decl.builder(Decl.Kind.PARAM, "items").setType(Type.named("Any")).build()))
            .setSystem(true)
            .build();

    private int depth = 0;

    private static final class Scope {
      final @Nullable Scope parent;
      final Map<String, List<Decl>> decls = new HashMap<>();

      Scope(@Nullable Scope parent) {
        this.parent = parent;
      }

      void declare(Decl decl) {
        if (decl.hasName()) {
          decls.computeIfAbsent(decl.getName(), k -> new ArrayList<>()).add(decl);
        }
      }

      @Nullable List<Decl> lookupAll(String name) {
        for (Scope s = this; s != null; s = s.parent) {
          List<Decl> found = s.decls.get(name);
          if (found != null) {
            return found;
          }
        }
        return null;
      }

      @Nullable Decl lookup(String name) {
        List<Decl> found = lookupAll(name);
        return found == null ? null : found.get(found.size() - 1);
      }
    }

    void resolveScript(Node script) {
      Scope builtins = new Scope(null);
      builtins.declare(PRINT);
      resolveStatements(script, new Scope(builtins));
    }

    private void resolveStatements(Node block, Scope scope) {
      for (Node child : block.children()) {
        if (child.isFunction()) {
          scope.declare(child.getDecl());
        }
      }
      for (Node child : block.children()) {
        resolve(child, scope, null);
      }
    }

    private void resolve(Node n, Scope scope, @Nullable Type context) {
      switch (n.getToken()) {
        case BLOCK:
          resolveStatements(n, new Scope(scope));
          return;
        case FUNCTION:
          {
            Scope functionScope = new Scope(scope);
            for (Node param : n.getFunctionParamList().children()) {
              functionScope.declare(param.getDecl());
            }
            Node body = n.getFunctionBody();
            if (body != null) {
              depth++;
              resolve(body, functionScope, null);
              depth--;
            }
            return;
          }
        case CLOSURE:
          resolveClosure(n, scope, context);
          return;
        case BINDING:
          {
            Node pattern = n.getFirstChild();
            Node init = pattern.getNext();
            Type type = pattern.getType();
            if (init != null) {
              resolve(init, scope, type);
              if (type == null) {
                type = typeOf(init);
              }
            }
            resolvePattern(pattern, scope, type, n.getBooleanProp(Node.Prop.IS_LET));
            return;
          }
        case IF:
          {
            Scope ifScope = new Scope(scope);
            resolve(n.getCondition(), ifScope, null);
            resolve(n.getThenBlock(), ifScope, null);
            if (n.getElse() != null) {
              resolve(n.getElse(), scope, null);
            }
            return;
          }
        case GUARD:
          {
            Scope conditionScope = new Scope(scope);
            resolve(n.getCondition(), conditionScope, null);
            resolve(n.getGuardBody(), scope, null);
            conditionScope.decls.values().forEach(decls -> decls.forEach(scope::declare));
            return;
          }
        case WHILE:
          {
            Scope whileScope = new Scope(scope);
            resolve(n.getFirstChild(), whileScope, null);
            resolve(n.getLastChild(), whileScope, null);
            return;
          }
        case FOR_EACH:
          {
            Node pattern = n.getFirstChild();
            resolve(pattern.getNext(), scope, null);
            Scope forScope = new Scope(scope);
            resolvePattern(pattern, forScope, null, true);
            resolve(n.getLastChild(), forScope, null);
            return;
          }
        case SWITCH:
          {
            Node subject = n.getSwitchSubject();
            resolve(subject, scope, null);
            Type subjectType = typeOf(subject);
            for (Node caseNode : n.getCases()) {
              Scope caseScope = new Scope(scope);
              for (Node item : caseNode.getCaseItems()) {
                resolvePattern(item.getFirstChild(), caseScope, subjectType, false);
                if (item.hasWhereClause()) {
                  resolve(item.getLastChild(), caseScope, null);
                }
              }
              resolve(caseNode.getCaseBody(), caseScope, null);
            }
            return;
          }
        case COND_BINDING:
          {
            Node init = n.getLastChild();
            resolve(init, scope, null);
            resolvePattern(n.getFirstChild(), scope, typeOf(init), false);
            return;
          }
        case CALL:
          resolveCall(n, scope, context);
          return;
        case NAME:
          if (n.getDecl() == null) {
            n.setDecl(scope.lookup(n.getString()));
          }
          return;
        case MEMBER:
          {
            Node base = n.getFirstChild();
            resolve(base, scope, null);
            Type baseType = typeOf(base);
            if (n.getString().equals("get") && baseType != null && baseType.isResult()) {
              n.setDecl(
                  Decl.builder(Decl.Kind.FUNC, "get")
                      .setResultType(baseType.getGenericArgs().get(0))
                      .setThrows(true)
                      .setSystem(true)
                      .build());
            }
            return;
          }
        case IMPLICIT_MEMBER:
          n.setDecl(enumCase(n.getString(), context));
          return;
        default:
          for (Node child : n.children()) {
            resolve(child, scope, null);
          }
      }
    }

    private void resolveClosure(Node closure, Scope scope, @Nullable Type context) {
      Type functionType = context == null ? null : context.lookThroughSingleOptionalType();
      ImmutableList<Type> paramTypes =
          functionType != null && functionType.isFunction()
              ? functionType.getParams()
              : ImmutableList.of();

      Scope closureScope = new Scope(scope);
      int index = 0;
      for (Node param : closure.getFunctionParamList().children()) {
        Type type = param.getType();
        if (type == null) {
          type = index < paramTypes.size() ? paramTypes.get(index) : Type.named("_");
        }
        String name = param.getString().equals("_") ? "" : param.getString();
        Decl decl = Decl.builder(Decl.Kind.PARAM, name).setType(type).setLocal(true).build();
        param.setDecl(decl);
        decl.setDeclaringNode(param);
        closureScope.declare(decl);
        index++;
      }
      depth++;
      resolve(closure.getFunctionBody(), closureScope, null);
      depth--;
    }

    private void resolvePattern(Node pattern, Scope scope, @Nullable Type type, boolean isLet) {
      switch (pattern.getToken()) {
        case NAME_PATTERN:
          {
            if (pattern.getType() != null) {
              type = pattern.getType();
            }
            Decl decl =
                Decl.builder(Decl.Kind.VAR, pattern.getString())
                    .setType(type == null ? Type.named("_") : type)
                    .setLet(isLet)
                    .setLocal(depth > 0)
                    .build();
            pattern.setDecl(decl);
            decl.setDeclaringNode(pattern);
            scope.declare(decl);
            return;
          }
        case BINDING_PATTERN:
          resolvePattern(
              pattern.getFirstChild(), scope, type, pattern.getBooleanProp(Node.Prop.IS_LET));
          return;
        case OPTIONAL_SOME_PATTERN:
          resolvePattern(
              pattern.getFirstChild(),
              scope,
              type == null ? null : type.lookThroughSingleOptionalType(),
              isLet);
          return;
        case ENUM_PATTERN:
          {
            pattern.setDecl(enumCase(pattern.getString(), type));
            if (pattern.hasChildren()) {
              resolvePattern(
                  pattern.getFirstChild(), scope, payloadType(pattern.getString(), type), isLet);
            }
            return;
          }
        case ANY_PATTERN:
          return;
        default:
          resolve(pattern, scope, type);
      }
    }

    private static Decl enumCase(String name, @Nullable Type context) {
      Decl.Builder builder = Decl.builder(Decl.Kind.ENUM_CASE, name);
      if (context != null) {
        builder.setContextType(context);
      }
      return builder.build();
    }

    private static @Nullable Type payloadType(String caseName, @Nullable Type enumType) {
      if (enumType == null || !enumType.isResult()) {
        return null;
      }
      if (caseName.equals("success")) {
        return enumType.getGenericArgs().get(0);
      }
      return caseName.equals("failure") ? enumType.getGenericArgs().get(1) : null;
    }

    private void resolveCall(Node call, Scope scope, @Nullable Type context) {
      Node callee = call.getCallee();
      ImmutableList<Node> args = call.getArguments();
      if (callee.isName() && callee.getDecl() == null) {
        callee.setDecl(lookupCallee(callee, args, scope));
      } else {
        resolve(callee, scope, context);
      }

      Decl called = callee.getReferencedDecl();
      List<Type> paramTypes = new ArrayList<>();
      if (called != null && called.isFunc()) {
        for (Decl param : called.getParams()) {
          paramTypes.add(param.getType());
        }
      } else if (called != null && called.isEnumCase()) {
        Type payload = payloadType(called.getName(), called.getContextType());
        if (payload != null) {
          paramTypes.add(payload);
        }
      } else if (called != null) {
        Type type = called.getType().lookThroughSingleOptionalType();
        if (type.isFunction()) {
          paramTypes.addAll(type.getParams());
        }
      }

      for (int i = 0; i < args.size(); i++) {
        resolve(
            args.get(i).getFirstChild(), scope, i < paramTypes.size() ? paramTypes.get(i) : null);
      }
    }

    /** Picks the overload whose labels match the arguments of the call. */
    private static @Nullable Decl lookupCallee(Node callee, List<Node> args, Scope scope) {
      List<Decl> candidates = scope.lookupAll(callee.getString());
      if (candidates == null) {
        return null;
      }
      Decl match = null;
      for (Decl candidate : candidates) {
        if (candidate.isFunc() && labelsMatch(candidate, callee, args)) {
          match = candidate;
        }
      }
      return match != null ? match : candidates.get(candidates.size() - 1);
    }

    private static boolean labelsMatch(Decl func, Node callee, List<Node> args) {
      ImmutableList<Decl> params = func.getParams();
      ImmutableList<SourceSpan> compoundLabels = callee.getCompoundLabelSpans();
      if (!compoundLabels.isEmpty()) {
        return compoundLabels.size() == params.size();
      }
      if (args.size() > params.size()) {
        return false;
      }
      for (int i = 0; i < args.size(); i++) {
        Node arg = args.get(i);
        if (!arg.isTrailingClosure() && !arg.getLabel().equals(params.get(i).getArgumentLabel())) {
          return false;
        }
      }
      return true;
    }

    private static @Nullable Type typeOf(Node n) {
      if (n.getType() != null) {
        return n.getType();
      }
      switch (n.getToken()) {
        case NAME:
        case MEMBER:
          {
            Decl decl = n.getReferencedDecl();
            return decl == null || decl.isEnumCase() ? null : decl.getType();
          }
        case CALL:
          {
            Decl called = n.getCalledDecl();
            if (called == null) {
              return null;
            } else if (called.isFunc()) {
              return called.getResultType();
            } else if (called.isEnumCase()) {
              return called.getContextType();
            }
            Type type = called.getType().lookThroughSingleOptionalType();
            return type.isFunction() ? type.getResult() : null;
          }
        case TRY:
        case AWAIT:
        case PAREN:
          return typeOf(n.getFirstChild());
        case TRY_OPTIONAL:
          {
            Type type = typeOf(n.getFirstChild());
            return type == null ? null : Type.optional(type);
          }
        case FORCE_UNWRAP:
          {
            Type type = typeOf(n.getFirstChild());
            return type == null ? null : type.lookThroughSingleOptionalType();
          }
        case LITERAL:
          return Type.named(n.isStringLiteral() ? "String" : "Int");
        default:
          return null;
      }
    }
  }
}

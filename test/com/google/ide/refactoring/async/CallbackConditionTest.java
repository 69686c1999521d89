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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableSet;
import com.google.ide.analysis.ContextFinder;
import com.google.ide.syntax.Decl;
import com.google.ide.syntax.Node;
import com.google.ide.syntax.Token;
import com.google.ide.testing.TestParser;
import com.google.ide.testing.TestParser.Parsed;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link CallbackCondition}. */
@RunWith(JUnit4.class)
public final class CallbackConditionTest {

  private static final String CODE =
      """
      func f(res: String?, err: Error?, r: Result<String, Error>) {
        if err != nil {}
        if let value = res {}
        if case .failure(let e) = r {}
        if case .success(let s) = r {}
        if let v = try? r.get() {}
        if res == nil && err != nil {}
        if res == nil && res != nil {}
        if res == nil || err == nil {}
      }
      """;

  private Parsed parsed;
  private Decl res;
  private Decl err;
  private Decl r;
  private Map<Decl, CallbackCondition> conditions;

  @Before
  public void setUp() {
    parsed = TestParser.parse(CODE);
    res = parsed.findDecl("res");
    err = parsed.findDecl("err");
    r = parsed.findDecl("r");
    conditions = new LinkedHashMap<>();
  }

  @Test
  public void testComparison() {
    CallbackCondition cond =
        CallbackCondition.fromComparison(conditionList("err != nil").getFirstChild());

    assertThat(cond.isValid()).isTrue();
    assertThat(cond.getType()).isEqualTo(ConditionType.NOT_NIL);
    assertThat(cond.getSubject()).isSameInstanceAs(err);
    assertThat(cond.getBindPattern()).isNull();
  }

  @Test
  public void testOptionalBinding() {
    CallbackCondition cond = fromBinding("let value = res");

    assertThat(cond.getType()).isEqualTo(ConditionType.NOT_NIL);
    assertThat(cond.getSubject()).isSameInstanceAs(res);
    assertThat(cond.getBindPattern().getToken()).isEqualTo(Token.BINDING_PATTERN);
    assertThat(cond.isErrorCase()).isFalse();
  }

  @Test
  public void testResultCases() {
    CallbackCondition failure = fromBinding("case .failure");
    CallbackCondition success = fromBinding("case .success");

    assertThat(failure.getSubject()).isSameInstanceAs(r);
    assertThat(failure.isErrorCase()).isTrue();
    assertThat(success.getType()).isEqualTo(ConditionType.NOT_NIL);
    assertThat(success.isErrorCase()).isFalse();
  }

  @Test
  public void testOptionalTryOfResult() {
    CallbackCondition cond = fromBinding("let v = try?");

    assertThat(cond.getType()).isEqualTo(ConditionType.NOT_NIL);
    assertThat(cond.getSubject()).isSameInstanceAs(r);
  }

  @Test
  public void testAllConjunction() {
    boolean handled =
        CallbackCondition.all(
            conditionList("res == nil && err"), ImmutableSet.of(res, err), conditions);

    assertThat(handled).isTrue();
    assertThat(conditions.keySet()).containsExactly(err, res);
    assertThat(conditions.get(res).getType()).isEqualTo(ConditionType.NIL);
    assertThat(conditions.get(err).getType()).isEqualTo(ConditionType.NOT_NIL);
  }

  @Test
  public void testAllRejectsRepeatedSubject() {
    assertThat(
            CallbackCondition.all(
                conditionList("res == nil && res"), ImmutableSet.of(res, err), conditions))
        .isFalse();
  }

  @Test
  public void testAllRejectsDisjunction() {
    assertThat(
            CallbackCondition.all(
                conditionList("res == nil ||"), ImmutableSet.of(res, err), conditions))
        .isFalse();
  }

  @Test
  public void testAllRejectsUnknownSubject() {
    assertThat(
            CallbackCondition.all(conditionList("err != nil"), ImmutableSet.of(res), conditions))
        .isFalse();
    assertThat(conditions).isEmpty();
  }

  private Node conditionList(String text) {
    return ContextFinder.findInnermost(
        parsed.root(), parsed.offsetOf(text), n -> n.getToken() == Token.CONDITION_LIST);
  }

  private CallbackCondition fromBinding(String text) {
    Node binding = conditionList(text).getFirstChild();
    return CallbackCondition.fromBinding(binding.getFirstChild(), binding.getLastChild());
  }
}

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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.ide.syntax.Type;
import com.google.ide.testing.TestParser;
import com.google.ide.testing.TestParser.Parsed;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link AsyncHandlerDesc} and {@link AsyncHandlerParamDesc}. */
@RunWith(JUnit4.class)
public final class AsyncHandlerDescTest {

  @Test
  public void testSimpleHandler() {
    AsyncHandlerParamDesc desc =
        find("func simple(completion: @escaping (String) -> Void) {}", "simple", true);

    assertThat(desc.isValid()).isTrue();
    assertThat(desc.getType()).isEqualTo(HandlerType.PARAMS);
    assertThat(desc.hasError()).isFalse();
    assertThat(desc.getIndex()).isEqualTo(0);
    assertThat(desc.getNameStr()).isEqualTo("completion");
    assertThat(desc.printAsyncFunctionName()).isEqualTo("simple()");
    assertThat(returnTypes(desc)).containsExactly("String");
    assertThat(desc.willAsyncReturnVoid()).isFalse();
  }

  @Test
  public void testErrorParameter() {
    AsyncHandlerParamDesc desc =
        find(
            "func load(id: Int, _ b: Int, completion: @escaping (String?, Int, Error?) -> Void) {}",
            "load",
            true);

    assertThat(desc.isValid()).isTrue();
    assertThat(desc.hasError()).isTrue();
    assertThat(desc.getIndex()).isEqualTo(2);
    assertThat(desc.printAsyncFunctionName()).isEqualTo("load(id:_:)");
    assertThat(returnTypes(desc)).containsExactly("String", "Int").inOrder();
  }

  @Test
  public void testNoParameters() {
    AsyncHandlerParamDesc desc =
        find("func ping(completion: @escaping () -> Void) {}", "ping", true);

    assertThat(desc.isValid()).isTrue();
    assertThat(desc.getAsyncReturnTypes()).isEmpty();
    assertThat(desc.willAsyncReturnVoid()).isTrue();
  }

  @Test
  public void testResultHandler() {
    AsyncHandlerParamDesc desc =
        find("func load(completion: @escaping (Result<Int, Error>) -> Void) {}", "load", true);

    assertThat(desc.getType()).isEqualTo(HandlerType.RESULT);
    assertThat(desc.hasError()).isTrue();
    assertThat(returnTypes(desc)).containsExactly("Int");
  }

  @Test
  public void testResultHandlerThatCannotFail() {
    AsyncHandlerParamDesc desc =
        find("func load(completion: @escaping (Result<Int, Never>) -> Void) {}", "load", true);

    assertThat(desc.getType()).isEqualTo(HandlerType.RESULT);
    assertThat(desc.hasError()).isFalse();
  }

  @Test
  public void testResultMixedWithOtherParameters() {
    AsyncHandlerParamDesc desc =
        find(
            "func load(completion: @escaping (Result<Int, Error>, Int) -> Void) {}", "load", true);

    assertThat(desc.isValid()).isFalse();
  }

  @Test
  public void testNameRequirement() {
    String code = "func run(callback: @escaping (Int) -> Void) {}";

    assertThat(find(code, "run", true).isValid()).isFalse();
    assertThat(find(code, "run", false).isValid()).isTrue();
  }

  @Test
  public void testAttributeLiftsTheNameRequirement() {
    String code =
        "@completionHandlerAsync(\"run()\")\nfunc run(callback: @escaping (Int) -> Void) {}";

    assertThat(find(code, "run", true).isValid()).isTrue();
  }

  @Test
  public void testFunctionShapesWithoutAsyncAlternative() {
    assertThat(find("func run(completion: (Int) -> Void) async {}", "run", true).isValid())
        .isFalse();
    assertThat(find("func run(completion: (Int) -> Void) throws {}", "run", true).isValid())
        .isFalse();
    assertThat(find("func run(completion: (Int) -> Void) -> Int {}", "run", true).isValid())
        .isFalse();
    assertThat(find("func run(completion: Int) {}", "run", true).isValid()).isFalse();
    assertThat(find("func run(completion: (Int) -> Int) {}", "run", true).isValid()).isFalse();
    assertThat(find("func run() {}", "run", true).isValid()).isFalse();
  }

  @Test
  public void testHandlerMustBeLast() {
    AsyncHandlerParamDesc desc =
        find("func run(completion: @escaping (Int) -> Void, id: Int) {}", "run", true);

    assertThat(desc.isValid()).isFalse();
  }

  @Test
  public void testNullFunction() {
    assertThat(AsyncHandlerParamDesc.find(null, false).isValid()).isFalse();
    assertThat(AsyncHandlerParamDesc.find(null, false).printAsyncFunctionName()).isEmpty();
  }

  private static AsyncHandlerParamDesc find(String code, String name, boolean requireName) {
    Parsed parsed = TestParser.parse(code);
    return AsyncHandlerParamDesc.find(parsed.findDecl(name), requireName);
  }

  private static ImmutableList<String> returnTypes(AsyncHandlerDesc desc) {
    return desc.getAsyncReturnTypes().stream().map(Type::toString).collect(toImmutableList());
  }
}

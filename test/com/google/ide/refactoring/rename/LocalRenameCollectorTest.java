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

package com.google.ide.refactoring.rename;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.ide.analysis.CancellationChecker;
import com.google.ide.syntax.Decl;
import com.google.ide.syntax.Node;
import com.google.ide.testing.TestParser;
import com.google.ide.testing.TestParser.Parsed;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class LocalRenameCollectorTest {

  @Test
  public void testVariableOccurrences() {
    Parsed parsed =
        TestParser.parse(
            """
            func run() {
              let value = 1
              // value is printed
              print(value)
              print("value")
            }
            """);
    Decl value = parsed.findDecl("value");

    ImmutableList<RenameLoc> locs =
        new LocalRenameCollector(parsed.file(), CancellationChecker.NEVER)
            .collect(value, "renamed");

    assertThat(locs.stream().map(RenameLoc::usage).collect(toImmutableList()))
        .containsExactly(
            NameUsage.DEFINITION, NameUsage.UNKNOWN, NameUsage.REFERENCE, NameUsage.UNKNOWN)
        .inOrder();
    assertThat(locs.get(0).line()).isEqualTo(2);
    assertThat(locs.get(0).column()).isEqualTo(7);
    assertThat(locs.get(1).line()).isEqualTo(3);
    assertThat(locs.get(1).column()).isEqualTo(6);
    assertThat(locs.get(2).line()).isEqualTo(4);
    assertThat(locs.get(2).column()).isEqualTo(9);
    for (RenameLoc loc : locs) {
      assertThat(loc.oldName()).isEqualTo("value");
      assertThat(loc.newName()).isEqualTo("renamed");
      assertThat(loc.isFunctionLike()).isFalse();
    }
  }

  @Test
  public void testLocalFunctionCall() {
    Parsed parsed =
        TestParser.parse(
            """
            func run() {
              func helper(x: Int) {}
              helper(x: 1)
              let f = helper
            }
            """);
    Decl helper = parsed.findDecl("helper");

    ImmutableList<RenameLoc> locs =
        new LocalRenameCollector(parsed.file(), CancellationChecker.NEVER)
            .collect(helper, "other(y:)");

    assertThat(locs.stream().map(RenameLoc::usage).collect(toImmutableList()))
        .containsExactly(NameUsage.DEFINITION, NameUsage.CALL, NameUsage.REFERENCE)
        .inOrder();
    assertThat(locs.get(0).oldName()).isEqualTo("helper(x:)");
    assertThat(locs.get(0).isFunctionLike()).isTrue();
  }

  @Test
  public void testOccurrencesOutsideTheScopeAreIgnored() {
    Parsed parsed =
        TestParser.parse(
            """
            func run() {
              if true {
                let value = 1
                print(value)
              }
              // value
            }
            """);
    Decl value = parsed.findDecl("value");

    ImmutableList<RenameLoc> locs =
        new LocalRenameCollector(parsed.file(), CancellationChecker.NEVER)
            .collect(value, "renamed");

    assertThat(locs).hasSize(2);
  }

  @Test
  public void testRenameScope() {
    Parsed parsed =
        TestParser.parse(
            """
            func run(a: Int) {
              let b = a
            }
            """);
    Node body = parsed.findDecl("run").getDeclaringNode().getFunctionBody();

    assertThat(LocalRenameCollector.getRenameScope(parsed.findDecl("b"))).isSameInstanceAs(body);
    assertThat(LocalRenameCollector.getRenameScope(parsed.findDecl("a")))
        .isSameInstanceAs(parsed.findDecl("run").getDeclaringNode());
  }
}

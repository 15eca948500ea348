// Copyright 2025 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.typeflow.narrowing;

import static com.google.common.truth.Truth.assertThat;
import static net.typeflow.analysis.AnalysisFixture.analyze;

import com.google.common.collect.ImmutableList;
import net.typeflow.analysis.AnalysisFixture;
import net.typeflow.analysis.Reachability;
import net.typeflow.evaluator.TypeEnvironment;
import net.typeflow.syntax.DefStatement;
import net.typeflow.syntax.IfStatement;
import net.typeflow.types.Types;
import net.typeflow.types.Types.ClassType;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the conditions that narrow references, applied through flow analysis. */
@RunWith(JUnit4.class)
public final class NarrowingRulesTest {

  private static final ClassType CIRCLE =
      Types.classBuilder("Circle").addField("kind", Types.literal("circle")).build();
  private static final ClassType SQUARE =
      Types.classBuilder("Square").addField("kind", Types.literal("square")).build();
  private static final ClassType POINT =
      Types.classBuilder("Point").addField("v", Types.union(Types.INT, Types.NONE)).build();

  private static TypeEnvironment env() {
    return TypeEnvironment.builder()
        .addClass(CIRCLE)
        .addClass(SQUARE)
        .addClass(POINT)
        .addNamedType("Handler", Types.callable(ImmutableList.of(), Types.NONE))
        .addTypedDict(Types.typedDictBuilder("Keyed").addRequiredKey("k", Types.INT).build())
        .addTypedDict(Types.typedDictBuilder("Plain").addRequiredKey("p", Types.INT).build())
        .build();
  }

  /** Analyzes a function whose body tests {@code x} and reveals it on both paths. */
  private static ImmutableList<String> revealBothWays(String signature, String test) {
    return analyze(
            env(),
            "def f" + signature + ":",
            "  if " + test + ":",
            "    reveal(x)",
            "  else:",
            "    reveal(x)")
        .reveals();
  }

  @Test
  public void testTruthiness() {
    assertThat(revealBothWays("(x: int | None)", "x"))
        .containsExactly("int", "int | None")
        .inOrder();
    assertThat(revealBothWays("(x: bool)", "x"))
        .containsExactly("Literal[True]", "Literal[False]")
        .inOrder();
    assertThat(revealBothWays("(x: int | None)", "bool(x)"))
        .containsExactly("int", "int | None")
        .inOrder();
  }

  @Test
  public void testNot() {
    assertThat(revealBothWays("(x: int | None)", "not x is None"))
        .containsExactly("int", "None")
        .inOrder();
  }

  @Test
  public void testNoneComparisons() {
    assertThat(revealBothWays("(x: int | None)", "x is None"))
        .containsExactly("None", "int")
        .inOrder();
    assertThat(revealBothWays("(x: int | None)", "x != None"))
        .containsExactly("int", "None")
        .inOrder();
    assertThat(revealBothWays("(x: int | None)", "None is x"))
        .containsExactly("None", "int")
        .inOrder();
  }

  @Test
  public void testLiteralComparisons() {
    assertThat(revealBothWays("(x: Literal['a', 'b'])", "x == 'a'"))
        .containsExactly("Literal['a']", "Literal['b']")
        .inOrder();
    assertThat(revealBothWays("(x: str)", "x == 'a'"))
        .containsExactly("Literal['a']", "str")
        .inOrder();
  }

  @Test
  public void testAndOr() {
    AnalysisFixture fixture =
        analyze(
            "def f(x: int | None, y: str | None):",
            "  if x is not None and y is not None:",
            "    reveal(x)",
            "    reveal(y)",
            "  else:",
            "    reveal(x)",
            "  if x is None or y is None:",
            "    reveal(y)",
            "  else:",
            "    reveal(x)");
    assertThat(fixture.reveal(0).getType()).isEqualTo(Types.INT);
    assertThat(fixture.reveal(1).getType()).isEqualTo(Types.STR);
    assertThat(fixture.reveal(2).getType()).isEqualTo(Types.union(Types.INT, Types.NONE));
    assertThat(fixture.reveal(3).getType()).isEqualTo(Types.union(Types.STR, Types.NONE));
    assertThat(fixture.reveal(4).getType()).isEqualTo(Types.INT);
  }

  @Test
  public void testIsInstance() {
    assertThat(revealBothWays("(x: int | str | None)", "isinstance(x, int)"))
        .containsExactly("int", "str | None")
        .inOrder();
    assertThat(revealBothWays("(x: int | str | None)", "isinstance(x, (int, str))"))
        .containsExactly("int | str", "None")
        .inOrder();
    assertThat(revealBothWays("(x: int | str | None)", "isinstance(x, int | str)"))
        .containsExactly("int | str", "None")
        .inOrder();
  }

  @Test
  public void testIsSubclass() {
    assertThat(revealBothWays("(x: type[int] | type[str])", "issubclass(x, int)"))
        .containsExactly("type[int]", "type[str]")
        .inOrder();
  }

  @Test
  public void testTypeOf() {
    // The negative path is not narrowed.
    assertThat(revealBothWays("(x: int | str)", "type(x) is int"))
        .containsExactly("int", "int | str")
        .inOrder();
  }

  @Test
  public void testLen() {
    assertThat(revealBothWays("(x: tuple[int] | tuple[int, str])", "len(x) == 2"))
        .containsExactly("tuple[int, str]", "tuple[int]")
        .inOrder();
  }

  @Test
  public void testIn() {
    assertThat(revealBothWays("(x: str | None)", "x in ('a', 'b')"))
        .containsExactly("Literal['a'] | Literal['b']", "str | None")
        .inOrder();
    assertThat(revealBothWays("(x: Literal['a', 'b', 'c'])", "x not in ('a', 'b')"))
        .containsExactly("Literal['c']", "Literal['a'] | Literal['b']")
        .inOrder();
  }

  @Test
  public void testTypedDictKey() {
    assertThat(revealBothWays("(x: Keyed | Plain)", "'k' in x"))
        .containsExactly("Keyed", "Plain")
        .inOrder();
  }

  @Test
  public void testCallable() {
    assertThat(revealBothWays("(x: int | Handler)", "callable(x)"))
        .containsExactly("Callable[[], None]", "int")
        .inOrder();
  }

  @Test
  public void testDiscriminant() {
    assertThat(revealBothWays("(x: Circle | Square)", "x.kind == 'circle'"))
        .containsExactly("Circle", "Square")
        .inOrder();
  }

  @Test
  public void testUserDefinedTypeGuard() {
    AnalysisFixture fixture =
        analyze(
            "def is_str(v) -> TypeIs[str]:",
            "  return True",
            "def f(x: int | str):",
            "  if is_str(x):",
            "    reveal(x)",
            "  else:",
            "    reveal(x)");
    assertThat(fixture.reveals()).containsExactly("str", "int").inOrder();
  }

  @Test
  public void testAliasedCondition() {
    AnalysisFixture fixture =
        analyze(
            "def f(x: int | None):", //
            "  ok = x is not None",
            "  if ok:",
            "    reveal(x)");
    assertThat(fixture.reveals()).containsExactly("int");
  }

  @Test
  public void testAliasIgnoredWhenReferenceIsReassigned() {
    AnalysisFixture fixture =
        analyze(
            "def f(x: int | None):",
            "  ok = x is not None",
            "  x = None",
            "  if ok:",
            "    reveal(x)");
    assertThat(fixture.reveals()).containsExactly("None");
  }

  @Test
  public void testMemberAccessChain() {
    AnalysisFixture fixture =
        analyze(
            env(),
            "def f(p: Point):", //
            "  if p.v is not None:",
            "    reveal(p.v)",
            "  reveal(p.v)");
    assertThat(fixture.reveals()).containsExactly("int", "int | None").inOrder();
  }

  @Test
  public void testAssignmentToBaseInvalidatesMember() {
    AnalysisFixture fixture =
        analyze(
            env(),
            "def f(p: Point, q: Point):",
            "  if p.v is not None:",
            "    p = q",
            "    reveal(p.v)");
    assertThat(fixture.reveals()).containsExactly("int | None");
  }

  @Test
  public void testImpossibleConditionMakesBranchUnreachable() {
    AnalysisFixture fixture =
        analyze(
            "def f(x: int):",
            "  if x is None:",
            "    y = 1",
            "def g(x):",
            "  if x is None:",
            "    y = 1");
    IfStatement declared =
        (IfStatement) fixture.statement(0, DefStatement.class).getBody().get(0);
    IfStatement undeclared =
        (IfStatement) fixture.statement(1, DefStatement.class).getBody().get(0);
    assertThat(fixture.reachabilityOf(declared.getThenBlock().get(0)))
        .isEqualTo(Reachability.UNREACHABLE_BY_ANALYSIS);
    assertThat(fixture.reachabilityOf(undeclared.getThenBlock().get(0)))
        .isEqualTo(Reachability.REACHABLE);
  }
}

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
package net.typeflow.evaluator;

import static com.google.common.truth.Truth.assertThat;
import static net.typeflow.analysis.AnalysisFixture.analyze;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.typeflow.analysis.AnalysisFixture;
import net.typeflow.analysis.Reachability;
import net.typeflow.syntax.DefStatement;
import net.typeflow.syntax.SyntaxError;
import net.typeflow.types.Types;
import net.typeflow.types.Types.ClassType;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the expression and assignment types computed by {@link SimpleTypeEvaluator}. */
@RunWith(JUnit4.class)
public final class SimpleTypeEvaluatorTest {

  private static final ClassType POINT = Types.classType("Point");
  private static final ClassType KEY_ERROR = Types.classType("KeyError");
  private static final ClassType VALUE_ERROR = Types.classType("ValueError");

  private static TypeEnvironment env() {
    return TypeEnvironment.builder()
        .addClass(POINT)
        .addClass(KEY_ERROR)
        .addClass(VALUE_ERROR)
        .addValue("make", Types.callable(ImmutableList.of(), Types.STR))
        .addValue("maybe", Types.callable(ImmutableList.of(), Types.union(Types.STR, Types.NONE)))
        .addValue("g", Types.callable(ImmutableList.of(), Types.NONE))
        .addModule("m", ImmutableMap.of("k", Types.INT))
        .build();
  }

  @Test
  public void testLiterals() {
    assertThat(
            analyze(
                    "reveal(1)", //
                    "reveal('a')",
                    "reveal(True)",
                    "reveal(None)",
                    "reveal(1.5)",
                    "reveal(-2)")
                .reveals())
        .containsExactly(
            "Literal[1]", "Literal['a']", "Literal[True]", "None", "float", "Literal[-2]")
        .inOrder();
  }

  @Test
  public void testOperators() {
    assertThat(
            analyze(
                    "reveal(1 + 2)",
                    "reveal(1 / 2)",
                    "reveal('a' + 'b')",
                    "reveal('a' * 2)",
                    "reveal(1 + 'a')",
                    "reveal(not None)",
                    "reveal(1 < 2)")
                .reveals())
        .containsExactly("int", "float", "str", "str", "Any", "Literal[True]", "bool")
        .inOrder();
  }

  @Test
  public void testDisplays() {
    assertThat(
            analyze(
                    "reveal([1, 2])", //
                    "reveal([])",
                    "reveal((1, 'a'))",
                    "reveal({'k': 1})")
                .reveals())
        .containsExactly(
            "list[int]", "list[Any]", "tuple[Literal[1], Literal['a']]", "dict[str, int]")
        .inOrder();
  }

  @Test
  public void testCalls() {
    AnalysisFixture fixture =
        analyze(
            env(),
            "x: int = 1",
            "reveal(make())",
            "reveal(Point())",
            "reveal(len([]))",
            "reveal(undefined())",
            "reveal(type(x))");
    assertThat(fixture.reveals())
        .containsExactly("str", "Point", "int", "Any", "type[int]")
        .inOrder();
  }

  @Test
  public void testAugmentedAssignment() {
    AnalysisFixture fixture =
        analyze(
            "x = 1", //
            "x += 2",
            "reveal(x)",
            "s = 'a'",
            "s += 'b'",
            "reveal(s)");
    assertThat(fixture.reveals()).containsExactly("int", "str").inOrder();
  }

  @Test
  public void testUnpacking() {
    AnalysisFixture fixture =
        analyze(
            "a, (b, c) = 1, ('x', None)", //
            "reveal(a)",
            "reveal(b)",
            "reveal(c)");
    assertThat(fixture.reveals()).containsExactly("Literal[1]", "Literal['x']", "None").inOrder();
  }

  @Test
  public void testIteration() {
    AnalysisFixture fixture =
        analyze(
            "for v in [1, 2]:", //
            "  reveal(v)",
            "for k in {'a': 1}:",
            "  reveal(k)",
            "for i, s in [(1, 'a')]:",
            "  reveal(s)");
    assertThat(fixture.reveals()).containsExactly("int", "str", "Literal['a']").inOrder();
  }

  @Test
  public void testExceptionBinding() {
    AnalysisFixture fixture =
        analyze(
            env(),
            "def f():",
            "  try:",
            "    g()",
            "  except ValueError as e:",
            "    reveal(e)",
            "  except (KeyError, ValueError) as e:",
            "    reveal(e)");
    assertThat(fixture.reveal(0).getType()).isEqualTo(VALUE_ERROR);
    assertThat(fixture.reveal(1).getType()).isEqualTo(Types.union(KEY_ERROR, VALUE_ERROR));
  }

  @Test
  public void testImports() {
    AnalysisFixture fixture =
        analyze(
            env(),
            "from m import k",
            "from m import k as j",
            "from unknown import u",
            "import m",
            "reveal(k)",
            "reveal(j)",
            "reveal(u)",
            "reveal(m)");
    assertThat(fixture.reveals()).containsExactly("int", "int", "Any", "Any").inOrder();
  }

  @Test
  public void testWildcardImport() {
    AnalysisFixture fixture =
        analyze(
            env(),
            "from m import *", //
            "reveal(k)");
    assertThat(fixture.reveals()).containsExactly("int");
  }

  @Test
  public void testWalrusInCondition() {
    AnalysisFixture fixture =
        analyze(
            env(),
            "def f():", //
            "  if (y := maybe()) is not None:",
            "    reveal(y)",
            "  reveal(y)");
    assertThat(fixture.reveal(0).getType()).isEqualTo(Types.STR);
    assertThat(fixture.reveal(1).getType()).isEqualTo(Types.union(Types.STR, Types.NONE));
  }

  @Test
  public void testFreeNames() {
    AnalysisFixture fixture =
        analyze(
            "x = 1",
            "def f():",
            "  reveal(x)",
            "x = 'a'",
            "def g():",
            "  reveal(y)",
            "y = 2");
    assertThat(fixture.reveals()).containsExactly("Literal[1]", "Literal[2]").inOrder();
  }

  @Test
  public void testDeletedNameIsUnbound() {
    AnalysisFixture fixture =
        analyze(
            "x = 1", //
            "del x",
            "reveal(x)");
    assertThat(fixture.narrowed(0).getType()).isEqualTo(Types.UNBOUND);
    assertThat(fixture.reveals()).containsExactly("Any");
  }

  @Test
  public void testFunctionTypes() {
    AnalysisFixture fixture =
        analyze(
            "def stop():",
            "  raise ValueError()",
            "def fail() -> NoReturn:",
            "  raise ValueError()",
            "def h(a: int, b):",
            "  return 1",
            "reveal(stop)",
            "reveal(fail)",
            "reveal(h)",
            "reveal(lambda a, b: a)");
    assertThat(fixture.reveals())
        .containsExactly(
            "Callable[[], Never]",
            "Callable[[], Never]",
            "Callable[[int, Any], Any]",
            "Callable[[Any, Any], Any]")
        .inOrder();
  }

  @Test
  public void testConditionalExpression() {
    AnalysisFixture fixture =
        analyze(
            "def f(x: int | None):", //
            "  reveal(x if x is not None else 0)");
    assertThat(fixture.reveals()).containsExactly("int");
  }

  @Test
  public void testAnnotationErrors() {
    AnalysisFixture fixture =
        analyze(
            "def f(x: Bogus):", //
            "  reveal(x)");
    assertThat(fixture.reveals()).containsExactly("Any");
    ImmutableList<SyntaxError> errors = fixture.getEvaluator().getAnnotationErrors();
    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).message()).isEqualTo("type 'Bogus' is not defined");
  }

  @Test
  public void testContextManagers() {
    ClassType suppress = Types.classBuilder("Suppress").setExitSwallowingExceptions(true).build();
    TypeEnvironment env =
        TypeEnvironment.builder()
            .addValue("quiet", suppress)
            .addValue("plain", Types.classType("Plain"))
            .addValue("g", Types.callable(ImmutableList.of(), Types.NONE))
            .build();
    AnalysisFixture fixture =
        analyze(
            env,
            "def f():",
            "  with quiet as q:",
            "    reveal(q)",
            "    g()",
            "    return 1",
            "  y = 1",
            "def h():",
            "  with plain:",
            "    g()",
            "    return 1",
            "  z = 1");
    assertThat(fixture.reveals()).containsExactly("Suppress");
    DefStatement f = fixture.statement(0, DefStatement.class);
    DefStatement h = fixture.statement(1, DefStatement.class);
    assertThat(fixture.reachabilityOf(f.getBody().get(1))).isEqualTo(Reachability.REACHABLE);
    assertThat(fixture.reachabilityOf(h.getBody().get(1)))
        .isEqualTo(Reachability.UNREACHABLE_BY_ANALYSIS);
  }
}

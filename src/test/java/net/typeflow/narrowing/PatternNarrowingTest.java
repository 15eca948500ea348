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
import net.typeflow.evaluator.TypeEnvironment;
import net.typeflow.types.Types;
import net.typeflow.types.Types.ClassType;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the narrowing and captures of {@code match} statements. */
@RunWith(JUnit4.class)
public final class PatternNarrowingTest {

  private static final ClassType CIRCLE =
      Types.classBuilder("Circle").addField("kind", Types.literal("circle")).build();
  private static final ClassType SQUARE =
      Types.classBuilder("Square").addField("kind", Types.literal("square")).build();

  private static TypeEnvironment shapes() {
    return TypeEnvironment.builder().addClass(CIRCLE).addClass(SQUARE).build();
  }

  @Test
  public void testLiteralPatterns() {
    AnalysisFixture fixture =
        analyze(
            "def f(x: Literal[1, 2, 3]):",
            "  match x:",
            "    case 1:",
            "      reveal(x)",
            "    case 2 | 3:",
            "      reveal(x)",
            "  reveal(x)");
    assertThat(fixture.reveals())
        .containsExactly(
            "Literal[1]", "Literal[2] | Literal[3]", "Literal[1] | Literal[2] | Literal[3]")
        .inOrder();
  }

  @Test
  public void testNoneAndWildcard() {
    AnalysisFixture fixture =
        analyze(
            "def f(x: str | None):",
            "  match x:",
            "    case None:",
            "      reveal(x)",
            "    case _:",
            "      reveal(x)");
    assertThat(fixture.reveals()).containsExactly("None", "str").inOrder();
  }

  @Test
  public void testClassPatternWithArguments() {
    AnalysisFixture fixture =
        analyze(
            "def f(x: int | str):",
            "  match x:",
            "    case int(0):",
            "      reveal(x)",
            "    case _:",
            "      reveal(x)");
    // A failed int(0) may still leave other ints.
    assertThat(fixture.reveals()).containsExactly("int", "int | str").inOrder();
  }

  @Test
  public void testClassPatternWithKeywords() {
    AnalysisFixture fixture =
        analyze(
            shapes(),
            "def f(x: Circle | Square):",
            "  match x:",
            "    case Square(kind='circle'):",
            "      reveal(x)",
            "    case Circle():",
            "      reveal(x)",
            "    case _:",
            "      reveal(x)");
    assertThat(fixture.reveals()).containsExactly("Never", "Circle", "Square").inOrder();
  }

  @Test
  public void testSequencePatterns() {
    AnalysisFixture fixture =
        analyze(
            "def f(x: tuple[int, str] | tuple[int] | list[int]):",
            "  match x:",
            "    case (a, b):",
            "      reveal(x)",
            "      reveal(b)");
    assertThat(fixture.reveal(0).getType())
        .isEqualTo(
            Types.union(
                Types.tuple(ImmutableList.of(Types.INT, Types.STR)),
                Types.list(Types.INT)));
    assertThat(fixture.reveal(1).getType()).isEqualTo(Types.union(Types.STR, Types.INT));
  }

  @Test
  public void testStarCapture() {
    AnalysisFixture fixture =
        analyze(
            "def f(x: tuple[int, str, str]):",
            "  match x:",
            "    case (first, *rest):",
            "      reveal(first)",
            "      reveal(rest)");
    assertThat(fixture.reveals()).containsExactly("int", "list[str]").inOrder();
  }

  @Test
  public void testMappingPattern() {
    AnalysisFixture fixture =
        analyze(
            "def f(x: dict[str, int] | int):",
            "  match x:",
            "    case {'k': v}:",
            "      reveal(x)",
            "      reveal(v)");
    assertThat(fixture.reveals()).containsExactly("dict[str, int]", "int").inOrder();
  }

  @Test
  public void testAsPattern() {
    AnalysisFixture fixture =
        analyze(
            "def f(x: int | str | None):",
            "  match x:",
            "    case int() | str() as y:",
            "      reveal(y)");
    assertThat(fixture.reveals()).containsExactly("int | str");
  }

  @Test
  public void testGuardFailureFallsThrough() {
    AnalysisFixture fixture =
        analyze(
            "def f(x: int | str):",
            "  match x:",
            "    case int() if x > 0:",
            "      reveal(x)",
            "    case _:",
            "      reveal(x)");
    assertThat(fixture.reveal(0).getType()).isEqualTo(Types.INT);
    assertThat(fixture.reveal(1).getType()).isEqualTo(Types.union(Types.INT, Types.STR));
  }

  @Test
  public void testTupleSubject() {
    AnalysisFixture fixture =
        analyze(
            "def f(x: int | None, y: str | None):",
            "  match (x, y):",
            "    case (int(), str()):",
            "      reveal(x)",
            "      reveal(y)");
    assertThat(fixture.reveals()).containsExactly("int", "str").inOrder();
  }

  @Test
  public void testDiscriminatingSubject() {
    AnalysisFixture fixture =
        analyze(
            shapes(),
            "def f(s: Circle | Square):",
            "  match s.kind:",
            "    case 'circle':",
            "      reveal(s)",
            "    case _:",
            "      reveal(s)");
    assertThat(fixture.reveals()).containsExactly("Circle", "Square").inOrder();
  }
}

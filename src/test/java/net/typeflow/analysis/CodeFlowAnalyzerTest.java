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
package net.typeflow.analysis;

import static com.google.common.truth.Truth.assertThat;
import static net.typeflow.analysis.AnalysisFixture.analyze;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.Locale;
import net.typeflow.evaluator.SimpleTypeEvaluator;
import net.typeflow.evaluator.TypeEnvironment;
import net.typeflow.flow.ExhaustedMatchNode;
import net.typeflow.flow.FlowGraph;
import net.typeflow.flow.FlowNode;
import net.typeflow.syntax.DefStatement;
import net.typeflow.syntax.IfStatement;
import net.typeflow.syntax.ParserInput;
import net.typeflow.syntax.SourceFile;
import net.typeflow.syntax.Statement;
import net.typeflow.types.StaticType;
import net.typeflow.types.Types;
import net.typeflow.types.Types.TypeVariableType;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of narrowing and reachability queries answered by {@link CodeFlowAnalyzer}. */
@RunWith(JUnit4.class)
public final class CodeFlowAnalyzerTest {

  /** Returns the i-th statement of the body of the function defined by the first statement. */
  private static Statement bodyStatement(AnalysisFixture fixture, int i) {
    return fixture.statement(0, DefStatement.class).getBody().get(i);
  }

  private static TypeEnvironment withValue(String name, StaticType type) {
    return TypeEnvironment.builder().addValue(name, type).build();
  }

  @Test
  public void testNoneCheckNarrowsInsideBranch() {
    AnalysisFixture fixture =
        analyze(
            "def f(x: int | None):", //
            "  if x is not None:",
            "    reveal(x)",
            "  reveal(x)");
    assertThat(fixture.reveals()).containsExactly("int", "int | None").inOrder();
  }

  @Test
  public void testAssignmentNarrowsDeclaredType() {
    AnalysisFixture fixture =
        analyze(
            "def f(x: int | str):", //
            "  x = 3",
            "  y = 3",
            "  reveal(x)",
            "  reveal(y)");
    assertThat(fixture.reveals()).containsExactly("int", "Literal[3]").inOrder();
  }

  @Test
  public void testVariableAssignedInLoopMayBeUnbound() {
    AnalysisFixture fixture =
        analyze(
            withValue("compute", Types.callable(ImmutableList.of(), Types.STR)),
            "def f(c: bool):",
            "  while c:",
            "    x = compute()",
            "  reveal(x)");
    assertThat(fixture.narrowed(0).getType()).isEqualTo(Types.union(Types.STR, Types.UNBOUND));
    assertThat(fixture.reveals()).containsExactly("str");
  }

  @Test
  public void testLoopReachesFixedPoint() {
    AnalysisFixture fixture =
        analyze(
            "def f(n: int):", //
            "  x = None",
            "  while n:",
            "    reveal(x)",
            "    x = 1",
            "  reveal(x)");
    FlowNodeTypeResult inside = fixture.reveal(0);
    FlowNodeTypeResult after = fixture.reveal(1);
    assertThat(inside.isIncomplete()).isFalse();
    assertThat(inside.getType()).isEqualTo(Types.union(Types.NONE, Types.literal(1)));
    assertThat(after.getType()).isEqualTo(Types.union(Types.NONE, Types.literal(1)));
  }

  @Test
  public void testLoopConvergenceCeilingGivesIncompleteResult() {
    String[] lines = {
      "def f(n: int):", //
      "  x = 0",
      "  while n:",
      "    x = x + 1",
      "  reveal(x)",
    };
    assertThat(analyze(lines).reveals()).containsExactly("int");

    FlowOptions options = FlowOptions.builder().maxLoopConvergenceAttempts(1).build();
    AnalysisFixture limited =
        analyze(TypeEnvironment.builtins(), options, CancellationToken.NONE, lines);
    assertThat(limited.reveals()).containsExactly("int (incomplete)");
  }

  @Test
  public void testNarrowingInsideWhileBody() {
    AnalysisFixture fixture =
        analyze(
            "def f(n: int, x: int | None):", //
            "  while n:",
            "    if x is not None:",
            "      reveal(x)");
    FlowNodeTypeResult inside = fixture.reveal(0);
    assertThat(inside.getType()).isEqualTo(Types.INT);
    assertThat(inside.isIncomplete()).isFalse();
  }

  @Test
  public void testNarrowingInsideForBody() {
    AnalysisFixture fixture =
        analyze(
            "def f(xs: list[int], x: int | None):", //
            "  for i in xs:",
            "    if x is not None:",
            "      reveal(x)");
    FlowNodeTypeResult inside = fixture.reveal(0);
    assertThat(inside.getType()).isEqualTo(Types.INT);
    assertThat(inside.isIncomplete()).isFalse();
  }

  @Test
  public void testNarrowingAfterContinue() {
    AnalysisFixture fixture =
        analyze(
            "def f(n: int, x: int | None):", //
            "  while n:",
            "    if x is None:",
            "      continue",
            "    reveal(x)",
            "  reveal(x)");
    FlowNodeTypeResult inside = fixture.reveal(0);
    assertThat(inside.getType()).isEqualTo(Types.INT);
    assertThat(inside.isIncomplete()).isFalse();
    FlowNodeTypeResult after = fixture.reveal(1);
    assertThat(after.getType()).isEqualTo(Types.union(Types.INT, Types.NONE));
    assertThat(after.isIncomplete()).isFalse();
  }

  @Test
  public void testNarrowingCarriedOutByBreak() {
    AnalysisFixture fixture =
        analyze(
            "def f(x: int | None):", //
            "  while True:",
            "    if x is not None:",
            "      break",
            "  reveal(x)");
    FlowNodeTypeResult after = fixture.reveal(0);
    assertThat(after.getType()).isEqualTo(Types.INT);
    assertThat(after.isIncomplete()).isFalse();
  }

  @Test
  public void testNarrowingInsideFinallyInLoop() {
    AnalysisFixture fixture =
        analyze(
            withValue("g", Types.callable(ImmutableList.of(), Types.NONE)),
            "def f(n: int, x: int | None):",
            "  while n:",
            "    if x is not None:",
            "      try:",
            "        g()",
            "      finally:",
            "        reveal(x)");
    FlowNodeTypeResult inFinally = fixture.reveal(0);
    assertThat(inFinally.getType()).isEqualTo(Types.INT);
    assertThat(inFinally.isIncomplete()).isFalse();
  }

  @Test
  public void testNarrowingInsideLoopThatAssigns() {
    AnalysisFixture fixture =
        analyze(
            "def f(n: int):", //
            "  x = None",
            "  while n:",
            "    if x is not None:",
            "      reveal(x)",
            "    x = 1");
    FlowNodeTypeResult inside = fixture.reveal(0);
    assertThat(inside.getType()).isEqualTo(Types.literal(1));
    assertThat(inside.isIncomplete()).isFalse();
  }

  @Test
  public void testMatchNarrowsSubject() {
    AnalysisFixture fixture =
        analyze(
            "def f(x: int | str):",
            "  match x:",
            "    case int():",
            "      reveal(x)",
            "    case str():",
            "      reveal(x)",
            "  reveal(x)");
    assertThat(fixture.reveals()).containsExactly("int", "str", "int | str").inOrder();

    FlowNode exhausted = null;
    for (FlowNode node : fixture.getGraph().getNodes()) {
      if (node instanceof ExhaustedMatchNode) {
        exhausted = node;
      }
    }
    assertThat(exhausted).isNotNull();
    assertThat(fixture.getAnalyzer().reachable(exhausted))
        .isEqualTo(Reachability.UNREACHABLE_BY_ANALYSIS);
  }

  @Test
  public void testNonExhaustiveMatchKeepsRemainder() {
    AnalysisFixture fixture =
        analyze(
            "def f(x: int | str | None):",
            "  match x:",
            "    case int():",
            "      reveal(x)",
            "    case str():",
            "      reveal(x)",
            "  reveal(x)");
    assertThat(fixture.reveal(2).getType())
        .isEqualTo(Types.union(Types.INT, Types.STR, Types.NONE));
  }

  @Test
  public void testCodeAfterExhaustiveMatchOfReturningCasesIsUnreachable() {
    AnalysisFixture fixture =
        analyze(
            "def f(x: int | str):",
            "  match x:",
            "    case int():",
            "      return 1",
            "    case str():",
            "      return 2",
            "  y = 3");
    assertThat(fixture.reachabilityOf(bodyStatement(fixture, 1)))
        .isEqualTo(Reachability.UNREACHABLE_BY_ANALYSIS);
    assertThat(fixture.getAnalyzer().isAfterNodeReachable(bodyStatement(fixture, 0))).isFalse();
    assertThat(fixture.getAnalyzer().isAfterNodeReachable(fixture.statement(0, Statement.class)))
        .isTrue();
  }

  @Test
  public void testRaiseAfterFailedIsinstance() {
    AnalysisFixture fixture =
        analyze(
            "def f(x: int | str):",
            "  if not isinstance(x, int):",
            "    raise TypeError()",
            "  reveal(x)");
    assertThat(fixture.reveals()).containsExactly("int");
  }

  @Test
  public void testCallsThatNeverReturnEndPaths() {
    TypeEnvironment env =
        TypeEnvironment.builder()
            .addValue("fail", Types.callable(ImmutableList.of(), Types.NEVER))
            .build();
    AnalysisFixture fixture =
        analyze(
            env,
            "def stop():",
            "  raise ValueError()",
            "def f(x: int | None, y: int | None):",
            "  if x is None:",
            "    fail()",
            "  if y is None:",
            "    stop()",
            "    z = 1",
            "  reveal(x)",
            "  reveal(y)");
    assertThat(fixture.reveals()).containsExactly("int", "int").inOrder();

    DefStatement f = fixture.statement(1, DefStatement.class);
    Statement secondIf = f.getBody().get(1);
    Statement assignment =
        ((IfStatement) secondIf).getThenBlock().get(1);
    assertThat(fixture.reachabilityOf(assignment)).isEqualTo(Reachability.UNREACHABLE_BY_ANALYSIS);
    assertThat(fixture.getAnalyzer().isAfterNodeReachable(fixture.statement(0, Statement.class)))
        .isFalse();
  }

  @Test
  public void testIgnoreNoReturn() {
    AnalysisFixture fixture =
        analyze(
            withValue("fail", Types.callable(ImmutableList.of(), Types.NEVER)),
            "fail()", //
            "y = 1");
    FlowNode node = fixture.getGraph().requireFlowNode(fixture.statement(1, Statement.class));
    CodeFlowAnalyzer analyzer = fixture.getAnalyzer();
    assertThat(analyzer.reachable(node)).isEqualTo(Reachability.UNREACHABLE_BY_ANALYSIS);
    assertThat(analyzer.reachable(node, null, true)).isEqualTo(Reachability.REACHABLE);
  }

  @Test
  public void testReachabilityFromSource() {
    AnalysisFixture fixture =
        analyze(
            "x = 1", //
            "y = 2");
    FlowGraph graph = fixture.getGraph();
    FlowNode start = graph.getModuleScope().getStart();
    FlowNode beforeY = graph.requireFlowNode(fixture.statement(1, Statement.class));
    CodeFlowAnalyzer analyzer = fixture.getAnalyzer();
    assertThat(analyzer.reachable(beforeY, start, false)).isEqualTo(Reachability.REACHABLE);
    assertThat(analyzer.reachable(start, beforeY, false))
        .isEqualTo(Reachability.UNREACHABLE_STRUCTURAL);
  }

  @Test
  public void testStaticallyFalseBranch() {
    AnalysisFixture fixture =
        analyze(
            "if False:", //
            "  x = 1",
            "def f():",
            "  return",
            "  y = 2");
    Statement inBranch =
        ((IfStatement) fixture.statement(0, Statement.class))
            .getThenBlock()
            .get(0);
    Statement afterReturn = fixture.statement(1, DefStatement.class).getBody().get(1);
    assertThat(fixture.reachabilityOf(inBranch))
        .isEqualTo(Reachability.UNREACHABLE_STATIC_CONDITION);
    assertThat(fixture.reachabilityOf(afterReturn))
        .isEqualTo(Reachability.UNREACHABLE_STRUCTURAL);
  }

  @Test
  public void testFinallySeesEveryExitOfTry() {
    AnalysisFixture fixture =
        analyze(
            withValue("g", Types.callable(ImmutableList.of(), Types.NONE)),
            "def f():",
            "  try:",
            "    x = 1",
            "    g()",
            "    x = 'a'",
            "  finally:",
            "    reveal(x)",
            "  reveal(x)");
    assertThat(fixture.reveal(0).getType())
        .isEqualTo(Types.union(Types.literal("a"), Types.literal(1)));
    assertThat(fixture.narrowed(0).getType())
        .isEqualTo(Types.union(Types.literal("a"), Types.literal(1), Types.UNBOUND));
    assertThat(fixture.reveal(1).getType()).isEqualTo(Types.literal("a"));
  }

  @Test
  public void testResultsAreDeterministic() {
    AnalysisFixture fixture =
        analyze(
            "def f(x: int | str | None, n: int):",
            "  while n:",
            "    if isinstance(x, str):",
            "      x = None",
            "  reveal(x)");
    FlowNodeTypeResult first = fixture.reveal(0);
    assertThat(fixture.reveal(0)).isEqualTo(first);
    AnalysisFixture again =
        analyze(
            "def f(x: int | str | None, n: int):",
            "  while n:",
            "    if isinstance(x, str):",
            "      x = None",
            "  reveal(x)");
    assertThat(again.reveal(0)).isEqualTo(first);
  }

  @Test
  public void testComplexityCeilingAbortsNarrowing() {
    FlowOptions options = FlowOptions.builder().maxCodeComplexity(1).build();
    AnalysisFixture fixture =
        analyze(
            TypeEnvironment.builtins(),
            options,
            CancellationToken.NONE,
            "def f(x: int | None):",
            "  if x is None:",
            "    x = 1",
            "  reveal(x)");
    assertThat(fixture.reveal(0).isAborted()).isTrue();
  }

  @Test
  public void testVisitBudgetAbortsNarrowing() {
    FlowOptions options = FlowOptions.builder().maxNodeVisits(3).build();
    AnalysisFixture fixture =
        analyze(
            TypeEnvironment.builtins(),
            options,
            CancellationToken.NONE,
            "def f(n: int):",
            "  x = 0",
            "  while n:",
            "    x = x + 1",
            "  reveal(x)");
    assertThat(fixture.reveal(0).isAborted()).isTrue();
  }

  @Test
  public void testCancellationAbortsNarrowing() {
    CancellationToken token = new CancellationToken();
    token.cancel();
    AnalysisFixture fixture =
        analyze(
            TypeEnvironment.builtins(),
            FlowOptions.DEFAULT,
            token,
            "def f(x: int | None):",
            "  if x is None:",
            "    x = 1",
            "  reveal(x)");
    assertThat(fixture.reveal(0).isAborted()).isTrue();
  }

  @Test
  public void testAbortedReachabilityAnswersReachable() {
    CancellationToken token = new CancellationToken();
    token.cancel();
    AnalysisFixture fixture =
        analyze(
            TypeEnvironment.builtins(),
            FlowOptions.DEFAULT,
            token,
            "def f():",
            "  return",
            "  y = 2");
    assertThat(fixture.reachabilityOf(bodyStatement(fixture, 1)))
        .isEqualTo(Reachability.REACHABLE);
  }

  @Test
  public void testPrintGraph() {
    AnalysisFixture fixture =
        analyze(
            "x = None", //
            "if x is None:",
            "  x = 1",
            "reveal(x)");
    FlowGraph graph = fixture.getGraph();
    assertThat(fixture.getAnalyzer().printGraph(graph.getFlowNode(fixture.revealed(0))))
        .isEqualTo(
            "#7 branch_label <- #10, #11\n"
                + "#10 assignment(x) value <- #5\n"
                + "#5 branch_label <- #8\n"
                + "#8 condition(true) (x is None) <- #4\n"
                + "#4 assignment(x) value <- #2\n"
                + "#2 start\n"
                + "#11 condition(false_never) (x is None) <- #6\n"
                + "#6 branch_label <- #9\n"
                + "#9 condition(false) (x is None) <- #4\n");
  }

  @Test
  public void testPrintGraphIgnoresDefaultLocale() {
    AnalysisFixture fixture =
        analyze(
            "x = None", //
            "if x is None:",
            "  x = 1",
            "reveal(x)");
    FlowNode revealed = fixture.getGraph().getFlowNode(fixture.revealed(0));
    String expected = fixture.getAnalyzer().printGraph(revealed);
    Locale saved = Locale.getDefault();
    Locale.setDefault(new Locale("tr", "TR"));
    try {
      assertThat(fixture.getAnalyzer().printGraph(revealed)).isEqualTo(expected);
      assertThat(fixture.getAnalyzer().printGraph(revealed)).contains("condition(true)");
    } finally {
      Locale.setDefault(saved);
    }
  }

  @Test
  public void testSessionUpdateDropsResults() {
    AnalysisFixture fixture =
        analyze(
            "x = 1", //
            "reveal(x)");
    AnalysisSession session = fixture.getSession();
    FlowGraph before = session.getGraph();
    assertThat(session.getGeneration()).isEqualTo(0);

    session.update(SourceFile.parse(ParserInput.fromLines("x = 'a'")));

    assertThat(session.getGeneration()).isEqualTo(1);
    assertThat(session.getGraph()).isNotSameInstanceAs(before);
    assertThat(session.getAnalyzer().getOptions()).isSameInstanceAs(session.getOptions());
  }

  @Test
  public void testSessionRejectsFileWithSyntaxErrors() {
    SourceFile file = SourceFile.parse(ParserInput.fromLines("break"));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            AnalysisSession.create(
                file, SimpleTypeEvaluator.factory(TypeEnvironment.builtins())));
  }

  @Test
  public void testNarrowConstrainedTypeVariable() {
    TypeVariableType t = Types.typeVariable("T", ImmutableList.of(Types.INT, Types.STR));
    AnalysisFixture fixture =
        analyze(
            TypeEnvironment.builder().addTypeVariable(t).build(),
            "def f(x: T):",
            "  if isinstance(x, int):",
            "    reveal(x)");
    FlowGraph graph = fixture.getGraph();
    CodeFlowAnalyzer analyzer = fixture.getAnalyzer();
    assertThat(analyzer.narrowConstrainedTypeVariable(graph.getFlowNode(fixture.revealed(0)), t))
        .containsExactly(Types.INT);
    FlowNode start = graph.getScope(fixture.statement(0, DefStatement.class)).getStart();
    assertThat(analyzer.narrowConstrainedTypeVariable(start, t))
        .containsExactly(Types.INT, Types.STR);
  }
}

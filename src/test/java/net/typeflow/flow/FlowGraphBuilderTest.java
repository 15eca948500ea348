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
package net.typeflow.flow;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import net.typeflow.flow.AssignmentNode.Origin;
import net.typeflow.flow.ConditionNode.Polarity;
import net.typeflow.syntax.AssignmentStatement;
import net.typeflow.syntax.CallExpression;
import net.typeflow.syntax.DefStatement;
import net.typeflow.syntax.ExpressionStatement;
import net.typeflow.syntax.ForStatement;
import net.typeflow.syntax.IfStatement;
import net.typeflow.syntax.LambdaExpression;
import net.typeflow.syntax.ListExpression;
import net.typeflow.syntax.MatchStatement;
import net.typeflow.syntax.ParserInput;
import net.typeflow.syntax.SourceFile;
import net.typeflow.syntax.Statement;
import net.typeflow.syntax.TryStatement;
import net.typeflow.syntax.WhileStatement;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the graphs built by {@link FlowGraphBuilder}. */
@RunWith(JUnit4.class)
public final class FlowGraphBuilderTest {

  private SourceFile file;
  private FlowGraph graph;

  /** Parses the lines and builds their graph. */
  private FlowGraph build(String... lines) {
    file = SourceFile.parse(ParserInput.fromLines(lines));
    assertThat(file.errors()).isEmpty();
    graph = FlowGraphBuilder.build(file);
    return graph;
  }

  /** Returns the i-th top-level statement of the last built file. */
  private <T extends Statement> T statement(int i, Class<T> clazz) {
    return clazz.cast(file.getStatements().get(i));
  }

  private static String buildError(String... lines) {
    SourceFile file = SourceFile.parse(ParserInput.fromLines(lines));
    return assertThrows(IllegalArgumentException.class, () -> FlowGraphBuilder.build(file))
        .getMessage();
  }

  @Test
  public void testScopes() {
    build(
        "x = 1", //
        "def f(a):",
        "  return a",
        "g = lambda y: y");
    FlowScope module = graph.getModuleScope();
    assertThat(module.getKind()).isEqualTo(FlowScope.Kind.MODULE);
    assertThat(module.getParent()).isNull();
    assertThat(module.isLocal("x")).isTrue();
    assertThat(module.isLocal("f")).isTrue();
    assertThat(module.isLocal("a")).isFalse();

    DefStatement def = statement(1, DefStatement.class);
    FlowScope function = graph.getScope(def);
    assertThat(function.getKind()).isEqualTo(FlowScope.Kind.FUNCTION);
    assertThat(function.getParent()).isSameInstanceAs(module);
    assertThat(function.isLocal("a")).isTrue();
    assertThat(graph.getScopeOf(function.getStart())).isSameInstanceAs(function);

    LambdaExpression lambda = (LambdaExpression) statement(2, AssignmentStatement.class).getRHS();
    FlowScope lambdaScope = graph.getScope(lambda);
    assertThat(lambdaScope.getKind()).isEqualTo(FlowScope.Kind.LAMBDA);
    assertThat(lambdaScope.getParent()).isSameInstanceAs(module);
    assertThat(graph.getEnclosingScope(lambda)).isSameInstanceAs(module);
  }

  @Test
  public void testNodesAreNumberedDensely() {
    build("x = 1", "if x:", "  y = x");
    for (int i = 0; i < graph.getNodeCount(); i++) {
      assertThat(graph.getNode(i).getId()).isEqualTo(i);
    }
    // The shared unreachable nodes belong to no scope.
    assertThat(graph.getNode(0)).isInstanceOf(UnreachableNode.class);
    assertThat(graph.getScopeOf(graph.getNode(0))).isNull();
    assertThat(graph.getModuleScope().getComplexity()).isGreaterThan(0);
  }

  @Test
  public void testAssignment() {
    build("x = 1");
    AssignmentStatement stmt = statement(0, AssignmentStatement.class);
    assertThat(graph.getFlowNode(stmt)).isSameInstanceAs(graph.getModuleScope().getStart());

    AssignmentNode assign = (AssignmentNode) graph.requireFlowNode(stmt.getLHS());
    assertThat(assign.getOrigin()).isEqualTo(Origin.VALUE);
    assertThat(assign.getKey()).isEqualTo(ReferenceKey.forName("x"));
    assertThat(assign.getSource()).isSameInstanceAs(stmt.getRHS());
    assertThat(assign.isUnbind()).isFalse();
    assertThat(assign.getAntecedent()).isSameInstanceAs(graph.getModuleScope().getStart());
    assertThat(graph.getAfterFlowNode(stmt)).isSameInstanceAs(assign);
  }

  @Test
  public void testIfJoin() {
    build(
        "x = None", //
        "if x is None:",
        "  y = 1",
        "else:",
        "  y = 2",
        "z = x");
    AssignmentNode assignX =
        (AssignmentNode) graph.getFlowNode(statement(0, AssignmentStatement.class).getLHS());
    BranchLabel join =
        (BranchLabel) graph.getFlowNode(statement(2, AssignmentStatement.class).getRHS());
    assertThat(join.getPreBranchAntecedent()).isSameInstanceAs(assignX);
    assertThat(join.getAntecedents()).hasSize(2);
    assertThat(join.isUnaffected(ReferenceKey.forName("x"))).isFalse();
    assertThat(join.isUnaffected(ReferenceKey.forName("y"))).isFalse();
    assertThat(join.isUnaffected(ReferenceKey.forName("z"))).isTrue();

    AssignmentNode thenY = (AssignmentNode) join.getAntecedents().get(0);
    assertThat(thenY.getKey()).isEqualTo(ReferenceKey.forName("y"));
    LabelNode thenLabel = (LabelNode) thenY.getAntecedent();
    ConditionNode isNone = (ConditionNode) thenLabel.getAntecedents().get(0);
    assertThat(isNone.getPolarity()).isEqualTo(Polarity.TRUE);
    assertThat(isNone.getReferences()).containsKey(ReferenceKey.forName("x"));
    assertThat(isNone.getTest())
        .isSameInstanceAs(statement(1, IfStatement.class).getCondition());
    assertThat(isNone.getAntecedent()).isSameInstanceAs(assignX);

    AssignmentNode elseY = (AssignmentNode) join.getAntecedents().get(1);
    LabelNode elseLabel = (LabelNode) elseY.getAntecedent();
    ConditionNode isNotNone = (ConditionNode) elseLabel.getAntecedents().get(0);
    assertThat(isNotNone.getPolarity()).isEqualTo(Polarity.FALSE);
  }

  @Test
  public void testIfWithoutElseAddsNeverCondition() {
    build(
        "x = None", //
        "if x:",
        "  pass",
        "y = x");
    BranchLabel join =
        (BranchLabel) graph.getFlowNode(statement(2, AssignmentStatement.class).getRHS());
    ConditionNode never = (ConditionNode) join.getAntecedents().get(1);
    assertThat(never.getPolarity()).isEqualTo(Polarity.FALSE_NEVER);
    assertThat(never.getPolarity().isNeverVariant()).isTrue();
    LabelNode elseLabel = (LabelNode) never.getAntecedent();
    ConditionNode negative = (ConditionNode) elseLabel.getAntecedents().get(0);
    assertThat(negative.getPolarity()).isEqualTo(Polarity.FALSE);
  }

  @Test
  public void testStaticCondition() {
    build(
        "if False:", //
        "  x = 1",
        "y = 2");
    IfStatement ifStmt = statement(0, IfStatement.class);
    FlowNode dead = graph.getFlowNode(ifStmt.getThenBlock().get(0));
    assertThat(dead).isInstanceOf(UnreachableNode.class);
    assertThat(((UnreachableNode) dead).getReason())
        .isEqualTo(UnreachableNode.Reason.STATIC_CONDITION);
    // No assignment node is created on a dead path.
    assertThat(graph.getFlowNode(((AssignmentStatement) ifStmt.getThenBlock().get(0)).getLHS()))
        .isSameInstanceAs(dead);
    assertThat(graph.getFlowNode(statement(1, AssignmentStatement.class)))
        .isNotInstanceOf(UnreachableNode.class);
  }

  @Test
  public void testCodeAfterReturnIsUnreachable() {
    build(
        "def f():", //
        "  return 1",
        "  x = 2");
    DefStatement def = statement(0, DefStatement.class);
    FlowNode dead = graph.getFlowNode(def.getBody().get(1));
    assertThat(((UnreachableNode) dead).getReason())
        .isEqualTo(UnreachableNode.Reason.STRUCTURAL);
    assertThat(graph.getScope(def).getReturnNode()).isInstanceOf(BranchLabel.class);
  }

  @Test
  public void testFunctionThatAlwaysRaisesHasUnreachableReturn() {
    build(
        "def f():", //
        "  raise ValueError()");
    FlowScope scope = graph.getScope(statement(0, DefStatement.class));
    assertThat(scope.getReturnNode()).isInstanceOf(UnreachableNode.class);
  }

  @Test
  public void testMalformedTrees() {
    assertThat(buildError("break")).contains("'break' outside loop");
    assertThat(buildError("continue")).contains("'continue' outside loop");
    assertThat(buildError("return 1")).contains("'return' outside function");
    assertThat(buildError("f() = 1")).contains("cannot assign to call expression");
    assertThat(buildError("x = *")).contains("syntax errors");
  }

  @Test
  public void testWhileLoop() {
    build(
        "n = 10", //
        "while n:",
        "  n = n - 1");
    AssignmentNode init =
        (AssignmentNode) graph.getFlowNode(statement(0, AssignmentStatement.class).getLHS());
    WhileStatement loop = statement(1, WhileStatement.class);
    LoopLabel head = (LoopLabel) graph.getFlowNode(loop.getCondition());
    assertThat(head.getEntry()).isSameInstanceAs(init);
    assertThat(head.getAntecedents()).hasSize(2);
    assertThat(head.getAntecedents().get(0)).isSameInstanceAs(init);
    assertThat(head.isUnaffected(ReferenceKey.forName("n"))).isFalse();
    assertThat(head.isUnaffected(ReferenceKey.forName("m"))).isTrue();
  }

  @Test
  public void testForLoop() {
    build(
        "items = [1]", //
        "for k in items:",
        "  pass");
    ForStatement loop = statement(1, ForStatement.class);
    AssignmentNode k = (AssignmentNode) graph.getFlowNode(loop.getTarget());
    assertThat(k.getOrigin()).isEqualTo(Origin.ITERATION);
    assertThat(k.getSource()).isSameInstanceAs(loop.getIterable());
    LoopLabel head = (LoopLabel) k.getAntecedent();
    assertThat(head.getAntecedents()).containsExactly(head.getEntry(), k).inOrder();
  }

  @Test
  public void testUnpacking() {
    build("a, (b, c) = t");
    ListExpression targets = (ListExpression) statement(0, AssignmentStatement.class).getLHS();
    AssignmentNode a = (AssignmentNode) graph.getFlowNode(targets.getElements().get(0));
    assertThat(a.getOrigin()).isEqualTo(Origin.UNPACK);
    assertThat(a.getUnpackPath()).containsExactly(0);
    ListExpression inner = (ListExpression) targets.getElements().get(1);
    AssignmentNode c = (AssignmentNode) graph.getFlowNode(inner.getElements().get(1));
    assertThat(c.getUnpackPath()).containsExactly(1, 1).inOrder();
  }

  @Test
  public void testTryFinally() {
    build(
        "try:", //
        "  x = 1",
        "finally:",
        "  y = 2",
        "z = 3");
    PostFinallyNode post =
        (PostFinallyNode) graph.getFlowNode(statement(1, AssignmentStatement.class));
    assertThat(post.getGate().kind()).isEqualTo(FlowNode.Kind.PRE_FINALLY_GATE);
    AssignmentNode y = (AssignmentNode) post.getAntecedent();
    assertThat(y.getKey()).isEqualTo(ReferenceKey.forName("y"));
    LabelNode preFinally = (LabelNode) y.getAntecedent();
    assertThat(preFinally.getAntecedents()).contains(post.getGate());
  }

  @Test
  public void testExceptName() {
    build(
        "try:", //
        "  pass",
        "except ValueError as e:",
        "  pass");
    TryStatement.ExceptHandler handler = statement(0, TryStatement.class).getHandlers().get(0);
    AssignmentNode deletion = (AssignmentNode) graph.getFlowNode(handler.getName());
    assertThat(deletion.getOrigin()).isEqualTo(Origin.DELETION);
    assertThat(deletion.isUnbind()).isTrue();
    AssignmentNode binding = (AssignmentNode) deletion.getAntecedent();
    assertThat(binding.getOrigin()).isEqualTo(Origin.EXCEPTION);
    assertThat(binding.getSource()).isSameInstanceAs(handler);
    assertThat(graph.getModuleScope().getBindingCount("e")).isEqualTo(2);
  }

  @Test
  public void testMatch() {
    build(
        "match v:", //
        "  case 1:",
        "    pass",
        "  case 2:",
        "    pass",
        "w = 0");
    MatchStatement match = statement(0, MatchStatement.class);
    BranchLabel join = (BranchLabel) graph.getFlowNode(statement(1, AssignmentStatement.class));
    ImmutableList<FlowNode> paths = join.getAntecedents();
    assertThat(paths).hasSize(3);

    PatternNode first = (PatternNode) paths.get(0);
    assertThat(first.isPositive()).isTrue();
    assertThat(first.getCase()).isSameInstanceAs(match.getCases().get(0));
    assertThat(first.getSubject()).isSameInstanceAs(match.getSubject());
    assertThat(first.getReferences()).containsKey(ReferenceKey.forName("v"));

    ExhaustedMatchNode exhausted = (ExhaustedMatchNode) paths.get(2);
    PatternNode lastFailed = (PatternNode) exhausted.getAntecedent();
    assertThat(lastFailed.isPositive()).isFalse();
    assertThat(lastFailed.getCase()).isSameInstanceAs(match.getCases().get(1));
  }

  @Test
  public void testIrrefutableCaseEndsMatch() {
    build(
        "match v:", //
        "  case 1:",
        "    pass",
        "  case _:",
        "    pass");
    for (FlowNode node : graph.getNodes()) {
      assertThat(node.kind()).isNotEqualTo(FlowNode.Kind.EXHAUSTED_MATCH);
    }
  }

  @Test
  public void testWildcardImport() {
    build("x = 1");
    assertThat(graph.getModuleScope().hasWildcardImport()).isFalse();
    assertThat(graph.getModuleScope().isTracked(ReferenceKey.forName("x"))).isTrue();
    assertThat(graph.getModuleScope().isTracked(ReferenceKey.forName("q"))).isFalse();

    build("from m import *");
    assertThat(graph.getModuleScope().hasWildcardImport()).isTrue();
    assertThat(graph.getModuleScope().isTracked(ReferenceKey.forName("q"))).isTrue();
  }

  @Test
  public void testAliases() {
    build(
        "ok = x is not None", //
        "flag = x is None",
        "flag = True");
    FlowScope module = graph.getModuleScope();
    assertThat(module.getAlias("ok"))
        .isSameInstanceAs(statement(0, AssignmentStatement.class).getRHS());
    // Bound twice.
    assertThat(module.getAlias("flag")).isNull();
  }

  @Test
  public void testBindingsAndAnnotations() {
    build(
        "x: int = 1", //
        "x = 2",
        "def f(a: str, b):",
        "  pass");
    FlowScope module = graph.getModuleScope();
    assertThat(module.getBindingCount("x")).isEqualTo(2);
    assertThat(module.getAnnotation("x").toString()).isEqualTo("int");
    assertThat(
            ((AssignmentNode) graph.getFlowNode(statement(0, AssignmentStatement.class).getLHS()))
                .getOrigin())
        .isEqualTo(Origin.ANNOTATED);

    FlowScope function = graph.getScope(statement(2, DefStatement.class));
    assertThat(function.getAnnotation("a").toString()).isEqualTo("str");
    assertThat(function.getAnnotation("b")).isNull();
    assertThat(function.getBindingCount("a")).isEqualTo(1);
    assertThat(module.getBindingCount("f")).isEqualTo(1);
  }

  @Test
  public void testVariableAnnotation() {
    build("x: int");
    FlowNode node = graph.getFlowNode(statement(0, AssignmentStatement.class).getLHS());
    assertThat(node).isInstanceOf(VariableAnnotationNode.class);
    assertThat(graph.getModuleScope().getAnnotation("x").toString()).isEqualTo("int");
  }

  @Test
  public void testCall() {
    build(
        "f(x)", //
        "y = x");
    CallExpression call = (CallExpression) statement(0, ExpressionStatement.class).getExpression();
    assertThat(graph.getFlowNode(call.getPositionalArgument(0)))
        .isSameInstanceAs(graph.getModuleScope().getStart());
    CallNode after = (CallNode) graph.getFlowNode(statement(1, AssignmentStatement.class).getRHS());
    assertThat(after.getCall()).isSameInstanceAs(call);
    assertThat(graph.getAfterFlowNode(call)).isSameInstanceAs(after);
  }

  @Test
  public void testCallInsideTryReachesHandler() {
    build(
        "try:", //
        "  f()",
        "except E:",
        "  pass");
    TryStatement stmt = statement(0, TryStatement.class);
    ExpressionStatement body = (ExpressionStatement) stmt.getBody().get(0);
    CallExpression call = (CallExpression) body.getExpression();
    CallNode callNode = (CallNode) graph.getAfterFlowNode(call);
    LabelNode handler = (LabelNode) graph.getFlowNode(stmt.getHandlers().get(0));
    // The state before the call, and the state at the start of the body.
    assertThat(handler.getAntecedents()).contains(callNode.getAntecedent());
    assertThat(handler.getAntecedents()).doesNotContain(callNode);
  }
}

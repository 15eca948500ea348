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
package net.typeflow.syntax;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of parsing behavior of the {@link Parser}. */
@RunWith(JUnit4.class)
public final class ParserTest {

  /** Parses an expression and returns its printed form. */
  private static String expr(String... lines) throws SyntaxError.Exception {
    return Expression.parse(ParserInput.fromLines(lines)).toString();
  }

  /** Parses a file, asserting that it has no errors. */
  private static SourceFile parseFile(String... lines) {
    SourceFile file = SourceFile.parse(ParserInput.fromLines(lines));
    assertThat(file.errors()).isEmpty();
    return file;
  }

  /** Parses a file that is expected to have errors and returns the first message. */
  private static String firstError(String... lines) {
    SourceFile file = SourceFile.parse(ParserInput.fromLines(lines));
    assertThat(file.ok()).isFalse();
    return file.errors().get(0).message();
  }

  /** Returns the first statement of a parsed file. */
  private static <T extends Statement> T getFirstStatement(Class<T> clazz, String... lines) {
    SourceFile file = parseFile(lines);
    assertThat(file.getStatements()).isNotEmpty();
    Statement stmt = file.getStatements().get(0);
    assertThat(stmt).isInstanceOf(clazz);
    return clazz.cast(stmt);
  }

  @Test
  public void testPrecedence() throws Exception {
    assertThat(expr("a + b * c")).isEqualTo("(a + (b * c))");
    assertThat(expr("a or b and c")).isEqualTo("(a or (b and c))");
    assertThat(expr("not a == b")).isEqualTo("not (a == b)");
    assertThat(expr("a | b | None")).isEqualTo("((a | b) | None)");
    assertThat(expr("-x.y")).isEqualTo("-x.y");
  }

  @Test
  public void testComparisonOperators() throws Exception {
    assertThat(expr("x is not None")).isEqualTo("(x is not None)");
    assertThat(expr("x is None")).isEqualTo("(x is None)");
    assertThat(expr("x not in y")).isEqualTo("(x not in y)");
    assertThat(expr("x in (1, 2)")).isEqualTo("(x in (1, 2))");
  }

  @Test
  public void testChainedComparisonIsRejected() throws Exception {
    SyntaxError.Exception e = assertThrows(SyntaxError.Exception.class, () -> expr("a < b < c"));
    assertThat(e.errors().get(0).message())
        .isEqualTo("comparison '<' cannot follow '<'; combine comparisons with 'and'");
  }

  @Test
  public void testPrimaries() throws Exception {
    assertThat(expr("f(a, *b, k=1, **d)")).isEqualTo("f(a, *b, k=1, **d)");
    assertThat(expr("a.b[0]")).isEqualTo("a.b[0]");
    assertThat(expr("d[str, int]")).isEqualTo("d[str, int]");
    assertThat(expr("(1,)")).isEqualTo("(1,)");
    assertThat(expr("()")).isEqualTo("()");
    assertThat(expr("[1, 'a']")).isEqualTo("[1, \"a\"]");
    assertThat(expr("{'k': None}")).isEqualTo("{\"k\": None}");
  }

  @Test
  public void testConditionalLambdaAndWalrus() throws Exception {
    assertThat(expr("a if c else b")).isEqualTo("a if c else b");
    assertThat(expr("lambda x, y=1: x")).isEqualTo("lambda x, y=1: x");
    assertThat(expr("(y := f())")).isEqualTo("(y := f())");
  }

  @Test
  public void testIndexKeyIsTuple() throws Exception {
    IndexExpression index = (IndexExpression) Expression.parse(ParserInput.fromLines("d[a, b]"));
    assertThat(index.getKey()).isInstanceOf(ListExpression.class);
    assertThat(((ListExpression) index.getKey()).isTuple()).isTrue();
  }

  @Test
  public void testSlicesAreRejected() throws Exception {
    SyntaxError.Exception e = assertThrows(SyntaxError.Exception.class, () -> expr("a[1:2]"));
    assertThat(e.errors().get(0).message()).contains("slices are not supported");
  }

  @Test
  public void testAssignments() throws Exception {
    AssignmentStatement plain = getFirstStatement(AssignmentStatement.class, "x = 1");
    assertThat(plain.isAugmented()).isFalse();
    assertThat(plain.getType()).isNull();

    AssignmentStatement augmented = getFirstStatement(AssignmentStatement.class, "x += 1");
    assertThat(augmented.isAugmented()).isTrue();
    assertThat(augmented.getOperator()).isEqualTo(TokenKind.PLUS);

    AssignmentStatement annotated = getFirstStatement(AssignmentStatement.class, "x: int = 1");
    assertThat(annotated.getType().toString()).isEqualTo("int");
    assertThat(annotated.isAnnotationOnly()).isFalse();

    AssignmentStatement declaration = getFirstStatement(AssignmentStatement.class, "x: int");
    assertThat(declaration.isAnnotationOnly()).isTrue();
    assertThat(declaration.getRHS()).isNull();
  }

  @Test
  public void testIfElif() throws Exception {
    IfStatement stmt =
        getFirstStatement(
            IfStatement.class,
            "if a:", //
            "  x = 1",
            "elif b:",
            "  x = 2",
            "else:",
            "  x = 3");
    assertThat(stmt.getElseBlock()).hasSize(1);
    IfStatement elif = (IfStatement) stmt.getElseBlock().get(0);
    assertThat(elif.isElif()).isTrue();
    assertThat(elif.getElseBlock()).hasSize(1);
  }

  @Test
  public void testTry() throws Exception {
    TryStatement stmt =
        getFirstStatement(
            TryStatement.class,
            "try:", //
            "  f()",
            "except ValueError as e:",
            "  pass",
            "except:",
            "  pass",
            "else:",
            "  g()",
            "finally:",
            "  h()");
    assertThat(stmt.getHandlers()).hasSize(2);
    assertThat(stmt.getHandlers().get(0).getName().getName()).isEqualTo("e");
    assertThat(stmt.getHandlers().get(1).getType()).isNull();
    assertThat(stmt.getElseBlock()).hasSize(1);
    assertThat(stmt.getFinallyBlock()).hasSize(1);
  }

  @Test
  public void testTryWithoutHandler() throws Exception {
    assertThat(firstError("try:", "  f()", "x = 1"))
        .isEqualTo("syntax error at 'x': expected 'except' or 'finally' block");
  }

  @Test
  public void testDef() throws Exception {
    DefStatement def =
        getFirstStatement(
            DefStatement.class,
            "def f(a: int, b=1, *args, c, **kw) -> str:", //
            "  return a");
    assertThat(def.getIdentifier().getName()).isEqualTo("f");
    assertThat(def.getParameters()).hasSize(5);
    assertThat(def.getParameters().get(0).getType().toString()).isEqualTo("int");
    assertThat(def.getParameters().get(1).getKind()).isEqualTo(Parameter.Kind.OPTIONAL);
    assertThat(def.getParameters().get(2).getKind()).isEqualTo(Parameter.Kind.STAR);
    assertThat(def.getParameters().get(4).getKind()).isEqualTo(Parameter.Kind.STAR_STAR);
    assertThat(def.getReturnType().toString()).isEqualTo("str");
  }

  @Test
  public void testBareStarParameter() throws Exception {
    DefStatement def = getFirstStatement(DefStatement.class, "def f(*, key): pass");
    assertThat(def.getParameters().get(0).getName()).isEqualTo("*");
    assertThat(def.getParameters().get(1).getName()).isEqualTo("key");
  }

  @Test
  public void testImports() throws Exception {
    ImportStatement imp = getFirstStatement(ImportStatement.class, "import os.path as p, sys");
    assertThat(imp.getItems()).hasSize(2);
    assertThat(imp.getItems().get(0).getModuleName()).isEqualTo("os.path");
    assertThat(imp.getItems().get(0).getAlias().getName()).isEqualTo("p");

    FromImportStatement from =
        getFirstStatement(FromImportStatement.class, "from ..pkg.mod import (a, b as c)");
    assertThat(from.getModule()).isEqualTo("..pkg.mod");
    assertThat(from.getBindings()).hasSize(2);
    assertThat(from.getBindings().get(1).getLocalName().getName()).isEqualTo("c");

    FromImportStatement wildcard = getFirstStatement(FromImportStatement.class, "from m import *");
    assertThat(wildcard.isWildcard()).isTrue();
  }

  @Test
  public void testMatch() throws Exception {
    MatchStatement match =
        getFirstStatement(
            MatchStatement.class,
            "match command:", //
            "  case [x, *rest]:",
            "    pass",
            "  case Point(x=0, y=y) | None:",
            "    pass",
            "  case {'k': v, **others}:",
            "    pass",
            "  case 1 | -2 as n if n:",
            "    pass",
            "  case _:",
            "    pass");
    assertThat(match.getCases()).hasSize(5);

    Pattern.Sequence seq = (Pattern.Sequence) match.getCases().get(0).getPattern();
    assertThat(seq.getStarIndex()).isEqualTo(1);

    Pattern.Or or = (Pattern.Or) match.getCases().get(1).getPattern();
    Pattern.ClassPattern cls = (Pattern.ClassPattern) or.getAlternatives().get(0);
    assertThat(cls.getKeywordNames()).hasSize(2);
    assertThat(cls.getPositionalPatterns()).isEmpty();

    Pattern.Mapping mapping = (Pattern.Mapping) match.getCases().get(2).getPattern();
    assertThat(mapping.getRest().getName()).isEqualTo("others");

    MatchStatement.Case guarded = match.getCases().get(3);
    assertThat(guarded.getPattern()).isInstanceOf(Pattern.As.class);
    assertThat(guarded.getGuard()).isNotNull();
    assertThat(guarded.isIrrefutable()).isFalse();

    assertThat(match.getCases().get(4).isIrrefutable()).isTrue();
  }

  @Test
  public void testOpenSequencePattern() throws Exception {
    MatchStatement match =
        getFirstStatement(
            MatchStatement.class,
            "match p:", //
            "  case a, b:",
            "    pass");
    Pattern.Sequence seq = (Pattern.Sequence) match.getCases().get(0).getPattern();
    assertThat(seq.getElements()).hasSize(2);
  }

  @Test
  public void testDottedValuePattern() throws Exception {
    MatchStatement match =
        getFirstStatement(
            MatchStatement.class,
            "match c:", //
            "  case Color.RED:",
            "    pass");
    assertThat(match.getCases().get(0).getPattern().kind()).isEqualTo(Pattern.Kind.VALUE);
  }

  @Test
  public void testComprehensionsAreRejected() throws Exception {
    assertThat(firstError("x = [a for a in b]"))
        .isEqualTo("syntax error at 'for': comprehensions are not supported");
  }

  @Test
  public void testMissingIndentedBlock() throws Exception {
    assertThat(firstError("if x:", "pass")).isEqualTo("expected an indented block");
  }

  @Test
  public void testRecoveryContinuesWithNextStatement() throws Exception {
    SourceFile file = SourceFile.parse(ParserInput.fromLines("x = *", "y = 1"));
    assertThat(file.errors()).hasSize(1);
    assertThat(file.getStatements()).hasSize(2);
  }
}

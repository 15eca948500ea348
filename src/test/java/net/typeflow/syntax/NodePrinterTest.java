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

import com.google.common.base.Joiner;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link Node#toString} for statements, which uses {@link NodePrinter}. */
@RunWith(JUnit4.class)
public final class NodePrinterTest {

  /** Parses the lines as a file and prints its first statement. */
  private static String printFirst(String... lines) {
    SourceFile file = SourceFile.parse(ParserInput.fromLines(lines));
    assertThat(file.errors()).isEmpty();
    return file.getStatements().get(0).toString();
  }

  /** Asserts that the lines, parsed as a file, print back as themselves. */
  private static void assertRoundTrip(String... lines) {
    assertThat(printFirst(lines)).isEqualTo(Joiner.on("\n").join(lines) + "\n");
  }

  @Test
  public void simpleStatements() {
    assertRoundTrip("x = 1");
    assertRoundTrip("x += 1");
    assertRoundTrip("x: Optional[int] = None");
    assertRoundTrip("y: str");
    assertRoundTrip("del a.b, c[0]");
    assertRoundTrip("assert x, \"message\"");
    assertRoundTrip("raise ValueError() from e");
    assertRoundTrip("import os.path as p");
    assertRoundTrip("from m import a, b as c");
    assertRoundTrip("from m import *");
    assertRoundTrip("pass");
  }

  @Test
  public void compoundStatements() {
    assertRoundTrip(
        "if a:", //
        "  pass",
        "elif b:",
        "  pass",
        "else:",
        "  pass");
    assertRoundTrip(
        "while x:", //
        "  break",
        "else:",
        "  pass");
    assertRoundTrip(
        "for x in items:", //
        "  continue");
    assertRoundTrip(
        "with open(f) as fp, lock:", //
        "  pass");
    assertRoundTrip(
        "def f(a: int, *args, k=1, **kw) -> str:", //
        "  return a");
  }

  @Test
  public void tryStatement() {
    assertRoundTrip(
        "try:", //
        "  f()",
        "except ValueError as e:",
        "  pass",
        "except:",
        "  raise",
        "finally:",
        "  g()");
  }

  @Test
  public void matchStatement() {
    assertRoundTrip(
        "match p:", //
        "  case [1, *rest]:",
        "    pass",
        "  case Point(x, y=0) | None:",
        "    pass",
        "  case {\"k\": v, **others}:",
        "    pass",
        "  case str() as s if s:",
        "    pass",
        "  case _:",
        "    pass");
  }

  @Test
  public void expressionsAreParenthesized() {
    assertThat(printFirst("x = a + b * c")).isEqualTo("x = (a + (b * c))\n");
    assertThat(printFirst("f(not x, y if c else z)")).isEqualTo("f(not x, y if c else z)\n");
  }

  @Test
  public void stringEscapes() {
    assertThat(printFirst("x = 'a\"b\\n'")).isEqualTo("x = \"a\\\"b\\n\"\n");
  }
}

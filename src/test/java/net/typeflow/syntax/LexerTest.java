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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LexerTest {

  private final List<SyntaxError> errors = new ArrayList<>();

  // Tokenizes src into "KIND" or "KIND(value)" words separated by spaces.
  private String tokens(String src) {
    errors.clear();
    Lexer lexer = new Lexer(ParserInput.fromString(src, "test.py"), errors);
    List<String> words = new ArrayList<>();
    do {
      lexer.nextToken();
      String word = lexer.kind.name();
      words.add(lexer.value == null ? word : word + "(" + lexer.value + ")");
    } while (lexer.kind != TokenKind.EOF);
    return String.join(" ", words);
  }

  private void check(String src, String want) {
    assertThat(tokens(src)).isEqualTo(want);
    assertThat(errors).isEmpty();
  }

  // Each expected error is a caret under its column followed by the message.
  private void checkErrors(String src, String want, String... wantErrors) {
    assertThat(tokens(src)).isEqualTo(want);
    List<String> got = new ArrayList<>();
    for (SyntaxError error : errors) {
      got.add(" ".repeat(error.location().column() - 1) + "^ " + error.message());
    }
    assertThat(got).containsExactlyElementsIn(Arrays.asList(wantErrors)).inOrder();
  }

  @Test
  public void testBasics() throws Exception {
    check("", "NEWLINE EOF");
    check("# foo", "NEWLINE EOF");
    check("1 2 3", "INT(1) INT(2) INT(3) NEWLINE EOF");
    check("123#456\n789", "INT(123) NEWLINE INT(789) NEWLINE EOF");
    check(
        "foo(bar, wiz)",
        "IDENTIFIER(foo) LPAREN IDENTIFIER(bar) COMMA IDENTIFIER(wiz) RPAREN NEWLINE EOF");
  }

  @Test
  public void testKeywords() throws Exception {
    check("x is None", "IDENTIFIER(x) IS NONE NEWLINE EOF");
    check("not x in y", "NOT IDENTIFIER(x) IN IDENTIFIER(y) NEWLINE EOF");
    check("match x", "MATCH IDENTIFIER(x) NEWLINE EOF");
    check("case _", "CASE IDENTIFIER(_) NEWLINE EOF");
    check("True or False", "TRUE OR FALSE NEWLINE EOF");
    check("with a as b", "WITH IDENTIFIER(a) AS IDENTIFIER(b) NEWLINE EOF");
    check("lambda: 0", "LAMBDA COLON INT(0) NEWLINE EOF");
  }

  @Test
  public void testOperators() throws Exception {
    check("(y := 1)", "LPAREN IDENTIFIER(y) COLON_EQUALS INT(1) RPAREN NEWLINE EOF");
    check("def f() -> int", "DEF IDENTIFIER(f) LPAREN RPAREN RARROW IDENTIFIER(int) NEWLINE EOF");
    check(
        "a ** b // c",
        "IDENTIFIER(a) STAR_STAR IDENTIFIER(b) SLASH_SLASH IDENTIFIER(c) NEWLINE EOF");
    check("a | b", "IDENTIFIER(a) PIPE IDENTIFIER(b) NEWLINE EOF");
    check("a != b\n", "IDENTIFIER(a) NOT_EQUALS IDENTIFIER(b) NEWLINE EOF");
    check("a += 1\n", "IDENTIFIER(a) PLUS_EQUALS INT(1) NEWLINE EOF");
    check(
        "a <<= b >> c",
        "IDENTIFIER(a) LESS_LESS_EQUALS IDENTIFIER(b) GREATER_GREATER IDENTIFIER(c) NEWLINE EOF");
    check("a.b", "IDENTIFIER(a) DOT IDENTIFIER(b) NEWLINE EOF");
  }

  @Test
  public void testNumbers() throws Exception {
    check("0x1F 0b101 1_000", "INT(31) INT(5) INT(1000) NEWLINE EOF");
    check("1.5 .5 1e1", "FLOAT(1.5) FLOAT(0.5) FLOAT(10.0) NEWLINE EOF");
    check("12345-", "INT(12345) MINUS NEWLINE EOF");
    checkErrors(
        "0x", "INT(0) NEWLINE EOF", "^ invalid hex literal", "^ invalid integer literal: 0x");
    checkErrors(
        "0b2",
        "INT(0) INT(2) NEWLINE EOF",
        "^ invalid binary literal",
        "^ invalid integer literal: 0b");
  }

  @Test
  public void testStrings() throws Exception {
    check("'abc' \"def\"", "STRING(abc) STRING(def) NEWLINE EOF");
    check("'a\\tb'", "STRING(a\tb) NEWLINE EOF");
    check("'it\"s'", "STRING(it\"s) NEWLINE EOF");
    check("\"\"\"a\nb\"\"\"", "STRING(a\nb) NEWLINE EOF");
    checkErrors("'abc\n", "STRING(abc) NEWLINE EOF", "^ unclosed string literal");
  }

  @Test
  public void testIndentation() throws Exception {
    check(
        "if x:\n  y\nz\n",
        "IF IDENTIFIER(x) COLON NEWLINE INDENT IDENTIFIER(y) NEWLINE OUTDENT IDENTIFIER(z) NEWLINE"
            + " EOF");
    check(
        "if x:\n  y\n",
        "IF IDENTIFIER(x) COLON NEWLINE INDENT IDENTIFIER(y) NEWLINE OUTDENT NEWLINE EOF");
    check(
        "if x:\n\n  # comment\n  y\n",
        "IF IDENTIFIER(x) COLON NEWLINE INDENT IDENTIFIER(y) NEWLINE OUTDENT NEWLINE EOF");
  }

  @Test
  public void testNewlineInsideBrackets() throws Exception {
    check("f(1,\n  2)\n", "IDENTIFIER(f) LPAREN INT(1) COMMA INT(2) RPAREN NEWLINE EOF");
    check("[\n1\n]", "LBRACKET INT(1) RBRACKET NEWLINE EOF");
  }

  @Test
  public void testErrors() throws Exception {
    checkErrors("a $ b", "IDENTIFIER(a) IDENTIFIER(b) NEWLINE EOF", "  ^ invalid character: '$'");
    checkErrors("x)", "IDENTIFIER(x) RPAREN NEWLINE EOF", " ^ unbalanced closing bracket");
  }
}

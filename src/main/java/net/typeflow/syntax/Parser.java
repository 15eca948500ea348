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

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A recursive-descent parser for the source language.
 *
 * <p>The parser never throws on bad input. Each error is recorded against the file and the parser
 * resynchronizes at the next statement boundary; only the first few errors of a file are kept,
 * since later ones are usually consequences of the first.
 */
final class Parser {

  /** A parsed file, before it is wrapped in a {@link SourceFile}. */
  static final class ParseResult {
    final FileLocations locs;
    final ImmutableList<Statement> statements;
    final List<SyntaxError> errors;

    private ParseResult(
        FileLocations locs, ImmutableList<Statement> statements, List<SyntaxError> errors) {
      this.locs = locs;
      this.statements = Preconditions.checkNotNull(statements);
      this.errors = errors;
    }
  }

  private static final int MAX_ERRORS_PER_FILE = 5;

  // Recovery stop sets. Each contains EOF so skipping always terminates.
  private static final ImmutableSet<TokenKind> STATEMENT_END =
      Sets.immutableEnumSet(TokenKind.EOF, TokenKind.NEWLINE, TokenKind.SEMI);
  private static final ImmutableSet<TokenKind> LIST_END =
      Sets.immutableEnumSet(TokenKind.EOF, TokenKind.RBRACKET, TokenKind.SEMI);
  private static final ImmutableSet<TokenKind> DICT_END =
      Sets.immutableEnumSet(TokenKind.EOF, TokenKind.RBRACE, TokenKind.SEMI);
  private static final ImmutableSet<TokenKind> SEQUENCE_END =
      Sets.immutableEnumSet(
          TokenKind.EOF,
          TokenKind.NEWLINE,
          TokenKind.EQUALS,
          TokenKind.COLON,
          TokenKind.RBRACE,
          TokenKind.RBRACKET,
          TokenKind.RPAREN,
          TokenKind.SEMI);
  private static final ImmutableSet<TokenKind> EXPRESSION_END =
      Sets.immutableEnumSet(
          TokenKind.COLON,
          TokenKind.COMMA,
          TokenKind.EOF,
          TokenKind.NEWLINE,
          TokenKind.FOR,
          TokenKind.MINUS,
          TokenKind.PERCENT,
          TokenKind.PLUS,
          TokenKind.RBRACKET,
          TokenKind.RPAREN,
          TokenKind.SLASH);

  // Maps each augmented assignment token to the binary operator it applies.
  private static final ImmutableMap<TokenKind, TokenKind> AUGMENTED_OPERATORS =
      ImmutableMap.<TokenKind, TokenKind>builder()
          .put(TokenKind.PLUS_EQUALS, TokenKind.PLUS)
          .put(TokenKind.MINUS_EQUALS, TokenKind.MINUS)
          .put(TokenKind.STAR_EQUALS, TokenKind.STAR)
          .put(TokenKind.SLASH_EQUALS, TokenKind.SLASH)
          .put(TokenKind.SLASH_SLASH_EQUALS, TokenKind.SLASH_SLASH)
          .put(TokenKind.PERCENT_EQUALS, TokenKind.PERCENT)
          .put(TokenKind.AMPERSAND_EQUALS, TokenKind.AMPERSAND)
          .put(TokenKind.CARET_EQUALS, TokenKind.CARET)
          .put(TokenKind.PIPE_EQUALS, TokenKind.PIPE)
          .put(TokenKind.GREATER_GREATER_EQUALS, TokenKind.GREATER_GREATER)
          .put(TokenKind.LESS_LESS_EQUALS, TokenKind.LESS_LESS)
          .buildOrThrow();

  // Binding strength of the binary operators; a larger number binds tighter. The prefix 'not'
  // sits between 'and' and the comparisons.
  private static final ImmutableMap<TokenKind, Integer> BINARY_PRECEDENCE =
      ImmutableMap.<TokenKind, Integer>builder()
          .put(TokenKind.OR, 1)
          .put(TokenKind.AND, 2)
          .put(TokenKind.EQUALS_EQUALS, 4)
          .put(TokenKind.NOT_EQUALS, 4)
          .put(TokenKind.LESS, 4)
          .put(TokenKind.LESS_EQUALS, 4)
          .put(TokenKind.GREATER, 4)
          .put(TokenKind.GREATER_EQUALS, 4)
          .put(TokenKind.IN, 4)
          .put(TokenKind.NOT_IN, 4)
          .put(TokenKind.IS, 4)
          .put(TokenKind.IS_NOT, 4)
          .put(TokenKind.PIPE, 5)
          .put(TokenKind.CARET, 6)
          .put(TokenKind.AMPERSAND, 7)
          .put(TokenKind.GREATER_GREATER, 8)
          .put(TokenKind.LESS_LESS, 8)
          .put(TokenKind.PLUS, 9)
          .put(TokenKind.MINUS, 9)
          .put(TokenKind.STAR, 10)
          .put(TokenKind.SLASH, 10)
          .put(TokenKind.SLASH_SLASH, 10)
          .put(TokenKind.PERCENT, 10)
          .buildOrThrow();
  private static final int NOT_PRECEDENCE = 3;

  // The lexer doubles as the current token; token.kind reads better than lexer.kind.
  private final Lexer token;
  private final Lexer lexer;
  private final FileLocations locs;
  private final List<SyntaxError> errors;

  private int errorCount;
  // Set by a syntax error; further errors are dropped until the next statement starts.
  private boolean recovering;

  private Parser(Lexer lexer, List<SyntaxError> errors) {
    this.lexer = lexer;
    this.token = lexer;
    this.locs = lexer.locs;
    this.errors = errors;
    nextToken();
  }

  static ParseResult parseFile(ParserInput input) {
    List<SyntaxError> errors = new ArrayList<>();
    Parser parser = new Parser(new Lexer(input, errors), errors);
    ImmutableList<Statement> statements = parser.parseFileInput();
    return new ParseResult(parser.locs, statements, errors);
  }

  /** Parses a single expression, allowing trailing blank lines. */
  static Expression parseExpression(ParserInput input) throws SyntaxError.Exception {
    List<SyntaxError> errors = new ArrayList<>();
    Parser parser = new Parser(new Lexer(input, errors), errors);
    Expression result = null;
    try {
      result = parser.parseExpr();
      while (parser.token.kind == TokenKind.NEWLINE) {
        parser.nextToken();
      }
      parser.expect(TokenKind.EOF);
    } catch (StackOverflowError e) {
      parser.reportStackOverflow(e);
    }
    if (!errors.isEmpty()) {
      throw new SyntaxError.Exception(errors);
    }
    return result;
  }

  // stmt = simple_stmt
  //      | compound_stmt
  private void parseStatement(ImmutableList.Builder<Statement> list) {
    switch (token.kind) {
      case DEF -> list.add(parseDefStatement());
      case IF -> list.add(parseIfStatement());
      case FOR -> list.add(parseForStatement());
      case WHILE -> list.add(parseWhileStatement());
      case TRY -> list.add(parseTryStatement());
      case WITH -> list.add(parseWithStatement());
      case MATCH -> list.add(parseMatchStatement());
      default -> parseSimpleStatement(list);
    }
  }

  // Parses every kind of expression, including unparenthesized tuples.
  //
  // In many cases we need to use parseTest() in place of parseExpr() to avoid ambiguity, e.g.:
  //
  //   f(x, y)  vs  f((x, y))
  private Expression parseExpr() {
    Expression e = parseTest();
    if (token.kind != TokenKind.COMMA) {
      return e;
    }

    // unparenthesized tuple
    ImmutableList.Builder<Expression> elems = ImmutableList.builder();
    elems.add(e);
    parseExprList(elems, /* trailingCommaAllowed= */ false);
    return new ListExpression(locs, /* isTuple= */ true, -1, elems.build(), -1);
  }

  @FormatMethod
  private void reportError(int offset, String format, Object... args) {
    errorCount++;
    if (errorCount <= MAX_ERRORS_PER_FILE) {
      errors.add(new SyntaxError(locs.getLocation(offset), String.format(format, args)));
    }
  }

  // Deeply nested input can exhaust the thread's stack anywhere in the descent, including in
  // error recovery, so overflow is reported as an ordinary error on the file.
  private void reportStackOverflow(StackOverflowError e) {
    reportError(
        token.end,
        "internal error: stack overflow while parsing %s.\n%s",
        locs.file(),
        Throwables.getStackTraceAsString(e));
  }

  // Reports an error at the current token, unless one is already being recovered from.
  private void syntaxError(String message) {
    if (recovering) {
      return;
    }
    recovering = true;
    if (token.kind == TokenKind.INDENT) {
      reportError(token.start, "indentation error");
      return;
    }
    String found;
    if (token.kind == TokenKind.STRING) {
      found = "\"" + token.value + "\"";
    } else if (token.value != null) {
      found = token.value.toString();
    } else {
      found = token.kind.toString();
    }
    reportError(token.start, "syntax error at '%s': %s", found, message);
  }

  // Consumes the current token, reporting an error if it is not of the given kind. Returns the
  // consumed token's start offset.
  @CanIgnoreReturnValue
  private int expect(TokenKind kind) {
    if (token.kind != kind) {
      syntaxError("expected " + kind);
    }
    return nextToken();
  }

  // Like expect, but a match also ends error recovery.
  @CanIgnoreReturnValue
  private int expectAndRecover(TokenKind kind) {
    if (token.kind == kind) {
      recovering = false;
    } else {
      syntaxError("expected " + kind);
    }
    return nextToken();
  }

  // Skips tokens through the first one in stop, and returns that token's end offset.
  @CanIgnoreReturnValue
  private int skipPast(ImmutableSet<TokenKind> stop) {
    Preconditions.checkArgument(stop.contains(TokenKind.EOF));
    while (!stop.contains(token.kind)) {
      nextToken();
    }
    int end = token.end;
    nextToken();
    return end;
  }

  // Skips the current token and any that follow it up to, not including, the first one in stop.
  // Returns the end offset of the last token skipped.
  @CanIgnoreReturnValue
  private int skipTo(ImmutableSet<TokenKind> stop) {
    Preconditions.checkArgument(stop.contains(TokenKind.EOF));
    int lastEnd = token.end;
    nextToken();
    while (!stop.contains(token.kind)) {
      lastEnd = token.end;
      nextToken();
    }
    return lastEnd;
  }

  @CanIgnoreReturnValue
  private int nextToken() {
    int consumed = token.start;
    if (token.kind != TokenKind.EOF) {
      lexer.nextToken();
    }
    return consumed;
  }

  // Stands in for a malformed expression so callers always get a node; its name is the source
  // text that was skipped.
  private Identifier errorExpression(int start, int end) {
    return new Identifier(locs, lexer.bufferSlice(start, end), start);
  }

  // arg = '**' test | '*' test | IDENTIFIER '=' test | test
  private Argument parseArgument() {
    switch (token.kind) {
      case STAR_STAR -> {
        int offset = nextToken();
        return new Argument.StarStar(locs, offset, parseTest());
      }
      case STAR -> {
        int offset = nextToken();
        return new Argument.Star(locs, offset, parseTest());
      }
      default -> {
        Expression expr = parseTest();
        if (expr instanceof Identifier name && token.kind == TokenKind.EQUALS) {
          nextToken();
          return new Argument.Keyword(locs, name, parseTest());
        }
        return new Argument.Positional(locs, expr);
      }
    }
  }

  // param = IDENTIFIER [':' test] [ '=' test ]
  //       | '*' [IDENTIFIER [':' test]]
  //       | '**' IDENTIFIER [':' test]
  // Type annotations are only available on def statements (not lambdas).
  private Parameter parseParameter(boolean defStatement) {
    Expression type = null;

    // **kwargs
    if (token.kind == TokenKind.STAR_STAR) {
      int starStarOffset = nextToken();
      Identifier id = parseIdent();
      if (defStatement) {
        type = maybeParseAnnotationAfter(TokenKind.COLON);
      }
      return new Parameter(locs, Parameter.Kind.STAR_STAR, starStarOffset, id, type, null);
    }

    // * or *args
    if (token.kind == TokenKind.STAR) {
      int starOffset = nextToken();
      if (token.kind == TokenKind.IDENTIFIER) {
        Identifier id = parseIdent();
        if (defStatement) {
          type = maybeParseAnnotationAfter(TokenKind.COLON);
        }
        return new Parameter(locs, Parameter.Kind.STAR, starOffset, id, type, null);
      }
      Identifier bare = new Identifier(locs, "*", starOffset);
      return new Parameter(locs, Parameter.Kind.STAR, starOffset, bare, null, null);
    }

    // name
    Identifier id = parseIdent();

    // name: type
    if (defStatement) {
      type = maybeParseAnnotationAfter(TokenKind.COLON);
    }

    // name=default
    if (token.kind == TokenKind.EQUALS) {
      nextToken();
      Expression expr = parseTest();
      return new Parameter(
          locs, Parameter.Kind.OPTIONAL, id.getStartOffset(), id, type, expr);
    }

    return new Parameter(locs, Parameter.Kind.MANDATORY, id.getStartOffset(), id, type, null);
  }

  @Nullable
  private Expression maybeParseAnnotationAfter(TokenKind expectedToken) {
    if (token.kind == expectedToken) {
      nextToken();
      return parseTest();
    }
    return null;
  }

  // call_suffix = '(' (arg (',' arg)* ','?)? ')'
  private Expression parseCallSuffix(Expression fn) {
    int lparenOffset = expect(TokenKind.LPAREN);
    ImmutableList.Builder<Argument> args = ImmutableList.builder();
    while (token.kind != TokenKind.RPAREN && token.kind != TokenKind.EOF) {
      args.add(parseArgument());
      if (token.kind == TokenKind.FOR) {
        syntaxError("generator expressions are not supported");
      }
      if (token.kind != TokenKind.RPAREN) {
        expect(TokenKind.COMMA);
      }
    }
    int rparenOffset = expect(TokenKind.RPAREN);
    return new CallExpression(locs, fn, lparenOffset, args.build(), rparenOffset);
  }

  // selector_suffix = '.' IDENTIFIER
  private Expression parseSelectorSuffix(Expression e) {
    int dotOffset = expect(TokenKind.DOT);
    if (token.kind == TokenKind.IDENTIFIER) {
      Identifier id = parseIdent();
      return new DotExpression(locs, e, dotOffset, id);
    }

    syntaxError("expected identifier after dot");
    skipTo(EXPRESSION_END);
    return e;
  }

  // Parses the tail of a comma-separated sequence whose first element has been consumed.
  //
  // expr_list = (',' test)* ','?
  private void parseExprList(
      ImmutableList.Builder<Expression> elements, boolean trailingCommaAllowed) {
    while (token.kind == TokenKind.COMMA) {
      int commaOffset = nextToken();
      if (SEQUENCE_END.contains(token.kind)) {
        if (!trailingCommaAllowed) {
          reportError(commaOffset, "a trailing comma needs parentheses around the tuple");
        }
        return;
      }
      elements.add(parseTest());
    }
  }

  // dict_entry = test ':' test
  private DictExpression.Entry parseDictEntry() {
    Expression key = parseTest();
    int colonOffset = expect(TokenKind.COLON);
    return new DictExpression.Entry(locs, key, colonOffset, parseTest());
  }

  // string = STRING+
  // Adjacent literals are joined into one node.
  private StringLiteral parseStringLiteral() {
    int start = token.start;
    int end = token.end;
    StringBuilder value = new StringBuilder();
    while (token.kind == TokenKind.STRING) {
      value.append((String) token.value);
      end = token.end;
      nextToken();
    }
    return new StringLiteral(locs, start, end, value.toString());
  }

  // primary = INT | FLOAT | STRING+ | IDENTIFIER | 'True' | 'False' | 'None'
  //         | list_display | dict_display
  //         | '(' ')' | '(' test ')' | '(' test (',' test)* ','? ')'
  //         | ('-' | '+' | '~') primary_with_suffix
  private Expression parsePrimary() {
    switch (token.kind) {
      case INT -> {
        IntLiteral literal =
            new IntLiteral(locs, token.start, token.raw, (BigInteger) token.value);
        nextToken();
        return literal;
      }
      case FLOAT -> {
        FloatLiteral literal = new FloatLiteral(locs, token.start, token.raw, (Double) token.value);
        nextToken();
        return literal;
      }
      case STRING -> {
        return parseStringLiteral();
      }
      case IDENTIFIER -> {
        return parseIdent();
      }
      case TRUE, FALSE -> {
        boolean value = token.kind == TokenKind.TRUE;
        return new BoolLiteral(locs, nextToken(), value);
      }
      case NONE -> {
        return new NoneLiteral(locs, nextToken());
      }
      case LBRACKET -> {
        return parseListDisplay();
      }
      case LBRACE -> {
        return parseDictExpression();
      }
      case LPAREN -> {
        return parseParenthesized();
      }
      case MINUS, PLUS, TILDE -> {
        TokenKind op = token.kind;
        int offset = nextToken();
        return new UnaryOperatorExpression(locs, op, offset, parsePrimaryWithSuffix());
      }
      default -> {
        int start = token.start;
        syntaxError("expected expression");
        return errorExpression(start, skipTo(EXPRESSION_END));
      }
    }
  }

  // A parenthesized expression or a tuple display.
  private Expression parseParenthesized() {
    int lparenOffset = expect(TokenKind.LPAREN);
    if (token.kind == TokenKind.RPAREN) {
      return tupleDisplay(lparenOffset, ImmutableList.of(), nextToken());
    }
    Expression first = parseTest();
    switch (token.kind) {
      case RPAREN -> {
        nextToken();
        return first;
      }
      case COMMA -> {
        ImmutableList.Builder<Expression> elements = ImmutableList.builder();
        elements.add(first);
        parseExprList(elements, /* trailingCommaAllowed= */ true);
        return tupleDisplay(lparenOffset, elements.build(), expect(TokenKind.RPAREN));
      }
      case FOR -> syntaxError("generator expressions are not supported");
      default -> expect(TokenKind.RPAREN);
    }
    return errorExpression(lparenOffset, skipTo(EXPRESSION_END));
  }

  private ListExpression tupleDisplay(
      int lparenOffset, ImmutableList<Expression> elements, int rparenOffset) {
    return new ListExpression(locs, /* isTuple= */ true, lparenOffset, elements, rparenOffset);
  }

  // primary_with_suffix = primary (selector_suffix | index_suffix | call_suffix)*
  private Expression parsePrimaryWithSuffix() {
    Expression e = parsePrimary();
    while (true) {
      if (token.kind == TokenKind.DOT) {
        e = parseSelectorSuffix(e);
      } else if (token.kind == TokenKind.LBRACKET) {
        e = parseIndexSuffix(e);
      } else if (token.kind == TokenKind.LPAREN) {
        e = parseCallSuffix(e);
      } else {
        return e;
      }
    }
  }

  // index_suffix = '[' expr ']'
  // Slices are not supported.
  private Expression parseIndexSuffix(Expression e) {
    int lbracketOffset = expect(TokenKind.LBRACKET);
    if (token.kind == TokenKind.COLON) {
      syntaxError("slices are not supported");
      int end = skipPast(LIST_END);
      return errorExpression(e.getStartOffset(), end);
    }
    Expression key = parseExpr();
    if (token.kind == TokenKind.COLON) {
      syntaxError("slices are not supported");
      int end = skipPast(LIST_END);
      return errorExpression(e.getStartOffset(), end);
    }
    int rbracketOffset = expect(TokenKind.RBRACKET);
    return new IndexExpression(locs, e, lbracketOffset, key, rbracketOffset);
  }

  // Equivalent to 'exprlist' rule in Python grammar.
  // loop_variables = primary_with_suffix ( ',' primary_with_suffix )* ','?
  private Expression parseForLoopVariables() {
    // We cannot reuse parseExpr because it would parse the 'in' operator.
    // e.g.  "for i in e: pass"  -> we want to parse only "i" here.
    Expression e1 = parsePrimaryWithSuffix();
    if (token.kind != TokenKind.COMMA) {
      return e1;
    }

    // unparenthesized tuple
    ImmutableList.Builder<Expression> elems = ImmutableList.builder();
    elems.add(e1);
    while (token.kind == TokenKind.COMMA) {
      expect(TokenKind.COMMA);
      if (SEQUENCE_END.contains(token.kind) || token.kind == TokenKind.IN) {
        break;
      }
      elems.add(parsePrimaryWithSuffix());
    }
    return new ListExpression(locs, /* isTuple= */ true, -1, elems.build(), -1);
  }

  // list_display = '[' ']' | '[' test (',' test)* ','? ']'
  private Expression parseListDisplay() {
    int lbracketOffset = expect(TokenKind.LBRACKET);
    ImmutableList.Builder<Expression> elements = ImmutableList.builder();
    if (token.kind != TokenKind.RBRACKET) {
      elements.add(parseTest());
      if (token.kind == TokenKind.FOR) {
        syntaxError("comprehensions are not supported");
        return errorExpression(lbracketOffset, skipPast(LIST_END));
      }
      parseExprList(elements, /* trailingCommaAllowed= */ true);
    }
    if (token.kind != TokenKind.RBRACKET) {
      syntaxError("expected ',' or ']'");
      return errorExpression(lbracketOffset, skipPast(LIST_END));
    }
    int rbracketOffset = nextToken();
    return new ListExpression(
        locs, /* isTuple= */ false, lbracketOffset, elements.build(), rbracketOffset);
  }

  // dict_display = '{' (dict_entry (',' dict_entry)* ','?)? '}'
  private Expression parseDictExpression() {
    int lbraceOffset = expect(TokenKind.LBRACE);
    ImmutableList.Builder<DictExpression.Entry> entries = ImmutableList.builder();
    while (token.kind != TokenKind.RBRACE && token.kind != TokenKind.EOF) {
      entries.add(parseDictEntry());
      if (token.kind == TokenKind.FOR) {
        syntaxError("comprehensions are not supported");
        return errorExpression(lbraceOffset, skipPast(DICT_END));
      }
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      nextToken();
    }
    if (token.kind != TokenKind.RBRACE) {
      syntaxError("expected ',' or '}'");
      return errorExpression(lbraceOffset, skipPast(DICT_END));
    }
    int rbraceOffset = nextToken();
    return new DictExpression(locs, lbraceOffset, entries.build(), rbraceOffset);
  }

  private Identifier parseIdent() {
    if (token.kind != TokenKind.IDENTIFIER) {
      int start = token.start;
      int end = expect(TokenKind.IDENTIFIER);
      return errorExpression(start, end);
    }

    String name = (String) token.value;
    int offset = nextToken();
    return new Identifier(locs, name, offset);
  }

  // or_expr = not_expr (BINOP not_expr)*
  // Parses operators binding at least as tightly as minPrecedence, left to right, by
  // precedence climbing.
  private Expression parseBinary(int minPrecedence) {
    Expression x =
        token.kind == TokenKind.NOT && minPrecedence <= NOT_PRECEDENCE
            ? parseNotExpression()
            : parsePrimaryWithSuffix();
    TokenKind previousComparison = null;
    while (true) {
      if (token.kind == TokenKind.NOT) {
        // 'not' in operator position must begin 'not in'; fold the pair into one token.
        expect(TokenKind.NOT);
        if (token.kind != TokenKind.IN) {
          syntaxError("expected 'in'");
        }
        token.kind = TokenKind.NOT_IN;
      }
      Integer precedence = BINARY_PRECEDENCE.get(token.kind);
      if (precedence == null || precedence < minPrecedence) {
        return x;
      }
      TokenKind op = token.kind;
      int opOffset = nextToken();
      if (op == TokenKind.IS && token.kind == TokenKind.NOT) {
        nextToken();
        op = TokenKind.IS_NOT;
      }
      if (op.isComparison() && previousComparison != null) {
        reportError(
            opOffset,
            "comparison '%s' cannot follow '%s'; combine comparisons with 'and'",
            op,
            previousComparison);
      }
      previousComparison = op.isComparison() ? op : null;
      Expression y = parseBinary(precedence + 1);
      x = new BinaryOperatorExpression(locs, x, op, opOffset, y);
    }
  }

  private Expression parseOrExpression() {
    return parseBinary(1);
  }

  // not_expr = 'not' not_expr | comparison
  private Expression parseNotExpression() {
    int notOffset = expect(TokenKind.NOT);
    Expression x = parseBinary(NOT_PRECEDENCE);
    return new UnaryOperatorExpression(locs, TokenKind.NOT, notOffset, x);
  }

  // Parses any expression except for an unparenthesized tuple.
  //
  // test = lambda | named_expr ['if' test 'else' test]
  // named_expr = IDENTIFIER ':=' test | or_expr
  private Expression parseTest() {
    int start = token.start;
    if (token.kind == TokenKind.LAMBDA) {
      return parseLambda();
    }

    Expression expr = parseOrExpression();
    if (token.kind == TokenKind.COLON_EQUALS) {
      int opOffset = nextToken();
      Expression value = parseTest();
      if (expr instanceof Identifier id) {
        return new AssignmentExpression(locs, id, opOffset, value);
      }
      reportError(opOffset, "cannot use assignment expressions with %s", expr.kind());
      return value;
    }
    if (token.kind == TokenKind.IF) {
      nextToken();
      Expression condition = parseOrExpression();
      if (token.kind == TokenKind.ELSE) {
        nextToken();
        Expression elseClause = parseTest();
        return new ConditionalExpression(locs, expr, condition, elseClause);
      } else {
        reportError(start, "missing else clause in conditional expression or semicolon before if");
        return expr; // Try to recover from error: drop the if and the expression after it.
      }
    }
    return expr;
  }

  // lambda = 'lambda' params ':' test
  private LambdaExpression parseLambda() {
    int lambdaOffset = expect(TokenKind.LAMBDA);
    ImmutableList<Parameter> params = parseParameters(/* defStatement= */ false);
    expect(TokenKind.COLON);
    return new LambdaExpression(locs, lambdaOffset, params, parseTest());
  }

  // file_input = ('\n' | stmt)* EOF
  // The terminating newline is injected by the lexer even if not present in the input.
  private ImmutableList<Statement> parseFileInput() {
    ImmutableList.Builder<Statement> list = ImmutableList.builder();
    try {
      while (token.kind != TokenKind.EOF) {
        if (token.kind == TokenKind.NEWLINE) {
          expectAndRecover(TokenKind.NEWLINE);
        } else if (recovering) {
          // Drop the rest of the broken statement.
          skipTo(STATEMENT_END);
          recovering = false;
        } else {
          parseStatement(list);
        }
      }
    } catch (StackOverflowError e) {
      reportStackOverflow(e);
    }
    return list.build();
  }

  // simple_stmt = small_stmt (';' small_stmt)* ';'? NEWLINE
  private void parseSimpleStatement(ImmutableList.Builder<Statement> list) {
    list.add(parseSmallStatement());

    while (token.kind == TokenKind.SEMI) {
      nextToken();
      if (token.kind == TokenKind.NEWLINE) {
        break;
      }
      list.add(parseSmallStatement());
    }
    expectAndRecover(TokenKind.NEWLINE);
  }

  //     small_stmt = assign_stmt
  //                | expr
  //                | return_stmt | raise_stmt | assert_stmt | del_stmt
  //                | import_stmt | from_import_stmt
  //                | BREAK | CONTINUE | PASS
  //
  //     assign_stmt = expr ('=' | augassign) expr
  //                 | expr ':' test ['=' expr]
  //
  //     augassign = '+=' | '-=' | '*=' | '/=' | '%=' | '//=' | '&=' | '|=' | '^=' |'<<=' | '>>='
  private Statement parseSmallStatement() {
    switch (token.kind) {
      case RETURN:
        return parseReturnStatement();
      case BREAK:
      case CONTINUE:
      case PASS:
        {
          FlowStatement.Jump jump = FlowStatement.Jump.of(token.kind);
          int offset = nextToken();
          return new FlowStatement(locs, jump, offset);
        }
      case RAISE:
        return parseRaiseStatement();
      case ASSERT:
        return parseAssertStatement();
      case DEL:
        return parseDelStatement();
      case IMPORT:
        return parseImportStatement();
      case FROM:
        return parseFromImportStatement();
      default:
        break;
    }

    Expression lhs = parseExpr();

    // lhs: type [= rhs]
    if (token.kind == TokenKind.COLON) {
      int colonOffset = nextToken();
      Expression type = parseTest();
      if (token.kind == TokenKind.EQUALS) {
        int opOffset = nextToken();
        Expression rhs = parseExpr();
        return new AssignmentStatement(locs, lhs, null, type, opOffset, rhs);
      }
      return new AssignmentStatement(locs, lhs, null, type, colonOffset, null);
    }

    // lhs = rhs  or  lhs += rhs
    TokenKind op = AUGMENTED_OPERATORS.get(token.kind);
    if (token.kind == TokenKind.EQUALS || op != null) {
      int opOffset = nextToken();
      Expression rhs = parseExpr();
      // op == null for ordinary assignment.
      return new AssignmentStatement(locs, lhs, op, null, opOffset, rhs);
    } else {
      return new ExpressionStatement(locs, lhs);
    }
  }

  // return_stmt = RETURN [expr]
  private ReturnStatement parseReturnStatement() {
    int returnOffset = expect(TokenKind.RETURN);

    Expression result = null;
    if (!STATEMENT_END.contains(token.kind)) {
      result = parseExpr();
    }
    return new ReturnStatement(locs, returnOffset, result);
  }

  // raise_stmt = RAISE [test ['from' test]]
  private RaiseStatement parseRaiseStatement() {
    int raiseOffset = expect(TokenKind.RAISE);
    Expression exception = null;
    Expression cause = null;
    if (!STATEMENT_END.contains(token.kind)) {
      exception = parseTest();
      if (token.kind == TokenKind.FROM) {
        nextToken();
        cause = parseTest();
      }
    }
    return new RaiseStatement(locs, raiseOffset, exception, cause);
  }

  // assert_stmt = ASSERT test [',' test]
  private AssertStatement parseAssertStatement() {
    int assertOffset = expect(TokenKind.ASSERT);
    Expression condition = parseTest();
    Expression message = null;
    if (token.kind == TokenKind.COMMA) {
      nextToken();
      message = parseTest();
    }
    return new AssertStatement(locs, assertOffset, condition, message);
  }

  // del_stmt = DEL primary_with_suffix (',' primary_with_suffix)*
  private DelStatement parseDelStatement() {
    int delOffset = expect(TokenKind.DEL);
    ImmutableList.Builder<Expression> targets = ImmutableList.builder();
    targets.add(parsePrimaryWithSuffix());
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      if (STATEMENT_END.contains(token.kind)) {
        break;
      }
      targets.add(parsePrimaryWithSuffix());
    }
    return new DelStatement(locs, delOffset, targets.build());
  }

  // dotted_name = IDENTIFIER ('.' IDENTIFIER)*
  private ImmutableList<Identifier> parseDottedName() {
    ImmutableList.Builder<Identifier> path = ImmutableList.builder();
    path.add(parseIdent());
    while (token.kind == TokenKind.DOT) {
      nextToken();
      path.add(parseIdent());
    }
    return path.build();
  }

  // import_stmt = IMPORT dotted_name ['as' IDENTIFIER] (',' dotted_name ['as' IDENTIFIER])*
  private ImportStatement parseImportStatement() {
    int importOffset = expect(TokenKind.IMPORT);
    ImmutableList.Builder<ImportStatement.Item> items = ImmutableList.builder();
    do {
      if (token.kind == TokenKind.COMMA) {
        nextToken();
      }
      ImmutableList<Identifier> path = parseDottedName();
      Identifier alias = null;
      if (token.kind == TokenKind.AS) {
        nextToken();
        alias = parseIdent();
      }
      items.add(new ImportStatement.Item(locs, path, alias));
    } while (token.kind == TokenKind.COMMA);
    return new ImportStatement(locs, importOffset, items.build());
  }

  // from_import_stmt = FROM '.'* [dotted_name] IMPORT ('*' | import_names | '(' import_names ')')
  // import_names = IDENTIFIER ['as' IDENTIFIER] (',' IDENTIFIER ['as' IDENTIFIER])* ','?
  private FromImportStatement parseFromImportStatement() {
    int fromOffset = expect(TokenKind.FROM);
    StringBuilder module = new StringBuilder();
    while (token.kind == TokenKind.DOT) {
      module.append('.');
      nextToken();
    }
    if (token.kind == TokenKind.IDENTIFIER) {
      for (Identifier id : parseDottedName()) {
        if (module.length() > 0 && module.charAt(module.length() - 1) != '.') {
          module.append('.');
        }
        module.append(id.getName());
      }
    }
    expect(TokenKind.IMPORT);

    if (token.kind == TokenKind.STAR) {
      int end = token.end;
      nextToken();
      return new FromImportStatement(
          locs, fromOffset, module.toString(), ImmutableList.of(), /* wildcard= */ true, end);
    }

    boolean parenthesized = token.kind == TokenKind.LPAREN;
    if (parenthesized) {
      nextToken();
    }
    ImmutableList.Builder<FromImportStatement.Binding> bindings = ImmutableList.builder();
    int end = token.end;
    while (token.kind == TokenKind.IDENTIFIER) {
      Identifier name = parseIdent();
      Identifier alias = null;
      if (token.kind == TokenKind.AS) {
        nextToken();
        alias = parseIdent();
      }
      bindings.add(new FromImportStatement.Binding(name, alias));
      end = (alias != null ? alias : name).getEndOffset();
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      nextToken();
    }
    if (parenthesized) {
      end = expect(TokenKind.RPAREN) + 1;
    }
    ImmutableList<FromImportStatement.Binding> list = bindings.build();
    if (list.isEmpty()) {
      syntaxError("expected at least one name to import");
    }
    return new FromImportStatement(
        locs, fromOffset, module.toString(), list, /* wildcard= */ false, end);
  }

  // if_stmt = 'if' test ':' suite ('elif' test ':' suite)* ('else' ':' suite)?
  // Each 'elif' becomes an if statement that is the sole element of the previous else block.
  private IfStatement parseIfStatement() {
    return parseIfClause(TokenKind.IF);
  }

  private IfStatement parseIfClause(TokenKind keyword) {
    int offset = expect(keyword);
    Expression cond = parseTest();
    expect(TokenKind.COLON);
    IfStatement clause = new IfStatement(locs, keyword, offset, cond, parseSuite());
    if (token.kind == TokenKind.ELIF) {
      clause.setElseBlock(ImmutableList.of(parseIfClause(TokenKind.ELIF)));
    } else if (token.kind == TokenKind.ELSE) {
      nextToken();
      expect(TokenKind.COLON);
      clause.setElseBlock(parseSuite());
    }
    return clause;
  }

  // Parses an optional "else:" suite following a loop.
  @Nullable
  private ImmutableList<Statement> parseOptionalElseSuite() {
    if (token.kind != TokenKind.ELSE) {
      return null;
    }
    expect(TokenKind.ELSE);
    expect(TokenKind.COLON);
    return parseSuite();
  }

  // for_stmt = FOR loop_variables IN expr ':' suite [ELSE ':' suite]
  private ForStatement parseForStatement() {
    int forOffset = expect(TokenKind.FOR);
    Expression vars = parseForLoopVariables();
    expect(TokenKind.IN);
    Expression collection = parseExpr();
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();
    ImmutableList<Statement> elseBlock = parseOptionalElseSuite();
    return new ForStatement(locs, forOffset, vars, collection, body, elseBlock);
  }

  // while_stmt = WHILE test ':' suite [ELSE ':' suite]
  private WhileStatement parseWhileStatement() {
    int whileOffset = expect(TokenKind.WHILE);
    Expression cond = parseTest();
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();
    ImmutableList<Statement> elseBlock = parseOptionalElseSuite();
    return new WhileStatement(locs, whileOffset, cond, body, elseBlock);
  }

  // try_stmt = TRY ':' suite
  //            (EXCEPT [test ['as' IDENTIFIER]] ':' suite)*
  //            [ELSE ':' suite]
  //            [FINALLY ':' suite]
  private TryStatement parseTryStatement() {
    int tryOffset = expect(TokenKind.TRY);
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();

    ImmutableList.Builder<TryStatement.ExceptHandler> handlers = ImmutableList.builder();
    boolean hasHandler = false;
    while (token.kind == TokenKind.EXCEPT) {
      int exceptOffset = nextToken();
      Expression type = null;
      Identifier name = null;
      if (token.kind != TokenKind.COLON) {
        type = parseTest();
        if (token.kind == TokenKind.AS) {
          nextToken();
          name = parseIdent();
        }
      }
      expect(TokenKind.COLON);
      ImmutableList<Statement> handlerBody = parseSuite();
      handlers.add(new TryStatement.ExceptHandler(locs, exceptOffset, type, name, handlerBody));
      hasHandler = true;
    }

    ImmutableList<Statement> elseBlock = null;
    if (token.kind == TokenKind.ELSE) {
      if (!hasHandler) {
        syntaxError("'else' requires at least one 'except' clause");
      }
      elseBlock = parseOptionalElseSuite();
    }

    ImmutableList<Statement> finallyBlock = null;
    if (token.kind == TokenKind.FINALLY) {
      expect(TokenKind.FINALLY);
      expect(TokenKind.COLON);
      finallyBlock = parseSuite();
    }

    if (!hasHandler && finallyBlock == null) {
      syntaxError("expected 'except' or 'finally' block");
    }
    return new TryStatement(
        locs, tryOffset, body, handlers.build(), elseBlock, finallyBlock);
  }

  // with_stmt = WITH with_item (',' with_item)* ':' suite
  // with_item = test ['as' primary_with_suffix]
  private WithStatement parseWithStatement() {
    int withOffset = expect(TokenKind.WITH);
    ImmutableList.Builder<WithStatement.Item> items = ImmutableList.builder();
    do {
      if (token.kind == TokenKind.COMMA) {
        nextToken();
      }
      Expression cm = parseTest();
      Expression target = null;
      if (token.kind == TokenKind.AS) {
        nextToken();
        target = parsePrimaryWithSuffix();
      }
      items.add(new WithStatement.Item(locs, cm, target));
    } while (token.kind == TokenKind.COMMA);
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();
    return new WithStatement(locs, withOffset, items.build(), body);
  }

  // match_stmt = MATCH expr ':' NEWLINE INDENT case_clause+ OUTDENT
  // case_clause = CASE patterns ['if' test] ':' suite
  private MatchStatement parseMatchStatement() {
    int matchOffset = expect(TokenKind.MATCH);
    Expression subject = parseExpr();
    expect(TokenKind.COLON);
    ImmutableList.Builder<MatchStatement.Case> cases = ImmutableList.builder();
    expect(TokenKind.NEWLINE);
    if (token.kind != TokenKind.INDENT) {
      reportError(token.start, "expected an indented block of 'case' clauses");
      return new MatchStatement(locs, matchOffset, subject, cases.build());
    }
    expect(TokenKind.INDENT);
    while (token.kind != TokenKind.OUTDENT && token.kind != TokenKind.EOF) {
      if (token.kind != TokenKind.CASE) {
        syntaxError("expected 'case'");
        skipPast(STATEMENT_END);
        continue;
      }
      int caseOffset = nextToken();
      Pattern pattern = parseOpenSequencePattern();
      Expression guard = null;
      if (token.kind == TokenKind.IF) {
        nextToken();
        guard = parseTest();
      }
      expect(TokenKind.COLON);
      ImmutableList<Statement> body = parseSuite();
      cases.add(new MatchStatement.Case(locs, caseOffset, pattern, guard, body));
    }
    expectAndRecover(TokenKind.OUTDENT);
    return new MatchStatement(locs, matchOffset, subject, cases.build());
  }

  // patterns = pattern (',' pattern)* ','?      -- more than one makes a sequence
  private Pattern parseOpenSequencePattern() {
    Pattern first = parseAsPattern();
    if (token.kind != TokenKind.COMMA) {
      return first;
    }
    ImmutableList.Builder<Pattern> elems = ImmutableList.builder();
    elems.add(first);
    int end = first.getEndOffset();
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      if (token.kind == TokenKind.COLON || token.kind == TokenKind.IF) {
        break;
      }
      Pattern p = parseAsPattern();
      elems.add(p);
      end = p.getEndOffset();
    }
    return new Pattern.Sequence(locs, first.getStartOffset(), elems.build(), end);
  }

  // as_pattern = or_pattern ['as' IDENTIFIER]
  private Pattern parseAsPattern() {
    Pattern p = parseOrPattern();
    if (token.kind == TokenKind.AS) {
      nextToken();
      Identifier name = parseIdent();
      return new Pattern.As(locs, p, name);
    }
    return p;
  }

  // or_pattern = closed_pattern ('|' closed_pattern)*
  private Pattern parseOrPattern() {
    Pattern first = parseClosedPattern();
    if (token.kind != TokenKind.PIPE) {
      return first;
    }
    ImmutableList.Builder<Pattern> alternatives = ImmutableList.builder();
    alternatives.add(first);
    while (token.kind == TokenKind.PIPE) {
      nextToken();
      alternatives.add(parseClosedPattern());
    }
    return new Pattern.Or(locs, alternatives.build());
  }

  // closed_pattern = literal | capture | '_' | value | class | sequence | mapping | group
  private Pattern parseClosedPattern() {
    switch (token.kind) {
      case INT:
      case FLOAT:
      case STRING:
      case TRUE:
      case FALSE:
      case NONE:
        return new Pattern.Literal(locs, parsePrimary());

      case MINUS:
        {
          int offset = nextToken();
          if (token.kind != TokenKind.INT && token.kind != TokenKind.FLOAT) {
            syntaxError("expected a number after '-' in pattern");
          }
          Expression number = parsePrimary();
          return new Pattern.Literal(
              locs, new UnaryOperatorExpression(locs, TokenKind.MINUS, offset, number));
        }

      case STAR:
        {
          int starOffset = nextToken();
          Identifier name = parseIdent();
          return new Pattern.Star(locs, starOffset, name.isWildcard() ? null : name);
        }

      case IDENTIFIER:
        return parseNamePattern();

      case LPAREN:
        {
          int lparenOffset = nextToken();
          if (token.kind == TokenKind.RPAREN) {
            int rparenOffset = nextToken();
            return new Pattern.Sequence(locs, lparenOffset, ImmutableList.of(), rparenOffset + 1);
          }
          Pattern first = parseAsPattern();
          if (token.kind == TokenKind.RPAREN) {
            nextToken();
            return first; // group
          }
          ImmutableList.Builder<Pattern> elems = ImmutableList.builder();
          elems.add(first);
          while (token.kind == TokenKind.COMMA) {
            nextToken();
            if (token.kind == TokenKind.RPAREN) {
              break;
            }
            elems.add(parseAsPattern());
          }
          int rparenOffset = expect(TokenKind.RPAREN);
          return new Pattern.Sequence(locs, lparenOffset, elems.build(), rparenOffset + 1);
        }

      case LBRACKET:
        {
          int lbracketOffset = nextToken();
          ImmutableList.Builder<Pattern> elems = ImmutableList.builder();
          while (token.kind != TokenKind.RBRACKET && token.kind != TokenKind.EOF) {
            elems.add(parseAsPattern());
            if (token.kind != TokenKind.COMMA) {
              break;
            }
            nextToken();
          }
          int rbracketOffset = expect(TokenKind.RBRACKET);
          return new Pattern.Sequence(locs, lbracketOffset, elems.build(), rbracketOffset + 1);
        }

      case LBRACE:
        return parseMappingPattern();

      default:
        {
          int start = token.start;
          syntaxError("expected pattern");
          int end = skipTo(EXPRESSION_END);
          return new Pattern.Capture(locs, errorExpression(start, end));
        }
    }
  }

  // Parses a pattern starting with a name: wildcard, capture, value or class pattern.
  private Pattern parseNamePattern() {
    Identifier id = parseIdent();
    Expression name = id;
    while (token.kind == TokenKind.DOT) {
      int dotOffset = nextToken();
      name = new DotExpression(locs, name, dotOffset, parseIdent());
    }
    if (token.kind == TokenKind.LPAREN) {
      return parseClassPatternSuffix(name);
    }
    if (name instanceof DotExpression dot) {
      return new Pattern.Value(locs, dot);
    }
    if (id.isWildcard()) {
      return new Pattern.Wildcard(locs, id.getStartOffset());
    }
    return new Pattern.Capture(locs, id);
  }

  // class_pattern = name_or_attr '(' [pattern (',' pattern)*] [IDENTIFIER '=' pattern ...] ')'
  private Pattern parseClassPatternSuffix(Expression cls) {
    expect(TokenKind.LPAREN);
    ImmutableList.Builder<Pattern> positional = ImmutableList.builder();
    ImmutableList.Builder<Identifier> keywordNames = ImmutableList.builder();
    ImmutableList.Builder<Pattern> keywordPatterns = ImmutableList.builder();
    boolean seenKeyword = false;
    while (token.kind != TokenKind.RPAREN && token.kind != TokenKind.EOF) {
      Pattern p = parseAsPattern();
      if (token.kind == TokenKind.EQUALS
          && p instanceof Pattern.Capture capture) {
        nextToken();
        keywordNames.add(capture.getName());
        keywordPatterns.add(parseAsPattern());
        seenKeyword = true;
      } else {
        if (seenKeyword) {
          syntaxError("positional patterns follow keyword patterns");
        }
        positional.add(p);
      }
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      nextToken();
    }
    int rparenOffset = expect(TokenKind.RPAREN);
    return new Pattern.ClassPattern(
        locs,
        cls,
        positional.build(),
        keywordNames.build(),
        keywordPatterns.build(),
        rparenOffset);
  }

  // mapping_pattern = '{' [key ':' pattern (',' key ':' pattern)*] [',' '**' IDENTIFIER] '}'
  private Pattern parseMappingPattern() {
    int lbraceOffset = expect(TokenKind.LBRACE);
    ImmutableList.Builder<Expression> keys = ImmutableList.builder();
    ImmutableList.Builder<Pattern> values = ImmutableList.builder();
    Identifier rest = null;
    while (token.kind != TokenKind.RBRACE && token.kind != TokenKind.EOF) {
      if (token.kind == TokenKind.STAR_STAR) {
        nextToken();
        rest = parseIdent();
      } else {
        Expression key;
        if (token.kind == TokenKind.IDENTIFIER) {
          Pattern value = parseNamePattern();
          if (!(value instanceof Pattern.Value v)) {
            syntaxError("mapping pattern keys must be literals or dotted names");
            key = errorExpression(value.getStartOffset(), value.getEndOffset());
          } else {
            key = v.getValue();
          }
        } else {
          key = parsePrimary();
        }
        expect(TokenKind.COLON);
        keys.add(key);
        values.add(parseAsPattern());
      }
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      nextToken();
    }
    int rbraceOffset = expect(TokenKind.RBRACE);
    return new Pattern.Mapping(
        locs, lbraceOffset, keys.build(), values.build(), rest, rbraceOffset);
  }

  // def_stmt = DEF IDENTIFIER '(' arguments ')' ['->' test] ':' suite
  private DefStatement parseDefStatement() {
    int defOffset = expect(TokenKind.DEF);
    Identifier ident = parseIdent();
    expect(TokenKind.LPAREN);
    ImmutableList<Parameter> params = parseParameters(/* defStatement= */ true);
    expect(TokenKind.RPAREN);
    Expression returnType = maybeParseAnnotationAfter(TokenKind.RARROW);
    expect(TokenKind.COLON);
    ImmutableList<Statement> block = parseSuite();
    return new DefStatement(locs, defOffset, ident, params, returnType, block);
  }

  // params = (param (',' param)* ','?)?
  // Ends at ')' for a def and at ':' for a lambda.
  private ImmutableList<Parameter> parseParameters(boolean defStatement) {
    ImmutableList.Builder<Parameter> params = ImmutableList.builder();
    while (token.kind != TokenKind.RPAREN
        && token.kind != TokenKind.COLON
        && token.kind != TokenKind.EOF) {
      params.add(parseParameter(defStatement));
      if (token.kind != TokenKind.RPAREN && token.kind != TokenKind.COLON) {
        expect(TokenKind.COMMA);
      }
    }
    return params.build();
  }

  // suite = simple_stmt | NEWLINE INDENT stmt+ OUTDENT
  private ImmutableList<Statement> parseSuite() {
    ImmutableList.Builder<Statement> body = ImmutableList.builder();
    if (token.kind != TokenKind.NEWLINE) {
      parseSimpleStatement(body);
      return body.build();
    }
    nextToken();
    if (token.kind != TokenKind.INDENT) {
      reportError(token.start, "expected an indented block");
      return body.build();
    }
    nextToken();
    while (token.kind != TokenKind.OUTDENT && token.kind != TokenKind.EOF) {
      parseStatement(body);
    }
    expectAndRecover(TokenKind.OUTDENT);
    return body.build();
  }
}

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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.FormatMethod;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * A scanner for the indentation-structured source language.
 *
 * <p>The parser reads the current token directly from the package-private fields below and calls
 * {@link #nextToken} to advance. Lexical errors are appended to the list supplied at construction
 * and scanning always continues, so the token stream is never cut short by bad input.
 */
final class Lexer {

  final FileLocations locs;

  // The current token. raw and value are set only for STRING, INT, FLOAT, IDENTIFIER and ILLEGAL.
  TokenKind kind;
  int start;
  int end;
  String raw;
  Object value; // String, BigInteger or Double

  private final List<SyntaxError> errors;
  private final char[] buffer;
  private int pos;

  // Widths of the enclosing indented blocks; the bottom entry is always zero.
  private final Deque<Integer> indents = new ArrayDeque<>();
  private int bracketDepth;
  private boolean atLineStart = true;
  // INDENT (> 0) or OUTDENT (< 0) tokens measured but not yet returned.
  private int pendingDents;

  private static final ImmutableSet<TokenKind> SYNTHETIC =
      Sets.immutableEnumSet(
          TokenKind.EOF,
          TokenKind.IDENTIFIER,
          TokenKind.INDENT,
          TokenKind.NEWLINE,
          TokenKind.OUTDENT);

  private static final ImmutableMap<String, TokenKind> KEYWORDS = spellings(true);
  private static final ImmutableMap<String, TokenKind> PUNCTUATION = spellings(false);
  private static final int LONGEST_PUNCTUATION = 3;

  private static final ImmutableMap<Character, Character> ESCAPES =
      ImmutableMap.of('n', '\n', 'r', '\r', 't', '\t', '\\', '\\', '\'', '\'', '"', '"');

  Lexer(ParserInput input, List<SyntaxError> errors) {
    this.locs = FileLocations.create(input.getContent(), input.getFile());
    this.buffer = input.getContent();
    this.errors = errors;
    indents.push(0);
  }

  /** Advances to the next token. The stream always ends with NEWLINE followed by EOF. */
  void nextToken() {
    boolean afterNewline = kind == TokenKind.NEWLINE;
    scan();
    if (kind == TokenKind.EOF && !afterNewline) {
      kind = TokenKind.NEWLINE;
    }
  }

  /** Returns the source text between two offsets. */
  String bufferSlice(int start, int end) {
    return new String(buffer, start, end - start);
  }

  private void scan() {
    if (atLineStart) {
      atLineStart = false;
      measureIndentation();
    }
    if (pendingDents > 0) {
      pendingDents--;
      setToken(TokenKind.INDENT, Math.max(0, pos - 1), pos);
      return;
    }
    if (pendingDents < 0) {
      pendingDents++;
      setToken(TokenKind.OUTDENT, Math.max(0, pos - 1), pos);
      return;
    }

    while (pos < buffer.length) {
      char c = buffer[pos];
      switch (c) {
        case ' ', '\t', '\r' -> pos++;
        case '#' -> skipComment();
        case '\\' -> {
          if (!skipLineContinuation()) {
            setToken(TokenKind.ILLEGAL, pos, pos + 1);
            setValue("\\");
            pos++;
            return;
          }
        }
        case '\n' -> {
          pos++;
          if (bracketDepth == 0) {
            atLineStart = true;
            setToken(TokenKind.NEWLINE, pos - 1, pos);
            return;
          }
        }
        case '\'', '"' -> {
          scanString(c);
          return;
        }
        default -> {
          if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
            scanNumber();
            return;
          }
          if (isIdentifierStart(c)) {
            scanWord();
            return;
          }
          if (scanPunctuation()) {
            return;
          }
          error(pos, "invalid character: '%c'", c);
          pos++;
        }
      }
    }

    // Close every open block before EOF.
    if (indents.size() > 1) {
      pendingDents -= indents.size() - 1;
      while (indents.size() > 1) {
        indents.pop();
      }
      setToken(TokenKind.NEWLINE, Math.max(0, pos - 1), pos);
      return;
    }
    setToken(TokenKind.EOF, pos, pos);
  }

  // Skips blank and comment-only lines, then compares the width of the first printing line with
  // the enclosing blocks.
  private void measureIndentation() {
    int width = 0;
    while (pos < buffer.length) {
      char c = buffer[pos];
      if (c == '#') {
        skipComment();
        width = 0;
        continue;
      }
      if (c == '\n') {
        width = 0;
      } else if (c == ' ') {
        width++;
      } else if (c == '\t') {
        width++;
        error(pos + 1, "Tab characters are not allowed for indentation. Use spaces instead.");
      } else if (c != '\r') {
        break;
      }
      pos++;
    }
    if (pos == buffer.length) {
      width = 0;
    }

    if (width > indents.peek()) {
      indents.push(width);
      pendingDents++;
      return;
    }
    while (width < indents.peek()) {
      indents.pop();
      pendingDents--;
    }
    if (width != indents.peek()) {
      error(pos - 1, "indentation error");
    }
  }

  private void skipComment() {
    while (pos < buffer.length && buffer[pos] != '\n') {
      pos++;
    }
  }

  // A backslash immediately before a line break joins the two lines.
  private boolean skipLineContinuation() {
    if (peek(1) == '\n') {
      pos += 2;
      return true;
    }
    if (peek(1) == '\r' && peek(2) == '\n') {
      pos += 3;
      return true;
    }
    return false;
  }

  private void scanWord() {
    int wordStart = pos;
    while (pos < buffer.length && isIdentifierPart(buffer[pos])) {
      pos++;
    }
    String word = bufferSlice(wordStart, pos);
    TokenKind keyword = KEYWORDS.get(word);
    if (keyword != null) {
      setToken(keyword, wordStart, pos);
    } else {
      setToken(TokenKind.IDENTIFIER, wordStart, pos);
      setValue(word);
    }
  }

  // Longest match wins, so "<<=" is preferred over "<<" and "<".
  private boolean scanPunctuation() {
    for (int len = Math.min(LONGEST_PUNCTUATION, buffer.length - pos); len > 0; len--) {
      TokenKind punct = PUNCTUATION.get(bufferSlice(pos, pos + len));
      if (punct != null) {
        setToken(punct, pos, pos + len);
        pos += len;
        trackBrackets(punct);
        return true;
      }
    }
    return false;
  }

  private void trackBrackets(TokenKind punct) {
    switch (punct) {
      case LPAREN, LBRACKET, LBRACE -> bracketDepth++;
      case RPAREN, RBRACKET, RBRACE -> {
        if (bracketDepth == 0) {
          error(pos - 1, "unbalanced closing bracket");
        } else {
          bracketDepth--;
        }
      }
      default -> {}
    }
  }

  private void scanString(char quote) {
    int literalStart = pos;
    pos++;
    boolean triple = peek(0) == quote && peek(1) == quote;
    if (triple) {
      pos += 2;
    }
    StringBuilder text = new StringBuilder();
    while (pos < buffer.length) {
      char c = buffer[pos++];
      if (c == quote && (!triple || closesTripleQuote(quote))) {
        finishString(literalStart, text);
        return;
      }
      if (c == '\n' && !triple) {
        break;
      }
      if (c != '\\') {
        text.append(c);
        continue;
      }
      if (pos == buffer.length) {
        break;
      }
      char escaped = buffer[pos++];
      Character replacement = ESCAPES.get(escaped);
      if (replacement != null) {
        text.append(replacement.charValue());
      } else if (escaped != '\n') {
        // Unknown escapes are kept as written.
        text.append('\\').append(escaped);
      }
    }
    error(literalStart, "unclosed string literal");
    finishString(literalStart, text);
  }

  private boolean closesTripleQuote(char quote) {
    if (peek(0) == quote && peek(1) == quote) {
      pos += 2;
      return true;
    }
    return false;
  }

  private void finishString(int literalStart, StringBuilder text) {
    setToken(TokenKind.STRING, literalStart, pos);
    setValue(text.toString());
  }

  private void scanNumber() {
    int numberStart = pos;
    int radix = 10;
    if (peek(0) == '0' && (peek(1) == 'x' || peek(1) == 'X')) {
      radix = 16;
    } else if (peek(0) == '0' && (peek(1) == 'b' || peek(1) == 'B')) {
      radix = 2;
    }

    if (radix != 10) {
      pos += 2;
      int digitsStart = pos;
      while (pos < buffer.length && isDigitIn(buffer[pos], radix)) {
        pos++;
      }
      if (pos == digitsStart && radix == 16) {
        error(numberStart, "invalid hex literal");
      } else if (pos == digitsStart) {
        error(numberStart, "invalid binary literal");
      }
      finishInt(numberStart, bufferSlice(digitsStart, pos), radix);
      return;
    }

    skipDecimalDigits(true);
    boolean isFloat = false;
    if (peek(0) == '.') {
      isFloat = true;
      pos++;
      skipDecimalDigits(false);
    }
    if (peek(0) == 'e' || peek(0) == 'E') {
      isFloat = true;
      pos++;
      if (peek(0) == '+' || peek(0) == '-') {
        pos++;
      }
      skipDecimalDigits(false);
    }
    if (!isFloat) {
      finishInt(numberStart, bufferSlice(numberStart, pos), 10);
      return;
    }

    setToken(TokenKind.FLOAT, numberStart, pos);
    double number = 0.0;
    try {
      number = Double.parseDouble(bufferSlice(numberStart, pos));
      if (Double.isInfinite(number)) {
        error(numberStart, "floating-point literal too large");
      }
    } catch (NumberFormatException e) {
      error(numberStart, "invalid float literal");
    }
    setValue(number);
  }

  private void skipDecimalDigits(boolean allowUnderscore) {
    while (pos < buffer.length
        && (isDigit(buffer[pos]) || (allowUnderscore && buffer[pos] == '_'))) {
      pos++;
    }
  }

  private void finishInt(int numberStart, String digits, int radix) {
    setToken(TokenKind.INT, numberStart, pos);
    BigInteger number = BigInteger.ZERO;
    try {
      number = new BigInteger(digits.replace("_", ""), radix);
    } catch (NumberFormatException e) {
      error(numberStart, "invalid integer literal: %s", bufferSlice(numberStart, pos));
    }
    setValue(number);
  }

  private void setToken(TokenKind kind, int start, int end) {
    this.kind = kind;
    this.start = start;
    this.end = end;
    this.raw = null;
    this.value = null;
  }

  private void setValue(Object value) {
    this.value = value;
    this.raw = bufferSlice(start, end);
  }

  @FormatMethod
  private void error(int offset, String format, Object... args) {
    errors.add(new SyntaxError(locs.getLocation(offset), String.format(format, args)));
  }

  // Returns the char i places past the current one, or -1 past the end of input.
  private int peek(int i) {
    return pos + i < buffer.length ? buffer[pos + i] : -1;
  }

  private static boolean isDigit(int c) {
    return '0' <= c && c <= '9';
  }

  private static boolean isDigitIn(char c, int radix) {
    return c < 128 && Character.digit(c, radix) >= 0;
  }

  private static boolean isIdentifierStart(int c) {
    return ('a' <= c && c <= 'z') || ('A' <= c && c <= 'Z') || c == '_';
  }

  private static boolean isIdentifierPart(int c) {
    return isIdentifierStart(c) || isDigit(c);
  }

  // Keywords are the kinds spelled as a single word; punctuation is everything spelled without
  // letters or spaces.
  private static ImmutableMap<String, TokenKind> spellings(boolean words) {
    ImmutableMap.Builder<String, TokenKind> spellings = ImmutableMap.builder();
    for (TokenKind kind : TokenKind.values()) {
      String text = kind.toString();
      if (SYNTHETIC.contains(kind) || text.isEmpty()) {
        continue;
      }
      boolean isWord = text.chars().allMatch(Character::isLetter);
      boolean isPunctuation =
          text.chars().noneMatch(c -> Character.isLetter(c) || Character.isWhitespace(c));
      if (words ? isWord : isPunctuation) {
        spellings.put(text, kind);
      }
    }
    return spellings.buildOrThrow();
  }
}

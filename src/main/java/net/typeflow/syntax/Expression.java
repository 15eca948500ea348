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

/**
 * An expression node.
 *
 * <p>Only some expressions can name a value tracked across the flow graph: identifiers, and dot or
 * index chains over them with literal subscripts. Those, plus list and tuple displays of them, are
 * also the valid assignment targets.
 */
public abstract class Expression extends Node {

  /** The concrete node class, for switching without a chain of instanceof tests. */
  public enum Kind {
    ASSIGNMENT_EXPR,
    BINARY_OPERATOR,
    BOOL_LITERAL,
    CALL,
    CONDITIONAL,
    DICT_EXPR,
    DOT,
    FLOAT_LITERAL,
    IDENTIFIER,
    INDEX,
    INT_LITERAL,
    LAMBDA,
    LIST_EXPR,
    NONE_LITERAL,
    STRING_LITERAL,
    UNARY_OPERATOR,
  }

  private final Kind kind;

  Expression(FileLocations locs, Kind kind) {
    super(locs);
    this.kind = kind;
  }

  public final Kind kind() {
    return kind;
  }

  /**
   * Parses a single expression, such as an annotation held in a string.
   *
   * @throws SyntaxError.Exception if the input is not exactly one well-formed expression
   */
  public static Expression parse(ParserInput input) throws SyntaxError.Exception {
    return Parser.parseExpression(input);
  }
}

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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Syntax tree for a source file.
 *
 * <p>A file that failed to parse still has a tree, possibly incomplete, together with a non-empty
 * list of errors. Analyses must check {@link #ok} before relying on the tree's shape.
 */
public final class SourceFile extends Node {

  private final ImmutableList<Statement> statements;
  private final ImmutableList<SyntaxError> errors;

  private SourceFile(
      FileLocations locs, ImmutableList<Statement> statements, List<SyntaxError> errors) {
    super(locs);
    this.statements = statements;
    this.errors = ImmutableList.copyOf(errors);
  }

  /**
   * Parses the input as a file. The result contains the errors encountered by the scanner and
   * parser, if any; it is never null.
   */
  public static SourceFile parse(ParserInput input) {
    Parser.ParseResult result = Parser.parseFile(input);
    return new SourceFile(result.locs, result.statements, result.errors);
  }

  /** Returns an unmodifiable view of the list of scanner and parser errors accumulated. */
  public ImmutableList<SyntaxError> errors() {
    return errors;
  }

  /** Returns true if there were no errors during scanning and parsing. */
  public boolean ok() {
    return errors.isEmpty();
  }

  /** Returns an unmodifiable view of the list of top-level statements. */
  public ImmutableList<Statement> getStatements() {
    return statements;
  }

  @Override
  public int getStartOffset() {
    return 0;
  }

  @Override
  public int getEndOffset() {
    return locs.size();
  }

  @Override
  public String toString() {
    return "<SourceFile with " + statements.size() + " statements>";
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}

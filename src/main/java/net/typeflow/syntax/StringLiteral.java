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
 * A string literal. Adjacent literals in the source are joined into one node whose value is their
 * concatenation and whose span covers all of them.
 */
public final class StringLiteral extends Expression {

  private final int startOffset;
  private final int endOffset;
  private final String value;

  StringLiteral(FileLocations locs, int startOffset, int endOffset, String value) {
    super(locs, Kind.STRING_LITERAL);
    this.startOffset = startOffset;
    this.endOffset = endOffset;
    this.value = value;
  }

  /** The decoded value, with escapes replaced. */
  public String getValue() {
    return value;
  }

  @Override
  public int getStartOffset() {
    return startOffset;
  }

  @Override
  public int getEndOffset() {
    return endOffset;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}

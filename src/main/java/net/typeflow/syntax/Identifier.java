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
 * A name used as an expression, an assignment target, a parameter, a capture pattern or the
 * binding of an {@code as} clause.
 */
public final class Identifier extends Expression {

  private final String name;
  private final int startOffset;

  Identifier(FileLocations locs, String name, int startOffset) {
    super(locs, Kind.IDENTIFIER);
    this.name = name;
    this.startOffset = startOffset;
  }

  public String getName() {
    return name;
  }

  /** Reports whether this is {@code _}, which binds nothing in a pattern. */
  public boolean isWildcard() {
    return name.equals("_");
  }

  @Override
  public int getStartOffset() {
    return startOffset;
  }

  @Override
  public int getEndOffset() {
    return startOffset + name.length();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}

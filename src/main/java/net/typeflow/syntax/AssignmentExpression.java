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
 * Syntax node for an assignment expression, {@code name := value}.
 *
 * <p>The target is always a plain identifier. The expression's value is the assigned value, which
 * makes it usable as the operand of a test.
 */
public final class AssignmentExpression extends Expression {

  private final Identifier target;
  private final int opOffset;
  private final Expression value;

  AssignmentExpression(FileLocations locs, Identifier target, int opOffset, Expression value) {
    super(locs, Kind.ASSIGNMENT_EXPR);
    this.target = target;
    this.opOffset = opOffset;
    this.value = value;
  }

  public Identifier getTarget() {
    return target;
  }

  public Expression getValue() {
    return value;
  }

  public Location getOperatorLocation() {
    return locs.getLocation(opOffset);
  }

  @Override
  public int getStartOffset() {
    return target.getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return value.getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}

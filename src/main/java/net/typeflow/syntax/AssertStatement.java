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

import javax.annotation.Nullable;

/** Syntax node for an {@code assert condition [, message]} statement. */
public final class AssertStatement extends Statement {

  private final int assertOffset;
  private final Expression condition;
  @Nullable private final Expression message;

  AssertStatement(
      FileLocations locs, int assertOffset, Expression condition, @Nullable Expression message) {
    super(locs);
    this.assertOffset = assertOffset;
    this.condition = condition;
    this.message = message;
  }

  public Expression getCondition() {
    return condition;
  }

  @Nullable
  public Expression getMessage() {
    return message;
  }

  @Override
  public int getStartOffset() {
    return assertOffset;
  }

  @Override
  public int getEndOffset() {
    return message != null ? message.getEndOffset() : condition.getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public Kind kind() {
    return Kind.ASSERT;
  }
}

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
import javax.annotation.Nullable;

/**
 * {@code for target in iterable: body [else: orelse]}. The iterable is evaluated once before the
 * loop; the target is rebound at the top of every iteration.
 */
public final class ForStatement extends Statement {

  private final int keywordOffset;
  private final Expression target;
  private final Expression iterable;
  private final ImmutableList<Statement> body;
  @Nullable private final ImmutableList<Statement> orElse;

  ForStatement(
      FileLocations locs,
      int keywordOffset,
      Expression target,
      Expression iterable,
      ImmutableList<Statement> body,
      @Nullable ImmutableList<Statement> orElse) {
    super(locs);
    this.keywordOffset = keywordOffset;
    this.target = target;
    this.iterable = iterable;
    this.body = body;
    this.orElse = orElse;
  }

  /** The loop variable; may be a tuple or list of targets such as {@code k, v}. */
  public Expression getTarget() {
    return target;
  }

  public Expression getIterable() {
    return iterable;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  /** The block run when the iterable is exhausted without {@code break}, or null. */
  @Nullable
  public ImmutableList<Statement> getElseBlock() {
    return orElse;
  }

  @Override
  public int getStartOffset() {
    return keywordOffset;
  }

  @Override
  public int getEndOffset() {
    ImmutableList<Statement> tail = orElse != null ? orElse : body;
    return tail.isEmpty() ? iterable.getEndOffset() : tail.get(tail.size() - 1).getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public Kind kind() {
    return Kind.FOR;
  }
}

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

/**
 * A statement that binds or declares a target. Four forms share this node:
 *
 * <ul>
 *   <li>{@code x = v}: no operator, no annotation;
 *   <li>{@code x += v}: {@link #getOperator} is the binary operator applied;
 *   <li>{@code x: T = v}: {@link #getType} is the annotation;
 *   <li>{@code x: T}: a declaration that binds nothing, with a null right-hand side.
 * </ul>
 */
public final class AssignmentStatement extends Statement {

  private final Expression target;
  @Nullable private final TokenKind augmentedOp;
  @Nullable private final Expression annotation;
  private final int opOffset;
  @Nullable private final Expression value;

  AssignmentStatement(
      FileLocations locs,
      Expression target,
      @Nullable TokenKind augmentedOp,
      @Nullable Expression annotation,
      int opOffset,
      @Nullable Expression value) {
    super(locs);
    this.target = target;
    this.augmentedOp = augmentedOp;
    this.annotation = annotation;
    this.opOffset = opOffset;
    this.value = value;
  }

  public Expression getLHS() {
    return target;
  }

  @Nullable
  public TokenKind getOperator() {
    return augmentedOp;
  }

  public boolean isAugmented() {
    return augmentedOp != null;
  }

  @Nullable
  public Expression getType() {
    return annotation;
  }

  public boolean isAnnotationOnly() {
    return value == null;
  }

  @Nullable
  public Expression getRHS() {
    return value;
  }

  /** The location of {@code =}, of the augmented operator, or of the colon of a declaration. */
  public Location getOperatorLocation() {
    return locs.getLocation(opOffset);
  }

  @Override
  public int getStartOffset() {
    return target.getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return value != null ? value.getEndOffset() : annotation.getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public Kind kind() {
    return Kind.ASSIGNMENT;
  }
}

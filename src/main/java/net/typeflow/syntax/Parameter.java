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
 * Syntax node for a parameter in a function definition.
 *
 * <p>Parameters may be of four forms, as in {@code def f(a, b=c, *args, **kwargs)}. They are
 * distinguished by {@link #kind}.
 */
public final class Parameter extends Node {

  /** The form of a parameter. */
  public enum Kind {
    MANDATORY,
    OPTIONAL,
    STAR,
    STAR_STAR
  }

  private final Kind kind;
  private final int startOffset;
  private final Identifier id;
  @Nullable private final Expression type;
  @Nullable private final Expression defaultValue;

  Parameter(
      FileLocations locs,
      Kind kind,
      int startOffset,
      Identifier id,
      @Nullable Expression type,
      @Nullable Expression defaultValue) {
    super(locs);
    this.kind = kind;
    this.startOffset = startOffset;
    this.id = id;
    this.type = type;
    this.defaultValue = defaultValue;
  }

  public Kind getKind() {
    return kind;
  }

  public String getName() {
    return id.getName();
  }

  public Identifier getIdentifier() {
    return id;
  }

  /** Returns the type annotation, or null if the parameter is unannotated. */
  @Nullable
  public Expression getType() {
    return type;
  }

  @Nullable
  public Expression getDefaultValue() {
    return defaultValue;
  }

  @Override
  public int getStartOffset() {
    return startOffset;
  }

  @Override
  public int getEndOffset() {
    if (defaultValue != null) {
      return defaultValue.getEndOffset();
    }
    return type != null ? type.getEndOffset() : id.getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}

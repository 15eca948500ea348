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

/** Syntax node for a {@code del} statement, which unbinds one or more targets. */
public final class DelStatement extends Statement {

  private final int delOffset;
  private final ImmutableList<Expression> targets;

  DelStatement(FileLocations locs, int delOffset, ImmutableList<Expression> targets) {
    super(locs);
    this.delOffset = delOffset;
    this.targets = targets;
  }

  public ImmutableList<Expression> getTargets() {
    return targets;
  }

  @Override
  public int getStartOffset() {
    return delOffset;
  }

  @Override
  public int getEndOffset() {
    return targets.isEmpty() ? delOffset + 3 : targets.get(targets.size() - 1).getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public Kind kind() {
    return Kind.DEL;
  }
}

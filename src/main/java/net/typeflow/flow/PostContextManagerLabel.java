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
package net.typeflow.flow;

import com.google.common.collect.ImmutableList;
import net.typeflow.syntax.Expression;

/**
 * A label on one of the two edges leaving a {@code with} statement.
 *
 * <p>If {@link #isBlockedIfSwallowsExceptions} is false, the label carries exceptions raised in
 * the body to the code after the statement, and is passable only when some context manager
 * swallows exceptions. Otherwise it carries them to the enclosing exception handlers, and is
 * passable only when none does.
 */
public final class PostContextManagerLabel extends LabelNode {

  private final ImmutableList<Expression> contextManagers;
  private final boolean blockIfSwallowsExceptions;

  PostContextManagerLabel(
      int id, ImmutableList<Expression> contextManagers, boolean blockIfSwallowsExceptions) {
    super(id, Kind.POST_CONTEXT_MANAGER);
    this.contextManagers = contextManagers;
    this.blockIfSwallowsExceptions = blockIfSwallowsExceptions;
  }

  public ImmutableList<Expression> getContextManagers() {
    return contextManagers;
  }

  public boolean isBlockedIfSwallowsExceptions() {
    return blockIfSwallowsExceptions;
  }
}

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

/** Syntax node for a function call expression. */
public final class CallExpression extends Expression {

  private final Expression function;
  private final int lparenOffset;
  private final ImmutableList<Argument> arguments;
  private final int rparenOffset;

  CallExpression(
      FileLocations locs,
      Expression function,
      int lparenOffset,
      ImmutableList<Argument> arguments,
      int rparenOffset) {
    super(locs, Kind.CALL);
    this.function = function;
    this.lparenOffset = lparenOffset;
    this.arguments = arguments;
    this.rparenOffset = rparenOffset;
  }

  /** Returns the function that is called. */
  public Expression getFunction() {
    return function;
  }

  /** Returns the function arguments. */
  public ImmutableList<Argument> getArguments() {
    return arguments;
  }

  /** Returns the number of positional arguments before the first keyword or starred one. */
  public int getPositionalArgumentCount() {
    int n = 0;
    for (Argument arg : arguments) {
      if (!(arg instanceof Argument.Positional)) {
        break;
      }
      n++;
    }
    return n;
  }

  /** Returns the i'th positional argument, or null if there are fewer. */
  @Nullable
  public Expression getPositionalArgument(int i) {
    return i < getPositionalArgumentCount() ? arguments.get(i).getValue() : null;
  }

  /** Returns the value of the keyword argument with the given name, or null. */
  @Nullable
  public Expression getKeywordArgument(String name) {
    for (Argument arg : arguments) {
      if (name.equals(arg.getName())) {
        return arg.getValue();
      }
    }
    return null;
  }

  /** Returns the name of the called function if it is a plain identifier, or null. */
  @Nullable
  public String getCalleeName() {
    return function instanceof Identifier id ? id.getName() : null;
  }

  public Location getLparenLocation() {
    return locs.getLocation(lparenOffset);
  }

  @Override
  public int getStartOffset() {
    return function.getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return rparenOffset + 1;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}

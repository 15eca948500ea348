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

/**
 * {@code lambda params: body}. A lambda opens its own flow scope; its body is a single expression
 * evaluated when the lambda is called, not where it is written.
 */
public final class LambdaExpression extends Expression {

  private final int keywordOffset;
  private final ImmutableList<Parameter> parameters;
  private final Expression body;

  LambdaExpression(
      FileLocations locs,
      int keywordOffset,
      ImmutableList<Parameter> parameters,
      Expression body) {
    super(locs, Kind.LAMBDA);
    this.keywordOffset = keywordOffset;
    this.parameters = parameters;
    this.body = body;
  }

  public ImmutableList<Parameter> getParameters() {
    return parameters;
  }

  public Expression getBody() {
    return body;
  }

  @Override
  public int getStartOffset() {
    return keywordOffset;
  }

  @Override
  public int getEndOffset() {
    return body.getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}

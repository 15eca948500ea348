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
import net.typeflow.syntax.Node;

/**
 * The entry of a scope. The defining node is the {@link net.typeflow.syntax.SourceFile}, {@link
 * net.typeflow.syntax.DefStatement} or {@link net.typeflow.syntax.LambdaExpression}.
 */
public final class StartNode extends FlowNode {

  private final Node definingNode;

  StartNode(int id, Node definingNode) {
    super(id, Kind.START);
    this.definingNode = definingNode;
  }

  public Node getDefiningNode() {
    return definingNode;
  }

  @Override
  public ImmutableList<FlowNode> getAntecedents() {
    return ImmutableList.of();
  }
}

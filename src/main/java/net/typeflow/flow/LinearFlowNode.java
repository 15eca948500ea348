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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/** A flow node with exactly one antecedent. */
public abstract class LinearFlowNode extends FlowNode {

  private final FlowNode antecedent;

  LinearFlowNode(int id, Kind kind, FlowNode antecedent) {
    super(id, kind);
    this.antecedent = Preconditions.checkNotNull(antecedent);
  }

  public final FlowNode getAntecedent() {
    return antecedent;
  }

  @Override
  public final ImmutableList<FlowNode> getAntecedents() {
    return ImmutableList.of(antecedent);
  }
}

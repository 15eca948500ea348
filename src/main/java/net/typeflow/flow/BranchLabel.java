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

import javax.annotation.Nullable;

/**
 * The join after a branching construct. If the label knows the node that preceded the branch, a
 * query for a reference the branch leaves untouched may jump straight there.
 */
public final class BranchLabel extends LabelNode {

  @Nullable private final FlowNode preBranchAntecedent;

  BranchLabel(int id, @Nullable FlowNode preBranchAntecedent) {
    super(id, Kind.BRANCH_LABEL);
    this.preBranchAntecedent = preBranchAntecedent;
  }

  @Nullable
  public FlowNode getPreBranchAntecedent() {
    return preBranchAntecedent;
  }
}

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

/**
 * The normal exit of a {@code finally} block. Queries that pass through it close the associated
 * {@link PreFinallyGate} for the rest of their walk.
 */
public final class PostFinallyNode extends LinearFlowNode {

  private final PreFinallyGate gate;

  PostFinallyNode(int id, FlowNode antecedent, PreFinallyGate gate) {
    super(id, Kind.POST_FINALLY, antecedent);
    this.gate = gate;
  }

  public PreFinallyGate getGate() {
    return gate;
  }
}

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
 * The entry of a {@code finally} block for paths that leave the {@code try} statement by return
 * or raise. Its antecedent is the label joining those paths.
 *
 * <p>While the code after the {@code finally} block is analyzed, the gate is closed, so that the
 * normal completion of the block is not polluted by the abnormal paths.
 */
public final class PreFinallyGate extends LinearFlowNode {

  PreFinallyGate(int id, FlowNode antecedent) {
    super(id, Kind.PRE_FINALLY_GATE, antecedent);
  }
}

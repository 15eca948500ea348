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

import net.typeflow.syntax.CallExpression;

/** The point after a call. It is unreachable if the callee never returns. */
public final class CallNode extends LinearFlowNode {

  private final CallExpression call;

  CallNode(int id, FlowNode antecedent, CallExpression call) {
    super(id, Kind.CALL, antecedent);
    this.call = call;
  }

  public CallExpression getCall() {
    return call;
  }
}

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
 * The head of a loop. Its antecedents are the entry edge, if the loop is reachable, followed by
 * the back edges from the end of the body and from {@code continue} statements.
 */
public final class LoopLabel extends LabelNode {

  @Nullable private FlowNode entry;

  LoopLabel(int id) {
    super(id, Kind.LOOP_LABEL);
  }

  void setEntry(FlowNode entry) {
    this.entry = entry;
  }

  /** Returns the node through which control enters the loop, or null if it never does. */
  @Nullable
  public FlowNode getEntry() {
    return entry;
  }
}

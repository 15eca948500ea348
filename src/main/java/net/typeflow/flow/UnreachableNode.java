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
import java.util.Locale;

/** A node that control never reaches. It has no antecedents. */
public final class UnreachableNode extends FlowNode {

  /** Why the builder knows the code is unreachable. */
  public enum Reason {
    /** After a return, raise, break or continue, or a join none of whose inputs is reachable. */
    STRUCTURAL,
    /** In a branch whose condition is a literal that rules it out, as in {@code if False:}. */
    STATIC_CONDITION,
  }

  private final Reason reason;

  UnreachableNode(int id, Reason reason) {
    super(id, Kind.UNREACHABLE);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }

  @Override
  public ImmutableList<FlowNode> getAntecedents() {
    return ImmutableList.of();
  }

  @Override
  public String toString() {
    return super.toString() + "(" + reason.name().toLowerCase(Locale.ROOT) + ")";
  }
}

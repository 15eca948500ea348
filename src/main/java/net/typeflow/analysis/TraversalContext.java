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
package net.typeflow.analysis;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.Table;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;
import net.typeflow.flow.ReferenceKey;
import net.typeflow.types.StaticType;

/**
 * The mutable state of one narrowing query, including the nested queries the type evaluator
 * issues while it runs. It is created by the outermost query and dropped when that query returns.
 */
final class TraversalContext {

  /** What a narrowing query asks: the type of a reference given its type at scope start. */
  @AutoValue
  abstract static class Query {
    abstract ReferenceKey getKey();

    abstract StaticType getTypeAtStart();

    static Query create(ReferenceKey key, StaticType typeAtStart) {
      return new AutoValue_TraversalContext_Query(key, typeAtStart);
    }
  }

  /** The fixed-point state of a loop label being evaluated for one query. */
  static final class LoopState {
    final int depth;
    // The union of the antecedent types seen so far; null before the first one.
    @Nullable StaticType accumulated;
    // Set when a placeholder for this loop was handed out in the current attempt.
    boolean selfReferenced;
    // Set when some antecedent read the placeholder of an enclosing loop.
    boolean dependsOnOuter;

    LoopState(int depth) {
      this.depth = depth;
    }
  }

  final ComplexityGuard guard;

  private final Table<Integer, Query, LoopState> loops = HashBasedTable.create();
  private final List<LoopState> loopStack = new ArrayList<>();
  private final Set<Integer> closedGates = new HashSet<>();
  // Results computed under the current set of closed finally gates; dropped when the set changes.
  private final Table<Integer, Query, FlowNodeTypeResult> speculativeCache =
      HashBasedTable.create();

  TraversalContext(ComplexityGuard guard) {
    this.guard = guard;
  }

  // ==== Loops ====

  @Nullable
  LoopState getLoop(int nodeId, Query query) {
    return loops.get(nodeId, query);
  }

  LoopState enterLoop(int nodeId, Query query) {
    LoopState state = new LoopState(loopStack.size());
    loops.put(nodeId, query, state);
    loopStack.add(state);
    return state;
  }

  void exitLoop(int nodeId, Query query, LoopState state) {
    Preconditions.checkState(
        loopStack.get(loopStack.size() - 1) == state, "unbalanced loop evaluation");
    loopStack.remove(loopStack.size() - 1);
    loops.remove(nodeId, query);
  }

  /**
   * Records that the placeholder of {@code state} was handed out. Loops entered after it now
   * depend on a value that is not final.
   */
  void notePlaceholder(LoopState state) {
    state.selfReferenced = true;
    for (int i = state.depth + 1; i < loopStack.size(); i++) {
      loopStack.get(i).dependsOnOuter = true;
    }
  }

  // ==== Finally gates ====

  boolean isGateClosed(int gateId) {
    return closedGates.contains(gateId);
  }

  void closeGate(int gateId) {
    closedGates.add(gateId);
    speculativeCache.clear();
  }

  void openGate(int gateId) {
    closedGates.remove(gateId);
    speculativeCache.clear();
  }

  boolean isSpeculative() {
    return !closedGates.isEmpty();
  }

  @Nullable
  FlowNodeTypeResult getSpeculative(int nodeId, Query query) {
    return speculativeCache.get(nodeId, query);
  }

  void putSpeculative(int nodeId, Query query, FlowNodeTypeResult result) {
    speculativeCache.put(nodeId, query, result);
  }
}

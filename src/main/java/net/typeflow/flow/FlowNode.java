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

/**
 * A node of the control-flow graph of one execution scope.
 *
 * <p>Edges point backwards: each node lists the nodes that may execute immediately before it, its
 * antecedents. Queries start at the node attached to an expression and walk antecedents towards
 * the start of the scope.
 *
 * <p>Nodes are numbered densely within a graph; the number serves as a cache key and makes
 * printing deterministic.
 */
public abstract class FlowNode {

  /**
   * Kind of the node. This is similar to using instanceof, except that it's more efficient and can
   * be used in a switch/case.
   */
  public enum Kind {
    START,
    UNREACHABLE,
    BRANCH_LABEL,
    LOOP_LABEL,
    ASSIGNMENT,
    VARIABLE_ANNOTATION,
    CONDITION,
    PATTERN,
    EXHAUSTED_MATCH,
    CALL,
    PRE_FINALLY_GATE,
    POST_FINALLY,
    POST_CONTEXT_MANAGER,
    WILDCARD_IMPORT,
  }

  private final int id;
  private final Kind kind;

  FlowNode(int id, Kind kind) {
    this.id = id;
    this.kind = kind;
  }

  /** Returns the number of this node, unique within its graph. */
  public final int getId() {
    return id;
  }

  public final Kind kind() {
    return kind;
  }

  /** Returns the nodes that may execute immediately before this one. */
  public abstract ImmutableList<FlowNode> getAntecedents();

  @Override
  public String toString() {
    return kind.name().toLowerCase(Locale.ROOT) + "#" + id;
  }
}

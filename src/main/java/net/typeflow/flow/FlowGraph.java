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
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import net.typeflow.syntax.Node;
import net.typeflow.syntax.SourceFile;

/**
 * The flow graphs of every scope of one file, and the attachment of AST nodes to flow nodes.
 *
 * <p>Attachments are held in identity maps keyed by syntax node, so the syntax tree stays
 * immutable and may be shared.
 */
public final class FlowGraph {

  private final SourceFile file;
  private final ImmutableList<FlowNode> nodes;
  private final Map<Node, FlowNode> flowNodes;
  private final Map<Node, FlowNode> afterFlowNodes;
  private final Map<Node, FlowScope> scopes;
  private final Map<Node, FlowScope> enclosingScopes;
  // Indexed by node id; null for the unreachable nodes shared by all scopes.
  private final List<FlowScope> nodeScopes;

  FlowGraph(
      SourceFile file,
      ImmutableList<FlowNode> nodes,
      IdentityHashMap<Node, FlowNode> flowNodes,
      IdentityHashMap<Node, FlowNode> afterFlowNodes,
      IdentityHashMap<Node, FlowScope> scopes,
      IdentityHashMap<Node, FlowScope> enclosingScopes,
      List<FlowScope> nodeScopes) {
    this.file = file;
    this.nodes = nodes;
    this.flowNodes = Collections.unmodifiableMap(flowNodes);
    this.afterFlowNodes = Collections.unmodifiableMap(afterFlowNodes);
    this.scopes = Collections.unmodifiableMap(scopes);
    this.enclosingScopes = Collections.unmodifiableMap(enclosingScopes);
    this.nodeScopes = Collections.unmodifiableList(nodeScopes);
  }

  public SourceFile getFile() {
    return file;
  }

  /** Returns every node of the graph, indexed by id. */
  public ImmutableList<FlowNode> getNodes() {
    return nodes;
  }

  public FlowNode getNode(int id) {
    return nodes.get(id);
  }

  /**
   * Returns the flow node attached to an expression or statement: the point at which it is
   * evaluated. For an assignment target it is the assignment node itself.
   */
  @Nullable
  public FlowNode getFlowNode(Node node) {
    return flowNodes.get(node);
  }

  /** Like {@link #getFlowNode}, but fails if the node has no attachment. */
  public FlowNode requireFlowNode(Node node) {
    FlowNode flowNode = flowNodes.get(node);
    Preconditions.checkState(flowNode != null, "no flow node attached to %s", node);
    return flowNode;
  }

  /** Returns the flow node after a statement or call has completed, or null. */
  @Nullable
  public FlowNode getAfterFlowNode(Node node) {
    return afterFlowNodes.get(node);
  }

  /** Returns the scope a file, def or lambda introduces, or null. */
  @Nullable
  public FlowScope getScope(Node definingNode) {
    return scopes.get(definingNode);
  }

  /** Returns the scope of the file. */
  public FlowScope getModuleScope() {
    return scopes.get(file);
  }

  /** Returns the scope in which an attached node is evaluated. */
  public FlowScope getEnclosingScope(Node node) {
    FlowScope scope = enclosingScopes.get(node);
    Preconditions.checkState(scope != null, "no scope recorded for %s", node);
    return scope;
  }

  /**
   * Returns the scope a flow node belongs to, or null for the shared unreachable nodes, which
   * belong to none.
   */
  @Nullable
  public FlowScope getScopeOf(FlowNode node) {
    return nodeScopes.get(node.getId());
  }

  public int getNodeCount() {
    return nodes.size();
  }
}

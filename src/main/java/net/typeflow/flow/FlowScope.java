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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Locale;
import javax.annotation.Nullable;
import net.typeflow.syntax.Expression;
import net.typeflow.syntax.Node;

/**
 * Flow metadata of one execution scope: a file, a function or a lambda.
 *
 * <p>Nested function scopes have their own graphs; they share no nodes with their parent. A free
 * name in a nested scope is resolved by narrowing it in the parent at the node of the defining
 * statement.
 */
public final class FlowScope {

  /** The construct that introduces a scope. */
  public enum Kind {
    MODULE,
    FUNCTION,
    LAMBDA,
  }

  private final Kind kind;
  private final Node definingNode;
  @Nullable private final FlowScope parent;
  private final StartNode start;
  private final FlowNode returnNode;
  private final ImmutableSet<ReferenceKey> trackedKeys;
  private final int complexity;
  private final ImmutableMap<String, Integer> bindingCounts;
  private final ImmutableMap<String, Expression> annotations;
  private final ImmutableMap<String, Expression> aliases;
  private final boolean hasWildcardImport;

  FlowScope(
      Kind kind,
      Node definingNode,
      @Nullable FlowScope parent,
      StartNode start,
      FlowNode returnNode,
      ImmutableSet<ReferenceKey> trackedKeys,
      int complexity,
      ImmutableMap<String, Integer> bindingCounts,
      ImmutableMap<String, Expression> annotations,
      ImmutableMap<String, Expression> aliases,
      boolean hasWildcardImport) {
    this.kind = kind;
    this.definingNode = definingNode;
    this.parent = parent;
    this.start = start;
    this.returnNode = returnNode;
    this.trackedKeys = trackedKeys;
    this.complexity = complexity;
    this.bindingCounts = bindingCounts;
    this.annotations = annotations;
    this.aliases = aliases;
    this.hasWildcardImport = hasWildcardImport;
  }

  public Kind getKind() {
    return kind;
  }

  public Node getDefiningNode() {
    return definingNode;
  }

  /** Returns the lexically enclosing scope, or null for a module. */
  @Nullable
  public FlowScope getParent() {
    return parent;
  }

  public StartNode getStart() {
    return start;
  }

  /**
   * Returns the node joining every path that leaves the scope normally: returns and falling off
   * the end. For a module it is the end of the file. It is an unreachable node if no such path
   * exists.
   */
  public FlowNode getReturnNode() {
    return returnNode;
  }

  /** Returns the references assigned or narrowed anywhere in the scope. */
  public ImmutableSet<ReferenceKey> getTrackedKeys() {
    return trackedKeys;
  }

  /**
   * Reports whether queries for {@code key} need flow analysis. A key that nothing in the scope
   * assigns, invalidates or narrows has its start type everywhere the scope is reachable.
   */
  public boolean isTracked(ReferenceKey key) {
    if (hasWildcardImport && key.isName()) {
      return true;
    }
    for (ReferenceKey tracked : trackedKeys) {
      if (tracked.affects(key)) {
        return true;
      }
    }
    return false;
  }

  /** Returns the number of flow nodes and antecedent edges created for the scope. */
  public int getComplexity() {
    return complexity;
  }

  /** Reports whether the scope binds {@code name} anywhere, including as a parameter. */
  public boolean isLocal(String name) {
    return bindingCounts.containsKey(name);
  }

  /** Returns the number of bindings of {@code name} in the scope. */
  public int getBindingCount(String name) {
    return bindingCounts.getOrDefault(name, 0);
  }

  /** Returns the declared annotation of a local name or parameter, or null. */
  @Nullable
  public Expression getAnnotation(String name) {
    return annotations.get(name);
  }

  /**
   * Returns the test expression {@code name} is an alias of, or null. A name is an alias if it is
   * bound exactly once, to an expression some narrowing rule understands.
   */
  @Nullable
  public Expression getAlias(String name) {
    return aliases.get(name);
  }

  /** Reports whether the scope contains {@code from m import *}. */
  public boolean hasWildcardImport() {
    return hasWildcardImport;
  }

  @Override
  public String toString() {
    return kind.name().toLowerCase(Locale.ROOT) + " scope at " + definingNode.getStartLocation();
  }
}

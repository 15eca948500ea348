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
package net.typeflow.syntax;

/**
 * A Node is a node in a syntax tree.
 *
 * <p>Nodes are compared by identity. Analyses that attach information to nodes (such as the flow
 * graph builder) do so through identity maps rather than by mutating the tree.
 */
public abstract class Node {

  final FileLocations locs;

  Node(FileLocations locs) {
    this.locs = locs;
  }

  /** Returns the node's start offset, as a char index (zero-based count of UTF-16 codes). */
  public abstract int getStartOffset();

  /** Returns the char offset of the source position immediately after this node. */
  public abstract int getEndOffset();

  /** Returns the location of the start of this syntax node. */
  public final Location getStartLocation() {
    return locs.getLocation(getStartOffset());
  }

  /** Returns the location of the end of this syntax node. */
  public final Location getEndLocation() {
    return locs.getLocation(getEndOffset());
  }

  /** Returns the name of the file containing this node. */
  public final String getFile() {
    return locs.file();
  }

  /** Returns a pretty-printed representation of this node. */
  @Override
  public String toString() {
    return NodePrinter.print(this);
  }

  /**
   * Implements the double dispatch by calling into the node specific <code>visit</code> method of
   * the {@link NodeVisitor}
   *
   * @param visitor the {@link NodeVisitor} instance to dispatch to.
   */
  public abstract void accept(NodeVisitor visitor);
}

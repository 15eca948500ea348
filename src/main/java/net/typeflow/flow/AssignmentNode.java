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
import javax.annotation.Nullable;
import net.typeflow.syntax.Expression;
import net.typeflow.syntax.Node;
import net.typeflow.syntax.Pattern;

/**
 * A binding of a reference. Querying the bound reference at this node yields the assigned type;
 * querying a reference the binding partially overwrites (a member of the bound object) yields the
 * type at the start of the scope.
 */
public final class AssignmentNode extends LinearFlowNode {

  /** The construct that performed the binding. */
  public enum Origin {
    /** {@code x = v}: the source is the value expression. */
    VALUE,
    /** {@code x: T = v}: the source is the assignment statement. */
    ANNOTATED,
    /** {@code x += v}: the source is the assignment statement. */
    AUGMENTED,
    /** {@code a, b = v}: the source is the value; the unpack path selects the element. */
    UNPACK,
    /** {@code for x in v}: the source is the iterated collection. */
    ITERATION,
    /** {@code with v as x}: the source is the context manager expression. */
    CONTEXT_ENTER,
    /** {@code except E as x}: the source is the except clause. */
    EXCEPTION,
    /** {@code import m} and {@code from m import x}: the source is the import statement. */
    IMPORT,
    /** {@code def f}: the source is the def statement. */
    DEFINITION,
    /** A function or lambda parameter: the source is the parameter. */
    PARAMETER,
    /** A name captured by a {@code case} pattern: the source is the case clause. */
    PATTERN_CAPTURE,
    /** {@code del x}, or the implicit deletion at the end of an {@code except} clause. */
    DELETION,
  }

  private final Expression target;
  private final ReferenceKey key;
  private final Origin origin;
  private final Node source;
  private final ImmutableList<Integer> unpackPath;
  @Nullable private final Pattern capturePattern;

  AssignmentNode(
      int id,
      FlowNode antecedent,
      Expression target,
      ReferenceKey key,
      Origin origin,
      Node source,
      ImmutableList<Integer> unpackPath,
      @Nullable Pattern capturePattern) {
    super(id, Kind.ASSIGNMENT, antecedent);
    this.target = target;
    this.key = key;
    this.origin = origin;
    this.source = source;
    this.unpackPath = unpackPath;
    this.capturePattern = capturePattern;
  }

  public Expression getTarget() {
    return target;
  }

  public ReferenceKey getKey() {
    return key;
  }

  public Origin getOrigin() {
    return origin;
  }

  /** Reports whether the binding leaves the reference unbound, as {@code del} does. */
  public boolean isUnbind() {
    return origin == Origin.DELETION;
  }

  public Node getSource() {
    return source;
  }

  /**
   * Returns the element indices that lead from the source value to the bound element, outermost
   * first. Empty unless the target is nested in a tuple or list target.
   */
  public ImmutableList<Integer> getUnpackPath() {
    return unpackPath;
  }

  /** Returns the capture, as-, star- or mapping pattern that binds the name, if any. */
  @Nullable
  public Pattern getCapturePattern() {
    return capturePattern;
  }

  @Override
  public String toString() {
    return super.toString() + "(" + key + (isUnbind() ? " unbound" : "") + ")";
  }
}

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

import javax.annotation.Nullable;
import net.typeflow.flow.AssignmentNode;
import net.typeflow.flow.CallNode;
import net.typeflow.flow.FlowNode;
import net.typeflow.flow.WildcardImportNode;
import net.typeflow.narrowing.NarrowingContext;
import net.typeflow.syntax.Expression;
import net.typeflow.types.StaticType;

/**
 * The type evaluator that {@link CodeFlowAnalyzer} consults for the values flowing into a
 * reference. An evaluator usually calls back into the analyzer to narrow the references in the
 * expressions it evaluates; such nested queries share the state of the query that caused them.
 */
public interface TypeEvaluator extends NarrowingContext {

  /** Creates the evaluator of an analyzer. */
  @FunctionalInterface
  interface Factory {
    TypeEvaluator create(CodeFlowAnalyzer analyzer);
  }

  /**
   * Returns the type an assignment node binds to its target. The result is incomplete if the
   * value depends on an incomplete narrowing.
   */
  FlowNodeTypeResult getTypeOfAssignment(AssignmentNode node);

  /**
   * Returns the type of a reference expression narrowed at {@code node}, which need not be the
   * node the expression is attached to.
   */
  FlowNodeTypeResult getTypeOfReferenceAt(Expression reference, FlowNode node);

  /**
   * Returns the declared type of a reference expression, or null if it has none. Only references
   * with declared types take part in implied-else narrowing.
   */
  @Nullable
  StaticType getDeclaredType(Expression reference);

  /** Reports whether a call is known never to return. */
  boolean isCallNoReturn(CallNode node);

  /** Reports whether the exit method of a context manager may swallow exceptions. */
  boolean isExceptionContextManager(Expression contextManager);

  /**
   * Returns the type a wildcard import binds to {@code name}, or null if the imported module does
   * not export the name.
   */
  @Nullable
  StaticType getTypeOfWildcardImport(WildcardImportNode node, String name);
}

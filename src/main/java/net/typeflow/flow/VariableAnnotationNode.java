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

import net.typeflow.syntax.Expression;

/** A declaration {@code x: T} without a value. It binds nothing and is transparent to queries. */
public final class VariableAnnotationNode extends LinearFlowNode {

  private final Expression target;
  private final Expression annotation;

  VariableAnnotationNode(int id, FlowNode antecedent, Expression target, Expression annotation) {
    super(id, Kind.VARIABLE_ANNOTATION, antecedent);
    this.target = target;
    this.annotation = annotation;
  }

  public Expression getTarget() {
    return target;
  }

  public Expression getAnnotation() {
    return annotation;
  }
}

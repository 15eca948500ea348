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
import net.typeflow.syntax.Expression;
import net.typeflow.syntax.MatchStatement;

/**
 * The path that leaves a {@code match} statement after no case matched. It is unreachable if the
 * cases exhaust the type of the subject.
 */
public final class ExhaustedMatchNode extends LinearFlowNode {

  private final Expression subject;
  private final ImmutableList<MatchStatement.Case> cases;

  ExhaustedMatchNode(
      int id, FlowNode antecedent, Expression subject, ImmutableList<MatchStatement.Case> cases) {
    super(id, Kind.EXHAUSTED_MATCH, antecedent);
    this.subject = subject;
    this.cases = cases;
  }

  public Expression getSubject() {
    return subject;
  }

  public ImmutableList<MatchStatement.Case> getCases() {
    return cases;
  }
}

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
import net.typeflow.syntax.Expression;
import net.typeflow.syntax.MatchStatement;

/**
 * A point reached only if the subject of a {@code match} statement did (positive) or did not
 * (negative) match the pattern of a case.
 */
public final class PatternNode extends LinearFlowNode {

  private final Expression subject;
  private final MatchStatement.Case matchCase;
  private final boolean positive;
  private final ImmutableMap<ReferenceKey, Expression> references;

  PatternNode(
      int id,
      FlowNode antecedent,
      Expression subject,
      MatchStatement.Case matchCase,
      boolean positive,
      ImmutableMap<ReferenceKey, Expression> references) {
    super(id, Kind.PATTERN, antecedent);
    this.subject = subject;
    this.matchCase = matchCase;
    this.positive = positive;
    this.references = references;
  }

  public Expression getSubject() {
    return subject;
  }

  public MatchStatement.Case getCase() {
    return matchCase;
  }

  public boolean isPositive() {
    return positive;
  }

  /**
   * Returns the references the match narrows: the subject, the elements of a tuple subject, and
   * the object whose member is the subject.
   */
  public ImmutableMap<ReferenceKey, Expression> getReferences() {
    return references;
  }

  @Override
  public String toString() {
    return super.toString() + "(" + (positive ? "match" : "no match") + ")";
  }
}

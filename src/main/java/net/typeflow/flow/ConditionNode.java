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
import java.util.Locale;
import net.typeflow.syntax.Expression;

/**
 * A point reached only if a test expression evaluated to the given truth value.
 *
 * <p>The never variants are placed on the fall-through path of an {@code if} without an {@code
 * else}: that path is unreachable if narrowing one of the tested names for the given outcome
 * leaves nothing, which is how exhaustive {@code isinstance} chains are recognized.
 */
public final class ConditionNode extends LinearFlowNode {

  /** The outcome of the test on the path through this node. */
  public enum Polarity {
    TRUE,
    FALSE,
    TRUE_NEVER,
    FALSE_NEVER;

    public boolean isPositive() {
      return this == TRUE || this == TRUE_NEVER;
    }

    public boolean isNeverVariant() {
      return this == TRUE_NEVER || this == FALSE_NEVER;
    }
  }

  private final Expression test;
  private final Polarity polarity;
  private final ImmutableMap<ReferenceKey, Expression> references;

  ConditionNode(
      int id,
      FlowNode antecedent,
      Expression test,
      Polarity polarity,
      ImmutableMap<ReferenceKey, Expression> references) {
    super(id, Kind.CONDITION, antecedent);
    this.test = test;
    this.polarity = polarity;
    this.references = references;
  }

  public Expression getTest() {
    return test;
  }

  public Polarity getPolarity() {
    return polarity;
  }

  public boolean isPositive() {
    return polarity.isPositive();
  }

  /**
   * Returns the references the test may narrow, each mapped to an expression for it inside the
   * test, or inside the test an alias stands for.
   */
  public ImmutableMap<ReferenceKey, Expression> getReferences() {
    return references;
  }

  @Override
  public String toString() {
    return super.toString() + "(" + polarity.name().toLowerCase(Locale.ROOT) + ")";
  }
}

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

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Limits and policies of flow analysis, fixed for an {@link AnalysisSession}.
 *
 * <p>Use {@link #DEFAULT} unless a caller needs different limits:
 *
 * <pre>
 * FlowOptions options = FlowOptions.builder().maxNodeVisits(1000).build();
 * </pre>
 */
@AutoValue
public abstract class FlowOptions {

  /** The default options. */
  public static final FlowOptions DEFAULT = builder().build();

  /**
   * Scopes whose graphs have a complexity above this ceiling are not analyzed; queries in them
   * return aborted results.
   */
  public abstract int maxCodeComplexity();

  /** The number of node visits one query may make before it is aborted. */
  public abstract int maxNodeVisits();

  /** The number of times the head of a loop is re-evaluated before its result is accepted. */
  public abstract int maxLoopConvergenceAttempts();

  /**
   * The unreachable reasons in decreasing priority. A join none of whose inputs is reachable
   * reports the reason of highest priority among its inputs.
   */
  public abstract ImmutableList<Reachability> unreachablePriority();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_FlowOptions.Builder()
        .maxCodeComplexity(768)
        .maxNodeVisits(200_000)
        .maxLoopConvergenceAttempts(64)
        .unreachablePriority(
            ImmutableList.of(
                Reachability.UNREACHABLE_BY_ANALYSIS,
                Reachability.UNREACHABLE_STATIC_CONDITION,
                Reachability.UNREACHABLE_STRUCTURAL));
  }

  /** Returns the more important of two unreachable reasons. */
  Reachability strongest(Reachability a, Reachability b) {
    return unreachablePriority().indexOf(a) <= unreachablePriority().indexOf(b) ? a : b;
  }

  /** Builder for {@link FlowOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder maxCodeComplexity(int value);

    public abstract Builder maxNodeVisits(int value);

    public abstract Builder maxLoopConvergenceAttempts(int value);

    public abstract Builder unreachablePriority(ImmutableList<Reachability> value);

    abstract FlowOptions autoBuild();

    public FlowOptions build() {
      FlowOptions options = autoBuild();
      Preconditions.checkArgument(
          options.maxLoopConvergenceAttempts() >= 1, "maxLoopConvergenceAttempts must be positive");
      Preconditions.checkArgument(
          options.unreachablePriority().size() == 3
              && !options.unreachablePriority().contains(Reachability.REACHABLE)
              && ImmutableSet.copyOf(options.unreachablePriority()).size() == 3,
          "unreachablePriority must order the three unreachable reasons: %s",
          options.unreachablePriority());
      return options;
    }
  }
}

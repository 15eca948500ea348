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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public final class FlowOptionsTest {

  /** The unreachable reasons. */
  enum Reason {
    STRUCTURAL(Reachability.UNREACHABLE_STRUCTURAL),
    STATIC_CONDITION(Reachability.UNREACHABLE_STATIC_CONDITION),
    BY_ANALYSIS(Reachability.UNREACHABLE_BY_ANALYSIS);

    final Reachability value;

    Reason(Reachability value) {
      this.value = value;
    }
  }

  @Test
  public void testStrongestFollowsPriority(@TestParameter Reason a, @TestParameter Reason b) {
    FlowOptions options = FlowOptions.DEFAULT;
    Reachability strongest = options.strongest(a.value, b.value);
    assertThat(strongest).isAnyOf(a.value, b.value);
    assertThat(options.unreachablePriority().indexOf(strongest))
        .isEqualTo(
            Math.min(
                options.unreachablePriority().indexOf(a.value),
                options.unreachablePriority().indexOf(b.value)));
    assertThat(options.strongest(b.value, a.value)).isEqualTo(strongest);
  }

  @Test
  public void testCustomPriority() {
    FlowOptions options =
        FlowOptions.builder()
            .unreachablePriority(
                ImmutableList.of(
                    Reachability.UNREACHABLE_STRUCTURAL,
                    Reachability.UNREACHABLE_STATIC_CONDITION,
                    Reachability.UNREACHABLE_BY_ANALYSIS))
            .build();
    assertThat(
            options.strongest(
                Reachability.UNREACHABLE_BY_ANALYSIS, Reachability.UNREACHABLE_STRUCTURAL))
        .isEqualTo(Reachability.UNREACHABLE_STRUCTURAL);
    assertThat(
            FlowOptions.DEFAULT.strongest(
                Reachability.UNREACHABLE_BY_ANALYSIS, Reachability.UNREACHABLE_STRUCTURAL))
        .isEqualTo(Reachability.UNREACHABLE_BY_ANALYSIS);
  }

  @Test
  public void testDefaults() {
    assertThat(FlowOptions.DEFAULT.maxCodeComplexity()).isEqualTo(768);
    assertThat(FlowOptions.DEFAULT.maxLoopConvergenceAttempts()).isEqualTo(64);
    assertThat(FlowOptions.DEFAULT.toBuilder().maxNodeVisits(5).build().maxNodeVisits())
        .isEqualTo(5);
  }

  @Test
  public void testInvalidOptions() {
    assertThrows(
        IllegalArgumentException.class,
        () -> FlowOptions.builder().maxLoopConvergenceAttempts(0).build());
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                FlowOptions.builder()
                    .unreachablePriority(
                        ImmutableList.of(
                            Reachability.REACHABLE,
                            Reachability.UNREACHABLE_STRUCTURAL,
                            Reachability.UNREACHABLE_BY_ANALYSIS))
                    .build());
    assertThat(e).hasMessageThat().contains("unreachablePriority must order");
  }
}

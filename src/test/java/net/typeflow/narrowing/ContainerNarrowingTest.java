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
package net.typeflow.narrowing;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import net.typeflow.types.StaticType;
import net.typeflow.types.Types;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ContainerNarrowingTest {

  private static final StaticType A = Types.literal("a");
  private static final StaticType B = Types.literal("b");

  @Test
  public void testInKeepsElementTypes() {
    assertThat(
            ContainerNarrowing.narrowForIn(
                Types.union(Types.STR, Types.NONE), Types.list(Types.STR), true))
        .isEqualTo(Types.STR);
    assertThat(ContainerNarrowing.narrowForIn(Types.ANY, Types.list(Types.INT), true))
        .isEqualTo(Types.INT);
  }

  @Test
  public void testInNarrowsWiderMemberToElements() {
    StaticType tuple = Types.tuple(ImmutableList.of(A, B));
    assertThat(ContainerNarrowing.narrowForIn(Types.STR, tuple, true))
        .isEqualTo(Types.union(A, B));
  }

  @Test
  public void testNotInRemovesEnumeratedLiterals() {
    StaticType type = Types.union(A, B, Types.NONE);
    StaticType tuple = Types.tuple(ImmutableList.of(A, Types.NONE));
    assertThat(ContainerNarrowing.narrowForIn(type, tuple, false)).isEqualTo(B);
    assertThat(ContainerNarrowing.narrowForIn(type, Types.list(Types.STR), false)).isNull();
  }

  @Test
  public void testUnknownElementType() {
    assertThat(ContainerNarrowing.narrowForIn(Types.STR, Types.list(Types.UNKNOWN), true))
        .isNull();
    assertThat(ContainerNarrowing.narrowForIn(Types.STR, Types.INT, true)).isNull();
  }

  @Test
  public void testElementTypeOf() {
    assertThat(ContainerNarrowing.elementTypeOf(Types.dict(Types.STR, Types.INT)))
        .isEqualTo(Types.STR);
    assertThat(ContainerNarrowing.elementTypeOf(A)).isEqualTo(Types.STR);
    assertThat(
            ContainerNarrowing.elementTypeOf(
                Types.union(Types.list(Types.INT), Types.tuple(ImmutableList.of(Types.STR)))))
        .isEqualTo(Types.union(Types.INT, Types.STR));
    assertThat(ContainerNarrowing.elementTypeOf(Types.INT)).isNull();
  }
}

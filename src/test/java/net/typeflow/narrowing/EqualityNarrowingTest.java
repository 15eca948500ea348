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

import net.typeflow.types.StaticType;
import net.typeflow.types.Types;
import net.typeflow.types.Types.ClassType;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class EqualityNarrowingTest {

  private static final StaticType ONE = Types.literal(1);
  private static final StaticType TWO = Types.literal(2);

  @Test
  public void testNone() {
    StaticType optional = Types.union(Types.INT, Types.NONE);
    assertThat(EqualityNarrowing.narrowForNone(optional, true)).isEqualTo(Types.NONE);
    assertThat(EqualityNarrowing.narrowForNone(optional, false)).isEqualTo(Types.INT);
    assertThat(EqualityNarrowing.narrowForNone(Types.INT, true)).isEqualTo(Types.NEVER);
  }

  @Test
  public void testNoneWithOpenTypes() {
    assertThat(EqualityNarrowing.narrowForNone(Types.ANY, true)).isEqualTo(Types.NONE);
    assertThat(EqualityNarrowing.narrowForNone(Types.ANY, false)).isEqualTo(Types.ANY);
    assertThat(EqualityNarrowing.narrowForNone(Types.OBJECT, true)).isEqualTo(Types.NONE);
  }

  @Test
  public void testLiteralNarrowsClassToLiteral() {
    StaticType type = Types.union(Types.INT, Types.STR);
    assertThat(EqualityNarrowing.narrowForLiteral(type, Types.literal(1), true, false))
        .isEqualTo(ONE);
    // x != 1 says nothing about other ints.
    assertThat(EqualityNarrowing.narrowForLiteral(type, Types.literal(1), false, false))
        .isEqualTo(type);
  }

  @Test
  public void testLiteralUnion() {
    StaticType type = Types.union(ONE, TWO);
    assertThat(EqualityNarrowing.narrowForLiteral(type, Types.literal(1), true, true))
        .isEqualTo(ONE);
    assertThat(EqualityNarrowing.narrowForLiteral(type, Types.literal(1), false, true))
        .isEqualTo(TWO);
    assertThat(EqualityNarrowing.narrowForLiteral(type, Types.literal(3), true, true))
        .isEqualTo(Types.NEVER);
  }

  @Test
  public void testBoolIsExpandedToItsLiterals() {
    assertThat(EqualityNarrowing.narrowForLiteral(Types.BOOL, Types.TRUE, true, true))
        .isEqualTo(Types.TRUE);
    assertThat(EqualityNarrowing.narrowForLiteral(Types.BOOL, Types.TRUE, false, true))
        .isEqualTo(Types.FALSE);
  }

  @Test
  public void testEqualityKeepsSubclassWithCustomEquality() {
    ClassType myInt = Types.classBuilder("MyInt").addSupertype(Types.INT).build();
    assertThat(EqualityNarrowing.narrowForLiteral(myInt, Types.literal(1), true, false))
        .isEqualTo(myInt);
    assertThat(EqualityNarrowing.narrowForLiteral(myInt, Types.literal(1), true, true))
        .isEqualTo(Types.NEVER);
  }
}

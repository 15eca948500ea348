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
package net.typeflow.types;

import static com.google.common.truth.Truth.assertThat;

import net.typeflow.types.Types.ClassType;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link TypeRelations}. */
@RunWith(JUnit4.class)
public final class TypeRelationsTest {

  private static final ClassType ANIMAL = Types.classType("Animal");
  private static final ClassType DOG = Types.classBuilder("Dog").addSupertype(ANIMAL).build();
  private static final ClassType CAR = Types.classType("Car");

  @Test
  public void isAssignable_gradualTypesAreCompatibleBothWays() {
    assertThat(TypeRelations.isAssignable(Types.INT, Types.ANY)).isTrue();
    assertThat(TypeRelations.isAssignable(Types.ANY, Types.INT)).isTrue();
  }

  @Test
  public void isAssignable_classes() {
    assertThat(TypeRelations.isAssignable(ANIMAL, DOG)).isTrue();
    assertThat(TypeRelations.isAssignable(DOG, ANIMAL)).isFalse();
    assertThat(TypeRelations.isAssignable(Types.INT, Types.BOOL)).isTrue();
    assertThat(TypeRelations.isAssignable(Types.OBJECT, CAR)).isTrue();
  }

  @Test
  public void isAssignable_literals() {
    assertThat(TypeRelations.isAssignable(Types.STR, Types.literal("a"))).isTrue();
    assertThat(TypeRelations.isAssignable(Types.literal("a"), Types.STR)).isFalse();
    assertThat(TypeRelations.isAssignable(Types.literal("a"), Types.literal("a"))).isTrue();
  }

  @Test
  public void isAssignable_unions() {
    StaticType optionalInt = Types.union(Types.INT, Types.NONE);
    assertThat(TypeRelations.isAssignable(optionalInt, Types.NONE)).isTrue();
    assertThat(TypeRelations.isAssignable(optionalInt, Types.literal(3))).isTrue();
    assertThat(TypeRelations.isAssignable(Types.INT, optionalInt)).isFalse();
    assertThat(TypeRelations.isAssignable(Types.INT, Types.NEVER)).isTrue();
  }

  @Test
  public void isAssignable_unboundIsNeverAssignable() {
    assertThat(TypeRelations.isAssignable(Types.INT, Types.UNBOUND)).isFalse();
    assertThat(TypeRelations.isAssignable(Types.OBJECT, Types.UNBOUND)).isFalse();
  }

  @Test
  public void isAssignable_containersAreInvariant() {
    assertThat(TypeRelations.isAssignable(Types.list(ANIMAL), Types.list(DOG))).isFalse();
    assertThat(TypeRelations.isAssignable(Types.list(Types.ANY), Types.list(DOG))).isTrue();
    assertThat(TypeRelations.isAssignable(Types.tuple(ANIMAL), Types.tuple(DOG))).isTrue();
    assertThat(TypeRelations.isAssignable(Types.tuple(ANIMAL), Types.tuple(DOG, DOG))).isFalse();
  }

  @Test
  public void isDisjoint() {
    assertThat(TypeRelations.isDisjoint(Types.literal("a"), Types.literal("b"))).isTrue();
    assertThat(TypeRelations.isDisjoint(Types.NONE, Types.INT)).isTrue();
    assertThat(TypeRelations.isDisjoint(Types.INT, Types.STR)).isTrue();
    assertThat(TypeRelations.isDisjoint(Types.INT, Types.BOOL)).isFalse();
    // User classes may share a subclass.
    assertThat(TypeRelations.isDisjoint(ANIMAL, CAR)).isFalse();
    assertThat(TypeRelations.isDisjoint(Types.ANY, Types.NONE)).isFalse();
    assertThat(TypeRelations.isDisjoint(Types.union(Types.INT, Types.NONE), Types.STR)).isTrue();
  }

  @Test
  public void subtypes_expandsBool() {
    assertThat(TypeRelations.subtypes(Types.union(Types.BOOL, Types.NONE)))
        .containsExactly(Types.TRUE, Types.FALSE, Types.NONE)
        .inOrder();
  }

  @Test
  public void truthiness() {
    assertThat(TypeRelations.canBeFalsy(Types.NONE)).isTrue();
    assertThat(TypeRelations.canBeTruthy(Types.NONE)).isFalse();
    assertThat(TypeRelations.canBeFalsy(Types.literal(1))).isFalse();
    assertThat(TypeRelations.canBeFalsy(DOG)).isFalse();
    assertThat(TypeRelations.canBeFalsy(Types.tuple())).isTrue();
    assertThat(TypeRelations.canBeTruthy(Types.tuple())).isFalse();
    assertThat(TypeRelations.canBeFalsy(Types.tuple(Types.INT))).isFalse();
  }

  @Test
  public void removeFalsiness() {
    StaticType type = Types.union(Types.INT, Types.NONE, Types.BOOL);
    assertThat(TypeRelations.removeFalsiness(type)).isEqualTo(Types.union(Types.INT, Types.TRUE));
  }

  @Test
  public void removeTruthiness() {
    StaticType type = Types.union(DOG, Types.NONE, Types.BOOL, Types.literal("x"));
    assertThat(TypeRelations.removeTruthiness(type))
        .isEqualTo(Types.union(Types.NONE, Types.FALSE));
  }

  @Test
  public void removeMembers() {
    StaticType type = Types.union(Types.INT, Types.UNBOUND, Types.NONE);
    assertThat(TypeRelations.removeUnbound(type)).isEqualTo(Types.union(Types.INT, Types.NONE));
    assertThat(TypeRelations.removeNone(type)).isEqualTo(Types.union(Types.INT, Types.UNBOUND));
    assertThat(TypeRelations.removeNone(Types.INT)).isSameInstanceAs(Types.INT);
    assertThat(TypeRelations.isPossiblyUnbound(type)).isTrue();
    assertThat(TypeRelations.isUnbound(type)).isFalse();
  }

  @Test
  public void stripLiterals() {
    StaticType type = Types.union(Types.literal(1), Types.literal(2), Types.literal("a"));
    assertThat(TypeRelations.stripLiterals(type)).isEqualTo(Types.union(Types.INT, Types.STR));
  }

  @Test
  public void nominalClass() {
    assertThat(TypeRelations.nominalClass(Types.literal("a"))).isEqualTo(Types.STR);
    assertThat(TypeRelations.nominalClass(Types.list(Types.INT))).isEqualTo(Types.LIST_CLASS);
    assertThat(TypeRelations.nominalClass(Types.NONE)).isNull();
  }
}

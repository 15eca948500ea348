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
import net.typeflow.types.Types.CallableType;
import net.typeflow.types.Types.ClassType;
import net.typeflow.types.Types.GuardKind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ClassNarrowingTest {

  private static final ClassType ANIMAL = Types.classType("Animal");
  private static final ClassType DOG = Types.classBuilder("Dog").addSupertype(ANIMAL).build();
  private static final ClassType ROBOT = Types.classType("Robot");

  private static StaticType isinstance(StaticType type, StaticType classInfo, boolean positive) {
    return ClassNarrowing.narrowForIsInstance(type, classInfo, true, positive);
  }

  private static StaticType issubclass(StaticType type, StaticType classInfo, boolean positive) {
    return ClassNarrowing.narrowForIsInstance(type, classInfo, false, positive);
  }

  @Test
  public void testIsInstanceOfBuiltin() {
    StaticType type = Types.union(Types.INT, Types.STR, Types.NONE);
    StaticType intClass = Types.classObject(Types.INT);
    assertThat(isinstance(type, intClass, true)).isEqualTo(Types.INT);
    assertThat(isinstance(type, intClass, false)).isEqualTo(Types.union(Types.STR, Types.NONE));
    assertThat(isinstance(Types.STR, intClass, true)).isEqualTo(Types.NEVER);
  }

  @Test
  public void testIsInstanceOfSubclass() {
    assertThat(isinstance(ANIMAL, Types.classObject(DOG), true)).isEqualTo(DOG);
    // An Animal that is not a Dog is still an Animal.
    assertThat(isinstance(ANIMAL, Types.classObject(DOG), false)).isEqualTo(ANIMAL);
    assertThat(isinstance(DOG, Types.classObject(ANIMAL), false)).isEqualTo(Types.NEVER);
  }

  @Test
  public void testIsInstanceOfUnrelatedUserClass() {
    assertThat(isinstance(ANIMAL, Types.classObject(ROBOT), true)).isEqualTo(ROBOT);
    assertThat(isinstance(ANIMAL, Types.classObject(ROBOT), false)).isEqualTo(ANIMAL);
  }

  @Test
  public void testIsInstanceOfOpenTypes() {
    assertThat(isinstance(Types.ANY, Types.classObject(DOG), true)).isEqualTo(DOG);
    assertThat(isinstance(Types.ANY, Types.classObject(DOG), false)).isEqualTo(Types.ANY);
  }

  @Test
  public void testClassInfoTupleAndUnion() {
    StaticType type = Types.union(Types.INT, Types.STR, Types.NONE);
    StaticType tuple =
        Types.tuple(ImmutableList.of(Types.classObject(Types.INT), Types.classObject(Types.STR)));
    StaticType union = Types.union(Types.classObject(Types.INT), Types.classObject(Types.STR));
    assertThat(isinstance(type, tuple, true)).isEqualTo(Types.union(Types.INT, Types.STR));
    assertThat(isinstance(type, union, false)).isEqualTo(Types.NONE);
  }

  @Test
  public void testUnknownClassInfo() {
    assertThat(isinstance(Types.INT, Types.INT, true)).isNull();
    assertThat(isinstance(Types.INT, Types.ANY, true)).isNull();
  }

  @Test
  public void testIsSubclass() {
    StaticType type = Types.union(Types.classObject(DOG), Types.classObject(Types.INT), ANIMAL);
    StaticType animalClass = Types.classObject(ANIMAL);
    assertThat(issubclass(type, animalClass, true)).isEqualTo(Types.classObject(DOG));
    assertThat(issubclass(type, animalClass, false))
        .isEqualTo(Types.union(Types.classObject(Types.INT), ANIMAL));
  }

  @Test
  public void testTypeGuard() {
    CallableType guard = Types.typeGuard(ImmutableList.of(Types.ANY), GuardKind.TYPE_GUARD, DOG);
    assertThat(ClassNarrowing.narrowForTypeGuard(ANIMAL, guard, true)).isEqualTo(DOG);
    assertThat(ClassNarrowing.narrowForTypeGuard(ANIMAL, guard, false)).isNull();
  }

  @Test
  public void testTypeIs() {
    CallableType guard = Types.typeGuard(ImmutableList.of(Types.ANY), GuardKind.TYPE_IS, Types.STR);
    StaticType type = Types.union(Types.INT, Types.STR);
    assertThat(ClassNarrowing.narrowForTypeGuard(type, guard, true)).isEqualTo(Types.STR);
    assertThat(ClassNarrowing.narrowForTypeGuard(type, guard, false)).isEqualTo(Types.INT);
  }

  @Test
  public void testNotAGuard() {
    assertThat(ClassNarrowing.narrowForTypeGuard(Types.INT, Types.callable(Types.BOOL), true))
        .isNull();
  }
}

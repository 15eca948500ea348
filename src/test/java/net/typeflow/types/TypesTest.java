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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import net.typeflow.types.Types.ClassType;
import net.typeflow.types.Types.UnionType;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for type constructors and their string forms. */
@RunWith(JUnit4.class)
public final class TypesTest {

  @Test
  public void union_flattensAndRemovesDuplicates() {
    StaticType inner = Types.union(Types.INT, Types.STR);
    StaticType outer = Types.union(inner, Types.NONE, Types.INT);

    assertThat(outer).isInstanceOf(UnionType.class);
    assertThat(((UnionType) outer).getTypes())
        .containsExactly(Types.INT, Types.STR, Types.NONE)
        .inOrder();
  }

  @Test
  public void union_isOrderInsensitiveForEquality() {
    assertThat(Types.union(Types.INT, Types.NONE)).isEqualTo(Types.union(Types.NONE, Types.INT));
  }

  @Test
  public void union_singletonAndEmpty() {
    assertThat(Types.union(Types.INT)).isEqualTo(Types.INT);
    assertThat(Types.union(Types.INT, Types.INT)).isEqualTo(Types.INT);
    assertThat(Types.union(ImmutableList.of())).isEqualTo(Types.NEVER);
    assertThat(Types.union(Types.NEVER, Types.STR)).isEqualTo(Types.STR);
  }

  @Test
  public void union_objectAbsorbsEverything() {
    assertThat(Types.union(Types.INT, Types.OBJECT, Types.NONE)).isEqualTo(Types.OBJECT);
  }

  @Test
  public void union_literalAbsorbedByItsClass() {
    assertThat(Types.union(Types.literal(1), Types.INT)).isEqualTo(Types.INT);
    assertThat(Types.union(Types.literal("a"), Types.INT))
        .isEqualTo(Types.union(Types.literal("a"), Types.INT));
  }

  @Test
  public void union_boolLiteralsCondense() {
    assertThat(Types.union(Types.TRUE, Types.FALSE)).isEqualTo(Types.BOOL);
    assertThat(Types.union(Types.NONE, Types.FALSE, Types.TRUE))
        .isEqualTo(Types.union(Types.NONE, Types.BOOL));
  }

  @Test
  public void unfoldUnion() {
    assertThat(Types.unfoldUnion(Types.INT)).containsExactly(Types.INT);
    assertThat(Types.unfoldUnion(Types.union(Types.INT, Types.NONE)))
        .containsExactly(Types.INT, Types.NONE);
  }

  @Test
  public void literal_rejectsUnsupportedValues() {
    assertThrows(IllegalArgumentException.class, () -> Types.literal(Types.FLOAT, 1.5));
  }

  @Test
  public void literal_falsiness() {
    assertThat(Types.literal(0).isFalsy()).isTrue();
    assertThat(Types.literal(3).isFalsy()).isFalse();
    assertThat(Types.literal("").isFalsy()).isTrue();
    assertThat(Types.literal("x").isFalsy()).isFalse();
    assertThat(Types.FALSE.isFalsy()).isTrue();
  }

  @Test
  public void classType_subclassing() {
    ClassType base = Types.classType("Base");
    ClassType derived = Types.classBuilder("Derived").addSupertype(base).build();

    assertThat(derived.isSubclassOf(base)).isTrue();
    assertThat(base.isSubclassOf(derived)).isFalse();
    assertThat(Types.BOOL.isSubclassOf(Types.INT)).isTrue();
  }

  @Test
  public void classType_inheritsFields() {
    ClassType base = Types.classBuilder("Base").addField("x", Types.INT).build();
    ClassType derived =
        Types.classBuilder("Derived").addSupertype(base).addField("y", Types.STR).build();

    assertThat(derived.getField("x")).isEqualTo(Types.INT);
    assertThat(derived.getField("y")).isEqualTo(Types.STR);
    assertThat(derived.getField("z")).isNull();
  }

  @Test
  public void typedDict_keys() {
    Types.TypedDictType movie =
        Types.typedDictBuilder("Movie")
            .addRequiredKey("title", Types.STR)
            .addNotRequiredKey("year", Types.INT)
            .build();

    assertThat(movie.getKeyType("title")).isEqualTo(Types.STR);
    assertThat(movie.getKeyType("year")).isEqualTo(Types.INT);
    assertThat(movie.getKeyType("rating")).isNull();
  }

  @Test
  public void mapSubtypes() {
    StaticType type = Types.union(Types.literal(1), Types.literal("a"));
    assertThat(Types.mapSubtypes(type, TypeRelations::stripLiterals))
        .isEqualTo(Types.union(Types.INT, Types.STR));
  }

  @Test
  public void stringForms() {
    assertThat(Types.union(Types.INT, Types.NONE).toString()).isEqualTo("int | None");
    assertThat(Types.literal("a").toString()).isEqualTo("Literal['a']");
    assertThat(Types.TRUE.toString()).isEqualTo("Literal[True]");
    assertThat(Types.literal(-2).toString()).isEqualTo("Literal[-2]");
    assertThat(Types.list(Types.STR).toString()).isEqualTo("list[str]");
    assertThat(Types.tuple().toString()).isEqualTo("tuple[()]");
    assertThat(Types.tuple(Types.INT, Types.STR).toString()).isEqualTo("tuple[int, str]");
    assertThat(Types.dict(Types.STR, Types.INT).toString()).isEqualTo("dict[str, int]");
    assertThat(Types.classObject(Types.INT).toString()).isEqualTo("type[int]");
    assertThat(Types.UNBOUND.toString()).isEqualTo("Unbound");
  }
}

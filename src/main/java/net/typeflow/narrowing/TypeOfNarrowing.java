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

import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import net.typeflow.types.StaticType;
import net.typeflow.types.TypeRelations;
import net.typeflow.types.Types;
import net.typeflow.types.Types.ClassType;

/**
 * Narrowing for {@code type(x) is C} and {@code type(x) == C}.
 *
 * <p>The positive path keeps members whose class is exactly {@code C}, and narrows superclasses
 * of {@code C} to it. The negative path is not narrowed: a member of class {@code C} may still
 * be an instance of a subclass.
 */
public final class TypeOfNarrowing {

  private TypeOfNarrowing() {}

  @Nullable
  public static StaticType narrow(StaticType type, ClassType cls, boolean positive) {
    if (!positive) {
      return null;
    }
    List<StaticType> result = new ArrayList<>();
    for (StaticType member : TypeRelations.subtypes(type)) {
      if (member.equals(Types.ANY) || member.equals(Types.UNKNOWN) || member.equals(Types.OBJECT)) {
        result.add(cls);
        continue;
      }
      ClassType memberClass = TypeRelations.nominalClass(member);
      if (memberClass == null) {
        continue;
      }
      if (memberClass.equals(cls)) {
        result.add(member);
      } else if (cls.isSubclassOf(memberClass)) {
        result.add(cls);
      }
    }
    return Types.union(result);
  }
}

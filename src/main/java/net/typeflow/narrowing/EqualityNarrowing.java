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
import net.typeflow.types.StaticType;
import net.typeflow.types.TypeRelations;
import net.typeflow.types.Types;
import net.typeflow.types.Types.LiteralType;
import net.typeflow.types.Types.TypeVariableType;

/**
 * Narrowing for comparisons of a reference with {@code None} or a literal, by identity ({@code
 * is}) or equality ({@code ==}).
 *
 * <p>A positive comparison keeps the members that may hold the compared value, narrowing a class
 * to the literal when the literal is one of its instances. A negative comparison removes only the
 * members that are exactly that value; {@code x != 1} says nothing about a plain {@code int}.
 */
public final class EqualityNarrowing {

  private EqualityNarrowing() {}

  /** Narrows for {@code x is None} or {@code x == None}, or their negations. */
  public static StaticType narrowForNone(StaticType type, boolean positive) {
    List<StaticType> result = new ArrayList<>();
    for (StaticType member : TypeRelations.subtypes(type)) {
      if (positive) {
        if (member.equals(Types.NONE)) {
          result.add(member);
        } else if (isOpen(member)) {
          result.add(Types.NONE);
        } else if (member instanceof TypeVariableType var
            && TypeRelations.isAssignable(var.getUpperBound(), Types.NONE)) {
          result.add(member);
        }
      } else if (!member.equals(Types.NONE)) {
        result.add(member);
      }
    }
    return Types.union(result);
  }

  /**
   * Narrows for a comparison with a literal value. {@code identity} distinguishes {@code is} from
   * {@code ==}; the only difference is that equality against a class with unknown equality
   * semantics keeps the class on the positive path.
   */
  public static StaticType narrowForLiteral(
      StaticType type, LiteralType literal, boolean positive, boolean identity) {
    List<StaticType> result = new ArrayList<>();
    for (StaticType member : TypeRelations.subtypes(type)) {
      if (positive) {
        if (member instanceof LiteralType) {
          if (member.equals(literal)) {
            result.add(member);
          }
        } else if (isOpen(member)) {
          result.add(literal);
        } else if (TypeRelations.isAssignable(member, literal)) {
          result.add(literal);
        } else if (!identity && !TypeRelations.isDisjoint(member, literal)) {
          result.add(member);
        }
      } else if (!member.equals(literal)) {
        result.add(member);
      }
    }
    return Types.union(result);
  }

  // Types any value may inhabit.
  private static boolean isOpen(StaticType type) {
    return type.equals(Types.ANY) || type.equals(Types.UNKNOWN) || type.equals(Types.OBJECT);
  }
}

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
import net.typeflow.types.Types.LiteralType;
import net.typeflow.types.Types.TupleType;
import net.typeflow.types.Types.TypedDictType;

/**
 * Narrowing of a union of records by a comparison of one of their fields with a literal: {@code
 * x.kind == "a"}, {@code x["kind"] == "a"}, {@code x[0] is None}.
 *
 * <p>A member is examined only if its discriminant has a literal (or None) type. On the positive
 * path members whose discriminant cannot equal the value are removed; on the negative path
 * members whose discriminant is exactly the value are removed. Other members are kept.
 */
public final class DiscriminantNarrowing {

  private DiscriminantNarrowing() {}

  /** The discriminant of one union member, or null if the member has none. */
  private interface Discriminant {
    @Nullable
    StaticType of(StaticType member);
  }

  /** Narrows for a comparison of the attribute {@code field}. */
  public static StaticType narrowForMember(
      StaticType type, String field, StaticType value, boolean positive) {
    return narrow(type, member -> member.getField(field), value, positive);
  }

  /** Narrows for a comparison of the string key {@code key} of a typed dict. */
  public static StaticType narrowForKey(
      StaticType type, String key, StaticType value, boolean positive) {
    return narrow(
        type,
        member -> member instanceof TypedDictType dict ? dict.getKeyType(key) : null,
        value,
        positive);
  }

  /** Narrows for a comparison of element {@code index} of a fixed-length tuple. */
  public static StaticType narrowForTupleIndex(
      StaticType type, int index, StaticType value, boolean positive) {
    return narrow(
        type,
        member -> {
          if (!(member instanceof TupleType tuple)) {
            return null;
          }
          int n = tuple.getElementTypes().size();
          int i = index < 0 ? index + n : index;
          return i >= 0 && i < n ? tuple.getElementTypes().get(i) : null;
        },
        value,
        positive);
  }

  private static StaticType narrow(
      StaticType type, Discriminant discriminant, StaticType value, boolean positive) {
    List<StaticType> result = new ArrayList<>();
    for (StaticType member : Types.unfoldUnion(type)) {
      StaticType tag = discriminant.of(member);
      if (tag == null || !isLiteralLike(tag)) {
        result.add(member);
      } else if (positive) {
        if (!TypeRelations.isDisjoint(tag, value)) {
          result.add(member);
        }
      } else if (!tag.equals(value)) {
        result.add(member);
      }
    }
    return Types.union(result);
  }

  private static boolean isLiteralLike(StaticType type) {
    for (StaticType member : TypeRelations.subtypes(type)) {
      if (!(member instanceof LiteralType) && !member.equals(Types.NONE)) {
        return false;
      }
    }
    return true;
  }
}

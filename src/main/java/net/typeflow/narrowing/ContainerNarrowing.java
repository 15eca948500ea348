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
import net.typeflow.types.Types.DictType;
import net.typeflow.types.Types.ListType;
import net.typeflow.types.Types.LiteralType;
import net.typeflow.types.Types.TupleType;
import net.typeflow.types.Types.TypedDictType;

/** Narrowing of an element by a membership test: {@code x in container}. */
public final class ContainerNarrowing {

  private ContainerNarrowing() {}

  /**
   * Narrows the type of {@code x} in {@code x in container} or {@code x not in container}.
   *
   * <p>On the positive path, each member of {@code x} that is an element type is kept, and a
   * member that is wider than some element types is replaced by them. On the negative path only
   * literals enumerated by a fixed-length tuple of literals are removed. Returns null if the
   * element type of the container is unknown.
   */
  @Nullable
  public static StaticType narrowForIn(
      StaticType type, StaticType containerType, boolean positive) {
    if (!positive) {
      return narrowForNotIn(type, containerType);
    }
    StaticType elementType = elementTypeOf(containerType);
    if (elementType == null || TypeRelations.containsUnknown(elementType)) {
      return null;
    }
    List<StaticType> result = new ArrayList<>();
    for (StaticType member : TypeRelations.subtypes(type)) {
      if (member.equals(Types.ANY) || member.equals(Types.UNKNOWN)) {
        result.add(elementType);
      } else if (TypeRelations.isAssignable(elementType, member)) {
        result.add(member);
      } else {
        for (StaticType element : TypeRelations.subtypes(elementType)) {
          if (TypeRelations.isAssignable(member, element)) {
            result.add(element);
          }
        }
      }
    }
    return Types.union(result);
  }

  @Nullable
  private static StaticType narrowForNotIn(StaticType type, StaticType containerType) {
    if (!(containerType instanceof TupleType tuple)) {
      return null;
    }
    for (StaticType element : tuple.getElementTypes()) {
      if (!(element instanceof LiteralType) && !element.equals(Types.NONE)) {
        return null;
      }
    }
    List<StaticType> result = new ArrayList<>();
    for (StaticType member : TypeRelations.subtypes(type)) {
      if (!tuple.getElementTypes().contains(member)) {
        result.add(member);
      }
    }
    return Types.union(result);
  }

  /** Returns the type of the values iteration over a container yields, or null if unknown. */
  @Nullable
  public static StaticType elementTypeOf(StaticType containerType) {
    List<StaticType> result = new ArrayList<>();
    for (StaticType member : Types.unfoldUnion(containerType)) {
      if (member instanceof ListType list) {
        result.add(list.getElementType());
      } else if (member instanceof TupleType tuple) {
        result.addAll(tuple.getElementTypes());
      } else if (member instanceof DictType dict) {
        result.add(dict.getKeyType());
      } else if (member instanceof TypedDictType) {
        result.add(Types.STR);
      } else if (member.equals(Types.STR)
          || (member instanceof LiteralType literal && literal.getBaseClass().equals(Types.STR))) {
        result.add(Types.STR);
      } else {
        return null;
      }
    }
    return Types.union(result);
  }
}

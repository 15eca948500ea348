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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import net.typeflow.types.StaticType;
import net.typeflow.types.TypeRelations;
import net.typeflow.types.Types;
import net.typeflow.types.Types.CallableType;
import net.typeflow.types.Types.ClassObjectType;
import net.typeflow.types.Types.ClassType;
import net.typeflow.types.Types.TupleType;
import net.typeflow.types.Types.TypeVariableType;

/**
 * Narrowing for class tests: {@code isinstance(x, C)}, {@code issubclass(x, C)}, and calls of
 * user-defined type guards.
 *
 * <p>On the positive path a member that is a subclass of a tested class is kept, and a member
 * that is a superclass of one is replaced by it. On the negative path only members entirely
 * covered by a tested class are removed.
 */
public final class ClassNarrowing {

  private ClassNarrowing() {}

  /**
   * Narrows for {@code isinstance(x, classInfo)} or, if {@code instanceCheck} is false, {@code
   * issubclass(x, classInfo)}. The second argument is a class object, or a tuple or union of
   * them. Returns null if it is not, since the test is then unknown.
   *
   * <p>An instance check applies to instances; a subclass check applies only to members that are
   * class objects, and narrows their instance types.
   */
  @Nullable
  public static StaticType narrowForIsInstance(
      StaticType type, StaticType classInfo, boolean instanceCheck, boolean positive) {
    List<StaticType> filters = new ArrayList<>();
    if (!collectFilters(classInfo, filters)) {
      return null;
    }
    List<StaticType> result = new ArrayList<>();
    for (StaticType member : TypeRelations.subtypes(type)) {
      if (instanceCheck) {
        result.add(filterInstance(member, filters, positive));
      } else if (member instanceof ClassObjectType cls) {
        StaticType narrowed = filterInstance(cls.getInstanceType(), filters, positive);
        result.add(narrowed.equals(Types.NEVER) ? narrowed : Types.classObject(narrowed));
      } else if (isOpen(member)) {
        result.add(positive ? Types.classObject(Types.union(filters)) : member);
      } else if (!positive) {
        result.add(member);
      }
    }
    return Types.union(result);
  }

  private static boolean collectFilters(StaticType classInfo, List<StaticType> filters) {
    if (classInfo instanceof ClassObjectType cls) {
      filters.add(cls.getInstanceType());
      return true;
    }
    if (classInfo instanceof TupleType tuple) {
      for (StaticType element : tuple.getElementTypes()) {
        if (!collectFilters(element, filters)) {
          return false;
        }
      }
      return true;
    }
    if (classInfo instanceof Types.UnionType union) {
      for (StaticType element : union.getTypes()) {
        if (!collectFilters(element, filters)) {
          return false;
        }
      }
      return true;
    }
    return false;
  }

  /** Filters one member against the tested classes. */
  private static StaticType filterInstance(
      StaticType member, List<StaticType> filters, boolean positive) {
    if (isOpen(member)) {
      return positive ? Types.union(filters) : member;
    }
    List<StaticType> kept = new ArrayList<>();
    for (StaticType filter : filters) {
      if (TypeRelations.isAssignable(filter, upperBound(member))) {
        // The member is entirely an instance of the filter.
        return positive ? member : Types.NEVER;
      }
      if (positive && isSubclass(filter, upperBound(member))) {
        kept.add(member instanceof TypeVariableType ? member : filter);
      } else if (positive && !TypeRelations.isDisjoint(filter, upperBound(member))) {
        // Unrelated classes may still share a subclass, whose instances pass the test.
        kept.add(filter);
      }
    }
    return positive ? Types.union(kept) : member;
  }

  private static boolean isSubclass(StaticType sub, StaticType sup) {
    ClassType subClass = TypeRelations.nominalClass(sub);
    ClassType supClass = TypeRelations.nominalClass(sup);
    return subClass != null && supClass != null && subClass.isSubclassOf(supClass);
  }

  private static StaticType upperBound(StaticType type) {
    return type instanceof TypeVariableType var ? var.getUpperBound() : type;
  }

  /**
   * Narrows for a call of a type guard function. A {@code TypeGuard[T]} narrows the positive
   * path to {@code T} and leaves the negative path alone; a {@code TypeIs[T]} narrows both paths
   * like an instance check against {@code T}. Returns null if {@code guard} is not a guard.
   */
  @Nullable
  public static StaticType narrowForTypeGuard(
      StaticType type, CallableType guard, boolean positive) {
    StaticType guarded = guard.getGuardedType();
    if (guarded == null) {
      return null;
    }
    switch (guard.getGuardKind()) {
      case TYPE_GUARD:
        return positive ? guarded : null;
      case TYPE_IS:
        {
          List<StaticType> filters = ImmutableList.copyOf(Types.unfoldUnion(guarded));
          List<StaticType> result = new ArrayList<>();
          for (StaticType member : TypeRelations.subtypes(type)) {
            result.add(filterGuarded(member, filters, positive));
          }
          return Types.union(result);
        }
      default:
        return null;
    }
  }

  // Like filterInstance, but the filters are arbitrary types rather than classes.
  private static StaticType filterGuarded(
      StaticType member, List<StaticType> filters, boolean positive) {
    if (isOpen(member)) {
      return positive ? Types.union(filters) : member;
    }
    List<StaticType> kept = new ArrayList<>();
    for (StaticType filter : filters) {
      if (TypeRelations.isAssignable(filter, member)) {
        return positive ? member : Types.NEVER;
      }
      if (positive && TypeRelations.isAssignable(member, filter)) {
        kept.add(filter);
      }
    }
    return positive ? Types.union(kept) : member;
  }

  private static boolean isOpen(StaticType type) {
    return type.equals(Types.ANY) || type.equals(Types.UNKNOWN) || type.equals(Types.OBJECT);
  }
}

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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import net.typeflow.types.Types.CallableType;
import net.typeflow.types.Types.ClassObjectType;
import net.typeflow.types.Types.ClassType;
import net.typeflow.types.Types.DictType;
import net.typeflow.types.Types.ListType;
import net.typeflow.types.Types.LiteralType;
import net.typeflow.types.Types.OverloadedType;
import net.typeflow.types.Types.TupleType;
import net.typeflow.types.Types.TypeVariableType;
import net.typeflow.types.Types.TypedDictType;
import net.typeflow.types.Types.UnionType;

/**
 * Relations between types: assignability, disjointness, decomposition and the truthiness
 * operations used by narrowing.
 */
public final class TypeRelations {

  private TypeRelations() {} // uninstantiable

  /**
   * Returns whether a value of type {@code src} can be assigned to a location of type {@code
   * dest}.
   *
   * <p>In gradual typing terms, {@code src} must be a "consistent subtype of" {@code dest}: {@code
   * Any} and {@code Unknown} are compatible with everything in both directions.
   */
  public static boolean isAssignable(StaticType dest, StaticType src) {
    if (isGradual(dest) || isGradual(src)) {
      return true;
    }
    if (src.equals(Types.NEVER) || dest.equals(src)) {
      return true;
    }
    if (src instanceof UnionType union) {
      return union.getTypes().stream().allMatch(member -> isAssignable(dest, member));
    }
    if (dest instanceof UnionType union) {
      return union.getTypes().stream().anyMatch(member -> isAssignable(member, src));
    }
    if (src.equals(Types.UNBOUND) || dest.equals(Types.UNBOUND)) {
      return false;
    }
    if (dest.equals(Types.OBJECT)) {
      return true;
    }
    if (src instanceof TypeVariableType var) {
      return isAssignable(dest, var.getUpperBound());
    }
    if (dest instanceof TypeVariableType || dest instanceof LiteralType) {
      return false;
    }
    if (dest instanceof ClassType destClass) {
      ClassType srcClass = nominalClass(src);
      return srcClass != null && srcClass.isSubclassOf(destClass);
    }
    if (dest instanceof ListType destList) {
      return src instanceof ListType srcList
          && isEquivalent(destList.getElementType(), srcList.getElementType());
    }
    if (dest instanceof TupleType destTuple) {
      if (!(src instanceof TupleType srcTuple)
          || destTuple.getElementTypes().size() != srcTuple.getElementTypes().size()) {
        return false;
      }
      for (int i = 0; i < destTuple.getElementTypes().size(); i++) {
        if (!isAssignable(destTuple.getElementTypes().get(i), srcTuple.getElementTypes().get(i))) {
          return false;
        }
      }
      return true;
    }
    if (dest instanceof DictType destDict) {
      return src instanceof DictType srcDict
          && isEquivalent(destDict.getKeyType(), srcDict.getKeyType())
          && isEquivalent(destDict.getValueType(), srcDict.getValueType());
    }
    if (dest instanceof TypedDictType destDict) {
      return src instanceof TypedDictType srcDict && isTypedDictAssignable(destDict, srcDict);
    }
    if (dest instanceof CallableType destCallable) {
      StaticType returns = returnTypeOf(src);
      return returns != null && isAssignable(destCallable.getReturnType(), returns);
    }
    if (dest instanceof ClassObjectType destClass) {
      return src instanceof ClassObjectType srcClass
          && isAssignable(destClass.getInstanceType(), srcClass.getInstanceType());
    }
    return false;
  }

  private static boolean isGradual(StaticType type) {
    return type.equals(Types.ANY) || type.equals(Types.UNKNOWN);
  }

  private static boolean isEquivalent(StaticType t1, StaticType t2) {
    return isAssignable(t1, t2) && isAssignable(t2, t1);
  }

  private static boolean isTypedDictAssignable(TypedDictType dest, TypedDictType src) {
    for (var entry : dest.getRequiredKeys().entrySet()) {
      StaticType srcType = src.getRequiredKeys().get(entry.getKey());
      if (srcType == null || !isEquivalent(entry.getValue(), srcType)) {
        return false;
      }
    }
    for (var entry : dest.getNotRequiredKeys().entrySet()) {
      StaticType srcType = src.getNotRequiredKeys().get(entry.getKey());
      if (srcType == null || !isEquivalent(entry.getValue(), srcType)) {
        return false;
      }
    }
    return true;
  }

  @Nullable
  private static StaticType returnTypeOf(StaticType callable) {
    if (callable instanceof CallableType c) {
      return c.getReturnType();
    } else if (callable instanceof OverloadedType o) {
      List<StaticType> returns = new ArrayList<>();
      for (CallableType c : o.getOverloads()) {
        returns.add(c.getReturnType());
      }
      return Types.union(returns);
    } else if (callable instanceof ClassObjectType c) {
      return c.getInstanceType();
    }
    return null;
  }

  /**
   * Returns the class a value of the given type is an instance of, or null if the type is not a
   * single nominal type.
   */
  @Nullable
  public static ClassType nominalClass(StaticType type) {
    if (type instanceof ClassType c) {
      return c;
    } else if (type instanceof LiteralType literal) {
      return literal.getBaseClass();
    }
    for (StaticType sup : type.getSupertypes()) {
      if (sup instanceof ClassType c) {
        return c;
      }
    }
    return null;
  }

  /**
   * Reports whether no value can have both types.
   *
   * <p>The answer errs on the side of "not disjoint": only distinct literals, None against a
   * non-None type, and unrelated builtin classes are considered disjoint, since user classes may
   * share a subclass.
   */
  public static boolean isDisjoint(StaticType t1, StaticType t2) {
    if (t1 instanceof UnionType union) {
      return union.getTypes().stream().allMatch(member -> isDisjoint(member, t2));
    }
    if (t2 instanceof UnionType union) {
      return union.getTypes().stream().allMatch(member -> isDisjoint(t1, member));
    }
    if (isGradual(t1) || isGradual(t2) || t1.equals(Types.OBJECT) || t2.equals(Types.OBJECT)) {
      return false;
    }
    if (t1.equals(Types.NEVER) || t2.equals(Types.NEVER)) {
      return true;
    }
    if (t1.equals(Types.NONE) || t2.equals(Types.NONE)) {
      return !t1.equals(t2);
    }
    if (t1 instanceof LiteralType l1 && t2 instanceof LiteralType l2) {
      return !l1.equals(l2);
    }
    ClassType c1 = nominalClass(t1);
    ClassType c2 = nominalClass(t2);
    if (c1 == null || c2 == null) {
      return false;
    }
    if (c1.isSubclassOf(c2) || c2.isSubclassOf(c1)) {
      return false;
    }
    return isBuiltinClass(c1) || isBuiltinClass(c2);
  }

  private static boolean isBuiltinClass(ClassType c) {
    return c.equals(Types.INT)
        || c.equals(Types.BOOL)
        || c.equals(Types.FLOAT)
        || c.equals(Types.STR)
        || c.equals(Types.LIST_CLASS)
        || c.equals(Types.TUPLE_CLASS)
        || c.equals(Types.DICT_CLASS);
  }

  public static boolean isNever(StaticType type) {
    return type.equals(Types.NEVER);
  }

  public static boolean isUnbound(StaticType type) {
    return type.equals(Types.UNBOUND);
  }

  /** Reports whether the type is Unbound or a union with Unbound as a member. */
  public static boolean isPossiblyUnbound(StaticType type) {
    return Types.unfoldUnion(type).contains(Types.UNBOUND);
  }

  /**
   * Decomposes a type into the members narrowing operates on: the members of a union, with bool
   * expanded into its two literals.
   */
  public static ImmutableList<StaticType> subtypes(StaticType type) {
    ImmutableList.Builder<StaticType> result = ImmutableList.builder();
    for (StaticType member : Types.unfoldUnion(type)) {
      if (member.equals(Types.BOOL)) {
        result.add(Types.TRUE, Types.FALSE);
      } else {
        result.add(member);
      }
    }
    return result.build();
  }

  /** Reports whether some value of the type is falsy. */
  public static boolean canBeFalsy(StaticType type) {
    if (type instanceof UnionType union) {
      return union.getTypes().stream().anyMatch(TypeRelations::canBeFalsy);
    }
    if (type instanceof LiteralType literal) {
      return literal.isFalsy();
    }
    if (type instanceof TupleType tuple) {
      return tuple.getElementTypes().isEmpty();
    }
    if (type instanceof TypedDictType dict) {
      return dict.getRequiredKeys().isEmpty();
    }
    if (type instanceof ListType || type instanceof DictType) {
      return true;
    }
    if (type instanceof ClassType c) {
      return isBuiltinClass(c) || c.getField("__bool__") != null || c.getField("__len__") != null;
    }
    if (type instanceof TypeVariableType var) {
      return canBeFalsy(var.getUpperBound());
    }
    return type.equals(Types.NONE)
        || type.equals(Types.OBJECT)
        || isGradual(type);
  }

  /** Reports whether some value of the type is truthy. */
  public static boolean canBeTruthy(StaticType type) {
    if (type instanceof UnionType union) {
      return union.getTypes().stream().anyMatch(TypeRelations::canBeTruthy);
    }
    if (type instanceof LiteralType literal) {
      return !literal.isFalsy();
    }
    if (type instanceof TupleType tuple) {
      return !tuple.getElementTypes().isEmpty();
    }
    return !type.equals(Types.NONE)
        && !type.equals(Types.NEVER)
        && !type.equals(Types.UNBOUND);
  }

  /** Returns the subset of the type that can be truthy; bool becomes {@code Literal[True]}. */
  public static StaticType removeFalsiness(StaticType type) {
    List<StaticType> result = new ArrayList<>();
    for (StaticType member : Types.unfoldUnion(type)) {
      if (member.equals(Types.BOOL)) {
        result.add(Types.TRUE);
      } else if (canBeTruthy(member)) {
        result.add(member);
      }
    }
    return Types.union(result);
  }

  /** Returns the subset of the type that can be falsy; bool becomes {@code Literal[False]}. */
  public static StaticType removeTruthiness(StaticType type) {
    List<StaticType> result = new ArrayList<>();
    for (StaticType member : Types.unfoldUnion(type)) {
      if (member.equals(Types.BOOL)) {
        result.add(Types.FALSE);
      } else if (canBeFalsy(member)) {
        result.add(member);
      }
    }
    return Types.union(result);
  }

  public static StaticType removeUnbound(StaticType type) {
    return remove(type, Types.UNBOUND);
  }

  public static StaticType removeUnknown(StaticType type) {
    return remove(type, Types.UNKNOWN);
  }

  public static StaticType removeNone(StaticType type) {
    return remove(type, Types.NONE);
  }

  public static boolean containsUnknown(StaticType type) {
    return Types.unfoldUnion(type).contains(Types.UNKNOWN);
  }

  private static StaticType remove(StaticType type, StaticType member) {
    if (!Types.unfoldUnion(type).contains(member)) {
      return type;
    }
    List<StaticType> result = new ArrayList<>();
    for (StaticType t : Types.unfoldUnion(type)) {
      if (!t.equals(member)) {
        result.add(t);
      }
    }
    return Types.union(result);
  }

  /** Replaces each literal member by its class, as when inferring the type of a list element. */
  public static StaticType stripLiterals(StaticType type) {
    return Types.mapSubtypes(
        type, t -> t instanceof LiteralType literal ? literal.getBaseClass() : t);
  }
}

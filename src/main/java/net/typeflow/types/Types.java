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

import static java.util.stream.Collectors.joining;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableCollection;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * Definitions of types.
 *
 * <p><code>
 *   t1, t2 ::= Any | Unknown | object | Never | Unbound | None
 *           | C | Literal[v] | t1|t2 | list[t] | tuple[t1, ...] | dict[k, v]
 *           | TypedDict | Callable | Overloaded | TypeVar | type[C]
 * </code>
 *
 * <p>{@code Unknown} is the placeholder used while a value is still being computed; it behaves like
 * {@code Any} in relations but is tracked separately so that incomplete results can be recognized
 * and stripped. {@code Unbound} is the type of a name that has not been assigned on some path.
 */
public final class Types {

  /**
   * The Dynamic type of gradual typing; compatible with any other type, but not related by
   * subtyping to any other type.
   */
  public static final StaticType ANY = new AnyType();

  /** Placeholder for a type that is not known yet. */
  public static final StaticType UNKNOWN = new UnknownType();

  /** The top type of the type hierarchy. */
  public static final StaticType OBJECT = new ObjectType();

  /** The bottom type of the type hierarchy. */
  public static final StaticType NEVER = new NeverType();

  /** The type of a name on a path where it was never assigned, or was deleted. */
  public static final StaticType UNBOUND = new UnboundType();

  public static final StaticType NONE = new NoneType();

  // Builtin classes
  public static final ClassType INT = classType("int");
  public static final ClassType BOOL = classBuilder("bool").addSupertype(INT).build();
  public static final ClassType FLOAT = classType("float");
  public static final ClassType STR = classType("str");
  public static final ClassType LIST_CLASS = classType("list");
  public static final ClassType TUPLE_CLASS = classType("tuple");
  public static final ClassType DICT_CLASS = classType("dict");
  public static final ClassType FUNCTION_CLASS = classType("function");
  public static final ClassType TYPE_CLASS = classType("type");

  public static final LiteralType TRUE = literal(BOOL, true);
  public static final LiteralType FALSE = literal(BOOL, false);

  private Types() {} // uninstantiable

  // hashCode and equals implementation make duplicated singletons interchangeable.
  private static final class AnyType extends StaticType {
    @Override
    public String toString() {
      return "Any";
    }

    @Override
    public int hashCode() {
      return AnyType.class.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof AnyType;
    }

    @Override
    public StaticType getField(String name) {
      return ANY;
    }
  }

  private static final class UnknownType extends StaticType {
    @Override
    public String toString() {
      return "Unknown";
    }

    @Override
    public int hashCode() {
      return UnknownType.class.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof UnknownType;
    }

    @Override
    public StaticType getField(String name) {
      return UNKNOWN;
    }
  }

  private static final class ObjectType extends StaticType {
    @Override
    public String toString() {
      return "object";
    }

    @Override
    public int hashCode() {
      return ObjectType.class.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof ObjectType;
    }
  }

  private static final class NeverType extends StaticType {
    @Override
    public String toString() {
      return "Never";
    }

    @Override
    public int hashCode() {
      return NeverType.class.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof NeverType;
    }
  }

  private static final class UnboundType extends StaticType {
    @Override
    public String toString() {
      return "Unbound";
    }

    @Override
    public int hashCode() {
      return UnboundType.class.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof UnboundType;
    }
  }

  private static final class NoneType extends StaticType {
    @Override
    public String toString() {
      return "None";
    }

    @Override
    public int hashCode() {
      return NoneType.class.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof NoneType;
    }
  }

  // ---- classes ----

  /** Returns a class with no supertypes other than object and no declared fields. */
  public static ClassType classType(String name) {
    return classBuilder(name).build();
  }

  public static ClassType.Builder classBuilder(String name) {
    return new AutoValue_Types_ClassType.Builder()
        .setName(name)
        .setExitSwallowingExceptions(false);
  }

  /**
   * A nominal class type.
   *
   * <p>Besides its name and direct supertypes, a class records its declared fields (including
   * methods, whose types are callables) and whether its {@code __exit__} routine may swallow
   * exceptions when instances are used as context managers.
   */
  @AutoValue
  public abstract static class ClassType extends StaticType {
    public abstract String getName();

    public abstract ImmutableList<ClassType> getDirectSupertypes();

    public abstract ImmutableMap<String, StaticType> getFields();

    public abstract boolean isExitSwallowingExceptions();

    @Override
    public List<StaticType> getSupertypes() {
      return ImmutableList.copyOf(getDirectSupertypes());
    }

    @Override
    @Nullable
    public StaticType getField(String name) {
      StaticType field = getFields().get(name);
      if (field != null) {
        return field;
      }
      for (ClassType sup : getDirectSupertypes()) {
        field = sup.getField(name);
        if (field != null) {
          return field;
        }
      }
      return null;
    }

    /** Reports whether this class is {@code other} or derives from it, directly or not. */
    public boolean isSubclassOf(ClassType other) {
      if (this.equals(other)) {
        return true;
      }
      for (ClassType sup : getDirectSupertypes()) {
        if (sup.isSubclassOf(other)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public final String toString() {
      return getName();
    }

    /** Builder for {@link ClassType}. */
    @AutoValue.Builder
    public abstract static class Builder {
      abstract Builder setName(String name);

      abstract ImmutableList.Builder<ClassType> directSupertypesBuilder();

      abstract ImmutableMap.Builder<String, StaticType> fieldsBuilder();

      @CanIgnoreReturnValue
      public abstract Builder setExitSwallowingExceptions(boolean value);

      @CanIgnoreReturnValue
      public Builder addSupertype(ClassType supertype) {
        directSupertypesBuilder().add(supertype);
        return this;
      }

      @CanIgnoreReturnValue
      public Builder addField(String name, StaticType type) {
        fieldsBuilder().put(name, type);
        return this;
      }

      public abstract ClassType build();
    }
  }

  // ---- literals ----

  /** Constructs a literal type. The value must be a Boolean, Long or String. */
  public static LiteralType literal(ClassType baseClass, Object value) {
    Preconditions.checkArgument(
        value instanceof Boolean || value instanceof Long || value instanceof String,
        "unsupported literal value %s",
        value);
    return new AutoValue_Types_LiteralType(baseClass, value);
  }

  public static LiteralType literal(long value) {
    return literal(INT, value);
  }

  public static LiteralType literal(String value) {
    return literal(STR, value);
  }

  public static LiteralType literal(boolean value) {
    return value ? TRUE : FALSE;
  }

  /** A literal type: a single value of a builtin class such as {@code Literal["a"]}. */
  @AutoValue
  public abstract static class LiteralType extends StaticType {
    public abstract ClassType getBaseClass();

    public abstract Object getValue();

    /** Reports whether the literal value is falsy (False, 0 or the empty string). */
    public boolean isFalsy() {
      Object value = getValue();
      if (value instanceof Boolean b) {
        return !b;
      } else if (value instanceof Long l) {
        return l == 0;
      }
      return ((String) value).isEmpty();
    }

    @Override
    @Nullable
    public StaticType getField(String name) {
      return getBaseClass().getField(name);
    }

    @Override
    public final String toString() {
      Object value = getValue();
      if (value instanceof String s) {
        return "Literal['" + s + "']";
      } else if (value instanceof Boolean b) {
        return b ? "Literal[True]" : "Literal[False]";
      }
      return "Literal[" + value + "]";
    }
  }

  // ---- unions ----

  /**
   * Constructs a union type.
   *
   * <p>Nested unions are flattened, duplicates removed and occurrences of Never dropped. If the set
   * contains object, the result is object. Literals whose class is also a member are absorbed by
   * it, and {@code Literal[True] | Literal[False]} condenses to {@code bool}. If a single element
   * remains it is returned instead of constructing a union, and if none remains, Never is
   * returned.
   */
  public static StaticType union(StaticType... types) {
    return union(ImmutableList.copyOf(types));
  }

  /** Constructs a union type; see {@link #union(StaticType...)}. */
  public static StaticType union(Iterable<? extends StaticType> types) {
    Set<StaticType> flat = new LinkedHashSet<>();
    for (StaticType type : types) {
      if (type instanceof UnionType union) {
        flat.addAll(union.getTypes());
      } else if (!type.equals(NEVER)) {
        flat.add(type);
      }
    }
    if (flat.contains(OBJECT)) {
      return OBJECT;
    }
    if (flat.contains(TRUE) && flat.contains(FALSE)) {
      // Put bool where the first of the two literals was.
      List<StaticType> condensed = new ArrayList<>();
      for (StaticType type : flat) {
        if (type.equals(TRUE) || type.equals(FALSE)) {
          if (!condensed.contains(BOOL)) {
            condensed.add(BOOL);
          }
        } else {
          condensed.add(type);
        }
      }
      flat = new LinkedHashSet<>(condensed);
    }
    ImmutableSet.Builder<StaticType> members = ImmutableSet.builder();
    for (StaticType type : flat) {
      if (type instanceof LiteralType literal && flat.contains(literal.getBaseClass())) {
        continue;
      }
      members.add(type);
    }
    ImmutableSet<StaticType> subtypes = members.build();
    if (subtypes.size() == 1) {
      return subtypes.iterator().next();
    } else if (subtypes.isEmpty()) {
      return NEVER;
    }
    return new AutoValue_Types_UnionType(subtypes);
  }

  /** Returns the list of a union's types, or a singleton list if {@code type} is not a union. */
  public static ImmutableCollection<StaticType> unfoldUnion(StaticType type) {
    if (type instanceof UnionType unionType) {
      return unionType.getTypes();
    }
    return ImmutableList.of(type);
  }

  /**
   * Union type
   *
   * <p>Unions contain at least two types, none of which may be Never or object. See {@link
   * Types#union}.
   */
  @AutoValue
  public abstract static class UnionType extends StaticType {
    public abstract ImmutableSet<StaticType> getTypes();

    @Override
    public final String toString() {
      return getTypes().stream().map(StaticType::toString).collect(joining(" | "));
    }
  }

  // ---- containers ----

  public static ListType list(StaticType elementType) {
    return new AutoValue_Types_ListType(elementType);
  }

  /** The type of a list with elements of a given type. */
  @AutoValue
  public abstract static class ListType extends StaticType {
    public abstract StaticType getElementType();

    @Override
    public List<StaticType> getSupertypes() {
      return ImmutableList.of(LIST_CLASS);
    }

    @Override
    public final String toString() {
      return "list[" + getElementType() + "]";
    }
  }

  public static TupleType tuple(ImmutableList<StaticType> elementTypes) {
    return new AutoValue_Types_TupleType(elementTypes);
  }

  public static TupleType tuple(StaticType... elementTypes) {
    return tuple(ImmutableList.copyOf(elementTypes));
  }

  /** The type of a fixed-length tuple. */
  @AutoValue
  public abstract static class TupleType extends StaticType {
    public abstract ImmutableList<StaticType> getElementTypes();

    @Override
    public List<StaticType> getSupertypes() {
      return ImmutableList.of(TUPLE_CLASS);
    }

    @Override
    public final String toString() {
      if (getElementTypes().isEmpty()) {
        return "tuple[()]";
      }
      return "tuple["
          + getElementTypes().stream().map(StaticType::toString).collect(joining(", "))
          + "]";
    }
  }

  public static DictType dict(StaticType keyType, StaticType valueType) {
    return new AutoValue_Types_DictType(keyType, valueType);
  }

  /** The type of a dict with keys and values of given types. */
  @AutoValue
  public abstract static class DictType extends StaticType {
    public abstract StaticType getKeyType();

    public abstract StaticType getValueType();

    @Override
    public List<StaticType> getSupertypes() {
      return ImmutableList.of(DICT_CLASS);
    }

    @Override
    public final String toString() {
      return "dict[" + getKeyType() + ", " + getValueType() + "]";
    }
  }

  public static TypedDictType.Builder typedDictBuilder(String name) {
    return new AutoValue_Types_TypedDictType.Builder().setName(name);
  }

  /**
   * A dict with a fixed set of string keys, each with its own value type. Keys are either required
   * (always present) or not required.
   */
  @AutoValue
  public abstract static class TypedDictType extends StaticType {
    public abstract String getName();

    public abstract ImmutableMap<String, StaticType> getRequiredKeys();

    public abstract ImmutableMap<String, StaticType> getNotRequiredKeys();

    /** Returns the value type of a key, or null if the dict does not declare it. */
    @Nullable
    public StaticType getKeyType(String key) {
      StaticType type = getRequiredKeys().get(key);
      return type != null ? type : getNotRequiredKeys().get(key);
    }

    @Override
    public List<StaticType> getSupertypes() {
      return ImmutableList.of(DICT_CLASS);
    }

    @Override
    public final String toString() {
      return getName();
    }

    /** Builder for {@link TypedDictType}. */
    @AutoValue.Builder
    public abstract static class Builder {
      abstract Builder setName(String name);

      abstract ImmutableMap.Builder<String, StaticType> requiredKeysBuilder();

      abstract ImmutableMap.Builder<String, StaticType> notRequiredKeysBuilder();

      @CanIgnoreReturnValue
      public Builder addRequiredKey(String key, StaticType type) {
        requiredKeysBuilder().put(key, type);
        return this;
      }

      @CanIgnoreReturnValue
      public Builder addNotRequiredKey(String key, StaticType type) {
        notRequiredKeysBuilder().put(key, type);
        return this;
      }

      public abstract TypedDictType build();
    }
  }

  // ---- callables ----

  /** The kind of user-defined type guard a callable declares. */
  public enum GuardKind {
    /** An ordinary callable. */
    NONE,
    /** {@code TypeGuard[T]}: narrows the positive branch only. */
    TYPE_GUARD,
    /** {@code TypeIs[T]}: narrows both branches. */
    TYPE_IS,
  }

  public static CallableType callable(
      ImmutableList<StaticType> parameterTypes, StaticType returns) {
    return new AutoValue_Types_CallableType(parameterTypes, returns, GuardKind.NONE, null);
  }

  public static CallableType callable(StaticType returns) {
    return callable(ImmutableList.of(), returns);
  }

  /** Constructs a callable whose return value is a type guard for its first argument. */
  public static CallableType typeGuard(
      ImmutableList<StaticType> parameterTypes, GuardKind kind, StaticType guardedType) {
    Preconditions.checkArgument(kind != GuardKind.NONE);
    return new AutoValue_Types_CallableType(parameterTypes, BOOL, kind, guardedType);
  }

  /** The type of a callable value. */
  @AutoValue
  public abstract static class CallableType extends StaticType {
    public abstract ImmutableList<StaticType> getParameterTypes();

    public abstract StaticType getReturnType();

    public abstract GuardKind getGuardKind();

    /** The type established by a type guard, or null for ordinary callables. */
    @Nullable
    public abstract StaticType getGuardedType();

    @Override
    public List<StaticType> getSupertypes() {
      return ImmutableList.of(FUNCTION_CLASS);
    }

    @Override
    public final String toString() {
      String returns =
          switch (getGuardKind()) {
            case NONE -> getReturnType().toString();
            case TYPE_GUARD -> "TypeGuard[" + getGuardedType() + "]";
            case TYPE_IS -> "TypeIs[" + getGuardedType() + "]";
          };
      return "Callable[["
          + getParameterTypes().stream().map(StaticType::toString).collect(joining(", "))
          + "], "
          + returns
          + "]";
    }
  }

  public static OverloadedType overloaded(ImmutableList<CallableType> overloads) {
    Preconditions.checkArgument(overloads.size() >= 2, "an overload needs two signatures");
    return new AutoValue_Types_OverloadedType(overloads);
  }

  /** A callable with several signatures. */
  @AutoValue
  public abstract static class OverloadedType extends StaticType {
    public abstract ImmutableList<CallableType> getOverloads();

    @Override
    public List<StaticType> getSupertypes() {
      return ImmutableList.of(FUNCTION_CLASS);
    }

    @Override
    public final String toString() {
      return "Overload["
          + getOverloads().stream().map(StaticType::toString).collect(joining(", "))
          + "]";
    }
  }

  // ---- type variables and class objects ----

  /** Constructs a type variable restricted to one of the given constraints. */
  public static TypeVariableType typeVariable(String name, ImmutableList<StaticType> constraints) {
    return new AutoValue_Types_TypeVariableType(name, constraints, null);
  }

  /** Constructs a type variable with an upper bound, or unbounded if bound is null. */
  public static TypeVariableType boundTypeVariable(String name, @Nullable StaticType bound) {
    return new AutoValue_Types_TypeVariableType(name, ImmutableList.of(), bound);
  }

  /** A type variable, either constrained or bounded. */
  @AutoValue
  public abstract static class TypeVariableType extends StaticType {
    public abstract String getName();

    public abstract ImmutableList<StaticType> getConstraints();

    @Nullable
    public abstract StaticType getBound();

    public boolean isConstrained() {
      return !getConstraints().isEmpty();
    }

    /** Returns the widest type a value of this variable can have. */
    public StaticType getUpperBound() {
      if (isConstrained()) {
        return union(getConstraints());
      }
      return getBound() != null ? getBound() : OBJECT;
    }

    @Override
    public final String toString() {
      return getName();
    }
  }

  public static ClassObjectType classObject(StaticType instanceType) {
    return new AutoValue_Types_ClassObjectType(instanceType);
  }

  /** The type of a class value, {@code type[C]}. */
  @AutoValue
  public abstract static class ClassObjectType extends StaticType {
    public abstract StaticType getInstanceType();

    @Override
    public List<StaticType> getSupertypes() {
      return ImmutableList.of(TYPE_CLASS);
    }

    @Override
    public final String toString() {
      return "type[" + getInstanceType() + "]";
    }
  }

  /** Returns the union of each member of {@code type} mapped through {@code fn}. */
  public static StaticType mapSubtypes(
      StaticType type, Function<StaticType, StaticType> fn) {
    List<StaticType> result = new ArrayList<>();
    for (StaticType member : unfoldUnion(type)) {
      result.add(fn.apply(member));
    }
    return union(result);
  }
}

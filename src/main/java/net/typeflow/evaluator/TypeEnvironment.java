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
package net.typeflow.evaluator;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;
import net.typeflow.types.StaticType;
import net.typeflow.types.Types;
import net.typeflow.types.Types.ClassType;
import net.typeflow.types.Types.TypedDictType;
import net.typeflow.types.Types.TypeVariableType;

/**
 * The names a file is analyzed against: the types of predeclared values, the named types that
 * annotations may mention, and the exports of importable modules.
 *
 * <p>Every environment includes the builtin classes and functions the narrowing rules recognize.
 */
public final class TypeEnvironment {

  private final ImmutableMap<String, StaticType> values;
  private final ImmutableMap<String, StaticType> namedTypes;
  private final ImmutableMap<String, ImmutableMap<String, StaticType>> modules;

  private TypeEnvironment(
      ImmutableMap<String, StaticType> values,
      ImmutableMap<String, StaticType> namedTypes,
      ImmutableMap<String, ImmutableMap<String, StaticType>> modules) {
    this.values = values;
    this.namedTypes = namedTypes;
    this.modules = modules;
  }

  /** Returns an environment containing only the builtins. */
  public static TypeEnvironment builtins() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the type of a predeclared value, or null if there is no such value. */
  @Nullable
  public StaticType getValueType(String name) {
    return values.get(name);
  }

  /** Returns the type an annotation means by {@code name}, or null if it names no type. */
  @Nullable
  public StaticType getNamedType(String name) {
    return namedTypes.get(name);
  }

  /** Returns the exports of a module, or null if the module is unknown. */
  @Nullable
  public ImmutableMap<String, StaticType> getModule(String name) {
    return modules.get(name);
  }

  /** Builder for {@link TypeEnvironment}. */
  public static final class Builder {
    private final Map<String, StaticType> values = new LinkedHashMap<>();
    private final Map<String, StaticType> namedTypes = new LinkedHashMap<>();
    private final Map<String, ImmutableMap<String, StaticType>> modules = new LinkedHashMap<>();

    private Builder() {
      for (ClassType cls :
          ImmutableList.of(
              Types.INT,
              Types.BOOL,
              Types.FLOAT,
              Types.STR,
              Types.LIST_CLASS,
              Types.TUPLE_CLASS,
              Types.DICT_CLASS,
              Types.TYPE_CLASS)) {
        addClass(cls);
      }
      namedTypes.put("object", Types.OBJECT);
      values.put("object", Types.classObject(Types.OBJECT));
      ImmutableList<StaticType> anyAny = ImmutableList.of(Types.ANY, Types.ANY);
      ImmutableList<StaticType> any = ImmutableList.of(Types.ANY);
      values.put("isinstance", Types.callable(anyAny, Types.BOOL));
      values.put("issubclass", Types.callable(anyAny, Types.BOOL));
      values.put("callable", Types.callable(any, Types.BOOL));
      values.put("len", Types.callable(any, Types.INT));
      values.put("print", Types.callable(any, Types.NONE));
      values.put("repr", Types.callable(any, Types.STR));
    }

    /** Declares a value, such as a variable or a function, by its type. */
    @CanIgnoreReturnValue
    public Builder addValue(String name, StaticType type) {
      values.put(name, type);
      return this;
    }

    /**
     * Declares a class: annotations may name it, and its name is bound to the class object.
     */
    @CanIgnoreReturnValue
    public Builder addClass(ClassType cls) {
      namedTypes.put(cls.getName(), cls);
      values.put(cls.getName(), Types.classObject(cls));
      return this;
    }

    /** Declares a typed dict that annotations may name. */
    @CanIgnoreReturnValue
    public Builder addTypedDict(TypedDictType type) {
      namedTypes.put(type.getName(), type);
      return this;
    }

    /** Declares a type variable that annotations may name. */
    @CanIgnoreReturnValue
    public Builder addTypeVariable(TypeVariableType type) {
      namedTypes.put(type.getName(), type);
      return this;
    }

    /** Declares a type alias. */
    @CanIgnoreReturnValue
    public Builder addNamedType(String name, StaticType type) {
      namedTypes.put(name, type);
      return this;
    }

    /** Declares an importable module and the types of the names it exports. */
    @CanIgnoreReturnValue
    public Builder addModule(String name, Map<String, StaticType> exports) {
      modules.put(name, ImmutableMap.copyOf(exports));
      return this;
    }

    public TypeEnvironment build() {
      return new TypeEnvironment(
          ImmutableMap.copyOf(values),
          ImmutableMap.copyOf(namedTypes),
          ImmutableMap.copyOf(modules));
    }
  }
}

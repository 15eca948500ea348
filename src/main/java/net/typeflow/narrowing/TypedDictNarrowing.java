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
import net.typeflow.types.Types;
import net.typeflow.types.Types.TypedDictType;

/**
 * Narrowing of typed dicts by key presence: {@code "k" in td}.
 *
 * <p>On the positive path members that do not declare the key are removed, and members that
 * declare it as not required are replaced by a copy in which it is required. On the negative path
 * members that require the key are removed. Members that are not typed dicts are kept.
 */
public final class TypedDictNarrowing {

  private TypedDictNarrowing() {}

  public static StaticType narrowForKey(StaticType type, String key, boolean positive) {
    List<StaticType> result = new ArrayList<>();
    for (StaticType member : Types.unfoldUnion(type)) {
      if (!(member instanceof TypedDictType dict)) {
        result.add(member);
      } else if (positive) {
        if (dict.getRequiredKeys().containsKey(key)) {
          result.add(dict);
        } else if (dict.getNotRequiredKeys().containsKey(key)) {
          result.add(withRequiredKey(dict, key));
        }
      } else if (!dict.getRequiredKeys().containsKey(key)) {
        result.add(dict);
      }
    }
    return Types.union(result);
  }

  private static TypedDictType withRequiredKey(TypedDictType dict, String key) {
    TypedDictType.Builder builder = Types.typedDictBuilder(dict.getName());
    dict.getRequiredKeys().forEach(builder::addRequiredKey);
    dict.getNotRequiredKeys()
        .forEach(
            (k, v) -> {
              if (k.equals(key)) {
                builder.addRequiredKey(k, v);
              } else {
                builder.addNotRequiredKey(k, v);
              }
            });
    return builder.build();
  }
}

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
import net.typeflow.types.Types.TupleType;

/**
 * Narrowing of fixed-length tuples by {@code len(x) == n}. Members that are not tuples are kept.
 */
public final class LenNarrowing {

  private LenNarrowing() {}

  public static StaticType narrowForLength(StaticType type, int length, boolean positive) {
    List<StaticType> result = new ArrayList<>();
    for (StaticType member : Types.unfoldUnion(type)) {
      if (member instanceof TupleType tuple
          && (tuple.getElementTypes().size() == length) != positive) {
        continue;
      }
      result.add(member);
    }
    return Types.union(result);
  }
}

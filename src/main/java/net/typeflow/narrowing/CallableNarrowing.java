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
import net.typeflow.types.Types.CallableType;
import net.typeflow.types.Types.ClassObjectType;
import net.typeflow.types.Types.ClassType;
import net.typeflow.types.Types.OverloadedType;

/** Narrowing for {@code callable(x)}. */
public final class CallableNarrowing {

  private CallableNarrowing() {}

  public static StaticType narrow(StaticType type, boolean positive) {
    List<StaticType> result = new ArrayList<>();
    for (StaticType member : Types.unfoldUnion(type)) {
      boolean callable = isCallable(member);
      boolean maybeCallable =
          callable
              || member.equals(Types.ANY)
              || member.equals(Types.UNKNOWN)
              || member.equals(Types.OBJECT);
      if (positive ? maybeCallable : !callable) {
        result.add(member);
      }
    }
    return Types.union(result);
  }

  private static boolean isCallable(StaticType type) {
    return type instanceof CallableType
        || type instanceof OverloadedType
        || type instanceof ClassObjectType
        || (type instanceof ClassType cls && cls.getField("__call__") != null);
  }
}

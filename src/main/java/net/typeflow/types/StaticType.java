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
import java.util.List;
import javax.annotation.Nullable;

/**
 * Base class for all static types.
 *
 * <p>Types are immutable values compared structurally. Singletons compare by class so that
 * duplicated instances still compare equal.
 */
public abstract class StaticType {

  /**
   * Returns the list of direct supertypes of this type.
   *
   * <p>Preferred order is from the most specific to the least specific supertype.
   */
  public List<StaticType> getSupertypes() {
    return ImmutableList.of();
  }

  /**
   * If this type has a field by the given name, returns the type of that field, or null otherwise.
   */
  @Nullable
  public StaticType getField(String name) {
    return null;
  }
}

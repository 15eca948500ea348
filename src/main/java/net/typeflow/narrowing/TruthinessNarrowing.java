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

import net.typeflow.types.StaticType;
import net.typeflow.types.TypeRelations;

/** Narrowing for tests of the truth value of a reference: {@code if x:}, {@code bool(x)}. */
public final class TruthinessNarrowing {

  private TruthinessNarrowing() {}

  public static StaticType narrow(StaticType type, boolean positive) {
    return positive ? TypeRelations.removeFalsiness(type) : TypeRelations.removeTruthiness(type);
  }
}

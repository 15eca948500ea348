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

import javax.annotation.Nullable;
import net.typeflow.types.StaticType;

/**
 * The effect of a test on the type of one reference: a function from the type before the test to
 * the type on the path where the test had the given outcome.
 */
@FunctionalInterface
public interface NarrowingCallback {

  /** Returns the refined type, or null if the test says nothing about this type. */
  @Nullable
  StaticType narrow(StaticType type);
}

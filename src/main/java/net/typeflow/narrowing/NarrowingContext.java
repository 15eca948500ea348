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
import net.typeflow.syntax.Expression;
import net.typeflow.syntax.Identifier;
import net.typeflow.types.StaticType;

/** What narrowing rules need to know about the program beyond the test expression itself. */
public interface NarrowingContext {

  /**
   * Returns the type of an operand of a test, such as the class argument of {@code isinstance} or
   * the literal a reference is compared with.
   */
  StaticType getTypeOfExpression(Expression expr);

  /**
   * Returns the test expression that a name stands for, if the name is a local bound exactly once
   * to a narrowing test and nothing the test refers to is rebound; otherwise null.
   */
  @Nullable
  Expression getAlias(Identifier name);
}

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
package net.typeflow.analysis;

import com.google.auto.value.AutoValue;
import net.typeflow.types.StaticType;

/**
 * The narrowed type of a reference at a flow node.
 *
 * <p>An incomplete result was computed from a placeholder for a value still being computed, such
 * as the type at the head of a loop under evaluation, or after the loop convergence ceiling was
 * hit. An aborted result was cut short by the complexity guard or by cancellation; it is also
 * incomplete.
 */
@AutoValue
public abstract class FlowNodeTypeResult {

  public abstract StaticType getType();

  public abstract boolean isIncomplete();

  public abstract boolean isAborted();

  public static FlowNodeTypeResult complete(StaticType type) {
    return new AutoValue_FlowNodeTypeResult(type, false, false);
  }

  public static FlowNodeTypeResult incomplete(StaticType type) {
    return new AutoValue_FlowNodeTypeResult(type, true, false);
  }

  public static FlowNodeTypeResult aborted(StaticType type) {
    return new AutoValue_FlowNodeTypeResult(type, true, true);
  }

  /** Returns a result of the given type that is incomplete if this one is. */
  FlowNodeTypeResult withType(StaticType type) {
    return new AutoValue_FlowNodeTypeResult(type, isIncomplete(), isAborted());
  }

  @Override
  public final String toString() {
    return getType() + (isAborted() ? " (aborted)" : isIncomplete() ? " (incomplete)" : "");
  }
}
